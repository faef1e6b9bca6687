package io.vena.modelsync;

import org.jetbrains.annotations.Nullable;

/**
 * Invoked by a watcher registered with {@link Model#when} when its condition
 * becomes true, or stops being true.
 */
@FunctionalInterface
public interface WatcherCallback {
	/**
	 * @param model the model whose state satisfied (or stopped satisfying) the condition
	 * @param payload the update that caused the transition; null when the
	 * transition was detected at registration time
	 */
	void accept(Model model, @Nullable Payload payload);

	WatcherCallback NONE = (model, payload) -> { };
}
