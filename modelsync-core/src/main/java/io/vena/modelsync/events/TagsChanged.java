package io.vena.modelsync.events;

import io.vena.modelsync.Model;
import java.util.Set;

/**
 * Published on every tag merge, even one that added nothing new.
 */
public record TagsChanged(
	Model model,
	Set<String> before,
	Set<String> after
) implements ModelEvent {
	@Override
	public EventKey key() {
		return EventKey.TAGS;
	}

	public boolean isEffective() {
		return !before.equals(after);
	}
}
