package io.vena.modelsync.events;

/**
 * Receives {@link ModelEvent}s. Called synchronously on the thread performing
 * the merge, while the model's lock is held, so it should be quick.
 */
@FunctionalInterface
public interface ModelObserver {
	void onEvent(ModelEvent event);
}
