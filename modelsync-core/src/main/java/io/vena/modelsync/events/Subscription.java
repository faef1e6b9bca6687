package io.vena.modelsync.events;

/**
 * Returned by {@link ModelEventBus#subscribe}; closing it stops further delivery.
 */
public interface Subscription extends AutoCloseable {
	@Override
	void close();
}
