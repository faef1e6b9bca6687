package io.vena.modelsync.events;

/**
 * The publish/subscribe capability each model uses to notify observers.
 */
public interface ModelEventBus {
	Subscription subscribe(EventKey key, ModelObserver observer);

	/**
	 * Delivers <code>event</code> to every observer subscribed to {@link ModelEvent#key()}.
	 * Delivery to one observer is not affected by another observer throwing.
	 */
	void publish(ModelEvent event);
}
