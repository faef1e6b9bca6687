package io.vena.modelsync.events;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers events on the publishing thread, to observers in subscription order.
 *
 * <p>
 * Subscribing and unsubscribing are safe at any time, including from within
 * an observer; an observer added during a publish won't see that event.
 */
@RequiredArgsConstructor
public final class SynchronousEventBus implements ModelEventBus {
	private final String name;
	private final Map<EventKey, List<Registration>> observers = new ConcurrentHashMap<>();

	@Override
	public Subscription subscribe(@NonNull EventKey key, @NonNull ModelObserver observer) {
		Registration registration = new Registration(key, observer);
		observers.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(registration);
		LOGGER.debug("{}: subscribed {} to {}", name, observer, key);
		return registration;
	}

	@Override
	public void publish(@NonNull ModelEvent event) {
		deliver(event, event.key());
		if (event.key().isProperty()) {
			deliver(event, EventKey.EVERY_PROPERTY);
		}
	}

	private void deliver(ModelEvent event, EventKey key) {
		List<Registration> registrations = observers.get(key);
		if (registrations == null) {
			return;
		}
		for (Registration registration: registrations) {
			LOGGER.trace("{}: deliver {} to {}", name, event, registration.observer);
			try {
				registration.observer.onEvent(event);
			} catch (RuntimeException e) {
				LOGGER.error("{}: observer for {} aborted due to exception: {}", name, event.key(), e.getMessage(), e);
			}
		}
	}

	@Override
	public String toString() {
		return "SynchronousEventBus(" + name + ")";
	}

	@RequiredArgsConstructor
	private final class Registration implements Subscription {
		final EventKey key;
		final ModelObserver observer;

		@Override
		public void close() {
			List<Registration> registrations = observers.get(key);
			if (registrations != null && registrations.remove(this)) {
				LOGGER.debug("{}: unsubscribed {} from {}", name, observer, key);
			}
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SynchronousEventBus.class);
}
