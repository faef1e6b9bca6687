package io.vena.modelsync.events;

import lombok.NonNull;

import static io.vena.modelsync.events.EventKey.Kind.ANY_CHANGE;
import static io.vena.modelsync.events.EventKey.Kind.EVERY_PROPERTY_CHANGE;
import static io.vena.modelsync.events.EventKey.Kind.PROPERTY;
import static io.vena.modelsync.events.EventKey.Kind.TAGS_CHANGE;

/**
 * Identifies a class of {@link ModelEvent} to subscribe to.
 * Property events are keyed by property name, so a property called
 * <code>"tags"</code> can't be confused with {@link #TAGS}.
 * Subscribers to {@link #EVERY_PROPERTY} receive every {@link PropertyChanged}.
 */
public record EventKey(Kind kind, String property) {
	public enum Kind {
		PROPERTY,
		EVERY_PROPERTY_CHANGE,
		ANY_CHANGE,
		TAGS_CHANGE,
	}

	public static final EventKey EVERY_PROPERTY = new EventKey(EVERY_PROPERTY_CHANGE, "");
	public static final EventKey ANY = new EventKey(ANY_CHANGE, "");
	public static final EventKey TAGS = new EventKey(TAGS_CHANGE, "");

	public static EventKey property(@NonNull String name) {
		return new EventKey(PROPERTY, name);
	}

	public boolean isProperty() {
		return kind == PROPERTY;
	}

	@Override
	public String toString() {
		return (kind == PROPERTY)? property : kind.name();
	}
}
