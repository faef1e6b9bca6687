package io.vena.modelsync;

import io.vena.modelsync.exceptions.InvalidPayloadException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.jetbrains.annotations.Nullable;

import static io.vena.modelsync.SessionKeys.ENTITY_ID;
import static io.vena.modelsync.SessionKeys.FLAGS;
import static io.vena.modelsync.SessionKeys.LEVEL;
import static io.vena.modelsync.SessionKeys.RANK;
import static io.vena.modelsync.SessionKeys.SESSION_ID;
import static io.vena.modelsync.SessionKeys.VIDEO_STATE;

/**
 * A decoded partial-state update for one {@link Model}.
 *
 * <p>
 * Top-level fields are either flat properties or <em>property groups</em>:
 * a field whose value is a {@link Map} of sub-properties. {@link SessionMerger}
 * flattens groups into the target session.
 *
 * <p>
 * Construction normalizes values so that merging can't fail halfway:
 * well-known integer properties become {@link Integer}s,
 * {@link SessionKeys#VIDEO_STATE} becomes a {@link VideoState},
 * and nulls or nested groups-within-groups are rejected with
 * {@link InvalidPayloadException}.
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
@EqualsAndHashCode
public final class Payload {
	private final PropertyMap<Object> fields;

	public static Payload of(@NonNull Map<String, ?> fields) {
		Map<String, Object> normalized = new LinkedHashMap<>();
		fields.forEach((name, value) -> {
			if (name == null) {
				throw new InvalidPayloadException("Payload field name can't be null");
			}
			if (value instanceof Map) {
				normalized.put(name, normalizeGroup(name, (Map<?, ?>) value));
			} else {
				normalized.put(name, normalizeValue(name, name, value));
			}
		});
		return new Payload(PropertyMap.fromOrderedMap(normalized));
	}

	public static Builder builder() {
		return new Builder();
	}

	public PropertyMap<Object> fields() {
		return fields;
	}

	/**
	 * @return the top-level session ID, or zero if this payload doesn't name a session
	 */
	public int sessionId() {
		Object result = fields.get(SESSION_ID);
		return (result == null)? 0 : (Integer) result;
	}

	/**
	 * @return the producer level declared by this payload, if any
	 */
	public @Nullable Object level() {
		return fields.get(LEVEL);
	}

	public @Nullable Object get(String fieldName) {
		return fields.get(fieldName);
	}

	public Set<String> fieldNames() {
		return fields.keySet();
	}

	static boolean isGroup(Object value) {
		return value instanceof PropertyMap;
	}

	@Override
	public String toString() {
		return "Payload" + fields;
	}

	private static PropertyMap<Object> normalizeGroup(String groupName, Map<?, ?> group) {
		Map<String, Object> normalized = new LinkedHashMap<>();
		group.forEach((key, value) -> {
			if (!(key instanceof String)) {
				throw new InvalidPayloadException("Property names in group \"" + groupName + "\" must be strings: " + key);
			}
			String name = (String) key;
			if (value instanceof Map) {
				throw new InvalidPayloadException("Property group \"" + groupName + "\" contains nested group \"" + name + "\"");
			}
			normalized.put(name, normalizeValue(groupName + "." + name, name, value));
		});
		return PropertyMap.fromOrderedMap(normalized);
	}

	private static Object normalizeValue(String qualifiedName, String name, Object value) {
		if (value == null) {
			throw new InvalidPayloadException("Property \"" + qualifiedName + "\" can't be null");
		}
		switch (name) {
			case VIDEO_STATE:
				return normalizeVideoState(qualifiedName, value);
			case SESSION_ID:
			case ENTITY_ID:
			case RANK:
			case LEVEL:
			case FLAGS:
				return normalizeInteger(qualifiedName, value);
			default:
				return value;
		}
	}

	private static VideoState normalizeVideoState(String qualifiedName, Object value) {
		if (value instanceof VideoState) {
			return (VideoState) value;
		}
		try {
			return VideoState.fromCode(normalizeInteger(qualifiedName, value));
		} catch (IllegalArgumentException e) {
			throw new InvalidPayloadException("Invalid video state for \"" + qualifiedName + "\": " + value, e);
		}
	}

	private static Integer normalizeInteger(String qualifiedName, Object value) {
		if (value instanceof Integer) {
			return (Integer) value;
		} else if (value instanceof Long || value instanceof Short || value instanceof Byte) {
			try {
				return Math.toIntExact(((Number) value).longValue());
			} catch (ArithmeticException e) {
				throw new InvalidPayloadException("Property \"" + qualifiedName + "\" out of range: " + value, e);
			}
		} else {
			throw new InvalidPayloadException("Property \"" + qualifiedName + "\" must be an integer: " + value);
		}
	}

	public static final class Builder {
		private final Map<String, Object> fields = new LinkedHashMap<>();

		private Builder() { }

		public Builder field(String name, Object value) {
			fields.put(name, value);
			return this;
		}

		public Builder group(String name, Map<String, ?> properties) {
			fields.put(name, properties);
			return this;
		}

		public Payload build() {
			return Payload.of(fields);
		}
	}
}
