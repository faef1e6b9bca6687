package io.vena.modelsync;

import java.util.LinkedHashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

import static io.vena.modelsync.SessionKeys.ENTITY_ID;
import static io.vena.modelsync.SessionKeys.OFFICIAL_SOFTWARE;
import static io.vena.modelsync.SessionKeys.RANK;
import static io.vena.modelsync.SessionKeys.SESSION_ID;
import static io.vena.modelsync.SessionKeys.TRUE_PRIVATE;
import static io.vena.modelsync.SessionKeys.VIDEO_STATE;

/**
 * One state snapshot of a {@link Model}, keyed by session ID.
 *
 * <p>
 * Mutable, and guarded by the owning model's lock. Nothing outside this
 * package sees a <code>Session</code>; callers get a {@link #snapshot()}.
 */
final class Session {
	private final Map<String, Object> properties = new LinkedHashMap<>();

	private Session(int sessionId, int modelId) {
		properties.put(SESSION_ID, sessionId);
		properties.put(ENTITY_ID, modelId);
		properties.put(VIDEO_STATE, VideoState.OFFLINE);
		properties.put(RANK, 0);
	}

	static Session withDefaults(int sessionId, int modelId) {
		return new Session(sessionId, modelId);
	}

	int sessionId() {
		return (Integer) properties.get(SESSION_ID);
	}

	/**
	 * Missing or unrecognized video state counts as offline.
	 */
	VideoState videoState() {
		Object result = properties.get(VIDEO_STATE);
		return (result instanceof VideoState)? (VideoState) result : VideoState.OFFLINE;
	}

	boolean isOffline() {
		return VideoState.isOffline(properties.get(VIDEO_STATE));
	}

	boolean isOfficialSoftware() {
		return Boolean.TRUE.equals(properties.get(OFFICIAL_SOFTWARE));
	}

	boolean isTruePrivate() {
		return Boolean.TRUE.equals(properties.get(TRUE_PRIVATE));
	}

	@Nullable Object get(String name) {
		return properties.get(name);
	}

	boolean has(String name) {
		return properties.containsKey(name);
	}

	void put(String name, Object value) {
		properties.put(name, value);
	}

	/**
	 * Sets the boolean properties derived from a <code>flags</code> bitmask.
	 */
	void applyFlags(int flags) {
		for (SessionFlag flag: SessionFlag.values()) {
			properties.put(flag.propertyName(), flag.isSetIn(flags));
		}
	}

	PropertyMap<Object> snapshot() {
		return PropertyMap.fromOrderedMap(properties);
	}

	@Override
	public String toString() {
		return properties.toString();
	}
}
