package io.vena.modelsync;

import java.util.HashMap;
import java.util.Map;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Liveness and visibility of a single {@link Session}, using the numeric
 * codes the platform sends on the wire.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum VideoState {
	ONLINE(0),
	RESET(1),
	AWAY(2),
	CONFIRMING(11),
	PRIVATE(12),
	GROUP_SHOW(13),
	CLUB_SHOW(14),
	KILL_MODEL(15),
	CAM2CAM_ON(20),
	CAM2CAM_OFF(21),
	RX_IDLE(90),
	RX_PRIVATE(91),
	RX_VOYEUR(92),
	RX_GROUP(93),
	RX_CLUB(94),
	NULL(126),
	OFFLINE(127),
	;

	private final int code;

	public boolean isOffline() {
		return this == OFFLINE;
	}

	/**
	 * @throws IllegalArgumentException if <code>code</code> is not one of ours
	 */
	public static VideoState fromCode(int code) {
		VideoState result = BY_CODE.get(code);
		if (result == null) {
			throw new IllegalArgumentException("Unknown video state code " + code);
		}
		return result;
	}

	/**
	 * A session with no video state at all counts as offline.
	 */
	static boolean isOffline(Object value) {
		return !(value instanceof VideoState) || ((VideoState) value).isOffline();
	}

	private static final Map<Integer, VideoState> BY_CODE = new HashMap<>();

	static {
		for (VideoState state: values()) {
			BY_CODE.put(state.code, state);
		}
	}
}
