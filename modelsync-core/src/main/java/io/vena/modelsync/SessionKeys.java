package io.vena.modelsync;

/**
 * Property names with special meaning to the merge engine.
 * Any other property name is carried through opaquely.
 */
public final class SessionKeys {
	public static final String SESSION_ID  = "sessionId";
	public static final String ENTITY_ID   = "entityId";
	public static final String VIDEO_STATE = "videoState";
	public static final String RANK        = "rank";
	public static final String NAME        = "name";
	public static final String LEVEL       = "level";
	public static final String FLAGS       = "flags";
	public static final String TAGS        = "tags";

	// Derived from FLAGS
	public static final String TRUE_PRIVATE      = "truePrivate";
	public static final String GUESTS_MUTED      = "guestsMuted";
	public static final String BASICS_MUTED      = "basicsMuted";
	public static final String OFFICIAL_SOFTWARE = "officialSoftware";

	private SessionKeys() { }
}
