package io.vena.modelsync;

/**
 * Opaque token returned by {@link Model#when}, used to {@link Model#unwatch unwatch}.
 */
public record WatchHandle(int ownerID, long serial) {
	@Override
	public String toString() {
		return "WatchHandle(" + ownerID + "#" + serial + ")";
	}
}
