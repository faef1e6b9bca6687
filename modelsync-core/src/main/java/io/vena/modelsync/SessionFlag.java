package io.vena.modelsync;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Bits of the <code>flags</code> bitmask that {@link SessionMerger} expands
 * into boolean session properties.
 *
 * <p>
 * The derived properties are consumed by {@link BestSessionSelector} and
 * {@link Model#inTruePrivate()}; they never produce change events of their own.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum SessionFlag {
	TRUE_PRIVATE(8, SessionKeys.TRUE_PRIVATE),
	OFFICIAL_SOFTWARE(2048, SessionKeys.OFFICIAL_SOFTWARE),
	GUESTS_MUTED(4096, SessionKeys.GUESTS_MUTED),
	BASICS_MUTED(8192, SessionKeys.BASICS_MUTED),
	;

	private final int bit;
	private final String propertyName;

	public boolean isSetIn(int flags) {
		return (flags & bit) != 0;
	}

	static boolean isDerivedProperty(String propertyName) {
		for (SessionFlag flag: values()) {
			if (flag.propertyName.equals(propertyName)) {
				return true;
			}
		}
		return false;
	}
}
