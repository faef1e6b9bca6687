package io.vena.modelsync.exceptions;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Thrown when a payload declares a producer level other than the one
 * the registry was configured to accept. The payload was not applied.
 */
@Getter
@Accessors(fluent = true)
public class ProducerLevelMismatchException extends IllegalArgumentException {
	private final int expectedLevel;
	private final Object actualLevel;

	public ProducerLevelMismatchException(int expectedLevel, Object actualLevel) {
		super("Payload level " + actualLevel + " does not match expected level " + expectedLevel);
		this.expectedLevel = expectedLevel;
		this.actualLevel = actualLevel;
	}
}
