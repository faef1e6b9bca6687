package io.vena.modelsync;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

@Value
@Builder
public class ModelSyncSettings {
	/**
	 * ID of the reserved aggregate model. Real model IDs are never negative.
	 */
	@Default int aggregateModelID = -500;

	/**
	 * Payloads that declare a {@link SessionKeys#LEVEL level} must declare this one.
	 * The default is the level the platform uses for broadcasters.
	 */
	@Default int expectedProducerLevel = 4;

	public void validate() {
		if (aggregateModelID >= 0) {
			throw new IllegalArgumentException("Aggregate model ID must be negative so it can't collide with a real model: " + aggregateModelID);
		}
	}
}
