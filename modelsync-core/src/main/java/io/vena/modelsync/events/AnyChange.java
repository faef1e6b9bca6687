package io.vena.modelsync.events;

import io.vena.modelsync.Model;
import io.vena.modelsync.Payload;

/**
 * Published once for every merge that affected the model's best session,
 * whether or not any property actually changed value.
 */
public record AnyChange(
	Model model,
	Payload payload
) implements ModelEvent {
	@Override
	public EventKey key() {
		return EventKey.ANY;
	}
}
