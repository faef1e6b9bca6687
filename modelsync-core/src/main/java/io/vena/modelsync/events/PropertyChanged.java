package io.vena.modelsync.events;

import io.vena.modelsync.Model;
import org.jetbrains.annotations.Nullable;

/**
 * One property of a model's best session changed value.
 *
 * @param before the value in the best session prior to the merge, or null if absent
 * @param after the merged value, or null if the property was cleared by a session change
 */
public record PropertyChanged(
	Model model,
	String property,
	@Nullable Object before,
	@Nullable Object after
) implements ModelEvent {
	@Override
	public EventKey key() {
		return EventKey.property(property);
	}
}
