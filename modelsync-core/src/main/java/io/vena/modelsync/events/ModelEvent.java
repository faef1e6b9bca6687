package io.vena.modelsync.events;

import io.vena.modelsync.Model;

/**
 * A notification about a change to one {@link Model}.
 * Each event is published on the model's own bus and mirrored
 * to the aggregate model's bus.
 */
sealed public interface ModelEvent permits
	PropertyChanged,
	AnyChange,
	TagsChanged
{
	/**
	 * The model that changed. Never the aggregate model.
	 */
	Model model();

	/**
	 * The key under which observers receive this event.
	 */
	EventKey key();
}
