package io.vena.modelsync;

import io.vena.modelsync.exceptions.AggregateMergeException;
import java.util.Collection;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The reserved model whose observers hear every other model's events,
 * and whose watchers are evaluated against every other model.
 *
 * <p>
 * It has no sessions: merging into it is an error, and resetting it resets
 * every model in the registry.
 */
public final class AggregateModel extends Model {
	AggregateModel(int id, ModelRegistry registry) {
		super(id, registry);
	}

	@Override
	public boolean isAggregate() {
		return true;
	}

	/**
	 * @throws AggregateMergeException always; the aggregate has no tags of its own
	 */
	@Override
	public void mergeTags(Collection<String> newTags) {
		throw new AggregateMergeException("Cannot merge tags into the aggregate model: " + newTags);
	}

	/**
	 * Resets every model in the registry. The registry's lock is not held
	 * while the models are reset, so models created concurrently may be missed.
	 */
	@Override
	public void reset() {
		List<Model> models = registry().models();
		LOGGER.info("Resetting all {} models", models.size());
		for (Model model: models) {
			model.reset();
		}
	}

	/**
	 * Evaluates the new watcher against each model in turn, taking each model's lock
	 * before this one's.
	 */
	@Override
	void evaluateNewWatcher() {
		for (Model model: registry().models()) {
			model.lock.lock();
			try {
				evaluateWatchersOn(model, null);
			} finally {
				model.lock.unlock();
			}
		}
	}

	@Override
	void evaluateWatchers(Payload payload) {
		// Watchers on the aggregate only ever see real models
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(AggregateModel.class);
}
