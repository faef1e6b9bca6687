package io.vena.modelsync;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import lombok.Getter;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Collections.unmodifiableList;

/**
 * Owns every {@link Model} known to one client, keyed by model ID,
 * plus the {@link AggregateModel} that mirrors them all.
 *
 * <p>
 * A single lock guards the ID-to-model map. It is never held while
 * a model's lock is being acquired, except during {@link #find},
 * whose predicate runs under it.
 */
public class ModelRegistry {
	@Getter private final ModelSyncSettings settings;
	@Getter private final AggregateModel aggregate;
	private final Map<Integer, Model> models = new HashMap<>();

	public ModelRegistry() {
		this(ModelSyncSettings.builder().build());
	}

	public ModelRegistry(@NonNull ModelSyncSettings settings) {
		settings.validate();
		this.settings = settings;
		this.aggregate = new AggregateModel(settings.aggregateModelID(), this);
		LOGGER.debug("New registry with aggregate model {}", aggregate.id());
	}

	/**
	 * @return the model with the given ID, created if necessary. Repeated calls with the
	 * same ID return the same object. The aggregate model's ID returns the aggregate model.
	 */
	public Model getOrCreate(int id) {
		if (id == aggregate.id()) {
			return aggregate;
		}
		synchronized (models) {
			return models.computeIfAbsent(id, this::newModel);
		}
	}

	/**
	 * @throws NumberFormatException if <code>id</code> is not a decimal integer
	 */
	public Model getOrCreate(@NonNull String id) {
		return getOrCreate(Integer.parseInt(id.trim()));
	}

	/**
	 * Never creates a model.
	 */
	public Optional<Model> get(int id) {
		if (id == aggregate.id()) {
			return Optional.of(aggregate);
		}
		synchronized (models) {
			return Optional.ofNullable(models.get(id));
		}
	}

	/**
	 * Evaluates <code>predicate</code> on every model (but not the aggregate)
	 * while holding the registry's lock.
	 * The predicate may read the models but must not call back into this registry.
	 *
	 * @return the matching models
	 */
	public List<Model> find(@NonNull Predicate<Model> predicate) {
		List<Model> result = new ArrayList<>();
		synchronized (models) {
			for (Model model: models.values()) {
				if (predicate.test(model)) {
					result.add(model);
				}
			}
		}
		return unmodifiableList(result);
	}

	/**
	 * @return a snapshot of every model except the aggregate
	 */
	public List<Model> models() {
		synchronized (models) {
			return unmodifiableList(new ArrayList<>(models.values()));
		}
	}

	/**
	 * Takes every model offline.
	 *
	 * @see AggregateModel#reset()
	 */
	public void resetAll() {
		aggregate.reset();
	}

	private Model newModel(int id) {
		LOGGER.debug("New model {}", id);
		return new Model(id, this);
	}

	@Override
	public String toString() {
		synchronized (models) {
			return "ModelRegistry(" + models.size() + " models)";
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ModelRegistry.class);
}
