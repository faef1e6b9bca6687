package io.vena.modelsync;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import lombok.RequiredArgsConstructor;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The watcher table of a single {@link Model}, with edge-triggered evaluation.
 *
 * <p>
 * Each watcher remembers the IDs of the models for which its condition was last
 * seen to be true. A watcher on an ordinary model only ever sees that model;
 * a watcher on the aggregate model sees all of them.
 *
 * <p>
 * Not thread-safe: every method must be called while holding the owning model's lock.
 */
@RequiredArgsConstructor
final class Watchers {
	private final int ownerID;
	private final Map<WatchHandle, WatcherRecord> records = new LinkedHashMap<>();
	private long serialCounter = 0;

	@RequiredArgsConstructor
	private static final class WatcherRecord {
		final Predicate<Model> condition;
		final WatcherCallback onTrue;
		final WatcherCallback onFalseAfterTrue;
		final Set<Integer> matched = new HashSet<>();
	}

	WatchHandle add(Predicate<Model> condition, WatcherCallback onTrue, WatcherCallback onFalseAfterTrue) {
		WatchHandle handle = new WatchHandle(ownerID, ++serialCounter);
		records.put(handle, new WatcherRecord(condition, onTrue, onFalseAfterTrue));
		return handle;
	}

	boolean remove(WatchHandle handle) {
		return records.remove(handle) != null;
	}

	int size() {
		return records.size();
	}

	/**
	 * Runs every watcher's condition against <code>subject</code> and fires the
	 * callbacks of those whose answer changed since the last evaluation.
	 */
	void evaluate(Model subject, @Nullable Payload payload) {
		// Callbacks may add or remove watchers, so iterate over a copy
		List<Map.Entry<WatchHandle, WatcherRecord>> snapshot = new ArrayList<>(records.entrySet());
		for (Map.Entry<WatchHandle, WatcherRecord> entry: snapshot) {
			if (records.containsKey(entry.getKey())) {
				evaluateOne(entry.getKey(), entry.getValue(), subject, payload);
			}
		}
	}

	private void evaluateOne(WatchHandle handle, WatcherRecord record, Model subject, @Nullable Payload payload) {
		boolean conditionHolds;
		try {
			conditionHolds = record.condition.test(subject);
		} catch (RuntimeException e) {
			LOGGER.error("Condition of {} threw on model {}; skipping: {}", handle, subject.id(), e.getMessage(), e);
			return;
		}
		if (conditionHolds) {
			if (record.matched.add(subject.id())) {
				LOGGER.debug("{}: became true for model {}", handle, subject.id());
				invoke(handle, record.onTrue, subject, payload);
			}
		} else if (record.matched.remove(subject.id())) {
			LOGGER.debug("{}: no longer true for model {}", handle, subject.id());
			invoke(handle, record.onFalseAfterTrue, subject, payload);
		}
	}

	private static void invoke(WatchHandle handle, WatcherCallback callback, Model subject, @Nullable Payload payload) {
		try {
			callback.accept(subject, payload);
		} catch (RuntimeException e) {
			LOGGER.error("Callback of {} aborted due to exception: {}", handle, e.getMessage(), e);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Watchers.class);
}
