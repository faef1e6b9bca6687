package io.vena.modelsync;

import io.vena.modelsync.events.AnyChange;
import io.vena.modelsync.events.PropertyChanged;
import io.vena.modelsync.exceptions.AggregateMergeException;
import io.vena.modelsync.exceptions.ProducerLevelMismatchException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.vena.modelsync.BestSessionSelector.NO_SESSION;
import static io.vena.modelsync.SessionKeys.FLAGS;
import static io.vena.modelsync.SessionKeys.NAME;
import static io.vena.modelsync.SessionKeys.SESSION_ID;

/**
 * Applies a {@link Payload} to a {@link Model}'s sessions and notifies
 * observers of the consequences.
 *
 * <p>
 * Property changes are computed against the model's best session as it was
 * <em>before</em> the merge, because that is the state observers last heard about.
 * They are published only if the merge is <em>visible</em>: it updated what is now
 * the best session, or it targeted a real session while no session qualifies as best.
 * The latter is how observers hear about a model going offline.
 */
final class SessionMerger {
	private final Model model;
	private final Payload payload;

	/**
	 * Changes recorded in this merge, in the order first encountered.
	 * A property appearing more than once keeps its original baseline value.
	 */
	private final Map<String, Change> changes = new LinkedHashMap<>();

	@RequiredArgsConstructor
	private static final class Change {
		final @Nullable Object before;
		@Nullable Object after;
	}

	private SessionMerger(Model model, Payload payload) {
		this.model = model;
		this.payload = payload;
	}

	/**
	 * Caller must hold <code>model.lock</code>.
	 */
	static void merge(Model model, Payload payload) {
		checkPreconditions(model, payload);
		new SessionMerger(model, payload).run();
	}

	private static void checkPreconditions(Model model, Payload payload) {
		if (model.isAggregate()) {
			throw new AggregateMergeException("Cannot merge into the aggregate model: " + payload);
		}
		Object level = payload.level();
		int expectedLevel = model.registry().settings().expectedProducerLevel();
		if (level != null && !level.equals(expectedLevel)) {
			throw new ProducerLevelMismatchException(expectedLevel, level);
		}
	}

	private void run() {
		int targetId = payload.sessionId();
		PropertyMap<Object> baseline = model.bestSessionRow().snapshot();
		int baselineId = (Integer) baseline.get(SESSION_ID);
		Session target = model.sessionFor(targetId);
		LOGGER.debug("Merging into session {} with baseline session {}", targetId, baselineId);

		for (Map.Entry<String, Object> field: payload.fields().entrySet()) {
			Object value = field.getValue();
			if (Payload.isGroup(value)) {
				@SuppressWarnings("unchecked")
				PropertyMap<Object> group = (PropertyMap<Object>) value;
				for (Map.Entry<String, Object> property: group.entrySet()) {
					apply(target, baseline, property.getKey(), property.getValue());
					if (FLAGS.equals(property.getKey())) {
						target.applyFlags((Integer) property.getValue());
					}
				}
			} else {
				apply(target, baseline, field.getKey(), value);
			}
		}

		if (target.sessionId() != baselineId) {
			// Properties of the old session that the new one lacks are implicitly cleared
			for (Map.Entry<String, Object> old: baseline.entrySet()) {
				if (!target.has(old.getKey()) && !SessionFlag.isDerivedProperty(old.getKey())) {
					record(old.getKey(), old.getValue(), null);
				}
			}
		}

		int bestId = BestSessionSelector.bestSessionId(model.sessions());
		boolean visible = (bestId == targetId)
			|| (targetId != NO_SESSION && (bestId == NO_SESSION || baselineId == NO_SESSION));
		if (visible) {
			notifyObservers();
		} else {
			LOGGER.debug("Session {} is not the best session {}; suppressing notifications", targetId, bestId);
		}

		purgeOfflineSessions();
	}

	private void apply(Session target, PropertyMap<Object> baseline, String property, Object value) {
		record(property, baseline.get(property), value);
		target.put(property, value);
	}

	private void record(String property, @Nullable Object before, @Nullable Object after) {
		Change existing = changes.get(property);
		if (existing == null) {
			Change change = new Change(before);
			change.after = after;
			changes.put(property, change);
		} else {
			existing.after = after;
		}
	}

	private void notifyObservers() {
		Session best = model.bestSessionRow();
		Object bestName = best.get(NAME);
		if (bestName != null && !bestName.equals(model.cachedName())) {
			model.setName(bestName.toString());
		}
		int published = 0;
		for (Map.Entry<String, Change> entry: changes.entrySet()) {
			Change change = entry.getValue();
			if (!Objects.equals(change.before, change.after)) {
				model.publish(new PropertyChanged(model, entry.getKey(), change.before, change.after));
				++published;
			}
		}
		LOGGER.debug("Published {} of {} property changes", published, changes.size());
		model.publish(new AnyChange(model, payload));
		model.evaluateWatchers(payload);
	}

	private void purgeOfflineSessions() {
		int purged = 0;
		for (Iterator<Session> iter = model.sessions().values().iterator(); iter.hasNext(); ) {
			Session session = iter.next();
			if (session.isOffline()) {
				iter.remove();
				++purged;
			}
		}
		if (purged != 0) {
			LOGGER.debug("Purged {} offline session{}", purged, (purged >= 2)? "s":"");
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SessionMerger.class);
}
