package io.vena.modelsync;

import io.vena.modelsync.MappedDiagnosticContext.MDCScope;
import io.vena.modelsync.events.EventKey;
import io.vena.modelsync.events.ModelEvent;
import io.vena.modelsync.events.ModelEventBus;
import io.vena.modelsync.events.ModelObserver;
import io.vena.modelsync.events.Subscription;
import io.vena.modelsync.events.SynchronousEventBus;
import io.vena.modelsync.events.TagsChanged;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import lombok.Getter;
import lombok.NonNull;
import org.jetbrains.annotations.Nullable;
import org.pcollections.OrderedPSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.vena.modelsync.MappedDiagnosticContext.setupMDC;
import static io.vena.modelsync.SessionKeys.ENTITY_ID;
import static io.vena.modelsync.SessionKeys.SESSION_ID;
import static io.vena.modelsync.SessionKeys.TAGS;
import static io.vena.modelsync.SessionKeys.VIDEO_STATE;
import static java.util.Collections.singletonMap;
import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableSet;

/**
 * A remote participant, such as a broadcaster, whose state is assembled
 * from the partial updates merged into it.
 *
 * <p>
 * A model may have several sessions at once while it transitions between them.
 * Exactly one of these, chosen by {@link #bestSessionId()}, is authoritative:
 * observers only hear about merges that affect the best session.
 *
 * <p>
 * Obtain instances from {@link ModelRegistry#getOrCreate}. All methods are thread-safe.
 * Observers and watcher callbacks run on the calling thread while this model's
 * lock is held; they may read this model freely, but must not call
 * {@link ModelRegistry#find} or wait for other threads.
 *
 * <h3>Locking</h3>
 * Each model has a reentrant lock guarding its sessions, name and watchers.
 * After a merge, the aggregate model's lock is taken to run its watchers;
 * it is always acquired <em>after</em> this model's lock, never before,
 * so concurrent merges into different models can't deadlock.
 */
public class Model {
	@Getter private final int id;
	@Getter private final ModelRegistry registry;
	final ReentrantLock lock = new ReentrantLock();
	final ModelEventBus events;

	// Guarded by lock
	private final Map<Integer, Session> sessions = new HashMap<>();
	private final Watchers watchers;
	private @Nullable String name;

	// Replaced, never mutated
	private volatile OrderedPSet<String> tags = OrderedPSet.empty();

	Model(int id, ModelRegistry registry) {
		this.id = id;
		this.registry = registry;
		this.events = new SynchronousEventBus("model " + id);
		this.watchers = new Watchers(id);
	}

	public boolean isAggregate() {
		return false;
	}

	/**
	 * @return the display name from the best session of the most recent
	 * merge that supplied one, or null if no name has been seen
	 */
	public @Nullable String name() {
		lock.lock();
		try {
			return name;
		} finally {
			lock.unlock();
		}
	}

	/**
	 * @return an immutable snapshot of this model's tags
	 */
	public Set<String> tags() {
		return tags;
	}

	/**
	 * Recomputed on every call, since it depends on the current state of every session.
	 *
	 * @return the ID of the authoritative session, or zero if every session is offline
	 */
	public int bestSessionId() {
		lock.lock();
		try {
			return BestSessionSelector.bestSessionId(sessions);
		} finally {
			lock.unlock();
		}
	}

	/**
	 * @return the properties of the {@link #bestSessionId() best session}; if there is
	 * none, an offline placeholder containing only default properties
	 */
	public PropertyMap<Object> bestSession() {
		lock.lock();
		try {
			return bestSessionRow().snapshot();
		} finally {
			lock.unlock();
		}
	}

	public VideoState videoState() {
		lock.lock();
		try {
			return bestSessionRow().videoState();
		} finally {
			lock.unlock();
		}
	}

	/**
	 * @return true if the best session is a private show with the true-private flag set
	 */
	public boolean inTruePrivate() {
		lock.lock();
		try {
			Session best = bestSessionRow();
			return best.videoState() == VideoState.PRIVATE && best.isTruePrivate();
		} finally {
			lock.unlock();
		}
	}

	/**
	 * @return the IDs of all sessions currently being tracked, in ascending order
	 */
	public Set<Integer> sessionIds() {
		lock.lock();
		try {
			return unmodifiableSet(new TreeSet<>(sessions.keySet()));
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Applies <code>payload</code> to the session it names (session zero if it names none),
	 * and, if that affected the best session, notifies observers of each property that
	 * changed value and then of the update as a whole.
	 * Finally, discards sessions that have gone offline.
	 *
	 * @throws io.vena.modelsync.exceptions.AggregateMergeException if this is the aggregate model
	 * @throws io.vena.modelsync.exceptions.ProducerLevelMismatchException if the payload declares
	 * a producer level other than {@link ModelSyncSettings#expectedProducerLevel()}; the model is unchanged
	 */
	public void merge(@NonNull Payload payload) {
		lock.lock();
		try {
			try (MDCScope __ = setupMDC(id, payload.sessionId())) {
				SessionMerger.merge(this, payload);
			}
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Adds <code>newTags</code> to this model's tags and notifies observers with a
	 * {@link TagsChanged} event, whether or not any tag was actually new.
	 *
	 * @throws IllegalArgumentException if any tag is null; the model is unchanged
	 */
	public void mergeTags(@NonNull Collection<String> newTags) {
		for (String tag: newTags) {
			if (tag == null) {
				throw new IllegalArgumentException("Tags can't be null: " + newTags);
			}
		}
		lock.lock();
		try {
			OrderedPSet<String> previousTags = tags;
			tags = previousTags.plusAll(newTags);
			LOGGER.debug("Model {}: tags {} -> {}", id, previousTags, tags);
			publish(new TagsChanged(this, previousTags, tags));
			evaluateWatchers(Payload.of(singletonMap(TAGS, unmodifiableList(new ArrayList<>(newTags)))));
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Takes this model offline: every session other than the best one is marked offline,
	 * and then the best session is taken offline by an ordinary {@link #merge}, so observers
	 * and watchers see the transition like any other.
	 */
	public void reset() {
		lock.lock();
		try {
			int bestSessionId = BestSessionSelector.bestSessionId(sessions);
			try (MDCScope __ = setupMDC(id, bestSessionId)) {
				for (Session session: sessions.values()) {
					if (session.sessionId() != bestSessionId && !session.isOffline()) {
						LOGGER.debug("Reset: forcing session {} offline", session.sessionId());
						session.put(VIDEO_STATE, VideoState.OFFLINE);
					}
				}
				Map<String, Object> blank = new LinkedHashMap<>();
				blank.put(SESSION_ID, bestSessionId);
				blank.put(ENTITY_ID, id);
				blank.put(VIDEO_STATE, VideoState.OFFLINE);
				merge(Payload.of(blank));
			}
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Registers a watcher whose callbacks fire on transitions of <code>condition</code>:
	 * <code>onTrue</code> when it becomes true, <code>onFalseAfterTrue</code> when it
	 * stops being true. Steady states fire nothing.
	 *
	 * <p>
	 * The condition is evaluated immediately, and again after every visible merge and
	 * every tag merge. Registering on the {@link ModelRegistry#aggregate() aggregate model}
	 * watches every model.
	 */
	public WatchHandle when(@NonNull Predicate<Model> condition, @NonNull WatcherCallback onTrue, @NonNull WatcherCallback onFalseAfterTrue) {
		WatchHandle handle;
		lock.lock();
		try {
			handle = watchers.add(condition, onTrue, onFalseAfterTrue);
			LOGGER.debug("Model {}: registered {}", id, handle);
		} finally {
			lock.unlock();
		}
		evaluateNewWatcher();
		return handle;
	}

	public WatchHandle when(@NonNull Predicate<Model> condition, @NonNull WatcherCallback onTrue) {
		return when(condition, onTrue, WatcherCallback.NONE);
	}

	/**
	 * @return false if the watcher was already removed, or belongs to another model
	 */
	public boolean unwatch(@NonNull WatchHandle handle) {
		lock.lock();
		try {
			return watchers.remove(handle);
		} finally {
			lock.unlock();
		}
	}

	public Subscription subscribe(@NonNull EventKey key, @NonNull ModelObserver observer) {
		return events.subscribe(key, observer);
	}

	public Subscription onProperty(@NonNull String property, @NonNull ModelObserver observer) {
		return subscribe(EventKey.property(property), observer);
	}

	public Subscription onEveryProperty(@NonNull ModelObserver observer) {
		return subscribe(EventKey.EVERY_PROPERTY, observer);
	}

	public Subscription onAny(@NonNull ModelObserver observer) {
		return subscribe(EventKey.ANY, observer);
	}

	public Subscription onTags(@NonNull ModelObserver observer) {
		return subscribe(EventKey.TAGS, observer);
	}

	/**
	 * Publishes <code>event</code> to this model's observers, then to the aggregate's.
	 */
	void publish(ModelEvent event) {
		LOGGER.trace("Model {}: publish {}", id, event);
		events.publish(event);
		registry.aggregate().events.publish(event);
	}

	/**
	 * Runs this model's watchers, then the aggregate's, against this model.
	 */
	void evaluateWatchers(@Nullable Payload payload) {
		lock.lock();
		try {
			watchers.evaluate(this, payload);
			registry.aggregate().evaluateWatchersOn(this, payload);
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Called without holding this model's lock.
	 */
	void evaluateNewWatcher() {
		evaluateWatchers(null);
	}

	void evaluateWatchersOn(Model subject, @Nullable Payload payload) {
		lock.lock();
		try {
			watchers.evaluate(subject, payload);
		} finally {
			lock.unlock();
		}
	}

	int watcherCount() {
		lock.lock();
		try {
			return watchers.size();
		} finally {
			lock.unlock();
		}
	}

	////////////////
	//
	//  For SessionMerger. Caller must hold the lock.
	//

	Map<Integer, Session> sessions() {
		return sessions;
	}

	Session sessionFor(int sessionId) {
		return sessions.computeIfAbsent(sessionId, sid -> Session.withDefaults(sid, id));
	}

	/**
	 * @return the best session, or a detached offline placeholder if there isn't one
	 */
	Session bestSessionRow() {
		int bestSessionId = BestSessionSelector.bestSessionId(sessions);
		Session result = sessions.get(bestSessionId);
		return (result == null)? Session.withDefaults(bestSessionId, id) : result;
	}

	void setName(@Nullable String name) {
		this.name = name;
	}

	@Nullable String cachedName() {
		return name;
	}

	@Override
	public String toString() {
		lock.lock();
		try {
			return "Model{id=" + id + ", name=" + name + ", tags=" + tags + ", bestSession=" + bestSessionRow() + "}";
		} finally {
			lock.unlock();
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Model.class);
}
