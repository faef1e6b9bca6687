package io.vena.modelsync;

import io.vena.modelsync.events.AnyChange;
import io.vena.modelsync.events.PropertyChanged;
import io.vena.modelsync.exceptions.AggregateMergeException;
import io.vena.modelsync.exceptions.ProducerLevelMismatchException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static io.vena.modelsync.SessionKeys.ENTITY_ID;
import static io.vena.modelsync.SessionKeys.FLAGS;
import static io.vena.modelsync.SessionKeys.LEVEL;
import static io.vena.modelsync.SessionKeys.NAME;
import static io.vena.modelsync.SessionKeys.OFFICIAL_SOFTWARE;
import static io.vena.modelsync.SessionKeys.RANK;
import static io.vena.modelsync.SessionKeys.SESSION_ID;
import static io.vena.modelsync.SessionKeys.TRUE_PRIVATE;
import static io.vena.modelsync.SessionKeys.VIDEO_STATE;
import static java.util.Arrays.asList;
import static java.util.Collections.emptyList;
import static java.util.Collections.singletonList;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionMergerTest extends AbstractModelTest {
	static final int MODEL_ID = 1234;

	Model model;
	EventRecorder recorder;
	EventRecorder aggregateRecorder;

	@BeforeEach
	void setUpModel() {
		model = registry.getOrCreate(MODEL_ID);
		recorder = new EventRecorder().attachTo(model);
		aggregateRecorder = new EventRecorder().attachTo(registry.aggregate());
	}

	@Test
	void firstMerge_emitsEachChangedPropertyAndAny() {
		Payload payload = sessionIn(1, VideoState.ONLINE, NAME, "Alice");
		model.merge(payload);

		assertEquals(
			asList(
				new PropertyChanged(model, SESSION_ID, 0, 1),
				new PropertyChanged(model, VIDEO_STATE, VideoState.OFFLINE, VideoState.ONLINE),
				new PropertyChanged(model, NAME, null, "Alice"),
				new AnyChange(model, payload)),
			recorder.events());
		assertEquals(singletonList(new PropertyChanged(model, NAME, null, "Alice")), recorder.propertyChanges(NAME));
		assertEquals("Alice", model.name());
		assertEquals(1, model.bestSessionId());
	}

	@Test
	void repeatedMerge_noPropertyEventsButAnyFiresAgain() {
		Payload payload = sessionIn(1, VideoState.ONLINE, NAME, "Alice");
		model.merge(payload);
		recorder.restart();

		model.merge(payload);
		assertThat(recorder.propertyChanges(), empty());
		assertEquals(singletonList(new AnyChange(model, payload)), recorder.events());
	}

	@Test
	void events_mirroredToAggregate() {
		model.merge(sessionIn(1, VideoState.ONLINE, NAME, "Alice"));
		assertEquals(recorder.events(), aggregateRecorder.events());

		Model other = registry.getOrCreate(MODEL_ID + 1);
		aggregateRecorder.restart();
		other.merge(sessionIn(2, VideoState.AWAY));
		assertEquals(1, aggregateRecorder.anyChanges().size());
		assertEquals(other, aggregateRecorder.anyChanges().get(0).model());
	}

	@Test
	void singlePropertySubscription_seesOnlyThatProperty() {
		EventRecorder nameRecorder = new EventRecorder();
		model.onProperty(NAME, nameRecorder);

		model.merge(sessionIn(1, VideoState.ONLINE, NAME, "Alice", RANK, 3));
		model.merge(sessionIn(1, VideoState.ONLINE, NAME, "Alicia"));

		assertEquals(
			asList(
				new PropertyChanged(model, NAME, null, "Alice"),
				new PropertyChanged(model, NAME, "Alice", "Alicia")),
			nameRecorder.events());
	}

	@Test
	void propertyGroups_flattenedIntoSession() {
		model.merge(payload(
			SESSION_ID, 1,
			"user", map(VIDEO_STATE, VideoState.ONLINE.code(), NAME, "Alice"),
			"model", map("camscore", 512, "topic", "hi")));

		PropertyMap<Object> best = model.bestSession();
		assertEquals(VideoState.ONLINE, best.get(VIDEO_STATE));
		assertEquals("Alice", best.get(NAME));
		assertEquals(512, best.get("camscore"));
		assertEquals("hi", best.get("topic"));
		assertFalse(best.containsKey("user"));
		assertEquals(1, recorder.propertyChanges("topic").size());
	}

	@Test
	void flags_deriveBooleansWithoutEvents() {
		int flags = SessionFlag.TRUE_PRIVATE.bit() | SessionFlag.OFFICIAL_SOFTWARE.bit();
		model.merge(payload(
			SESSION_ID, 1,
			VIDEO_STATE, VideoState.PRIVATE,
			"model", map(FLAGS, flags)));

		PropertyMap<Object> best = model.bestSession();
		assertEquals(true, best.get(TRUE_PRIVATE));
		assertEquals(true, best.get(OFFICIAL_SOFTWARE));
		assertEquals(false, best.get(SessionKeys.GUESTS_MUTED));
		assertEquals(false, best.get(SessionKeys.BASICS_MUTED));
		assertTrue(model.inTruePrivate());

		assertEquals(singletonList(new PropertyChanged(model, FLAGS, null, flags)), recorder.propertyChanges(FLAGS));
		for (SessionFlag flag: SessionFlag.values()) {
			assertThat("No event for derived property " + flag.propertyName(), recorder.propertyChanges(flag.propertyName()), empty());
		}
	}

	@Test
	void truePrivate_requiresPrivateState() {
		model.merge(payload(
			SESSION_ID, 1,
			VIDEO_STATE, VideoState.GROUP_SHOW,
			"model", map(FLAGS, SessionFlag.TRUE_PRIVATE.bit())));
		assertFalse(model.inTruePrivate());
	}

	@Test
	void mergeIntoNonBestSession_invisible() {
		model.merge(sessionIn(10, VideoState.ONLINE, NAME, "Alice"));
		recorder.restart();

		model.merge(sessionIn(5, VideoState.ONLINE, NAME, "Bob"));
		assertEquals(emptyList(), recorder.events(), "Lower session is not the best; nothing to report");
		assertEquals("Alice", model.name());
		assertEquals(asList(5, 10), List.copyOf(model.sessionIds()));
	}

	@Test
	void officialSoftwareSession_takesOver() {
		model.merge(sessionIn(10, VideoState.ONLINE));
		model.merge(sessionIn(5, VideoState.ONLINE));
		recorder.restart();

		int officialFlag = SessionFlag.OFFICIAL_SOFTWARE.bit();
		model.merge(payload(SESSION_ID, 5, "model", map(FLAGS, officialFlag)));

		assertEquals(5, model.bestSessionId());
		assertEquals(
			asList(
				new PropertyChanged(model, SESSION_ID, 10, 5),
				new PropertyChanged(model, FLAGS, null, officialFlag)),
			recorder.propertyChanges());
	}

	@Test
	void sessionChange_clearsPropertiesMissingFromNewSession() {
		model.merge(sessionIn(10, VideoState.ONLINE, "topic", "hello", NAME, "Alice"));
		recorder.restart();

		model.merge(sessionIn(20, VideoState.ONLINE, NAME, "Alice"));

		assertEquals(
			asList(
				new PropertyChanged(model, SESSION_ID, 10, 20),
				new PropertyChanged(model, "topic", "hello", null)),
			recorder.propertyChanges());
	}

	@Test
	void sessionChange_derivedFlagsNotReportedAsCleared() {
		model.merge(payload(SESSION_ID, 10, VIDEO_STATE, VideoState.ONLINE, "model", map(FLAGS, 0)));
		recorder.restart();

		model.merge(sessionIn(20, VideoState.ONLINE));

		assertEquals(
			asList(
				new PropertyChanged(model, SESSION_ID, 10, 20),
				new PropertyChanged(model, FLAGS, 0, null)),
			recorder.propertyChanges());
	}

	@Test
	void duplicateKeyAcrossGroups_reportedOnce() {
		model.merge(payload(
			SESSION_ID, 1,
			VIDEO_STATE, VideoState.ONLINE,
			"user", map(RANK, 3),
			"model", map(RANK, 5)));

		assertEquals(singletonList(new PropertyChanged(model, RANK, 0, 5)), recorder.propertyChanges(RANK));
		assertEquals(5, model.bestSession().get(RANK));
	}

	@Test
	void goingOffline_visibleAndPurged() {
		model.merge(sessionIn(1, VideoState.ONLINE));
		recorder.restart();

		model.merge(sessionIn(1, VideoState.OFFLINE));

		assertEquals(
			singletonList(new PropertyChanged(model, VIDEO_STATE, VideoState.ONLINE, VideoState.OFFLINE)),
			recorder.propertyChanges());
		assertEquals(1, recorder.anyChanges().size());
		assertThat(model.sessionIds(), empty());
		assertEquals(0, model.bestSessionId());
		assertEquals(VideoState.OFFLINE, model.videoState());
	}

	@Test
	void payloadWithoutVideoState_purgedAsOffline() {
		model.merge(payload(SESSION_ID, 7, NAME, "Alice"));
		assertThat(model.sessionIds(), empty());
	}

	@Test
	void bestSession_offlinePlaceholderNotStored() {
		PropertyMap<Object> placeholder = model.bestSession();
		assertEquals(0, placeholder.get(SESSION_ID));
		assertEquals(MODEL_ID, placeholder.get(ENTITY_ID));
		assertEquals(VideoState.OFFLINE, placeholder.get(VIDEO_STATE));
		assertEquals(0, placeholder.get(RANK));
		assertThat(model.sessionIds(), empty());
	}

	@Test
	void matchingLevel_accepted() {
		model.merge(sessionIn(1, VideoState.ONLINE, LEVEL, 4));
		assertEquals(1, model.bestSessionId());
	}

	@Test
	void mismatchedLevel_rejectedWithoutSideEffects() {
		model.merge(sessionIn(1, VideoState.ONLINE, NAME, "Alice"));
		PropertyMap<Object> before = model.bestSession();
		recorder.restart();

		ProducerLevelMismatchException e = assertThrows(ProducerLevelMismatchException.class,
			() -> model.merge(sessionIn(2, VideoState.ONLINE, NAME, "Mallory", LEVEL, 1)));

		assertEquals(4, e.expectedLevel());
		assertEquals(1, e.actualLevel());
		assertEquals(before, model.bestSession());
		assertEquals(singletonList(1), List.copyOf(model.sessionIds()));
		assertEquals("Alice", model.name());
		assertEquals(emptyList(), recorder.events());
	}

	@Test
	void mergeIntoAggregate_rejected() {
		AggregateModel aggregate = registry.aggregate();
		assertThrows(AggregateMergeException.class, () -> aggregate.merge(sessionIn(1, VideoState.ONLINE)));
		assertThrows(AggregateMergeException.class, () -> aggregate.mergeTags(singletonList("nope")));
		assertEquals(emptyList(), aggregateRecorder.events());
	}

	@Test
	void nameCleared_cachedNameRetained() {
		model.merge(sessionIn(10, VideoState.ONLINE, NAME, "Alice"));
		model.merge(sessionIn(20, VideoState.ONLINE));
		assertEquals(new PropertyChanged(model, NAME, "Alice", null), recorder.propertyChanges(NAME).get(1));
		assertEquals("Alice", model.name());
		assertNull(model.bestSession().get(NAME));
	}

	@Test
	void throwingObserver_doesNotAbortMerge() {
		model.onProperty(NAME, event -> {
			throw new IllegalStateException("Observer failure (this is expected in this test)");
		});
		model.merge(sessionIn(1, VideoState.ONLINE, NAME, "Alice"));

		assertEquals(1, recorder.anyChanges().size());
		assertEquals(1, recorder.propertyChanges(NAME).size());
		assertEquals("Alice", model.name());
	}

	@Test
	void closedSubscription_stopsDelivery() {
		EventRecorder anyRecorder = new EventRecorder();
		var subscription = model.onAny(anyRecorder);
		model.merge(sessionIn(1, VideoState.ONLINE));
		subscription.close();
		model.merge(sessionIn(1, VideoState.AWAY));

		assertEquals(1, anyRecorder.events().size());
	}
}
