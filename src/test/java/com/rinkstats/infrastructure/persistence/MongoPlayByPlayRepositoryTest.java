package com.rinkstats.infrastructure.persistence;

import com.rinkstats.domain.model.CanonicalEvent;
import com.rinkstats.domain.model.EnrichedEvent;
import com.rinkstats.domain.model.EventType;
import com.rinkstats.support.SyntheticGame;
import com.rinkstats.support.SyntheticPlayByPlay;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the document mapping of MongoPlayByPlayRepository.
 */
class MongoPlayByPlayRepositoryTest {

    private List<EnrichedEvent> events;

    @BeforeEach
    void setUp() {
        events = SyntheticPlayByPlay.build().enriched();
    }

    @Test
    void testDocumentCarriesKeyFields() {
        EnrichedEvent goal = find(EventType.GOAL);

        Document document = MongoPlayByPlayRepository.eventToDocument(goal);

        assertEquals(SyntheticGame.GAME_ID.toString(), document.getString(MongoPlayByPlayRepository.GAME_ID));
        assertEquals(goal.getEvent().getEventIdx(), document.getInteger(MongoPlayByPlayRepository.EVENT_IDX));
        assertEquals("PIT", document.getString("homeTeam"));
        assertNotNull(document.get("event"));
    }

    @Test
    void testStoredEventReadsBack() {
        EnrichedEvent goal = find(EventType.GOAL);
        Document stored = MongoPlayByPlayRepository.eventToDocument(goal);
        stored.put("_id", "generated");

        EnrichedEvent restored = MongoPlayByPlayRepository.documentToEvent(stored);

        CanonicalEvent original = goal.getEvent();
        CanonicalEvent copy = restored.getEvent();
        assertEquals(SyntheticGame.GAME_ID, restored.getGameId());
        assertEquals(original.getEventIdx(), copy.getEventIdx());
        assertEquals(EventType.GOAL, copy.getEventType());
        assertEquals(original.getPeriodTime(), copy.getPeriodTime());
        assertEquals(original.getPlayers(), copy.getPlayers());
        assertEquals(original.getProvenance(), copy.getProvenance());
        assertEquals(goal.getHomeOnIce(), restored.getHomeOnIce());
        assertEquals(goal.getHomeStrengthState(), restored.getHomeStrengthState());
        assertEquals(goal.getShotDistance(), restored.getShotDistance());
        assertEquals(goal.isHighDanger(), restored.isHighDanger());
        assertEquals(goal.getEventVenue(), restored.getEventVenue());
    }

    @Test
    void testEventWithoutCoordinatesReadsBack() {
        EnrichedEvent periodStart = find(EventType.PSTR);

        EnrichedEvent restored = MongoPlayByPlayRepository.documentToEvent(
            MongoPlayByPlayRepository.eventToDocument(periodStart));

        assertNull(restored.getShotDistance());
        assertNull(restored.getEvent().getCoordsX());
        assertNull(restored.getPredictedGoal());
    }

    private EnrichedEvent find(EventType type) {
        return events.stream().filter(event -> event.getEvent().getEventType() == type)
            .findFirst().orElseThrow();
    }
}
