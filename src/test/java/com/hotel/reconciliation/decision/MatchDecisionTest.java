package com.hotel.reconciliation.decision;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class MatchDecisionTest {

    @Test
    @DisplayName("Rejected decisions need a reason")
    void rejectedNeedsReason() {
        assertThrows(NullPointerException.class, () -> MatchDecision.builder().rejected(null).build());
    }

    @Test
    @DisplayName("Accepted decisions carry no reason")
    void acceptedHasNoReason() {
        assertThrows(IllegalArgumentException.class, () -> new MatchDecision(0, 0, "a", "b", 1.0, 0.0,
                true, RejectionReason.NAME, 0.85, 0.3));

        MatchDecision decision = MatchDecision.builder()
                .rejected(RejectionReason.NAME)
                .accepted()
                .distanceMeters(1500)
                .build();
        assertTrue(decision.accepted());
        assertFalse(decision.isRejected());
        assertEquals(1.5, decision.distanceKm());
    }

    @ParameterizedTest(name = "name={0} distance={1} -> {2}")
    @CsvSource({
            "false, true, NAME",
            "true, false, DISTANCE",
            "false, false, NAME_AND_DISTANCE"
    })
    @DisplayName("Threshold failures map to a reason")
    void forThresholds(boolean namePassed, boolean distancePassed, RejectionReason expected) {
        assertEquals(expected, RejectionReason.forThresholds(namePassed, distancePassed));
        assertTrue(expected.isThresholdFailure());
    }

    @Test
    @DisplayName("Passing both thresholds is not a rejection")
    void bothPassed() {
        assertThrows(IllegalArgumentException.class, () -> RejectionReason.forThresholds(true, true));
        assertFalse(RejectionReason.SOURCE_B_CLAIMED.isThresholdFailure());
        assertFalse(RejectionReason.SOURCE_A_MATCHED.isThresholdFailure());
    }

    @Test
    @DisplayName("Labels are short and lower case")
    void labels() {
        assertEquals("name", RejectionReason.NAME.label());
        assertEquals("distance", RejectionReason.DISTANCE.label());
        assertEquals("name+distance", RejectionReason.NAME_AND_DISTANCE.label());
        assertEquals("b-claimed", RejectionReason.SOURCE_B_CLAIMED.label());
    }
}
