package work.bindlang.lifecycle;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class LifecycleRulesTest {
    @Test
    void legalTransitions() {
        assertTrue(LifecycleRules.isLegal(UnitState.CREATED, UnitState.DORMANT));
        assertTrue(LifecycleRules.isLegal(UnitState.DORMANT, UnitState.ACTIVATED));
        assertTrue(LifecycleRules.isLegal(UnitState.DORMANT, UnitState.EXPIRED));
        assertTrue(LifecycleRules.isLegal(UnitState.ACTIVATED, UnitState.ARCHIVED));
        assertTrue(LifecycleRules.isLegal(UnitState.ACTIVATED, UnitState.DORMANT));
    }

    @Test
    void terminalStates() {
        assertTrue(LifecycleRules.isTerminal(UnitState.EXPIRED));
        assertTrue(LifecycleRules.isTerminal(UnitState.ARCHIVED));
        assertFalse(LifecycleRules.isTerminal(UnitState.DORMANT));
        assertEquals(Set.of(UnitState.ACTIVATED, UnitState.EXPIRED), LifecycleRules.reachableFrom(UnitState.DORMANT));
    }

    @Test
    void ledgerRejectsIllegalTransition() {
        var ledger = new TransitionLedger(Clock.fixed(Instant.EPOCH, ZoneOffset.UTC));
        var ex = assertThrows(IllegalTransitionException.class,
            () -> ledger.record("u", UnitState.DORMANT, UnitState.ARCHIVED, "nope"));
        assertEquals("Invalid transition: dormant -> archived", ex.getMessage());
        assertEquals(UnitState.DORMANT, ex.from());
        assertEquals(UnitState.ARCHIVED, ex.to());
        assertEquals(0, ledger.size());
    }

    @Test
    void ledgerTracksLatestState() {
        var ledger = new TransitionLedger(Clock.fixed(Instant.EPOCH, ZoneOffset.UTC));
        ledger.record("u", UnitState.CREATED, UnitState.DORMANT, "Registered");
        ledger.record("v", UnitState.CREATED, UnitState.DORMANT, "Registered");
        ledger.record("u", UnitState.DORMANT, UnitState.ACTIVATED, "Binding success");

        assertEquals(Optional.of(UnitState.ACTIVATED), ledger.latestState("u"));
        assertEquals(Optional.of(UnitState.DORMANT), ledger.latestState("v"));
        assertEquals(Optional.empty(), ledger.latestState("w"));
        assertEquals(2, ledger.entries("u").size());
        assertEquals(3, ledger.entries(null).size());
    }
}
