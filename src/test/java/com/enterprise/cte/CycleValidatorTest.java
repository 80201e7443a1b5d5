package com.enterprise.cte;

import com.enterprise.cte.core.Cte;
import com.enterprise.cte.core.CteMapping;
import com.enterprise.cte.graph.CycleValidator;
import com.enterprise.cte.graph.TopologicalOrderer;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CycleValidatorTest {

    @Test
    void acyclicMappingIsValid() {
        CteMapping mapping = CteMapping.of(
                Cte.of("session_data", "SELECT user_id, session_id FROM user_sessions"),
                Cte.of("conversion_events", "SELECT user_id, event_type FROM events"),
                Cte.of("funnel_analysis", "SELECT user_id FROM conversion_events", "conversion_events"),
                Cte.of("channel_performance", "SELECT * FROM session_data sd JOIN funnel_analysis fa ON sd.user_id = fa.user_id",
                        "session_data", "funnel_analysis"));

        assertThat(CycleValidator.validateNoCycles(mapping)).isTrue();
        assertThat(CycleValidator.hasCycle(mapping)).isFalse();
        assertThat(CycleValidator.findCycle(mapping)).isEmpty();
    }

    @Test
    void twoNodeCycle() {
        CteMapping mapping = CteMapping.of(
                Cte.of("a", "SELECT * FROM b", "b"),
                Cte.of("b", "SELECT * FROM a", "a"));

        assertThat(CycleValidator.validateNoCycles(mapping)).isFalse();
        assertThat(CycleValidator.hasCycle(mapping)).isTrue();
        assertThat(CycleValidator.findCycle(mapping)).contains(List.of("a", "b", "a"));
    }

    @Test
    void threeNodeCyclePath() {
        CteMapping mapping = CteMapping.of(
                Cte.of("a", "SELECT * FROM b", "b"),
                Cte.of("b", "SELECT * FROM c", "c"),
                Cte.of("c", "SELECT * FROM a", "a"));

        assertThat(CycleValidator.findCycle(mapping))
                .hasValueSatisfying(path -> assertThat(path).containsExactly("a", "b", "c", "a"));
    }

    @Test
    void cyclePathExcludesTheLeadIn() {
        // entry -> a -> b -> a: the cycle is a, b only
        CteMapping mapping = CteMapping.of(
                Cte.of("entry", "SELECT * FROM a", "a"),
                Cte.of("a", "SELECT * FROM b", "b"),
                Cte.of("b", "SELECT * FROM a", "a"));

        assertThat(CycleValidator.findCycle(mapping))
                .hasValueSatisfying(path -> assertThat(path).containsExactly("a", "b", "a"));
    }

    @Test
    void selfReferenceIsACycle() {
        CteMapping mapping = CteMapping.of(Cte.of("a", "SELECT * FROM a", "a"));

        assertThat(CycleValidator.validateNoCycles(mapping)).isFalse();
        assertThat(CycleValidator.findCycle(mapping))
                .hasValueSatisfying(path -> assertThat(path).containsExactly("a", "a"));
    }

    @Test
    void disconnectedCycleStillDetectedGlobally() {
        CteMapping mapping = CteMapping.of(
                Cte.of("report", "SELECT * FROM base", "base"),
                Cte.of("base", "SELECT 1"),
                Cte.of("x", "SELECT * FROM y", "y"),
                Cte.of("y", "SELECT * FROM x", "x"));

        assertThat(CycleValidator.validateNoCycles(mapping)).isFalse();
        // a per-target walk does not reach the cycle
        assertThat(TopologicalOrderer.orderForTarget("report", mapping)).containsExactly("base", "report");
    }

    @Test
    void danglingReferencesAreNotCycles() {
        CteMapping mapping = CteMapping.of(
                Cte.of("a", "SELECT * FROM orders JOIN b ON true", "orders", "b"),
                Cte.of("b", "SELECT * FROM customers", "customers"));

        assertThat(CycleValidator.validateNoCycles(mapping)).isTrue();
    }

    @Test
    void diamondIsNotACycle() {
        CteMapping mapping = CteMapping.of(
                Cte.of("top", "SELECT * FROM l JOIN r ON true", "l", "r"),
                Cte.of("l", "SELECT * FROM base", "base"),
                Cte.of("r", "SELECT * FROM base", "base"),
                Cte.of("base", "SELECT 1"));

        assertThat(CycleValidator.validateNoCycles(mapping)).isTrue();
    }

    @Test
    void emptyMappingIsValid() {
        assertThat(CycleValidator.validateNoCycles(CteMapping.empty())).isTrue();
    }

    @Test
    void nullMappingRejected() {
        assertThatThrownBy(() -> CycleValidator.validateNoCycles(null))
                .isInstanceOf(NullPointerException.class);
    }
}
