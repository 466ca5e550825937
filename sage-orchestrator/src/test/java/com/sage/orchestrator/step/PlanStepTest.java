package com.sage.orchestrator.step;

import com.sage.model.Entity;
import com.sage.model.Fact;
import com.sage.model.ResearchState;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PlanStepTest {

    private static final String CONTRADICTED =
            "Metformin reduced HbA1c by 1.5 points in a large trial of adults over sixty years old";

    private static ResearchState state() {
        ResearchState state = ResearchState.start("s-1", "diabetes treatments", "medical", null, 0L);
        state.addFact(Fact.of("Metformin is first-line therapy", "https://a", 0.8));
        state.addFact(Fact.of(CONTRADICTED, "https://b", 0.8).withContradiction("HbA1c fell by 0.5 points"));
        state.addEntity(new Entity("Metformin", "CONCEPT"));
        state.addEntity(new Entity("Diabetes", "CONCEPT"));
        state.addEntity(new Entity("2024", "DATE"));
        state.addEntity(new Entity("Novo Nordisk", "ORGANIZATION"));
        return state;
    }

    @Test
    void originalQueryThenContradictionsThenNewestEntities() {
        List<String> queries = PlanStep.followUpQueries(state(), 3);

        assertEquals(List.of(
                "diabetes treatments",
                "Metformin reduced HbA1c by 1.5 points in a large trial of adults",
                "diabetes treatments Novo Nordisk"), queries);
    }

    @Test
    void executedQueriesAreNotRepeated() {
        ResearchState state = state();
        state.markQueryExecuted("diabetes treatments Novo Nordisk");

        List<String> queries = PlanStep.followUpQueries(state, 5);

        assertEquals(List.of(
                "diabetes treatments",
                "Metformin reduced HbA1c by 1.5 points in a large trial of adults",
                "diabetes treatments Metformin"), queries);
    }

    @Test
    void limitOfOneKeepsOnlyTheOriginalQuery() {
        assertEquals(List.of("diabetes treatments"), PlanStep.followUpQueries(state(), 1));
    }
}
