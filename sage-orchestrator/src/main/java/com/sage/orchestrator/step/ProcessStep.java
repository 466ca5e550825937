package com.sage.orchestrator.step;

import com.sage.memory.ResilientMemory;
import com.sage.model.Entity;
import com.sage.model.Fact;
import com.sage.model.Phase;
import com.sage.model.ResearchState;
import com.sage.model.SourceResult;
import com.sage.orchestrator.PhaseStep;
import com.sage.orchestrator.ResearchContext;
import com.sage.orchestrator.Transition;
import com.sage.orchestrator.extract.EntityExtractor;
import com.sage.orchestrator.extract.FactExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Extracts facts and entities from this cycle's new results and stores each result's content in memory.
 */
public final class ProcessStep implements PhaseStep {

    private static final Logger log = LoggerFactory.getLogger(ProcessStep.class);

    static final String SOURCE_TYPE = "source";

    private final FactExtractor facts;
    private final EntityExtractor entities;
    private final ResilientMemory memory;

    public ProcessStep(ResearchContext context) {
        this(new FactExtractor(context.getRouter()), new EntityExtractor(), context.getMemory());
    }

    ProcessStep(FactExtractor facts, EntityExtractor entities, ResilientMemory memory) {
        this.facts = facts;
        this.entities = entities;
        this.memory = memory;
    }

    @Override
    public Phase phase() {
        return Phase.PROCESS;
    }

    @Override
    public Transition apply(ResearchState state) throws InterruptedException {
        int newFacts = 0;
        int newEntities = 0;
        List<SourceResult> results = List.copyOf(state.getCycleResults());
        for (SourceResult r : results) {
            if (!r.isSuccess()) continue;
            for (Fact f : facts.extract(r, state.getQuery(), state.getPrivacyMode())) {
                state.addFact(f);
                newFacts++;
            }
            for (Entity e : entities.extract(r.content())) {
                if (state.addEntity(e)) newEntities++;
            }
            memory.storeDocument(r.content(), metadata(state, r), state.getSessionId());
        }
        log.info("Session {} processed {} result(s): {} fact(s), {} new entit(ies)",
                state.getSessionId(), results.size(), newFacts, newEntities);
        return Transition.to(Phase.ANALYZE, newFacts + " fact(s), " + newEntities + " entit(ies)");
    }

    private static Map<String, String> metadata(ResearchState state, SourceResult r) {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("type", SOURCE_TYPE);
        m.put("url", r.getUrl());
        m.put("provider", r.getProvider());
        m.put("title", r.getTitle());
        m.put("domain", state.getDomain() != null ? state.getDomain() : "");
        return m;
    }
}
