package com.sage.orchestrator.extract;

import com.sage.model.Entity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EntityExtractorTest {

    private final EntityExtractor extractor = new EntityExtractor();

    @Test
    void classifiesOrganizationsAcronymsAndYears() {
        List<Entity> entities = extractor.extract("The World Health Organization reported in 2023 that WHO guidance changed.");

        assertEquals(List.of(
                new Entity("World Health Organization", "ORGANIZATION"),
                new Entity("WHO", "ACRONYM"),
                new Entity("2023", "DATE")), entities);
    }

    @Test
    void keepsOfInsideNamesAndDropsLeadingStopwords() {
        List<Entity> entities = extractor.extract("However researchers at University of Oslo studied Metformin.");

        assertTrue(entities.contains(new Entity("University of Oslo", "ORGANIZATION")));
        assertTrue(entities.contains(new Entity("Metformin", "CONCEPT")));
        assertFalse(entities.stream().anyMatch(e -> e.getName().equals("However")));
    }

    @Test
    void repeatedMentionsAreReturnedOnce() {
        assertEquals(1, extractor.extract("Pfizer and Pfizer again").size());
    }

    @Test
    void blankTextHasNoEntities() {
        assertTrue(extractor.extract("  ").isEmpty());
        assertTrue(extractor.extract(null).isEmpty());
    }
}
