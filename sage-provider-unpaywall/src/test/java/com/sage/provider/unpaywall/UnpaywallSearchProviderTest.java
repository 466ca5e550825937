package com.sage.provider.unpaywall;

import com.sage.model.SourceResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UnpaywallSearchProviderTest {

    private static final String OPEN_RECORD = """
            {
              "doi": "10.1038/nature12373",
              "title": "Nanometre-scale thermometry in a living cell",
              "journal_name": "Nature",
              "is_oa": true,
              "best_oa_location": {
                "url": "https://europepmc.org/articles/pmc4221854",
                "url_for_pdf": "https://europepmc.org/articles/pmc4221854?pdf=render",
                "host_type": "repository"
              }
            }
            """;

    private static final String LANDING_PAGE_ONLY = """
            {"doi": "10.1000/landing", "title": "", "is_oa": true,
             "best_oa_location": {"url": "https://repo.example/landing", "url_for_pdf": null}}
            """;

    private static final String CLOSED_RECORD = """
            {"doi": "10.1000/closed", "title": "Closed", "is_oa": false, "best_oa_location": null}
            """;

    @Test
    void openRecord_prefersThePdfLocation() throws Exception {
        Optional<SourceResult> result = UnpaywallSearchProvider.parse(OPEN_RECORD, 42L);

        assertTrue(result.isPresent());
        SourceResult r = result.get();
        assertEquals("https://europepmc.org/articles/pmc4221854?pdf=render", r.getUrl());
        assertEquals("Nanometre-scale thermometry in a living cell", r.getTitle());
        assertEquals("Open access version of DOI: 10.1038/nature12373 (Nature)", r.getSnippet());
        assertEquals(0.8, r.getQualityScore());
    }

    @Test
    void landingPageIsUsedWithoutPdf_andDoiStandsInForMissingTitle() throws Exception {
        SourceResult r = UnpaywallSearchProvider.parse(LANDING_PAGE_ONLY, 42L).orElseThrow();

        assertEquals("https://repo.example/landing", r.getUrl());
        assertEquals("10.1000/landing", r.getTitle());
    }

    @Test
    void closedRecordYieldsNothing() throws Exception {
        assertTrue(UnpaywallSearchProvider.parse(CLOSED_RECORD, 42L).isEmpty());
    }

    @Test
    void doisComeFromTheFilterAndFromADoiQuery() {
        assertEquals(List.of("10.1038/nature12373", "10.1000/xyz"),
                UnpaywallSearchProvider.dois("https://doi.org/10.1000/xyz",
                        Map.of("dois", " doi:10.1038/nature12373 , not-a-doi,10.1000/xyz")));
        assertTrue(UnpaywallSearchProvider.dois("thermometry in living cells", Map.of()).isEmpty());
        assertTrue(UnpaywallSearchProvider.dois("thermometry", null).isEmpty());
    }

    @Test
    void normalizeDoi_rejectsFreeText() {
        assertEquals("10.1000/xyz", UnpaywallSearchProvider.normalizeDoi("DOI:10.1000/xyz"));
        assertNull(UnpaywallSearchProvider.normalizeDoi("10.1000 is a number"));
        assertNull(UnpaywallSearchProvider.normalizeDoi(null));
    }

    @Test
    void unavailableWithoutContactEmail() {
        assertFalse(new UnpaywallSearchProvider(" ").isAvailable());
        assertTrue(new UnpaywallSearchProvider("research@example.org").isAvailable());
    }
}
