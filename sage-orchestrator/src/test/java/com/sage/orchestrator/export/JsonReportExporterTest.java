package com.sage.orchestrator.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sage.model.Fact;
import com.sage.model.PrivacyMode;
import com.sage.model.ResearchReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonReportExporterTest {

    private static ResearchReport report(String sessionId) {
        return new ResearchReport(sessionId, "diabetes treatments 2024", "medical", PrivacyMode.LOCAL_ONLY,
                "Metformin remains first-line.", List.of(Fact.of("Metformin is first-line therapy", "https://a", 0.8)),
                List.of(), List.of("No results from arxiv"), true, "Maximum cycles reached (5)", 5, "llama3.2:3b");
    }

    @Test
    void writesReportUnderSessionId(@TempDir Path dir) throws Exception {
        Path out = dir.resolve("reports");

        String written = new JsonReportExporter(out).export(report("s-1"));

        Path file = out.resolve("s-1.json");
        assertEquals(file.toString(), written);
        ResearchReport read = new ObjectMapper().readValue(Files.readString(file, StandardCharsets.UTF_8), ResearchReport.class);
        assertEquals("diabetes treatments 2024", read.getQuery());
        assertEquals(1, read.getFacts().size());
        assertTrue(read.isPartial());
        assertEquals(List.of("No results from arxiv"), read.getNotFound());
    }

    @Test
    void unsafeSessionIdCharactersAreReplaced() {
        assertEquals("a_b_c.json", JsonReportExporter.fileName(report("a/b c")));
        assertEquals("report.json", JsonReportExporter.fileName(report(null)));
    }

    @Test
    void renderIsPrettyPrinted() throws Exception {
        assertTrue(JsonReportExporter.render(report("s-2")).contains("\n"));
    }
}
