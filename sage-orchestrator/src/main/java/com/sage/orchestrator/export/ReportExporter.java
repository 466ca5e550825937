package com.sage.orchestrator.export;

import com.sage.model.ResearchReport;

import java.io.IOException;

/**
 * Writes a finished report somewhere durable.
 */
public interface ReportExporter {

    ReportExporter NONE = report -> null;

    /**
     * @return a locator for the written report (e.g. a file path), or null when nothing was written
     */
    String export(ResearchReport report) throws IOException;
}
