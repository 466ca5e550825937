package com.sage.worker;

import com.sage.config.SageConfig;
import com.sage.model.Phase;
import com.sage.model.ResearchReport;
import com.sage.model.ResearchState;
import com.sage.model.error.PrivacyViolationException;
import com.sage.orchestrator.ResearchOrchestrator;
import com.sage.orchestrator.export.JsonReportExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Command-line entry point: runs one research session (or resumes a checkpointed one) and prints the report
 * as JSON. Configuration comes from {@code SAGE_*} environment variables.
 * <p>
 * Ctrl+C requests a graceful stop; the session then synthesizes a partial report from what it has.
 */
public final class SageApplication {

    private static final Logger log = LoggerFactory.getLogger(SageApplication.class);
    private static final int STOP_TIMEOUT_SECONDS = 30;

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 2;
    static final int EXIT_FAILED = 1;

    private SageApplication() {
    }

    public static void main(String[] args) {
        CommandLineOptions options;
        try {
            options = CommandLineOptions.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(CommandLineOptions.USAGE);
            System.exit(EXIT_USAGE);
            return;
        }
        SageConfig config = SageConfig.fromEnvironment();
        int code;
        try (SageRuntime runtime = SageRuntime.create(config, options.reportDirectory())) {
            code = run(runtime, options, System.out);
        }
        System.exit(code);
    }

    /** Runs the session described by {@code options}; returns the process exit code. */
    static int run(SageRuntime runtime, CommandLineOptions options, PrintStream out) {
        ResearchOrchestrator orchestrator = new ResearchOrchestrator(runtime.context());
        runtime.context().getBroadcaster().subscribe(snapshot -> log.info("[{}] {} | sources={} entities={} facts={}",
                snapshot.getSequence(), snapshot.getPhase(), snapshot.getSourcesQueried(),
                snapshot.getEntitiesFound(), snapshot.getFactsExtracted()));
        CountDownLatch finished = new CountDownLatch(1);
        Thread stopHook = new Thread(() -> {
            log.info("Stop requested; finishing with a partial report...");
            orchestrator.requestStop();
            try {
                if (!finished.await(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                    log.warn("Session did not finish within {}s; checkpoint kept for --resume", STOP_TIMEOUT_SECONDS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "sage-stop");
        Runtime.getRuntime().addShutdownHook(stopHook);
        try {
            if (options.autoApprove()) orchestrator.approve();
            ResearchState state;
            if (options.isResume()) {
                state = orchestrator.resume(options.resumeSessionId());
            } else {
                orchestrator.start(options.query(), options.domain(), options.privacyMode());
                state = orchestrator.run();
            }
            if (state.getPhase() == Phase.AWAIT_APPROVAL) {
                out.println("Session " + state.getSessionId() + " is waiting for approval of sources "
                        + state.getPlannedSources() + "; rerun with --approve --resume " + state.getSessionId());
                return EXIT_OK;
            }
            ResearchReport report = state.getReport();
            out.println(JsonReportExporter.render(report));
            return EXIT_OK;
        } catch (PrivacyViolationException e) {
            log.error("Session aborted: {}", e.getMessage());
            return EXIT_FAILED;
        } catch (IllegalArgumentException | IOException e) {
            log.error("Research failed: {}", e.getMessage(), e);
            return EXIT_FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Interrupted; session checkpoint kept for --resume");
            return EXIT_FAILED;
        } finally {
            finished.countDown();
            removeHook(stopHook);
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down; stop hook stays registered");
        }
    }
}
