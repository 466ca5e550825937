package com.sage.worker;

import com.sage.model.PrivacyMode;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommandLineOptionsTest {

    @Test
    void queryWordsAreJoinedAroundFlags() {
        CommandLineOptions options = CommandLineOptions.parse(new String[] {
                "diabetes", "--domain", "medical", "treatments", "--mode", "cloud-allowed", "2024", "--out", "/tmp/r"});

        assertEquals("diabetes treatments 2024", options.query());
        assertEquals("medical", options.domain());
        assertEquals(PrivacyMode.CLOUD_ALLOWED, options.privacyMode());
        assertEquals(Path.of("/tmp/r"), options.reportDirectory());
        assertFalse(options.isResume());
        assertFalse(options.autoApprove());
    }

    @Test
    void defaultsLeaveDomainAndModeToDetection() {
        CommandLineOptions options = CommandLineOptions.parse(new String[] {"open", "source", "databases"});

        assertNull(options.domain());
        assertNull(options.privacyMode());
        assertEquals(CommandLineOptions.DEFAULT_REPORT_DIRECTORY, options.reportDirectory());
    }

    @Test
    void resumeNeedsNoQuery() {
        CommandLineOptions options = CommandLineOptions.parse(new String[] {"--approve", "--resume", "s-42"});

        assertTrue(options.isResume());
        assertTrue(options.autoApprove());
        assertEquals("s-42", options.resumeSessionId());
        assertNull(options.query());
    }

    @Test
    void invalidInvocationsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> CommandLineOptions.parse(new String[] {}));
        assertThrows(IllegalArgumentException.class, () -> CommandLineOptions.parse(new String[] {"q", "--domain"}));
        assertThrows(IllegalArgumentException.class, () -> CommandLineOptions.parse(new String[] {"q", "--mode", "public"}));
        assertThrows(IllegalArgumentException.class, () -> CommandLineOptions.parse(new String[] {"q", "--verbose"}));
    }
}
