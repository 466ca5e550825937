package com.sage.worker;

import com.sage.model.PrivacyMode;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parsed command line: {@code [--domain D] [--mode LOCAL_ONLY|CLOUD_ALLOWED|HYBRID] [--out DIR] [--approve]
 * (--resume SESSION | query words...)}.
 */
public record CommandLineOptions(String query, String domain, PrivacyMode privacyMode, Path reportDirectory,
                                 String resumeSessionId, boolean autoApprove) {

    public static final Path DEFAULT_REPORT_DIRECTORY = Path.of("reports");

    public static final String USAGE = "usage: sage [--domain D] [--mode LOCAL_ONLY|CLOUD_ALLOWED|HYBRID] "
            + "[--out DIR] [--approve] (--resume SESSION | <query>)";

    public boolean isResume() {
        return resumeSessionId != null;
    }

    /**
     * @throws IllegalArgumentException on an unknown flag, a flag without its value, an unknown mode, or when
     *                                  neither a query nor a session to resume is given
     */
    public static CommandLineOptions parse(String[] args) {
        List<String> words = new ArrayList<>();
        String domain = null;
        PrivacyMode mode = null;
        Path out = DEFAULT_REPORT_DIRECTORY;
        String resume = null;
        boolean approve = false;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--domain":
                    domain = value(args, ++i, arg);
                    break;
                case "--mode":
                    mode = parseMode(value(args, ++i, arg));
                    break;
                case "--out":
                    out = Path.of(value(args, ++i, arg));
                    break;
                case "--resume":
                    resume = value(args, ++i, arg);
                    break;
                case "--approve":
                    approve = true;
                    break;
                default:
                    if (arg.startsWith("--")) throw new IllegalArgumentException("Unknown option " + arg);
                    words.add(arg);
            }
        }
        String query = String.join(" ", words).trim();
        if (query.isEmpty() && resume == null) {
            throw new IllegalArgumentException("A query or --resume SESSION is required");
        }
        return new CommandLineOptions(query.isEmpty() ? null : query, domain, mode, out, resume, approve);
    }

    private static String value(String[] args, int index, String flag) {
        if (index >= args.length || args[index].startsWith("--")) {
            throw new IllegalArgumentException(flag + " needs a value");
        }
        return args[index];
    }

    private static PrivacyMode parseMode(String raw) {
        try {
            return PrivacyMode.valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown privacy mode " + raw, e);
        }
    }
}
