package com.example.docredact.engine;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex detectors used by the rule-based engine, each enabled from a minimum severity upward.
 */
final class PiiPatterns {

    static final class Detector {
        final String type;
        final Pattern pattern;
        final int minSeverity;
        final int group;

        Detector(String type, String regex, int minSeverity, int group) {
            this.type = type;
            this.pattern = Pattern.compile(regex);
            this.minSeverity = minSeverity;
            this.group = group;
        }
    }

    static final class Match {
        final String type;
        final int start;
        final int end;

        Match(String type, int start, int end) {
            this.type = type;
            this.start = start;
            this.end = end;
        }
    }

    private static final List<Detector> DETECTORS = List.of(
            // Government and financial identifiers
            new Detector("SSN", "\\b\\d{3}-\\d{2}-\\d{4}\\b", 1, 0),
            new Detector("CREDIT_CARD", "\\b(?:\\d{4}[- ]?){3}\\d{4}\\b", 1, 0),
            new Detector("IBAN", "\\b[A-Z]{2}\\d{2}(?: ?[A-Z0-9]{4}){2,7}(?: ?[A-Z0-9]{1,4})?\\b", 1, 0),
            new Detector("BANK_ACCOUNT", "\\b\\d{10,17}\\b", 1, 0),
            new Detector("PASSPORT", "\\b[A-Z]\\d{8}\\b", 1, 0),
            // Contact and network identifiers
            new Detector("EMAIL", "\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b", 2, 0),
            new Detector("PHONE", "(?<!\\w)(?:\\+?1[-. ]?)?\\(?\\d{3}\\)?[-. ]?\\d{3}[-. ]?\\d{4}\\b", 2, 0),
            new Detector("IP_ADDRESS", "\\b(?:(?:25[0-5]|2[0-4]\\d|1?\\d?\\d)\\.){3}(?:25[0-5]|2[0-4]\\d|1?\\d?\\d)\\b", 2, 0),
            new Detector("DRIVER_LICENSE", "\\b[A-Z]\\d{6,7}\\b", 2, 0),
            // Quasi-identifiers
            new Detector("DATE", "\\b(?:\\d{1,2}[/.-]\\d{1,2}[/.-]\\d{2,4}|\\d{4}-\\d{2}-\\d{2})\\b", 3, 0),
            new Detector("DATE", "\\b(?:Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Sept|Oct|Nov|Dec)[a-z]*\\.? \\d{1,2},? \\d{4}\\b", 3, 0),
            new Detector("PERSON_NAME", "\\b(?:Mr|Mrs|Ms|Miss|Dr|Prof)\\.? ((?:[A-Z][a-z]+)(?: [A-Z][a-z]+){0,2})", 3, 1)
    );

    private PiiPatterns() {
    }

    /**
     * Non-overlapping matches in {@code text}; where detectors overlap, the earliest and then longest match wins.
     */
    static List<Match> scan(String text, int severity) {
        List<Match> all = new ArrayList<>();
        for (Detector detector : DETECTORS) {
            if (detector.minSeverity > severity) continue;
            Matcher matcher = detector.pattern.matcher(text);
            while (matcher.find()) {
                int start = matcher.start(detector.group);
                int end = matcher.end(detector.group);
                if (start >= 0 && end > start) {
                    all.add(new Match(detector.type, start, end));
                }
            }
        }
        all.sort(Comparator.<Match>comparingInt(m -> m.start).thenComparingInt(m -> -(m.end - m.start)));

        List<Match> kept = new ArrayList<>();
        int coveredUntil = -1;
        for (Match m : all) {
            if (m.start >= coveredUntil) {
                kept.add(m);
                coveredUntil = m.end;
            }
        }
        return kept;
    }
}
