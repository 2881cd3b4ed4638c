package com.autofix.core.guardrail;

import com.autofix.core.model.FileChange;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scans proposed file contents line by line for dangerous or unwanted constructs.
 * Matching is case-insensitive. Deleted files are skipped.
 */
public class ForbiddenPatternDetector {

    /** Always checked, in addition to configured patterns. */
    public static final List<String> BUILT_IN_PATTERNS = List.of(
            "rm\\s+-rf\\s",
            "drop\\s+(table|database)\\s",
            "(password|passwd|secret|api[_-]?key)\\s*[:=]\\s*[\"'][^\"']{4,}[\"']",
            "\\bdebugger\\s*;"
    );

    private final List<Pattern> patterns;

    public ForbiddenPatternDetector(List<String> customPatterns) {
        var all = new ArrayList<Pattern>();
        for (String p : BUILT_IN_PATTERNS) {
            all.add(Pattern.compile(p, Pattern.CASE_INSENSITIVE));
        }
        if (customPatterns != null) {
            for (String p : customPatterns) {
                all.add(Pattern.compile(p, Pattern.CASE_INSENSITIVE));
            }
        }
        this.patterns = List.copyOf(all);
    }

    public List<ForbiddenPatternMatch> detect(List<FileChange> changes) {
        var matches = new ArrayList<ForbiddenPatternMatch>();
        for (FileChange change : changes) {
            if (change.isDeleted() || change.content().isEmpty()) {
                continue;
            }
            String[] lines = change.content().split("\n", -1);
            for (int i = 0; i < lines.length; i++) {
                String line = lines[i];
                if (line.isBlank()) {
                    continue;
                }
                for (Pattern pattern : patterns) {
                    Matcher matcher = pattern.matcher(line + " ");
                    if (matcher.find()) {
                        matches.add(new ForbiddenPatternMatch(change.path(), i + 1, pattern.pattern(), line.trim()));
                    }
                }
            }
        }
        return matches;
    }

    /**
     * Human-readable listing of matches.
     */
    public static String format(List<ForbiddenPatternMatch> matches) {
        if (matches.isEmpty()) {
            return "No forbidden patterns detected.";
        }
        var sb = new StringBuilder("Found ").append(matches.size()).append(" forbidden pattern(s):\n");
        for (ForbiddenPatternMatch m : matches) {
            sb.append("  - ").append(m.filePath()).append(':').append(m.lineNumber())
                    .append("  [").append(m.pattern()).append("]  ").append(m.content()).append('\n');
        }
        return sb.toString().stripTrailing();
    }
}
