package com.phasegate.core.attestation;

import com.phasegate.core.util.Hashes;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Default drift classifier.
 * <ul>
 *   <li>HIGH when any guardrail keyword occurs fewer times than in the baseline, counted over the
 *       whole text including headings and comment lines</li>
 *   <li>LOW when the texts match after stripping comment lines and collapsing whitespace</li>
 *   <li>MEDIUM otherwise</li>
 * </ul>
 */
public class StructuralDriftClassifier implements DriftClassifier {

    public static final List<String> DEFAULT_GUARDRAILS = List.of(
            "must", "never", "do not", "required", "verify", "test", "evidence", "review");

    public static final List<String> DEFAULT_COMMENT_PREFIXES = List.of("//", "#");

    private static final Pattern HTML_COMMENT = Pattern.compile("<!--.*?-->", Pattern.DOTALL);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final List<String> guardrailKeywords;
    private final List<String> commentPrefixes;

    public StructuralDriftClassifier() {
        this(DEFAULT_GUARDRAILS, DEFAULT_COMMENT_PREFIXES);
    }

    public StructuralDriftClassifier(List<String> guardrailKeywords, List<String> commentPrefixes) {
        this.commentPrefixes = List.copyOf(commentPrefixes);
        this.guardrailKeywords = guardrailKeywords.stream()
                .map(k -> k.toLowerCase(Locale.ROOT).trim())
                .filter(k -> !k.isEmpty())
                .distinct()
                .toList();
    }

    @Override
    public Classification classify(String baseline, String current) {
        // a heading such as "# Never push to main" is still an instruction
        String baseText = baseline.toLowerCase(Locale.ROOT);
        String currentText = current.toLowerCase(Locale.ROOT);
        var weakened = new ArrayList<String>();
        for (String keyword : guardrailKeywords) {
            int before = occurrences(baseText, keyword);
            int after = occurrences(currentText, keyword);
            if (after < before) {
                weakened.add(keyword + " (" + before + " -> " + after + ")");
            }
        }
        if (!weakened.isEmpty()) {
            return new Classification(DriftSeverity.HIGH, "guardrail keywords removed: " + String.join(", ", weakened));
        }

        if (Hashes.sha256(structural(baseline)).equals(Hashes.sha256(structural(current)))) {
            return new Classification(DriftSeverity.LOW, "comments or formatting changed");
        }
        return new Classification(DriftSeverity.MEDIUM, "instructional content changed");
    }

    /**
     * Lowercased text without comment lines and with whitespace collapsed.
     * Markdown headings start with '#' and are treated as formatting here.
     */
    String structural(String text) {
        String withoutHtml = HTML_COMMENT.matcher(text).replaceAll(" ");
        var kept = new StringBuilder();
        for (String line : withoutHtml.split("\\R")) {
            String trimmed = line.strip();
            if (isComment(trimmed)) {
                continue;
            }
            kept.append(trimmed).append(' ');
        }
        return WHITESPACE.matcher(kept.toString()).replaceAll(" ").strip().toLowerCase(Locale.ROOT);
    }

    private boolean isComment(String line) {
        for (String prefix : commentPrefixes) {
            if (line.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private static int occurrences(String text, String keyword) {
        Pattern p = Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b");
        Matcher m = p.matcher(text);
        int count = 0;
        while (m.find()) {
            count++;
        }
        return count;
    }
}
