package org.calista.branchgraph.text.impl;

import org.calista.branchgraph.text.LogicalComponents;
import org.calista.branchgraph.text.TextAnalyzer;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex-based {@link TextAnalyzer}.
 *
 * <p>Text is lowercased first. Every pattern must have exactly one capture group;
 * the trimmed capture becomes the extracted item. Items are de-duplicated per kind.</p>
 */
public final class PatternTextAnalyzer implements TextAnalyzer {

    public static final List<Pattern> DEFAULT_PREMISES = List.of(
            Pattern.compile("\\b(?:given|assuming|if|suppose|let's say)\\s+([^,.]+)"),
            Pattern.compile("\\bpremise:\\s*([^,.]+)"),
            Pattern.compile("\\b(?:based on|according to|from)\\s+([^,.]+)"),
            Pattern.compile("\\b(?:because|since|as)\\s+([^,.]+)")
    );

    public static final List<Pattern> DEFAULT_CONCLUSIONS = List.of(
            Pattern.compile("\\b(?:therefore|thus|hence|so|consequently)\\s+([^,.]+)"),
            Pattern.compile("\\b(?:this means|this shows|we can conclude)\\s+([^,.]+)"),
            Pattern.compile("\\b(?:proves|demonstrates|indicates)\\s+([^,.]+)")
    );

    public static final List<Pattern> DEFAULT_DEPENDENCIES = List.of(
            Pattern.compile("\\b(?:as shown in|see|refer to|from)\\s+thought[- ]?(\\w+)"),
            Pattern.compile("\\b(?:building on|extending|following)\\s+(\\w+)")
    );

    private final List<Pattern> premisePatterns;
    private final List<Pattern> conclusionPatterns;
    private final List<Pattern> dependencyPatterns;

    public PatternTextAnalyzer() {
        this(DEFAULT_PREMISES, DEFAULT_CONCLUSIONS, DEFAULT_DEPENDENCIES);
    }

    public PatternTextAnalyzer(List<Pattern> premisePatterns, List<Pattern> conclusionPatterns, List<Pattern> dependencyPatterns) {
        this.premisePatterns = List.copyOf(Objects.requireNonNull(premisePatterns, "premisePatterns"));
        this.conclusionPatterns = List.copyOf(Objects.requireNonNull(conclusionPatterns, "conclusionPatterns"));
        this.dependencyPatterns = List.copyOf(Objects.requireNonNull(dependencyPatterns, "dependencyPatterns"));
    }

    @Override
    public LogicalComponents analyze(String content) {
        if (content == null || content.isBlank()) return LogicalComponents.EMPTY;
        String s = content.toLowerCase(Locale.ROOT);
        return new LogicalComponents(
                collect(s, premisePatterns),
                collect(s, conclusionPatterns),
                collect(s, dependencyPatterns));
    }

    private static List<String> collect(String s, List<Pattern> patterns) {
        Set<String> out = new LinkedHashSet<>();
        for (Pattern p : patterns) {
            Matcher m = p.matcher(s);
            while (m.find()) {
                String g = m.group(1);
                if (g == null) continue;
                g = g.trim();
                if (!g.isEmpty()) out.add(g);
            }
        }
        return new ArrayList<>(out);
    }
}
