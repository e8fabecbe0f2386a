package org.calista.branchgraph.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Lowercases and splits on anything that is not a letter or digit.
 * Apostrophes split too: "won't" yields "won", "t".
 */
public final class SimpleTokenizer implements Tokenizer {

    public static final SimpleTokenizer INSTANCE = new SimpleTokenizer();

    @Override
    public List<String> tokenize(String text) {
        if (text == null || text.isBlank()) return List.of();
        String s = text.toLowerCase(Locale.ROOT);

        StringBuilder b = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            b.append(Character.isLetterOrDigit(c) ? c : ' ');
        }

        String trimmed = b.toString().trim();
        if (trimmed.isEmpty()) return List.of();

        String[] parts = trimmed.split("\\s+");
        ArrayList<String> out = new ArrayList<>(parts.length);
        for (String p : parts) if (!p.isEmpty()) out.add(p);
        return out;
    }
}
