package com.eainde.langextract.alignment;

import com.eainde.langextract.document.CharInterval;

import java.util.Arrays;

/**
 * A normalized view of a text that remembers where each normalized character came from,
 * so a match found in normalized space can be mapped back to original offsets.
 */
final class NormalizedText {

    static final String PUNCTUATION = ".,!?;:()[]{}\"'-";

    private final String text;
    private final int[] starts;
    private final int[] ends;

    private NormalizedText(String text, int[] starts, int[] ends) {
        this.text = text;
        this.starts = starts;
        this.ends = ends;
    }

    /**
     * @param foldCase          lower-case every character (length preserving)
     * @param collapseWhitespace turn every whitespace run into one space
     * @param stripPunctuation  drop characters from {@link #PUNCTUATION}
     */
    static NormalizedText of(String source, boolean foldCase, boolean collapseWhitespace, boolean stripPunctuation) {
        int n = source.length();
        StringBuilder sb = new StringBuilder(n);
        int[] starts = new int[n];
        int[] ends = new int[n];
        int size = 0;
        boolean lastWasSpace = false;

        for (int i = 0; i < n; i++) {
            char c = source.charAt(i);
            if (stripPunctuation && PUNCTUATION.indexOf(c) >= 0) {
                continue;
            }
            if (collapseWhitespace && Character.isWhitespace(c)) {
                if (lastWasSpace) {
                    ends[size - 1] = i + 1;
                    continue;
                }
                sb.append(' ');
                starts[size] = i;
                ends[size] = i + 1;
                size++;
                lastWasSpace = true;
                continue;
            }
            sb.append(foldCase ? Character.toLowerCase(c) : c);
            starts[size] = i;
            ends[size] = i + 1;
            size++;
            lastWasSpace = false;
        }
        return new NormalizedText(sb.toString(), Arrays.copyOf(starts, size), Arrays.copyOf(ends, size));
    }

    /**
     * Normalizes a search pattern the same way, trimming the edges when whitespace is collapsed.
     */
    static String pattern(String extracted, boolean foldCase, boolean collapseWhitespace, boolean stripPunctuation) {
        String normalized = of(extracted, foldCase, collapseWhitespace, stripPunctuation).text();
        return collapseWhitespace ? normalized.strip() : normalized;
    }

    String text() {
        return text;
    }

    /**
     * Original interval covered by normalized range {@code [from, to)}; {@code to > from}.
     */
    CharInterval toOriginal(int from, int to) {
        return new CharInterval(starts[from], ends[to - 1]);
    }
}
