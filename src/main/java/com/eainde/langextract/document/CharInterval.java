package com.eainde.langextract.document;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

/**
 * Half-open character range {@code [start, end)} within a document's text.
 *
 * <p>A zero-length interval is allowed; the alignment engine uses {@code [0,0)} to
 * represent an unanchored extraction.</p>
 *
 * @param start inclusive start offset
 * @param end   exclusive end offset
 */
public record CharInterval(
        @JsonProperty("start_pos") int start,
        @JsonProperty("end_pos") int end
) {

    public static final CharInterval EMPTY = new CharInterval(0, 0);

    public CharInterval {
        if (start < 0) {
            throw new IllegalArgumentException("start position cannot be negative: " + start);
        }
        if (end < start) {
            throw new IllegalArgumentException(
                    "end position (" + end + ") cannot be less than start position (" + start + ")");
        }
    }

    public static CharInterval of(int start, int end) {
        return new CharInterval(start, end);
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    public boolean contains(int position) {
        return position >= start && position < end;
    }

    /**
     * Two intervals overlap iff {@code max(a.start, b.start) < min(a.end, b.end)}.
     */
    public boolean overlaps(CharInterval other) {
        return Math.max(start, other.start) < Math.min(end, other.end);
    }

    public CharInterval union(CharInterval other) {
        return new CharInterval(Math.min(start, other.start), Math.max(end, other.end));
    }

    public Optional<CharInterval> intersection(CharInterval other) {
        if (!overlaps(other)) {
            return Optional.empty();
        }
        return Optional.of(new CharInterval(Math.max(start, other.start), Math.min(end, other.end)));
    }

    /**
     * @return true if the interval lies inside a text of the given length
     */
    public boolean fitsWithin(int textLength) {
        return end <= textLength;
    }

    @Override
    public String toString() {
        return "[" + start + ":" + end + ")";
    }
}
