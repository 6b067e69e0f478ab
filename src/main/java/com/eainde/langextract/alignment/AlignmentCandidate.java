package com.eainde.langextract.alignment;

/**
 * A possible approximate match location.
 *
 * @param start        inclusive start in the source
 * @param end          exclusive end in the source
 * @param editDistance Levenshtein distance between the extracted text and {@code source[start,end)}
 */
record AlignmentCandidate(int start, int end, int editDistance) {

    int proximityTo(Integer hint) {
        return hint == null ? 0 : Math.abs(start - hint);
    }
}
