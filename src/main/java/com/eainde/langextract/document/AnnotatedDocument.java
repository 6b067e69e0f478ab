package com.eainde.langextract.document;

import com.eainde.langextract.extraction.Extraction;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * The sealed output of a pipeline run: the source document plus its final extraction set.
 *
 * <p>This is the artifact handed to renderers and exporters. Each extraction is copied on
 * construction, and every accessor returns fresh copies in an unmodifiable list, so nothing a
 * caller does to a returned extraction reaches the document.</p>
 */
public final class AnnotatedDocument {

    private final Document document;
    private final List<Extraction> extractions;

    public AnnotatedDocument(Document document, List<Extraction> extractions) {
        this.document = Objects.requireNonNull(document, "document");
        this.extractions = extractions.stream().map(Extraction::copy).toList();
    }

    public Document getDocument() {
        return document;
    }

    public String getText() {
        return document.getText();
    }

    public List<Extraction> getExtractions() {
        return copies(extractions);
    }

    public int extractionCount() {
        return extractions.size();
    }

    public boolean hasExtractions() {
        return !extractions.isEmpty();
    }

    public List<Extraction> getExtractionsByClass(String extractionClass) {
        return extractions.stream()
                .filter(e -> e.getExtractionClass().equals(extractionClass))
                .map(Extraction::copy)
                .toList();
    }

    public List<Extraction> getExtractionsByGroup(int groupIndex) {
        return extractions.stream()
                .filter(e -> e.getGroupIndex() != null && e.getGroupIndex() == groupIndex)
                .map(Extraction::copy)
                .toList();
    }

    public List<String> getUniqueClasses() {
        LinkedHashSet<String> classes = new LinkedHashSet<>();
        extractions.forEach(e -> classes.add(e.getExtractionClass()));
        return List.copyOf(classes);
    }

    /**
     * Extractions at or above the threshold. Extractions without a confidence are kept.
     */
    public List<Extraction> filterByConfidence(double threshold) {
        return extractions.stream()
                .filter(e -> !e.hasConfidence() || e.getConfidence() >= threshold)
                .map(Extraction::copy)
                .toList();
    }

    /** Grounded extractions by start position; ungrounded ones keep their order at the end. */
    public List<Extraction> sortedByPosition() {
        List<Extraction> sorted = new ArrayList<>(extractions);
        sorted.sort(Comparator.comparing(
                (Extraction e) -> e.hasCharInterval() ? e.getCharInterval().start() : Integer.MAX_VALUE));
        return copies(sorted);
    }

    public List<Extraction> sortedByIndex() {
        List<Extraction> sorted = new ArrayList<>(extractions);
        sorted.sort(Comparator.comparing(
                (Extraction e) -> e.getExtractionIndex() != null ? e.getExtractionIndex() : Integer.MAX_VALUE));
        return copies(sorted);
    }

    /**
     * Fraction of document characters spanned by grounded extractions, in {@code [0,1]}.
     * Overlapping intervals are counted once.
     */
    public double getCoverage() {
        int length = document.length();
        if (length == 0) {
            return 0.0;
        }
        List<CharInterval> intervals = extractions.stream()
                .map(Extraction::getCharInterval)
                .filter(Objects::nonNull)
                .filter(i -> !i.isEmpty())
                .sorted(Comparator.comparingInt(CharInterval::start))
                .toList();

        int covered = 0;
        int cursor = 0;
        for (CharInterval interval : intervals) {
            int start = Math.max(interval.start(), cursor);
            int end = Math.min(interval.end(), length);
            if (end > start) {
                covered += end - start;
                cursor = end;
            }
        }
        return (double) covered / length;
    }

    private static List<Extraction> copies(List<Extraction> source) {
        return source.stream().map(Extraction::copy).toList();
    }

    @Override
    public String toString() {
        return "AnnotatedDocument{document=" + document.getDocumentId() + ", extractions=" + extractions.size() + "}";
    }
}
