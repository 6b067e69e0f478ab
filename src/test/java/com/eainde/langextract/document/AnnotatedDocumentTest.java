package com.eainde.langextract.document;

import com.eainde.langextract.extraction.AlignmentStatus;
import com.eainde.langextract.extraction.Extraction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnnotatedDocumentTest {

    private static final String TEXT = "John Smith works at Google Inc.";

    private static Extraction grounded(String cls, String text, int start, Double confidence, int group) {
        Extraction e = Extraction.of(cls, text, confidence);
        e.setCharInterval(CharInterval.of(start, start + text.length()));
        e.setAlignmentStatus(AlignmentStatus.EXACT);
        e.setGroupIndex(group);
        return e;
    }

    @Test
    @DisplayName("coverage counts overlapping characters once")
    void coverageUnion() {
        List<Extraction> extractions = List.of(
                grounded("PERSON", "John Smith", 0, 0.9, 0),
                grounded("PERSON", "Smith", 5, 0.8, 0),
                grounded("ORG", "Google Inc.", 20, 0.9, 1),
                Extraction.of("ORG", "Alphabet", 0.4));

        AnnotatedDocument doc = new AnnotatedDocument(new Document(TEXT), extractions);

        assertThat(doc.getCoverage()).isEqualTo(21.0 / TEXT.length());
    }

    @Test
    @DisplayName("queries filter by class, group and confidence")
    void queries() {
        Extraction unscored = Extraction.of("ORG", "Alphabet", null);
        AnnotatedDocument doc = new AnnotatedDocument(new Document(TEXT), List.of(
                grounded("ORG", "Google Inc.", 20, 0.9, 1),
                grounded("PERSON", "John Smith", 0, 0.3, 0),
                unscored));

        assertThat(doc.getExtractionsByClass("ORG")).hasSize(2);
        assertThat(doc.getExtractionsByGroup(0)).extracting(Extraction::getExtractionText).containsExactly("John Smith");
        assertThat(doc.getUniqueClasses()).containsExactly("ORG", "PERSON");
        assertThat(doc.filterByConfidence(0.5)).extracting(Extraction::getExtractionText)
                .containsExactly("Google Inc.", "Alphabet");
        assertThat(doc.sortedByPosition()).extracting(Extraction::getExtractionText)
                .containsExactly("John Smith", "Google Inc.", "Alphabet");
    }

    @Test
    @DisplayName("extractions are copied and read-only")
    void immutable() {
        List<Extraction> source = new ArrayList<>(List.of(Extraction.of("ORG", "Google", 0.9)));
        AnnotatedDocument doc = new AnnotatedDocument(new Document(TEXT), source);
        source.clear();

        assertThat(doc.extractionCount()).isEqualTo(1);
        assertThatThrownBy(() -> doc.getExtractions().add(Extraction.of("X", "y", null)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("changes to source or returned extractions never reach the document")
    void extractionsDetached() {
        Extraction original = grounded("ORG", "Google Inc.", 20, 0.9, 1);
        AnnotatedDocument doc = new AnnotatedDocument(new Document(TEXT), List.of(original));

        original.setConfidence(0.1);
        doc.getExtractions().get(0).setCharInterval(CharInterval.of(0, 31));
        doc.getExtractionsByClass("ORG").get(0).setConfidence(0.2);

        assertThat(doc.getExtractions().get(0).getConfidence()).isEqualTo(0.9);
        assertThat(doc.getExtractions().get(0).getCharInterval()).isEqualTo(CharInterval.of(20, 31));
        assertThat(doc.getCoverage()).isEqualTo(11.0 / TEXT.length());
    }

    @Test
    @DisplayName("empty document has zero coverage")
    void emptyCoverage() {
        assertThat(new AnnotatedDocument(new Document(""), List.of()).getCoverage()).isZero();
    }
}
