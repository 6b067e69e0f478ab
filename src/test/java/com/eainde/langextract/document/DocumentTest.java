package com.eainde.langextract.document;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentTest {

    @Test
    @DisplayName("id is a stable content hash of text and context")
    void documentId() {
        Document a = new Document("John Smith works at Google Inc.");
        Document b = new Document("John Smith works at Google Inc.");
        Document withContext = new Document("John Smith works at Google Inc.", "press release");

        assertThat(a.getDocumentId()).startsWith("doc_").hasSize(4 + 16);
        assertThat(a.getDocumentId()).isEqualTo(b.getDocumentId());
        assertThat(withContext.getDocumentId()).isNotEqualTo(a.getDocumentId());
    }

    @Test
    @DisplayName("tokens are a whitespace split of the trimmed text")
    void tokens() {
        Document document = new Document("  John   Smith\nworks  ");

        assertThat(document.getTokens()).containsExactly("John", "Smith", "works");
        assertThat(document.tokenCount()).isEqualTo(3);
        assertThat(document.getTokens()).isSameAs(document.getTokens());
    }

    @Test
    @DisplayName("blank text counts as empty and has no tokens")
    void blankDocument() {
        Document document = new Document("   ");

        assertThat(document.isEmpty()).isTrue();
        assertThat(document.getTokens()).isEmpty();
        assertThat(document.length()).isEqualTo(3);
    }

    @Test
    @DisplayName("null text is rejected")
    void nullText() {
        assertThatThrownBy(() -> new Document(null)).isInstanceOf(NullPointerException.class);
    }
}
