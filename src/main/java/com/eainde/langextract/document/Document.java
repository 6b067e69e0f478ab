package com.eainde.langextract.document;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.Objects;

/**
 * Immutable input text plus derived identity and tokenization.
 *
 * <p>The id and the whitespace tokens are computed on first access and cached. Both are
 * pure functions of the text and the additional context, so a racing first access can
 * only compute the same value twice.</p>
 */
public final class Document {

    private final String text;
    private final String additionalContext;

    private volatile String documentId;
    private volatile List<String> tokens;

    public Document(String text) {
        this(text, null);
    }

    public Document(String text, String additionalContext) {
        this.text = Objects.requireNonNull(text, "text must not be null");
        this.additionalContext = additionalContext;
    }

    public String getText() {
        return text;
    }

    public String getAdditionalContext() {
        return additionalContext;
    }

    /**
     * Content hash of text + context: {@code doc_} followed by the hex of the first
     * 8 bytes of the SHA-256 digest.
     */
    public String getDocumentId() {
        String id = documentId;
        if (id == null) {
            id = generateId();
            documentId = id;
        }
        return id;
    }

    public List<String> getTokens() {
        List<String> cached = tokens;
        if (cached == null) {
            cached = tokenize();
            tokens = cached;
        }
        return cached;
    }

    public int length() {
        return text.length();
    }

    public int tokenCount() {
        return getTokens().size();
    }

    public boolean isEmpty() {
        return text.isBlank();
    }

    private String generateId() {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            String material = text + (additionalContext == null ? "" : additionalContext);
            byte[] hash = digest.digest(material.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder("doc_");
            for (int i = 0; i < 8; i++) {
                sb.append(String.format("%02x", hash[i]));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private List<String> tokenize() {
        String trimmed = text.strip();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        return List.of(trimmed.split("\\s+"));
    }

    @Override
    public String toString() {
        String preview = text.length() > 100 ? text.substring(0, 97) + "..." : text;
        return "Document{id=" + getDocumentId() + ", length=" + text.length() + ", text=\"" + preview + "\"}";
    }
}
