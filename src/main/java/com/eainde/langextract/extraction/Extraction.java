package com.eainde.langextract.extraction;

import com.eainde.langextract.document.CharInterval;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * One candidate entity produced by a model.
 *
 * <p>Created by {@link ExtractionParser}, then mutated by the alignment step (interval,
 * status, quality) before aggregation decides whether it survives. Once the pipeline
 * seals an {@code AnnotatedDocument}, instances are no longer touched.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Extraction {

    @JsonProperty("extraction_class")
    private final String extractionClass;

    @JsonProperty("extraction_text")
    private final String extractionText;

    @JsonProperty("char_interval")
    private CharInterval charInterval;

    @JsonProperty("alignment_status")
    private AlignmentStatus alignmentStatus;

    @JsonProperty("alignment_quality")
    private Integer alignmentQuality;

    private Double confidence;

    @JsonProperty("extraction_index")
    private Integer extractionIndex;

    @JsonProperty("group_index")
    private Integer groupIndex;

    private String description;

    private final Map<String, Object> attributes = new LinkedHashMap<>();

    public Extraction(String extractionClass, String extractionText) {
        this.extractionClass = Objects.requireNonNull(extractionClass, "extractionClass");
        this.extractionText = Objects.requireNonNull(extractionText, "extractionText");
    }

    public static Extraction of(String extractionClass, String extractionText, Double confidence) {
        Extraction extraction = new Extraction(extractionClass, extractionText);
        extraction.setConfidence(confidence);
        return extraction;
    }

    public String getExtractionClass() {
        return extractionClass;
    }

    public String getExtractionText() {
        return extractionText;
    }

    public CharInterval getCharInterval() {
        return charInterval;
    }

    public void setCharInterval(CharInterval charInterval) {
        this.charInterval = charInterval;
    }

    @JsonIgnore
    public boolean hasCharInterval() {
        return charInterval != null;
    }

    public AlignmentStatus getAlignmentStatus() {
        return alignmentStatus;
    }

    public void setAlignmentStatus(AlignmentStatus alignmentStatus) {
        this.alignmentStatus = alignmentStatus;
    }

    public Integer getAlignmentQuality() {
        return alignmentQuality;
    }

    public void setAlignmentQuality(Integer alignmentQuality) {
        this.alignmentQuality = alignmentQuality;
    }

    /**
     * Grounded with an interval and an alignment quality of at least 60.
     */
    @JsonIgnore
    public boolean isWellGrounded() {
        if (charInterval == null || alignmentStatus == null) {
            return false;
        }
        int quality = alignmentQuality != null ? alignmentQuality : alignmentStatus.quality();
        return quality >= AlignmentStatus.WELL_GROUNDED_QUALITY;
    }

    public Double getConfidence() {
        return confidence;
    }

    public void setConfidence(Double confidence) {
        this.confidence = confidence;
    }

    @JsonIgnore
    public boolean hasConfidence() {
        return confidence != null;
    }

    /**
     * Confidence for ranking: a missing score compares as 0.
     */
    @JsonIgnore
    public double confidenceOrZero() {
        return confidence != null ? confidence : 0.0;
    }

    public Integer getExtractionIndex() {
        return extractionIndex;
    }

    public void setExtractionIndex(Integer extractionIndex) {
        this.extractionIndex = extractionIndex;
    }

    public Integer getGroupIndex() {
        return groupIndex;
    }

    public void setGroupIndex(Integer groupIndex) {
        this.groupIndex = groupIndex;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Map<String, Object> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public void putAttribute(String key, Object value) {
        attributes.put(key, value);
    }

    public void putAllAttributes(Map<String, ?> values) {
        attributes.putAll(values);
    }

    public Optional<Object> getAttribute(String key) {
        return Optional.ofNullable(attributes.get(key));
    }

    public Optional<String> getStringAttribute(String key) {
        Object value = attributes.get(key);
        return value instanceof String s ? Optional.of(s) : Optional.empty();
    }

    public OptionalDouble getDoubleAttribute(String key) {
        Object value = attributes.get(key);
        if (value instanceof Number n) {
            return OptionalDouble.of(n.doubleValue());
        }
        if (value instanceof String s) {
            try {
                return OptionalDouble.of(Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        }
        return OptionalDouble.empty();
    }

    public Optional<Integer> getIntAttribute(String key) {
        Object value = attributes.get(key);
        if (value instanceof Number n) {
            return Optional.of(n.intValue());
        }
        if (value instanceof String s) {
            try {
                return Optional.of(Integer.parseInt(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    @JsonIgnore
    public int length() {
        return extractionText.length();
    }

    public Extraction copy() {
        Extraction copy = new Extraction(extractionClass, extractionText);
        copy.charInterval = charInterval;
        copy.alignmentStatus = alignmentStatus;
        copy.alignmentQuality = alignmentQuality;
        copy.confidence = confidence;
        copy.extractionIndex = extractionIndex;
        copy.groupIndex = groupIndex;
        copy.description = description;
        copy.attributes.putAll(attributes);
        return copy;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Extraction{class=").append(extractionClass)
                .append(", text=\"").append(extractionText).append('"');
        if (charInterval != null) {
            sb.append(", interval=").append(charInterval);
        }
        if (alignmentStatus != null) {
            sb.append(", status=").append(alignmentStatus.label());
        }
        if (confidence != null) {
            sb.append(String.format(", confidence=%.2f", confidence));
        }
        return sb.append('}').toString();
    }
}
