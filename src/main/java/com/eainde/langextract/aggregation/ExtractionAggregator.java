package com.eainde.langextract.aggregation;

import com.eainde.langextract.document.CharInterval;
import com.eainde.langextract.extraction.Extraction;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Merges the extractions of all passes into one clean set.
 *
 * <h3>Steps, in order:</h3>
 * <pre>
 * deduplicate     (class, text) groups → highest confidence survives (first seen on ties)
 * resolveOverlaps grounded extractions with overlapping intervals → one survivor per conflict
 * filter          confidence &lt; threshold dropped; no confidence → kept
 * </pre>
 *
 * <p>Aggregation never throws for well-formed input: it only removes or merges. Relative
 * order of the surviving extractions is preserved throughout.</p>
 */
@Log4j2
@Getter
public class ExtractionAggregator {

    private final OverlapStrategy overlapStrategy;
    private final double confidenceThreshold;

    public ExtractionAggregator(OverlapStrategy overlapStrategy, double confidenceThreshold) {
        this.overlapStrategy = overlapStrategy == null ? OverlapStrategy.KEEP_HIGHEST_CONFIDENCE : overlapStrategy;
        this.confidenceThreshold = confidenceThreshold;
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * @param sourceText document text, used to label merged extractions; may be null
     */
    public AggregationResult aggregate(List<Extraction> extractions, String sourceText) {
        int original = extractions.size();
        List<Extraction> deduplicated = deduplicate(extractions);
        List<Extraction> resolved = resolveOverlaps(deduplicated, overlapStrategy, sourceText);
        List<Extraction> filtered = filterByConfidence(resolved, confidenceThreshold);

        log.debug("Aggregated {} → {} (duplicates={}, overlaps={}, lowConfidence={})",
                original, filtered.size(), original - deduplicated.size(),
                deduplicated.size() - resolved.size(), resolved.size() - filtered.size());

        return new AggregationResult(filtered, original,
                original - deduplicated.size(),
                deduplicated.size() - resolved.size(),
                resolved.size() - filtered.size());
    }

    /**
     * Keeps one extraction per {@code (class, text)}: the highest confidence, with a missing
     * confidence counting as 0 and ties going to the first seen. The survivor takes the slot
     * of its group's first member.
     */
    public static List<Extraction> deduplicate(List<Extraction> extractions) {
        Map<String, Extraction> survivors = new LinkedHashMap<>();
        for (Extraction extraction : extractions) {
            String key = extraction.getExtractionClass() + '\u0000' + extraction.getExtractionText();
            Extraction existing = survivors.get(key);
            if (existing == null || extraction.confidenceOrZero() > existing.confidenceOrZero()) {
                survivors.put(key, extraction);
            }
        }
        return new ArrayList<>(survivors.values());
    }

    /**
     * Removes or merges grounded extractions whose intervals overlap. Ungrounded extractions
     * and zero-length intervals never overlap anything and pass through.
     */
    public static List<Extraction> resolveOverlaps(List<Extraction> extractions, OverlapStrategy strategy,
                                                   String sourceText) {
        if (strategy == OverlapStrategy.MERGE_OVERLAPPING) {
            return mergeOverlapping(extractions, sourceText);
        }

        Map<Extraction, Integer> order = positions(extractions);
        List<Extraction> grounded = extractions.stream().filter(ExtractionAggregator::isGrounded).toList();
        List<Extraction> ranked = new ArrayList<>(grounded);
        ranked.sort(priority(strategy, order));

        // accepted intervals keyed by start; they never overlap each other
        NavigableMap<Integer, CharInterval> accepted = new TreeMap<>();
        Map<Extraction, Boolean> kept = new IdentityHashMap<>();
        for (Extraction candidate : ranked) {
            CharInterval interval = candidate.getCharInterval();
            if (!overlapsAny(accepted, interval)) {
                accepted.put(interval.start(), interval);
                kept.put(candidate, Boolean.TRUE);
            }
        }

        List<Extraction> result = new ArrayList<>(extractions.size());
        for (Extraction extraction : extractions) {
            if (!isGrounded(extraction) || kept.containsKey(extraction)) {
                result.add(extraction);
            }
        }
        return result;
    }

    /**
     * Drops extractions whose confidence is present and below the threshold.
     */
    public static List<Extraction> filterByConfidence(List<Extraction> extractions, double threshold) {
        List<Extraction> result = new ArrayList<>(extractions.size());
        for (Extraction extraction : extractions) {
            if (!extraction.hasConfidence() || extraction.getConfidence() >= threshold) {
                result.add(extraction);
            }
        }
        return result;
    }

    // =========================================================================
    //  Overlap helpers
    // =========================================================================

    private static boolean isGrounded(Extraction extraction) {
        return extraction.hasCharInterval() && !extraction.getCharInterval().isEmpty();
    }

    private static Map<Extraction, Integer> positions(List<Extraction> extractions) {
        Map<Extraction, Integer> order = new IdentityHashMap<>();
        for (int i = 0; i < extractions.size(); i++) {
            order.put(extractions.get(i), i);
        }
        return order;
    }

    private static Comparator<Extraction> priority(OverlapStrategy strategy, Map<Extraction, Integer> order) {
        Comparator<Extraction> firstSeen = Comparator.comparingInt(order::get);
        return switch (strategy) {
            case KEEP_LONGEST -> Comparator
                    .comparingInt((Extraction e) -> e.getCharInterval().length()).reversed()
                    .thenComparing(Comparator.comparingDouble(Extraction::confidenceOrZero).reversed())
                    .thenComparing(firstSeen);
            case KEEP_FIRST -> Comparator
                    .comparingInt((Extraction e) -> e.getCharInterval().start())
                    .thenComparing(firstSeen);
            default -> Comparator
                    .comparingDouble(Extraction::confidenceOrZero).reversed()
                    .thenComparing(firstSeen);
        };
    }

    private static boolean overlapsAny(NavigableMap<Integer, CharInterval> accepted, CharInterval interval) {
        Map.Entry<Integer, CharInterval> floor = accepted.floorEntry(interval.start());
        if (floor != null && floor.getValue().overlaps(interval)) {
            return true;
        }
        Map.Entry<Integer, CharInterval> higher = accepted.higherEntry(interval.start());
        return higher != null && higher.getValue().overlaps(interval);
    }

    /**
     * Groups transitively overlapping grounded extractions and replaces each group of two
     * or more with one extraction spanning the union of their intervals.
     */
    private static List<Extraction> mergeOverlapping(List<Extraction> extractions, String sourceText) {
        Map<Extraction, Integer> order = positions(extractions);
        List<Extraction> grounded = new ArrayList<>(extractions.stream().filter(ExtractionAggregator::isGrounded).toList());
        grounded.sort(Comparator.comparingInt((Extraction e) -> e.getCharInterval().start()).thenComparing(order::get));

        List<List<Extraction>> clusters = new ArrayList<>();
        List<Extraction> current = new ArrayList<>();
        int currentEnd = -1;
        for (Extraction extraction : grounded) {
            CharInterval interval = extraction.getCharInterval();
            if (!current.isEmpty() && interval.start() < currentEnd) {
                current.add(extraction);
                currentEnd = Math.max(currentEnd, interval.end());
            } else {
                if (!current.isEmpty()) {
                    clusters.add(current);
                }
                current = new ArrayList<>();
                current.add(extraction);
                currentEnd = interval.end();
            }
        }
        if (!current.isEmpty()) {
            clusters.add(current);
        }

        // each member maps to the extraction that replaces its cluster; only the first member emits it
        Map<Extraction, Extraction> replacement = new IdentityHashMap<>();
        Map<Extraction, Boolean> emitter = new IdentityHashMap<>();
        for (List<Extraction> cluster : clusters) {
            Extraction merged = cluster.size() == 1 ? cluster.get(0) : merge(cluster, order, sourceText);
            Extraction first = cluster.stream().min(Comparator.comparing(order::get)).orElseThrow();
            cluster.forEach(member -> replacement.put(member, merged));
            emitter.put(first, Boolean.TRUE);
        }

        List<Extraction> result = new ArrayList<>(extractions.size());
        for (Extraction extraction : extractions) {
            if (!isGrounded(extraction)) {
                result.add(extraction);
            } else if (emitter.containsKey(extraction)) {
                result.add(replacement.get(extraction));
            }
        }
        return result;
    }

    private static Extraction merge(List<Extraction> cluster, Map<Extraction, Integer> order, String sourceText) {
        Extraction leader = cluster.get(0);
        for (Extraction member : cluster) {
            if (member.confidenceOrZero() > leader.confidenceOrZero()
                    || (member.confidenceOrZero() == leader.confidenceOrZero() && order.get(member) < order.get(leader))) {
                leader = member;
            }
        }

        CharInterval span = cluster.get(0).getCharInterval();
        for (Extraction member : cluster) {
            span = span.union(member.getCharInterval());
        }

        String text;
        if (sourceText != null && span.fitsWithin(sourceText.length())) {
            text = sourceText.substring(span.start(), span.end());
        } else {
            StringBuilder joined = new StringBuilder();
            for (Extraction member : cluster) {
                if (joined.length() > 0) {
                    joined.append(' ');
                }
                joined.append(member.getExtractionText());
            }
            text = joined.toString();
        }

        Extraction merged = new Extraction(leader.getExtractionClass(), text);
        merged.setCharInterval(span);
        merged.setAlignmentStatus(leader.getAlignmentStatus());
        merged.setAlignmentQuality(leader.getAlignmentQuality());
        merged.setConfidence(leader.getConfidence());
        merged.setGroupIndex(leader.getGroupIndex());
        merged.setExtractionIndex(cluster.stream()
                .map(Extraction::getExtractionIndex)
                .filter(i -> i != null)
                .min(Integer::compare)
                .orElse(null));
        for (Extraction member : cluster) {
            if (member != leader) {
                merged.putAllAttributes(member.getAttributes());
            }
        }
        merged.putAllAttributes(leader.getAttributes());
        merged.putAttribute("merged_texts", cluster.stream().map(Extraction::getExtractionText).toList());
        return merged;
    }
}
