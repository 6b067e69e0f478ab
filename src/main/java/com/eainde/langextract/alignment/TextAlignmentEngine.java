package com.eainde.langextract.alignment;

import com.eainde.langextract.RequestContext;
import com.eainde.langextract.document.CharInterval;
import com.eainde.langextract.extraction.AlignmentStatus;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.IntUnaryOperator;

/**
 * Multi-strategy text aligner: re-anchors a model's (possibly re-cased, re-spaced,
 * re-punctuated or slightly paraphrased) text to its location in the source document.
 *
 * <h3>Strategies, in order; the first accepted match wins:</h3>
 * <ol>
 *   <li><b>Exact</b>: literal substring search. Quality 100, {@link AlignmentStatus#EXACT}.</li>
 *   <li><b>Normalized</b>: substring search after cumulative normalization, skipping levels
 *       the options disable:
 *       case fold ({@code FUZZY_CASE}, 85) → + whitespace collapse ({@code FUZZY_WHITESPACE}, 70)
 *       → + punctuation strip ({@code FUZZY_WHITESPACE}, 55).</li>
 *   <li><b>Approximate</b>: best substring within {@code maxDistance} edits, searched within
 *       {@code windowSize} of the hint (or everywhere without one), ranked by
 *       (edit distance, distance to hint, position). Quality {@code 100 * (1 - d / len)},
 *       {@code FUZZY_APPROXIMATE}; rejected below {@code minConfidence}.</li>
 *   <li><b>None</b>: {@code [0,0)} with {@link AlignmentStatus#NONE}.</li>
 * </ol>
 *
 * <p>When several occurrences match, the one whose start is nearest the position hint is
 * taken (earliest on ties), or the first one without a hint.</p>
 *
 * <p>Each alignment is bounded by {@code timeoutMs} and by the request context. Running out of
 * time returns the best acceptable candidate found so far, or NONE, flagged as timed out.</p>
 *
 * <p>Stateless and thread-safe; one instance serves every request.</p>
 */
@Log4j2
public class TextAlignmentEngine implements TextAligner {

    static final String EXACT = "exact";
    static final String FUZZY_CASE = "fuzzy_case";
    static final String FUZZY_WHITESPACE = "fuzzy_whitespace";
    static final String FUZZY_PUNCTUATION = "fuzzy_punctuation";
    static final String APPROXIMATE = "approximate";

    private static final int PUNCTUATION_QUALITY = 55;

    @Override
    public String name() {
        return "multi_strategy";
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    @Override
    public AlignmentResult alignExtraction(String extracted, String source, AlignmentOptions options,
                                           Integer positionHint, RequestContext context) {
        return align(extracted, new SourceIndex(source == null ? "" : source), options, positionHint, context);
    }

    @Override
    public List<AlignmentResult> alignExtractions(List<String> extracted, String source, AlignmentOptions options,
                                                  RequestContext context) {
        SourceIndex index = new SourceIndex(source == null ? "" : source);
        List<AlignmentResult> results = new ArrayList<>(extracted.size());
        Integer hint = null;
        for (String text : extracted) {
            AlignmentResult result = align(text, index, options, hint, context);
            if (result.isMatched()) {
                hint = result.interval().end();
            }
            results.add(result);
        }
        return results;
    }

    @Override
    public AlignmentResult findBestAlignment(String extracted, String source, AlignmentOptions options) {
        long started = System.nanoTime();
        SourceIndex index = new SourceIndex(source == null ? "" : source);
        List<String> attempted = new ArrayList<>();
        if (extracted == null || extracted.isEmpty() || index.text.isEmpty()) {
            return AlignmentResult.none(extracted, attempted, elapsedMillis(started), false);
        }
        StopCondition stop = new StopCondition(started, options.getTimeoutMs(), RequestContext.background());

        List<Match> matches = new ArrayList<>();
        attempted.add(EXACT);
        Match exact = exactMatch(extracted, index, null, stop);
        if (exact != null) {
            matches.add(exact);
        }
        for (Level level : levels(options)) {
            attempted.add(level.method);
            Match normalized = normalizedMatch(extracted, index, level, null, stop);
            if (normalized != null) {
                matches.add(normalized);
            }
        }
        if (options.getMaxDistance() > 0) {
            attempted.add(APPROXIMATE);
            Match approximate = approximateMatch(extracted, index, options, null, stop);
            if (approximate != null) {
                matches.add(approximate);
            }
        }

        Match best = null;
        for (Match match : matches) {
            if (best == null || match.quality > best.quality) {
                best = match;
            }
        }
        if (best == null) {
            return AlignmentResult.none(extracted, attempted, elapsedMillis(started), stop.tripped);
        }
        return toResult(best, extracted, index, attempted, started, stop.tripped);
    }

    @Override
    public double validateAlignment(String extracted, String source, CharInterval interval) {
        if (interval == null) {
            throw new AlignmentException("character interval cannot be null");
        }
        if (source == null || !interval.fitsWithin(source.length())) {
            throw new AlignmentException("interval " + interval + " lies outside the source text");
        }
        String aligned = source.substring(interval.start(), interval.end());
        String text = extracted == null ? "" : extracted;
        if (text.equals(aligned)) {
            return 1.0;
        }
        String a = NormalizedText.pattern(text, true, true, false);
        String b = NormalizedText.pattern(aligned, true, true, false);
        int longest = Math.max(Math.max(a.length(), b.length()), 1);
        double confidence = 1.0 - (double) EditDistance.levenshtein(a, b) / longest;
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    // =========================================================================
    //  Strategy chain
    // =========================================================================

    private AlignmentResult align(String extracted, SourceIndex index, AlignmentOptions options,
                                  Integer hint, RequestContext context) {
        long started = System.nanoTime();
        List<String> attempted = new ArrayList<>();
        if (extracted == null || extracted.isEmpty() || index.text.isEmpty()) {
            return AlignmentResult.none(extracted, attempted, elapsedMillis(started), false);
        }
        StopCondition stop = new StopCondition(started, options.getTimeoutMs(), context);
        if (stop.reached()) {
            return AlignmentResult.none(extracted, attempted, elapsedMillis(started), true);
        }

        attempted.add(EXACT);
        Match exact = exactMatch(extracted, index, hint, stop);
        if (exact != null) {
            return toResult(exact, extracted, index, attempted, started, false);
        }

        for (Level level : levels(options)) {
            if (stop.reached()) {
                return AlignmentResult.none(extracted, attempted, elapsedMillis(started), true);
            }
            attempted.add(level.method);
            Match normalized = normalizedMatch(extracted, index, level, hint, stop);
            if (normalized != null) {
                return toResult(normalized, extracted, index, attempted, started, false);
            }
        }

        if (options.getMaxDistance() > 0 && !stop.reached()) {
            attempted.add(APPROXIMATE);
            Match approximate = approximateMatch(extracted, index, options, hint, stop);
            if (approximate == null && hint != null && !stop.tripped) {
                log.debug("No approximate match near hint {} for \"{}\", searching whole document", hint, extracted);
                approximate = approximateMatch(extracted, index, options, null, stop);
            }
            if (approximate != null) {
                return toResult(approximate, extracted, index, attempted, started, stop.tripped);
            }
        }

        if (stop.tripped) {
            log.debug("Alignment of \"{}\" stopped after {}ms without a match", extracted, elapsedMillis(started));
        }
        return AlignmentResult.none(extracted, attempted, elapsedMillis(started), stop.tripped);
    }

    private Match exactMatch(String extracted, SourceIndex index, Integer hint, StopCondition stop) {
        int position = nearestOccurrence(index.text, extracted, hint, i -> i, stop);
        if (position < 0) {
            return null;
        }
        return new Match(new CharInterval(position, position + extracted.length()),
                AlignmentStatus.EXACT, AlignmentStatus.EXACT.quality(), 0, EXACT);
    }

    private Match normalizedMatch(String extracted, SourceIndex index, Level level, Integer hint, StopCondition stop) {
        String pattern = NormalizedText.pattern(extracted, level.foldCase, level.collapseWhitespace, level.stripPunctuation);
        if (pattern.isEmpty()) {
            return null;
        }
        NormalizedText normalized = index.normalized(level);
        int position = nearestOccurrence(normalized.text(), pattern, hint,
                i -> normalized.toOriginal(i, i + 1).start(), stop);
        if (position < 0) {
            return null;
        }
        return new Match(normalized.toOriginal(position, position + pattern.length()),
                level.status, level.quality, 0, level.method);
    }

    private Match approximateMatch(String extracted, SourceIndex index, AlignmentOptions options,
                                   Integer hint, StopCondition stop) {
        String haystack = options.isCaseSensitive() ? index.text : index.folded();
        String pattern = options.isCaseSensitive() ? extracted : NormalizedText.pattern(extracted, true, false, false);
        int maxDistance = options.getMaxDistance();
        int n = haystack.length();

        int from = 0;
        int to = n;
        if (hint != null) {
            from = Math.max(0, hint - options.getWindowSize());
            to = Math.min(n, hint + options.getWindowSize() + pattern.length() + maxDistance);
        }

        Comparator<AlignmentCandidate> ranking = Comparator
                .comparingInt(AlignmentCandidate::editDistance)
                .thenComparingInt(c -> c.proximityTo(hint))
                .thenComparingInt(AlignmentCandidate::start);
        int keep = options.getMaxCandidates();
        List<AlignmentCandidate> candidates = new ArrayList<>();

        boolean completed = EditDistance.search(pattern, haystack, from, to, maxDistance, stop::reached, candidate -> {
            candidates.add(candidate);
            if (candidates.size() > keep * 4) {
                candidates.sort(ranking);
                candidates.subList(keep, candidates.size()).clear();
            }
        });
        if (!completed) {
            log.debug("Approximate search for \"{}\" cut short with {} candidate(s)", extracted, candidates.size());
        }
        if (candidates.isEmpty()) {
            return null;
        }
        candidates.sort(ranking);
        AlignmentCandidate best = candidates.get(0);

        double confidence = 1.0 - (double) best.editDistance() / Math.max(pattern.length(), 1);
        if (confidence < options.getMinConfidence()) {
            log.debug("Best approximate match for \"{}\" rejected: confidence {} < {}",
                    extracted, confidence, options.getMinConfidence());
            return null;
        }
        int quality = (int) Math.round(100.0 * Math.max(0.0, confidence));
        return new Match(new CharInterval(best.start(), best.end()),
                AlignmentStatus.FUZZY_APPROXIMATE, quality, best.editDistance(), APPROXIMATE);
    }

    /**
     * Start of the occurrence of {@code pattern} nearest to {@code hint} (earliest on ties),
     * the first occurrence without a hint, or -1.
     *
     * @param toOriginal maps a position in {@code haystack} to an original source offset
     */
    private static int nearestOccurrence(String haystack, String pattern, Integer hint,
                                         IntUnaryOperator toOriginal, StopCondition stop) {
        int position = haystack.indexOf(pattern);
        if (position < 0 || hint == null) {
            return position;
        }
        int best = position;
        int bestDistance = Math.abs(toOriginal.applyAsInt(position) - hint);
        int scanned = 0;
        while ((position = haystack.indexOf(pattern, position + 1)) >= 0) {
            if (++scanned % 64 == 0 && stop.reached()) {
                break;
            }
            int distance = Math.abs(toOriginal.applyAsInt(position) - hint);
            if (distance < bestDistance) {
                best = position;
                bestDistance = distance;
            } else if (toOriginal.applyAsInt(position) > hint) {
                break;
            }
        }
        return best;
    }

    private static List<Level> levels(AlignmentOptions options) {
        List<Level> levels = new ArrayList<>(3);
        boolean fold = false;
        boolean collapse = false;
        if (!options.isCaseSensitive()) {
            fold = true;
            levels.add(new Level(FUZZY_CASE, AlignmentStatus.FUZZY_CASE,
                    AlignmentStatus.FUZZY_CASE.quality(), true, false, false));
        }
        if (options.isIgnoreWhitespace()) {
            collapse = true;
            levels.add(new Level(FUZZY_WHITESPACE, AlignmentStatus.FUZZY_WHITESPACE,
                    AlignmentStatus.FUZZY_WHITESPACE.quality(), fold, true, false));
        }
        if (options.isIgnorePunctuation()) {
            levels.add(new Level(FUZZY_PUNCTUATION, AlignmentStatus.FUZZY_WHITESPACE,
                    PUNCTUATION_QUALITY, fold, collapse, true));
        }
        return levels;
    }

    private static AlignmentResult toResult(Match match, String extracted, SourceIndex index,
                                            List<String> attempted, long started, boolean timedOut) {
        AlignmentResult result = new AlignmentResult(
                match.interval,
                match.status,
                match.quality,
                match.quality / 100.0,
                extracted,
                index.text.substring(match.interval.start(), match.interval.end()),
                match.method,
                match.editDistance,
                attempted,
                elapsedMillis(started),
                timedOut);
        log.debug("Aligned \"{}\" at {} via {} (quality {})", extracted, match.interval, match.method, match.quality);
        return result;
    }

    private static long elapsedMillis(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    // =========================================================================
    //  Internals
    // =========================================================================

    private record Level(String method, AlignmentStatus status, int quality,
                         boolean foldCase, boolean collapseWhitespace, boolean stripPunctuation) {
    }

    private record Match(CharInterval interval, AlignmentStatus status, int quality, int editDistance, String method) {
    }

    /** Source text plus its normalized views, built on demand and reused across a batch. */
    private static final class SourceIndex {
        private final String text;
        private final Map<Integer, NormalizedText> views = new HashMap<>();

        SourceIndex(String text) {
            this.text = text;
        }

        NormalizedText normalized(Level level) {
            int key = (level.foldCase ? 1 : 0) | (level.collapseWhitespace ? 2 : 0) | (level.stripPunctuation ? 4 : 0);
            return views.computeIfAbsent(key, k ->
                    NormalizedText.of(text, level.foldCase, level.collapseWhitespace, level.stripPunctuation));
        }

        String folded() {
            return views.computeIfAbsent(1, k -> NormalizedText.of(text, true, false, false)).text();
        }
    }

    /** Timeout plus request-context check; remembers whether it ever fired. */
    private static final class StopCondition {
        private final long deadlineNanos;
        private final RequestContext context;
        private boolean tripped;

        StopCondition(long startedNanos, long timeoutMs, RequestContext context) {
            this.deadlineNanos = startedNanos + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
            this.context = context == null ? RequestContext.background() : context;
        }

        boolean reached() {
            if (!tripped && (System.nanoTime() - deadlineNanos > 0 || context.isDone())) {
                tripped = true;
            }
            return tripped;
        }
    }
}
