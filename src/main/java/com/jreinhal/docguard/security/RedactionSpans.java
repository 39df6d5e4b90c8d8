package com.jreinhal.docguard.security;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Disjoint set of text spans claimed by secret rules.
 *
 * <p>A match overlapping claimed spans is merged with them into their union, so no
 * character of any matched value survives redaction. The merged span keeps the most
 * severe rule; ties go to the longest match, then to the rule added first.</p>
 */
public final class RedactionSpans {
    private final TreeMap<Integer, Span> spans = new TreeMap<>();

    /**
     * @return true when the match overlapped and was merged into an existing span
     */
    public boolean add(SecretPattern rule, int start, int end) {
        Span merged = new Span(rule, start, end, end - start);
        boolean overlapped = false;
        Integer from = this.spans.floorKey(start);
        Map<Integer, Span> candidates = this.spans.subMap(from != null ? from : start, true, end, false);
        List<Integer> absorbed = new ArrayList<>();
        for (Map.Entry<Integer, Span> entry : candidates.entrySet()) {
            Span existing = entry.getValue();
            if (existing.end() <= start) {
                continue;
            }
            absorbed.add(entry.getKey());
            merged = merge(existing, merged);
            overlapped = true;
        }
        absorbed.forEach(this.spans::remove);
        this.spans.put(merged.start(), merged);
        return overlapped;
    }

    public boolean isEmpty() {
        return this.spans.isEmpty();
    }

    /** Spans in ascending offset order. */
    public Collection<Span> spans() {
        return this.spans.values();
    }

    /**
     * Replaces every span with {@code [REDACTED: TYPE]}, highest offset first so pending
     * offsets stay valid.
     */
    public String apply(String text) {
        StringBuilder redacted = new StringBuilder(text);
        for (Span span : this.spans.descendingMap().values()) {
            redacted.replace(span.start(), span.end(), SecretScanner.marker(span.rule().typeName()));
        }
        return redacted.toString();
    }

    // existing was added earlier, so it wins a full tie
    private static Span merge(Span existing, Span incoming) {
        int start = Math.min(existing.start(), incoming.start());
        int end = Math.max(existing.end(), incoming.end());
        Span winner = outranks(incoming, existing) ? incoming : existing;
        return new Span(winner.rule(), start, end, winner.matchLength());
    }

    private static boolean outranks(Span candidate, Span other) {
        int bySeverity = Integer.compare(other.rule().severity().ordinal(), candidate.rule().severity().ordinal());
        if (bySeverity != 0) {
            return bySeverity > 0;
        }
        return candidate.matchLength() > other.matchLength();
    }

    /**
     * @param matchLength length of the winning rule's own match, used for tie-breaking
     */
    public record Span(SecretPattern rule, int start, int end, int matchLength) {
    }
}
