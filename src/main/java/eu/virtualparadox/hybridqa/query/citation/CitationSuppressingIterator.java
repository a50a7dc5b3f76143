package eu.virtualparadox.hybridqa.query.citation;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Removes citation markers from a fragment stream.
 * <p>
 * Fragments are buffered and flushed every {@code flushEvery} fragments with complete markers
 * removed. An opened but unclosed marker at the end of the buffer is held back until it closes,
 * so a marker split across fragments is never emitted in pieces. Whatever remains when the
 * source ends is flushed as is, minus complete markers. Flushes that end up empty are skipped.
 * <p>
 * Pulls from the source only when the caller pulls; at most {@code flushEvery} fragments ahead.
 */
public final class CitationSuppressingIterator implements Iterator<String> {

    private final Iterator<String> source;
    private final int flushEvery;
    private final StringBuilder buffer = new StringBuilder();

    private String next;

    public CitationSuppressingIterator(final Iterator<String> source, final int flushEvery) {
        if (flushEvery <= 0) {
            throw new IllegalArgumentException("flushEvery must be positive");
        }
        this.source = source;
        this.flushEvery = flushEvery;
    }

    @Override
    public boolean hasNext() {
        while (next == null) {
            if (!source.hasNext()) {
                if (buffer.length() == 0) {
                    return false;
                }
                final String rest = CitationGuard.removeMarkers(buffer.toString());
                buffer.setLength(0);
                if (!rest.isEmpty()) {
                    next = rest;
                }
                continue;
            }
            int pulled = 0;
            while (pulled < flushEvery && source.hasNext()) {
                buffer.append(source.next());
                pulled++;
            }
            next = flush();
        }
        return true;
    }

    @Override
    public String next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        final String out = next;
        next = null;
        return out;
    }

    /**
     * @return cleaned text ready to emit, or {@code null} when nothing can be emitted yet
     */
    private String flush() {
        final String pending = buffer.toString();
        final int open = CitationGuard.unterminatedMarkerStart(pending);
        final String ready = open < 0 ? pending : pending.substring(0, open);
        buffer.setLength(0);
        if (open >= 0) {
            buffer.append(pending, open, pending.length());
        }
        final String cleaned = CitationGuard.removeMarkers(ready);
        return cleaned.isEmpty() ? null : cleaned;
    }
}
