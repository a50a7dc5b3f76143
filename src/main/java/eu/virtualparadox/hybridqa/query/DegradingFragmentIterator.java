package eu.virtualparadox.hybridqa.query;

import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Passes fragments through until the source fails; then emits the degraded message once and ends.
 */
@Slf4j
final class DegradingFragmentIterator implements Iterator<String> {

    private final Iterator<String> source;
    private final String degradedMessage;

    private boolean failed;
    private boolean degradedEmitted;

    DegradingFragmentIterator(final Iterator<String> source, final String degradedMessage) {
        this.source = source;
        this.degradedMessage = degradedMessage;
    }

    @Override
    public boolean hasNext() {
        if (failed) {
            return !degradedEmitted;
        }
        try {
            return source.hasNext();
        } catch (final RuntimeException e) {
            log.error("Answer stream failed", e);
            failed = true;
            return true;
        }
    }

    @Override
    public String next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        if (failed) {
            degradedEmitted = true;
            return degradedMessage;
        }
        try {
            return source.next();
        } catch (final RuntimeException e) {
            log.error("Answer stream failed", e);
            failed = true;
            degradedEmitted = true;
            return degradedMessage;
        }
    }
}
