package eu.virtualparadox.hybridqa.rag.context;

import eu.virtualparadox.hybridqa.query.citation.Citation;
import eu.virtualparadox.hybridqa.rag.context.ContextBlock.ContextFragment;
import eu.virtualparadox.hybridqa.rag.retriever.model.RankedPassage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Turns a ranking into a character-bounded, citation-tagged context block.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>Hits are taken in the given order and never re-sorted.</li>
 *   <li>Only the first hit per {@code (sourceId, sectionPath)} is used; later chunks of the
 *       same section are skipped, not merged.</li>
 *   <li>Each fragment is the citation marker on its own line followed by the passage text.
 *       Fragments are joined by one blank line.</li>
 *   <li>A fragment is appended only if the text, separator included, stays within
 *       {@code maxChars}. The first fragment that does not fit ends assembly: no partial
 *       fragments, no hunting for a smaller one further down.</li>
 *   <li>Assembly also ends once {@code maxCitations} distinct citations are in.</li>
 * </ul>
 * The result is trimmed, so its length never exceeds {@code maxChars}. Output depends only on
 * the input, so assembling the same ranking twice gives identical text.
 */
@Component
@Slf4j
public class ContextAssembler {

    static final String FRAGMENT_SEPARATOR = "\n\n";

    private final int maxChars;
    private final int maxCitations;

    public ContextAssembler(@Value("${hybridqa.max-context-chars:2500}") final int maxChars,
                            @Value("${hybridqa.max-citations:3}") final int maxCitations) {
        if (maxChars <= 0) {
            throw new IllegalArgumentException("maxChars must be positive");
        }
        if (maxCitations <= 0) {
            throw new IllegalArgumentException("maxCitations must be positive");
        }
        this.maxChars = maxChars;
        this.maxCitations = maxCitations;
    }

    /**
     * Assembles with the configured budget.
     */
    public ContextBlock assemble(final List<? extends RankedPassage> hits) {
        return assemble(hits, maxChars);
    }

    /**
     * Assembles with an explicit character budget.
     *
     * @param hits     best-first ranking (fused or a raw fallback list)
     * @param budget   maximum length of the resulting text
     * @return the assembled block; empty when nothing fits
     */
    public ContextBlock assemble(final List<? extends RankedPassage> hits, final int budget) {
        Objects.requireNonNull(hits, "hits must not be null");
        if (budget <= 0) {
            throw new IllegalArgumentException("budget must be positive, was " + budget);
        }

        final Set<Citation> seen = new HashSet<>();
        final List<ContextFragment> kept = new ArrayList<>();
        final StringBuilder text = new StringBuilder();

        for (final RankedPassage hit : hits) {
            final Citation citation = Citation.of(hit.passage());
            if (seen.contains(citation)) {
                continue;
            }

            final String fragment = format(citation, hit.passage().text());
            final int added = (text.length() == 0 ? 0 : FRAGMENT_SEPARATOR.length()) + fragment.length();
            if (text.length() + added > budget) {
                log.debug("Context budget {} reached after {} fragments", budget, kept.size());
                break;
            }

            if (text.length() > 0) {
                text.append(FRAGMENT_SEPARATOR);
            }
            text.append(fragment);
            seen.add(citation);
            kept.add(new ContextFragment(citation, fragment));

            if (seen.size() >= maxCitations) {
                break;
            }
        }

        return new ContextBlock(kept, text.toString().trim());
    }

    static String format(final Citation citation, final String passageText) {
        return citation.asMarker() + "\n" + passageText.trim();
    }
}
