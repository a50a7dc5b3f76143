package eu.virtualparadox.hybridqa.rag.context;

import eu.virtualparadox.hybridqa.query.citation.Citation;

import java.util.List;

/**
 * Assembled prompt context.
 *
 * @param fragments kept fragments in ranking order, one per distinct citation
 * @param text      the fragments joined by blank lines and trimmed
 */
public record ContextBlock(List<ContextFragment> fragments, String text) {

    public ContextBlock {
        fragments = List.copyOf(fragments);
    }

    public static ContextBlock empty() {
        return new ContextBlock(List.of(), "");
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    public List<Citation> citations() {
        return fragments.stream().map(ContextFragment::citation).toList();
    }

    /**
     * @param citation provenance of the passage
     * @param text     citation header line followed by the passage text
     */
    public record ContextFragment(Citation citation, String text) {
    }
}
