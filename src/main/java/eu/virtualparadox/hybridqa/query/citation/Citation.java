package eu.virtualparadox.hybridqa.query.citation;

import eu.virtualparadox.hybridqa.ingest.model.Passage;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Objects;

/**
 * Provenance tag of a context fragment, rendered as {@code [source: <sourceId> §<section>]}.
 * <p>
 * Two passages from the same section of the same document share one citation, whatever
 * their chunk index.
 */
public final class Citation {

    static final String MARKER_PREFIX = "[source: ";
    static final String SECTION_MARK = " §";
    static final String SECTION_SEPARATOR = " > ";

    private final String sourceId;
    private final List<String> sectionPath;

    public Citation(final String sourceId, final List<String> sectionPath) {
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId must not be null");
        this.sectionPath = sectionPath == null ? List.of() : List.copyOf(sectionPath);
    }

    public static Citation of(final Passage passage) {
        return new Citation(passage.sourceId(), passage.sectionPath());
    }

    public String sourceId() {
        return sourceId;
    }

    public List<String> sectionPath() {
        return sectionPath;
    }

    /**
     * @return the breadcrumb joined with {@code " > "}, empty when there is no section
     */
    public String section() {
        return StringUtils.join(sectionPath, SECTION_SEPARATOR);
    }

    /**
     * @return the wire form, e.g. {@code [source: handbook.md §Leave > Annual]}
     */
    public String asMarker() {
        final String section = section();
        return MARKER_PREFIX + sourceId + (section.isEmpty() ? "" : SECTION_MARK + section) + "]";
    }

    @Override
    public boolean equals(final Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        final Citation citation = (Citation) o;
        return sourceId.equals(citation.sourceId) && sectionPath.equals(citation.sectionPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceId, sectionPath);
    }

    @Override
    public String toString() {
        return asMarker();
    }
}
