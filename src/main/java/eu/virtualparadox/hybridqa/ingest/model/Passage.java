package eu.virtualparadox.hybridqa.ingest.model;

import java.util.List;
import java.util.Objects;

/**
 * Immutable unit of retrievable text produced by the (external) ingestion pipeline.
 *
 * @param text        passage text
 * @param sourceId    stable document identifier, usually the file name
 * @param sectionPath heading breadcrumb from the outermost heading inwards; may be empty
 * @param chunkIndex  position of this passage inside its section or document
 */
public record Passage(String text, String sourceId, List<String> sectionPath, int chunkIndex) {

    public Passage {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        sectionPath = sectionPath == null ? List.of() : List.copyOf(sectionPath);
    }

    public static Passage of(final String sourceId, final int chunkIndex, final String text, final String... sections) {
        return new Passage(text, sourceId, List.of(sections), chunkIndex);
    }
}
