package eu.virtualparadox.hybridqa.rag.retriever.model;

import eu.virtualparadox.hybridqa.ingest.model.Passage;

import java.util.List;

/**
 * Identity of a passage across independent retrieval methods.
 * <p>
 * Only ever built through {@link #of(Passage)}, so two rankers that saw the same passage
 * produce equal keys.
 */
public record PassageKey(String sourceId, List<String> sectionPath, int chunkIndex) {

    public PassageKey {
        sectionPath = List.copyOf(sectionPath);
    }

    public static PassageKey of(final Passage passage) {
        return new PassageKey(passage.sourceId(), passage.sectionPath(), passage.chunkIndex());
    }
}
