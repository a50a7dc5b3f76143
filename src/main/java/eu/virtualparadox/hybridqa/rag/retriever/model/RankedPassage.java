package eu.virtualparadox.hybridqa.rag.retriever.model;

import eu.virtualparadox.hybridqa.ingest.model.Passage;

/**
 * A passage at a 1-based position of some ranking; what the context assembler consumes.
 */
public interface RankedPassage {

    PassageKey key();

    Passage passage();

    int rank();
}
