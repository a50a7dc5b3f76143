package eu.virtualparadox.hybridqa.util;

public class LuceneConstants {
    public static final String FIELD_VECTOR = "vector";
    public static final String FIELD_VECTOR_ID = "vectorId";
    public static final String FIELD_SOURCE_ID = "sourceId";
    public static final String FIELD_SECTION = "section";
    public static final String FIELD_CHUNK_INDEX = "chunkIndex";
    public static final String FIELD_TEXT = "text";

    private LuceneConstants() {
        // prevent instantiation
    }
}
