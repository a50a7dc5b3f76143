package eu.virtualparadox.hybridqa.rag.index;

import eu.virtualparadox.hybridqa.ingest.model.Passage;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.KnnFloatVectorField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexableField;
import org.apache.lucene.index.VectorSimilarityFunction;

import java.util.Arrays;
import java.util.List;

import static eu.virtualparadox.hybridqa.util.LuceneConstants.*;

/**
 * Maps {@link Passage}s to Lucene documents and back.
 * <p>
 * The dense and the sparse ranker both rebuild passages through {@link #toPassage(Document)},
 * which is what guarantees that the same stored passage yields equal passage keys on both sides.
 *
 * <h3>Field layout</h3>
 * <ul>
 *   <li>{@code vectorId} – stored string: ordinal of the passage inside its generation</li>
 *   <li>{@code sourceId} – stored string</li>
 *   <li>{@code section} – stored, multi-valued, in breadcrumb order</li>
 *   <li>{@code chunkIndex} – stored int</li>
 *   <li>{@code text} – analyzed with {@link TermAnalyzer} and stored</li>
 *   <li>{@code vector} – {@link KnnFloatVectorField} with cosine similarity (absent when no embedder)</li>
 * </ul>
 */
final class PassageDocuments {

    private PassageDocuments() {
        // prevent instantiation
    }

    static Document toDocument(final String vectorId, final Passage passage, final float[] vector) {
        final Document d = new Document();

        d.add(new StringField(FIELD_VECTOR_ID, vectorId, Field.Store.YES));
        d.add(new StringField(FIELD_SOURCE_ID, passage.sourceId(), Field.Store.YES));
        for (final String section : passage.sectionPath()) {
            d.add(new StoredField(FIELD_SECTION, section));
        }
        d.add(new StoredField(FIELD_CHUNK_INDEX, passage.chunkIndex()));
        d.add(new TextField(FIELD_TEXT, passage.text(), Field.Store.YES));

        if (vector != null) {
            d.add(new KnnFloatVectorField(FIELD_VECTOR, vector, VectorSimilarityFunction.COSINE));
        }
        return d;
    }

    static Passage toPassage(final Document doc) {
        final IndexableField chunkIndex = doc.getField(FIELD_CHUNK_INDEX);
        final List<String> sections = Arrays.asList(doc.getValues(FIELD_SECTION));
        return new Passage(
                doc.get(FIELD_TEXT),
                doc.get(FIELD_SOURCE_ID),
                sections,
                chunkIndex == null ? 0 : chunkIndex.numericValue().intValue());
    }
}
