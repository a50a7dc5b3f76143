package eu.virtualparadox.hybridqa.rag.index;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.pattern.PatternTokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import static eu.virtualparadox.hybridqa.util.LuceneConstants.FIELD_TEXT;

/**
 * Keyword analyzer for the sparse index: runs of ASCII letters, digits and underscore,
 * lowercased. No stemming and no stop words, so the same analyzer serves indexing
 * and query parsing.
 */
public final class TermAnalyzer extends Analyzer {

    private static final Pattern TERM = Pattern.compile("[A-Za-z0-9_]+");

    @Override
    protected TokenStreamComponents createComponents(final String fieldName) {
        final Tokenizer source = new PatternTokenizer(TERM, 0);
        final TokenStream lowered = new LowerCaseFilter(source);
        return new TokenStreamComponents(source, lowered);
    }

    /**
     * Tokenizes the given text exactly as it is indexed.
     *
     * @param text input text; {@code null} yields no tokens
     * @return tokens in order of appearance, duplicates kept
     */
    public List<String> tokenize(final String text) {
        final List<String> tokens = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return tokens;
        }
        try (final TokenStream stream = tokenStream(FIELD_TEXT, text)) {
            final CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                tokens.add(term.toString());
            }
            stream.end();
        } catch (final IOException e) {
            throw new UncheckedIOException("Failed to tokenize text", e);
        }
        return tokens;
    }
}
