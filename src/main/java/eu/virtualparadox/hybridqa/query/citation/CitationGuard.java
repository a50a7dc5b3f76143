package eu.virtualparadox.hybridqa.query.citation;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Post-generation citation checks on answer text.
 *
 * <h2>Marker grammar</h2>
 * A citation marker is the literal {@code [source: }, a name without brackets or {@code §},
 * an optional {@code  §section}, and a closing {@code ]}. Matching is case-sensitive and
 * brackets never nest.
 *
 * <h2>Limiting</h2>
 * {@link #limitCitations(String)} walks the markers left to right with a counter. The first
 * {@code maxCitations} distinct markers stay; repeats of a kept marker and every marker past
 * the ceiling are cut out. All text between markers is copied unchanged.
 */
@Component
public class CitationGuard {

    static final Pattern MARKER = Pattern.compile("\\[source: ([^\\[\\]§]+?)(?: §([^\\[\\]]+))?]");

    /**
     * Looser form used for stripping, so malformed markers are hidden too. A marker runs to the
     * first {@code ]}, even across a stray {@code [}.
     */
    private static final Pattern STRIPPABLE = Pattern.compile("\\[source:[^\\]]*]");

    private static final Pattern HORIZONTAL_RUNS = Pattern.compile("[ \\t]{2,}");
    private static final Pattern BLANK_LINE_RUNS = Pattern.compile("\\n{3,}");

    private final int maxCitations;

    public CitationGuard(@Value("${hybridqa.max-citations:3}") final int maxCitations) {
        if (maxCitations <= 0) {
            throw new IllegalArgumentException("maxCitations must be positive");
        }
        this.maxCitations = maxCitations;
    }

    public int maxCitations() {
        return maxCitations;
    }

    /**
     * @return {@code true} if {@code text} contains at least one well-formed marker
     */
    public boolean hasCitation(final String text) {
        return text != null && MARKER.matcher(text).find();
    }

    /**
     * @return every well-formed marker in order of appearance, repeats included
     */
    public List<String> markers(final String text) {
        final List<String> markers = new ArrayList<>();
        if (text == null) {
            return markers;
        }
        final Matcher m = MARKER.matcher(text);
        while (m.find()) {
            markers.add(m.group());
        }
        return markers;
    }

    /**
     * Keeps the first {@code maxCitations} distinct markers and deletes the rest in place.
     *
     * @param text answer text, may be {@code null}
     * @return text with excess and repeated markers removed; {@code ""} for {@code null}
     */
    public String limitCitations(final String text) {
        if (text == null) {
            return "";
        }
        final Set<String> kept = new LinkedHashSet<>();
        final StringBuilder out = new StringBuilder(text.length());
        final Matcher m = MARKER.matcher(text);
        int copiedUpTo = 0;

        while (m.find()) {
            out.append(text, copiedUpTo, m.start());
            final String marker = m.group();
            if (!kept.contains(marker) && kept.size() < maxCitations) {
                kept.add(marker);
                out.append(marker);
            }
            copiedUpTo = m.end();
        }
        out.append(text, copiedUpTo, text.length());
        return out.toString();
    }

    /**
     * Parses the distinct citations present in {@code text}, in first-seen order.
     */
    public List<Citation> citations(final String text) {
        final Set<Citation> seen = new LinkedHashSet<>();
        if (text == null) {
            return List.of();
        }
        final Matcher m = MARKER.matcher(text);
        while (m.find()) {
            final String section = m.group(2);
            final List<String> path = section == null
                    ? List.of()
                    : Arrays.asList(section.split(Pattern.quote(Citation.SECTION_SEPARATOR)));
            seen.add(new Citation(m.group(1), path));
        }
        return List.copyOf(seen);
    }

    /**
     * Removes every citation marker and tidies the whitespace left behind.
     */
    public String stripCitations(final String text) {
        if (text == null) {
            return "";
        }
        String cleaned = removeMarkers(text);
        cleaned = HORIZONTAL_RUNS.matcher(cleaned).replaceAll(" ");
        cleaned = BLANK_LINE_RUNS.matcher(cleaned).replaceAll("\n\n");
        return cleaned.trim();
    }

    /**
     * Removes complete markers only; whitespace is left untouched.
     */
    static String removeMarkers(final String text) {
        return STRIPPABLE.matcher(text).replaceAll("");
    }

    /**
     * Finds a marker that has been opened but not yet closed at the end of {@code text},
     * including a partial {@code [source:} prefix such as {@code "[sou"}. A stray {@code [}
     * inside an open marker does not hide it.
     *
     * @return start index of the open marker, or {@code -1}
     */
    static int unterminatedMarkerStart(final String text) {
        final String prefix = Citation.MARKER_PREFIX.trim();
        final int marker = text.lastIndexOf(prefix);
        if (marker >= 0 && text.indexOf(']', marker) < 0) {
            return marker;
        }
        final int open = text.lastIndexOf('[');
        if (open >= 0 && prefix.startsWith(text.substring(open))) {
            return open;
        }
        return -1;
    }
}
