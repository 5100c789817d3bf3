package com.catmepim.chartsync.opc;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues numeric identifiers that are unique within one package.
 * <p>
 * One scanning algorithm serves every identifier family: the candidates are matched
 * against the family's pattern, the highest captured number wins and {@code max + 1} is
 * returned. The allocator also remembers the highest number it issued per family and
 * scope, so a number is never handed out twice during one editing session even when the
 * entity that used it has since disappeared.
 *
 * @invariant for a given family and scope, issued numbers are strictly increasing
 */
public final class IdAllocator {

    private static final Logger logger = LoggerFactory.getLogger(IdAllocator.class);

    /**
     * Identifier families and how to recognize them.
     */
    public enum Family {
        /** {@code rId<N>}, matched against whole relationship IDs. */
        RELATIONSHIP_ID("^rId(\\d+)$", true),
        /** {@code chart<N>.xml}, matched against file names in {@code word/charts}. */
        CHART_PART("^chart(\\d+)\\.xml$", true),
        /** {@code docPr id}, found anywhere in a part's XML. */
        DRAWING_OBJECT_ID("<(?:\\w+:)?docPr\\b[^>]*?\\sid=\"(\\d+)\"", false),
        /** {@code w:id} of bookmark start and end markers, found anywhere in a part's XML. */
        BOOKMARK_ID("<w:bookmark(?:Start|End)\\b[^>]*?\\sw:id=\"(\\d+)\"", false);

        private final Pattern pattern;
        private final boolean wholeToken;

        Family(String regex, boolean wholeToken) {
            this.pattern = Pattern.compile(regex);
            this.wholeToken = wholeToken;
        }

        Pattern pattern() {
            return pattern;
        }
    }

    private final Map<Family, Map<String, Long>> issued = new EnumMap<>(Family.class);

    /**
     * Highest number of the family found in the candidates, 0 if none.
     * Whole-token families test each candidate as a single identifier, the others search
     * every occurrence inside each candidate text. Numbers are read as {@code long}, since
     * drawing-object IDs are unsigned 32-bit values.
     */
    public static long scanMax(Family family, Iterable<? extends CharSequence> candidates) {
        long max = 0;
        for (CharSequence candidate : candidates) {
            if (candidate == null) {
                continue;
            }
            Matcher m = family.pattern().matcher(candidate);
            if (family.wholeToken) {
                if (m.find()) {
                    max = Math.max(max, parse(m.group(1)));
                }
            } else {
                while (m.find()) {
                    max = Math.max(max, parse(m.group(1)));
                }
            }
        }
        return max;
    }

    /**
     * Allocates the next number of a family.
     *
     * @param family identifier family
     * @param scope uniqueness scope, e.g. the {@code .rels} part name for relationship IDs
     * @param candidates existing identifiers, or texts containing them
     * @return {@code max(existing, previously issued) + 1}
     */
    public long next(Family family, String scope, Iterable<? extends CharSequence> candidates) {
        Map<String, Long> byScope = issued.computeIfAbsent(family, f -> new HashMap<>());
        long scanned = scanMax(family, candidates);
        long previous = byScope.getOrDefault(scope, 0L);
        long value = Math.max(scanned, previous) + 1;
        byScope.put(scope, value);
        logger.debug("Allocated {} {} in scope {}", family, value, scope);
        return value;
    }

    public String nextRelationshipId(String relsPartName, RelationshipsPart rels) {
        return "rId" + next(Family.RELATIONSHIP_ID, relsPartName, rels.getIds());
    }

    /**
     * @param chartFileNames file names found in {@code word/charts}
     */
    public int nextChartIndex(Iterable<String> chartFileNames) {
        return Math.toIntExact(next(Family.CHART_PART, PartNames.CHARTS_DIR, chartFileNames));
    }

    /**
     * Drawing-object IDs are unique per document part, so the scope is the part name.
     */
    public long nextDrawingObjectId(String partName, String partXml) {
        return next(Family.DRAWING_OBJECT_ID, partName, Collections.singletonList(partXml));
    }

    public long nextBookmarkId(String partName, String partXml) {
        return next(Family.BOOKMARK_ID, partName, Collections.singletonList(partXml));
    }

    private static long parse(String digits) {
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            // more digits than a long holds; such an ID cannot be followed by a valid one
            throw new IllegalStateException("Identifier out of range: " + digits, e);
        }
    }
}
