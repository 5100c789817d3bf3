package com.catmepim.chartsync.opc;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Part-name arithmetic for a package. Part names are package-relative, use forward slashes
 * and carry no leading slash ({@code word/charts/chart1.xml}).
 * <p>
 * Relationship targets are resolved against the directory of the part the {@code .rels}
 * file serves, never against the {@code _rels} directory itself.
 */
public final class PartNames {

    public static final String CHARTS_DIR = "word/charts";

    private PartNames() {
    }

    public static String chartPart(int chartIndex) {
        return CHARTS_DIR + "/chart" + chartIndex + ".xml";
    }

    public static String chartRelsPart(int chartIndex) {
        return relsPartFor(chartPart(chartIndex));
    }

    /**
     * @return the {@code .rels} part serving {@code partName}, e.g.
     *         {@code word/_rels/document.xml.rels} for {@code word/document.xml}
     */
    public static String relsPartFor(String partName) {
        String dir = directoryOf(partName);
        String file = fileName(partName);
        return (dir.isEmpty() ? "" : dir + "/") + "_rels/" + file + ".rels";
    }

    /**
     * @return the directory of a part, or the empty string for a part at the package root
     */
    public static String directoryOf(String partName) {
        int slash = partName.lastIndexOf('/');
        return slash < 0 ? "" : partName.substring(0, slash);
    }

    public static String fileName(String partName) {
        int slash = partName.lastIndexOf('/');
        return slash < 0 ? partName : partName.substring(slash + 1);
    }

    /**
     * Resolves a relationship target against the part that owns the relationship.
     *
     * @param sourcePart part the relationship belongs to, e.g. {@code word/charts/chart1.xml}
     * @param target relationship target, e.g. {@code ../embeddings/Microsoft_Excel_Worksheet1.xlsx}
     * @return normalized part name, e.g. {@code word/embeddings/Microsoft_Excel_Worksheet1.xlsx}
     * @throws IllegalArgumentException if the target escapes the package root
     */
    public static String resolve(String sourcePart, String target) {
        String decoded = percentDecode(stripFragment(target));
        if (decoded.startsWith("/")) {
            return normalize(decoded.substring(1));
        }
        String dir = directoryOf(sourcePart);
        return normalize(dir.isEmpty() ? decoded : dir + "/" + decoded);
    }

    /**
     * Computes the target string that {@code sourcePart} must use to reach {@code targetPart}.
     */
    public static String relativize(String sourcePart, String targetPart) {
        String[] from = directoryOf(sourcePart).isEmpty() ? new String[0] : directoryOf(sourcePart).split("/");
        String[] to = targetPart.split("/");
        int common = 0;
        while (common < from.length && common < to.length - 1 && from[common].equals(to[common])) {
            common++;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = common; i < from.length; i++) {
            sb.append("../");
        }
        for (int i = common; i < to.length; i++) {
            if (i > common) {
                sb.append('/');
            }
            sb.append(to[i]);
        }
        return sb.toString();
    }

    /**
     * Collapses {@code .} and {@code ..} segments and duplicate slashes.
     *
     * @throws IllegalArgumentException if {@code ..} climbs above the package root
     */
    public static String normalize(String path) {
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : path.replace('\\', '/').split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                if (segments.isEmpty()) {
                    throw new IllegalArgumentException("Path escapes the package root: " + path);
                }
                segments.removeLast();
            } else {
                segments.addLast(segment);
            }
        }
        StringBuilder sb = new StringBuilder();
        Iterator<String> it = segments.iterator();
        while (it.hasNext()) {
            sb.append(it.next());
            if (it.hasNext()) {
                sb.append('/');
            }
        }
        return sb.toString();
    }

    /**
     * @return the name used by {@code [Content_Types].xml} overrides, e.g. {@code /word/charts/chart1.xml}
     */
    public static String contentTypePartName(String partName) {
        return "/" + partName;
    }

    private static String stripFragment(String target) {
        int hash = target.indexOf('#');
        return hash < 0 ? target : target.substring(0, hash);
    }

    private static String percentDecode(String value) {
        if (value.indexOf('%') < 0) {
            return value;
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '%' && i + 2 < value.length()) {
                int hi = Character.digit(value.charAt(i + 1), 16);
                int lo = Character.digit(value.charAt(i + 2), 16);
                if (hi >= 0 && lo >= 0) {
                    out.write((hi << 4) + lo);
                    i += 2;
                    continue;
                }
            }
            byte[] bytes = String.valueOf(c).getBytes(StandardCharsets.UTF_8);
            out.write(bytes, 0, bytes.length);
        }
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }
}
