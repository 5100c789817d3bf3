package com.catmepim.chartsync.xml;

import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A parsed XML part: its declaration and root element.
 * <p>
 * Serialization always emits UTF-8 and always puts a line break right after the
 * declaration, which strict consumers (Word) require.
 */
public final class XmlDocument {

    public static final String DEFAULT_DECLARATION =
            "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>";

    private static final Pattern ENCODING_ATTR = Pattern.compile("encoding=([\"'])[^\"']*\\1");

    private final String declaration;
    private final XmlElement root;

    public XmlDocument(String declaration, XmlElement root) {
        if (root == null) {
            throw new IllegalArgumentException("Root element must not be null");
        }
        this.declaration = normalizeDeclaration(declaration);
        this.root = root;
    }

    public XmlDocument(XmlElement root) {
        this(null, root);
    }

    private static String normalizeDeclaration(String declaration) {
        if (declaration == null || declaration.isEmpty()) {
            return DEFAULT_DECLARATION;
        }
        Matcher m = ENCODING_ATTR.matcher(declaration);
        if (m.find()) {
            return m.replaceFirst("encoding=\"UTF-8\"");
        }
        return declaration;
    }

    public String getDeclaration() {
        return declaration;
    }

    public XmlElement getRoot() {
        return root;
    }

    /**
     * @post result starts with the declaration followed by {@code '\n'}
     */
    public String toXml() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append(declaration).append('\n');
        root.writeTo(sb);
        return sb.toString();
    }

    public byte[] toBytes() {
        return toXml().getBytes(StandardCharsets.UTF_8);
    }
}
