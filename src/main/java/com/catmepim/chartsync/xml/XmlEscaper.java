package com.catmepim.chartsync.xml;

/**
 * Escaping for serialized character data and attribute values.
 */
final class XmlEscaper {

    private XmlEscaper() {
    }

    static void escapeText(String value, StringBuilder out) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '&':
                    out.append("&amp;");
                    break;
                case '<':
                    out.append("&lt;");
                    break;
                case '>':
                    out.append("&gt;");
                    break;
                case '\r':
                    out.append("&#13;");
                    break;
                default:
                    out.append(c);
            }
        }
    }

    static void escapeAttribute(String value, StringBuilder out) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '&':
                    out.append("&amp;");
                    break;
                case '<':
                    out.append("&lt;");
                    break;
                case '>':
                    out.append("&gt;");
                    break;
                case '"':
                    out.append("&quot;");
                    break;
                case '\n':
                    out.append("&#10;");
                    break;
                case '\r':
                    out.append("&#13;");
                    break;
                case '\t':
                    out.append("&#9;");
                    break;
                default:
                    out.append(c);
            }
        }
    }
}
