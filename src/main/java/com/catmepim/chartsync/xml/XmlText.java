package com.catmepim.chartsync.xml;

/**
 * Character data. Stored unescaped, escaped on serialization.
 */
public final class XmlText extends XmlNode {

    private String text;

    public XmlText(String text) {
        this.text = text == null ? "" : text;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text == null ? "" : text;
    }

    void append(char[] ch, int start, int length) {
        text = text + new String(ch, start, length);
    }

    @Override
    void writeTo(StringBuilder out) {
        XmlEscaper.escapeText(text, out);
    }
}
