package com.catmepim.chartsync.xml;

/**
 * Node of the minimal XML tree: either an {@link XmlElement} or an {@link XmlText}.
 */
public abstract class XmlNode {

    private XmlElement parent;

    XmlNode() {
    }

    public XmlElement getParent() {
        return parent;
    }

    void setParent(XmlElement parent) {
        this.parent = parent;
    }

    abstract void writeTo(StringBuilder out);
}
