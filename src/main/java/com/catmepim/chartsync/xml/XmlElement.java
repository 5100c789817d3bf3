package com.catmepim.chartsync.xml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Element of the minimal XML tree.
 * <p>
 * Names are kept exactly as serialized (qualified, e.g. {@code c:ser}); namespace
 * declarations are ordinary attributes. No namespace processing happens, which is what
 * lets the same lookups work for prefixed and prefix-free documents once a
 * {@link TagNaming} has been chosen.
 *
 * @invariant every child's parent is this element
 * @invariant attribute order is preserved as parsed or inserted
 */
public final class XmlElement extends XmlNode {

    private final String name;
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private final List<XmlNode> children = new ArrayList<>();

    public XmlElement(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Element name must not be empty");
        }
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * @return the name without its prefix, e.g. {@code ser} for {@code c:ser}
     */
    public String getLocalName() {
        return localNameOf(name);
    }

    /**
     * @return the prefix of the name, or null for an unprefixed element
     */
    public String getPrefix() {
        int colon = name.indexOf(':');
        return colon < 0 ? null : name.substring(0, colon);
    }

    static String localNameOf(String qualifiedName) {
        int colon = qualifiedName.indexOf(':');
        return colon < 0 ? qualifiedName : qualifiedName.substring(colon + 1);
    }

    // --- attributes ---

    public String getAttribute(String qualifiedName) {
        return attributes.get(qualifiedName);
    }

    /**
     * Returns the value of the first attribute whose local name matches, whatever its prefix.
     * Used for relationship references, which appear as {@code r:id} or {@code relationships:id}.
     *
     * @param localName local attribute name
     * @param requirePrefix when true, unprefixed attributes are ignored; when false, an
     *        unprefixed attribute of that name wins over prefixed ones
     * @return the value, or null
     */
    public String getAttributeByLocalName(String localName, boolean requirePrefix) {
        if (!requirePrefix && attributes.containsKey(localName)) {
            return attributes.get(localName);
        }
        for (Map.Entry<String, String> e : attributes.entrySet()) {
            String key = e.getKey();
            boolean prefixed = key.indexOf(':') >= 0;
            if (requirePrefix && !prefixed) {
                continue;
            }
            if (key.startsWith("xmlns")) {
                continue;
            }
            if (localNameOf(key).equals(localName)) {
                return e.getValue();
            }
        }
        return null;
    }

    public XmlElement setAttribute(String qualifiedName, String value) {
        attributes.put(qualifiedName, value);
        return this;
    }

    public Map<String, String> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    // --- children ---

    public List<XmlNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public List<XmlElement> getChildElements() {
        List<XmlElement> result = new ArrayList<>();
        for (XmlNode child : children) {
            if (child instanceof XmlElement) {
                result.add((XmlElement) child);
            }
        }
        return result;
    }

    public XmlElement firstChild(String qualifiedName) {
        for (XmlNode child : children) {
            if (child instanceof XmlElement && ((XmlElement) child).name.equals(qualifiedName)) {
                return (XmlElement) child;
            }
        }
        return null;
    }

    public List<XmlElement> childrenNamed(String qualifiedName) {
        List<XmlElement> result = new ArrayList<>();
        for (XmlNode child : children) {
            if (child instanceof XmlElement && ((XmlElement) child).name.equals(qualifiedName)) {
                result.add((XmlElement) child);
            }
        }
        return result;
    }

    /**
     * Depth-first, document-order search below this element (this element excluded).
     */
    public XmlElement firstDescendant(String qualifiedName) {
        for (XmlNode child : children) {
            if (child instanceof XmlElement) {
                XmlElement el = (XmlElement) child;
                if (el.name.equals(qualifiedName)) {
                    return el;
                }
                XmlElement nested = el.firstDescendant(qualifiedName);
                if (nested != null) {
                    return nested;
                }
            }
        }
        return null;
    }

    /**
     * All descendants with the given name in document order. Matches are not searched
     * for nested matches of their own.
     */
    public List<XmlElement> descendants(String qualifiedName) {
        List<XmlElement> result = new ArrayList<>();
        collectDescendants(qualifiedName, result);
        return result;
    }

    private void collectDescendants(String qualifiedName, List<XmlElement> result) {
        for (XmlNode child : children) {
            if (child instanceof XmlElement) {
                XmlElement el = (XmlElement) child;
                if (el.name.equals(qualifiedName)) {
                    result.add(el);
                } else {
                    el.collectDescendants(qualifiedName, result);
                }
            }
        }
    }

    /**
     * First descendant, in document order, whose local name is one of the given names.
     * Needed where a structure mixes vocabularies, e.g. DrawingML {@code a:t} runs inside a
     * chart title.
     */
    public XmlElement firstDescendantByLocalName(String... localNames) {
        for (XmlNode child : children) {
            if (child instanceof XmlElement) {
                XmlElement el = (XmlElement) child;
                String local = el.getLocalName();
                for (String candidate : localNames) {
                    if (candidate.equals(local)) {
                        return el;
                    }
                }
                XmlElement nested = el.firstDescendantByLocalName(localNames);
                if (nested != null) {
                    return nested;
                }
            }
        }
        return null;
    }

    /**
     * Nearest ancestor with the given qualified name, or null.
     */
    public XmlElement ancestor(String qualifiedName) {
        XmlElement current = getParent();
        while (current != null) {
            if (current.name.equals(qualifiedName)) {
                return current;
            }
            current = current.getParent();
        }
        return null;
    }

    public XmlElement appendChild(XmlNode child) {
        adopt(child);
        children.add(child);
        return this;
    }

    /**
     * Inserts at {@code index}. When the node is already a child of this element and sits
     * before {@code index}, the index is taken as counted before the node was detached.
     */
    public void insertChild(int index, XmlNode child) {
        int current = child.getParent() == this ? indexOf(child) : -1;
        adopt(child);
        children.add(current >= 0 && current < index ? index - 1 : index, child);
    }

    /**
     * Inserts {@code node} directly after {@code reference}, which must be a child of this element.
     */
    public void insertAfter(XmlNode reference, XmlNode node) {
        int idx = indexOf(reference);
        if (idx < 0) {
            throw new IllegalArgumentException("Reference node is not a child of <" + name + ">");
        }
        insertChild(idx + 1, node);
    }

    public int indexOf(XmlNode child) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == child) {
                return i;
            }
        }
        return -1;
    }

    public boolean removeChild(XmlNode child) {
        int idx = indexOf(child);
        if (idx < 0) {
            return false;
        }
        children.remove(idx);
        child.setParent(null);
        return true;
    }

    public void removeChildren() {
        for (XmlNode child : children) {
            child.setParent(null);
        }
        children.clear();
    }

    private void adopt(XmlNode child) {
        if (child.getParent() != null) {
            child.getParent().removeChild(child);
        }
        child.setParent(this);
    }

    // --- text ---

    /**
     * @return concatenation of the direct text children
     */
    public String getText() {
        StringBuilder sb = new StringBuilder();
        for (XmlNode child : children) {
            if (child instanceof XmlText) {
                sb.append(((XmlText) child).getText());
            }
        }
        return sb.toString();
    }

    /**
     * Replaces all children with a single text node.
     */
    public XmlElement setText(String text) {
        removeChildren();
        appendChild(new XmlText(text));
        return this;
    }

    // --- serialization ---

    @Override
    void writeTo(StringBuilder out) {
        out.append('<').append(name);
        for (Map.Entry<String, String> e : attributes.entrySet()) {
            out.append(' ').append(e.getKey()).append("=\"");
            XmlEscaper.escapeAttribute(e.getValue(), out);
            out.append('"');
        }
        if (children.isEmpty()) {
            out.append("/>");
            return;
        }
        out.append('>');
        for (XmlNode child : children) {
            child.writeTo(out);
        }
        out.append("</").append(name).append('>');
    }

    /**
     * Serializes this element and its subtree without an XML declaration.
     */
    public String toXml() {
        StringBuilder sb = new StringBuilder();
        writeTo(sb);
        return sb.toString();
    }

    @Override
    public String toString() {
        return "<" + name + "> (" + children.size() + " children)";
    }
}
