package com.catmepim.chartsync.opc;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.catmepim.chartsync.xml.XmlDocument;
import com.catmepim.chartsync.xml.XmlElement;
import com.catmepim.chartsync.xml.XmlTreeParser;

/**
 * Parsed {@code .rels} part. Edits are made on the underlying tree so relationships this
 * code does not touch keep their attributes and order.
 *
 * @invariant relationship IDs are unique within one part
 */
public final class RelationshipsPart {

    public static final String NAMESPACE = "http://schemas.openxmlformats.org/package/2006/relationships";

    private static final String RELATIONSHIP = "Relationship";

    private final XmlDocument document;

    private RelationshipsPart(XmlDocument document) {
        this.document = document;
    }

    public static RelationshipsPart parse(byte[] raw, String partName) throws IOException {
        XmlDocument doc = XmlTreeParser.parse(raw, partName);
        if (!"Relationships".equals(doc.getRoot().getLocalName())) {
            throw new IOException("Not a relationships part: " + partName);
        }
        return new RelationshipsPart(doc);
    }

    public static RelationshipsPart empty() {
        XmlElement root = new XmlElement("Relationships").setAttribute("xmlns", NAMESPACE);
        return new RelationshipsPart(new XmlDocument(root));
    }

    public List<Relationship> getRelationships() {
        List<Relationship> result = new ArrayList<>();
        for (XmlElement el : relationshipElements()) {
            result.add(toRelationship(el));
        }
        return result;
    }

    /**
     * @return the relationship with the given ID, or null
     */
    public Relationship findById(String id) {
        XmlElement el = elementById(id);
        return el == null ? null : toRelationship(el);
    }

    /**
     * @return the first internal relationship whose resolved target equals {@code partName}, or null
     */
    public Relationship findByTargetPart(String sourcePart, String partName) {
        for (Relationship rel : getRelationships()) {
            if (rel.isExternal()) {
                continue;
            }
            try {
                if (PartNames.resolve(sourcePart, rel.getTarget()).equals(partName)) {
                    return rel;
                }
            } catch (IllegalArgumentException e) {
                // target escapes the package; cannot be the part we are looking for
                continue;
            }
        }
        return null;
    }

    public List<String> getIds() {
        List<String> ids = new ArrayList<>();
        for (XmlElement el : relationshipElements()) {
            ids.add(el.getAttribute("Id"));
        }
        return ids;
    }

    /**
     * Appends a relationship.
     *
     * @throws IllegalArgumentException if the ID is already used in this part
     */
    public void add(Relationship relationship) {
        if (elementById(relationship.getId()) != null) {
            throw new IllegalArgumentException("Duplicate relationship ID " + relationship.getId());
        }
        XmlElement el = new XmlElement(qualified(RELATIONSHIP))
                .setAttribute("Id", relationship.getId())
                .setAttribute("Type", relationship.getType())
                .setAttribute("Target", relationship.getTarget());
        if (relationship.getTargetMode() != null) {
            el.setAttribute("TargetMode", relationship.getTargetMode());
        }
        document.getRoot().appendChild(el);
    }

    /**
     * Points an existing relationship at a new target.
     *
     * @return false if no relationship has the given ID
     */
    public boolean setTarget(String id, String target) {
        XmlElement el = elementById(id);
        if (el == null) {
            return false;
        }
        el.setAttribute("Target", target);
        return true;
    }

    public byte[] toBytes() {
        return document.toBytes();
    }

    private List<XmlElement> relationshipElements() {
        List<XmlElement> result = new ArrayList<>();
        for (XmlElement el : document.getRoot().getChildElements()) {
            if (RELATIONSHIP.equals(el.getLocalName())) {
                result.add(el);
            }
        }
        return result;
    }

    private XmlElement elementById(String id) {
        for (XmlElement el : relationshipElements()) {
            if (id != null && id.equals(el.getAttribute("Id"))) {
                return el;
            }
        }
        return null;
    }

    private String qualified(String localName) {
        String prefix = document.getRoot().getPrefix();
        return prefix == null ? localName : prefix + ":" + localName;
    }

    private static Relationship toRelationship(XmlElement el) {
        return new Relationship(el.getAttribute("Id"), el.getAttribute("Type"),
                el.getAttribute("Target"), el.getAttribute("TargetMode"));
    }
}
