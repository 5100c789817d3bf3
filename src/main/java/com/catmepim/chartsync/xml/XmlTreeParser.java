package com.catmepim.chartsync.xml;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xml.sax.Attributes;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.XMLReader;
import org.xml.sax.helpers.DefaultHandler;

/**
 * Builds an {@link XmlDocument} from the bytes of a package part using a SAX pass.
 * <p>
 * The parser is not namespace aware: element and attribute names are kept as written and
 * namespace declarations surface as plain attributes. Doctype declarations and external
 * entities are rejected.
 *
 * @invariant Parsing never resolves external resources.
 */
public final class XmlTreeParser {

    private static final Logger logger = LoggerFactory.getLogger(XmlTreeParser.class);

    private XmlTreeParser() {
    }

    /**
     * Parses a complete XML part.
     *
     * @param raw part bytes
     * @param sourceName part name used in error messages
     * @return the parsed document
     * @throws IOException if the content is not well-formed XML
     * @pre raw != null
     * @post result.getRoot() is the document element
     */
    public static XmlDocument parse(byte[] raw, String sourceName) throws IOException {
        if (raw == null) {
            throw new IllegalArgumentException("XML content must not be null");
        }
        XmlElement root = parseRoot(raw, sourceName);
        return new XmlDocument(extractDeclaration(raw), root);
    }

    /**
     * Parses a standalone element fragment, e.g. a generated drawing paragraph. Prefixes
     * do not need to be declared inside the fragment.
     */
    public static XmlElement parseFragment(String xml) throws IOException {
        return parseRoot(xml.getBytes(StandardCharsets.UTF_8), "fragment");
    }

    private static XmlElement parseRoot(byte[] raw, String sourceName) throws IOException {
        try {
            SAXParserFactory factory = SAXParserFactory.newInstance();
            factory.setNamespaceAware(false);
            factory.setValidating(false);

            // Prevent XML attacks
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);

            SAXParser saxParser = factory.newSAXParser();
            XMLReader xmlReader = saxParser.getXMLReader();
            TreeBuildingHandler handler = new TreeBuildingHandler();
            xmlReader.setContentHandler(handler);
            xmlReader.parse(new InputSource(new ByteArrayInputStream(raw)));

            if (handler.root == null) {
                throw new IOException("No root element in " + sourceName);
            }
            logger.trace("Parsed {} with root <{}>", sourceName, handler.root.getName());
            return handler.root;
        } catch (ParserConfigurationException | SAXException e) {
            throw new IOException("Error parsing XML part " + sourceName, e);
        }
    }

    /**
     * Returns the {@code <?xml ...?>} declaration as written, or null if the part has none.
     */
    static String extractDeclaration(byte[] raw) {
        int offset = 0;
        if (raw.length >= 3 && (raw[0] & 0xFF) == 0xEF && (raw[1] & 0xFF) == 0xBB && (raw[2] & 0xFF) == 0xBF) {
            offset = 3;
        }
        int limit = Math.min(raw.length, offset + 256);
        String head = new String(raw, offset, limit - offset, StandardCharsets.ISO_8859_1);
        if (!head.startsWith("<?xml")) {
            return null;
        }
        int end = head.indexOf("?>");
        return end < 0 ? null : head.substring(0, end + 2);
    }

    private static final class TreeBuildingHandler extends DefaultHandler {
        private final Deque<XmlElement> stack = new ArrayDeque<>();
        private XmlElement root;

        @Override
        public void startElement(String uri, String localName, String qName, Attributes attributes) {
            XmlElement element = new XmlElement(qName);
            for (int i = 0; i < attributes.getLength(); i++) {
                element.setAttribute(attributes.getQName(i), attributes.getValue(i));
            }
            if (stack.isEmpty()) {
                root = element;
            } else {
                stack.peek().appendChild(element);
            }
            stack.push(element);
        }

        @Override
        public void endElement(String uri, String localName, String qName) {
            stack.pop();
        }

        @Override
        public void characters(char[] ch, int start, int length) {
            XmlElement current = stack.peek();
            if (current == null) {
                return;
            }
            List<XmlNode> children = current.getChildren();
            if (!children.isEmpty() && children.get(children.size() - 1) instanceof XmlText) {
                ((XmlText) children.get(children.size() - 1)).append(ch, start, length);
            } else {
                current.appendChild(new XmlText(new String(ch, start, length)));
            }
        }
    }
}
