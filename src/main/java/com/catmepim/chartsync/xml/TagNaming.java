package com.catmepim.chartsync.xml;

/**
 * Tag-naming strategy of one XML part: either every element of the vocabulary carries the
 * same prefix ({@code c:ser}) or none does ({@code ser}).
 * <p>
 * Chosen once per parsed part from its root element and passed to every lookup and every
 * generated element, so prefixed and prefix-free serializations go through the same code.
 * The set is closed: {@link #unprefixed()} and {@link #prefixed(String)}.
 */
public abstract class TagNaming {

    private static final TagNaming UNPREFIXED = new Unprefixed();

    private TagNaming() {
    }

    public static TagNaming unprefixed() {
        return UNPREFIXED;
    }

    public static TagNaming prefixed(String prefix) {
        if (prefix == null || prefix.isEmpty()) {
            return UNPREFIXED;
        }
        return new Prefixed(prefix);
    }

    /**
     * Detects the strategy from the root element of a part: {@code <c:chartSpace>} yields
     * prefix {@code c}, {@code <chartSpace>} yields the unprefixed strategy.
     */
    public static TagNaming detect(XmlElement root) {
        return prefixed(root.getPrefix());
    }

    /**
     * @return the serialized name for a local name, e.g. {@code c:ser}
     */
    public abstract String tag(String localName);

    /**
     * @return the prefix, or null when unprefixed
     */
    public abstract String prefix();

    public boolean matches(XmlElement element, String localName) {
        return element != null && element.getName().equals(tag(localName));
    }

    /**
     * Creates a new, detached element of this vocabulary.
     */
    public XmlElement element(String localName) {
        return new XmlElement(tag(localName));
    }

    /**
     * Creates {@code <tag val="value"/>}, the shape of most chart scalar settings.
     */
    public XmlElement valElement(String localName, String value) {
        return element(localName).setAttribute("val", value);
    }

    /**
     * Creates {@code <tag>text</tag>}.
     */
    public XmlElement textElement(String localName, String text) {
        return element(localName).setText(text);
    }

    private static final class Unprefixed extends TagNaming {
        @Override
        public String tag(String localName) {
            return localName;
        }

        @Override
        public String prefix() {
            return null;
        }

        @Override
        public String toString() {
            return "TagNaming[unprefixed]";
        }
    }

    private static final class Prefixed extends TagNaming {
        private final String prefix;

        Prefixed(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public String tag(String localName) {
            return prefix + ":" + localName;
        }

        @Override
        public String prefix() {
            return prefix;
        }

        @Override
        public String toString() {
            return "TagNaming[" + prefix + ":]";
        }
    }
}
