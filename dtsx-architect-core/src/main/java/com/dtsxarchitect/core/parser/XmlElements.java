package com.dtsxarchitect.core.parser;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * DOM navigation helpers matching elements by local tag name.
 *
 * <p>Tag checks ignore the namespace prefix so that {@code DTS:Executables} and a bare
 * {@code Executables} are treated alike.
 */
public final class XmlElements {

    private XmlElements() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Returns the tag name without any prefix.
     *
     * @param element element
     * @return local tag name
     */
    public static String localName(Element element) {
        String local = element.getLocalName();
        if (local != null) {
            return local;
        }
        String nodeName = element.getNodeName();
        int colon = nodeName.indexOf(':');
        return colon >= 0 ? nodeName.substring(colon + 1) : nodeName;
    }

    public static boolean isNamed(Element element, String name) {
        return localName(element).equals(name);
    }

    public static boolean nameContains(Element element, String fragment) {
        return localName(element).contains(fragment);
    }

    /**
     * Returns the direct child elements in document order.
     *
     * @param parent parent element
     * @return child elements
     */
    public static List<Element> children(Element parent) {
        List<Element> result = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                result.add((Element) node);
            }
        }
        return result;
    }

    public static List<Element> children(Element parent, Predicate<Element> filter) {
        return children(parent).stream().filter(filter).toList();
    }

    public static List<Element> childrenNamed(Element parent, String name) {
        return children(parent, e -> isNamed(e, name));
    }

    public static Optional<Element> firstChildNamed(Element parent, String name) {
        return children(parent).stream().filter(e -> isNamed(e, name)).findFirst();
    }

    /**
     * Returns every descendant element (excluding {@code root} itself) in document order.
     *
     * @param root subtree root
     * @return descendant elements
     */
    public static List<Element> descendants(Element root) {
        List<Element> result = new ArrayList<>();
        collect(root, result);
        return result;
    }

    public static List<Element> descendants(Element root, Predicate<Element> filter) {
        return descendants(root).stream().filter(filter).toList();
    }

    public static Optional<Element> firstDescendant(Element root, Predicate<Element> filter) {
        return descendants(root).stream().filter(filter).findFirst();
    }

    /**
     * Returns the element's text, or {@code null} when it has none.
     *
     * @param element element, may be null
     * @return text content or {@code null}
     */
    public static String text(Element element) {
        if (element == null) {
            return null;
        }
        String text = element.getTextContent();
        return text == null || text.isEmpty() ? null : text;
    }

    private static void collect(Element parent, List<Element> into) {
        for (Element child : children(parent)) {
            into.add(child);
            collect(child, into);
        }
    }
}
