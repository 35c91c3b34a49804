package com.dtsxarchitect.core.parser.base;

import com.dtsxarchitect.core.parser.AttributeResolver;
import com.dtsxarchitect.core.parser.XmlElements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.util.List;
import java.util.Objects;

/**
 * Base class for extractors providing a per-class logger and attribute helpers bound to
 * the package namespace.
 *
 * @param <T> extracted result type
 */
public abstract class AbstractExtractor<T> implements Extractor<T> {

    /**
     * Logger instance for this extractor.
     * Automatically initialized with the concrete extractor class name.
     */
    protected final Logger log;

    protected final AttributeResolver attributes;

    protected AbstractExtractor(AttributeResolver attributes) {
        this.log = LoggerFactory.getLogger(getClass());
        this.attributes = Objects.requireNonNull(attributes, "attributes must not be null");
    }

    protected String attr(Element element, String name) {
        return attributes.resolve(element, name);
    }

    protected String attr(Element element, String name, String defaultValue) {
        return attributes.resolve(element, name, defaultValue);
    }

    /**
     * Returns the elements of every container matching {@code containerFragment} anywhere in
     * the document, keeping only children whose tag contains {@code itemFragment}.
     *
     * @param root package root
     * @param containerFragment fragment of the container tag (e.g. {@code PackageParameters})
     * @param itemFragment fragment of the item tag (e.g. {@code PackageParameter})
     * @return matched items in document order
     */
    protected List<Element> itemsOf(Element root, String containerFragment, String itemFragment) {
        return XmlElements.descendants(root, e -> XmlElements.nameContains(e, containerFragment)).stream()
            .flatMap(container -> XmlElements.children(container,
                child -> XmlElements.nameContains(child, itemFragment)).stream())
            .toList();
    }

    /**
     * Returns the text of the first {@code Property} child whose {@code Name} attribute
     * equals the given name.
     *
     * @param parent element holding property children
     * @param propertyName property name
     * @return property text, or {@code null}
     */
    protected String propertyChild(Element parent, String propertyName) {
        for (Element child : XmlElements.children(parent)) {
            if (XmlElements.nameContains(child, "Property") && propertyName.equals(attr(child, "Name"))) {
                return XmlElements.text(child);
            }
        }
        return null;
    }
}
