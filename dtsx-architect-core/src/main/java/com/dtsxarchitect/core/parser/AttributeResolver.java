package com.dtsxarchitect.core.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Attr;
import org.w3c.dom.Element;

import java.util.Objects;

/**
 * Resolves logical attribute names on package elements.
 *
 * <p>Packages written by different tool versions encode the same attribute in different
 * ways, so a lookup tries three forms in order and returns the first present:
 * <ol>
 *   <li>the name qualified by the namespace URI ({@code {uri}ObjectName})</li>
 *   <li>the bare name with no namespace ({@code ObjectName})</li>
 *   <li>the literal prefixed key ({@code DTS:ObjectName}), for documents whose prefix was
 *       never bound to the namespace</li>
 * </ol>
 *
 * <p>An absent attribute is not an error: lookups return {@code null} or the supplied default.
 */
public class AttributeResolver {

    private static final Logger log = LoggerFactory.getLogger(AttributeResolver.class);

    private final XmlNamespace namespace;

    public AttributeResolver(XmlNamespace namespace) {
        this.namespace = Objects.requireNonNull(namespace, "namespace must not be null");
    }

    public XmlNamespace namespace() {
        return namespace;
    }

    /**
     * Resolves an attribute value.
     *
     * @param element element to read, may be null
     * @param name logical attribute name
     * @return attribute value, or {@code null} when absent in all three forms
     */
    public String resolve(Element element, String name) {
        if (element == null) {
            return null;
        }
        Attr attr = element.getAttributeNodeNS(namespace.uri(), name);
        if (attr != null) {
            return attr.getValue();
        }
        attr = element.getAttributeNode(name);
        if (attr != null) {
            return attr.getValue();
        }
        attr = element.getAttributeNode(namespace.qualify(name));
        if (attr != null) {
            log.debug("Attribute {} on <{}> resolved through literal prefix {}",
                name, element.getNodeName(), namespace.prefix());
            return attr.getValue();
        }
        return null;
    }

    /**
     * Resolves an attribute value, falling back to a default.
     *
     * @param element element to read
     * @param name logical attribute name
     * @param defaultValue value returned when the attribute is absent
     * @return attribute value or default
     */
    public String resolve(Element element, String name, String defaultValue) {
        String value = resolve(element, name);
        return value != null ? value : defaultValue;
    }

    /**
     * Resolves an integer attribute; absent or malformed values yield the default.
     *
     * @param element element to read
     * @param name logical attribute name
     * @param defaultValue fallback
     * @return parsed value or default
     */
    public int resolveInt(Element element, String name, int defaultValue) {
        Integer value = resolveInteger(element, name);
        return value != null ? value : defaultValue;
    }

    /**
     * Resolves an optional integer attribute.
     *
     * @param element element to read
     * @param name logical attribute name
     * @return parsed value, or {@code null} when absent or malformed
     */
    public Integer resolveInteger(Element element, String name) {
        return parseInteger(resolve(element, name), name);
    }

    /**
     * Returns true when the attribute equals the given literal exactly, else the default
     * when absent.
     *
     * @param element element to read
     * @param name logical attribute name
     * @param trueLiteral literal that means {@code true} (e.g. {@code True} or {@code 1})
     * @param defaultValue result when the attribute is absent
     * @return flag value
     */
    public boolean resolveFlag(Element element, String name, String trueLiteral, boolean defaultValue) {
        String value = resolve(element, name);
        if (value == null) {
            return defaultValue;
        }
        return trueLiteral.equals(value);
    }

    /**
     * Parses an optional integer, logging and returning {@code null} for malformed text.
     *
     * @param text text to parse, may be null
     * @param what name used in the debug log
     * @return parsed value or {@code null}
     */
    public static Integer parseInteger(String text, String what) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring malformed number '{}' for {}", text, what);
            return null;
        }
    }
}
