package com.dtsxarchitect.core.parser;

import java.util.Objects;

/**
 * Namespace URI together with the prefix documents conventionally bind it to.
 *
 * @param uri namespace URI
 * @param prefix conventional prefix, used for the literal {@code prefix:name} lookup
 */
public record XmlNamespace(String uri, String prefix) {

    public XmlNamespace {
        Objects.requireNonNull(uri, "uri must not be null");
        Objects.requireNonNull(prefix, "prefix must not be null");
    }

    /**
     * Returns the literal qualified attribute name, e.g. {@code DTS:ObjectName}.
     *
     * @param localName attribute local name
     * @return prefixed name
     */
    public String qualify(String localName) {
        return prefix + ":" + localName;
    }
}
