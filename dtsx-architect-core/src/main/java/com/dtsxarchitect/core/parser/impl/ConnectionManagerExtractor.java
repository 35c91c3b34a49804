package com.dtsxarchitect.core.parser.impl;

import com.dtsxarchitect.core.model.ConnectionManager;
import com.dtsxarchitect.core.parser.AttributeResolver;
import com.dtsxarchitect.core.parser.XmlElements;
import com.dtsxarchitect.core.parser.base.AbstractExtractor;
import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts connection managers and derives server, database and provider from their
 * connection strings.
 */
public class ConnectionManagerExtractor extends AbstractExtractor<List<ConnectionManager>> {

    private static final Pattern SERVER_PATTERN =
        Pattern.compile("(?:Data Source|Server)=([^;]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern DATABASE_PATTERN =
        Pattern.compile("(?:Initial Catalog|Database)=([^;]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern PROVIDER_PATTERN =
        Pattern.compile("Provider=([^;]+)", Pattern.CASE_INSENSITIVE);

    private static final String CONNECTION_STRING = "ConnectionString";

    public ConnectionManagerExtractor(AttributeResolver attributes) {
        super(attributes);
    }

    @Override
    public List<ConnectionManager> extract(Element root) {
        List<ConnectionManager> result = XmlElements.descendants(root,
                e -> XmlElements.localName(e).endsWith("ConnectionManagers")).stream()
            .flatMap(container -> XmlElements.children(container,
                c -> XmlElements.nameContains(c, "ConnectionManager")).stream())
            .map(this::toConnectionManager)
            .toList();
        log.debug("Extracted {} connection managers", result.size());
        return result;
    }

    private ConnectionManager toConnectionManager(Element element) {
        String connectionString = null;
        Map<String, String> properties = new LinkedHashMap<>();

        for (Element objectData : XmlElements.descendants(element, e -> XmlElements.nameContains(e, "ObjectData"))) {
            for (Element inner : XmlElements.children(objectData, e -> XmlElements.nameContains(e, "ConnectionManager"))) {
                connectionString = attr(inner, CONNECTION_STRING);
                properties.putAll(otherAttributes(inner));
            }
        }

        return new ConnectionManager(
            attr(element, "ObjectName", "Unknown"),
            attr(element, "refId", ""),
            attr(element, "DTSID", ""),
            attr(element, "CreationName", "Unknown"),
            connectionString,
            match(SERVER_PATTERN, connectionString),
            match(DATABASE_PATTERN, connectionString),
            match(PROVIDER_PATTERN, connectionString),
            attr(element, "Description"),
            properties
        );
    }

    private Map<String, String> otherAttributes(Element element) {
        Map<String, String> result = new LinkedHashMap<>();
        NamedNodeMap attributeNodes = element.getAttributes();
        for (int i = 0; i < attributeNodes.getLength(); i++) {
            Attr attribute = (Attr) attributeNodes.item(i);
            String nodeName = attribute.getName();
            if (nodeName.equals("xmlns") || nodeName.startsWith("xmlns:")) {
                continue;
            }
            String local = attribute.getLocalName() != null
                ? attribute.getLocalName()
                : nodeName.substring(nodeName.indexOf(':') + 1);
            if (!CONNECTION_STRING.equals(local)) {
                result.put(local, attribute.getValue());
            }
        }
        return result;
    }

    /**
     * Applies a connection-string pattern.
     *
     * @param pattern pattern with one capturing group
     * @param connectionString connection string, may be null
     * @return captured value, or {@code null}
     */
    static String match(Pattern pattern, String connectionString) {
        if (connectionString == null || connectionString.isEmpty()) {
            return null;
        }
        Matcher matcher = pattern.matcher(connectionString);
        return matcher.find() ? matcher.group(1) : null;
    }
}
