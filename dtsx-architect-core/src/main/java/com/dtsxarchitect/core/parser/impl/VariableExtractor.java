package com.dtsxarchitect.core.parser.impl;

import com.dtsxarchitect.core.model.SsisDataType;
import com.dtsxarchitect.core.model.Variable;
import com.dtsxarchitect.core.parser.AttributeResolver;
import com.dtsxarchitect.core.parser.XmlElements;
import com.dtsxarchitect.core.parser.base.AbstractExtractor;
import org.w3c.dom.Element;

import java.util.List;
import java.util.Optional;

/**
 * Extracts variables from every {@code Variables} container, excluding {@code PackageVariables}.
 */
public class VariableExtractor extends AbstractExtractor<List<Variable>> {

    public VariableExtractor(AttributeResolver attributes) {
        super(attributes);
    }

    @Override
    public List<Variable> extract(Element root) {
        List<Variable> result = XmlElements.descendants(root, this::isVariableContainer).stream()
            .flatMap(container -> XmlElements.children(container,
                c -> XmlElements.nameContains(c, "Variable")).stream())
            .map(this::toVariable)
            .toList();
        log.debug("Extracted {} variables", result.size());
        return result;
    }

    private boolean isVariableContainer(Element element) {
        String name = XmlElements.localName(element);
        return name.endsWith("Variables") && !name.endsWith("PackageVariables");
    }

    private Variable toVariable(Element element) {
        Optional<Element> valueElement = XmlElements.children(element,
            c -> XmlElements.nameContains(c, "VariableValue")).stream().findFirst();
        int dataType = valueElement
            .map(v -> attributes.resolveInt(v, "DataType", SsisDataType.DEFAULT_CODE))
            .orElse(SsisDataType.DEFAULT_CODE);
        String value = valueElement.map(XmlElements::text).orElse(null);

        return new Variable(
            attr(element, "ObjectName", "Unknown"),
            attr(element, "Namespace", "User"),
            attr(element, "DTSID", ""),
            dataType,
            value,
            attr(element, "Expression"),
            attr(element, "Description"),
            attributes.resolveFlag(element, "ReadOnly", "True", false),
            attributes.resolveFlag(element, "RaiseChangedEvent", "True", false)
        );
    }
}
