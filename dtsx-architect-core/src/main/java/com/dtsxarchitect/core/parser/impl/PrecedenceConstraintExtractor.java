package com.dtsxarchitect.core.parser.impl;

import com.dtsxarchitect.core.model.PrecedenceConstraint;
import com.dtsxarchitect.core.parser.AttributeResolver;
import com.dtsxarchitect.core.parser.XmlElements;
import com.dtsxarchitect.core.parser.base.AbstractExtractor;
import org.w3c.dom.Element;

import java.util.List;

/**
 * Extracts the precedence constraints declared directly under a container executable
 * (the package root, or an event handler).
 */
public class PrecedenceConstraintExtractor extends AbstractExtractor<List<PrecedenceConstraint>> {

    public PrecedenceConstraintExtractor(AttributeResolver attributes) {
        super(attributes);
    }

    @Override
    public List<PrecedenceConstraint> extract(Element container) {
        return XmlElements.children(container, e -> XmlElements.nameContains(e, "PrecedenceConstraints")).stream()
            .flatMap(group -> XmlElements.children(group,
                c -> XmlElements.nameContains(c, "PrecedenceConstraint")).stream())
            .map(this::toConstraint)
            .toList();
    }

    PrecedenceConstraint toConstraint(Element element) {
        return new PrecedenceConstraint(
            attr(element, "ObjectName", ""),
            attr(element, "refId", ""),
            attr(element, "DTSID", ""),
            attr(element, "From", ""),
            attr(element, "To", ""),
            attributes.resolveInt(element, "Value", 0),
            attributes.resolveFlag(element, "LogicalAnd", "True", true),
            attr(element, "Expression"),
            attributes.resolveInteger(element, "EvalOp")
        );
    }
}
