package com.dtsxarchitect.core.parser.impl;

import com.dtsxarchitect.core.model.Parameter;
import com.dtsxarchitect.core.model.SsisDataType;
import com.dtsxarchitect.core.parser.AttributeResolver;
import com.dtsxarchitect.core.parser.base.AbstractExtractor;
import org.w3c.dom.Element;

import java.util.List;

/**
 * Extracts package parameters; the value comes from the {@code ParameterValue} property.
 */
public class ParameterExtractor extends AbstractExtractor<List<Parameter>> {

    public ParameterExtractor(AttributeResolver attributes) {
        super(attributes);
    }

    @Override
    public List<Parameter> extract(Element root) {
        return itemsOf(root, "PackageParameters", "PackageParameter").stream()
            .map(element -> new Parameter(
                attr(element, "ObjectName", "Unknown"),
                attr(element, "DTSID", ""),
                attributes.resolveInt(element, "DataType", SsisDataType.DEFAULT_CODE),
                propertyChild(element, "ParameterValue"),
                attr(element, "Description"),
                attributes.resolveFlag(element, "Sensitive", "1", false),
                attributes.resolveFlag(element, "Required", "1", false)))
            .toList();
    }
}
