package com.dtsxarchitect.core.parser.impl;

import com.dtsxarchitect.core.model.Annotation;
import com.dtsxarchitect.core.parser.AttributeResolver;
import com.dtsxarchitect.core.parser.XmlElements;
import com.dtsxarchitect.core.parser.base.AbstractExtractor;
import org.w3c.dom.Element;

import java.util.List;

/**
 * Extracts designer annotations from {@code Annotations/Annotation} elements.
 */
public class AnnotationExtractor extends AbstractExtractor<List<Annotation>> {

    public AnnotationExtractor(AttributeResolver attributes) {
        super(attributes);
    }

    @Override
    public List<Annotation> extract(Element root) {
        return itemsOf(root, "Annotations", "Annotation").stream()
            .map(this::toAnnotation)
            .toList();
    }

    private Annotation toAnnotation(Element element) {
        String text = XmlElements.children(element, e -> XmlElements.nameContains(e, "AnnotationText")).stream()
            .findFirst()
            .map(XmlElements::text)
            .orElse(null);
        return new Annotation(
            attr(element, "refId", ""),
            attr(element, "Description"),
            attr(element, "Tag"),
            text,
            attr(element, "CreationDate")
        );
    }
}
