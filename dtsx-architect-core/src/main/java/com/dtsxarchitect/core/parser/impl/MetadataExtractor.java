package com.dtsxarchitect.core.parser.impl;

import com.dtsxarchitect.core.model.PackageMetadata;
import com.dtsxarchitect.core.parser.AttributeResolver;
import com.dtsxarchitect.core.parser.XmlElements;
import com.dtsxarchitect.core.parser.base.AbstractExtractor;
import org.w3c.dom.Element;

/**
 * Reads package metadata from the root executable.
 */
public class MetadataExtractor extends AbstractExtractor<PackageMetadata> {

    public MetadataExtractor(AttributeResolver attributes) {
        super(attributes);
    }

    @Override
    public PackageMetadata extract(Element root) {
        PackageMetadata metadata = new PackageMetadata(
            attr(root, "ObjectName", "Unknown"),
            attr(root, "DTSID", ""),
            attr(root, "CreationDate"),
            attr(root, "CreatorName"),
            attr(root, "CreatorComputerName"),
            attr(root, "VersionBuild"),
            attr(root, "VersionGUID"),
            findProperty(root, "PackageFormatVersion"),
            attr(root, "LastModifiedProductVersion"),
            attr(root, "Description"),
            attr(root, "LocaleID")
        );
        log.debug("Package metadata: name={}, format={}", metadata.name(), metadata.packageFormatVersion());
        return metadata;
    }

    private String findProperty(Element root, String propertyName) {
        return XmlElements.firstDescendant(root,
                e -> XmlElements.nameContains(e, "Property") && propertyName.equals(attr(e, "Name")))
            .map(XmlElements::text)
            .orElse(null);
    }
}
