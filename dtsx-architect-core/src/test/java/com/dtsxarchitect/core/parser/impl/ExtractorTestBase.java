package com.dtsxarchitect.core.parser.impl;

import com.dtsxarchitect.core.PackageFixtures;
import com.dtsxarchitect.core.parser.AttributeResolver;
import com.dtsxarchitect.core.parser.DtsxDocumentLoader;
import com.dtsxarchitect.core.parser.DtsxNamespaces;
import com.dtsxarchitect.core.parser.task.SendMailTaskDetailParser;
import com.dtsxarchitect.core.parser.task.SqlTaskDetailParser;
import com.dtsxarchitect.core.parser.task.TaskDescriptorExtractor;
import org.w3c.dom.Element;

import java.util.List;

/**
 * Base class for extractor tests.
 *
 * <p>Builds package roots from inline XML and wires extractors with the default namespaces.
 */
abstract class ExtractorTestBase {

    protected final AttributeResolver dts = new AttributeResolver(DtsxNamespaces.DTS);

    private final DtsxDocumentLoader loader = new DtsxDocumentLoader();

    /**
     * Parses a package whose root declares the DTS namespace.
     *
     * @param body child elements of the package root
     * @return package root element
     */
    protected Element packageRoot(String body) {
        return loader.parse(PackageFixtures.packageXml("Test", body)).getDocumentElement();
    }

    protected TaskDescriptorExtractor taskExtractor() {
        return new TaskDescriptorExtractor(dts, List.of(
            new SqlTaskDetailParser(new AttributeResolver(DtsxNamespaces.SQL_TASK)),
            new SendMailTaskDetailParser(new AttributeResolver(DtsxNamespaces.SEND_MAIL_TASK))));
    }
}
