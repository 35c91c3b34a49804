package com.dtsxarchitect.core.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a package document fully into a DOM tree.
 *
 * <p>Documents are parsed namespace-aware. A document that fails namespace processing
 * (typically an attribute prefix that was never declared) is re-read without namespace
 * processing so that the literal-prefix lookup of {@link AttributeResolver} can still
 * find its attributes. External entities and DTDs are never loaded.
 */
public class DtsxDocumentLoader {

    private static final Logger log = LoggerFactory.getLogger(DtsxDocumentLoader.class);

    // Errors surface as exceptions only, never on stderr.
    private static final ErrorHandler QUIET_ERRORS = new ErrorHandler() {
        @Override
        public void warning(SAXParseException e) {
            log.debug("XML warning at line {}: {}", e.getLineNumber(), e.getMessage());
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    };

    /**
     * Loads a document from a file.
     *
     * @param file package file
     * @return parsed document
     * @throws DtsxParseException if the file cannot be read or is not well-formed
     */
    public Document load(Path file) {
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new DtsxParseException("Cannot read package file: " + file, e);
        }
        log.debug("Read {} bytes from {}", content.length, file);
        return parseBytes(content, file.toString());
    }

    /**
     * Loads a document from a stream. The stream is read to the end but not closed.
     *
     * @param input document stream
     * @param sourceName name used in messages
     * @return parsed document
     */
    public Document load(InputStream input, String sourceName) {
        try {
            return parseBytes(input.readAllBytes(), sourceName);
        } catch (IOException e) {
            throw new DtsxParseException("Cannot read package source: " + sourceName, e);
        }
    }

    /**
     * Parses a document held in memory.
     *
     * @param xml document text
     * @return parsed document
     */
    public Document parse(String xml) {
        try {
            return build(true).parse(new InputSource(new StringReader(xml)));
        } catch (SAXException e) {
            return retryWithoutNamespaces(new InputSource(new StringReader(xml)), "<inline>", e);
        } catch (IOException e) {
            throw new DtsxParseException("Cannot read inline package document", e);
        }
    }

    private Document parseBytes(byte[] content, String sourceName) {
        try {
            return build(true).parse(new InputSource(new ByteArrayInputStream(content)));
        } catch (SAXException e) {
            return retryWithoutNamespaces(
                new InputSource(new ByteArrayInputStream(content)), sourceName, e);
        } catch (IOException e) {
            throw new DtsxParseException("Cannot read package source: " + sourceName, e);
        }
    }

    private Document retryWithoutNamespaces(InputSource source, String sourceName, SAXException original) {
        log.debug("Namespace-aware parse of {} failed ({}), retrying without namespace processing",
            sourceName, original.getMessage());
        try {
            return build(false).parse(source);
        } catch (SAXException | IOException e) {
            throw new DtsxParseException("Malformed package document " + sourceName + ": " + original.getMessage(),
                original);
        }
    }

    private DocumentBuilder build(boolean namespaceAware) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(namespaceAware);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setExpandEntityReferences(false);
            factory.setXIncludeAware(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(QUIET_ERRORS);
            return builder;
        } catch (ParserConfigurationException e) {
            throw new DtsxParseException("XML parser configuration failed", e);
        }
    }
}
