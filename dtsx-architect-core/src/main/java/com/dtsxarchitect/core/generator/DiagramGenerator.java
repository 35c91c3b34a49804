package com.dtsxarchitect.core.generator;

import com.dtsxarchitect.core.model.DtsxPackage;

import java.util.Set;

/**
 * Interface for diagram generators that turn a parsed package into a diagram format.
 *
 * <p>Generators are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.dtsxarchitect.core.generator.DiagramGenerator}
 *
 * @see DiagramType
 * @see GeneratorConfig
 * @see GeneratedDiagram
 */
public interface DiagramGenerator {

    /**
     * Returns unique identifier for this generator.
     *
     * <p>Used for referencing the generator on the command line. Should be lowercase
     * (e.g., "mermaid", "ascii").
     *
     * @return unique generator identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this generator.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file extension for generated diagrams, without leading dot.
     *
     * @return file extension
     */
    String getFileExtension();

    /**
     * Returns set of diagram types this generator can produce.
     *
     * @return supported diagram types
     */
    Set<DiagramType> getSupportedDiagramTypes();

    /**
     * Generates a diagram from the package.
     *
     * <p>A package without data for the requested type yields a placeholder text rather
     * than an empty diagram.
     *
     * @param dtsxPackage the parsed package
     * @param type the diagram type to generate
     * @param config configuration settings for generation
     * @return generated diagram content
     * @throws IllegalArgumentException if diagram type is not supported
     */
    GeneratedDiagram generate(DtsxPackage dtsxPackage, DiagramType type, GeneratorConfig config);
}
