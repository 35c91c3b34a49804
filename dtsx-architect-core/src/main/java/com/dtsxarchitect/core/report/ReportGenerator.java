package com.dtsxarchitect.core.report;

import com.dtsxarchitect.core.generator.GeneratorConfig;
import com.dtsxarchitect.core.model.DtsxPackage;

/**
 * Turns a parsed package into a complete report document.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}; register them in
 * {@code META-INF/services/com.dtsxarchitect.core.report.ReportGenerator}. See
 * {@link ReportGenerators} for lookup by format.
 */
public interface ReportGenerator {

    /**
     * Returns the format this generator produces.
     *
     * @return report format
     */
    ReportFormat getFormat();

    /**
     * Returns the identifier used on the command line, the format id by default.
     *
     * @return generator identifier
     */
    default String getId() {
        return getFormat().id();
    }

    /**
     * Generates the report.
     *
     * @param dtsxPackage parsed package
     * @param config diagram settings for the embedded diagrams and previews
     * @return report text
     */
    String generate(DtsxPackage dtsxPackage, GeneratorConfig config);
}
