package com.dtsxarchitect.core.report;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Lookup of the registered {@link ReportGenerator} implementations.
 */
public final class ReportGenerators {

    private ReportGenerators() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Loads every registered report generator.
     *
     * @return generators in registration order
     */
    public static List<ReportGenerator> all() {
        List<ReportGenerator> generators = new ArrayList<>();
        ServiceLoader.load(ReportGenerator.class).forEach(generators::add);
        return generators;
    }

    /**
     * Returns the generator registered for a format.
     *
     * @param format report format
     * @return generator
     * @throws IllegalStateException if no generator is registered for the format
     */
    public static ReportGenerator forFormat(ReportFormat format) {
        return all().stream()
            .filter(generator -> generator.getFormat() == format)
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("No report generator registered for " + format.id()));
    }

    /**
     * Builds the conventional report file name, {@code <PackageName>_report.<ext>}, with
     * blanks in the package name replaced by underscores.
     *
     * @param packageName package name
     * @param format report format
     * @return file name
     */
    public static String fileName(String packageName, ReportFormat format) {
        return packageName.trim().replaceAll("\\s+", "_") + "_report." + format.fileExtension();
    }
}
