package com.dtsxarchitect.core.parser.base;

import org.w3c.dom.Element;

/**
 * Materializes one kind of entity from a package document.
 *
 * @param <T> extracted result type
 */
@FunctionalInterface
public interface Extractor<T> {

    /**
     * Extracts entities from the document rooted at the package executable.
     *
     * <p>Implementations never fail on absent optional data; they return defaults or
     * empty collections instead.
     *
     * @param packageRoot root {@code Executable} element of the package
     * @return extracted result, never null
     */
    T extract(Element packageRoot);
}
