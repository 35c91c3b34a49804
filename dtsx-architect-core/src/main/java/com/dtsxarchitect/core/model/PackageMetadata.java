package com.dtsxarchitect.core.model;

import java.util.Objects;

/**
 * Package-level metadata read from the root executable of a DTSX document.
 *
 * @param name package object name
 * @param dtsid package unique identifier
 * @param creationDate creation timestamp as written by the designer
 * @param creatorName account that created the package
 * @param creatorComputer machine the package was created on
 * @param versionBuild build counter
 * @param versionGuid version GUID
 * @param packageFormatVersion value of the {@code PackageFormatVersion} property
 * @param lastModifiedVersion last product version that saved the package
 * @param description optional description
 * @param localeId locale identifier
 */
public record PackageMetadata(
    String name,
    String dtsid,
    String creationDate,
    String creatorName,
    String creatorComputer,
    String versionBuild,
    String versionGuid,
    String packageFormatVersion,
    String lastModifiedVersion,
    String description,
    String localeId
) {
    /**
     * Compact constructor with validation.
     */
    public PackageMetadata {
        Objects.requireNonNull(name, "name must not be null");
        if (dtsid == null) {
            dtsid = "";
        }
    }
}
