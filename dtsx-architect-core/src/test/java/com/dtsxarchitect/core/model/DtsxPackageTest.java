package com.dtsxarchitect.core.model;

import com.dtsxarchitect.core.PackageFixtures;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DtsxPackage} and the small value types around it.
 */
class DtsxPackageTest {

    @Test
    void constructor_withNullCollections_usesEmptyDefaults() {
        DtsxPackage pkg = new DtsxPackage(PackageFixtures.salesLoad().metadata(),
            null, null, null, null, null, null, null, null, null, null, null);

        assertThat(pkg.controlFlowStages()).isEmpty();
        assertThat(pkg.alerts()).isEmpty();
        assertThat(pkg.errorHandling()).isEqualTo(ErrorHandlingStrategy.empty());
    }

    @Test
    void constructor_withNullMetadata_throwsException() {
        assertThatThrownBy(() -> new DtsxPackage(null,
            null, null, null, null, null, null, null, null, null, null, null))
            .isInstanceOf(NullPointerException.class)
            .hasMessage("metadata must not be null");
    }

    @Test
    void findConnection_matchesRefIdDtsidOrName() {
        DtsxPackage pkg = PackageFixtures.salesLoad();

        assertThat(pkg.findConnection("Package.ConnectionManagers[SalesDB]")).extracting(ConnectionManager::name)
            .isEqualTo("SalesDB");
        assertThat(pkg.findConnection("Mail")).isNotNull();
        assertThat(pkg.findConnection("Nope")).isNull();
        assertThat(pkg.findConnection(null)).isNull();
    }

    @Test
    void describe_formatsKnownAndUnknownCodes() {
        assertThat(SsisDataType.describe(8)).isEqualTo("String (8)");
        assertThat(SsisDataType.describe(3)).isEqualTo("Int32 (3)");
        assertThat(SsisDataType.describe(99)).isEqualTo("99");
        assertThat(SsisDataType.fromCode(11)).contains(SsisDataType.BOOLEAN);
    }

    @Test
    void componentCategory_sourceWinsOverDestination() {
        assertThat(ComponentCategory.fromClassId("Microsoft.SourceToDestination")).isEqualTo(ComponentCategory.SOURCE);
        assertThat(ComponentCategory.fromClassId("Microsoft.OLEDBDestination")).isEqualTo(ComponentCategory.DESTINATION);
        assertThat(ComponentCategory.fromClassId(null)).isEqualTo(ComponentCategory.TRANSFORM);
    }
}
