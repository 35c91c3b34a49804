package com.dtsxarchitect.core.generator;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link GeneratorConfig}.
 */
class GeneratorConfigTest {

    @Test
    void defaults_returnsDocumentedValues() {
        GeneratorConfig config = GeneratorConfig.defaults();

        assertThat(config.direction()).isEqualTo("TB");
        assertThat(config.includeStyling()).isTrue();
        assertThat(config.maxDerivedColumns()).isEqualTo(3);
        assertThat(config.expressionPreviewLength()).isEqualTo(40);
        assertThat(config.sqlPreviewLength()).isEqualTo(50);
    }

    @Test
    void constructor_withBlankDirection_usesDefault() {
        GeneratorConfig config = new GeneratorConfig(" ", false, 2, 10, 20);

        assertThat(config.direction()).isEqualTo("TB");
        assertThat(config.includeStyling()).isFalse();
        assertThat(config.maxDerivedColumns()).isEqualTo(2);
    }

    @Test
    void constructor_withNonPositiveLimits_usesDefaults() {
        GeneratorConfig config = new GeneratorConfig("LR", true, -1, 0, -5);

        assertThat(config.direction()).isEqualTo("LR");
        assertThat(config.maxDerivedColumns()).isEqualTo(GeneratorConfig.DEFAULT_MAX_DERIVED_COLUMNS);
        assertThat(config.expressionPreviewLength()).isEqualTo(GeneratorConfig.DEFAULT_EXPRESSION_PREVIEW_LENGTH);
        assertThat(config.sqlPreviewLength()).isEqualTo(GeneratorConfig.DEFAULT_SQL_PREVIEW_LENGTH);
    }

    @Test
    void constructor_withZeroDerivedColumns_keepsZero() {
        assertThat(new GeneratorConfig("TB", true, 0, 40, 50).maxDerivedColumns()).isZero();
    }
}
