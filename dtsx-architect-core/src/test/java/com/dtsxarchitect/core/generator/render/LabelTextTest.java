package com.dtsxarchitect.core.generator.render;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class LabelTextTest {

    @Test
    void conditionLabel_stripsVariableDecorationAndEquality() {
        assertThat(LabelText.conditionLabel("@[User::Rows] == 0")).isEqualTo("Rows = 0");
        assertThat(LabelText.stripVariableDecoration("@[User::Mode] == \"Full\"")).isEqualTo("Mode == \"Full\"");
        assertThat(LabelText.conditionLabel(null)).isEmpty();
    }

    @Test
    void preview_appendsEllipsisOnlyWhenTruncated() {
        assertThat(LabelText.preview("abcdef", 3)).isEqualTo("abc...");
        assertThat(LabelText.preview("abc", 3)).isEqualTo("abc");
        assertThat(LabelText.preview(null, 3)).isEmpty();
    }

    @Test
    void collapseWhitespace_joinsLinesWithSingleSpaces() {
        assertThat(LabelText.collapseWhitespace("  SELECT *\n\tFROM   t  ")).isEqualTo("SELECT * FROM t");
    }

    @Test
    void center_padsBothSides() {
        assertThat(LabelText.center("ab", 6)).isEqualTo("  ab  ");
        assertThat(LabelText.center("abc", 6)).isEqualTo(" abc  ");
        assertThat(LabelText.center("toolong", 3)).isEqualTo("toolong");
    }

    @Test
    void transformSymbol_matchesClassFragment() {
        assertThat(TransformSymbol.markerFor("Microsoft.ConditionalSplit")).isEqualTo("{SPLIT}");
        assertThat(TransformSymbol.markerFor("Microsoft.Lookup")).isEqualTo("{LKP}");
        assertThat(TransformSymbol.markerFor("Microsoft.Sort")).isEqualTo("{TRF}");
        assertThat(TransformSymbol.markerFor(null)).isEqualTo("{TRF}");
    }
}
