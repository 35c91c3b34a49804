package com.dtsxarchitect.core.model;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class StageKindTest {

    @ParameterizedTest
    @CsvSource(value = {
        "STOCK:SEQUENCE,           NULL,                      Sequence",
        "Microsoft.Pipeline,       NULL,                      DataFlow",
        "NULL,                     Microsoft.ExecuteSQLTask,  SqlTask",
        "Microsoft.SendMailTask,   NULL,                      SendMailTask",
        "Microsoft.FileSystemTask, NULL,                      Microsoft.FileSystemTask",
        "'',                       Microsoft.ScriptTask,      Microsoft.ScriptTask",
        "NULL,                     NULL,                      Unknown"
    }, nullValues = "NULL")
    void classify_prefersWellKnownKinds(String executableType, String creationName, String expected) {
        assertThat(StageKind.classify(executableType, creationName)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({"DataFlow, true", "Pipeline, false"})
    void matches_comparesLabel(String stageType, boolean expected) {
        assertThat(StageKind.DATA_FLOW.matches(stageType)).isEqualTo(expected);
    }
}
