package com.dtsxarchitect.core.parser;

import com.dtsxarchitect.core.PackageFixtures;
import com.dtsxarchitect.core.model.Alert;
import com.dtsxarchitect.core.model.ComponentCategory;
import com.dtsxarchitect.core.model.ConnectionManager;
import com.dtsxarchitect.core.model.ControlFlowStage;
import com.dtsxarchitect.core.model.DataFlowComponent;
import com.dtsxarchitect.core.model.DataFlowTask;
import com.dtsxarchitect.core.model.DatabaseObject;
import com.dtsxarchitect.core.model.DatabaseObjectType;
import com.dtsxarchitect.core.model.DtsxPackage;
import com.dtsxarchitect.core.model.GenericTask;
import com.dtsxarchitect.core.model.SendMailTask;
import com.dtsxarchitect.core.model.SqlTask;
import com.dtsxarchitect.core.model.Threshold;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests for {@link DtsxPackageParser} against the sales-load fixture.
 */
class DtsxPackageParserTest {

    private static DtsxPackage salesLoad;

    @TempDir
    Path tempDir;

    @BeforeAll
    static void parseFixture() {
        salesLoad = PackageFixtures.salesLoad();
    }

    @Test
    void parse_readsPackageMetadata() {
        assertThat(salesLoad.metadata().name()).isEqualTo("SalesLoad");
        assertThat(salesLoad.metadata().creatorName()).isEqualTo("CORP\\etl");
        assertThat(salesLoad.metadata().creatorComputer()).isEqualTo("ETL01");
        assertThat(salesLoad.metadata().versionBuild()).isEqualTo("7");
        assertThat(salesLoad.metadata().packageFormatVersion()).isEqualTo("8");
        assertThat(salesLoad.metadata().localeId()).isEqualTo("1033");
        assertThat(salesLoad.metadata().description()).isEqualTo("Nightly sales load");
    }

    @Test
    void parse_splitsConnectionStrings() {
        // Then
        assertThat(salesLoad.connectionManagers()).extracting(ConnectionManager::name)
            .containsExactly("SalesDB", "Mail");

        ConnectionManager sales = salesLoad.connectionManagers().get(0);
        assertThat(sales.connectionType()).isEqualTo("OLEDB");
        assertThat(sales.server()).isEqualTo("SRV01");
        assertThat(sales.database()).isEqualTo("Sales");
        assertThat(sales.provider()).isEqualTo("SQLOLEDB");
        assertThat(sales.properties()).containsEntry("Retain", "True").doesNotContainKey("ConnectionString");
    }

    @Test
    void parse_readsVariablesAndParameters() {
        assertThat(salesLoad.variables()).hasSize(3);
        assertThat(salesLoad.variables().get(0).name()).isEqualTo("FraudScoreThreshold");
        assertThat(salesLoad.variables().get(0).dataType()).isEqualTo(3);
        assertThat(salesLoad.variables().get(0).value()).isEqualTo("75");
        assertThat(salesLoad.variables().get(1).readOnly()).isTrue();
        assertThat(salesLoad.variables().get(1).qualifiedName()).isEqualTo("User::RunMode");

        assertThat(salesLoad.parameters()).singleElement().satisfies(parameter -> {
            assertThat(parameter.name()).isEqualTo("Environment");
            assertThat(parameter.value()).isEqualTo("PROD");
            assertThat(parameter.dataType()).isEqualTo(18);
            assertThat(parameter.required()).isTrue();
            assertThat(parameter.sensitive()).isFalse();
        });
    }

    @Test
    void parse_numbersStagesInDocumentOrder() {
        assertThat(salesLoad.controlFlowStages())
            .extracting(ControlFlowStage::order, ControlFlowStage::name, ControlFlowStage::stageType)
            .containsExactly(
                tuple(1, "Extract Orders", "SqlTask"),
                tuple(2, "Load Orders", "DataFlow"),
                tuple(3, "Cleanup Staging", "SqlTask"),
                tuple(4, "Notify Finance", "SendMailTask"));
    }

    @Test
    void parse_attachesTaskDetailsByKind() {
        ControlFlowStage extract = salesLoad.controlFlowStages().get(0);
        assertThat(extract.detail()).isInstanceOf(SqlTask.class);
        SqlTask sql = (SqlTask) extract.detail();
        assertThat(sql.connection()).isEqualTo("{CM000001-0000-0000-0000-000000000001}");
        assertThat(sql.sqlStatement()).startsWith("INSERT INTO staging.Orders");
        assertThat(sql.parameterBindings()).singleElement()
            .satisfies(binding -> assertThat(binding.variableName()).isEqualTo("User::RunMode"));

        assertThat(salesLoad.controlFlowStages().get(1).detail()).isInstanceOf(GenericTask.class);

        SendMailTask mail = (SendMailTask) salesLoad.controlFlowStages().get(3).detail();
        assertThat(mail.to()).isEqualTo("finance@corp.local");
        assertThat(mail.subject()).isEqualTo("Sales load finished");
        assertThat(mail.messageSource()).isEqualTo("The nightly sales load completed.");
        assertThat(mail.priority()).isEqualTo("Normal");
    }

    @Test
    void parse_linksPrecedenceConstraints() {
        ControlFlowStage extract = salesLoad.controlFlowStages().get(0);
        ControlFlowStage load = salesLoad.controlFlowStages().get(1);
        ControlFlowStage notify = salesLoad.controlFlowStages().get(3);

        assertThat(extract.precedenceFrom()).isEmpty();
        assertThat(extract.precedenceTo()).containsExactly("Package\\Load Orders");
        assertThat(load.precedenceFrom()).containsExactly("Package\\Extract Orders");
        assertThat(load.hasCondition()).isFalse();
        assertThat(notify.condition()).isEqualTo("@[User::RunMode] == \"Full\"");
        assertThat(salesLoad.precedenceConstraints()).hasSize(3);
        assertThat(salesLoad.precedenceConstraints().get(2).evalOp()).isEqualTo(3);
    }

    @Test
    void parse_readsDataFlowPipeline() {
        DataFlowTask task = salesLoad.dataFlowTasks().get(0);

        assertThat(salesLoad.dataFlowTasks()).hasSize(1);
        assertThat(task.name()).isEqualTo("Load Orders");
        assertThat(task.componentsOf(ComponentCategory.SOURCE)).extracting(DataFlowComponent::name)
            .containsExactly("OLE DB Source");
        assertThat(task.componentsOf(ComponentCategory.TRANSFORM)).extracting(DataFlowComponent::name)
            .containsExactly("Add Risk Flag", "Route By Risk", "Customer Lookup");
        assertThat(task.componentsOf(ComponentCategory.DESTINATION)).extracting(DataFlowComponent::tableName)
            .containsExactly("[dbo].[FraudReview]", "[dbo].[FactOrders]", "[dbo].[UnmatchedOrders]");
        assertThat(task.paths()).hasSize(6);

        DataFlowComponent source = task.components().get(0);
        assertThat(source.hasErrorOutput()).isTrue();
        assertThat(source.connectionManager()).isEqualTo("Package.ConnectionManagers[SalesDB]");
        assertThat(source.sqlCommand()).isEqualTo("SELECT OrderId, Amount, Score FROM staging.Orders");

        DataFlowComponent derived = task.components().get(1);
        assertThat(derived.outputColumns()).singleElement()
            .satisfies(column -> assertThat(column.expression()).isEqualTo("Score > 70"));
        assertThat(derived.inputColumns()).singleElement()
            .satisfies(column -> assertThat(column.name()).isEqualTo("Score"));

        DataFlowComponent split = task.components().get(2);
        assertThat(split.conditionalOutputs()).hasSize(2);
        assertThat(split.conditionalOutputs().get(0).displayExpression()).isEqualTo("RiskFlag == TRUE");
        assertThat(split.conditionalOutputs().get(0).evaluationOrder()).isZero();
        assertThat(split.conditionalOutputs().get(1).isDefault()).isTrue();
    }

    @Test
    void parse_readsErrorHandling() {
        assertThat(salesLoad.errorHandling().maxErrorCount()).isEqualTo(3);
        assertThat(salesLoad.errorHandling().failPackageOnFailure()).isTrue();
        assertThat(salesLoad.errorHandling().loggingMode()).isEqualTo("1");
        assertThat(salesLoad.errorHandling().loggedEvents()).containsExactly("OnError", "OnWarning");
        assertThat(salesLoad.errorHandling().eventHandlers()).singleElement().satisfies(handler -> {
            assertThat(handler.eventName()).isEqualTo("OnError");
            assertThat(handler.tasks()).singleElement().isInstanceOf(SendMailTask.class);
        });
    }

    @Test
    void parse_minesDatabaseObjects() {
        assertThat(salesLoad.databaseObjects())
            .filteredOn(object -> object.type() == DatabaseObjectType.TABLE)
            .extracting(DatabaseObject::qualifiedName)
            .containsExactly(
                "dbo.FraudReview", "dbo.FactOrders", "dbo.UnmatchedOrders",
                "dbo.Orders", "staging.Orders", "dbo.Customers");
        assertThat(salesLoad.databaseObjects())
            .filteredOn(object -> object.qualifiedName().equals("staging.Orders"))
            .extracting(DatabaseObject::usage)
            .containsExactly("Task");
        assertThat(salesLoad.databaseObjects())
            .filteredOn(object -> object.type() == DatabaseObjectType.STORED_PROCEDURE)
            .extracting(DatabaseObject::name)
            .containsExactly("usp_CleanupStaging");
        assertThat(salesLoad.databaseObjects())
            .filteredOn(object -> object.type() == DatabaseObjectType.FUNCTION)
            .extracting(DatabaseObject::name)
            .containsExactly("fn_IsActive");
        assertThat(salesLoad.databaseObjects().get(0).database()).isEqualTo("Sales");
    }

    @Test
    void parse_detectsThresholdsAndAlerts() {
        assertThat(salesLoad.thresholds())
            .extracting(Threshold::name, Threshold::category)
            .containsExactly(
                tuple("FraudScoreThreshold", "General"),
                tuple("MaxBatchSize", "Performance"));

        assertThat(salesLoad.alerts())
            .extracting(Alert::name, Alert::alertType, Alert::priority, Alert::category, Alert::recipients)
            .containsExactly(
                tuple("Alert On Failure", "OnError", "High", "Error", "oncall@corp.local"),
                tuple("Notify Finance", "Completion", "Normal", "Notification", "finance@corp.local"));
        assertThat(salesLoad.alerts().get(1).condition()).isEqualTo("@[User::RunMode] == \"Full\"");
    }

    @Test
    void parse_fromFile_matchesStreamParse() throws Exception {
        // Given
        Path file = Files.writeString(tempDir.resolve("SalesLoad.dtsx"), PackageFixtures.salesLoadXml());

        // When
        DtsxPackage parsed = new DtsxPackageParser().parse(file);

        // Then
        assertThat(parsed).isEqualTo(salesLoad);
    }

    @Test
    void parseString_withEmptyPackage_returnsEmptySections() {
        // When
        DtsxPackage parsed = new DtsxPackageParser().parseString(PackageFixtures.packageXml("Empty", ""));

        // Then
        assertThat(parsed.metadata().name()).isEqualTo("Empty");
        assertThat(parsed.connectionManagers()).isEmpty();
        assertThat(parsed.controlFlowStages()).isEmpty();
        assertThat(parsed.dataFlowTasks()).isEmpty();
        assertThat(parsed.databaseObjects()).isEmpty();
        assertThat(parsed.errorHandling().eventHandlers()).isEmpty();
        assertThat(parsed.errorHandling().maxErrorCount()).isEqualTo(1);
    }

    @Test
    void parseString_withUndeclaredPrefix_stillReadsPackageName() {
        // When
        DtsxPackage parsed = new DtsxPackageParser().parseString(
            "<DTS:Executable DTS:ObjectName=\"NoNamespace\">"
                + "<DTS:Variables><DTS:Variable DTS:ObjectName=\"BatchLimit\" DTS:Namespace=\"User\">"
                + "<DTS:VariableValue DTS:DataType=\"3\">10</DTS:VariableValue>"
                + "</DTS:Variable></DTS:Variables></DTS:Executable>");

        // Then
        assertThat(parsed.metadata().name()).isEqualTo("NoNamespace");
        assertThat(parsed.variables()).singleElement()
            .satisfies(variable -> assertThat(variable.value()).isEqualTo("10"));
        assertThat(parsed.thresholds()).singleElement()
            .satisfies(threshold -> assertThat(threshold.category()).isEqualTo("General"));
    }

    @Test
    void parse_withCustomNamespace_resolvesRenamedPrefix() {
        // Given
        XmlNamespace custom = new XmlNamespace("urn:custom-dts", "C");
        DtsxPackageParser parser = new DtsxPackageParser(new DtsxNamespaces(
            custom, DtsxNamespaces.SQL_TASK, DtsxNamespaces.SEND_MAIL_TASK));

        // When
        DtsxPackage parsed = parser.parseString("<C:Executable xmlns:C=\"urn:custom-dts\" C:ObjectName=\"Custom\"/>");

        // Then
        assertThat(parsed.metadata().name()).isEqualTo("Custom");
    }

    @Test
    void parseString_withMalformedXml_throwsParseException() {
        assertThatThrownBy(() -> new DtsxPackageParser().parseString("<DTS:Executable"))
            .isInstanceOf(DtsxParseException.class);
    }
}
