package com.dtsxarchitect.core.config;

import com.dtsxarchitect.core.generator.GeneratorConfig;
import com.dtsxarchitect.core.parser.DtsxNamespaces;
import com.dtsxarchitect.core.parser.XmlNamespace;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Root configuration for dtsx-architect.
 *
 * <p>Loaded from {@code dtsx-architect.yaml}. Every section is optional; absent
 * sections and absent values fall back to {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * parser:
 *   namespaces:
 *     dts:
 *       uri: "www.microsoft.com/SqlServer/Dts"
 *       prefix: "DTS"
 *
 * diagrams:
 *   direction: LR
 *   includeStyling: false
 *   maxDerivedColumns: 5
 *
 * report:
 *   defaultFormat: markdown
 *   outputDirectory: "./reports"
 * }</pre>
 *
 * @param parser parser settings
 * @param diagrams diagram settings
 * @param report report settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalyzerConfig(
    @JsonProperty("parser") ParserSettings parser,
    @JsonProperty("diagrams") DiagramSettings diagrams,
    @JsonProperty("report") ReportSettings report
) {
    public static final String DEFAULT_FILE_NAME = "dtsx-architect.yaml";

    /**
     * Compact constructor replacing absent sections with their defaults.
     */
    public AnalyzerConfig {
        if (parser == null) {
            parser = ParserSettings.defaults();
        }
        if (diagrams == null) {
            diagrams = DiagramSettings.defaults();
        }
        if (report == null) {
            report = ReportSettings.defaults();
        }
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static AnalyzerConfig defaults() {
        return new AnalyzerConfig(null, null, null);
    }

    /**
     * Maps the diagram section onto the generator configuration.
     *
     * @return generator configuration
     */
    public GeneratorConfig toGeneratorConfig() {
        return diagrams.toGeneratorConfig();
    }

    /**
     * Maps the namespace section onto the parser's namespace table.
     *
     * @return namespaces, with defaults for unset entries
     */
    public DtsxNamespaces toNamespaces() {
        return parser.namespaces().toNamespaces();
    }

    /**
     * Parser settings.
     *
     * @param namespaces attribute namespace URIs and prefixes
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ParserSettings(
        @JsonProperty("namespaces") NamespaceSettings namespaces
    ) {
        public ParserSettings {
            if (namespaces == null) {
                namespaces = new NamespaceSettings(null, null, null);
            }
        }

        public static ParserSettings defaults() {
            return new ParserSettings(null);
        }
    }

    /**
     * Namespaces for the three attribute families.
     *
     * @param dts core package namespace
     * @param sqlTask Execute-SQL task namespace
     * @param sendMailTask Send-Mail task namespace
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NamespaceSettings(
        @JsonProperty("dts") NamespaceEntry dts,
        @JsonProperty("sqlTask") NamespaceEntry sqlTask,
        @JsonProperty("sendMailTask") NamespaceEntry sendMailTask
    ) {
        public DtsxNamespaces toNamespaces() {
            return new DtsxNamespaces(
                NamespaceEntry.resolve(dts, DtsxNamespaces.DTS),
                NamespaceEntry.resolve(sqlTask, DtsxNamespaces.SQL_TASK),
                NamespaceEntry.resolve(sendMailTask, DtsxNamespaces.SEND_MAIL_TASK));
        }
    }

    /**
     * A single namespace; either field may be omitted.
     *
     * @param uri namespace URI
     * @param prefix conventional prefix
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NamespaceEntry(
        @JsonProperty("uri") String uri,
        @JsonProperty("prefix") String prefix
    ) {
        static XmlNamespace resolve(NamespaceEntry entry, XmlNamespace fallback) {
            if (entry == null) {
                return fallback;
            }
            String uri = isBlank(entry.uri()) ? fallback.uri() : entry.uri();
            String prefix = isBlank(entry.prefix()) ? fallback.prefix() : entry.prefix();
            return new XmlNamespace(uri, prefix);
        }
    }

    /**
     * Diagram settings. Unset values take the generator defaults.
     *
     * @param direction flowchart direction
     * @param includeStyling whether flowcharts carry the styling block
     * @param maxDerivedColumns derived columns listed per transform
     * @param expressionPreviewLength expression preview length
     * @param sqlPreviewLength SQL preview length
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DiagramSettings(
        @JsonProperty("direction") String direction,
        @JsonProperty("includeStyling") Boolean includeStyling,
        @JsonProperty("maxDerivedColumns") Integer maxDerivedColumns,
        @JsonProperty("expressionPreviewLength") Integer expressionPreviewLength,
        @JsonProperty("sqlPreviewLength") Integer sqlPreviewLength
    ) {
        public static DiagramSettings defaults() {
            return new DiagramSettings(null, null, null, null, null);
        }

        public GeneratorConfig toGeneratorConfig() {
            return new GeneratorConfig(
                isBlank(direction) ? GeneratorConfig.DEFAULT_DIRECTION : direction.trim().toUpperCase(),
                includeStyling == null || includeStyling,
                maxDerivedColumns == null ? GeneratorConfig.DEFAULT_MAX_DERIVED_COLUMNS : maxDerivedColumns,
                expressionPreviewLength == null
                    ? GeneratorConfig.DEFAULT_EXPRESSION_PREVIEW_LENGTH : expressionPreviewLength,
                sqlPreviewLength == null ? GeneratorConfig.DEFAULT_SQL_PREVIEW_LENGTH : sqlPreviewLength);
        }
    }

    /**
     * Report settings.
     *
     * @param defaultFormat format used when none is requested
     * @param outputDirectory directory for written reports
     * @param formats formats written by "all formats" runs
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ReportSettings(
        @JsonProperty("defaultFormat") String defaultFormat,
        @JsonProperty("outputDirectory") String outputDirectory,
        @JsonProperty("formats") List<String> formats
    ) {
        public static final String DEFAULT_FORMAT = "text";
        public static final String DEFAULT_OUTPUT_DIRECTORY = "./reports";
        public static final List<String> DEFAULT_FORMATS = List.of("text", "markdown", "json");

        public ReportSettings {
            if (isBlank(defaultFormat)) {
                defaultFormat = DEFAULT_FORMAT;
            }
            if (isBlank(outputDirectory)) {
                outputDirectory = DEFAULT_OUTPUT_DIRECTORY;
            }
            formats = formats == null || formats.isEmpty() ? DEFAULT_FORMATS : List.copyOf(formats);
        }

        public static ReportSettings defaults() {
            return new ReportSettings(null, null, null);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
