package com.funcplan.config;

import com.funcplan.export.SvgGraphExporter;
import com.funcplan.plan.UnsupportedPolicy;
import com.funcplan.syntax.JdtSourceParser;
import com.funcplan.syntax.LabelText;
import com.google.gson.annotations.SerializedName;

/**
 * Deserialized form of the optional JSON config file. Every field is optional; getters supply defaults.
 */
public class ToolConfig {

    /** Directory for plan.json and friends (default: current directory). */
    @SerializedName("output_dir")
    private String outputDir;

    /** {@code placeholder} (default) or {@code abort}. */
    @SerializedName("unsupported_policy")
    private String unsupportedPolicy;

    @SerializedName("label_max_length")
    private Integer labelMaxLength;

    @SerializedName("max_source_chars")
    private Integer maxSourceChars;

    /** Path or name of the Graphviz executable used for SVG export. */
    @SerializedName("dot_executable")
    private String dotExecutable;

    @SerializedName("export_timeout_seconds")
    private Integer exportTimeoutSeconds;

    /** Caption for HTML and SVG output (default: the function signature). */
    @SerializedName("html_title")
    private String htmlTitle;

    public static ToolConfig defaults() {
        return new ToolConfig();
    }

    public String getOutputDir()   { return outputDir != null ? outputDir : "."; }
    public UnsupportedPolicy getUnsupportedPolicy() { return UnsupportedPolicy.parse(unsupportedPolicy); }
    public int getLabelMaxLength() { return labelMaxLength != null ? labelMaxLength : LabelText.DEFAULT_MAX_LENGTH; }
    public int getMaxSourceChars() {
        return maxSourceChars != null ? maxSourceChars : JdtSourceParser.DEFAULT_MAX_SOURCE_CHARS;
    }
    public String getDotExecutable() {
        return dotExecutable != null ? dotExecutable : SvgGraphExporter.DEFAULT_DOT_EXECUTABLE;
    }
    public long getExportTimeoutSeconds() {
        return exportTimeoutSeconds != null ? exportTimeoutSeconds : SvgGraphExporter.DEFAULT_TIMEOUT_SECONDS;
    }
    public String getHtmlTitle()   { return htmlTitle; }
}
