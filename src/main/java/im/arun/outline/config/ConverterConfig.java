package im.arun.outline.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConverterConfig {
    @JsonProperty("auto_collapse_depth")
    private int autoCollapseDepth = 2;

    @JsonProperty("auto_collapse_threshold")
    private int autoCollapseThreshold = 30;

    @JsonProperty("max_nesting_depth")
    private int maxNestingDepth = 64;

    @JsonProperty("max_tree_depth")
    private int maxTreeDepth = 256;

    @JsonProperty("max_tables_per_note")
    private int maxTablesPerNote = 32;

    @JsonProperty("new_node_offset")
    private double newNodeOffset = 28;

    @JsonProperty("default_font_size")
    private int defaultFontSize = 14;

    @JsonProperty("default_font_weight")
    private String defaultFontWeight = "normal";
}
