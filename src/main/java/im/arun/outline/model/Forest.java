package im.arun.outline.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered sequence of root nodes for one document, plus document-level facts
 * recorded while parsing.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Forest {

    @JsonProperty("roots")
    private List<Node> roots = new ArrayList<>();

    @JsonProperty("line_ending")
    private String lineEnding;

    @JsonProperty("heading_level_by_text")
    private Map<String, Integer> headingLevelByText = new LinkedHashMap<>();

    @JsonProperty("layout_hints")
    private LayoutHints layoutHints;

    public Forest(List<Node> roots) {
        this.roots = roots;
    }

    /**
     * Same document facts, different roots. Used by the mutators, which never touch the receiver.
     */
    public Forest withRoots(List<Node> newRoots) {
        return new Forest(newRoots, lineEnding, headingLevelByText, layoutHints);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return roots == null || roots.isEmpty();
    }
}
