package im.arun.outline.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Placement hints for the external layout pass. The converter only forwards them.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LayoutHints {

    @JsonProperty("start_x")
    private Double startX;

    @JsonProperty("start_y")
    private Double startY;

    @JsonProperty("horizontal_spacing")
    private Double horizontalSpacing;

    @JsonProperty("vertical_spacing")
    private Double verticalSpacing;
}
