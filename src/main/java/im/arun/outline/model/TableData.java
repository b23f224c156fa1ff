package im.arun.outline.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Parsed cells of a pipe table held by a table node.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TableData {

    @JsonProperty("headers")
    List<String> headers;

    @JsonProperty("rows")
    List<List<String>> rows;
}
