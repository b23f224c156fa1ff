package im.arun.outline.table;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * First pipe table found in a text block, with the exact text around it.
 * {@code before} is null when the table starts on the first line,
 * {@code after} is null when the table runs to the last line.
 */
@Data
@AllArgsConstructor
public class TableExtract {
    private List<String> headers;
    private List<List<String>> rows;
    private String before;
    private String tableBlock;
    private String after;
}
