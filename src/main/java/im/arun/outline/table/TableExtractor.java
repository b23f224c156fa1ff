package im.arun.outline.table;

import im.arun.outline.lexer.LineEndings;
import im.arun.outline.model.TableData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Locates GFM-style pipe tables inside free text.
 * A malformed or partial table is not an error: the text is simply reported as table-free.
 */
public class TableExtractor {
    private static final Logger logger = LoggerFactory.getLogger(TableExtractor.class);
    private static final Pattern SEPARATOR_CELL = Pattern.compile("^:?-{3,}:?$");
    private static final int DEFAULT_MAX_TABLES = 32;

    /**
     * Extract the first table of {@code text}, joining segments with {@code lineEnding}.
     */
    public Optional<TableExtract> extractFirstTable(String text, String lineEnding) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }

        String eol = lineEnding != null ? lineEnding : LineEndings.DEFAULT;
        List<String> lines = LineEndings.splitLines(text);

        for (int i = 0; i < lines.size() - 1; i++) {
            String headerLine = lines.get(i);
            String separatorLine = lines.get(i + 1);

            if (!headerLine.contains("|") || !isTableSeparator(separatorLine)) {
                continue;
            }

            // Data rows: every following contiguous line with a pipe
            int j = i + 2;
            List<String> rowLines = new ArrayList<>();
            while (j < lines.size() && lines.get(j).contains("|")) {
                rowLines.add(lines.get(j));
                j++;
            }

            List<String> headers = toCells(headerLine);
            List<List<String>> rows = rowLines.stream()
                .map(TableExtractor::toCells)
                .collect(Collectors.toList());

            // No trimming anywhere: surrounding whitespace must survive a round trip
            String before = i > 0 ? String.join(eol, lines.subList(0, i)) : null;
            String tableBlock = String.join(eol, lines.subList(i, j));
            String after = j < lines.size() ? String.join(eol, lines.subList(j, lines.size())) : null;

            logger.debug("Found table at line {} with {} data rows", i, rows.size());
            return Optional.of(new TableExtract(headers, rows, before, tableBlock, after));
        }

        return Optional.empty();
    }

    /**
     * Extract every table by repeatedly scanning the remainder after the previous one.
     */
    public List<TableExtract> extractAllTables(String text, String lineEnding) {
        return extractAllTables(text, lineEnding, DEFAULT_MAX_TABLES);
    }

    public List<TableExtract> extractAllTables(String text, String lineEnding, int maxTables) {
        List<TableExtract> tables = new ArrayList<>();
        String remaining = text;

        while (remaining != null && !remaining.isEmpty() && tables.size() < maxTables) {
            Optional<TableExtract> table = extractFirstTable(remaining, lineEnding);
            if (table.isEmpty()) {
                break;
            }
            tables.add(table.get());
            remaining = table.get().getAfter();
        }

        if (tables.size() >= maxTables) {
            logger.warn("Stopped table extraction after {} tables", maxTables);
        }
        return tables;
    }

    /**
     * Parse headers and rows of the first table in {@code text}.
     */
    public Optional<TableData> parseTable(String text) {
        return extractFirstTable(text, LineEndings.DEFAULT)
            .map(extract -> TableData.builder()
                .headers(extract.getHeaders())
                .rows(extract.getRows())
                .build());
    }

    static boolean isTableSeparator(String line) {
        if (!line.contains("|")) {
            return false;
        }
        List<String> parts = toCells(line);
        return !parts.isEmpty() && parts.stream().allMatch(cell -> SEPARATOR_CELL.matcher(cell).matches());
    }

    static List<String> toCells(String line) {
        String inner = line.trim().replaceFirst("^\\|", "").replaceFirst("\\|$", "");
        return Arrays.stream(inner.split("\\|", -1))
            .map(String::trim)
            .collect(Collectors.toList());
    }
}
