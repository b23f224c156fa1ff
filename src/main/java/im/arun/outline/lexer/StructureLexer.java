package im.arun.outline.lexer;

import im.arun.outline.model.StructureElement;
import im.arun.outline.model.StructureKind;
import im.arun.outline.util.TraceLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Single-pass line scanner turning a document into a flat list of structural elements.
 * <p>
 * Recognized: ATX headings ({@code #} to {@code ######}), bulleted items ({@code - * +}),
 * numbered items ({@code 1.}) with optional leading spaces, and {@code [ ]}/{@code [x]}
 * checkboxes on bulleted items. Every other line is raw content that belongs to the
 * element above it, or to the preface when no element has been seen yet.
 */
public class StructureLexer {
    private static final Logger logger = LoggerFactory.getLogger(StructureLexer.class);

    private static final Pattern HEADING = Pattern.compile("^(#{1,6}) +(.+)$");
    private static final Pattern LIST_ITEM = Pattern.compile("^(\\s*)([-*+]|\\d+\\.)\\s+(.+)$");
    private static final Pattern ORDERED_MARKER = Pattern.compile("^\\d+\\.$");
    private static final Pattern CHECKBOX = Pattern.compile("^\\[([ xX])\\](?:\\s+(.*))?$");

    private enum State {
        SEEKING_FIRST_ELEMENT,
        INSIDE_ELEMENT
    }

    public LexResult lex(String text) {
        return lex(text, null);
    }

    public LexResult lex(String text, TraceLog trace) {
        String source = text != null ? text : "";
        String lineEnding = LineEndings.detect(source);
        List<String> lines = LineEndings.splitLines(source);

        List<StructureElement> elements = new ArrayList<>();
        List<String> prefaceLines = new ArrayList<>();
        List<String> trailingLines = new ArrayList<>();
        StructureElement.StructureElementBuilder current = null;
        State state = State.SEEKING_FIRST_ELEMENT;

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            StructureElement.StructureElementBuilder recognized = recognize(line, i);

            if (recognized == null) {
                if (state == State.SEEKING_FIRST_ELEMENT) {
                    prefaceLines.add(line);
                } else {
                    trailingLines.add(line);
                }
                continue;
            }

            if (state == State.SEEKING_FIRST_ELEMENT) {
                addPreface(elements, prefaceLines, lineEnding);
                state = State.INSIDE_ELEMENT;
            } else {
                elements.add(finish(current, trailingLines, lineEnding));
            }
            current = recognized;
            trailingLines = new ArrayList<>();
        }

        if (state == State.SEEKING_FIRST_ELEMENT) {
            addPreface(elements, prefaceLines, lineEnding);
        } else {
            elements.add(finish(current, trailingLines, lineEnding));
        }

        LexResult result = new LexResult(elements, lineEnding, lines.size());
        logger.debug("Lexed {} lines into {} elements", lines.size(), elements.size());
        TraceLog.info(trace, "Extracted structure elements", Map.of(
            "lines", lines.size(),
            "elements", elements.size(),
            "structural", result.structuralCount()
        ));
        return result;
    }

    /**
     * Builder for the element starting on {@code line}, or null for a content line.
     */
    private StructureElement.StructureElementBuilder recognize(String line, int lineNumber) {
        Matcher heading = HEADING.matcher(line);
        if (heading.matches()) {
            String text = heading.group(2).trim();
            if (!text.isEmpty()) {
                String marker = heading.group(1);
                return StructureElement.builder()
                    .kind(StructureKind.HEADING)
                    .level(marker.length())
                    .text(text)
                    .originalMarker(marker)
                    .sourceLine(lineNumber);
            }
        }

        Matcher item = LIST_ITEM.matcher(line);
        if (item.matches()) {
            String text = item.group(3).trim();
            if (text.isEmpty()) {
                return null;
            }
            String indent = item.group(1);
            String marker = item.group(2);
            boolean ordered = ORDERED_MARKER.matcher(marker).matches();

            StructureElement.StructureElementBuilder builder = StructureElement.builder()
                .kind(ordered ? StructureKind.ORDERED_LIST : StructureKind.UNORDERED_LIST)
                .level(indent.length() / 2 + 1)
                .originalMarker(marker)
                .indentSpaces(indent.length())
                .sourceLine(lineNumber);

            if (!ordered) {
                Matcher checkbox = CHECKBOX.matcher(text);
                if (checkbox.matches()) {
                    String rest = checkbox.group(2);
                    return builder
                        .checkbox(true)
                        .checked(!" ".equals(checkbox.group(1)))
                        .text(rest != null ? rest.trim() : "");
                }
            }
            return builder.text(text);
        }

        return null;
    }

    private void addPreface(List<StructureElement> elements, List<String> prefaceLines, String lineEnding) {
        if (prefaceLines.isEmpty()) {
            return;
        }
        elements.add(StructureElement.builder()
            .kind(StructureKind.PREFACE)
            .level(0)
            .text(String.join(lineEnding, prefaceLines))
            .originalMarker("")
            .sourceLine(0)
            .build());
    }

    private StructureElement finish(StructureElement.StructureElementBuilder current,
                                    List<String> trailingLines,
                                    String lineEnding) {
        String trailing = trailingLines.isEmpty() ? null : String.join(lineEnding, trailingLines);
        return current.trailingContent(trailing).build();
    }
}
