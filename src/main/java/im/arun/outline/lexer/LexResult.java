package im.arun.outline.lexer;

import im.arun.outline.model.StructureElement;
import im.arun.outline.model.StructureKind;
import lombok.Value;

import java.util.List;

/**
 * Lexer output: elements in document order plus the document's dominant line ending.
 */
@Value
public class LexResult {
    List<StructureElement> elements;
    String lineEnding;
    int lineCount;

    public long structuralCount() {
        return elements.stream()
            .filter(e -> e.getKind() != StructureKind.PREFACE)
            .count();
    }
}
