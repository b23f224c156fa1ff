package im.arun.outline.lexer;

import im.arun.outline.model.StructureElement;
import im.arun.outline.model.StructureKind;
import im.arun.outline.util.TraceLog;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StructureLexer")
class StructureLexerTest {

    private final StructureLexer lexer = new StructureLexer();

    @Test
    @DisplayName("Recognizes headings and nested bullets")
    void headingsAndBullets() {
        List<StructureElement> elements = lexer.lex("# Title\n- item\n  - sub").getElements();

        assertThat(elements).hasSize(3);
        assertThat(elements.get(0).getKind()).isEqualTo(StructureKind.HEADING);
        assertThat(elements.get(0).getLevel()).isEqualTo(1);
        assertThat(elements.get(0).getText()).isEqualTo("Title");
        assertThat(elements.get(0).getOriginalMarker()).isEqualTo("#");

        assertThat(elements.get(1).getKind()).isEqualTo(StructureKind.UNORDERED_LIST);
        assertThat(elements.get(1).getLevel()).isEqualTo(1);
        assertThat(elements.get(1).getIndentSpaces()).isEqualTo(0);

        assertThat(elements.get(2).getLevel()).isEqualTo(2);
        assertThat(elements.get(2).getIndentSpaces()).isEqualTo(2);
        assertThat(elements.get(2).getSourceLine()).isEqualTo(2);
    }

    @Test
    @DisplayName("Keeps the numbered marker as written")
    void orderedItems() {
        StructureElement item = lexer.lex("3. third").getElements().get(0);

        assertThat(item.getKind()).isEqualTo(StructureKind.ORDERED_LIST);
        assertThat(item.getOriginalMarker()).isEqualTo("3.");
        assertThat(item.getText()).isEqualTo("third");
    }

    @Test
    @DisplayName("Reads checkbox state from bulleted items")
    void checkboxes() {
        List<StructureElement> elements = lexer.lex("- [x] done\n- [ ] todo\n- plain").getElements();

        assertThat(elements.get(0).isCheckbox()).isTrue();
        assertThat(elements.get(0).isChecked()).isTrue();
        assertThat(elements.get(0).getText()).isEqualTo("done");
        assertThat(elements.get(1).isCheckbox()).isTrue();
        assertThat(elements.get(1).isChecked()).isFalse();
        assertThat(elements.get(2).isCheckbox()).isFalse();
    }

    @Test
    @DisplayName("Collects lines before the first element into a preface")
    void preface() {
        List<StructureElement> elements = lexer.lex("intro\nmore\n# A").getElements();

        assertThat(elements).hasSize(2);
        assertThat(elements.get(0).getKind()).isEqualTo(StructureKind.PREFACE);
        assertThat(elements.get(0).getText()).isEqualTo("intro\nmore");
        assertThat(elements.get(0).getSourceLine()).isEqualTo(0);
        assertThat(elements.get(1).getSourceLine()).isEqualTo(2);
    }

    @Test
    @DisplayName("Attaches following content lines verbatim")
    void trailingContent() {
        List<StructureElement> elements = lexer.lex("# A\nbody\n\n# B").getElements();

        assertThat(elements.get(0).getTrailingContent()).isEqualTo("body\n");
        assertThat(elements.get(1).getTrailingContent()).isNull();
    }

    @Test
    @DisplayName("Does not treat malformed markers as structure")
    void malformedMarkers() {
        LexResult result = lexer.lex("#NoSpace\n-   \n#######seven\n-dash\n#\tTabbed");

        assertThat(result.structuralCount()).isZero();
        assertThat(result.getElements()).hasSize(1);
        assertThat(result.getElements().get(0).getKind()).isEqualTo(StructureKind.PREFACE);
    }

    @Test
    @DisplayName("Produces nothing for empty text")
    void emptyText() {
        LexResult result = lexer.lex("");

        assertThat(result.structuralCount()).isZero();
        assertThat(result.getLineEnding()).isEqualTo("\n");
    }

    @Test
    @DisplayName("Detects CRLF documents and joins content with CRLF")
    void crlf() {
        LexResult result = lexer.lex("# A\r\nline one\r\nline two\r\n- b\r\n");

        assertThat(result.getLineEnding()).isEqualTo("\r\n");
        assertThat(result.getElements().get(0).getTrailingContent()).isEqualTo("line one\r\nline two");
        assertThat(result.getElements().get(1).getTrailingContent()).isEqualTo("");
    }

    @Test
    @DisplayName("Records lexing in the trace")
    void traces() {
        TraceLog trace = new TraceLog("test");
        lexer.lex("# A", trace);

        assertThat(trace.getEntries()).hasSize(1);
        assertThat(trace.getEntries().get(0)).containsEntry("structural", 1L);
    }
}
