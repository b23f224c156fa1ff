package im.arun.outline.mutation;

import im.arun.outline.error.ConversionError;
import im.arun.outline.error.ConversionException;
import im.arun.outline.model.Forest;
import im.arun.outline.model.Node;
import im.arun.outline.model.StructureKind;
import im.arun.outline.serialize.OutlineSerializer;
import im.arun.outline.service.OutlineConverterService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

@DisplayName("StructuralMutator")
class StructuralMutatorTest {

    private final OutlineConverterService service = new OutlineConverterService();
    private final StructuralMutator mutator = new StructuralMutator();
    private final OutlineSerializer serializer = new OutlineSerializer();

    private Forest parse(String text) throws Exception {
        return service.parse(text);
    }

    private static Node root(Forest forest, int index) {
        return forest.getRoots().get(index);
    }

    @Test
    @DisplayName("Refuses to turn a heading with sub-headings into a list item")
    void illegalDescendant() throws Exception {
        Forest forest = parse("# A\n## B\n- item");
        String before = serializer.serialize(forest);
        Node a = root(forest, 0);
        Node b = a.getChildren().get(0);

        ConversionException e = catchThrowableOfType(
            () -> mutator.changeNodeType(forest, a.getId(), StructureKind.UNORDERED_LIST),
            ConversionException.class);

        assertThat(e.getError()).isEqualTo(ConversionError.ILLEGAL_DESCENDANT);
        assertThat(e.getNodeId()).isEqualTo(a.getId());
        assertThat(e.getOffendingNodeId()).isEqualTo(b.getId());
        assertThat(serializer.serialize(forest)).isEqualTo(before);
        assertThat(a.isHeadingNode()).isTrue();
    }

    @Test
    @DisplayName("Refuses a list item after a heading sibling")
    void illegalSiblingToList() throws Exception {
        Forest forest = parse("# A\n# B");

        ConversionException e = catchThrowableOfType(
            () -> mutator.changeNodeType(forest, root(forest, 1).getId(), StructureKind.UNORDERED_LIST),
            ConversionException.class);

        assertThat(e.getError()).isEqualTo(ConversionError.ILLEGAL_SIBLING);
        assertThat(e.getOffendingNodeId()).isEqualTo(root(forest, 0).getId());
    }

    @Test
    @DisplayName("Refuses a heading followed by list siblings")
    void illegalSiblingToHeading() throws Exception {
        Forest forest = parse("# A\n- x\n- y");
        Node x = root(forest, 0).getChildren().get(0);

        assertThatThrownBy(() -> mutator.changeNodeType(forest, x.getId(), StructureKind.HEADING))
            .isInstanceOf(ConversionException.class)
            .extracting(t -> ((ConversionException) t).getError())
            .isEqualTo(ConversionError.ILLEGAL_SIBLING);
    }

    @Test
    @DisplayName("Refuses a heading inside a list item")
    void illegalParent() throws Exception {
        Forest forest = parse("- a\n  - b");
        Node b = root(forest, 0).getChildren().get(0);

        ConversionException e = catchThrowableOfType(
            () -> mutator.changeNodeType(forest, b.getId(), StructureKind.HEADING),
            ConversionException.class);

        assertThat(e.getError()).isEqualTo(ConversionError.ILLEGAL_PARENT);
        assertThat(e.getOffendingNodeId()).isEqualTo(root(forest, 0).getId());
    }

    @Test
    @DisplayName("Reports unknown ids and unsupported nodes")
    void unknownAndUnsupported() throws Exception {
        Forest forest = parse("Intro\n# A\n| k |\n|---|");

        ConversionException missing = catchThrowableOfType(
            () -> mutator.changeNodeType(forest, "nope", StructureKind.HEADING),
            ConversionException.class);
        assertThat(missing.getError()).isEqualTo(ConversionError.NODE_NOT_FOUND);

        Node preface = root(forest, 0);
        Node table = root(forest, 2);
        assertThat(table.isTableNode()).isTrue();
        for (Node node : List.of(preface, table)) {
            ConversionException e = catchThrowableOfType(
                () -> mutator.changeNodeType(forest, node.getId(), StructureKind.UNORDERED_LIST),
                ConversionException.class);
            assertThat(e.getError()).isEqualTo(ConversionError.UNSUPPORTED_NODE);
        }
    }

    @Test
    @DisplayName("Turns the last list item into a sub-heading")
    void listToHeading() throws Exception {
        Forest forest = parse("# A\n- x\n- y");
        Node y = root(forest, 0).getChildren().get(1);

        Forest result = mutator.changeNodeType(forest, y.getId(), StructureKind.HEADING);

        Node converted = root(result, 0).getChildren().get(1);
        assertThat(converted.getId()).isEqualTo(y.getId());
        assertThat(converted.getStructuralMeta().getKind()).isEqualTo(StructureKind.HEADING);
        assertThat(converted.getStructuralMeta().getLevel()).isEqualTo(2);
        assertThat(serializer.serialize(result)).isEqualTo("# A\n- x\n## y");
        assertThat(y.isListNode()).isTrue();
    }

    @Test
    @DisplayName("Turns a bullet into a numbered item")
    void bulletToNumbered() throws Exception {
        Forest forest = parse("- a\n- b");

        Forest result = mutator.changeNodeType(forest, root(forest, 0).getId(), StructureKind.ORDERED_LIST);

        assertThat(root(result, 0).getStructuralMeta().getOriginalMarker()).isEqualTo("1.");
        assertThat(serializer.serialize(result)).isEqualTo("1. a\n- b");
    }

    @Test
    @DisplayName("Turns a leading heading into a list item and re-indents its items")
    void headingToList() throws Exception {
        Forest forest = parse("# A\n- x\n# B");

        Forest result = mutator.changeNodeType(forest, root(forest, 0).getId(), StructureKind.UNORDERED_LIST);

        assertThat(serializer.serialize(result)).isEqualTo("- A\n  - x\n# B");
    }

    @Test
    @DisplayName("Strips typed markers from nodes created without structure")
    void retypesBareNode() throws Exception {
        Node bare = new Node();
        bare.setId("bare");
        bare.setText("- typed by hand");
        Forest forest = new Forest(new ArrayList<>(List.of(bare)));

        Forest result = mutator.changeNodeType(forest, "bare", StructureKind.HEADING);

        assertThat(root(result, 0).getText()).isEqualTo("typed by hand");
        assertThat(root(result, 0).getStructuralMeta().getLevel()).isEqualTo(1);
    }

    @Test
    @DisplayName("Switches list style and drops checkboxes on numbered items")
    void listStyle() throws Exception {
        Forest forest = parse("- [x] a\n# H");

        Forest ordered = mutator.changeListStyle(forest, root(forest, 0).getId(), ListStyle.ORDERED);
        Forest heading = mutator.changeListStyle(forest, root(forest, 1).getId(), ListStyle.ORDERED);

        assertThat(serializer.serialize(ordered)).isEqualTo("1. a\n# H");
        assertThat(root(heading, 1).getStructuralMeta().getKind()).isEqualTo(StructureKind.HEADING);
    }

    @Test
    @DisplayName("Keeps heading levels between 1 and 6")
    void headingIndentClamped() throws Exception {
        Forest forest = parse("# Top\n\n###### Deepest");
        Node top = root(forest, 0);
        Node deepest = top.getChildren().get(0);

        Forest shallower = mutator.changeIndent(forest, top.getId(), IndentDirection.DECREASE);
        Forest deeper = mutator.changeIndent(forest, deepest.getId(), IndentDirection.INCREASE);
        Forest moved = mutator.changeIndent(forest, top.getId(), IndentDirection.INCREASE);

        assertThat(root(shallower, 0).getStructuralMeta().getLevel()).isEqualTo(1);
        assertThat(root(deeper, 0).getChildren().get(0).getStructuralMeta().getLevel()).isEqualTo(6);
        assertThat(root(moved, 0).getStructuralMeta().getLevel()).isEqualTo(2);
        assertThat(root(moved, 0).getStructuralMeta().getOriginalMarker()).isEqualTo("##");
    }

    @Test
    @DisplayName("Moves list items by two spaces and never below zero")
    void listIndent() throws Exception {
        Forest forest = parse("- a\n- b\n  - c");
        Node b = root(forest, 1);

        Forest deeper = mutator.changeIndent(forest, b.getId(), IndentDirection.INCREASE);
        Forest shallower = mutator.changeIndent(forest, root(forest, 0).getId(), IndentDirection.DECREASE);

        Node movedB = root(deeper, 1);
        assertThat(movedB.getStructuralMeta().getIndentSpaces()).isEqualTo(2);
        assertThat(movedB.getStructuralMeta().getLevel()).isEqualTo(2);
        assertThat(movedB.getChildren().get(0).getStructuralMeta().getIndentSpaces()).isEqualTo(4);
        assertThat(root(shallower, 0).getStructuralMeta().getIndentSpaces()).isEqualTo(0);
        assertThat(root(shallower, 0).getStructuralMeta().getLevel()).isEqualTo(1);
    }

    @Test
    @DisplayName("Numbers each run of numbered siblings from one")
    void renumbers() throws Exception {
        Forest forest = parse("1. a\n1. b\n- c\n7. d\n   1. nested\n   5. nested2");

        Forest result = mutator.renumberOrderedLists(forest);

        assertThat(serializer.serialize(result)).isEqualTo("1. a\n2. b\n- c\n1. d\n   1. nested\n   2. nested2");
        assertThat(root(forest, 1).getStructuralMeta().getOriginalMarker()).isEqualTo("1.");
    }

    @Test
    @DisplayName("Copies only the path to the changed node")
    void pathCopying() throws Exception {
        Forest forest = parse("# A\n- x\n# B");
        Node x = root(forest, 0).getChildren().get(0);

        Forest result = mutator.updateNodeText(forest, x.getId(), "renamed");

        assertThat(root(result, 0).getChildren().get(0).getText()).isEqualTo("renamed");
        assertThat(x.getText()).isEqualTo("x");
        assertThat(result.getRoots()).isNotSameAs(forest.getRoots());
        assertThat(root(result, 0)).isNotSameAs(root(forest, 0));
        assertThat(root(result, 1)).isSameAs(root(forest, 1));
    }

    @Test
    @DisplayName("Leaves the forest alone for unknown ids")
    void unknownIdIsNoop() throws Exception {
        Forest forest = parse("# A");

        Forest result = mutator.updateNodeText(forest, "missing", "text");

        assertThat(result.getRoots()).isSameAs(forest.getRoots());
    }

    @Test
    @DisplayName("Strips heading, bullet and number markers")
    void stripsMarkers() {
        assertThat(StructuralMutator.stripMarkers("## Title")).isEqualTo("Title");
        assertThat(StructuralMutator.stripMarkers("  - item")).isEqualTo("item");
        assertThat(StructuralMutator.stripMarkers("3. step")).isEqualTo("step");
        assertThat(StructuralMutator.stripMarkers("-item")).isEqualTo("-item");
        assertThat(StructuralMutator.stripMarkers(null)).isEmpty();
    }
}
