package im.arun.outline.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("OutlineCLI")
class OutlineCLITest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine cmd = new CommandLine(new OutlineCLI());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    @Test
    @DisplayName("Prints the parsed forest as JSON")
    void parseMode(@TempDir Path dir) throws Exception {
        Path input = dir.resolve("doc.md");
        Files.writeString(input, "# A\n- x\n");

        int exitCode = run("--input", input.toString());

        assertThat(exitCode).isZero();
        JsonNode json = new ObjectMapper().readTree(out.toString());
        assertThat(json.get("roots").get(0).get("text").asText()).isEqualTo("A");
        assertThat(json.get("roots").get(0).get("children").get(0).get("text").asText()).isEqualTo("x");
    }

    @Test
    @DisplayName("Writes normalized text to the output file")
    void formatMode(@TempDir Path dir) throws Exception {
        Path input = dir.resolve("doc.md");
        Path output = dir.resolve("out.md");
        Files.writeString(input, "* a\n+ b\n");

        int exitCode = run("--input", input.toString(), "--mode", "format", "--output", output.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(output)).isEqualTo("- a\n- b\n");
    }

    @Test
    @DisplayName("Merges text into an existing JSON forest")
    void mergeMode(@TempDir Path dir) throws Exception {
        Path input = dir.resolve("doc.md");
        Path existing = dir.resolve("existing.json");
        Path merged = dir.resolve("merged.json");
        Files.writeString(input, "# A\n");
        Files.writeString(existing, "{\"roots\":[{\"id\":\"keep-me\",\"text\":\"A\",\"x\":42.0,\"children\":[]}]}");

        int exitCode = run("--input", input.toString(), "--mode", "merge",
            "--existing", existing.toString(), "--output", merged.toString());

        assertThat(exitCode).isZero();
        JsonNode root = new ObjectMapper().readTree(merged.toFile()).get("roots").get(0);
        assertThat(root.get("id").asText()).isEqualTo("keep-me");
        assertThat(root.get("x").asDouble()).isEqualTo(42.0);
    }

    @Test
    @DisplayName("Writes a trace file when asked")
    void traceFile(@TempDir Path dir) throws Exception {
        Path input = dir.resolve("doc.md");
        Path trace = dir.resolve("trace.json");
        Files.writeString(input, "# A\n");

        run("--input", input.toString(), "--trace", trace.toString());

        assertThat(trace).exists();
        assertThat(new ObjectMapper().readTree(trace.toFile()).isArray()).isTrue();
    }

    @Test
    @DisplayName("Fails on unstructured input")
    void unstructuredInput(@TempDir Path dir) throws Exception {
        Path input = dir.resolve("plain.txt");
        Files.writeString(input, "nothing here");

        int exitCode = run("--input", input.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("No structure found");
    }

    @Test
    @DisplayName("Fails on a missing input file or missing merge source")
    void missingFiles(@TempDir Path dir) throws Exception {
        assertThat(run("--input", dir.resolve("absent.md").toString())).isEqualTo(1);

        Path input = dir.resolve("doc.md");
        Files.writeString(input, "# A\n");
        assertThat(run("--input", input.toString(), "--mode", "merge")).isEqualTo(1);
        assertThat(err.toString()).contains("--existing");
    }
}
