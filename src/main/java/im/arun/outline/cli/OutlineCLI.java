package im.arun.outline.cli;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.outline.config.ConfigLoader;
import im.arun.outline.config.ConverterConfig;
import im.arun.outline.error.ConversionMessages;
import im.arun.outline.error.StructureException;
import im.arun.outline.model.Forest;
import im.arun.outline.model.ParseOptions;
import im.arun.outline.service.OutlineConverterService;
import im.arun.outline.util.TraceLog;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line front end for the outline converter.
 */
@Command(
    name = "outline",
    description = "Convert structured text documents to node trees and back",
    mixinStandardHelpOptions = true,
    version = "Outline Converter 1.0"
)
public class OutlineCLI implements Callable<Integer> {

    enum Mode {
        PARSE,
        FORMAT,
        MERGE
    }

    @Option(names = {"--input"}, description = "Path to the text document", required = true)
    private String inputPath;

    @Option(names = {"--mode"}, description = "parse (text to JSON), format (normalize text), merge (text into existing JSON): ${COMPLETION-CANDIDATES}",
        defaultValue = "PARSE", converter = ModeConverter.class)
    private Mode mode;

    @Option(names = {"--existing"}, description = "Previously saved JSON forest (merge mode)")
    private String existingPath;

    @Option(names = {"--output"}, description = "Output file path (stdout when omitted)")
    private String outputPath;

    @Option(names = {"--collapse-depth"}, description = "Heading depth from which large documents start collapsed")
    private Integer collapseDepth;

    @Option(names = {"--config"}, description = "YAML configuration file")
    private String configPath;

    @Option(names = {"--trace"}, description = "Write a JSON trace of the conversion to this file")
    private String tracePath;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    static class ModeConverter implements CommandLine.ITypeConverter<Mode> {
        @Override
        public Mode convert(String value) {
            return Mode.valueOf(value.trim().toUpperCase());
        }
    }

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Path input = Paths.get(inputPath);
        if (!Files.exists(input)) {
            err.println("Error: input file not found: " + inputPath);
            return 1;
        }
        if (mode == Mode.MERGE && (existingPath == null || !Files.exists(Paths.get(existingPath)))) {
            err.println("Error: merge mode needs an existing JSON forest via --existing");
            return 1;
        }

        Map<String, Object> overrides = new HashMap<>();
        if (collapseDepth != null) {
            overrides.put("auto_collapse_depth", collapseDepth);
        }
        ConverterConfig config = new ConfigLoader(configPath).load(overrides);
        OutlineConverterService service = new OutlineConverterService(config);

        TraceLog trace = tracePath != null ? new TraceLog(input.getFileName().toString()) : null;
        ParseOptions options = ParseOptions.builder()
            .autoCollapseDepth(collapseDepth)
            .trace(trace)
            .build();

        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        String text = Files.readString(input);
        String result;
        try {
            switch (mode) {
                case FORMAT:
                    result = service.serialize(service.parse(text, options));
                    break;
                case MERGE:
                    Forest existing = mapper.readValue(Paths.get(existingPath).toFile(), Forest.class);
                    result = mapper.writeValueAsString(service.reconcile(existing, text, options));
                    break;
                case PARSE:
                default:
                    result = mapper.writeValueAsString(service.parse(text, options));
                    break;
            }
        } catch (StructureException e) {
            err.println("Error: " + ConversionMessages.describe(e));
            return 1;
        } finally {
            writeTrace(trace, err);
        }

        if (outputPath != null) {
            Files.writeString(Paths.get(outputPath), result);
            err.println("Output written to: " + outputPath);
        } else {
            out.println(result);
        }
        out.flush();
        return 0;
    }

    private void writeTrace(TraceLog trace, PrintWriter err) {
        if (trace == null) {
            return;
        }
        try {
            trace.writeTo(Paths.get(tracePath));
        } catch (IOException e) {
            err.println("Warning: could not write trace file " + tracePath + ": " + e.getMessage());
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new OutlineCLI()).execute(args);
        System.exit(exitCode);
    }
}
