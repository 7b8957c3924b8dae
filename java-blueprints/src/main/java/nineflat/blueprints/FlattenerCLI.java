package nineflat.blueprints;

import picocli.CommandLine;

import java.nio.file.Path;

/**
 * Options of {@link StandaloneFlattener}.
 */
public class FlattenerCLI {

    public enum OutputFormat {
        json, cbor
    }

    @CommandLine.Option(names = { "-n", "--network" }, required = true,
            description = "The path of the network description, in JSON.")
    Path networkPath;
    @CommandLine.Option(names = { "-o", "--output" },
            description = "The path where the flattened network is written. Standard output if absent.")
    Path outputPath;
    @CommandLine.Option(names = { "-f", "--format" }, defaultValue = "json",
            description = "The output format: ${COMPLETION-CANDIDATES}.")
    OutputFormat format = OutputFormat.json;
    @CommandLine.Option(names = { "-c", "--config" }, description = "A flattening configuration in JSON.")
    Path configPath;
    @CommandLine.Option(names = { "--cell-name" }, description = "The sub-component name of cells.")
    String cellName;
    @CommandLine.Option(names = { "--parallel" }, description = "Flatten populations in parallel.")
    boolean parallel;
}
