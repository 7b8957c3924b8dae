package nineflat.blueprints;

import nineflat.common.FlatteningConfiguration;
import nineflat.common.NetworkFlattener;
import nineflat.core.FlattenedNetwork;
import nineflat.core.LoweredModel;
import nineflat.core.NetworkModel;
import nineflat.core.StructuralException;
import nineflat.core.network.Network;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.util.concurrent.Callable;

/**
 * Command line entry point: reads a network, flattens it and writes the result
 * as JSON or CBOR.
 *
 * Exit codes are {@value #OK}, {@value #STRUCTURAL_ERROR} when the network is
 * read but cannot be flattened, and {@value #UNREADABLE_INPUT} when the
 * network or configuration cannot be read.
 */
@CommandLine.Command(name = "nineflat", mixinStandardHelpOptions = true, version = "0.3.0",
        description = "Flattens a neural network description into component arrays and connection groups.")
public class StandaloneFlattener implements Callable<Integer> {

    public static final int OK = 0;
    public static final int STRUCTURAL_ERROR = 1;
    public static final int UNREADABLE_INPUT = 2;

    private static final Logger logger = LoggerFactory.getLogger(StandaloneFlattener.class);

    @CommandLine.Mixin
    FlattenerCLI cli = new FlattenerCLI();

    private final PrintStream out;

    public StandaloneFlattener() {
        this(System.out);
    }

    public StandaloneFlattener(PrintStream out) {
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    public static int run(String... args) {
        return new CommandLine(new StandaloneFlattener()).execute(args);
    }

    @Override
    public Integer call() {
        var configuration = new FlatteningConfiguration();
        if (cli.configPath != null) {
            try {
                var read = FlatteningConfiguration.fromJsonString(Files.readString(cli.configPath));
                if (read.isEmpty()) {
                    logger.error("Configuration {} is not valid", cli.configPath);
                    return UNREADABLE_INPUT;
                }
                configuration = read.get();
            } catch (IOException e) {
                logger.error("Could not read configuration {}", cli.configPath, e);
                return UNREADABLE_INPUT;
            }
        }
        if (cli.cellName != null) {
            configuration.cellName = cli.cellName;
        }
        if (cli.parallel) {
            configuration.parallel = true;
        }
        logger.debug("Using {}", configuration);

        Network network;
        try {
            network = NetworkModel.objectMapper.readValue(cli.networkPath.toFile(), Network.class);
        } catch (IOException e) {
            var structural = structuralCause(e);
            if (structural != null) {
                logger.error("Network {} is malformed: {}", cli.networkPath, structural.getMessage());
                return STRUCTURAL_ERROR;
            }
            logger.error("Could not read network {}: {}", cli.networkPath, e.getMessage());
            return UNREADABLE_INPUT;
        }

        FlattenedNetwork flattened;
        try {
            flattened = new NetworkFlattener(configuration).flatten(network);
        } catch (StructuralException e) {
            logger.error("Could not flatten '{}': {}", network.name(), e.getMessage());
            return STRUCTURAL_ERROR;
        }

        try {
            var bytes = switch (cli.format) {
                case json -> LoweredModel.objectMapper.writeValueAsBytes(flattened);
                case cbor -> LoweredModel.objectMapperCBOR.writeValueAsBytes(flattened);
            };
            if (cli.outputPath == null) {
                out.write(bytes, 0, bytes.length);
                out.flush();
            } else {
                Files.write(cli.outputPath, bytes);
                logger.info("Wrote {} to {}", flattened.name(), cli.outputPath);
            }
        } catch (IOException e) {
            logger.error("Could not write {}", cli.outputPath, e);
            return UNREADABLE_INPUT;
        }
        return OK;
    }

    private static StructuralException structuralCause(Throwable e) {
        for (var cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof StructuralException structural) {
                return structural;
            }
        }
        return null;
    }
}
