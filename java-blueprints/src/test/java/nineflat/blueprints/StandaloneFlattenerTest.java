package nineflat.blueprints;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import nineflat.core.FlattenedNetwork;
import nineflat.core.LoweredModel;
import picocli.CommandLine;

class StandaloneFlattenerTest {

    @TempDir
    Path tempDir;

    Path resource(String name) throws URISyntaxException {
        return Path.of(getClass().getResource(name).toURI());
    }

    int run(PrintStream out, String... args) {
        return new CommandLine(new StandaloneFlattener(out)).execute(args);
    }

    @Test
    void testJsonToStandardOutput() throws URISyntaxException {
        var bytes = new ByteArrayOutputStream();
        var code = run(new PrintStream(bytes, true, StandardCharsets.UTF_8), "-n",
                resource("two_populations.json").toString());
        assertEquals(StandaloneFlattener.OK, code);
        var flattened = LoweredModel.fromJsonString(bytes.toString(StandardCharsets.UTF_8), FlattenedNetwork.class)
                .orElseThrow();
        assertEquals("feedforward", flattened.name());
        assertEquals(2, flattened.componentArrays().size());
        assertEquals(2, flattened.connectionGroups().size());
    }

    @Test
    void testCborToFile() throws URISyntaxException, IOException {
        var output = tempDir.resolve("flat.cbor");
        var code = run(System.out, "--network", resource("two_populations.json").toString(), "-o", output.toString(),
                "-f", "cbor", "--cell-name", "neuron", "--parallel");
        assertEquals(StandaloneFlattener.OK, code);
        var flattened = LoweredModel.fromCBOR(Files.readAllBytes(output), FlattenedNetwork.class).orElseThrow();
        assertTrue(flattened.componentArrays().get("A").dynamics().subComponents().containsKey("neuron"));
    }

    @Test
    void testConfigurationFile() throws URISyntaxException, IOException {
        var config = tempDir.resolve("config.json");
        Files.writeString(config, "{\"cell_name\": \"soma\"}");
        var output = tempDir.resolve("flat.json");
        var code = run(System.out, "-n", resource("two_populations.json").toString(), "-c", config.toString(), "-o",
                output.toString());
        assertEquals(StandaloneFlattener.OK, code);
        var flattened = LoweredModel.fromJsonString(Files.readString(output), FlattenedNetwork.class).orElseThrow();
        assertTrue(flattened.connectionGroups().values().stream().anyMatch(g -> g.sourcePort().equals("spike__soma")));
    }

    @Test
    void testErrors() throws URISyntaxException, IOException {
        assertEquals(StandaloneFlattener.UNREADABLE_INPUT,
                run(System.out, "-n", tempDir.resolve("missing.json").toString()));
        assertEquals(StandaloneFlattener.STRUCTURAL_ERROR,
                run(System.out, "-n", resource("bad_role.json").toString()));
        assertEquals(StandaloneFlattener.STRUCTURAL_ERROR,
                run(System.out, "-n", resource("two_populations.json").toString(), "--cell-name", "A"));
        var config = tempDir.resolve("broken.json");
        Files.writeString(config, "{ not json");
        assertEquals(StandaloneFlattener.UNREADABLE_INPUT,
                run(System.out, "-n", resource("two_populations.json").toString(), "-c", config.toString()));
    }
}
