package nineflat.core.network;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import nineflat.core.InvalidRoleException;
import nineflat.core.NetworkModel;
import nineflat.core.StructuralException;
import nineflat.core.dynamics.Communication;
import nineflat.core.expressions.Expression;
import nineflat.core.values.ArrayValue;

class NetworkTest {

    final ObjectMapper objectMapper = NetworkModel.objectMapper;

    Network read(String resource) throws IOException {
        InputStream is = getClass().getResourceAsStream(resource);
        return objectMapper.readValue(is, Network.class);
    }

    @Test
    void testReadNetwork() throws IOException {
        var network = read("two_populations.json");
        assertEquals("feedforward", network.name());
        assertEquals(Set.of("A", "B", "P"), network.elements());
        assertEquals(10, network.sizeOf("A"));

        var projection = network.projection("P").orElseThrow();
        assertTrue(projection.plasticityIfPresent().isEmpty());
        assertEquals(3, projection.portConnections().size());
        assertEquals(Role.PRE, projection.portConnections().get(0).senderRole());
        assertEquals(Communication.EVENT, projection.portConnections().get(0).communicates());
        assertEquals("ms", projection.delay().units());

        var response = projection.response();
        assertEquals(Expression.parse("g + w"),
                response.dynamics().regimes().get(0).onEvents().get(0).stateAssignments().get("g"));
        assertFalse(response.properties().get("w").isSingle());
        assertEquals(List.of(0.1, 0.2, 0.3), ((ArrayValue) response.properties().get("w").value()).values());
        assertTrue(response.properties().get("tau_syn").isSingle());
    }

    @Test
    void testJsonIsStable() throws IOException {
        var network = read("two_populations.json");
        var again = objectMapper.readValue(network.asString().orElseThrow(), Network.class);
        assertEquals(network, again);
        assertEquals(network.fingerprint(), again.fingerprint());
    }

    @Test
    void testUnknownRole() {
        var error = assertThrows(JsonMappingException.class, () -> read("bad_role.json"));
        Throwable cause = error;
        while (cause != null && !(cause instanceof InvalidRoleException)) {
            cause = cause.getCause();
        }
        assertTrue(cause instanceof InvalidRoleException, error.getMessage());
    }

    @Test
    void testSelections() {
        var a = new Population("A", 3, null);
        var b = new Population("B", 4, null);
        var network = new Network("n", List.of(a, b), List.of(new Selection("AB", List.of("A", "B"))), List.of());
        assertEquals(7, network.sizeOf("AB"));
        assertTrue(network.reference("AB").isSelection());
        assertFalse(network.reference("A").isSelection());
        assertThrows(StructuralException.class, () -> network.reference("C"));
    }
}
