package nineflat.common;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import nineflat.core.StructuralException;
import nineflat.core.dynamics.Communication;
import nineflat.core.network.PortConnection;
import nineflat.core.network.Role;

class PortConnectionResolverTest {

    final PortConnectionResolver resolver = new PortConnectionResolver();

    PortConnection resolve(PortConnection pc) {
        var network = Fixtures.feedforward(Fixtures.linearResponse(), pc);
        return resolver.resolve(network, network.projection("P").orElseThrow(), pc);
    }

    @Test
    void testKindFollowsPorts() {
        assertEquals(Communication.EVENT,
                resolve(new PortConnection(Role.PRE, Role.RESPONSE, "spike", "spike", null)).communicates());
        assertEquals(Communication.ANALOG,
                resolve(new PortConnection(Role.RESPONSE, Role.POST, "i", "i_syn", null)).communicates());
        assertEquals(Fixtures.spikeIn(), resolve(Fixtures.spikeIn()));
    }

    @Test
    void testDeclaredKindMustMatchPorts() {
        var error = assertThrows(StructuralException.class,
                () -> resolve(new PortConnection(Role.PRE, Role.RESPONSE, "spike", "spike", Communication.ANALOG)));
        assertTrue(error.getMessage().contains("pre__spike__response__spike"));
    }

    @Test
    void testMixedAndMisdirectedPorts() {
        assertThrows(StructuralException.class,
                () -> resolve(new PortConnection(Role.PRE, Role.POST, "spike", "i_syn", null)));
        assertThrows(StructuralException.class,
                () -> resolve(new PortConnection(Role.POST, Role.RESPONSE, "i_syn", "spike", null)));
        assertThrows(StructuralException.class,
                () -> resolve(new PortConnection(Role.RESPONSE, Role.PRE, "spike", "spike", null)));
    }

    @Test
    void testUnknownPort() {
        var error = assertThrows(StructuralException.class,
                () -> resolve(new PortConnection(Role.PRE, Role.RESPONSE, "burst", "spike", null)));
        assertTrue(error.getMessage().contains("'burst'"));
    }

    @Test
    void testUnresolvedRolesAreLeftAlone() {
        var pc = new PortConnection(Role.PRE, Role.PLASTICITY, "spike", "spike", null);
        assertSame(pc, resolve(pc));
    }
}
