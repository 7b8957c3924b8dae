package nineflat.core.multi;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import nineflat.core.InvalidRoleException;
import nineflat.core.NamespaceCollisionException;
import nineflat.core.dynamics.Communication;
import nineflat.core.network.PortConnection;
import nineflat.core.network.Role;

class RoleNamespacerTest {

    final RoleNamespacer namespacer = new RoleNamespacer(Map.of(Role.POST, "cell", Role.SYNAPSE, "proj"));

    @Test
    void testNamespaceAndSplit() {
        assertEquals("i_syn__cell", namespacer.namespace("i_syn", Role.POST));
        assertEquals(new RoleNamespacer.RolePort(Role.SYNAPSE, "spike__psr"), namespacer.split("spike__psr__proj"));
        assertEquals(new RoleNamespacer.RolePort(Role.POST, "v"), namespacer.split(namespacer.namespace("v", Role.POST)));
    }

    @Test
    void testUnknownRoles() {
        assertThrows(InvalidRoleException.class, () -> namespacer.namespace("spike", Role.PRE));
        assertThrows(InvalidRoleException.class, () -> namespacer.split("spike__other"));
        assertThrows(InvalidRoleException.class, () -> namespacer.split("spike"));
        assertEquals("spike", namespacer.qualify("spike", Role.PRE));
    }

    @Test
    void testTableIsChecked() {
        assertThrows(NamespaceCollisionException.class,
                () -> new RoleNamespacer(Map.of(Role.PRE, "cell", Role.POST, "cell")));
        assertThrows(NamespaceCollisionException.class, () -> RoleNamespacer.of(Role.SYNAPSE, "a__b"));
    }

    @Test
    void testPortConnections() {
        var pc = new PortConnection(Role.SYNAPSE, Role.POST, "i__psr", "i_syn", Communication.ANALOG);
        assertEquals(new SubComponentConnection("proj", "i__psr", "cell", "i_syn"), namespacer.connect(pc));
        assertEquals(new PortConnection(Role.SYNAPSE, Role.POST, "i__psr__proj", "i_syn__cell", Communication.ANALOG),
                namespacer.assignPortNamespaces(pc));
        assertEquals(List.of(new PortExposure("proj", "i__psr"), new PortExposure("cell", "i_syn")),
                namespacer.exposures(pc));

        var fromPre = new PortConnection(Role.PRE, Role.SYNAPSE, "spike", "spike__psr", Communication.EVENT);
        assertEquals(List.of(new PortExposure("proj", "spike__psr")), namespacer.exposures(fromPre));
        assertThrows(InvalidRoleException.class, () -> namespacer.connect(fromPre));
    }

    @Test
    void testSplitAtLastSeparator() {
        var split = RoleNamespacer.splitNamespace("spike__psr__proj");
        assertTrue(split.isPresent());
        assertEquals("spike__psr", split.get().name());
        assertEquals("proj", split.get().namespace());
        assertTrue(RoleNamespacer.splitNamespace("spike").isEmpty());
    }
}
