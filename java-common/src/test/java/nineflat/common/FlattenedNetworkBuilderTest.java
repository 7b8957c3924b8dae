package nineflat.common;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;

import nineflat.core.ComponentArray;
import nineflat.core.ConnectionGroup;
import nineflat.core.Connectivity;
import nineflat.core.NameCollisionException;
import nineflat.core.dynamics.Communication;
import nineflat.core.multi.MultiComponent;
import nineflat.core.values.Quantity;

class FlattenedNetworkBuilderTest {

    static ComponentArray array(String name) {
        var dynamics = new MultiComponent(name, Map.of("cell", Fixtures.leakyCell("c")), List.of(), Set.of());
        return new ComponentArray(name, 1, dynamics, List.of(), List.of());
    }

    static ConnectionGroup group(String name) {
        return new ConnectionGroup(name, "A", "B", "spike__cell", "spike__psr__P",
                Connectivity.of(Fixtures.ALL_TO_ALL, 1, 1), Quantity.of(1, "ms"), Communication.EVENT);
    }

    @Test
    void testDuplicatesAreRejected() {
        var builder = new FlattenedNetworkBuilder("n").addComponentArray(array("A")).addConnectionGroup(group("g"));
        var error = assertThrows(NameCollisionException.class, () -> builder.addComponentArray(array("A")));
        assertEquals("A", error.getName());
        assertThrows(NameCollisionException.class, () -> builder.addConnectionGroup(group("g")));
        assertEquals(Set.of("A"), builder.build().componentArrays().keySet());
    }

    @Test
    void testConcurrentInserts() {
        var builder = new FlattenedNetworkBuilder("n");
        IntStream.range(0, 200).parallel().forEach(i -> builder.addConnectionGroup(group("g" + i)));
        assertEquals(200, builder.build().connectionGroups().size());
    }
}
