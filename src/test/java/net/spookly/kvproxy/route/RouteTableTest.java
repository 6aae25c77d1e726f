package net.spookly.kvproxy.route;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class RouteTableTest {
    @Test
    void lookupReturnsOrderedReplicasOfTheKeysBucket() {
        RouteTable table = RouteTable.of(3, 2, List.of(
                List.of("10.0.0.1:7900", "10.0.0.2:7900"),
                List.of("10.0.0.2:7900", "10.0.0.3:7900")
        ));

        int bucket = table.bucketOf("user:42");

        assertEquals(table.replicas(bucket), table.lookup("user:42"));
        assertEquals(table.lookup("user:42"), table.lookup("user:42"));
        assertEquals(List.of("10.0.0.1:7900", "10.0.0.2:7900", "10.0.0.3:7900"), List.copyOf(table.nodes()));
    }

    @Test
    void rejectsWrongReplicaCount() {
        MalformedRouteException exception = assertThrows(MalformedRouteException.class, () -> RouteTable.of(1, 3, List.of(
                List.of("10.0.0.1:7900", "10.0.0.2:7900")
        )));

        assertTrue(exception.getMessage().contains("exactly 3"));
    }

    @Test
    void rejectsDuplicateReplicaInBucket() {
        assertThrows(MalformedRouteException.class, () -> RouteTable.of(1, 2, List.of(
                List.of("10.0.0.1:7900", "10.0.0.1:7900")
        )));
    }

    @Test
    void rejectsInvalidAddressAndBucketCount() {
        assertThrows(MalformedRouteException.class, () -> RouteTable.of(1, 1, List.of(List.of("nope"))));
        assertThrows(MalformedRouteException.class, () -> RouteTable.of(1, 1, List.of(
                List.of("10.0.0.1:7900"), List.of("10.0.0.1:7900"), List.of("10.0.0.1:7900")
        )));
        assertThrows(MalformedRouteException.class, () -> RouteTable.of(-1, 1, List.of(List.of("10.0.0.1:7900"))));
    }

    @Test
    void comparesByVersionOnly() {
        RouteTable table = RouteTable.of(5, 1, List.of(List.of("10.0.0.1:7900")));

        assertTrue(table.isNewerThan(4));
        assertFalse(table.isNewerThan(5));
        assertFalse(table.isNewerThan(6));
    }
}
