package net.spookly.kvproxy.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NodeAddressTest {
    @Test
    void parsesHostAndPort() {
        NodeAddress address = NodeAddress.parse(" 10.0.0.1:7900 ");

        assertEquals("10.0.0.1", address.host());
        assertEquals(7900, address.port());
        assertEquals("10.0.0.1:7900", address.toString());
    }

    @Test
    void parsesBracketedIpv6() {
        NodeAddress address = NodeAddress.parse("[::1]:7900");

        assertEquals("::1", address.host());
        assertEquals("[::1]:7900", address.toString());
        assertEquals(address, NodeAddress.parse(address.toString()));
    }

    @Test
    void rejectsInvalidAddresses() {
        assertThrows(IllegalArgumentException.class, () -> NodeAddress.parse(null));
        assertThrows(IllegalArgumentException.class, () -> NodeAddress.parse("host"));
        assertThrows(IllegalArgumentException.class, () -> NodeAddress.parse("host:"));
        assertThrows(IllegalArgumentException.class, () -> NodeAddress.parse(":7900"));
        assertThrows(IllegalArgumentException.class, () -> NodeAddress.parse("host:port"));
        assertThrows(IllegalArgumentException.class, () -> NodeAddress.parse("host:0"));
        assertThrows(IllegalArgumentException.class, () -> NodeAddress.parse("host:65536"));
    }
}
