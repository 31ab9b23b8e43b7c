package com.magicfolder.dispatch.server;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EndpointPropertiesTest {

    @Test
    @DisplayName("defaults to a loopback TCP endpoint reachable by native clients")
    void defaultEndpoint() {
        var properties = new EndpointProperties();

        assertEquals("tcp://127.0.0.1:5555", properties.getEndpoint());
        assertEquals(500, properties.getPollTimeoutMs());
        assertEquals(120_000, properties.getClientTimeoutMs());
    }
}
