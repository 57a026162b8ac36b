package com.relay.common.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CloseCodeTest {

    @Test
    void testOnlyAbnormalCodeIsAbnormal() {
        assertTrue(CloseCode.fromCode(1006).isAbnormal());
        assertFalse(CloseCode.fromCode(1000).isAbnormal());
        assertFalse(CloseCode.fromCode(1001).isAbnormal());
        assertFalse(CloseCode.fromCode(1011).isAbnormal());
    }

    @Test
    void testUnknownCodeMapsToUndefined() {
        assertEquals(CloseCode.UNDEFINED, CloseCode.fromCode(4321));
        assertFalse(CloseCode.UNDEFINED.isAbnormal());
    }

    @Test
    void testTerminalConnectionState() {
        assertTrue(ConnectionState.CLOSED.isTerminal());
        assertFalse(ConnectionState.OPEN.isTerminal());
        assertFalse(ConnectionState.CONNECTING.isTerminal());
    }
}
