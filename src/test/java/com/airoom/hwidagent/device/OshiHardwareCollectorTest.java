package com.airoom.hwidagent.device;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OshiHardwareCollectorTest {

    @Test
    void placeholderValuesAreDropped() {
        assertNull(OshiHardwareCollector.cleanup(null));
        assertNull(OshiHardwareCollector.cleanup("   "));
        assertNull(OshiHardwareCollector.cleanup("unknown"));
        assertNull(OshiHardwareCollector.cleanup("To Be Filled By O.E.M."));
        assertNull(OshiHardwareCollector.cleanup("Default string"));
    }

    @Test
    void realValuesAreTrimmed() {
        assertEquals("S4EWNX0N123456", OshiHardwareCollector.cleanup("  S4EWNX0N123456 "));
    }
}
