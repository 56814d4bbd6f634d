package org.littleshoot.authority.impl;

import static org.junit.Assert.*;

import org.junit.Test;

public class LegacyRenegotiationTest {

    @Test
    public void testEnableSetsPropertiesOnce() {
        LegacyRenegotiation.enable();

        assertEquals("true",
                System.getProperty(LegacyRenegotiation.ALLOW_UNSAFE_RENEGOTIATION));
        assertEquals("true",
                System.getProperty(LegacyRenegotiation.ALLOW_LEGACY_HELLO_MESSAGES));
        assertFalse("Second call must be a no-op", LegacyRenegotiation.enable());
    }
}
