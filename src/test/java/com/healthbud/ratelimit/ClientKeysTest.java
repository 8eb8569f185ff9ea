package com.healthbud.ratelimit;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ClientKeysTest {

    @Test
    void firstForwardedForEntryWins() {
        assertEquals("198.51.100.7", ClientKeys.resolve("198.51.100.7, 10.0.0.2, 10.0.0.3", "127.0.0.1"));
    }

    @Test
    void fallsBackToPeerAddress() {
        assertEquals("127.0.0.1", ClientKeys.resolve(null, "127.0.0.1"));
        assertEquals("127.0.0.1", ClientKeys.resolve("   ", "127.0.0.1"));
        assertEquals("127.0.0.1", ClientKeys.resolve(" , 10.0.0.2", "127.0.0.1"));
    }

    @Test
    void unknownWhenNothingIsAvailable() {
        assertEquals(ClientKeys.UNKNOWN, ClientKeys.resolve(null, null));
        assertEquals("unknown", ClientKeys.resolve("", " "));
    }
}
