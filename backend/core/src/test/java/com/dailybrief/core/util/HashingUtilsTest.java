package com.dailybrief.core.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HashingUtilsTest {
    @Test
    void fingerprintIsLowercaseHexMd5OfUrl() {
        String fingerprint = HashingUtils.fingerprint("hello");

        assertEquals("5d41402abc4b2a76b9719d911017c592", fingerprint);
        assertTrue(fingerprint.matches("[0-9a-f]{32}"));
    }

    @Test
    void fingerprintIsDeterministicAndSensitiveToEveryCharacter() {
        assertEquals(HashingUtils.fingerprint("https://x.com/a"), HashingUtils.fingerprint("https://x.com/a"));
        assertNotEquals(HashingUtils.fingerprint("https://x.com/a"), HashingUtils.fingerprint("https://x.com/a/"));
    }

    @Test
    void fingerprintRejectsBlankUrl() {
        assertThrows(IllegalArgumentException.class, () -> HashingUtils.fingerprint(" "));
        assertThrows(IllegalArgumentException.class, () -> HashingUtils.fingerprint(null));
    }

}
