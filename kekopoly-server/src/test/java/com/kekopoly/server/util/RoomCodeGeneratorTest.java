package com.kekopoly.server.util;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class RoomCodeGeneratorTest {

    @Test
    public void testCodesUseUnambiguousAlphabet() {
        RoomCodeGenerator gen = new RoomCodeGenerator();
        for (int i = 0; i < 200; i++) {
            String code = gen.next();
            assertEquals(RoomCodeGenerator.LENGTH, code.length());
            for (char c : code.toCharArray()) {
                assertTrue(RoomCodeGenerator.CHARSET.indexOf(c) >= 0, code);
            }
            assertFalse(code.contains("0") || code.contains("O") || code.contains("1") || code.contains("I"));
            assertTrue(RoomCodeGenerator.looksLikeCode(code));
        }
    }

    @Test
    public void testLooksLikeCode() {
        assertTrue(RoomCodeGenerator.looksLikeCode("abcdef"));
        assertFalse(RoomCodeGenerator.looksLikeCode("ABCDE"));
        assertFalse(RoomCodeGenerator.looksLikeCode("ABCDE0"));
        assertFalse(RoomCodeGenerator.looksLikeCode(null));
        assertFalse(RoomCodeGenerator.looksLikeCode("3f2a9c0d4e5b"));
    }
}
