package com.raditha.xnos.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TokenTypeTest {

    @Test
    void testFromPandocName() {
        assertEquals(TokenType.RAW_INLINE, TokenType.fromPandocName("RawInline"));
        assertEquals(TokenType.OTHER, TokenType.fromPandocName("HorizontalRule"));
    }

    @Test
    void testFromStringAcceptsConfigAndPandocNames() {
        assertEquals(TokenType.IMAGE, TokenType.fromString("image"));
        assertEquals(TokenType.RAW_INLINE, TokenType.fromString("raw-inline"));
        assertEquals(TokenType.MATH, TokenType.fromString("Math"));
        assertThrows(IllegalArgumentException.class, () -> TokenType.fromString("figure-ish"));
        assertThrows(IllegalArgumentException.class, () -> TokenType.fromString(null));
    }

    @Test
    void testAttributedArity() {
        assertTrue(TokenType.MATH.isAttributed(3));
        assertFalse(TokenType.MATH.isAttributed(2));
        assertTrue(TokenType.TABLE.isAttributed(6));
        assertTrue(TokenType.LINK.isAttributed(3));
    }
}
