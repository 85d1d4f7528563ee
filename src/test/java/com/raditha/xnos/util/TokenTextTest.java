package com.raditha.xnos.util;

import com.raditha.xnos.model.Break;
import com.raditha.xnos.model.Code;
import com.raditha.xnos.model.InlineContainer;
import com.raditha.xnos.model.Math;
import com.raditha.xnos.model.MathType;
import com.raditha.xnos.model.QuoteType;
import com.raditha.xnos.model.Quoted;
import com.raditha.xnos.model.Space;
import com.raditha.xnos.model.Str;
import com.raditha.xnos.model.Token;
import com.raditha.xnos.model.TokenType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TokenTextTest {

    private final List<Token> sample = List.of(
            new Str("a"), new Space(), new Quoted(QuoteType.SINGLE_QUOTE, List.of(new Str("b"))),
            new Break(TokenType.SOFT_BREAK), new Math(MathType.INLINE_MATH, "x^2"),
            new InlineContainer(TokenType.EMPH, List.of(new Str("e"))),
            new Code(null, "c()"));

    @Test
    void testStringify() {
        assertEquals("a b x^2ec()", TokenText.stringify(sample));
    }

    @Test
    void testPlainText() {
        assertEquals("a 'b' $x^2$ec()", TokenText.plainText(sample));
    }

    @Test
    void testStringifySingleToken() {
        assertEquals("e", TokenText.stringify(sample.get(5)));
    }

    @Test
    void testJoinStrings() {
        List<Token> x = new ArrayList<>(List.of(new Str("["), new Str("a"), new Str("]"), new Space(), new Str("b")));

        assertTrue(TokenText.joinStrings(x));
        assertEquals(List.of(new Str("[a]"), new Space(), new Str("b")), x);
        assertFalse(TokenText.joinStrings(x));
    }
}
