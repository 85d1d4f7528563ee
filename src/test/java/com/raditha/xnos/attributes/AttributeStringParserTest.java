package com.raditha.xnos.attributes;

import com.raditha.xnos.model.AttributeSet;
import net.jqwik.api.*;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AttributeStringParserTest {

    @Test
    void testIdClassesAndPairs() {
        AttributeSet attrs = AttributeStringParser.parse("{#fig:plot .wide .dark width=50% title=\"A plot\"}");
        assertEquals("fig:plot", attrs.getId());
        assertEquals(List.of("wide", "dark"), attrs.getClasses());
        assertEquals("50%", attrs.get("width"));
        assertEquals("A plot", attrs.get("title"));
        assertFalse(attrs.isParseFailed());
    }

    @Test
    void testFirstIdWins() {
        assertEquals("a", AttributeStringParser.parse("#a #b").getId());
    }

    @Test
    void testDashMeansUnnumbered() {
        assertEquals(List.of("unnumbered"), AttributeStringParser.parse("{-}").getClasses());
        assertEquals(List.of("x", "unnumbered"), AttributeStringParser.parse("{.x -}").getClasses());
    }

    @Test
    void testSingleBareWordIsClass() {
        AttributeSet attrs = AttributeStringParser.parse("{python}");
        assertEquals("", attrs.getId());
        assertEquals(List.of("python"), attrs.getClasses());
    }

    @Test
    void testBareWordAmongOthersIsIgnored() {
        AttributeSet attrs = AttributeStringParser.parse("#a python");
        assertEquals("a", attrs.getId());
        assertTrue(attrs.getClasses().isEmpty());
    }

    @Test
    void testSingleQuotedValue() {
        assertEquals("x y", AttributeStringParser.parse("k='x y'").get("k"));
    }

    @Test
    void testEqualsInsideQuotedValue() {
        assertEquals("a=b", AttributeStringParser.parse("k=\"a=b\"").get("k"));
    }

    @Test
    void testMalformedPairSetsFlagButKeepsRest() {
        AttributeSet attrs = AttributeStringParser.parse("{#eq:1 =oops k=v}");
        assertTrue(attrs.isParseFailed());
        assertEquals("eq:1", attrs.getId());
        assertEquals("v", attrs.get("k"));
        assertEquals(1, attrs.getKvs().size());
    }

    @Test
    void testEqualsOnlyInsideQuotesFails() {
        AttributeSet attrs = AttributeStringParser.parse("#a \"x=y\"");
        assertTrue(attrs.isParseFailed());
        assertTrue(attrs.getKvs().isEmpty());
    }

    @Test
    void testEmptyAndNullInput() {
        assertTrue(AttributeStringParser.parse("{}").isEmpty());
        assertTrue(AttributeStringParser.parse("").isEmpty());
        assertTrue(AttributeStringParser.parse(null).isEmpty());
    }

    @Test
    void testUnterminatedQuoteFails() {
        AttributeSet attrs = AttributeStringParser.parse("{#tbl:1 caption=\"open}");
        assertTrue(attrs.isParseFailed());
        assertEquals("tbl:1", attrs.getId());
        assertTrue(attrs.getKvs().isEmpty());
    }

    @Test
    void testEscapedQuoteInsideValue() {
        AttributeSet attrs = AttributeStringParser.parse("{k=\"say \\\"hi\\\" 'now'\" j=\"a\\\\\"}");
        assertFalse(attrs.isParseFailed());
        assertEquals("say \"hi\" 'now'", attrs.get("k"));
        assertEquals("a\\", attrs.get("j"));
    }

    @Test
    void testTabStaysInsideWord() {
        AttributeSet attrs = AttributeStringParser.parse("{#a\tb .c}");
        assertEquals("a\tb", attrs.getId());
        assertEquals(List.of("c"), attrs.getClasses());
    }

    @Test
    void testQuotesInValuesSurviveMarkdown() {
        AttributeSet original = new AttributeSet("fig:a", List.of("c"),
                Map.of("k", "a\"b", "q", "'x'", "both", "it's \"so\"", "eq", "x=y"));

        AttributeSet parsed = AttributeStringParser.parse(original.toMarkdown());

        assertFalse(parsed.isParseFailed(), original.toMarkdown());
        assertEquals(original.getKvs(), parsed.getKvs(), original.toMarkdown());
    }

    @Test
    void testRawSourceRecorded() {
        assertEquals("{#a}", AttributeStringParser.parse("{#a}").getRawSource());
    }

    @Property(tries = 200)
    void markdownRoundTrip(@ForAll("ids") String id,
            @ForAll("classLists") List<String> classes,
            @ForAll("pairs") Map<String, String> kvs) {
        AttributeSet original = new AttributeSet(id, classes, kvs);

        AttributeSet parsed = AttributeStringParser.parse(original.toMarkdown());

        assertFalse(parsed.isParseFailed(), original.toMarkdown());
        assertEquals(original, parsed, original.toMarkdown());
    }

    @Provide
    Arbitrary<String> ids() {
        return Arbitraries.oneOf(
                Arbitraries.just(""),
                Arbitraries.strings().alpha().ofMinLength(1).ofMaxLength(6).map(s -> "fig:" + s));
    }

    @Provide
    Arbitrary<List<String>> classLists() {
        return Arbitraries.strings().alpha().numeric().ofMinLength(1).ofMaxLength(8)
                .list().ofMaxSize(4);
    }

    @Provide
    Arbitrary<Map<String, String>> pairs() {
        Arbitrary<String> keys = Arbitraries.strings().alpha().ofMinLength(1).ofMaxLength(6);
        Arbitrary<String> values = Arbitraries.strings().alpha().numeric()
                .withChars(' ', '%', '.', '"', '\'', '{', '}', '=', '\\')
                .ofMaxLength(10);
        return Arbitraries.maps(keys, values).ofMaxSize(4).map(LinkedHashMap::new);
    }
}
