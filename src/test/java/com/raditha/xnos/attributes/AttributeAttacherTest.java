package com.raditha.xnos.attributes;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.raditha.xnos.model.AttributeSet;
import com.raditha.xnos.model.Document;
import com.raditha.xnos.model.Image;
import com.raditha.xnos.model.InlineContainer;
import com.raditha.xnos.model.LinkTarget;
import com.raditha.xnos.model.Math;
import com.raditha.xnos.model.MathType;
import com.raditha.xnos.model.Space;
import com.raditha.xnos.model.Span;
import com.raditha.xnos.model.Str;
import com.raditha.xnos.model.Table;
import com.raditha.xnos.model.Token;
import com.raditha.xnos.model.TokenType;
import com.raditha.xnos.pipeline.DiagnosticSink;
import com.raditha.xnos.pipeline.PipelineContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.*;

class AttributeAttacherTest {

    private DiagnosticSink sink;
    private PipelineContext context;

    @BeforeEach
    void setUp() {
        sink = mock(DiagnosticSink.class);
        context = new PipelineContext(sink, PipelineContext.CRITICAL);
        context.init("2.11");
    }

    @Test
    void testEquationWithSpaceBeforeAttributes() {
        Math math = new Math(MathType.DISPLAY_MATH, "E = mc^2");
        InlineContainer para = InlineContainer.para(List.of(math, new Space(), new Str("{#eq:einstein}")));
        Document doc = Document.of(new ArrayList<>(List.of(para)));

        new AttributeAttacher(context, TokenType.MATH, true, false).attach(doc);

        assertEquals("eq:einstein", math.getAttributes().getId());
        assertEquals(List.of(math, new Space()), para.getChildren());
    }

    @Test
    void testSpaceNotAllowed() {
        Math math = new Math(MathType.DISPLAY_MATH, "x");
        List<Token> x = new ArrayList<>(List.of(math, new Space(), new Str("{#eq:x}")));

        new AttributeAttacher(context, TokenType.MATH, false, false).attach(x);

        assertFalse(math.hasAttributes());
        assertEquals(3, x.size());
    }

    @Test
    void testExistingAttributesKeptUnlessReplacing() {
        Math math = new Math(new AttributeSet("eq:a", List.of(), java.util.Map.of()), MathType.INLINE_MATH, "x");
        List<Token> x = new ArrayList<>(List.of(math, new Str("{#eq:b}")));

        new AttributeAttacher(context, TokenType.MATH, false, false).attach(x);
        assertEquals("eq:a", math.getAttributes().getId());

        new AttributeAttacher(context, TokenType.MATH, false, true).attach(x);
        assertEquals("eq:b", math.getAttributes().getId());
        assertEquals(1, x.size());
    }

    @Test
    void testLoneImageBecomesFigure() {
        Image image = new Image(new AttributeSet(), List.of(new Str("Plot")), LinkTarget.of("plot.png"));
        List<Token> x = new ArrayList<>(List.of(image, new Str("{#fig:plot}")));

        new AttributeAttacher(context, TokenType.IMAGE, false, true).attach(x);

        assertEquals("fig:plot", image.getAttributes().getId());
        assertEquals(Image.FIGURE_TITLE, image.getTarget().title());
    }

    @Test
    void testInlineImageIsNotFigure() {
        Image image = new Image(new AttributeSet(), List.of(), LinkTarget.of("icon.png"));
        List<Token> x = new ArrayList<>(List.of(new Str("An"), new Space(), image, new Str("{#fig:icon}")));

        new AttributeAttacher(context, TokenType.IMAGE, false, true).attach(x);

        assertEquals("fig:icon", image.getAttributes().getId());
        assertEquals("", image.getTarget().title());
    }

    @Test
    void testUnattributedSpanIsUnwrapped() {
        Span span = new Span(null, List.of(new Str("fig. 1")));
        List<Token> x = new ArrayList<>(List.of(new Str("See"), new Space(), span, new Str(".")));

        new AttributeAttacher(context, TokenType.SPAN, false, true).attach(x);

        assertEquals(List.of(new Str("See"), new Space(), new Str("[fig. 1].")), x);
    }

    @Test
    void testSpanWithAttributes() {
        Span span = new Span(null, List.of(new Str("x")));
        List<Token> x = new ArrayList<>(List.of(span, new Str("{.nolink}")));

        new AttributeAttacher(context, TokenType.SPAN, false, true).attach(x);

        assertEquals(List.of("nolink"), span.getAttributes().getClasses());
        assertEquals(1, x.size());
    }

    @Test
    void testTableCaptionAttributes() {
        Table table = new Table(null,
                List.of(new Str("Results"), new Space(), new Str("{#tbl:results}")),
                JsonNodeFactory.instance.arrayNode());
        Document doc = Document.of(new ArrayList<>(List.of(table)));

        new AttributeAttacher(context, TokenType.TABLE, false, true).attach(doc);

        assertEquals("tbl:results", table.getAttributes().getId());
        assertEquals(List.of(new Str("Results")), table.getCaption());
    }

    @Test
    void testTableCaptionBraceInTheMiddleIgnored() {
        Table table = new Table(null,
                List.of(new Str("{#tbl:x}"), new Space(), new Str("trailing")),
                JsonNodeFactory.instance.arrayNode());
        Document doc = Document.of(new ArrayList<>(List.of(table)));

        new AttributeAttacher(context, TokenType.TABLE, false, true).attach(doc);

        assertFalse(table.hasAttributes());
        assertEquals(3, table.getCaption().size());
    }

    @Test
    void testMalformedAttributesWarn() {
        Math math = new Math(MathType.INLINE_MATH, "x");
        List<Token> x = new ArrayList<>(List.of(math, new Str("{#eq:1 =oops}")));

        new AttributeAttacher(context, TokenType.MATH, false, false).attach(x);

        assertEquals("eq:1", math.getAttributes().getId());
        verify(sink).warning(contains("Malformed attributes:\n{#eq:1 =oops}"));
    }

    @Test
    void testWellFormedAttributesDoNotWarn() {
        Math math = new Math(MathType.INLINE_MATH, "x");
        List<Token> x = new ArrayList<>(List.of(math, new Str("{#eq:1 tag=B}")));

        new AttributeAttacher(context, TokenType.MATH, false, false).attach(x);

        verify(sink, never()).warning(anyString());
    }
}
