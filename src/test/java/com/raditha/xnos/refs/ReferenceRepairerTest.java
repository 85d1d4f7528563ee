package com.raditha.xnos.refs;

import com.raditha.xnos.model.AttributeSet;
import com.raditha.xnos.model.CitationMode;
import com.raditha.xnos.model.Cite;
import com.raditha.xnos.model.Document;
import com.raditha.xnos.model.InlineContainer;
import com.raditha.xnos.model.Link;
import com.raditha.xnos.model.LinkTarget;
import com.raditha.xnos.model.QuoteType;
import com.raditha.xnos.model.Quoted;
import com.raditha.xnos.model.Space;
import com.raditha.xnos.model.Str;
import com.raditha.xnos.model.Token;
import com.raditha.xnos.pipeline.DiagnosticSink;
import com.raditha.xnos.pipeline.PipelineContext;
import com.raditha.xnos.pipeline.UninitializedStateException;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class ReferenceRepairerTest {

    private PipelineContext context;
    private ReferenceRepairer repairer;

    @BeforeEach
    void setUp() {
        context = new PipelineContext(mock(DiagnosticSink.class), PipelineContext.SILENT);
        context.init("1.16");
        repairer = new ReferenceRepairer(context);
    }

    private static Link mailto(String text) {
        return new Link(new AttributeSet(), List.of(new Str(text)), LinkTarget.of("mailto:" + text));
    }

    @Test
    void testUninitialisedContextFails() {
        ReferenceRepairer fresh = new ReferenceRepairer(
                new PipelineContext(mock(DiagnosticSink.class), PipelineContext.SILENT));
        List<Token> x = new ArrayList<>(List.of(mailto("{+@fig"), new Str(":one}")));

        assertThrows(UninitializedStateException.class, () -> fresh.repair(x));
    }

    @Test
    void testClever() {
        List<Token> x = new ArrayList<>(List.of(new Str("See"), new Space(), mailto("{+@fig"), new Str(":one}.")));

        assertTrue(repairer.repair(x));

        assertEquals(List.of(new Str("See"), new Space(), new Str("{+"), Cite.reference("fig:one"), new Str("}.")), x);
    }

    @Test
    void testPrefixJoinsPreviousText() {
        List<Token> x = new ArrayList<>(List.of(new Str("x"), mailto("{@fig"), new Str(":a}")));

        repairer.repair(x);

        assertEquals(List.of(new Str("x{"), Cite.reference("fig:a"), new Str("}")), x);
    }

    @Test
    void testSuppressAuthor() {
        List<Token> x = new ArrayList<>(List.of(mailto("-@fig"), new Str(":a")));

        repairer.repair(x);

        assertEquals(List.of(Cite.reference("fig:a", CitationMode.SUPPRESS_AUTHOR)), x);
    }

    @Test
    void testLinkWithQuotedTextIsLeftAlone() {
        Link link = new Link(new AttributeSet(),
                List.of(new Quoted(QuoteType.DOUBLE_QUOTE, List.of(new Str("@fig")))), LinkTarget.of("x"));
        List<Token> x = new ArrayList<>(List.of(link, new Str(":a")));

        assertFalse(repairer.repair(x));
        assertEquals(2, x.size());
    }

    @Test
    void testNotAReference() {
        List<Token> x = new ArrayList<>(List.of(mailto("someone@example"), new Str(".com")));

        assertFalse(repairer.repair(x));
    }

    @Test
    void testSecondRunChangesNothing() {
        List<Token> x = new ArrayList<>(List.of(mailto("{+@fig"), new Str(":one}"), new Space(),
                mailto("@tbl"), new Str(":two")));

        assertTrue(repairer.repair(x));
        String once = x.toString();

        assertFalse(repairer.repair(x));
        assertEquals(once, x.toString());
    }

    @Test
    void testDocumentRepairDependsOnVersion() {
        InlineContainer para = InlineContainer.para(List.of(mailto("@fig"), new Str(":one")));
        Document doc = Document.of(List.of(para));

        repairer.repair(doc);
        assertEquals(List.of(Cite.reference("fig:one")), para.getChildren());

        context.init("2.11");
        InlineContainer untouched = InlineContainer.para(List.of(mailto("@fig"), new Str(":one")));
        repairer.repair(Document.of(List.of(untouched)));
        assertEquals(2, untouched.getChildren().size());
        assertInstanceOf(Link.class, untouched.getChildren().get(0));
    }

    @Property(tries = 100)
    void everyBrokenPairBecomesOneCite(@ForAll @IntRange(min = 0, max = 12) int pairs,
            @ForAll boolean withWords) {
        PipelineContext ctx = new PipelineContext(mock(DiagnosticSink.class), PipelineContext.SILENT);
        ctx.init("1.17");
        ReferenceRepairer propertyRepairer = new ReferenceRepairer(ctx);
        List<Token> x = new ArrayList<>();
        for (int j = 0; j < pairs; j++) {
            if (withWords) {
                x.add(new Str("see"));
                x.add(new Space());
            }
            x.add(mailto("{+@fig"));
            x.add(new Str(":n" + j + "}"));
            x.add(new Space());
        }

        propertyRepairer.repair(x);

        assertEquals(pairs, x.stream().filter(Cite.class::isInstance).count());
        assertEquals(0, x.stream().filter(Link.class::isInstance).count());
        assertFalse(propertyRepairer.repair(x));
    }
}
