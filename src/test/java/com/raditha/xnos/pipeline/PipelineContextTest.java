package com.raditha.xnos.pipeline;

import com.raditha.xnos.compat.CompatibilityProfile;
import com.raditha.xnos.compat.UnsupportedVersionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class PipelineContextTest {

    private DiagnosticSink sink;

    @BeforeEach
    void setUp() {
        sink = mock(DiagnosticSink.class);
    }

    @Test
    void testInvalidWarningLevel() {
        assertThrows(IllegalArgumentException.class, () -> new PipelineContext(sink, 3));
        assertThrows(IllegalArgumentException.class, () -> new PipelineContext(sink, -1));
    }

    @Test
    void testUseBeforeInit() {
        PipelineContext context = new PipelineContext(sink, PipelineContext.CRITICAL);

        assertFalse(context.isInitialized());
        assertThrows(UninitializedStateException.class, context::getVersion);
        assertThrows(UninitializedStateException.class, context::getProfile);
    }

    @Test
    void testInitSelectsProfile() {
        PipelineContext context = new PipelineContext(sink, PipelineContext.CRITICAL);

        context.init("2.9.2");

        assertTrue(context.isInitialized());
        assertEquals("2.9.2", context.getVersion().text());
        assertEquals(CompatibilityProfile.PANDOC_1_18, context.getProfile());
    }

    @Test
    void testInitRejectsUnsupportedVersion() {
        PipelineContext context = new PipelineContext(sink, PipelineContext.CRITICAL);

        assertThrows(UnsupportedVersionException.class, () -> context.init("1.12"));
        assertFalse(context.isInitialized());
    }

    @Test
    void testInitResetsRunState() {
        PipelineContext context = new PipelineContext(sink, PipelineContext.CRITICAL);
        context.init("2.11");
        context.markCleverefRequired();
        context.nextSection();
        assertTrue(context.reportBadLabel("fig:x"));
        assertFalse(context.reportBadLabel("fig:x"));

        context.init("2.11");

        assertFalse(context.isCleverefRequired());
        assertEquals(0, context.getSectionCounter());
        assertTrue(context.reportBadLabel("fig:x"));
    }

    @Test
    void testWarningsRespectLevel() {
        new PipelineContext(sink, PipelineContext.SILENT).warn("quiet");
        verify(sink, never()).warning(anyString());

        new PipelineContext(sink, PipelineContext.CRITICAL).warn("loud");
        verify(sink).warning("pandoc-xnos: loud");
    }

    @Test
    void testNotesOnlyWhenVerbose() {
        new PipelineContext(sink, PipelineContext.CRITICAL).note("detail");
        verify(sink, never()).note(anyString());

        PipelineContext verbose = new PipelineContext(sink, PipelineContext.VERBOSE);
        verbose.setFilterName("pandoc-fignos");
        verbose.note("detail");
        verify(sink).note("pandoc-fignos: detail");
    }

    @Test
    void testSectionCounter() {
        PipelineContext context = new PipelineContext(sink, PipelineContext.SILENT);
        assertEquals(1, context.nextSection());
        assertEquals(2, context.nextSection());
        context.resetSectionCounter();
        assertEquals(0, context.getSectionCounter());
    }
}
