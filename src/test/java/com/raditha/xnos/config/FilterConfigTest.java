package com.raditha.xnos.config;

import com.raditha.xnos.model.TokenType;
import com.raditha.xnos.refs.NameTable;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FilterConfigTest {

    @Test
    void testDefaults() {
        FilterConfig config = FilterConfig.defaults();

        assertEquals(1, config.warningLevel());
        assertTrue(config.cleverefFakery());
        assertEquals(List.of("fig", "eq", "tbl"), config.targets().stream().map(TargetKindConfig::prefix).toList());
        assertTrue(config.targets().get(1).eqref());
        assertTrue(config.targets().get(1).allowSpace());
    }

    @Test
    void testDuplicatePrefixRejected() {
        List<TargetKindConfig> targets = List.of(TargetKindConfig.figures(), TargetKindConfig.figures());

        assertThrows(IllegalArgumentException.class, () -> new FilterConfig(1, false, true, false, false, targets));
    }

    @Test
    void testNoTargetsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new FilterConfig(1, false, true, false, false, List.of()));
    }

    @Test
    void testTargetValidation() {
        NameTable names = new NameTable("x.", "xs.");
        assertThrows(IllegalArgumentException.class,
                () -> new TargetKindConfig(TokenType.STR, "x", names, names, false, false));
        assertThrows(IllegalArgumentException.class,
                () -> new TargetKindConfig(TokenType.IMAGE, "1fig", names, names, false, false));
        assertThrows(IllegalArgumentException.class,
                () -> new TargetKindConfig(TokenType.IMAGE, "fig:", names, names, false, false));
        assertDoesNotThrow(() -> new TargetKindConfig(TokenType.CODE, "lst-code", names, names, false, false));
    }
}
