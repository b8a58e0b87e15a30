package com.formatrouter.config;

import com.formatrouter.split.SplitTag;
import com.formatrouter.testutil.Styles;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FormatStyleTest {

    @Test
    @DisplayName("The default style")
    void testDefaults() {
        FormatStyle style = FormatStyle.defaults();

        assertEquals(80, style.getMaxColumn());
        assertEquals(2, style.getContinuationIndentCallSite());
        assertEquals(4, style.getContinuationIndentDefnSite());
        assertTrue(style.isAlignIfWhileOpenParen());
        assertTrue(style.isDanglingParenthesesCallSite());
        assertFalse(style.isBinPackCallSite());
        assertEquals(ImportSelectors.NO_BIN_PACK, style.getImportSelectors());
        assertEquals(CurlyLambdaNewlines.NEVER, style.getAfterCurlyLambda());
        assertEquals(ContextBoundSpacing.NEVER, style.getSpaceBeforeContextBoundColon());
        assertEquals(150, style.getForceConfigStyleOnOffset());
        assertEquals(EnumSet.allOf(EditionGate.class), style.getEditionGates());
    }

    @Test
    @DisplayName("Enum options parse their configuration names")
    void testEnumOptions() {
        FormatStyle style = Styles.with(
                "newlines.afterCurlyLambda", "preserve",
                "spaces.beforeContextBoundColon", "ifMultipleBounds");

        assertEquals(CurlyLambdaNewlines.PRESERVE, style.getAfterCurlyLambda());
        assertEquals(ContextBoundSpacing.IF_MULTIPLE_BOUNDS, style.getSpaceBeforeContextBoundColon());
        assertEquals(CurlyLambdaNewlines.NEVER, Styles.with("newlines.afterCurlyLambda", "sometimes").getAfterCurlyLambda());
    }

    @Test
    @DisplayName("Tagged split families follow their style flag")
    void testSplitTags() {
        assertFalse(Styles.defaults().isEnabled(SplitTag.ONE_ARG_PER_LINE));
        assertTrue(Styles.with("oneArgPerLine", true).isEnabled(SplitTag.ONE_ARG_PER_LINE));
    }

    @Test
    @DisplayName("Operators indent unless excluded")
    void testIndentOperator() {
        FormatStyle style = Styles.defaults();

        assertTrue(style.indentsOperator("+"));
        assertTrue(style.indentsOperator("::"));
        assertFalse(style.indentsOperator("&&"));
        assertFalse(style.indentsOperator("||"));
        assertFalse(Styles.with("indentOperator.include", "^\\+$").indentsOperator("-"));
    }

    @ParameterizedTest
    @CsvSource({
            "latest, 3",
            "2020-03, 3",
            "2020-02, 2",
            "2020-01, 2",
            "2019-12, 1",
            "2019-11, 1",
            "2019-10, 0"
    })
    @DisplayName("An edition activates every gate released up to it")
    void testUpTo(String edition, int expected) {
        Set<EditionGate> gates = EditionGate.upTo(edition);

        assertEquals(expected, gates.size());
        assertEquals(gates, Styles.with("edition", edition).getEditionGates());
    }

    @ParameterizedTest
    @EnumSource(EditionGate.class)
    @DisplayName("Each gate can be turned off alone")
    void testGateOverride(EditionGate gate) {
        FormatStyle style = Styles.with("editions." + gate.getConfigName(), false);

        assertFalse(style.isActive(gate));
        Set<EditionGate> others = EnumSet.allOf(EditionGate.class);
        others.remove(gate);
        assertEquals(others, style.getEditionGates());
    }

    @Test
    @DisplayName("A gate can be turned on past the configured edition")
    void testGateOverrideOn() {
        FormatStyle style = Styles.with("edition", "2019-11", "editions.2020-03", "true");

        assertTrue(style.isActive(EditionGate.EDITION_2019_11));
        assertFalse(style.isActive(EditionGate.EDITION_2020_01));
        assertTrue(style.isActive(EditionGate.EDITION_2020_03));
    }

    @Test
    @DisplayName("Gate names")
    void testGateNames() {
        assertEquals(EditionGate.EDITION_2020_01, EditionGate.fromConfig(" 2020-01 "));
        assertNull(EditionGate.fromConfig("2021-01"));
        assertNull(EditionGate.fromConfig(null));
        assertTrue(EditionGate.upTo(null).containsAll(EnumSet.allOf(EditionGate.class)));
    }
}
