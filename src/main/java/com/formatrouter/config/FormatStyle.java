package com.formatrouter.config;

import com.formatrouter.split.SplitTag;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Typed, immutable view of a {@link FormatterConfig}: every option the rules
 * read. Missing or malformed options fall back to the defaults below.
 */
public final class FormatStyle {
    private final int maxColumn;

    private final int continuationIndentCallSite;
    private final int continuationIndentDefnSite;
    private final int continuationIndentExtendSite;

    private final boolean alignOpenParenCallSite;
    private final boolean alignOpenParenDefnSite;
    private final boolean alignIfWhileOpenParen;
    private final boolean alignArrowEnumeratorGenerator;

    private final boolean danglingParenthesesCallSite;
    private final boolean danglingParenthesesDefnSite;

    private final boolean binPackCallSite;
    private final boolean binPackDefnSite;
    private final boolean binPackParentConstructors;

    private final boolean configStyleArguments;
    private final boolean breakChainOnFirstMethodDot;
    private final boolean breaksInsideChains;
    private final boolean annotationNewlines;
    private final boolean selfAnnotationNewline;

    private final boolean alwaysBeforeMultilineDef;
    private final boolean alwaysBeforeCurlyBraceLambdaParams;
    private final boolean sometimesBeforeColonInMethodReturnType;
    private final boolean neverInResultType;
    private final boolean penalizeSingleSelectMultiArgList;
    private final CurlyLambdaNewlines afterCurlyLambda;
    private final boolean alwaysBeforeElseAfterCurlyIf;
    private final boolean avoidAfterYield;
    private final boolean beforeImplicitParamListModifier;
    private final boolean afterImplicitParamListModifier;
    private final boolean neverBeforeJsNative;
    private final boolean alwaysBeforeTopLevelStatements;
    private final boolean beforeSingleArgParenLambdaParams;
    private final boolean betweenCurlyAndCatchFinally;

    private final ImportSelectors importSelectors;

    private final boolean spaceInImportCurlyBraces;
    private final boolean spaceInParentheses;
    private final boolean spaceAfterKeywordBeforeParen;
    private final boolean spaceAfterTripleEquals;
    private final boolean spaceAfterSymbolicDefs;
    private final ContextBoundSpacing spaceBeforeContextBoundColon;
    private final boolean spaceInByNameTypes;

    private final boolean indentYieldKeyword;
    private final boolean unindentTopLevelOperators;
    private final Pattern indentOperatorInclude;
    private final Pattern indentOperatorExclude;
    private final boolean poorMansTrailingCommasInConfigStyle;
    private final boolean oneArgPerLine;
    private final int forceConfigStyleOnOffset;
    private final int forceConfigStyleMinArgCount;

    private final Set<EditionGate> editionGates;

    private FormatStyle(FormatterConfig config) {
        maxColumn = config.get("maxColumn", 80);

        continuationIndentCallSite = config.get("continuationIndent.callSite", 2);
        continuationIndentDefnSite = config.get("continuationIndent.defnSite", 4);
        continuationIndentExtendSite = config.get("continuationIndent.extendSite", 4);

        alignOpenParenCallSite = config.get("align.openParenCallSite", false);
        alignOpenParenDefnSite = config.get("align.openParenDefnSite", false);
        alignIfWhileOpenParen = config.get("align.ifWhileOpenParen", true);
        alignArrowEnumeratorGenerator = config.get("align.arrowEnumeratorGenerator", false);

        danglingParenthesesCallSite = config.get("danglingParentheses.callSite", true);
        danglingParenthesesDefnSite = config.get("danglingParentheses.defnSite", true);

        binPackCallSite = config.get("binPack.callSite", false);
        binPackDefnSite = config.get("binPack.defnSite", false);
        binPackParentConstructors = config.get("binPack.parentConstructors", false);

        configStyleArguments = config.get("optIn.configStyleArguments", true);
        breakChainOnFirstMethodDot = config.get("optIn.breakChainOnFirstMethodDot", true);
        breaksInsideChains = config.get("optIn.breaksInsideChains", false);
        annotationNewlines = config.get("optIn.annotationNewlines", true);
        selfAnnotationNewline = config.get("optIn.selfAnnotationNewline", true);

        alwaysBeforeMultilineDef = config.get("newlines.alwaysBeforeMultilineDef", true);
        alwaysBeforeCurlyBraceLambdaParams = config.get("newlines.alwaysBeforeCurlyBraceLambdaParams", false);
        sometimesBeforeColonInMethodReturnType = config.get("newlines.sometimesBeforeColonInMethodReturnType", true);
        neverInResultType = config.get("newlines.neverInResultType", false);
        penalizeSingleSelectMultiArgList = config.get("newlines.penalizeSingleSelectMultiArgList", true);
        afterCurlyLambda = orDefault(
                CurlyLambdaNewlines.fromConfig(config.get("newlines.afterCurlyLambda", "never")),
                CurlyLambdaNewlines.NEVER);
        alwaysBeforeElseAfterCurlyIf = config.get("newlines.alwaysBeforeElseAfterCurlyIf", false);
        avoidAfterYield = config.get("newlines.avoidAfterYield", true);
        beforeImplicitParamListModifier = config.get("newlines.beforeImplicitParamListModifier", false);
        afterImplicitParamListModifier = config.get("newlines.afterImplicitParamListModifier", false);
        neverBeforeJsNative = config.get("newlines.neverBeforeJsNative", false);
        alwaysBeforeTopLevelStatements = config.get("newlines.alwaysBeforeTopLevelStatements", false);
        beforeSingleArgParenLambdaParams = config.get("newlines.beforeSingleArgParenLambdaParams", false);
        betweenCurlyAndCatchFinally = config.get("newlines.betweenCurlyAndCatchFinally", false);

        importSelectors = orDefault(
                ImportSelectors.fromConfig(config.get("importSelectors", "noBinPack")),
                ImportSelectors.NO_BIN_PACK);

        spaceInImportCurlyBraces = config.get("spaces.inImportCurlyBraces", false);
        spaceInParentheses = config.get("spaces.inParentheses", false);
        spaceAfterKeywordBeforeParen = config.get("spaces.afterKeywordBeforeParen", true);
        spaceAfterTripleEquals = config.get("spaces.afterTripleEquals", false);
        spaceAfterSymbolicDefs = config.get("spaces.afterSymbolicDefs", false);
        spaceBeforeContextBoundColon = orDefault(
                ContextBoundSpacing.fromConfig(config.get("spaces.beforeContextBoundColon", "never")),
                ContextBoundSpacing.NEVER);
        spaceInByNameTypes = config.get("spaces.inByNameTypes", true);

        indentYieldKeyword = config.get("indentYieldKeyword", true);
        unindentTopLevelOperators = config.get("unindentTopLevelOperators", false);
        indentOperatorInclude = Pattern.compile(config.get("indentOperator.include", ".*"));
        indentOperatorExclude = Pattern.compile(config.get("indentOperator.exclude", "^(&&|\\|\\|)$"));
        poorMansTrailingCommasInConfigStyle = config.get("poorMansTrailingCommasInConfigStyle", false);
        oneArgPerLine = config.get("oneArgPerLine", false);
        forceConfigStyleOnOffset = config.get("forceConfigStyleOnOffset", 150);
        forceConfigStyleMinArgCount = config.get("forceConfigStyleMinArgCount", 2);

        editionGates = resolveGates(config);
    }

    /**
     * Builds the typed style of a configuration.
     */
    public static FormatStyle fromConfig(FormatterConfig config) {
        return new FormatStyle(config);
    }

    /**
     * The style of the bundled default configuration.
     */
    public static FormatStyle defaults() {
        return fromConfig(ConfigurationLoader.loadDefaultConfig());
    }

    private static Set<EditionGate> resolveGates(FormatterConfig config) {
        Set<EditionGate> gates = EnumSet.noneOf(EditionGate.class);
        gates.addAll(EditionGate.upTo(config.get("edition", "latest")));
        // individual overrides under "editions", e.g. editions: {"2020-01": false}
        for (EditionGate gate : EditionGate.values()) {
            Object override = config.getSectionConfig("editions", gate.getConfigName(), (Object) null);
            if (override == null) {
                continue;
            }
            if (Boolean.parseBoolean(override.toString())) {
                gates.add(gate);
            } else {
                gates.remove(gate);
            }
        }
        return Collections.unmodifiableSet(gates);
    }

    private static <T> T orDefault(T value, T defaultValue) {
        return value != null ? value : defaultValue;
    }

    public boolean isActive(EditionGate gate) {
        return editionGates.contains(gate);
    }

    public Set<EditionGate> getEditionGates() {
        return editionGates;
    }

    /**
     * Whether splits of the given family are offered.
     */
    public boolean isEnabled(SplitTag tag) {
        return switch (tag) {
            case ONE_ARG_PER_LINE -> oneArgPerLine;
        };
    }

    /**
     * Whether an infix operator continues its left operand's indentation.
     */
    public boolean indentsOperator(String operator) {
        return indentOperatorInclude.matcher(operator).find()
                && !indentOperatorExclude.matcher(operator).find();
    }

    // Getters
    public int getMaxColumn() { return maxColumn; }
    public int getContinuationIndentCallSite() { return continuationIndentCallSite; }
    public int getContinuationIndentDefnSite() { return continuationIndentDefnSite; }
    public int getContinuationIndentExtendSite() { return continuationIndentExtendSite; }
    public boolean isAlignOpenParenCallSite() { return alignOpenParenCallSite; }
    public boolean isAlignOpenParenDefnSite() { return alignOpenParenDefnSite; }
    public boolean isAlignIfWhileOpenParen() { return alignIfWhileOpenParen; }
    public boolean isAlignArrowEnumeratorGenerator() { return alignArrowEnumeratorGenerator; }
    public boolean isDanglingParenthesesCallSite() { return danglingParenthesesCallSite; }
    public boolean isDanglingParenthesesDefnSite() { return danglingParenthesesDefnSite; }
    public boolean isBinPackCallSite() { return binPackCallSite; }
    public boolean isBinPackDefnSite() { return binPackDefnSite; }
    public boolean isBinPackParentConstructors() { return binPackParentConstructors; }
    public boolean isConfigStyleArguments() { return configStyleArguments; }
    public boolean isBreakChainOnFirstMethodDot() { return breakChainOnFirstMethodDot; }
    public boolean isBreaksInsideChains() { return breaksInsideChains; }
    public boolean isAnnotationNewlines() { return annotationNewlines; }
    public boolean isSelfAnnotationNewline() { return selfAnnotationNewline; }
    public boolean isAlwaysBeforeMultilineDef() { return alwaysBeforeMultilineDef; }
    public boolean isAlwaysBeforeCurlyBraceLambdaParams() { return alwaysBeforeCurlyBraceLambdaParams; }
    public boolean isSometimesBeforeColonInMethodReturnType() { return sometimesBeforeColonInMethodReturnType; }
    public boolean isNeverInResultType() { return neverInResultType; }
    public boolean isPenalizeSingleSelectMultiArgList() { return penalizeSingleSelectMultiArgList; }
    public CurlyLambdaNewlines getAfterCurlyLambda() { return afterCurlyLambda; }
    public boolean isAlwaysBeforeElseAfterCurlyIf() { return alwaysBeforeElseAfterCurlyIf; }
    public boolean isAvoidAfterYield() { return avoidAfterYield; }
    public boolean isBeforeImplicitParamListModifier() { return beforeImplicitParamListModifier; }
    public boolean isAfterImplicitParamListModifier() { return afterImplicitParamListModifier; }
    public boolean isNeverBeforeJsNative() { return neverBeforeJsNative; }
    public boolean isAlwaysBeforeTopLevelStatements() { return alwaysBeforeTopLevelStatements; }
    public boolean isBeforeSingleArgParenLambdaParams() { return beforeSingleArgParenLambdaParams; }
    public boolean isBetweenCurlyAndCatchFinally() { return betweenCurlyAndCatchFinally; }
    public ImportSelectors getImportSelectors() { return importSelectors; }
    public boolean isSpaceInImportCurlyBraces() { return spaceInImportCurlyBraces; }
    public boolean isSpaceInParentheses() { return spaceInParentheses; }
    public boolean isSpaceAfterKeywordBeforeParen() { return spaceAfterKeywordBeforeParen; }
    public boolean isSpaceAfterTripleEquals() { return spaceAfterTripleEquals; }
    public boolean isSpaceAfterSymbolicDefs() { return spaceAfterSymbolicDefs; }
    public ContextBoundSpacing getSpaceBeforeContextBoundColon() { return spaceBeforeContextBoundColon; }
    public boolean isSpaceInByNameTypes() { return spaceInByNameTypes; }
    public boolean isIndentYieldKeyword() { return indentYieldKeyword; }
    public boolean isUnindentTopLevelOperators() { return unindentTopLevelOperators; }
    public boolean isPoorMansTrailingCommasInConfigStyle() { return poorMansTrailingCommasInConfigStyle; }
    public boolean isOneArgPerLine() { return oneArgPerLine; }
    public int getForceConfigStyleOnOffset() { return forceConfigStyleOnOffset; }
    public int getForceConfigStyleMinArgCount() { return forceConfigStyleMinArgCount; }
}
