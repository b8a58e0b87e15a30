package com.formatrouter.router.rules;

import com.formatrouter.config.EditionGate;
import com.formatrouter.model.FormatToken;
import com.formatrouter.model.NodeKind;
import com.formatrouter.model.Role;
import com.formatrouter.model.Token;
import com.formatrouter.model.TokenKind;
import com.formatrouter.model.TokenRange;
import com.formatrouter.model.TreeNode;
import com.formatrouter.router.Constants;
import com.formatrouter.router.FormatOps;
import com.formatrouter.router.RouteContext;
import com.formatrouter.router.TokenOps;
import com.formatrouter.router.TreeOps;
import com.formatrouter.split.ExpiresOn;
import com.formatrouter.split.Length;
import com.formatrouter.split.Modification;
import com.formatrouter.split.OptimalToken;
import com.formatrouter.split.Policy;
import com.formatrouter.split.Split;
import com.formatrouter.split.SplitTag;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static com.formatrouter.router.RouteContext.splits;

/**
 * Argument and parameter lists: opening delimiters, commas and the braces
 * of lambda arguments.
 */
public final class ApplyRules {

    private ApplyRules() {
    }

    private static Modification orNoSplit(Modification mod) {
        return mod == null ? Modification.NO_SPLIT : mod;
    }

    /**
     * A call whose single argument is a lambda, under config-style
     * arguments: the lambda's parameters stay on the paren's line.
     */
    public static List<Split> configStyleLambdaArg(RouteContext c) {
        if (!c.leftIs(TokenKind.LEFT_PAREN) || !c.style().isConfigStyleArguments()
                || c.style().isBeforeSingleArgParenLambdaParams()) {
            return null;
        }
        FormatOps ops = c.ops();
        Optional<TreeNode> lambda = ops.getLambdaAtSingleArgCallSite(c.ft());
        if (!lambda.isPresent()) {
            return null;
        }
        Optional<FormatToken> arrow = ops.getFuncArrow(lambda.get());
        if (!arrow.isPresent()) {
            return null;
        }
        FormatToken arrowFt = arrow.get();
        Optional<Token> lambdaLeft = c.tokens().matchingOpt(ops.functionExpire(lambda.get()).getToken())
                .filter(t -> t.is(TokenKind.LEFT_BRACE));
        boolean lambdaIsABlock = lambdaLeft.map(t -> t == arrowFt.getRight()).orElse(false);
        Token lambdaToken = ops.getOptimalTokenFor(lambdaIsABlock ? ops.next(arrowFt) : arrowFt);

        Token close = ops.matching(c.left());
        Policy newlinePolicy = c.style().isDanglingParenthesesCallSite()
                ? ops.newlinesOnlyBeforeClosePolicy(close)
                : Policy.NO_POLICY;
        Policy spacePolicy = ops.singleLineBlock(lambdaToken);
        if (!lambdaIsABlock && !newlinePolicy.isEmpty()) {
            spacePolicy = spacePolicy.orElse(ops.delayedBreakPolicy(lambdaLeft.orElse(null), newlinePolicy));
        }

        Modification noSplitMod = ops.getNoSplit(c.ft(), true);
        int newlinePenalty = 3 + TreeOps.nestedApplies(c.leftOwner());
        return splits(
                new Split(orNoSplit(noSplitMod), 0)
                        .withPolicy(ops.singleLineBlock(close))
                        .onlyIf(noSplitMod != null)
                        .withOptimalToken(close),
                new Split(orNoSplit(noSplitMod), 0)
                        .withPolicy(spacePolicy)
                        .onlyIf(noSplitMod != null)
                        .withOptimalToken(lambdaToken),
                new Split(Modification.NEWLINE, newlinePenalty)
                        .withPolicy(newlinePolicy)
                        .withIndent(c.style().getContinuationIndentCallSite(), close, ExpiresOn.RIGHT));
    }

    /**
     * Config-style arguments: the source breaks after the opening and before
     * the closing delimiter, so every argument gets its own line.
     */
    public static List<Split> configStyleArgs(RouteContext c) {
        if (!c.leftIs(TokenKind.LEFT_PAREN, TokenKind.LEFT_BRACKET) || !c.style().isConfigStyleArguments()
                || !FormatOps.isDefnOrCallSite(c.leftOwner())) {
            return null;
        }
        FormatOps ops = c.ops();
        if (!ops.opensConfigStyle(c.ft()) && !ops.forceConfigStyle(c.leftOwner())) {
            return null;
        }
        Token close = ops.matching(c.left());
        Length indent = ops.getApplyIndent(c.leftOwner(), true);
        Length extraIndent = Length.num(c.style().isPoorMansTrailingCommasInConfigStyle() ? 2 : 0);
        Policy policy = ops.oneArgOneLineSplit(c.ft()).orElse(ops.newlinesOnlyBeforeClosePolicy(close));
        Split implicitSplit = Split.ignored();
        if (ops.opensConfigStyleImplicitParamList(c.ft())) {
            implicitSplit = new Split(Modification.space(c.style().isSpaceInParentheses()), 0)
                    .withPolicy(policy.orElse(ops.decideNewlinesOnlyAfterToken(c.right())))
                    .withOptimalToken(c.right(), true)
                    .withIndent(indent, close, ExpiresOn.RIGHT)
                    .withIndent(extraIndent, c.right(), ExpiresOn.RIGHT);
        }
        return splits(
                implicitSplit,
                new Split(Modification.NEWLINE, implicitSplit.isActive() ? 1 : 0)
                        .withPolicy(policy)
                        .withIndent(indent, close, ExpiresOn.RIGHT)
                        .withIndent(extraIndent, c.right(), ExpiresOn.RIGHT));
    }

    public static List<Split> binPackDefnSite(RouteContext c) {
        if (!c.leftIs(TokenKind.LEFT_PAREN, TokenKind.LEFT_BRACKET) || !c.style().isBinPackDefnSite()
                || !TreeOps.isDefnSite(c.leftOwner())) {
            return null;
        }
        FormatOps ops = c.ops();
        Token close = ops.matching(c.left());
        if (TreeOps.isTuple(c.leftOwner())) {
            return splits(new Split(Modification.NO_SPLIT, 0)
                    .withPolicy(ops.singleLineBlock(close, Collections.emptyList(), false, false)));
        }
        boolean isBracket = c.leftIs(TokenKind.LEFT_BRACKET);
        int indent = c.style().getContinuationIndentDefnSite();
        int bracketCoef = isBracket ? Constants.BRACKET_PENALTY : 1;
        int bracketPenalty = isBracket ? 1 : 0;
        int nestingPenalty = TreeOps.nestedApplies(c.leftOwner());

        Policy noSplitPenalizeNewlines = penalizeBrackets(ops, isBracket, close, 1 + bracketPenalty);
        Policy noSplitPolicy = ops.argumentStartingAt(c.right())
                .map(arg -> {
                    Policy singleLine = ops.singleLineBlock(arg.lastToken());
                    return isBracket ? noSplitPenalizeNewlines.andThen(singleLine) : singleLine;
                })
                .orElse(noSplitPenalizeNewlines);
        Modification noSplitModification = c.rightIs(TokenKind.COMMENT)
                ? TokenOps.newlines2Modification(c.ft())
                : Modification.NO_SPLIT;
        return splits(
                new Split(noSplitModification, nestingPenalty * bracketCoef)
                        .withPolicy(noSplitPolicy)
                        .withIndent(indent, close, ExpiresOn.LEFT),
                new Split(Modification.NEWLINE, (1 + nestingPenalty * nestingPenalty) * bracketCoef)
                        .notIf(c.rightIs(TokenKind.RIGHT_PAREN))
                        .withPolicy(penalizeBrackets(ops, isBracket, close, 1))
                        .withIndent(indent, close, ExpiresOn.LEFT));
    }

    private static Policy penalizeBrackets(FormatOps ops, boolean isBracket, Token close, int penalty) {
        return isBracket
                ? ops.penalizeAllNewlines(close, Constants.BRACKET_PENALTY * penalty + 3)
                : Policy.NO_POLICY;
    }

    public static List<Split> binPackCallSite(RouteContext c) {
        if (!c.leftIs(TokenKind.LEFT_PAREN, TokenKind.LEFT_BRACKET) || !c.style().isBinPackCallSite()
                || !TreeOps.isCallSite(c.leftOwner())) {
            return null;
        }
        FormatOps ops = c.ops();
        Token close = ops.matching(c.left());
        Length indent = ops.getApplyIndent(c.leftOwner());
        List<TreeNode> args = ops.getApplyArgs(c.ft(), false).getArgs();
        Token optimal = c.leftOwner().tokens().stream()
                .filter(t -> t.is(TokenKind.COMMA))
                .findFirst()
                .orElse(close);
        boolean isBracket = c.leftIs(TokenKind.LEFT_BRACKET);
        List<Token> exclude = ops.insideBlock(c.ft(), close, isBracket ? TokenKind.LEFT_BRACKET : TokenKind.LEFT_BRACE);
        List<TokenRange> excludeRanges = ops.parensRanges(exclude);
        Policy unindent = ops.unindentAtExclude(exclude, Length.num(-c.style().getContinuationIndentCallSite()), close);
        Policy unindentPolicy = args.size() == 1 ? unindent : Policy.NO_POLICY;
        Policy noSplitPolicy = ops.penalizeAllNewlines(close, 3, true, excludeRanges, false).andThen(unindent);
        return splits(
                new Split(Modification.NO_SPLIT, 0)
                        .withOptimalToken(optimal)
                        .withPolicy(noSplitPolicy)
                        .withIndent(indent, close, ExpiresOn.LEFT),
                new Split(Modification.NEWLINE, 2)
                        .withPolicy(unindentPolicy)
                        .withIndent(4, close, ExpiresOn.LEFT));
    }

    public static List<Split> emptyParens(RouteContext c) {
        if (c.leftIs(TokenKind.LEFT_PAREN) && c.rightIs(TokenKind.RIGHT_PAREN)) {
            return splits(new Split(Modification.NO_SPLIT, 0));
        }
        return null;
    }

    public static List<Split> keywordParen(RouteContext c) {
        if (c.leftIs(TokenKind.KW_IF, TokenKind.KW_FOR, TokenKind.KW_WHILE) && c.rightIs(TokenKind.LEFT_PAREN)
                && !c.style().isSpaceAfterKeywordBeforeParen()) {
            return splits(new Split(Modification.NO_SPLIT, 0));
        }
        return null;
    }

    /**
     * The general call and definition site: everything on one line, one
     * newline after the opening delimiter, one argument per line aligned to
     * the delimiter, or one argument per line after a newline.
     */
    public static List<Split> defaultApply(RouteContext c) {
        if (!c.leftIs(TokenKind.LEFT_PAREN, TokenKind.LEFT_BRACKET)) {
            return null;
        }
        TreeNode owner = c.leftOwner();
        boolean callSite = !TreeOps.isSuperfluousParenthesis(c.left(), owner)
                && !c.style().isBinPackCallSite() && TreeOps.isCallSite(owner);
        boolean defnSite = TreeOps.isDefnSite(owner);
        if (!callSite && !(defnSite && !c.style().isBinPackDefnSite())) {
            return null;
        }
        FormatOps ops = c.ops();
        Token close = ops.matching(c.left());
        FormatOps.ApplyArgs applyArgs = ops.getApplyArgs(c.ft(), false);
        List<TreeNode> args = applyArgs.getArgs();
        // in a long sequence of selects and applies, breaking the rightmost parens costs most
        int lhsPenalty = TreeOps.treeDepth(applyArgs.getLhs());

        // with zero arguments, multipleArgs is not !singleArgument
        boolean singleArgument = args.size() == 1;
        boolean multipleArgs = args.size() > 1;
        boolean notTooManyArgs = multipleArgs && args.size() <= 100;

        boolean isBracket = c.leftIs(TokenKind.LEFT_BRACKET);
        int bracketCoef = isBracket ? Constants.BRACKET_PENALTY : 1;
        int nestedPenalty = TreeOps.nestedApplies(owner) + lhsPenalty;

        List<Token> exclude;
        if (isBracket) {
            exclude = ops.insideBlock(c.ft(), close, TokenKind.LEFT_BRACKET);
        } else if (c.isActive(EditionGate.EDITION_2020_03) && multipleArgs) {
            exclude = Collections.emptyList();
        } else {
            exclude = ops.insideBlock(c.ft(), close, TokenKind.LEFT_BRACE);
        }
        List<TokenRange> excludeRanges = ops.parensRanges(exclude);
        Length indent = ops.getApplyIndent(owner);
        SingleLine singleLine = new SingleLine(ops, close, isBracket, singleArgument, excludeRanges);

        Modification newlineMod = Modification.NO_SPLIT.orNewline(c.rightIs(TokenKind.LEFT_BRACE));
        FormatToken closeFt = ops.at(close);
        Token expirationToken = defnSite && !isBracket
                ? ops.defnSiteLastToken(closeFt, owner)
                : ops.rhsOptimalToken(closeFt);

        boolean mustDangle = c.isActive(EditionGate.EDITION_2020_01) && expirationToken.is(TokenKind.COMMENT);
        boolean wouldDangle = defnSite
                ? c.style().isDanglingParenthesesDefnSite()
                : c.style().isDanglingParenthesesCallSite();
        Policy newlinePolicy = wouldDangle || mustDangle
                ? ops.newlinesOnlyBeforeClosePolicy(close)
                : Policy.NO_POLICY;

        boolean handleImplicit = c.isActive(EditionGate.EDITION_2020_03)
                && ops.opensImplicitParamList(c.ft(), args);
        Modification noSplitMod = handleImplicit && c.style().isBeforeImplicitParamListModifier()
                ? null
                : ops.getNoSplit(c.ft(), !isBracket);
        Length noSplitIndent = c.rightIs(TokenKind.COMMENT) ? indent : Length.num(0);

        boolean align = defnSite ? c.style().isAlignOpenParenDefnSite() : c.style().isAlignOpenParenCallSite();
        boolean alignTuple = align && TreeOps.isTuple(owner);

        boolean keepConfigStyleSplit = c.style().isConfigStyleArguments() && c.newlines() != 0;
        List<Split> splitsForAssign = null;
        if (!defnSite && !isBracket && !keepConfigStyleSplit) {
            Optional<TreeNode> assign = TreeOps.getAssignAtSingleArgCallSite(owner);
            if (assign.isPresent()) {
                splitsForAssign = assignArgumentSplits(c, assign.get(), close, indent, newlinePolicy, nestedPenalty);
            }
        }

        Policy noSplitPolicy;
        if (wouldDangle || mustDangle && isBracket) {
            noSplitPolicy = ops.singleLineBlock(close, excludeRanges);
        } else {
            noSplitPolicy = singleLine.policy(splitsForAssign != null ? 3 : 10);
        }
        Policy oneArgOneLine = newlinePolicy.andThen(ops.oneArgOneLineSplit(c.ft()));

        List<Split> result = splits(
                new Split(orNoSplit(noSplitMod), 0)
                        .withPolicy(noSplitPolicy)
                        .onlyIf(noSplitMod != null)
                        .withOptimalToken(expirationToken)
                        .withIndent(noSplitIndent, close, ExpiresOn.RIGHT),
                new Split(newlineMod, (1 + nestedPenalty) * bracketCoef)
                        .withPolicy(newlinePolicy.andThen(singleLine.policy(4)))
                        .onlyIf(!multipleArgs && !alignTuple && splitsForAssign == null)
                        .withOptimalToken(expirationToken)
                        .withIndent(indent, close, ExpiresOn.RIGHT),
                new Split(orNoSplit(noSplitMod), (2 + lhsPenalty) * bracketCoef)
                        .withPolicy(oneArgOneLine)
                        .onlyIf((handleImplicit || (notTooManyArgs && align)) && noSplitMod != null)
                        .withOptimalToken(expirationToken)
                        .withIndent(align ? Length.STATE_COLUMN : indent, close, ExpiresOn.RIGHT),
                new Split(Modification.NEWLINE, (3 + nestedPenalty) * bracketCoef)
                        .withPolicy(oneArgOneLine)
                        .onlyIf(!singleArgument && !alignTuple)
                        .withIndent(indent, close, ExpiresOn.RIGHT));
        if (splitsForAssign != null) {
            result.addAll(splitsForAssign);
        }
        return result;
    }

    /**
     * A single named argument, as in {@code foo(bar = baz)}: stay on the
     * line up to the {@code =} and break after it.
     */
    private static List<Split> assignArgumentSplits(RouteContext c, TreeNode assign, Token close, Length indent,
                                                    Policy newlinePolicy, int nestedPenalty) {
        FormatOps ops = c.ops();
        Optional<TreeNode> rhs = assign.child(Role.RHS);
        Token assignToken;
        if (rhs.isPresent() && rhs.get().is(NodeKind.TERM_BLOCK) && rhs.get().hasTokens()) {
            assignToken = rhs.get().firstToken();
        } else {
            assignToken = assign.tokens().stream()
                    .filter(t -> t.is(TokenKind.EQUALS))
                    .findFirst()
                    .orElse(assign.lastToken());
        }
        Token breakToken = ops.getOptimalTokenFor(assignToken);
        Policy newlineAfterAssign = newlinePolicy.isEmpty()
                ? Policy.NO_POLICY
                : ops.decideNewlinesOnlyAfterToken(breakToken);
        int noSplitCost = 1 + nestedPenalty;
        int newlineCost = Constants.EXCEED_COLUMN_PENALTY + noSplitCost;
        return splits(
                new Split(Modification.NEWLINE, newlineCost)
                        .withPolicy(newlinePolicy)
                        .withIndent(indent, close, ExpiresOn.RIGHT),
                new Split(Modification.NO_SPLIT, noSplitCost)
                        .withOptimalToken(breakToken)
                        .withPolicy(newlinePolicy
                                .andThen(newlineAfterAssign)
                                .andThen(ops.singleLineBlock(breakToken)))
                        .withIndent(indent, close, ExpiresOn.RIGHT));
    }

    /**
     * Newline penalties that keep an argument list on one line.
     */
    private static final class SingleLine {
        private final FormatOps ops;
        private final Token close;
        private final boolean isBracket;
        private final boolean singleArgument;
        private final List<TokenRange> insideBraces;

        SingleLine(FormatOps ops, Token close, boolean isBracket, boolean singleArgument,
                   List<TokenRange> insideBraces) {
            this.ops = ops;
            this.close = close;
            this.isBracket = isBracket;
            this.singleArgument = singleArgument;
            this.insideBraces = insideBraces;
        }

        Policy policy(int newlinePenalty) {
            if (isBracket) {
                return singleArgument
                        ? ops.penalizeAllNewlines(close, newlinePenalty, false, Collections.emptyList(), false)
                        : ops.singleLineBlock(close);
            }
            int penalty = singleArgument ? newlinePenalty : Constants.SHOULD_BE_NEWLINE;
            return ops.penalizeAllNewlines(close, penalty, !singleArgument, insideBraces, !singleArgument);
        }
    }

    public static List<Split> parenBrace(RouteContext c) {
        if (c.leftIs(TokenKind.LEFT_PAREN) && c.rightIs(TokenKind.LEFT_BRACE)) {
            return splits(new Split(Modification.NO_SPLIT, 0));
        }
        return null;
    }

    public static List<Split> xmlBraceOpen(RouteContext c) {
        if (c.rightIs(TokenKind.LEFT_BRACE) && TreeOps.isXml(c.rightOwner())) {
            return splits(new Split(Modification.NO_SPLIT, 0));
        }
        return null;
    }

    public static List<Split> xmlBraceClose(RouteContext c) {
        if (c.leftIs(TokenKind.RIGHT_BRACE) && TreeOps.isXml(c.leftOwner())) {
            return splits(new Split(Modification.NO_SPLIT, 0));
        }
        return null;
    }

    /**
     * A brace opening a lambda argument after a comma, as in
     * {@code foo(a, { x => ... })}.
     */
    public static List<Split> commaBrace(RouteContext c) {
        if (!c.leftIs(TokenKind.COMMA) || !c.rightIs(TokenKind.LEFT_BRACE)
                || c.style().isPoorMansTrailingCommasInConfigStyle()) {
            return null;
        }
        TreeNode owner = c.leftOwner();
        boolean unpacked = TreeOps.isCallSite(owner)
                ? !c.style().isBinPackCallSite()
                : TreeOps.isDefnSite(owner) && !c.style().isBinPackDefnSite();
        if (!unpacked) {
            return null;
        }
        FormatOps ops = c.ops();
        Token open = c.right();
        Token close = ops.matching(open);
        List<Split> result = splits(
                new Split(Modification.SPACE, 0),
                new Split(Modification.NEWLINE, 0)
                        .onlyIf(c.newlines() != 0 && open.getEndLine() == close.getStartLine())
                        .withOptimalToken(close, true)
                        .withPolicy(ops.singleLineBlock(close)));
        if (c.isActive(EditionGate.EDITION_2020_03)) {
            result.addAll(oneArgPerLineSplits(c, close));
        }
        return result;
    }

    private static List<Split> oneArgPerLineSplits(RouteContext c, Token close) {
        FormatOps ops = c.ops();
        TreeNode owner = c.rightOwner();
        boolean functionBody = owner.is(NodeKind.TERM_PARTIAL_FUNCTION)
                || (owner.is(NodeKind.TERM_BLOCK) && isSingleFunction(owner.children(Role.STAT)));
        if (functionBody) {
            return splits(new Split(Modification.NEWLINE, 0).onlyFor(SplitTag.ONE_ARG_PER_LINE));
        }
        Token breakAfter = ops.rhsOptimalToken(ops.next(ops.nextNonCommentSameLine(c.ft())));
        Policy multiLine = ops.newlinesOnlyBeforeClosePolicy(close)
                .orElse(ops.decideNewlinesOnlyAfterToken(breakAfter));
        return splits(
                new Split(Modification.NEWLINE, 0)
                        .withPolicy(ops.singleLineBlock(close))
                        .withOptimalToken(close, true)
                        .onlyFor(SplitTag.ONE_ARG_PER_LINE),
                new Split(Modification.SPACE, 1)
                        .withPolicy(multiLine)
                        .onlyFor(SplitTag.ONE_ARG_PER_LINE));
    }

    private static boolean isSingleFunction(List<TreeNode> stats) {
        return stats.size() == 1 && stats.get(0).is(NodeKind.TERM_FUNCTION, NodeKind.TERM_PARTIAL_FUNCTION);
    }

    public static List<Split> beforeBrace(RouteContext c) {
        if (c.rightIs(TokenKind.LEFT_BRACE)) {
            return splits(new Split(Modification.SPACE, 0));
        }
        return null;
    }

    public static List<Split> beforeComma(RouteContext c) {
        if (c.rightIs(TokenKind.COMMA)) {
            return splits(new Split(Modification.NO_SPLIT, 0));
        }
        return null;
    }

    /**
     * After a comma; mostly narrowed down by the policies of the enclosing
     * list.
     */
    public static List<Split> afterComma(RouteContext c) {
        if (!c.leftIs(TokenKind.COMMA)) {
            return null;
        }
        FormatOps ops = c.ops();
        TreeNode owner = c.leftOwner();
        Optional<TreeNode> nextArg = ops.argumentStartingAt(c.right());
        if (nextArg.isPresent() && ops.isBinPack(owner)) {
            return binPackedArgument(c, nextArg.get());
        }
        if (owner.is(NodeKind.TERM_APPLY_INFIX)) {
            // keep whatever the source does
            return splits(new Split(Modification.SPACE.orNewline(c.newlines() == 0), 0));
        }
        int indent = owner.is(NodeKind.DEFN_VAL, NodeKind.DEFN_VAR) ? c.style().getContinuationIndentDefnSite() : 0;
        boolean singleLineComment = TokenOps.isSingleLineComment(c.right());
        boolean noNewline = c.newlines() == 0 && (singleLineComment || c.isActive(EditionGate.EDITION_2020_01)
                && trailingComma(c));
        return splits(
                new Split(Modification.SPACE, 0).notIf(c.newlines() != 0 && singleLineComment),
                new Split(Modification.NEWLINE, 1)
                        .notIf(noNewline)
                        .withIndent(indent, c.right(), ExpiresOn.RIGHT));
    }

    private static boolean trailingComma(RouteContext c) {
        Token next = c.ops().nextNonComment(c.ft()).getRight();
        return next != c.right() && next.isAny(TokenKind.RIGHT_PAREN, TokenKind.RIGHT_BRACKET);
    }

    private static List<Split> binPackedArgument(RouteContext c, TreeNode nextArg) {
        FormatOps ops = c.ops();
        FormatToken lastFt = ops.at(nextArg.lastToken());
        FormatToken afterArg = c.tokens().offset(lastFt, 1);
        FormatToken nextComma = afterArg.getLeft().is(TokenKind.COMMA) && afterArg.getLeftOwner() == c.leftOwner()
                ? afterArg
                : null;
        Policy singleLine = ops.singleLineBlock(lastFt.getLeft());
        Policy breakOnNextComma = Policy.NO_POLICY;
        OptimalToken optimal = null;
        if (nextComma != null) {
            breakOnNextComma = Policy.of(nextComma.getRight(), "BreakOnNextComma(" + nextComma.getIndex() + ")",
                    d -> d.getFormatToken() == nextComma ? FormatOps.forceNewline(d) : null);
            optimal = new OptimalToken(ops.rhsOptimalToken(lastFt), true);
        }
        return splits(
                new Split(Modification.SPACE, 0).withOptimalToken(optimal).withPolicy(singleLine),
                new Split(Modification.NEWLINE, 1).withOptimalToken(optimal).withPolicy(singleLine),
                // the next argument does not fit on a line: break on both sides of it
                new Split(Modification.NEWLINE, 2).withOptimalToken(optimal).withPolicy(breakOnNextComma));
    }

    public static List<Split> beforeSemicolon(RouteContext c) {
        if (c.rightIs(TokenKind.SEMICOLON)) {
            return splits(new Split(Modification.NO_SPLIT, 0));
        }
        return null;
    }

    /**
     * Any other opening paren, e.g. around an expression.
     */
    public static List<Split> openParenFallback(RouteContext c) {
        if (!c.leftIs(TokenKind.LEFT_PAREN)) {
            return null;
        }
        FormatOps ops = c.ops();
        boolean isConfig = ops.opensConfigStyle(c.ft());
        Token close = ops.matching(c.left());
        Policy breakOnClose = Policy.of(close, "BreakBeforeClose(" + close.getIndex() + ")",
                d -> d.getFormatToken().getRight() == close ? splits(new Split(Modification.NEWLINE, 0)) : null);
        Length indent;
        if (c.rightIs(TokenKind.KW_IF)
                || (c.rightIs(TokenKind.KW_FOR) && !c.style().isIndentYieldKeyword())) {
            indent = Length.STATE_COLUMN;
        } else {
            indent = Length.num(0);
        }
        return splits(
                new Split(Modification.NEWLINE, 0)
                        .onlyIf(isConfig)
                        .withPolicy(breakOnClose)
                        .withIndent(c.style().getContinuationIndentCallSite(), close, ExpiresOn.RIGHT),
                new Split(Modification.NO_SPLIT, 0)
                        .notIf(isConfig)
                        .withIndent(indent, close, ExpiresOn.LEFT)
                        .withPolicy(ops.penalizeAllNewlines(close, 1)));
    }
}
