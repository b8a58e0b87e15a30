package com.formatrouter.router.rules;

import com.formatrouter.config.ImportSelectors;
import com.formatrouter.model.NodeKind;
import com.formatrouter.model.Token;
import com.formatrouter.model.TokenKind;
import com.formatrouter.router.Constants;
import com.formatrouter.router.FormatOps;
import com.formatrouter.router.RouteContext;
import com.formatrouter.router.TokenOps;
import com.formatrouter.router.TreeOps;
import com.formatrouter.split.ExpiresOn;
import com.formatrouter.split.Length;
import com.formatrouter.split.Modification;
import com.formatrouter.split.Policy;
import com.formatrouter.split.Split;

import java.util.List;

import static com.formatrouter.router.RouteContext.splits;

/**
 * File boundaries, string interpolation and import selector lists.
 */
public final class BoundaryRules {

    private BoundaryRules() {
    }

    public static List<Split> beginningOfFile(RouteContext c) {
        if (!c.leftIs(TokenKind.BOF)) {
            return null;
        }
        return splits(new Split(Modification.NO_SPLIT, 0));
    }

    public static List<Split> endOfFile(RouteContext c) {
        if (!c.rightIs(TokenKind.EOF)) {
            return null;
        }
        // files end with a trailing newline
        return splits(new Split(Modification.NEWLINE, 0));
    }

    public static List<Split> interpolationStart(RouteContext c) {
        if (!c.leftIs(TokenKind.INTERPOLATION_START)) {
            return null;
        }
        Token start = c.left();
        boolean stripMargin = c.ops().isMarginizedString(start);
        Token end = c.tokens().matchingOpt(start).orElse(start);
        Policy policy = TokenOps.isTripleQuote(start)
                ? Policy.NO_POLICY
                : c.ops().penalizeAllNewlines(end, Constants.BREAK_SINGLE_LINE_INTERPOLATED_STRING);
        // one column less than the state column: the margin character
        return splits(
                new Split(Modification.NO_SPLIT, 0)
                        .onlyIf(stripMargin)
                        .withPolicy(policy)
                        .withIndent(Length.STATE_COLUMN, end, ExpiresOn.LEFT)
                        .withIndent(-1, end, ExpiresOn.LEFT),
                new Split(Modification.NO_SPLIT, 0)
                        .notIf(stripMargin)
                        .withPolicy(policy));
    }

    public static List<Split> interpolationInterior(RouteContext c) {
        if (c.leftIs(TokenKind.INTERPOLATION_ID, TokenKind.INTERPOLATION_PART,
                TokenKind.INTERPOLATION_START, TokenKind.INTERPOLATION_SPLICE_START)
                || c.rightIs(TokenKind.INTERPOLATION_PART, TokenKind.INTERPOLATION_END,
                TokenKind.INTERPOLATION_SPLICE_END)) {
            return splits(new Split(Modification.NO_SPLIT, 0));
        }
        return null;
    }

    public static List<Split> emptyBraces(RouteContext c) {
        if (!c.leftIs(TokenKind.LEFT_BRACE) || !c.rightIs(TokenKind.RIGHT_BRACE)) {
            return null;
        }
        return splits(new Split(Modification.NO_SPLIT, 0));
    }

    public static List<Split> importDotBrace(RouteContext c) {
        if (c.leftIs(TokenKind.DOT) && c.rightIs(TokenKind.LEFT_BRACE)
                && TreeOps.existsParentOfType(c.rightOwner(), NodeKind.IMPORT)) {
            return splits(new Split(Modification.NO_SPLIT, 0));
        }
        return null;
    }

    /**
     * Opening brace of an import selector list, laid out according to
     * {@code importSelectors}.
     */
    public static List<Split> importOpenBrace(RouteContext c) {
        if (!c.leftIs(TokenKind.LEFT_BRACE) || !TreeOps.existsParentOfType(c.leftOwner(), NodeKind.IMPORT)) {
            return null;
        }
        FormatOps ops = c.ops();
        Token close = ops.matching(c.left());
        boolean singleLineOnly = c.style().getImportSelectors() == ImportSelectors.SINGLE_LINE;
        Policy policy = ops.singleLineBlock(close, List.of(), !singleLineOnly, false);
        Policy newlineBeforeClose = ops.newlinesOnlyBeforeClosePolicy(close);
        Policy newlinePolicy = switch (c.style().getImportSelectors()) {
            case NO_BIN_PACK -> newlineBeforeClose.andThen(ops.oneArgOneLineSplit(c.ft()));
            case BIN_PACK -> newlineBeforeClose;
            case SINGLE_LINE -> ops.singleLineBlock(close);
        };
        return splits(
                new Split(Modification.space(c.style().isSpaceInImportCurlyBraces()), 0)
                        .withPolicy(policy),
                new Split(Modification.NEWLINE, 1)
                        .onlyIf(!singleLineOnly)
                        .withPolicy(newlinePolicy)
                        .withIndent(2, close, ExpiresOn.RIGHT));
    }

    public static List<Split> interpolationOpenBrace(RouteContext c) {
        if (c.leftIs(TokenKind.LEFT_BRACE) && TreeOps.isInterpolate(c.leftOwner())) {
            return splits(new Split(Modification.NO_SPLIT, 0));
        }
        return null;
    }

    public static List<Split> selectorCloseBrace(RouteContext c) {
        if (!c.rightIs(TokenKind.RIGHT_BRACE)) {
            return null;
        }
        boolean inImport = TreeOps.existsParentOfType(c.rightOwner(), NodeKind.IMPORT);
        if (!inImport && !TreeOps.isInterpolate(c.rightOwner())) {
            return null;
        }
        boolean isInterpolate = c.rightOwner().is(NodeKind.TERM_INTERPOLATE);
        return splits(
                new Split(Modification.space(c.style().isSpaceInImportCurlyBraces() && !isInterpolate), 0),
                // only taken when the opening brace forced a newline before the close
                new Split(Modification.NEWLINE, Constants.SHOULD_BE_NEWLINE).onlyIf(inImport));
    }

    public static List<Split> importWildcard(RouteContext c) {
        if (c.leftIs(TokenKind.DOT) && c.rightIs(TokenKind.UNDERSCORE)
                && TreeOps.existsParentOfType(c.rightOwner(), NodeKind.IMPORT)) {
            return splits(new Split(Modification.NO_SPLIT, 0));
        }
        return null;
    }
}
