package com.formatrouter.router.rules;

import com.formatrouter.config.EditionGate;
import com.formatrouter.model.FormatToken;
import com.formatrouter.model.NodeKind;
import com.formatrouter.model.Role;
import com.formatrouter.model.Token;
import com.formatrouter.model.TokenKind;
import com.formatrouter.model.TreeNode;
import com.formatrouter.router.FormatOps;
import com.formatrouter.router.RouteContext;
import com.formatrouter.router.TokenOps;
import com.formatrouter.router.TreeOps;
import com.formatrouter.split.ExpiresOn;
import com.formatrouter.split.Modification;
import com.formatrouter.split.Policy;
import com.formatrouter.split.Split;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.formatrouter.router.RouteContext.splits;

/**
 * Braced blocks, lambda and case arrows, and statement boundaries.
 */
public final class BlockRules {

    private BlockRules() {
    }

    /**
     * Opening brace of a block. Offers the block on one line, a curly lambda
     * whose parameters stay on the brace's line, and the block broken after
     * the brace.
     */
    public static List<Split> openBrace(RouteContext c) {
        if (!c.leftIs(TokenKind.LEFT_BRACE)) {
            return null;
        }
        FormatOps ops = c.ops();
        Token open = c.left();
        Token close = ops.matching(open);
        FormatToken closeFt = ops.at(close);
        Policy newlineBeforeClosingCurly = ops.newlinesOnlyBeforeClosePolicy(close);

        Optional<TreeNode> selfAnnotation = c.leftOwner().is(NodeKind.TEMPLATE)
                ? c.leftOwner().child(Role.SELF).filter(TreeNode::hasTokens)
                : Optional.empty();
        boolean isSelfAnnotation = c.style().isSelfAnnotationNewline()
                && c.newlines() > 0
                && selfAnnotation.isPresent();
        Modification nl = isSelfAnnotation
                ? TokenOps.newlines2Modification(c.ft())
                : Modification.newline(ops.shouldGet2xNewlines(c.ft()));

        FormatToken lambdaExpire = null;
        Token lambdaArrow = null;
        int lambdaIndent = 0;
        Optional<TreeNode> lambda = ops.statementStartingAt(c.right()).filter(s -> s.is(NodeKind.TERM_FUNCTION));
        if (lambda.isPresent()) {
            Optional<FormatToken> arrow = ops.getFuncArrow(TreeOps.lastLambda(lambda.get()));
            List<TreeNode> params = lambda.get().children(Role.PARAM);
            Token lastParam = params.isEmpty() || !params.get(params.size() - 1).hasTokens()
                    ? lambda.get().firstToken()
                    : params.get(params.size() - 1).lastToken();
            lambdaExpire = arrow.orElse(ops.at(lastParam));
            lambdaArrow = arrow.map(FormatToken::getLeft).orElse(null);
        } else if (selfAnnotation.isPresent()) {
            Optional<Token> arrow = c.leftOwner().tokens().stream()
                    .filter(t -> t.is(TokenKind.RIGHT_ARROW))
                    .findFirst();
            lambdaExpire = ops.at(arrow.orElse(selfAnnotation.get().lastToken()));
            lambdaArrow = arrow.orElse(null);
            lambdaIndent = 2;
        }
        Policy lambdaPolicy = null;
        if (lambdaExpire != null) {
            Token arrowOptimal = ops.getOptimalTokenFor(lambdaExpire);
            lambdaPolicy = newlineBeforeClosingCurly
                    .andThen(ops.singleLineBlock(arrowOptimal))
                    .andThen(ops.decideNewlinesOnlyAfterToken(arrowOptimal));
        }

        int singleLineCost = 0;
        Policy singleLineDecision;
        if (lambdaPolicy == null) {
            singleLineDecision = singleLineDecision(c, close, closeFt);
        } else if (c.isActive(EditionGate.EDITION_2020_01)
                && !c.style().isAlwaysBeforeCurlyBraceLambdaParams()
                && ops.getSpaceAndNewlineAfterCurlyLambda(c.newlines()).isSpaceAllowed()) {
            // a single-line lambda in the middle of an infix expression costs more
            singleLineCost = isInfixLhs(c.leftOwner()) ? 1 : 0;
            singleLineDecision = singleLineDecisionSince2019Nov(c, close, closeFt);
        } else {
            singleLineDecision = null;
        }

        Split singleLineSplit;
        if (singleLineDecision == null) {
            singleLineSplit = Split.ignored();
        } else {
            Token expire = lambdaPolicy == null ? close : ops.endOfSingleLineBlock(closeFt);
            Policy policy = ops.singleLineBlock(expire, List.of(), true, true).andThen(singleLineDecision);
            singleLineSplit = new Split(FormatOps.xmlSpace(c.leftOwner()), singleLineCost)
                    .withPolicy(policy)
                    .withOptimalToken(expire, true);
        }

        return splits(
                singleLineSplit,
                new Split(Modification.SPACE, 0)
                        .notIf(c.style().isAlwaysBeforeCurlyBraceLambdaParams()
                                || isSelfAnnotation || lambdaPolicy == null)
                        .withOptimalToken(lambdaArrow)
                        .withIndent(lambdaIndent, close, ExpiresOn.RIGHT)
                        .withPolicy(lambdaPolicy),
                new Split(nl, 1)
                        .withPolicy(newlineBeforeClosingCurly)
                        .withIndent(2, close, ExpiresOn.RIGHT));
    }

    private static boolean isInfixLhs(TreeNode owner) {
        Optional<TreeNode> parent = owner.getParent();
        if (!parent.isPresent()) {
            return false;
        }
        Optional<TreeNode> grandParent = parent.get().getParent();
        return grandParent.isPresent()
                && grandParent.get().is(NodeKind.TERM_APPLY_INFIX)
                && grandParent.get().child(Role.LHS).map(lhs -> lhs == parent.get()).orElse(false);
    }

    // null when the block must not be offered on a single line
    private static Policy singleLineDecision(RouteContext c, Token close, FormatToken closeFt) {
        if (c.newlines() > 0) {
            return null;
        }
        if (c.isActive(EditionGate.EDITION_2019_11)) {
            return singleLineDecisionSince2019Nov(c, close, closeFt);
        }
        boolean continued = c.leftOwner().getParent()
                .map(p -> p.is(NodeKind.TERM_IF, NodeKind.TERM_TRY, NodeKind.TERM_TRY_WITH_HANDLER))
                .orElse(false);
        return continued ? null : Policy.NO_POLICY;
    }

    /**
     * Breaks after the closing brace when an {@code else}, {@code catch} or
     * {@code finally} continues the statement.
     */
    private static Policy singleLineDecisionSince2019Nov(RouteContext c, Token close, FormatToken closeFt) {
        Set<TokenKind> continuations = EnumSet.noneOf(TokenKind.class);
        TreeNode owner = c.leftOwner();
        if (owner.is(NodeKind.TERM_TRY) && c.rightOwner().is(NodeKind.CASE)) {
            // catch cases: only a finally can follow
            continuations.add(TokenKind.KW_FINALLY);
        } else if (c.isActive(EditionGate.EDITION_2020_01)) {
            Optional<TreeNode> parent = owner.getParent();
            if (parent.isPresent() && parent.get().is(NodeKind.TERM_IF)) {
                continuations.add(TokenKind.KW_ELSE);
            } else if (parent.isPresent() && parent.get().is(NodeKind.TERM_TRY, NodeKind.TERM_TRY_WITH_HANDLER)) {
                continuations.add(TokenKind.KW_CATCH);
                continuations.add(TokenKind.KW_FINALLY);
            }
        }
        if (!continuations.contains(closeFt.getRight().getKind())) {
            return Policy.NO_POLICY;
        }
        return c.ops().decideNewlinesOnlyAfterClose(new Split(Modification.NEWLINE, 0), close);
    }

    /**
     * Arrow of a curly lambda whose body starts a statement, as in
     * {@code xs.map { x => f(x) }}.
     */
    public static List<Split> statementLambdaArrow(RouteContext c) {
        if (!c.leftIs(TokenKind.RIGHT_ARROW) || !c.ops().startsStatement(c.ft())
                || !c.leftOwner().is(NodeKind.TERM_FUNCTION)) {
            return null;
        }
        FormatOps ops = c.ops();
        TreeNode function = c.leftOwner();
        Token endOfFunction = function.child(Role.BODY)
                .filter(TreeNode::hasTokens)
                .map(TreeNode::lastToken)
                .orElse(function.lastToken());
        boolean canBeSpace = ops.statementStartingAt(c.right())
                .map(s -> s.is(NodeKind.TERM_FUNCTION))
                .orElse(false);
        FormatOps.CurlyLambdaBreak curly = ops.getSpaceAndNewlineAfterCurlyLambda(c.newlines());
        Split spaceSplit;
        if (canBeSpace) {
            spaceSplit = new Split(Modification.SPACE, 0);
        } else if (curly.isSpaceAllowed() && c.isActive(EditionGate.EDITION_2020_01)) {
            spaceSplit = new Split(Modification.SPACE, 0)
                    .withPolicy(ops.singleLineBlock(ops.getOptimalTokenFor(endOfFunction), List.of(), true, true));
        } else {
            spaceSplit = Split.ignored();
        }
        return splits(
                spaceSplit,
                new Split(curly.getNewline(), 1).withIndent(2, endOfFunction, ExpiresOn.LEFT));
    }

    public static List<Split> lambdaArrow(RouteContext c) {
        if (!c.leftIs(TokenKind.RIGHT_ARROW) || !c.leftOwner().is(NodeKind.TERM_FUNCTION)) {
            return null;
        }
        FormatOps ops = c.ops();
        TreeNode function = c.leftOwner();
        FormatOps.FunctionExpiry expiry = ops.functionExpire(function);
        Token endOfFunction = expiry.getToken();
        boolean hasSingleLineComment = TokenOps.isSingleLineComment(c.right());
        // `{ x => }` has nothing to indent
        int indent = TreeOps.isEmptyFunctionBody(function) && !c.rightIs(TokenKind.COMMENT) ? 0 : 2;
        Split singleLineSplit = new Split(Modification.SPACE, 0)
                .notIf(hasSingleLineComment)
                .withPolicy(ops.singleLineBlock(endOfFunction));
        Split newlineSplit = new Split(Modification.NEWLINE, 1 + TreeOps.nestedApplies(function))
                .withIndent(indent, endOfFunction, expiry.getExpiresOn());

        if (hasSingleLineComment) {
            return splits(singleLineSplit, newlineSplit);
        }
        if (!c.isActive(EditionGate.EDITION_2020_01)) {
            // break after a following brace, or right here
            boolean hasBlock = ops.nextNonComment(c.ft()).getRight().is(TokenKind.LEFT_BRACE);
            return splits(singleLineSplit, hasBlock ? new Split(Modification.SPACE, 0) : newlineSplit);
        }
        // break after a same-line comment or an opening brace when it fits
        FormatToken nonComment = ops.nextNonCommentSameLine(c.ft());
        boolean hasBlock = nonComment.getRight().is(TokenKind.LEFT_BRACE)
                && c.tokens().matchingOpt(nonComment.getRight()).map(t -> t == endOfFunction).orElse(false);
        if (!hasBlock && nonComment == c.ft()) {
            return splits(singleLineSplit, newlineSplit);
        }
        // the brace rule indents the block itself
        int spaceIndent = hasBlock ? 0 : indent;
        return splits(
                singleLineSplit,
                new Split(Modification.SPACE, 0)
                        .withIndent(spaceIndent, endOfFunction, expiry.getExpiresOn())
                        .withOptimalToken(ops.getOptimalTokenFor(ops.next(nonComment))),
                newlineSplit);
    }

    public static List<Split> caseArrow(RouteContext c) {
        if (!c.leftIs(TokenKind.RIGHT_ARROW) || !c.leftOwner().is(NodeKind.CASE)) {
            return null;
        }
        TreeNode caseClause = c.leftOwner();
        boolean bracedBody = c.rightIs(TokenKind.LEFT_BRACE)
                && caseClause.child(Role.BODY).map(b -> b == c.rightOwner()).orElse(false);
        if (bracedBody) {
            // redundant braces around the case body
            return splits(new Split(Modification.SPACE, 0)
                    .withIndent(-2, c.rightOwner().lastToken(), ExpiresOn.LEFT));
        }
        return splits(
                // killed by the case keyword's policy when the clause does not fit
                new Split(Modification.SPACE, 0).onlyIf(c.newlines() == 0),
                new Split(Modification.newline(false, TokenOps.rhsIsCommentedOut(c.ft())), 1));
    }

    public static List<Split> semicolonStatement(RouteContext c) {
        if (!c.leftIs(TokenKind.SEMICOLON) || !c.ops().startsStatement(c.ft()) || c.newlines() != 0) {
            return null;
        }
        FormatOps ops = c.ops();
        Token expire = ops.statementStartingAt(c.right()).get().lastToken();
        return splits(
                new Split(Modification.SPACE, 0)
                        .withOptimalToken(expire)
                        .withPolicy(ops.singleLineBlock(expire)),
                new Split(Modification.newline(ops.shouldGet2xNewlines(c.ft())), 0));
    }

    public static List<Split> statementStart(RouteContext c) {
        FormatOps ops = c.ops();
        if (!ops.startsStatement(c.ft())) {
            return null;
        }
        Modification newline = Modification.newline(ops.shouldGet2xNewlines(c.ft()));
        Token expire = statementExpire(c);
        boolean annoRight = c.rightIs(TokenKind.AT);
        boolean annoLeft = ops.isSingleIdentifierAnnotation(ops.prev(c.ft()));
        if ((annoRight || annoLeft) && c.style().isAnnotationNewlines()) {
            return splits(new Split(TokenOps.newlines2Modification(c.ft()), 0));
        }
        boolean spaceCouldBeOk = annoLeft && c.newlines() == 0 && c.right().getKind().isKeyword();
        return splits(
                new Split(Modification.SPACE, 0)
                        .onlyIf(spaceCouldBeOk)
                        .withOptimalToken(expire)
                        .withPolicy(ops.singleLineBlock(expire)),
                new Split(newline, 0));
    }

    // the definition's `=` (or the brace opening its body), else the end of the statement
    private static Token statementExpire(RouteContext c) {
        TreeNode owner = c.rightOwner();
        if (!owner.hasTokens()) {
            return c.right();
        }
        for (Token token : owner.tokens()) {
            if (token.is(TokenKind.EQUALS)) {
                FormatToken afterEquals = c.ops().at(token);
                return afterEquals.getRight().is(TokenKind.LEFT_BRACE) ? afterEquals.getRight() : token;
            }
        }
        return owner.lastToken();
    }

    public static List<Split> closeBrace(RouteContext c) {
        if (!c.rightIs(TokenKind.RIGHT_BRACE)) {
            return null;
        }
        return splits(
                new Split(FormatOps.xmlSpace(c.rightOwner()), 0),
                new Split(Modification.newline(c.newlines() > 1), 0));
    }

    public static List<Split> packageKeyword(RouteContext c) {
        if (!c.leftIs(TokenKind.KW_PACKAGE) || !c.leftOwner().is(NodeKind.PKG)) {
            return null;
        }
        return splits(new Split(Modification.SPACE, 0));
    }
}
