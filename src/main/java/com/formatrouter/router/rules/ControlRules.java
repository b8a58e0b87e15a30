package com.formatrouter.router.rules;

import com.formatrouter.api.error.UnexpectedTreeException;
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
import com.formatrouter.split.Policy;
import com.formatrouter.split.Split;

import java.util.List;
import java.util.Optional;

import static com.formatrouter.router.RouteContext.splits;

/**
 * Conditionals, loops, for comprehensions, pattern cases and
 * try / catch / finally.
 */
public final class ControlRules {

    private ControlRules() {
    }

    /**
     * The condition of {@code if}, {@code while} and {@code for}.
     */
    public static List<Split> controlParen(RouteContext c) {
        if (!c.leftIs(TokenKind.LEFT_PAREN)
                || !c.leftOwner().is(NodeKind.TERM_IF, NodeKind.TERM_WHILE, NodeKind.TERM_FOR, NodeKind.TERM_FOR_YIELD)
                || TreeOps.isSuperfluousParenthesis(c.left(), c.leftOwner())) {
            return null;
        }
        FormatOps ops = c.ops();
        Token close = ops.matching(c.left());
        Length indent = c.style().isAlignIfWhileOpenParen()
                ? Length.STATE_COLUMN
                : Length.num(c.style().getContinuationIndentCallSite());
        return splits(new Split(Modification.NO_SPLIT, 0)
                .withIndent(indent, close, ExpiresOn.LEFT)
                .withPolicy(ops.penalizeNewlineByNesting(c.left(), close)));
    }

    /**
     * Either the whole if / else chain fits on one line, or every
     * {@code else} of the chain starts a new one.
     */
    public static List<Split> ifKeyword(RouteContext c) {
        if (!c.leftIs(TokenKind.KW_IF) || !c.leftOwner().is(NodeKind.TERM_IF)) {
            return null;
        }
        FormatOps ops = c.ops();
        TreeNode owner = c.leftOwner();
        Token last = owner.child(Role.ELSE)
                .filter(TreeNode::hasTokens)
                .map(TreeNode::lastToken)
                .orElse(owner.lastToken());
        Token expire = ops.rhsOptimalToken(ops.at(last));
        List<Token> elses = ops.getElseChain(owner);
        Policy breakOnlyBeforeElse = Policy.NO_POLICY;
        if (!elses.isEmpty()) {
            breakOnlyBeforeElse = Policy.of(expire, "BreakOnlyBeforeElse(" + c.left().getIndex() + ")", d -> {
                Token right = d.getFormatToken().getRight();
                return right.is(TokenKind.KW_ELSE) && elses.contains(right)
                        ? d.onlyNewlinesWithFallback(new Split(Modification.NEWLINE, 0))
                        : null;
            });
        }
        return splits(
                new Split(Modification.SPACE, 0)
                        .withOptimalToken(expire, true)
                        .withPolicy(ops.singleLineBlock(expire)),
                new Split(Modification.SPACE, 1).withPolicy(breakOnlyBeforeElse));
    }

    public static List<Split> controlCloseParen(RouteContext c) {
        if (!c.leftIs(TokenKind.RIGHT_PAREN)) {
            return null;
        }
        TreeNode owner = c.leftOwner();
        boolean applies;
        Role bodyRole;
        switch (owner.getKind()) {
            case TERM_IF -> {
                applies = true;
                bodyRole = Role.THEN;
            }
            case TERM_FOR -> {
                applies = true;
                bodyRole = Role.BODY;
            }
            case TERM_FOR_YIELD -> {
                applies = c.style().isIndentYieldKeyword();
                bodyRole = Role.BODY;
            }
            case TERM_WHILE -> {
                applies = c.isActive(EditionGate.EDITION_2020_01);
                bodyRole = Role.BODY;
            }
            default -> {
                applies = false;
                bodyRole = Role.NONE;
            }
        }
        if (!applies || TreeOps.isFirstOrLastToken(c.left(), owner)) {
            return null;
        }
        Optional<TreeNode> body = owner.child(bodyRole).filter(TreeNode::hasTokens);
        if (!body.isPresent()) {
            return null;
        }
        FormatOps ops = c.ops();
        Token expire = body.get().lastToken();
        List<TokenRange> exclude = ops.parensRanges(ops.insideBlock(c.ft(), expire, TokenKind.LEFT_BRACE));
        return splits(
                new Split(Modification.SPACE, 0)
                        .notIf(TokenOps.isSingleLineComment(c.right()) || c.newlines() != 0)
                        .withPolicy(ops.singleLineBlock(expire, exclude)),
                new Split(Modification.NEWLINE, 1).withIndent(2, expire, ExpiresOn.LEFT));
    }

    public static List<Split> braceElse(RouteContext c) {
        if (!c.leftIs(TokenKind.RIGHT_BRACE) || !c.rightIs(TokenKind.KW_ELSE)) {
            return null;
        }
        TreeNode owner = c.leftOwner();
        boolean newlineOnly = c.style().isAlwaysBeforeElseAfterCurlyIf()
                || !owner.is(NodeKind.TERM_BLOCK)
                || !owner.getParent().map(p -> p == c.rightOwner()).orElse(true);
        return splits(
                new Split(Modification.SPACE.orNewline(!newlineOnly), 0),
                // taken only when the if keyword breaks before every else
                new Split(Modification.NEWLINE, Constants.SHOULD_BE_NEWLINE).onlyIf(!newlineOnly));
    }

    public static List<Split> braceYield(RouteContext c) {
        if (c.leftIs(TokenKind.RIGHT_BRACE) && c.rightIs(TokenKind.KW_YIELD)) {
            return splits(new Split(Modification.SPACE, 0));
        }
        return null;
    }

    public static List<Split> beforeElseOrYield(RouteContext c) {
        if (!c.rightIs(TokenKind.KW_ELSE, TokenKind.KW_YIELD)) {
            return null;
        }
        FormatOps ops = c.ops();
        Token expire = ops.rhsOptimalToken(ops.at(c.rightOwner().lastToken()));
        List<TokenRange> exclude = ops.parensRanges(ops.insideBlock(c.ft(), expire, TokenKind.LEFT_BRACE));
        return splits(
                new Split(Modification.SPACE, 0)
                        .onlyIf(c.newlines() == 0)
                        .withPolicy(ops.singleLineBlock(expire, exclude)),
                new Split(Modification.NEWLINE, 1));
    }

    /**
     * The last {@code else} of a chain; an {@code else if} is left to the
     * {@code if} keyword.
     *
     * @throws UnexpectedTreeException when the {@code else} does not belong
     *                                 to an {@code if}
     */
    public static List<Split> lastElse(RouteContext c) {
        if (!c.leftIs(TokenKind.KW_ELSE)) {
            return null;
        }
        TreeNode owner = c.leftOwner();
        if (!owner.is(NodeKind.TERM_IF)) {
            throw new UnexpectedTreeException(NodeKind.TERM_IF, owner, c.ft());
        }
        Optional<TreeNode> elsep = owner.child(Role.ELSE);
        if (elsep.map(e -> e.is(NodeKind.TERM_IF)).orElse(false)) {
            return null;
        }
        Token expire = elsep.filter(TreeNode::hasTokens).map(TreeNode::lastToken).orElse(owner.lastToken());
        return splits(
                new Split(Modification.SPACE, 0)
                        .onlyIf(c.newlines() == 0)
                        .withPolicy(c.ops().singleLineBlock(expire)),
                new Split(Modification.NEWLINE, 1).withIndent(2, expire, ExpiresOn.LEFT));
    }

    /**
     * Either the whole case clause fits on one line, or its body starts on
     * the line after the arrow.
     */
    public static List<Split> caseKeyword(RouteContext c) {
        if (!c.leftIs(TokenKind.KW_CASE) || !c.leftOwner().is(NodeKind.CASE)) {
            return null;
        }
        FormatOps ops = c.ops();
        TreeNode owner = c.leftOwner();
        Token arrow = ops.getCaseArrow(owner).getLeft();
        // an empty body expires on the arrow
        Token expire = owner.child(Role.BODY)
                .filter(body -> body.tokens().stream().anyMatch(t -> !t.getKind().isTrivia()))
                .map(body -> ops.getOptimalTokenFor(body.lastToken()))
                .orElse(arrow);
        Policy breakAfterArrow = Policy.of(expire, "BreakAfterCaseArrow(" + arrow.getIndex() + ")", d -> {
            FormatToken t = d.getFormatToken();
            if (t.getLeft() == arrow && !t.getRight().is(TokenKind.LEFT_BRACE)
                    && !TokenOps.isAttachedSingleLineComment(t)) {
                return d.onlyNewlinesWithoutFallback();
            }
            return null;
        });
        return splits(
                new Split(Modification.SPACE, 0)
                        .withOptimalToken(expire, true)
                        .withPolicy(ops.singleLineBlock(expire)),
                new Split(Modification.SPACE, 1)
                        .withPolicy(breakAfterArrow)
                        .withIndent(2, expire, ExpiresOn.LEFT)
                        .withIndent(2, arrow, ExpiresOn.LEFT));
    }

    public static List<Split> caseGuard(RouteContext c) {
        if (!c.rightIs(TokenKind.KW_IF) || !c.rightOwner().is(NodeKind.CASE)) {
            return null;
        }
        FormatOps ops = c.ops();
        Token arrow = ops.getCaseArrow(c.rightOwner()).getLeft();
        List<TokenRange> exclude = ops.parensRanges(ops.insideBlock(c.ft(), arrow, TokenKind.LEFT_BRACE));
        return splits(
                new Split(Modification.SPACE, 0).withPolicy(ops.singleLineBlock(arrow, exclude)),
                new Split(Modification.NEWLINE, 1).withPolicy(ops.penalizeNewlineByNesting(c.right(), arrow)));
    }

    public static List<Split> enumeratorGuard(RouteContext c) {
        if (!c.rightIs(TokenKind.KW_IF) || !c.rightOwner().is(NodeKind.ENUMERATOR_GUARD)) {
            return null;
        }
        return splits(
                new Split(Modification.SPACE, 0).onlyIf(c.newlines() == 0),
                new Split(Modification.NEWLINE, 1));
    }

    public static List<Split> generatorArrow(RouteContext c) {
        if (!c.leftIs(TokenKind.LEFT_ARROW) || !c.leftOwner().is(NodeKind.ENUMERATOR_GENERATOR)) {
            return null;
        }
        Length indent = c.style().isAlignArrowEnumeratorGenerator() ? Length.STATE_COLUMN : Length.num(0);
        return splits(new Split(Modification.SPACE, 0)
                .withIndent(indent, c.leftOwner().lastToken(), ExpiresOn.LEFT));
    }

    public static List<Split> yieldKeyword(RouteContext c) {
        if (!c.leftIs(TokenKind.KW_YIELD) || !c.leftOwner().is(NodeKind.TERM_FOR_YIELD)) {
            return null;
        }
        if (c.style().isAvoidAfterYield() && !c.rightOwner().is(NodeKind.TERM_IF)) {
            return splits(new Split(Modification.SPACE, 0));
        }
        Token lastToken = c.leftOwner().child(Role.BODY)
                .filter(TreeNode::hasTokens)
                .map(TreeNode::lastToken)
                .orElse(c.leftOwner().lastToken());
        return splits(
                new Split(Modification.SPACE, 0).withPolicy(c.ops().singleLineBlock(lastToken)),
                new Split(Modification.NEWLINE, 1).withIndent(2, lastToken, ExpiresOn.LEFT));
    }

    /**
     * {@code catch} and {@code finally} start a new line unless they follow
     * a closing brace and the style keeps them there.
     */
    public static List<Split> catchFinally(RouteContext c) {
        if (!c.rightIs(TokenKind.KW_CATCH, TokenKind.KW_FINALLY)) {
            return null;
        }
        if (c.style().isBetweenCurlyAndCatchFinally() || !c.leftIs(TokenKind.RIGHT_BRACE)) {
            return splits(new Split(Modification.NEWLINE, 0));
        }
        return splits(
                new Split(Modification.SPACE, 0),
                new Split(Modification.NEWLINE, Constants.SHOULD_BE_NEWLINE));
    }
}
