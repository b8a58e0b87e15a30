package com.formatrouter.router.rules;

import com.formatrouter.config.EditionGate;
import com.formatrouter.model.NodeKind;
import com.formatrouter.model.TokenKind;
import com.formatrouter.model.TreeNode;
import com.formatrouter.router.Constants;
import com.formatrouter.router.FormatOps;
import com.formatrouter.router.RouteContext;
import com.formatrouter.router.TokenOps;
import com.formatrouter.router.TreeOps;
import com.formatrouter.split.Modification;
import com.formatrouter.split.Split;

import java.util.List;
import java.util.Optional;

import static com.formatrouter.router.RouteContext.splits;

/**
 * Comments, infix operators, patterns and the catch-all spacing rules tried
 * last.
 */
public final class FallbackRules {

    private FallbackRules() {
    }

    private static List<Split> noSplit() {
        return splits(new Split(Modification.NO_SPLIT, 0));
    }

    private static List<Split> space() {
        return splits(new Split(Modification.SPACE, 0));
    }

    // a newline only taken when a policy of an enclosing construct forces one
    private static Split dormantNewline() {
        return new Split(Modification.NEWLINE, Constants.SHOULD_BE_NEWLINE);
    }

    public static List<Split> returnKeyword(RouteContext c) {
        if (!c.leftIs(TokenKind.KW_RETURN)) {
            return null;
        }
        // a bare return ends its line
        boolean bare = c.leftOwner().is(NodeKind.TERM_RETURN) && c.leftOwner().getChildren().stream()
                .anyMatch(child -> child.is(NodeKind.LIT_UNIT) && !child.hasTokens());
        return splits(new Split(bare ? Modification.NEWLINE : Modification.SPACE, 0));
    }

    public static List<Split> typeVariance(RouteContext c) {
        if (c.leftIs(TokenKind.IDENT) && c.rightIs(TokenKind.IDENT, TokenKind.UNDERSCORE)
                && TreeOps.isTypeVariant(c.leftOwner())) {
            return noSplit();
        }
        return null;
    }

    public static List<Split> repeatedType(RouteContext c) {
        if (c.right().isIdent("*") && c.rightOwner().is(NodeKind.TYPE_REPEATED)) {
            return noSplit();
        }
        return null;
    }

    public static List<Split> infixLeft(RouteContext c) {
        if (c.leftIs(TokenKind.IDENT) && TreeOps.isApplyInfixOp(c.leftOwner())) {
            return splits(c.ops().infixSplit(c.leftOwner().getParent().get(), c.ft()));
        }
        return null;
    }

    public static List<Split> infixRight(RouteContext c) {
        if (c.rightIs(TokenKind.IDENT) && TreeOps.isApplyInfixOp(c.rightOwner())) {
            return splits(c.ops().infixSplit(c.rightOwner().getParent().get(), c.ft()));
        }
        return null;
    }

    public static List<Split> commentRight(RouteContext c) {
        if (c.rightIs(TokenKind.COMMENT)) {
            return splits(new Split(TokenOps.newlines2Modification(c.ft()), 0));
        }
        return null;
    }

    /**
     * Commented-out code stays where it is.
     */
    public static List<Split> singleLineCommentLeft(RouteContext c) {
        if (TokenOps.isSingleLineComment(c.left())) {
            return splits(new Split(Modification.NEWLINE, 0));
        }
        return null;
    }

    public static List<Split> commentLeft(RouteContext c) {
        if (c.leftIs(TokenKind.COMMENT)) {
            return splits(new Split(TokenOps.newlines2Modification(c.ft()), 0));
        }
        return null;
    }

    /**
     * The modifier of an implicit parameter list, as in
     * {@code (implicit a: A, b: B)}.
     */
    public static List<Split> implicitModifier(RouteContext c) {
        if (!c.leftIs(TokenKind.KW_IMPLICIT) || !c.isActive(EditionGate.EDITION_2020_03)) {
            return null;
        }
        FormatOps ops = c.ops();
        Optional<List<TreeNode>> params = ops.opensImplicitParamList(ops.prevNonComment(ops.prev(c.ft())));
        if (!params.isPresent()) {
            return space();
        }
        List<TreeNode> list = params.get();
        Split spaceSplit = new Split(Modification.SPACE, 0)
                .notIf(c.style().isAfterImplicitParamListModifier())
                .withPolicy(ops.singleLineBlock(list.get(list.size() - 1).lastToken()));
        return splits(spaceSplit, new Split(Modification.NEWLINE, spaceSplit.isActive() ? 1 : 0));
    }

    /**
     * The token after a parameter annotation keeps the source's line break.
     */
    public static List<Split> optionalAnnotationNewline(RouteContext c) {
        if (c.style().isAnnotationNewlines() && c.ops().isOptionalNewline(c.right())) {
            return splits(new Split(TokenOps.newlines2Modification(c.ft()), 0));
        }
        return null;
    }

    public static List<Split> patternAlternative(RouteContext c) {
        if (c.left().isIdent("|") && c.leftOwner().is(NodeKind.PAT_ALTERNATIVE)) {
            return splits(new Split(Modification.SPACE, 0), new Split(Modification.NEWLINE, 1));
        }
        return null;
    }

    public static List<Split> identSequence(RouteContext c) {
        if (c.leftIs(TokenKind.IDENT, TokenKind.LITERAL, TokenKind.INTERPOLATION_END, TokenKind.XML_END)
                && c.rightIs(TokenKind.IDENT, TokenKind.LITERAL, TokenKind.XML_START)) {
            return space();
        }
        return null;
    }

    public static List<Split> matchKeyword(RouteContext c) {
        return c.rightIs(TokenKind.KW_MATCH) ? space() : null;
    }

    /**
     * {@code private[pkg]} and {@code protected[this]}.
     */
    public static List<Split> qualifierBracketOpen(RouteContext c) {
        if (c.rightIs(TokenKind.LEFT_BRACKET) && TreeOps.isModPrivateProtected(c.leftOwner())) {
            return noSplit();
        }
        return null;
    }

    public static List<Split> qualifierBracketInside(RouteContext c) {
        if (c.leftIs(TokenKind.LEFT_BRACKET) && TreeOps.isModPrivateProtected(c.leftOwner())) {
            return noSplit();
        }
        return null;
    }

    public static List<Split> beforeInterpolationId(RouteContext c) {
        return c.rightIs(TokenKind.INTERPOLATION_ID, TokenKind.XML_START) ? space() : null;
    }

    public static List<Split> afterInterpolationId(RouteContext c) {
        return c.leftIs(TokenKind.INTERPOLATION_ID, TokenKind.XML_START) ? noSplit() : null;
    }

    public static List<Split> throwKeyword(RouteContext c) {
        return c.leftIs(TokenKind.KW_THROW) ? space() : null;
    }

    public static List<Split> singletonType(RouteContext c) {
        if (c.rightIs(TokenKind.KW_TYPE) && c.rightOwner().is(NodeKind.TYPE_SINGLETON)) {
            return noSplit();
        }
        return null;
    }

    /**
     * {@code foo(seq: _*)}.
     */
    public static List<Split> varArgsColon(RouteContext c) {
        if (c.leftIs(TokenKind.COLON) && c.rightIs(TokenKind.UNDERSCORE)
                && c.ops().next(c.ft()).getRight().isIdent("*")) {
            return space();
        }
        return null;
    }

    public static List<Split> varArgsStar(RouteContext c) {
        if (c.leftIs(TokenKind.UNDERSCORE) && c.right().isIdent("*")
                && c.ops().prev(c.ft()).getLeft().is(TokenKind.COLON)) {
            return noSplit();
        }
        return null;
    }

    public static List<Split> afterXmlPart(RouteContext c) {
        return c.leftIs(TokenKind.XML_PART) ? noSplit() : null;
    }

    public static List<Split> beforeXmlPart(RouteContext c) {
        return c.rightIs(TokenKind.XML_PART) ? noSplit() : null;
    }

    public static List<Split> beforeDot(RouteContext c) {
        if (!c.rightIs(TokenKind.DOT)) {
            return null;
        }
        boolean select = c.rightOwner().is(NodeKind.TERM_SELECT)
                && !TreeOps.existsParentOfType(c.rightOwner(), NodeKind.IMPORT);
        return splits(new Split(Modification.NO_SPLIT, 0), dormantNewline().onlyIf(select));
    }

    public static List<Split> beforeHash(RouteContext c) {
        if (c.rightIs(TokenKind.HASH)) {
            return splits(new Split(Modification.space(TokenOps.endsWithSymbolIdent(c.left())), 0));
        }
        return null;
    }

    public static List<Split> afterHash(RouteContext c) {
        if (c.leftIs(TokenKind.HASH) && c.rightIs(TokenKind.IDENT)) {
            return splits(new Split(Modification.space(TokenOps.isSymbolicIdent(c.right())), 0));
        }
        return null;
    }

    public static List<Split> afterDot(RouteContext c) {
        if (c.leftIs(TokenKind.DOT) && c.rightIs(TokenKind.IDENT, TokenKind.KW_THIS, TokenKind.KW_SUPER)) {
            return noSplit();
        }
        return null;
    }

    public static List<Split> closeBracket(RouteContext c) {
        if (c.rightIs(TokenKind.RIGHT_BRACKET)) {
            return splits(new Split(Modification.NO_SPLIT, 0), dormantNewline());
        }
        return null;
    }

    public static List<Split> closeParen(RouteContext c) {
        if (!c.rightIs(TokenKind.RIGHT_PAREN)) {
            return null;
        }
        boolean padded = c.style().isSpaceInParentheses() && FormatOps.isDefnOrCallSite(c.rightOwner());
        return splits(new Split(Modification.space(padded), 0), dormantNewline());
    }

    public static List<Split> beforeKeyword(RouteContext c) {
        return c.right().getKind().isKeyword() ? space() : null;
    }

    public static List<Split> afterKeyword(RouteContext c) {
        return c.left().getKind().isKeyword() || c.left().getKind().isModifier() ? space() : null;
    }

    public static List<Split> afterOpenBracket(RouteContext c) {
        return c.leftIs(TokenKind.LEFT_BRACKET) ? noSplit() : null;
    }

    public static List<Split> beforeDelim(RouteContext c) {
        return c.right().getKind().isDelim() ? space() : null;
    }

    public static List<Split> wildcardStar(RouteContext c) {
        return c.leftIs(TokenKind.UNDERSCORE) && c.right().isIdent("*") ? noSplit() : null;
    }

    public static List<Split> byNameArrow(RouteContext c) {
        if (c.leftIs(TokenKind.RIGHT_ARROW) && c.leftOwner().is(NodeKind.TYPE_BY_NAME)) {
            return splits(new Split(Modification.space(c.style().isSpaceInByNameTypes()), 0));
        }
        return null;
    }

    public static List<Split> afterDelim(RouteContext c) {
        return c.left().getKind().isDelim() ? space() : null;
    }
}
