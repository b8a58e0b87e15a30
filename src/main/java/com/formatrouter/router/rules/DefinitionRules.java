package com.formatrouter.router.rules;

import com.formatrouter.config.ContextBoundSpacing;
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
import com.formatrouter.split.Modification;
import com.formatrouter.split.Policy;
import com.formatrouter.split.Split;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.formatrouter.router.RouteContext.splits;

/**
 * Definitions: templates, defs, assignments and their type annotations.
 */
public final class DefinitionRules {

    private DefinitionRules() {
    }

    /**
     * An opening paren or bracket glued to what it applies to, as in
     * {@code foo(} or {@code List[}.
     */
    public static List<Split> noSpaceOpenParen(RouteContext c) {
        if (!c.leftIs(TokenKind.KW_SUPER, TokenKind.KW_THIS, TokenKind.IDENT, TokenKind.RIGHT_BRACKET,
                TokenKind.RIGHT_BRACE, TokenKind.RIGHT_PAREN, TokenKind.UNDERSCORE)
                || !c.rightIs(TokenKind.LEFT_PAREN, TokenKind.LEFT_BRACKET)
                || !TreeOps.noSpaceBeforeOpeningParen(c.rightOwner())) {
            return null;
        }
        boolean infixOperand = c.leftOwner().getParent()
                .map(p -> p.is(NodeKind.TYPE_APPLY_INFIX, NodeKind.TERM_APPLY_INFIX))
                .orElse(false);
        if (infixOperand) {
            return null;
        }
        return splits(new Split(openParenModification(c), 0));
    }

    private static Modification openParenModification(RouteContext c) {
        TreeNode owner = c.leftOwner();
        if (owner.is(NodeKind.MOD, NodeKind.MOD_ANNOT, NodeKind.MOD_PRIVATE, NodeKind.MOD_PROTECTED,
                NodeKind.MOD_IMPLICIT)) {
            return Modification.SPACE;
        }
        // constructor annotations keep a space before their parameter lists
        if (owner.is(NodeKind.INIT)
                && owner.getParent().map(p -> p.is(NodeKind.MOD_ANNOT)).orElse(true)) {
            return Modification.SPACE;
        }
        if (owner.is(NodeKind.TERM_NAME, NodeKind.NAME)) {
            String name = c.left().getText();
            if (c.style().isSpaceAfterTripleEquals() && "===".equals(name)) {
                return Modification.SPACE;
            }
            boolean ofDef = owner.getParent().map(p -> p.is(NodeKind.DEFN_DEF, NodeKind.DECL_DEF)).orElse(false);
            if (c.style().isSpaceAfterSymbolicDefs() && TokenOps.isSymbolicName(name) && ofDef) {
                return Modification.SPACE;
            }
        }
        return Modification.NO_SPLIT;
    }

    /**
     * {@code object}, {@code class} or {@code trait}: the header fits on one
     * line up to the template brace, or {@code extends} goes to a new line.
     */
    public static List<Split> templateKeyword(RouteContext c) {
        if (!c.leftIs(TokenKind.KW_OBJECT, TokenKind.KW_CLASS, TokenKind.KW_TRAIT)) {
            return null;
        }
        FormatOps ops = c.ops();
        TreeNode owner = c.leftOwner();
        Token expire = ops.templateCurlyOrLast(owner);
        Policy forceNewlineBeforeExtends = Policy.of(expire, "NewlineBeforeExtends(" + c.left().getIndex() + ")", d -> {
            FormatToken t = d.getFormatToken();
            if (t.getRight().is(TokenKind.KW_EXTENDS) && t.getRightOwner() == owner) {
                return d.onlyNewlinesWithoutFallback();
            }
            return null;
        });
        return splits(
                new Split(Modification.SPACE, 0)
                        .withOptimalToken(expire, true)
                        .withPolicy(ops.singleLineBlock(expire)),
                new Split(Modification.SPACE, 1).withPolicy(forceNewlineBeforeExtends));
    }

    public static List<Split> defName(RouteContext c) {
        if (c.leftIs(TokenKind.KW_DEF) && c.rightIs(TokenKind.IDENT)) {
            return splits(new Split(Modification.SPACE, 0));
        }
        return null;
    }

    /**
     * The {@code =} before a def body.
     */
    public static List<Split> defBodyEquals(RouteContext c) {
        if (!c.leftIs(TokenKind.EQUALS)) {
            return null;
        }
        Optional<TreeNode> body = TreeOps.defBody(c.leftOwner()).filter(TreeNode::hasTokens);
        if (!body.isPresent()) {
            return null;
        }
        FormatOps ops = c.ops();
        Token expire = body.get().lastToken();
        boolean alwaysBeforeMultilineDef = c.style().isAlwaysBeforeMultilineDef();
        List<TokenRange> exclude = ops.getExcludeIf(expire, t -> {
            if (t.is(TokenKind.RIGHT_BRACE)) {
                return true;
            }
            if (!t.is(TokenKind.RIGHT_PAREN)) {
                return false;
            }
            // def x = foo(
            //   1
            // )
            return !alwaysBeforeMultilineDef
                    || c.tokens().matchingOpt(t).map(open -> ops.opensConfigStyle(ops.at(open))).orElse(false);
        });
        if (c.rightIs(TokenKind.LEFT_BRACE)) {
            // the block indents itself
            return splits(new Split(Modification.SPACE, 0));
        }
        boolean rhsIsJsNative = ops.isJsNative(c.right());
        boolean rhsIsComment = TokenOps.isSingleLineComment(c.right());
        return splits(
                new Split(Modification.SPACE, 0)
                        .notIf(rhsIsComment || c.newlines() != 0 && !rhsIsJsNative)
                        .withPolicy(alwaysBeforeMultilineDef ? ops.singleLineBlock(expire, exclude) : Policy.NO_POLICY),
                new Split(Modification.SPACE, 0)
                        .onlyIf(c.newlines() == 0 && rhsIsComment)
                        .withIndent(2, expire, ExpiresOn.LEFT),
                new Split(Modification.NEWLINE, 1)
                        .notIf(rhsIsJsNative)
                        .withIndent(2, expire, ExpiresOn.LEFT));
    }

    /**
     * Colon before a method's return type, which may go to the next line.
     */
    public static List<Split> returnTypeColon(RouteContext c) {
        if (!c.rightIs(TokenKind.COLON) || !c.style().isSometimesBeforeColonInMethodReturnType()
                || !TreeOps.defDefReturnType(c.leftOwner()).isPresent()) {
            return null;
        }
        FormatOps ops = c.ops();
        TreeNode returnType = TreeOps.defDefReturnType(c.rightOwner())
                .orElse(TreeOps.defDefReturnType(c.leftOwner()).get());
        Token expire = returnType.lastToken();
        Policy penalizeNewlines = ops.penalizeAllNewlines(expire, Constants.BRACKET_PENALTY);
        return splits(
                new Split(Modification.space(TokenOps.endsWithSymbolIdent(c.left())), 0)
                        .withPolicy(penalizeNewlines),
                new Split(Modification.NEWLINE, Constants.SPARK_COLON_NEWLINE)
                        .withIndent(c.style().getContinuationIndentDefnSite(), expire, ExpiresOn.LEFT)
                        .withPolicy(penalizeNewlines));
    }

    public static List<Split> resultTypeColon(RouteContext c) {
        if (!c.leftIs(TokenKind.COLON) || !c.style().isNeverInResultType()) {
            return null;
        }
        Optional<TreeNode> returnType = TreeOps.defDefReturnType(c.leftOwner());
        if (!returnType.isPresent()) {
            return null;
        }
        Token expire = returnType.get().lastToken();
        return splits(new Split(Modification.SPACE, 0)
                .withPolicy(c.ops().singleLineBlock(expire, Collections.emptyList(), false, false)));
    }

    /**
     * A colon of a type ascription or a context bound.
     */
    public static List<Split> colon(RouteContext c) {
        if (!c.rightIs(TokenKind.COLON)) {
            return null;
        }
        Modification mod;
        if (c.rightOwner().is(NodeKind.TYPE_PARAM)) {
            TreeNode param = c.rightOwner();
            int bounds = param.children(Role.LOWER_BOUND).size()
                    + param.children(Role.UPPER_BOUND).size()
                    + param.children(Role.CONTEXT_BOUND).size();
            ContextBoundSpacing option = c.style().getSpaceBeforeContextBoundColon();
            boolean useSpace = option == ContextBoundSpacing.ALWAYS
                    || (option == ContextBoundSpacing.IF_MULTIPLE_BOUNDS && bounds > 1);
            mod = Modification.space(useSpace);
        } else if (c.leftIs(TokenKind.IDENT)) {
            mod = TokenOps.identModification(c.left());
        } else {
            mod = Modification.NO_SPLIT;
        }
        return splits(new Split(mod, 0));
    }

    /**
     * The {@code =} of a val, var, type alias, assignment or parameter
     * default.
     */
    public static List<Split> assignmentEquals(RouteContext c) {
        if (!c.leftIs(TokenKind.EQUALS)) {
            return null;
        }
        TreeNode owner = c.leftOwner();
        TreeNode rhs = assignedValue(owner);
        if (rhs == null || !rhs.hasTokens()) {
            return null;
        }
        FormatOps ops = c.ops();
        Token expire = rhs.lastToken();
        boolean wouldDangle = (c.style().isDanglingParenthesesDefnSite()
                && owner.getParent().map(TreeOps::isDefnSite).orElse(false))
                || (c.style().isDanglingParenthesesCallSite()
                && owner.getParent().map(TreeOps::isCallSite).orElse(false));
        // rhsOptimalToken is too eager here
        Token afterExpire = ops.at(expire).getRight();
        Token optimal;
        if (afterExpire.is(TokenKind.COMMA)) {
            optimal = afterExpire;
        } else if (afterExpire.isAny(TokenKind.RIGHT_PAREN, TokenKind.RIGHT_BRACKET) && !wouldDangle) {
            optimal = afterExpire;
        } else {
            optimal = expire;
        }
        int penalty = 0;
        if ((owner.is(NodeKind.TERM_ASSIGN) && c.style().isBinPackCallSite())
                || (owner.is(NodeKind.TERM_PARAM) && c.style().isBinPackDefnSite())) {
            penalty = Constants.BIN_PACK_ASSIGNMENT_PENALTY;
        }

        if (rhs.is(NodeKind.TERM_APPLY_INFIX)) {
            return splits(ops.infixSplit(rhs, c.ft()));
        }
        boolean jsNative = ops.isJsNative(c.right());
        Policy spacePolicy;
        if (rhs.is(NodeKind.TERM_IF, NodeKind.TERM_FOR_YIELD)) {
            List<Token> exclude = ops.insideBlock(c.ft(), expire, TokenKind.LEFT_BRACE);
            spacePolicy = ops.penalizeAllNewlines(expire, Constants.SHOULD_BE_SINGLE_LINE, true,
                    ops.parensRanges(exclude), false);
        } else if (rhs.is(NodeKind.TERM_TRY, NodeKind.TERM_TRY_WITH_HANDLER)
                && c.isActive(EditionGate.EDITION_2019_11) && !jsNative) {
            // try/catch/finally always breaks
            spacePolicy = null;
        } else {
            spacePolicy = Policy.NO_POLICY;
        }
        boolean isDefinition = owner.is(NodeKind.DEFN_TYPE, NodeKind.DEFN_VAL, NodeKind.DEFN_VAR);
        boolean noSpace = spacePolicy == null || (!jsNative && c.newlines() > 0 && isDefinition);
        int spaceIndent = TokenOps.isSingleLineComment(c.right()) ? 2 : 0;
        return splits(
                new Split(Modification.SPACE, 0)
                        .withPolicy(spacePolicy)
                        .notIf(noSpace)
                        .withOptimalToken(optimal)
                        .withIndent(spaceIndent, expire, ExpiresOn.LEFT),
                new Split(Modification.NEWLINE, 1 + penalty)
                        .notIf(jsNative)
                        .withIndent(2, expire, ExpiresOn.LEFT));
    }

    private static TreeNode assignedValue(TreeNode owner) {
        return switch (owner.getKind()) {
            case TERM_ASSIGN, DEFN_VAL -> owner.child(Role.RHS).orElse(null);
            case TERM_PARAM -> owner.child(Role.DEFAULT).orElse(null);
            case DEFN_TYPE -> owner.child(Role.BODY).orElse(null);
            // var x: Int = _
            case DEFN_VAR -> owner.child(Role.RHS).orElse(owner);
            default -> null;
        };
    }

    public static List<Split> extendsKeyword(RouteContext c) {
        if (!c.rightIs(TokenKind.KW_EXTENDS)) {
            return null;
        }
        FormatOps ops = c.ops();
        Optional<TreeNode> template = TreeOps.defnTemplate(c.rightOwner());
        Token lastToken = template
                .map(t -> ops.templateCurly(t).orElse(t.lastToken()))
                .orElse(c.rightOwner().lastToken());
        Set<TreeNode> owners = new HashSet<>();
        template.ifPresent(owners::add);
        return ops.binPackParentConstructorSplits(owners, lastToken, c.style().getContinuationIndentExtendSite());
    }

    public static List<Split> withKeyword(RouteContext c) {
        if (!c.rightIs(TokenKind.KW_WITH)) {
            return null;
        }
        FormatOps ops = c.ops();
        TreeNode owner = c.rightOwner();
        if (owner.is(NodeKind.TEMPLATE)
                && owner.parentIs(NodeKind.TERM_NEW, NodeKind.TERM_NEW_ANONYMOUS)) {
            // new A with B with C
            Optional<TreeNode> firstInit = owner.child(Role.INIT);
            boolean isFirstWith = firstInit
                    .map(init -> init == c.leftOwner()
                            || init.child(Role.TPE).map(tpe -> tpe == c.leftOwner()).orElse(false))
                    .orElse(false);
            Set<TreeNode> owners = new HashSet<>();
            owners.add(owner);
            return ops.splitWithChain(isFirstWith, owners, ops.templateCurly(owner).orElse(owner.lastToken()));
        }
        if (owner.is(NodeKind.TEMPLATE)) {
            return templateWith(c, owner);
        }
        if (owner.is(NodeKind.TYPE_WITH)) {
            // trait A extends B with C with D
            TreeNode top = TreeOps.topOfWithChain(owner);
            boolean isFirstWith = !owner.child(Role.LHS).map(l -> l.is(NodeKind.TYPE_WITH)).orElse(false);
            return ops.splitWithChain(isFirstWith, new HashSet<>(TreeOps.withChain(top)), top.lastToken());
        }
        return splits(new Split(Modification.SPACE, 0));
    }

    // a template that mixes in traits is never a one-liner
    private static List<Split> templateWith(RouteContext c, TreeNode template) {
        boolean hasSelfAnnotation = template.child(Role.SELF).map(TreeNode::hasTokens).orElse(false);
        Policy policy = Policy.NO_POLICY;
        if (!hasSelfAnnotation) {
            policy = Policy.of(template.lastToken(), "MultilineTemplate(" + c.right().getIndex() + ")", d -> {
                FormatToken t = d.getFormatToken();
                if (t.getLeft().is(TokenKind.LEFT_BRACE)
                        && !t.getRight().is(TokenKind.RIGHT_BRACE)
                        && isWithin(template, t.getLeftOwner())) {
                    return FormatOps.forceNewline(d);
                }
                return null;
            });
        }
        return splits(
                new Split(Modification.SPACE, 0),
                new Split(Modification.NEWLINE, 1).withPolicy(policy));
    }

    private static boolean isWithin(TreeNode node, TreeNode ancestor) {
        TreeNode current = node;
        while (current != null) {
            if (current == ancestor) {
                return true;
            }
            current = current.getParent().orElse(null);
        }
        return false;
    }
}
