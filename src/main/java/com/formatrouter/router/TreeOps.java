package com.formatrouter.router;

import com.formatrouter.model.NodeKind;
import com.formatrouter.model.Role;
import com.formatrouter.model.Token;
import com.formatrouter.model.TokenKind;
import com.formatrouter.model.TreeNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Stateless predicates and lookups over syntax nodes.
 */
public final class TreeOps {

    private TreeOps() {
    }

    /**
     * True if the node or one of its ancestors has one of the given kinds.
     */
    public static boolean existsParentOfType(TreeNode node, NodeKind... kinds) {
        TreeNode current = node;
        while (current != null) {
            if (current.is(kinds)) {
                return true;
            }
            current = current.getParent().orElse(null);
        }
        return false;
    }

    /**
     * Number of strict ancestors with one of the given kinds.
     */
    public static int numParents(TreeNode node, NodeKind... kinds) {
        int count = 0;
        Optional<TreeNode> parent = node.getParent();
        while (parent.isPresent()) {
            if (parent.get().is(kinds)) {
                count++;
            }
            parent = parent.get().getParent();
        }
        return count;
    }

    public static int nestedApplies(TreeNode node) {
        return numParents(node, NodeKind.TERM_APPLY, NodeKind.TERM_APPLY_INFIX, NodeKind.TYPE_APPLY);
    }

    public static int nestedSelect(TreeNode node) {
        return numParents(node, NodeKind.TERM_SELECT);
    }

    public static int treeDepth(TreeNode node) {
        int depth = 0;
        for (TreeNode child : node.getChildren()) {
            depth = Math.max(depth, 1 + treeDepth(child));
        }
        return depth;
    }

    public static boolean isDefnSite(TreeNode node) {
        return switch (node.getKind()) {
            case DECL_DEF, DEFN_DEF, DEFN_MACRO, DEFN_CLASS, DEFN_TRAIT, CTOR_SECONDARY,
                    DECL_TYPE, DEFN_TYPE, TYPE_PARAM, TYPE_TUPLE, TYPE_FUNCTION, TERM_FUNCTION -> true;
            case CTOR_PRIMARY -> node.parentIs(NodeKind.DEFN_CLASS);
            default -> false;
        };
    }

    public static boolean isCallSite(TreeNode node) {
        return node.is(NodeKind.TERM_APPLY, NodeKind.TYPE_APPLY, NodeKind.PAT_EXTRACT,
                NodeKind.TERM_SUPER, NodeKind.PAT_TUPLE, NodeKind.TERM_TUPLE,
                NodeKind.TERM_APPLY_TYPE, NodeKind.TERM_ASSIGN, NodeKind.INIT,
                NodeKind.TERM_APPLY_INFIX);
    }

    public static boolean isTuple(TreeNode node) {
        return node.is(NodeKind.TERM_TUPLE, NodeKind.PAT_TUPLE, NodeKind.TYPE_TUPLE);
    }

    /**
     * Parentheses that merely wrap an expression.
     */
    public static boolean isSuperfluousParenthesis(Token open, TreeNode owner) {
        return !isTuple(owner) && owner.hasTokens() && owner.firstToken() == open;
    }

    public static boolean noSpaceBeforeOpeningParen(TreeNode node) {
        return !isTuple(node)
                && !node.is(NodeKind.TERM_FUNCTION, NodeKind.TYPE_FUNCTION)
                && !(node.hasTokens() && node.firstToken().is(TokenKind.LEFT_PAREN));
    }

    public static boolean isTypeVariant(TreeNode node) {
        if (!node.is(NodeKind.MOD) || !node.parentIs(NodeKind.TYPE_PARAM) || !node.hasTokens()) {
            return false;
        }
        Token token = node.firstToken();
        return token.isIdent("+") || token.isIdent("-");
    }

    public static boolean isModPrivateProtected(TreeNode node) {
        return node.is(NodeKind.MOD_PRIVATE, NodeKind.MOD_PROTECTED);
    }

    public static boolean isXml(TreeNode node) {
        return node.is(NodeKind.TERM_XML, NodeKind.PAT_XML);
    }

    public static boolean isInterpolate(TreeNode node) {
        return node.is(NodeKind.TERM_INTERPOLATE, NodeKind.PAT_INTERPOLATE);
    }

    public static boolean isInfixApplication(TreeNode node) {
        return node.is(NodeKind.TERM_APPLY_INFIX, NodeKind.TYPE_APPLY_INFIX, NodeKind.PAT_EXTRACT_INFIX);
    }

    /**
     * True when {@code owner} is the operator name of an infix application.
     */
    public static boolean isApplyInfixOp(TreeNode owner) {
        return owner.getRole() == Role.OP
                && owner.getParent().map(TreeOps::isInfixApplication).orElse(false);
    }

    /**
     * Right-hand arguments of an infix application.
     */
    public static List<TreeNode> infixArgs(TreeNode infix) {
        List<TreeNode> args = infix.children(Role.ARG);
        if (args.isEmpty()) {
            infix.child(Role.RHS).ifPresent(args::add);
        }
        return args;
    }

    /**
     * An infix application whose value is used directly by a statement,
     * definition or condition rather than as an argument or operand.
     */
    public static boolean isTopLevelInfixApplication(TreeNode infix) {
        TreeNode outermost = infix;
        while (outermost.getParent().map(TreeOps::isInfixApplication).orElse(false)) {
            outermost = outermost.getParent().get();
        }
        Optional<TreeNode> parent = outermost.getParent();
        if (!parent.isPresent()) {
            return true;
        }
        return switch (parent.get().getKind()) {
            case SOURCE, TEMPLATE, TERM_BLOCK, TERM_IF, TERM_WHILE, TERM_DO,
                    DEFN_VAL, DEFN_VAR, DEFN_DEF, TERM_ASSIGN, CASE -> true;
            default -> false;
        };
    }

    public static boolean isFirstOrLastToken(Token token, TreeNode owner) {
        return owner.hasTokens() && (owner.firstToken() == token || owner.lastToken() == token);
    }

    public static Optional<TreeNode> defBody(TreeNode node) {
        if (node.is(NodeKind.DEFN_DEF, NodeKind.DEFN_MACRO)) {
            return node.child(Role.BODY);
        }
        if (node.is(NodeKind.CTOR_SECONDARY)) {
            return node.child(Role.BODY);
        }
        return Optional.empty();
    }

    public static Optional<TreeNode> defDefReturnType(TreeNode node) {
        if (node.is(NodeKind.DEFN_DEF, NodeKind.DECL_DEF)) {
            return node.child(Role.DECLTPE);
        }
        return Optional.empty();
    }

    public static Optional<TreeNode> defnTemplate(TreeNode node) {
        if (node.is(NodeKind.DEFN_CLASS, NodeKind.DEFN_TRAIT, NodeKind.DEFN_OBJECT, NodeKind.PKG_OBJECT)) {
            return node.child(Role.TEMPLATE);
        }
        return Optional.empty();
    }

    /**
     * The innermost function of a curried lambda such as {@code a => b => c}.
     */
    public static TreeNode lastLambda(TreeNode function) {
        Optional<TreeNode> body = function.child(Role.BODY);
        if (body.isPresent()) {
            TreeNode b = body.get();
            if (b.is(NodeKind.TERM_FUNCTION)) {
                return lastLambda(b);
            }
            if (b.is(NodeKind.TERM_BLOCK)) {
                List<TreeNode> stats = b.children(Role.STAT);
                if (!stats.isEmpty() && stats.get(0).is(NodeKind.TERM_FUNCTION)) {
                    return lastLambda(stats.get(0));
                }
            }
        }
        return function;
    }

    public static boolean isEmptyFunctionBody(TreeNode node) {
        if (!node.is(NodeKind.TERM_FUNCTION)) {
            return false;
        }
        return node.child(Role.BODY)
                .map(body -> body.is(NodeKind.TERM_BLOCK) && body.children(Role.STAT).isEmpty())
                .orElse(false);
    }

    /**
     * The outermost {@code with} of a compound type such as {@code A with B with C}.
     */
    public static TreeNode topOfWithChain(TreeNode with) {
        TreeNode top = with;
        while (top.parentIs(NodeKind.TYPE_WITH)) {
            top = top.getParent().get();
        }
        return top;
    }

    /**
     * Every {@code with} node along the left spine of a compound type.
     */
    public static List<TreeNode> withChain(TreeNode top) {
        List<TreeNode> chain = new ArrayList<>();
        TreeNode current = top;
        while (current != null && current.is(NodeKind.TYPE_WITH)) {
            chain.add(current);
            current = current.child(Role.LHS).orElse(null);
        }
        return chain;
    }

    /**
     * Selects of a method chain, from {@code start} outwards through the
     * applications and selects that use it as their qualifier.
     */
    public static List<TreeNode> getSelectChain(TreeNode start) {
        List<TreeNode> chain = new ArrayList<>();
        chain.add(start);
        TreeNode current = start;
        while (current.getParent().isPresent()) {
            TreeNode parent = current.getParent().get();
            if (parent.is(NodeKind.TERM_APPLY, NodeKind.TERM_APPLY_TYPE) && current.getRole() == Role.FUN) {
                current = parent;
            } else if (parent.is(NodeKind.TERM_SELECT) && current.getRole() == Role.QUAL) {
                chain.add(parent);
                current = parent;
            } else {
                break;
            }
        }
        return chain;
    }

    public static Optional<TreeNode> getAssignAtSingleArgCallSite(TreeNode node) {
        if (node.is(NodeKind.TERM_APPLY)) {
            List<TreeNode> args = node.children(Role.ARG);
            if (args.size() == 1 && args.get(0).is(NodeKind.TERM_ASSIGN)) {
                return Optional.of(args.get(0));
            }
        }
        return Optional.empty();
    }

    public static boolean isDefinition(TreeNode node) {
        return switch (node.getKind()) {
            case DEFN_CLASS, DEFN_TRAIT, DEFN_OBJECT, DEFN_DEF, DEFN_MACRO, DEFN_VAL, DEFN_VAR,
                    DEFN_TYPE, DECL_DEF, DECL_VAL, DECL_TYPE, CTOR_SECONDARY, PKG_OBJECT -> true;
            default -> false;
        };
    }
}
