package com.formatrouter.router.rules;

import com.formatrouter.model.FormatToken;
import com.formatrouter.model.NodeKind;
import com.formatrouter.model.Role;
import com.formatrouter.model.Token;
import com.formatrouter.model.TokenKind;
import com.formatrouter.model.TokenRange;
import com.formatrouter.model.TreeNode;
import com.formatrouter.router.FormatOps;
import com.formatrouter.router.RouteContext;
import com.formatrouter.router.TokenOps;
import com.formatrouter.router.TreeOps;
import com.formatrouter.split.ExpiresOn;
import com.formatrouter.split.Modification;
import com.formatrouter.split.Policy;
import com.formatrouter.split.Split;

import java.util.List;
import java.util.Optional;

import static com.formatrouter.router.RouteContext.splits;

/**
 * Selects, method chains, unary operators and annotations.
 */
public final class ChainRules {

    private ChainRules() {
    }

    public static List<Split> symbolicSelect(RouteContext c) {
        if (c.rightIs(TokenKind.DOT) && TokenOps.isSymbolicIdent(c.left())) {
            return splits(new Split(Modification.NO_SPLIT, 0));
        }
        return null;
    }

    public static List<Split> underscoreSelect(RouteContext c) {
        if (c.leftIs(TokenKind.UNDERSCORE) && c.rightIs(TokenKind.DOT)) {
            return splits(new Split(Modification.NO_SPLIT, 0));
        }
        return null;
    }

    /**
     * The dot before a method call of a chain. Either the rest of the chain
     * stays on one line, or every following dot of the chain breaks. The
     * break gets more expensive the deeper the chain is nested and the more
     * selects it still has ahead of it.
     */
    public static List<Split> selectChain(RouteContext c) {
        if (!c.rightIs(TokenKind.DOT)) {
            return null;
        }
        FormatOps ops = c.ops();
        Optional<List<TreeNode>> found = ops.selectChain(c.ft());
        if (!found.isPresent()) {
            return null;
        }
        List<TreeNode> chain = found.get();
        int nestedPenalty = TreeOps.nestedSelect(c.rightOwner()) + TreeOps.nestedApplies(c.leftOwner());
        Token optimalToken = ops.chainOptimalToken(chain);
        Token expire = chain.size() == 1 ? chain.get(chain.size() - 1).lastToken() : optimalToken;

        boolean breaksInsideChains = c.style().isBreaksInsideChains();
        Policy breakOnEveryDot = Policy.of(expire,
                "BreakOnEveryDot(" + c.right().getIndex() + ", insideChains=" + breaksInsideChains + ")", d -> {
            FormatToken t = d.getFormatToken();
            if (!t.getRight().is(TokenKind.DOT) || !chain.contains(t.getRightOwner())) {
                return null;
            }
            Modification mod = Modification.NO_SPLIT.orNewline(breaksInsideChains && t.getNewlinesBetween() == 0);
            return splits(new Split(mod, 1));
        });
        List<TokenRange> exclude = ops.getExcludeIf(expire);
        // applies to both splits, otherwise the newline is too cheap even when
        // it does not prevent other newlines
        Policy penalizeNewlinesInApply = ops.penalizeAllNewlines(expire, 2);
        Policy noSplitPolicy = ops.singleLineBlock(expire, exclude).andThen(penalizeNewlinesInApply);
        Policy newlinePolicy = breakOnEveryDot.andThen(penalizeNewlinesInApply);

        boolean ignoreNoSplit = c.style().isBreakChainOnFirstMethodDot() && c.newlines() > 0;
        int chainLengthPenalty = chain.size() - 1;
        if (c.style().isPenalizeSingleSelectMultiArgList() && chain.size() < 2) {
            // many arguments on one line read badly: break the argument list instead
            chainLengthPenalty += ops.singleSelectArgPenalty(c.ft());
        }
        return splits(
                new Split(Modification.NO_SPLIT, 0)
                        .notIf(ignoreNoSplit)
                        .withPolicy(noSplitPolicy),
                new Split(Modification.NEWLINE.withAcceptNoSplit(true), 2 + nestedPenalty + chainLengthPenalty)
                        .withPolicy(newlinePolicy)
                        .withIndent(2, optimalToken, ExpiresOn.LEFT));
    }

    /**
     * A literal with a sign, as in {@code -1}.
     */
    public static List<Split> unaryLiteral(RouteContext c) {
        if (c.leftIs(TokenKind.IDENT) && c.rightIs(TokenKind.LITERAL) && c.leftOwner() == c.rightOwner()) {
            return splits(new Split(Modification.NO_SPLIT, 0));
        }
        return null;
    }

    public static List<Split> unaryOperator(RouteContext c) {
        if (!c.leftIs(TokenKind.IDENT)) {
            return null;
        }
        boolean isUnaryOp = c.leftOwner().getParent()
                .filter(p -> p.is(NodeKind.TERM_APPLY_UNARY))
                .flatMap(p -> p.child(Role.OP))
                .map(op -> op.hasTokens() && op.firstToken() == c.left())
                .orElse(false);
        if (!isUnaryOp) {
            return null;
        }
        // keeps "- -x" from turning into "--x"
        return splits(new Split(Modification.space(TokenOps.isSymbolicIdent(c.right())), 0));
    }

    public static List<Split> bindBefore(RouteContext c) {
        if (c.rightIs(TokenKind.AT) && c.rightOwner().is(NodeKind.PAT_BIND)) {
            return splits(new Split(Modification.SPACE, 0));
        }
        return null;
    }

    public static List<Split> bindAfter(RouteContext c) {
        if (c.leftIs(TokenKind.AT) && c.leftOwner().is(NodeKind.PAT_BIND)) {
            return splits(new Split(Modification.SPACE, 0));
        }
        return null;
    }

    public static List<Split> annotationDelim(RouteContext c) {
        if (c.leftIs(TokenKind.AT) && c.right().getKind().isDelim()) {
            return splits(new Split(Modification.NO_SPLIT, 0));
        }
        return null;
    }

    public static List<Split> annotationIdent(RouteContext c) {
        if (c.leftIs(TokenKind.AT) && c.rightIs(TokenKind.IDENT)) {
            return splits(new Split(TokenOps.identModification(c.right()), 0));
        }
        return null;
    }
}
