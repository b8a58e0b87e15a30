package com.formatrouter.router;

import com.formatrouter.config.EditionGate;
import com.formatrouter.config.FormatStyle;
import com.formatrouter.model.FormatToken;
import com.formatrouter.model.FormatTokens;
import com.formatrouter.model.NodeKind;
import com.formatrouter.model.Role;
import com.formatrouter.model.Token;
import com.formatrouter.model.TokenKind;
import com.formatrouter.model.TokenRange;
import com.formatrouter.model.TreeNode;
import com.formatrouter.split.Decision;
import com.formatrouter.split.ExpiresOn;
import com.formatrouter.split.Length;
import com.formatrouter.split.Modification;
import com.formatrouter.split.Policy;
import com.formatrouter.split.Split;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Per-file lookups and policy builders shared by the rule families.
 * <p>
 * Built once per file: the constructor indexes statement starts, argument
 * starts and the tokens after parameter annotations, so rules can look them
 * up by token index.
 */
public class FormatOps {
    private final FormatTokens tokens;
    private final FormatStyle style;

    private final Int2ObjectOpenHashMap<TreeNode> statementStarts = new Int2ObjectOpenHashMap<>();
    private final Int2ObjectOpenHashMap<TreeNode> argumentStarts = new Int2ObjectOpenHashMap<>();
    private final IntOpenHashSet optionalNewlines = new IntOpenHashSet();
    private final IntOpenHashSet topLevelTokens = new IntOpenHashSet();

    public FormatOps(FormatTokens tokens, FormatStyle style) {
        this.tokens = tokens;
        this.style = style;
        if (tokens.getRoot() != null) {
            index(tokens.getRoot());
        }
    }

    public FormatTokens getTokens() {
        return tokens;
    }

    public FormatStyle getStyle() {
        return style;
    }

    // Indexing

    private void index(TreeNode node) {
        switch (node.getKind()) {
            case SOURCE, PKG -> {
                for (TreeNode stat : node.children(Role.STAT)) {
                    addStatement(stat);
                    if (stat.hasTokens()) {
                        topLevelTokens.add(stat.getFirstTokenIndex());
                    }
                }
            }
            case TEMPLATE, TERM_BLOCK -> node.children(Role.STAT).forEach(this::addStatement);
            case TERM_MATCH, TERM_PARTIAL_FUNCTION, TERM_TRY, TERM_TRY_WITH_HANDLER ->
                    node.children(Role.CASE).forEach(this::addStatement);
            default -> {
            }
        }
        if (TreeOps.isDefinition(node)) {
            addDefinition(node);
        }
        for (TreeNode child : node.getChildren()) {
            Role role = child.getRole();
            if (child.hasTokens()
                    && (role == Role.ARG || role == Role.PARAM || role == Role.TYPE_ARG || role == Role.TYPE_PARAM)) {
                argumentStarts.put(child.getFirstTokenIndex(), child);
            }
        }
        if (node.is(NodeKind.TERM_PARAM, NodeKind.TYPE_PARAM)) {
            for (TreeNode mod : node.children(Role.MOD)) {
                if (mod.is(NodeKind.MOD_ANNOT) && mod.hasTokens()) {
                    optionalNewlines.add(mod.getLastTokenIndex() + 1);
                }
            }
        }
        for (TreeNode child : node.getChildren()) {
            index(child);
        }
    }

    private void addStatement(TreeNode stat) {
        if (stat.hasTokens()) {
            statementStarts.put(stat.getFirstTokenIndex(), stat);
        }
    }

    // each annotation starts its own line, then the first modifier or keyword
    private void addDefinition(TreeNode definition) {
        Token firstNonAnnotation = null;
        for (TreeNode mod : definition.children(Role.MOD)) {
            if (!mod.hasTokens()) {
                continue;
            }
            if (mod.is(NodeKind.MOD_ANNOT)) {
                addStatement(mod);
            } else if (firstNonAnnotation == null) {
                firstNonAnnotation = mod.firstToken();
            }
        }
        if (firstNonAnnotation == null) {
            for (Token token : definition.tokens()) {
                if (token.getKind().isKeyword() && !token.getKind().isModifier()
                        && tokens.owner(token) == definition) {
                    firstNonAnnotation = token;
                    break;
                }
            }
        }
        if (firstNonAnnotation != null) {
            statementStarts.put(firstNonAnnotation.getIndex(), definition);
        }
    }

    public boolean startsStatement(FormatToken ft) {
        return statementStarts.containsKey(ft.getRight().getIndex());
    }

    public Optional<TreeNode> statementStartingAt(Token token) {
        return Optional.ofNullable(statementStarts.get(token.getIndex()));
    }

    public Optional<TreeNode> argumentStartingAt(Token token) {
        return Optional.ofNullable(argumentStarts.get(token.getIndex()));
    }

    public boolean isOptionalNewline(Token token) {
        return optionalNewlines.contains(token.getIndex());
    }

    // Token navigation

    public Token matching(Token token) {
        return tokens.matching(token);
    }

    public FormatToken at(Token token) {
        return tokens.at(token);
    }

    public FormatToken next(FormatToken ft) {
        return tokens.next(ft);
    }

    public FormatToken prev(FormatToken ft) {
        return tokens.prev(ft);
    }

    public FormatToken nextNonComment(FormatToken ft) {
        FormatToken current = ft;
        while (current.getRight().is(TokenKind.COMMENT)) {
            FormatToken following = tokens.next(current);
            if (following == current) {
                break;
            }
            current = following;
        }
        return current;
    }

    public FormatToken nextNonCommentSameLine(FormatToken ft) {
        FormatToken current = ft;
        while (current.getRight().is(TokenKind.COMMENT) && current.getNewlinesBetween() == 0) {
            FormatToken following = tokens.next(current);
            if (following == current) {
                break;
            }
            current = following;
        }
        return current;
    }

    public FormatToken prevNonComment(FormatToken ft) {
        FormatToken current = ft;
        while (current.getLeft().is(TokenKind.COMMENT)) {
            FormatToken previous = tokens.prev(current);
            if (previous == current) {
                break;
            }
            current = previous;
        }
        return current;
    }

    // Token and tree queries that need the pair stream

    public boolean shouldGet2xNewlines(FormatToken ft) {
        if (TokenOps.isDocstring(ft.getLeft())) {
            return false;
        }
        return ft.getNewlinesBetween() > 1
                || (TokenOps.isDocstring(ft.getRight()) && !ft.getLeft().is(TokenKind.COMMENT))
                || (style.isAlwaysBeforeTopLevelStatements() && topLevelTokens.contains(ft.getRight().getIndex()));
    }

    /**
     * A triple-quoted interpolation followed by {@code .stripMargin}.
     */
    public boolean isMarginizedString(Token start) {
        if (!TokenOps.isTripleQuote(start)) {
            return false;
        }
        Optional<Token> end = tokens.matchingOpt(start);
        if (!end.isPresent()) {
            return false;
        }
        FormatToken afterEnd = tokens.at(end.get());
        return afterEnd.getRight().is(TokenKind.DOT)
                && tokens.next(afterEnd).getRight().isIdent("stripMargin");
    }

    /**
     * True when {@code ft} ends an annotation that is a bare identifier, such
     * as {@code @inline}; argument lists after the name are skipped.
     */
    public boolean isSingleIdentifierAnnotation(FormatToken ft) {
        FormatToken toMatch = ft;
        if (ft.getRight().is(TokenKind.RIGHT_PAREN)) {
            Optional<Token> open = tokens.matchingOpt(ft.getRight());
            if (!open.isPresent()) {
                return false;
            }
            toMatch = tokens.prev(tokens.before(open.get()));
        }
        return toMatch.getLeft().is(TokenKind.AT) && toMatch.getRight().is(TokenKind.IDENT);
    }

    public boolean isJsNative(Token token) {
        if (!style.isNeverBeforeJsNative() || !token.isIdent("js")) {
            return false;
        }
        FormatToken ft = tokens.at(token);
        return ft.getRight().is(TokenKind.DOT) && tokens.next(ft).getRight().isIdent("native");
    }

    /**
     * The token itself, or the single-line comment attached to it.
     */
    public Token getOptimalTokenFor(Token token) {
        return getOptimalTokenFor(tokens.at(token));
    }

    public Token getOptimalTokenFor(FormatToken ft) {
        return TokenOps.isAttachedSingleLineComment(ft) ? ft.getRight() : ft.getLeft();
    }

    /**
     * Skips closing delimiters and separators glued to {@code start}.
     */
    public Token rhsOptimalToken(FormatToken start) {
        FormatToken current = start;
        while (current.getNewlinesBetween() == 0
                && current.getRight().isAny(TokenKind.COMMA, TokenKind.LEFT_PAREN, TokenKind.RIGHT_PAREN,
                        TokenKind.RIGHT_BRACKET, TokenKind.SEMICOLON, TokenKind.RIGHT_ARROW, TokenKind.EQUALS)) {
            FormatToken following = tokens.next(current);
            if (following == current) {
                break;
            }
            current = following;
        }
        return current.getLeft();
    }

    /**
     * Where a single-line block that ends at {@code start}'s left token
     * really has to end: trailing separators, infix continuations and an
     * attached comment are pulled in.
     */
    public Token endOfSingleLineBlock(FormatToken start) {
        FormatToken current = start;
        while (true) {
            Token right = current.getRight();
            boolean noBreak = current.getNewlinesBetween() == 0;
            boolean extend;
            if (right.isAny(TokenKind.COMMA, TokenKind.LEFT_PAREN, TokenKind.SEMICOLON,
                    TokenKind.RIGHT_ARROW, TokenKind.EQUALS)) {
                extend = true;
            } else if (right.is(TokenKind.RIGHT_PAREN) && current.getLeft().is(TokenKind.LEFT_PAREN)) {
                extend = true;
            } else if (TokenOps.isSingleLineComment(right) && noBreak) {
                return right;
            } else {
                extend = noBreak && isInfixRhs(current);
            }
            FormatToken following = tokens.next(current);
            if (!extend || following == current) {
                return current.getLeft();
            }
            current = following;
        }
    }

    public boolean isInfixRhs(FormatToken ft) {
        TreeNode owner = ft.getRightOwner();
        return TreeOps.isApplyInfixOp(owner) && owner.hasTokens() && owner.firstToken() == ft.getRight();
    }

    // Argument lists

    /**
     * The function part and arguments of the list opened by the pair's left
     * (or right) delimiter.
     */
    public ApplyArgs getApplyArgs(FormatToken ft, boolean isRight) {
        TreeNode owner = isRight ? ft.getRightOwner() : ft.getLeftOwner();
        Token open = isRight ? ft.getRight() : ft.getLeft();
        int closeIndex = tokens.matchingOpt(open).map(Token::getIndex).orElse(owner.getLastTokenIndex());
        TreeNode lhs = owner.child(Role.FUN)
                .or(() -> owner.child(Role.NAME))
                .or(() -> owner.child(Role.TPE))
                .orElse(owner);
        List<TreeNode> args = new ArrayList<>();
        for (TreeNode child : owner.getChildren()) {
            Role role = child.getRole();
            if ((role == Role.ARG || role == Role.PARAM || role == Role.TYPE_ARG || role == Role.TYPE_PARAM)
                    && child.hasTokens()
                    && child.getFirstTokenIndex() > open.getIndex()
                    && child.getFirstTokenIndex() < closeIndex) {
                args.add(child);
            }
        }
        return new ApplyArgs(lhs, args);
    }

    public Length getApplyIndent(TreeNode owner, boolean isConfigStyle) {
        if (owner.is(NodeKind.PAT_EXTRACT, NodeKind.PAT_TUPLE) && !isConfigStyle) {
            return Length.num(0);
        }
        if (TreeOps.isDefnSite(owner) && !owner.is(NodeKind.TYPE_APPLY)) {
            return Length.num(style.getContinuationIndentDefnSite());
        }
        return Length.num(style.getContinuationIndentCallSite());
    }

    public Length getApplyIndent(TreeNode owner) {
        return getApplyIndent(owner, false);
    }

    /**
     * The source breaks after the opening delimiter and before the closing
     * one.
     */
    public boolean opensConfigStyle(FormatToken ft) {
        Optional<Token> close = tokens.matchingOpt(ft.getLeft());
        if (!close.isPresent()) {
            return false;
        }
        FormatToken beforeClose = tokens.before(close.get());
        return beforeClose.getNewlinesBetween() > 0
                && (ft.getNewlinesBetween() > 0 || opensConfigStyleImplicitParamList(ft));
    }

    /**
     * {@code (implicit} followed by a line break, for a parameter list whose
     * closing paren is on its own line.
     */
    public boolean opensConfigStyleImplicitParamList(FormatToken ft) {
        return style.isActive(EditionGate.EDITION_2020_03)
                && ft.getRight().is(TokenKind.KW_IMPLICIT)
                && tokens.next(ft).getNewlinesBetween() > 0
                && opensImplicitParamList(ft).isPresent();
    }

    public Optional<List<TreeNode>> opensImplicitParamList(FormatToken ft) {
        if (!ft.getLeft().is(TokenKind.LEFT_PAREN) || !ft.getRight().is(TokenKind.KW_IMPLICIT)) {
            return Optional.empty();
        }
        List<TreeNode> args = getApplyArgs(ft, false).getArgs();
        return opensImplicitParamList(ft, args) ? Optional.of(args) : Optional.empty();
    }

    public boolean opensImplicitParamList(FormatToken ft, List<TreeNode> args) {
        if (!ft.getRight().is(TokenKind.KW_IMPLICIT) || args.isEmpty()) {
            return false;
        }
        for (TreeNode arg : args) {
            if (!arg.is(NodeKind.TERM_PARAM)) {
                return false;
            }
        }
        return true;
    }

    /**
     * An application whose argument list spans more characters than
     * {@code forceConfigStyleOnOffset} and has enough arguments.
     */
    public boolean forceConfigStyle(TreeNode owner) {
        int maxDistance = style.getForceConfigStyleOnOffset();
        if (maxDistance < 0 || !owner.is(NodeKind.TERM_APPLY)) {
            return false;
        }
        List<TreeNode> args = owner.children(Role.ARG);
        if (args.isEmpty() || args.size() < style.getForceConfigStyleMinArgCount() || !args.get(0).hasTokens()) {
            return false;
        }
        Token open = tokens.before(args.get(0).firstToken()).getLeft();
        Optional<Token> close = tokens.matchingOpt(open);
        return open.is(TokenKind.LEFT_PAREN) && close.isPresent()
                && close.get().getStart() - open.getEnd() > maxDistance;
    }

    public boolean isBinPack(TreeNode owner) {
        return (style.isBinPackCallSite() && TreeOps.isCallSite(owner))
                || (style.isBinPackDefnSite() && TreeOps.isDefnSite(owner));
    }

    public static boolean isDefnOrCallSite(TreeNode owner) {
        return TreeOps.isDefnSite(owner) || TreeOps.isCallSite(owner);
    }

    /**
     * The closing token of a definition site's last parameter list: the
     * {@code =} (or the brace right after it) for definitions with a body.
     */
    public Token defnSiteLastToken(FormatToken closeFt, TreeNode owner) {
        if (owner.is(NodeKind.TERM_FUNCTION)) {
            return closeFt.getRight().is(TokenKind.RIGHT_ARROW) ? closeFt.getRight() : closeFt.getLeft();
        }
        if (owner.hasTokens()) {
            for (int i = closeFt.getLeft().getIndex() + 1; i <= owner.getLastTokenIndex(); i++) {
                Token token = tokens.getTokens().get(i);
                if (token.is(TokenKind.EQUALS) && tokens.owner(token) == owner) {
                    FormatToken afterEquals = tokens.at(token);
                    return afterEquals.getRight().is(TokenKind.LEFT_BRACE) ? afterEquals.getRight() : token;
                }
            }
        }
        return rhsOptimalToken(closeFt);
    }

    public List<Token> insideBlock(FormatToken start, Token end, TokenKind kind) {
        List<Token> result = new ArrayList<>();
        FormatToken current = tokens.next(start);
        while (current.getLeft() != end && current.getLeft().getIndex() < end.getIndex()) {
            Token left = current.getLeft();
            Optional<Token> close = left.is(kind) ? tokens.matchingOpt(left) : Optional.empty();
            FormatToken following = close.isPresent() ? tokens.at(close.get()) : tokens.next(current);
            if (close.isPresent()) {
                result.add(left);
            }
            if (following == current) {
                break;
            }
            current = following;
        }
        return result;
    }

    public TokenRange parensRange(Token open) {
        return TokenRange.between(open, tokens.matching(open));
    }

    public List<TokenRange> parensRanges(List<Token> opens) {
        return opens.stream().map(this::parensRange).collect(Collectors.toList());
    }

    /**
     * The block ending at {@code end}, when {@code end} is a closing brace.
     */
    public List<TokenRange> getExcludeIf(Token end) {
        return getExcludeIf(end, t -> t.is(TokenKind.RIGHT_BRACE));
    }

    public List<TokenRange> getExcludeIf(Token end, Predicate<Token> condition) {
        if (!condition.test(end)) {
            return Collections.emptyList();
        }
        return tokens.matchingOpt(end)
                .map(open -> Collections.singletonList(TokenRange.between(open, end)))
                .orElse(Collections.emptyList());
    }

    /**
     * What goes right after an opening paren when the list is not broken,
     * {@code null} when that is impossible because a comment follows.
     */
    public Modification getNoSplit(FormatToken ft, boolean spaceOk) {
        Token right = ft.getRight();
        if (right.is(TokenKind.COMMENT)) {
            boolean detachedSingleLineComment = ft.getNewlinesBetween() > 0 && TokenOps.isSingleLineComment(right);
            boolean multiline = right.getEndLine() > right.getStartLine();
            return detachedSingleLineComment || multiline ? null : Modification.SPACE;
        }
        return Modification.space(style.isSpaceInParentheses() && spaceOk);
    }

    public CurlyLambdaBreak getSpaceAndNewlineAfterCurlyLambda(int newlines) {
        return switch (style.getAfterCurlyLambda()) {
            case NEVER -> new CurlyLambdaBreak(true, Modification.NEWLINE);
            case ALWAYS -> new CurlyLambdaBreak(false, Modification.NEWLINE_2X);
            case PRESERVE -> new CurlyLambdaBreak(newlines == 0,
                    newlines >= 2 ? Modification.NEWLINE_2X : Modification.NEWLINE);
        };
    }

    public static Modification xmlSpace(TreeNode owner) {
        return TreeOps.isXml(owner) ? Modification.NO_SPLIT : Modification.SPACE;
    }

    // Lambdas, cases, conditionals

    public Optional<TreeNode> getLambdaAtSingleArgCallSite(FormatToken ft) {
        TreeNode owner = ft.getLeftOwner();
        if (owner.is(NodeKind.TERM_APPLY)) {
            List<TreeNode> args = owner.children(Role.ARG);
            if (args.size() == 1 && args.get(0).is(NodeKind.TERM_FUNCTION)) {
                return Optional.of(args.get(0));
            }
        } else if (owner.is(NodeKind.TERM_FUNCTION) && owner.parentIs(NodeKind.TERM_APPLY_INFIX)) {
            List<TreeNode> args = TreeOps.infixArgs(owner.getParent().get());
            if (args.size() == 1 && args.get(0) == owner) {
                return Optional.of(owner);
            }
        }
        return Optional.empty();
    }

    /**
     * The pair whose left token is the lambda's {@code =>}.
     */
    public Optional<FormatToken> getFuncArrow(TreeNode function) {
        return findOwnToken(function, TokenKind.RIGHT_ARROW).map(tokens::at);
    }

    public FormatToken getCaseArrow(TreeNode caseNode) {
        return findOwnToken(caseNode, TokenKind.RIGHT_ARROW)
                .map(tokens::at)
                .orElseThrow(() -> new IllegalStateException("Case clause without arrow: " + caseNode));
    }

    private Optional<Token> findOwnToken(TreeNode node, TokenKind kind) {
        for (Token token : node.tokens()) {
            if (token.is(kind) && tokens.owner(token) == node) {
                return Optional.of(token);
            }
        }
        return Optional.empty();
    }

    /**
     * Where the indentation of a lambda body ends.
     */
    public FunctionExpiry functionExpire(TreeNode function) {
        Optional<TreeNode> parent = function.getParent();
        if (parent.isPresent() && parent.get().is(NodeKind.TERM_BLOCK)
                && parent.get().children(Role.STAT).size() == 1 && parent.get().hasTokens()) {
            return new FunctionExpiry(parent.get().lastToken(), ExpiresOn.RIGHT);
        }
        int lastIndex = function.getLastTokenIndex();
        if (parent.isPresent() && parent.get().is(NodeKind.CASE)) {
            while (lastIndex > function.getFirstTokenIndex()
                    && tokens.getTokens().get(lastIndex).is(TokenKind.COMMENT)) {
                lastIndex--;
            }
        }
        Token last = tokens.getTokens().get(lastIndex);
        if (last.is(TokenKind.RIGHT_PAREN)
                && tokens.matchingOpt(last).map(open -> open == function.firstToken()).orElse(false)) {
            return new FunctionExpiry(tokens.getTokens().get(lastIndex - 1), ExpiresOn.LEFT);
        }
        return new FunctionExpiry(last, ExpiresOn.RIGHT);
    }

    /**
     * The {@code else} keywords of an if / else-if chain.
     */
    public List<Token> getElseChain(TreeNode ifNode) {
        List<Token> result = new ArrayList<>();
        TreeNode current = ifNode;
        while (current != null && current.is(NodeKind.TERM_IF)) {
            Optional<Token> elseToken = findOwnToken(current, TokenKind.KW_ELSE);
            if (!elseToken.isPresent()) {
                break;
            }
            result.add(elseToken.get());
            current = current.child(Role.ELSE).orElse(null);
        }
        return result;
    }

    public Optional<Token> templateCurly(TreeNode template) {
        return findOwnToken(template, TokenKind.LEFT_BRACE);
    }

    public Token templateCurlyOrLast(TreeNode owner) {
        TreeNode template = owner.is(NodeKind.TEMPLATE) ? owner : TreeOps.defnTemplate(owner).orElse(null);
        if (template == null) {
            return owner.lastToken();
        }
        return templateCurly(template).orElse(owner.lastToken());
    }

    // Chains

    public static boolean isOpenApply(Token token, boolean includeCurly) {
        return token.isAny(TokenKind.LEFT_PAREN, TokenKind.LEFT_BRACKET)
                || (includeCurly && token.is(TokenKind.LEFT_BRACE));
    }

    /**
     * The method chain continuing at a dot that selects a method which is
     * then applied; empty for plain field selections and imports.
     */
    public Optional<List<TreeNode>> selectChain(FormatToken ft) {
        TreeNode select = ft.getRightOwner();
        if (!ft.getRight().is(TokenKind.DOT) || !select.is(NodeKind.TERM_SELECT)
                || TreeOps.existsParentOfType(select, NodeKind.IMPORT)) {
            return Optional.empty();
        }
        Token afterName = tokens.next(tokens.at(ft.getRight())).getRight();
        if (!isOpenApply(afterName, style.isActive(EditionGate.EDITION_2020_01))) {
            return Optional.empty();
        }
        return Optional.of(TreeOps.getSelectChain(select));
    }

    /**
     * The end of the last call of the chain.
     */
    public Token chainOptimalToken(List<TreeNode> chain) {
        TreeNode last = chain.get(chain.size() - 1);
        Token name = last.child(Role.NAME).map(TreeNode::lastToken).orElse(last.lastToken());
        Token result = name;
        FormatToken ft = tokens.at(result);
        while (isOpenApply(ft.getRight(), false) && tokens.matchingOpt(ft.getRight()).isPresent()) {
            result = tokens.matching(ft.getRight());
            ft = tokens.at(result);
        }
        return result;
    }

    /**
     * Number of arguments of the application opened right after the select
     * at {@code dotFt}, minus one.
     */
    public int singleSelectArgPenalty(FormatToken dotFt) {
        TreeNode owner = tokens.offset(dotFt, 2).getRightOwner();
        if (!owner.is(NodeKind.TERM_APPLY, NodeKind.TERM_APPLY_TYPE)) {
            return 0;
        }
        int count = owner.children(Role.ARG).size() + owner.children(Role.TYPE_ARG).size();
        return Math.max(0, count - 1);
    }

    // Split builders

    /**
     * Reproduces the source's line breaks around an infix operator, indenting
     * the continuation when the operator's style asks for it.
     */
    public Split infixSplit(TreeNode infix, FormatToken ft) {
        Token op = infix.child(Role.OP).map(TreeNode::firstToken).orElse(ft.getLeft());
        List<TreeNode> args = TreeOps.infixArgs(infix);
        boolean unindent = style.isUnindentTopLevelOperators() && TreeOps.isTopLevelInfixApplication(infix);
        int indent = !unindent && style.indentsOperator(op.getText()) ? 2 : 0;
        Token expire = args.isEmpty() || !args.get(args.size() - 1).hasTokens()
                ? infix.lastToken()
                : args.get(args.size() - 1).lastToken();
        return new Split(TokenOps.newlines2Modification(ft), 0).withIndent(indent, expire, ExpiresOn.LEFT);
    }

    public List<Split> binPackParentConstructorSplits(Set<TreeNode> owners, Token lastToken, int indent) {
        Policy breakBeforeWith = style.isBinPackParentConstructors()
                ? Policy.NO_POLICY
                : Policy.of(lastToken, "NewlineBeforeWith(" + lastToken.getIndex() + ", owners="
                        + owners.stream().map(TreeNode::getFirstTokenIndex).sorted().collect(Collectors.toList())
                        + ")", d -> {
                    FormatToken t = d.getFormatToken();
                    if (t.getRight().is(TokenKind.KW_WITH) && owners.contains(t.getRightOwner())) {
                        return d.onlyNewlinesWithoutFallback();
                    }
                    return null;
                });
        List<Split> result = new ArrayList<>();
        result.add(new Split(Modification.SPACE, 0)
                .withPolicy(singleLineBlock(lastToken))
                .withIndent(indent, lastToken, ExpiresOn.LEFT));
        result.add(new Split(Modification.NEWLINE.withAcceptSpace(true), 1)
                .withPolicy(breakBeforeWith)
                .withIndent(indent, lastToken, ExpiresOn.LEFT));
        return result;
    }

    public List<Split> splitWithChain(boolean isFirstWith, Set<TreeNode> owners, Token lastToken) {
        if (isFirstWith) {
            return binPackParentConstructorSplits(owners, lastToken, Constants.INDENT_FOR_WITH_CHAINS);
        }
        List<Split> result = new ArrayList<>();
        result.add(new Split(Modification.SPACE, 0));
        result.add(new Split(Modification.NEWLINE, 1));
        return result;
    }

    // Policies

    public Policy singleLineBlock(Token expire) {
        return singleLineBlock(expire, Collections.emptyList(), true, false);
    }

    public Policy singleLineBlock(Token expire, List<TokenRange> exclude) {
        return singleLineBlock(expire, exclude, true, false);
    }

    /**
     * Forbids newlines up to and including the pair before {@code expire},
     * except inside the excluded ranges.
     *
     * @param disallowSingleLineComments when false, a single-line comment may
     *                                   still end its line
     * @param penaliseNewlinesInsideTokens when true, a multi-line token such
     *                                     as a triple-quoted string kills the
     *                                     path
     */
    public Policy singleLineBlock(Token expire, List<TokenRange> exclude,
                                  boolean disallowSingleLineComments, boolean penaliseNewlinesInsideTokens) {
        List<TokenRange> ranges = List.copyOf(exclude);
        int end = expire.getEnd();
        String description = "SingleLineBlock(" + expire.getIndex() + ", exclude=" + ranges
                + ", comments=" + disallowSingleLineComments + ", multiline=" + penaliseNewlinesInsideTokens + ")";
        return Policy.of(expire, description, d -> {
            FormatToken ft = d.getFormatToken();
            if (ft.getRight().is(TokenKind.EOF) || ft.getRight().getEnd() > end) {
                return null;
            }
            for (TokenRange range : ranges) {
                if (range.contains(ft.getLeft().getStart())) {
                    return null;
                }
            }
            if (!disallowSingleLineComments && TokenOps.isSingleLineComment(ft.getLeft())) {
                return null;
            }
            if (penaliseNewlinesInsideTokens && ft.leftHasNewline()) {
                return Collections.emptyList();
            }
            return d.noNewlines();
        });
    }

    public Policy penalizeAllNewlines(Token expire, int penalty) {
        return penalizeAllNewlines(expire, penalty, true, Collections.emptyList(), false);
    }

    /**
     * Adds {@code penalty} to every newline before {@code expire}.
     *
     * @param penalizeLambdas when false, breaks right after a lambda arrow
     *                        stay free
     * @param ignore          pairs whose left token starts inside one of these
     *                        ranges are left alone
     */
    public Policy penalizeAllNewlines(Token expire, int penalty, boolean penalizeLambdas,
                                      List<TokenRange> ignore, boolean penaliseNewlinesInsideTokens) {
        List<TokenRange> ranges = List.copyOf(ignore);
        int end = expire.getEnd();
        String description = "PenalizeAllNewlines(" + expire.getIndex() + ", " + penalty + ", lambdas="
                + penalizeLambdas + ", ignore=" + ranges + ", multiline=" + penaliseNewlinesInsideTokens + ")";
        return Policy.of(expire, description, d -> {
            FormatToken ft = d.getFormatToken();
            if (ft.getRight().getEnd() >= end
                    || (!penalizeLambdas && ft.getLeft().is(TokenKind.RIGHT_ARROW))) {
                return null;
            }
            for (TokenRange range : ranges) {
                if (range.contains(ft.getLeft().getStart())) {
                    return null;
                }
            }
            boolean multiline = penaliseNewlinesInsideTokens && ft.leftHasNewline();
            List<Split> result = new ArrayList<>(d.getSplits().size());
            for (Split split : d.getSplits()) {
                result.add(split.isNewline() || multiline ? split.withPenalty(penalty) : split);
            }
            return result;
        });
    }

    /**
     * Penalizes newlines between {@code from} and {@code to} by how deeply
     * they sit in selects and applications; breaks after {@code &&} and
     * {@code ||} are cheaper.
     */
    public Policy penalizeNewlineByNesting(Token from, Token to) {
        TokenRange range = new TokenRange(from.getStart(), to.getEnd());
        return Policy.of(to, "PenalizeNewlineByNesting(" + from.getIndex() + ", " + to.getIndex() + ")", d -> {
            FormatToken ft = d.getFormatToken();
            if (!range.contains(ft.getRight().getStart())) {
                return null;
            }
            int nonBoolPenalty = TokenOps.isBoolOperator(ft.getLeft()) ? 0 : 5;
            int penalty = TreeOps.nestedSelect(ft.getLeftOwner()) + TreeOps.nestedApplies(ft.getRightOwner())
                    + nonBoolPenalty;
            return d.withPenalty(penalty, true);
        });
    }

    public Policy newlinesOnlyBeforeClosePolicy(Token close) {
        return decideNewlinesOnlyBeforeClose(new Split(Modification.NEWLINE, 0), close);
    }

    public Policy decideNewlinesOnlyBeforeClose(Split fallback, Token close) {
        return Policy.of(close, "NewlinesOnlyBeforeClose(" + close.getIndex() + ", " + fallback + ")",
                d -> d.getFormatToken().getRight() == close ? d.onlyNewlinesWithFallback(fallback) : null);
    }

    public Policy decideNewlinesOnlyAfterClose(Split fallback, Token close) {
        return Policy.of(close, "NewlinesOnlyAfterClose(" + close.getIndex() + ", " + fallback + ")",
                d -> d.getFormatToken().getLeft() == close ? d.onlyNewlinesWithFallback(fallback) : null);
    }

    public Policy decideNewlinesOnlyAfterToken(Token token) {
        return Policy.of(token, "NewlinesOnlyAfterToken(" + token.getIndex() + ")",
                d -> d.getFormatToken().getLeft() == token ? d.onlyNewlinesWithoutFallback() : null);
    }

    /**
     * Breaks after every comma of the argument list opened by {@code ft}'s
     * left token. A comma followed by a same-line comment keeps the comment
     * on its line; a comma followed by a brace defers to the one-arg-per-line
     * splits when the style offers them.
     */
    public Policy oneArgOneLineSplit(FormatToken ft) {
        Token open = ft.getLeft();
        Token close = tokens.matching(open);
        TreeNode owner = ft.getLeftOwner();
        boolean braceArgsTagged = style.isActive(EditionGate.EDITION_2020_03);
        return Policy.of(close, "OneArgOneLine(" + open.getIndex() + ", taggedBraces=" + braceArgsTagged + ")", d -> {
            FormatToken t = d.getFormatToken();
            if (!t.getLeft().is(TokenKind.COMMA) || t.getLeftOwner() != owner) {
                return null;
            }
            if (t.getRight().is(TokenKind.COMMENT) && t.getNewlinesBetween() == 0) {
                return null;
            }
            if (!t.getRight().is(TokenKind.LEFT_BRACE)) {
                return d.onlyNewlinesWithoutFallback();
            }
            if (!braceArgsTagged) {
                return null;
            }
            List<Split> tagged = new ArrayList<>();
            for (Split split : d.getSplits()) {
                if (split.getTag() != null) {
                    tagged.add(split);
                }
            }
            return tagged.isEmpty() ? null : tagged;
        });
    }

    /**
     * Re-indents the blocks opened by {@code exclude} tokens by
     * {@code indent}, up to their closing delimiter.
     */
    public Policy unindentAtExclude(List<Token> exclude, Length indent, Token expire) {
        List<Token> opens = List.copyOf(exclude);
        String description = "UnindentAtExclude(" + opens.stream().map(t -> String.valueOf(t.getIndex()))
                .collect(Collectors.joining(",")) + ", " + indent + ")";
        return Policy.of(expire, description, d -> {
            Token left = d.getFormatToken().getLeft();
            if (!opens.contains(left)) {
                return null;
            }
            Token close = tokens.matching(left);
            List<Split> result = new ArrayList<>(d.getSplits().size());
            for (Split split : d.getSplits()) {
                result.add(split.withIndent(indent, close, ExpiresOn.LEFT));
            }
            return result;
        });
    }

    /**
     * Attaches {@code onBreak} to every newline split up to its expiry,
     * only for pairs whose left token ends before {@code limit} when a limit
     * is given.
     */
    public Policy delayedBreakPolicy(Token limit, Policy onBreak) {
        String description = "DelayedBreak(" + (limit == null ? "-" : String.valueOf(limit.getIndex()))
                + ", " + onBreak + ")";
        return Policy.of(onBreak.getExpire(), description, d -> {
            if (limit != null && d.getFormatToken().getLeft().getEnd() >= limit.getEnd()) {
                return null;
            }
            List<Split> result = new ArrayList<>(d.getSplits().size());
            for (Split split : d.getSplits()) {
                result.add(split.isNewline() ? split.andThenPolicy(onBreak) : split);
            }
            return result;
        });
    }

    /**
     * Splits for a forced break: newline splits at no more than cost zero.
     */
    public static List<Split> forceNewline(Decision decision) {
        return decision.onlyNewlinesWithFallback(new Split(Modification.NEWLINE, 0));
    }

    /**
     * Function part and arguments of an argument list.
     */
    public static final class ApplyArgs {
        private final TreeNode lhs;
        private final List<TreeNode> args;

        ApplyArgs(TreeNode lhs, List<TreeNode> args) {
            this.lhs = lhs;
            this.args = Collections.unmodifiableList(args);
        }

        public TreeNode getLhs() { return lhs; }
        public List<TreeNode> getArgs() { return args; }
    }

    /**
     * Expiry token of a lambda body's indentation.
     */
    public static final class FunctionExpiry {
        private final Token token;
        private final ExpiresOn expiresOn;

        FunctionExpiry(Token token, ExpiresOn expiresOn) {
            this.token = token;
            this.expiresOn = expiresOn;
        }

        public Token getToken() { return token; }
        public ExpiresOn getExpiresOn() { return expiresOn; }
    }

    /**
     * Whether a curly lambda may keep its body on the arrow's line, and the
     * newline to use otherwise.
     */
    public static final class CurlyLambdaBreak {
        private final boolean spaceAllowed;
        private final Modification.Newline newline;

        CurlyLambdaBreak(boolean spaceAllowed, Modification.Newline newline) {
            this.spaceAllowed = spaceAllowed;
            this.newline = newline;
        }

        public boolean isSpaceAllowed() { return spaceAllowed; }
        public Modification.Newline getNewline() { return newline; }
    }
}
