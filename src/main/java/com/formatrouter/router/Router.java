package com.formatrouter.router;

import com.formatrouter.api.error.UnexpectedTreeException;
import com.formatrouter.model.FormatToken;
import com.formatrouter.router.rules.ApplyRules;
import com.formatrouter.router.rules.BlockRules;
import com.formatrouter.router.rules.BoundaryRules;
import com.formatrouter.router.rules.ChainRules;
import com.formatrouter.router.rules.ControlRules;
import com.formatrouter.router.rules.DefinitionRules;
import com.formatrouter.router.rules.FallbackRules;
import com.formatrouter.split.Split;
import com.formatrouter.util.LoggerUtil;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Assigns the candidate splits of a token pair.
 * <p>
 * The rules are tried in table order and the first one that matches the pair
 * decides it alone, so a specific rule must come before the general rule that
 * would also match. Every returned split records the name of the rule that
 * produced it. A pair no rule matches gets an empty list, which leaves the
 * surrounding code unformatted.
 * <p>
 * One router serves one file; it is not thread-safe.
 */
public class Router {
    private static final Logger logger = LoggerUtil.getLogger(Router.class);

    private static final List<Rule> RULES = List.of(
            // Boundaries, interpolation, imports
            new Rule("BeginningOfFile", BoundaryRules::beginningOfFile),
            new Rule("EndOfFile", BoundaryRules::endOfFile),
            new Rule("InterpolationStart", BoundaryRules::interpolationStart),
            new Rule("InterpolationInterior", BoundaryRules::interpolationInterior),
            new Rule("EmptyBraces", BoundaryRules::emptyBraces),
            new Rule("ImportDotBrace", BoundaryRules::importDotBrace),
            new Rule("ImportOpenBrace", BoundaryRules::importOpenBrace),
            new Rule("InterpolationOpenBrace", BoundaryRules::interpolationOpenBrace),
            new Rule("SelectorCloseBrace", BoundaryRules::selectorCloseBrace),
            new Rule("ImportWildcard", BoundaryRules::importWildcard),

            // Blocks and statements
            new Rule("OpenBrace", BlockRules::openBrace),
            new Rule("StatementLambdaArrow", BlockRules::statementLambdaArrow),
            new Rule("LambdaArrow", BlockRules::lambdaArrow),
            new Rule("CaseArrow", BlockRules::caseArrow),
            new Rule("SemicolonStatement", BlockRules::semicolonStatement),
            new Rule("StatementStart", BlockRules::statementStart),
            new Rule("CloseBrace", BlockRules::closeBrace),
            new Rule("PackageKeyword", BlockRules::packageKeyword),

            // Definitions
            new Rule("NoSpaceOpenParen", DefinitionRules::noSpaceOpenParen),
            new Rule("TemplateKeyword", DefinitionRules::templateKeyword),
            new Rule("DefName", DefinitionRules::defName),
            new Rule("DefBodyEquals", DefinitionRules::defBodyEquals),

            // Argument lists
            new Rule("ConfigStyleLambdaArg", ApplyRules::configStyleLambdaArg),
            new Rule("ConfigStyleArgs", ApplyRules::configStyleArgs),
            new Rule("BinPackDefnSite", ApplyRules::binPackDefnSite),
            new Rule("BinPackCallSite", ApplyRules::binPackCallSite),
            new Rule("EmptyParens", ApplyRules::emptyParens),
            new Rule("KeywordParen", ApplyRules::keywordParen),
            new Rule("DefaultApply", ApplyRules::defaultApply),
            new Rule("ReturnTypeColon", DefinitionRules::returnTypeColon),
            new Rule("ResultTypeColon", DefinitionRules::resultTypeColon),
            new Rule("ParenBrace", ApplyRules::parenBrace),
            new Rule("XmlBraceOpen", ApplyRules::xmlBraceOpen),
            new Rule("XmlBraceClose", ApplyRules::xmlBraceClose),
            new Rule("CommaBrace", ApplyRules::commaBrace),
            new Rule("BeforeBrace", ApplyRules::beforeBrace),
            new Rule("BeforeComma", ApplyRules::beforeComma),
            new Rule("AfterComma", ApplyRules::afterComma),
            new Rule("BeforeSemicolon", ApplyRules::beforeSemicolon),
            new Rule("ReturnKeyword", FallbackRules::returnKeyword),
            new Rule("Colon", DefinitionRules::colon),
            new Rule("AssignmentEquals", DefinitionRules::assignmentEquals),

            // Selects, unary operators, annotations
            new Rule("SymbolicSelect", ChainRules::symbolicSelect),
            new Rule("UnderscoreSelect", ChainRules::underscoreSelect),
            new Rule("SelectChain", ChainRules::selectChain),
            new Rule("UnaryLiteral", ChainRules::unaryLiteral),
            new Rule("UnaryOperator", ChainRules::unaryOperator),
            new Rule("BindBefore", ChainRules::bindBefore),
            new Rule("BindAfter", ChainRules::bindAfter),
            new Rule("AnnotationDelim", ChainRules::annotationDelim),
            new Rule("AnnotationIdent", ChainRules::annotationIdent),

            // Templates
            new Rule("ExtendsKeyword", DefinitionRules::extendsKeyword),
            new Rule("WithKeyword", DefinitionRules::withKeyword),

            // Control flow
            new Rule("ControlParen", ControlRules::controlParen),
            new Rule("IfKeyword", ControlRules::ifKeyword),
            new Rule("ControlCloseParen", ControlRules::controlCloseParen),
            new Rule("BraceElse", ControlRules::braceElse),
            new Rule("BraceYield", ControlRules::braceYield),
            new Rule("BeforeElseOrYield", ControlRules::beforeElseOrYield),
            new Rule("LastElse", ControlRules::lastElse),

            new Rule("TypeVariance", FallbackRules::typeVariance),
            new Rule("RepeatedType", FallbackRules::repeatedType),
            new Rule("OpenParenFallback", ApplyRules::openParenFallback),
            new Rule("InfixLeft", FallbackRules::infixLeft),
            new Rule("InfixRight", FallbackRules::infixRight),
            new Rule("CaseKeyword", ControlRules::caseKeyword),
            new Rule("CaseGuard", ControlRules::caseGuard),

            // Comments
            new Rule("CommentRight", FallbackRules::commentRight),
            new Rule("SingleLineCommentLeft", FallbackRules::singleLineCommentLeft),
            new Rule("CommentLeft", FallbackRules::commentLeft),

            new Rule("ImplicitModifier", FallbackRules::implicitModifier),
            new Rule("OptionalAnnotationNewline", FallbackRules::optionalAnnotationNewline),
            new Rule("PatternAlternative", FallbackRules::patternAlternative),
            new Rule("IdentSequence", FallbackRules::identSequence),
            new Rule("MatchKeyword", FallbackRules::matchKeyword),
            new Rule("QualifierBracketOpen", FallbackRules::qualifierBracketOpen),
            new Rule("QualifierBracketInside", FallbackRules::qualifierBracketInside),

            // For comprehensions
            new Rule("EnumeratorGuard", ControlRules::enumeratorGuard),
            new Rule("GeneratorArrow", ControlRules::generatorArrow),
            new Rule("YieldKeyword", ControlRules::yieldKeyword),

            // Fallback
            new Rule("BeforeInterpolationId", FallbackRules::beforeInterpolationId),
            new Rule("AfterInterpolationId", FallbackRules::afterInterpolationId),
            new Rule("ThrowKeyword", FallbackRules::throwKeyword),
            new Rule("SingletonType", FallbackRules::singletonType),
            new Rule("VarArgsColon", FallbackRules::varArgsColon),
            new Rule("VarArgsStar", FallbackRules::varArgsStar),
            new Rule("AfterXmlPart", FallbackRules::afterXmlPart),
            new Rule("BeforeXmlPart", FallbackRules::beforeXmlPart),
            new Rule("BeforeDot", FallbackRules::beforeDot),
            new Rule("BeforeHash", FallbackRules::beforeHash),
            new Rule("AfterHash", FallbackRules::afterHash),
            new Rule("AfterDot", FallbackRules::afterDot),
            new Rule("CloseBracket", FallbackRules::closeBracket),
            new Rule("CloseParen", FallbackRules::closeParen),
            new Rule("CatchFinally", ControlRules::catchFinally),
            new Rule("BeforeKeyword", FallbackRules::beforeKeyword),
            new Rule("AfterKeyword", FallbackRules::afterKeyword),
            new Rule("AfterOpenBracket", FallbackRules::afterOpenBracket),
            new Rule("BeforeDelim", FallbackRules::beforeDelim),
            new Rule("WildcardStar", FallbackRules::wildcardStar),
            new Rule("ByNameArrow", FallbackRules::byNameArrow),
            new Rule("AfterDelim", FallbackRules::afterDelim));

    private final FormatOps ops;
    private final IntArrayList unmatchedPairs = new IntArrayList();

    public Router(FormatOps ops) {
        this.ops = ops;
    }

    public FormatOps getOps() {
        return ops;
    }

    /**
     * Names of the rules in the order they are tried.
     */
    public static List<String> ruleNames() {
        return RULES.stream().map(Rule::getName).collect(Collectors.toList());
    }

    /**
     * The candidate splits of {@code ft}, ignored ones included; empty when
     * no rule matches.
     *
     * @throws com.formatrouter.api.error.UnexpectedTreeException when a rule
     *         finds the syntax tree in a shape it cannot handle
     */
    public List<Split> getSplits(FormatToken ft) {
        RouteContext ctx = new RouteContext(ft, ops);
        for (Rule rule : RULES) {
            List<Split> result = route(rule, ctx);
            if (result != null) {
                List<Split> tagged = new ArrayList<>(result.size());
                for (Split split : result) {
                    tagged.add(split.withOrigin(rule.getName()));
                }
                return tagged;
            }
        }
        unmatchedPairs.add(ft.getIndex());
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("No rule matches pair " + ft.getIndex() + ": " + ctx);
        }
        return Collections.emptyList();
    }

    /**
     * Name of the rule that decides {@code ft}.
     */
    public Optional<String> matchingRule(FormatToken ft) {
        RouteContext ctx = new RouteContext(ft, ops);
        for (Rule rule : RULES) {
            if (route(rule, ctx) != null) {
                return Optional.of(rule.getName());
            }
        }
        return Optional.empty();
    }

    /**
     * Runs one rule. Navigation failures inside it mean the tree handed in is
     * malformed and are reported against the pair.
     */
    private static List<Split> route(Rule rule, RouteContext ctx) {
        try {
            return rule.route(ctx);
        } catch (IllegalStateException | IllegalArgumentException e) {
            throw new UnexpectedTreeException(ctx.ft(), e);
        }
    }

    /**
     * Indices of the pairs no rule matched so far.
     */
    public IntList getUnmatchedPairs() {
        return IntLists.unmodifiable(unmatchedPairs);
    }
}
