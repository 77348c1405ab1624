package com.vidnyan.aro.adapter.out.parser;

import com.vidnyan.aro.domain.ast.Action;
import com.vidnyan.aro.domain.ast.AroStatement;
import com.vidnyan.aro.domain.ast.CaseClause;
import com.vidnyan.aro.domain.ast.Expression;
import com.vidnyan.aro.domain.ast.FeatureSet;
import com.vidnyan.aro.domain.ast.ForEachLoop;
import com.vidnyan.aro.domain.ast.ImportDeclaration;
import com.vidnyan.aro.domain.ast.LiteralValue;
import com.vidnyan.aro.domain.ast.MatchStatement;
import com.vidnyan.aro.domain.ast.ObjectClause;
import com.vidnyan.aro.domain.ast.Pattern;
import com.vidnyan.aro.domain.ast.PipelineStatement;
import com.vidnyan.aro.domain.ast.Program;
import com.vidnyan.aro.domain.ast.PublishStatement;
import com.vidnyan.aro.domain.ast.QualifiedNoun;
import com.vidnyan.aro.domain.ast.RequireStatement;
import com.vidnyan.aro.domain.ast.Statement;
import com.vidnyan.aro.domain.diagnostic.DiagnosticCollector;
import com.vidnyan.aro.domain.diagnostic.DiagnosticKind;
import com.vidnyan.aro.domain.model.SourceSpan;
import com.vidnyan.aro.domain.token.Keyword;
import com.vidnyan.aro.domain.token.Preposition;
import com.vidnyan.aro.domain.token.Token;
import com.vidnyan.aro.domain.token.TokenKind;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser producing the {@link Program} tree.
 * <p>
 * Errors never escape {@link #parse()}: a failing statement is reported and skipped up to its
 * terminating dot, a failing feature set header is skipped up to the next header, so independent
 * mistakes across the source are all reported in one pass.
 */
public final class Parser {

    private static final Set<Keyword> KEYWORD_VERBS =
            EnumSet.of(Keyword.ASSERT, Keyword.GUARD, Keyword.DEFER, Keyword.PRECONDITION);

    private final TokenCursor cursor;
    private final NounParser nouns;
    private final ExpressionParser expressions;
    private final DiagnosticCollector diagnostics;

    public Parser(List<Token> tokens, DiagnosticCollector diagnostics) {
        this.cursor = new TokenCursor(tokens);
        this.nouns = new NounParser(cursor);
        this.expressions = new ExpressionParser(cursor, nouns);
        this.diagnostics = diagnostics;
    }

    public Program parse() {
        SourceSpan start = cursor.peek().span();
        List<ImportDeclaration> imports = new ArrayList<>();
        List<FeatureSet> featureSets = new ArrayList<>();

        while (!cursor.isAtEnd()) {
            int attemptStart = cursor.position();
            try {
                if (cursor.check(Keyword.IMPORT)) {
                    imports.add(parseImport());
                } else {
                    FeatureSet featureSet = parseFeatureSet();
                    if (featureSet != null) {
                        featureSets.add(featureSet);
                    }
                }
            } catch (ParseException e) {
                diagnostics.report(e.toDiagnostic());
                synchronizeToFeatureSet(attemptStart);
            }
        }

        SourceSpan end = cursor.hasPrevious() ? cursor.previous().span() : start;
        return new Program(imports, featureSets, start.merged(end));
    }

    // --- Top level ---

    private ImportDeclaration parseImport() {
        Token keyword = cursor.advance();
        Token first = cursor.peek();
        if (first.is(TokenKind.STRING_LITERAL)) {
            cursor.advance();
            return new ImportDeclaration(first.text(), keyword.span().merged(first.span()));
        }
        if (first.is(TokenKind.EOF) || first.span().start().line() != keyword.span().start().line()) {
            throw cursor.unexpected("import path");
        }
        StringBuilder path = new StringBuilder();
        Token last = first;
        do {
            last = cursor.advance();
            path.append(last.lexeme());
        } while (!cursor.isAtEnd() && last.span().touches(cursor.peek().span()));
        return new ImportDeclaration(path.toString(), keyword.span().merged(last.span()));
    }

    /**
     * {@code "(" Name ":" Business Activity ")" "{" Statement+ "}"}.
     * Returns null when the body is empty; that error is already reported.
     */
    private FeatureSet parseFeatureSet() {
        Token open = cursor.expect(TokenKind.LEFT_PAREN, "'('");

        String name = nouns.parseIdentifierSequence();
        if (name.isEmpty()) {
            throw new ParseException(DiagnosticKind.MISSING_FEATURE_SET_NAME,
                    "Missing feature set name", cursor.peek().span().start());
        }
        cursor.expect(TokenKind.COLON, "':'");

        String activity = nouns.parseIdentifierSequence();
        if (activity.isEmpty()) {
            throw new ParseException(DiagnosticKind.MISSING_BUSINESS_ACTIVITY,
                    "Missing business activity", cursor.peek().span().start());
        }
        cursor.expect(TokenKind.RIGHT_PAREN, "')'");
        Token brace = cursor.expect(TokenKind.LEFT_BRACE, "'{'");

        Block body = parseBlock();
        Token close = cursor.expect(TokenKind.RIGHT_BRACE, "'}'");

        if (body.statements().isEmpty()) {
            if (!body.recovered()) {
                diagnostics.error(DiagnosticKind.EMPTY_FEATURE_SET,
                        "Feature set must contain at least one statement", brace.span().start(),
                        "Add a statement to '" + name + "', e.g. Return an <OK: status> for the <result>.");
            }
            return null;
        }
        return new FeatureSet(name, activity, body.statements(), open.span().merged(close.span()));
    }

    // --- Blocks and statements ---

    private record Block(List<Statement> statements, boolean recovered) {}

    /**
     * Statements up to (not including) the closing brace.
     */
    private Block parseBlock() {
        List<Statement> statements = new ArrayList<>();
        boolean recovered = false;
        while (!cursor.check(TokenKind.RIGHT_BRACE) && !cursor.isAtEnd() && !cursor.atFeatureSetHeader(0)) {
            try {
                statements.add(parseStatement());
            } catch (ParseException e) {
                diagnostics.report(e.toDiagnostic());
                recovered = true;
                synchronizeToNextStatement();
            }
        }
        return new Block(statements, recovered);
    }

    private List<Statement> parseBracedBlock() {
        cursor.expect(TokenKind.LEFT_BRACE, "'{'");
        Block block = parseBlock();
        cursor.expect(TokenKind.RIGHT_BRACE, "'}'");
        return block.statements();
    }

    private Statement parseStatement() {
        Token token = cursor.peek();
        if (startsKeywordStatement(Keyword.PUBLISH)) {
            return parsePublish();
        }
        if (startsKeywordStatement(Keyword.REQUIRE)) {
            return parseRequire();
        }
        if (token.is(Keyword.MATCH)) {
            return parseMatch();
        }
        if (token.is(Keyword.PARALLEL) || (token.is(Keyword.FOR) && cursor.peek(1).is(Keyword.EACH))) {
            return parseForEach();
        }
        if (isActionStart()) {
            return parseAroOrPipeline();
        }
        throw new ParseException(DiagnosticKind.INVALID_STATEMENT,
                "Invalid statement: unexpected " + token.describe(), token.span().start(),
                "Statements start with an action verb, e.g. Extract the <user> from the <request>.");
    }

    /**
     * Keyword verbs may be written bare or in angle brackets: {@code Publish} or {@code <Publish>}.
     */
    private boolean startsKeywordStatement(Keyword keyword) {
        if (cursor.check(keyword)) {
            return true;
        }
        return cursor.check(TokenKind.LEFT_ANGLE)
                && cursor.peek(1).is(keyword)
                && cursor.peek(2).is(TokenKind.RIGHT_ANGLE);
    }

    private Token consumeKeywordVerb(Keyword keyword) {
        if (cursor.match(TokenKind.LEFT_ANGLE)) {
            Token open = cursor.previous();
            cursor.expect(keyword);
            Token close = cursor.expect(TokenKind.RIGHT_ANGLE, "'>'");
            return new Token(TokenKind.KEYWORD, keyword.word(), open.span().merged(close.span()), keyword);
        }
        return cursor.expect(keyword);
    }

    private boolean isActionStart() {
        Token token = cursor.peek();
        if (token.is(TokenKind.LEFT_ANGLE)) {
            return isVerbToken(cursor.peek(1)) && cursor.peek(2).is(TokenKind.RIGHT_ANGLE);
        }
        return isVerbToken(token);
    }

    private static boolean isVerbToken(Token token) {
        if (token.is(TokenKind.IDENTIFIER)) {
            return true;
        }
        return token.is(TokenKind.KEYWORD) && KEYWORD_VERBS.contains(token.keyword());
    }

    private Statement parseAroOrPipeline() {
        List<AroStatement> stages = new ArrayList<>();
        stages.add(parseAroBody());
        while (cursor.match(TokenKind.ARROW)) {
            stages.add(parseAroBody());
        }
        Token end = cursor.expect(TokenKind.DOT, "'.'");
        if (stages.size() == 1) {
            AroStatement only = stages.get(0);
            return new AroStatement(only.action(), only.result(), only.resultExpression(), only.object(),
                    only.withValue(), only.guard(), only.span().merged(end.span()));
        }
        SourceSpan span = stages.get(0).span().merged(end.span());
        return new PipelineStatement(stages, span);
    }

    /**
     * {@code Verb [article] (<result> | value) [preposition [article] object] [with value] [when guard]},
     * without the terminating dot.
     */
    private AroStatement parseAroBody() {
        Token start = cursor.peek();
        Action action = parseAction();
        cursor.skipArticle();

        QualifiedNoun result = null;
        Expression resultExpression = null;
        if (cursor.check(TokenKind.LEFT_ANGLE)) {
            cursor.advance();
            result = nouns.parseQualifiedNoun();
            cursor.expect(TokenKind.RIGHT_ANGLE, "'>'");
        } else if (startsValue(cursor.peek())) {
            resultExpression = expressions.parseExpression();
        } else {
            throw cursor.unexpected("result '<noun>'");
        }

        ObjectClause object = null;
        Preposition preposition = currentPreposition();
        if (preposition != null) {
            cursor.advance();
            cursor.skipArticle();
            Expression target = expressions.parseExpression();
            object = target instanceof Expression.VariableRef ref
                    ? ObjectClause.of(preposition, ref.noun())
                    : ObjectClause.ofExpression(preposition, target);
        }

        Expression withValue = null;
        if (object != null && cursor.peek().is(Preposition.WITH)) {
            cursor.advance();
            withValue = expressions.parseExpression();
        }

        Expression guard = null;
        if (cursor.match(Keyword.WHEN)) {
            guard = expressions.parseExpression();
        }

        SourceSpan span = start.span().merged(cursor.previous().span());
        return new AroStatement(action, result, resultExpression, object, withValue, guard, span);
    }

    private Action parseAction() {
        if (cursor.match(TokenKind.LEFT_ANGLE)) {
            Token open = cursor.previous();
            Token verb = cursor.advance();
            Token close = cursor.expect(TokenKind.RIGHT_ANGLE, "'>'");
            return new Action(verb.lexeme(), open.span().merged(close.span()));
        }
        Token verb = cursor.peek();
        if (!isVerbToken(verb)) {
            throw cursor.unexpected("action verb");
        }
        cursor.advance();
        return new Action(verb.lexeme(), verb.span());
    }

    /**
     * Preposition at the cursor; {@code for} and {@code at} are keywords that double as prepositions.
     */
    private Preposition currentPreposition() {
        Token token = cursor.peek();
        if (token.is(TokenKind.PREPOSITION)) {
            return token.preposition();
        }
        if (token.is(Keyword.FOR)) {
            return Preposition.FOR;
        }
        if (token.is(Keyword.AT)) {
            return Preposition.AT;
        }
        return null;
    }

    private static boolean startsValue(Token token) {
        switch (token.kind()) {
            case STRING_LITERAL:
            case STRING_SEGMENT:
            case INTEGER_LITERAL:
            case FLOAT_LITERAL:
            case BOOLEAN_LITERAL:
            case NULL_LITERAL:
            case REGEX_LITERAL:
            case LEFT_BRACKET:
            case LEFT_BRACE:
            case LEFT_PAREN:
            case MINUS:
                return true;
            default:
                return token.is(Keyword.NOT);
        }
    }

    /**
     * {@code Publish as <external> <internal>.}
     */
    private PublishStatement parsePublish() {
        Token verb = consumeKeywordVerb(Keyword.PUBLISH);
        cursor.expect(Keyword.AS);
        String external = parseAngleName();
        String internal = parseAngleName();
        Token end = cursor.expect(TokenKind.DOT, "'.'");
        return new PublishStatement(external, internal, verb.span().merged(end.span()));
    }

    /**
     * {@code Require [article] <name> from [article] <framework|environment|Feature Set>.}
     */
    private RequireStatement parseRequire() {
        Token verb = consumeKeywordVerb(Keyword.REQUIRE);
        cursor.skipArticle();
        String name = parseAngleName();
        if (!cursor.peek().is(Preposition.FROM)) {
            throw cursor.unexpected("'from'");
        }
        cursor.advance();
        cursor.skipArticle();
        String sourceName;
        if (cursor.match(TokenKind.LEFT_ANGLE)) {
            sourceName = nouns.parseIdentifierSequence();
            cursor.expect(TokenKind.RIGHT_ANGLE, "'>'");
        } else {
            sourceName = nouns.parseIdentifierSequence();
        }
        if (sourceName.isEmpty()) {
            throw cursor.unexpected("dependency source");
        }
        Token end = cursor.expect(TokenKind.DOT, "'.'");
        return new RequireStatement(name, RequireStatement.Source.resolve(sourceName),
                verb.span().merged(end.span()));
    }

    private String parseAngleName() {
        cursor.expect(TokenKind.LEFT_ANGLE, "'<'");
        String name = nouns.parseCompoundIdentifier();
        cursor.expect(TokenKind.RIGHT_ANGLE, "'>'");
        return name;
    }

    /**
     * {@code match <subject> { (case Pattern [where Expr] { Stmt* })* [otherwise { Stmt* }] }}.
     */
    private MatchStatement parseMatch() {
        Token keyword = cursor.advance();
        cursor.expect(TokenKind.LEFT_ANGLE, "'<'");
        QualifiedNoun subject = nouns.parseQualifiedNoun();
        cursor.expect(TokenKind.RIGHT_ANGLE, "'>'");
        cursor.expect(TokenKind.LEFT_BRACE, "'{'");

        List<CaseClause> cases = new ArrayList<>();
        List<Statement> otherwise = null;
        while (cursor.check(Keyword.CASE)) {
            Token caseToken = cursor.advance();
            Pattern pattern = parsePattern();
            Expression guard = cursor.match(Keyword.WHERE) ? expressions.parseExpression() : null;
            List<Statement> body = parseBracedBlock();
            cases.add(new CaseClause(pattern, guard, body, caseToken.span().merged(cursor.previous().span())));
        }
        if (cursor.match(Keyword.OTHERWISE)) {
            otherwise = parseBracedBlock();
        }
        if (cases.isEmpty() && otherwise == null) {
            throw cursor.unexpected("'case' or 'otherwise'");
        }
        Token close = cursor.expect(TokenKind.RIGHT_BRACE, "'}'");
        return new MatchStatement(subject, cases, otherwise, keyword.span().merged(close.span()));
    }

    private Pattern parsePattern() {
        Token token = cursor.peek();
        switch (token.kind()) {
            case REGEX_LITERAL: {
                cursor.advance();
                Token.RegexValue regex = (Token.RegexValue) token.value();
                return new Pattern.Regex(regex.pattern(), regex.flags());
            }
            case LEFT_ANGLE: {
                cursor.advance();
                QualifiedNoun noun = nouns.parseQualifiedNoun();
                cursor.expect(TokenKind.RIGHT_ANGLE, "'>'");
                return new Pattern.Variable(noun);
            }
            case STRING_LITERAL:
                cursor.advance();
                return new Pattern.Literal(LiteralValue.string(token.text()));
            case INTEGER_LITERAL:
                cursor.advance();
                return new Pattern.Literal(LiteralValue.integer((Long) token.value()));
            case FLOAT_LITERAL:
                cursor.advance();
                return new Pattern.Literal(LiteralValue.decimal((Double) token.value()));
            case BOOLEAN_LITERAL:
                cursor.advance();
                return new Pattern.Literal(LiteralValue.bool((Boolean) token.value()));
            case NULL_LITERAL:
                cursor.advance();
                return new Pattern.Literal(LiteralValue.NULL);
            default:
                throw cursor.unexpected("case pattern");
        }
    }

    /**
     * {@code [parallel] for each <item> [at <index>] in <items> [where Expr] [with <concurrency: N>] { Stmt* }}.
     */
    private ForEachLoop parseForEach() {
        Token start = cursor.peek();
        boolean parallel = cursor.match(Keyword.PARALLEL);
        cursor.expect(Keyword.FOR);
        cursor.expect(Keyword.EACH);

        String item = parseAngleName();
        String index = null;
        if (cursor.match(Keyword.AT)) {
            index = parseAngleName();
        }
        cursor.expect(Keyword.IN);
        cursor.expect(TokenKind.LEFT_ANGLE, "'<'");
        QualifiedNoun collection = nouns.parseQualifiedNoun();
        cursor.expect(TokenKind.RIGHT_ANGLE, "'>'");

        Expression filter = cursor.match(Keyword.WHERE) ? expressions.parseExpression() : null;

        Integer concurrency = null;
        if (cursor.peek().is(Preposition.WITH)) {
            cursor.advance();
            concurrency = parseConcurrency();
        }

        List<Statement> body = parseBracedBlock();
        SourceSpan span = start.span().merged(cursor.previous().span());
        return new ForEachLoop(item, index, collection, filter, parallel, concurrency, body, span);
    }

    /**
     * {@code <concurrency: N>} or {@code concurrency: N}.
     */
    private Integer parseConcurrency() {
        boolean angled = cursor.match(TokenKind.LEFT_ANGLE);
        cursor.expect(Keyword.CONCURRENCY);
        cursor.expect(TokenKind.COLON, "':'");
        Token bound = cursor.peek();
        if (!bound.is(TokenKind.INTEGER_LITERAL) || (Long) bound.value() < 1 || (Long) bound.value() > Integer.MAX_VALUE) {
            throw new ParseException(DiagnosticKind.UNEXPECTED_TOKEN,
                    "Expected a positive concurrency bound, but got " + bound.describe(), bound.span().start());
        }
        cursor.advance();
        if (angled) {
            cursor.expect(TokenKind.RIGHT_ANGLE, "'>'");
        }
        return ((Long) bound.value()).intValue();
    }

    // --- Recovery ---

    /**
     * Skip past the failed statement: stop after its terminating dot, before a closing brace of the
     * enclosing block, or before the next feature set header.
     */
    private void synchronizeToNextStatement() {
        int depth = 0;
        while (!cursor.isAtEnd()) {
            Token token = cursor.peek();
            if (depth == 0 && token.is(TokenKind.DOT) && !cursor.atMemberDot()) {
                cursor.advance();
                return;
            }
            if (token.is(TokenKind.LEFT_BRACE)) {
                depth++;
            } else if (token.is(TokenKind.RIGHT_BRACE)) {
                if (depth == 0) {
                    return;
                }
                depth--;
            } else if (depth == 0 && cursor.atFeatureSetHeader(0)) {
                return;
            }
            cursor.advance();
        }
    }

    /**
     * Skip to the next feature set header or import, making progress past {@code attemptStart}.
     */
    private void synchronizeToFeatureSet(int attemptStart) {
        if (cursor.position() == attemptStart) {
            cursor.advance();
        }
        while (!cursor.isAtEnd() && !cursor.atFeatureSetHeader(0) && !cursor.check(Keyword.IMPORT)) {
            cursor.advance();
        }
    }
}
