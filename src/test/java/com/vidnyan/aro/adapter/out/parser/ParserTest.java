package com.vidnyan.aro.adapter.out.parser;

import com.vidnyan.aro.domain.ast.*;
import com.vidnyan.aro.domain.diagnostic.Diagnostic;
import com.vidnyan.aro.domain.diagnostic.DiagnosticCollector;
import com.vidnyan.aro.domain.diagnostic.DiagnosticKind;
import com.vidnyan.aro.domain.token.Preposition;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParserTest {

    private final DiagnosticCollector diagnostics = new DiagnosticCollector();

    private Program parse(String source) {
        return new Parser(Lexer.tokenize(source), diagnostics).parse();
    }

    private List<DiagnosticKind> diagnosticKinds() {
        return diagnostics.diagnostics().stream().map(Diagnostic::kind).toList();
    }

    @Test
    void parse_ShouldBuildFeatureSetWithStatements() {
        // Arrange
        String source = """
                (Create User: User API) {
                    Extract the <data> from the <request: body>.
                    Create the <user: record> with <data>.
                    Return a <Created: status> for the <user>.
                }
                """;

        // Act
        Program program = parse(source);

        // Assert
        assertTrue(diagnostics.diagnostics().isEmpty(), diagnostics.diagnostics().toString());
        assertEquals(1, program.featureSets().size());
        FeatureSet featureSet = program.featureSets().get(0);
        assertEquals("Create User", featureSet.name());
        assertEquals("User API", featureSet.businessActivity());
        assertEquals(3, featureSet.statements().size());

        AroStatement extract = assertInstanceOf(AroStatement.class, featureSet.statements().get(0));
        assertEquals("Extract", extract.action().verb());
        assertEquals(ActionRole.REQUEST, extract.role());
        assertEquals("data", extract.result().base());
        assertEquals(Preposition.FROM, extract.object().preposition());
        assertEquals("request: body", extract.objectNoun().fullName());

        AroStatement create = assertInstanceOf(AroStatement.class, featureSet.statements().get(1));
        assertEquals(ActionRole.OWN, create.role());
        assertEquals(List.of("record"), create.result().specifiers());
        assertEquals(Preposition.WITH, create.object().preposition());

        AroStatement ret = assertInstanceOf(AroStatement.class, featureSet.statements().get(2));
        assertTrue(ret.isTerminal());
        assertEquals(Preposition.FOR, ret.object().preposition());
    }

    @Test
    void parse_ShouldJoinHyphenatedAndMultiWordNames() {
        // Act
        Program program = parse("(Application-Start: Order Service v2) { Log \"up\" to the <console>. }");

        // Assert
        FeatureSet featureSet = program.featureSets().get(0);
        assertEquals("Application-Start", featureSet.name());
        assertEquals("Order Service v2", featureSet.businessActivity());
    }

    @Test
    void parse_LiteralResultShouldBecomeResultExpression() {
        // Act
        Program program = parse("(Start: Demo) { Log \"Hello ${<name>}\" to the <console>. }");

        // Assert
        AroStatement log = (AroStatement) program.featureSets().get(0).statements().get(0);
        assertNull(log.result());
        assertInstanceOf(Expression.InterpolatedString.class, log.resultExpression());
        assertEquals(ActionRole.RESPONSE, log.role());
    }

    @Test
    void parse_ObjectShouldAcceptExpressions() {
        // Act
        Program program = parse("(Sum: Demo) { Compute the <total> from <price> * <qty> + 1. }");

        // Assert
        AroStatement compute = (AroStatement) program.featureSets().get(0).statements().get(0);
        assertFalse(compute.object().hasNoun());
        assertEquals("((<price> * <qty>) + 1)", new AstPrinter().print(compute.object().expression()));
    }

    @Test
    void parse_ShouldReadGuardAndBracketedVerb() {
        // Act
        Program program = parse(
                "(Check: Demo) { <Return> an <OK: status> for the <user> when <user> exists. }");

        // Assert
        AroStatement ret = (AroStatement) program.featureSets().get(0).statements().get(0);
        assertEquals("Return", ret.action().verb());
        assertTrue(ret.isGuarded());
        assertFalse(ret.isTerminal(), "a guarded return may fall through");
        assertInstanceOf(Expression.Existence.class, ret.guard());
    }

    @Test
    void parse_ShouldReadPublishAndRequire() {
        // Arrange
        String source = """
                (Auth: Security) {
                    Require the <db> from the framework.
                    Require <settings> from <Config Loader>.
                    Extract the <user> from the <request>.
                    <Publish> as <current-user> <user>.
                    Publish as <db-handle> <db>.
                    Return an <OK: status> for the <user>.
                }
                """;

        // Act
        Program program = parse(source);

        // Assert
        assertTrue(diagnostics.diagnostics().isEmpty(), diagnostics.diagnostics().toString());
        List<Statement> statements = program.featureSets().get(0).statements();
        RequireStatement db = assertInstanceOf(RequireStatement.class, statements.get(0));
        assertEquals("db", db.variableName());
        assertEquals(RequireStatement.Source.Kind.FRAMEWORK, db.source().kind());
        RequireStatement settings = assertInstanceOf(RequireStatement.class, statements.get(1));
        assertEquals(RequireStatement.Source.Kind.FEATURE_SET, settings.source().kind());
        assertEquals("Config Loader", settings.source().featureSetName());
        PublishStatement publish = assertInstanceOf(PublishStatement.class, statements.get(3));
        assertEquals("current-user", publish.externalName());
        assertEquals("user", publish.internalVariable());
        assertInstanceOf(PublishStatement.class, statements.get(4));
    }

    @Test
    void parse_ShouldReadMatchWithPatterns() {
        // Arrange
        String source = """
                (Route: Demo) {
                    Extract the <status> from the <request>.
                    match <status> {
                        case "active" { Log "on" to the <console>. }
                        case /^pend/i where <status> != "pending-review" { Log "wait" to the <console>. }
                        case <fallback> { Log "same" to the <console>. }
                        otherwise { Log "off" to the <console>. }
                    }
                    Return an <OK: status> for the <status>.
                }
                """;

        // Act
        Program program = parse(source);

        // Assert
        assertTrue(diagnostics.diagnostics().isEmpty(), diagnostics.diagnostics().toString());
        MatchStatement match = assertInstanceOf(MatchStatement.class,
                program.featureSets().get(0).statements().get(1));
        assertEquals("status", match.subject().base());
        assertEquals(3, match.cases().size());
        assertEquals(new Pattern.Literal(LiteralValue.string("active")), match.cases().get(0).pattern());
        assertEquals(new Pattern.Regex("^pend", "i"), match.cases().get(1).pattern());
        assertNotNull(match.cases().get(1).guard());
        assertInstanceOf(Pattern.Variable.class, match.cases().get(2).pattern());
        assertTrue(match.hasOtherwise());
        assertEquals(1, match.otherwise().size());
    }

    @Test
    void parse_ShouldReadForEachForms() {
        // Arrange
        String source = """
                (Batch: Demo) {
                    Retrieve the <items> from the <repository>.
                    for each <item> in <items> { Log <item> to the <console>. }
                    parallel for each <item> at <idx> in <items> where <item> > 0 { Log <idx> to the <console>. }
                    parallel for each <item> in <items> with <concurrency: 4> { Log <item> to the <console>. }
                    Return an <OK: status> for the <items>.
                }
                """;

        // Act
        Program program = parse(source);

        // Assert
        assertTrue(diagnostics.diagnostics().isEmpty(), diagnostics.diagnostics().toString());
        List<Statement> statements = program.featureSets().get(0).statements();
        ForEachLoop plain = assertInstanceOf(ForEachLoop.class, statements.get(1));
        assertFalse(plain.parallel());
        assertNull(plain.concurrency());
        ForEachLoop indexed = assertInstanceOf(ForEachLoop.class, statements.get(2));
        assertTrue(indexed.parallel());
        assertEquals("idx", indexed.indexVariable());
        assertNotNull(indexed.filter());
        assertNull(indexed.concurrency());
        ForEachLoop bounded = assertInstanceOf(ForEachLoop.class, statements.get(3));
        assertTrue(bounded.parallel());
        assertEquals(4, bounded.concurrency());
    }

    @Test
    void parse_ZeroConcurrencyShouldBeRejected() {
        // Act
        parse("""
                (Batch: Demo) {
                    parallel for each <item> in <items> with <concurrency: 0> { Log <item> to the <console>. }
                    Return an <OK: status> for the <items>.
                }
                """);

        // Assert
        assertTrue(diagnosticKinds().contains(DiagnosticKind.UNEXPECTED_TOKEN));
    }

    @Test
    void parse_ArrowShouldChainPipelineStages() {
        // Act
        Program program = parse(
                "(Flow: Demo) { Extract the <a> from the <request> -> Transform the <b> from the <a> -> Return an <OK: status> for the <b>. }");

        // Assert
        PipelineStatement pipeline = assertInstanceOf(PipelineStatement.class,
                program.featureSets().get(0).statements().get(0));
        assertEquals(3, pipeline.stages().size());
        assertEquals("Transform", pipeline.stages().get(1).action().verb());
    }

    @Test
    void parse_ShouldCollectImports() {
        // Act
        Program program = parse("""
                import ../shared
                import "lib/common"
                (Start: Demo) { Return an <OK: status> for the <request>. }
                """);

        // Assert
        assertEquals(List.of("../shared", "lib/common"),
                program.imports().stream().map(ImportDeclaration::path).toList());
        assertEquals(1, program.featureSets().size());
    }

    // --- Errors and recovery ---

    @Test
    void parse_EmptyFeatureSetShouldBeError() {
        // Act
        Program program = parse("(Nothing: Demo) { }");

        // Assert
        assertEquals(List.of(DiagnosticKind.EMPTY_FEATURE_SET), diagnosticKinds());
        assertTrue(program.featureSets().isEmpty());
        assertTrue(diagnostics.diagnostics().get(0).message().contains("at least one statement"));
    }

    @Test
    void parse_ShouldRecoverAfterBadStatements() {
        // Arrange
        String source = """
                (Broken: Demo) {
                    Extract the <a> from the <request>.
                    Compute the from <a>.
                    Extract <b> from the <request> the.
                    Return an <OK: status> for the <a>.
                }
                (Second: Demo) {
                    Return an <OK: status> for the <request>.
                }
                """;

        // Act
        Program program = parse(source);

        // Assert
        assertEquals(List.of(DiagnosticKind.UNEXPECTED_TOKEN, DiagnosticKind.UNEXPECTED_TOKEN), diagnosticKinds());
        assertEquals(3, diagnostics.diagnostics().get(0).location().line());
        assertEquals(4, diagnostics.diagnostics().get(1).location().line());
        assertEquals(2, program.featureSets().size());
        assertEquals(2, program.featureSets().get(0).statements().size());
    }

    @Test
    void parse_InvalidStatementShouldBeReportedWithHint() {
        // Act
        Program program = parse("""
                (Odd: Demo) {
                    42 is the answer.
                    Return an <OK: status> for the <request>.
                }
                """);

        // Assert
        assertEquals(List.of(DiagnosticKind.INVALID_STATEMENT), diagnosticKinds());
        Diagnostic diagnostic = diagnostics.diagnostics().get(0);
        assertTrue(diagnostic.message().startsWith("Invalid statement"));
        assertFalse(diagnostic.hints().isEmpty());
        assertEquals(1, program.featureSets().get(0).statements().size());
    }

    @Test
    void parse_MissingNameShouldSkipToNextFeatureSet() {
        // Act
        Program program = parse("""
                (: Demo) { Return an <OK: status> for the <request>. }
                (Good: Demo) { Return an <OK: status> for the <request>. }
                """);

        // Assert
        assertEquals(List.of(DiagnosticKind.MISSING_FEATURE_SET_NAME), diagnosticKinds());
        assertEquals(1, program.featureSets().size());
        assertEquals("Good", program.featureSets().get(0).name());
    }

    @Test
    void parse_TruncatedSourceShouldReportEndOfFile() {
        // Act
        Program program = parse("(Cut: Demo) { Extract the <x> from");

        // Assert
        assertTrue(diagnosticKinds().contains(DiagnosticKind.UNEXPECTED_END_OF_FILE));
        assertTrue(program.featureSets().isEmpty());
    }

    @Test
    void parse_EmptySourceShouldYieldEmptyProgram() {
        // Act
        Program program = parse("   (* nothing here *)  ");

        // Assert
        assertTrue(program.isEmpty());
        assertTrue(diagnostics.diagnostics().isEmpty());
    }
}
