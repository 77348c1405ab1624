package com.vidnyan.aro.application.service;

import com.vidnyan.aro.AroCompiler;
import com.vidnyan.aro.CompilerProperties;
import com.vidnyan.aro.adapter.out.check.MissingTerminalReturnCheck;
import com.vidnyan.aro.adapter.out.parser.Lexer;
import com.vidnyan.aro.adapter.out.parser.Parser;
import com.vidnyan.aro.domain.analysis.AnalyzedFeatureSet;
import com.vidnyan.aro.domain.analysis.AnalyzedProgram;
import com.vidnyan.aro.domain.analysis.DataFlowInfo;
import com.vidnyan.aro.domain.ast.Program;
import com.vidnyan.aro.domain.check.CheckContext;
import com.vidnyan.aro.domain.check.ProgramCheck;
import com.vidnyan.aro.domain.diagnostic.Diagnostic;
import com.vidnyan.aro.domain.diagnostic.DiagnosticCollector;
import com.vidnyan.aro.domain.diagnostic.DiagnosticKind;
import com.vidnyan.aro.domain.symbol.DataType;
import com.vidnyan.aro.domain.symbol.Symbol;
import com.vidnyan.aro.domain.symbol.SymbolSource;
import com.vidnyan.aro.domain.symbol.Visibility;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SemanticAnalyzerTest {

    private final DiagnosticCollector diagnostics = new DiagnosticCollector();
    private SemanticAnalyzer analyzer = new SemanticAnalyzer(CompilerProperties.defaults(), AroCompiler.defaultChecks());

    private AnalyzedProgram analyze(String source) {
        Program program = new Parser(Lexer.tokenize(source), diagnostics).parse();
        assertFalse(diagnostics.hasErrors(), "syntax errors: " + diagnostics.diagnostics());
        return analyzer.analyze(program, diagnostics);
    }

    private List<Diagnostic> ofKind(DiagnosticKind kind) {
        return diagnostics.diagnostics().stream().filter(d -> d.kind() == kind).toList();
    }

    // --- Immutability ---

    @Test
    void analyze_SecondBindingShouldBeRebindError() {
        // Act
        analyze("""
                (Values: Demo) {
                    Make the <value> with "first".
                    Make the <value> with "second".
                    Return an <OK: status> for the <value>.
                }
                """);

        // Assert
        List<Diagnostic> errors = ofKind(DiagnosticKind.CANNOT_REBIND_VARIABLE);
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).message().startsWith("Cannot rebind variable 'value'"));
        assertTrue(errors.get(0).hints().stream().anyMatch(h -> h.contains("value-updated")));
        assertEquals(3, errors.get(0).location().line());
    }

    @Test
    void analyze_ReservedPrefixShouldAllowRebinding() {
        // Act
        analyze("""
                (Scratch: Demo) {
                    Compute the <_tmp> from 1.
                    Compute the <_tmp> from <_tmp> + 1.
                    Return an <OK: status> for the <_tmp>.
                }
                """);

        // Assert
        assertTrue(ofKind(DiagnosticKind.CANNOT_REBIND_VARIABLE).isEmpty());
        assertFalse(diagnostics.hasErrors());
    }

    @Test
    void analyze_RebindingLoopItemShouldBeError() {
        // Act
        analyze("""
                (Loop: Demo) {
                    Extract the <items> from the <request: body>.
                    for each <item> in <items> {
                        Compute the <item> from <item> + 1.
                    }
                    Return an <OK: status> for the <items>.
                }
                """);

        // Assert
        assertEquals(1, ofKind(DiagnosticKind.CANNOT_REBIND_VARIABLE).size());
    }

    // --- Scoping ---

    @Test
    void analyze_LoopBindingsShouldNotLeakOutOfBody() {
        // Act
        AnalyzedProgram analyzed = analyze("""
                (Loop: Demo) {
                    Extract the <items> from the <request: body>.
                    for each <item> at <i> in <items> {
                        Compute the <doubled> from <item> * 2.
                        Log <doubled> to the <console>.
                    }
                    Compute the <last> from <doubled> + <i>.
                    Return an <OK: status> for the <last>.
                }
                """);

        // Assert
        List<Diagnostic> undefined = ofKind(DiagnosticKind.UNDEFINED_VARIABLE);
        assertEquals(List.of("Undefined variable 'doubled'", "Undefined variable 'i'"),
                undefined.stream().map(Diagnostic::message).toList());
        AnalyzedFeatureSet loop = analyzed.featureSet("Loop");
        assertNull(loop.symbol("item"));
        assertNotNull(loop.symbol("last"));
    }

    @Test
    void analyze_MatchBranchBindingsShouldStayInBranch() {
        // Act
        analyze("""
                (Branch: Demo) {
                    Extract the <mode> from the <request>.
                    match <mode> {
                        case "a" { Compute the <x> from 1. Log <x> to the <console>. }
                        otherwise { Compute the <x> from 2. Log <x> to the <console>. }
                    }
                    Compute the <y> from <x> + 1.
                    Return an <OK: status> for the <y>.
                }
                """);

        // Assert
        assertTrue(ofKind(DiagnosticKind.CANNOT_REBIND_VARIABLE).isEmpty(), "sibling branches are separate scopes");
        assertEquals(1, ofKind(DiagnosticKind.UNDEFINED_VARIABLE).size());
    }

    @Test
    void analyze_UndefinedNameInGuardShouldBeError() {
        // Act
        analyze("""
                (Guarded: Demo) {
                    Return an <OK: status> for the <request> when <missing> exists.
                }
                """);

        // Assert
        List<Diagnostic> errors = ofKind(DiagnosticKind.UNDEFINED_VARIABLE);
        assertEquals(1, errors.size());
        assertEquals("Undefined variable 'missing'", errors.get(0).message());
        assertFalse(errors.get(0).hints().isEmpty());
    }

    @Test
    void analyze_UnknownLoopCollectionShouldWarn() {
        // Act
        analyze("""
                (Loop: Demo) {
                    for each <item> in <nothing> { Log <item> to the <console>. }
                    Return an <OK: status> for the <request>.
                }
                """);

        // Assert
        List<Diagnostic> warnings = ofKind(DiagnosticKind.USED_BEFORE_DEFINITION);
        assertEquals(1, warnings.size());
        assertEquals("Variable 'nothing' used before definition", warnings.get(0).message());
        assertFalse(diagnostics.hasErrors());
    }

    @Test
    void analyze_UnknownResponseObjectShouldWarn() {
        // Act
        analyze("""
                (Reply: Demo) {
                    Return an <OK: status> with <nowhere>.
                }
                """);

        // Assert
        List<Diagnostic> warnings = ofKind(DiagnosticKind.USED_BEFORE_DEFINITION);
        assertEquals(1, warnings.size());
        assertEquals("Variable 'nowhere' used before definition", warnings.get(0).message());
        assertEquals(2, warnings.get(0).location().line());
        assertFalse(diagnostics.hasErrors());
    }

    @Test
    void analyze_SiblingBindingsShouldBeTrackedSeparately() {
        // Act
        analyze("""
                (Branch: Demo) {
                    Extract the <mode> from the <request>.
                    match <mode> {
                        case "a" { Compute the <x> from 1. Log <x> to the <console>. }
                        otherwise { Compute the <x> from 2. }
                    }
                    Return an <OK: status> for the <mode>.
                }
                """);

        // Assert
        List<Diagnostic> warnings = ofKind(DiagnosticKind.UNUSED_VARIABLE);
        assertEquals(1, warnings.size());
        assertEquals("Variable 'x' is defined but never used", warnings.get(0).message());
        assertEquals(5, warnings.get(0).location().line());
    }

    // --- Publish / Require ---

    @Test
    void analyze_PublishShouldCreateAliasAndUpgradeInternal() {
        // Act
        AnalyzedProgram analyzed = analyze("""
                (Auth: Security) {
                    Extract the <user> from the <request>.
                    Publish as <current-user> <user>.
                    Return an <OK: status> for the <user>.
                }
                """);

        // Assert
        AnalyzedFeatureSet auth = analyzed.featureSet("Auth");
        assertEquals(Visibility.PUBLISHED, auth.symbol("user").visibility());
        Symbol alias = auth.symbol("current-user");
        assertEquals(SymbolSource.alias("user"), alias.source());
        assertEquals(Visibility.PUBLISHED, alias.visibility());
        assertTrue(analyzed.registry().isPublished("current-user"));
        assertEquals("Auth", analyzed.registry().lookup("current-user").featureSet());
        assertTrue(auth.exports().contains("current-user"));
        assertTrue(ofKind(DiagnosticKind.UNUSED_VARIABLE).isEmpty());
    }

    @Test
    void analyze_PublishingUnboundNameShouldBeError() {
        // Act
        analyze("""
                (Leak: Demo) {
                    Publish as <secret> <ghost>.
                    Return an <OK: status> for the <request>.
                }
                """);

        // Assert
        List<Diagnostic> errors = ofKind(DiagnosticKind.UNDEFINED_VARIABLE);
        assertEquals(1, errors.size());
        assertEquals("Cannot publish undefined variable 'ghost'", errors.get(0).message());
    }

    @Test
    void analyze_PublishedNameShouldResolveInOtherFeatureSetsRegardlessOfOrder() {
        // Act
        AnalyzedProgram analyzed = analyze("""
                (Audit: Auth) {
                    Compute the <entry> from <session-token> ++ "-audit".
                    Log <entry> to the <console>.
                    Return an <OK: status> for the <entry>.
                }
                (Login: Auth) {
                    Extract the <credentials> from the <request>.
                    Create the <token> from <credentials>.
                    Publish as <session-token> <token>.
                    Return an <OK: status> for the <token>.
                }
                """);

        // Assert
        assertFalse(diagnostics.hasErrors(), diagnostics.diagnostics().toString());
        assertEquals(1, analyzed.registry().size());
    }

    @Test
    void analyze_ExportVerbShouldPublishResult() {
        // Act
        AnalyzedProgram analyzed = analyze("""
                (Report: Demo) {
                    Compute the <summary> from 42.
                    Export the <summary>.
                    Return an <OK: status> for the <summary>.
                }
                """);

        // Assert
        AnalyzedFeatureSet report = analyzed.featureSet("Report");
        assertEquals(Visibility.PUBLISHED, report.symbol("summary").visibility());
        assertTrue(analyzed.registry().isPublished("summary"));
    }

    @Test
    void analyze_RequestDependenciesShouldBeVerified() {
        // Act
        AnalyzedProgram analyzed = analyze("""
                (Orders: API) {
                    Extract the <order> from the <order-service>.
                    Retrieve the <price> from the <pricing>.
                    Return an <OK: status> for the <order> when <price> exists.
                }
                (Pricing: API) {
                    Compute the <table> from 1.
                    Publish as <pricing> <table>.
                    Return an <OK: status> for the <table>.
                }
                """);

        // Assert
        AnalyzedFeatureSet orders = analyzed.featureSet("Orders");
        assertEquals(java.util.Set.of("order-service", "pricing"), orders.dependencies());
        List<Diagnostic> warnings = ofKind(DiagnosticKind.UNPUBLISHED_DEPENDENCY);
        assertEquals(1, warnings.size());
        assertEquals("External dependency 'order-service' is not published by any feature set",
                warnings.get(0).message());
    }

    @Test
    void analyze_RequireShouldBindExternalSymbols() {
        // Act
        AnalyzedProgram analyzed = analyze("""
                (Service: Demo) {
                    Require the <db> from the framework.
                    Require <settings> from <Config Loader>.
                    Return an <OK: status> for the <db>.
                }
                """);

        // Assert
        AnalyzedFeatureSet service = analyzed.featureSet("Service");
        assertEquals(Visibility.EXTERNAL, service.symbol("db").visibility());
        assertEquals(SymbolSource.extracted("framework"), service.symbol("db").source());
        List<Diagnostic> warnings = ofKind(DiagnosticKind.UNPUBLISHED_DEPENDENCY);
        assertEquals(1, warnings.size(), "framework requirements are provided by the runtime");
        assertTrue(warnings.get(0).message().contains("'settings'"));
        assertTrue(ofKind(DiagnosticKind.UNUSED_VARIABLE).isEmpty());
    }

    // --- Symbols and data flow ---

    @Test
    void analyze_ShouldRecordSourcesTypesAndDataFlow() {
        // Act
        AnalyzedProgram analyzed = analyze("""
                (Create User: API) {
                    Extract the <user-id: id> from the <request: params>.
                    Create the <user: record> with <user-id>.
                    Emit a <UserCreated: event> with <user>.
                    Return a <Created: status> for the <user>.
                }
                (Welcome: UserCreated Handler) {
                    Return an <OK: status> for the <event>.
                }
                """);

        // Assert
        AnalyzedFeatureSet create = analyzed.featureSet("Create User");
        Symbol userId = create.symbol("user-id");
        assertEquals(DataType.IDENTIFIER, userId.dataType());
        assertEquals(SymbolSource.extracted("request"), userId.source());
        assertEquals(SymbolSource.COMPUTED, create.symbol("user").source());
        assertEquals(DataType.RECORD, create.symbol("user").dataType());

        List<DataFlowInfo> flows = create.dataFlows();
        assertEquals(4, flows.size());
        assertEquals(List.of("request"), flows.get(0).inputs());
        assertEquals(List.of("user-id"), flows.get(0).outputs());
        assertEquals(List.of("user-id"), flows.get(1).inputs());
        assertEquals(List.of("emit:UserCreated"), flows.get(2).sideEffects());
        assertEquals(List.of("user"), flows.get(2).inputs());
        assertEquals(List.of("return:Created"), flows.get(3).sideEffects());
        assertTrue(create.dependencies().isEmpty(), "request is a builtin context");
        assertTrue(ofKind(DiagnosticKind.UNUSED_VARIABLE).isEmpty());
    }

    @Test
    void analyze_ParallelLoopShouldBeTaggedNotExecuted() {
        // Act
        AnalyzedProgram analyzed = analyze("""
                (Batch: Demo) {
                    Extract the <items> from the <request: body>.
                    parallel for each <item> in <items> with <concurrency: 4> {
                        Log <item> to the <console>.
                    }
                    Return an <OK: status> for the <items>.
                }
                """);

        // Assert
        List<DataFlowInfo> flows = analyzed.featureSet("Batch").dataFlows();
        assertEquals(4, flows.size());
        DataFlowInfo loop = flows.get(1);
        assertEquals(List.of("items"), loop.inputs());
        assertEquals(List.of("item"), loop.outputs());
        assertEquals(List.of("parallel", "concurrency:4"), loop.sideEffects());
        assertEquals("Log", flows.get(2).label(), "body flows follow their loop");
    }

    @Test
    void analyze_MatchFlowShouldIncludeCaseGuardInputs() {
        // Act
        AnalyzedProgram analyzed = analyze("""
                (Route: Demo) {
                    Extract the <kind> from the <request>.
                    Extract the <limit> from the <request: query>.
                    match <kind> {
                        case "x" where <limit> > 3 { Log <kind> to the <console>. }
                    }
                    Return an <OK: status> for the <kind>.
                }
                """);

        // Assert
        List<DataFlowInfo> flows = analyzed.featureSet("Route").dataFlows();
        DataFlowInfo match = flows.get(2);
        assertEquals("match", match.label());
        assertEquals(List.of("kind", "limit"), match.inputs());
        assertEquals("Log", flows.get(3).label(), "case bodies follow their match");
        assertTrue(ofKind(DiagnosticKind.UNUSED_VARIABLE).isEmpty());
    }

    @Test
    void analyze_UnconsumedBindingShouldWarn() {
        // Act
        analyze("""
                (Waste: Demo) {
                    Compute the <unused> from 1.
                    Return an <OK: status> for the <request>.
                }
                """);

        // Assert
        List<Diagnostic> warnings = ofKind(DiagnosticKind.UNUSED_VARIABLE);
        assertEquals(1, warnings.size());
        assertEquals("Variable 'unused' is defined but never used", warnings.get(0).message());
        assertEquals(2, warnings.get(0).location().line());
    }

    // --- Program checks ---

    @Test
    void analyze_SelfEmittingHandlerShouldBeCircular() {
        // Act
        analyze("""
                (A: EventAlpha Handler) {
                    Emit <EventAlpha: event>.
                    Return an <OK: status> for the <event>.
                }
                """);

        // Assert
        List<Diagnostic> errors = ofKind(DiagnosticKind.CIRCULAR_EVENT_CHAIN);
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).message().contains("EventAlpha → EventAlpha"));
        assertFalse(errors.get(0).hints().isEmpty());
    }

    @Test
    void analyze_DuplicateNamesShouldBeReportedOnce() {
        // Act
        analyze("""
                (Same Name: Demo) { Return an <OK: status> for the <request>. }
                (Same Name: Demo) { Return an <OK: status> for the <request>. }
                """);

        // Assert
        List<Diagnostic> errors = ofKind(DiagnosticKind.DUPLICATE_FEATURE_SET);
        assertEquals(1, errors.size());
        assertEquals(2, errors.get(0).location().line());
    }

    @Test
    void analyze_FailingCheckShouldNotStopOtherChecks() {
        // Arrange
        ProgramCheck broken = new ProgramCheck() {
            @Override
            public List<Diagnostic> check(CheckContext context) {
                throw new IllegalStateException("boom");
            }

            @Override
            public String getName() {
                return "BrokenCheck";
            }
        };
        analyzer = new SemanticAnalyzer(CompilerProperties.defaults(),
                List.of(broken, new MissingTerminalReturnCheck()));

        // Act
        analyze("(Quiet: Demo) { Log \"x\" to the <console>. }");

        // Assert
        List<Diagnostic> failures = ofKind(DiagnosticKind.CHECK_FAILURE);
        assertEquals(1, failures.size());
        assertEquals("Internal error in BrokenCheck: boom", failures.get(0).message());
        assertEquals(1, ofKind(DiagnosticKind.MISSING_TERMINAL_RETURN).size());
    }

    @Test
    void analyze_EmptyProgramShouldYieldEmptyAnalysis() {
        // Act
        AnalyzedProgram analyzed = analyze("");

        // Assert
        assertTrue(analyzed.featureSets().isEmpty());
        assertTrue(analyzed.eventGraph().events().isEmpty());
        assertTrue(diagnostics.diagnostics().isEmpty());
    }
}
