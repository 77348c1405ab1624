package com.vidnyan.aro.application.service;

import com.vidnyan.aro.CompilerProperties;
import com.vidnyan.aro.domain.analysis.AnalyzedFeatureSet;
import com.vidnyan.aro.domain.analysis.AnalyzedProgram;
import com.vidnyan.aro.domain.analysis.DataFlowInfo;
import com.vidnyan.aro.domain.ast.*;
import com.vidnyan.aro.domain.check.CheckContext;
import com.vidnyan.aro.domain.check.ProgramCheck;
import com.vidnyan.aro.domain.diagnostic.Diagnostic;
import com.vidnyan.aro.domain.diagnostic.DiagnosticCollector;
import com.vidnyan.aro.domain.diagnostic.DiagnosticKind;
import com.vidnyan.aro.domain.graph.EventGraph;
import com.vidnyan.aro.domain.model.SourceSpan;
import com.vidnyan.aro.domain.symbol.*;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Semantic analysis over a parsed program.
 * <p>
 * Never aborts: every finding becomes a diagnostic and a best-effort {@link AnalyzedProgram} is
 * always returned. Per feature set it resolves names through persistent scopes, binds results,
 * enforces single assignment and records data flow. Afterwards it verifies cross-feature-set
 * dependencies and runs the program-wide checks in order.
 * <p>
 * The analyzer itself is stateless; all per-compile state lives in local objects.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SemanticAnalyzer {

    private final CompilerProperties properties;
    private final List<ProgramCheck> checks;

    @PostConstruct
    void logRegisteredChecks() {
        log.info("Registered {} program checks: {}", checks.size(),
                checks.stream().map(ProgramCheck::getName).toList());
    }

    public AnalyzedProgram analyze(Program program, DiagnosticCollector diagnostics) {
        GlobalSymbolRegistry registry = new GlobalSymbolRegistry();
        Set<String> programExports = collectExportNames(program);

        List<AnalyzedFeatureSet> analyzed = new ArrayList<>();
        for (FeatureSet featureSet : program.featureSets()) {
            FeatureSetAnalysis analysis = new FeatureSetAnalysis(featureSet, registry, programExports, diagnostics);
            analyzed.add(analysis.run());
        }
        verifyDependencies(analyzed, registry, diagnostics);

        EventGraph eventGraph = EventGraph.build(program,
                fs -> properties.isExternallyTriggered(fs.businessActivity()));
        log.debug("Event graph: {} events, {} edges", eventGraph.events().size(), eventGraph.edgeCount());

        runChecks(CheckContext.of(program, eventGraph), diagnostics);
        return new AnalyzedProgram(program, analyzed, registry, eventGraph);
    }

    private void runChecks(CheckContext context, DiagnosticCollector diagnostics) {
        for (ProgramCheck check : checks) {
            try {
                List<Diagnostic> findings = check.check(context);
                diagnostics.reportAll(findings);
                if (!findings.isEmpty()) {
                    log.debug("  {} found {} issues", check.getName(), findings.size());
                }
            } catch (RuntimeException e) {
                log.error("Error running check {}: {}", check.getName(), e.getMessage(), e);
                diagnostics.report(Diagnostic.builder(DiagnosticKind.CHECK_FAILURE)
                        .message("Internal error in %s: %s", check.getName(), e.getMessage())
                        .build());
            }
        }
    }

    /**
     * Names any feature set publishes, known before analysis so resolution does not depend on
     * feature set order.
     */
    private static Set<String> collectExportNames(Program program) {
        Set<String> names = new HashSet<>();
        for (FeatureSet featureSet : program.featureSets()) {
            AstWalker.walk(featureSet.statements(), statement -> {
                if (statement instanceof PublishStatement publish) {
                    names.add(publish.externalName());
                } else if (statement instanceof AroStatement aro
                        && aro.role() == ActionRole.EXPORT && aro.result() != null) {
                    names.add(aro.result().base());
                }
            });
        }
        return names;
    }

    /**
     * A request dependency nobody publishes and the runtime does not provide is suspicious.
     */
    private void verifyDependencies(
            List<AnalyzedFeatureSet> analyzed,
            GlobalSymbolRegistry registry,
            DiagnosticCollector diagnostics
    ) {
        for (AnalyzedFeatureSet featureSet : analyzed) {
            for (String dependency : new TreeSet<>(featureSet.dependencies())) {
                if (registry.isPublished(dependency) || properties.isBuiltinContext(dependency)) {
                    continue;
                }
                if (isRuntimeProvided(featureSet.symbolTable().lookupLocal(dependency))) {
                    continue;
                }
                diagnostics.warning(DiagnosticKind.UNPUBLISHED_DEPENDENCY,
                        "External dependency '" + dependency + "' is not published by any feature set",
                        featureSet.featureSet().span().start(),
                        "Publish it from the providing feature set with Publish as <" + dependency + "> <value>.");
            }
        }
    }

    /**
     * Required from the framework or the environment rather than from another feature set.
     */
    private static boolean isRuntimeProvided(Symbol symbol) {
        if (symbol == null || symbol.visibility() != Visibility.EXTERNAL) {
            return false;
        }
        String from = symbol.source().reference();
        return RequireStatement.Source.resolve(from).kind() != RequireStatement.Source.Kind.FEATURE_SET;
    }

    /**
     * Mutable analysis state for a single feature set.
     */
    private final class FeatureSetAnalysis {

        private final FeatureSet featureSet;
        private final GlobalSymbolRegistry registry;
        private final Set<String> programExports;
        private final DiagnosticCollector diagnostics;

        private final List<DataFlowInfo> dataFlows = new ArrayList<>();
        private final Set<String> dependencies = new LinkedHashSet<>();
        private final Set<String> exports = new LinkedHashSet<>();
        private final Set<Binding> used = new HashSet<>();
        private final Set<String> parameters = new HashSet<>();
        private final List<Symbol> defined = new ArrayList<>();
        private int childScopes;

        FeatureSetAnalysis(
                FeatureSet featureSet,
                GlobalSymbolRegistry registry,
                Set<String> programExports,
                DiagnosticCollector diagnostics
        ) {
            this.featureSet = featureSet;
            this.registry = registry;
            this.programExports = programExports;
            this.diagnostics = diagnostics;
        }

        AnalyzedFeatureSet run() {
            SymbolTable root = SymbolTable.root(featureSet.name(), featureSet.name());
            SymbolTable scope = analyzeBlock(featureSet.statements(), root);
            reportUnused();
            return new AnalyzedFeatureSet(featureSet, scope, dataFlows, dependencies, exports);
        }

        private SymbolTable analyzeBlock(List<Statement> statements, SymbolTable scope) {
            for (Statement statement : statements) {
                scope = analyzeStatement(statement, scope);
            }
            return scope;
        }

        private SymbolTable analyzeStatement(Statement statement, SymbolTable scope) {
            if (statement instanceof AroStatement aro) {
                return analyzeAro(aro, scope);
            } else if (statement instanceof PublishStatement publish) {
                return analyzePublish(publish, scope);
            } else if (statement instanceof RequireStatement require) {
                return analyzeRequire(require, scope);
            } else if (statement instanceof MatchStatement match) {
                return analyzeMatch(match, scope);
            } else if (statement instanceof ForEachLoop loop) {
                return analyzeForEach(loop, scope);
            } else if (statement instanceof PipelineStatement pipeline) {
                for (AroStatement stage : pipeline.stages()) {
                    scope = analyzeAro(stage, scope);
                }
                return scope;
            }
            throw new IllegalStateException("Unknown statement type: " + statement.getClass().getSimpleName());
        }

        // --- ARO statements ---

        private SymbolTable analyzeAro(AroStatement statement, SymbolTable scope) {
            FlowBuilder flow = new FlowBuilder(statement.action().verb(), statement.span());
            QualifiedNoun result = statement.result();
            QualifiedNoun object = statement.objectNoun();

            resolveStrict(statement.resultExpression(), scope, flow);
            if (statement.object() != null) {
                resolveStrict(statement.object().expression(), scope, flow);
            }
            resolveStrict(statement.withValue(), scope, flow);
            resolveStrict(statement.guard(), scope, flow);

            switch (statement.role()) {
                case REQUEST -> {
                    String from = "expression";
                    if (object != null) {
                        from = object.base();
                        flow.input(from);
                        if (scope.contains(from)) {
                            markUsed(from, scope);
                        } else if (!properties.isBuiltinContext(from)) {
                            dependencies.add(from);
                        }
                    }
                    if (result != null) {
                        scope = bind(scope, result.base(), statement.span(), Visibility.INTERNAL,
                                SymbolSource.extracted(from), DataType.infer(result.specifiers()));
                        flow.output(result.base());
                    }
                }
                case OWN -> {
                    if (object != null) {
                        flow.input(object.base());
                        resolveLenient(object, scope);
                    }
                    if (result != null) {
                        scope = bind(scope, result.base(), statement.span(), Visibility.INTERNAL,
                                SymbolSource.COMPUTED, DataType.infer(result.specifiers()));
                        flow.output(result.base());
                    }
                }
                case RESPONSE -> {
                    if (result != null && scope.contains(result.base())) {
                        markUsed(result.base(), scope);
                        flow.input(result.base());
                    }
                    if (object != null) {
                        if (scope.contains(object.base())) {
                            flow.input(object.base());
                        }
                        resolveLenient(object, scope);
                    }
                    flow.effect(responseEffect(statement));
                }
                case EXPORT -> {
                    if (result != null) {
                        scope = exportInPlace(result.base(), statement.span(), scope, flow);
                    }
                }
            }
            dataFlows.add(flow.build());
            return scope;
        }

        private String responseEffect(AroStatement statement) {
            String verb = statement.action().lowercase();
            String emitted = statement.emittedEventType();
            if (emitted != null) {
                return "emit:" + emitted;
            }
            if (statement.result() != null) {
                return verb + ":" + statement.result().base();
            }
            if (statement.objectNoun() != null) {
                return verb + ":" + statement.objectNoun().base();
            }
            return verb;
        }

        /**
         * Export verbs publish the result under its own name.
         */
        private SymbolTable exportInPlace(String name, SourceSpan span, SymbolTable scope, FlowBuilder flow) {
            Symbol symbol = scope.lookup(name);
            if (symbol == null) {
                reportUndefinedPublish(name, span);
                return scope;
            }
            markUsed(name, scope);
            flow.input(name);
            flow.output(name);
            scope = scope.updateVisibility(name, Visibility.PUBLISHED);
            registry.register(featureSet.name(), symbol.withVisibility(Visibility.PUBLISHED));
            exports.add(name);
            return scope;
        }

        // --- Publish / Require ---

        private SymbolTable analyzePublish(PublishStatement statement, SymbolTable scope) {
            FlowBuilder flow = new FlowBuilder("Publish", statement.span());
            String internal = statement.internalVariable();
            Symbol symbol = scope.lookup(internal);
            if (symbol == null) {
                reportUndefinedPublish(internal, statement.span());
                dataFlows.add(flow.build());
                return scope;
            }
            markUsed(internal, scope);
            flow.input(internal);
            scope = scope.updateVisibility(internal, Visibility.PUBLISHED);
            if (statement.externalName().equals(internal)) {
                registry.register(featureSet.name(), symbol.withVisibility(Visibility.PUBLISHED));
                exports.add(internal);
                flow.output(internal);
                dataFlows.add(flow.build());
                return scope;
            }

            Symbol alias = new Symbol(statement.externalName(), statement.span(), Visibility.PUBLISHED,
                    SymbolSource.alias(internal), symbol.dataType());
            scope = bindSymbol(scope, alias);
            registry.register(featureSet.name(), alias);
            exports.add(statement.externalName());
            flow.output(statement.externalName());
            dataFlows.add(flow.build());
            return scope;
        }

        private void reportUndefinedPublish(String name, SourceSpan span) {
            diagnostics.error(DiagnosticKind.UNDEFINED_VARIABLE,
                    "Cannot publish undefined variable '" + name + "'",
                    span.start(),
                    "Bind '" + name + "' before publishing it");
        }

        private SymbolTable analyzeRequire(RequireStatement statement, SymbolTable scope) {
            FlowBuilder flow = new FlowBuilder("Require", statement.span());
            String name = statement.variableName();
            scope = bind(scope, name, statement.span(), Visibility.EXTERNAL,
                    SymbolSource.extracted(statement.source().describe()), null);
            dependencies.add(name);
            flow.output(name);
            dataFlows.add(flow.build());
            return scope;
        }

        // --- Blocks ---

        private SymbolTable analyzeMatch(MatchStatement statement, SymbolTable scope) {
            FlowBuilder flow = new FlowBuilder("match", statement.span());
            flow.input(statement.subject().base());
            resolveLenient(statement.subject(), scope);

            List<SymbolTable> caseScopes = new ArrayList<>();
            for (CaseClause clause : statement.cases()) {
                SymbolTable caseScope = childScope(scope, "case");
                if (clause.pattern() instanceof Pattern.Variable variable) {
                    flow.input(variable.noun().base());
                    resolveLenient(variable.noun(), caseScope);
                }
                resolveStrict(clause.guard(), caseScope, flow);
                caseScopes.add(caseScope);
            }
            dataFlows.add(flow.build());

            for (int i = 0; i < statement.cases().size(); i++) {
                analyzeBlock(statement.cases().get(i).body(), caseScopes.get(i));
            }
            if (statement.hasOtherwise()) {
                analyzeBlock(statement.otherwise(), childScope(scope, "otherwise"));
            }
            // branch bindings stay in their child scopes
            return scope;
        }

        private SymbolTable analyzeForEach(ForEachLoop loop, SymbolTable scope) {
            FlowBuilder flow = new FlowBuilder(loop.parallel() ? "parallel for each" : "for each", loop.span());
            flow.input(loop.collection().base());
            resolveLenient(loop.collection(), scope);
            if (loop.parallel()) {
                flow.effect("parallel");
            }
            if (loop.concurrency() != null) {
                flow.effect("concurrency:" + loop.concurrency());
            }

            SymbolTable body = childScope(scope, "for-each");
            body = bindParameter(body, loop.itemVariable(), loop.span());
            flow.output(loop.itemVariable());
            if (loop.indexVariable() != null) {
                body = bindParameter(body, loop.indexVariable(), loop.span());
                flow.output(loop.indexVariable());
            }
            resolveStrict(loop.filter(), body, flow);
            dataFlows.add(flow.build());

            analyzeBlock(loop.body(), body);
            return scope;
        }

        private SymbolTable childScope(SymbolTable scope, String kind) {
            childScopes++;
            return scope.createChild(featureSet.name() + "#" + childScopes, kind);
        }

        private SymbolTable bindParameter(SymbolTable scope, String name, SourceSpan span) {
            parameters.add(name);
            return bind(scope, name, span, Visibility.INTERNAL, SymbolSource.PARAMETER, null);
        }

        // --- Binding and resolution ---

        private SymbolTable bind(
                SymbolTable scope,
                String name,
                SourceSpan span,
                Visibility visibility,
                SymbolSource source,
                DataType dataType
        ) {
            return bindSymbol(scope, new Symbol(name, span, visibility, source, dataType));
        }

        /**
         * Single assignment: a name bound anywhere in the enclosing scopes may not be bound again,
         * unless it carries the reserved prefix.
         */
        private SymbolTable bindSymbol(SymbolTable scope, Symbol symbol) {
            String name = symbol.name();
            if (!properties.isReserved(name) && scope.contains(name)) {
                diagnostics.report(Diagnostic.builder(DiagnosticKind.CANNOT_REBIND_VARIABLE)
                        .message("Cannot rebind variable '%s': variables are immutable", name)
                        .location(symbol.definedAt().start())
                        .hints("Create a new variable instead, e.g. '" + name + "-updated'",
                                "Names starting with '" + properties.getReservedPrefix() + "' may be rebound",
                                "Previous binding at " + scope.lookup(name).definedAt().start().format())
                        .build());
                return scope;
            }
            defined.add(symbol);
            return scope.define(symbol);
        }

        private boolean isKnown(String name, SymbolTable scope) {
            return scope.contains(name)
                    || properties.isBuiltinContext(name)
                    || programExports.contains(name)
                    || registry.isPublished(name);
        }

        /**
         * Object nouns, loop collections and match subjects: an unknown name is only a warning.
         */
        private void resolveLenient(QualifiedNoun noun, SymbolTable scope) {
            String name = noun.base();
            if (scope.contains(name)) {
                markUsed(name, scope);
            } else if (!isKnown(name, scope)) {
                diagnostics.warning(DiagnosticKind.USED_BEFORE_DEFINITION,
                        "Variable '" + name + "' used before definition",
                        noun.span().start(),
                        "Bind '" + name + "' earlier in the feature set");
            }
        }

        /**
         * Variable references inside expressions must resolve.
         */
        private void resolveStrict(Expression expression, SymbolTable scope, FlowBuilder flow) {
            for (Expression.VariableRef ref : AstWalker.variableRefs(expression)) {
                String name = ref.name();
                flow.input(name);
                if (scope.contains(name)) {
                    markUsed(name, scope);
                } else if (!isKnown(name, scope)) {
                    diagnostics.error(DiagnosticKind.UNDEFINED_VARIABLE,
                            "Undefined variable '" + name + "'",
                            ref.span().start(),
                            "Bind '" + name + "' with an action before using it, e.g. Extract the <"
                                    + name + "> from the <request>.");
                }
            }
        }

        /**
         * Marks the binding the name currently resolves to, not every binding of that name.
         */
        private void markUsed(String name, SymbolTable scope) {
            Symbol symbol = scope.lookup(name);
            if (symbol != null) {
                used.add(Binding.of(symbol));
            }
        }

        private void reportUnused() {
            for (Symbol symbol : defined) {
                if (symbol.visibility() != Visibility.INTERNAL
                        || parameters.contains(symbol.name())
                        || used.contains(Binding.of(symbol))
                        || exports.contains(symbol.name())) {
                    continue;
                }
                diagnostics.warning(DiagnosticKind.UNUSED_VARIABLE,
                        "Variable '" + symbol.name() + "' is defined but never used",
                        symbol.definedAt().start(),
                        "Remove the binding, or publish it with Publish as <name> <" + symbol.name() + ">.");
            }
        }
    }

    /**
     * Identity of one binding; visibility updates keep it.
     */
    private record Binding(String name, SourceSpan definedAt) {
        static Binding of(Symbol symbol) {
            return new Binding(symbol.name(), symbol.definedAt());
        }
    }

    /**
     * Accumulates one statement's data flow; duplicates are dropped, order is kept.
     */
    private static final class FlowBuilder {
        private final String label;
        private final SourceSpan span;
        private final Set<String> inputs = new LinkedHashSet<>();
        private final Set<String> outputs = new LinkedHashSet<>();
        private final Set<String> effects = new LinkedHashSet<>();

        FlowBuilder(String label, SourceSpan span) {
            this.label = label;
            this.span = span;
        }

        void input(String name) { inputs.add(name); }
        void output(String name) { outputs.add(name); }
        void effect(String tag) { effects.add(tag); }

        DataFlowInfo build() {
            return new DataFlowInfo(label, span, new ArrayList<>(inputs), new ArrayList<>(outputs),
                    new ArrayList<>(effects));
        }
    }
}
