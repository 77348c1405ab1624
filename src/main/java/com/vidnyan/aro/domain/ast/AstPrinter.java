package com.vidnyan.aro.domain.ast;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a syntax tree as indented text. Expressions render inline, fully parenthesized.
 */
public final class AstPrinter implements StatementVisitor<String>, ExpressionVisitor<String> {

    private final int indent;

    public AstPrinter() {
        this(0);
    }

    private AstPrinter(int indent) {
        this.indent = indent;
    }

    public String print(Program program) {
        StringBuilder sb = new StringBuilder("Program\n");
        for (ImportDeclaration declaration : program.imports()) {
            sb.append("  Import: ").append(declaration.path()).append('\n');
        }
        AstPrinter nested = new AstPrinter(indent + 1);
        for (FeatureSet featureSet : program.featureSets()) {
            sb.append(nested.print(featureSet));
        }
        return sb.toString();
    }

    public String print(FeatureSet featureSet) {
        StringBuilder sb = new StringBuilder();
        sb.append(pad()).append("FeatureSet: ").append(featureSet.name()).append('\n');
        sb.append(pad()).append("  BusinessActivity: ").append(featureSet.businessActivity()).append('\n');
        sb.append(new AstPrinter(indent + 1).block(featureSet.statements()));
        return sb.toString();
    }

    public String print(Expression expression) {
        return expression.accept(this);
    }

    private String block(List<Statement> statements) {
        StringBuilder sb = new StringBuilder();
        for (Statement statement : statements) {
            sb.append(statement.accept(this));
        }
        return sb.toString();
    }

    private String pad() {
        return "  ".repeat(indent);
    }

    @Override
    public String visitAro(AroStatement statement) {
        StringBuilder sb = new StringBuilder();
        sb.append(pad()).append("AroStatement\n");
        sb.append(pad()).append("  Action: ").append(statement.action().verb())
                .append(" [").append(statement.role().label()).append("]\n");
        if (statement.result() != null) {
            sb.append(pad()).append("  Result: ").append(statement.result().fullName()).append('\n');
        } else if (statement.resultExpression() != null) {
            sb.append(pad()).append("  Result: ").append(print(statement.resultExpression())).append('\n');
        }
        if (statement.object() != null) {
            ObjectClause object = statement.object();
            String target = object.hasNoun() ? object.noun().fullName() : print(object.expression());
            sb.append(pad()).append("  Object: ").append(object.preposition().word()).append(' ')
                    .append(target).append('\n');
        }
        if (statement.withValue() != null) {
            sb.append(pad()).append("  With: ").append(print(statement.withValue())).append('\n');
        }
        if (statement.guard() != null) {
            sb.append(pad()).append("  When: ").append(print(statement.guard())).append('\n');
        }
        return sb.toString();
    }

    @Override
    public String visitPublish(PublishStatement statement) {
        return pad() + "PublishStatement\n"
                + pad() + "  External: " + statement.externalName() + "\n"
                + pad() + "  Internal: " + statement.internalVariable() + "\n";
    }

    @Override
    public String visitRequire(RequireStatement statement) {
        return pad() + "RequireStatement\n"
                + pad() + "  Variable: " + statement.variableName() + "\n"
                + pad() + "  Source: " + statement.source().describe() + "\n";
    }

    @Override
    public String visitMatch(MatchStatement statement) {
        StringBuilder sb = new StringBuilder();
        sb.append(pad()).append("Match <").append(statement.subject().fullName()).append(">\n");
        AstPrinter nested = new AstPrinter(indent + 2);
        for (CaseClause clause : statement.cases()) {
            sb.append(pad()).append("  Case ").append(clause.pattern().describe());
            if (clause.guard() != null) {
                sb.append(" where ").append(print(clause.guard()));
            }
            sb.append('\n').append(nested.block(clause.body()));
        }
        if (statement.hasOtherwise()) {
            sb.append(pad()).append("  Otherwise\n").append(nested.block(statement.otherwise()));
        }
        return sb.toString();
    }

    @Override
    public String visitForEach(ForEachLoop loop) {
        StringBuilder sb = new StringBuilder(pad());
        if (loop.parallel()) {
            sb.append("Parallel ");
        }
        sb.append("ForEach <").append(loop.itemVariable()).append('>');
        if (loop.indexVariable() != null) {
            sb.append(" at <").append(loop.indexVariable()).append('>');
        }
        sb.append(" in <").append(loop.collection().fullName()).append('>');
        if (loop.filter() != null) {
            sb.append(" where ").append(print(loop.filter()));
        }
        if (loop.concurrency() != null) {
            sb.append(" concurrency ").append(loop.concurrency());
        }
        sb.append('\n').append(new AstPrinter(indent + 1).block(loop.body()));
        return sb.toString();
    }

    @Override
    public String visitPipeline(PipelineStatement pipeline) {
        StringBuilder sb = new StringBuilder(pad()).append("Pipeline\n");
        AstPrinter nested = new AstPrinter(indent + 1);
        for (AroStatement stage : pipeline.stages()) {
            sb.append(stage.accept(nested));
        }
        return sb.toString();
    }

    @Override
    public String visitLiteral(Expression.Literal literal) {
        return literal.value().render();
    }

    @Override
    public String visitArray(Expression.ArrayLiteral array) {
        return array.elements().stream().map(this::print).collect(Collectors.joining(", ", "[", "]"));
    }

    @Override
    public String visitMap(Expression.MapLiteral map) {
        return map.entries().stream()
                .map(e -> e.key() + ": " + print(e.value()))
                .collect(Collectors.joining(", ", "{", "}"));
    }

    @Override
    public String visitVariable(Expression.VariableRef variable) {
        return "<" + variable.noun().fullName() + ">";
    }

    @Override
    public String visitBinary(Expression.Binary binary) {
        return "(" + print(binary.left()) + " " + binary.operator().symbol() + " " + print(binary.right()) + ")";
    }

    @Override
    public String visitUnary(Expression.Unary unary) {
        String separator = unary.operator() == UnaryOperator.NOT ? " " : "";
        return "(" + unary.operator().symbol() + separator + print(unary.operand()) + ")";
    }

    @Override
    public String visitMemberAccess(Expression.MemberAccess access) {
        return print(access.base()) + "." + access.member();
    }

    @Override
    public String visitSubscript(Expression.Subscript subscript) {
        return print(subscript.base()) + "[" + print(subscript.index()) + "]";
    }

    @Override
    public String visitGrouped(Expression.Grouped grouped) {
        return "(" + print(grouped.inner()) + ")";
    }

    @Override
    public String visitExistence(Expression.Existence existence) {
        return "(" + print(existence.operand()) + " exists)";
    }

    @Override
    public String visitTypeCheck(Expression.TypeCheck check) {
        return "(" + print(check.operand()) + " is " + check.typeName() + ")";
    }

    @Override
    public String visitInterpolated(Expression.InterpolatedString string) {
        StringBuilder sb = new StringBuilder("\"");
        for (Expression part : string.parts()) {
            if (part instanceof Expression.Literal literal && literal.value().kind() == LiteralValue.Kind.STRING) {
                sb.append(literal.value().value());
            } else {
                sb.append("${").append(print(part)).append('}');
            }
        }
        return sb.append('"').toString();
    }
}
