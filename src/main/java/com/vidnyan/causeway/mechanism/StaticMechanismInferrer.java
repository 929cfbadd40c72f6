package com.vidnyan.causeway.mechanism;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.expr.*;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.vidnyan.causeway.domain.error.FittingException;
import com.vidnyan.causeway.domain.mechanism.Mechanism;
import com.vidnyan.causeway.domain.mechanism.MechanismKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Classifies the return expression of a method into a mechanism shape without running it.
 * <p>
 * Checks run in a fixed order: literal, {@code var*c}, {@code var+c} or {@code (var*c)+b},
 * bare parameter, sum of linear terms, nonlinear call, ternary; anything else is unknown.
 */
@Slf4j
@Component
public class StaticMechanismInferrer {

    private static final Map<String, String> NONLINEAR_FUNCTIONS = Map.of(
            "pow", "power",
            "exp", "exp",
            "log", "log",
            "sqrt", "sqrt");

    private final JavaParser parser = new JavaParser(new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));

    /**
     * Infer from method source, either a bare method declaration or a whole compilation unit.
     *
     * @throws FittingException if the source does not parse
     */
    public Mechanism infer(String functionSource) {
        Node tree;
        synchronized (parser) {
            ParseResult<MethodDeclaration> method = parser.parseMethodDeclaration(functionSource);
            if (method.isSuccessful() && method.getResult().isPresent()) {
                tree = method.getResult().get();
            } else {
                ParseResult<CompilationUnit> unit = parser.parse(functionSource);
                if (!unit.isSuccessful() || unit.getResult().isEmpty()) {
                    throw new FittingException("Cannot parse function source: " + method.getProblems());
                }
                tree = unit.getResult().get();
            }
        }
        return infer(tree);
    }

    public Mechanism infer(Node tree) {
        Optional<MethodDeclaration> function = tree instanceof MethodDeclaration m
                ? Optional.of(m)
                : tree.findFirst(MethodDeclaration.class);
        if (function.isEmpty()) {
            return Mechanism.unknown(0.0, List.of(), "No function found");
        }

        MethodDeclaration method = function.get();
        Optional<Expression> returned = method.findAll(ReturnStmt.class).stream()
                .map(ReturnStmt::getExpression)
                .flatMap(Optional::stream)
                .findFirst();
        if (returned.isEmpty()) {
            return Mechanism.constant(null, "null");
        }

        List<String> parameters = method.getParameters().stream()
                .map(Parameter::getNameAsString)
                .sorted()
                .toList();
        Mechanism mechanism = classify(unwrap(returned.get()), new HashSet<>(parameters), parameters);
        log.debug("Inferred {} mechanism for {}: {}", mechanism.kind(), method.getNameAsString(),
                mechanism.expression());
        return mechanism;
    }

    private Mechanism classify(Expression expr, Set<String> params, List<String> variables) {
        Optional<Object> literal = literalValue(expr);
        if (literal.isPresent() || expr instanceof NullLiteralExpr) {
            return new Mechanism(MechanismKind.CONSTANT, valueParameter(literal.orElse(null)), 1.0,
                    variables, expr.toString());
        }

        Optional<Term> product = linearProduct(expr);
        if (product.isPresent()) {
            Term term = product.get();
            return linear(term.coefficient(), 0.0, term.variable(), 0.9, variables,
                    format(term.coefficient()) + "*" + term.variable());
        }

        if (expr instanceof BinaryExpr binary && binary.getOperator() == BinaryExpr.Operator.PLUS) {
            Expression left = unwrap(binary.getLeft());
            Optional<Double> offset = numeric(unwrap(binary.getRight()));
            if (offset.isPresent()) {
                if (left instanceof NameExpr name && params.contains(name.getNameAsString())) {
                    return linear(1.0, offset.get(), name.getNameAsString(), 0.9, variables,
                            name.getNameAsString() + " + " + format(offset.get()));
                }
                Optional<Term> scaled = linearProduct(left);
                if (scaled.isPresent()) {
                    Term term = scaled.get();
                    return linear(term.coefficient(), offset.get(), term.variable(), 0.9, variables,
                            format(term.coefficient()) + "*" + term.variable() + " + " + format(offset.get()));
                }
            }
        }

        if (expr instanceof NameExpr name && params.contains(name.getNameAsString())) {
            return linear(1.0, 0.0, name.getNameAsString(), 1.0, variables, name.getNameAsString());
        }

        Optional<Mechanism> multi = multiLinear(expr, params, variables);
        if (multi.isPresent()) {
            return multi.get();
        }

        if (expr instanceof MethodCallExpr call && isMathCall(call)
                && NONLINEAR_FUNCTIONS.containsKey(call.getNameAsString())) {
            return new Mechanism(MechanismKind.NONLINEAR,
                    Map.of("function", NONLINEAR_FUNCTIONS.get(call.getNameAsString())),
                    0.7, variables, expr.toString());
        }

        if (expr instanceof ConditionalExpr conditional) {
            return new Mechanism(MechanismKind.CONDITIONAL,
                    Map.of("condition", conditional.getCondition().toString()),
                    0.6, variables, expr.toString());
        }

        return Mechanism.unknown(0.3, variables, expr.toString());
    }

    /**
     * Sum or difference whose leaves are parameters, {@code c*parameter} or constants.
     */
    private Optional<Mechanism> multiLinear(Expression expr, Set<String> params, List<String> variables) {
        if (!(expr instanceof BinaryExpr binary)
                || (binary.getOperator() != BinaryExpr.Operator.PLUS
                && binary.getOperator() != BinaryExpr.Operator.MINUS)) {
            return Optional.empty();
        }

        Map<String, Double> coefficients = new TreeMap<>();
        double[] offset = {0.0};
        if (!collectTerms(expr, 1.0, params, coefficients, offset)) {
            return Optional.empty();
        }

        List<String> terms = new ArrayList<>();
        coefficients.forEach((variable, coefficient) ->
                terms.add(coefficient == 1.0 ? variable : format(coefficient) + "*" + variable));
        String expression = String.join(" + ", terms);
        if (offset[0] != 0.0) {
            expression = expression.isEmpty() ? format(offset[0]) : expression + " + " + format(offset[0]);
        }

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("coefficients", Collections.unmodifiableMap(coefficients));
        parameters.put("offset", offset[0]);
        return Optional.of(new Mechanism(MechanismKind.LINEAR, parameters, 0.8, variables, expression));
    }

    private boolean collectTerms(Expression expr, double sign, Set<String> params,
                                 Map<String, Double> coefficients, double[] offset) {
        expr = unwrap(expr);
        if (expr instanceof BinaryExpr binary) {
            if (binary.getOperator() == BinaryExpr.Operator.PLUS) {
                return collectTerms(binary.getLeft(), sign, params, coefficients, offset)
                        && collectTerms(binary.getRight(), sign, params, coefficients, offset);
            }
            if (binary.getOperator() == BinaryExpr.Operator.MINUS) {
                return collectTerms(binary.getLeft(), sign, params, coefficients, offset)
                        && collectTerms(binary.getRight(), -sign, params, coefficients, offset);
            }
        }
        if (expr instanceof NameExpr name && params.contains(name.getNameAsString())) {
            coefficients.merge(name.getNameAsString(), sign, Double::sum);
            return true;
        }
        Optional<Double> constant = numeric(expr);
        if (constant.isPresent()) {
            offset[0] += sign * constant.get();
            return true;
        }
        Optional<Term> product = linearProduct(expr);
        if (product.isPresent() && params.contains(product.get().variable())) {
            coefficients.merge(product.get().variable(), sign * product.get().coefficient(), Double::sum);
            return true;
        }
        return false;
    }

    /**
     * {@code var * c} or {@code c * var}.
     */
    private Optional<Term> linearProduct(Expression expr) {
        if (!(expr instanceof BinaryExpr binary) || binary.getOperator() != BinaryExpr.Operator.MULTIPLY) {
            return Optional.empty();
        }
        Expression left = unwrap(binary.getLeft());
        Expression right = unwrap(binary.getRight());
        if (left instanceof NameExpr name && numeric(right).isPresent()) {
            return Optional.of(new Term(name.getNameAsString(), numeric(right).get()));
        }
        if (right instanceof NameExpr name && numeric(left).isPresent()) {
            return Optional.of(new Term(name.getNameAsString(), numeric(left).get()));
        }
        return Optional.empty();
    }

    private record Term(String variable, double coefficient) {}

    private static Mechanism linear(double coefficient, double offset, String variable, double confidence,
                                    List<String> variables, String expression) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("coefficient", coefficient);
        parameters.put("offset", offset);
        parameters.put("variable", variable);
        return new Mechanism(MechanismKind.LINEAR, parameters, confidence, variables, expression);
    }

    private static Map<String, Object> valueParameter(Object value) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("value", value);
        return parameters;
    }

    private static boolean isMathCall(MethodCallExpr call) {
        return call.getScope().map(s -> s.toString().equals("Math") || s.toString().equals("StrictMath"))
                .orElse(false);
    }

    private static Expression unwrap(Expression expr) {
        while (expr instanceof EnclosedExpr enclosed) {
            expr = enclosed.getInner();
        }
        return expr;
    }

    private static Optional<Object> literalValue(Expression expr) {
        if (expr instanceof BooleanLiteralExpr b) {
            return Optional.of(b.getValue());
        }
        if (expr instanceof StringLiteralExpr s) {
            return Optional.of(s.asString());
        }
        if (expr instanceof CharLiteralExpr c) {
            return Optional.of(c.asChar());
        }
        return numeric(expr).map(n -> (Object) n);
    }

    /**
     * Numeric literal, optionally signed.
     */
    private static Optional<Double> numeric(Expression expr) {
        expr = unwrap(expr);
        if (expr instanceof UnaryExpr unary) {
            if (unary.getOperator() == UnaryExpr.Operator.MINUS) {
                return numeric(unary.getExpression()).map(v -> -v);
            }
            if (unary.getOperator() == UnaryExpr.Operator.PLUS) {
                return numeric(unary.getExpression());
            }
            return Optional.empty();
        }
        if (expr instanceof IntegerLiteralExpr i) {
            return Optional.of(i.asNumber().doubleValue());
        }
        if (expr instanceof LongLiteralExpr l) {
            return Optional.of(l.asNumber().doubleValue());
        }
        if (expr instanceof DoubleLiteralExpr d) {
            return Optional.of(d.asDouble());
        }
        return Optional.empty();
    }

    static String format(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
