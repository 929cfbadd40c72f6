package com.vidnyan.causeway.simulation;

import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.*;
import com.github.javaparser.ast.stmt.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Tree-walking evaluator for a method body accepted by {@link SourceFunctionCompiler}.
 */
final class InterpretedFunction implements NodeFunction {

    static final Set<String> MATH_FUNCTIONS = Set.of(
            "abs", "pow", "sqrt", "cbrt", "exp", "expm1", "log", "log10", "log1p",
            "sin", "cos", "tan", "asin", "acos", "atan", "atan2", "sinh", "cosh", "tanh",
            "floor", "ceil", "rint", "round", "signum", "hypot", "min", "max",
            "toRadians", "toDegrees");

    private static final int MAX_STEPS = 100_000;

    private final String name;
    private final List<String> parameters;
    private final BlockStmt body;

    InterpretedFunction(String name, List<String> parameters, BlockStmt body) {
        this.name = name;
        this.parameters = List.copyOf(parameters);
        this.body = body;
    }

    @Override
    public List<String> parameters() {
        return parameters;
    }

    @Override
    public double invoke(double[] arguments) {
        if (arguments.length != parameters.size()) {
            throw new IllegalArgumentException(name + " expects " + parameters.size()
                    + " arguments, got " + arguments.length);
        }
        Frame frame = new Frame();
        for (int i = 0; i < arguments.length; i++) {
            frame.locals.put(parameters.get(i), arguments[i]);
        }
        if (execute(body, frame) == Flow.RETURN) {
            return frame.returned;
        }
        throw new IllegalStateException(name + " completed without returning a value");
    }

    @Override
    public String toString() {
        return name + parameters;
    }

    static boolean isMathScope(Optional<Expression> scope) {
        return scope.map(s -> s.toString().equals("Math") || s.toString().equals("StrictMath"))
                .orElse(false);
    }

    private enum Flow { NORMAL, BREAK, CONTINUE, RETURN }

    private static final class Frame {
        private final Map<String, Double> locals = new HashMap<>();
        private double returned;
        private int steps;

        void step() {
            if (++steps > MAX_STEPS) {
                throw new IllegalStateException("Iteration limit exceeded");
            }
        }
    }

    private Flow execute(Statement statement, Frame frame) {
        frame.step();
        if (statement instanceof BlockStmt block) {
            return executeAll(block.getStatements(), frame);
        }
        if (statement instanceof ExpressionStmt expression) {
            evaluate(expression.getExpression(), frame);
            return Flow.NORMAL;
        }
        if (statement instanceof ReturnStmt returnStmt) {
            frame.returned = returnStmt.getExpression().map(e -> evaluate(e, frame)).orElse(Double.NaN);
            return Flow.RETURN;
        }
        if (statement instanceof IfStmt ifStmt) {
            if (truth(evaluate(ifStmt.getCondition(), frame))) {
                return execute(ifStmt.getThenStmt(), frame);
            }
            return ifStmt.getElseStmt().map(s -> execute(s, frame)).orElse(Flow.NORMAL);
        }
        if (statement instanceof WhileStmt whileStmt) {
            while (truth(evaluate(whileStmt.getCondition(), frame))) {
                Flow flow = execute(whileStmt.getBody(), frame);
                if (flow == Flow.RETURN) {
                    return flow;
                }
                if (flow == Flow.BREAK) {
                    break;
                }
            }
            return Flow.NORMAL;
        }
        if (statement instanceof DoStmt doStmt) {
            do {
                Flow flow = execute(doStmt.getBody(), frame);
                if (flow == Flow.RETURN) {
                    return flow;
                }
                if (flow == Flow.BREAK) {
                    break;
                }
            } while (truth(evaluate(doStmt.getCondition(), frame)));
            return Flow.NORMAL;
        }
        if (statement instanceof ForStmt forStmt) {
            forStmt.getInitialization().forEach(e -> evaluate(e, frame));
            while (forStmt.getCompare().map(c -> truth(evaluate(c, frame))).orElse(true)) {
                Flow flow = execute(forStmt.getBody(), frame);
                if (flow == Flow.RETURN) {
                    return flow;
                }
                if (flow == Flow.BREAK) {
                    break;
                }
                forStmt.getUpdate().forEach(e -> evaluate(e, frame));
            }
            return Flow.NORMAL;
        }
        if (statement instanceof BreakStmt) {
            return Flow.BREAK;
        }
        if (statement instanceof ContinueStmt) {
            return Flow.CONTINUE;
        }
        if (statement instanceof ThrowStmt throwStmt) {
            throw new IllegalStateException("Function raised: " + throwStmt.getExpression());
        }
        return Flow.NORMAL;
    }

    private Flow executeAll(NodeList<Statement> statements, Frame frame) {
        for (Statement statement : statements) {
            Flow flow = execute(statement, frame);
            if (flow != Flow.NORMAL) {
                return flow;
            }
        }
        return Flow.NORMAL;
    }

    private double evaluate(Expression expr, Frame frame) {
        if (expr instanceof EnclosedExpr enclosed) {
            return evaluate(enclosed.getInner(), frame);
        }
        if (expr instanceof IntegerLiteralExpr i) {
            return i.asNumber().doubleValue();
        }
        if (expr instanceof LongLiteralExpr l) {
            return l.asNumber().doubleValue();
        }
        if (expr instanceof DoubleLiteralExpr d) {
            return d.asDouble();
        }
        if (expr instanceof BooleanLiteralExpr b) {
            return b.getValue() ? 1.0 : 0.0;
        }
        if (expr instanceof NameExpr nameExpr) {
            Double value = frame.locals.get(nameExpr.getNameAsString());
            if (value == null) {
                throw new IllegalStateException("Undefined variable: " + nameExpr.getNameAsString());
            }
            return value;
        }
        if (expr instanceof FieldAccessExpr field) {
            return field.getNameAsString().equals("PI") ? Math.PI : Math.E;
        }
        if (expr instanceof VariableDeclarationExpr declaration) {
            for (VariableDeclarator variable : declaration.getVariables()) {
                double value = variable.getInitializer().map(e -> evaluate(e, frame)).orElse(0.0);
                frame.locals.put(variable.getNameAsString(), value);
            }
            return Double.NaN;
        }
        if (expr instanceof AssignExpr assign) {
            return assign(assign, frame);
        }
        if (expr instanceof UnaryExpr unary) {
            return unary(unary, frame);
        }
        if (expr instanceof BinaryExpr binary) {
            return binary(binary, frame);
        }
        if (expr instanceof ConditionalExpr conditional) {
            return truth(evaluate(conditional.getCondition(), frame))
                    ? evaluate(conditional.getThenExpr(), frame)
                    : evaluate(conditional.getElseExpr(), frame);
        }
        if (expr instanceof CastExpr cast) {
            double value = evaluate(cast.getExpression(), frame);
            return switch (cast.getType().asString()) {
                case "int", "long", "short", "byte", "Integer", "Long" -> (double) (long) value;
                case "float", "Float" -> (double) (float) value;
                default -> value;
            };
        }
        if (expr instanceof MethodCallExpr call) {
            double[] args = call.getArguments().stream().mapToDouble(a -> evaluate(a, frame)).toArray();
            return math(call.getNameAsString(), args);
        }
        throw new IllegalStateException("Cannot evaluate " + expr.getClass().getSimpleName() + ": " + expr);
    }

    private double assign(AssignExpr assign, Frame frame) {
        String target = ((NameExpr) assign.getTarget()).getNameAsString();
        double value = evaluate(assign.getValue(), frame);
        if (assign.getOperator() != AssignExpr.Operator.ASSIGN) {
            double current = evaluate(assign.getTarget(), frame);
            value = switch (assign.getOperator()) {
                case PLUS -> current + value;
                case MINUS -> current - value;
                case MULTIPLY -> current * value;
                case DIVIDE -> divide(current, value);
                case REMAINDER -> remainder(current, value);
                default -> throw new IllegalStateException("Unsupported operator " + assign.getOperator());
            };
        }
        frame.locals.put(target, value);
        return value;
    }

    private double unary(UnaryExpr unary, Frame frame) {
        UnaryExpr.Operator operator = unary.getOperator();
        switch (operator) {
            case PLUS:
                return evaluate(unary.getExpression(), frame);
            case MINUS:
                return -evaluate(unary.getExpression(), frame);
            case LOGICAL_COMPLEMENT:
                return truth(evaluate(unary.getExpression(), frame)) ? 0.0 : 1.0;
            case PREFIX_INCREMENT:
            case PREFIX_DECREMENT:
            case POSTFIX_INCREMENT:
            case POSTFIX_DECREMENT: {
                if (!(unary.getExpression() instanceof NameExpr nameExpr)) {
                    throw new IllegalStateException("Cannot increment " + unary.getExpression());
                }
                double before = evaluate(nameExpr, frame);
                boolean increment = operator == UnaryExpr.Operator.PREFIX_INCREMENT
                        || operator == UnaryExpr.Operator.POSTFIX_INCREMENT;
                double after = increment ? before + 1 : before - 1;
                frame.locals.put(nameExpr.getNameAsString(), after);
                return operator.isPostfix() ? before : after;
            }
            default:
                throw new IllegalStateException("Unsupported operator " + operator);
        }
    }

    private double binary(BinaryExpr binary, Frame frame) {
        BinaryExpr.Operator operator = binary.getOperator();
        if (operator == BinaryExpr.Operator.AND) {
            return truth(evaluate(binary.getLeft(), frame)) && truth(evaluate(binary.getRight(), frame)) ? 1.0 : 0.0;
        }
        if (operator == BinaryExpr.Operator.OR) {
            return truth(evaluate(binary.getLeft(), frame)) || truth(evaluate(binary.getRight(), frame)) ? 1.0 : 0.0;
        }
        double left = evaluate(binary.getLeft(), frame);
        double right = evaluate(binary.getRight(), frame);
        return switch (operator) {
            case PLUS -> left + right;
            case MINUS -> left - right;
            case MULTIPLY -> left * right;
            case DIVIDE -> divide(left, right);
            case REMAINDER -> remainder(left, right);
            case LESS -> left < right ? 1.0 : 0.0;
            case LESS_EQUALS -> left <= right ? 1.0 : 0.0;
            case GREATER -> left > right ? 1.0 : 0.0;
            case GREATER_EQUALS -> left >= right ? 1.0 : 0.0;
            case EQUALS -> left == right ? 1.0 : 0.0;
            case NOT_EQUALS -> left != right ? 1.0 : 0.0;
            default -> throw new IllegalStateException("Unsupported operator " + operator);
        };
    }

    private static double math(String function, double[] args) {
        return switch (function) {
            case "abs" -> Math.abs(args[0]);
            case "pow" -> Math.pow(args[0], args[1]);
            case "sqrt" -> Math.sqrt(args[0]);
            case "cbrt" -> Math.cbrt(args[0]);
            case "exp" -> Math.exp(args[0]);
            case "expm1" -> Math.expm1(args[0]);
            case "log" -> Math.log(args[0]);
            case "log10" -> Math.log10(args[0]);
            case "log1p" -> Math.log1p(args[0]);
            case "sin" -> Math.sin(args[0]);
            case "cos" -> Math.cos(args[0]);
            case "tan" -> Math.tan(args[0]);
            case "asin" -> Math.asin(args[0]);
            case "acos" -> Math.acos(args[0]);
            case "atan" -> Math.atan(args[0]);
            case "atan2" -> Math.atan2(args[0], args[1]);
            case "sinh" -> Math.sinh(args[0]);
            case "cosh" -> Math.cosh(args[0]);
            case "tanh" -> Math.tanh(args[0]);
            case "floor" -> Math.floor(args[0]);
            case "ceil" -> Math.ceil(args[0]);
            case "rint" -> Math.rint(args[0]);
            case "round" -> (double) Math.round(args[0]);
            case "signum" -> Math.signum(args[0]);
            case "hypot" -> Math.hypot(args[0], args[1]);
            case "min" -> Math.min(args[0], args[1]);
            case "max" -> Math.max(args[0], args[1]);
            case "toRadians" -> Math.toRadians(args[0]);
            case "toDegrees" -> Math.toDegrees(args[0]);
            default -> throw new IllegalStateException("Unsupported function Math." + function);
        };
    }

    private static double divide(double left, double right) {
        if (right == 0.0) {
            throw new ArithmeticException("division by zero");
        }
        return left / right;
    }

    private static double remainder(double left, double right) {
        if (right == 0.0) {
            throw new ArithmeticException("division by zero");
        }
        return left % right;
    }

    private static boolean truth(double value) {
        return value != 0.0 && !Double.isNaN(value);
    }
}
