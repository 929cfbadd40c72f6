package com.vidnyan.causeway.simulation;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.*;
import com.github.javaparser.ast.stmt.*;
import com.github.javaparser.ast.type.Type;
import com.vidnyan.causeway.domain.error.TraceCollectionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Compiles the source of a single Java method into a {@link NodeFunction}.
 * <p>
 * Supported: numeric locals and parameters, arithmetic, comparison and logical
 * operators, ternaries, casts, if/while/do/for, return, throw, and {@code Math} calls.
 * Every value is held as a double; booleans are 1 and 0.
 */
@Slf4j
@Component
public class SourceFunctionCompiler {

    private static final Set<BinaryExpr.Operator> BINARY_OPERATORS = EnumSet.of(
            BinaryExpr.Operator.AND, BinaryExpr.Operator.OR,
            BinaryExpr.Operator.PLUS, BinaryExpr.Operator.MINUS, BinaryExpr.Operator.MULTIPLY,
            BinaryExpr.Operator.DIVIDE, BinaryExpr.Operator.REMAINDER,
            BinaryExpr.Operator.LESS, BinaryExpr.Operator.LESS_EQUALS,
            BinaryExpr.Operator.GREATER, BinaryExpr.Operator.GREATER_EQUALS,
            BinaryExpr.Operator.EQUALS, BinaryExpr.Operator.NOT_EQUALS);

    private static final Set<AssignExpr.Operator> ASSIGN_OPERATORS = EnumSet.of(
            AssignExpr.Operator.ASSIGN, AssignExpr.Operator.PLUS, AssignExpr.Operator.MINUS,
            AssignExpr.Operator.MULTIPLY, AssignExpr.Operator.DIVIDE, AssignExpr.Operator.REMAINDER);

    private static final Set<String> ASYNC_RETURN_TYPES = Set.of(
            "CompletableFuture", "CompletionStage", "Future", "Mono", "Flux");

    private final JavaParser parser = new JavaParser(new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));

    /**
     * @throws TraceCollectionException if the source does not parse, is async,
     *                                  or uses unsupported constructs
     */
    public NodeFunction compile(String nodeId, String source) {
        MethodDeclaration method = parseMethod(nodeId, source);

        if (isAsync(method)) {
            throw new TraceCollectionException("Async functions are not supported for trace collection: "
                    + nodeId + " (" + method.getNameAsString() + ")");
        }
        BlockStmt body = method.getBody().orElseThrow(() ->
                new TraceCollectionException("Function for node " + nodeId + " has no body"));

        Optional<Node> unsupported = firstUnsupported(body);
        if (unsupported.isPresent()) {
            Node node = unsupported.get();
            throw new TraceCollectionException(String.format(
                    "Unsupported construct in code for node %s at line %d: %s",
                    nodeId, node.getBegin().map(p -> p.line).orElse(0), node.getClass().getSimpleName()));
        }

        return new InterpretedFunction(
                method.getNameAsString(),
                method.getParameters().stream().map(Parameter::getNameAsString).toList(),
                body);
    }

    private MethodDeclaration parseMethod(String nodeId, String source) {
        synchronized (parser) {
            ParseResult<MethodDeclaration> method = parser.parseMethodDeclaration(source);
            if (method.isSuccessful() && method.getResult().isPresent()) {
                return method.getResult().get();
            }
            ParseResult<CompilationUnit> unit = parser.parse(source);
            if (unit.isSuccessful() && unit.getResult().isPresent()) {
                Optional<MethodDeclaration> first = unit.getResult().get().findFirst(MethodDeclaration.class);
                if (first.isPresent()) {
                    return first.get();
                }
                throw new TraceCollectionException("No function found in code for node " + nodeId);
            }
            throw new TraceCollectionException("Failed to compile code for node " + nodeId + ": "
                    + method.getProblems());
        }
    }

    private boolean isAsync(MethodDeclaration method) {
        String returnType = method.getType().asString();
        int generic = returnType.indexOf('<');
        String raw = generic > 0 ? returnType.substring(0, generic) : returnType;
        return ASYNC_RETURN_TYPES.contains(raw)
                || method.getAnnotations().stream().anyMatch(a -> a.getNameAsString().equals("Async"));
    }

    private Optional<Node> firstUnsupported(Node node) {
        if (node instanceof ThrowStmt) {
            return Optional.empty();
        }
        if (!isSupported(node)) {
            return Optional.of(node);
        }
        for (Node child : node.getChildNodes()) {
            Optional<Node> found = firstUnsupported(child);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    private boolean isSupported(Node node) {
        if (node instanceof MethodCallExpr call) {
            return InterpretedFunction.isMathScope(call.getScope())
                    && InterpretedFunction.MATH_FUNCTIONS.contains(call.getNameAsString());
        }
        if (node instanceof FieldAccessExpr field) {
            return InterpretedFunction.isMathScope(Optional.of(field.getScope()))
                    && (field.getNameAsString().equals("PI") || field.getNameAsString().equals("E"));
        }
        if (node instanceof AssignExpr assign) {
            return assign.getTarget() instanceof NameExpr && ASSIGN_OPERATORS.contains(assign.getOperator());
        }
        if (node instanceof BinaryExpr binary) {
            return BINARY_OPERATORS.contains(binary.getOperator());
        }
        if (node instanceof UnaryExpr unary) {
            return unary.getOperator() != UnaryExpr.Operator.BITWISE_COMPLEMENT;
        }
        if (node instanceof LiteralExpr) {
            // numbers and booleans only
            return node instanceof IntegerLiteralExpr
                    || node instanceof LongLiteralExpr
                    || node instanceof DoubleLiteralExpr
                    || node instanceof BooleanLiteralExpr;
        }
        return node instanceof BlockStmt
                || node instanceof ExpressionStmt
                || node instanceof ReturnStmt
                || node instanceof IfStmt
                || node instanceof WhileStmt
                || node instanceof DoStmt
                || node instanceof ForStmt
                || node instanceof BreakStmt
                || node instanceof ContinueStmt
                || node instanceof EmptyStmt
                || node instanceof VariableDeclarationExpr
                || node instanceof VariableDeclarator
                || node instanceof NameExpr
                || node instanceof SimpleName
                || node instanceof Name
                || node instanceof EnclosedExpr
                || node instanceof ConditionalExpr
                || node instanceof CastExpr
                || node instanceof Type
                || node instanceof com.github.javaparser.ast.Modifier
                || node instanceof com.github.javaparser.ast.comments.Comment;
    }
}
