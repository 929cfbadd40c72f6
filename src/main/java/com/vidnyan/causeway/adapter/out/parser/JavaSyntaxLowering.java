package com.vidnyan.causeway.adapter.out.parser;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.*;
import com.github.javaparser.ast.expr.*;
import com.github.javaparser.ast.stmt.*;
import com.vidnyan.causeway.domain.syntax.*;

import java.util.*;

/**
 * Lowers a JavaParser compilation unit into the closed set of syntax kinds.
 * Statements the analysis does not care about contribute only the calls and
 * assignments nested in their expressions.
 */
final class JavaSyntaxLowering {

    private static final Set<String> ASYNC_RETURN_TYPES = Set.of(
            "CompletableFuture", "CompletionStage", "Future", "Mono", "Flux");

    private JavaSyntaxLowering() {
    }

    static List<SyntaxNode> lower(CompilationUnit unit) {
        List<SyntaxNode> roots = new ArrayList<>();
        for (TypeDeclaration<?> type : unit.getTypes()) {
            roots.add(lowerType(type));
        }
        return roots;
    }

    private static TypeDef lowerType(TypeDeclaration<?> type) {
        List<SyntaxNode> body = new ArrayList<>();
        for (BodyDeclaration<?> member : type.getMembers()) {
            if (member instanceof MethodDeclaration method) {
                body.add(lowerMethod(method));
            } else if (member instanceof ConstructorDeclaration constructor) {
                body.add(lowerConstructor(constructor));
            } else if (member instanceof FieldDeclaration field) {
                for (VariableDeclarator variable : field.getVariables()) {
                    variable.getInitializer().ifPresent(init -> {
                        collect(init, body);
                        body.add(declaration(variable, init));
                    });
                }
            } else if (member instanceof InitializerDeclaration initializer) {
                body.addAll(lowerBlock(initializer.getBody()));
            } else if (member instanceof TypeDeclaration<?> nested) {
                body.add(lowerType(nested));
            }
        }
        return new TypeDef(type.getNameAsString(), begin(type), end(type), body);
    }

    private static FunctionDef lowerMethod(MethodDeclaration method) {
        List<SyntaxNode> body = method.getBody().map(JavaSyntaxLowering::lowerBlock).orElse(List.of());
        String returnType = method.getType().asString();
        int generic = returnType.indexOf('<');
        String rawReturnType = generic > 0 ? returnType.substring(0, generic) : returnType;
        boolean async = ASYNC_RETURN_TYPES.contains(rawReturnType)
                || method.getAnnotations().stream().anyMatch(a -> a.getNameAsString().equals("Async"));
        return new FunctionDef(
                method.getNameAsString(),
                begin(method),
                end(method),
                parameterNames(method),
                decorators(method),
                async,
                method.toString(),
                body);
    }

    private static FunctionDef lowerConstructor(ConstructorDeclaration constructor) {
        return new FunctionDef(
                "<init>",
                begin(constructor),
                end(constructor),
                parameterNames(constructor),
                decorators(constructor),
                false,
                constructor.toString(),
                lowerBlock(constructor.getBody()));
    }

    private static List<String> parameterNames(CallableDeclaration<?> callable) {
        return callable.getParameters().stream().map(Parameter::getNameAsString).toList();
    }

    private static List<String> decorators(CallableDeclaration<?> callable) {
        return callable.getAnnotations().stream().map(AnnotationExpr::toString).toList();
    }

    private static List<SyntaxNode> lowerBlock(BlockStmt block) {
        return lowerStatements(block.getStatements());
    }

    private static List<SyntaxNode> lowerStatements(NodeList<Statement> statements) {
        List<SyntaxNode> out = new ArrayList<>();
        for (Statement statement : statements) {
            lowerStatement(statement, out);
        }
        return out;
    }

    /**
     * Body of a branch or loop: a block's statements, or the single statement.
     */
    private static List<SyntaxNode> lowerBody(Statement statement) {
        List<SyntaxNode> out = new ArrayList<>();
        lowerStatement(statement, out);
        return out;
    }

    private static void lowerStatement(Statement statement, List<SyntaxNode> out) {
        if (statement instanceof BlockStmt block) {
            out.addAll(lowerBlock(block));
        } else if (statement instanceof ExpressionStmt expression) {
            collect(expression.getExpression(), out);
        } else if (statement instanceof IfStmt ifStmt) {
            lowerIf(ifStmt, out);
        } else if (statement instanceof WhileStmt whileStmt) {
            collect(whileStmt.getCondition(), out);
            out.add(loop(Loop.LoopKind.WHILE, whileStmt, reads(whileStmt.getCondition()), whileStmt.getBody()));
        } else if (statement instanceof DoStmt doStmt) {
            collect(doStmt.getCondition(), out);
            out.add(loop(Loop.LoopKind.DO_WHILE, doStmt, reads(doStmt.getCondition()), doStmt.getBody()));
        } else if (statement instanceof ForStmt forStmt) {
            forStmt.getInitialization().forEach(e -> collect(e, out));
            forStmt.getCompare().ifPresent(e -> collect(e, out));
            forStmt.getUpdate().forEach(e -> collect(e, out));
            List<String> control = forStmt.getCompare().map(JavaSyntaxLowering::reads).orElse(List.of());
            out.add(loop(Loop.LoopKind.FOR, forStmt, control, forStmt.getBody()));
        } else if (statement instanceof ForEachStmt forEach) {
            collect(forEach.getIterable(), out);
            VariableDeclarator variable = forEach.getVariable().getVariables().get(0);
            out.add(new Assignment(variable.getNameAsString(), begin(forEach), reads(forEach.getIterable()),
                    false, "=", "ForEach"));
            out.add(loop(Loop.LoopKind.FOR_EACH, forEach, reads(forEach.getIterable()), forEach.getBody()));
        } else if (statement instanceof TryStmt tryStmt) {
            tryStmt.getResources().forEach(e -> collect(e, out));
            out.add(lowerTry(tryStmt));
        } else if (statement instanceof SwitchStmt switchStmt) {
            collect(switchStmt.getSelector(), out);
            lowerSwitch(switchStmt, out);
        } else if (statement instanceof ReturnStmt returnStmt) {
            returnStmt.getExpression().ifPresent(e -> collect(e, out));
            out.add(new Return(
                    begin(returnStmt),
                    returnStmt.getExpression().map(JavaSyntaxLowering::reads).orElse(List.of()),
                    returnStmt.getExpression().isPresent()));
        } else if (statement instanceof ThrowStmt throwStmt) {
            collect(throwStmt.getExpression(), out);
        } else if (statement instanceof LabeledStmt labeled) {
            lowerStatement(labeled.getStatement(), out);
        } else if (statement instanceof SynchronizedStmt sync) {
            collect(sync.getExpression(), out);
            out.addAll(lowerBlock(sync.getBody()));
        } else if (statement instanceof LocalClassDeclarationStmt local) {
            out.add(lowerType(local.getClassDeclaration()));
        } else if (statement instanceof LocalRecordDeclarationStmt local) {
            out.add(lowerType(local.getRecordDeclaration()));
        } else if (statement instanceof ExplicitConstructorInvocationStmt invocation) {
            invocation.getArguments().forEach(e -> collect(e, out));
        } else if (statement instanceof AssertStmt assertStmt) {
            collect(assertStmt.getCheck(), out);
        }
    }

    private static void lowerIf(IfStmt ifStmt, List<SyntaxNode> out) {
        collect(ifStmt.getCondition(), out);
        out.add(conditional(ifStmt));
    }

    private static Conditional conditional(IfStmt ifStmt) {
        int line = begin(ifStmt);
        LineRange bodyRange = range(ifStmt.getThenStmt(), line);
        List<SyntaxNode> body = lowerBody(ifStmt.getThenStmt());

        LineRange elseRange = null;
        List<SyntaxNode> orElse = List.of();
        boolean elseIf = false;
        if (ifStmt.getElseStmt().isPresent()) {
            Statement elseStmt = ifStmt.getElseStmt().get();
            elseRange = range(elseStmt, end(ifStmt.getThenStmt()));
            elseIf = elseStmt instanceof IfStmt;
            orElse = lowerBody(elseStmt);
        }
        return new Conditional(line, reads(ifStmt.getCondition()), bodyRange, body, elseRange, orElse, elseIf);
    }

    private static Loop loop(Loop.LoopKind kind, Statement loop, List<String> control, Statement body) {
        int line = begin(loop);
        return new Loop(kind, line, control, range(body, line), lowerBody(body), null, List.of());
    }

    private static ExceptionBlock lowerTry(TryStmt tryStmt) {
        int line = begin(tryStmt);
        List<ExceptionBlock.Handler> handlers = new ArrayList<>();
        for (CatchClause clause : tryStmt.getCatchClauses()) {
            handlers.add(new ExceptionBlock.Handler(
                    clause.getParameter().getType().asString(),
                    begin(clause),
                    range(clause.getBody(), begin(clause)),
                    lowerBlock(clause.getBody())));
        }
        LineRange finallyRange = tryStmt.getFinallyBlock()
                .map(b -> range(b, begin(b)))
                .orElse(null);
        List<SyntaxNode> finallyBody = tryStmt.getFinallyBlock()
                .map(JavaSyntaxLowering::lowerBlock)
                .orElse(List.of());
        return new ExceptionBlock(
                line,
                range(tryStmt.getTryBlock(), line),
                lowerBlock(tryStmt.getTryBlock()),
                handlers,
                null,
                List.of(),
                finallyRange,
                finallyBody);
    }

    /**
     * A switch becomes a chain of conditionals on the selector, one per entry.
     */
    private static void lowerSwitch(SwitchStmt switchStmt, List<SyntaxNode> out) {
        List<String> selector = reads(switchStmt.getSelector());
        NodeList<SwitchEntry> entries = switchStmt.getEntries();
        Conditional next = null;
        for (int i = entries.size() - 1; i >= 0; i--) {
            SwitchEntry entry = entries.get(i);
            int line = begin(entry);
            LineRange bodyRange = statementsRange(entry.getStatements(), line);
            LineRange elseRange = next == null
                    ? null
                    : new LineRange(next.line(), end(switchStmt));
            next = new Conditional(
                    line,
                    selector,
                    bodyRange,
                    lowerStatements(entry.getStatements()),
                    elseRange,
                    next == null ? List.of() : List.of(next),
                    next != null);
        }
        if (next != null) {
            out.add(next);
        }
    }

    /**
     * Assignments, declarations, increments and calls nested in an expression.
     * Lambda bodies contribute calls only.
     */
    private static void collect(Expression expression, List<SyntaxNode> out) {
        collect(expression, out, false);
    }

    private static void collect(Node node, List<SyntaxNode> out, boolean inLambda) {
        if (node instanceof MethodCallExpr call) {
            out.add(new Call(
                    call.getNameAsString(),
                    call.getScope().map(Expression::toString).orElse(null),
                    begin(call)));
        } else if (!inLambda && node instanceof AssignExpr assign && targetName(assign.getTarget()).isPresent()) {
            collect(assign.getValue(), out, false);
            boolean augmented = assign.getOperator() != AssignExpr.Operator.ASSIGN;
            out.add(new Assignment(targetName(assign.getTarget()).get(), begin(assign), reads(assign.getValue()),
                    augmented, assign.getOperator().asString(), valueType(assign.getValue())));
            return;
        } else if (!inLambda && node instanceof UnaryExpr unary && isIncrement(unary)) {
            targetName(unary.getExpression()).ifPresent(target ->
                    out.add(new Assignment(target, begin(unary), List.of(), true,
                            unary.getOperator().asString(), "UnaryExpr")));
        } else if (!inLambda && node instanceof VariableDeclarator variable) {
            variable.getInitializer().ifPresent(init -> {
                collect(init, out, false);
                out.add(declaration(variable, init));
            });
            return;
        }

        boolean lambda = inLambda || node instanceof LambdaExpr;
        for (Node child : node.getChildNodes()) {
            collect(child, out, lambda);
        }
    }

    private static Assignment declaration(VariableDeclarator variable, Expression init) {
        return new Assignment(variable.getNameAsString(), begin(variable), reads(init), false, "=", valueType(init));
    }

    private static boolean isIncrement(UnaryExpr unary) {
        return switch (unary.getOperator()) {
            case PREFIX_INCREMENT, PREFIX_DECREMENT, POSTFIX_INCREMENT, POSTFIX_DECREMENT -> true;
            default -> false;
        };
    }

    private static Optional<String> targetName(Expression target) {
        if (target instanceof NameExpr name) {
            return Optional.of(name.getNameAsString());
        }
        if (target instanceof FieldAccessExpr field && field.getScope() instanceof ThisExpr) {
            return Optional.of(field.getNameAsString());
        }
        return Optional.empty();
    }

    /**
     * Simple names read by an expression, in order of appearance. {@code this.x} reads {@code x}.
     */
    static List<String> reads(Expression expression) {
        Set<String> names = new LinkedHashSet<>();
        expression.walk(node -> {
            if (node instanceof NameExpr name) {
                names.add(name.getNameAsString());
            } else if (node instanceof FieldAccessExpr field && field.getScope() instanceof ThisExpr) {
                names.add(field.getNameAsString());
            }
        });
        return List.copyOf(names);
    }

    private static String valueType(Expression value) {
        return value.getClass().getSimpleName();
    }

    private static LineRange range(Statement statement, int headerLine) {
        if (statement instanceof BlockStmt block) {
            return statementsRange(block.getStatements(), headerLine);
        }
        return new LineRange(begin(statement), end(statement));
    }

    private static LineRange statementsRange(NodeList<Statement> statements, int headerLine) {
        if (statements.isEmpty()) {
            return LineRange.emptyAfter(headerLine);
        }
        return new LineRange(begin(statements.get(0)), end(statements.get(statements.size() - 1)));
    }

    private static int begin(Node node) {
        return node.getBegin().map(p -> p.line).orElse(0);
    }

    private static int end(Node node) {
        return node.getEnd().map(p -> p.line).orElse(begin(node));
    }
}
