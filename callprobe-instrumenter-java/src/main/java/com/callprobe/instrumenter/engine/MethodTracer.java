package com.callprobe.instrumenter.engine;

import org.eclipse.jdt.core.dom.AST;
import org.eclipse.jdt.core.dom.ASTNode;
import org.eclipse.jdt.core.dom.ASTVisitor;
import org.eclipse.jdt.core.dom.AbstractTypeDeclaration;
import org.eclipse.jdt.core.dom.AnonymousClassDeclaration;
import org.eclipse.jdt.core.dom.Block;
import org.eclipse.jdt.core.dom.BooleanLiteral;
import org.eclipse.jdt.core.dom.BreakStatement;
import org.eclipse.jdt.core.dom.CatchClause;
import org.eclipse.jdt.core.dom.ConstructorInvocation;
import org.eclipse.jdt.core.dom.DoStatement;
import org.eclipse.jdt.core.dom.Expression;
import org.eclipse.jdt.core.dom.ForStatement;
import org.eclipse.jdt.core.dom.IfStatement;
import org.eclipse.jdt.core.dom.LabeledStatement;
import org.eclipse.jdt.core.dom.LambdaExpression;
import org.eclipse.jdt.core.dom.MethodDeclaration;
import org.eclipse.jdt.core.dom.ParenthesizedExpression;
import org.eclipse.jdt.core.dom.PrimitiveType;
import org.eclipse.jdt.core.dom.ReturnStatement;
import org.eclipse.jdt.core.dom.Statement;
import org.eclipse.jdt.core.dom.StructuralPropertyDescriptor;
import org.eclipse.jdt.core.dom.SuperConstructorInvocation;
import org.eclipse.jdt.core.dom.SwitchCase;
import org.eclipse.jdt.core.dom.SwitchStatement;
import org.eclipse.jdt.core.dom.SynchronizedStatement;
import org.eclipse.jdt.core.dom.TryStatement;
import org.eclipse.jdt.core.dom.TypeDeclarationStatement;
import org.eclipse.jdt.core.dom.WhileStatement;

import java.util.ArrayList;
import java.util.List;

/**
 * Traces entry to and exit from method and constructor bodies.
 *
 * <pre>
 * void m() {                          void m() {
 *     work();                             Runtime.trace("Entering method T.m");
 *     if (done) return;          =&gt;       work();
 *     more();                             if (done) { Runtime.trace("Exiting method T.m"); return; }
 * }                                       more();
 *                                         Runtime.trace("Exiting method T.m");
 *                                     }
 * </pre>
 *
 * Entry goes after an explicit {@code this(...)} or {@code super(...)} call. Exit is traced before
 * every {@code return} of the body itself (not those of nested lambdas or classes), and at the end
 * of a {@code void} method or constructor whose body can fall through. Fall-through is only assumed
 * where it is certain, so a body ending in an unusual shape gets no trailing exit trace. A method
 * that exits by throwing traces entry only.
 */
public final class MethodTracer {

    static final String ENTER_PREFIX = "Entering method ";
    static final String EXIT_PREFIX = "Exiting method ";

    private final CodeSynthesizer synthesizer;

    public MethodTracer(CodeSynthesizer synthesizer) {
        this.synthesizer = synthesizer;
    }

    /** {@code Type.method}; constructors are {@code Type.<init>}, members of anonymous classes {@code <anonymous>.method}. */
    public static String labelOf(MethodDeclaration method) {
        String owner = method.getParent() instanceof AbstractTypeDeclaration type
            ? type.getName().getIdentifier()
            : "<anonymous>";
        return owner + "." + (method.isConstructor() ? "<init>" : method.getName().getIdentifier());
    }

    /** Returns a traced copy of {@code method}, or {@code method} itself when it has no body. */
    @SuppressWarnings("unchecked")
    public ASTNode instrument(MethodDeclaration method, InstrumentationContext ctx) {
        if (method.getBody() == null) {
            return method;
        }
        AST ast = method.getAST();
        String label = labelOf(method);
        MethodDeclaration copy = (MethodDeclaration) ASTNode.copySubtree(ast, method);
        Block body = copy.getBody();

        for (ReturnStatement exit : ownReturns(body)) {
            Block guarded = ast.newBlock();
            replace(exit, guarded);
            guarded.statements().add(synthesizer.traceStatement(ast, EXIT_PREFIX + label));
            guarded.statements().add(exit);
        }

        List<Statement> statements = body.statements();
        if (returnsNothing(copy) && canCompleteNormally(body)) {
            statements.add(synthesizer.traceStatement(ast, EXIT_PREFIX + label));
        }
        statements.add(entryIndex(statements), synthesizer.traceStatement(ast, ENTER_PREFIX + label));

        ctx.recordSite(new SiteRecord(SiteRecord.Kind.METHOD, label, ctx.sourceText().lineOf(method)));
        return copy;
    }

    private static int entryIndex(List<Statement> statements) {
        if (!statements.isEmpty()
                && (statements.get(0) instanceof ConstructorInvocation
                    || statements.get(0) instanceof SuperConstructorInvocation)) {
            return 1;
        }
        return 0;
    }

    private static boolean returnsNothing(MethodDeclaration method) {
        if (method.isConstructor()) {
            return true;
        }
        return method.getReturnType2() instanceof PrimitiveType primitive
            && primitive.getPrimitiveTypeCode() == PrimitiveType.VOID;
    }

    private static List<ReturnStatement> ownReturns(Block body) {
        List<ReturnStatement> found = new ArrayList<>();
        body.accept(new ASTVisitor() {
            @Override
            public boolean visit(ReturnStatement node) {
                found.add(node);
                return false;
            }

            @Override
            public boolean visit(LambdaExpression node) { return false; }

            @Override
            public boolean visit(AnonymousClassDeclaration node) { return false; }

            @Override
            public boolean visit(TypeDeclarationStatement node) { return false; }
        });
        return found;
    }

    @SuppressWarnings("unchecked")
    private static void replace(Statement original, Statement replacement) {
        ASTNode parent = original.getParent();
        StructuralPropertyDescriptor location = original.getLocationInParent();
        if (location.isChildListProperty()) {
            List<ASTNode> siblings = (List<ASTNode>) parent.getStructuralProperty(location);
            siblings.set(siblings.indexOf(original), replacement);
        } else {
            parent.setStructuralProperty(location, replacement);
        }
    }

    // -----------------------------------------------------------------------
    // Normal completion, after JLS 14.22. Answers true only when certain.
    // -----------------------------------------------------------------------

    @SuppressWarnings("unchecked")
    static boolean canCompleteNormally(Statement statement) {
        if (statement instanceof Block block) {
            List<Statement> statements = block.statements();
            return statements.isEmpty() || canCompleteNormally(statements.get(statements.size() - 1));
        }
        if (statement instanceof IfStatement branch) {
            return branch.getElseStatement() == null
                || canCompleteNormally(branch.getThenStatement())
                || canCompleteNormally(branch.getElseStatement());
        }
        if (statement instanceof WhileStatement loop) {
            return !isConstantTrue(loop.getExpression());
        }
        if (statement instanceof ForStatement loop) {
            return loop.getExpression() != null && !isConstantTrue(loop.getExpression());
        }
        if (statement instanceof DoStatement loop) {
            return !isConstantTrue(loop.getExpression()) && canCompleteNormally(loop.getBody());
        }
        if (statement instanceof LabeledStatement labeled) {
            return canCompleteNormally(labeled.getBody());
        }
        if (statement instanceof SynchronizedStatement sync) {
            return canCompleteNormally(sync.getBody());
        }
        if (statement instanceof TryStatement attempt) {
            return canCompleteNormally(attempt);
        }
        if (statement instanceof SwitchStatement choice) {
            return canCompleteNormally(choice);
        }
        return switch (statement.getNodeType()) {
            case ASTNode.RETURN_STATEMENT, ASTNode.THROW_STATEMENT, ASTNode.BREAK_STATEMENT,
                 ASTNode.CONTINUE_STATEMENT, ASTNode.YIELD_STATEMENT -> false;
            default -> true;
        };
    }

    @SuppressWarnings("unchecked")
    private static boolean canCompleteNormally(TryStatement attempt) {
        if (attempt.getFinally() != null && !canCompleteNormally(attempt.getFinally())) {
            return false;
        }
        if (canCompleteNormally(attempt.getBody())) {
            return true;
        }
        return ((List<CatchClause>) attempt.catchClauses()).stream()
            .anyMatch(clause -> canCompleteNormally(clause.getBody()));
    }

    @SuppressWarnings("unchecked")
    private static boolean canCompleteNormally(SwitchStatement choice) {
        List<Statement> statements = choice.statements();
        boolean hasDefault = false;
        boolean arrows = false;
        for (Statement statement : statements) {
            if (statement instanceof SwitchCase label) {
                hasDefault |= label.isDefault();
                arrows |= label.isSwitchLabeledRule();
            }
        }
        if (!hasDefault) {
            return true;
        }
        // With a default label only the plain fall-through form is judged
        if (arrows || statements.isEmpty()) {
            return false;
        }
        Statement last = statements.get(statements.size() - 1);
        if (last instanceof BreakStatement exit) {
            return exit.getLabel() == null;
        }
        return !(last instanceof SwitchCase) && canCompleteNormally(last);
    }

    private static boolean isConstantTrue(Expression condition) {
        Expression e = condition;
        while (e instanceof ParenthesizedExpression parenthesized) {
            e = parenthesized.getExpression();
        }
        return e instanceof BooleanLiteral literal && literal.booleanValue();
    }
}
