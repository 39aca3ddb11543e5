package com.callprobe.instrumenter.engine;

import org.eclipse.jdt.core.dom.AST;
import org.eclipse.jdt.core.dom.ASTNode;
import org.eclipse.jdt.core.dom.Block;
import org.eclipse.jdt.core.dom.Expression;
import org.eclipse.jdt.core.dom.ExpressionStatement;
import org.eclipse.jdt.core.dom.ImportDeclaration;
import org.eclipse.jdt.core.dom.Initializer;
import org.eclipse.jdt.core.dom.MethodInvocation;
import org.eclipse.jdt.core.dom.Modifier;
import org.eclipse.jdt.core.dom.PrimitiveType;
import org.eclipse.jdt.core.dom.Statement;
import org.eclipse.jdt.core.dom.StringLiteral;
import org.eclipse.jdt.core.dom.VariableDeclarationFragment;
import org.eclipse.jdt.core.dom.VariableDeclarationStatement;

import java.util.List;

/**
 * Builds the replacement fragments: wrapped calls, wrapped loop bodies and the unit
 * initialization sequence.
 *
 * Every fragment is newly allocated from the unit's {@link AST}. Original sub-trees are copied
 * into the fragment, never moved, so the input node is left untouched and the walker can splice
 * the fragment in its place.
 */
public final class CodeSynthesizer {

    private final RuntimeApi runtime;

    public CodeSynthesizer(RuntimeApi runtime) {
        this.runtime = runtime;
    }

    /**
     * A synthesized replacement together with the copy of the original call it contains.
     * The copy is the node that remains in the tree, so it is the one to mark.
     */
    public record CallRewrite(ASTNode replacement, Expression relocatedCall) {}

    /** Trace and identifier form of a resolved name: dots become underscores. */
    public static String formatLabel(String resolvedName) {
        return resolvedName.replace('.', '_');
    }

    // -----------------------------------------------------------------------
    // Calls
    // -----------------------------------------------------------------------

    /**
     * {@code Runtime.exitCall(Runtime.enterCall("<name>", "<label>"), <call>)}.
     * Arguments evaluate left to right, so the whole begin sequence runs before the original call.
     */
    public CallRewrite wrapCallExpression(Expression call, String resolvedName) {
        AST ast = call.getAST();
        Expression relocated = (Expression) ASTNode.copySubtree(ast, call);
        MethodInvocation enter = runtimeCall(ast, RuntimeApi.ENTER_CALL,
            stringLiteral(ast, resolvedName), stringLiteral(ast, formatLabel(resolvedName)));
        MethodInvocation exit = runtimeCall(ast, RuntimeApi.EXIT_CALL, enter, relocated);
        return new CallRewrite(exit, relocated);
    }

    /**
     * Block form for a call used as a statement, where the call may be {@code void}:
     * trace, register, count, start timer, original statement, end timer, trace.
     */
    @SuppressWarnings("unchecked")
    public CallRewrite wrapCallStatement(ExpressionStatement statement, String resolvedName, UniqueNames names) {
        AST ast = statement.getAST();
        String label = formatLabel(resolvedName);
        String startVar = names.fresh("__call_start_" + label);

        VariableDeclarationFragment fragment = ast.newVariableDeclarationFragment();
        fragment.setName(ast.newSimpleName(startVar));
        fragment.setInitializer(runtimeCall(ast, RuntimeApi.MARK_START, stringLiteral(ast, resolvedName)));
        VariableDeclarationStatement startDecl = ast.newVariableDeclarationStatement(fragment);
        startDecl.setType(ast.newPrimitiveType(PrimitiveType.LONG));

        ExpressionStatement relocated = (ExpressionStatement) ASTNode.copySubtree(ast, statement);

        Block block = ast.newBlock();
        List<Statement> statements = block.statements();
        statements.add(runtimeStatement(ast, RuntimeApi.TRACE, stringLiteral(ast, "begin call " + label)));
        statements.add(runtimeStatement(ast, RuntimeApi.REGISTER_CALL, stringLiteral(ast, resolvedName)));
        statements.add(runtimeStatement(ast, RuntimeApi.INCREMENT_CALL_COUNT, stringLiteral(ast, resolvedName)));
        statements.add(startDecl);
        statements.add(relocated);
        statements.add(runtimeStatement(ast, RuntimeApi.MARK_END,
            stringLiteral(ast, resolvedName), ast.newSimpleName(startVar)));
        statements.add(runtimeStatement(ast, RuntimeApi.TRACE, stringLiteral(ast, "end call " + label)));

        return new CallRewrite(block, relocated.getExpression());
    }

    // -----------------------------------------------------------------------
    // Loops
    // -----------------------------------------------------------------------

    /** {@code { registerLoop(id); incrementIteration(id); <body> }} with the body copied verbatim. */
    @SuppressWarnings("unchecked")
    public Block wrapLoopBody(Statement body, String loopId) {
        AST ast = body.getAST();
        Block block = ast.newBlock();
        List<Statement> statements = block.statements();
        statements.add(runtimeStatement(ast, RuntimeApi.REGISTER_LOOP, stringLiteral(ast, loopId)));
        statements.add(runtimeStatement(ast, RuntimeApi.INCREMENT_ITERATION, stringLiteral(ast, loopId)));
        statements.add((Statement) ASTNode.copySubtree(ast, body));
        return block;
    }

    // -----------------------------------------------------------------------
    // Method bodies
    // -----------------------------------------------------------------------

    /** {@code Runtime.trace("<text>");} */
    public ExpressionStatement traceStatement(AST ast, String text) {
        return runtimeStatement(ast, RuntimeApi.TRACE, stringLiteral(ast, text));
    }

    // -----------------------------------------------------------------------
    // Unit initialization
    // -----------------------------------------------------------------------

    public ImportDeclaration runtimeImport(AST ast) {
        ImportDeclaration declaration = ast.newImportDeclaration();
        declaration.setName(ast.newName(runtime.qualifiedName()));
        return declaration;
    }

    /** {@code static { Runtime.init("<unitName>"); }} */
    @SuppressWarnings("unchecked")
    public Initializer initBlock(AST ast, String unitName) {
        Initializer initializer = ast.newInitializer();
        initializer.modifiers().add(ast.newModifier(Modifier.ModifierKeyword.STATIC_KEYWORD));
        Block body = ast.newBlock();
        body.statements().add(runtimeStatement(ast, RuntimeApi.INIT, stringLiteral(ast, unitName)));
        initializer.setBody(body);
        return initializer;
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    @SuppressWarnings("unchecked")
    private MethodInvocation runtimeCall(AST ast, String method, Expression... arguments) {
        MethodInvocation invocation = ast.newMethodInvocation();
        invocation.setExpression(ast.newSimpleName(runtime.simpleName()));
        invocation.setName(ast.newSimpleName(method));
        for (Expression argument : arguments) {
            invocation.arguments().add(argument);
        }
        return invocation;
    }

    private ExpressionStatement runtimeStatement(AST ast, String method, Expression... arguments) {
        return ast.newExpressionStatement(runtimeCall(ast, method, arguments));
    }

    private static StringLiteral stringLiteral(AST ast, String value) {
        StringLiteral literal = ast.newStringLiteral();
        literal.setLiteralValue(value);
        return literal;
    }
}
