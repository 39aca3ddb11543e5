package com.callprobe.instrumenter.engine;

import org.eclipse.jdt.core.dom.ASTNode;
import org.eclipse.jdt.core.dom.Expression;
import org.eclipse.jdt.core.dom.ExpressionStatement;
import org.eclipse.jdt.core.dom.ForStatement;
import org.eclipse.jdt.core.dom.LambdaExpression;
import org.eclipse.jdt.core.dom.MethodInvocation;
import org.eclipse.jdt.core.dom.StructuralPropertyDescriptor;
import org.eclipse.jdt.core.dom.SuperMethodInvocation;

/**
 * Rewrites one call site: resolve its name, skip excluded or already-instrumented calls,
 * otherwise mark it and return the synthesized replacement.
 *
 * Call sites are {@link MethodInvocation} and {@link SuperMethodInvocation} nodes.
 */
public final class CallInstrumenter {

    private final NameResolver nameResolver;
    private final ExclusionFilter exclusionFilter;
    private final CodeSynthesizer synthesizer;
    private final boolean verbose;

    public CallInstrumenter(NameResolver nameResolver, ExclusionFilter exclusionFilter,
                            CodeSynthesizer synthesizer, boolean verbose) {
        this.nameResolver = nameResolver;
        this.exclusionFilter = exclusionFilter;
        this.synthesizer = synthesizer;
        this.verbose = verbose;
    }

    public static boolean isCall(ASTNode node) {
        return node instanceof MethodInvocation || node instanceof SuperMethodInvocation;
    }

    /**
     * True when {@code call} is used for its value. A call that forms a whole expression statement,
     * a lambda's expression body, or a {@code for} initializer/updater might be {@code void}; those
     * are either handled as statements or left alone.
     */
    public static boolean isExpressionPosition(Expression call) {
        StructuralPropertyDescriptor location = call.getLocationInParent();
        return location != ExpressionStatement.EXPRESSION_PROPERTY
            && location != LambdaExpression.BODY_PROPERTY
            && location != ForStatement.INITIALIZERS_PROPERTY
            && location != ForStatement.UPDATERS_PROPERTY;
    }

    /** Wraps a call used as a value; returns {@code call} itself when it is not instrumented. */
    public ASTNode instrument(Expression call, InstrumentationContext ctx) {
        String name = resolve(call, ctx);
        if (!shouldRewrite(name, call, ctx)) {
            return call;
        }
        return apply(name, call, synthesizer.wrapCallExpression(call, name), ctx);
    }

    /** Wraps a call statement in a block; returns {@code statement} itself when it is not instrumented. */
    public ASTNode instrument(ExpressionStatement statement, InstrumentationContext ctx) {
        Expression call = statement.getExpression();
        String name = resolve(call, ctx);
        if (!shouldRewrite(name, call, ctx)) {
            return statement;
        }
        return apply(name, call, synthesizer.wrapCallStatement(statement, name, ctx.names()), ctx);
    }

    private String resolve(Expression call, InstrumentationContext ctx) {
        String name;
        if (call instanceof SuperMethodInvocation superCall) {
            name = nameResolver.resolve(superCall, ctx.sourceText());
        } else if (call instanceof MethodInvocation invocation) {
            name = nameResolver.resolve(invocation, ctx.sourceText());
        } else {
            throw new IllegalArgumentException("Not a call site: " + call.getClass().getSimpleName());
        }
        if (verbose) {
            System.err.println("[callprobe] call name: " + name);
        }
        return name;
    }

    private boolean shouldRewrite(String name, Expression call, InstrumentationContext ctx) {
        return exclusionFilter.shouldInstrument(name, calleeText(call, ctx.sourceText()))
            && !ctx.identityTracker().alreadyInstrumented(name, call);
    }

    private static String calleeText(Expression call, SourceText text) {
        return call instanceof SuperMethodInvocation superCall
            ? text.calleeOf(superCall)
            : text.calleeOf((MethodInvocation) call);
    }

    private ASTNode apply(String name, Expression original, CodeSynthesizer.CallRewrite rewrite,
                          InstrumentationContext ctx) {
        ctx.identityTracker().markInstrumented(name, rewrite.relocatedCall());
        ctx.recordSite(new SiteRecord(SiteRecord.Kind.CALL, name, ctx.sourceText().lineOf(original)));
        return rewrite.replacement();
    }
}
