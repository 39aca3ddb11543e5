package com.callprobe.instrumenter.engine;

import org.eclipse.jdt.core.dom.AST;
import org.eclipse.jdt.core.dom.ASTNode;
import org.eclipse.jdt.core.dom.Block;
import org.eclipse.jdt.core.dom.EnhancedForStatement;
import org.eclipse.jdt.core.dom.Expression;
import org.eclipse.jdt.core.dom.ForStatement;
import org.eclipse.jdt.core.dom.SingleVariableDeclaration;
import org.eclipse.jdt.core.dom.Statement;

import java.util.Optional;

/**
 * Rebuilds a loop with the same header and a body that first records the iteration.
 *
 * There is no idempotency guard: instrumenting an already instrumented loop wraps it again.
 */
public final class LoopInstrumenter {

    private final CodeSynthesizer synthesizer;
    private final SourceHasher hasher;

    public LoopInstrumenter(CodeSynthesizer synthesizer, SourceHasher hasher) {
        this.synthesizer = synthesizer;
        this.hasher = hasher;
    }

    /** Returns the rebuilt loop, or {@code loop} itself when its kind is not supported. */
    public ASTNode instrument(Statement loop, InstrumentationContext ctx) {
        Optional<LoopKind> kind = LoopKind.of(loop);
        if (kind.isEmpty()) {
            return loop;
        }
        String loopId = ctx.names().uniqueKey(kind.get().idPrefix() + hasher.hash(ctx.sourceText().of(loop)));

        Statement rebuilt = switch (kind.get()) {
            case COUNTED -> rebuild((ForStatement) loop, loopId);
            case FOR_EACH -> rebuild((EnhancedForStatement) loop, loopId);
        };
        // Keep the original range so the rebuilt loop still maps to its source text
        rebuilt.setSourceRange(loop.getStartPosition(), loop.getLength());
        ctx.recordSite(new SiteRecord(SiteRecord.Kind.LOOP, loopId, ctx.sourceText().lineOf(loop)));
        return rebuilt;
    }

    @SuppressWarnings("unchecked")
    private ForStatement rebuild(ForStatement loop, String loopId) {
        AST ast = loop.getAST();
        ForStatement copy = ast.newForStatement();
        copy.initializers().addAll(ASTNode.copySubtrees(ast, loop.initializers()));
        copy.setExpression((Expression) ASTNode.copySubtree(ast, loop.getExpression()));
        copy.updaters().addAll(ASTNode.copySubtrees(ast, loop.updaters()));
        copy.setBody(wrapBody(loop.getBody(), loopId));
        return copy;
    }

    private EnhancedForStatement rebuild(EnhancedForStatement loop, String loopId) {
        AST ast = loop.getAST();
        EnhancedForStatement copy = ast.newEnhancedForStatement();
        copy.setParameter((SingleVariableDeclaration) ASTNode.copySubtree(ast, loop.getParameter()));
        copy.setExpression((Expression) ASTNode.copySubtree(ast, loop.getExpression()));
        copy.setBody(wrapBody(loop.getBody(), loopId));
        return copy;
    }

    private Block wrapBody(Statement body, String loopId) {
        return synthesizer.wrapLoopBody(body, loopId);
    }
}
