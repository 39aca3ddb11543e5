package com.callprobe.instrumenter.engine;

import com.callprobe.instrumenter.host.TreeWalker;
import org.eclipse.jdt.core.dom.ASTNode;
import org.eclipse.jdt.core.dom.CompilationUnit;
import org.eclipse.jdt.core.dom.Expression;
import org.eclipse.jdt.core.dom.ExpressionStatement;
import org.eclipse.jdt.core.dom.MethodDeclaration;
import org.eclipse.jdt.core.dom.Statement;

/**
 * Entry point of the rewrite: decides, for each node the walker hands over, whether it is a
 * compilation unit, a call, a supported loop or (when method tracing is on) a method body, and
 * delegates to the matching instrumenter. Anything else is returned unchanged.
 */
public final class InstrumentationEngine {

    private final CallInstrumenter calls;
    private final LoopInstrumenter loops;
    private final UnitInitializer units;
    private final MethodTracer methods; // null when method tracing is off

    public InstrumentationEngine(CallInstrumenter calls, LoopInstrumenter loops, UnitInitializer units,
                                 MethodTracer methods) {
        this.calls = calls;
        this.loops = loops;
        this.units = units;
        this.methods = methods;
    }

    /**
     * Wires the components together. Calls into {@code runtime} are always added to the
     * exclusions, so generated code is never instrumented itself.
     */
    public static InstrumentationEngine create(ExclusionFilter exclusions, RuntimeApi runtime,
                                               SourceHasher hasher, boolean verbose) {
        return create(exclusions, runtime, hasher, verbose, false);
    }

    /** As {@link #create(ExclusionFilter, RuntimeApi, SourceHasher, boolean)}, optionally tracing method entry and exit. */
    public static InstrumentationEngine create(ExclusionFilter exclusions, RuntimeApi runtime,
                                               SourceHasher hasher, boolean verbose, boolean traceMethods) {
        CodeSynthesizer synthesizer = new CodeSynthesizer(runtime);
        ExclusionFilter filter = exclusions.extendedWith(runtime.exclusionNames());
        return new InstrumentationEngine(
            new CallInstrumenter(new NameResolver(hasher), filter, synthesizer, verbose),
            new LoopInstrumenter(synthesizer, hasher),
            new UnitInitializer(runtime, synthesizer),
            traceMethods ? new MethodTracer(synthesizer) : null);
    }

    public static InstrumentationEngine defaults() {
        return create(ExclusionFilter.defaults(), RuntimeApi.defaults(), new Sha256SourceHasher(), false);
    }

    public ASTNode transform(ASTNode node, InstrumentationContext ctx) {
        if (node instanceof CompilationUnit unit) {
            return units.instrument(unit, ctx);
        }
        if (node instanceof ExpressionStatement statement && CallInstrumenter.isCall(statement.getExpression())) {
            return calls.instrument(statement, ctx);
        }
        if (node instanceof Expression call && CallInstrumenter.isCall(call)) {
            return CallInstrumenter.isExpressionPosition(call) ? calls.instrument(call, ctx) : call;
        }
        if (node instanceof MethodDeclaration method && methods != null) {
            return methods.instrument(method, ctx);
        }
        if (node instanceof Statement loop && LoopKind.of(loop).isPresent()) {
            return loops.instrument(loop, ctx);
        }
        return node;
    }

    /** Runs one full traversal over {@code unit} and returns the rewritten unit. */
    public CompilationUnit instrument(CompilationUnit unit, InstrumentationContext ctx) {
        return (CompilationUnit) new TreeWalker().walk(unit, node -> transform(node, ctx));
    }
}
