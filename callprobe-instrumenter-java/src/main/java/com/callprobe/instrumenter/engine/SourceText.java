package com.callprobe.instrumenter.engine;

import org.eclipse.jdt.core.dom.ASTNode;
import org.eclipse.jdt.core.dom.CompilationUnit;
import org.eclipse.jdt.core.dom.MethodInvocation;
import org.eclipse.jdt.core.dom.SimpleName;
import org.eclipse.jdt.core.dom.SuperMethodInvocation;

/**
 * The original text of one compilation unit, used to recover the exact source of a node.
 *
 * Copies made with {@code ASTNode.copySubtree} keep their source range, so relocated nodes still
 * map back to their original text. Nodes built by the engine have no range and fall back to the
 * printer's rendering.
 */
public final class SourceText {

    private final String source;
    private final CompilationUnit unit;

    public SourceText(String source) {
        this(source, null);
    }

    /** {@code unit} is the tree parsed from {@code source}; its line table answers {@link #lineOf}. */
    public SourceText(String source, CompilationUnit unit) {
        this.source = source != null ? source : "";
        this.unit = unit;
    }

    /** Exact source text of {@code node}. */
    public String of(ASTNode node) {
        return hasRange(node) ? source.substring(node.getStartPosition(), node.getStartPosition() + node.getLength())
                              : node.toString();
    }

    /** Text of a call's callee, {@code receiver.name}, without type arguments or the argument list. */
    public String calleeOf(MethodInvocation call) {
        if (call.getExpression() == null) {
            return call.getName().getIdentifier();
        }
        return calleeText(call, call.getName(), call.getExpression().toString() + "." + call.getName().getIdentifier());
    }

    /** {@code super.name} or {@code X.super.name}. */
    public String calleeOf(SuperMethodInvocation call) {
        String receiver = call.getQualifier() == null ? "super" : call.getQualifier() + ".super";
        return calleeText(call, call.getName(), receiver + "." + call.getName().getIdentifier());
    }

    private String calleeText(ASTNode call, SimpleName name, String fallback) {
        if (hasRange(call) && hasRange(name)) {
            int end = name.getStartPosition() + name.getLength();
            if (end <= call.getStartPosition() + call.getLength()) {
                return source.substring(call.getStartPosition(), end);
            }
        }
        return fallback;
    }

    /** 1-based line of the node's first character, or -1 for synthesized nodes or without a parsed unit. */
    public int lineOf(ASTNode node) {
        if (unit == null || !hasRange(node)) return -1;
        int line = unit.getLineNumber(node.getStartPosition());
        return line > 0 ? line : -1;
    }

    private boolean hasRange(ASTNode node) {
        int start = node.getStartPosition();
        return start >= 0 && node.getLength() > 0 && start + node.getLength() <= source.length();
    }
}
