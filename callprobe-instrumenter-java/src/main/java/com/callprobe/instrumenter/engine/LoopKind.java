package com.callprobe.instrumenter.engine;

import org.eclipse.jdt.core.dom.ASTNode;
import org.eclipse.jdt.core.dom.EnhancedForStatement;
import org.eclipse.jdt.core.dom.ForStatement;

import java.util.Optional;

/**
 * Loop constructs the engine knows how to rebuild. {@code while} and {@code do} loops are not
 * among them and pass through unchanged.
 */
public enum LoopKind {

    COUNTED("for_"),
    FOR_EACH("foreach_");

    private final String idPrefix;

    LoopKind(String idPrefix) {
        this.idPrefix = idPrefix;
    }

    public String idPrefix() { return idPrefix; }

    public static Optional<LoopKind> of(ASTNode node) {
        if (node instanceof ForStatement) return Optional.of(COUNTED);
        if (node instanceof EnhancedForStatement) return Optional.of(FOR_EACH);
        return Optional.empty();
    }
}
