package com.callprobe.instrumenter.engine;

import org.eclipse.jdt.core.dom.ASTNode;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.WeakHashMap;

/**
 * Records which call sites have been instrumented, by resolved name and by node identity.
 *
 * A call counts as already handled only when both the name flag is set and that very node was
 * marked. The name flag alone never skips a call: a second, distinct node resolving to an
 * already-seen name is still wrapped and gets its own mark. Name flags grow monotonically and are
 * never pruned while a tracker is in use.
 */
public final class IdentityTracker {

    private final Map<String, Boolean> instrumentedNames = new HashMap<>();

    // ASTNode equality is identity; weak keys let finished units be collected when a tracker is shared
    private final Set<ASTNode> markedNodes = Collections.newSetFromMap(new WeakHashMap<>());

    public boolean alreadyInstrumented(String resolvedName, ASTNode node) {
        return isNameInstrumented(resolvedName) && isMarked(node);
    }

    public void markInstrumented(String resolvedName, ASTNode node) {
        instrumentedNames.put(resolvedName, Boolean.TRUE);
        markedNodes.add(node);
    }

    public boolean isNameInstrumented(String resolvedName) {
        return Boolean.TRUE.equals(instrumentedNames.get(resolvedName));
    }

    public boolean isMarked(ASTNode node) {
        return markedNodes.contains(node);
    }

    public int instrumentedNameCount() {
        return instrumentedNames.size();
    }
}
