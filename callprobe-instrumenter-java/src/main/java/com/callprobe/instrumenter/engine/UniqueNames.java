package com.callprobe.instrumenter.engine;

import org.eclipse.jdt.core.dom.ASTVisitor;
import org.eclipse.jdt.core.dom.CompilationUnit;
import org.eclipse.jdt.core.dom.SimpleName;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Generates identifiers and site keys that are unique within one compilation unit.
 *
 * Seeded with every identifier already spelled in the unit, so a generated local can neither
 * shadow nor be shadowed by user code regardless of nesting. Suffixes are a per-unit monotonic
 * counter per base name.
 */
public final class UniqueNames {

    private final Set<String> takenIdentifiers;
    private final Map<String, Integer> counters = new HashMap<>();
    private final Set<String> issuedKeys = new HashSet<>();

    public UniqueNames(Set<String> takenIdentifiers) {
        this.takenIdentifiers = new HashSet<>(takenIdentifiers);
    }

    public static UniqueNames forUnit(CompilationUnit unit) {
        Set<String> identifiers = new HashSet<>();
        unit.accept(new ASTVisitor() {
            @Override
            public boolean visit(SimpleName node) {
                identifiers.add(node.getIdentifier());
                return false;
            }
        });
        return new UniqueNames(identifiers);
    }

    /** Returns {@code base_<n>} for the smallest unused {@code n >= 1} and reserves it. */
    public String fresh(String base) {
        int n = counters.getOrDefault(base, 0);
        String candidate;
        do {
            n++;
            candidate = base + "_" + n;
        } while (takenIdentifiers.contains(candidate));
        counters.put(base, n);
        claim(candidate);
        return candidate;
    }

    /**
     * Reserves an exact identifier.
     *
     * @throws IdentifierCollisionException if the identifier already appears in the unit or was issued
     */
    public void claim(String identifier) {
        if (!takenIdentifiers.add(identifier)) {
            throw new IdentifierCollisionException("Identifier already bound in compilation unit: " + identifier);
        }
    }

    public boolean isTaken(String identifier) {
        return takenIdentifiers.contains(identifier);
    }

    /** Returns {@code base} the first time, then {@code base_2}, {@code base_3}... */
    public String uniqueKey(String base) {
        if (issuedKeys.add(base)) {
            return base;
        }
        int n = 1;
        String candidate;
        do {
            n++;
            candidate = base + "_" + n;
        } while (!issuedKeys.add(candidate));
        return candidate;
    }
}
