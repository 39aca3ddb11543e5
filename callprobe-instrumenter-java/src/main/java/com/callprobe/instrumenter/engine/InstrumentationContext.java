package com.callprobe.instrumenter.engine;

import org.eclipse.jdt.core.dom.CompilationUnit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-traversal state for instrumenting one compilation unit.
 *
 * The identity tracker may be shared between contexts to keep one name map for a whole run;
 * everything else belongs to this unit only.
 */
public final class InstrumentationContext {

    private final String unitName;
    private final SourceText sourceText;
    private final IdentityTracker identityTracker;
    private final UniqueNames names;
    private final List<SiteRecord> sites = new ArrayList<>();

    public InstrumentationContext(String unitName, SourceText sourceText,
                                  IdentityTracker identityTracker, UniqueNames names) {
        this.unitName = unitName;
        this.sourceText = sourceText;
        this.identityTracker = identityTracker;
        this.names = names;
    }

    /** Context for a freshly parsed unit with its own tracker. */
    public static InstrumentationContext forUnit(String unitName, String source, CompilationUnit unit) {
        return forUnit(unitName, source, unit, new IdentityTracker());
    }

    public static InstrumentationContext forUnit(String unitName, String source, CompilationUnit unit,
                                                 IdentityTracker sharedTracker) {
        return new InstrumentationContext(unitName, new SourceText(source, unit), sharedTracker, UniqueNames.forUnit(unit));
    }

    public String unitName() { return unitName; }
    public SourceText sourceText() { return sourceText; }
    public IdentityTracker identityTracker() { return identityTracker; }
    public UniqueNames names() { return names; }

    void recordSite(SiteRecord site) {
        sites.add(site);
    }

    public List<SiteRecord> sites() {
        return Collections.unmodifiableList(sites);
    }
}
