package com.callprobe.instrumenter.engine;

import org.eclipse.jdt.core.dom.AST;
import org.eclipse.jdt.core.dom.ASTNode;
import org.eclipse.jdt.core.dom.AbstractTypeDeclaration;
import org.eclipse.jdt.core.dom.CompilationUnit;
import org.eclipse.jdt.core.dom.EnumDeclaration;
import org.eclipse.jdt.core.dom.ImportDeclaration;
import org.eclipse.jdt.core.dom.RecordDeclaration;
import org.eclipse.jdt.core.dom.TypeDeclaration;

import java.util.List;
import java.util.Optional;

/**
 * Adds the runtime import and a {@code static { Runtime.init("<unit>"); }} block to a compilation unit.
 *
 * The block goes first in the body of the first top-level class, enum or record. A unit made only
 * of interfaces or annotations gets the import alone.
 */
public final class UnitInitializer {

    private final RuntimeApi runtime;
    private final CodeSynthesizer synthesizer;

    public UnitInitializer(RuntimeApi runtime, CodeSynthesizer synthesizer) {
        this.runtime = runtime;
        this.synthesizer = synthesizer;
    }

    @SuppressWarnings("unchecked")
    public CompilationUnit instrument(CompilationUnit unit, InstrumentationContext ctx) {
        boolean imported = importsRuntime(unit);
        if (!imported) {
            checkRuntimeNameIsFree(unit, ctx);
        }

        AST ast = unit.getAST();
        CompilationUnit copy = (CompilationUnit) ASTNode.copySubtree(ast, unit);
        if (!imported) {
            copy.imports().add(synthesizer.runtimeImport(ast));
        }
        initTarget(copy).ifPresent(type ->
            type.bodyDeclarations().add(0, synthesizer.initBlock(ast, ctx.unitName())));

        ctx.recordSite(new SiteRecord(SiteRecord.Kind.UNIT, ctx.unitName(), 1));
        return copy;
    }

    private boolean importsRuntime(CompilationUnit unit) {
        for (ImportDeclaration declaration : imports(unit)) {
            if (!declaration.isStatic() && !declaration.isOnDemand()
                    && declaration.getName().getFullyQualifiedName().equals(runtime.qualifiedName())) {
                return true;
            }
        }
        return false;
    }

    /** The runtime's simple name must not already mean something else in this unit. */
    private void checkRuntimeNameIsFree(CompilationUnit unit, InstrumentationContext ctx) {
        String simpleName = runtime.simpleName();
        for (ImportDeclaration declaration : imports(unit)) {
            if (declaration.isOnDemand()) continue;
            String imported = declaration.getName().getFullyQualifiedName();
            if (imported.endsWith("." + simpleName)) {
                throw new IdentifierCollisionException(
                    "Unit " + ctx.unitName() + " already imports " + imported + " as " + simpleName);
            }
        }
        if (ctx.names().isTaken(simpleName)) {
            throw new IdentifierCollisionException(
                "Unit " + ctx.unitName() + " already binds the identifier " + simpleName);
        }
    }

    @SuppressWarnings("unchecked")
    private static List<ImportDeclaration> imports(CompilationUnit unit) {
        return unit.imports();
    }

    @SuppressWarnings("unchecked")
    private static Optional<AbstractTypeDeclaration> initTarget(CompilationUnit unit) {
        for (AbstractTypeDeclaration type : (List<AbstractTypeDeclaration>) unit.types()) {
            if (type instanceof TypeDeclaration declaration && !declaration.isInterface()) {
                return Optional.of(type);
            }
            if (type instanceof EnumDeclaration || type instanceof RecordDeclaration) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
