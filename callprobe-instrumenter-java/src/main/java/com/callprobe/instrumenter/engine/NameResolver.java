package com.callprobe.instrumenter.engine;

import org.eclipse.jdt.core.dom.Expression;
import org.eclipse.jdt.core.dom.FieldAccess;
import org.eclipse.jdt.core.dom.MethodInvocation;
import org.eclipse.jdt.core.dom.QualifiedName;
import org.eclipse.jdt.core.dom.SimpleName;
import org.eclipse.jdt.core.dom.SuperMethodInvocation;
import org.eclipse.jdt.core.dom.ThisExpression;

/**
 * Derives a canonical dotted name for a call target from its syntactic shape alone.
 *
 * <ul>
 *   <li>{@code foo()} resolves to {@code foo}</li>
 *   <li>{@code this.foo()} resolves to {@code this.foo}</li>
 *   <li>{@code a.b.foo()} resolves to {@code a.b.foo}, {@code this.a.foo()} to {@code this.a.foo}</li>
 *   <li>any other receiver shape (a call, literal, cast, {@code new} expression, qualified
 *       {@code this}...) resolves to {@code anonymous_<hash>} of the enclosing callee text,
 *       followed by the remaining member names</li>
 *   <li>{@code super.foo()} and {@code X.super.foo()} resolve to {@code anonymous_<hash>.foo},
 *       hashing the callee text {@code super.foo} or {@code X.super.foo}</li>
 * </ul>
 *
 * Names are recomputed on every visit and never cached across nodes.
 */
public final class NameResolver {

    public static final String ANONYMOUS_PREFIX = "anonymous_";

    private final SourceHasher hasher;

    public NameResolver(SourceHasher hasher) {
        this.hasher = hasher;
    }

    public String resolve(MethodInvocation call, SourceText text) {
        String member = call.getName().getIdentifier();
        Expression receiver = call.getExpression();
        if (receiver == null) {
            return member;
        }
        if (isReceiverKeyword(receiver)) {
            return "this." + member;
        }
        return resolveCallee(text.calleeOf(call), receiver, text) + "." + member;
    }

    public String resolve(SuperMethodInvocation call, SourceText text) {
        return ANONYMOUS_PREFIX + hasher.hash(text.calleeOf(call)) + "." + call.getName().getIdentifier();
    }

    /**
     * Resolves {@code callee} as if it were the callee of a call whose own text is {@code siteText}.
     * Only property accesses rooted in something other than {@code this} recurse.
     */
    private String resolveCallee(String siteText, Expression callee, SourceText text) {
        if (callee instanceof SimpleName name) {
            return name.getIdentifier();
        }
        if (callee instanceof QualifiedName qualified) {
            return resolvePropertyAccess(qualified, qualified.getQualifier(), qualified.getName(), text);
        }
        if (callee instanceof FieldAccess access) {
            return resolvePropertyAccess(access, access.getExpression(), access.getName(), text);
        }
        return ANONYMOUS_PREFIX + hasher.hash(siteText);
    }

    private String resolvePropertyAccess(Expression access, Expression object, SimpleName member, SourceText text) {
        if (isReceiverKeyword(object)) {
            return "this." + member.getIdentifier();
        }
        return resolveCallee(text.of(access), object, text) + "." + member.getIdentifier();
    }

    private static boolean isReceiverKeyword(Expression expression) {
        return expression instanceof ThisExpression self && self.getQualifier() == null;
    }
}
