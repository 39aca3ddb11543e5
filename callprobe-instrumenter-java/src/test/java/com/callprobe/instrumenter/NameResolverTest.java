package com.callprobe.instrumenter;

import com.callprobe.instrumenter.engine.NameResolver;
import com.callprobe.instrumenter.engine.Sha256SourceHasher;
import com.callprobe.instrumenter.engine.SourceText;
import com.callprobe.instrumenter.host.JdtSourceParser.ParsedUnit;
import org.eclipse.jdt.core.dom.MethodInvocation;
import org.eclipse.jdt.core.dom.SuperMethodInvocation;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NameResolverTest {

    private static final String SOURCE = """
        class Sample {
            Helper helper;
            Sample s;

            void run() {
                foo(1);
                this.bar();
                a.b.c();
                this.helper.go();
                foo().bar();
                new Sample().run();
                ((Sample) s).run();
                System.out.println("x");
            }

            class Inner {
                void call() {
                    Sample.this.run();
                }
            }
        }
        """;

    private final Sha256SourceHasher hasher = new Sha256SourceHasher();
    private final NameResolver resolver = new NameResolver(hasher);

    private String resolve(String callText) {
        ParsedUnit parsed = EngineHarness.parse("Sample.java", SOURCE);
        SourceText text = new SourceText(SOURCE);
        for (MethodInvocation call : EngineHarness.nodes(parsed.unit(), MethodInvocation.class)) {
            if (text.of(call).equals(callText)) {
                return resolver.resolve(call, text);
            }
        }
        throw new AssertionError("No call with text: " + callText);
    }

    @Test
    void bareIdentifierResolvesToItsName() {
        assertEquals("foo", resolve("foo(1)"));
    }

    @Test
    void thisQualifiedMethodKeepsThisPrefix() {
        assertEquals("this.bar", resolve("this.bar()"));
    }

    @Test
    void memberChainResolvesToDottedName() {
        assertEquals("a.b.c", resolve("a.b.c()"));
        assertEquals("System.out.println", resolve("System.out.println(\"x\")"));
    }

    @Test
    void fieldOfThisResolvesThroughReceiver() {
        assertEquals("this.helper.go", resolve("this.helper.go()"));
    }

    @Test
    void callReceiverFallsBackToHashedAnonymousName() {
        assertEquals("anonymous_" + hasher.hash("foo().bar") + ".bar", resolve("foo().bar()"));
    }

    @Test
    void constructedAndCastReceiversAreAnonymous() {
        assertEquals("anonymous_" + hasher.hash("new Sample().run") + ".run", resolve("new Sample().run()"));
        assertEquals("anonymous_" + hasher.hash("((Sample) s).run") + ".run", resolve("((Sample) s).run()"));
    }

    @Test
    void qualifiedThisIsNotTheReceiverKeyword() {
        assertEquals("anonymous_" + hasher.hash("Sample.this.run") + ".run", resolve("Sample.this.run()"));
    }

    @Test
    void anonymousNameIsDeterministicAcrossParses() {
        String first = resolve("foo().bar()");
        String second = resolve("foo().bar()");
        assertEquals(first, second);
        assertTrue(first.startsWith(NameResolver.ANONYMOUS_PREFIX));
        assertEquals(NameResolver.ANONYMOUS_PREFIX.length() + Sha256SourceHasher.DEFAULT_LENGTH + ".bar".length(),
            first.length());
    }

    @Test
    void superCallsResolveThroughTheirCalleeText() {
        String source = """
            interface Greeter {
                default String greet() { return "hi"; }
            }
            class Polite extends Object implements Greeter {
                public String greet() { return Greeter.super.greet() + super.toString(); }
            }
            """;
        ParsedUnit parsed = EngineHarness.parse("Polite.java", source);
        SourceText text = new SourceText(source, parsed.unit());

        List<String> names = new ArrayList<>();
        for (SuperMethodInvocation call : EngineHarness.nodes(parsed.unit(), SuperMethodInvocation.class)) {
            names.add(resolver.resolve(call, text));
        }

        assertEquals(List.of(
            "anonymous_" + hasher.hash("Greeter.super.greet") + ".greet",
            "anonymous_" + hasher.hash("super.toString") + ".toString"), names);
    }
}
