package com.callprobe.instrumenter;

import com.callprobe.instrumenter.engine.IdentifierCollisionException;
import com.callprobe.instrumenter.engine.SiteRecord;
import org.junit.jupiter.api.Test;

import static com.callprobe.instrumenter.EngineHarness.occurrences;
import static org.junit.jupiter.api.Assertions.*;

class UnitInitializerTest {

    private static final String IMPORT = "import com.callprobe.runtime.PerfRuntime;";

    @Test
    void unitGetsExactlyOneImportAndInitBlock() {
        EngineHarness.Run run = EngineHarness.instrument("Busy.java", """
            package demo;

            import java.util.List;

            public class Busy {
                int f(List<Integer> xs) {
                    int t = 0;
                    for (int x : xs) { t = add(t, x); }
                    for (int i = 0; i < 3; i++) { t = add(t, i); }
                    helper();
                    return t;
                }
                int add(int a, int b) { return a + b; }
                void helper() {}
            }
            """);

        assertEquals(1, occurrences(run.printed(), IMPORT), run.printed());
        assertEquals(1, occurrences(run.printed(), "PerfRuntime.init(\"Busy.java\");"), run.printed());
        assertEquals(1, run.context().sites().stream().filter(s -> s.kind() == SiteRecord.Kind.UNIT).count());
    }

    @Test
    void initBlockIsFirstMemberOfFirstClass() {
        EngineHarness.Run run = EngineHarness.instrument("Two.java", """
            interface Shape {}
            class First { int x; }
            class Second {}
            """);

        String printed = run.printed();
        int first = printed.indexOf("class First");
        int init = printed.indexOf("PerfRuntime.init(");
        int field = printed.indexOf("int x;");
        int second = printed.indexOf("class Second");
        assertTrue(first < init && init < field && field < second, printed);
    }

    @Test
    void existingRuntimeImportIsNotDuplicated() {
        EngineHarness.Run run = EngineHarness.instrument("Pre.java", """
            import com.callprobe.runtime.PerfRuntime;

            class Pre {}
            """);

        assertEquals(1, occurrences(run.printed(), IMPORT));
        assertEquals(1, occurrences(run.printed(), "PerfRuntime.init("));
    }

    @Test
    void interfaceOnlyUnitGetsImportOnly() {
        EngineHarness.Run run = EngineHarness.instrument("Shape.java", """
            interface Shape {
                double area();
            }
            """);

        assertEquals(1, occurrences(run.printed(), IMPORT));
        assertFalse(run.printed().contains("PerfRuntime.init("), run.printed());
    }

    @Test
    void enumsAndRecordsAreInitialized() {
        assertTrue(EngineHarness.instrument("Color.java", "enum Color { RED, GREEN }")
            .printed().contains("PerfRuntime.init(\"Color.java\");"));
        assertTrue(EngineHarness.instrument("Point.java", "record Point(int x, int y) {}")
            .printed().contains("PerfRuntime.init(\"Point.java\");"));
    }

    @Test
    void unitDeclaringRuntimeSimpleNameIsACollision() {
        assertThrows(IdentifierCollisionException.class,
            () -> EngineHarness.instrument("Clash.java", "class PerfRuntime {}"));
    }

    @Test
    void importOfAnotherRuntimeClassIsACollision() {
        assertThrows(IdentifierCollisionException.class,
            () -> EngineHarness.instrument("Clash.java", """
                import org.other.PerfRuntime;

                class Clash {}
                """));
    }
}
