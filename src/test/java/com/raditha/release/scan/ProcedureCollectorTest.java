package com.raditha.release.scan;

import com.github.javaparser.ast.CompilationUnit;
import com.raditha.release.SourceFixture;
import com.raditha.release.model.Procedure;
import com.raditha.release.model.ProcedureKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProcedureCollectorTest {

    private final ProcedureCollector collector = new ProcedureCollector();

    @Test
    void testCollectAllKinds() {
        CompilationUnit cu = SourceFixture.parse("""
                abstract class A {
                    static { init(); }
                    { setUp(); }
                    A() { }
                    abstract void skipped();
                    void run() {
                        Runnable r = () -> work();
                        new Thread() {
                            public void run() { }
                        }.start();
                    }
                }
                """);

        List<Procedure> procedures = collector.collect(cu);

        assertEquals(List.of("<clinit>", "<init>", "A", "run", "lambda@7", "run"),
                procedures.stream().map(Procedure::name).toList());
        assertEquals(ProcedureKind.STATIC_INITIALIZER, procedures.get(0).kind());
        assertEquals(ProcedureKind.LAMBDA, procedures.get(4).kind());
    }

    @Test
    void testInterfaceMethods() {
        CompilationUnit cu = SourceFixture.parse("""
                interface I {
                    void abstractOne();
                    default void concrete() { helper(); }
                }
                """);

        List<Procedure> procedures = collector.collect(cu);

        assertEquals(1, procedures.size());
        assertEquals("concrete", procedures.get(0).name());
    }

    @Test
    void testEmptyUnit() {
        assertTrue(collector.collect(SourceFixture.parse("package a;")).isEmpty());
    }
}
