package io.inlinerepl.core.engine.pass;

import static io.inlinerepl.core.engine.pass.PassHarness.squash;
import static org.assertj.core.api.Assertions.assertThat;

import io.inlinerepl.core.model.TransformOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("LoopGuardPass")
class LoopGuardPassTest {

    private static final TransformOptions GUARDED =
            TransformOptions.builder().loopProtection(true).build();

    private final LoopGuardPass pass = new LoopGuardPass();

    private String apply(String source) {
        return squash(PassHarness.apply(pass, source, GUARDED));
    }

    @Test
    void followsLoopProtectionOption() {
        assertThat(pass.isEnabled(TransformOptions.DEFAULTS)).isFalse();
        assertThat(pass.isEnabled(GUARDED)).isTrue();
    }

    @Test
    void guardSourceCarriesBudgetAndMessages() {
        String guard = LoopGuardPass.guardSource("__loop3", new GuardBudget(50, 5));

        assertThat(guard)
                .contains("if (++__loop3 > 50) throw new Error(\"Loop limit exceeded\");")
                .contains("if (__loop3 % 5 === 0 && __isCancelled()) throw new Error(\"Execution cancelled\");");
    }

    @Test
    @DisplayName("A while loop gets a counter before it and both checks at the top of its body")
    void guardsWhileLoop() {
        String out = apply("while (true) {\n  work();\n}");

        assertThat(out).startsWith("let __loop0 = 0; while (true) {");
        assertThat(out).contains("++__loop0 > 10000").contains("\"Loop limit exceeded\"");
        assertThat(out).contains("__loop0 % 100 === 0 && __isCancelled()");
        assertThat(out.indexOf("Loop limit exceeded")).isLessThan(out.indexOf("work();"));
    }

    @Test
    void guardsEveryLoopKindWithDistinctCounters() {
        String out = apply("for (let i = 0; i < 3; i++) {}\n"
                + "do { n++; } while (n < 5);\n"
                + "for (let k in o) {}\n"
                + "for (let v of list) {}");

        assertThat(out)
                .contains("let __loop0 = 0;")
                .contains("let __loop1 = 0;")
                .contains("let __loop2 = 0;")
                .contains("let __loop3 = 0;");
    }

    @Test
    void guardsNestedLoops() {
        String out = apply("for (;;) {\n  while (x) {}\n}");

        assertThat(out).contains("++__loop0").contains("++__loop1");
    }

    @Test
    @DisplayName("Counter names skip identifiers the program already uses")
    void skipsUsedNames() {
        String out = apply("let __loop0 = 'mine';\nwhile (x) {}");

        assertThat(out).contains("let __loop0 = 'mine';").contains("let __loop1 = 0;");
    }

    @Test
    void declaresCounterBeforeTheLabel() {
        String out = apply("outer: for (;;) {\n  break outer;\n}");

        assertThat(out.indexOf("let __loop0 = 0;")).isLessThan(out.indexOf("outer:"));
    }

    @Test
    void givesBodylessLoopsABlock() {
        String out = apply("while (x) x--;");

        assertThat(out).contains("++__loop0").contains("x--;");
        assertThat(out.indexOf("++__loop0")).isLessThan(out.indexOf("x--;"));
    }

    @Test
    void wrapsLoopOutsideAStatementListInABlock() {
        String out = apply("if (c) while (x) {}");

        assertThat(out).contains("{ let __loop0 = 0; while (x) {");
    }

    @Test
    void guardsLoopsInsideFunctions() {
        String out = apply("function spin() {\n  while (true) {}\n}");

        assertThat(out).contains("function spin() { let __loop0 = 0; while (true) {");
    }

    @Test
    void leavesLoopFreeCodeUntouched() {
        assertThat(apply("const a = 1;")).isEqualTo("const a = 1;");
    }
}
