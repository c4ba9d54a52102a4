package io.inlinerepl.core.engine.pass;

import static io.inlinerepl.core.engine.pass.PassHarness.squash;
import static org.assertj.core.api.Assertions.assertThat;

import io.inlinerepl.core.model.TransformOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ConsoleBridgePass")
class ConsoleBridgePassTest {

    private final ConsoleBridgePass pass = new ConsoleBridgePass();

    @Test
    void isAlwaysEnabled() {
        assertThat(pass.isEnabled(TransformOptions.DEFAULTS)).isTrue();
        assertThat(pass.isEnabled(TransformOptions.builder().showTopLevelResults(false).build()))
                .isTrue();
    }

    @Test
    @DisplayName("console.log(args) becomes __debug(line, args) with the same arguments")
    void redirectsConsoleCall() {
        String out = PassHarness.apply(pass, "console.log(\"a\", 1);");

        assertThat(squash(out)).isEqualTo("__debug(1, \"a\", 1);");
    }

    @Test
    void tagsCallWithTheLineItStartsOn() {
        String out = PassHarness.apply(pass, "let x = 1;\n\nconsole.warn(x);");

        assertThat(squash(out)).contains("__debug(3, x);");
    }

    @Test
    void redirectsEveryConsoleMethod() {
        String out = PassHarness.apply(pass, "console.info(1);\nconsole.error(2);\nconsole.table(3);");

        assertThat(squash(out)).isEqualTo("__debug(1, 1); __debug(2, 2); __debug(3, 3);");
    }

    @Test
    void redirectsCallsInsideFunctions() {
        String out = PassHarness.apply(pass, "function f() {\n  console.error('e');\n}");

        assertThat(squash(out)).contains("__debug(2, 'e')").doesNotContain("console");
    }

    @Test
    void redirectsComputedMemberCall() {
        String out = PassHarness.apply(pass, "console[\"log\"](42);");

        assertThat(squash(out)).isEqualTo("__debug(1, 42);");
    }

    @Test
    void redirectsCallWithoutArguments() {
        String out = PassHarness.apply(pass, "console.log();");

        assertThat(squash(out)).isEqualTo("__debug(1);");
    }

    @Test
    @DisplayName("Nested console calls are both redirected")
    void redirectsNestedCalls() {
        String out = PassHarness.apply(pass, "console.log(console.log(1));");

        assertThat(squash(out)).isEqualTo("__debug(1, __debug(1, 1));");
    }

    @Test
    void leavesConsoleReferencesThatAreNotCalled() {
        String out = PassHarness.apply(pass, "const log = console.log;");

        assertThat(squash(out)).contains("console.log").doesNotContain("__debug");
    }

    @Test
    void leavesOtherReceiversAlone() {
        String out = PassHarness.apply(pass, "logger.log(1);");

        assertThat(squash(out)).isEqualTo("logger.log(1);");
    }
}
