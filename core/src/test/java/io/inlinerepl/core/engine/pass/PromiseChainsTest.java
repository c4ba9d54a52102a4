package io.inlinerepl.core.engine.pass;

import static org.assertj.core.api.Assertions.assertThat;

import io.inlinerepl.core.engine.ast.JsFrontEnd;
import org.junit.jupiter.api.Test;
import org.mozilla.javascript.ast.AstNode;
import org.mozilla.javascript.ast.ExpressionStatement;

class PromiseChainsTest {

    private static AstNode expression(String source) {
        return ((ExpressionStatement) JsFrontEnd.parseStatement(source)).getExpression();
    }

    @Test
    void recognizesChainLinks() {
        assertThat(PromiseChains.isChainLink(expression("p.then(f);"))).isTrue();
        assertThat(PromiseChains.isChainLink(expression("p.catch(f);"))).isTrue();
        assertThat(PromiseChains.isChainLink(expression("p.finally(f);"))).isTrue();
        assertThat(PromiseChains.isChainLink(expression("p.map(f);"))).isFalse();
        assertThat(PromiseChains.isChainLink(expression("then(f);"))).isFalse();
    }

    @Test
    void rootOfMixedChainIsTheFirstReceiver() {
        AstNode target = PromiseChains.captureTarget(expression("a.b().then(f).catch(x => console.warn(x));"));

        assertThat(target.toSource()).isEqualTo("a.b()");
    }

    @Test
    void consoleInAnyLinkSelectsTheRoot() {
        AstNode target = PromiseChains.captureTarget(expression("p.then(v => console.log(v)).then(g).then(h);"));

        assertThat(target.toSource()).isEqualTo("p");
    }

    @Test
    void nonChainExpressionIsItsOwnTarget() {
        AstNode expression = expression("f(console.log);");

        assertThat((Object) PromiseChains.captureTarget(expression)).isSameAs(expression);
    }

    @Test
    void chainWithoutConsoleIsItsOwnTarget() {
        AstNode expression = expression("p.then(f).catch(g);");

        assertThat((Object) PromiseChains.captureTarget(expression)).isSameAs(expression);
    }
}
