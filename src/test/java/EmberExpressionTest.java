import org.junit.jupiter.api.Test;

import com.ember.script.expr.DefaultExpressionHost;
import com.ember.script.expr.EvalResult;
import com.ember.script.expr.ExpressionException;
import com.ember.script.expr.ExpressionResult;
import com.ember.script.expr.Numbers;
import com.ember.script.expr.ScriptEvaluator;
import com.ember.script.expr.ScriptFunctions;
import com.ember.script.parser.ExpressionTokenizer;
import com.ember.script.parser.ScriptExpression;
import com.ember.script.plugins.StringFunctionsPlugin;

import java.util.List;
import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.*;

public class EmberExpressionTest {

    private static final UnaryOperator<String> NO_VARS = UnaryOperator.identity();

    private final ScriptFunctions functions = new ScriptFunctions();
    private final DefaultExpressionHost host = new DefaultExpressionHost(functions);
    private final ScriptEvaluator evaluator = new ScriptEvaluator(host, functions);
    private final ExpressionTokenizer tokenizer = new ExpressionTokenizer();

    EmberExpressionTest() {
        StringFunctionsPlugin.register(functions);
    }

    private ScriptExpression expr(String text) {
        return tokenizer.tokenize(text).expression;
    }

    private boolean bool(String text) {
        return evaluator.evaluateBool(expr(text), NO_VARS).isTrue();
    }

    // ===================== tokenizer =====================

    @Test
    void tokenizer_splitsConditionFromRest() {
        ExpressionTokenizer.Result then = tokenizer.tokenize("%a > 1 then echo big");
        assertEquals(ScriptExpression.value("%a > 1"), then.expression);
        assertEquals("echo big", then.rest);
        assertTrue(then.hadThen);

        ExpressionTokenizer.Result brace = tokenizer.tokenize("\"{x}\" == %b {");
        assertEquals(ScriptExpression.value("\"{x}\" == %b"), brace.expression);
        assertEquals("{", brace.rest);
        assertFalse(brace.hadThen);
    }

    @Test
    void tokenizer_mixesFunctionsAndText() {
        ScriptExpression e = expr("len(%name) > 3");
        assertTrue(e instanceof ScriptExpression.Sequence);
        List<ScriptExpression> parts = ((ScriptExpression.Sequence) e).parts;
        assertEquals(ScriptExpression.function("len", List.of("%name")), parts.get(0));
        assertEquals(ScriptExpression.value("> 3"), parts.get(1));

        assertEquals(ScriptExpression.value("%a >= 2"), expr("%a > = 2"));
        assertEquals(ScriptExpression.value(""), expr("   "));
    }

    // ===================== host =====================

    @Test
    void host_arithmeticAndPrecedence() throws ExpressionException {
        assertEquals(14.0, host.evaluate("2 + 3 * 4").value());
        assertEquals(20.0, host.evaluate("(2 + 3) * 4").value());
        assertEquals(2.0, host.evaluate("10 % 4").value());
        assertEquals(-3.0, host.evaluate("-3").value());
        assertEquals("ab", host.evaluate("\"a\" + \"b\"").value());
    }

    @Test
    void host_comparisonsAndLogic() throws ExpressionException {
        assertEquals(true, host.evaluate("1 < 2 && 3 >= 3").value());
        assertEquals(true, host.evaluate("1 > 2 || !false").value());
        assertEquals(true, host.evaluate("5 = 5.0").value());
        assertEquals(false, host.evaluate("one == two").value());
        assertEquals(true, host.evaluate("north == north").value());
        assertEquals(true, host.evaluate("\"a b\" != \"a c\"").value());
        assertEquals(true, host.evaluate("true == yes").value());
    }

    @Test
    void host_errors() {
        assertThrows(ExpressionException.class, () -> host.evaluate("1 / 0"));
        assertThrows(ExpressionException.class, () -> host.evaluate("goblin > 3"));
        assertThrows(ExpressionException.class, () -> host.evaluate("(1 + 2"));
        assertThrows(ExpressionException.class, () -> host.evaluate("nosuchfn(1)"));
        assertThrows(ExpressionException.class, () -> host.evaluate(""));
    }

    // ===================== evaluator =====================

    @Test
    void evaluateBool_defaultsToFalseOnFailure() {
        assertTrue(bool("1==1"));
        assertFalse(bool("1==2"));
        assertFalse(bool("goblin > 3"));
        assertFalse(bool(""));
        assertTrue(bool("yes"));
        assertFalse(bool("off"));
    }

    @Test
    void evaluateBool_usesReplacer() {
        UnaryOperator<String> vars = text -> text.replace("%hp", "12");
        assertTrue(evaluator.evaluateBool(expr("%hp > 10"), vars).isTrue());
        assertEquals("12 > 10", evaluator.evaluateBool(expr("%hp > 10"), vars).text);
    }

    @Test
    void evaluateValue_numbersOnly() {
        assertEquals("2", evaluator.evaluateValue(expr("1+1"), NO_VARS).result);
        assertEquals("2.5", evaluator.evaluateValue(expr("5 / 2"), NO_VARS).result);
        assertEquals("0", evaluator.evaluateValue(expr("\"a\" + \"b\""), NO_VARS).result);
        assertEquals("0", evaluator.evaluateValue(expr("1 / 0"), NO_VARS).result);
        assertEquals("3", evaluator.evaluateValue(expr("len(\"abc\")"), NO_VARS).result);
    }

    @Test
    void evaluateStrValue() {
        assertEquals("2", evaluator.evaluateStrValue(expr("1 + 1"), NO_VARS).result);
        assertEquals("ab", evaluator.evaluateStrValue(expr("\"a\" + \"b\""), NO_VARS).result);
        assertEquals("HELLO", evaluator.evaluateStrValue(expr("toupper(\"hello\")"), NO_VARS).result);
        assertEquals("", evaluator.evaluateStrValue(expr("1 +"), NO_VARS).result);
    }

    @Test
    void functionInsideCondition() {
        UnaryOperator<String> vars = text -> text.replace("%name", "goblin");
        assertTrue(evaluator.evaluateBool(expr("len(\"%name\") > 3"), vars).isTrue());
        assertTrue(evaluator.evaluateBool(expr("contains(\"%name\", \"gob\")"), vars).isTrue());
        assertFalse(evaluator.evaluateBool(expr("startswith(\"%name\", \"orc\")"), vars).isTrue());
    }

    @Test
    void matchre_publishesGroups() {
        EvalResult result = evaluator.evaluateBool(
                expr("matchre(\"You see a goblin\", \"see an? (\\w+)\")"), NO_VARS);
        assertTrue(result.isTrue());
        assertEquals(List.of("see a goblin", "goblin"), result.groups);

        EvalResult miss = evaluator.evaluateBool(expr("matchre(\"nothing\", \"(\\d+)\")"), NO_VARS);
        assertFalse(miss.isTrue());
        assertTrue(miss.groups.isEmpty());
    }

    @Test
    void customFunctions() {
        functions.register("Double", args -> ExpressionResult.of(Double.parseDouble(args.get(0)) * 2));
        assertEquals("8", evaluator.evaluateValue(expr("double(4)"), NO_VARS).result);
        assertTrue(functions.has("DOUBLE"));
    }

    @Test
    void stringFunctions() throws ExpressionException {
        assertEquals("bc", functions.call("substring", List.of("abcd", "1", "3")).value());
        assertEquals("cd", functions.call("substring", List.of("abcd", "2")).value());
        assertEquals("a-b-c", functions.call("replace", List.of("a b c", " ", "-")).value());
        assertEquals("go", functions.call("replacere", List.of("go north", " \\w+$", "")).value());
        assertEquals(3.0, functions.call("countsplit", List.of("a|b|c", "|")).value());
        assertEquals(2.0, functions.call("count", List.of("abcabc", "bc")).value());
        assertEquals(1.0, functions.call("indexof", List.of("abc", "b")).value());
        assertEquals("x", functions.call("trim", List.of("  x ")).value());
        assertThrows(ExpressionException.class, () -> functions.call("len", List.of()));
        assertThrows(ExpressionException.class, () -> functions.call("matchre", List.of("a", "(")));
    }

    @Test
    void numbers() {
        assertEquals("2", Numbers.format(2.0));
        assertEquals("6.5", Numbers.format(6.5));
        assertEquals("0.33", Numbers.formatRounded(1.0 / 3));
        assertEquals("3", Numbers.formatRounded(2.999));
        assertNull(Numbers.parse("Infinity"));
        assertNull(Numbers.parse("0x10"));
        assertEquals(-1.5, Numbers.parse(" -1.5 "));
        assertEquals(Boolean.TRUE, Numbers.toBool("ON"));
        assertNull(Numbers.toBool("maybe"));
    }
}
