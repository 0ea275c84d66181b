import org.junit.jupiter.api.Test;

import com.ember.script.parser.ScriptExpression;
import com.ember.script.parser.ScriptToken;
import com.ember.script.parser.ScriptToken.Kind;
import com.ember.script.parser.ScriptTokenizer;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EmberScriptTokenizerTest {

    private final ScriptTokenizer tokenizer = new ScriptTokenizer();

    private ScriptToken read(String line) {
        ScriptToken token = tokenizer.read(line);
        assertNotNull(token, "Expected a token for: " + line);
        return token;
    }

    @Test
    void singleLineIf_hasConditionAndBody() {
        ScriptToken token = read("if 1==1 then echo hi");

        assertEquals(Kind.IF_SINGLE, token.kind());
        assertEquals(ScriptExpression.value("1==1"), token.expression());
        assertEquals(Kind.ECHO, token.body().kind());
        assertEquals("hi", token.body().text());
    }

    @Test
    void blockIf_thenClosingBrace() {
        ScriptToken open = read("if 1==1 {");
        assertEquals(Kind.IF, open.kind());
        assertEquals(ScriptExpression.value("1==1"), open.expression());

        assertEquals(Kind.RIGHT_BRACE, read("}").kind());
        assertEquals(Kind.LEFT_BRACE, read("{").kind());
    }

    @Test
    void ifWithoutBody_needsBrace() {
        assertEquals(Kind.IF_NEEDS_BRACE, read("if %1 == 2").kind());
        assertEquals(Kind.IF_NEEDS_BRACE, read("if %1 == 2 then").kind());
    }

    @Test
    void bracedSingleLineBody() {
        ScriptToken token = read("if %x > 1 then { put look }");
        assertEquals(Kind.IF_SINGLE, token.kind());
        assertEquals(Kind.PUT, token.body().kind());
        assertEquals("look", token.body().text());
    }

    @Test
    void elseForms() {
        assertEquals(Kind.ELSE, read("else {").kind());
        assertEquals(Kind.ELSE_NEEDS_BRACE, read("else").kind());
        assertEquals(Kind.ELSE_SINGLE, read("else echo no").kind());
        assertEquals(Kind.ELSE_IF, read("else if 2 > 1 {").kind());
        assertEquals(Kind.ELSE_IF_SINGLE, read("else if 2 > 1 then echo yes").kind());
        assertEquals(Kind.ELSE_IF_NEEDS_BRACE, read("elseif 2 > 1").kind());
    }

    @Test
    void closingBraceElse_isMarked() {
        ScriptToken token = read("} else {");
        assertEquals(Kind.ELSE, token.kind());
        assertTrue(token.hasLeadingBrace());

        ScriptToken elseIf = read("} else if %a == 1 {");
        assertEquals(Kind.ELSE_IF, elseIf.kind());
        assertTrue(elseIf.hasLeadingBrace());
        assertEquals(ScriptExpression.value("%a == 1"), elseIf.expression());

        assertFalse(read("else {").hasLeadingBrace());
    }

    @Test
    void ifArgForms() {
        ScriptToken single = read("if_2 echo two args");
        assertEquals(Kind.IF_ARG_SINGLE, single.kind());
        assertEquals(2, single.argCount());
        assertEquals("two args", single.body().text());

        assertEquals(Kind.IF_ARG, read("if_1 {").kind());
        assertEquals(Kind.IF_ARG_NEEDS_BRACE, read("if_1").kind());
        assertEquals(Kind.IF_ARG_SINGLE, read("if_3 then goto start").kind());

        ScriptToken elseIfArg = read("else if_2 then echo x");
        assertEquals(Kind.ELSE_IF_SINGLE, elseIfArg.kind());
        assertEquals(ScriptExpression.value("%argcount >= 2"), elseIfArg.expression());
    }

    @Test
    void functionCondition_isParsed() {
        ScriptToken token = read("if contains(\"%list\", \"a, b\") then echo found");
        ScriptExpression.Function fn = (ScriptExpression.Function) token.expression();
        assertEquals("contains", fn.name);
        assertEquals(List.of("\"%list\"", "\"a, b\""), fn.args);
    }

    @Test
    void labelsAndComments() {
        ScriptToken label = read("my.label-1:");
        assertEquals(Kind.LABEL, label.kind());
        assertEquals("my.label-1", label.text());

        ScriptToken comment = read("# just a note");
        assertEquals(Kind.COMMENT, comment.kind());
        assertEquals("# just a note", comment.text());
    }

    @Test
    void blankAndUnknownLines_yieldNull() {
        assertNull(tokenizer.read(""));
        assertNull(tokenizer.read("   "));
        assertNull(tokenizer.read("dance wildly"));
        assertNull(tokenizer.read("echoes nothing"));
        assertNull(tokenizer.read("{ echo x"));
    }

    @Test
    void commandsAreCaseInsensitive() {
        assertEquals(Kind.ECHO, read("ECHO hi").kind());
        assertEquals(Kind.GOTO, read("GoTo start").kind());
    }

    @Test
    void commandPayloads() {
        ScriptToken goTo = read("goto attack %1 \"big rat\"");
        assertEquals(Kind.GOTO, goTo.kind());
        assertEquals("attack", goTo.value(0));
        assertEquals("%1 \"big rat\"", goTo.value(1));

        ScriptToken var = read("setvariable weapon broadsword");
        assertEquals(Kind.VARIABLE, var.kind());
        assertEquals("weapon", var.value(0));
        assertEquals("broadsword", var.value(1));

        ScriptToken math = read("math count ADD 2");
        assertEquals(Kind.MATH, math.kind());
        assertEquals(List.of("count", "add", "2"), math.values());

        ScriptToken random = read("random 1 10");
        assertEquals(List.of("1", "10"), random.values());

        ScriptToken match = read("matchre done ^You (finish|stop)");
        assertEquals(Kind.MATCHRE, match.kind());
        assertEquals("done", match.value(0));
        assertEquals("^You (finish|stop)", match.value(1));

        assertEquals(Kind.WAITFOR_PROMPT, read("wait").kind());
        assertEquals(Kind.NEXTROOM, read("nextroom").kind());
        assertEquals(Kind.RETURN, read("return").kind());
    }

    @Test
    void evalCarriesExpression() {
        ScriptToken eval = read("eval total 1 + 2");
        assertEquals(Kind.EVAL, eval.kind());
        assertEquals("total", eval.value(0));
        assertEquals(ScriptExpression.value("1 + 2"), eval.expression());

        ScriptToken evalFn = read("evalmath len length(\"abc\")");
        assertEquals(Kind.EVAL_MATH, evalFn.kind());
        assertTrue(evalFn.expression() instanceof ScriptExpression.Function);
    }

    @Test
    void actionForms() {
        ScriptToken action = read("action (combat) put attack; echo hit $1 when ^(\\w+) lunges");
        assertEquals(Kind.ACTION, action.kind());
        assertEquals("combat", action.value(0));
        assertEquals("put attack; echo hit $1", action.value(1));
        assertEquals("^(\\w+) lunges", action.value(2));
        assertNull(action.expression());

        ScriptToken evalAction = read("action echo low when eval $hp < 5");
        assertEquals(Kind.ACTION, evalAction.kind());
        assertEquals("", evalAction.value(0));
        assertEquals(ScriptExpression.value("$hp < 5"), evalAction.expression());

        ScriptToken toggle = read("action (combat) off");
        assertEquals(Kind.ACTION_TOGGLE, toggle.kind());
        assertEquals(List.of("combat", "off"), toggle.values());

        assertNull(tokenizer.read("action echo missing trigger"));
    }
}
