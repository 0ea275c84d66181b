import org.junit.jupiter.api.Test;

import com.ember.script.parser.ScriptLine;
import com.ember.script.runtime.ScriptContext;
import com.ember.script.vars.VariableStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class EmberContextTest {

    private static ScriptContext context(String... lines) {
        List<ScriptLine> parsed = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) parsed.add(new ScriptLine(lines[i], "t", i + 1));
        return new ScriptContext("t", parsed, Map.of(), new VariableStore());
    }

    @Test
    void shift_dropsFirstArgument() {
        ScriptContext ctx = context();
        ctx.setArgumentVars(List.of("one", "two"));
        ctx.shiftArgs();

        assertEquals(List.of("two"), ctx.args());
        assertEquals("two", ctx.replaceVars("%1"));
        assertEquals("two", ctx.replaceVars("%0"));
        assertEquals("1", ctx.replaceVars("%argcount"));
        for (int i = 2; i <= 9; i++) {
            assertEquals("", ctx.replaceVars("%" + i), "%" + i);
        }
    }

    @Test
    void shift_withoutArguments_isNoop() {
        ScriptContext ctx = context();
        ctx.setArgumentVars(List.of());
        ctx.shiftArgs();
        assertTrue(ctx.args().isEmpty());
        assertEquals("0", ctx.replaceVars("%argcount"));
    }

    @Test
    void argumentQuotesAreTrimmed() {
        ScriptContext ctx = context();
        ctx.setArgumentVars(List.of("\"big rat\"", "x"));

        assertEquals("big rat", ctx.replaceVars("%1"));
        assertEquals("big rat x", ctx.replaceVars("%0"));
    }

    @Test
    void labelVars_visibleThroughDollarAndAmpersand() {
        ScriptContext ctx = context();
        ctx.setLabelVars("a \"b c\"", List.of("a", "\"b c\""));

        assertEquals("a", ctx.replaceVars("$1"));
        assertEquals("b c", ctx.replaceVars("&2"));
        assertEquals("a \"b c\"", ctx.replaceVars("&0"));
    }

    @Test
    void actionVars_onlyInActionScope() {
        ScriptContext ctx = context();
        ctx.setActionVars(List.of("Bob hits", "Bob"));

        assertEquals("hit Bob", ctx.replaceActionVars("hit $1"));
        assertEquals("hit $1", ctx.replaceVars("hit $1"));
    }

    @Test
    void regexVarsShadowGlobals() {
        VariableStore globals = new VariableStore();
        globals.set("1", "global");
        ScriptContext ctx = new ScriptContext("t", List.of(), Map.of(), globals);

        assertEquals("global", ctx.replaceVars("$1"));
        ctx.setRegexVars(List.of("whole", "group"));
        assertEquals("group", ctx.replaceVars("$1"));
    }

    @Test
    void advanceToNextBlock_skipsNestedBlocks() {
        ScriptContext ctx = context("if 1 == 2 {", "if 3 == 3 {", "echo a", "}", "}", "echo b");
        ctx.advance();
        ctx.ifStack().push(ctx.currentLine());

        assertTrue(ctx.advanceToNextBlock());
        assertEquals(3, ctx.currentLineNumber());
        assertEquals(1, ctx.ifStack().size());
        assertEquals("}", ctx.peekNextLine().originalText());
    }

    @Test
    void advanceToNextBlock_stopsBeforeClosingElse() {
        ScriptContext ctx = context("if 1 == 2 {", "echo a", "} else {", "echo b", "}");
        ctx.advance();
        ctx.ifStack().push(ctx.currentLine());

        assertTrue(ctx.advanceToNextBlock());
        assertEquals("} else {", ctx.peekNextLine().originalText());
    }

    @Test
    void advanceToNextBlock_unterminated() {
        ScriptContext ctx = context("if x {", "if y {", "echo");
        ctx.advance();
        ctx.ifStack().push(ctx.currentLine());

        assertFalse(ctx.advanceToNextBlock());
        assertEquals(1, ctx.ifStack().size());
        assertNull(ctx.currentLine());
    }

    @Test
    void programCounter_stopsOnePastTheEnd() {
        ScriptContext ctx = context("echo a");
        assertEquals(-1, ctx.currentLineNumber());

        ctx.advance();
        assertEquals(0, ctx.currentLineNumber());
        ctx.advance();
        ctx.advance();

        assertEquals(1, ctx.currentLineNumber());
        assertNull(ctx.currentLine());
        assertNull(ctx.peekNextLine());
    }
}
