import org.junit.jupiter.api.Test;

import com.ember.script.vars.GlobalVariables;
import com.ember.script.vars.VariableContext;
import com.ember.script.vars.VariableReplacer;
import com.ember.script.vars.VariableStore;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EmberVariablesTest {

    private final VariableReplacer replacer = new VariableReplacer();

    @Test
    void settingSameValue_notifiesOnce() {
        VariableStore store = new VariableStore();
        List<String> changes = new ArrayList<>();
        store.addListener((key, value) -> changes.add(key + "=" + value));

        store.set("hp", "10");
        store.set("hp", "10");
        store.set("hp", "9");
        store.remove("hp");
        store.remove("hp");

        assertEquals(List.of("hp=10", "hp=9", "hp=null"), changes);
    }

    @Test
    void store_basicOperations() {
        VariableStore store = new VariableStore();
        store.set("b", "2");
        store.set("a", "1");

        assertTrue(store.has("a"));
        assertEquals("1", store.get("a"));
        assertNull(store.get("missing"));
        assertEquals(2, store.count());
        assertEquals(List.of("a", "b"), new ArrayList<>(store.snapshot().keySet()));

        store.removeAll();
        assertEquals(0, store.count());
        assertThrows(IllegalArgumentException.class, () -> store.set(null, "x"));
    }

    @Test
    void globals_computeDateAndIgnoreWrites() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-05T10:15:30Z"), ZoneOffset.UTC);
        GlobalVariables globals = new GlobalVariables("yyyy-MM-dd", "HH:mm:ss", "yyyy-MM-dd HH:mm:ss", clock);

        assertEquals("2024-03-05", globals.get("date"));
        assertEquals("10:15:30", globals.get("time"));
        assertEquals("2024-03-05 10:15:30", globals.get("datetime"));

        globals.set("date", "yesterday");
        assertEquals("2024-03-05", globals.get("date"));
    }

    @Test
    void replace_withoutSigils_isIdentity() {
        VariableContext ctx = new VariableContext().add('$', new VariableStore());
        for (String text : List.of("", "plain text", "a | b [1] (2)", "100% sure")) {
            assertEquals(text, replacer.replace(text, ctx));
        }
    }

    @Test
    void indexedLookup() {
        VariableStore globals = new VariableStore();
        globals.set("list", "a|b|c");
        VariableContext ctx = new VariableContext().add('$', globals);

        assertEquals("b", replacer.replace("$list[1]", ctx));
        assertEquals("c", replacer.replace("$list(2)", ctx));
        assertEquals("$list[5]", replacer.replace("$list[5]", ctx));
        assertEquals("$nothing[0]", replacer.replace("$nothing[0]", ctx));
        assertEquals("first a then b", replacer.replace("first $list[0] then $list[1]", ctx));
    }

    @Test
    void indexFromAnotherVariable() {
        VariableStore globals = new VariableStore();
        VariableStore locals = new VariableStore();
        globals.set("list", "a|b|c");
        locals.set("i", "2");
        VariableContext ctx = new VariableContext().add('$', globals).add('%', locals);

        assertEquals("c", replacer.replace("$list[%i]", ctx));
    }

    @Test
    void unresolvedName_isShortenedFromTheRight() {
        VariableStore globals = new VariableStore();
        globals.set("weapon", "sword");
        VariableContext ctx = new VariableContext().add('$', globals);

        assertEquals("sword.skill", replacer.replace("$weapon.skill", ctx));
        assertEquals("I wield a swordsman", replacer.replace("I wield a $weaponsman", ctx));
        assertEquals("$armor stays", replacer.replace("$armor stays", ctx));
    }

    @Test
    void valuesMayReferenceOtherVariables() {
        VariableStore globals = new VariableStore();
        VariableStore locals = new VariableStore();
        globals.set("target", "goblin");
        locals.set("msg", "attack $target");
        VariableContext ctx = new VariableContext().add('$', globals).add('%', locals);

        assertEquals("attack goblin now", replacer.replace("%msg now", ctx));
    }

    @Test
    void selfReferenceStopsAtIterationLimit() {
        VariableStore locals = new VariableStore();
        locals.set("a", "x%a");
        VariableContext ctx = new VariableContext().add('%', locals);

        String result = replacer.replace("%a", ctx);
        assertTrue(result.startsWith("xxxxxxxxxxxxxxx"), result);
    }

    @Test
    void firstScopeWins() {
        VariableStore regex = new VariableStore();
        VariableStore globals = new VariableStore();
        regex.set("1", "captured");
        globals.set("1", "global");
        globals.set("name", "bob");
        VariableContext ctx = new VariableContext().add('$', regex).add('$', globals);

        assertEquals("captured bob", replacer.replace("$1 $name", ctx));
    }
}
