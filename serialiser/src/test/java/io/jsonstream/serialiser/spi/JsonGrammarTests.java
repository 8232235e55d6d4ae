package io.jsonstream.serialiser.spi;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import io.jsonstream.serialiser.JsonGrammarException;
import io.jsonstream.serialiser.NodeKind;
import io.jsonstream.serialiser.spi.JsonGrammar.Separator;

class JsonGrammarTests {
    @Test
    void testInitialState() {
        final JsonGrammar grammar = new JsonGrammar();
        assertEquals(NodeKind.ROOT, grammar.parentNode());
        assertEquals(0, grammar.depth());
        assertFalse(grammar.isComplete());
        assertFalse(grammar.needsSeparator());
        assertEquals(Separator.NONE, grammar.separator());
        assertNotNull(grammar.toString());
    }

    @DisplayName("single scalar root value")
    @Test
    void testScalarRoot() {
        final JsonGrammar grammar = new JsonGrammar(4);
        assertEquals(Separator.NONE, grammar.enter(NodeKind.VALUE));
        assertEquals(NodeKind.VALUE, grammar.parentNode());
        grammar.endChild();
        assertTrue(grammar.isComplete());
        assertEquals(NodeKind.ROOT, grammar.parentNode());

        final JsonGrammarException exception = assertThrows(JsonGrammarException.class, () -> grammar.enter(NodeKind.VALUE));
        assertEquals(JsonGrammar.MULTIPLE_ROOTS, exception.getMessage());
        assertTrue(grammar.isComplete(), "rejected call leaves state untouched");
    }

    @ParameterizedTest(name = "terminal state rejects {0}")
    @EnumSource(value = NodeKind.class, names = { "OBJECT", "ARRAY", "KEY", "VALUE" })
    void testTerminalStateRejectsEverything(final NodeKind kind) {
        final JsonGrammar grammar = new JsonGrammar();
        grammar.enter(NodeKind.ARRAY);
        grammar.exit(NodeKind.ARRAY);
        assertTrue(grammar.isComplete());

        assertThrows(JsonGrammarException.class, () -> grammar.enter(kind));
        final JsonGrammarException exception = assertThrows(JsonGrammarException.class, () -> grammar.exit(NodeKind.ARRAY));
        assertEquals(JsonGrammar.MULTIPLE_ROOTS, exception.getMessage());
    }

    @Test
    void testArraySeparators() {
        final JsonGrammar grammar = new JsonGrammar();
        assertEquals(Separator.NONE, grammar.enter(NodeKind.ARRAY));
        assertFalse(grammar.needsSeparator());
        assertEquals(Separator.NONE, grammar.enter(NodeKind.VALUE));
        grammar.endChild();
        assertTrue(grammar.needsSeparator());
        assertEquals(Separator.ITEM, grammar.separator());
        assertEquals(Separator.ITEM, grammar.enter(NodeKind.VALUE));
        grammar.endChild();
        assertEquals(Separator.ITEM, grammar.enter(NodeKind.OBJECT)); // nested object as third element
        assertFalse(grammar.needsSeparator());
        grammar.exit(NodeKind.OBJECT);
        assertEquals(NodeKind.ARRAY, grammar.parentNode());
        assertTrue(grammar.needsSeparator());
        grammar.exit(NodeKind.ARRAY);
        assertTrue(grammar.isComplete());
    }

    @Test
    void testObjectMembers() {
        final JsonGrammar grammar = new JsonGrammar();
        grammar.enter(NodeKind.OBJECT);
        assertEquals(Separator.NONE, grammar.enter(NodeKind.KEY));
        assertEquals(NodeKind.KEY, grammar.parentNode());
        assertTrue(grammar.needsSeparator());
        assertEquals(Separator.KEY, grammar.separator());
        assertEquals(Separator.KEY, grammar.enter(NodeKind.VALUE));
        grammar.endChild();
        assertEquals(NodeKind.OBJECT, grammar.parentNode(), "key resolved by its value");

        assertEquals(Separator.ITEM, grammar.enter(NodeKind.KEY));
        assertEquals(Separator.KEY, grammar.enter(NodeKind.ARRAY));
        assertEquals(2, grammar.depth());
        grammar.exit(NodeKind.ARRAY);
        assertEquals(NodeKind.OBJECT, grammar.parentNode(), "key resolved by the closed container");
        assertEquals(1, grammar.depth());

        grammar.exit(NodeKind.OBJECT);
        assertTrue(grammar.isComplete());
        assertEquals(0, grammar.depth());
    }

    @Test
    void testIllegalSequences() {
        final JsonGrammar grammar = new JsonGrammar();
        assertThat(assertThrows(JsonGrammarException.class, () -> grammar.enter(NodeKind.KEY)).getMessage(), containsString("outside of an object"));
        assertThrows(JsonGrammarException.class, () -> grammar.enter(NodeKind.ROOT));
        assertThrows(JsonGrammarException.class, () -> grammar.exit(NodeKind.OBJECT));

        grammar.enter(NodeKind.ARRAY);
        assertThrows(JsonGrammarException.class, () -> grammar.enter(NodeKind.KEY));
        assertThrows(JsonGrammarException.class, () -> grammar.exit(NodeKind.OBJECT));
        assertThrows(JsonGrammarException.class, () -> grammar.exit(NodeKind.VALUE));

        grammar.enter(NodeKind.OBJECT);
        assertThat(assertThrows(JsonGrammarException.class, () -> grammar.enter(NodeKind.VALUE)).getMessage(), containsString("key is expected"));
        assertThrows(JsonGrammarException.class, () -> grammar.enter(NodeKind.ARRAY));
        assertThrows(JsonGrammarException.class, () -> grammar.enter(NodeKind.OBJECT));
        assertThrows(JsonGrammarException.class, () -> grammar.exit(NodeKind.ARRAY));

        grammar.enter(NodeKind.KEY);
        assertThat(assertThrows(JsonGrammarException.class, () -> grammar.enter(NodeKind.KEY)).getMessage(), containsString("awaits its value"));
        assertThrows(JsonGrammarException.class, () -> grammar.exit(NodeKind.OBJECT));

        // nothing of the above changed the state
        assertEquals(NodeKind.KEY, grammar.parentNode());
        assertEquals(3, grammar.depth());
    }

    @Test
    void testHasChildrenNeverReverts() {
        final NodeStack stack = new NodeStack(1);
        assertEquals(1, stack.size());
        assertEquals(NodeKind.ROOT, stack.top().getKind());
        stack.push(NodeKind.ARRAY);
        assertFalse(stack.top().hasChildren());
        stack.top().markChild();
        stack.top().markChild();
        assertTrue(stack.top().hasChildren());
        assertEquals(NodeKind.ARRAY, stack.pop().getKind());
        assertThrows(IllegalStateException.class, stack::pop, "root is never popped");
        assertEquals("[ROOT]", stack.toString());
    }

    @Test
    void testDeepNesting() {
        final JsonGrammar grammar = new JsonGrammar(0);
        final int depth = 1000;
        for (int i = 0; i < depth; i++) {
            assertEquals(Separator.NONE, grammar.enter(NodeKind.ARRAY)); // arrays nested as first element
        }
        assertEquals(depth, grammar.depth());
        for (int i = 0; i < depth; i++) {
            grammar.exit(NodeKind.ARRAY);
        }
        assertTrue(grammar.isComplete());
    }
}
