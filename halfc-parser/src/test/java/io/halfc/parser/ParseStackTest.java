package io.halfc.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParseStackTest {

    @Test
    void testPushAndPop() {
        ParseStack stack = new ParseStack(4);
        stack.push(0, null, null);
        stack.push(3, "a", null);
        stack.push(5, "b", null);
        assertEquals(5, stack.topState());
        assertEquals("b", stack.topValue());
        assertEquals(List.of("a", "b"), stack.pop(2));
        assertEquals(1, stack.size());
        assertEquals(0, stack.topState());
        assertEquals(3, stack.getMaxSize());
        assertThrows(IllegalStateException.class, () -> stack.pop(1));
    }

    @Test
    void testOverflow() {
        ParseStack stack = new ParseStack(2);
        stack.push(0, null, null);
        stack.push(1, null, null);
        ParseStackOverflowException e = assertThrows(ParseStackOverflowException.class,
                () -> stack.push(2, null, null));
        assertEquals("parse stack overflow, more than 2 entries", e.getMessage());
        assertEquals(2, stack.size());
        assertThrows(IllegalArgumentException.class, () -> new ParseStack(0));
    }

    @Test
    void testTruncate() {
        ParseStack stack = new ParseStack();
        assertEquals(ParseStack.DEFAULT_CAPACITY, stack.capacity());
        for (int i = 0; i < 5; i++) {
            stack.push(i, i, null);
        }
        stack.truncate(2);
        assertEquals(2, stack.size());
        assertEquals(1, stack.topValue());
        assertArrayEquals(new int[]{0, 1}, stack.copyStates());
        assertEquals(1, stack.state(1));
    }

}
