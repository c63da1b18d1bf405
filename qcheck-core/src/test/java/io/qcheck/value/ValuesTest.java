package io.qcheck.value;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class ValuesTest {

  private static Value.DocumentValue nested() {
    return Value.document(
        new OrderedDocument<Value>()
            .append("n", Value.of(1))
            .append("xs", Value.sequence(Value.of("a"), Value.sequence()))
            .append("ref", Value.reference("c", Value.sequence(Value.of(true)))));
  }

  @Test
  void depthOfLeavesAndContainers() {
    assertEquals(0, Values.depth(Value.of(1)));
    assertEquals(0, Values.depth(Value.nullValue()));
    assertEquals(1, Values.depth(Value.sequence()));
    assertEquals(3, Values.depth(nested()));
  }

  @Test
  void referencesCountAsLeaves() {
    assertEquals(0, Values.depth(Value.reference("c", Value.sequence(Value.of(1)))));
    assertEquals(1, Values.size(Value.reference("c", Value.sequence(Value.of(1)))));
  }

  @Test
  void depthOfPlainContainers() {
    assertEquals(2, Values.depth(List.of(List.of(1), 2)));
    assertEquals(1, Values.depth(new OrderedDocument<Integer>().append("a", 1)));
    assertEquals(0, Values.depth("text"));
  }

  @Test
  void sizeCountsNodes() {
    assertEquals(1, Values.size(Value.of(1)));
    assertEquals(3, Values.size(Value.sequence(Value.of(1), Value.of(2))));
    // root, n, xs, 'a', [], ref
    assertEquals(6, Values.size(nested()));
  }

  @Test
  void getFollowsKeysAndIndices() {
    assertEquals(Value.of("a"), Values.get(nested(), "xs", 0));
    assertEquals(Value.of(1), Values.get(nested(), "n"));
    assertSame(Value.nullValue(), Values.get(Value.nullValue()));
  }

  @Test
  void getReturnsNullForUnreachablePaths() {
    assertNull(Values.get(nested(), "missing"));
    assertNull(Values.get(nested(), "xs", 5));
    assertNull(Values.get(nested(), "n", 0));
    assertNull(Values.get(nested(), 0));
  }

  @Test
  void getRejectsUnsupportedSegments() {
    assertThrows(IllegalArgumentException.class, () -> Values.get(nested(), 1.5));
  }

  @Test
  void reprQuotesAndEscapes() {
    assertEquals("'it\\'s\\n'", Values.repr("it's\n"));
    assertEquals("b'a\\x00'", Values.repr(new byte[] {'a', 0}));
    assertEquals("[1, 'x', null]", Values.repr(java.util.Arrays.asList(1, "x", null)));
    assertEquals("null", Values.repr(null));
  }

  @Test
  void valueToStringUsesRepr() {
    assertEquals("{'n': 1, 'xs': ['a', []], 'ref': DBRef('c', [true])}", nested().toString());
    assertEquals("Binary(b'ab', 0)", Value.of(new byte[] {'a', 'b'}).toString());
  }
}
