package io.qcheck.value;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;

class OrderedDocumentTest {

  private static OrderedDocument<Integer> abc() {
    return new OrderedDocument<Integer>().append("a", 1).append("b", 2).append("c", 3);
  }

  @Test
  void iteratesInInsertionOrder() {
    OrderedDocument<Integer> doc = abc();
    assertThat(doc.keys()).containsExactly("a", "b", "c");
    assertThat(doc.values()).containsExactly(1, 2, 3);
    List<String> seen = new ArrayList<>();
    for (Map.Entry<String, Integer> e : doc) {
      seen.add(e.getKey() + "=" + e.getValue());
    }
    assertThat(seen).containsExactly("a=1", "b=2", "c=3");
  }

  @Test
  void overwriteKeepsPosition() {
    OrderedDocument<Integer> doc = abc();
    assertThat(doc.put("a", 10)).isEqualTo(1);
    assertThat(doc.keys()).containsExactly("a", "b", "c");
    assertThat(doc.get("a")).isEqualTo(10);
  }

  @Test
  void removeAndContains() {
    OrderedDocument<Integer> doc = abc();
    assertThat(doc.remove("b")).isEqualTo(2);
    assertThat(doc.containsKey("b")).isFalse();
    assertThat(doc.remove("missing")).isNull();
    assertThat(doc.size()).isEqualTo(2);
  }

  @Test
  void equalityDependsOnOrder() {
    OrderedDocument<Integer> reversed =
        new OrderedDocument<Integer>().append("c", 3).append("b", 2).append("a", 1);
    assertThat(abc()).isEqualTo(abc()).hasSameHashCodeAs(abc());
    assertThat(abc()).isNotEqualTo(reversed);
    assertThat(abc().toMap()).isEqualTo(reversed.toMap());
  }

  @Test
  void copyIsIndependent() {
    OrderedDocument<Integer> doc = abc();
    OrderedDocument<Integer> copy = doc.copy();
    copy.put("d", 4);
    copy.remove("a");
    assertThat(doc).isEqualTo(abc());
  }

  @Test
  void deepCopyCopiesValues() {
    OrderedDocument<List<Integer>> doc = new OrderedDocument<>();
    doc.put("xs", new ArrayList<>(List.of(1, 2)));
    OrderedDocument<List<Integer>> copy = doc.deepCopy(ArrayList::new);
    copy.get("xs").add(3);
    assertThat(doc.get("xs")).containsExactly(1, 2);
    assertThat(copy.get("xs")).containsExactly(1, 2, 3);
  }

  @Test
  void putIfAbsentReturnsExistingOrInserted() {
    OrderedDocument<Integer> doc = abc();
    assertThat(doc.putIfAbsent("a", 99)).isEqualTo(1);
    assertThat(doc.putIfAbsent("z", 26)).isEqualTo(26);
    assertThat(doc.keys()).containsExactly("a", "b", "c", "z");
  }

  @Test
  void popFirstRemovesOldestEntry() {
    OrderedDocument<Integer> doc = abc();
    Map.Entry<String, Integer> first = doc.popFirst();
    assertThat(first.getKey()).isEqualTo("a");
    assertThat(first.getValue()).isEqualTo(1);
    assertThat(doc.keys()).containsExactly("b", "c");
  }

  @Test
  void popFirstOnEmptyThrows() {
    assertThatThrownBy(() -> new OrderedDocument<String>().popFirst())
        .isInstanceOf(NoSuchElementException.class);
  }

  @Test
  void nullValuesAreAllowedButNullKeysAreNot() {
    OrderedDocument<String> doc = new OrderedDocument<>();
    doc.put("k", null);
    assertThat(doc.containsKey("k")).isTrue();
    assertThat(doc.popFirst().getValue()).isNull();
    assertThatThrownBy(() -> doc.put(null, "v")).isInstanceOf(NullPointerException.class);
  }

  @Test
  void snapshotsAreUnmodifiable() {
    OrderedDocument<Integer> doc = abc();
    assertThatThrownBy(() -> doc.keys().add("x"))
        .isInstanceOf(UnsupportedOperationException.class);
    assertThatThrownBy(() -> doc.values().clear())
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void toStringQuotesKeysAndStrings() {
    OrderedDocument<Object> doc = new OrderedDocument<>();
    doc.put("a", 1);
    doc.put("b", "x");
    assertThat(doc).hasToString("{'a': 1, 'b': 'x'}");
  }
}
