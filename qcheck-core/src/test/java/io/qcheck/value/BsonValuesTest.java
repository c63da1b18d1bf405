package io.qcheck.value;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDateTime;
import java.util.Date;
import java.util.List;
import java.util.Map;
import org.bson.BsonRegularExpression;
import org.bson.Document;
import org.bson.types.Binary;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

class BsonValuesTest {

  @Test
  void scalarsMapToBsonObjectModel() {
    assertThat(BsonValues.toBson(Value.nullValue())).isNull();
    assertThat(BsonValues.toBson(Value.of(true))).isEqualTo(Boolean.TRUE);
    assertThat(BsonValues.toBson(Value.of(7))).isEqualTo(7);
    assertThat(BsonValues.toBson(Value.of(1L << 40))).isEqualTo(1L << 40);
    assertThat(BsonValues.toBson(Value.of(1.5))).isEqualTo(1.5d);
    assertThat(BsonValues.toBson(Value.of("s"))).isEqualTo("s");
    assertThat(BsonValues.toBson(Value.of(new byte[] {1, 2})))
        .isEqualTo(new Binary(new byte[] {1, 2}));
  }

  @Test
  void timestampsAreUtcDates() {
    LocalDateTime t = LocalDateTime.of(1970, 1, 1, 0, 0, 1, 5_000_000);
    assertThat(BsonValues.toBson(Value.of(t))).isEqualTo(new Date(1005L));
    assertThat(BsonValues.fromBson(new Date(1005L))).isEqualTo(Value.of(t));
  }

  @Test
  void referencesBecomeRefIdDocuments() {
    Object bson = BsonValues.toBson(Value.reference("users", Value.of(3)));
    assertThat(bson).isEqualTo(new Document("$ref", "users").append("$id", 3));
    assertThat(BsonValues.isReference((Map<?, ?>) bson)).isTrue();
    assertThat(BsonValues.fromBson(bson)).isEqualTo(Value.reference("users", Value.of(3)));
  }

  @Test
  void refIdInOtherOrderIsAPlainDocument() {
    Document doc = new Document("$id", 3).append("$ref", "users");
    assertThat(BsonValues.isReference(doc)).isFalse();
    assertThat(BsonValues.fromBson(doc)).isInstanceOf(Value.DocumentValue.class);
  }

  @Test
  void containersConvertBothWays() {
    ObjectId id = new ObjectId();
    BsonRegularExpression regex = new BsonRegularExpression("aa", "i");
    Value.DocumentValue value =
        Value.document(
            new OrderedDocument<Value>()
                .append("id", Value.of(id))
                .append("re", new Value.RegexValue(regex))
                .append("xs", Value.sequence(Value.of(1), Value.nullValue())));
    Document bson = BsonValues.toDocument(value);
    assertThat(bson.keySet()).containsExactly("id", "re", "xs");
    assertThat(bson.get("xs")).isEqualTo(java.util.Arrays.asList(1, null));
    assertThat(BsonValues.fromBson(bson)).isEqualTo(value);
  }

  @Test
  void decodedIntegersAndLongsBecomeIntValues() {
    assertThat(BsonValues.fromBson(5)).isEqualTo(Value.of(5));
    assertThat(BsonValues.fromBson(5L)).isEqualTo(Value.of(5));
    assertThat(BsonValues.fromBson(new byte[] {9})).isEqualTo(Value.of(new byte[] {9}));
    assertThat(BsonValues.fromBson(List.of("a"))).isEqualTo(Value.sequence(Value.of("a")));
  }

  @Test
  void unsupportedObjectsAreRejected() {
    assertThatThrownBy(() -> BsonValues.fromBson(new StringBuilder("x")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("java.lang.StringBuilder");
  }
}
