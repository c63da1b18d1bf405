package io.qcheck.value;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.bson.BsonRegularExpression;
import org.bson.types.Binary;
import org.bson.types.ObjectId;

/**
 * A generated document value.
 *
 * <p>The set of variants is closed: scalars, byte strings with a subtype tag, naive timestamps,
 * object identifiers, regular expressions, ordered sequences, ordered documents and references
 * into another collection. Containers never hold Java {@code null}; the absence of a value is
 * {@link NullValue}.
 *
 * <p>All variants are immutable. {@link DocumentValue} copies the document it is given and hands
 * out copies, so a value can be shared between an original counterexample and its shrunk
 * candidates.
 */
public sealed interface Value
    permits Value.NullValue,
        Value.BooleanValue,
        Value.IntValue,
        Value.FloatValue,
        Value.TextValue,
        Value.BytesValue,
        Value.TimestampValue,
        Value.IdentifierValue,
        Value.RegexValue,
        Value.SequenceValue,
        Value.DocumentValue,
        Value.ReferenceValue {

  /** Tag of each variant. */
  enum Kind {
    NULL,
    BOOLEAN,
    INT,
    FLOAT,
    TEXT,
    BYTES,
    TIMESTAMP,
    IDENTIFIER,
    REGEX,
    SEQUENCE,
    DOCUMENT,
    REFERENCE;

    /** Whether values of this kind hold other values that the shrinker may remove. */
    public boolean isContainer() {
      return this == SEQUENCE || this == DOCUMENT;
    }
  }

  Kind kind();

  static NullValue nullValue() {
    return NullValue.INSTANCE;
  }

  static BooleanValue of(boolean value) {
    return new BooleanValue(value);
  }

  static IntValue of(long value) {
    return new IntValue(value);
  }

  static FloatValue of(double value) {
    return new FloatValue(value);
  }

  static TextValue of(String value) {
    return new TextValue(value);
  }

  static BytesValue of(byte[] data) {
    return new BytesValue(data);
  }

  static TimestampValue of(LocalDateTime value) {
    return new TimestampValue(value);
  }

  static IdentifierValue of(ObjectId id) {
    return new IdentifierValue(id);
  }

  static SequenceValue sequence(Value... elements) {
    return new SequenceValue(Arrays.asList(elements));
  }

  static DocumentValue document(OrderedDocument<Value> document) {
    return new DocumentValue(document);
  }

  static ReferenceValue reference(String collection, Value id) {
    return new ReferenceValue(collection, id);
  }

  /** The null value. */
  record NullValue() implements Value {
    public static final NullValue INSTANCE = new NullValue();

    @Override
    public Kind kind() {
      return Kind.NULL;
    }

    @Override
    public String toString() {
      return "null";
    }
  }

  record BooleanValue(boolean value) implements Value {
    @Override
    public Kind kind() {
      return Kind.BOOLEAN;
    }

    @Override
    public String toString() {
      return Boolean.toString(value);
    }
  }

  /** Signed integer; stored as 64 bits, encoded as 32 bits when it fits. */
  record IntValue(long value) implements Value {
    @Override
    public Kind kind() {
      return Kind.INT;
    }

    public boolean fitsInInt() {
      return value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
    }

    @Override
    public String toString() {
      return Long.toString(value);
    }
  }

  record FloatValue(double value) implements Value {
    @Override
    public Kind kind() {
      return Kind.FLOAT;
    }

    @Override
    public String toString() {
      return Double.toString(value);
    }
  }

  record TextValue(String value) implements Value {
    public TextValue {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public Kind kind() {
      return Kind.TEXT;
    }

    @Override
    public String toString() {
      return Values.repr(value);
    }
  }

  /** Byte string with a BSON binary subtype. */
  record BytesValue(Binary binary) implements Value {
    public BytesValue {
      Objects.requireNonNull(binary, "binary");
    }

    public BytesValue(byte[] data) {
      this(new Binary(Objects.requireNonNull(data, "data")));
    }

    public byte[] data() {
      return binary.getData().clone();
    }

    public byte subtype() {
      return binary.getType();
    }

    @Override
    public Kind kind() {
      return Kind.BYTES;
    }

    @Override
    public String toString() {
      return "Binary(" + Values.repr(binary.getData()) + ", " + (binary.getType() & 0xFF) + ")";
    }
  }

  /** Timezone-less instant at millisecond resolution. */
  record TimestampValue(LocalDateTime value) implements Value {
    public TimestampValue {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public Kind kind() {
      return Kind.TIMESTAMP;
    }

    @Override
    public String toString() {
      return "datetime(" + value + ")";
    }
  }

  record IdentifierValue(ObjectId id) implements Value {
    public IdentifierValue {
      Objects.requireNonNull(id, "id");
    }

    @Override
    public Kind kind() {
      return Kind.IDENTIFIER;
    }

    @Override
    public String toString() {
      return "ObjectId('" + id.toHexString() + "')";
    }
  }

  record RegexValue(BsonRegularExpression regex) implements Value {
    public RegexValue {
      Objects.requireNonNull(regex, "regex");
    }

    @Override
    public Kind kind() {
      return Kind.REGEX;
    }

    @Override
    public String toString() {
      return "/" + regex.getPattern() + "/" + regex.getOptions();
    }
  }

  /** Ordered sequence of values. */
  record SequenceValue(List<Value> elements) implements Value {
    public SequenceValue {
      elements = List.copyOf(elements);
    }

    public int size() {
      return elements.size();
    }

    @Override
    public Kind kind() {
      return Kind.SEQUENCE;
    }

    @Override
    public String toString() {
      return elements.toString();
    }
  }

  /** Ordered document of values. */
  record DocumentValue(OrderedDocument<Value> document) implements Value {
    public DocumentValue {
      document = document.copy();
      for (Value v : document.values()) {
        Objects.requireNonNull(v, "document values must not be null, use Value.nullValue()");
      }
    }

    /** Returns a copy; modifying it does not affect this value. */
    @Override
    public OrderedDocument<Value> document() {
      return document.copy();
    }

    public Value get(String key) {
      return document.get(key);
    }

    public boolean containsKey(String key) {
      return document.containsKey(key);
    }

    public List<String> keys() {
      return document.keys();
    }

    public int size() {
      return document.size();
    }

    @Override
    public Kind kind() {
      return Kind.DOCUMENT;
    }

    @Override
    public String toString() {
      return document.toString();
    }
  }

  /** Reference to a value in another collection. Never simplified by the shrinker. */
  record ReferenceValue(String collection, Value id) implements Value {
    public ReferenceValue {
      Objects.requireNonNull(collection, "collection");
      Objects.requireNonNull(id, "id");
    }

    @Override
    public Kind kind() {
      return Kind.REFERENCE;
    }

    @Override
    public String toString() {
      return "DBRef(" + Values.repr(collection) + ", " + id + ")";
    }
  }
}
