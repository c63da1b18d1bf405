package io.qcheck.value;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;
import org.bson.BsonRegularExpression;
import org.bson.Document;
import org.bson.types.Binary;
import org.bson.types.ObjectId;

/**
 * Bridge between {@link Value} and the object model of the {@code org.bson} library, so a
 * generated value can be handed to a BSON codec and the decoded result compared with the original.
 *
 * <p>References are represented the way MongoDB stores them: an embedded document whose first two
 * keys are {@value #REF_KEY} and {@value #ID_KEY}. Timestamps are treated as UTC.
 */
public final class BsonValues {
  /** Reserved key naming the referenced collection. */
  public static final String REF_KEY = "$ref";

  /** Reserved key holding the referenced id. */
  public static final String ID_KEY = "$id";

  private BsonValues() {}

  /**
   * Converts a value into the Java object the {@code org.bson} codecs expect for it.
   *
   * @param value the value
   * @return the BSON object model equivalent, {@code null} for {@link Value.NullValue}
   */
  public static Object toBson(Value value) {
    if (value instanceof Value.NullValue) {
      return null;
    } else if (value instanceof Value.BooleanValue b) {
      return b.value();
    } else if (value instanceof Value.IntValue i) {
      return i.fitsInInt() ? (Object) (int) i.value() : (Object) i.value();
    } else if (value instanceof Value.FloatValue f) {
      return f.value();
    } else if (value instanceof Value.TextValue t) {
      return t.value();
    } else if (value instanceof Value.BytesValue b) {
      return b.binary();
    } else if (value instanceof Value.TimestampValue t) {
      return Date.from(t.value().toInstant(ZoneOffset.UTC));
    } else if (value instanceof Value.IdentifierValue id) {
      return id.id();
    } else if (value instanceof Value.RegexValue r) {
      return r.regex();
    } else if (value instanceof Value.SequenceValue seq) {
      List<Object> out = new ArrayList<>(seq.size());
      for (Value element : seq.elements()) {
        out.add(toBson(element));
      }
      return out;
    } else if (value instanceof Value.DocumentValue doc) {
      return toDocument(doc);
    } else if (value instanceof Value.ReferenceValue ref) {
      return new Document(REF_KEY, ref.collection()).append(ID_KEY, toBson(ref.id()));
    }
    throw new IllegalArgumentException("Unsupported value: " + value);
  }

  /**
   * Converts a document value into an {@link org.bson.Document}, preserving key order.
   *
   * @param value the document
   * @return the BSON document
   */
  public static Document toDocument(Value.DocumentValue value) {
    Document out = new Document();
    for (Map.Entry<String, Value> e : value.document()) {
      out.append(e.getKey(), toBson(e.getValue()));
    }
    return out;
  }

  /**
   * Converts an object decoded by an {@code org.bson} codec back into a {@link Value}.
   *
   * @param bson the decoded object, may be null
   * @return the value
   * @throws IllegalArgumentException if the object has no {@link Value} counterpart
   */
  public static Value fromBson(Object bson) {
    if (bson == null) {
      return Value.nullValue();
    } else if (bson instanceof Boolean b) {
      return Value.of(b.booleanValue());
    } else if (bson instanceof Integer || bson instanceof Long) {
      return Value.of(((Number) bson).longValue());
    } else if (bson instanceof Double d) {
      return Value.of(d.doubleValue());
    } else if (bson instanceof String s) {
      return Value.of(s);
    } else if (bson instanceof Binary b) {
      return new Value.BytesValue(b);
    } else if (bson instanceof byte[] bytes) {
      return Value.of(bytes);
    } else if (bson instanceof Date d) {
      return Value.of(LocalDateTime.ofInstant(d.toInstant(), ZoneOffset.UTC));
    } else if (bson instanceof ObjectId id) {
      return Value.of(id);
    } else if (bson instanceof BsonRegularExpression r) {
      return new Value.RegexValue(r);
    } else if (bson instanceof List<?> list) {
      List<Value> out = new ArrayList<>(list.size());
      for (Object element : list) {
        out.add(fromBson(element));
      }
      return new Value.SequenceValue(out);
    } else if (bson instanceof Map<?, ?> map) {
      return fromMap(map);
    }
    throw new IllegalArgumentException(
        "Unsupported BSON object: " + bson.getClass().getName() + " " + Values.repr(bson));
  }

  /**
   * Whether {@code map} has the shape of a stored reference.
   *
   * @param map the candidate
   * @return true if the first keys are {@value #REF_KEY} and {@value #ID_KEY}
   */
  public static boolean isReference(Map<?, ?> map) {
    if (map.size() != 2 || !(map.get(REF_KEY) instanceof String)) {
      return false;
    }
    List<?> keys = new ArrayList<>(map.keySet());
    return REF_KEY.equals(keys.get(0)) && ID_KEY.equals(keys.get(1));
  }

  private static Value fromMap(Map<?, ?> map) {
    if (isReference(map)) {
      return Value.reference((String) map.get(REF_KEY), fromBson(map.get(ID_KEY)));
    }
    OrderedDocument<Value> out = new OrderedDocument<>();
    for (Map.Entry<?, ?> e : map.entrySet()) {
      out.put(String.valueOf(e.getKey()), fromBson(e.getValue()));
    }
    return Value.document(out);
  }
}
