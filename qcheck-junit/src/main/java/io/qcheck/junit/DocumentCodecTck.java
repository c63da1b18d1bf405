package io.qcheck.junit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import io.qcheck.check.CheckerOptions;
import io.qcheck.value.BsonValues;
import io.qcheck.value.DocumentValues;
import io.qcheck.value.OrderedDocument;
import io.qcheck.value.Value;
import org.bson.Document;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

/**
 * Compatibility kit for document codecs: generated documents must survive an encode/decode round
 * trip unchanged.
 *
 * <p>Codec authors extend this class and implement {@link #encode(Document)} and {@link
 * #decode(byte[])}:
 *
 * <pre>{@code
 * class MyCodecTckTest extends DocumentCodecTck {
 *   @Override
 *   protected byte[] encode(Document document) {
 *     return MyCodec.write(document);
 *   }
 *
 *   @Override
 *   protected Document decode(byte[] bytes) {
 *     return MyCodec.read(bytes);
 *   }
 * }
 * }</pre>
 *
 * <p>Run size follows {@link CheckerOptions#fromSystemProperties()}; override {@link #options()}
 * to pin it.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public abstract class DocumentCodecTck {

  private CheckerOptions options;

  /**
   * Encodes a document.
   *
   * @param document the document
   * @return the encoded bytes
   * @throws Exception if encoding fails
   */
  protected abstract byte[] encode(Document document) throws Exception;

  /**
   * Decodes bytes produced by {@link #encode(Document)}.
   *
   * @param bytes the encoded document
   * @return the document
   * @throws Exception if decoding fails
   */
  protected abstract Document decode(byte[] bytes) throws Exception;

  /** Checker options for the generated round trips. */
  protected CheckerOptions options() {
    return CheckerOptions.fromSystemProperties();
  }

  /** Generation bounds. Override to enable regular expressions or shrink leaves. */
  protected DocumentValues.Options valueOptions() {
    return DocumentValues.Options.DEFAULT;
  }

  @BeforeAll
  void initOptions() {
    options = options();
    assertNotNull(options, "options() must not return null");
  }

  /**
   * Encodes and decodes {@code value}.
   *
   * @param value the document
   * @return the decoded document as a value
   * @throws Exception if the codec fails
   */
  protected Value.DocumentValue roundTrip(Value.DocumentValue value) throws Exception {
    return (Value.DocumentValue) BsonValues.fromBson(decode(encode(BsonValues.toDocument(value))));
  }

  // ==================== Fixed documents ====================

  @Test
  void emptyDocumentRoundTrips() throws Exception {
    Value.DocumentValue empty = Value.document(new OrderedDocument<>());
    assertEquals(empty, roundTrip(empty));
  }

  @Test
  void keyOrderIsPreserved() throws Exception {
    Value.DocumentValue doc =
        Value.document(
            new OrderedDocument<Value>()
                .append("z", Value.of(1))
                .append("a", Value.of(2))
                .append("m", Value.of(3)));
    assertEquals(doc.keys(), roundTrip(doc).keys());
  }

  @Test
  void referenceRoundTrips() throws Exception {
    Value.DocumentValue doc =
        Value.document(
            new OrderedDocument<Value>()
                .append("ref", Value.reference("coll", Value.of("id"))));
    assertEquals(doc, roundTrip(doc));
  }

  // ==================== Generated documents ====================

  @Test
  void flatDocumentsRoundTrip() {
    QCheckAssertions.assertProperty(
        options,
        doc -> roundTrip(doc).equals(doc),
        DocumentValues.document(1, false, valueOptions()));
  }

  @Test
  void nestedDocumentsRoundTrip() {
    QCheckAssertions.assertProperty(
        options,
        doc -> roundTrip(doc).equals(doc),
        DocumentValues.document(3, false, valueOptions()));
  }

  @Test
  void documentsWithReferencesRoundTrip() {
    QCheckAssertions.assertProperty(
        options,
        doc -> roundTrip(doc).equals(doc),
        DocumentValues.document(2, true, valueOptions()));
  }
}
