package io.qcheck.value;

import io.qcheck.api.GeneratorMisuseException;
import io.qcheck.api.ValidationUtils;
import io.qcheck.gen.Gen;
import io.qcheck.gen.Gens;
import java.util.ArrayList;
import java.util.List;

/**
 * Generators over the full {@link Value} domain, bounded by a depth budget.
 *
 * <p>{@link #value(int, boolean)} is a uniform choice among leaf families (unicode text, printable
 * text, bytes, 32-bit ints, floats, booleans, timestamps, object ids, null, optionally references)
 * plus, only while the budget is positive, a sequence family and a document family built one level
 * down. Every value produced at depth {@code d} therefore has {@link Values#depth(Object)} at most
 * {@code d}, and {@code d = 0} yields leaves only.
 *
 * <p>Leaves are wide (text up to 50 characters, bytes up to 1000) while containers are short (at
 * most 10 entries), which favours shallow but varied trees that shrink quickly.
 */
public final class DocumentValues {

  /**
   * Size bounds and optional leaf families.
   *
   * @param maxTextLength longest sampled length for text leaves
   * @param maxBytesLength longest sampled length for byte string leaves
   * @param maxKeyLength longest sampled length for document keys and collection names
   * @param maxContainerLength most entries in a sequence or document
   * @param regex whether regular expressions are offered as a leaf family
   */
  public record Options(
      int maxTextLength,
      int maxBytesLength,
      int maxKeyLength,
      int maxContainerLength,
      boolean regex) {

    /** Default bounds: text 0..50, bytes 0..1000, keys 0..20, containers 0..10, no regex. */
    public static final Options DEFAULT = new Options(50, 1000, 20, 10, false);

    public Options {
      ValidationUtils.requireBounds(0, maxTextLength);
      ValidationUtils.requireBounds(0, maxBytesLength);
      ValidationUtils.requireBounds(0, maxKeyLength);
      ValidationUtils.requireBounds(0, maxContainerLength);
    }

    public static Builder builder() {
      return new Builder();
    }

    public static class Builder {
      private int maxTextLength = DEFAULT.maxTextLength;
      private int maxBytesLength = DEFAULT.maxBytesLength;
      private int maxKeyLength = DEFAULT.maxKeyLength;
      private int maxContainerLength = DEFAULT.maxContainerLength;
      private boolean regex = DEFAULT.regex;

      public Builder maxTextLength(int value) {
        this.maxTextLength = value;
        return this;
      }

      public Builder maxBytesLength(int value) {
        this.maxBytesLength = value;
        return this;
      }

      public Builder maxKeyLength(int value) {
        this.maxKeyLength = value;
        return this;
      }

      public Builder maxContainerLength(int value) {
        this.maxContainerLength = value;
        return this;
      }

      public Builder regex(boolean value) {
        this.regex = value;
        return this;
      }

      public Options build() {
        return new Options(maxTextLength, maxBytesLength, maxKeyLength, maxContainerLength, regex);
      }
    }
  }

  private DocumentValues() {}

  /**
   * Generator over all value kinds with nesting depth at most {@code depth}.
   *
   * @param depth the depth budget, at least 0
   * @param references whether references are offered as a leaf family
   * @return the generator
   */
  public static Gen<Value> value(int depth, boolean references) {
    return value(depth, references, Options.DEFAULT);
  }

  /**
   * Generator over all value kinds with nesting depth at most {@code depth}.
   *
   * @param depth the depth budget, at least 0
   * @param references whether references are offered as a leaf family
   * @param options size bounds and optional families
   * @return the generator
   */
  public static Gen<Value> value(int depth, boolean references, Options options) {
    if (depth < 0) {
      throw GeneratorMisuseException.invalidDepth(depth, 0);
    }
    ValidationUtils.requireNonNull(options, "options");
    List<Gen<? extends Value>> choices = new ArrayList<>(12);
    choices.add(Gens.text(Gens.intRange(0, options.maxTextLength())).map(Value.TextValue::new));
    choices.add(
        Gens.printableText(Gens.intRange(0, options.maxTextLength())).map(Value.TextValue::new));
    choices.add(Gens.bytes(Gens.intRange(0, options.maxBytesLength())).map(Value.BytesValue::new));
    choices.add(Gens.intFull().map(i -> new Value.IntValue(i)));
    choices.add(Gens.floatFull().map(Value.FloatValue::new));
    choices.add(Gens.booleans().map(Value.BooleanValue::new));
    choices.add(Gens.timestamp().map(Value.TimestampValue::new));
    choices.add(Gens.objectIds().map(Value.IdentifierValue::new));
    choices.add(Gens.constant(Value.nullValue()));
    if (options.regex()) {
      choices.add(Gens.regex(Gens.intRange(0, options.maxKeyLength())).map(Value.RegexValue::new));
    }
    if (references) {
      choices.add(reference(options));
    }
    if (depth > 0) {
      choices.add(sequence(depth, references, options));
      choices.add(document(depth, references, options));
    }
    return Gens.chooseGenerator(choices);
  }

  /**
   * Generator of sequences whose elements are drawn from {@link #value(int, boolean)} one level
   * down.
   *
   * @param depth the depth budget of the sequence itself, at least 1
   * @param references whether elements may be references
   * @return the generator
   */
  public static Gen<Value.SequenceValue> sequence(int depth, boolean references) {
    return sequence(depth, references, Options.DEFAULT);
  }

  public static Gen<Value.SequenceValue> sequence(int depth, boolean references, Options options) {
    if (depth < 1) {
      throw GeneratorMisuseException.invalidDepth(depth, 1);
    }
    Gen<Value> element = value(depth - 1, references, options);
    return Gens.sequence(element, Gens.intRange(0, options.maxContainerLength()))
        .map(Value.SequenceValue::new);
  }

  /**
   * Generator of documents keyed by unicode text, with values drawn from {@link #value(int,
   * boolean)} one level down.
   *
   * @param depth the depth budget of the document itself, at least 1
   * @param references whether values may be references
   * @return the generator
   */
  public static Gen<Value.DocumentValue> document(int depth, boolean references) {
    return document(depth, references, Options.DEFAULT);
  }

  public static Gen<Value.DocumentValue> document(int depth, boolean references, Options options) {
    if (depth < 1) {
      throw GeneratorMisuseException.invalidDepth(depth, 1);
    }
    Gen<Value> element = value(depth - 1, references, options);
    Gen<String> keys = Gens.text(Gens.intRange(0, options.maxKeyLength()));
    return Gens.mapping(keys, element, Gens.intRange(0, options.maxContainerLength()))
        .map(Value.DocumentValue::new);
  }

  /**
   * Generator of references: a unicode collection name paired with a value of depth at most 1.
   * The nested value never contains another reference, so reference chains stop after one hop.
   *
   * @return the generator
   */
  public static Gen<Value.ReferenceValue> reference() {
    return reference(Options.DEFAULT);
  }

  public static Gen<Value.ReferenceValue> reference(Options options) {
    Gen<String> collection = Gens.text(Gens.intRange(0, options.maxKeyLength()));
    Gen<Value> id = value(1, false, options);
    return random -> new Value.ReferenceValue(collection.next(random), id.next(random));
  }
}
