package io.qcheck.gen;

import io.qcheck.api.ValidationUtils;
import io.qcheck.value.OrderedDocument;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import org.bson.BsonRegularExpression;
import org.bson.types.ObjectId;

/**
 * Factories for generators.
 *
 * <p>Every method is a pure factory: it validates its arguments and returns a {@link Gen}; no
 * randomness is consumed until the returned generator is sampled. Arguments that can never produce
 * a value (empty choice lists, inverted bounds) are rejected immediately with a {@link
 * io.qcheck.api.GeneratorMisuseException}.
 *
 * <p>Example:
 *
 * <pre>{@code
 * Gen<List<Integer>> smallLists = Gens.sequence(Gens.intRange(0, 9), Gens.intRange(0, 5));
 * Gen<OrderedDocument<Boolean>> flags =
 *     Gens.mapping(Gens.printableText(Gens.intRange(1, 8)), Gens.booleans(), Gens.intRange(0, 4));
 * }</pre>
 */
public final class Gens {
  /** Largest code point produced by {@link #text(Gen)}. */
  public static final int MAX_TEXT_CODE_POINT = 0xFFF;

  /** Characters that {@link #text(Gen)} never produces, so its output is usable as a key. */
  public static final String RESERVED_KEY_CHARACTERS = ".$";

  private static final int MIN_YEAR = 1970;
  private static final int MAX_YEAR = 2037;
  private static final int OBJECT_ID_LENGTH = 12;

  private Gens() {}

  /**
   * Always yields {@code value}.
   *
   * @param value the value, may be null
   * @param <T> the value type
   * @return the generator
   */
  public static <T> Gen<T> constant(T value) {
    return random -> value;
  }

  /**
   * Yields a uniformly chosen element of {@code values}.
   *
   * @param values the candidates, must not be empty; null elements are allowed
   * @param <T> the value type
   * @return the generator
   */
  public static <T> Gen<T> chooseValue(List<? extends T> values) {
    ValidationUtils.requireNonEmpty(values, "values");
    List<T> snapshot = Collections.unmodifiableList(new ArrayList<>(values));
    return random -> snapshot.get(random.nextInt(snapshot.size()));
  }

  /**
   * Varargs form of {@link #chooseValue(List)}.
   *
   * @param values the candidates, must not be empty
   * @param <T> the value type
   * @return the generator
   */
  @SafeVarargs
  public static <T> Gen<T> chooseValue(T... values) {
    ValidationUtils.requireNonNull(values, "values");
    return chooseValue(Arrays.asList(values));
  }

  /**
   * Uniformly selects one of {@code generators} and samples it.
   *
   * <p>The two-level choice weights generator families rather than raw values: a family with a
   * huge domain is picked as often as a family with a single value.
   *
   * @param generators the candidate generators, must not be empty
   * @param <T> the value type
   * @return the generator
   */
  public static <T> Gen<T> chooseGenerator(List<? extends Gen<? extends T>> generators) {
    ValidationUtils.requireNonEmpty(generators, "generators");
    List<Gen<? extends T>> snapshot = List.copyOf(generators);
    return random -> snapshot.get(random.nextInt(snapshot.size())).next(random);
  }

  /**
   * Varargs form of {@link #chooseGenerator(List)}.
   *
   * @param generators the candidate generators, must not be empty
   * @param <T> the value type
   * @return the generator
   */
  @SafeVarargs
  public static <T> Gen<T> chooseGenerator(Gen<? extends T>... generators) {
    ValidationUtils.requireNonNull(generators, "generators");
    return chooseGenerator(Arrays.asList(generators));
  }

  /**
   * Yields {@code mapper(gen.next())}.
   *
   * @param gen the source generator
   * @param mapper the transformation
   * @param <T> the source type
   * @param <R> the result type
   * @return the generator
   */
  public static <T, R> Gen<R> map(Gen<? extends T> gen, Function<? super T, ? extends R> mapper) {
    ValidationUtils.requireNonNull(gen, "gen");
    ValidationUtils.requireNonNull(mapper, "mapper");
    return random -> mapper.apply(gen.next(random));
  }

  /**
   * Yields ints uniformly from the closed interval {@code [lo, hi]}.
   *
   * @param lo the inclusive lower bound
   * @param hi the inclusive upper bound
   * @return the generator
   */
  public static Gen<Integer> intRange(int lo, int hi) {
    ValidationUtils.requireBounds(lo, hi);
    return random -> random.nextInt(lo, hi);
  }

  /**
   * Yields ints uniformly over the full signed 32-bit range.
   *
   * @return the generator
   */
  public static Gen<Integer> intFull() {
    return intRange(Integer.MIN_VALUE, Integer.MAX_VALUE);
  }

  /**
   * Yields longs uniformly over the full signed 64-bit range.
   *
   * @return the generator
   */
  public static Gen<Long> longFull() {
    return RandomSource::nextLong;
  }

  /**
   * Yields doubles spread symmetrically around zero and scaled by {@link Long#MAX_VALUE}, so both
   * tiny and very large magnitudes show up.
   *
   * @return the generator
   */
  public static Gen<Double> floatFull() {
    return random -> (random.nextDouble() - 0.5) * Long.MAX_VALUE;
  }

  /**
   * Yields {@code true} and {@code false} with equal probability.
   *
   * @return the generator
   */
  public static Gen<Boolean> booleans() {
    return RandomSource::nextBoolean;
  }

  /**
   * Samples a length, then that many independent elements, in generation order.
   *
   * @param element the element generator
   * @param length the length generator, must produce non-negative values
   * @param <T> the element type
   * @return the generator
   */
  public static <T> Gen<List<T>> sequence(Gen<? extends T> element, Gen<Integer> length) {
    ValidationUtils.requireNonNull(element, "element");
    ValidationUtils.requireNonNull(length, "length");
    return random -> {
      int n = ValidationUtils.requireLength(length.next(random));
      List<T> out = new ArrayList<>(n);
      for (int i = 0; i < n; i++) {
        out.add(element.next(random));
      }
      return out;
    };
  }

  /**
   * Samples a length, then that many key/value pairs, inserting them in order into an {@link
   * OrderedDocument}. A repeated key overwrites the earlier value in place, so the realized size
   * may be smaller than the sampled length.
   *
   * @param keys the key generator
   * @param values the value generator
   * @param length the length generator, must produce non-negative values
   * @param <V> the value type
   * @return the generator
   */
  public static <V> Gen<OrderedDocument<V>> mapping(
      Gen<String> keys, Gen<? extends V> values, Gen<Integer> length) {
    ValidationUtils.requireNonNull(keys, "keys");
    ValidationUtils.requireNonNull(values, "values");
    ValidationUtils.requireNonNull(length, "length");
    return random -> {
      int n = ValidationUtils.requireLength(length.next(random));
      OrderedDocument<V> out = new OrderedDocument<>();
      for (int i = 0; i < n; i++) {
        // key first, then value
        String key = keys.next(random);
        out.put(key, values.next(random));
      }
      return out;
    };
  }

  /**
   * Yields strings of code points in {@code [1, 0xFFF]}, with {@code '.'} and {@code '$'} dropped
   * after generation. The result is therefore at most as long as the sampled length.
   *
   * @param length the length generator
   * @return the generator
   */
  public static Gen<String> text(Gen<Integer> length) {
    return sequence(intRange(1, MAX_TEXT_CODE_POINT), length).map(cps -> join(cps, true));
  }

  /**
   * Yields strings of printable ASCII characters ({@code 32..126}).
   *
   * @param length the length generator
   * @return the generator
   */
  public static Gen<String> printableText(Gen<Integer> length) {
    return sequence(intRange(32, 126), length).map(cps -> join(cps, false));
  }

  /**
   * Yields strings of ISO-8859-1 characters ({@code 0..255}), including control characters.
   *
   * @param length the length generator
   * @return the generator
   */
  public static Gen<String> latin1Text(Gen<Integer> length) {
    return sequence(intRange(0, 255), length).map(cps -> join(cps, false));
  }

  /**
   * Yields byte arrays with uniformly random content.
   *
   * @param length the length generator
   * @return the generator
   */
  public static Gen<byte[]> bytes(Gen<Integer> length) {
    return sequence(intRange(0, 255), length)
        .map(
            values -> {
              byte[] out = new byte[values.size()];
              for (int i = 0; i < out.length; i++) {
                out[i] = (byte) (int) values.get(i);
              }
              return out;
            });
  }

  /**
   * Yields naive timestamps between 1970 and 2037 at millisecond resolution. Days stop at 28 so
   * every month is valid.
   *
   * @return the generator
   */
  public static Gen<LocalDateTime> timestamp() {
    return random ->
        LocalDateTime.of(
            random.nextInt(MIN_YEAR, MAX_YEAR),
            random.nextInt(1, 12),
            random.nextInt(1, 28),
            random.nextInt(0, 23),
            random.nextInt(0, 59),
            random.nextInt(0, 59),
            random.nextInt(0, 999) * 1_000_000);
  }

  /**
   * Yields regular expressions whose pattern is a run of {@code 'a'} and whose options are any
   * subset of {@code i}, {@code m} and {@code x}.
   *
   * @param length the pattern length generator
   * @return the generator
   */
  public static Gen<BsonRegularExpression> regex(Gen<Integer> length) {
    Gen<String> pattern = sequence(constant("a"), length).map(parts -> String.join("", parts));
    return random -> {
      String p = pattern.next(random);
      StringBuilder options = new StringBuilder(3);
      if (random.nextBoolean()) options.append('i');
      if (random.nextBoolean()) options.append('m');
      if (random.nextBoolean()) options.append('x');
      return new BsonRegularExpression(p, options.toString());
    };
  }

  /**
   * Yields object identifiers built from random bytes, so seeded runs reproduce them.
   *
   * @return the generator
   */
  public static Gen<ObjectId> objectIds() {
    return random -> {
      byte[] raw = new byte[OBJECT_ID_LENGTH];
      for (int i = 0; i < raw.length; i++) {
        raw[i] = (byte) random.nextInt(256);
      }
      return new ObjectId(raw);
    };
  }

  private static String join(List<Integer> codePoints, boolean dropReserved) {
    StringBuilder sb = new StringBuilder(codePoints.size());
    for (int cp : codePoints) {
      if (dropReserved && RESERVED_KEY_CHARACTERS.indexOf(cp) >= 0) {
        continue;
      }
      sb.appendCodePoint(cp);
    }
    return sb.toString();
  }
}
