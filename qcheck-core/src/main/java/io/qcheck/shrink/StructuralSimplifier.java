package io.qcheck.shrink;

import io.qcheck.gen.RandomSource;
import io.qcheck.value.BsonValues;
import io.qcheck.value.OrderedDocument;
import io.qcheck.value.Value;
import java.util.ArrayList;
import java.util.List;

/**
 * Simplifies containers by deleting or recursively simplifying one randomly chosen element.
 *
 * <p>Handles the plain containers built by the combinators ({@link List}, {@link OrderedDocument})
 * as well as {@link Value.SequenceValue} and {@link Value.DocumentValue}. Each step flips a coin:
 * heads deletes one entry (no change when the container is empty), tails simplifies one entry in
 * place and reports whatever the nested step reported. Documents that carry the {@value
 * BsonValues#REF_KEY} key, {@link Value.ReferenceValue}s and all scalars are never simplified.
 *
 * <p>The input is never modified; changed candidates are fresh containers.
 */
public final class StructuralSimplifier implements Simplifier<Object> {
  private static final StructuralSimplifier INSTANCE = new StructuralSimplifier();

  private StructuralSimplifier() {}

  /**
   * The simplifier, typed for the caller's value type. Candidates always have the runtime type of
   * the value they were derived from.
   *
   * @param <T> the value type
   * @return the simplifier
   */
  @SuppressWarnings("unchecked")
  public static <T> Simplifier<T> structural() {
    return (Simplifier<T>) (Simplifier<?>) INSTANCE;
  }

  @Override
  public ShrinkProposal<Object> simplify(Object value, RandomSource random) {
    if (value instanceof List<?> list) {
      return simplifyList(list, random);
    } else if (value instanceof OrderedDocument<?> doc) {
      if (doc.containsKey(BsonValues.REF_KEY)) {
        return unchanged(value);
      }
      return simplifyDocument(doc, random);
    } else if (value instanceof Value.SequenceValue seq) {
      ShrinkProposal<Object> inner = simplifyList(seq.elements(), random);
      return inner.changed()
          ? ShrinkProposal.changed(asSequence(inner.candidate()))
          : unchanged(value);
    } else if (value instanceof Value.DocumentValue doc) {
      if (doc.containsKey(BsonValues.REF_KEY)) {
        return unchanged(value);
      }
      ShrinkProposal<Object> inner = simplifyDocument(doc.document(), random);
      return inner.changed()
          ? ShrinkProposal.changed(asDocument(inner.candidate()))
          : unchanged(value);
    }
    return unchanged(value);
  }

  private ShrinkProposal<Object> simplifyList(List<?> list, RandomSource random) {
    if (random.nextBoolean()) {
      if (list.isEmpty()) {
        return unchanged(list);
      }
      List<Object> candidate = new ArrayList<>(list);
      candidate.remove(random.nextInt(list.size()));
      return ShrinkProposal.changed(candidate);
    }
    if (list.isEmpty()) {
      return unchanged(list);
    }
    int index = random.nextInt(list.size());
    ShrinkProposal<Object> nested = simplify(list.get(index), random);
    if (!nested.changed()) {
      return unchanged(list);
    }
    List<Object> candidate = new ArrayList<>(list);
    candidate.set(index, nested.candidate());
    return ShrinkProposal.changed(candidate);
  }

  private ShrinkProposal<Object> simplifyDocument(OrderedDocument<?> doc, RandomSource random) {
    if (random.nextBoolean()) {
      if (doc.isEmpty()) {
        return unchanged(doc);
      }
      OrderedDocument<Object> candidate = new OrderedDocument<>(doc.toMap());
      candidate.remove(doc.keys().get(random.nextInt(doc.size())));
      return ShrinkProposal.changed(candidate);
    }
    if (doc.isEmpty()) {
      return unchanged(doc);
    }
    String key = doc.keys().get(random.nextInt(doc.size()));
    ShrinkProposal<Object> nested = simplify(doc.get(key), random);
    if (!nested.changed()) {
      return unchanged(doc);
    }
    OrderedDocument<Object> candidate = new OrderedDocument<>(doc.toMap());
    candidate.put(key, nested.candidate());
    return ShrinkProposal.changed(candidate);
  }

  private static ShrinkProposal<Object> unchanged(Object value) {
    return ShrinkProposal.unchanged(value);
  }

  @SuppressWarnings("unchecked")
  private static Value.SequenceValue asSequence(Object candidate) {
    return new Value.SequenceValue((List<Value>) candidate);
  }

  @SuppressWarnings("unchecked")
  private static Value.DocumentValue asDocument(Object candidate) {
    return new Value.DocumentValue((OrderedDocument<Value>) candidate);
  }
}
