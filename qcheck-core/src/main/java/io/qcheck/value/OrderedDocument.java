package io.qcheck.value;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Mapping from unique string keys to values that iterates in insertion order.
 *
 * <p>Overwriting an existing key keeps its original position. Two documents are equal only when
 * they hold the same keys, in the same order, mapped to equal values; in that respect this differs
 * from {@link Map#equals(Object)}.
 *
 * <p>Instances are mutable and not thread-safe. Use {@link #copy()} or {@link
 * #deepCopy(UnaryOperator)} before handing a document to code that may modify it.
 *
 * @param <V> the value type
 */
public final class OrderedDocument<V> implements Iterable<Map.Entry<String, V>> {
  private final LinkedHashMap<String, V> entries;

  /** Creates an empty document. */
  public OrderedDocument() {
    this.entries = new LinkedHashMap<>();
  }

  /**
   * Creates a document holding the entries of {@code source} in its iteration order.
   *
   * @param source the entries to copy
   */
  public OrderedDocument(Map<String, ? extends V> source) {
    this.entries = new LinkedHashMap<>(Objects.requireNonNull(source, "source"));
  }

  /**
   * Fluent insertion, convenient for literals in tests and examples.
   *
   * @param key the key
   * @param value the value
   * @return this document
   */
  public OrderedDocument<V> append(String key, V value) {
    put(key, value);
    return this;
  }

  public V get(String key) {
    return entries.get(key);
  }

  public boolean containsKey(String key) {
    return entries.containsKey(key);
  }

  /**
   * Associates {@code value} with {@code key}. A new key is appended at the end, an existing key
   * keeps its position.
   *
   * @param key the key, must not be null
   * @param value the value
   * @return the previous value, or null
   */
  public V put(String key, V value) {
    return entries.put(Objects.requireNonNull(key, "key"), value);
  }

  /**
   * Returns the value for {@code key}, inserting {@code defaultValue} first if the key is absent.
   *
   * @param key the key
   * @param defaultValue the value to insert when absent
   * @return the existing or newly inserted value
   */
  public V putIfAbsent(String key, V defaultValue) {
    if (!entries.containsKey(key)) {
      put(key, defaultValue);
      return defaultValue;
    }
    return entries.get(key);
  }

  /**
   * Removes {@code key}.
   *
   * @param key the key
   * @return the removed value, or null if the key was absent
   */
  public V remove(String key) {
    return entries.remove(key);
  }

  /**
   * Removes and returns the first entry.
   *
   * @return the removed entry
   * @throws NoSuchElementException if the document is empty
   */
  public Map.Entry<String, V> popFirst() {
    Iterator<Map.Entry<String, V>> it = entries.entrySet().iterator();
    if (!it.hasNext()) {
      throw new NoSuchElementException("document is empty");
    }
    Map.Entry<String, V> first = it.next();
    Map.Entry<String, V> detached =
        new AbstractMap.SimpleImmutableEntry<>(first.getKey(), first.getValue());
    it.remove();
    return detached;
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public void clear() {
    entries.clear();
  }

  /** Keys in insertion order, as an unmodifiable snapshot. */
  public List<String> keys() {
    return List.copyOf(entries.keySet());
  }

  /** Values in insertion order, as an unmodifiable snapshot. Null values are kept. */
  public List<V> values() {
    return Collections.unmodifiableList(new ArrayList<>(entries.values()));
  }

  /** Entries in insertion order, as an unmodifiable snapshot. */
  public List<Map.Entry<String, V>> entries() {
    List<Map.Entry<String, V>> out = new ArrayList<>(entries.size());
    for (Map.Entry<String, V> e : entries.entrySet()) {
      out.add(new AbstractMap.SimpleImmutableEntry<>(e.getKey(), e.getValue()));
    }
    return Collections.unmodifiableList(out);
  }

  @Override
  public Iterator<Map.Entry<String, V>> iterator() {
    return entries().iterator();
  }

  /** Shallow copy: a new container holding the same value references. */
  public OrderedDocument<V> copy() {
    return new OrderedDocument<>(entries);
  }

  /**
   * Deep copy: a new container whose values are produced by {@code valueCopier}.
   *
   * @param valueCopier copies a single value
   * @return the copy
   */
  public OrderedDocument<V> deepCopy(UnaryOperator<V> valueCopier) {
    OrderedDocument<V> out = new OrderedDocument<>();
    for (Map.Entry<String, V> e : entries.entrySet()) {
      out.put(e.getKey(), valueCopier.apply(e.getValue()));
    }
    return out;
  }

  /** Plain insertion-ordered {@link Map} view, copied. */
  public Map<String, V> toMap() {
    return new LinkedHashMap<>(entries);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof OrderedDocument<?> other)) return false;
    if (entries.size() != other.entries.size()) return false;
    Iterator<? extends Map.Entry<String, ?>> a = entries.entrySet().iterator();
    Iterator<? extends Map.Entry<String, ?>> b = other.entries.entrySet().iterator();
    while (a.hasNext()) {
      Map.Entry<String, ?> x = a.next();
      Map.Entry<String, ?> y = b.next();
      if (!x.getKey().equals(y.getKey()) || !Objects.equals(x.getValue(), y.getValue())) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    int h = 1;
    for (Map.Entry<String, V> e : entries.entrySet()) {
      h = 31 * h + e.getKey().hashCode();
      h = 31 * h + Objects.hashCode(e.getValue());
    }
    return h;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("{");
    boolean first = true;
    for (Map.Entry<String, V> e : entries.entrySet()) {
      if (!first) sb.append(", ");
      first = false;
      sb.append(Values.repr(e.getKey())).append(": ").append(Values.repr(e.getValue()));
    }
    return sb.append('}').toString();
  }
}
