package io.qcheck.value;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Utilities to measure, navigate and print generated values.
 *
 * <ul>
 *   <li>{@link #depth(Object)} and {@link #size(Object)} give the nesting depth and node count used
 *       to bound generation and to judge shrinking progress
 *   <li>{@link #get(Value, Object...)} follows a path of keys/indices through nested containers
 *   <li>{@link #repr(Object)} renders any generated value for counterexample reports
 * </ul>
 */
public final class Values {
  private static final char[] HEX = "0123456789abcdef".toCharArray();

  private Values() {}

  /**
   * Nesting depth of a value: 0 for scalars and references, {@code 1 + max(child depth)} for
   * sequences and documents (an empty container has depth 1). Works on {@link Value}s as well as
   * on {@link List}s and {@link OrderedDocument}s produced by the plain combinators.
   *
   * @param value the value
   * @return the nesting depth
   */
  public static int depth(Object value) {
    Collection<?> children = children(value);
    if (children == null) {
      return 0;
    }
    int max = 0;
    for (Object child : children) {
      max = Math.max(max, depth(child));
    }
    return 1 + max;
  }

  /**
   * Number of nodes in a value tree: 1 for a scalar or reference, {@code 1 + sum(child size)} for
   * containers.
   *
   * @param value the value
   * @return the node count
   */
  public static int size(Object value) {
    Collection<?> children = children(value);
    if (children == null) {
      return 1;
    }
    int total = 1;
    for (Object child : children) {
      total += size(child);
    }
    return total;
  }

  /**
   * Navigate a nested value using a sequence of keys/indices. Each path element may be a {@link
   * String} key (for documents) or an {@link Integer} index (for sequences).
   *
   * @param root the root value
   * @param path the path of keys/indices to follow
   * @return the located value or {@code null} if the path cannot be followed
   */
  public static Value get(Value root, Object... path) {
    Objects.requireNonNull(root, "root");
    Value current = root;
    if (path == null) {
      return current;
    }
    for (Object segment : path) {
      if (segment instanceof CharSequence) {
        if (!(current instanceof Value.DocumentValue doc)) {
          return null;
        }
        current = doc.get(segment.toString());
        if (current == null) return null;
      } else if (segment instanceof Integer idx) {
        if (!(current instanceof Value.SequenceValue seq)) {
          return null;
        }
        if (idx < 0 || idx >= seq.size()) return null;
        current = seq.elements().get(idx);
      } else {
        throw new IllegalArgumentException("Unsupported path segment type: " + segment);
      }
    }
    return current;
  }

  /**
   * Printable form of a generated value: strings are quoted and escaped, byte arrays are shown as
   * {@code b'...'}, containers recurse.
   *
   * @param value the value, may be null
   * @return the printable form
   */
  public static String repr(Object value) {
    if (value == null) {
      return "null";
    }
    if (value instanceof String s) {
      return quote(s);
    }
    if (value instanceof byte[] bytes) {
      return bytesRepr(bytes);
    }
    if (value instanceof List<?> list) {
      StringBuilder sb = new StringBuilder("[");
      for (int i = 0; i < list.size(); i++) {
        if (i > 0) sb.append(", ");
        sb.append(repr(list.get(i)));
      }
      return sb.append(']').toString();
    }
    if (value instanceof Map<?, ?> map) {
      StringBuilder sb = new StringBuilder("{");
      boolean first = true;
      for (Map.Entry<?, ?> e : map.entrySet()) {
        if (!first) sb.append(", ");
        first = false;
        sb.append(repr(e.getKey())).append(": ").append(repr(e.getValue()));
      }
      return sb.append('}').toString();
    }
    try {
      return String.valueOf(value);
    } catch (RuntimeException e) {
      return "<toString failed: " + e.getClass().getName() + ": " + e.getMessage() + ">";
    }
  }

  private static Collection<?> children(Object value) {
    if (value instanceof Value.SequenceValue seq) {
      return seq.elements();
    }
    if (value instanceof Value.DocumentValue doc) {
      return doc.document().values();
    }
    if (value instanceof List<?> list) {
      return list;
    }
    if (value instanceof OrderedDocument<?> doc) {
      return doc.values();
    }
    return null;
  }

  private static String quote(String s) {
    StringBuilder sb = new StringBuilder(s.length() + 2).append('\'');
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '\'':
          sb.append("\\'");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        default:
          if (c < 0x20 || c == 0x7F) {
            sb.append("\\x").append(HEX[(c >> 4) & 0xF]).append(HEX[c & 0xF]);
          } else {
            sb.append(c);
          }
      }
    }
    return sb.append('\'').toString();
  }

  private static String bytesRepr(byte[] bytes) {
    StringBuilder sb = new StringBuilder(bytes.length + 3).append("b'");
    for (byte b : bytes) {
      int v = b & 0xFF;
      if (v == '\'' || v == '\\') {
        sb.append('\\').append((char) v);
      } else if (v >= 0x20 && v < 0x7F) {
        sb.append((char) v);
      } else {
        sb.append("\\x").append(HEX[v >> 4]).append(HEX[v & 0xF]);
      }
    }
    return sb.append('\'').toString();
  }
}
