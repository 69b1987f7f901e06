package io.intellixity.scoped.map;

import io.intellixity.scoped.key.Binding;
import io.intellixity.scoped.key.BindingKey;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Immutable mapping from {@link BindingKey} to value.\n
 *
 * Null is a legitimate stored value and is distinct from an absent key; use
 * {@link #containsKey(BindingKey)} or {@link #getOrDefault(BindingKey, Object)} with a private
 * sentinel to tell them apart.\n
 *
 * Every extension returns a new map and leaves the receiver untouched. Instances are safe to share
 * across threads.\n
 */
public final class ScopeMap {
  /**
   * Extensions with at most this many pairs are applied as a chain of single insertions; larger
   * ones go through a {@link Builder} that copies once.
   */
  public static final int SEQUENTIAL_EXTEND_LIMIT = 8;

  private static final ScopeMap EMPTY = new ScopeMap(Map.of());

  private final Map<BindingKey<?>, Object> entries;

  private ScopeMap(Map<BindingKey<?>, Object> entries) {
    this.entries = entries;
  }

  /** The canonical empty scope. */
  public static ScopeMap empty() {
    return EMPTY;
  }

  public int size() { return entries.size(); }

  public boolean isEmpty() { return entries.isEmpty(); }

  public boolean containsKey(BindingKey<?> key) {
    return entries.containsKey(key);
  }

  /** Stored value, or null if absent. Ambiguous for keys bound to null; see {@link #containsKey}. */
  @SuppressWarnings("unchecked")
  public <T> T get(BindingKey<T> key) {
    return (T) entries.get(key);
  }

  /** Stored value (possibly null) if the key is present, otherwise {@code notFound}. */
  public Object getOrDefault(BindingKey<?> key, Object notFound) {
    Object v = entries.get(key);
    if (v == null && !entries.containsKey(key)) return notFound;
    return v;
  }

  public Set<BindingKey<?>> keys() {
    return Collections.unmodifiableSet(entries.keySet());
  }

  /** Read-only view of the entries. */
  public Map<BindingKey<?>, Object> asMap() {
    return Collections.unmodifiableMap(entries);
  }

  /** New map with {@code key} bound to {@code value}. */
  public <T> ScopeMap with(BindingKey<T> key, T value) {
    Objects.requireNonNull(key, "key");
    return assoc(key, value);
  }

  /**
   * New map with the given alternating key/value pairs applied left to right.\n
   *
   * Input is validated before anything is built: the array must have an even length and every
   * even index must hold a {@link BindingKey}.\n
   */
  public ScopeMap extend(Object... keysAndValues) {
    Objects.requireNonNull(keysAndValues, "keysAndValues");
    validatePairs(keysAndValues);
    int pairs = keysAndValues.length / 2;
    if (pairs == 0) return this;

    if (pairs <= SEQUENTIAL_EXTEND_LIMIT) {
      ScopeMap out = this;
      for (int i = 0; i < keysAndValues.length; i += 2) {
        out = out.assoc((BindingKey<?>) keysAndValues[i], keysAndValues[i + 1]);
      }
      return out;
    }

    Builder b = toBuilder();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      b.putRaw((BindingKey<?>) keysAndValues[i], keysAndValues[i + 1]);
    }
    return b.build();
  }

  /** Typed form of {@link #extend(Object...)}. */
  public ScopeMap extend(List<Binding<?>> bindings) {
    Objects.requireNonNull(bindings, "bindings");
    if (bindings.isEmpty()) return this;

    if (bindings.size() <= SEQUENTIAL_EXTEND_LIMIT) {
      ScopeMap out = this;
      for (Binding<?> b : bindings) out = out.assoc(b.key(), b.value());
      return out;
    }

    Builder b = toBuilder();
    for (Binding<?> binding : bindings) b.putRaw(binding.key(), binding.value());
    return b.build();
  }

  /** Mutable builder seeded with this map's entries. */
  public Builder toBuilder() {
    return new Builder(entries);
  }

  public static Builder builder() {
    return new Builder(Map.of());
  }

  /**
   * Throws {@link IllegalArgumentException} unless {@code keysAndValues} is a well-formed pair list.
   */
  public static void validatePairs(Object[] keysAndValues) {
    Objects.requireNonNull(keysAndValues, "keysAndValues");
    if (keysAndValues.length % 2 != 0) {
      throw new IllegalArgumentException("keysAndValues must contain an even number of elements, got "
          + keysAndValues.length);
    }
    for (int i = 0; i < keysAndValues.length; i += 2) {
      Object k = keysAndValues[i];
      if (!(k instanceof BindingKey)) {
        throw new IllegalArgumentException("Cannot resolve binding key at index " + i + ": " + k);
      }
    }
  }

  private ScopeMap assoc(BindingKey<?> key, Object value) {
    Map<BindingKey<?>, Object> copy = new HashMap<>(capacityFor(entries.size() + 1));
    copy.putAll(entries);
    copy.put(key, value);
    return new ScopeMap(copy);
  }

  private static int capacityFor(int size) {
    return (int) (size / 0.75f) + 1;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ScopeMap)) return false;
    return entries.equals(((ScopeMap) o).entries);
  }

  @Override
  public int hashCode() {
    return entries.hashCode();
  }

  @Override
  public String toString() {
    StringJoiner sj = new StringJoiner(", ", "{", "}");
    for (var e : entries.entrySet()) sj.add(e.getKey() + " " + e.getValue());
    return sj.toString();
  }

  /**
   * Single-use accumulator for bulk extension. Copies the seed once, takes any number of puts and
   * hands ownership of its storage to the produced map.
   */
  public static final class Builder {
    private Map<BindingKey<?>, Object> entries;

    private Builder(Map<BindingKey<?>, Object> seed) {
      this.entries = new HashMap<>(seed);
    }

    public <T> Builder put(BindingKey<T> key, T value) {
      return putRaw(key, value);
    }

    private Builder putRaw(BindingKey<?> key, Object value) {
      Objects.requireNonNull(key, "key");
      ensureOpen();
      entries.put(key, value);
      return this;
    }

    public ScopeMap build() {
      ensureOpen();
      Map<BindingKey<?>, Object> out = entries;
      entries = null;
      return out.isEmpty() ? EMPTY : new ScopeMap(out);
    }

    private void ensureOpen() {
      if (entries == null) throw new IllegalStateException("ScopeMap.Builder already built");
    }
  }
}
