package dev.dylanburati.chaintable;

import java.util.AbstractCollection;
import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.Arrays;
import java.util.Collection;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;

/**
 * Hash map from ints to strings which resolves collisions by separate chaining.
 *
 * Each bucket keeps its pairs in two parallel arrays, an {@code int[]} of keys and
 * a {@code String[]} of values, so lookups by primitive key never box. Buckets are
 * allocated on first insertion. When an insertion brings the ratio of stored keys
 * to buckets up to the load factor, the bucket array is multiplied by
 * {@link #GROWTH_COEFFICIENT} and every pair is rehashed into it. Removal never
 * shrinks the table.
 *
 * Null values are not permitted, so a {@code null} result from {@link #get(int)}
 * or {@link #remove(int)} always means the key was absent.
 *
 * This class is not synchronized.
 */
public class IntStringHashTable extends AbstractMap<Integer, String> implements Cloneable {
  public static final int DEFAULT_CAPACITY = 16;
  public static final double DEFAULT_LOAD_FACTOR = 0.75;
  public static final int GROWTH_COEFFICIENT = 2;
  public static final int MAX_CAPACITY = 1 << 30;

  private final IntHasher hasher;
  private final double loadFactor;
  // INVARIANT 0: buckets.length >= 1
  // INVARIANT 1: a pair with key k is stored in buckets[bucketIndex(k, buckets.length)], nowhere else
  private Bucket[] buckets;
  // INVARIANT 2: size == sum of b.size over the non-null buckets
  private int size;
  // bumped on every structural change, checked by the view iterators
  private int modCount;

  public IntStringHashTable() {
    this(DEFAULT_CAPACITY);
  }

  public IntStringHashTable(int capacity) {
    this(capacity, DEFAULT_LOAD_FACTOR);
  }

  public IntStringHashTable(int capacity, double loadFactor) {
    this(capacity, loadFactor, DefaultHasher.instance());
  }

  /**
   * @param capacity   initial number of buckets, must be positive
   * @param loadFactor ratio of keys to buckets that triggers growth, in {@code (0, 1]}
   * @param hasher     hash function for keys, fixed for the table's lifetime
   * @throws IllegalArgumentException if {@code capacity} or {@code loadFactor} is out of range
   */
  public IntStringHashTable(int capacity, double loadFactor, final IntHasher hasher) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("hash table capacity must be greater than zero");
    }
    // written this way round so that NaN is rejected
    if (!(loadFactor > 0.0 && loadFactor <= 1.0)) {
      throw new IllegalArgumentException("hash table load factor must be in range (0, 1]");
    }
    this.hasher = Objects.requireNonNull(hasher);
    this.loadFactor = loadFactor;
    // INVARIANT 0 upheld
    this.buckets = new Bucket[capacity];
    // INVARIANT 2 upheld, no buckets allocated
    this.size = 0;
  }

  private IntStringHashTable(final IntHasher hasher, double loadFactor, Bucket[] buckets, int size) {
    // clone constructor, invariants are the responsibility of clone()
    this.hasher = hasher;
    this.loadFactor = loadFactor;
    this.buckets = buckets;
    this.size = size;
  }

  @Override
  public int size() {
    return this.size;
  }

  @Override
  public boolean isEmpty() {
    return this.size == 0;
  }

  /** Current number of buckets. */
  public int capacity() {
    return this.buckets.length;
  }

  public double loadFactor() {
    return this.loadFactor;
  }

  /** Returns the value mapped to {@code key}, or empty when the key is absent. */
  public Optional<String> search(int key) {
    return Optional.ofNullable(this.get(key));
  }

  /** Returns the value mapped to {@code key}, or {@code null} when the key is absent. */
  public String get(int key) {
    Bucket bucket = this.buckets[this.bucketIndex(key)];
    if (bucket == null) {
      return null;
    }
    int pos = bucket.indexOf(key);
    return pos < 0 ? null : bucket.values[pos];
  }

  public boolean containsKey(int key) {
    // values are never null
    return this.get(key) != null;
  }

  @Override
  public boolean containsKey(Object key) {
    return key instanceof Integer && this.containsKey(((Integer) key).intValue());
  }

  @Override
  public boolean containsValue(Object value) {
    if (!(value instanceof String)) {
      return false;
    }
    for (Bucket bucket : this.buckets) {
      if (bucket == null) {
        continue;
      }
      for (int pos = 0; pos < bucket.size; pos++) {
        if (bucket.values[pos].equals(value)) {
          return true;
        }
      }
    }
    return false;
  }

  private boolean containsEntry(Map.Entry<?, ?> e) {
    Object key = e.getKey();
    if (!(key instanceof Integer)) {
      return false;
    }
    String value = this.get(((Integer) key).intValue());
    return value != null && value.equals(e.getValue());
  }

  @Override
  public String get(Object key) {
    return this.getOrDefault(key, null);
  }

  @Override
  public String getOrDefault(Object key, String defaultValue) {
    if (!(key instanceof Integer)) {
      return defaultValue;
    }
    String value = this.get(((Integer) key).intValue());
    return value != null ? value : defaultValue;
  }

  /**
   * Maps {@code key} to {@code value}, overwriting any previous value in place. Inserting a new
   * key may grow the table.
   *
   * @return the previous value, or {@code null} if the key was absent
   */
  public String put(int key, String value) {
    return this.putImpl(key, value, true);
  }

  @Override
  public String put(Integer key, String value) {
    return this.putImpl(Objects.requireNonNull(key), value, true);
  }

  @Override
  public String putIfAbsent(Integer key, String value) {
    return this.putImpl(Objects.requireNonNull(key), value, false);
  }

  @Override
  public void putAll(Map<? extends Integer, ? extends String> m) {
    for (Map.Entry<? extends Integer, ? extends String> e : m.entrySet()) {
      this.put(e.getKey(), e.getValue());
    }
  }

  private String putImpl(int key, String value, boolean shouldReplace) {
    Objects.requireNonNull(value);
    int idx = this.bucketIndex(key);
    Bucket bucket = this.buckets[idx];
    if (bucket == null) {
      bucket = new Bucket();
      this.buckets[idx] = bucket;
    } else {
      int pos = bucket.indexOf(key);
      if (pos >= 0) {
        String prev = bucket.values[pos];
        if (shouldReplace) {
          bucket.values[pos] = value;
        }
        return prev;
      }
    }
    bucket.append(key, value);
    // INVARIANT 2 upheld
    this.size++;
    this.modCount++;
    if ((double) this.size / this.buckets.length >= this.loadFactor) {
      this.grow();
    }
    return null;
  }

  /**
   * Removes the mapping for {@code key}.
   *
   * @return the removed value, or {@code null} if the key was absent
   */
  public String remove(int key) {
    Bucket bucket = this.buckets[this.bucketIndex(key)];
    if (bucket == null) {
      return null;
    }
    int pos = bucket.indexOf(key);
    if (pos < 0) {
      return null;
    }
    return this.removeAt(bucket, pos);
  }

  /** Removes the mapping for {@code key}, returning the removed value or empty when absent. */
  public Optional<String> removeKey(int key) {
    return Optional.ofNullable(this.remove(key));
  }

  @Override
  public String remove(Object key) {
    if (!(key instanceof Integer)) {
      return null;
    }
    return this.remove(((Integer) key).intValue());
  }

  @Override
  public boolean remove(Object key, Object value) {
    if (!(key instanceof Integer) || value == null) {
      return false;
    }
    int k = (Integer) key;
    Bucket bucket = this.buckets[this.bucketIndex(k)];
    if (bucket == null) {
      return false;
    }
    int pos = bucket.indexOf(k);
    if (pos >= 0 && bucket.values[pos].equals(value)) {
      this.removeAt(bucket, pos);
      return true;
    }
    return false;
  }

  @Override
  public void clear() {
    Arrays.fill(this.buckets, null);
    // INVARIANT 2 upheld
    this.size = 0;
    this.modCount++;
  }

  /** Snapshot of the stored keys; later changes to the table are not reflected in it. */
  public IntSet keys() {
    IntSet keys = new IntOpenHashSet(this.size);
    for (Bucket bucket : this.buckets) {
      if (bucket == null) {
        continue;
      }
      for (int pos = 0; pos < bucket.size; pos++) {
        keys.add(bucket.keys[pos]);
      }
    }
    return keys;
  }

  @Override
  public Set<Integer> keySet() {
    return new KeySet(this);
  }

  @Override
  public Collection<String> values() {
    return new Values(this);
  }

  @Override
  public Set<Map.Entry<Integer, String>> entrySet() {
    return new EntrySet(this);
  }

  @Override
  public IntStringHashTable clone() {
    Bucket[] bucketsClone = new Bucket[this.buckets.length];
    for (int i = 0; i < this.buckets.length; i++) {
      // INVARIANT 1 upheld on the clone: same capacity and hasher, so every pair keeps its index
      if (this.buckets[i] != null && this.buckets[i].size > 0) {
        bucketsClone[i] = new Bucket(this.buckets[i]);
      }
    }
    return new IntStringHashTable(this.hasher, this.loadFactor, bucketsClone, this.size);
  }

  private int bucketIndex(int key) {
    return bucketIndex(this.hasher, key, this.buckets.length);
  }

  private static int bucketIndex(IntHasher hasher, int key, int capacity) {
    return (hasher.hash(key) & 0x7fff_ffff) % capacity;
  }

  /** INVARIANT 2 upheld WHEN {@code pos < bucket.size} prior to calling */
  private String removeAt(Bucket bucket, int pos) {
    String prev = bucket.removeAt(pos);
    this.size--;
    this.modCount++;
    return prev;
  }

  private void grow() {
    int cap = this.buckets.length;
    int nextCap = cap > MAX_CAPACITY / GROWTH_COEFFICIENT ? MAX_CAPACITY : cap * GROWTH_COEFFICIENT;
    if (nextCap <= cap) {
      // already at the limit, chains just get longer
      return;
    }
    Bucket[] nextBuckets = new Bucket[nextCap];
    for (Bucket bucket : this.buckets) {
      if (bucket == null) {
        continue;
      }
      // INVARIANT 1 upheld: each pair is appended exactly once, to the bucket for the new capacity
      for (int pos = 0; pos < bucket.size; pos++) {
        int idx = bucketIndex(this.hasher, bucket.keys[pos], nextCap);
        if (nextBuckets[idx] == null) {
          nextBuckets[idx] = new Bucket();
        }
        nextBuckets[idx].append(bucket.keys[pos], bucket.values[pos]);
      }
    }
    this.buckets = nextBuckets;
    this.modCount++;
  }

  /** A chain of pairs sharing one bucket index. Pair order is not significant. */
  private static final class Bucket {
    private static final int INITIAL_LENGTH = 2;

    // INVARIANT: keys.length == values.length >= size, values[size..] are null
    private int[] keys;
    private String[] values;
    private int size;

    Bucket() {
      this.keys = new int[INITIAL_LENGTH];
      this.values = new String[INITIAL_LENGTH];
    }

    Bucket(Bucket other) {
      this.keys = Arrays.copyOf(other.keys, other.keys.length);
      this.values = Arrays.copyOf(other.values, other.values.length);
      this.size = other.size;
    }

    int indexOf(int key) {
      for (int pos = 0; pos < this.size; pos++) {
        if (this.keys[pos] == key) {
          return pos;
        }
      }
      return -1;
    }

    void append(int key, String value) {
      if (this.size == this.keys.length) {
        int len = this.keys.length << 1;
        this.keys = Arrays.copyOf(this.keys, len);
        this.values = Arrays.copyOf(this.values, len);
      }
      this.keys[this.size] = key;
      this.values[this.size] = value;
      this.size++;
    }

    /** Fills slot {@code pos} with the last pair of the chain. */
    String removeAt(int pos) {
      String prev = this.values[pos];
      int last = --this.size;
      this.keys[pos] = this.keys[last];
      this.values[pos] = this.values[last];
      this.values[last] = null;
      return prev;
    }
  }

  // start of section adapted from
  // https://github.com/apache/commons-collections/blob/master/src/main/java/org/apache/commons/collections4/map/AbstractHashedMap.java

  protected static class KeySet extends AbstractSet<Integer> {
    private final IntStringHashTable owner;
    protected KeySet(final IntStringHashTable owner) {
      this.owner = owner;
    }

    public final int size() {
      return owner.size;
    }
    public final void clear() {
      owner.clear();
    }
    public final Iterator<Integer> iterator() {
      return new KeyIterator(owner);
    }
    public final boolean contains(Object o) {
      return owner.containsKey(o);
    }
    public final boolean remove(Object key) {
      return owner.remove(key) != null;
    }
  }

  protected static class Values extends AbstractCollection<String> {
    private final IntStringHashTable owner;
    protected Values(final IntStringHashTable owner) {
      this.owner = owner;
    }

    public final int size() {
      return owner.size;
    }
    public final void clear() {
      owner.clear();
    }
    public final Iterator<String> iterator() {
      return new ValueIterator(owner);
    }
    public final boolean contains(Object o) {
      return owner.containsValue(o);
    }
  }

  protected static class Node implements Map.Entry<Integer, String> {
    private final IntStringHashTable owner;
    private final int key;

    protected Node(IntStringHashTable owner, int key) {
      this.owner = owner;
      this.key = key;
    }

    @Override
    public Integer getKey() {
      return this.key;
    }

    @Override
    public String getValue() {
      String value = this.owner.get(this.key);
      if (value == null) {
        throw new IllegalStateException("Entry no longer in map");
      }
      return value;
    }

    @Override
    public String setValue(String value) {
      Objects.requireNonNull(value);
      if (!this.owner.containsKey(this.key)) {
        throw new IllegalStateException("Entry no longer in map");
      }
      // overwrite of an existing key, not a structural change
      return this.owner.put(this.key, value);
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Map.Entry<?, ?>)) {
        return false;
      }
      Map.Entry<?, ?> e = (Map.Entry<?, ?>) o;
      return Objects.equals(this.getKey(), e.getKey()) && Objects.equals(this.getValue(), e.getValue());
    }

    @Override
    public int hashCode() {
      return Integer.hashCode(this.key) ^ this.getValue().hashCode();
    }

    @Override
    public String toString() {
      return this.key + "=" + this.getValue();
    }
  }

  protected static class EntrySet extends AbstractSet<Map.Entry<Integer, String>> {
    private final IntStringHashTable owner;
    protected EntrySet(final IntStringHashTable owner) {
      this.owner = owner;
    }

    public final int size() {
      return owner.size;
    }
    public final void clear() {
      owner.clear();
    }
    public final Iterator<Map.Entry<Integer, String>> iterator() {
      return new EntryIterator(owner);
    }

    public final boolean contains(Object o) {
      if (!(o instanceof Map.Entry<?, ?>)) {
        return false;
      }
      return owner.containsEntry((Map.Entry<?, ?>) o);
    }
    public final boolean remove(Object o) {
      if (o instanceof Map.Entry<?, ?>) {
        Map.Entry<?, ?> e = (Map.Entry<?, ?>) o;
        return owner.remove(e.getKey(), e.getValue());
      }
      return false;
    }
  }

  protected static abstract class HashIterator {
    protected final IntStringHashTable owner;
    private int expectedModCount;
    // position of the next pair to return; bucketIndex == buckets.length when exhausted
    private int bucketIndex;
    private int pos;
    // position of the pair last returned, lastPos < 0 when there is none
    private int lastBucketIndex;
    private int lastPos;

    protected HashIterator(final IntStringHashTable owner) {
      this.owner = owner;
      this.expectedModCount = owner.modCount;
      this.bucketIndex = 0;
      this.pos = 0;
      this.lastPos = -1;
      this.seek();
    }

    private void seek() {
      Bucket[] buckets = owner.buckets;
      while (this.bucketIndex < buckets.length
          && (buckets[this.bucketIndex] == null || this.pos >= buckets[this.bucketIndex].size)) {
        this.bucketIndex++;
        this.pos = 0;
      }
    }

    public final boolean hasNext() {
      return this.bucketIndex < owner.buckets.length;
    }

    public final void remove() {
      if (this.lastPos < 0) {
        throw new IllegalStateException();
      }
      if (owner.modCount != this.expectedModCount) {
        throw new ConcurrentModificationException();
      }
      owner.removeAt(owner.buckets[this.lastBucketIndex], this.lastPos);
      if (this.bucketIndex == this.lastBucketIndex) {
        // the chain's last pair was moved into the removed slot and has not been returned yet
        this.pos = this.lastPos;
      }
      this.lastPos = -1;
      this.expectedModCount = owner.modCount;
    }

    /** Moves past the next pair and returns its bucket; the pair's slot is then {@code lastPos}. */
    private Bucket advance() {
      if (owner.modCount != this.expectedModCount) {
        throw new ConcurrentModificationException();
      }
      if (!this.hasNext()) {
        throw new NoSuchElementException();
      }
      this.lastBucketIndex = this.bucketIndex;
      this.lastPos = this.pos;
      this.pos++;
      this.seek();
      return owner.buckets[this.lastBucketIndex];
    }

    protected final int nextKey() {
      Bucket bucket = this.advance();
      return bucket.keys[this.lastPos];
    }

    protected final String nextValue() {
      Bucket bucket = this.advance();
      return bucket.values[this.lastPos];
    }
  }

  protected static class KeyIterator extends HashIterator implements Iterator<Integer> {
    protected KeyIterator(final IntStringHashTable owner) {
      super(owner);
    }
    public final Integer next() {
      return this.nextKey();
    }
  }

  protected static class ValueIterator extends HashIterator implements Iterator<String> {
    protected ValueIterator(final IntStringHashTable owner) {
      super(owner);
    }
    public final String next() {
      return this.nextValue();
    }
  }

  protected static class EntryIterator extends HashIterator implements Iterator<Map.Entry<Integer, String>> {
    protected EntryIterator(final IntStringHashTable owner) {
      super(owner);
    }
    public final Map.Entry<Integer, String> next() {
      return new Node(owner, this.nextKey());
    }
  }

  // end section adapted from
  // https://github.com/apache/commons-collections/blob/master/src/main/java/org/apache/commons/collections4/map/AbstractHashedMap.java
}
