package dev.dylanburati.chaintable;

/**
 * Computes hashes for insertion to chained tables. The rules of {@link Object#hashCode}
 * also apply here: a given key must always produce the same hash.
 */
public interface IntHasher {
  int hash(int key);
}
