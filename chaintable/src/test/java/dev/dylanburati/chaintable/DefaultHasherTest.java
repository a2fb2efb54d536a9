package dev.dylanburati.chaintable;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;

class DefaultHasherTest {
  @Test void testSingleton() {
    assertSame(DefaultHasher.instance(), DefaultHasher.instance());
  }

  @Test void testDeterministic() {
    IntHasher hasher = DefaultHasher.instance();
    for (int k = -1000; k < 1000; k++) {
      assertEquals(hasher.hash(k), hasher.hash(k));
    }
  }

  @Test void testSpreadsSequentialKeys() {
    IntHasher hasher = DefaultHasher.instance();
    IntSet used = new IntOpenHashSet();
    for (int k = 0; k < 1024; k++) {
      used.add((hasher.hash(k) & 0x7fff_ffff) % 1024);
    }
    assertTrue(used.size() > 512, "only " + used.size() + " buckets used");

    // strided keys collide under identity hashing
    used.clear();
    for (int k = 0; k < 1024; k++) {
      used.add((hasher.hash(k * 1024) & 0x7fff_ffff) % 1024);
    }
    assertTrue(used.size() > 512, "only " + used.size() + " buckets used");
  }
}
