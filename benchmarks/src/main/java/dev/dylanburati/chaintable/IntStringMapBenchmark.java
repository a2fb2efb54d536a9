package dev.dylanburati.chaintable;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.infra.Blackhole;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;

@State(Scope.Benchmark)
public class IntStringMapBenchmark {
  @Param({"0.5", "0.75", "1.0"})
  public double loadFactor;

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void vocabularyIntStringHashTable(Blackhole bh) {
    bh.consume(vocabulary(new IntStringHashTable(IntStringHashTable.DEFAULT_CAPACITY, loadFactor)));
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void vocabularyHashMap(Blackhole bh) {
    bh.consume(vocabulary(new HashMap<>(IntStringHashTable.DEFAULT_CAPACITY, (float) loadFactor)));
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void vocabularyInt2ObjectMap(Blackhole bh) {
    bh.consume(vocabulary(new Int2ObjectOpenHashMap<>(IntStringHashTable.DEFAULT_CAPACITY, (float) loadFactor)));
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void sequentialIntStringHashTable(Blackhole bh) {
    bh.consume(sequential(new IntStringHashTable(IntStringHashTable.DEFAULT_CAPACITY, loadFactor)));
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void sequentialHashMap(Blackhole bh) {
    bh.consume(sequential(new HashMap<>(IntStringHashTable.DEFAULT_CAPACITY, (float) loadFactor)));
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void sequentialInt2ObjectMap(Blackhole bh) {
    bh.consume(sequential(new Int2ObjectOpenHashMap<>(IntStringHashTable.DEFAULT_CAPACITY, (float) loadFactor)));
  }

  private static int genWordId(double uniform) {
    // Prob of returning x is proportional to (x+3.7) ** -1.01
    // Similar distribution to English

    // d/dx cdf = const * (x+3.7) ** -1.01
    // cdf = const * ( [ -100 * (x+3.7) ** -0.01 ] - [ -100 * (3.7) ** -0.01 ] )
    // cdf = 100 * const * [ (3.7) ** -0.01 - (x+3.7) ** -0.01 ]

    // [ (3.7) ** -0.01 - (x+3.7) ** -0.01 ] = 0.01 * const * cdf
    // x + 3.7 = (-0.01 * const * cdf + (3.7) ** -0.01) ** -100

    // set maximum of x to 2**27 ->
    // 2**27 = (-0.01 * const * 1 + (3.7**0.01)) ** -100

    // ignoring the lhs constant 3.7
    return (int) Math.pow(-0.01 * 15.768233989819334 * uniform + 0.9870018865063785, -100.0);
  }

  private static final byte[] ALPH = "pfscxkde".getBytes(StandardCharsets.US_ASCII);

  private static String spell(int wordId) {
    byte[] wbuf = new byte[11];
    int wlen = 0;
    do {
      wbuf[wlen++] = ALPH[wordId & 7];
      wordId >>>= 3;
    } while (wordId != 0);
    return new String(wbuf, 0, wlen, StandardCharsets.US_ASCII);
  }

  public int vocabulary(Map<Integer, String> m) {
    Random r = new Random(0L);
    for (int i = 0; i < 20_000_000; i++) {
      int wid = genWordId(r.nextDouble());
      m.putIfAbsent(wid, spell(wid));
    }
    System.out.println("Size: " + m.size());
    return m.size();
  }

  // insert, look up and remove keys 0..n-1, every lookup a hit
  public int sequential(Map<Integer, String> m) {
    int n = 4_000_000;
    for (int i = 0; i < n; i++) {
      m.put(i, spell(i));
    }
    int hits = 0;
    for (int i = 0; i < n; i++) {
      if (m.get(i) != null) {
        hits++;
      }
    }
    for (int i = 0; i < n; i += 2) {
      m.remove(i);
    }
    System.out.println("Hits: " + hits + ", size: " + m.size());
    return hits + m.size();
  }
}
