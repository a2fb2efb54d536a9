package dev.dylanburati;

import dev.dylanburati.chaintable.IntStringHashTable;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;

public class App {
  private static int genWordId(double uniform) {
    // Prob of returning x is proportional to (x+3.7) ** -1.01
    // Similar distribution to English

    // x + 3.7 = (-0.01 * const * cdf + (3.7) ** -0.01) ** -100
    // with const chosen so that the maximum of x is 2**27
    return (int) Math.pow(-0.01 * 15.768233989819334 * uniform + 0.9870018865063785, -100.0);
  }

  private static String spell(int wordId) {
    byte[] alph = "pfscxkde".getBytes(StandardCharsets.US_ASCII);
    byte[] wbuf = new byte[11];
    int wlen = 0;
    do {
      wbuf[wlen++] = alph[wordId & 7];
      wordId >>>= 3;
    } while (wordId != 0);
    return new String(wbuf, 0, wlen, StandardCharsets.US_ASCII);
  }

  /** Records the spelling of each word id the first time it is drawn, then removes every tenth id. */
  public static int vocabulary(Map<Integer, String> m, int draws) {
    Random r = new Random(0L);
    for (int i = 0; i < draws; i++) {
      int wid = genWordId(r.nextDouble());
      m.putIfAbsent(wid, spell(wid));
    }
    for (int wid = 0; wid < draws; wid += 10) {
      m.remove(wid);
    }
    System.out.println("Size: " + m.size());
    return m.size();
  }

  public static void main(String[] args) {
    Map<Integer, String> m;
    switch (args.length > 0 ? args[0] : "") {
      case "java.util":
        m = new HashMap<Integer, String>();
        break;
      case "fastutil":
        m = new Int2ObjectOpenHashMap<String>();
        break;
      default:
        m = new IntStringHashTable();
        break;
    };
    vocabulary(m, 10_000_000);
    if (m instanceof IntStringHashTable) {
      System.out.println("Capacity: " + ((IntStringHashTable) m).capacity());
    }
  }
}
