package dev.dylanburati.chaintable;

/* package-private */ class DefaultHasher implements IntHasher {
  private static DefaultHasher instance = null;

  private DefaultHasher() {}

  static DefaultHasher instance() {
    if (instance == null) {
      instance = new DefaultHasher();
    }
    return instance;
  }

  @Override
  public int hash(int key) {
    // Fibonacci hashing: 0x9E3779B9 is 2^32 / phi
    int h = key * 0x9E37_79B9;
    return h ^ (h >>> 16);
  }
}
