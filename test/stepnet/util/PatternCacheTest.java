package stepnet.util;

import java.util.regex.Pattern;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class PatternCacheTest {

  @Test
  void testHitsAndMisses() {
    PatternCache cache = new PatternCache(4);
    Pattern first = cache.get("STAP\\s+\\d+");
    Assertions.assertSame(first, cache.get("STAP\\s+\\d+"));
    Assertions.assertEquals(1, cache.getHitCount());
    Assertions.assertEquals(1, cache.getMissCount());

    // flags are part of the key
    Pattern insensitive = cache.get("STAP\\s+\\d+", Pattern.CASE_INSENSITIVE);
    Assertions.assertNotSame(first, insensitive);
    Assertions.assertTrue(insensitive.matcher("stap 3").matches());
    Assertions.assertFalse(first.matcher("stap 3").matches());
    Assertions.assertEquals(2, cache.size());
  }

  @Test
  void testLeastRecentlyUsedEviction() {
    PatternCache cache = new PatternCache(2);
    Pattern a = cache.get("a");
    cache.get("b");
    Assertions.assertSame(a, cache.get("a"));
    cache.get("c");
    Assertions.assertEquals(2, cache.size());

    // b was the least recently used entry
    long misses = cache.getMissCount();
    Assertions.assertSame(a, cache.get("a"));
    cache.get("b");
    Assertions.assertEquals(misses + 1, cache.getMissCount());
    Assertions.assertEquals(2, cache.getCapacity());
  }

  @Test
  void testClear() {
    PatternCache cache = new PatternCache(8);
    cache.get("x");
    cache.get("x");
    cache.clear();
    Assertions.assertEquals(0, cache.size());
    Assertions.assertEquals(0, cache.getHitCount());
    Assertions.assertEquals(0, cache.getMissCount());
  }

  @Test
  void testInvalidArguments() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> new PatternCache(0));
    PatternCache cache = new PatternCache(1);
    Assertions.assertThrows(java.util.regex.PatternSyntaxException.class, () -> cache.get("(unclosed"));
    Assertions.assertEquals(0, cache.size());
  }
}
