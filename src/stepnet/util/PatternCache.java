package stepnet.util;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Bounded least-recently-used cache of compiled patterns, keyed by pattern text and flags.
 * Has no effect on matching results; only saves recompilation of patterns built from configurable keyword sets.
 */
public class PatternCache {
  private record CacheKey(String regex, int flags) {}

  private final int capacity;
  private final LinkedHashMap<CacheKey, Pattern> cache;
  private long hitCount = 0;
  private long missCount = 0;

  public PatternCache(int capacity) {
    if (capacity < 1)
      throw new IllegalArgumentException("capacity must be positive");
    this.capacity = capacity;
    this.cache = new LinkedHashMap<CacheKey, Pattern>(16, 0.75f, true) {
      private static final long serialVersionUID = 1L;
      @Override
      protected boolean removeEldestEntry(Map.Entry<CacheKey, Pattern> eldest) {
        return size() > PatternCache.this.capacity;
      }
    };
  }

  public Pattern get(String regex) { return get(regex, 0); }

  public synchronized Pattern get(String regex, int flags) {
    CacheKey key = new CacheKey(regex, flags);
    Pattern pattern = cache.get(key);
    if (pattern != null) {
      ++hitCount;
      return pattern;
    }
    ++missCount;
    pattern = Pattern.compile(regex, flags);
    cache.put(key, pattern);
    return pattern;
  }

  public synchronized int size() { return cache.size(); }
  public int getCapacity() { return capacity; }
  public synchronized long getHitCount() { return hitCount; }
  public synchronized long getMissCount() { return missCount; }

  public synchronized void clear() {
    cache.clear();
    hitCount = 0;
    missCount = 0;
  }
}
