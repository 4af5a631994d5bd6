package io.b2mash.medicaid.rules;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Caches rule sets per (jurisdiction, year) with a bounded time-to-live in front of a slower
 * provider. Entries are immutable {@link RuleSet} records; a concurrent miss on the same key waits
 * for the single in-flight load while other keys proceed independently. Lookup failures are not
 * cached.
 */
public class CachingRulesProvider implements RulesProvider {

  private static final Logger log = LoggerFactory.getLogger(CachingRulesProvider.class);

  private final RulesProvider delegate;
  private final Cache<RulesKey, RuleSet> cache;
  private final Cache<RulesKey, RuleSet> latestCache;

  public CachingRulesProvider(RulesProvider delegate, Duration ttl, long maximumSize) {
    this(delegate, ttl, maximumSize, Ticker.systemTicker());
  }

  CachingRulesProvider(RulesProvider delegate, Duration ttl, long maximumSize, Ticker ticker) {
    this.delegate = delegate;
    this.cache = newCache(ttl, maximumSize, ticker);
    this.latestCache = newCache(ttl, maximumSize, ticker);
  }

  private static Cache<RulesKey, RuleSet> newCache(
      Duration ttl, long maximumSize, Ticker ticker) {
    return Caffeine.newBuilder()
        .expireAfterWrite(ttl)
        .maximumSize(maximumSize)
        .ticker(ticker)
        .build();
  }

  @Override
  public RuleSet getRules(Jurisdiction jurisdiction, int year) {
    return cache.get(
        new RulesKey(jurisdiction, year),
        key -> {
          log.debug("Rules cache miss: key={}", key);
          return delegate.getRules(key.jurisdiction(), key.year());
        });
  }

  /** Latest-year lookups are cached under the requested year, separately from exact lookups. */
  @Override
  public RuleSet getLatestRules(Jurisdiction jurisdiction, int year) {
    return latestCache.get(
        new RulesKey(jurisdiction, year),
        key -> {
          log.debug("Latest rules cache miss: key={}", key);
          return delegate.getLatestRules(key.jurisdiction(), key.year());
        });
  }

  public void invalidate(Jurisdiction jurisdiction, int year) {
    cache.invalidate(new RulesKey(jurisdiction, year));
    // a latest-year entry for any later year may point at this rule set
    latestCache.asMap().keySet().removeIf(key -> key.jurisdiction().equals(jurisdiction));
  }

  public void invalidateAll() {
    cache.invalidateAll();
    latestCache.invalidateAll();
  }

  long estimatedSize() {
    return cache.estimatedSize() + latestCache.estimatedSize();
  }
}
