package com.flamingo.ai.foodscout.service.poi;

import com.flamingo.ai.foodscout.config.ScoutConfig;
import com.flamingo.ai.foodscout.domain.model.PoiRecord;
import com.flamingo.ai.foodscout.domain.model.RestaurantRecommendation;
import com.flamingo.ai.foodscout.domain.model.ShopNames;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Adds address, phone, rating, photos and tags to recommendations. Lookups are cached by shop name,
 * including misses; failures are not cached and leave the recommendation as it was.
 */
@Service
@Slf4j
public class PoiEnrichmentService {

  private final PoiLookupClient client;
  private final MeterRegistry meterRegistry;
  private final boolean enabled;
  private final Cache<String, Optional<PoiRecord>> cache;

  public PoiEnrichmentService(
      PoiLookupClient client, ScoutConfig scoutConfig, MeterRegistry meterRegistry) {
    this.client = client;
    this.meterRegistry = meterRegistry;
    ScoutConfig.Poi poi = scoutConfig.getPoi();
    this.enabled = poi.isEnabled();
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(poi.getCacheSize())
            .expireAfterWrite(Duration.ofMinutes(poi.getCacheTtlMinutes()))
            .build();
  }

  /** Enriches in place and returns the same instance. */
  public RestaurantRecommendation enrich(RestaurantRecommendation recommendation, String cityHint) {
    if (!enabled) {
      return recommendation;
    }

    String key = ShopNames.normalize(recommendation.getName());
    Optional<PoiRecord> poi = cache.getIfPresent(key);
    if (poi == null) {
      try {
        poi = client.lookup(recommendation.getName(), cityHint);
        cache.put(key, poi);
        meterRegistry.counter("scout.poi.lookups", "outcome", poi.isPresent() ? "hit" : "miss")
            .increment();
      } catch (RuntimeException e) {
        meterRegistry.counter("scout.poi.lookups", "outcome", "failed").increment();
        log.warn("POI lookup failed for '{}': {}", recommendation.getName(), e.getMessage());
        return recommendation;
      }
    }

    poi.ifPresent(recommendation::applyPoi);
    return recommendation;
  }
}
