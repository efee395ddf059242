package com.flamingo.ai.foodscout.service.poi;

import com.flamingo.ai.foodscout.config.ScoutConfig;
import com.flamingo.ai.foodscout.domain.model.PoiRecord;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/** HTTP client for the POI gateway's place search. */
@Component
@Slf4j
public class HttpPoiLookupClient implements PoiLookupClient {

  private final WebClient webClient;
  private final Duration timeout;

  public HttpPoiLookupClient(ScoutConfig scoutConfig) {
    ScoutConfig.Poi poi = scoutConfig.getPoi();
    this.timeout = Duration.ofMillis(poi.getTimeoutMs());
    this.webClient = WebClient.builder().baseUrl(poi.getBaseUrl()).build();
    log.info("POI client initialized: baseUrl={}", poi.getBaseUrl());
  }

  @Override
  public Optional<PoiRecord> lookup(String name, String cityHint) {
    PlaceSearchResponse response =
        webClient
            .get()
            .uri(
                uriBuilder ->
                    uriBuilder
                        .path("/places/search")
                        .queryParam("keywords", name)
                        .queryParam("city", cityHint == null ? "" : cityHint)
                        .queryParam("limit", 1)
                        .build())
            .retrieve()
            .bodyToMono(PlaceSearchResponse.class)
            .timeout(timeout)
            .block();

    if (response == null || response.places() == null || response.places().isEmpty()) {
      return Optional.empty();
    }
    PlacePayload place = response.places().get(0);
    return Optional.of(
        new PoiRecord(
            place.name() != null ? place.name() : name,
            place.address(),
            place.tel(),
            place.rating(),
            place.photos() != null ? place.photos() : List.of(),
            place.tags() != null ? place.tags() : List.of()));
  }

  record PlaceSearchResponse(List<PlacePayload> places) {}

  record PlacePayload(
      String name,
      String address,
      String tel,
      Double rating,
      List<String> photos,
      List<String> tags) {}
}
