package com.flamingo.ai.foodscout.service.tagging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.foodscout.agent.SemanticTaggerAgent;
import com.flamingo.ai.foodscout.agent.dto.CommentTag;
import com.flamingo.ai.foodscout.agent.dto.CommentTagBatch;
import com.flamingo.ai.foodscout.domain.enums.IdentityStrength;
import com.flamingo.ai.foodscout.domain.enums.Sentiment;
import com.flamingo.ai.foodscout.domain.model.NormalizedCommentUnit;
import com.flamingo.ai.foodscout.domain.model.SemanticTag;
import com.flamingo.ai.foodscout.exception.SemanticTaggingException;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Contract around the semantic tagger. Sends only unit ids and texts, and validates whatever comes
 * back: unknown labels degrade to none/neutral and units the tagger skipped get an empty tag, so
 * they carry no shop evidence.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SemanticTaggerAdapter {

  private final SemanticTaggerAgent agent;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;

  /**
   * Tags a document's units.
   *
   * @return one tag per unit id, in unit order
   * @throws SemanticTaggingException when the tagger fails or returns nothing usable
   */
  public Map<String, SemanticTag> tag(
      String documentId, String title, List<NormalizedCommentUnit> units) {
    if (units.isEmpty()) {
      return new LinkedHashMap<>();
    }

    CommentTagBatch batch;
    try {
      batch = agent.tag(title, toPayload(documentId, units));
    } catch (SemanticTaggingException e) {
      throw e;
    } catch (RuntimeException e) {
      meterRegistry.counter("scout.tagger.failures").increment();
      throw new SemanticTaggingException(documentId, "Semantic tagger call failed", e);
    }

    if (batch == null || batch.tags() == null) {
      meterRegistry.counter("scout.tagger.failures").increment();
      throw new SemanticTaggingException(documentId, "Semantic tagger returned no tag list");
    }

    return validate(units, batch.tags());
  }

  Map<String, SemanticTag> validate(List<NormalizedCommentUnit> units, List<CommentTag> rawTags) {
    Map<String, CommentTag> byId = new HashMap<>();
    for (CommentTag raw : rawTags) {
      if (raw != null && raw.id() != null) {
        byId.putIfAbsent(raw.id().trim(), raw);
      }
    }

    Map<String, SemanticTag> tags = new LinkedHashMap<>();
    int missing = 0;
    for (NormalizedCommentUnit unit : units) {
      CommentTag raw = byId.get(unit.id());
      if (raw == null) {
        missing++;
        tags.put(unit.id(), SemanticTag.empty(unit.id()));
        continue;
      }
      tags.put(
          unit.id(),
          new SemanticTag(
              unit.id(),
              IdentityStrength.fromLabel(raw.identity()),
              Sentiment.fromLabel(raw.sentiment()),
              Boolean.TRUE.equals(raw.isCorrection()),
              cleanShopNames(raw.shops())));
    }

    if (missing > 0) {
      meterRegistry.counter("scout.tagger.missing_units").increment(missing);
      log.debug("Tagger skipped {} of {} units", missing, units.size());
    }
    return tags;
  }

  private List<String> cleanShopNames(List<String> shops) {
    if (shops == null) {
      return List.of();
    }
    Set<String> cleaned = new LinkedHashSet<>();
    for (String shop : shops) {
      if (shop != null && !shop.isBlank()) {
        cleaned.add(shop.strip());
      }
    }
    return new ArrayList<>(cleaned);
  }

  private String toPayload(String documentId, List<NormalizedCommentUnit> units) {
    List<Map<String, String>> payload = new ArrayList<>();
    for (NormalizedCommentUnit unit : units) {
      payload.add(Map.of("id", unit.id(), "text", unit.text()));
    }
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      throw new SemanticTaggingException(documentId, "Could not serialize comment units", e);
    }
  }
}
