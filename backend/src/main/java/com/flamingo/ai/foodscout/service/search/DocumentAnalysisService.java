package com.flamingo.ai.foodscout.service.search;

import com.flamingo.ai.foodscout.agent.LegacyNoteAnalyzerAgent;
import com.flamingo.ai.foodscout.agent.dto.NoteAnalysis;
import com.flamingo.ai.foodscout.config.ScoutConfig;
import com.flamingo.ai.foodscout.domain.enums.ShopVerdict;
import com.flamingo.ai.foodscout.domain.model.NormalizedCommentUnit;
import com.flamingo.ai.foodscout.domain.model.RestaurantRecommendation;
import com.flamingo.ai.foodscout.domain.model.SearchIntent;
import com.flamingo.ai.foodscout.domain.model.SemanticTag;
import com.flamingo.ai.foodscout.domain.model.ShopAssessment;
import com.flamingo.ai.foodscout.domain.model.ShopScore;
import com.flamingo.ai.foodscout.domain.model.SourceDocument;
import com.flamingo.ai.foodscout.domain.model.UnitScore;
import com.flamingo.ai.foodscout.exception.DocumentSourceException;
import com.flamingo.ai.foodscout.exception.SemanticTaggingException;
import com.flamingo.ai.foodscout.service.preprocess.CommentPreprocessor;
import com.flamingo.ai.foodscout.service.scoring.ScoringEngine;
import com.flamingo.ai.foodscout.service.source.DocumentSource;
import com.flamingo.ai.foodscout.service.tagging.SemanticTaggerAdapter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs preprocess, tag and score for each document and turns shop scores into recommendation
 * candidates. Documents are analysed in parallel on a bounded pool; one document failing only
 * removes that document's candidates.
 */
@Service
@Slf4j
public class DocumentAnalysisService {

  private static final int SNIPPET_LENGTH = 60;

  private final DocumentSource documentSource;
  private final CommentPreprocessor preprocessor;
  private final SemanticTaggerAdapter taggerAdapter;
  private final ScoringEngine scoringEngine;
  private final LegacyNoteAnalyzerAgent legacyAgent;
  private final ScoutConfig scoutConfig;
  private final MeterRegistry meterRegistry;
  private final Executor analysisExecutor;

  public DocumentAnalysisService(
      DocumentSource documentSource,
      CommentPreprocessor preprocessor,
      SemanticTaggerAdapter taggerAdapter,
      ScoringEngine scoringEngine,
      LegacyNoteAnalyzerAgent legacyAgent,
      ScoutConfig scoutConfig,
      MeterRegistry meterRegistry,
      @Qualifier("analysisExecutor") Executor analysisExecutor) {
    this.documentSource = documentSource;
    this.preprocessor = preprocessor;
    this.taggerAdapter = taggerAdapter;
    this.scoringEngine = scoringEngine;
    this.legacyAgent = legacyAgent;
    this.scoutConfig = scoutConfig;
    this.meterRegistry = meterRegistry;
    this.analysisExecutor = analysisExecutor;
  }

  /** Analyses all documents; candidates come back grouped in document order. */
  public List<RestaurantRecommendation> analyzeAll(
      List<SourceDocument> documents, SearchIntent intent) {
    List<CompletableFuture<List<RestaurantRecommendation>>> futures = new ArrayList<>();
    for (SourceDocument document : documents) {
      futures.add(
          CompletableFuture.supplyAsync(() -> analyzeSafely(document, intent), analysisExecutor));
    }

    List<RestaurantRecommendation> candidates = new ArrayList<>();
    for (CompletableFuture<List<RestaurantRecommendation>> future : futures) {
      candidates.addAll(future.join());
    }
    log.info("Analysed {} documents into {} shop candidates", documents.size(), candidates.size());
    return candidates;
  }

  private List<RestaurantRecommendation> analyzeSafely(
      SourceDocument document, SearchIntent intent) {
    try {
      return analyze(document, intent);
    } catch (RuntimeException e) {
      meterRegistry.counter("scout.documents.analysed", "outcome", "failed").increment();
      log.warn("Skipping document {} after analysis failure: {}", document.id(), e.getMessage());
      return List.of();
    }
  }

  /** Analyses one document, falling back to single-pass analysis if tagging fails. */
  public List<RestaurantRecommendation> analyze(SourceDocument document, SearchIntent intent) {
    SourceDocument complete = withComments(document);
    List<NormalizedCommentUnit> units = preprocessor.preprocess(complete.comments());
    if (units.isEmpty()) {
      log.debug("Document {} has no usable comments", complete.id());
      meterRegistry.counter("scout.documents.analysed", "outcome", "empty").increment();
      return List.of();
    }

    Map<String, SemanticTag> tags;
    try {
      tags = taggerAdapter.tag(complete.id(), complete.title(), units);
    } catch (SemanticTaggingException e) {
      meterRegistry.counter("scout.tagger.fallbacks").increment();
      log.warn("Tagging failed for document {}, using single-pass analysis", complete.id());
      return analyzeLegacy(complete, units, intent);
    }

    Map<String, ShopScore> shopScores = scoringEngine.scoreAll(units, tags);
    List<RestaurantRecommendation> candidates = new ArrayList<>();
    for (ShopScore shopScore : shopScores.values()) {
      ShopAssessment assessment = scoringEngine.classify(shopScore);
      candidates.add(
          RestaurantRecommendation.builder()
              .name(shopScore.name())
              .location(intent.location())
              .features(features(complete, shopScore))
              .sourceDocumentIds(new ArrayList<>(List.of(complete.id())))
              .confidence(assessment.confidence())
              .assessment(assessment)
              .build());
    }

    meterRegistry.counter("scout.documents.analysed", "outcome", "scored").increment();
    log.debug("Document {} yielded {} shops", complete.id(), candidates.size());
    return candidates;
  }

  private SourceDocument withComments(SourceDocument document) {
    if (document.hasComments()) {
      return document;
    }
    try {
      Optional<SourceDocument> fetched = documentSource.fetch(document.id());
      return fetched
          .filter(SourceDocument::hasComments)
          .map(f -> document.withComments(f.comments()))
          .orElse(document);
    } catch (DocumentSourceException e) {
      log.warn("Could not fetch comments for document {}: {}", document.id(), e.getMessage());
      return document;
    }
  }

  private List<String> features(SourceDocument document, ShopScore shopScore) {
    List<String> features = new ArrayList<>();
    if (!document.title().isBlank()) {
      features.add(document.title().strip());
    }
    shopScore.topUnits().stream()
        .limit(scoutConfig.getSearch().getFeatureSnippets())
        .map(UnitScore::text)
        .map(DocumentAnalysisService::snippet)
        .forEach(features::add);
    return features;
  }

  private List<RestaurantRecommendation> analyzeLegacy(
      SourceDocument document, List<NormalizedCommentUnit> units, SearchIntent intent) {
    String comments =
        units.stream()
            .map(u -> "[" + u.likes() + " likes] " + u.text())
            .collect(Collectors.joining("\n"));
    NoteAnalysis analysis =
        legacyAgent.analyze(
            document.title(),
            document.content(),
            comments,
            String.join(", ", intent.excludeKeywords()));

    List<RestaurantRecommendation> candidates = new ArrayList<>();
    if (analysis == null || analysis.restaurants() == null) {
      return candidates;
    }
    for (NoteAnalysis.AnalyzedShop shop : analysis.restaurants()) {
      if (shop == null || shop.name() == null || shop.name().isBlank()) {
        continue;
      }
      double confidence = clamp(shop.confidence() != null ? shop.confidence() : 0.5);
      ShopAssessment assessment =
          new ShopAssessment(
              ShopVerdict.fromLabel(shop.verdict()),
              confidence,
              shop.reasons(),
              Boolean.TRUE.equals(shop.hasLocalMentions()));
      candidates.add(
          RestaurantRecommendation.builder()
              .name(shop.name().strip())
              .location(
                  shop.location() != null && !shop.location().isBlank()
                      ? shop.location()
                      : intent.location())
              .features(
                  shop.features() != null ? new ArrayList<>(shop.features()) : new ArrayList<>())
              .sourceDocumentIds(new ArrayList<>(List.of(document.id())))
              .confidence(confidence)
              .assessment(assessment)
              .build());
    }
    meterRegistry.counter("scout.documents.analysed", "outcome", "legacy").increment();
    return candidates;
  }

  private static String snippet(String text) {
    return text.length() <= SNIPPET_LENGTH ? text : text.substring(0, SNIPPET_LENGTH) + "...";
  }

  private static double clamp(double value) {
    return Math.max(0.0, Math.min(1.0, value));
  }
}
