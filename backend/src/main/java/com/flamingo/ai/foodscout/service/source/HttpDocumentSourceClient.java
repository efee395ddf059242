package com.flamingo.ai.foodscout.service.source;

import com.flamingo.ai.foodscout.config.ScoutConfig;
import com.flamingo.ai.foodscout.domain.model.RawComment;
import com.flamingo.ai.foodscout.domain.model.SourceDocument;
import com.flamingo.ai.foodscout.exception.DocumentSourceException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * HTTP client for the content-source gateway. Signing, rate limiting and pagination live behind
 * the gateway; this client only maps its JSON to domain documents.
 */
@Component
@Slf4j
public class HttpDocumentSourceClient implements DocumentSource {

  private final WebClient webClient;
  private final Duration timeout;

  public HttpDocumentSourceClient(ScoutConfig scoutConfig) {
    ScoutConfig.Source source = scoutConfig.getSource();
    this.timeout = Duration.ofMillis(source.getTimeoutMs());
    this.webClient =
        WebClient.builder()
            .baseUrl(source.getBaseUrl())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
            .build();
    log.info("Document source client initialized: baseUrl={}", source.getBaseUrl());
  }

  @Override
  public SourceSearchResult search(String query, int maxResults, String sort) {
    SearchResponse response;
    try {
      response =
          webClient
              .get()
              .uri(
                  uriBuilder ->
                      uriBuilder
                          .path("/search")
                          .queryParam("query", query)
                          .queryParam("limit", maxResults)
                          .queryParam("sort", sort)
                          .build())
              .retrieve()
              .bodyToMono(SearchResponse.class)
              .timeout(timeout)
              .block();
    } catch (RuntimeException e) {
      throw new DocumentSourceException(query, "Document search failed: " + e.getMessage(), e);
    }

    if (response == null || response.documents() == null) {
      return SourceSearchResult.empty();
    }
    List<SourceDocument> documents = new ArrayList<>();
    for (DocumentPayload payload : response.documents()) {
      if (payload != null && payload.id() != null) {
        documents.add(payload.toDomain());
      }
    }
    return new SourceSearchResult(documents, Boolean.TRUE.equals(response.partial()));
  }

  @Override
  public Optional<SourceDocument> fetch(String documentId) {
    try {
      DocumentPayload payload =
          webClient
              .get()
              .uri("/documents/{id}", documentId)
              .retrieve()
              .bodyToMono(DocumentPayload.class)
              .timeout(timeout)
              .block();
      return Optional.ofNullable(payload).map(DocumentPayload::toDomain);
    } catch (WebClientResponseException e) {
      if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
        return Optional.empty();
      }
      throw new DocumentSourceException(documentId, "Document fetch failed: " + e.getMessage(), e);
    } catch (RuntimeException e) {
      throw new DocumentSourceException(documentId, "Document fetch failed: " + e.getMessage(), e);
    }
  }

  record SearchResponse(List<DocumentPayload> documents, Boolean partial) {}

  record DocumentPayload(String id, String title, String content, List<CommentPayload> comments) {

    SourceDocument toDomain() {
      List<RawComment> mapped = new ArrayList<>();
      if (comments != null) {
        for (CommentPayload comment : comments) {
          if (comment != null) {
            mapped.add(
                new RawComment(comment.content(), comment.likeCount(), comment.subCommentCount()));
          }
        }
      }
      return new SourceDocument(id, title, content, mapped);
    }
  }

  record CommentPayload(String content, Integer likeCount, Integer subCommentCount) {}
}
