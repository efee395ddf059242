package com.flamingo.ai.foodscout.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.foodscout.api.rest.SearchController;
import com.flamingo.ai.foodscout.api.sse.SearchStreamController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests pinning the public endpoint paths.
 *
 * <ul>
 *   <li>POST /api/search - Submit a turn or fetch recovery info
 *   <li>GET /api/search/{sessionId}/recovery - Recovery info for a turn
 *   <li>DELETE /api/search/{sessionId} - Reset a session
 *   <li>GET /api/search/{sessionId}/stream - Event stream
 * </ul>
 */
class ApiContractTest {

  @Nested
  @DisplayName("SearchController API contract")
  class SearchControllerContract {

    @Test
    @DisplayName("should be mapped to /api/search")
    void shouldBeMappedToApiSearch() {
      RequestMapping mapping = SearchController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/search");
    }
  }

  @Nested
  @DisplayName("SearchStreamController API contract")
  class SearchStreamControllerContract {

    @Test
    @DisplayName("should be mapped to /api/search/{sessionId}")
    void shouldBeMappedToApiSearchWithId() {
      RequestMapping mapping = SearchStreamController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/search/{sessionId}");
    }
  }
}
