package com.flamingo.ai.foodscout.service.tagging;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.foodscout.agent.SemanticTaggerAgent;
import com.flamingo.ai.foodscout.agent.dto.CommentTag;
import com.flamingo.ai.foodscout.agent.dto.CommentTagBatch;
import com.flamingo.ai.foodscout.domain.enums.IdentityStrength;
import com.flamingo.ai.foodscout.domain.enums.Sentiment;
import com.flamingo.ai.foodscout.domain.model.NormalizedCommentUnit;
import com.flamingo.ai.foodscout.domain.model.SemanticTag;
import com.flamingo.ai.foodscout.exception.SemanticTaggingException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SemanticTaggerAdapterTest {

  @Mock private SemanticTaggerAgent agent;

  private SimpleMeterRegistry meterRegistry;
  private SemanticTaggerAdapter adapter;

  private final List<NormalizedCommentUnit> units =
      List.of(
          new NormalizedCommentUnit("c0", "I grew up two streets away", 60, 0, 2.0),
          new NormalizedCommentUnit("c1", "overrated", 3, 0, 1.0));

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    adapter = new SemanticTaggerAdapter(agent, new ObjectMapper(), meterRegistry);
  }

  @Test
  void shouldSendOnlyIdsAndTexts_andMapLabels() {
    // Given
    when(agent.tag(eq("Noodles"), contains("\"id\":\"c0\"")))
        .thenReturn(
            new CommentTagBatch(
                List.of(
                    new CommentTag("c0", "strong", "positive", true, List.of(" Old Noodle House ")),
                    new CommentTag("c1", "none", "negative", false, List.of()))));

    // When
    Map<String, SemanticTag> tags = adapter.tag("d1", "Noodles", units);

    // Then
    SemanticTag first = tags.get("c0");
    assertThat(first.identity()).isEqualTo(IdentityStrength.STRONG);
    assertThat(first.sentiment()).isEqualTo(Sentiment.POSITIVE);
    assertThat(first.correction()).isTrue();
    assertThat(first.mentionedShops()).containsExactly("Old Noodle House");
    assertThat(tags.get("c1").sentiment()).isEqualTo(Sentiment.NEGATIVE);
  }

  @Test
  void shouldDegradeUnknownLabels_andFillSkippedUnits() {
    // Given
    when(agent.tag(anyString(), anyString()))
        .thenReturn(
            new CommentTagBatch(
                Arrays.asList(
                    null,
                    new CommentTag("c0", "VERY_STRONG", "ecstatic", null, null),
                    new CommentTag("c9", "strong", "positive", true, List.of("Ghost")))));

    // When
    Map<String, SemanticTag> tags = adapter.tag("d1", "Noodles", units);

    // Then
    assertThat(tags).containsOnlyKeys("c0", "c1");
    assertThat(tags.get("c0").identity()).isEqualTo(IdentityStrength.NONE);
    assertThat(tags.get("c0").sentiment()).isEqualTo(Sentiment.NEUTRAL);
    assertThat(tags.get("c0").correction()).isFalse();
    assertThat(tags.get("c1")).isEqualTo(SemanticTag.empty("c1"));
    assertThat(meterRegistry.counter("scout.tagger.missing_units").count()).isEqualTo(1.0);
  }

  @Test
  void shouldThrowTaggingException_whenAgentFails() {
    // Given
    when(agent.tag(anyString(), anyString())).thenThrow(new RuntimeException("timeout"));

    // When / Then
    assertThatThrownBy(() -> adapter.tag("d1", "Noodles", units))
        .isInstanceOf(SemanticTaggingException.class)
        .hasCauseInstanceOf(RuntimeException.class);
    assertThat(meterRegistry.counter("scout.tagger.failures").count()).isEqualTo(1.0);
  }

  @Test
  void shouldThrowTaggingException_whenTagListMissing() {
    // Given
    when(agent.tag(anyString(), anyString())).thenReturn(new CommentTagBatch(null));

    // When / Then
    assertThatThrownBy(() -> adapter.tag("d1", "Noodles", units))
        .isInstanceOf(SemanticTaggingException.class);
    verify(agent).tag(anyString(), anyString());
  }

  @Test
  void shouldSkipCollaborator_whenNoUnits() {
    assertThat(adapter.tag("d1", "Noodles", List.of())).isEmpty();
    verifyNoInteractions(agent);
  }
}
