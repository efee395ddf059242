package com.flamingo.ai.foodscout.config;

import com.flamingo.ai.foodscout.agent.FollowUpInterpretationAgent;
import com.flamingo.ai.foodscout.agent.IntentParserAgent;
import com.flamingo.ai.foodscout.agent.LegacyNoteAnalyzerAgent;
import com.flamingo.ai.foodscout.agent.SemanticTaggerAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the text-understanding agents using LangChain4j AI Services.
 *
 * <p>Every agent returns a small structured record; none of them is asked to do arithmetic.
 */
@Configuration
public class AiAgentConfig {

  /** Comment-level labelling for the scoring pipeline. */
  @Bean
  public SemanticTaggerAgent semanticTaggerAgent(ChatModel chatModel) {
    return AiServices.builder(SemanticTaggerAgent.class).chatModel(chatModel).build();
  }

  /** Whole-document analysis, used only when tagging fails. */
  @Bean
  public LegacyNoteAnalyzerAgent legacyNoteAnalyzerAgent(ChatModel chatModel) {
    return AiServices.builder(LegacyNoteAnalyzerAgent.class).chatModel(chatModel).build();
  }

  @Bean
  public IntentParserAgent intentParserAgent(ChatModel chatModel) {
    return AiServices.builder(IntentParserAgent.class).chatModel(chatModel).build();
  }

  /** Open-ended follow-up interpretation, reached only when no keyword rule matches. */
  @Bean
  public FollowUpInterpretationAgent followUpInterpretationAgent(ChatModel chatModel) {
    return AiServices.builder(FollowUpInterpretationAgent.class).chatModel(chatModel).build();
  }
}
