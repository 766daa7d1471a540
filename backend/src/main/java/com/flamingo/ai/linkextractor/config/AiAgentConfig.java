package com.flamingo.ai.linkextractor.config;

import com.flamingo.ai.linkextractor.agent.LinkSummaryAgent;
import com.flamingo.ai.linkextractor.agent.LinkTaggingAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the AI agents built with LangChain4j AI Services.
 *
 * <p>Agent interfaces declare their prompts with @SystemMessage/@UserMessage; implementations are
 * generated by AiServices.builder().
 */
@Configuration
public class AiAgentConfig {

  /** Summary agent for the summarize stage. Free-form text output. */
  @Bean
  public LinkSummaryAgent linkSummaryAgent(ChatModel chatModel) {
    return AiServices.builder(LinkSummaryAgent.class).chatModel(chatModel).build();
  }

  /** Tagging agent for the tag stage. Returns a JSON document as text. */
  @Bean
  public LinkTaggingAgent linkTaggingAgent(ChatModel chatModel) {
    return AiServices.builder(LinkTaggingAgent.class).chatModel(chatModel).build();
  }
}
