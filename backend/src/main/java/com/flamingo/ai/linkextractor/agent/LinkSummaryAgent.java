package com.flamingo.ai.linkextractor.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent for summarizing the page behind a link.
 *
 * <p>Produces two or three plain sentences on the main topic and key takeaways of the page.
 */
public interface LinkSummaryAgent {

  @SystemMessage(
      """
        You summarize web pages that someone saved to read later. Summarize the page in 2-3
        sentences. Focus on the main topic and the key takeaways. Write plain prose without
        markdown, headings or bullet points. Do not start with "This page" or "The article".
        """)
  @UserMessage(
      """
        Title: {{title}}
        URL: {{url}}
        User's note: {{note}}

        Content:
        {{content}}

        Summary:
        """)
  String summarize(
      @V("title") String title,
      @V("url") String url,
      @V("note") String note,
      @V("content") String content);
}
