package com.flamingo.ai.linkextractor.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent for assigning vocabulary tags to a link. Answers with raw JSON text. */
public interface LinkTaggingAgent {

  @SystemMessage(
      """
        You analyze web links and assign tags from a fixed vocabulary.

        Rules:
        1. Select 1-5 tags that best describe the content.
        2. Only use tags from the AVAILABLE TAGS list, with the category they are listed under.
        3. Assign a confidence score between 0.0 and 1.0 to each tag.
        4. Use higher confidence for explicit mentions, lower for inferred topics.
        5. Return ONLY valid JSON, no other text, in this exact format:
           {"tags": [{"name": "tag-name", "category": "category_name", "confidence": 0.9}]}
        """)
  @UserMessage(
      """
        AVAILABLE TAGS:
        {{availableTags}}

        LINK INFORMATION:
        - Title: {{title}}
        - URL: {{url}}
        - Domain: {{domain}}
        - User's description: {{description}}
        - Summary: {{summary}}

        JSON response:
        """)
  String tag(
      @V("availableTags") String availableTags,
      @V("title") String title,
      @V("url") String url,
      @V("domain") String domain,
      @V("description") String description,
      @V("summary") String summary);
}
