package com.example.funnel.service;

import com.example.funnel.service.dto.CopyGenerationResponse;
import java.util.Map;

/** AI collaborator that drafts a subject and body from prompts. */
public interface CopyGenerator {

  /**
   * @throws CopyGenerationException on any failure, timeout or unusable answer
   */
  CopyGenerationResponse generate(
      String subjectPrompt, String bodyPrompt, Map<String, String> userContext);
}
