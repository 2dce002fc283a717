/*
 * Where: Funnel service layer
 * What: Resolves subject and body for a step, falling back to the step's own copy
 * Why: Copy generation problems are cosmetic and must never block a send
 */
package com.example.funnel.service;

import com.example.funnel.model.CopySource;
import com.example.funnel.model.EmailCopy;
import com.example.funnel.model.EmailStep;
import com.example.funnel.service.dto.CopyGenerationResponse;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CopyResolver {

  private static final Logger logger = LoggerFactory.getLogger(CopyResolver.class);

  private final CopyGenerator copyGenerator;
  private final FunnelMetrics metrics;

  /** Never throws. */
  public EmailCopy resolve(EmailStep step, Map<String, String> userContext) {
    final Map<String, String> context = userContext == null ? Map.of() : userContext;
    if (hasText(step.subjectPrompt()) && hasText(step.bodyPrompt())) {
      try {
        final CopyGenerationResponse generated =
            copyGenerator.generate(
                TemplateRenderer.render(step.subjectPrompt(), context),
                TemplateRenderer.render(step.bodyPrompt(), context),
                context);
        if (generated != null && hasText(generated.subject()) && hasText(generated.body())) {
          return resolved(
              new EmailCopy(
                  TemplateRenderer.render(generated.subject().trim(), context),
                  TemplateRenderer.render(generated.body().trim(), context),
                  CopySource.AI));
        }
        logger.warn("ai copy incomplete, using fallback stepKey={}", step.key());
      } catch (CopyGenerationException ex) {
        logger.warn(
            "ai copy unavailable, using fallback stepKey={} reason={} message={}",
            step.key(),
            ex.reason(),
            ex.getMessage());
      } catch (RuntimeException ex) {
        logger.warn("ai copy failed, using fallback stepKey={}", step.key(), ex);
      }
    }
    return resolved(fallback(step, context));
  }

  public EmailCopy fallback(EmailStep step, Map<String, String> context) {
    return new EmailCopy(
        TemplateRenderer.render(step.fallbackSubject(), context),
        TemplateRenderer.render(step.fallbackBody(), context),
        CopySource.FALLBACK);
  }

  private EmailCopy resolved(EmailCopy copy) {
    metrics.recordCopySource(copy.source());
    return copy;
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
