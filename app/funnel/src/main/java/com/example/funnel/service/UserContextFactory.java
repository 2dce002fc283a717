/*
 * Where: Funnel service layer
 * What: Builds the template variables for one user
 * Why: Prompts, fallback copy and job payloads all substitute the same names
 */
package com.example.funnel.service;

import com.example.funnel.config.ContentProperties;
import com.example.funnel.model.UserSnapshot;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class UserContextFactory {

  private final ContentProperties contentProperties;

  public Map<String, String> forUser(UserSnapshot user) {
    return forUser(user, Map.of());
  }

  /** Extra values are applied first so user fields cannot be overridden by enrollment context. */
  public Map<String, String> forUser(UserSnapshot user, Map<String, String> extra) {
    final Map<String, String> context = new HashMap<>();
    extra.forEach(
        (key, value) -> {
          if (key != null && value != null) {
            context.put(key, value);
          }
        });
    context.put("first_name", user.displayFirstName());
    context.put("email", user.email() == null ? "" : user.email());
    context.put("plan", user.onPaidPlan() ? user.plan() : UserSnapshot.FREE_PLAN);
    context.put("user_id", user.id());
    context.put("site_url", contentProperties.siteUrl());
    return Map.copyOf(context);
  }

  public Map<String, String> siteDefaults() {
    return Map.of("site_url", contentProperties.siteUrl());
  }
}
