/*
 * Where: Funnel service layer
 * What: Substitutes {{name}} placeholders from a variable map
 * Why: Unknown placeholders render as empty text so no raw token reaches a recipient
 */
package com.example.funnel.service;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class TemplateRenderer {

  /** Any key up to the closing braces, so every context key can be referenced. */
  private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([^{}]+?)\\s*\\}\\}");

  private TemplateRenderer() {}

  public static String render(String template, Map<String, String> variables) {
    if (template == null || template.isEmpty()) {
      return "";
    }
    final Matcher matcher = PLACEHOLDER.matcher(template);
    final StringBuilder rendered = new StringBuilder(template.length());
    while (matcher.find()) {
      final String value = variables == null ? null : variables.get(matcher.group(1));
      matcher.appendReplacement(rendered, Matcher.quoteReplacement(value == null ? "" : value));
    }
    matcher.appendTail(rendered);
    return rendered.toString();
  }
}
