/*
 * Where: Funnel service layer
 * What: Turns plain-text copy into the HTML part of a message
 * Why: Copy is authored as plain text; paragraphs and bullet lists need markup in mail clients
 */
package com.example.funnel.service;

import com.example.funnel.config.ContentProperties;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

@Component
@RequiredArgsConstructor
public class EmailHtmlRenderer {

  private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n{2,}");
  private static final String BULLET = "•";
  private static final String PARAGRAPH_OPEN =
      "<p style=\"margin:0 0 16px;line-height:1.6;font-size:15px;\">";

  private final ContentProperties contentProperties;

  public String render(String subject, String text) {
    return render(subject, text, null);
  }

  /**
   * @param ctaPath path below the site URL; no button when blank
   */
  public String render(String subject, String text, String ctaPath) {
    final StringBuilder html = new StringBuilder(512);
    html.append("<!DOCTYPE html><html lang=\"en\"><head><meta charset=\"UTF-8\" />")
        .append("<title>")
        .append(escape(subject))
        .append("</title></head>")
        .append("<body style=\"margin:0;padding:24px;font-family:Arial,sans-serif;\">")
        .append("<div style=\"max-width:560px;margin:0 auto;\">");
    appendBody(html, text == null ? "" : text.replace("\r\n", "\n"));
    if (ctaPath != null && !ctaPath.isBlank()) {
      html.append("<p style=\"margin:24px 0;text-align:center;\"><a href=\"")
          .append(escape(ctaUrl(ctaPath)))
          .append("\" style=\"display:inline-block;padding:14px 32px;border-radius:999px;")
          .append("background:#1D4ED8;color:#F9FAFB;font-weight:600;text-decoration:none;\">")
          .append(escape(contentProperties.ctaLabel()))
          .append("</a></p>");
    }
    html.append("</div></body></html>");
    return html.toString();
  }

  String ctaUrl(String ctaPath) {
    if (ctaPath.startsWith("http://") || ctaPath.startsWith("https://")) {
      return ctaPath;
    }
    final String path = ctaPath.startsWith("/") ? ctaPath : "/" + ctaPath;
    return contentProperties.siteUrl() + path;
  }

  private void appendBody(StringBuilder html, String text) {
    for (String raw : PARAGRAPH_BREAK.split(text)) {
      final String paragraph = raw.trim();
      if (paragraph.isEmpty()) {
        continue;
      }
      if (paragraph.startsWith(BULLET) || paragraph.contains("\n" + BULLET)) {
        appendList(html, paragraph);
      } else {
        html.append(PARAGRAPH_OPEN)
            .append(escape(paragraph).replace("\n", "<br/>"))
            .append("</p>");
      }
    }
  }

  private void appendList(StringBuilder html, String paragraph) {
    final List<String> items = new ArrayList<>();
    for (String raw : paragraph.split("\n")) {
      final String line = raw.trim();
      if (line.isEmpty()) {
        continue;
      }
      if (line.startsWith(BULLET)) {
        items.add(line.substring(BULLET.length()).trim());
        continue;
      }
      flushList(html, items);
      html.append(PARAGRAPH_OPEN).append(escape(line)).append("</p>");
    }
    flushList(html, items);
  }

  private void flushList(StringBuilder html, List<String> items) {
    if (items.isEmpty()) {
      return;
    }
    html.append("<ul style=\"margin:0 0 16px;padding-left:20px;\">");
    for (String item : items) {
      html.append("<li style=\"margin-bottom:8px;\">").append(escape(item)).append("</li>");
    }
    html.append("</ul>");
    items.clear();
  }

  private static String escape(String value) {
    return value == null ? "" : HtmlUtils.htmlEscape(value);
  }
}
