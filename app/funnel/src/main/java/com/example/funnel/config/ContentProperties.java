/*
 * Where: Funnel configuration binding
 * What: Catalog location and values shared by every rendered message
 * Why: The site URL differs per environment and is substituted into copy and CTA links
 */
package com.example.funnel.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "funnel.content")
public record ContentProperties(String siteUrl, String catalogLocation, String ctaLabel) {

  public ContentProperties {
    siteUrl = siteUrl == null || siteUrl.isBlank() ? "http://localhost:8080" : stripSlash(siteUrl);
    catalogLocation =
        catalogLocation == null || catalogLocation.isBlank()
            ? "classpath:catalog/funnel-steps.json"
            : catalogLocation;
    ctaLabel = ctaLabel == null || ctaLabel.isBlank() ? "Open the dashboard" : ctaLabel;
  }

  private static String stripSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
