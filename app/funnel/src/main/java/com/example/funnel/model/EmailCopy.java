package com.example.funnel.model;

/** Subject and plain-text body of a message, tagged with where the text came from. */
public record EmailCopy(String subject, String body, CopySource source) {

  public boolean isFallback() {
    return source == CopySource.FALLBACK;
  }
}
