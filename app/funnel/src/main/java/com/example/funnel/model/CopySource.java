package com.example.funnel.model;

public enum CopySource {
  AI,
  FALLBACK
}
