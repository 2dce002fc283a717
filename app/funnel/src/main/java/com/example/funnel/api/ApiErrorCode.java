package com.example.funnel.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  NOT_FOUND,
  UNKNOWN_PASS
}
