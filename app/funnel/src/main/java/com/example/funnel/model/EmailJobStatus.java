package com.example.funnel.model;

public enum EmailJobStatus {
  PENDING,
  SENDING,
  SENT,
  FAILED
}
