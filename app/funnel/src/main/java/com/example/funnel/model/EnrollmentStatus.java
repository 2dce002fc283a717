package com.example.funnel.model;

public enum EnrollmentStatus {
  ACTIVE,
  COMPLETED
}
