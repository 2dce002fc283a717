/*
 * Where: Funnel domain model
 * What: A confirmed send of one step to one user
 * Why: The (user, step) pair is the unit of at-most-once delivery
 */
package com.example.funnel.model;

import java.time.Instant;

public record SendRecord(String userId, String stepKey, Instant sentAt, SendMeta meta) {}
