package com.example.funnel.model;

public record OutgoingEmail(String to, String subject, String text, String html) {}
