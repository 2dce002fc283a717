package com.example.funnel.api;

public record AutomationSwitchResponse(boolean enabled) {}
