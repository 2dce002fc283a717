package com.example.funnel.api;

import jakarta.validation.constraints.NotNull;

public record AutomationSwitchRequest(@NotNull(message = "enabled is required") Boolean enabled) {}
