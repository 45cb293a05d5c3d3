package com.github.dimitryivaniuta.essportal.gateway.web.dto;

import jakarta.validation.constraints.NotBlank;

public record RefreshRequest(@NotBlank String refreshToken) { }
