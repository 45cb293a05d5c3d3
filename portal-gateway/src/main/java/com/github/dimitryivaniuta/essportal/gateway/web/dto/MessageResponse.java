package com.github.dimitryivaniuta.essportal.gateway.web.dto;

public record MessageResponse(String message) { }
