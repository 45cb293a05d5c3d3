package com.github.dimitryivaniuta.essportal.gateway.auth;

/**
 * Access and refresh token issued together by login and refresh.
 */
public record TokenPair(MintedToken access, MintedToken refresh) { }
