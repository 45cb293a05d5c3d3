package com.github.dimitryivaniuta.essportal.gateway.web.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;

/**
 * Leave submission. Accepts {@code from}/{@code to} as aliases of {@code from_date}/{@code to_date}.
 */
public record LeaveRequest(
        @NotNull Long leaveTypeId,
        @NotNull @JsonAlias("from") LocalDate fromDate,
        @NotNull @JsonAlias("to") LocalDate toDate,
        String note
) { }
