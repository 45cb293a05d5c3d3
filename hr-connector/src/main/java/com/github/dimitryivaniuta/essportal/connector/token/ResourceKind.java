package com.github.dimitryivaniuta.essportal.connector.token;

import java.util.Arrays;
import java.util.Optional;

/**
 * HR resource families a service token can be scoped to. The tag is the stored form.
 */
public enum ResourceKind {
    EMPLOYEE("hr.employee"),
    LEAVE_TYPE("hr.leave.type"),
    LEAVE("hr.leave"),
    PAYSLIP("hr.payslip"),
    EXPENSE("hr.expense"),
    ATTENDANCE("hr.attendance"),
    ATTACHMENT("ir.attachment");

    private final String tag;

    ResourceKind(final String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static Optional<ResourceKind> fromTag(final String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String trimmed = tag.trim();
        return Arrays.stream(values()).filter(k -> k.tag.equals(trimmed)).findFirst();
    }
}
