package com.github.dimitryivaniuta.essportal.connector.token;

import com.github.dimitryivaniuta.essportal.common.error.GatewayException;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Set of {@link ResourceKind}s a service token may touch. Empty means unrestricted.
 *
 * <p>Stored as a comma-separated list of tags. Unknown tags are rejected when parsing,
 * never silently dropped, so a typo cannot widen a scope to "unrestricted".</p>
 */
public final class TokenScope {

    private static final TokenScope UNRESTRICTED = new TokenScope(EnumSet.noneOf(ResourceKind.class));

    private final Set<ResourceKind> kinds;

    private TokenScope(final EnumSet<ResourceKind> kinds) {
        this.kinds = Collections.unmodifiableSet(kinds);
    }

    public static TokenScope unrestricted() {
        return UNRESTRICTED;
    }

    public static TokenScope of(final Collection<ResourceKind> kinds) {
        if (kinds == null || kinds.isEmpty()) {
            return UNRESTRICTED;
        }
        return new TokenScope(EnumSet.copyOf(kinds));
    }

    /**
     * Parses the stored/column form.
     *
     * @throws GatewayException VALIDATION when a tag is unknown
     */
    public static TokenScope parse(final String value) {
        if (value == null || value.isBlank()) {
            return UNRESTRICTED;
        }
        EnumSet<ResourceKind> kinds = EnumSet.noneOf(ResourceKind.class);
        for (String raw : value.split(",")) {
            String tag = raw.trim();
            if (tag.isEmpty()) {
                continue;
            }
            kinds.add(ResourceKind.fromTag(tag)
                    .orElseThrow(() -> GatewayException.validation("Unknown resource kind in scope: " + tag)));
        }
        return kinds.isEmpty() ? UNRESTRICTED : new TokenScope(kinds);
    }

    /** A null kind means the operation is not resource-scoped. */
    public boolean permits(final ResourceKind kind) {
        return kind == null || kinds.isEmpty() || kinds.contains(kind);
    }

    public boolean isUnrestricted() {
        return kinds.isEmpty();
    }

    public Set<ResourceKind> kinds() {
        return kinds;
    }

    public String toColumnValue() {
        return kinds.stream().map(ResourceKind::tag).collect(Collectors.joining(","));
    }

    @Override
    public boolean equals(final Object o) {
        return this == o || (o instanceof TokenScope other && kinds.equals(other.kinds));
    }

    @Override
    public int hashCode() {
        return Objects.hash(kinds);
    }

    @Override
    public String toString() {
        return isUnrestricted() ? "TokenScope[*]" : "TokenScope[" + toColumnValue() + "]";
    }
}
