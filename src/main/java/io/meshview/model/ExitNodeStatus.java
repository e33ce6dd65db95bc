package io.meshview.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.Set;

public enum ExitNodeStatus {
    DISABLED("disabled"),
    PENDING("pending"),
    ACTIVE("active");

    private final String label;

    ExitNodeStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static ExitNodeStatus classify(boolean exitNodeOption, Collection<String> allowedRoutes) {
        if (!exitNodeOption) {
            return DISABLED;
        }
        Set<String> canonical = Cidr.canonicalSet(allowedRoutes);
        return canonical.containsAll(Cidr.DEFAULT_ROUTES) ? ACTIVE : PENDING;
    }
}
