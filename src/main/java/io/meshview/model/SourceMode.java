package io.meshview.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SourceMode {
    LOCAL_ONLY("local_only"),
    AUGMENTED("augmented");

    private final String label;

    SourceMode(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
