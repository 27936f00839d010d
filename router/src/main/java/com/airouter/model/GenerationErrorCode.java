package com.airouter.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum GenerationErrorCode {
    /** Every provider tried within the attempt budget failed. */
    ALL_PROVIDERS_EXHAUSTED("all_providers_exhausted"),
    /** Nothing was eligible, so not a single attempt was made. */
    NO_ELIGIBLE_PROVIDERS("no_eligible_providers");

    private final String value;

    GenerationErrorCode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
