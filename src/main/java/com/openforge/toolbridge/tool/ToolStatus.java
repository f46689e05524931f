package com.openforge.toolbridge.tool;

import com.fasterxml.jackson.annotation.JsonValue;

/** Outcome of one adapter call. These are values, never exceptions. */
public enum ToolStatus {

    OK("ok"),

    /** Upstream answered that the resource does not exist. */
    NOT_FOUND("not_found"),

    /** Rejected input, timeout, connection failure or unexpected upstream status. */
    ADAPTER_ERROR("adapter_error");

    private final String code;

    ToolStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
