package com.example.slidecast_backend.dto.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record ScriptEntry(int slideNumber, String script) {
    @JsonIgnore
    public boolean isBlank() {
        return script == null || script.isBlank();
    }
}
