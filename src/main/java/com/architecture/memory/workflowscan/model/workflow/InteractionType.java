package com.architecture.memory.workflowscan.model.workflow;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum InteractionType {
    BUTTON_CLICK,
    FORM_SUBMIT,
    PAGE_LOAD;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
