package com.openforge.numen.contract;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RepairAction {
    NONE("none"),
    CREATED_ARTIFACT("created_artifact"),
    OVERWROTE_ARTIFACT_FROM_STORE("overwrote_artifact_from_store");

    private final String wireName;

    RepairAction(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
