package com.projecthub.xp.model;

public enum BotAlertType {
    RAPID_PROJECT_PUBLISHING("rapid_project_publishing"),
    RAPID_IDEA_SUBMISSION("rapid_idea_submission");

    private final String code;

    BotAlertType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
