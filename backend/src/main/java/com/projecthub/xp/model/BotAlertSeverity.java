package com.projecthub.xp.model;

public enum BotAlertSeverity {
    LOW,
    MEDIUM,
    HIGH
}
