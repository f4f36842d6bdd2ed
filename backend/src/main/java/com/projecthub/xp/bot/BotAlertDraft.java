package com.projecthub.xp.bot;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.projecthub.xp.model.BotAlertSeverity;
import com.projecthub.xp.model.BotAlertType;

public record BotAlertDraft(
        BotAlertType alertType,
        BotAlertSeverity severity,
        int scoreIncrease,
        ObjectNode evidence
) {
}
