package com.projecthub.xp.bot;

import com.projecthub.xp.event.XpEvent;

import java.util.Optional;

public interface BotHeuristic {

    Optional<BotAlertDraft> inspect(XpEvent event, ActorHistory history);
}
