package com.projecthub.xp.service;

import com.projecthub.xp.model.XpReason;
import com.projecthub.xp.model.XpTransaction;
import com.projecthub.xp.repository.XpTransactionRepository;
import com.projecthub.xp.rules.AwardContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

@Component
@RequiredArgsConstructor
public class LedgerAwardContext implements AwardContext {

    private final XpTransactionRepository xpTransactionRepository;

    @Override
    public Optional<UUID> firstProjectAwardedFor(UUID actorId) {
        return xpTransactionRepository.findFirstByActorIdAndReason(actorId, XpReason.FIRST_PROJECT)
                .map(XpTransaction::getProjectId);
    }
}
