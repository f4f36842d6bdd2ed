package com.projecthub.xp.service;

import com.projecthub.xp.config.XpEngineProperties;
import com.projecthub.xp.dto.ActorRequests;
import com.projecthub.xp.dto.ActorResponses;
import com.projecthub.xp.mapper.XpResponseMapper;
import com.projecthub.xp.model.Actor;
import com.projecthub.xp.repository.ActorRepository;
import com.projecthub.xp.repository.LeaderboardRankRepository;
import com.projecthub.xp.repository.XpTransactionRepository;
import com.projecthub.xp.web.XpEventRejectedException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class ActorService {

    static final int MAX_HISTORY_PAGE_SIZE = 200;

    private static final Logger log = LoggerFactory.getLogger(ActorService.class);

    private final ActorRepository actorRepository;
    private final XpTransactionRepository xpTransactionRepository;
    private final LeaderboardRankRepository leaderboardRankRepository;
    private final XpEngineProperties xpEngineProperties;
    private final XpResponseMapper xpResponseMapper;
    private final TransactionTemplate transactionTemplate;

    /**
     * Creates the actor if it does not exist yet. Re-provisioning returns the existing standing unchanged.
     */
    public ActorResponses.ActorStanding provision(ActorRequests.ProvisionActorRequest request) {
        if (!actorRepository.existsById(request.actorId())) {
            try {
                transactionTemplate.executeWithoutResult(status -> {
                    OffsetDateTime now = OffsetDateTime.now();
                    Actor actor = new Actor();
                    actor.setActorId(request.actorId());
                    actor.setJoinedAt(request.joinedAt() == null ? now : request.joinedAt());
                    actor.setCreatedAt(now);
                    actor.setUpdatedAt(now);
                    actorRepository.saveAndFlush(actor);
                });
                log.info("Provisioned XP actor {}", request.actorId());
            } catch (DataIntegrityViolationException ex) {
                log.debug("XP actor {} provisioned concurrently", request.actorId());
            }
        }
        return getStanding(request.actorId());
    }

    @Transactional(readOnly = true)
    public ActorResponses.ActorStanding getStanding(UUID actorId) {
        Actor actor = actorRepository.findById(actorId)
                .orElseThrow(() -> XpEventRejectedException.unknownActor("XP actor not found: " + actorId));
        return xpResponseMapper.toActorStanding(actor, leaderboardRankRepository.findById(actorId).orElse(null));
    }

    @Transactional(readOnly = true)
    public List<ActorResponses.XpTransactionEntry> getHistory(UUID actorId, int limit) {
        if (!actorRepository.existsById(actorId)) {
            throw XpEventRejectedException.unknownActor("XP actor not found: " + actorId);
        }
        int pageSize = Math.max(1, Math.min(limit, MAX_HISTORY_PAGE_SIZE));
        return xpTransactionRepository.findByActorIdOrderByCreatedAtDesc(actorId, PageRequest.of(0, pageSize)).stream()
                .map(xpResponseMapper::toTransactionEntry)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<ActorResponses.LeaderboardEntry> getLeaderboard(int limit) {
        int pageSize = Math.max(1, Math.min(limit, xpEngineProperties.getLeaderboard().getMaxPageSize()));
        return leaderboardRankRepository.findTopRows(pageSize).stream()
                .map(xpResponseMapper::toLeaderboardEntry)
                .toList();
    }
}
