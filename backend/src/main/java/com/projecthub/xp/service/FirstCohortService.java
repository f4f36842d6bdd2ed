package com.projecthub.xp.service;

import com.projecthub.xp.config.XpEngineProperties;
import com.projecthub.xp.repository.ActorRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.UUID;

/**
 * Awards the first-100 badge to the earliest joiners. Runs once: after any actor holds the badge, later runs do nothing.
 */
@Service
public class FirstCohortService implements ApplicationRunner {

    public static final int FIRST_COHORT_SIZE = 100;

    private static final Logger log = LoggerFactory.getLogger(FirstCohortService.class);

    private final ActorRepository actorRepository;
    private final XpEngineProperties xpEngineProperties;
    private final TransactionTemplate transactionTemplate;

    public FirstCohortService(
            ActorRepository actorRepository,
            XpEngineProperties xpEngineProperties,
            TransactionTemplate transactionTemplate
    ) {
        this.actorRepository = actorRepository;
        this.xpEngineProperties = xpEngineProperties;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!xpEngineProperties.getFirstCohort().isBootstrapOnStartup()) {
            return;
        }
        markFirstCohort();
    }

    public int markFirstCohort() {
        Integer marked = transactionTemplate.execute(status -> {
            if (actorRepository.existsByFirstHundredTrue()) {
                log.debug("First-cohort bootstrap skipped: badge already assigned");
                return 0;
            }
            List<UUID> earliest = actorRepository.findEarliestJoinedActorIds(FIRST_COHORT_SIZE);
            if (earliest.isEmpty()) {
                log.debug("First-cohort bootstrap skipped: no actors provisioned yet");
                return 0;
            }
            return actorRepository.markFirstHundred(earliest);
        });
        int count = marked == null ? 0 : marked;
        if (count > 0) {
            log.info("First-cohort bootstrap marked {} actors", count);
        }
        return count;
    }
}
