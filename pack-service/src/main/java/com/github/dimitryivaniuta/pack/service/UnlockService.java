package com.github.dimitryivaniuta.pack.service;

import com.github.dimitryivaniuta.pack.catalog.CatalogSnapshot;
import com.github.dimitryivaniuta.pack.domain.model.OwnerAccount;
import com.github.dimitryivaniuta.pack.domain.model.UnlockRecord;
import com.github.dimitryivaniuta.pack.progress.ProgressEvaluator;
import com.github.dimitryivaniuta.pack.progress.UnlockCandidate;
import java.time.Clock;
import java.time.Instant;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns completion into unlock records. Inserting is a set-union keyed by character id, so
 * running it again without new acquisitions inserts nothing.
 */
@Slf4j
@RequiredArgsConstructor
public class UnlockService {

    private final ProgressEvaluator evaluator;
    private final Clock clock;

    /**
     * Adds an {@link UnlockRecord} for every earned character the account does not hold yet.
     * Mutates {@code account}; the caller persists it.
     *
     * @return number of records inserted
     */
    public int materialize(OwnerAccount account, Set<String> ownedIds, CatalogSnapshot catalog) {
        Instant now = clock.instant();
        int inserted = 0;
        for (UnlockCandidate candidate : evaluator.compute(ownedIds, catalog).unlockCandidates()) {
            if (account.getUnlocks().containsKey(candidate.characterId())) {
                continue;
            }
            account.getUnlocks().put(candidate.characterId(),
                    new UnlockRecord(account.getOwnerId(), candidate.characterId(), candidate.source(), now));
            inserted++;
            log.info("Unlocked character={} for owner={} via {}",
                    candidate.characterId(), account.getOwnerId(), candidate.source());
        }
        return inserted;
    }
}
