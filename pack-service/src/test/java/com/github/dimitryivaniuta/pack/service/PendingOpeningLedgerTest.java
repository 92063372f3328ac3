package com.github.dimitryivaniuta.pack.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.dimitryivaniuta.pack.catalog.ItemKind;
import com.github.dimitryivaniuta.pack.domain.model.DrawResult;
import com.github.dimitryivaniuta.pack.domain.model.OwnerId;
import com.github.dimitryivaniuta.pack.domain.model.PendingOpening;
import com.github.dimitryivaniuta.pack.error.NoMatchingItemsException;
import com.github.dimitryivaniuta.pack.error.NoPendingOpeningException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class PendingOpeningLedgerTest {

    private final OwnerId alice = OwnerId.player("alice");

    @Test
    void firstWinsKeepsExistingPending() {
        PendingOpeningLedger ledger = new PendingOpeningLedger(PendingPolicy.FIRST_WINS);

        assertThat(ledger.stage(alice, opening("op-1", "a", "b"))).isTrue();
        assertThat(ledger.stage(alice, opening("op-2", "c"))).isFalse();

        assertThat(ledger.peek(alice)).map(PendingOpening::openingId).contains("op-1");
    }

    @Test
    void latestWinsReplacesPending() {
        PendingOpeningLedger ledger = new PendingOpeningLedger(PendingPolicy.LATEST_WINS);

        ledger.stage(alice, opening("op-1", "a"));
        assertThat(ledger.stage(alice, opening("op-2", "c"))).isTrue();

        assertThat(ledger.peek(alice)).map(PendingOpening::openingId).contains("op-2");
    }

    @Test
    void commitAcceptsDrawnIdsInRequestOrderAndClears() {
        PendingOpeningLedger ledger = new PendingOpeningLedger(PendingPolicy.FIRST_WINS);
        ledger.stage(alice, opening("op-1", "a", "b", "c", "d", "e"));
        List<DrawResult> written = new ArrayList<>();

        List<DrawResult> accepted = ledger.commit(alice, List.of("e", "zzz", "a", "c"), written::addAll);

        assertThat(accepted).extracting(DrawResult::itemId).containsExactly("e", "a", "c");
        assertThat(written).isEqualTo(accepted);
        assertThat(ledger.peek(alice)).isEmpty();
        assertThatThrownBy(() -> ledger.commit(alice, List.of("b"), r -> { }))
                .isInstanceOf(NoPendingOpeningException.class);
    }

    @Test
    void everyRepeatOfDrawnIdIsAccepted() {
        PendingOpeningLedger ledger = new PendingOpeningLedger(PendingPolicy.FIRST_WINS);
        ledger.stage(alice, opening("op-1", "a", "b"));

        List<DrawResult> accepted = ledger.commit(alice, List.of("a", "a", "a", "x"), r -> { });

        assertThat(accepted).extracting(DrawResult::itemId).containsExactly("a", "a", "a");
        assertThat(ledger.peek(alice)).isEmpty();
    }

    @Test
    void noMatchingIdsKeepsPending() {
        PendingOpeningLedger ledger = new PendingOpeningLedger(PendingPolicy.FIRST_WINS);
        ledger.stage(alice, opening("op-1", "a"));

        assertThatThrownBy(() -> ledger.commit(alice, List.of("x", "y"), r -> { }))
                .isInstanceOf(NoMatchingItemsException.class);
        assertThat(ledger.peek(alice)).isPresent();
    }

    @Test
    void failedWriterKeepsPending() {
        PendingOpeningLedger ledger = new PendingOpeningLedger(PendingPolicy.FIRST_WINS);
        ledger.stage(alice, opening("op-1", "a"));

        assertThatThrownBy(() -> ledger.commit(alice, List.of("a"), r -> {
            throw new IllegalStateException("disk full");
        })).hasMessage("disk full");
        assertThat(ledger.peek(alice)).isPresent();
    }

    @Test
    void ownersAreIndependent() {
        PendingOpeningLedger ledger = new PendingOpeningLedger(PendingPolicy.FIRST_WINS);
        ledger.stage(alice, opening("op-1", "a"));

        assertThat(ledger.peek(OwnerId.player("bob"))).isEmpty();
        assertThat(ledger.peek(OwnerId.anonymous("alice"))).isEmpty();

        ledger.clear(alice);
        assertThat(ledger.peek(alice)).isEmpty();
    }

    private PendingOpening opening(String openingId, String... itemIds) {
        List<DrawResult> results = new ArrayList<>();
        for (int i = 0; i < itemIds.length; i++) {
            results.add(new DrawResult(i, itemIds[i], itemIds[i], "common", ItemKind.STEM, null, false, false, false));
        }
        return new PendingOpening(alice.value(), openingId, "starter", "key-" + openingId, Instant.EPOCH, results);
    }
}
