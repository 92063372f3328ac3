package com.github.dimitryivaniuta.pack.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.dimitryivaniuta.pack.catalog.CatalogSnapshot;
import com.github.dimitryivaniuta.pack.domain.model.OwnerAccount;
import com.github.dimitryivaniuta.pack.domain.model.OwnerId;
import com.github.dimitryivaniuta.pack.domain.model.UnlockRecord;
import com.github.dimitryivaniuta.pack.progress.ProgressEvaluator;
import com.github.dimitryivaniuta.pack.support.TestCatalogs;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class UnlockServiceTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
    private final CatalogSnapshot catalog = TestCatalogs.starter();
    private final UnlockService service = new UnlockService(new ProgressEvaluator(), clock);

    @Test
    void materializingTwiceInsertsOnce() {
        OwnerAccount account = OwnerAccount.fresh(OwnerId.player("p"), Map.of(), Instant.EPOCH);
        Set<String> owned = completeRelease();

        int first = service.materialize(account, owned, catalog);
        int second = service.materialize(account, owned, catalog);

        assertThat(first).isEqualTo(2);
        assertThat(second).isZero();
        assertThat(account.getUnlocks()).containsOnlyKeys("ch-1", "ch-2");
        assertThat(account.getUnlocks().get("ch-1"))
                .isEqualTo(new UnlockRecord("p", "ch-1", "release:ep-1", clock.instant()));
    }

    @Test
    void existingUnlockIsNotOverwritten() {
        OwnerAccount account = OwnerAccount.fresh(OwnerId.player("p"), Map.of(), Instant.EPOCH);
        UnlockRecord earlier = new UnlockRecord("p", "ch-2", "song:song-b", Instant.EPOCH);
        account.getUnlocks().put("ch-2", earlier);

        int inserted = service.materialize(account, completeRelease(), catalog);

        assertThat(inserted).isEqualTo(1);
        assertThat(account.getUnlocks().get("ch-2")).isSameAs(earlier);
    }

    private static Set<String> completeRelease() {
        Set<String> owned = new HashSet<>(TestCatalogs.SONG_A);
        owned.addAll(TestCatalogs.SONG_B);
        owned.add("cover-ep");
        return owned;
    }
}
