package com.github.dimitryivaniuta.pack.draw;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.dimitryivaniuta.pack.catalog.DropRow;
import com.github.dimitryivaniuta.pack.catalog.DropTable;
import com.github.dimitryivaniuta.pack.support.ScriptedRandom;
import com.github.dimitryivaniuta.pack.support.TestCatalogs;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class DropTableResolverTest {

    private final DropTable table = TestCatalogs.starterTable();

    @Test
    void walksCumulativeWeights() {
        DropTableResolver resolver = new DropTableResolver(new ScriptedRandom().rolls(0, 70, 70.5, 90.5, 99.9));
        PityState pity = PityState.initial();

        List<String> rarities = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            RarityOutcome outcome = resolver.resolve(table, pity);
            rarities.add(outcome.rarity());
            pity = outcome.next();
        }

        assertThat(rarities).containsExactly("common", "common", "rare", "legendary", "legendary");
    }

    @Test
    void fifthConsecutiveMissIsForcedToPityRarity() {
        DropTableResolver resolver = new DropTableResolver(new ScriptedRandom());
        PityState pity = PityState.initial();

        for (int i = 1; i <= 4; i++) {
            RarityOutcome outcome = resolver.resolve(table, pity);
            assertThat(outcome.rarity()).isEqualTo("common");
            assertThat(outcome.pityForced()).isFalse();
            assertThat(outcome.next().sinceLastPity()).isEqualTo(i);
            pity = outcome.next();
        }

        RarityOutcome fifth = resolver.resolve(table, pity);

        assertThat(fifth.rarity()).isEqualTo("legendary");
        assertThat(fifth.pityForced()).isTrue();
        assertThat(fifth.next()).isEqualTo(PityState.initial());
    }

    @Test
    void naturalPityRarityResetsCounter() {
        DropTableResolver resolver = new DropTableResolver(new ScriptedRandom().rolls(95));

        RarityOutcome outcome = resolver.resolve(table, new PityState(3));

        assertThat(outcome.rarity()).isEqualTo("legendary");
        assertThat(outcome.pityForced()).isFalse();
        assertThat(outcome.next().sinceLastPity()).isZero();
    }

    @Test
    void tableWithoutPityRowStillAdvancesCounter() {
        DropTable plain = new DropTable("plain", List.of(DropRow.of("common", 1), DropRow.of("rare", 1)));
        DropTableResolver resolver = new DropTableResolver(new ScriptedRandom().rolls(0, 1.5));

        RarityOutcome first = resolver.resolve(plain, new PityState(9));
        RarityOutcome second = resolver.resolve(plain, first.next());

        assertThat(first.rarity()).isEqualTo("common");
        assertThat(second.rarity()).isEqualTo("rare");
        assertThat(second.next().sinceLastPity()).isEqualTo(11);
    }

    @Test
    void onlyDeclaredRaritiesComeOut() {
        DropTableResolver resolver = new DropTableResolver(new ThreadLocalRandomSource());
        PityState pity = PityState.initial();

        for (int i = 0; i < 2_000; i++) {
            RarityOutcome outcome = resolver.resolve(table, pity);
            assertThat(table.rarities()).contains(outcome.rarity());
            assertThat(outcome.next().sinceLastPity()).isLessThan(5);
            pity = outcome.next();
        }
    }
}
