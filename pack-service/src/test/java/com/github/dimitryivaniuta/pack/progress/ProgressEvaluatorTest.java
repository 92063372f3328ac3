package com.github.dimitryivaniuta.pack.progress;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.dimitryivaniuta.common.money.Money;
import com.github.dimitryivaniuta.pack.catalog.CatalogSnapshot;
import com.github.dimitryivaniuta.pack.catalog.DropRow;
import com.github.dimitryivaniuta.pack.catalog.DropTable;
import com.github.dimitryivaniuta.pack.catalog.FragmentSet;
import com.github.dimitryivaniuta.pack.catalog.Item;
import com.github.dimitryivaniuta.pack.catalog.ItemKind;
import com.github.dimitryivaniuta.pack.catalog.Pack;
import com.github.dimitryivaniuta.pack.catalog.Release;
import com.github.dimitryivaniuta.pack.catalog.Single;
import com.github.dimitryivaniuta.pack.catalog.Song;
import com.github.dimitryivaniuta.pack.progress.ProgressReport.ReleaseProgress;
import com.github.dimitryivaniuta.pack.support.TestCatalogs;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ProgressEvaluatorTest {

    private final ProgressEvaluator evaluator = new ProgressEvaluator();
    private final CatalogSnapshot catalog = TestCatalogs.starter();

    @Test
    void releaseNeedsEverySongAndCover() {
        Set<String> owned = new HashSet<>(TestCatalogs.SONG_A);
        owned.addAll(TestCatalogs.SONG_B);

        ReleaseProgress withoutCover = evaluator.compute(owned, catalog).releases().get(0);
        assertThat(withoutCover.songsComplete()).isEqualTo(2);
        assertThat(withoutCover.coverOwned()).isFalse();
        assertThat(withoutCover.complete()).isFalse();

        owned.add("cover-ep");
        ProgressReport report = evaluator.compute(owned, catalog);

        assertThat(report.releases().get(0).complete()).isTrue();
        assertThat(report.unlockCandidates()).containsExactlyInAnyOrder(
                new UnlockCandidate("ch-2", "song:song-b"),
                new UnlockCandidate("ch-1", "release:ep-1"));
    }

    @Test
    void partialSongReportsCounts() {
        ProgressReport report = evaluator.compute(Set.of("s-a1", "s-a2", "s-b1", "cover-ep"), catalog);

        ReleaseProgress release = report.releases().get(0);
        assertThat(release.songs()).extracting(ProgressReport.SongProgress::stemsOwned).containsExactly(2, 1);
        assertThat(release.songs()).allSatisfy(s -> assertThat(s.stemsTotal()).isEqualTo(3));
        assertThat(release.songsComplete()).isZero();
        assertThat(release.complete()).isFalse();
        assertThat(report.unlockCandidates()).isEmpty();
    }

    @Test
    void completedSongWithoutRewardYieldsNoCandidate() {
        ProgressReport report = evaluator.compute(new HashSet<>(TestCatalogs.SONG_A), catalog);

        assertThat(report.releases().get(0).songs().get(0).complete()).isTrue();
        assertThat(report.unlockCandidates()).isEmpty();
    }

    @Test
    void emptyNodesAreNeverComplete() {
        CatalogSnapshot empty = CatalogSnapshot.builder()
                .item(new Item("cov", null, "rare", ItemKind.COVER, null))
                .release(new Release("r-empty", null, List.of(), "cov", "ch-x"))
                .release(new Release("r-nocover", null, List.of(new Song("s", null, List.of(), null)), null, "ch-y"))
                .single(new Single("single-empty", null, List.of(), "cov", "ch-z"))
                .fragmentSet(new FragmentSet("fs-empty", null, List.of(), "ch-w"))
                .dropTable(new DropTable("t", List.of(DropRow.of("rare", 1))))
                .pack(new Pack("p", null, Money.of("COIN", 1), "t"))
                .build();

        ProgressReport report = evaluator.compute(Set.of("cov"), empty);

        assertThat(report.releases()).noneMatch(ReleaseProgress::complete);
        assertThat(report.singles()).noneMatch(ProgressReport.SingleProgress::complete);
        assertThat(report.fragmentSets()).noneMatch(ProgressReport.FragmentSetProgress::complete);
        assertThat(report.unlockCandidates()).isEmpty();
    }

    @Test
    void singleAndFragmentSetCompletion() {
        CatalogSnapshot snapshot = CatalogSnapshot.builder()
                .item(new Item("st-1", null, "common", ItemKind.STEM, null))
                .item(new Item("cov-1", null, "rare", ItemKind.COVER, null))
                .item(new Item("f-1", null, "common", ItemKind.FRAGMENT, null))
                .item(new Item("f-2", null, "common", ItemKind.FRAGMENT, null))
                .item(new Item("ch-g", null, "legendary", ItemKind.CHARACTER, null))
                .single(new Single("single-1", null, List.of("st-1"), "cov-1", "ch-s"))
                .fragmentSet(new FragmentSet("fs-1", null, List.of("f-1", "f-2"), "ch-g"))
                .goldenCharacterId("ch-g")
                .build();

        ProgressReport report = evaluator.compute(Set.of("st-1", "cov-1", "f-1", "f-2"), snapshot);

        assertThat(report.singles().get(0).complete()).isTrue();
        assertThat(report.fragmentSets().get(0).complete()).isTrue();
        assertThat(report.goldenCharacters()).isEqualTo(new ProgressReport.Count(0, 1));
        assertThat(report.unlockCandidates()).containsExactly(
                new UnlockCandidate("ch-s", "single:single-1"),
                new UnlockCandidate("ch-g", "fragments:fs-1"));
    }
}
