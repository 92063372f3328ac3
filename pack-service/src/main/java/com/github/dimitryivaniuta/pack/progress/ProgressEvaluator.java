package com.github.dimitryivaniuta.pack.progress;

import com.github.dimitryivaniuta.pack.catalog.CatalogSnapshot;
import com.github.dimitryivaniuta.pack.catalog.FragmentSet;
import com.github.dimitryivaniuta.pack.catalog.Release;
import com.github.dimitryivaniuta.pack.catalog.Single;
import com.github.dimitryivaniuta.pack.catalog.Song;
import com.github.dimitryivaniuta.pack.progress.ProgressReport.Count;
import com.github.dimitryivaniuta.pack.progress.ProgressReport.FragmentSetProgress;
import com.github.dimitryivaniuta.pack.progress.ProgressReport.ReleaseProgress;
import com.github.dimitryivaniuta.pack.progress.ProgressReport.SingleProgress;
import com.github.dimitryivaniuta.pack.progress.ProgressReport.SongProgress;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Completion rules over the catalog hierarchy:
 * <ul>
 *   <li>Song: at least one stem and every stem owned.</li>
 *   <li>Release: at least one song, every song complete, cover owned.</li>
 *   <li>Single: at least one stem, every stem owned, cover owned.</li>
 *   <li>Fragment set: at least one fragment and every fragment owned.</li>
 * </ul>
 * Completed nodes that declare a reward character yield an {@link UnlockCandidate}.
 * Pure function of its inputs.
 */
public class ProgressEvaluator {

    public ProgressReport compute(Set<String> ownedIds, CatalogSnapshot catalog) {
        Objects.requireNonNull(ownedIds, "ownedIds");
        Objects.requireNonNull(catalog, "catalog");

        List<UnlockCandidate> candidates = new ArrayList<>();

        List<ReleaseProgress> releases = new ArrayList<>();
        for (Release release : catalog.getReleases()) {
            List<SongProgress> songs = new ArrayList<>();
            int songsComplete = 0;
            for (Song song : release.songs()) {
                int owned = countOwned(song.stemIds(), ownedIds);
                boolean complete = !song.stemIds().isEmpty() && owned == song.stemIds().size();
                if (complete) {
                    songsComplete++;
                    addCandidate(candidates, song.rewardCharacterId(), "song:" + song.id());
                }
                songs.add(new SongProgress(song.id(), song.name(), owned, song.stemIds().size(), complete));
            }
            boolean coverOwned = owns(ownedIds, release.coverId());
            boolean complete = !release.songs().isEmpty() && songsComplete == release.songs().size() && coverOwned;
            if (complete) {
                addCandidate(candidates, release.rewardCharacterId(), "release:" + release.id());
            }
            releases.add(new ReleaseProgress(release.id(), release.name(), songs, songsComplete,
                    release.songs().size(), coverOwned, complete, release.rewardCharacterId()));
        }

        List<SingleProgress> singles = new ArrayList<>();
        for (Single single : catalog.getSingles()) {
            int owned = countOwned(single.stemIds(), ownedIds);
            boolean coverOwned = owns(ownedIds, single.coverId());
            boolean complete = !single.stemIds().isEmpty() && owned == single.stemIds().size() && coverOwned;
            if (complete) {
                addCandidate(candidates, single.rewardCharacterId(), "single:" + single.id());
            }
            singles.add(new SingleProgress(single.id(), single.name(), owned, single.stemIds().size(),
                    coverOwned, complete, single.rewardCharacterId()));
        }

        List<FragmentSetProgress> fragmentSets = new ArrayList<>();
        for (FragmentSet set : catalog.getFragmentSets()) {
            int owned = countOwned(set.fragmentIds(), ownedIds);
            boolean complete = !set.fragmentIds().isEmpty() && owned == set.fragmentIds().size();
            if (complete) {
                addCandidate(candidates, set.rewardCharacterId(), "fragments:" + set.id());
            }
            fragmentSets.add(new FragmentSetProgress(set.id(), set.name(), owned, set.fragmentIds().size(),
                    complete, set.rewardCharacterId()));
        }

        return new ProgressReport(
                catalog.getVersion(),
                List.copyOf(releases),
                List.copyOf(singles),
                List.copyOf(fragmentSets),
                new Count(countOwned(catalog.getUnreleasedIds(), ownedIds), catalog.getUnreleasedIds().size()),
                new Count(countOwned(catalog.getGoldenCharacterIds(), ownedIds), catalog.getGoldenCharacterIds().size()),
                List.copyOf(candidates));
    }

    private static void addCandidate(List<UnlockCandidate> out, String characterId, String source) {
        if (characterId != null && !characterId.isBlank()) {
            out.add(new UnlockCandidate(characterId, source));
        }
    }

    private static boolean owns(Set<String> ownedIds, String id) {
        return id != null && ownedIds.contains(id);
    }

    private static int countOwned(Collection<String> ids, Set<String> ownedIds) {
        return (int) ids.stream().filter(ownedIds::contains).count();
    }
}
