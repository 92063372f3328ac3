package com.github.dimitryivaniuta.pack.progress;

import java.util.List;

/** Collection completion for one owner against one catalog snapshot. */
public record ProgressReport(
        long catalogVersion,
        List<ReleaseProgress> releases,
        List<SingleProgress> singles,
        List<FragmentSetProgress> fragmentSets,
        Count unreleased,
        Count goldenCharacters,
        List<UnlockCandidate> unlockCandidates
) {

    public record Count(int owned, int total) {}

    public record SongProgress(String id, String name, int stemsOwned, int stemsTotal, boolean complete) {}

    public record ReleaseProgress(
            String id,
            String name,
            List<SongProgress> songs,
            int songsComplete,
            int songsTotal,
            boolean coverOwned,
            boolean complete,
            String rewardCharacterId
    ) {}

    public record SingleProgress(
            String id,
            String name,
            int stemsOwned,
            int stemsTotal,
            boolean coverOwned,
            boolean complete,
            String rewardCharacterId
    ) {}

    public record FragmentSetProgress(
            String id,
            String name,
            int fragmentsOwned,
            int fragmentsTotal,
            boolean complete,
            String rewardCharacterId
    ) {}
}
