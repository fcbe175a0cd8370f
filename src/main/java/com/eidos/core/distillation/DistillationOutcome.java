package com.eidos.core.distillation;

import com.eidos.core.model.Distillation;

import java.util.List;

/**
 * What {@link DistillationService#distillEpisode} did for one episode.
 *
 * @param episodeId  the episode that was distilled
 * @param reflection the reflection the candidates came from
 * @param created    new distillations that were saved
 * @param reinforced existing distillations that absorbed a near-duplicate candidate
 * @param stepsUsed  number of complete steps fed to reflection
 */
public record DistillationOutcome(
        String episodeId,
        ReflectionResult reflection,
        List<Distillation> created,
        List<Distillation> reinforced,
        int stepsUsed
) {

    public DistillationOutcome {
        created = List.copyOf(created);
        reinforced = List.copyOf(reinforced);
    }
}
