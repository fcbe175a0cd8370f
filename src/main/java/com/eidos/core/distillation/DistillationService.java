package com.eidos.core.distillation;

import com.eidos.core.logging.MdcContext;
import com.eidos.core.metrics.EidosMetrics;
import com.eidos.core.model.Distillation;
import com.eidos.core.model.Episode;
import com.eidos.core.model.Step;
import com.eidos.core.model.WordSets;
import com.eidos.core.persistence.EpisodicStore;
import com.eidos.core.refinement.DistillationRefiner;
import com.eidos.core.refinement.RefinementResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Runs the post-episode learning pipeline: reflect, generate candidates, fold
 * near-duplicates into existing rules, refine the rest and persist them.
 */
@Service
public class DistillationService {

    private static final Logger log = LoggerFactory.getLogger(DistillationService.class);

    static final String SOURCE = "eidos";
    static final int EXISTING_SCAN_LIMIT = 200;

    private final EpisodicStore store;
    private final DistillationEngine engine;
    private final DistillationRefiner refiner;
    private final EidosMetrics metrics;

    public DistillationService(EpisodicStore store, DistillationEngine engine,
                               DistillationRefiner refiner, EidosMetrics metrics) {
        this.store = store;
        this.engine = engine;
        this.refiner = refiner;
        this.metrics = metrics;
    }

    /**
     * Distills a finished episode.
     *
     * @throws IllegalArgumentException if the episode does not exist
     * @throws IllegalStateException    if the episode is still in progress
     */
    public DistillationOutcome distillEpisode(String episodeId) {
        MdcContext.setEpisode(episodeId);
        try {
            Episode episode = store.getEpisode(episodeId)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown episode: " + episodeId));
            if (!episode.getOutcome().isTerminal()) {
                throw new IllegalStateException("Episode " + episodeId + " is still in progress");
            }
            List<Step> steps = store.getEpisodeSteps(episodeId).stream()
                    .filter(Step::isComplete)
                    .toList();
            log.info("Distilling episode {} ({}, {} complete steps)",
                    episodeId, episode.getOutcome().value(), steps.size());

            ReflectionResult reflection = engine.reflectOnEpisode(episode, steps);
            List<Distillation> fresh = engine.mergeSimilarDistillations(
                    engine.generateDistillations(episode, steps, reflection).stream()
                            .map(engine::finalizeDistillation)
                            .toList());

            List<Distillation> created = new ArrayList<>();
            List<Distillation> reinforced = new ArrayList<>();
            for (Distillation d : fresh) {
                Optional<Distillation> existing = findSimilar(d);
                if (existing.isPresent()) {
                    reinforced.add(reinforce(existing.get(), d));
                    continue;
                }
                refineAndSave(d, episode);
                created.add(d);
                metrics.recordDistillationGenerated(d.getType());
            }
            log.info("Episode {} distilled: {} created, {} reinforced", episodeId, created.size(), reinforced.size());
            return new DistillationOutcome(episodeId, reflection, created, reinforced, steps.size());
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Applies usage feedback to a stored distillation. Empty when the id is unknown.
     */
    public Optional<Distillation> recordFeedback(String distillationId, boolean helped) {
        MdcContext.setDistillation(distillationId);
        try {
            Optional<Distillation> found = store.getDistillation(distillationId);
            if (found.isEmpty()) {
                log.warn("Feedback for unknown distillation {}", distillationId);
                return Optional.empty();
            }
            Distillation d = engine.validateDistillation(found.get(), helped);
            store.saveDistillation(d);
            metrics.recordFeedback(helped);
            log.debug("Feedback recorded: helped={} confidence={}", helped, d.getConfidence());
            return Optional.of(d);
        } finally {
            MdcContext.clear();
        }
    }

    /** Active distillations whose revalidation deadline has passed. */
    public List<Distillation> dueForRevalidation() {
        return store.getDistillationsForRevalidation();
    }

    private Optional<Distillation> findSimilar(Distillation candidate) {
        return store.getDistillationsByType(candidate.getType(), EXISTING_SCAN_LIMIT).stream()
                .filter(e -> WordSets.jaccard(e.getStatement(), candidate.getStatement())
                        > DistillationEngine.SIMILARITY_THRESHOLD)
                .findFirst();
    }

    private Distillation reinforce(Distillation existing, Distillation candidate) {
        Set<String> sources = new LinkedHashSet<>(existing.getSourceSteps());
        sources.addAll(candidate.getSourceSteps());
        existing.setSourceSteps(new ArrayList<>(sources));
        existing.setValidationCount(existing.getValidationCount() + 1);
        existing.setConfidence(Math.max(existing.getConfidence(), candidate.getConfidence()));
        store.saveDistillation(existing);
        log.debug("Reinforced {} with candidate {}", existing.getDistillationId(), candidate.getDistillationId());
        return existing;
    }

    private void refineAndSave(Distillation d, Episode episode) {
        MdcContext.setDistillation(d.getDistillationId());
        try {
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("domain", d.getDomains().isEmpty() ? "general" : d.getDomains().get(0));
            context.put("goal", episode.getGoal());
            RefinementResult refined = refiner.refine(d.getStatement(), SOURCE, context);
            d.setRefinedStatement(refined.text().equals(d.getStatement().strip()) ? "" : refined.text());
            d.setAdvisoryQuality(refined.quality().toMap());
            store.saveDistillation(d);
        } finally {
            MdcContext.clearDistillation();
        }
    }
}
