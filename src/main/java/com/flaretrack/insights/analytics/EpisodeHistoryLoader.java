package com.flaretrack.insights.analytics;

import com.flaretrack.insights.domain.DomainModels.Episode;
import com.flaretrack.insights.domain.DomainModels.EpisodeEvent;
import com.flaretrack.insights.domain.EpisodeHistory;
import com.flaretrack.insights.repository.EventLogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

@Component
public class EpisodeHistoryLoader {
    private static final Logger log = LoggerFactory.getLogger(EpisodeHistoryLoader.class);

    private final EventLogStore eventLogStore;
    private final Executor executor;
    private final int batchSize;

    public EpisodeHistoryLoader(EventLogStore eventLogStore,
                                @Qualifier("insightsReadExecutor") Executor executor,
                                @Value("${insights.read-fanout.max-pool-size:8}") int batchSize) {
        this.eventLogStore = eventLogStore;
        this.executor = executor;
        this.batchSize = Math.max(1, batchSize);
    }

    /**
     * At most one batch of reads is in flight at a time. A store failure is rethrown
     * unchanged once its batch has settled; later batches are not started.
     * Events that point at a different episode than the one requested are dropped.
     */
    public List<EpisodeHistory> load(List<Episode> episodes) {
        if (episodes == null || episodes.isEmpty()) return List.of();

        List<Episode> rows = episodes.stream().filter(Objects::nonNull).filter(e -> e.id() != null).toList();
        List<EpisodeHistory> histories = new ArrayList<>(rows.size());
        for (int from = 0; from < rows.size(); from += batchSize) {
            histories.addAll(loadBatch(rows.subList(from, Math.min(rows.size(), from + batchSize))));
        }
        return histories;
    }

    private List<EpisodeHistory> loadBatch(List<Episode> batch) {
        List<CompletableFuture<EpisodeHistory>> reads = batch.stream()
                .map(episode -> CompletableFuture.supplyAsync(() -> read(episode), executor))
                .toList();

        try {
            CompletableFuture.allOf(reads.toArray(CompletableFuture[]::new)).join();
        } catch (CompletionException e) {
            throw unwrap(e);
        }
        return reads.stream().map(CompletableFuture::join).toList();
    }

    private EpisodeHistory read(Episode episode) {
        List<EpisodeEvent> events = eventLogStore.findByEpisodeId(episode.id());
        if (events == null) return EpisodeHistory.withoutEvents(episode);

        List<EpisodeEvent> owned = events.stream()
                .filter(Objects::nonNull)
                .filter(e -> episode.id().equals(e.episodeId()))
                .toList();
        if (owned.size() != events.size()) {
            log.debug("Dropped {} dangling events while loading episode {}", events.size() - owned.size(), episode.id());
        }
        return new EpisodeHistory(episode, owned);
    }

    private static RuntimeException unwrap(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException runtime) return runtime;
        if (cause instanceof Error error) throw error;
        return e;
    }
}
