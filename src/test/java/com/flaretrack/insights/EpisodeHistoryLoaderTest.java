package com.flaretrack.insights;

import com.flaretrack.insights.analytics.EpisodeHistoryLoader;
import com.flaretrack.insights.config.InsightsConfiguration;
import com.flaretrack.insights.domain.DomainModels.Episode;
import com.flaretrack.insights.domain.DomainModels.EpisodeEvent;
import com.flaretrack.insights.domain.DomainModels.EventKind;
import com.flaretrack.insights.domain.EpisodeHistory;
import com.flaretrack.insights.repository.EventLogStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.flaretrack.insights.support.InsightsFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class EpisodeHistoryLoaderTest {
    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    @Test
    void loadsEveryEpisodeInInputOrder() {
        Episode first = active("r", daysAgo(3), 4);
        Episode second = active("r", daysAgo(2), 5);
        EventLogStore store = mock(EventLogStore.class);
        when(store.findByEpisodeId(first.id())).thenReturn(List.of(severityUpdate(first, daysAgo(2), 7)));
        when(store.findByEpisodeId(second.id())).thenReturn(List.of());

        List<EpisodeHistory> histories = new EpisodeHistoryLoader(store, executor, 4).load(List.of(first, second));

        assertEquals(List.of(first, second), histories.stream().map(EpisodeHistory::episode).toList());
        assertEquals(7.0, histories.get(0).peakSeverity());
        assertEquals(5.0, histories.get(1).peakSeverity());
        verify(store, times(2)).findByEpisodeId(anyString());
    }

    @Test
    void readsRunConcurrently() throws InterruptedException {
        int episodes = 4;
        CountDownLatch allStarted = new CountDownLatch(episodes);
        EventLogStore store = episodeId -> {
            allStarted.countDown();
            try {
                // every read waits for the others, so a sequential loader would time out here
                if (!allStarted.await(5, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("reads were not concurrent");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            return List.of();
        };
        List<Episode> rows = new ArrayList<>();
        for (int i = 0; i < episodes; i++) rows.add(active("r", daysAgo(i), 3));

        assertEquals(episodes, new EpisodeHistoryLoader(store, executor, 4).load(rows).size());
    }

    @Test
    void manyEpisodesLoadOnTheConfiguredReadPool() {
        ThreadPoolTaskExecutor readPool = new InsightsConfiguration().insightsReadExecutor(4, 8, 256);
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        EventLogStore store = episodeId -> {
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            inFlight.decrementAndGet();
            return List.of();
        };
        List<Episode> rows = new ArrayList<>();
        for (int i = 0; i < 300; i++) rows.add(active("r", daysAgo(i % 200), 3));

        try {
            List<EpisodeHistory> histories = new EpisodeHistoryLoader(store, readPool, 8).load(rows);

            assertEquals(rows, histories.stream().map(EpisodeHistory::episode).toList());
            assertTrue(maxInFlight.get() <= 8);
        } finally {
            readPool.shutdown();
        }
    }

    @Test
    void saturatedReadPoolRunsOverflowOnCaller() {
        ThreadPoolTaskExecutor readPool = new InsightsConfiguration().insightsReadExecutor(1, 1, 1);
        EventLogStore store = episodeId -> {
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            return List.of();
        };
        List<Episode> rows = new ArrayList<>();
        for (int i = 0; i < 20; i++) rows.add(active("r", daysAgo(i), 3));

        try {
            assertEquals(20, new EpisodeHistoryLoader(store, readPool, 10).load(rows).size());
        } finally {
            readPool.shutdown();
        }
    }

    @Test
    void dropsEventsThatBelongToAnotherEpisode() {
        Episode episode = active("r", daysAgo(3), 4);
        EpisodeEvent own = severityUpdate(episode, daysAgo(2), 6);
        EpisodeEvent dangling = new EpisodeEvent("stray", "missing-episode", daysAgo(1), EventKind.SEVERITY_UPDATE,
                10.0, null, null, null, null);
        EventLogStore store = id -> List.of(own, dangling);

        EpisodeHistory history = new EpisodeHistoryLoader(store, executor, 4).load(List.of(episode)).get(0);

        assertEquals(List.of(own), history.events());
        assertEquals(6.0, history.peakSeverity());
    }

    @Test
    void storeFailurePropagatesUnchanged() {
        DataAccessResourceFailureException failure = new DataAccessResourceFailureException("store offline");
        EventLogStore store = mock(EventLogStore.class);
        when(store.findByEpisodeId(anyString())).thenThrow(failure);

        var loader = new EpisodeHistoryLoader(store, executor, 4);
        var thrown = assertThrows(DataAccessResourceFailureException.class,
                () -> loader.load(List.of(active("r", daysAgo(1), 2))));
        assertSame(failure, thrown);
    }

    @Test
    void nothingToLoadReadsNothing() {
        EventLogStore store = mock(EventLogStore.class);

        assertTrue(new EpisodeHistoryLoader(store, executor, 4).load(List.of()).isEmpty());
        assertTrue(new EpisodeHistoryLoader(store, executor, 4).load(null).isEmpty());
        verifyNoInteractions(store);
    }

    @Test
    void historyOrdersEventsByTimestamp() {
        Episode episode = active("r", daysAgo(5), 4);
        EpisodeEvent later = severityUpdate(episode, daysAgo(1), 3);
        EpisodeEvent earlier = severityUpdate(episode, daysAgo(4), 8);

        EpisodeHistory history = new EpisodeHistory(episode, List.of(later, earlier));

        assertEquals(List.of(earlier, later), history.events());
        assertNull(history.durationDays());
        assertEquals(2.0, EpisodeHistory.withoutEvents(resolved("r", daysAgo(5), 2, 3)).durationDays(), 1e-9);
        assertTrue(Duration.between(earlier.timestamp(), later.timestamp()).toDays() > 0);
    }
}
