package com.hookintel.hook.service;

import com.hookintel.hook.config.HookScraperProperties;
import com.hookintel.hook.model.Profile;
import com.hookintel.hook.model.ProfileStatus;
import com.hookintel.hook.model.RawPost;
import com.hookintel.hook.model.RunSummary;
import com.hookintel.hook.model.ScrapeRun;
import com.hookintel.hook.model.SlideshowPost;
import com.hookintel.hook.output.ScrapeRunLog;
import com.hookintel.hook.service.fetch.FetchException;
import com.hookintel.hook.service.fetch.PageFetcher;
import com.hookintel.hook.service.fetch.PageFetcherFactory;
import com.hookintel.hook.service.hook.HookAnalyzer;
import com.hookintel.hook.store.PersistenceException;
import com.hookintel.hook.store.PostStore;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Runs the scrape cycle over a pool of workers.
 *
 * Each worker owns one fetcher session and repeatedly claims a profile from the registry,
 * fetches its posts, validates, filters and annotates them, stores the accepted ones and
 * moves the profile to COMPLETED or FAILED. A fetch failure fails only its profile. A
 * storage failure stops the whole run and is rethrown once the workers have finished.
 *
 * Cancelling leaves every in-flight profile FAILED with reason "Scrape cancelled"; posts
 * processed before the cancellation are kept.
 */
@Service
@Slf4j
public class ScrapeOrchestrator {

    public static final String CANCELLED_REASON = "Scrape cancelled";
    static final String UNKNOWN_ERROR = "Unknown error";

    private final ProfileRegistry registry;
    private final PostStore postStore;
    private final PageFetcherFactory fetcherFactory;
    private final SlideshowFilter filter;
    private final RawPostMapper mapper;
    private final HookAnalyzer analyzer;
    private final Pacer pacer;
    private final ScrapeRunLog runLog;
    private final HookScraperProperties.Scrape settings;
    private final Retry fetchRetry;

    private volatile boolean cancelled;
    private volatile ExecutorService activePool;

    public ScrapeOrchestrator(ProfileRegistry registry,
                              PostStore postStore,
                              PageFetcherFactory fetcherFactory,
                              SlideshowFilter filter,
                              RawPostMapper mapper,
                              HookAnalyzer analyzer,
                              Pacer pacer,
                              ScrapeRunLog runLog,
                              HookScraperProperties properties) {
        this.registry = registry;
        this.postStore = postStore;
        this.fetcherFactory = fetcherFactory;
        this.filter = filter;
        this.mapper = mapper;
        this.analyzer = analyzer;
        this.pacer = pacer;
        this.runLog = runLog;
        this.settings = properties.getScrape();
        this.fetchRetry = buildRetry(settings);
    }

    private Retry buildRetry(HookScraperProperties.Scrape settings) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, settings.getRetryAttempts()))
                .waitDuration(settings.getRetryWait())
                .retryOnException(e -> e instanceof FetchException && !isCancelled())
                .build();
        Retry retry = Retry.of("page-fetch", config);
        retry.getEventPublisher().onRetry(event -> log.warn("Fetch attempt {} failed, retrying in {}: {}",
                event.getNumberOfRetryAttempts(), event.getWaitInterval(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown error"));
        return retry;
    }

    // ── Entry points ─────────────────────────────────────────────────────────

    /**
     * Scrape every PENDING profile, including ones an interrupted run left in SCRAPING.
     * FAILED profiles are left alone until reset.
     *
     * @param limit posts to fetch per profile, 0 or less for the configured default
     */
    public RunSummary scrapePending(int limit) {
        return run(() -> registry.claimNextPending().map(Profile::getId), List.of(), limit);
    }

    /**
     * Scrape the named profiles. Untracked handles are added first. Profiles that cannot
     * be claimed (COMPLETED, SKIPPED or held by another worker) are reported, not scraped.
     */
    public RunSummary scrapeProfiles(Collection<String> handles, int limit) {
        int added = registry.add(handles);
        if (added > 0) {
            log.info("Started tracking {} new profile(s) for this run", added);
        }

        Queue<String> queue = new ConcurrentLinkedQueue<>();
        handles.stream()
                .map(ProfileRegistry::normalize)
                .filter(id -> !id.isEmpty())
                .distinct()
                .forEach(queue::add);

        List<String> unclaimed = Collections.synchronizedList(new ArrayList<>());
        Supplier<Optional<String>> next = () -> {
            String id;
            while ((id = queue.poll()) != null) {
                if (registry.claim(id)) {
                    return Optional.of(id);
                }
                log.info("Skipping @{}: not claimable", id);
                unclaimed.add(id);
            }
            return Optional.empty();
        };
        return run(next, unclaimed, limit);
    }

    /**
     * Stop the current run. In-flight profiles end FAILED.
     */
    @PreDestroy
    public void cancel() {
        ExecutorService pool = activePool;
        if (pool == null) {
            return;
        }
        log.warn("Cancelling scrape run...");
        cancelled = true;
        pool.shutdownNow();
        try {
            if (!pool.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Scrape workers did not stop within 30 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for scrape workers to stop");
        }
    }

    // ── Run ──────────────────────────────────────────────────────────────────

    private RunSummary run(Supplier<Optional<String>> claimNext, List<String> unclaimed, int limit) {
        int postLimit = limit > 0 ? limit : settings.getPostLimit();
        int workers = Math.max(1, settings.getWorkers());
        log.info("Starting scrape run: {} worker(s), up to {} posts per profile", workers, postLimit);

        cancelled = false;
        List<ScrapeRun> runs = Collections.synchronizedList(new ArrayList<>());
        AtomicReference<PersistenceException> fatal = new AtomicReference<>();

        ExecutorService pool = Executors.newFixedThreadPool(workers, new CustomizableThreadFactory("scrape-worker-"));
        activePool = pool;
        try {
            List<CompletableFuture<Void>> futures = new ArrayList<>();
            for (int i = 0; i < workers; i++) {
                futures.add(CompletableFuture.runAsync(() -> work(claimNext, postLimit, runs, fatal), pool));
            }
            for (CompletableFuture<Void> future : futures) {
                try {
                    future.join();
                } catch (CompletionException e) {
                    if (!(e.getCause() instanceof PersistenceException)) {
                        log.error("Scrape worker died: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage(), e);
                    }
                }
            }
        } finally {
            activePool = null;
            pool.shutdown();
        }

        if (fatal.get() != null) {
            throw fatal.get();
        }

        RunSummary summary;
        synchronized (runs) {
            summary = RunSummary.of(new ArrayList<>(runs), new ArrayList<>(unclaimed));
        }
        log.info("Scrape run finished: {} completed, {} failed, {} posts accepted, {} rejected, {} malformed",
                summary.getProfilesCompleted(), summary.getProfilesFailed(),
                summary.getPostsAccepted(), summary.getPostsRejected(), summary.getPostsMalformed());
        return summary;
    }

    /**
     * One worker: claim, scrape, repeat until nothing is left or the run is cancelled.
     * The fetcher session is opened with the first claimed profile.
     */
    private void work(Supplier<Optional<String>> claimNext, int limit, List<ScrapeRun> runs,
                      AtomicReference<PersistenceException> fatal) {
        PageFetcher fetcher = null;
        try {
            boolean first = true;
            while (!isCancelled()) {
                Optional<String> claimed = claimNext.get();
                if (claimed.isEmpty()) {
                    break;
                }
                String profileId = claimed.get();

                if (fetcher == null) {
                    try {
                        fetcher = fetcherFactory.open();
                    } catch (FetchException e) {
                        log.error("Worker could not open a fetcher session: {}", e.getMessage());
                        runs.add(failWithoutFetch(profileId, e.getMessage()));
                        return;
                    }
                }

                if (!first && !pause()) {
                    runs.add(failWithoutFetch(profileId, CANCELLED_REASON));
                    break;
                }
                first = false;
                runs.add(scrapeProfile(fetcher, profileId, limit));
            }
        } catch (PersistenceException e) {
            log.error("Storage failure, stopping scrape run: {}", e.getMessage(), e);
            fatal.compareAndSet(null, e);
            cancelled = true;
            throw e;
        } finally {
            if (fetcher != null) {
                fetcher.close();
            }
        }
    }

    private ScrapeRun scrapeProfile(PageFetcher fetcher, String profileId, int limit) {
        ScrapeRun run = ScrapeRun.builder()
                .runId(UUID.randomUUID().toString())
                .profileId(profileId)
                .startedAt(LocalDateTime.now())
                .build();
        List<SlideshowPost> accepted = new ArrayList<>();

        try {
            log.info("Scraping @{}", profileId);
            List<RawPost> fetched = fetchRetry.executeSupplier(() -> fetcher.fetchPosts(profileId, limit));
            run.setPostsFetched(fetched.size());

            for (RawPost raw : fetched) {
                if (isCancelled()) {
                    break;
                }
                try {
                    mapper.validate(raw);
                } catch (MalformedPostException e) {
                    log.warn("Skipping malformed post from @{}: {}", profileId, e.getMessage());
                    run.setPostsMalformed(run.getPostsMalformed() + 1);
                    continue;
                }
                if (!filter.accepts(raw)) {
                    run.setPostsRejected(run.getPostsRejected() + 1);
                    continue;
                }
                SlideshowPost post = mapper.map(raw, profileId);
                post.setHook(analyzer.analyze(post.getCaption(), post.getEngagement()));
                accepted.add(post);
                log.debug("@{} post {}: [{}] {}", profileId, post.getPostId(),
                        post.getHook().category(), post.getHook().text());
            }
            run.setPostsAccepted(accepted.size());
            finish(run, accepted);

        } catch (PersistenceException e) {
            run.setOutcome(ProfileStatus.FAILED);
            run.setErrorMessage(e.getMessage());
            throw e;
        } catch (FetchException e) {
            if (isCancelled()) {
                finish(run, accepted);
            } else {
                log.warn("@{} failed: {}", profileId, e.getMessage());
                endFailed(run, e.getMessage());
            }
        } catch (RuntimeException e) {
            log.error("@{} failed unexpectedly: {}", profileId, e.getMessage(), e);
            endFailed(run, "Unexpected error: " + e.getMessage());
        } finally {
            run.setCompletedAt(LocalDateTime.now());
            runLog.append(run);
        }
        return run;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void endFailed(ScrapeRun run, String reason) {
        String why = reason == null || reason.isBlank() ? UNKNOWN_ERROR : reason;
        try {
            registry.markFailed(run.getProfileId(), why);
        } catch (IllegalStateException e) {
            // skipped or completed elsewhere while this worker held it
            log.warn("@{} left as is: {}", run.getProfileId(), e.getMessage());
        }
        run.setOutcome(ProfileStatus.FAILED);
        run.setErrorMessage(why);
    }

    /**
     * Store the processed posts, then complete the profile, or fail it when the run was
     * cancelled before or during the writes so a later run resumes it. The interrupt flag
     * is cleared for the writes and restored afterwards.
     */
    private void finish(ScrapeRun run, List<SlideshowPost> processed) {
        String profileId = run.getProfileId();
        boolean interrupted = Thread.interrupted();
        try {
            if (!processed.isEmpty()) {
                postStore.saveAll(profileId, processed);
            }
            interrupted |= Thread.interrupted();

            if (interrupted || cancelled) {
                endFailed(run, CANCELLED_REASON);
                log.warn("@{} cancelled after {} stored post(s)", profileId, processed.size());
            } else {
                registry.markCompleted(profileId, processed.size(), run.getPostsFetched());
                run.setOutcome(ProfileStatus.COMPLETED);
                log.info("@{} completed: {} fetched, {} kept, {} rejected, {} malformed", profileId,
                        run.getPostsFetched(), run.getPostsAccepted(), run.getPostsRejected(), run.getPostsMalformed());
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private ScrapeRun failWithoutFetch(String profileId, String reason) {
        ScrapeRun run = ScrapeRun.builder()
                .runId(UUID.randomUUID().toString())
                .profileId(profileId)
                .startedAt(LocalDateTime.now())
                .build();
        boolean interrupted = Thread.interrupted();
        try {
            endFailed(run, reason);
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
            run.setCompletedAt(LocalDateTime.now());
            runLog.append(run);
        }
        return run;
    }

    /**
     * @return false when the pause was interrupted
     */
    private boolean pause() {
        try {
            pacer.pause();
            return !isCancelled();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private boolean isCancelled() {
        return cancelled || Thread.currentThread().isInterrupted();
    }
}
