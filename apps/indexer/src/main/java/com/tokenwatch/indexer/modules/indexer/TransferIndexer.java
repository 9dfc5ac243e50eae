package com.tokenwatch.indexer.modules.indexer;

import com.tokenwatch.indexer.config.IndexerProperties;
import com.tokenwatch.indexer.modules.transfers.model.Frontier;
import com.tokenwatch.indexer.modules.transfers.store.EventStore;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs indexing cycles: reorg check, backward scan, retention.
 *
 * <p>Cycles never overlap. A trigger arriving while a cycle runs is skipped, not queued.
 * A failed cycle is logged and recorded in {@link #status()}; it never propagates to the caller's
 * thread, so a scheduler keeps firing.
 */
@Service
public class TransferIndexer {

    private static final Logger logger = LoggerFactory.getLogger(TransferIndexer.class);

    private final ReorgDetector reorgDetector;
    private final BackwardScanner backwardScanner;
    private final RetentionManager retentionManager;
    private final EventStore eventStore;
    private final IndexerProperties properties;
    private final Executor cycleExecutor;
    private final Tracer tracer;
    private final Clock clock;

    private final ReentrantLock cycleLock = new ReentrantLock();
    private final AtomicReference<CycleReport> lastReport = new AtomicReference<>();
    private final AtomicReference<CycleFailure> lastFailure = new AtomicReference<>();

    public TransferIndexer(ReorgDetector reorgDetector,
                           BackwardScanner backwardScanner,
                           RetentionManager retentionManager,
                           EventStore eventStore,
                           IndexerProperties properties,
                           @Qualifier("cycleExecutor") Executor cycleExecutor,
                           Tracer tracer,
                           Clock clock) {
        this.reorgDetector = reorgDetector;
        this.backwardScanner = backwardScanner;
        this.retentionManager = retentionManager;
        this.eventStore = eventStore;
        this.properties = properties;
        this.cycleExecutor = cycleExecutor;
        this.tracer = tracer;
        this.clock = clock;
    }

    /**
     * Start one cycle in the background once the application is up.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.isRunOnStartup()) {
            logger.info("Startup indexing is disabled. Use POST /api/indexer/run to trigger manually.");
            return;
        }
        triggerAsync("startup");
    }

    @Scheduled(fixedDelayString = "${indexer.schedule.interval-ms:60000}",
            initialDelayString = "${indexer.schedule.interval-ms:60000}")
    public void onSchedule() {
        if (!properties.getSchedule().isEnabled()) {
            return;
        }
        trigger("schedule");
    }

    /**
     * Hand a cycle to the background executor.
     *
     * @return false when a cycle is already running or the executor refused the task
     */
    public boolean triggerAsync(String source) {
        if (isRunning()) {
            logger.warn("Indexing cycle already running, ignoring {} trigger", source);
            return false;
        }
        try {
            cycleExecutor.execute(() -> trigger(source));
            return true;
        } catch (RejectedExecutionException e) {
            logger.error("Could not schedule {} cycle: {}", source, e.getMessage());
            return false;
        }
    }

    /**
     * Run one cycle on the calling thread unless another is in progress.
     *
     * @return true if a cycle completed successfully
     */
    public boolean trigger(String source) {
        if (!cycleLock.tryLock()) {
            logger.warn("Indexing cycle already running, skipping {} trigger", source);
            return false;
        }
        try {
            runCycle(source);
            return true;
        } catch (Exception e) {
            logger.error("Indexer loop error ({} trigger): {}", source, e.getMessage(), e);
            lastFailure.set(new CycleFailure(clock.instant(), e.getClass().getSimpleName() + ": " + e.getMessage()));
            return false;
        } finally {
            cycleLock.unlock();
        }
    }

    /**
     * One full cycle. Each step's writes are committed before the next step starts.
     */
    CycleReport runCycle(String source) {
        Span span = tracer.spanBuilder("TransferIndexer.runCycle")
                .setAttribute("cycle.trigger", source)
                .startSpan();
        Instant startedAt = clock.instant();
        try {
            logger.info("Indexing cycle started ({} trigger)", source);

            int rolledBack = reorgDetector.rollbackIfReorganized();

            long lastIndexed = eventStore.findHighestBlock().map(Frontier::getBlockNumber).orElse(0L);
            ScanResult scan = backwardScanner.scan(lastIndexed);

            int evicted = retentionManager.enforceCap();

            CycleReport report = CycleReport.builder()
                    .trigger(source)
                    .startedAt(startedAt)
                    .finishedAt(clock.instant())
                    .rolledBack(rolledBack)
                    .safeHead(scan.getSafeHead())
                    .lastIndexedBlock(scan.getLastIndexedBlock())
                    .chunksScanned(scan.getChunksScanned())
                    .inserted(scan.getInserted())
                    .dropped(scan.getDropped())
                    .evicted(evicted)
                    .lowestScannedBlock(scan.getLowestScannedBlock())
                    .build();
            lastReport.set(report);

            span.setAttribute("cycle.inserted", report.getInserted());
            span.setAttribute("cycle.evicted", report.getEvicted());
            logger.info("Indexing cycle finished in {}ms: rolledBack={}, chunks={}, inserted={}, dropped={}, evicted={}",
                    report.getDurationMs(), rolledBack, scan.getChunksScanned(), scan.getInserted(),
                    scan.getDropped(), evicted);
            return report;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    public boolean isRunning() {
        return cycleLock.isLocked();
    }

    /**
     * Snapshot of the engine state for the status endpoint.
     */
    public IndexerStatus status() {
        Optional<Frontier> frontier = eventStore.findHighestBlock();
        CycleFailure failure = lastFailure.get();
        return IndexerStatus.builder()
                .running(isRunning())
                .lastReport(lastReport.get())
                .lastError(failure != null ? failure.getMessage() : null)
                .lastErrorAt(failure != null ? failure.getAt() : null)
                .frontierBlock(frontier.map(Frontier::getBlockNumber).orElse(null))
                .frontierHash(frontier.map(Frontier::getBlockHash).orElse(null))
                .storedCount(eventStore.count())
                .build();
    }

    @Value
    private static class CycleFailure {
        Instant at;
        String message;
    }
}
