package com.example.footprint.service.worker;

import com.example.footprint.exception.CacheException;
import com.example.footprint.exception.EngineDataException;
import com.example.footprint.exception.EngineUnavailableException;
import com.example.footprint.exception.PersistenceException;
import com.example.footprint.metrics.PipelineMetrics;
import com.example.footprint.model.AllocationMethod;
import com.example.footprint.model.CalculationJob;
import com.example.footprint.model.CalculationMethod;
import com.example.footprint.model.CalculationOptions;
import com.example.footprint.model.FootprintResult;
import com.example.footprint.model.InventoryFlow;
import com.example.footprint.model.JobStatus;
import com.example.footprint.model.MaterialInput;
import com.example.footprint.model.PayloadKind;
import com.example.footprint.model.ProductInputs;
import com.example.footprint.service.cache.CacheKeyGenerator;
import com.example.footprint.service.cache.CaffeineFootprintCache;
import com.example.footprint.service.cache.FootprintCache;
import com.example.footprint.service.calculation.CalculationCore;
import com.example.footprint.service.calculation.FallbackEstimator;
import com.example.footprint.service.calculation.GwpFactorSource;
import com.example.footprint.service.calculation.GwpFactorTable;
import com.example.footprint.service.engine.LciEngineClient;
import com.example.footprint.service.queue.InMemoryJobQueue;
import com.example.footprint.service.store.InMemoryJobStore;
import com.example.footprint.support.MutableClock;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class CalculationJobExecutorTest {

    private static final ProductInputs INPUTS = ProductInputs.builder()
            .productCategory("cider")
            .material(MaterialInput.builder().name("bottle").category("glass").massKg(0.5).build())
            .material(MaterialInput.builder().name("apples").category("apples").massKg(2.0).build())
            .build();

    private static final CalculationOptions HYBRID = CalculationOptions.builder()
            .method(CalculationMethod.HYBRID)
            .allocationMethod(AllocationMethod.MASS)
            .factorVersion("AR6")
            .build();

    private static final List<InventoryFlow> INVENTORY = List.of(
            InventoryFlow.builder().name("CO2").category("Emission to air").amount(10.0).unit("kg").build(),
            InventoryFlow.builder().name("CH4").category("Emission to air").amount(1.0).unit("kg").build());

    private MutableClock clock;
    private InMemoryJobStore jobStore;
    private FootprintCache cache;
    private CacheKeyGenerator keyGenerator;
    private LciEngineClient engineClient;
    private CalculationCore calculationCore;
    private SimpleMeterRegistry meterRegistry;
    private ExecutorService engineExecutor;
    private CalculationJobExecutor executor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        jobStore = spy(new InMemoryJobStore(clock, Duration.ofMinutes(5)));
        cache = new CaffeineFootprintCache(100, Duration.ZERO, clock);
        keyGenerator = new CacheKeyGenerator();
        engineClient = mock(LciEngineClient.class);
        when(engineClient.engineVersion()).thenReturn("openLCA 2.0");
        calculationCore = spy(new CalculationCore());
        meterRegistry = new SimpleMeterRegistry();
        engineExecutor = Executors.newCachedThreadPool();
        executor = newExecutor(cache);
    }

    @AfterEach
    void tearDown() {
        engineExecutor.shutdownNow();
    }

    @Test
    void shouldCompleteJobFromEngineInventory() {
        // Given
        String jobId = submit(HYBRID);
        when(engineClient.calculateInventory(any())).thenReturn(INVENTORY);

        // When
        executor.execute(jobId, "worker-1");

        // Then
        CalculationJob job = jobStore.get(jobId).orElseThrow();
        assertEquals(JobStatus.COMPLETED, job.getStatus());
        assertEquals(100, job.getProgress());
        assertEquals(1, job.getAttempt());
        assertEquals(37.9, job.getResult().getTotalCo2e(), 1e-9);
        assertFalse(job.getResult().isDegraded());
        assertEquals(INVENTORY, job.getInventory());
        assertTrue(cache.get(keyGenerator.key(INPUTS, HYBRID, "AR6")).isPresent());
        assertEquals(1.0, meterRegistry.get("footprint.jobs.completed.total").counter().count());
    }

    @Test
    void cancelledPendingJobShouldNeverReachCalculationCore() {
        // Given
        String jobId = submit(HYBRID);
        jobStore.markCancelled(jobId);

        // When
        executor.execute(jobId, "worker-1");

        // Then
        assertEquals(JobStatus.CANCELLED, jobStore.get(jobId).orElseThrow().getStatus());
        verifyNoInteractions(calculationCore);
        verify(engineClient, never()).calculateInventory(any());
    }

    @Test
    void shouldNotWriteResultWhenCancelledDuringEngineCall() {
        // Given
        String jobId = submit(HYBRID);
        when(engineClient.calculateInventory(any())).thenAnswer(inv -> {
            jobStore.markCancelled(jobId);
            return INVENTORY;
        });

        // When
        executor.execute(jobId, "worker-1");

        // Then
        CalculationJob job = jobStore.get(jobId).orElseThrow();
        assertEquals(JobStatus.CANCELLED, job.getStatus());
        assertNull(job.getResult());
        assertEquals(1.0, meterRegistry.get("footprint.jobs.cancelled.total").counter().count());
    }

    @Test
    void shouldFallBackToCategoryEstimateWhenEngineExhausted() {
        // Given
        String jobId = submit(HYBRID);
        when(engineClient.calculateInventory(any())).thenThrow(new EngineUnavailableException("connection refused"));

        // When
        executor.execute(jobId, "worker-1");

        // Then: 0.5 × 0.7 + 2.0 × 0.53
        CalculationJob job = jobStore.get(jobId).orElseThrow();
        assertEquals(JobStatus.COMPLETED, job.getStatus());
        assertTrue(job.getResult().isDegraded());
        assertEquals(1.41, job.getResult().getTotalCo2e(), 1e-9);
        assertEquals(FallbackEstimator.METHOD, job.getResult().getMetadata().getCalculationMethod());
        assertEquals(3, job.getAttempt());
        verify(engineClient, times(3)).calculateInventory(any());
        assertTrue(cache.get(keyGenerator.key(INPUTS, HYBRID, "AR6")).isEmpty());
        assertEquals(1.0, meterRegistry.get("footprint.jobs.degraded.total").counter().count());
        assertEquals(2.0, meterRegistry.get("footprint.engine.retries.total").counter().count());
    }

    @Test
    void shouldFailWhenEngineExhaustedAndFallbackNotAllowed() {
        // Given
        CalculationOptions openLca = HYBRID.toBuilder().method(CalculationMethod.OPENLCA).build();
        String jobId = submit(openLca);
        when(engineClient.calculateInventory(any())).thenThrow(new EngineUnavailableException("connection refused"));

        // When
        executor.execute(jobId, "worker-1");

        // Then
        CalculationJob job = jobStore.get(jobId).orElseThrow();
        assertEquals(JobStatus.FAILED, job.getStatus());
        assertTrue(job.getErrorMessage().startsWith("External engine unavailable after 3 attempts"));
        assertEquals(3, job.getAttempt());
        assertNull(job.getResult());
    }

    @Test
    void shouldFailWithoutRetryOnEngineDataError() {
        // Given
        String jobId = submit(HYBRID);
        when(engineClient.calculateInventory(any())).thenThrow(new EngineDataException("unknown product system"));

        // When
        executor.execute(jobId, "worker-1");

        // Then
        CalculationJob job = jobStore.get(jobId).orElseThrow();
        assertEquals(JobStatus.FAILED, job.getStatus());
        assertEquals("Engine data error: unknown product system", job.getErrorMessage());
        assertFalse(job.isErrorReconcilable());
        verify(engineClient, times(1)).calculateInventory(any());
    }

    @Test
    void shouldServeResultFromCache() {
        // Given
        FootprintResult cached = FootprintResult.builder().totalCo2e(12.5).build();
        cache.put(keyGenerator.key(INPUTS, HYBRID, "AR6"), cached);
        String jobId = submit(HYBRID);

        // When
        executor.execute(jobId, "worker-1");

        // Then
        CalculationJob job = jobStore.get(jobId).orElseThrow();
        assertEquals(JobStatus.COMPLETED, job.getStatus());
        assertEquals(cached, job.getResult());
        verify(engineClient, never()).calculateInventory(any());
        assertEquals(1.0, meterRegistry.get("footprint.cache.hits.total").counter().count());
    }

    @Test
    void shouldUseSeparateCacheEntriesPerFactorVersion() {
        // Given
        when(engineClient.calculateInventory(any())).thenReturn(INVENTORY);
        String ar6Job = submit(HYBRID);
        String ar5Job = submit(HYBRID.toBuilder().factorVersion("AR5").build());

        // When
        executor.execute(ar6Job, "worker-1");
        executor.execute(ar5Job, "worker-1");

        // Then
        assertEquals(37.9, jobStore.get(ar6Job).orElseThrow().getResult().getTotalCo2e(), 1e-9);
        assertEquals(38.0, jobStore.get(ar5Job).orElseThrow().getResult().getTotalCo2e(), 1e-9);
        verify(engineClient, times(2)).calculateInventory(any());
    }

    @Test
    void shouldResumeFromCommittedInventoryWithoutCallingEngine() {
        // Given: воркер упал после фиксации инвентаризации
        String jobId = submit(HYBRID);
        jobStore.claim(jobId, "crashed-worker");
        jobStore.recordInventory(jobId, INVENTORY);
        clock.advance(Duration.ofMinutes(6));

        // When
        executor.execute(jobId, "worker-2");

        // Then
        CalculationJob job = jobStore.get(jobId).orElseThrow();
        assertEquals(JobStatus.COMPLETED, job.getStatus());
        assertEquals("worker-2", job.getWorkerId());
        assertEquals(37.9, job.getResult().getTotalCo2e(), 1e-9);
        verify(engineClient, never()).calculateInventory(any());
    }

    @Test
    void shouldBypassUnavailableCache() {
        // Given
        FootprintCache broken = mock(FootprintCache.class);
        when(broken.get(anyString())).thenThrow(new CacheException("redis down", null));
        doThrow(new CacheException("redis down", null)).when(broken).put(anyString(), any());
        executor = newExecutor(broken);
        String jobId = submit(HYBRID);
        when(engineClient.calculateInventory(any())).thenReturn(INVENTORY);

        // When
        executor.execute(jobId, "worker-1");

        // Then
        assertEquals(JobStatus.COMPLETED, jobStore.get(jobId).orElseThrow().getStatus());
        assertEquals(3.0, meterRegistry.get("footprint.cache.errors.total").counter().count());
    }

    @Test
    void shouldMarkJobStoreFailureAsReconcilable() {
        // Given
        String jobId = submit(HYBRID);
        when(engineClient.calculateInventory(any())).thenReturn(INVENTORY);
        doThrow(new PersistenceException("write failed", null)).when(jobStore).recordInventory(eq(jobId), any());

        // When
        executor.execute(jobId, "worker-1");

        // Then
        CalculationJob job = jobStore.get(jobId).orElseThrow();
        assertEquals(JobStatus.FAILED, job.getStatus());
        assertTrue(job.isErrorReconcilable());
        assertTrue(job.getErrorMessage().contains("write failed"));
    }

    @Test
    void shouldSkipJobLeasedByAnotherInstance() {
        String jobId = submit(HYBRID);
        jobStore.claim(jobId, "node-a/worker-1");

        executor.execute(jobId, "node-b/worker-1");

        assertEquals("node-a/worker-1", jobStore.get(jobId).orElseThrow().getWorkerId());
        verifyNoInteractions(calculationCore);
    }

    @Test
    void shouldResumeRedeliveredJobWithinLease() {
        // Given: после перезапуска экземпляра сообщение доставлено повторно через минуту
        String jobId = submit(HYBRID);
        jobStore.claim(jobId, "node-a/worker-1");
        jobStore.recordInventory(jobId, INVENTORY);
        clock.advance(Duration.ofMinutes(1));

        // When
        executor.execute(jobId, "node-a/worker-1");

        // Then
        CalculationJob job = jobStore.get(jobId).orElseThrow();
        assertEquals(JobStatus.COMPLETED, job.getStatus());
        assertEquals(37.9, job.getResult().getTotalCo2e(), 1e-9);
        verify(engineClient, never()).calculateInventory(any());
    }

    @Test
    void shouldResumeRedeliveredJobOnAnotherWorkerOfSameInstance() {
        String jobId = submit(HYBRID);
        jobStore.claim(jobId, "node-a/worker-1");
        jobStore.recordInventory(jobId, INVENTORY);
        clock.advance(Duration.ofSeconds(10));

        executor.execute(jobId, "node-a/worker-2");

        CalculationJob job = jobStore.get(jobId).orElseThrow();
        assertEquals(JobStatus.COMPLETED, job.getStatus());
        assertEquals("node-a/worker-2", job.getWorkerId());
    }

    @Test
    void shouldIgnoreDuplicateDeliveryOfJobRunningInThisInstance() throws Exception {
        // Given
        String jobId = submit(HYBRID);
        CountDownLatch engineEntered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(engineClient.calculateInventory(any())).thenAnswer(inv -> {
            engineEntered.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return INVENTORY;
        });
        ExecutorService first = Executors.newSingleThreadExecutor();
        try {
            Future<?> running = first.submit(() -> executor.execute(jobId, "node-a/worker-1"));
            assertTrue(engineEntered.await(5, TimeUnit.SECONDS));

            // When
            executor.execute(jobId, "node-a/worker-2");
            release.countDown();
            running.get(5, TimeUnit.SECONDS);
        } finally {
            first.shutdownNow();
        }

        // Then
        CalculationJob job = jobStore.get(jobId).orElseThrow();
        assertEquals(JobStatus.COMPLETED, job.getStatus());
        assertEquals("node-a/worker-1", job.getWorkerId());
        verify(engineClient, times(1)).calculateInventory(any());
    }

    @Test
    void shouldNotCountSweptJobAsCancelled() {
        // Given: пока движок отвечает, задачу принудительно завершает очистка
        String jobId = submit(HYBRID);
        when(engineClient.calculateInventory(any())).thenAnswer(inv -> {
            jobStore.fail(jobId, "stuck", true);
            return INVENTORY;
        });

        // When
        executor.execute(jobId, "worker-1");

        // Then
        CalculationJob job = jobStore.get(jobId).orElseThrow();
        assertEquals(JobStatus.FAILED, job.getStatus());
        assertEquals("stuck", job.getErrorMessage());
        assertNull(job.getResult());
        assertEquals(0.0, meterRegistry.get("footprint.jobs.cancelled.total").counter().count());
        assertEquals(0.0, meterRegistry.get("footprint.jobs.completed.total").counter().count());
    }

    @Test
    void joinedJobShouldReportLeaderAttempts() throws Exception {
        // Given: лидер дважды получает отказ движка и успевает с третьей попытки
        String leaderJob = submit(HYBRID);
        String joinedJob = submit(HYBRID);
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch engineEntered = new CountDownLatch(1);
        when(engineClient.calculateInventory(any())).thenAnswer(inv -> {
            int call = calls.incrementAndGet();
            if (call == 1) {
                engineEntered.countDown();
                awaitJoined();
                throw new EngineUnavailableException("connection refused");
            }
            if (call == 2) {
                throw new EngineUnavailableException("connection refused");
            }
            return INVENTORY;
        });
        ExecutorService leader = Executors.newSingleThreadExecutor();
        try {
            Future<?> running = leader.submit(() -> executor.execute(leaderJob, "worker-1"));
            assertTrue(engineEntered.await(5, TimeUnit.SECONDS));

            // When
            executor.execute(joinedJob, "worker-2");
            running.get(5, TimeUnit.SECONDS);
        } finally {
            leader.shutdownNow();
        }

        // Then
        assertEquals(3, jobStore.get(leaderJob).orElseThrow().getAttempt());
        CalculationJob joined = jobStore.get(joinedJob).orElseThrow();
        assertEquals(JobStatus.COMPLETED, joined.getStatus());
        assertEquals(3, joined.getAttempt());
        assertEquals(37.9, joined.getResult().getTotalCo2e(), 1e-9);
        verify(engineClient, times(3)).calculateInventory(any());
    }

    @Test
    void joinedJobShouldReportExhaustedAttemptsOnFallback() throws Exception {
        String leaderJob = submit(HYBRID);
        String joinedJob = submit(HYBRID);
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch engineEntered = new CountDownLatch(1);
        when(engineClient.calculateInventory(any())).thenAnswer(inv -> {
            if (calls.incrementAndGet() == 1) {
                engineEntered.countDown();
                awaitJoined();
            }
            throw new EngineUnavailableException("connection refused");
        });
        ExecutorService leader = Executors.newSingleThreadExecutor();
        try {
            Future<?> running = leader.submit(() -> executor.execute(leaderJob, "worker-1"));
            assertTrue(engineEntered.await(5, TimeUnit.SECONDS));

            executor.execute(joinedJob, "worker-2");
            running.get(5, TimeUnit.SECONDS);
        } finally {
            leader.shutdownNow();
        }

        CalculationJob joined = jobStore.get(joinedJob).orElseThrow();
        assertTrue(joined.getResult().isDegraded());
        assertEquals(3, joined.getAttempt());
        verify(engineClient, times(3)).calculateInventory(any());
    }

    private void awaitJoined() throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (meterRegistry.get("footprint.singleflight.joined.total").counter().count() < 1.0
                && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
    }

    private String submit(CalculationOptions options) {
        return jobStore.create("product-1", PayloadKind.CALCULATION, INPUTS, options);
    }

    private CalculationJobExecutor newExecutor(FootprintCache footprintCache) {
        Retry retry = Retry.of("test", RetryConfig.custom()
                .maxAttempts(3)
                .intervalFunction(IntervalFunction.ofExponentialRandomBackoff(Duration.ofMillis(1), 2.0, 0.5))
                .retryOnException(e -> e instanceof EngineUnavailableException)
                .build());
        TimeLimiter timeLimiter = TimeLimiter.of("test", TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofSeconds(5))
                .build());
        return new CalculationJobExecutor(
                jobStore,
                footprintCache,
                keyGenerator,
                engineClient,
                new FixedFactorSource(),
                calculationCore,
                new FallbackEstimator(),
                new EngineCallPolicy(retry, timeLimiter, engineExecutor),
                new PipelineMetrics(meterRegistry, new InMemoryJobQueue()),
                clock);
    }

    private static final class FixedFactorSource implements GwpFactorSource {
        private final Map<String, GwpFactorTable> tables = Map.of(
                "AR6", new GwpFactorTable("AR6", Map.of("CO2", 1.0, "CH4", 27.9)),
                "AR5", new GwpFactorTable("AR5", Map.of("CO2", 1.0, "CH4", 28.0)));

        @Override
        public OptionalDouble getGwpFactor(String gasFormula, String factorVersion) {
            return table(factorVersion).factorFor(gasFormula);
        }

        @Override
        public GwpFactorTable table(String factorVersion) {
            GwpFactorTable table = tables.get(factorVersion);
            if (table == null) {
                throw new EngineDataException("Unknown GWP factor version: " + factorVersion);
            }
            return table;
        }

        @Override
        public Set<String> availableVersions() {
            return tables.keySet();
        }
    }
}
