package com.example.footprint.service.worker;

import com.example.footprint.exception.EngineUnavailableException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;
import java.util.function.Supplier;

/**
 * Политика вызова внешнего движка: ограничение времени каждой попытки и повтор
 * с экспоненциальной задержкой и случайным разбросом.
 * <p>
 * Повторяется только {@link EngineUnavailableException}; таймаут попытки считается ею же.
 * После исчерпания попыток пробрасывается последняя ошибка.
 */
@Slf4j
@Component
public class EngineCallPolicy {

    private final Retry retry;
    private final TimeLimiter timeLimiter;
    private final ExecutorService engineCallExecutor;

    public EngineCallPolicy(@Qualifier("engineRetry") Retry retry,
                            @Qualifier("engineTimeLimiter") TimeLimiter timeLimiter,
                            @Qualifier("engineCallExecutor") ExecutorService engineCallExecutor) {
        this.retry = retry;
        this.timeLimiter = timeLimiter;
        this.engineCallExecutor = engineCallExecutor;
    }

    /**
     * Выполняет вызов движка.
     *
     * @param onAttempt получает номер попытки (с 1) перед каждой попыткой
     */
    public <T> T call(String jobId, Supplier<T> engineCall, IntConsumer onAttempt) {
        AtomicInteger attempts = new AtomicInteger();
        Callable<T> attempt = () -> {
            int number = attempts.incrementAndGet();
            if (number > 1) {
                log.info("Job {}: retrying engine call, attempt {}/{}",
                        jobId, number, retry.getRetryConfig().getMaxAttempts());
            }
            onAttempt.accept(number);
            return callWithTimeout(jobId, engineCall);
        };

        try {
            return Retry.decorateCallable(retry, attempt).call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new EngineUnavailableException("Engine call for job " + jobId + " failed: " + e.getMessage(), e);
        }
    }

    public int maxAttempts() {
        return retry.getRetryConfig().getMaxAttempts();
    }

    private <T> T callWithTimeout(String jobId, Supplier<T> engineCall) {
        Callable<T> task = engineCall::get;
        try {
            return timeLimiter.executeFutureSupplier(() -> engineCallExecutor.submit(task));
        } catch (TimeoutException e) {
            throw new EngineUnavailableException("Engine call for job " + jobId + " timed out after "
                    + timeLimiter.getTimeLimiterConfig().getTimeoutDuration(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EngineUnavailableException("Interrupted while waiting for engine response for job " + jobId, e);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new EngineUnavailableException("Engine call for job " + jobId + " failed: " + e.getMessage(), e);
        }
    }
}
