package com.example.footprint.service.cache;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Подавление дублирующихся вычислений по ключу: пока вычисление по ключу выполняется,
 * остальные вызовы ждут его результата вместо запуска собственного.
 * Метка снимается по завершении, в том числе с ошибкой.
 *
 * @param <T> тип результата
 */
@Slf4j
public class SingleFlight<T> {

    private final Map<String, CompletableFuture<T>> inFlight = new ConcurrentHashMap<>();

    /**
     * Выполняет {@code work} или присоединяется к уже выполняющемуся вычислению по ключу.
     *
     * @param onJoin вызывается, если вызов присоединился к чужому вычислению
     */
    public T execute(String key, Supplier<T> work, Runnable onJoin) {
        CompletableFuture<T> mine = new CompletableFuture<>();
        CompletableFuture<T> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            log.debug("Joining in-flight computation for key {}", key);
            onJoin.run();
            return await(existing);
        }

        try {
            T value = work.get();
            mine.complete(value);
            return value;
        } catch (RuntimeException | Error e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    public boolean isInFlight(String key) {
        return inFlight.containsKey(key);
    }

    private T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }
}
