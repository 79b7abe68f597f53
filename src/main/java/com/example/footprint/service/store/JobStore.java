package com.example.footprint.service.store;

import com.example.footprint.model.CalculationJob;
import com.example.footprint.model.CalculationOptions;
import com.example.footprint.model.ExecutionStage;
import com.example.footprint.model.FootprintResult;
import com.example.footprint.model.InventoryFlow;
import com.example.footprint.model.JobStatus;
import com.example.footprint.model.PayloadKind;
import com.example.footprint.model.ProductInputs;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Хранилище задач расчёта, единственный источник истины о состоянии задач.
 * <p>
 * Все изменения выполняются атомарно по ключу jobId. Недопустимые переходы статуса
 * молча не применяются и сообщаются возвращаемым значением.
 * Сбой бэкенда приводит к {@link com.example.footprint.exception.PersistenceException}.
 */
public interface JobStore {

    /**
     * Создаёт задачу в статусе PENDING.
     *
     * @return ID задачи
     */
    String create(String subjectRef, PayloadKind kind, ProductInputs inputs, CalculationOptions options);

    Optional<CalculationJob> get(String jobId);

    /**
     * Переводит задачу в PROCESSING за указанным воркером. Задачу в PROCESSING может
     * повторно захватить воркер того же экземпляра (доставка после перезапуска), а воркер
     * другого экземпляра только после истечения аренды.
     *
     * @return снимок захваченной задачи или пусто, если захват невозможен
     */
    Optional<CalculationJob> claim(String jobId, String workerId);

    /**
     * Фиксирует этап выполнения. Прогресс не уменьшается.
     */
    void updateProgress(String jobId, ExecutionStage stage);

    /**
     * Фиксирует инвентаризацию, полученную от движка (этап INVENTORY_RECEIVED).
     */
    void recordInventory(String jobId, List<InventoryFlow> inventory);

    /**
     * Увеличивает счётчик попыток, задача остаётся в PROCESSING.
     *
     * @return новое значение счётчика
     */
    int incrementAttempt(String jobId);

    /**
     * Записывает результат и переводит задачу в COMPLETED. Повторная запись идемпотентна.
     *
     * @return false, если задача уже отменена или завершилась ошибкой
     */
    boolean complete(String jobId, FootprintResult result);

    /**
     * Переводит нетерминальную задачу в FAILED.
     *
     * @param reconcilable ошибка инфраструктуры, результат можно сверить позже
     */
    boolean fail(String jobId, String errorMessage, boolean reconcilable);

    /**
     * Отменяет задачу.
     *
     * @return false, если задача уже в терминальном статусе или не найдена
     */
    boolean markCancelled(String jobId);

    /**
     * Перечитывает флаг отмены из хранилища.
     */
    boolean isCancelled(String jobId);

    List<CalculationJob> findBySubject(String subjectRef);

    /**
     * Задачи в статусе {@code status}, не обновлявшиеся с момента {@code updatedBefore}.
     */
    List<CalculationJob> findStale(JobStatus status, Instant updatedBefore);

    /**
     * Принудительно завершает ошибкой с признаком сверки задачу, которую конвейер потерял
     * до или во время обработки. В отличие от {@link #fail} допускается и из PENDING.
     *
     * @return true, если статус изменён
     */
    boolean abandon(String jobId, String errorMessage);

    /**
     * Завершает ошибкой зависшие задачи. Условие проверяется повторно при каждой записи.
     *
     * @return количество принудительно завершённых задач
     */
    int failStale(JobStatus status, Instant updatedBefore, String errorMessage);

    Map<JobStatus, Long> countByStatus();

    String backendName();
}
