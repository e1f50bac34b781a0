package com.ryuqq.redelivery.adapter.runner;

/**
 * RedeliveryWorker 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>batchSize: pump 1회당 receive할 메시지 수 (기본 10)</li>
 *   <li>concurrency: 동시에 처리할 메시지 수, 워커 스레드 수와 같음 (기본 5)</li>
 *   <li>shutdownTimeoutMs: shutdown 시 진행 중 작업 대기 시간 (기본 60000ms = 60초)</li>
 * </ul>
 *
 * <p><strong>성능 튜닝 가이드:</strong></p>
 * <ul>
 *   <li>높은 처리량: batchSize 증가 (10 → 50), concurrency 증가 (5 → 20)</li>
 *   <li>낮은 지연: batchSize 감소 (10 → 1)</li>
 *   <li>자원 절약: concurrency 감소</li>
 * </ul>
 *
 * @author Redelivery Team
 * @since 1.0.0
 * @param batchSize 배치 크기 (1 이상이어야 함)
 * @param concurrency 동시 처리 스레드 수 (1 이상이어야 함)
 * @param shutdownTimeoutMs shutdown 대기 시간 (밀리초, 양수여야 함)
 */
public record WorkerConfig(
    int batchSize,
    int concurrency,
    long shutdownTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: batchSize=10, concurrency=5, shutdownTimeoutMs=60000ms</p>
     */
    public WorkerConfig() {
        this(10, 5, 60_000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public WorkerConfig {
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    /**
     * batchSize만 변경한 새 인스턴스 생성.
     */
    public WorkerConfig withBatchSize(int batchSize) {
        return new WorkerConfig(batchSize, concurrency, shutdownTimeoutMs);
    }

    /**
     * concurrency만 변경한 새 인스턴스 생성.
     */
    public WorkerConfig withConcurrency(int concurrency) {
        return new WorkerConfig(batchSize, concurrency, shutdownTimeoutMs);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public WorkerConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new WorkerConfig(batchSize, concurrency, shutdownTimeoutMs);
    }
}
