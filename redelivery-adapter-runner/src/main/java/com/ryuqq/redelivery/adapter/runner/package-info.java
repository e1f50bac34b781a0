/**
 * Runner Adapter Layer - 메시지 소비 루프.
 *
 * <p>이 패키지는 broker에서 메시지를 가져와 재전달 전략에 넘기는 워커를 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.redelivery.adapter.runner.RedeliveryWorker} - 배치 receive 후 동시 처리하는 워커</li>
 *   <li>{@link com.ryuqq.redelivery.adapter.runner.WorkerConfig} - 워커 설정</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (RedeliveryWorker)
 *   ↓ depends on
 * core/strategy (ResilienceStrategy, ProcessingCallback)
 *   ↓ depends on
 * core/spi (MessageSource, MessageReceiver, MessageSender)
 * </pre>
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
package com.ryuqq.redelivery.adapter.runner;
