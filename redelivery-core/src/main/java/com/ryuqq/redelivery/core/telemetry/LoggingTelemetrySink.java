package com.ryuqq.redelivery.core.telemetry;

import com.ryuqq.redelivery.core.spi.TelemetrySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SLF4J 기반 기본 텔레메트리 sink.
 *
 * <p>INFORMATION은 INFO 레벨로, WARNING은 WARN 레벨로 기록합니다.</p>
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public final class LoggingTelemetrySink implements TelemetrySink {

    private static final Logger log = LoggerFactory.getLogger(LoggingTelemetrySink.class);

    @Override
    public void report(RedeliveryEvent event) {
        if (event.severity() == EventSeverity.WARNING) {
            log.warn("[{}] {}: messageId={}, outcome={}, args={}",
                event.strategyName(), event.eventName(),
                event.context().message().messageId().getValue(),
                describe(event), event.arguments());
        } else if (log.isInfoEnabled()) {
            log.info("[{}] {}: messageId={}, outcome={}, args={}",
                event.strategyName(), event.eventName(),
                event.context().message().messageId().getValue(),
                describe(event), event.arguments());
        }
    }

    private static String describe(RedeliveryEvent event) {
        return event.outcome().failureCause()
            .map(e -> "Fail(" + e.getClass().getSimpleName() + ": " + e.getMessage() + ")")
            .orElse("Ok");
    }
}
