package com.ryuqq.redelivery.core.telemetry;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.ryuqq.redelivery.core.context.DeliveryContext;
import com.ryuqq.redelivery.core.model.Message;
import com.ryuqq.redelivery.core.model.MessageId;
import com.ryuqq.redelivery.core.model.Payload;
import com.ryuqq.redelivery.core.outcome.Outcome;
import com.ryuqq.redelivery.core.spi.MessageReceiver;
import com.ryuqq.redelivery.core.spi.MessageSender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * LoggingTelemetrySink 테스트.
 *
 * <p>Logback ListAppender로 출력 레벨과 내용을 확인합니다.</p>
 */
@ExtendWith(MockitoExtension.class)
class LoggingTelemetrySinkTest {

    @Mock
    private MessageReceiver receiver;

    @Mock
    private MessageSender sender;

    private final LoggingTelemetrySink sink = new LoggingTelemetrySink();
    private Logger logger;
    private ListAppender<ILoggingEvent> appender;
    private DeliveryContext context;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(LoggingTelemetrySink.class);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        context = DeliveryContext.of(Message.of(MessageId.of("msg-1"), Payload.empty()), receiver, sender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
    }

    @Test
    void report_WarningEvent_LogsAtWarnWithFailure() {
        // given
        RedeliveryEvent event = new RedeliveryEvent("RedeliverMessage", "ExecutionAttempt", EventSeverity.WARNING,
            context, Outcome.fail(new IllegalStateException("boom")),
            new ExecutionAttemptArguments(0, Duration.ofMillis(5), true));

        // when
        sink.report(event);

        // then
        assertThat(appender.list).hasSize(1);
        ILoggingEvent logged = appender.list.get(0);
        assertThat(logged.getLevel()).isEqualTo(Level.WARN);
        assertThat(logged.getFormattedMessage())
            .contains("[RedeliverMessage] ExecutionAttempt")
            .contains("messageId=msg-1")
            .contains("Fail(IllegalStateException: boom)");
    }

    @Test
    void report_InformationEvent_LogsAtInfo() {
        // given
        RedeliveryEvent event = new RedeliveryEvent("RedeliverMessage", "ExecutionAttempt", EventSeverity.INFORMATION,
            context, Outcome.ok("done"), new ExecutionAttemptArguments(0, Duration.ofMillis(5), false));

        // when
        sink.report(event);

        // then
        assertThat(appender.list).hasSize(1);
        assertThat(appender.list.get(0).getLevel()).isEqualTo(Level.INFO);
        assertThat(appender.list.get(0).getFormattedMessage()).contains("outcome=Ok");
    }
}
