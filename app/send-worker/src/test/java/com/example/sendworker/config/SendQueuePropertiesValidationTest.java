/*
 * どこで: Send Worker 設定のバリデーションテスト
 * 何を: SendQueueProperties / SendFunctionProperties / SendRelayProperties の Bean Validation を検証する
 * なぜ: 起動時に不正なキュー設定や dead-letter 判定と矛盾する max-deliver を検出するため
 */
package com.example.sendworker.config;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SendQueuePropertiesValidationTest {

    private static final String SUBJECT = "notification.send";
    private static final String STREAM = "notification-send";
    private static final String DURABLE = "send-worker-consumer";
    private static final Duration DUPLICATE_WINDOW = Duration.ofMinutes(2);
    private static final Duration ACK_WAIT = Duration.ofMinutes(5);
    private static final int MAX_DELIVER = 10;

    private Validator validator;

    @BeforeEach
    void setUp() {
        validator = Validation.buildDefaultValidatorFactory().getValidator();
    }

    @Test
    void validationPassesWhenAllFieldsValid() {
        SendQueueProperties properties =
                new SendQueueProperties(SUBJECT, STREAM, DURABLE, DUPLICATE_WINDOW, ACK_WAIT, MAX_DELIVER);

        assertTrue(validator.validate(properties).isEmpty());
    }

    @Test
    void validationFailsWhenAckWaitIsZero() {
        SendQueueProperties properties =
                new SendQueueProperties(SUBJECT, STREAM, DURABLE, DUPLICATE_WINDOW, Duration.ZERO, MAX_DELIVER);

        assertFalse(validator.validate(properties).isEmpty());
    }

    @Test
    void validationFailsWhenDuplicateWindowIsNegative() {
        SendQueueProperties properties =
                new SendQueueProperties(SUBJECT, STREAM, DURABLE, Duration.ofSeconds(-1), ACK_WAIT, MAX_DELIVER);

        assertFalse(validator.validate(properties).isEmpty());
    }

    @Test
    void validationFailsWhenMaxDeliverIsBelowDeadLetterCount() {
        SendQueueProperties properties =
                new SendQueueProperties(SUBJECT, STREAM, DURABLE, DUPLICATE_WINDOW, ACK_WAIT, 9);

        assertFalse(validator.validate(properties).isEmpty());
    }

    @Test
    void validationPassesWhenMaxDeliverIsAboveDeadLetterCount() {
        SendQueueProperties properties =
                new SendQueueProperties(SUBJECT, STREAM, DURABLE, DUPLICATE_WINDOW, ACK_WAIT, 20);

        assertTrue(validator.validate(properties).isEmpty());
    }

    @Test
    void validationFailsWhenSendFunctionValuesAreNotPositive() {
        assertFalse(validator.validate(new SendFunctionProperties(0, 660.0d, 1000)).isEmpty());
        assertFalse(validator.validate(new SendFunctionProperties(3, 0.0d, 1000)).isEmpty());
        assertFalse(validator.validate(new SendFunctionProperties(3, 660.0d, 0)).isEmpty());
        assertTrue(validator.validate(new SendFunctionProperties(3, 0.5d, 1000)).isEmpty());
    }

    @Test
    void validationFailsWhenRelayDurationsAreNotPositive() {
        Duration pollInterval = Duration.ofSeconds(1);
        Duration lease = Duration.ofSeconds(30);

        assertTrue(validator.validate(new SendRelayProperties(true, pollInterval, 100, lease)).isEmpty());
        assertFalse(validator.validate(new SendRelayProperties(true, pollInterval, 100, Duration.ZERO)).isEmpty());
        assertFalse(validator.validate(new SendRelayProperties(true, Duration.ZERO, 100, lease)).isEmpty());
        assertFalse(validator.validate(
                new SendRelayProperties(true, pollInterval, 100, Duration.ofSeconds(-5))).isEmpty());
    }
}
