/*
 * どこで: Send Worker NATS JetStream 購読テスト(統合寄り)
 * 何を: start() 経由の購読設定と、受信メッセージがハンドラへ渡ることを検証する
 * なぜ: stream/consumer 設定とハンドラ連携を最低限保証するため
 */
package com.example.sendworker.nats;

import com.example.sendworker.config.SendQueueProperties;
import com.example.sendworker.service.ReceivedSendMessage;
import com.example.sendworker.service.SendMessageHandler;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.MessageHandler;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.Error;
import io.nats.client.api.StreamConfiguration;
import io.nats.client.impl.Headers;
import io.nats.client.impl.NatsJetStreamMetaData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

@ExtendWith(MockitoExtension.class)
class SendQueueSubscriberTest {

        private static final String SUBJECT = "notification.send";
        private static final String STREAM = "notification-send";
        private static final String DURABLE = "send-worker-consumer";
        private static final Duration DUPLICATE_WINDOW = Duration.ofMinutes(2);
        private static final Duration ACK_WAIT = Duration.ofMinutes(5);
        private static final int MAX_DELIVER = 10;
        private static final ZonedDateTime ENQUEUED_AT =
                        ZonedDateTime.of(2026, 3, 1, 0, 0, 0, 0, ZoneOffset.UTC);

        @Mock
        private Connection connection;

        @Mock
        private JetStream jetStream;

        @Mock
        private JetStreamManagement jetStreamManagement;

        @Mock
        private Dispatcher dispatcher;

        @Mock
        private JetStreamSubscription subscription;

        @Mock
        private SendMessageHandler messageHandler;

        @Captor
        private ArgumentCaptor<MessageHandler> handlerCaptor;

        @Captor
        private ArgumentCaptor<PushSubscribeOptions> optionsCaptor;

        @Captor
        private ArgumentCaptor<StreamConfiguration> streamCaptor;

        @Captor
        private ArgumentCaptor<ReceivedSendMessage> receivedCaptor;

        private SendQueueSubscriber subscriber;

        @BeforeEach
        void setUp() {
                SendQueueProperties properties =
                                new SendQueueProperties(SUBJECT, STREAM, DURABLE, DUPLICATE_WINDOW, ACK_WAIT, MAX_DELIVER);
                subscriber = new SendQueueSubscriber(connection, messageHandler, properties);
        }

        @Test
        void passesWrappedMessageToHandlerViaJetStreamWiring() throws Exception {
                Message message = jetStreamMessage(3L);
                stubConnection();
                when(jetStream.subscribe(eq(SUBJECT), eq(dispatcher), handlerCaptor.capture(), eq(false),
                                any(PushSubscribeOptions.class)))
                                .thenReturn(subscription);

                subscriber.start();

                // JetStream から受け取ったメッセージを handler 経由で処理する
                handlerCaptor.getValue().onMessage(message);

                verify(messageHandler).handle(receivedCaptor.capture());
                ReceivedSendMessage received = receivedCaptor.getValue();
                assertEquals(3, received.metadata().deliveryAttemptCount());
                assertEquals("delayed-job-1", received.metadata().messageId());
                assertEquals(ENQUEUED_AT.toInstant(), received.metadata().enqueuedAt());
        }

        @Test
        void nakWhenHandlerFailsUnexpectedly() {
                Message message = jetStreamMessage(1L);
                doThrow(new DataAccessResourceFailureException("boom"))
                                .when(messageHandler)
                                .handle(any(ReceivedSendMessage.class));

                subscriber.handleMessage(message);

                verify(message, never()).ack();
                verify(message).nak();
        }

        @Test
        void swallowExceptionWhenNakFails() {
                Message message = jetStreamMessage(1L);
                doThrow(new DataAccessResourceFailureException("boom"))
                                .when(messageHandler)
                                .handle(any(ReceivedSendMessage.class));
                doThrow(new IllegalStateException("nak-failed"))
                                .when(message)
                                .nak();

                assertDoesNotThrow(() -> subscriber.handleMessage(message));

                verify(message).nak();
        }

        @Test
        void dropsMessageWithoutJetStreamMetadata() {
                Message message = mock(Message.class);
                when(message.metaData()).thenThrow(new IllegalStateException("not a JetStream message"));

                assertDoesNotThrow(() -> subscriber.handleMessage(message));

                verifyNoInteractions(messageHandler);
                verify(message, never()).ack();
                verify(message, never()).nak();
        }

        @Test
        void startEnsuresStreamWithDuplicateWindow() throws Exception {
                stubConnection();
                when(jetStream.subscribe(eq(SUBJECT), eq(dispatcher), any(MessageHandler.class), eq(false),
                                any(PushSubscribeOptions.class)))
                                .thenReturn(subscription);
                when(jetStreamManagement.updateStream(any(StreamConfiguration.class)))
                                .thenThrow(new StreamNotFoundException());

                subscriber.start();

                verify(jetStreamManagement).updateStream(any(StreamConfiguration.class));
                verify(jetStreamManagement).addStream(streamCaptor.capture());
                assertEquals(STREAM, streamCaptor.getValue().getName());
                assertEquals(DUPLICATE_WINDOW, streamCaptor.getValue().getDuplicateWindow());
        }

        @Test
        void startUsesExplicitAckWithAckWaitAndMaxDeliver() throws Exception {
                stubConnection();
                when(jetStream.subscribe(eq(SUBJECT), eq(dispatcher), any(MessageHandler.class), eq(false),
                                optionsCaptor.capture()))
                                .thenReturn(subscription);

                subscriber.start();

                PushSubscribeOptions options = optionsCaptor.getValue();
                assertEquals(STREAM, options.getStream());
                assertEquals(DURABLE, options.getDurable());
                assertEquals(AckPolicy.Explicit, options.getConsumerConfiguration().getAckPolicy());
                assertEquals(ACK_WAIT, options.getConsumerConfiguration().getAckWait());
                assertEquals(MAX_DELIVER, options.getConsumerConfiguration().getMaxDeliver());
        }

        @Test
        void startFailsWhenStreamCannotBeEnsured() throws Exception {
                when(connection.jetStreamManagement()).thenThrow(new IOException("connection closed"));

                assertThatThrownBy(subscriber::start)
                                .isInstanceOf(IllegalStateException.class)
                                .hasCauseInstanceOf(IOException.class);
        }

        @Test
        void stopClosesSubscriptionAndDispatcherSafelyWhenCalledMultipleTimes() throws Exception {
                stubConnection();
                when(jetStream.subscribe(eq(SUBJECT), eq(dispatcher), any(MessageHandler.class), eq(false),
                                any(PushSubscribeOptions.class)))
                                .thenReturn(subscription);

                subscriber.start();

                assertDoesNotThrow(subscriber::stop);
                assertDoesNotThrow(subscriber::stop);

                verify(subscription, times(1)).unsubscribe();
                verify(connection, times(1)).closeDispatcher(dispatcher);
        }

        private void stubConnection() throws IOException {
                when(connection.jetStream()).thenReturn(jetStream);
                when(connection.jetStreamManagement()).thenReturn(jetStreamManagement);
                when(connection.createDispatcher()).thenReturn(dispatcher);
        }

        private Message jetStreamMessage(long deliveredCount) {
                Message message = mock(Message.class);
                NatsJetStreamMetaData metaData = mock(NatsJetStreamMetaData.class);
                when(metaData.deliveredCount()).thenReturn(deliveredCount);
                when(metaData.timestamp()).thenReturn(ENQUEUED_AT);
                when(message.metaData()).thenReturn(metaData);
                when(message.getHeaders()).thenReturn(new Headers().add("Nats-Msg-Id", "delayed-job-1"));
                return message;
        }

        private static final class StreamNotFoundException extends JetStreamApiException {
                private StreamNotFoundException() {
                        super(Error.JsBadRequestErr);
                }

                @Override
                public int getApiErrorCode() {
                        return 10059;
                }

                @Override
                public int getErrorCode() {
                        return 404;
                }
        }
}
