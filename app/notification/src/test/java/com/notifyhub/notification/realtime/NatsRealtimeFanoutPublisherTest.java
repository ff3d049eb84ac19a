package com.notifyhub.notification.realtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.notifyhub.notification.config.NotificationRealtimeProperties;
import io.nats.client.Connection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NatsRealtimeFanoutPublisherTest {

  @Mock private Connection connection;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private NatsRealtimeFanoutPublisher publisher;

  @BeforeEach
  void setUp() {
    publisher =
        new NatsRealtimeFanoutPublisher(
            connection,
            new NotificationRealtimeProperties(true, null, null, null, null, "rt", null),
            objectMapper);
  }

  @Test
  void publishesFrameToRecipientSubject() throws Exception {
    when(connection.getStatus()).thenReturn(Connection.Status.CONNECTED);

    publisher.groupSend(
        5L, RealtimeFrame.notification(objectMapper.createObjectNode().put("title", "x"), 3L));

    ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
    verify(connection).publish(eq("rt.5"), body.capture());
    RealtimeFrame decoded = objectMapper.readValue(body.getValue(), RealtimeFrame.class);
    assertThat(decoded.type()).isEqualTo(RealtimeFrame.TYPE_NOTIFICATION);
    assertThat(decoded.jobId()).isEqualTo(3L);
    assertThat(decoded.data().path("title").asText()).isEqualTo("x");
  }

  @Test
  void disconnectedConnectionIsReportedAsUnavailable() {
    when(connection.getStatus()).thenReturn(Connection.Status.DISCONNECTED);

    assertThatThrownBy(
            () ->
                publisher.groupSend(
                    5L, RealtimeFrame.notification(objectMapper.createObjectNode(), 3L)))
        .isInstanceOf(FanoutUnavailableException.class);
    verify(connection, never()).publish(anyString(), any(byte[].class));
  }

  @Test
  void publishOnClosedConnectionIsReportedAsUnavailable() {
    when(connection.getStatus()).thenReturn(Connection.Status.CONNECTED);
    doThrow(new IllegalStateException("Connection is Closed"))
        .when(connection)
        .publish(anyString(), any(byte[].class));

    assertThatThrownBy(
            () ->
                publisher.groupSend(
                    5L, RealtimeFrame.notification(objectMapper.createObjectNode(), 3L)))
        .isInstanceOf(FanoutUnavailableException.class)
        .hasMessageContaining("Connection is Closed");
  }

  @Test
  void subjectIsPrefixDotRecipientId() {
    assertThat(NatsRealtimeFanoutPublisher.subjectFor("notification.realtime", 12L))
        .isEqualTo("notification.realtime.12");
  }
}
