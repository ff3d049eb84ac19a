package com.notifyhub.notification.realtime;

import static org.assertj.core.api.Assertions.assertThat;

import com.notifyhub.notification.config.NotificationRealtimeProperties;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RealtimeHandshakeInterceptorTest {

  private final RealtimeHandshakeInterceptor interceptor =
      new RealtimeHandshakeInterceptor(
          new NotificationRealtimeProperties.Auth(null, "secret-token", null));

  @Test
  void validTokenAndUserIdStoreRecipientAttribute() {
    MockHttpServletRequest request = handshake("secret-token", "42");
    MockHttpServletResponse response = new MockHttpServletResponse();
    Map<String, Object> attributes = new HashMap<>();

    boolean accepted =
        interceptor.beforeHandshake(
            new ServletServerHttpRequest(request),
            new ServletServerHttpResponse(response),
            null,
            attributes);

    assertThat(accepted).isTrue();
    assertThat(attributes).containsEntry(RealtimeHandshakeInterceptor.RECIPIENT_ID_ATTRIBUTE, 42L);
  }

  @Test
  void wrongTokenIsRejectedWith401() {
    assertRejected(handshake("other-token", "42"));
    assertRejected(handshake(null, "42"));
  }

  @Test
  void missingOrMalformedUserIdIsRejectedWith401() {
    assertRejected(handshake("secret-token", null));
    assertRejected(handshake("secret-token", "abc"));
    assertRejected(handshake("secret-token", "0"));
  }

  @Test
  void blankConfiguredTokenRejectsEveryone() {
    RealtimeHandshakeInterceptor unconfigured =
        new RealtimeHandshakeInterceptor(new NotificationRealtimeProperties.Auth(null, "", null));
    MockHttpServletResponse response = new MockHttpServletResponse();

    boolean accepted =
        unconfigured.beforeHandshake(
            new ServletServerHttpRequest(handshake("", "42")),
            new ServletServerHttpResponse(response),
            null,
            new HashMap<>());

    assertThat(accepted).isFalse();
  }

  private void assertRejected(MockHttpServletRequest request) {
    MockHttpServletResponse response = new MockHttpServletResponse();
    Map<String, Object> attributes = new HashMap<>();
    ServletServerHttpResponse serverResponse = new ServletServerHttpResponse(response);

    boolean accepted =
        interceptor.beforeHandshake(
            new ServletServerHttpRequest(request), serverResponse, null, attributes);

    assertThat(accepted).isFalse();
    assertThat(response.getStatus()).isEqualTo(401);
    assertThat(attributes).isEmpty();
  }

  private static MockHttpServletRequest handshake(String token, String userId) {
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/ws/notifications");
    if (token != null) {
      request.addHeader("X-Internal-Token", token);
    }
    if (userId != null) {
      request.addHeader("X-User-Id", userId);
    }
    return request;
  }
}
