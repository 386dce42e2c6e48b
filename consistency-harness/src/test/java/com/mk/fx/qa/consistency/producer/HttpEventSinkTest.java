package com.mk.fx.qa.consistency.producer;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.consistency.model.SyntheticEvent;
import com.mk.fx.qa.consistency.rest.HttpMethod;
import com.mk.fx.qa.consistency.rest.Request;
import com.mk.fx.qa.consistency.rest.RestResponseData;
import com.mk.fx.qa.consistency.rest.TransportException;
import java.net.ConnectException;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class HttpEventSinkTest {

  private static final SyntheticEvent EVENT =
      new SyntheticEvent(
          "e-1", "c-1", "perf_1", 1L, "2024-05-01T10:15:30.123Z", "placement.created", Map.of());

  @Test
  void publish_postsEnvelopeToIngestPath_andAcceptsTwoHundreds() {
    var captured = new AtomicReference<Request>();
    var sink =
        new HttpEventSink(
            request -> {
              captured.set(request);
              return RestResponseData.of(202, "", 3);
            },
            "/v1/events",
            "nedlia.perf-test");

    assertTrue(sink.publish(EVENT, "nedlia-events"));

    var request = captured.get();
    assertEquals(HttpMethod.POST, request.getMethod());
    assertEquals("/v1/events", request.getPath());
    @SuppressWarnings("unchecked")
    var envelope = (Map<String, Object>) request.getBody();
    assertEquals("nedlia.perf-test", envelope.get("source"));
    assertEquals("placement.created", envelope.get("detail_type"));
    assertEquals("nedlia-events", envelope.get("bus"));
    assertSame(EVENT, envelope.get("detail"));
  }

  @Test
  void publish_errorStatus_returnsFalse() {
    var sink =
        new HttpEventSink(request -> RestResponseData.of(500, "", 3), "/v1/events", "src");
    assertFalse(sink.publish(EVENT, "bus"));
  }

  @Test
  void publish_transportFailure_raisesTypedPublishError() {
    var sink =
        new HttpEventSink(
            request -> {
              throw new TransportException("refused", new ConnectException("refused"));
            },
            "/v1/events",
            "src");

    var ex = assertThrows(EventPublishException.class, () -> sink.publish(EVENT, "bus"));
    assertInstanceOf(TransportException.class, ex.getCause());
  }
}
