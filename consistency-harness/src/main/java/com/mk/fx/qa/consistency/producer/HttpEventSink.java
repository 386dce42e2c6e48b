package com.mk.fx.qa.consistency.producer;

import com.mk.fx.qa.consistency.model.SyntheticEvent;
import com.mk.fx.qa.consistency.rest.Request;
import com.mk.fx.qa.consistency.rest.RequestClient;
import com.mk.fx.qa.consistency.rest.TransportException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Publishes events to an HTTP ingest endpoint of the system under test. Each event travels in an
 * envelope naming its source, type and destination bus; any 2xx answer counts as accepted.
 */
@Slf4j
public class HttpEventSink implements EventSink {

  private final RequestClient client;
  private final String ingestPath;
  private final String source;

  public HttpEventSink(RequestClient client, String ingestPath, String source) {
    this.client = Objects.requireNonNull(client, "client");
    this.ingestPath = Objects.requireNonNull(ingestPath, "ingestPath");
    this.source = Objects.requireNonNull(source, "source");
  }

  @Override
  public boolean publish(SyntheticEvent event, String sinkIdentifier) {
    Map<String, Object> envelope = new LinkedHashMap<>();
    envelope.put("source", source);
    envelope.put("detail_type", event.type());
    envelope.put("bus", sinkIdentifier);
    envelope.put("detail", event);
    try {
      var response = client.execute(Request.post(ingestPath, envelope, null));
      if (!response.isSuccessful()) {
        log.debug("Ingest answered {} for event {}", response.getStatusCode(), event.id());
      }
      return response.isSuccessful();
    } catch (TransportException e) {
      throw new EventPublishException("Could not publish event " + event.id(), e);
    }
  }
}
