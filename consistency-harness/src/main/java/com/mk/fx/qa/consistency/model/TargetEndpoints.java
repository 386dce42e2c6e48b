package com.mk.fx.qa.consistency.model;

import com.mk.fx.qa.consistency.rest.JsonUtil;
import com.mk.fx.qa.consistency.rest.Request;
import com.mk.fx.qa.consistency.rest.RestResponseData;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Describes the resource the scenarios exercise on the system under test: where to create it,
 * where to read it back and how to find its identifier in a create response.
 *
 * @param writePath path of the create call, e.g. {@code /v1/placements}
 * @param readPathTemplate path of the read call with an {@code {id}} placeholder
 * @param listPath path of the cheap read used by latency and resilience scenarios
 * @param listQuery query parameters for the list call
 * @param writeBody JSON body template for create calls
 * @param correlationField body field carrying the probe's correlation id
 * @param idPointer JSON pointer of the created resource's identifier in the create response
 * @param idempotencyHeader header carrying the idempotency token
 */
public record TargetEndpoints(
    String writePath,
    String readPathTemplate,
    String listPath,
    Map<String, String> listQuery,
    Map<String, Object> writeBody,
    String correlationField,
    String idPointer,
    String idempotencyHeader) {

  public static final String ID_PLACEHOLDER = "{id}";

  public TargetEndpoints {
    Objects.requireNonNull(writePath, "writePath");
    Objects.requireNonNull(readPathTemplate, "readPathTemplate");
    Objects.requireNonNull(listPath, "listPath");
    Objects.requireNonNull(idPointer, "idPointer");
    Objects.requireNonNull(idempotencyHeader, "idempotencyHeader");
    if (!readPathTemplate.contains(ID_PLACEHOLDER)) {
      throw new IllegalArgumentException(
          "readPathTemplate must contain " + ID_PLACEHOLDER + ": " + readPathTemplate);
    }
    listQuery = listQuery != null ? Map.copyOf(listQuery) : Map.of();
    writeBody = writeBody != null ? Map.copyOf(writeBody) : Map.of();
  }

  /**
   * Builds a create request.
   *
   * @param correlationId written into {@link #correlationField()} when both are set
   * @param idempotencyKey sent in {@link #idempotencyHeader()} when not null
   */
  public Request writeRequest(String correlationId, String idempotencyKey) {
    Map<String, Object> body = new LinkedHashMap<>(writeBody);
    if (correlationId != null && correlationField != null && !correlationField.isBlank()) {
      body.put(correlationField, correlationId);
    }
    Map<String, String> headers =
        idempotencyKey != null ? Map.of(idempotencyHeader, idempotencyKey) : null;
    return Request.post(writePath, body, headers);
  }

  public Request readRequest(String id) {
    return Request.get(readPathTemplate.replace(ID_PLACEHOLDER, id));
  }

  public Request listRequest() {
    return Request.get(listPath, listQuery);
  }

  /** Extracts the created resource's identifier from a create response. */
  public Optional<String> extractId(RestResponseData response) {
    return response.json().flatMap(json -> JsonUtil.textAt(json, idPointer));
  }
}
