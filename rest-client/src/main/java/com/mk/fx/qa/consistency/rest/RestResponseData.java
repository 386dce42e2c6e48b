package com.mk.fx.qa.consistency.rest;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;
import java.util.Optional;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RestResponseData {
  private int statusCode;
  private Map<String, String> headers;
  private String body;
  private long responseTimeMs;

  public static RestResponseData of(int statusCode, String body, long responseTimeMs) {
    return new RestResponseData(statusCode, Map.of(), body, responseTimeMs);
  }

  @JsonIgnore
  public boolean isSuccessful() {
    return statusCode >= 200 && statusCode < 300;
  }

  /** Parses the body as JSON; empty when there is no body or it is not valid JSON. */
  public Optional<JsonNode> json() {
    return JsonUtil.parse(body);
  }
}
