package com.mk.fx.qa.consistency.rest;

import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Request {
  private HttpMethod method;
  private String path;
  private Map<String, String> headers;
  private Map<String, String> query;
  private Object body;

  public static Request get(String path) {
    return new Request(HttpMethod.GET, path, null, null, null);
  }

  public static Request get(String path, Map<String, String> query) {
    return new Request(HttpMethod.GET, path, null, query, null);
  }

  public static Request post(String path, Object body, Map<String, String> headers) {
    return new Request(HttpMethod.POST, path, headers, null, body);
  }
}
