package com.mk.fx.qa.consistency.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link RequestClient} backed by the JDK HTTP client. Supports global headers and separate
 * connect/request timeouts. This implementation does not include retry logic.
 */
@Slf4j
public class LoadHttpClient implements RequestClient {

  /** The underlying Java HTTP client. */
  private final HttpClient httpClient;

  /** Global headers to be included in all requests. */
  private final Map<String, String> headers;

  /** Base URL for all requests. */
  private final String baseUrl;

  /** Timeout duration for requests. */
  private final Duration requestTimeout;

  /**
   * Constructs a client with explicit timeouts. Sub-second request timeouts are allowed, which the
   * timeout-handling scenario relies on.
   *
   * @param baseUrl the base URL for all requests
   * @param connectTimeout connection timeout
   * @param requestTimeout per-request timeout
   * @param headers global headers to include in all requests
   */
  public LoadHttpClient(
      String baseUrl,
      Duration connectTimeout,
      Duration requestTimeout,
      Map<String, String> headers) {

    this.baseUrl = validateAndNormalizeBaseUrl(baseUrl);
    this.requestTimeout = requirePositive(requestTimeout, "requestTimeout");

    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(requirePositive(connectTimeout, "connectTimeout"))
            .build();

    this.headers = headers != null ? Map.copyOf(headers) : Map.of();

    log.info(
        "LoadHttpClient initialised - Base URL: {}, Connection timeout: {}ms, Request timeout: {}ms",
        this.baseUrl,
        connectTimeout.toMillis(),
        requestTimeout.toMillis());
  }

  /**
   * Executes a synchronous REST request.
   *
   * @param request the REST request to execute
   * @return the response data, whatever its status code
   * @throws RequestTimeoutException if the connect or request timeout elapsed
   * @throws TransportException if no response was received for any other reason
   */
  @Override
  public RestResponseData execute(Request request) {
    Objects.requireNonNull(request, "Request cannot be null");

    var httpRequest = buildHttpRequest(request);
    var startTime = System.nanoTime();
    try {
      log.debug("Executing {} request to {}", request.getMethod(), httpRequest.uri());

      var response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
      var duration = (System.nanoTime() - startTime) / 1_000_000;

      log.debug("Request completed in {} ms with status {}", duration, response.statusCode());
      return buildResponseData(response, duration);

    } catch (HttpTimeoutException e) {
      log.debug("Request to {} timed out after {} ms", httpRequest.uri(), requestTimeout.toMillis());
      throw new RequestTimeoutException(
          "Request timed out after " + requestTimeout.toMillis() + "ms: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransportException("Request interrupted: " + httpRequest.uri(), e);
    } catch (IOException e) {
      log.debug("Error executing request to {}: {}", httpRequest.uri(), e.toString());
      throw new TransportException("Error executing request: " + e.getMessage(), e);
    }
  }

  /**
   * Builds an HTTP request from the given Request.
   *
   * @param request the Request to build
   * @return the constructed HttpRequest
   * @throws IllegalArgumentException if the method is missing, the URL is malformed or the body
   *     cannot be serialised
   */
  private HttpRequest buildHttpRequest(Request request) {
    if (request.getMethod() == null) {
      throw new IllegalArgumentException("Request method is required");
    }
    var url = baseUrl + (request.getPath() != null ? request.getPath() : "");

    if (request.getQuery() != null && !request.getQuery().isEmpty()) {
      url += "?" + buildQueryString(request.getQuery());
    }

    var requestBuilder = HttpRequest.newBuilder().uri(URI.create(url)).timeout(requestTimeout);

    // global headers
    headers.forEach(requestBuilder::header);

    // request-specific headers override
    if (request.getHeaders() != null) {
      request.getHeaders().forEach(requestBuilder::setHeader);
    }

    if (request.getBody() != null) {
      try {
        var jsonBody = JsonUtil.toJson(request.getBody());
        requestBuilder
            .method(request.getMethod().name(), HttpRequest.BodyPublishers.ofString(jsonBody))
            .setHeader("Content-Type", "application/json");
      } catch (JsonProcessingException e) {
        throw new IllegalArgumentException(
            "Failed to serialize request body: " + e.getMessage(), e);
      }
    } else {
      requestBuilder.method(request.getMethod().name(), HttpRequest.BodyPublishers.noBody());
    }

    return requestBuilder.build();
  }

  /**
   * Builds a RestResponseData object from the HTTP response.
   *
   * @param response the HTTP response
   * @param durationMs the duration of the request in milliseconds
   * @return the constructed RestResponseData
   */
  private RestResponseData buildResponseData(HttpResponse<String> response, long durationMs) {
    var result = new RestResponseData();
    result.setStatusCode(response.statusCode());
    result.setHeaders(
        response.headers().map().entrySet().stream()
            .collect(
                Collectors.toMap(Map.Entry::getKey, e -> String.join(",", e.getValue()))));
    result.setBody(response.body());
    result.setResponseTimeMs(durationMs);
    return result;
  }

  private String buildQueryString(Map<String, String> query) {
    return query.entrySet().stream()
        .filter(e -> e.getKey() != null && e.getValue() != null)
        .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
        .collect(Collectors.joining("&"));
  }

  private String encode(String value) {
    return value != null ? URLEncoder.encode(value, StandardCharsets.UTF_8) : "";
  }

  private String validateAndNormalizeBaseUrl(String baseUrl) {
    Objects.requireNonNull(baseUrl, "Base URL cannot be null");
    var trimmed = baseUrl.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("Base URL cannot be empty");
    }
    return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
  }

  private static Duration requirePositive(Duration value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(name + " must be positive");
    }
    return value;
  }
}
