package com.switchyard.sdk.server;

import com.google.common.annotations.VisibleForTesting;
import com.launchdarkly.logging.LDLogger;
import com.switchyard.sdk.internal.http.HttpConsts;
import com.switchyard.sdk.internal.http.HttpErrors;
import com.switchyard.sdk.internal.http.HttpErrors.HttpErrorException;
import com.switchyard.sdk.internal.http.HttpHelpers;
import com.switchyard.sdk.internal.http.HttpProperties;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static com.switchyard.sdk.internal.http.HttpErrors.checkIfErrorIsRetryableAndLog;
import static com.switchyard.sdk.internal.http.HttpErrors.httpErrorDescription;

import okhttp3.Headers;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Implementation of the sync requests over HTTP.
 * <p>
 * Spec downloads go to the CDN first unless it is disabled. A retryable CDN failure falls back to the
 * origin API once per call; the origin request, like the id list manifest request, is retried with
 * exponential backoff up to the configured retry budget.
 */
final class DefaultSpecsRequestor implements SpecsRequestor {
  static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(1);
  static final int BACKOFF_MULTIPLIER = 2;
  private static final MediaType JSON_CONTENT_TYPE = MediaType.parse("application/json; charset=utf-8");
  
  private final OkHttpClient httpClient;
  private final Headers headers;
  private final String serverSecret;
  @VisibleForTesting final URI apiBaseUri;
  @VisibleForTesting final URI cdnBaseUri;
  private final int maxRetries;
  private final Duration retryDelay;
  private final LDLogger logger;

  /**
   * Creates an instance.
   * 
   * @param httpProperties the HTTP configuration
   * @param serverSecret the server secret, used in the CDN path
   * @param apiBaseUri the origin API
   * @param cdnBaseUri the CDN, or null to always use the origin
   * @param maxRetries retries after the first attempt
   * @param retryDelay the delay before the first retry
   * @param logger the logger
   */
  DefaultSpecsRequestor(HttpProperties httpProperties, String serverSecret, URI apiBaseUri, URI cdnBaseUri,
      int maxRetries, Duration retryDelay, LDLogger logger) {
    this.httpClient = httpProperties.toHttpClientBuilder().build();
    this.headers = httpProperties.toHeadersBuilder().build();
    this.serverSecret = serverSecret;
    this.apiBaseUri = apiBaseUri;
    this.cdnBaseUri = cdnBaseUri;
    this.maxRetries = Math.max(0, maxRetries);
    this.retryDelay = retryDelay == null ? DEFAULT_RETRY_DELAY : retryDelay;
    this.logger = logger;
  }

  @Override
  public void close() {
    HttpProperties.shutdownHttpClient(httpClient);
  }

  @Override
  public String getConfigSpecs(long sinceTime) throws IOException, HttpErrorException {
    if (cdnBaseUri != null) {
      Request cdnRequest = newRequest(StandardEndpoints.cdnSpecsUri(cdnBaseUri, serverSecret, sinceTime)).get().build();
      try {
        return execute(cdnRequest);
      } catch (HttpErrorException e) {
        if (!HttpErrors.isHttpErrorRetryable(e.getStatus())) {
          throw e;
        }
        logger.warn("CDN spec download failed with {}; falling back to the origin API",
            httpErrorDescription(e.getStatus()));
      } catch (IOException e) {
        logger.warn("CDN spec download failed ({}); falling back to the origin API", e.toString());
      }
    }
    Request request = newRequest(StandardEndpoints.originSpecsUri(apiBaseUri, sinceTime)).get().build();
    return executeWithRetry(request, "downloading specs");
  }

  @Override
  public String getIdListManifest() throws IOException, HttpErrorException {
    Request request = newRequest(HttpHelpers.concatenateUriPath(apiBaseUri, StandardEndpoints.GET_ID_LISTS_PATH))
        .post(RequestBody.create("{}", JSON_CONTENT_TYPE))
        .build();
    return executeWithRetry(request, "downloading id list manifest");
  }

  @Override
  public IdListChunk getIdList(String url, long offset) throws IOException, HttpErrorException {
    Request request = new Request.Builder()
        .url(url)
        .header("Range", "bytes=" + offset + "-")
        .get()
        .build();
    logger.debug("Making request: GET {} from offset {}", url, offset);
    try (Response response = httpClient.newCall(request).execute()) {
      if (!response.isSuccessful()) {
        throw new HttpErrorException(response.code());
      }
      byte[] bytes = response.body() == null ? new byte[0] : response.body().bytes();
      String declared = response.header("Content-Length");
      long declaredLength = -1;
      if (declared != null) {
        try {
          declaredLength = Long.parseLong(declared.trim());
        } catch (NumberFormatException e) {
          logger.debug("Ignoring malformed Content-Length \"{}\" for id list", declared);
        }
      }
      return new IdListChunk(new String(bytes, StandardCharsets.UTF_8), bytes.length, declaredLength);
    }
  }
  
  private Request.Builder newRequest(URI uri) {
    return new Request.Builder()
        .url(uri.toASCIIString())
        .headers(headers)
        .header(HttpConsts.HEADER_CLIENT_TIME, String.valueOf(System.currentTimeMillis()));
  }
  
  private String executeWithRetry(Request request, String errorContext) throws IOException, HttpErrorException {
    long delayMillis = retryDelay.toMillis();
    for (int attempt = 0; ; attempt++) {
      boolean lastAttempt = attempt >= maxRetries;
      try {
        return execute(request);
      } catch (HttpErrorException e) {
        boolean retryable = checkIfErrorIsRetryableAndLog(logger, httpErrorDescription(e.getStatus()),
            errorContext, e.getStatus(), lastAttempt ? "giving up for this cycle" : "will retry");
        if (!retryable || lastAttempt) {
          throw e;
        }
      } catch (IOException e) {
        checkIfErrorIsRetryableAndLog(logger, e.toString(), errorContext, 0,
            lastAttempt ? "giving up for this cycle" : "will retry");
        if (lastAttempt) {
          throw e;
        }
      }
      try {
        Thread.sleep(delayMillis);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IOException("interrupted while waiting to retry", e);
      }
      delayMillis *= BACKOFF_MULTIPLIER;
    }
  }
  
  // The CDN path carries the secret, which must never reach the log.
  private String masked(String s) {
    return serverSecret == null || serverSecret.isEmpty() ? s : s.replace(serverSecret, "secret-...");
  }
  
  private String execute(Request request) throws IOException, HttpErrorException {
    logger.debug("Making request: {} {}", request.method(), masked(request.url().toString()));
    try (Response response = httpClient.newCall(request).execute()) {
      if (!response.isSuccessful()) {
        throw new HttpErrorException(response.code());
      }
      return response.body() == null ? "" : response.body().string();
    }
  }
}
