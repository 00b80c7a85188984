package com.switchyard.sdk.server;

import com.google.common.annotations.VisibleForTesting;
import com.launchdarkly.logging.LDLogger;
import com.switchyard.sdk.internal.http.HttpConsts;
import com.switchyard.sdk.internal.http.HttpHelpers;
import com.switchyard.sdk.internal.http.HttpProperties;
import com.switchyard.sdk.server.subsystems.EventSender;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.zip.GZIPOutputStream;

import static com.switchyard.sdk.internal.http.HttpErrors.checkIfErrorIsRetryableAndLog;
import static com.switchyard.sdk.internal.http.HttpErrors.httpErrorDescription;

import okhttp3.Headers;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Posts gzip-compressed event batches to the {@code log_event} endpoint, retrying retryable
 * failures with exponential backoff.
 */
final class DefaultEventSender implements EventSender {
  static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(1);
  static final int BACKOFF_MULTIPLIER = 10;
  private static final MediaType JSON_CONTENT_TYPE = MediaType.parse("application/json; charset=utf-8");

  private final OkHttpClient httpClient;
  private final Headers baseHeaders;
  private final int maxRetries;
  @VisibleForTesting final Duration retryDelay;
  private final LDLogger logger;

  DefaultEventSender(
      HttpProperties httpProperties,
      int maxRetries,
      Duration retryDelay,
      LDLogger logger
      ) {
    this.httpClient = httpProperties.toHttpClientBuilder().build();
    this.baseHeaders = httpProperties.toHeadersBuilder()
        .set("Content-Type", "application/json")
        .set("Content-Encoding", "gzip")
        .build();
    this.maxRetries = Math.max(0, maxRetries);
    this.retryDelay = retryDelay == null ? DEFAULT_RETRY_DELAY : retryDelay;
    this.logger = logger;
  }
  
  @Override
  public void close() throws IOException {
    HttpProperties.shutdownHttpClient(httpClient);
  }

  @Override
  public Result sendEventData(String data, int eventCount, URI eventsBaseUri) {
    if (data == null || data.isEmpty()) {
      // DefaultEventProcessor won't normally pass us an empty payload, but if it does, don't bother sending
      return Result.SUCCESS;
    }
    
    URI uri = HttpHelpers.concatenateUriPath(eventsBaseUri, StandardEndpoints.LOG_EVENT_PATH);
    String description = String.format("%d event(s)", eventCount);
    RequestBody body;
    try {
      body = RequestBody.create(gzip(data), JSON_CONTENT_TYPE);
    } catch (IOException e) {
      logger.error("Unable to compress event payload: {}", e.toString());
      return Result.FAILURE;
    }
    Headers headers = baseHeaders.newBuilder()
        .set(HttpConsts.HEADER_EVENT_COUNT, String.valueOf(eventCount))
        .set(HttpConsts.HEADER_CLIENT_TIME, String.valueOf(System.currentTimeMillis()))
        .build();
    
    logger.debug("Posting {} to {} with payload: {}", description, uri, data);

    long delayMillis = retryDelay.toMillis();
    for (int attempt = 0; attempt <= maxRetries; attempt++) {
      if (attempt > 0) {
        logger.warn("Will retry posting {} after {} ms", description, delayMillis);
        try {
          Thread.sleep(delayMillis);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return Result.FAILURE;
        }
        delayMillis *= BACKOFF_MULTIPLIER;
      }

      Request request = new Request.Builder()
          .url(uri.toASCIIString())
          .post(body)
          .headers(headers)
          .build();

      long startTime = System.currentTimeMillis();
      String nextActionMessage = attempt < maxRetries ? "will retry" : "some events were dropped";
      String errorContext = "posting " + description;
      
      try (Response response = httpClient.newCall(request).execute()) {
        logger.debug("{} delivery took {} ms, response status {}", description,
            System.currentTimeMillis() - startTime, response.code());
        if (response.isSuccessful()) {
          return Result.SUCCESS;
        }
        boolean retryable = checkIfErrorIsRetryableAndLog(
            logger,
            httpErrorDescription(response.code()),
            errorContext,
            response.code(),
            nextActionMessage
            );
        if (!retryable) {
          return response.code() == 401 || response.code() == 403 ? Result.STOP : Result.FAILURE;
        }
      } catch (IOException e) {
        checkIfErrorIsRetryableAndLog(logger, e.toString(), errorContext, 0, nextActionMessage);
      }
    }
    return Result.FAILURE;
  }
  
  private static byte[] gzip(String data) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (GZIPOutputStream gz = new GZIPOutputStream(out)) {
      gz.write(data.getBytes(StandardCharsets.UTF_8));
    }
    return out.toByteArray();
  }
}
