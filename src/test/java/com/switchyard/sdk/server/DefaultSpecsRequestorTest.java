package com.switchyard.sdk.server;

import com.launchdarkly.logging.LDLogLevel;
import com.launchdarkly.logging.LogCapture;
import com.launchdarkly.testhelpers.httptest.Handler;
import com.launchdarkly.testhelpers.httptest.Handlers;
import com.launchdarkly.testhelpers.httptest.HttpServer;
import com.launchdarkly.testhelpers.httptest.RequestInfo;
import com.switchyard.sdk.internal.http.HttpConsts;
import com.switchyard.sdk.internal.http.HttpErrors.HttpErrorException;
import com.switchyard.sdk.internal.http.HttpProperties;
import com.switchyard.sdk.server.SpecsRequestor.IdListChunk;

import org.junit.Test;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static com.switchyard.sdk.server.ModelBuilders.alwaysOnGate;
import static com.switchyard.sdk.server.ModelBuilders.specsBuilder;
import static com.switchyard.sdk.server.TestComponents.SERVER_SECRET;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

@SuppressWarnings("javadoc")
public class DefaultSpecsRequestorTest extends BaseTest {
  private static final String specsJson = specsBuilder(100).gates(alwaysOnGate("g")).json();
  private static final Duration briefDelay = Duration.ofMillis(10);

  private DefaultSpecsRequestor makeRequestor(URI apiUri, URI cdnUri, int maxRetries) {
    HttpProperties props = ComponentsImpl.toHttpProperties(
        TestComponents.clientContext(SERVER_SECRET, SwitchyardConfig.DEFAULT).getHttp());
    return new DefaultSpecsRequestor(props, SERVER_SECRET, apiUri, cdnUri, maxRetries, briefDelay, testLogger);
  }

  private static void verifyHeaders(RequestInfo req) {
    assertEquals(SERVER_SECRET, req.getHeader(HttpConsts.HEADER_API_KEY));
    assertEquals(Version.SDK_TYPE, req.getHeader(HttpConsts.HEADER_SDK_TYPE));
    assertEquals(Version.SDK_VERSION, req.getHeader(HttpConsts.HEADER_SDK_VERSION));
    assertEquals("SwitchyardJavaServer/" + Version.SDK_VERSION, req.getHeader("User-Agent"));
    assertEquals("test-session", req.getHeader(HttpConsts.HEADER_SESSION_ID));
  }

  @Test
  public void specsAreFetchedFromOriginWhenCdnIsDisabled() throws Exception {
    try (HttpServer server = HttpServer.start(Handlers.bodyJson(specsJson))) {
      try (DefaultSpecsRequestor r = makeRequestor(server.getUri(), null, 0)) {
        assertEquals(specsJson, r.getConfigSpecs(42));

        RequestInfo req = server.getRecorder().requireRequest();
        assertEquals("GET", req.getMethod());
        assertEquals("/download_config_specs", req.getPath());
        assertThat(req.getQuery(), containsString("sinceTime=42"));
        verifyHeaders(req);
      }
    }
  }

  @Test
  public void specsAreFetchedFromCdnWithSecretInPath() throws Exception {
    try (HttpServer cdn = HttpServer.start(Handlers.bodyJson(specsJson))) {
      try (HttpServer api = HttpServer.start(Handlers.status(500))) {
        try (DefaultSpecsRequestor r = makeRequestor(api.getUri(), cdn.getUri(), 0)) {
          assertEquals(specsJson, r.getConfigSpecs(0));

          RequestInfo req = cdn.getRecorder().requireRequest();
          assertEquals("/download_config_specs/" + SERVER_SECRET + ".json", req.getPath());
          assertThat(req.getQuery(), containsString("sinceTime=0"));
          api.getRecorder().requireNoRequests(java.time.Duration.ofMillis(100));
        }
      }
    }
  }

  @Test
  public void secretIsMaskedInLoggedCdnUrl() throws Exception {
    try (HttpServer cdn = HttpServer.start(Handlers.bodyJson(specsJson))) {
      try (DefaultSpecsRequestor r = makeRequestor(cdn.getUri(), cdn.getUri(), 0)) {
        r.getConfigSpecs(0);
      }
    }
    boolean sawRequestLog = false;
    for (LogCapture.Message m: logCapture.getMessages()) {
      assertThat(m.getText(), not(containsString(SERVER_SECRET)));
      if (m.getText().startsWith("Making request: GET") && m.getText().contains("secret-...")) {
        sawRequestLog = true;
      }
    }
    assertTrue(sawRequestLog);
  }

  @Test
  public void retryableCdnFailureFallsBackToOrigin() throws Exception {
    try (HttpServer cdn = HttpServer.start(Handlers.status(503))) {
      try (HttpServer api = HttpServer.start(Handlers.bodyJson(specsJson))) {
        try (DefaultSpecsRequestor r = makeRequestor(api.getUri(), cdn.getUri(), 0)) {
          assertEquals(specsJson, r.getConfigSpecs(0));

          cdn.getRecorder().requireRequest();
          RequestInfo req = api.getRecorder().requireRequest();
          assertEquals("/download_config_specs", req.getPath());
          assertTrue(hasLogMessage(LDLogLevel.WARN, "falling back to the origin API"));
        }
      }
    }
  }

  @Test
  public void nonRetryableCdnFailureIsNotRetriedAtOrigin() throws Exception {
    try (HttpServer cdn = HttpServer.start(Handlers.status(400))) {
      try (HttpServer api = HttpServer.start(Handlers.bodyJson(specsJson))) {
        try (DefaultSpecsRequestor r = makeRequestor(api.getUri(), cdn.getUri(), 3)) {
          try {
            r.getConfigSpecs(0);
            fail("expected exception");
          } catch (HttpErrorException e) {
            assertEquals(400, e.getStatus());
          }
          api.getRecorder().requireNoRequests(java.time.Duration.ofMillis(100));
        }
      }
    }
  }

  @Test
  public void originRequestIsRetriedAfterRecoverableError() throws Exception {
    Handler failThenSucceed = Handlers.sequential(Handlers.status(503), Handlers.bodyJson(specsJson));
    try (HttpServer server = HttpServer.start(failThenSucceed)) {
      try (DefaultSpecsRequestor r = makeRequestor(server.getUri(), null, 2)) {
        assertEquals(specsJson, r.getConfigSpecs(0));
        assertEquals(2, server.getRecorder().count());
      }
    }
  }

  @Test
  public void originRequestGivesUpAfterRetryBudget() throws Exception {
    try (HttpServer server = HttpServer.start(Handlers.status(503))) {
      try (DefaultSpecsRequestor r = makeRequestor(server.getUri(), null, 2)) {
        try {
          r.getConfigSpecs(0);
          fail("expected exception");
        } catch (HttpErrorException e) {
          assertEquals(503, e.getStatus());
        }
        assertEquals(3, server.getRecorder().count());
      }
    }
  }

  @Test
  public void unrecoverableOriginErrorIsNotRetried() throws Exception {
    try (HttpServer server = HttpServer.start(Handlers.status(401))) {
      try (DefaultSpecsRequestor r = makeRequestor(server.getUri(), null, 2)) {
        try {
          r.getConfigSpecs(0);
          fail("expected exception");
        } catch (HttpErrorException e) {
          assertEquals(401, e.getStatus());
        }
        assertEquals(1, server.getRecorder().count());
        assertTrue(hasLogMessage(LDLogLevel.ERROR, "invalid server secret"));
      }
    }
  }

  @Test
  public void idListManifestIsPosted() throws Exception {
    String manifest = "{\"list\":{\"name\":\"list\",\"size\":3,\"creationTime\":1,\"url\":\"u\",\"fileID\":\"f\"}}";
    try (HttpServer server = HttpServer.start(Handlers.bodyJson(manifest))) {
      try (DefaultSpecsRequestor r = makeRequestor(server.getUri(), null, 0)) {
        assertEquals(manifest, r.getIdListManifest());

        RequestInfo req = server.getRecorder().requireRequest();
        assertEquals("POST", req.getMethod());
        assertEquals("/get_id_lists", req.getPath());
        assertEquals("{}", req.getBody());
        verifyHeaders(req);
      }
    }
  }

  @Test
  public void idListIsFetchedWithRangeHeader() throws Exception {
    Handler resp = Handlers.all(Handlers.status(206), Handlers.bodyString("text/plain", "+abc\n+def\n"));
    try (HttpServer server = HttpServer.start(resp)) {
      try (DefaultSpecsRequestor r = makeRequestor(server.getUri(), null, 0)) {
        IdListChunk chunk = r.getIdList(server.getUri().resolve("/lists/list-1").toString(), 15);

        RequestInfo req = server.getRecorder().requireRequest();
        assertEquals("/lists/list-1", req.getPath());
        assertEquals("bytes=15-", req.getHeader("Range"));
        assertEquals("+abc\n+def\n", chunk.body);
        assertEquals(10, chunk.byteCount);
        assertFalse(chunk.isTruncated());
      }
    }
  }

  @Test
  public void idListErrorStatusIsThrown() throws Exception {
    try (HttpServer server = HttpServer.start(Handlers.status(404))) {
      try (DefaultSpecsRequestor r = makeRequestor(server.getUri(), null, 0)) {
        try {
          r.getIdList(server.getUri().resolve("/lists/list-1").toString(), 0);
          fail("expected exception");
        } catch (HttpErrorException e) {
          assertEquals(404, e.getStatus());
        }
      }
    }
  }

  @Test
  public void chunkIsTruncatedWhenDeclaredLengthDiffers() {
    assertTrue(new IdListChunk("+a\n", 3, 10).isTruncated());
    assertFalse(new IdListChunk("+a\n", 3, 3).isTruncated());
    assertFalse(new IdListChunk("+a\n", 3, -1).isTruncated());
  }
}
