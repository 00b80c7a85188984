package com.switchyard.sdk.server;

import com.launchdarkly.testhelpers.httptest.Handler;
import com.launchdarkly.testhelpers.httptest.Handlers;
import com.launchdarkly.testhelpers.httptest.HttpServer;
import com.launchdarkly.testhelpers.httptest.RequestInfo;
import com.launchdarkly.testhelpers.httptest.SimpleRouter;
import com.switchyard.sdk.User;
import com.switchyard.sdk.internal.http.HttpConsts;
import com.switchyard.sdk.server.interfaces.EvaluationDetails.Source;

import org.junit.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static com.switchyard.sdk.server.ModelBuilders.alwaysOnGate;
import static com.switchyard.sdk.server.ModelBuilders.specsBuilder;
import static com.switchyard.sdk.server.TestComponents.SERVER_SECRET;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

@SuppressWarnings("javadoc")
public class SwitchyardClientEndToEndTest extends BaseTest {
  private static final String gateName = "gate1";
  private static final User user = User.of("user-key");

  private static String specsJson() {
    return specsBuilder(1000).gates(alwaysOnGate(gateName)).json();
  }

  private static Handler apiHandler(Handler specsHandler) {
    return new SimpleRouter()
        .add("GET", StandardEndpoints.DOWNLOAD_CONFIG_SPECS_PATH, specsHandler)
        .add("POST", StandardEndpoints.GET_ID_LISTS_PATH, Handlers.bodyJson("{}"));
  }

  @Test
  public void clientStartsFromApi() throws Exception {
    try (HttpServer server = HttpServer.start(apiHandler(Handlers.bodyJson(specsJson())))) {
      SwitchyardConfig config = baseConfig()
          .dataSource(Components.pollingDataSource().apiBaseUri(server.getUri()).disableCDN(true))
          .build();

      try (SwitchyardClient client = new SwitchyardClient(SERVER_SECRET, config)) {
        assertTrue(client.isInitialized());
        assertEquals(Source.NETWORK, client.getInitializationDetails().getSource());
        assertTrue(client.checkGate(user, gateName));
      }
    }
  }

  @Test
  public void clientStartsFromCdn() throws Exception {
    try (HttpServer cdn = HttpServer.start(Handlers.bodyJson(specsJson()))) {
      try (HttpServer api = HttpServer.start(apiHandler(Handlers.status(500)))) {
        SwitchyardConfig config = baseConfig()
            .dataSource(Components.pollingDataSource().apiBaseUri(api.getUri()).cdnBaseUri(cdn.getUri()))
            .build();

        try (SwitchyardClient client = new SwitchyardClient(SERVER_SECRET, config)) {
          assertTrue(client.isInitialized());
          assertTrue(client.checkGate(user, gateName));

          RequestInfo req = cdn.getRecorder().requireRequest();
          assertEquals(StandardEndpoints.DOWNLOAD_CONFIG_SPECS_PATH + "/" + SERVER_SECRET + ".json", req.getPath());
        }
      }
    }
  }

  @Test
  public void clientStartsAfterRecoverableError() throws Exception {
    Handler errorThenSuccess = Handlers.sequential(Handlers.status(503), Handlers.bodyJson(specsJson()));
    try (HttpServer server = HttpServer.start(apiHandler(errorThenSuccess))) {
      SwitchyardConfig config = baseConfig()
          .dataSource(Components.pollingDataSource().apiBaseUri(server.getUri()).disableCDN(true))
          .build();

      try (SwitchyardClient client = new SwitchyardClient(SERVER_SECRET, config)) {
        assertTrue(client.isInitialized());
        assertTrue(client.checkGate(user, gateName));
      }
    }
  }

  @Test
  public void clientFailsWith401Error() throws Exception {
    try (HttpServer server = HttpServer.start(apiHandler(Handlers.status(401)))) {
      SwitchyardConfig config = baseConfig()
          .dataSource(Components.pollingDataSource().apiBaseUri(server.getUri()).disableCDN(true)
              .configSyncInterval(Duration.ofMillis(50)))
          .build();

      try (SwitchyardClient client = new SwitchyardClient(SERVER_SECRET, config)) {
        assertFalse(client.isInitialized());
        assertFalse(client.checkGate(user, gateName));
        assertFalse(client.getInitializationDetails().isReady());
      }
    }
  }

  @Test
  public void exposuresAreDeliveredToEventsEndpoint() throws Exception {
    try (HttpServer specs = HttpServer.start(apiHandler(Handlers.bodyJson(specsJson())))) {
      try (HttpServer events = HttpServer.start(Handlers.status(202))) {
        SwitchyardConfig config = baseConfig()
            .dataSource(Components.pollingDataSource().apiBaseUri(specs.getUri()).disableCDN(true))
            .events(Components.sendEvents().apiBaseUri(events.getUri()))
            .disableDiagnostics(true)
            .build();

        try (SwitchyardClient client = new SwitchyardClient(SERVER_SECRET, config)) {
          assertTrue(client.checkGate(user, gateName));
          client.flush();

          RequestInfo req = events.getRecorder().requireRequest();
          assertEquals("POST", req.getMethod());
          assertEquals(StandardEndpoints.LOG_EVENT_PATH, req.getPath());
          assertEquals(SERVER_SECRET, req.getHeader(HttpConsts.HEADER_API_KEY));
          assertEquals("1", req.getHeader(HttpConsts.HEADER_EVENT_COUNT));
          assertEquals("gzip", req.getHeader("Content-Encoding"));
        }
      }
    }
  }

  @Test
  public void localModeMakesNoRequests() throws Exception {
    try (HttpServer server = HttpServer.start(apiHandler(Handlers.bodyJson(specsJson())))) {
      SwitchyardConfig config = new SwitchyardConfig.Builder()
          .dataSource(Components.pollingDataSource().apiBaseUri(server.getUri()).disableCDN(true))
          .localMode(true)
          .logging(Components.logging(testLogging))
          .build();

      try (SwitchyardClient client = new SwitchyardClient(SERVER_SECRET, config)) {
        assertFalse(client.isInitialized());
        client.overrideGate(gateName, true);
        assertTrue(client.checkGate(user, gateName));
        server.getRecorder().requireNoRequests(java.time.Duration.ofMillis(100));
      }
    }
  }
}
