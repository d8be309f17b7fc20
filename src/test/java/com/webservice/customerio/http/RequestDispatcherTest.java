package com.webservice.customerio.http;

import com.webservice.customerio.error.ErrorClassifier;
import com.webservice.customerio.error.ErrorKind;
import com.webservice.customerio.error.Outcome;
import com.webservice.customerio.error.RequestContext;
import com.webservice.customerio.limiter.RateLimiter;
import com.webservice.customerio.service.ManualScheduledService;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpMethod;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class RequestDispatcherTest {

    private static final String TRACKING_URL = "https://track.customer.io/api/v1";
    private static final String API_URL = "https://api.customer.io/v1/api";

    @Mock
    private HttpExecutor executor;

    private ManualScheduledService scheduler;
    private RateLimiter trackingLimiter;
    private RateLimiter apiLimiter;
    private RequestDispatcher dispatcher;

    @BeforeEach
    void beforeEach() {
        scheduler = new ManualScheduledService();
        trackingLimiter = new RateLimiter("tracking", 2, 1000, scheduler);
        apiLimiter = new RateLimiter("api", 1, 1000, scheduler);
        dispatcher = new RequestDispatcher(executor, new ErrorClassifier(), "site", "key", Map.of(
                EndpointClass.TRACKING, new EndpointRoute(TRACKING_URL, trackingLimiter),
                EndpointClass.API, new EndpointRoute(API_URL, apiLimiter)));
    }

    @Test
    void testSuccess() {
        when(executor.execute(any())).thenReturn(Future.succeededFuture(response(200, "{\"id\":\"7\"}")));

        Future<Outcome> result = dispatcher.dispatch(EndpointClass.API, HttpMethod.GET, "campaigns/1/triggers/7", null);

        assertTrue(result.succeeded());
        assertEquals("7", result.result().payload().get("id").asText());

        HttpCall call = captureCall();
        assertEquals(HttpMethod.GET, call.method());
        assertEquals(API_URL + "/campaigns/1/triggers/7", call.uri());
        assertEquals("site", call.user());
        assertEquals("key", call.password());
    }

    @Test
    void testNotFoundKeepsRequestContext() {
        when(executor.execute(any())).thenReturn(Future.succeededFuture(new HttpResult(404, "Not Found",
                Buffer.buffer("{\"error\":\"not found\"}"))));
        Map<String, Object> body = Map.of("name", "signup");

        Future<Outcome> result = dispatcher.dispatch(EndpointClass.TRACKING, HttpMethod.POST, "customers/1/events", body);

        assertTrue(result.succeeded());
        Outcome outcome = result.result();
        assertFalse(outcome.isSuccess());
        assertEquals(ErrorKind.RESOURCE_NOT_FOUND, outcome.error().getKind());
        assertEquals(new RequestContext(HttpMethod.POST, "customers/1/events", body), outcome.error().getContext());
    }

    @Test
    void testMalformedSuccessResponse() {
        when(executor.execute(any())).thenReturn(Future.succeededFuture(response(200, "not-json")));

        Future<Outcome> result = dispatcher.dispatch(EndpointClass.TRACKING, HttpMethod.PUT, "customers/1", Map.of("a", 1));

        assertEquals(ErrorKind.UNEXPECTED_RESPONSE_FORMAT, result.result().error().getKind());
    }

    @Test
    void testConnectionRefusedIsPassedThrough() {
        ConnectException error = new ConnectException("Connection refused");
        when(executor.execute(any())).thenReturn(Future.failedFuture(error));

        Future<Outcome> result = dispatcher.dispatch(EndpointClass.TRACKING, HttpMethod.POST, "events", Map.of("name", "x"));

        assertTrue(result.failed());
        assertSame(error, result.cause());
    }

    @Test
    void testExecutorThrowingIsReportedAsFailure() {
        IllegalStateException error = new IllegalStateException("Client is closed");
        when(executor.execute(any())).thenThrow(error);

        Future<Outcome> result = dispatcher.dispatch(EndpointClass.TRACKING, HttpMethod.GET, "customers/1", null);

        assertTrue(result.failed());
        assertSame(error, result.cause());
    }

    @Test
    void testPostWithoutBodySendsEmptyBody() {
        when(executor.execute(any())).thenReturn(Future.succeededFuture(response(200, "{}")));

        dispatcher.dispatch(EndpointClass.TRACKING, HttpMethod.POST, "customers/1/suppress", null);

        HttpCall call = captureCall();
        assertTrue(call.hasBody());
        assertEquals(0, call.body().length());
    }

    @Test
    void testPutWithoutBodySendsEmptyBody() {
        when(executor.execute(any())).thenReturn(Future.succeededFuture(response(200, "{}")));

        dispatcher.dispatch(EndpointClass.TRACKING, HttpMethod.PUT, "customers/1", null);

        HttpCall call = captureCall();
        assertTrue(call.hasBody());
        assertEquals(0, call.body().length());
    }

    @Test
    void testGetAndDeleteSendNoBody() {
        when(executor.execute(any())).thenReturn(Future.succeededFuture(response(200, "{}")));

        dispatcher.dispatch(EndpointClass.TRACKING, HttpMethod.GET, "customers/1", null);
        dispatcher.dispatch(EndpointClass.TRACKING, HttpMethod.DELETE, "customers/1", null);

        ArgumentCaptor<HttpCall> captor = ArgumentCaptor.forClass(HttpCall.class);
        verify(executor, times(2)).execute(captor.capture());
        for (HttpCall call : captor.getAllValues()) {
            assertFalse(call.hasBody());
            assertNull(call.body());
        }
    }

    @Test
    void testBodyIsEncodedAsJson() {
        when(executor.execute(any())).thenReturn(Future.succeededFuture(response(200, "{}")));

        dispatcher.dispatch(EndpointClass.TRACKING, HttpMethod.POST, "segments/3/add_customers", Map.of("ids", List.of("1", "2")));

        HttpCall call = captureCall();
        assertEquals("{\"ids\":[\"1\",\"2\"]}", call.body().toString(StandardCharsets.UTF_8));
    }

    @Test
    void testRequestsWaitForAdmission() {
        when(executor.execute(any())).thenReturn(Future.succeededFuture(response(200, "{}")));

        Future<Outcome> first = dispatcher.dispatch(EndpointClass.API, HttpMethod.GET, "campaigns/1/triggers/1", null);
        Future<Outcome> second = dispatcher.dispatch(EndpointClass.API, HttpMethod.GET, "campaigns/1/triggers/2", null);

        assertTrue(first.succeeded());
        assertFalse(second.isComplete());
        verify(executor, times(1)).execute(any());

        scheduler.advance(1000);

        assertTrue(second.succeeded());
        verify(executor, times(2)).execute(any());
    }

    @Test
    void testEndpointClassesAreLimitedIndependently() {
        when(executor.execute(any())).thenReturn(Future.succeededFuture(response(200, "{}")));

        Future<Outcome> api = dispatcher.dispatch(EndpointClass.API, HttpMethod.GET, "campaigns/1/triggers/1", null);
        Future<Outcome> blocked = dispatcher.dispatch(EndpointClass.API, HttpMethod.GET, "campaigns/1/triggers/2", null);
        Future<Outcome> tracking = dispatcher.dispatch(EndpointClass.TRACKING, HttpMethod.GET, "customers/1", null);

        assertTrue(api.succeeded());
        assertFalse(blocked.isComplete());
        assertTrue(tracking.succeeded());
        assertEquals(0, apiLimiter.available());
        assertEquals(1, trackingLimiter.available());
    }

    @Test
    void testSlotIsConsumedWhileResponseIsPending() {
        Promise<HttpResult> pending = Promise.promise();
        when(executor.execute(any())).thenReturn(pending.future());

        Future<Outcome> result = dispatcher.dispatch(EndpointClass.API, HttpMethod.GET, "campaigns/1/triggers/1", null);

        assertFalse(result.isComplete());
        assertEquals(0, apiLimiter.available());

        pending.complete(response(503, "{}"));

        assertEquals(ErrorKind.INTERNAL_SERVER_ERR, result.result().error().getKind());
        assertEquals(0, apiLimiter.available());
        scheduler.advance(1000);
        assertEquals(1, apiLimiter.available());
    }

    @Test
    void testCancelWaitingRequest() {
        when(executor.execute(any())).thenReturn(Future.succeededFuture(response(200, "{}")));

        Future<Outcome> first = dispatcher.dispatch(EndpointClass.API, HttpMethod.GET, "campaigns/1/triggers/1", null);
        PendingRequest second = dispatcher.submit(new ApiRequest(EndpointClass.API, HttpMethod.GET, "campaigns/1/triggers/2", null));
        Future<Outcome> third = dispatcher.dispatch(EndpointClass.API, HttpMethod.GET, "campaigns/1/triggers/3", null);

        second.cancel();

        assertTrue(first.succeeded());
        assertTrue(second.result().failed());
        assertInstanceOf(CancellationException.class, second.result().cause());
        assertEquals(1, apiLimiter.waiting());

        scheduler.advance(1000);

        assertTrue(third.succeeded());
        ArgumentCaptor<HttpCall> captor = ArgumentCaptor.forClass(HttpCall.class);
        verify(executor, times(2)).execute(captor.capture());
        assertEquals(List.of(API_URL + "/campaigns/1/triggers/1", API_URL + "/campaigns/1/triggers/3"),
                captor.getAllValues().stream().map(HttpCall::uri).toList());
    }

    @Test
    void testCancelAdmittedRequestHasNoEffect() {
        when(executor.execute(any())).thenReturn(Future.succeededFuture(response(200, "{}")));

        PendingRequest request = dispatcher.submit(new ApiRequest(EndpointClass.TRACKING, HttpMethod.GET, "customers/1", null));
        request.cancel();

        assertTrue(request.admission().succeeded());
        assertTrue(request.result().succeeded());
        assertEquals(1, trackingLimiter.available());
    }

    @Test
    void testUnencodableBodyFailsBeforeAdmission() {
        Future<Outcome> result = dispatcher.dispatch(EndpointClass.API, HttpMethod.POST, "campaigns/1/triggers", new Object());

        assertTrue(result.failed());
        assertNotNull(result.cause());
        assertEquals(1, apiLimiter.available());
        verify(executor, never()).execute(any());
    }

    @Test
    void testUnsupportedMethod() {
        assertThrows(IllegalArgumentException.class,
                () -> dispatcher.dispatch(EndpointClass.API, HttpMethod.PATCH, "campaigns/1", null));
    }

    @Test
    void testMissingRoute() {
        assertThrows(IllegalArgumentException.class, () -> new RequestDispatcher(executor, new ErrorClassifier(), "site", "key",
                Map.of(EndpointClass.API, new EndpointRoute(API_URL, apiLimiter))));
    }

    private HttpCall captureCall() {
        ArgumentCaptor<HttpCall> captor = ArgumentCaptor.forClass(HttpCall.class);
        verify(executor).execute(captor.capture());
        return captor.getValue();
    }

    private static HttpResult response(int code, String body) {
        return new HttpResult(code, "status", Buffer.buffer(body));
    }
}
