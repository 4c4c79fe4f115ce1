/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package phasetrace.jersey.server;

import brave.Tracing;
import brave.handler.MutableSpan;
import brave.http.HttpTracing;
import brave.propagation.StrictCurrentTraceContext;
import brave.sampler.Sampler;
import brave.test.TestSpanHandler;
import jakarta.ws.rs.NotFoundException;
import java.lang.reflect.Method;
import java.net.URI;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicLong;
import org.glassfish.jersey.server.ContainerRequest;
import org.glassfish.jersey.server.ContainerResponse;
import org.glassfish.jersey.server.ExtendedUriInfo;
import org.glassfish.jersey.server.model.Invocable;
import org.glassfish.jersey.server.model.MethodHandler;
import org.glassfish.jersey.server.model.ResourceMethod;
import org.glassfish.jersey.server.monitoring.ApplicationEventListener;
import org.glassfish.jersey.server.monitoring.RequestEvent;
import org.glassfish.jersey.server.monitoring.RequestEventListener;
import org.glassfish.jersey.uri.PathTemplate;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import phasetrace.ErrorRaised;
import phasetrace.OperationResultReady;
import phasetrace.PhaseSpanTracker;
import phasetrace.PipelineTracing;
import phasetrace.PreDispatch;
import phasetrace.RequestStart;
import phasetrace.ResponseReady;
import phasetrace.ScopedOperationTracer;
import phasetrace.TraceIntentRegistry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.glassfish.jersey.server.monitoring.RequestEvent.Type.FINISHED;
import static org.glassfish.jersey.server.monitoring.RequestEvent.Type.ON_EXCEPTION;
import static org.glassfish.jersey.server.monitoring.RequestEvent.Type.REQUEST_FILTERED;
import static org.glassfish.jersey.server.monitoring.RequestEvent.Type.REQUEST_MATCHED;
import static org.glassfish.jersey.server.monitoring.RequestEvent.Type.RESOURCE_METHOD_FINISHED;
import static org.glassfish.jersey.server.monitoring.RequestEvent.Type.RESOURCE_METHOD_START;
import static org.glassfish.jersey.server.monitoring.RequestEvent.Type.RESP_FILTERS_FINISHED;
import static org.glassfish.jersey.server.monitoring.RequestEvent.Type.RESP_FILTERS_START;
import static org.glassfish.jersey.server.monitoring.RequestEvent.Type.START;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static phasetrace.PhaseSpanTracker.PHASE_NAME;

class PipelineTracingApplicationEventListenerTest {
  StrictCurrentTraceContext currentTraceContext = StrictCurrentTraceContext.create();
  TestSpanHandler spans = new TestSpanHandler();
  Tracing tracing = Tracing.newBuilder()
    .currentTraceContext(currentTraceContext)
    .addSpanHandler(spans)
    .build();
  AtomicLong now = new AtomicLong(1_000_000L);
  PipelineTracing pipelineTracing = PipelineTracing.newBuilder(tracing)
    .clock(now::get)
    .intentRegistry(TraceIntentRegistry.newBuilder().scan(TestResource.class).build())
    .build();
  ApplicationEventListener listener =
    PipelineTracingApplicationEventListener.create(HttpTracing.create(tracing), pipelineTracing);

  ContainerRequest request = mock(ContainerRequest.class);
  ExtendedUriInfo uriInfo = mock(ExtendedUriInfo.class);
  ContainerResponse response = mock(ContainerResponse.class);
  Throwable exception;

  @BeforeEach void setup() {
    when(request.getMethod()).thenReturn("GET");
    when(request.getPath(false)).thenReturn("books");
    when(request.getUriInfo()).thenReturn(uriInfo);
    when(request.getHeaderString("User-Agent")).thenReturn("curl/8.0");
    when(uriInfo.getRequestUri()).thenReturn(URI.create("http://localhost:8080/books"));
    when(uriInfo.getBaseUri()).thenReturn(URI.create("/"));
    when(uriInfo.getMatchedTemplates()).thenReturn(Arrays.asList(new PathTemplate("/books")));
    when(response.getStatus()).thenReturn(200);
    when(response.getLength()).thenReturn(4);
    when(response.getEntity()).thenReturn("Dune");
  }

  @AfterEach void close() {
    tracing.close();
    currentTraceContext.close();
  }

  @Test void synchronousRequest() throws Exception {
    matchResourceMethod("list", false);

    RequestEventListener requestListener = listener.onRequest(event(START));
    fire(requestListener, REQUEST_MATCHED, REQUEST_FILTERED, RESOURCE_METHOD_START);
    now.addAndGet(4_000L);
    fire(requestListener, RESOURCE_METHOD_FINISHED);
    long methodFinished = now.get();
    now.addAndGet(1_000L);
    fire(requestListener, RESP_FILTERS_START, RESP_FILTERS_FINISHED, FINISHED);

    assertThat(spans).extracting(MutableSpan::name).containsExactly(
      PhaseSpanTracker.OPERATION_NAME,
      "books.list",
      PhaseSpanTracker.OPERATION_NAME,
      PhaseSpanTracker.OPERATION_NAME,
      "GET /books"
    );
    MutableSpan server = spans.get(4);
    assertThat(spans).allSatisfy(span -> assertThat(span.traceId()).isEqualTo(server.traceId()));
    assertThat(spans.get(0).tags())
      .containsEntry(PHASE_NAME, "request")
      .containsEntry(RequestStart.URL, "http://localhost:8080/books")
      .containsEntry(RequestStart.USER_AGENT, "curl/8.0")
      .containsEntry(CheckpointParser.ROUTE, "/books")
      .containsEntry(CheckpointParser.RESOURCE_CLASS, "TestResource")
      .containsEntry(CheckpointParser.RESOURCE_METHOD, "list");
    assertThat(spans.get(1).parentId()).isEqualTo(server.id());
    assertThat(spans.get(1).tags())
      .containsEntry(ScopedOperationTracer.OPERATION, "TestResource::list")
      .containsEntry(ScopedOperationTracer.END_TRIGGER, ScopedOperationTracer.TRIGGER_RESULT)
      .containsEntry(ScopedOperationTracer.EXECUTION_STATUS, ScopedOperationTracer.STATUS_SUCCESS)
      .containsEntry("team", "catalog");
    assertThat(spans.get(1).finishTimestamp()).isEqualTo(methodFinished);
    assertThat(spans.get(2).tags())
      .containsEntry(PHASE_NAME, "view")
      .containsEntry(OperationResultReady.RESULT_TYPE, "String");
    assertThat(spans.get(2).startTimestamp()).isEqualTo(methodFinished);
    assertThat(spans.get(3).tags())
      .containsEntry(PHASE_NAME, "response")
      .containsEntry(ResponseReady.STATUS_CODE, "200")
      .containsEntry(ResponseReady.CONTENT_TYPE, "unknown");
    assertThat(server.tags())
      .containsEntry(CheckpointParser.RESOURCE_CLASS, "TestResource")
      .containsEntry("pipeline.phase_count", "3")
      .containsEntry("http.response_size", "small");
    assertThat(currentTraceContext.get()).isNull();
  }

  @Test void untracedResourceMethod() throws Exception {
    matchResourceMethod("count", false);

    RequestEventListener requestListener = listener.onRequest(event(START));
    fire(requestListener, REQUEST_MATCHED, REQUEST_FILTERED, RESOURCE_METHOD_START,
      RESOURCE_METHOD_FINISHED, RESP_FILTERS_START, RESP_FILTERS_FINISHED, FINISHED);

    assertThat(spans).extracting(s -> s.tag(PHASE_NAME))
      .containsExactly("request", "view", "response", null);
  }

  @Test void resourceMethodThrows() throws Exception {
    matchResourceMethod("list", false);
    when(response.getStatus()).thenReturn(500);

    RequestEventListener requestListener = listener.onRequest(event(START));
    fire(requestListener, REQUEST_MATCHED, REQUEST_FILTERED, RESOURCE_METHOD_START,
      RESOURCE_METHOD_FINISHED);
    exception = new IllegalStateException("out of stock");
    fire(requestListener, ON_EXCEPTION, RESP_FILTERS_START, RESP_FILTERS_FINISHED, FINISHED);

    // no view phase: the method produced no result
    assertThat(spans).extracting(s -> s.tag(PHASE_NAME))
      .containsExactly("request", null, "exception", "response", null);
    MutableSpan operation = spans.get(1);
    assertThat(operation.name()).isEqualTo("books.list");
    assertThat(operation.tags())
      .containsEntry(ScopedOperationTracer.END_TRIGGER, ScopedOperationTracer.TRIGGER_ERROR)
      .containsEntry(ScopedOperationTracer.EXECUTION_STATUS, ScopedOperationTracer.STATUS_ERROR)
      .doesNotContainKey(OperationResultReady.RESULT_TYPE);
    assertThat(operation.error()).isSameAs(exception);
    assertThat(spans.get(2).tags())
      .containsEntry(ErrorRaised.ERROR_KIND, "java.lang.IllegalStateException")
      .containsEntry(ErrorRaised.ERROR_MESSAGE, "out of stock")
      .containsEntry(PhaseSpanTracker.STATUS, PhaseSpanTracker.STATUS_FORCE_COMPLETED);
    assertThat(spans.get(4).error()).isSameAs(exception);
    assertThat(currentTraceContext.get()).isNull();
  }

  @Test void asynchronousResourceMethod_onlyTracesTransaction() throws Exception {
    matchResourceMethod("list", true);

    RequestEventListener requestListener = listener.onRequest(event(START));
    fire(requestListener, REQUEST_MATCHED, REQUEST_FILTERED, RESOURCE_METHOD_START,
      RESOURCE_METHOD_FINISHED, RESP_FILTERS_START, RESP_FILTERS_FINISHED, FINISHED);

    assertThat(spans).extracting(s -> s.tag(PHASE_NAME), s -> s.tag(PhaseSpanTracker.STATUS))
      .containsExactly(
        tuple("request", PhaseSpanTracker.STATUS_FORCE_COMPLETED),
        tuple(null, null)
      );
    assertThat(currentTraceContext.get()).isNull();
  }

  @Test void unmatchedRequest() {
    exception = new NotFoundException();
    when(response.getStatus()).thenReturn(404);

    RequestEventListener requestListener = listener.onRequest(event(START));
    fire(requestListener, ON_EXCEPTION, RESP_FILTERS_START, RESP_FILTERS_FINISHED, FINISHED);

    assertThat(spans).extracting(s -> s.tag(PHASE_NAME))
      .containsExactly("exception", "request", "response", null);
    assertThat(spans.get(0).tag(ErrorRaised.ERROR_KIND))
      .isEqualTo("jakarta.ws.rs.NotFoundException");
    assertThat(currentTraceContext.get()).isNull();
  }

  @Test void unsampledRequest_noPhases() throws Exception {
    matchResourceMethod("list", false);
    try (Tracing unsampled = Tracing.newBuilder()
      .currentTraceContext(currentTraceContext)
      .addSpanHandler(spans)
      .sampler(Sampler.NEVER_SAMPLE)
      .build()) {
      listener = PipelineTracingApplicationEventListener.create(HttpTracing.create(unsampled),
        PipelineTracing.create(unsampled));

      RequestEventListener requestListener = listener.onRequest(event(START));
      fire(requestListener, REQUEST_MATCHED, REQUEST_FILTERED, RESOURCE_METHOD_START,
        RESOURCE_METHOD_FINISHED, RESP_FILTERS_START, RESP_FILTERS_FINISHED, FINISHED);
    }

    assertThat(spans).isEmpty();
    assertThat(currentTraceContext.get()).isNull();
  }

  @Test void parserErrorsDontBreakTheRequest() throws Exception {
    matchResourceMethod("list", false);
    listener = PipelineTracingApplicationEventListener.create(HttpTracing.create(tracing),
      pipelineTracing, new CheckpointParser() {
        @Override protected PreDispatch preDispatch(RequestEvent event) {
          throw new IllegalStateException("broken");
        }
      });

    RequestEventListener requestListener = listener.onRequest(event(START));
    fire(requestListener, REQUEST_MATCHED, REQUEST_FILTERED, RESOURCE_METHOD_START,
      RESOURCE_METHOD_FINISHED, RESP_FILTERS_START, RESP_FILTERS_FINISHED, FINISHED);

    assertThat(spans).extracting(MutableSpan::name).doesNotContain("books.list").hasSize(4);
    assertThat(currentTraceContext.get()).isNull();
  }

  @Test void onRequest_ignoresOtherEvents() {
    assertThat(listener.onRequest(event(FINISHED))).isNull();
  }

  void matchResourceMethod(String methodName, boolean async) throws Exception {
    Method method = TestResource.class.getMethod(methodName);
    MethodHandler handler = mock(MethodHandler.class);
    doReturn(TestResource.class).when(handler).getHandlerClass();
    Invocable invocable = mock(Invocable.class);
    when(invocable.getHandler()).thenReturn(handler);
    when(invocable.getHandlingMethod()).thenReturn(method);
    doReturn(method.getReturnType()).when(invocable).getRawResponseType();
    ResourceMethod resourceMethod = mock(ResourceMethod.class);
    when(resourceMethod.getInvocable()).thenReturn(invocable);
    when(resourceMethod.isManagedAsyncDeclared()).thenReturn(async);
    when(uriInfo.getMatchedResourceMethod()).thenReturn(resourceMethod);
  }

  void fire(RequestEventListener requestListener, RequestEvent.Type... types) {
    for (RequestEvent.Type type : types) {
      requestListener.onEvent(event(type));
    }
  }

  RequestEvent event(RequestEvent.Type type) {
    RequestEvent event = mock(RequestEvent.class);
    when(event.getType()).thenReturn(type);
    when(event.getContainerRequest()).thenReturn(request);
    when(event.getUriInfo()).thenReturn(uriInfo);
    when(event.getException()).thenReturn(exception);
    if (type == RESP_FILTERS_START || type == RESP_FILTERS_FINISHED || type == FINISHED) {
      when(event.getContainerResponse()).thenReturn(response);
    }
    return event;
  }
}
