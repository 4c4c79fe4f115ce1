/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package phasetrace.jersey.server;

import brave.Tracing;
import brave.handler.MutableSpan;
import brave.http.HttpTracing;
import brave.propagation.StrictCurrentTraceContext;
import brave.propagation.TraceContext;
import brave.test.TestSpanHandler;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import java.net.URI;
import java.util.concurrent.atomic.AtomicReference;
import org.glassfish.jersey.internal.MapPropertiesDelegate;
import org.glassfish.jersey.server.ApplicationHandler;
import org.glassfish.jersey.server.ContainerRequest;
import org.glassfish.jersey.server.ContainerResponse;
import org.glassfish.jersey.server.ResourceConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import phasetrace.OperationResultReady;
import phasetrace.PhaseSpanTracker;
import phasetrace.PipelineTracing;
import phasetrace.ScopedOperationTracer;
import phasetrace.TraceIntentRegistry;

import static org.assertj.core.api.Assertions.assertThat;
import static phasetrace.PhaseSpanTracker.PHASE_NAME;

/** Runs requests through Jersey in memory, so that events arrive in their real order. */
class ApplicationHandlerTest {
  static final URI BASE_URI = URI.create("http://localhost:8080/");

  StrictCurrentTraceContext currentTraceContext = StrictCurrentTraceContext.create();
  TestSpanHandler spans = new TestSpanHandler();
  Tracing tracing = Tracing.newBuilder()
    .currentTraceContext(currentTraceContext)
    .addSpanHandler(spans)
    .build();
  PipelineTracing pipelineTracing = PipelineTracing.newBuilder(tracing)
    .intentRegistry(TraceIntentRegistry.newBuilder().scan(TestResource.class).build())
    .build();
  AtomicReference<TraceContext> contextInRequestFilter = new AtomicReference<>();
  AtomicReference<TraceContext> contextInResponseFilter = new AtomicReference<>();

  ApplicationHandler handler;

  @BeforeEach void setup() {
    handler = new ApplicationHandler(new ResourceConfig()
      .register(new TestResource(tracing.tracer()))
      .register(new ContainerRequestFilter() {
        @Override public void filter(ContainerRequestContext requestContext) {
          contextInRequestFilter.set(currentTraceContext.get());
        }
      })
      .register(new ContainerResponseFilter() {
        @Override public void filter(ContainerRequestContext requestContext,
          ContainerResponseContext responseContext) {
          contextInResponseFilter.set(currentTraceContext.get());
        }
      })
      .register(new ExceptionMapper<IllegalStateException>() {
        @Override public Response toResponse(IllegalStateException exception) {
          return Response.status(409).entity(exception.getMessage()).build();
        }
      })
      .register(PipelineTracingApplicationEventListener.create(HttpTracing.create(tracing),
        pipelineTracing)));
  }

  @AfterEach void close() {
    tracing.close();
    currentTraceContext.close();
  }

  @Test void tracedResourceMethod() throws Exception {
    ContainerResponse response = get("books");

    assertThat(response.getStatus()).isEqualTo(200);
    assertThat(spans).extracting(MutableSpan::name).containsExactly(
      PhaseSpanTracker.OPERATION_NAME,
      "select books",
      "books.list",
      PhaseSpanTracker.OPERATION_NAME,
      PhaseSpanTracker.OPERATION_NAME,
      "GET /books"
    );
    MutableSpan server = spans.get(5);
    assertThat(spans.get(0).tags())
      .containsEntry(PHASE_NAME, "request")
      .containsEntry(CheckpointParser.ROUTE, "/books")
      .containsEntry(CheckpointParser.RESOURCE_METHOD, "list");
    // filters ran inside the phase they belong to
    assertThat(contextInRequestFilter.get().spanIdString()).isEqualTo(spans.get(0).id());
    assertThat(contextInResponseFilter.get().spanIdString()).isEqualTo(spans.get(4).id());
    // the query ran inside the operation
    assertThat(spans.get(1).parentId()).isEqualTo(spans.get(2).id());
    assertThat(spans.get(2).parentId()).isEqualTo(server.id());
    assertThat(spans.get(2).tags())
      .containsEntry(ScopedOperationTracer.END_TRIGGER, ScopedOperationTracer.TRIGGER_RESULT)
      .containsEntry(OperationResultReady.RESULT_TYPE, "String");
    assertThat(spans.get(3).tags())
      .containsEntry(PHASE_NAME, "view")
      .containsEntry(OperationResultReady.RESULT_TYPE, "String");
    assertThat(spans.get(4).tag(PHASE_NAME)).isEqualTo("response");
    assertThat(server.tags()).containsEntry("pipeline.phase_count", "3");
    assertThat(currentTraceContext.get()).isNull();
  }

  @Test void tracedResourceMethodThrows() throws Exception {
    ContainerResponse response = get("books/reserve");

    assertThat(response.getStatus()).isEqualTo(409);
    assertThat(spans).extracting(s -> s.tag(PHASE_NAME))
      .contains("request", "exception", "response")
      .doesNotContain("view");
    MutableSpan operation = spans.spans().stream()
      .filter(span -> "books.reserve".equals(span.name()))
      .findFirst().get();
    assertThat(operation.tags())
      .containsEntry(ScopedOperationTracer.END_TRIGGER, ScopedOperationTracer.TRIGGER_ERROR)
      .containsEntry(ScopedOperationTracer.EXECUTION_STATUS, ScopedOperationTracer.STATUS_ERROR)
      .doesNotContainKey(OperationResultReady.RESULT_TYPE);
    assertThat(operation.error())
      .isInstanceOf(IllegalStateException.class)
      .hasMessage("out of stock");
    assertThat(currentTraceContext.get()).isNull();
  }

  @Test void untracedResourceMethod() throws Exception {
    get("books/count");

    assertThat(spans).extracting(s -> s.tag(PHASE_NAME))
      .containsExactly("request", "view", "response", null);
    assertThat(spans.get(3).name()).isEqualTo("GET /books/count");
  }

  ContainerResponse get(String path) throws Exception {
    ContainerRequest request = new ContainerRequest(BASE_URI, BASE_URI.resolve(path), "GET", null,
      new MapPropertiesDelegate(), handler.getConfiguration());
    return handler.apply(request).get();
  }
}
