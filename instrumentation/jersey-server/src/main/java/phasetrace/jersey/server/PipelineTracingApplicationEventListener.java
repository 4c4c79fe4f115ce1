/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package phasetrace.jersey.server;

import brave.Span;
import brave.http.HttpServerHandler;
import brave.http.HttpServerRequest;
import brave.http.HttpServerResponse;
import brave.http.HttpTracing;
import brave.internal.Nullable;
import brave.propagation.CurrentTraceContext;
import brave.propagation.CurrentTraceContext.Scope;
import jakarta.inject.Inject;
import jakarta.ws.rs.container.Suspended;
import jakarta.ws.rs.ext.Provider;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.glassfish.jersey.server.ContainerRequest;
import org.glassfish.jersey.server.ManagedAsync;
import org.glassfish.jersey.server.model.ResourceMethod;
import org.glassfish.jersey.server.monitoring.ApplicationEvent;
import org.glassfish.jersey.server.monitoring.ApplicationEventListener;
import org.glassfish.jersey.server.monitoring.RequestEvent;
import org.glassfish.jersey.server.monitoring.RequestEventListener;
import phasetrace.Checkpoint;
import phasetrace.ErrorRaised;
import phasetrace.PipelineTracing;
import phasetrace.RequestTracer;

import static brave.internal.Throwables.propagateIfFatal;

/**
 * Starts the request's transaction as an HTTP server span and traces the Jersey request pipeline
 * inside it: request, view and response phases, plus the resource method when it declared a
 * {@link phasetrace.Traced trace intent}.
 *
 * <p>Phases and operations are only traced for synchronous resources. Requests to
 * {@linkplain ManagedAsync} or {@linkplain Suspended} resources get the server span alone.
 */
@Provider
public final class PipelineTracingApplicationEventListener implements ApplicationEventListener {
  static final Logger LOG = Logger.getLogger(PipelineTracingApplicationEventListener.class.getName());

  public static ApplicationEventListener create(HttpTracing httpTracing,
    PipelineTracing pipelineTracing) {
    return new PipelineTracingApplicationEventListener(httpTracing, pipelineTracing,
      new CheckpointParser());
  }

  public static ApplicationEventListener create(HttpTracing httpTracing,
    PipelineTracing pipelineTracing, CheckpointParser parser) {
    return new PipelineTracingApplicationEventListener(httpTracing, pipelineTracing, parser);
  }

  final CurrentTraceContext currentTraceContext;
  final HttpServerHandler<HttpServerRequest, HttpServerResponse> handler;
  final PipelineTracing pipelineTracing;
  final CheckpointParser parser;

  @Inject PipelineTracingApplicationEventListener(HttpTracing httpTracing,
    PipelineTracing pipelineTracing, CheckpointParser parser) {
    if (httpTracing == null) throw new NullPointerException("httpTracing == null");
    if (pipelineTracing == null) throw new NullPointerException("pipelineTracing == null");
    if (parser == null) throw new NullPointerException("parser == null");
    currentTraceContext = httpTracing.tracing().currentTraceContext();
    handler = HttpServerHandler.create(httpTracing);
    this.pipelineTracing = pipelineTracing;
    this.parser = parser;
  }

  @Override public void onEvent(ApplicationEvent event) {
    // only onRequest is used
  }

  @Override public RequestEventListener onRequest(RequestEvent event) {
    if (event.getType() != RequestEvent.Type.START) return null;
    Span span = handler.handleReceive(new ContainerRequestWrapper(event.getContainerRequest()));
    Scope scope = currentTraceContext.newScope(span.context());
    // unsampled requests still run the pipeline, just without phases
    RequestTracer requestTracer = pipelineTracing.newRequestTracer(span.isNoop() ? null : span);
    PipelineRequestEventListener result =
      new PipelineRequestEventListener(span, scope, requestTracer);
    result.traceCheckpoint(event);
    return result;
  }

  // Scope reference invalidated when an asynchronous method is in use
  final class PipelineRequestEventListener extends AtomicReference<Scope>
    implements RequestEventListener {
    final Span span;
    final RequestTracer requestTracer;
    volatile boolean async;
    // RESOURCE_METHOD_FINISHED precedes ON_EXCEPTION, so a result is only known at the next event
    boolean resultPending;
    long resultTimestamp;

    PipelineRequestEventListener(Span span, Scope scope, RequestTracer requestTracer) {
      super(scope);
      this.span = span;
      this.requestTracer = requestTracer;
    }

    /**
     * This keeps the server span in scope as long as possible. In synchronous methods, the span
     * remains in scope for the whole request/response lifecycle, with phase and operation spans
     * nested inside it. {@linkplain ManagedAsync} and {@linkplain Suspended} requests are the worst
     * case: the span is only visible until request filters complete.
     */
    @Override public void onEvent(RequestEvent event) {
      if (!async) traceCheckpoint(event);

      Scope maybeScope;
      switch (event.getType()) {
        // Note: until REQUEST_MATCHED, we don't know metadata such as if the request is async or not
        case REQUEST_MATCHED:
          parser.requestMatched(event, span);
          async = async(event);
          // phases can't follow the request across threads, so close them while still on its own
          if (async) requestTracer.close();
          break;
        case REQUEST_FILTERED:
        case RESOURCE_METHOD_FINISHED:
          // Jersey-specific @ManagedAsync stays on the request thread until REQUEST_FILTERED
          // Normal async methods sometimes stay on a thread until RESOURCE_METHOD_FINISHED, but
          // this is not reliable. So, we eagerly close the scope from request filters, and re-apply
          // it later when the resource method starts.
          if (!async || (maybeScope = getAndSet(null)) == null) break;
          maybeScope.close();
          break;
        case RESOURCE_METHOD_START:
          // The resource method invocation is likely on a different thread than request filtering.
          if (!async || get() != null) break;
          set(currentTraceContext.newScope(span.context()));
          break;
        case FINISHED:
          handler.handleSend(new RequestEventWrapper(event), span);
          // In async FINISHED can happen before RESOURCE_METHOD_FINISHED, and on different threads!
          // Don't close the scope unless it is a synchronous method.
          if (!async && (maybeScope = getAndSet(null)) != null) {
            maybeScope.close();
          }
          break;
        default:
      }
    }

    /** Translates a request event into checkpoints. Never throws. */
    void traceCheckpoint(RequestEvent event) {
      try {
        if (resultPending && event.getType() != RequestEvent.Type.ON_EXCEPTION) {
          replayResult(event);
        }
        switch (event.getType()) {
          case START:
            requestTracer.checkpointStarted(parser.requestStart(event));
            break;
          case REQUEST_FILTERED:
            requestTracer.checkpointFinished(Checkpoint.Type.REQUEST_START,
              parser.requestFiltered(event));
            break;
          case RESOURCE_METHOD_START:
            requestTracer.checkpointStarted(parser.preDispatch(event));
            break;
          case RESOURCE_METHOD_FINISHED:
            resultPending = true;
            resultTimestamp = requestTracer.currentTimeMicroseconds();
            break;
          case RESP_FILTERS_START:
            requestTracer.checkpointFinished(Checkpoint.Type.OPERATION_RESULT_READY);
            requestTracer.checkpointStarted(parser.responseReady(event));
            break;
          case RESP_FILTERS_FINISHED:
            requestTracer.checkpointFinished(Checkpoint.Type.RESPONSE_READY);
            break;
          case ON_EXCEPTION:
            ErrorRaised errorRaised = parser.errorRaised(event);
            if (errorRaised == null) {
              if (resultPending) replayResult(event);
              break;
            }
            resultPending = false; // the method threw: there is no result to render
            requestTracer.checkpointStarted(errorRaised);
            break;
          case FINISHED:
            requestTracer.close();
            break;
          default:
        }
      } catch (Throwable t) {
        propagateIfFatal(t);
        log(t, "error tracing jersey event {0}", event.getType());
      }
    }

    /** Ends the operation with its result and opens the view phase, both as of the method end. */
    void replayResult(RequestEvent event) {
      resultPending = false;
      requestTracer.checkpointStarted(parser.operationResultReady(event), resultTimestamp);
    }
  }

  static boolean async(RequestEvent event) {
    ResourceMethod method = event.getUriInfo().getMatchedResourceMethod();
    if (method == null) return false;
    return method.isManagedAsyncDeclared() || method.isSuspendDeclared();
  }

  static void log(Throwable thrown, String msg, Object zero) {
    if (!LOG.isLoggable(Level.FINE)) return; // fine level to not fill logs
    LogRecord lr = new LogRecord(Level.FINE, msg);
    lr.setParameters(new Object[] {zero});
    lr.setThrown(thrown);
    LOG.log(lr);
  }

  static final class ContainerRequestWrapper extends HttpServerRequest {
    final ContainerRequest delegate;

    ContainerRequestWrapper(ContainerRequest delegate) {
      this.delegate = delegate;
    }

    @Override public String route() {
      return CheckpointParser.route(delegate);
    }

    @Override public Object unwrap() {
      return delegate;
    }

    @Override public String method() {
      return delegate.getMethod();
    }

    @Override public String path() {
      String result = delegate.getPath(false);
      return result.indexOf('/') == 0 ? result : "/" + result;
    }

    @Override public String url() {
      return delegate.getUriInfo().getRequestUri().toString();
    }

    @Override public String header(String name) {
      return delegate.getHeaderString(name);
    }

    @Override public boolean parseClientIpAndPort(Span span) {
      String clientIp = CheckpointParser.clientIp(delegate);
      return clientIp != null && span.remoteIpAndPort(clientIp, 0);
    }
  }

  static final class RequestEventWrapper extends HttpServerResponse {
    final RequestEvent event;
    @Nullable final Throwable error;
    ContainerRequestWrapper request;

    RequestEventWrapper(RequestEvent event) {
      this.event = event;
      this.error = CheckpointParser.unwrapError(event);
    }

    @Override public Object unwrap() {
      return event;
    }

    @Override public ContainerRequestWrapper request() {
      if (request == null) request = new ContainerRequestWrapper(event.getContainerRequest());
      return request;
    }

    @Override public Throwable error() {
      return error;
    }

    @Override public int statusCode() {
      return CheckpointParser.statusCode(event);
    }
  }
}
