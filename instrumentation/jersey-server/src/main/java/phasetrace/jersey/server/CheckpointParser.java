/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package phasetrace.jersey.server;

import brave.SpanCustomizer;
import brave.internal.Nullable;
import jakarta.ws.rs.ClientErrorException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.glassfish.jersey.server.ContainerRequest;
import org.glassfish.jersey.server.ContainerResponse;
import org.glassfish.jersey.server.ExtendedUriInfo;
import org.glassfish.jersey.server.internal.process.MappableException;
import org.glassfish.jersey.server.model.Invocable;
import org.glassfish.jersey.server.model.ResourceMethod;
import org.glassfish.jersey.server.monitoring.RequestEvent;
import org.glassfish.jersey.uri.UriTemplate;
import phasetrace.ErrorRaised;
import phasetrace.OperationRef;
import phasetrace.OperationResultReady;
import phasetrace.PreDispatch;
import phasetrace.RequestStart;
import phasetrace.ResponseReady;

/**
 * Jersey specific type used to turn request events into pipeline checkpoints.
 *
 * <p>Note: This should not duplicate data added by {@link brave.http.HttpTracing} to the server
 * span. Checkpoint metadata lands on phase spans instead.
 */
public class CheckpointParser {
  /** Adds no resource data: no route or resource tags, and no operation is ever traced. */
  public static final CheckpointParser NOOP = new CheckpointParser() {
    @Override protected void requestMatched(RequestEvent event, SpanCustomizer customizer) {
    }

    @Override protected Map<String, String> requestFiltered(RequestEvent event) {
      return Collections.emptyMap();
    }

    @Override protected PreDispatch preDispatch(RequestEvent event) {
      return PreDispatch.create(null);
    }
  };

  /** Matched template including the base path. ex "/books/{id}" */
  public static final String ROUTE = "http.route";
  /** Simple class name that processed the request. ex BookResource */
  public static final String RESOURCE_CLASS = "jaxrs.resource.class";
  /** Method name that processed the request. ex listOfBooks */
  public static final String RESOURCE_METHOD = "jaxrs.resource.method";

  static final String FORWARDED_FOR = "X-Forwarded-For";

  /**
   * Invoked on {@link RequestEvent.Type#REQUEST_MATCHED} to add {@link #RESOURCE_CLASS} and
   * {@link #RESOURCE_METHOD} to the server span.
   */
  protected void requestMatched(RequestEvent event, SpanCustomizer customizer) {
    ResourceMethod method = event.getContainerRequest().getUriInfo().getMatchedResourceMethod();
    if (method == null) return; // This case is extremely odd as this is called on REQUEST_MATCHED!
    Invocable i = method.getInvocable();
    customizer.tag(RESOURCE_CLASS, i.getHandler().getHandlerClass().getSimpleName());
    customizer.tag(RESOURCE_METHOD, i.getHandlingMethod().getName());
  }

  /** Invoked on {@link RequestEvent.Type#START}. */
  protected RequestStart requestStart(RequestEvent event) {
    ContainerRequest request = event.getContainerRequest();
    return RequestStart.create(
      request.getUriInfo().getRequestUri().toString(),
      request.getMethod(),
      clientIp(request),
      request.getHeaderString("User-Agent")
    );
  }

  /**
   * Invoked on {@link RequestEvent.Type#REQUEST_FILTERED}. The result tags the request phase as it
   * ends, as only now is the resource known.
   */
  protected Map<String, String> requestFiltered(RequestEvent event) {
    ContainerRequest request = event.getContainerRequest();
    Map<String, String> result = new LinkedHashMap<>();
    result.put(ROUTE, route(request));
    ResourceMethod method = request.getUriInfo().getMatchedResourceMethod();
    if (method == null) return result;
    Invocable i = method.getInvocable();
    result.put(RESOURCE_CLASS, i.getHandler().getHandlerClass().getSimpleName());
    result.put(RESOURCE_METHOD, i.getHandlingMethod().getName());
    return result;
  }

  /** Invoked on {@link RequestEvent.Type#RESOURCE_METHOD_START}. */
  protected PreDispatch preDispatch(RequestEvent event) {
    ResourceMethod method = event.getContainerRequest().getUriInfo().getMatchedResourceMethod();
    if (method == null) return PreDispatch.create(null);
    Invocable i = method.getInvocable();
    Class<?> handlerClass = i.getHandler().getHandlerClass();
    if (handlerClass == null || i.getHandlingMethod() == null) return PreDispatch.create(null);
    return PreDispatch.create(OperationRef.create(handlerClass, i.getHandlingMethod().getName()));
  }

  /**
   * Invoked on the event after {@link RequestEvent.Type#RESOURCE_METHOD_FINISHED}, usually
   * {@link RequestEvent.Type#RESP_FILTERS_START}, once the method is known to have returned.
   *
   * <p>The result type is the simple class name of the returned entity. Methods declared to
   * return a {@link Response} report that, as Jersey unwraps its entity. "void" is reported for
   * void methods and "null" when nothing was returned.
   */
  protected OperationResultReady operationResultReady(RequestEvent event) {
    ResourceMethod method = event.getContainerRequest().getUriInfo().getMatchedResourceMethod();
    if (method == null) return OperationResultReady.create("unknown");
    Class<?> declared = method.getInvocable().getRawResponseType();
    if (declared == void.class || declared == Void.class) {
      return OperationResultReady.create("void");
    }
    ContainerResponse response = event.getContainerResponse();
    if (response == null || Response.class.isAssignableFrom(declared)) {
      return OperationResultReady.create(declared.getSimpleName());
    }
    Object entity = response.getEntity();
    return OperationResultReady.create(entity != null ? entity.getClass().getSimpleName() : "null");
  }

  /** Invoked on {@link RequestEvent.Type#RESP_FILTERS_START}. */
  protected ResponseReady responseReady(RequestEvent event) {
    ContainerResponse response = event.getContainerResponse();
    if (response == null) return ResponseReady.create(statusCode(event), null, -1);
    MediaType mediaType = response.getMediaType();
    return ResponseReady.create(response.getStatus(),
      mediaType != null ? mediaType.toString() : null, response.getLength());
  }

  /** Invoked on {@link RequestEvent.Type#ON_EXCEPTION}. Returns null if there was no exception. */
  @Nullable protected ErrorRaised errorRaised(RequestEvent event) {
    Throwable error = unwrapError(event);
    // normal HTTP status codes still divert the pipeline to error handling
    if (error == null) error = event.getException();
    return error != null ? ErrorRaised.create(error) : null;
  }

  @Nullable static String clientIp(ContainerRequest request) {
    String forwardedFor = request.getHeaderString(FORWARDED_FOR);
    if (forwardedFor == null) return null;
    int comma = forwardedFor.indexOf(',');
    String result = (comma == -1 ? forwardedFor : forwardedFor.substring(0, comma)).trim();
    return result.isEmpty() ? null : result;
  }

  @Nullable static Throwable unwrapError(RequestEvent event) {
    Throwable error = event.getException();
    // For example, if thrown in an async controller
    if (error instanceof MappableException && error.getCause() != null) {
      error = error.getCause();
    }
    // MappableException can wrap a WebApplicationException!
    if (error instanceof WebApplicationException && error.getCause() != null) {
      error = error.getCause();
    }
    // Don't create error messages for normal HTTP status codes.
    if (error instanceof ClientErrorException && error.getCause() == null) {
      return null;
    }
    return error;
  }

  static int statusCode(RequestEvent event) {
    ContainerResponse response = event.getContainerResponse();
    if (response != null) return response.getStatus();

    Throwable error = event.getException();
    if (error instanceof MappableException && error.getCause() != null) {
      error = error.getCause();
    }
    if (error instanceof WebApplicationException) {
      return ((WebApplicationException) error).getResponse().getStatus();
    }
    return 0;
  }

  /**
   * This returns the matched template as defined by a base URL and path expressions.
   *
   * <p>Matched templates are pairs of (resource path, method path), innermost first. This code
   * skips redundant slashes from either source caused by Path("/") or Path("").
   */
  static String route(ContainerRequest request) {
    ExtendedUriInfo uriInfo = request.getUriInfo();
    List<UriTemplate> templates = uriInfo.getMatchedTemplates();
    int templateCount = templates.size();
    if (templateCount == 0) return "";
    StringBuilder builder = null; // don't allocate unless you need it!
    String basePath = uriInfo.getBaseUri().getPath();
    String result = null;
    if (!"/".equals(basePath)) { // skip empty base paths
      result = basePath;
    }
    for (int i = templateCount - 1; i >= 0; i--) {
      String template = templates.get(i).getTemplate();
      if ("/".equals(template)) continue; // skip allocation
      if (builder != null) {
        builder.append(template);
      } else if (result != null) {
        builder = new StringBuilder(result).append(template);
        result = null;
      } else {
        result = template;
      }
    }
    return result != null ? result : builder != null ? builder.toString() : "";
  }

  public CheckpointParser() { // intentionally public for @Inject to work without explicit binding
  }
}
