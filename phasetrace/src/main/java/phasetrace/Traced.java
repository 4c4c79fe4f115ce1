/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package phasetrace;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares that an operation should be measured as its own span. Place it on a class to trace
 * every operation it declares, or on a method to trace only that one. A method annotation replaces
 * the class annotation entirely; values are not merged.
 *
 * <p>Annotations on superclasses and interfaces count too, so it can sit on a resource interface
 * or on a method that subclasses override.
 *
 * <p>This is read once, by {@link TraceIntentRegistry.Builder#scan(Class[])}, never per request.
 *
 * <p>Ex.
 * <pre>{@code
 * @Traced(operationName = "books.list", tags = {"team=catalog", "tier=gold"})
 * public Response listOfBooks() {
 * }</pre>
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface Traced {
  /** Span name. Empty means {@value ScopedOperationTracer#DEFAULT_OPERATION_NAME}. */
  String operationName() default "";

  /** Span description. Empty means the operation's display name. ex "BookResource::listOfBooks" */
  String description() default "";

  /** Extra tags in {@code key=value} form. */
  String[] tags() default {};
}
