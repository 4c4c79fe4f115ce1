/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package phasetrace;

import brave.internal.Nullable;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Answers which operations declared a {@link TraceIntent}. This is built once at startup, so
 * per-request lookups are plain hash lookups with no reflection.
 *
 * <p>A method-level intent takes precedence over a class-level one for the same operation.
 */
public final class TraceIntentRegistry {
  static final Logger LOG = Logger.getLogger(TraceIntentRegistry.class.getName());

  /** Resolves no intents: nothing is traced at operation level. */
  public static final TraceIntentRegistry EMPTY = newBuilder().build();

  public static Builder newBuilder() {
    return new Builder();
  }

  final Map<OperationRef, TraceIntent> methodIntents;
  final Map<String, TraceIntent> classIntents;

  TraceIntentRegistry(Builder builder) {
    this.methodIntents = Collections.unmodifiableMap(new LinkedHashMap<>(builder.methodIntents));
    this.classIntents = Collections.unmodifiableMap(new LinkedHashMap<>(builder.classIntents));
  }

  /**
   * Returns the intent declared for this operation, or null if there is none. A null reference is
   * logged and treated as "nothing declared".
   */
  @Nullable public TraceIntent resolve(@Nullable OperationRef operation) {
    if (operation == null) {
      LOG.fine("unresolvable operation reference; not tracing it");
      return null;
    }
    TraceIntent result = methodIntents.get(operation);
    if (result != null) return result;
    return classIntents.get(operation.className());
  }

  public boolean isEmpty() {
    return methodIntents.isEmpty() && classIntents.isEmpty();
  }

  @Override public String toString() {
    return "TraceIntentRegistry{methods=" + methodIntents.keySet()
      + ", classes=" + classIntents.keySet() + "}";
  }

  public static final class Builder {
    final Map<OperationRef, TraceIntent> methodIntents = new LinkedHashMap<>();
    final Map<String, TraceIntent> classIntents = new LinkedHashMap<>();

    /** Traces every operation declared by this class, unless a method says otherwise. */
    public Builder addClass(Class<?> type, TraceIntent intent) {
      if (type == null) throw new NullPointerException("type == null");
      return addClass(type.getName(), intent);
    }

    public Builder addClass(String className, TraceIntent intent) {
      if (className == null) throw new NullPointerException("className == null");
      if (intent == null) throw new NullPointerException("intent == null");
      classIntents.put(className, intent);
      return this;
    }

    public Builder addMethod(OperationRef operation, TraceIntent intent) {
      if (operation == null) throw new NullPointerException("operation == null");
      if (intent == null) throw new NullPointerException("intent == null");
      methodIntents.put(operation, intent);
      return this;
    }

    /**
     * Registers the {@link Traced} annotations found on these classes and their public methods.
     * Inherited public methods are registered under the scanned class, as that is the class a
     * pipeline will report when it dispatches to them.
     *
     * <p>Annotations are also read from superclasses and interfaces, nearest first. A method
     * overriding or implementing an annotated one is traced as it declares, unless it carries
     * its own annotation.
     *
     * @throws IllegalArgumentException if an annotation has a malformed tag
     */
    public Builder scan(Class<?>... types) {
      if (types == null) throw new NullPointerException("types == null");
      for (Class<?> type : types) {
        if (type == null) throw new NullPointerException("types contains null");
        List<Class<?>> hierarchy = hierarchy(type);
        Traced onClass = findTraced(hierarchy);
        if (onClass != null) addClass(type, TraceIntent.from(onClass));
        for (Method method : type.getMethods()) {
          if (method.isBridge() || method.getDeclaringClass() == Object.class) continue;
          Traced onMethod = findTraced(hierarchy, method);
          if (onMethod == null) continue;
          addMethod(OperationRef.create(type, method.getName()), TraceIntent.from(onMethod));
        }
        if (LOG.isLoggable(Level.FINE)) {
          LOG.log(Level.FINE, "scanned {0} for trace intents", type.getName());
        }
      }
      return this;
    }

    @Nullable static Traced findTraced(List<Class<?>> hierarchy) {
      for (Class<?> type : hierarchy) {
        Traced result = type.getAnnotation(Traced.class);
        if (result != null) return result;
      }
      return null;
    }

    @Nullable static Traced findTraced(List<Class<?>> hierarchy, Method method) {
      Traced result = method.getAnnotation(Traced.class);
      if (result != null) return result;
      Class<?>[] parameterTypes = method.getParameterTypes();
      for (Class<?> type : hierarchy) {
        for (Method declared : type.getDeclaredMethods()) {
          if (!declared.getName().equals(method.getName())) continue;
          if (!Arrays.equals(declared.getParameterTypes(), parameterTypes)) continue;
          result = declared.getAnnotation(Traced.class);
          if (result != null) return result;
        }
      }
      return null;
    }

    /** The class, its superclasses, then the interfaces of each, nearest first. */
    static List<Class<?>> hierarchy(Class<?> type) {
      Set<Class<?>> result = new LinkedHashSet<>();
      for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
        result.add(c);
      }
      List<Class<?>> classes = new ArrayList<>(result);
      for (int i = 0; i < classes.size(); i++) {
        for (Class<?> iface : classes.get(i).getInterfaces()) {
          if (result.add(iface)) classes.add(iface);
        }
      }
      return classes;
    }

    public TraceIntentRegistry build() {
      return new TraceIntentRegistry(this);
    }

    Builder() {
    }
  }
}
