/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package phasetrace.spring.beans;

import java.util.List;
import org.springframework.beans.factory.FactoryBean;
import phasetrace.TraceIntentRegistry;

/**
 * Scans classes for {@link phasetrace.Traced} once, at startup.
 *
 * <pre>{@code
 * <bean id="intentRegistry" class="phasetrace.spring.beans.TraceIntentRegistryFactoryBean">
 *   <property name="scannedClasses">
 *     <list>
 *       <value>com.example.BookResource</value>
 *     </list>
 *   </property>
 * </bean>
 * }</pre>
 */
public class TraceIntentRegistryFactoryBean implements FactoryBean {
  List<Class<?>> scannedClasses;

  @Override public TraceIntentRegistry getObject() {
    if (scannedClasses == null || scannedClasses.isEmpty()) return TraceIntentRegistry.EMPTY;
    return TraceIntentRegistry.newBuilder()
      .scan(scannedClasses.toArray(new Class<?>[0]))
      .build();
  }

  @Override public Class<? extends TraceIntentRegistry> getObjectType() {
    return TraceIntentRegistry.class;
  }

  @Override public boolean isSingleton() {
    return true;
  }

  public void setScannedClasses(List<Class<?>> scannedClasses) {
    this.scannedClasses = scannedClasses;
  }
}
