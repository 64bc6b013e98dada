package org.hypertrace.core.metrics.query.service;

import com.google.inject.Guice;
import com.typesafe.config.Config;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class MetricsQueryServiceFactory {

  public static MetricQueryDispatcher build(Config config) {
    return build(config, new SimpleMeterRegistry());
  }

  public static MetricQueryDispatcher build(Config config, MeterRegistry meterRegistry) {
    return Guice.createInjector(new MetricsQueryServiceModule(config, meterRegistry))
        .getInstance(MetricQueryDispatcher.class);
  }
}
