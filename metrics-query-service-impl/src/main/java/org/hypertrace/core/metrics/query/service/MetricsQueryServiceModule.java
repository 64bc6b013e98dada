package org.hypertrace.core.metrics.query.service;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.typesafe.config.Config;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import javax.inject.Singleton;
import org.hypertrace.core.metrics.query.service.prometheus.PrometheusClient;
import org.hypertrace.core.metrics.query.service.prometheus.PrometheusRestClientFactory;
import org.hypertrace.core.metrics.query.service.validation.BatchValidationModule;

class MetricsQueryServiceModule extends AbstractModule {

  private final MetricsQueryServiceConfig config;
  private final MeterRegistry meterRegistry;

  MetricsQueryServiceModule(Config config, MeterRegistry meterRegistry) {
    this.config = new MetricsQueryServiceConfig(config);
    this.meterRegistry = meterRegistry;
  }

  @Override
  protected void configure() {
    bind(MetricsQueryServiceConfig.class).toInstance(this.config);
    bind(MeterRegistry.class).toInstance(this.meterRegistry);
    bind(Clock.class).toInstance(Clock.systemUTC());
    install(new BatchValidationModule());
  }

  @Provides
  @Singleton
  PrometheusClient providePrometheusClient(PrometheusRestClientFactory clientFactory) {
    return clientFactory.getPrometheusClient(config.getPrometheusClientConfig());
  }
}
