package org.hypertrace.core.metrics.query.service;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.time.Duration;
import lombok.Value;
import lombok.experimental.NonFinal;

@Value
@NonFinal
public class MetricsQueryServiceConfig {
  private static final String DEFAULTS_PATH = "metrics.query.service";
  private static final String CONFIG_PATH_PROMETHEUS_CLIENT = "prometheus.client";
  private static final String CONFIG_PATH_DISPATCH = "dispatch";

  PrometheusClientConfig prometheusClientConfig;
  DispatchConfig dispatchConfig;

  /** Missing keys fall back to the defaults in {@code reference.conf}. */
  public MetricsQueryServiceConfig(Config config) {
    Config resolved =
        config.withFallback(ConfigFactory.defaultReference().getConfig(DEFAULTS_PATH)).resolve();
    this.prometheusClientConfig =
        new PrometheusClientConfig(resolved.getConfig(CONFIG_PATH_PROMETHEUS_CLIENT));
    this.dispatchConfig = new DispatchConfig(resolved.getConfig(CONFIG_PATH_DISPATCH));
  }

  @Value
  @NonFinal
  public static class PrometheusClientConfig {
    private static final String CONFIG_PATH_CONNECTION_STRING = "connectionString";
    private static final String CONFIG_PATH_SCHEME = "scheme";
    private static final String CONFIG_PATH_CONNECT_TIMEOUT = "connectTimeout";
    private static final String CONFIG_PATH_READ_TIMEOUT = "readTimeout";

    /* host:port */
    String connectionString;
    String scheme;
    Duration connectTimeout;
    Duration readTimeout;

    private PrometheusClientConfig(Config config) {
      this.connectionString = config.getString(CONFIG_PATH_CONNECTION_STRING);
      this.scheme = config.getString(CONFIG_PATH_SCHEME);
      this.connectTimeout = config.getDuration(CONFIG_PATH_CONNECT_TIMEOUT);
      this.readTimeout = config.getDuration(CONFIG_PATH_READ_TIMEOUT);
    }
  }

  @Value
  @NonFinal
  public static class DispatchConfig {
    private static final String CONFIG_PATH_MAX_CONCURRENCY = "maxConcurrency";

    int maxConcurrency;

    private DispatchConfig(Config config) {
      this.maxConcurrency = config.getInt(CONFIG_PATH_MAX_CONCURRENCY);
      if (maxConcurrency < 1) {
        throw new IllegalArgumentException(
            CONFIG_PATH_MAX_CONCURRENCY + " has to be positive, got " + maxConcurrency);
      }
    }
  }
}
