package org.hypertrace.core.metrics.query.service.prometheus;

import com.google.inject.Singleton;
import java.util.concurrent.ConcurrentHashMap;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.hypertrace.core.metrics.query.service.MetricsQueryServiceConfig.PrometheusClientConfig;

@Singleton
public class PrometheusRestClientFactory {

  private final ConcurrentHashMap<String, PrometheusClient> clientMap = new ConcurrentHashMap<>();

  public PrometheusClient getPrometheusClient(PrometheusClientConfig clientConfig) {
    return this.clientMap.computeIfAbsent(
        clientConfig.getScheme() + "://" + clientConfig.getConnectionString(),
        baseUrl -> buildClient(baseUrl, clientConfig));
  }

  private PrometheusClient buildClient(String baseUrl, PrometheusClientConfig clientConfig) {
    HttpUrl url = HttpUrl.parse(baseUrl + "/");
    if (url == null) {
      throw new IllegalArgumentException("Invalid prometheus connection string: " + baseUrl);
    }
    OkHttpClient okHttpClient =
        new OkHttpClient.Builder()
            .connectTimeout(clientConfig.getConnectTimeout())
            .readTimeout(clientConfig.getReadTimeout())
            .build();
    return new PrometheusRestClient(url, okHttpClient);
  }
}
