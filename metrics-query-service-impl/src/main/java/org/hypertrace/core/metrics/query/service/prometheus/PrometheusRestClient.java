package org.hypertrace.core.metrics.query.service.prometheus;

import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.core.SingleEmitter;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.hypertrace.core.metrics.query.service.QueryExecutionException;

@Slf4j
class PrometheusRestClient implements PrometheusClient {
  private static final String INSTANT_QUERY = "api/v1/query";
  private static final String RANGE_QUERY = "api/v1/query_range";

  private final HttpUrl baseUrl;
  private final OkHttpClient okHttpClient;

  PrometheusRestClient(HttpUrl baseUrl, OkHttpClient okHttpClient) {
    this.baseUrl = baseUrl;
    this.okHttpClient = okHttpClient;
  }

  @Override
  public Single<PromQLMetricResponse> queryRange(
      String expression, Instant start, Instant end, Duration step) {
    HttpUrl url =
        baseUrl
            .newBuilder()
            .addPathSegments(RANGE_QUERY)
            .addQueryParameter("query", expression)
            .addQueryParameter("start", toSeconds(start.toEpochMilli()))
            .addQueryParameter("end", toSeconds(end.toEpochMilli()))
            .addQueryParameter("step", toSeconds(step.toMillis()))
            .build();
    return execute(new Request.Builder().url(url).build());
  }

  @Override
  public Single<PromQLMetricResponse> query(String expression, Instant evalTime) {
    HttpUrl url =
        baseUrl
            .newBuilder()
            .addPathSegments(INSTANT_QUERY)
            .addQueryParameter("query", expression)
            .addQueryParameter("time", toSeconds(evalTime.toEpochMilli()))
            .build();
    return execute(new Request.Builder().url(url).build());
  }

  private Single<PromQLMetricResponse> execute(Request request) {
    return Single.create(
        emitter -> {
          Call call = okHttpClient.newCall(request);
          emitter.setCancellable(call::cancel);
          call.enqueue(new OkHttpResponseCallback(request, emitter));
        });
  }

  private static PromQLMetricResponse convertResponse(Response response) throws IOException {
    ResponseBody body = response.body();
    String content = body == null ? "" : body.string();

    PromQLMetricResponse metricResponse;
    try {
      metricResponse = PromQLMetricResponse.fromJson(content);
    } catch (IOException e) {
      if (!response.isSuccessful()) {
        throw QueryExecutionException.transport("Unexpected code " + response.code(), e);
      }
      throw QueryExecutionException.malformedResponse(
          "Failed to parse response: " + e.getMessage(), e);
    }

    // prometheus reports evaluation errors with 400, 422 or 503 and an error body
    if (metricResponse != null && metricResponse.isError()) {
      throw QueryExecutionException.backend(
          String.format("%s: %s", metricResponse.getErrorType(), metricResponse.getError()));
    }
    if (!response.isSuccessful()) {
      throw QueryExecutionException.transport("Unexpected code " + response.code(), null);
    }
    if (metricResponse == null || !metricResponse.isSuccess()) {
      throw QueryExecutionException.malformedResponse(
          "Unknown response status: "
              + (metricResponse == null ? null : metricResponse.getStatus()),
          null);
    }
    return metricResponse;
  }

  /* decimal seconds with millisecond precision, as accepted by the prometheus API */
  static String toSeconds(long millis) {
    return BigDecimal.valueOf(millis, 3).stripTrailingZeros().toPlainString();
  }

  private static class OkHttpResponseCallback implements Callback {
    private final Request request;
    private final SingleEmitter<PromQLMetricResponse> emitter;

    OkHttpResponseCallback(Request request, SingleEmitter<PromQLMetricResponse> emitter) {
      this.request = request;
      this.emitter = emitter;
    }

    @Override
    public void onResponse(Call call, Response response) {
      try (response) {
        emitter.onSuccess(convertResponse(response));
      } catch (QueryExecutionException e) {
        emitter.tryOnError(e);
      } catch (IOException e) {
        emitter.tryOnError(
            QueryExecutionException.transport("Failed to read response: " + e.getMessage(), e));
      }
    }

    @Override
    public void onFailure(Call call, IOException e) {
      if (call.isCanceled()) {
        log.debug("Request cancelled: {}", request.url());
      }
      emitter.tryOnError(
          QueryExecutionException.transport("Request failed: " + e.getMessage(), e));
    }
  }
}
