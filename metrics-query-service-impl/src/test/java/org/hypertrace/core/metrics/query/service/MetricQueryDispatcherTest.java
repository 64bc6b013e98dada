package org.hypertrace.core.metrics.query.service;

import static org.hypertrace.core.metrics.query.service.MetricsQueryTestUtils.successResponse;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.google.inject.Guice;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.observers.TestObserver;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.hypertrace.core.metrics.query.service.api.BatchCancelledException;
import org.hypertrace.core.metrics.query.service.api.BatchResponse;
import org.hypertrace.core.metrics.query.service.api.ErrorType;
import org.hypertrace.core.metrics.query.service.api.Frame;
import org.hypertrace.core.metrics.query.service.api.InvalidBatchException;
import org.hypertrace.core.metrics.query.service.api.MetricQuery;
import org.hypertrace.core.metrics.query.service.api.QueryError;
import org.hypertrace.core.metrics.query.service.api.QueryMode;
import org.hypertrace.core.metrics.query.service.api.QueryOutcome;
import org.hypertrace.core.metrics.query.service.prometheus.PromQLMetricResponse;
import org.hypertrace.core.metrics.query.service.prometheus.PrometheusClient;
import org.hypertrace.core.metrics.query.service.validation.BatchValidationModule;
import org.hypertrace.core.metrics.query.service.validation.BatchValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MetricQueryDispatcherTest {
  private static final Instant T0 = Instant.ofEpochSecond(1641889530L);
  private static final Instant NOW = Instant.ofEpochSecond(1641900000L);
  private static final Duration STEP = Duration.ofSeconds(1);

  private static final PromQLMetricResponse GAPPED_RESPONSE =
      successResponse(
          "matrix",
          "[{\"metric\": {\"__name__\": \"go_goroutines\", \"job\": \"prometheus\"},"
              + "\"values\": [[1641889533, \"21\"], [1641889534, \"32\"], [1641889537, \"43\"]]}]");

  @Mock private PrometheusClient prometheusClient;
  private SimpleMeterRegistry meterRegistry;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
  }

  @Test
  void alignsRangeQueryToGrid() {
    when(prometheusClient.queryRange("go_goroutines", T0, T0.plusSeconds(8), STEP))
        .thenReturn(Single.just(GAPPED_RESPONSE));

    BatchResponse response =
        dispatcher(Schedulers.trampoline(), 4)
            .execute(List.of(rangeQuery("A", "go_goroutines", 8)), new BatchContext())
            .blockingGet();

    Frame frame = response.get("A").flatMap(QueryOutcome::getFrame).orElseThrow();
    assertEquals(9, frame.getRowCount());
    assertEquals(
        Arrays.asList(null, null, null, 21.0, 32.0, null, null, 43.0, null),
        frame.getColumns().get(0).getValues());
  }

  @Test
  void isolatesFailingQueries() {
    when(prometheusClient.queryRange(eq("ok"), any(), any(), any()))
        .thenReturn(Single.just(GAPPED_RESPONSE));
    when(prometheusClient.queryRange(eq("unreachable"), any(), any(), any()))
        .thenReturn(Single.error(QueryExecutionException.transport("connection refused", null)));
    when(prometheusClient.queryRange(eq("sum("), any(), any(), any()))
        .thenReturn(Single.error(QueryExecutionException.backend("bad_data: parse error")));
    when(prometheusClient.queryRange(eq("io"), any(), any(), any()))
        .thenReturn(Single.error(new IOException("stream reset")));

    BatchResponse response =
        dispatcher(Schedulers.trampoline(), 4)
            .execute(
                List.of(
                    rangeQuery("A", "ok", 8),
                    rangeQuery("B", "unreachable", 8),
                    rangeQuery("C", "sum(", 8),
                    rangeQuery("D", "io", 8)),
                new BatchContext())
            .blockingGet();

    assertEquals(List.of("A", "B", "C", "D"), List.copyOf(response.getResponses().keySet()));
    assertTrue(response.get("A").orElseThrow().isSuccess());
    assertEquals(
        new QueryError(ErrorType.TRANSPORT, "connection refused"), errorOf(response, "B"));
    assertEquals(new QueryError(ErrorType.BACKEND, "bad_data: parse error"), errorOf(response, "C"));
    assertEquals(ErrorType.TRANSPORT, errorOf(response, "D").getType());
    assertEquals(3, response.getErrorCount());
  }

  @Test
  void reportsMalformedValueOnlyForAffectedQuery() {
    when(prometheusClient.queryRange(eq("ok"), any(), any(), any()))
        .thenReturn(Single.just(GAPPED_RESPONSE));
    when(prometheusClient.queryRange(eq("bad"), any(), any(), any()))
        .thenReturn(
            Single.just(
                successResponse(
                    "matrix", "[{\"metric\": {}, \"values\": [[1641889530, \"1d\"]]}]")));

    BatchResponse response =
        dispatcher(Schedulers.trampoline(), 4)
            .execute(
                List.of(rangeQuery("A", "bad", 8), rangeQuery("B", "ok", 8)), new BatchContext())
            .blockingGet();

    assertEquals(ErrorType.MALFORMED_VALUE, errorOf(response, "A").getType());
    assertTrue(response.get("B").orElseThrow().isSuccess());
  }

  @Test
  void highResolutionQueryDoesNotAffectSiblings() {
    Instant dayLater = T0.plus(Duration.ofDays(1));
    when(prometheusClient.queryRange(eq("ok"), any(), any(), any()))
        .thenReturn(Single.just(GAPPED_RESPONSE));
    when(prometheusClient.queryRange("rate(up[1m])", T0, dayLater, STEP))
        .thenReturn(Single.just(successResponse("matrix", "[]")));

    MetricQuery highResolution =
        MetricQuery.builder()
            .refId("B")
            .expression("rate(up[1m])")
            .start(T0)
            .end(dayLater)
            .step(STEP)
            .build();
    BatchResponse response =
        dispatcher(Schedulers.trampoline(), 4)
            .execute(List.of(rangeQuery("A", "ok", 8), highResolution), new BatchContext())
            .blockingGet();

    assertEquals(9, response.get("A").flatMap(QueryOutcome::getFrame).orElseThrow().getRowCount());
    assertEquals(
        86_401, response.get("B").flatMap(QueryOutcome::getFrame).orElseThrow().getRowCount());
  }

  @Test
  void backendRejectingResolutionFailsOnlyThatQuery() {
    Instant dayLater = T0.plus(Duration.ofDays(1));
    when(prometheusClient.queryRange(eq("ok"), any(), any(), any()))
        .thenReturn(Single.just(GAPPED_RESPONSE));
    when(prometheusClient.queryRange("up", T0, dayLater, STEP))
        .thenReturn(
            Single.error(
                QueryExecutionException.backend(
                    "bad_data: exceeded maximum resolution of 11,000 points per timeseries")));

    MetricQuery highResolution =
        MetricQuery.builder().refId("B").expression("up").start(T0).end(dayLater).step(STEP).build();
    BatchResponse response =
        dispatcher(Schedulers.trampoline(), 4)
            .execute(List.of(rangeQuery("A", "ok", 8), highResolution), new BatchContext())
            .blockingGet();

    assertTrue(response.get("A").orElseThrow().isSuccess());
    assertEquals(ErrorType.BACKEND, errorOf(response, "B").getType());
    assertEquals(1, response.getErrorCount());
  }

  @Test
  void reportsUnsupportedResultType() {
    when(prometheusClient.query(eq("scalar(up)"), any()))
        .thenReturn(Single.just(successResponse("scalar", "[1641889530, \"1\"]")));

    BatchResponse response =
        dispatcher(Schedulers.trampoline(), 4)
            .execute(List.of(instantQuery("A", "scalar(up)", T0)), new BatchContext())
            .blockingGet();

    assertEquals(ErrorType.UNSUPPORTED_RESULT_TYPE, errorOf(response, "A").getType());
  }

  @Test
  void rejectsDuplicateReferenceIdsBeforeAnyRequest() {
    TestObserver<BatchResponse> observer =
        dispatcher(Schedulers.trampoline(), 4)
            .execute(
                List.of(rangeQuery("A", "up", 2), rangeQuery("A", "down", 2)), new BatchContext())
            .test();

    observer.assertError(InvalidBatchException.class);
    verifyNoInteractions(prometheusClient);
  }

  @Test
  void cancellationAbandonsInFlightQueries() {
    AtomicBoolean disposed = new AtomicBoolean();
    when(prometheusClient.queryRange(eq("slow"), any(), any(), any()))
        .thenReturn(Single.<PromQLMetricResponse>never().doOnDispose(() -> disposed.set(true)));
    when(prometheusClient.queryRange(eq("ok"), any(), any(), any()))
        .thenReturn(Single.just(GAPPED_RESPONSE));
    BatchContext context = new BatchContext();

    TestObserver<BatchResponse> observer =
        dispatcher(Schedulers.trampoline(), 4)
            .execute(List.of(rangeQuery("A", "ok", 8), rangeQuery("B", "slow", 8)), context)
            .test();
    observer.assertNotComplete();

    context.cancel();

    observer.assertError(BatchCancelledException.class);
    observer.assertNoValues();
    assertTrue(disposed.get());
    assertTrue(context.isCancelled());
  }

  @Test
  void cancelledContextSendsNoRequest() {
    BatchContext context = new BatchContext();
    context.cancel();

    dispatcher(Schedulers.trampoline(), 4)
        .execute(List.of(rangeQuery("A", "up", 2)), context)
        .test()
        .assertError(BatchCancelledException.class);
    verifyNoInteractions(prometheusClient);
  }

  @Test
  void evaluatesInstantQueryAtEndOrNow() {
    PromQLMetricResponse vectorResponse =
        successResponse("vector", "[{\"metric\": {\"job\": \"node\"}, \"value\": [1641889530, \"1\"]}]");
    when(prometheusClient.query(eq("up"), any())).thenReturn(Single.just(vectorResponse));

    BatchResponse response =
        dispatcher(Schedulers.trampoline(), 4)
            .execute(
                List.of(instantQuery("A", "up", T0), instantQuery("B", "up", null)),
                new BatchContext())
            .blockingGet();

    verify(prometheusClient).query("up", T0);
    verify(prometheusClient).query("up", NOW);
    Frame frame = response.get("A").flatMap(QueryOutcome::getFrame).orElseThrow();
    assertEquals(List.of(T0), frame.getTimestamps());
    assertEquals(List.of(1.0), frame.getColumns().get(0).getValues());
  }

  @Test
  void emptyBatchHasEmptyResponse() {
    BatchResponse response =
        dispatcher(Schedulers.trampoline(), 4)
            .execute(List.of(), new BatchContext())
            .blockingGet();

    assertEquals(0, response.size());
  }

  @Test
  void repeatedExecutionGivesEqualResponses() {
    when(prometheusClient.queryRange(eq("ok"), any(), any(), any()))
        .thenReturn(Single.just(GAPPED_RESPONSE));
    when(prometheusClient.queryRange(eq("unreachable"), any(), any(), any()))
        .thenReturn(Single.error(QueryExecutionException.transport("connection refused", null)));
    MetricQueryDispatcher dispatcher = dispatcher(Schedulers.io(), 4);
    List<MetricQuery> batch = List.of(rangeQuery("A", "ok", 8), rangeQuery("B", "unreachable", 8));

    BatchResponse first = dispatcher.execute(batch, new BatchContext()).blockingGet();
    BatchResponse second = dispatcher.execute(batch, new BatchContext()).blockingGet();

    assertEquals(first, second);
  }

  @Test
  void boundsConcurrentRequests() {
    AtomicInteger inFlight = new AtomicInteger();
    AtomicInteger maxInFlight = new AtomicInteger();
    when(prometheusClient.queryRange(any(), any(), any(), any()))
        .thenReturn(
            Single.just(GAPPED_RESPONSE)
                .delay(50, TimeUnit.MILLISECONDS)
                .doOnSubscribe(
                    disposable -> maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max))
                .doFinally(inFlight::decrementAndGet));

    List<MetricQuery> batch =
        List.of(
            rangeQuery("A", "a", 8),
            rangeQuery("B", "b", 8),
            rangeQuery("C", "c", 8),
            rangeQuery("D", "d", 8),
            rangeQuery("E", "e", 8),
            rangeQuery("F", "f", 8));
    BatchResponse response =
        dispatcher(Schedulers.io(), 2).execute(batch, new BatchContext()).blockingGet();

    assertEquals(List.of("A", "B", "C", "D", "E", "F"), List.copyOf(response.getResponses().keySet()));
    assertEquals(0, response.getErrorCount());
    assertTrue(maxInFlight.get() <= 2);
    assertFalse(maxInFlight.get() == 0);
  }

  @Test
  void countsOutcomes() {
    when(prometheusClient.queryRange(eq("ok"), any(), any(), any()))
        .thenReturn(Single.just(GAPPED_RESPONSE));
    when(prometheusClient.queryRange(eq("unreachable"), any(), any(), any()))
        .thenReturn(Single.error(QueryExecutionException.transport("connection refused", null)));

    dispatcher(Schedulers.trampoline(), 4)
        .execute(
            List.of(rangeQuery("A", "ok", 8), rangeQuery("B", "unreachable", 8)),
            new BatchContext())
        .blockingGet();

    assertEquals(
        1.0,
        meterRegistry
            .counter(
                "hypertrace.metrics.query.outcomes", "status", "success", "errorType", "none")
            .count());
    assertEquals(
        1.0,
        meterRegistry
            .counter(
                "hypertrace.metrics.query.outcomes", "status", "error", "errorType", "TRANSPORT")
            .count());
    assertEquals(
        1.0, meterRegistry.counter("hypertrace.metrics.query.batches", "status", "success").count());
  }

  private MetricQueryDispatcher dispatcher(Scheduler scheduler, int maxConcurrency) {
    BatchValidator batchValidator =
        Guice.createInjector(new BatchValidationModule()).getInstance(BatchValidator.class);
    return new MetricQueryDispatcher(
        prometheusClient,
        batchValidator,
        meterRegistry,
        Clock.fixed(NOW, ZoneOffset.UTC),
        scheduler,
        maxConcurrency);
  }

  private static QueryError errorOf(BatchResponse response, String refId) {
    return response.get(refId).flatMap(QueryOutcome::getError).orElseThrow();
  }

  private static MetricQuery rangeQuery(String refId, String expression, int seconds) {
    return MetricQuery.builder()
        .refId(refId)
        .expression(expression)
        .start(T0)
        .end(T0.plusSeconds(seconds))
        .step(STEP)
        .build();
  }

  private static MetricQuery instantQuery(String refId, String expression, Instant time) {
    return MetricQuery.builder()
        .refId(refId)
        .expression(expression)
        .mode(QueryMode.INSTANT)
        .end(time)
        .build();
  }
}
