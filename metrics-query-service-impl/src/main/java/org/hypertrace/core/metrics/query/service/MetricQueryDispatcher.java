package org.hypertrace.core.metrics.query.service;

import com.google.common.base.Preconditions;
import io.micrometer.core.instrument.MeterRegistry;
import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.tuple.ImmutablePair;
import org.hypertrace.core.metrics.query.service.api.BatchCancelledException;
import org.hypertrace.core.metrics.query.service.api.BatchResponse;
import org.hypertrace.core.metrics.query.service.api.Frame;
import org.hypertrace.core.metrics.query.service.api.MetricQuery;
import org.hypertrace.core.metrics.query.service.api.QueryError;
import org.hypertrace.core.metrics.query.service.api.QueryOutcome;
import org.hypertrace.core.metrics.query.service.api.Series;
import org.hypertrace.core.metrics.query.service.frame.FrameAssembler;
import org.hypertrace.core.metrics.query.service.frame.TimeGrid;
import org.hypertrace.core.metrics.query.service.frame.TimeGridBuilder;
import org.hypertrace.core.metrics.query.service.prometheus.PromQLMetricResponse;
import org.hypertrace.core.metrics.query.service.prometheus.PromQLResultParser;
import org.hypertrace.core.metrics.query.service.prometheus.PrometheusClient;
import org.hypertrace.core.metrics.query.service.validation.BatchValidator;

/**
 * Entry point of the service: runs a batch of queries against prometheus and returns one outcome
 * per reference id.
 *
 * <p>Each query is an independent unit of work producing its own (refId, outcome) pair, and any
 * failure of a query is turned into an error outcome within that unit, so it can't affect its
 * siblings. The pairs are merged into the {@link BatchResponse} once all units are done. Only an
 * invalid batch or a cancellation fails the batch as a whole.
 */
@Slf4j
@Singleton
public class MetricQueryDispatcher {
  private static final String QUERY_OUTCOMES_COUNTER = "hypertrace.metrics.query.outcomes";
  private static final String BATCHES_COUNTER = "hypertrace.metrics.query.batches";

  private final PrometheusClient prometheusClient;
  private final BatchValidator batchValidator;
  private final PromQLResultParser resultParser;
  private final TimeGridBuilder timeGridBuilder;
  private final FrameAssembler frameAssembler;
  private final MeterRegistry meterRegistry;
  private final Clock clock;
  private final Scheduler scheduler;
  private final int maxConcurrency;

  @Inject
  MetricQueryDispatcher(
      PrometheusClient prometheusClient,
      BatchValidator batchValidator,
      MetricsQueryServiceConfig config,
      MeterRegistry meterRegistry,
      Clock clock) {
    this(
        prometheusClient,
        batchValidator,
        meterRegistry,
        clock,
        Schedulers.io(),
        config.getDispatchConfig().getMaxConcurrency());
  }

  MetricQueryDispatcher(
      PrometheusClient prometheusClient,
      BatchValidator batchValidator,
      MeterRegistry meterRegistry,
      Clock clock,
      Scheduler scheduler,
      int maxConcurrency) {
    this.prometheusClient = prometheusClient;
    this.batchValidator = batchValidator;
    this.resultParser = new PromQLResultParser();
    this.timeGridBuilder = new TimeGridBuilder();
    this.frameAssembler = new FrameAssembler();
    this.meterRegistry = meterRegistry;
    this.clock = clock;
    this.scheduler = scheduler;
    this.maxConcurrency = maxConcurrency;
  }

  public Single<BatchResponse> execute(List<MetricQuery> queries, BatchContext context) {
    Preconditions.checkNotNull(queries);
    Preconditions.checkNotNull(context);
    List<MetricQuery> batch = List.copyOf(queries);

    return batchValidator
        .validate(batch)
        .andThen(Single.defer(() -> dispatch(batch, context)))
        .takeUntil(context.getCancellation())
        .onErrorResumeNext(error -> Single.error(toBatchError(error, context)))
        .doOnSuccess(
            response -> {
              log.debug(
                  "Batch of {} queries completed with {} errors",
                  response.size(),
                  response.getErrorCount());
              meterRegistry.counter(BATCHES_COUNTER, "status", "success").increment();
            })
        .doOnError(
            error -> {
              log.warn("Batch of {} queries failed: {}", batch.size(), error.getMessage());
              meterRegistry
                  .counter(BATCHES_COUNTER, "status", error.getClass().getSimpleName())
                  .increment();
            });
  }

  private Single<BatchResponse> dispatch(List<MetricQuery> batch, BatchContext context) {
    if (context.isCancelled()) {
      return Single.error(new CancellationException());
    }
    log.debug("Dispatching batch of {} queries", batch.size());
    return Observable.fromIterable(batch)
        .flatMap(query -> executeQuery(query).subscribeOn(scheduler).toObservable(), maxConcurrency)
        .toList()
        .map(results -> aggregate(batch, results));
  }

  private Single<ImmutablePair<String, QueryOutcome>> executeQuery(MetricQuery query) {
    return fetch(query)
        .map(response -> QueryOutcome.success(buildFrame(query, response)))
        .onErrorReturn(error -> QueryOutcome.failure(toQueryError(query, error)))
        .doOnSuccess(this::recordOutcome)
        .map(outcome -> ImmutablePair.of(query.getRefId(), outcome));
  }

  private Single<PromQLMetricResponse> fetch(MetricQuery query) {
    return Single.defer(
            () ->
                query.isRangeQuery()
                    ? prometheusClient.queryRange(
                        query.getExpression(), query.getStart(), query.getEnd(), query.getStep())
                    : prometheusClient.query(query.getExpression(), getEvalTime(query)))
        .onErrorResumeNext(
            error ->
                Single.error(
                    error instanceof QueryExecutionException
                        ? error
                        : QueryExecutionException.transport(
                            "Backend call failed: " + error.getMessage(), error)));
  }

  private Frame buildFrame(MetricQuery query, PromQLMetricResponse response) {
    try {
      List<Series> seriesList = resultParser.parse(response);
      TimeGrid grid =
          query.isRangeQuery()
              ? timeGridBuilder.forRange(query.getStart(), query.getEnd(), query.getStep())
              : timeGridBuilder.forObserved(seriesList);
      return frameAssembler.assemble(query, grid, seriesList, response.getWarnings());
    } catch (QueryExecutionException e) {
      throw e;
    } catch (RuntimeException e) {
      throw QueryExecutionException.malformedResponse(
          "Failed to build frame: " + e.getMessage(), e);
    }
  }

  private Instant getEvalTime(MetricQuery query) {
    return query.getEnd() != null ? query.getEnd() : clock.instant();
  }

  private QueryError toQueryError(MetricQuery query, Throwable error) {
    QueryError queryError =
        error instanceof QueryExecutionException
            ? ((QueryExecutionException) error).toQueryError()
            : QueryExecutionException.malformedResponse(String.valueOf(error.getMessage()), error)
                .toQueryError();
    log.warn(
        "Query {} failed with {}: {}",
        query.getRefId(),
        queryError.getType(),
        queryError.getMessage());
    return queryError;
  }

  private void recordOutcome(QueryOutcome outcome) {
    String errorType =
        outcome.getError().map(queryError -> queryError.getType().name()).orElse("none");
    meterRegistry
        .counter(
            QUERY_OUTCOMES_COUNTER,
            "status",
            outcome.isSuccess() ? "success" : "error",
            "errorType",
            errorType)
        .increment();
  }

  /* single merge step after all queries completed, restores the submission order */
  private BatchResponse aggregate(
      List<MetricQuery> batch, List<ImmutablePair<String, QueryOutcome>> results) {
    Map<String, QueryOutcome> outcomesByRefId =
        results.stream().collect(Collectors.toMap(ImmutablePair::getLeft, ImmutablePair::getRight));

    Map<String, QueryOutcome> orderedOutcomes = new LinkedHashMap<>();
    for (MetricQuery query : batch) {
      orderedOutcomes.put(query.getRefId(), outcomesByRefId.get(query.getRefId()));
    }
    Preconditions.checkState(
        orderedOutcomes.size() == batch.size() && !orderedOutcomes.containsValue(null),
        "Expected %s outcomes but got %s",
        batch.size(),
        results.size());
    return new BatchResponse(orderedOutcomes);
  }

  private Throwable toBatchError(Throwable error, BatchContext context) {
    if (error instanceof CancellationException || context.isCancelled()) {
      return new BatchCancelledException("Batch was cancelled before it completed");
    }
    return error;
  }
}
