package com.example.scheduler.service;

import com.example.scheduler.scheduling.TimerRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
public class SchedulerMetrics {

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> dispatchCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> restoreCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> dependencyErrorCounters = new ConcurrentHashMap<>();

  public SchedulerMetrics(MeterRegistry meterRegistry, TimerRegistry timerRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder("scheduler.timers.armed", timerRegistry, TimerRegistry::size)
        .description("Timers currently armed in memory")
        .register(meterRegistry);
    Gauge.builder("scheduler.timers.unarmed", timerRegistry, TimerRegistry::unarmedCount)
        .description("Stored messages whose timer was dropped after a store failure")
        .register(meterRegistry);
  }

  public void recordDispatch(String result) {
    dispatchCounters.computeIfAbsent(result, this::registerDispatchCounter).increment();
  }

  public void recordRestore(String result) {
    restoreCounters.computeIfAbsent(result, this::registerRestoreCounter).increment();
  }

  public void recordDependencyError(String errorType) {
    dependencyErrorCounters
        .computeIfAbsent(errorType, this::registerDependencyErrorCounter)
        .increment();
  }

  private Counter registerDispatchCounter(String result) {
    return Counter.builder("scheduler.dispatch.total")
        .tags(Tags.of("result", result))
        .register(meterRegistry);
  }

  private Counter registerRestoreCounter(String result) {
    return Counter.builder("scheduler.restore.total")
        .tags(Tags.of("result", result))
        .register(meterRegistry);
  }

  private Counter registerDependencyErrorCounter(String errorType) {
    return Counter.builder("scheduler.dependency.error.total")
        .tags(Tags.of("type", errorType))
        .register(meterRegistry);
  }
}
