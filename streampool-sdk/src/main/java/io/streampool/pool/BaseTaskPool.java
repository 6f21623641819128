package io.streampool.pool;

import com.uber.m3.tally.Scope;
import com.uber.m3.util.ImmutableMap;
import io.streampool.internal.schedule.ScheduleThreadManager;
import io.streampool.schedule.ScheduleContext;
import io.streampool.schedule.ScheduleThreadState;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * Base of task pools providing the options handling and the reference counted schedule thread.
 * Subclasses define how work items are run by overriding the {@link TaskPool} lifecycle methods.
 */
public abstract class BaseTaskPool implements TaskPool {

  private final TaskPoolOptions options;
  private final Scope metricsScope;
  private final boolean processDefault;
  private final ScheduleThreadManager scheduleThreadManager;

  protected BaseTaskPool(@Nonnull TaskPoolOptions options) {
    this(options, false);
  }

  BaseTaskPool(@Nonnull TaskPoolOptions options, boolean processDefault) {
    this.options = TaskPoolOptions.newBuilder(options).validateAndBuildWithDefaults();
    this.processDefault = processDefault;
    Map<String, String> tags =
        new ImmutableMap.Builder<String, String>(1)
            .put(MetricsTag.TASK_POOL, this.options.getName())
            .build();
    this.metricsScope = this.options.getMetricsScope().tagged(tags);
    this.scheduleThreadManager =
        new ScheduleThreadManager(
            this.options.getName(),
            !processDefault,
            this.options.getScheduleThreadStartTimeout(),
            this.options.getUncaughtExceptionHandler(),
            metricsScope);
  }

  @Override
  public final boolean acquireScheduleThread() {
    return scheduleThreadManager.acquire();
  }

  @Override
  public final boolean releaseScheduleThread() {
    return scheduleThreadManager.release();
  }

  @Override
  public final Optional<ScheduleContext> getScheduleContext() {
    return scheduleThreadManager.getContext();
  }

  public final ScheduleThreadState getScheduleThreadState() {
    return scheduleThreadManager.getState();
  }

  public final TaskPoolOptions getOptions() {
    return options;
  }

  public final String getName() {
    return options.getName();
  }

  /** Scope of the options tagged with the pool name. */
  protected final Scope getMetricsScope() {
    return metricsScope;
  }

  final boolean isProcessDefault() {
    return processDefault;
  }

  final ScheduleThreadManager getScheduleThreadManager() {
    return scheduleThreadManager;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{name=" + getName() + '}';
  }
}
