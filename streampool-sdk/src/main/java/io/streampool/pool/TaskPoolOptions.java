package io.streampool.pool;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.uber.m3.tally.NoopScope;
import com.uber.m3.tally.Scope;
import java.time.Duration;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class TaskPoolOptions {

  private static final Logger log = LoggerFactory.getLogger(TaskPoolOptions.class);

  /** Value of {@link #getMaxThreads()} for a pool that spawns as many threads as the load needs. */
  public static final int UNLIMITED_THREADS = -1;

  public static Builder newBuilder() {
    return new Builder();
  }

  public static Builder newBuilder(TaskPoolOptions options) {
    return new Builder(options);
  }

  public static TaskPoolOptions getDefaultInstance() {
    return DEFAULT_INSTANCE;
  }

  private static final TaskPoolOptions DEFAULT_INSTANCE;

  static {
    DEFAULT_INSTANCE = TaskPoolOptions.newBuilder().validateAndBuildWithDefaults();
  }

  public static final class Builder {

    private static final String DEFAULT_NAME = "TaskPool";
    private static final Duration DEFAULT_KEEP_ALIVE_TIME = Duration.ofSeconds(10);

    private String name;
    private int maxThreads;
    private boolean exclusive;
    private Duration keepAliveTime;
    private Scope metricsScope;
    private Thread.UncaughtExceptionHandler uncaughtExceptionHandler;
    private Duration scheduleThreadStartTimeout;

    private Builder() {}

    private Builder(TaskPoolOptions o) {
      if (o == null) {
        return;
      }
      this.name = o.name;
      this.maxThreads = o.maxThreads;
      this.exclusive = o.exclusive;
      this.keepAliveTime = o.keepAliveTime;
      this.metricsScope = o.metricsScope;
      this.uncaughtExceptionHandler = o.uncaughtExceptionHandler;
      this.scheduleThreadStartTimeout = o.scheduleThreadStartTimeout;
    }

    /**
     * Name of the pool. Used as a prefix of the worker thread names, as the name of the schedule
     * thread, in the logging MDC of the running work items and as the {@link MetricsTag#TASK_POOL}
     * metrics tag.
     *
     * <p>Default is "TaskPool".
     */
    public Builder setName(String name) {
      this.name = name;
      return this;
    }

    /**
     * @param maxThreads maximum number of worker threads running work items of the pool at the same
     *     time. {@link #UNLIMITED_THREADS} lets the pool spawn a new thread whenever all existing
     *     ones are busy. Default is {@link #UNLIMITED_THREADS}, which is chosen if set to zero.
     * @return {@code this}
     */
    public Builder setMaxThreads(int maxThreads) {
      if (maxThreads < UNLIMITED_THREADS) {
        throw new IllegalArgumentException("Invalid maxThreads value: " + maxThreads);
      }
      this.maxThreads = maxThreads;
      return this;
    }

    /**
     * If set to true, all {@link #setMaxThreads(int) maxThreads} worker threads are started when
     * the pool is prepared and stay alive until cleanup. Otherwise threads are spawned lazily up to
     * the limit and exit after {@link #setKeepAliveTime(Duration)} of idleness.
     *
     * <p>An exclusive pool requires a bounded number of threads. Default is false.
     */
    public Builder setExclusive(boolean exclusive) {
      this.exclusive = exclusive;
      return this;
    }

    /**
     * Time an idle worker thread of a non-exclusive pool waits for new work before exiting. Default
     * is 10 seconds, which is chosen if set to null or zero.
     */
    public Builder setKeepAliveTime(@Nullable Duration keepAliveTime) {
      Preconditions.checkArgument(
          keepAliveTime == null || !keepAliveTime.isNegative(),
          "Negative keepAliveTime value: %s",
          keepAliveTime);
      this.keepAliveTime = keepAliveTime;
      return this;
    }

    /** Scope the pool reports its metrics to. Default is a scope that drops everything. */
    public Builder setMetricsScope(Scope metricsScope) {
      this.metricsScope = metricsScope;
      return this;
    }

    /**
     * Called with the exceptions escaping work items. The worker thread that ran the item keeps
     * serving the pool. Default handler logs the exception.
     */
    public Builder setUncaughtExceptionHandler(
        Thread.UncaughtExceptionHandler uncaughtExceptionHandler) {
      this.uncaughtExceptionHandler = uncaughtExceptionHandler;
      return this;
    }

    /**
     * Maximum time {@link TaskPool#acquireScheduleThread()} waits for a newly spawned schedule
     * thread to report that its loop is running. When it expires the acquisition fails with a
     * {@link io.streampool.failure.BackendAllocationException}.
     *
     * <p>Default is to wait without a limit.
     */
    public Builder setScheduleThreadStartTimeout(@Nullable Duration scheduleThreadStartTimeout) {
      Preconditions.checkArgument(
          scheduleThreadStartTimeout == null
              || (!scheduleThreadStartTimeout.isNegative() && !scheduleThreadStartTimeout.isZero()),
          "Non positive scheduleThreadStartTimeout value: %s",
          scheduleThreadStartTimeout);
      this.scheduleThreadStartTimeout = scheduleThreadStartTimeout;
      return this;
    }

    public TaskPoolOptions build() {
      return new TaskPoolOptions(
          name,
          maxThreads,
          exclusive,
          keepAliveTime,
          metricsScope,
          uncaughtExceptionHandler,
          scheduleThreadStartTimeout);
    }

    public TaskPoolOptions validateAndBuildWithDefaults() {
      Preconditions.checkState(maxThreads >= UNLIMITED_THREADS, "invalid maxThreads");
      Preconditions.checkState(
          !exclusive || maxThreads > 0, "exclusive pool requires a bounded maxThreads");
      Preconditions.checkState(
          keepAliveTime == null || !keepAliveTime.isNegative(), "negative keepAliveTime");

      return new TaskPoolOptions(
          Strings.isNullOrEmpty(name) ? DEFAULT_NAME : name,
          maxThreads == 0 ? UNLIMITED_THREADS : maxThreads,
          exclusive,
          keepAliveTime == null || keepAliveTime.isZero() ? DEFAULT_KEEP_ALIVE_TIME : keepAliveTime,
          metricsScope == null ? new NoopScope() : metricsScope,
          uncaughtExceptionHandler == null
              ? (t, e) -> log.error("Work item failed on thread {}", t.getName(), e)
              : uncaughtExceptionHandler,
          scheduleThreadStartTimeout);
    }
  }

  private final String name;
  private final int maxThreads;
  private final boolean exclusive;
  private final Duration keepAliveTime;
  private final Scope metricsScope;
  private final Thread.UncaughtExceptionHandler uncaughtExceptionHandler;
  private final Duration scheduleThreadStartTimeout;

  private TaskPoolOptions(
      String name,
      int maxThreads,
      boolean exclusive,
      Duration keepAliveTime,
      Scope metricsScope,
      Thread.UncaughtExceptionHandler uncaughtExceptionHandler,
      Duration scheduleThreadStartTimeout) {
    this.name = name;
    this.maxThreads = maxThreads;
    this.exclusive = exclusive;
    this.keepAliveTime = keepAliveTime;
    this.metricsScope = metricsScope;
    this.uncaughtExceptionHandler = uncaughtExceptionHandler;
    this.scheduleThreadStartTimeout = scheduleThreadStartTimeout;
  }

  public String getName() {
    return name;
  }

  public int getMaxThreads() {
    return maxThreads;
  }

  public boolean isUnlimited() {
    return maxThreads == UNLIMITED_THREADS;
  }

  public boolean isExclusive() {
    return exclusive;
  }

  public Duration getKeepAliveTime() {
    return keepAliveTime;
  }

  @Nonnull
  public Scope getMetricsScope() {
    return metricsScope;
  }

  public Thread.UncaughtExceptionHandler getUncaughtExceptionHandler() {
    return uncaughtExceptionHandler;
  }

  @Nullable
  public Duration getScheduleThreadStartTimeout() {
    return scheduleThreadStartTimeout;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    TaskPoolOptions that = (TaskPoolOptions) o;
    return maxThreads == that.maxThreads
        && exclusive == that.exclusive
        && Objects.equals(name, that.name)
        && Objects.equals(keepAliveTime, that.keepAliveTime)
        && Objects.equals(metricsScope, that.metricsScope)
        && Objects.equals(uncaughtExceptionHandler, that.uncaughtExceptionHandler)
        && Objects.equals(scheduleThreadStartTimeout, that.scheduleThreadStartTimeout);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        name,
        maxThreads,
        exclusive,
        keepAliveTime,
        metricsScope,
        uncaughtExceptionHandler,
        scheduleThreadStartTimeout);
  }

  @Override
  public String toString() {
    return "TaskPoolOptions{"
        + "name='"
        + name
        + '\''
        + ", maxThreads="
        + maxThreads
        + ", exclusive="
        + exclusive
        + ", keepAliveTime="
        + keepAliveTime
        + ", scheduleThreadStartTimeout="
        + scheduleThreadStartTimeout
        + '}';
  }
}
