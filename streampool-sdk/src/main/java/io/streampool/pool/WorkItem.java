package io.streampool.pool;

import com.google.common.base.MoreObjects;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * One unit of work submitted to a {@link TaskPool}: a function together with the opaque context it
 * is called with. A work item runs at most once, further attempts to run it are rejected.
 */
public final class WorkItem {

  public static <C> WorkItem of(@Nonnull TaskFunction<C> function, @Nullable C context) {
    Objects.requireNonNull(function, "function");
    return new WorkItem(() -> function.run(context), function, context);
  }

  public static WorkItem of(@Nonnull Runnable runnable) {
    Objects.requireNonNull(runnable, "runnable");
    return new WorkItem(runnable::run, runnable, null);
  }

  private interface Body {
    void run() throws Exception;
  }

  private final Body body;
  private final Object function;
  private final Object context;
  private final AtomicBoolean consumed = new AtomicBoolean();

  private WorkItem(Body body, Object function, Object context) {
    this.body = body;
    this.function = function;
    this.context = context;
  }

  /**
   * Runs the function with its context.
   *
   * @throws IllegalStateException if the item already ran or started running
   * @throws Exception anything thrown by the function
   */
  public void run() throws Exception {
    if (!consumed.compareAndSet(false, true)) {
      throw new IllegalStateException("Work item already ran: " + this);
    }
    body.run();
  }

  /** @return true once {@link #run()} was called */
  public boolean isConsumed() {
    return consumed.get();
  }

  @Nullable
  public Object getContext() {
    return context;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("function", function)
        .add("context", context)
        .toString();
  }
}
