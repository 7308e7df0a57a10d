package com.consullo.toolsignal.watch;

import com.consullo.toolsignal.core.TerminalGrid;
import com.consullo.toolsignal.scan.RowTextCache;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for components that read a {@link TerminalGrid}, derive a value, and report it only when it changes.
 *
 * <p>Derived state is computed on the watcher's own background context. Each changed value crosses into the
 * delivery executor (the consumer's designated context) with a single enqueue. Every attachment gets a fresh
 * generation number; a delivery runs only if the generation it was computed under is still current, so once
 * {@link #detach()} returns nothing computed under the old attachment reaches a listener, even if a scan was in flight.
 *
 * @since 1.0
 */
public abstract class AbstractGridWatcher implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(AbstractGridWatcher.class);

  private final Object lock = new Object();
  private final Executor deliveryExecutor;
  private final String name;

  private long generation;
  private boolean closed;
  private volatile Attachment attachment;

  /**
   * The grid a watcher is currently attached to, with the state that lives exactly as long as the attachment.
   *
   * @param grid attached grid
   * @param generation generation number issued at attach time
   * @param rowCache per-attachment row cache for watchers that diff rows
   */
  protected record Attachment(TerminalGrid grid, long generation, RowTextCache rowCache) {
  }

  protected AbstractGridWatcher(final String name, final Executor deliveryExecutor) {
    Validate.notBlank(name, "name must not be blank");
    Validate.notNull(deliveryExecutor, "deliveryExecutor must not be null");
    this.name = name;
    this.deliveryExecutor = deliveryExecutor;
  }

  /**
   * Attaches to a grid, detaching from any previous one first.
   *
   * @param grid grid to watch
   * @throws IllegalStateException if the watcher has been closed
   */
  public final void attach(final TerminalGrid grid) {
    Validate.notNull(grid, "grid must not be null");
    synchronized (lock) {
      if (closed) {
        throw new IllegalStateException(name + " is closed");
      }
      detach();
      generation++;
      Attachment a = new Attachment(grid, generation, new RowTextCache());
      attachment = a;
      onAttach(a);
      LOGGER.info("{} attached (generation {})", name, a.generation());
    }
  }

  /**
   * Detaches from the current grid. Idempotent and safe to call concurrently with an in-flight scan; no value is
   * delivered to a listener after this method returns.
   */
  public final void detach() {
    synchronized (lock) {
      Attachment a = attachment;
      if (a == null) {
        return;
      }
      attachment = null;
      generation++;
      onDetach(a);
      LOGGER.info("{} detached (generation {})", name, a.generation());
    }
  }

  public final boolean isAttached() {
    return attachment != null;
  }

  /**
   * Detaches and closes the watcher. A closed watcher cannot be attached again. Idempotent.
   */
  @Override
  public void close() {
    synchronized (lock) {
      closed = true;
      detach();
    }
  }

  /**
   * Returns the current attachment, or null when detached. Scans read this once and use the result throughout.
   *
   * @return current attachment
   */
  protected final Attachment currentAttachment() {
    return attachment;
  }

  /**
   * Enqueues one changed value for delivery to a listener.
   *
   * @param source attachment the value was computed under
   * @param listener listener to notify; nothing is enqueued when null
   * @param value changed value
   * @param <V> value type
   */
  protected final <V> void deliver(final Attachment source, final Consumer<? super V> listener, final V value) {
    if (listener == null) {
      return;
    }
    try {
      deliveryExecutor.execute(() -> {
        synchronized (lock) {
          if (generation != source.generation()) {
            LOGGER.debug("{} dropped stale value {} from generation {}", name, value, source.generation());
            return;
          }
          try {
            listener.accept(value);
          } catch (RuntimeException e) {
            LOGGER.warn("{} listener failed for value {}: {}", name, value, e.getMessage(), e);
          }
        }
      });
    } catch (RejectedExecutionException e) {
      LOGGER.debug("{} delivery executor rejected value {}", name, value);
    }
  }

  /**
   * Hook invoked under the lifecycle lock right after a new attachment is installed.
   *
   * @param a new attachment
   */
  protected abstract void onAttach(Attachment a);

  /**
   * Hook invoked under the lifecycle lock right after an attachment is removed.
   *
   * @param a removed attachment
   */
  protected abstract void onDetach(Attachment a);

  protected final String name() {
    return name;
  }
}
