package com.consullo.toolsignal.core.events;

/**
 * Listener interface for grid range-changed notifications.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface RangeChangedListener {

  /**
   * Called after new output has been rendered.
   *
   * @param event event describing the changed rows
   */
  void onRangeChanged(RangeChangedEvent event);
}
