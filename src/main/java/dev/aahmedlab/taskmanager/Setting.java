package dev.aahmedlab.taskmanager;

/**
 * Runtime policy flags of a {@link TaskScheduler}. Both are off by default.
 *
 * @since 1.0.0
 */
public enum Setting {
  /**
   * Idle workers exit instead of waiting when the queue is empty. Once every worker has exited the
   * scheduler is stopped.
   *
   * @since 1.0.0
   */
  KILL_ON_EMPTY,

  /**
   * A task at the front of the queue whose dependency has not finished blocks the queue, instead of
   * being rotated to the back.
   *
   * @since 1.0.0
   */
  IN_ORDER
}
