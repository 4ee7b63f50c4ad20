package dev.aahmedlab.taskmanager;

/**
 * Callbacks invoked around task and worker transitions. All methods default to no-ops.
 *
 * <p>Hooks run synchronously on the worker thread that triggers them; a slow hook stalls that
 * worker. Exceptions thrown by a hook are logged and otherwise ignored.
 *
 * @since 1.0.0
 */
public interface TaskHooks {
  /**
   * Hooks that do nothing.
   *
   * @since 1.0.0
   */
  TaskHooks NONE = new TaskHooks() {};

  /** Called on the worker right before the task's function runs. */
  default void onTaskStart(Task task, int workerId) {}

  /** Called when the task's function returned a successful result. */
  default void onTaskStop(Task task, int workerId) {}

  /** Called instead of {@link #onTaskStop} when the task returned a non-zero error code. */
  default void onTaskFail(Task task, int workerId, int errorCode) {}

  /** Called once per worker before it takes its first task. */
  default void onWorkerStart(int workerId) {}

  /** Called once per worker when it exits. */
  default void onWorkerStop(int workerId) {}
}
