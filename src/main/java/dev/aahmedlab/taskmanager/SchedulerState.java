package dev.aahmedlab.taskmanager;

/**
 * Lifecycle state of the task scheduler. This enum is package-private and not part of the public
 * API. Use the public boolean methods (isRunning(), isPaused(), isStopped()) to check state.
 */
enum SchedulerState {
  IDLE,
  RUNNING,
  PAUSED,
  STOPPING,
  STOPPED
}
