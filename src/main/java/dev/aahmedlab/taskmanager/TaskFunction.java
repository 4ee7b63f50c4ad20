package dev.aahmedlab.taskmanager;

/**
 * The deferred computation carried by a {@link Task}.
 *
 * <p>Implementations report task-level failure by returning {@link TaskResult#failure(String,
 * int)}. An exception thrown from {@link #run()} is treated as a failure with {@link
 * TaskResult#EXCEPTION_ERROR_CODE}.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface TaskFunction {
  TaskResult run() throws Exception;
}
