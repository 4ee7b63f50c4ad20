package dev.aahmedlab.taskmanager;

import java.util.Objects;

/**
 * Outcome of a task function: either a success value or a value paired with a non-zero error code.
 *
 * @since 1.0.0
 */
public final class TaskResult {
  /**
   * Error code recorded when a task function throws or returns {@code null}.
   *
   * @since 1.0.0
   */
  public static final int EXCEPTION_ERROR_CODE = -1;

  private final String value;
  private final int errorCode;

  private TaskResult(String value, int errorCode) {
    this.value = value == null ? "" : value;
    this.errorCode = errorCode;
  }

  /**
   * Creates a successful result.
   *
   * @param value the result value, {@code null} is stored as an empty string
   * @return a successful result
   * @since 1.0.0
   */
  public static TaskResult success(String value) {
    return new TaskResult(value, 0);
  }

  /**
   * Creates a failed result. The value is still published to the task's pool.
   *
   * @param value the result value, {@code null} is stored as an empty string
   * @param errorCode the error code, must not be 0
   * @return a failed result
   * @throws IllegalArgumentException if errorCode is 0
   * @since 1.0.0
   */
  public static TaskResult failure(String value, int errorCode) {
    if (errorCode == 0) throw new IllegalArgumentException("errorCode must be != 0");
    return new TaskResult(value, errorCode);
  }

  /**
   * Creates a result from a value and error code pair, where 0 means success.
   *
   * @param value the result value
   * @param errorCode 0 for success, anything else for failure
   * @return the matching result
   * @since 1.0.0
   */
  public static TaskResult of(String value, int errorCode) {
    return new TaskResult(value, errorCode);
  }

  /**
   * Returns true if the error code is 0.
   *
   * @return true for a successful result
   * @since 1.0.0
   */
  public boolean isSuccess() {
    return errorCode == 0;
  }

  /**
   * Returns the value published to the task's pool, never null.
   *
   * @return the result value
   * @since 1.0.0
   */
  public String getValue() {
    return value;
  }

  /**
   * Returns the error code, 0 for a successful result.
   *
   * @return the error code
   * @since 1.0.0
   */
  public int getErrorCode() {
    return errorCode;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof TaskResult)) return false;
    TaskResult other = (TaskResult) o;
    return errorCode == other.errorCode && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, errorCode);
  }

  @Override
  public String toString() {
    return isSuccess()
        ? "TaskResult[success, value=" + value + "]"
        : "TaskResult[failure, errorCode=" + errorCode + ", value=" + value + "]";
  }
}
