package dev.aahmedlab.taskmanager;

/**
 * A named unit of deferred work.
 *
 * <p>Tasks are immutable. The id is assigned by {@link TaskScheduler#add(Task)}; a task built by
 * the caller carries {@link #UNASSIGNED_ID} until then.
 *
 * @since 1.0.0
 */
public final class Task {
  /**
   * Id of a task that has not been accepted by a scheduler.
   *
   * @since 1.0.0
   */
  public static final int UNASSIGNED_ID = -1;

  private final String name;
  private final TaskFunction function;
  private final String after;
  private final String pool;
  private final int id;

  private Task(String name, TaskFunction function, String after, String pool, int id) {
    this.name = name;
    this.function = function;
    this.after = after;
    this.pool = pool;
    this.id = id;
  }

  /**
   * Creates a task with no dependency whose result goes to the pool named after the task.
   *
   * @param name the task name
   * @param function the work to run
   * @return a new task
   * @throws NullPointerException if name or function is null
   * @since 1.0.0
   */
  public static Task of(String name, TaskFunction function) {
    return builder(name, function).build();
  }

  /**
   * Starts building a task.
   *
   * @param name the task name, need not be unique
   * @param function the work to run
   * @return a builder
   * @throws NullPointerException if name or function is null
   * @since 1.0.0
   */
  public static Builder builder(String name, TaskFunction function) {
    return new Builder(name, function);
  }

  /**
   * Returns the task name. Dependencies and the default pool refer to tasks by this name.
   *
   * @return the task name
   * @since 1.0.0
   */
  public String getName() {
    return name;
  }

  /**
   * Returns the work this task runs.
   *
   * @return the task function
   * @since 1.0.0
   */
  public TaskFunction getFunction() {
    return function;
  }

  /**
   * Returns the name of the task this one must run after, or an empty string if there is none.
   *
   * @return the dependency name
   * @since 1.0.0
   */
  public String getAfter() {
    return after;
  }

  /**
   * Returns true if this task must wait for another task to finish.
   *
   * @return true if {@link #getAfter()} is not empty
   * @since 1.0.0
   */
  public boolean hasDependency() {
    return !after.isEmpty();
  }

  /**
   * Returns the name of the pool that receives this task's result.
   *
   * @return the target pool name
   * @since 1.0.0
   */
  public String getPool() {
    return pool;
  }

  /**
   * Returns the id assigned when the task was accepted, or {@link #UNASSIGNED_ID}.
   *
   * @return the task id
   * @since 1.0.0
   */
  public int getId() {
    return id;
  }

  Task withId(int newId) {
    return new Task(name, function, after, pool, newId);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("Task[").append(name).append(", id=").append(id);
    if (hasDependency()) sb.append(", after=").append(after);
    if (!pool.equals(name)) sb.append(", pool=").append(pool);
    return sb.append(']').toString();
  }

  /**
   * Builder for {@link Task}.
   *
   * @since 1.0.0
   */
  public static final class Builder {
    private final String name;
    private final TaskFunction function;
    private String after = "";
    private String pool;

    private Builder(String name, TaskFunction function) {
      if (name == null) throw new NullPointerException("name");
      if (function == null) throw new NullPointerException("function");
      this.name = name;
      this.function = function;
      this.pool = name;
    }

    /**
     * Makes the task wait until a task with the given name has finished. Null or empty clears the
     * dependency.
     */
    public Builder after(String taskName) {
      this.after = taskName == null ? "" : taskName;
      return this;
    }

    /** Sets the target pool. Null or empty falls back to the task name. */
    public Builder pool(String poolName) {
      this.pool = poolName == null || poolName.isEmpty() ? name : poolName;
      return this;
    }

    public Task build() {
      return new Task(name, function, after, pool, UNASSIGNED_ID);
    }
  }
}
