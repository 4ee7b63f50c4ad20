package dev.aahmedlab.taskmanager;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A fixed-size worker pool that runs named tasks with soft dependency ordering and publishes their
 * results into named result pools.
 *
 * <p>Tasks may be added at any time before {@link #stop()}, including from inside a running task.
 * A task that declares a dependency ({@link Task#getAfter()}) only runs once a task with that name
 * has finished. Finished tasks deposit their result value into their target pool under the next
 * slot id of that pool, whether they succeeded or failed.
 *
 * <p>The scheduler is created idle; {@link #start()} spawns the workers. Two runtime policies are
 * available through {@link #set(Setting, boolean)}: {@link Setting#KILL_ON_EMPTY} and {@link
 * Setting#IN_ORDER}.
 *
 * <p>A dependency naming a task that never runs is not detected: the dependent task stays queued
 * forever.
 *
 * @author Abdullah Ahmed
 * @since 1.0.0
 */
public final class TaskScheduler {
  private static final Logger logger = LoggerFactory.getLogger(TaskScheduler.class);

  private static final int DEFAULT_WORKER_COUNT = 4;
  private static final long IDLE_WAIT_MILLIS = 50;

  private final int workerCount;
  private final TaskHooks hooks;
  private final TaskQueue taskQueue = new TaskQueue();
  private final DoneSet doneSet = new DoneSet();
  private final ResultStore resultStore = new ResultStore();
  private final SchedulerSettings settings;
  private final List<Thread> workerThreads;
  private final ReentrantLock stateLock = new ReentrantLock();
  private final Condition stateChanged = stateLock.newCondition();
  private volatile SchedulerState state = SchedulerState.IDLE;
  private Thread orchestrator;

  /**
   * Creates an idle task scheduler.
   *
   * @param workerCount the number of worker threads spawned by {@link #start()}
   * @param hooks callbacks invoked around task and worker transitions
   * @param initialSettings the settings enabled from the start
   * @throws IllegalArgumentException if workerCount is less than or equal to 0
   * @throws NullPointerException if hooks or initialSettings is null
   * @since 1.0.0
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Hooks are caller-owned callbacks and are meant to be shared")
  public TaskScheduler(int workerCount, TaskHooks hooks, Set<Setting> initialSettings) {
    if (workerCount <= 0) throw new IllegalArgumentException("workerCount must be > 0");
    if (hooks == null) throw new NullPointerException("hooks");
    if (initialSettings == null) throw new NullPointerException("initialSettings");
    this.workerCount = workerCount;
    this.hooks = hooks;
    this.settings = new SchedulerSettings(initialSettings);
    this.workerThreads = new ArrayList<>(workerCount);
  }

  /**
   * Creates an idle task scheduler with all settings off.
   *
   * @param workerCount the number of worker threads spawned by {@link #start()}
   * @param hooks callbacks invoked around task and worker transitions
   * @throws IllegalArgumentException if workerCount is less than or equal to 0
   * @throws NullPointerException if hooks is null
   * @since 1.0.0
   */
  public TaskScheduler(int workerCount, TaskHooks hooks) {
    this(workerCount, hooks, Set.of());
  }

  /**
   * Creates an idle task scheduler without hooks and with all settings off.
   *
   * @param workerCount the number of worker threads
   * @return a new TaskScheduler instance
   * @throws IllegalArgumentException if workerCount is less than or equal to 0
   * @since 1.0.0
   */
  public static TaskScheduler create(int workerCount) {
    return new TaskScheduler(workerCount, TaskHooks.NONE);
  }

  /**
   * Creates an idle task scheduler with four workers.
   *
   * @return a new TaskScheduler instance
   * @since 1.0.0
   */
  public static TaskScheduler createDefault() {
    return create(DEFAULT_WORKER_COUNT);
  }

  /**
   * Creates an idle task scheduler with one worker per available processor.
   *
   * @return a new TaskScheduler instance
   * @since 1.0.0
   */
  public static TaskScheduler createCpuBound() {
    return create(Runtime.getRuntime().availableProcessors());
  }

  /**
   * Adds a task to the back of the queue.
   *
   * @param task the task to run
   * @return the id assigned to the task
   * @throws NullPointerException if task is null
   * @throws RejectedExecutionException if the scheduler has been stopped
   * @since 1.0.0
   */
  public int add(Task task) {
    if (task == null) throw new NullPointerException("task");
    try {
      Task accepted = taskQueue.add(task);
      logger.debug("Accepted {}", accepted);
      return accepted.getId();
    } catch (IllegalStateException stateException) {
      throw new RejectedExecutionException("Scheduler is stopped", stateException);
    }
  }

  /**
   * Adds a task with no dependency whose result goes to the pool named after the task.
   *
   * @param name the task name
   * @param function the work to run
   * @return the id assigned to the task
   * @throws NullPointerException if name or function is null
   * @throws RejectedExecutionException if the scheduler has been stopped
   * @since 1.0.0
   */
  public int add(String name, TaskFunction function) {
    return add(Task.of(name, function));
  }

  /**
   * Starts or resumes consuming the queue.
   *
   * <p>The first call spawns the worker threads and an orchestrator thread that waits for them to
   * exit. Calling this while running has no effect.
   *
   * @throws IllegalStateException if the scheduler is stopping or stopped
   * @since 1.0.0
   */
  public void start() {
    stateLock.lock();
    try {
      switch (state) {
        case RUNNING -> {
          return;
        }
        case STOPPING, STOPPED -> throw new IllegalStateException("Scheduler is stopped");
        case PAUSED -> {
          state = SchedulerState.RUNNING;
          stateChanged.signalAll();
          logger.debug("Scheduler resumed");
        }
        case IDLE -> {
          state = SchedulerState.RUNNING;
          spawnThreads();
          logger.debug("Scheduler started with {} workers", workerCount);
        }
        default -> throw new AssertionError("Unhandled state: " + state);
      }
    } finally {
      stateLock.unlock();
    }
  }

  // Called with stateLock held.
  private void spawnThreads() {
    try {
      for (int i = 0; i < workerCount; i++) {
        Thread t = new Thread(new Worker(i), "tm-worker-" + i);
        t.setDaemon(true);
        t.start();
        workerThreads.add(t);
      }
      orchestrator = new Thread(this::awaitWorkers, "tm-orchestrator");
      orchestrator.setDaemon(true);
      orchestrator.start();
    } catch (RuntimeException | Error e) {
      logger.error("Failed to start scheduler threads", e);
      state = SchedulerState.STOPPED;
      taskQueue.close();
      stateChanged.signalAll();
      throw e;
    }
  }

  /**
   * Pauses consumption. Tasks already running finish; no new task is taken until {@link #start()}
   * is called again. Has no effect unless the scheduler is running.
   *
   * @since 1.0.0
   */
  public void pause() {
    stateLock.lock();
    try {
      if (state == SchedulerState.RUNNING) {
        state = SchedulerState.PAUSED;
        logger.debug("Scheduler paused");
      }
    } finally {
      stateLock.unlock();
    }
  }

  /**
   * Stops the scheduler.
   *
   * <p>This method:
   *
   * <ul>
   *   <li>Closes the task queue (new tasks will be rejected)
   *   <li>Wakes paused and idle workers so they exit
   *   <li>Lets tasks that are already running complete and publish their results
   *   <li>Returns the tasks that were still queued; they never run
   * </ul>
   *
   * <p>The scheduler reaches the stopped state once every worker has exited; use {@link #join()}
   * to wait for it. Calling this again has no effect and returns an empty list.
   *
   * @return tasks that never began execution, in queue order
   * @since 1.0.0
   */
  public List<Task> stop() {
    stateLock.lock();
    try {
      if (state == SchedulerState.STOPPING || state == SchedulerState.STOPPED) {
        return Collections.emptyList();
      }
      state = orchestrator == null ? SchedulerState.STOPPED : SchedulerState.STOPPING;
      taskQueue.close();
      stateChanged.signalAll();
      logger.debug("Scheduler stop requested, state is now {}", state);
    } finally {
      stateLock.unlock();
    }
    return taskQueue.drain();
  }

  /**
   * Blocks until the scheduler has stopped, either through {@link #stop()} or because every worker
   * exited under {@link Setting#KILL_ON_EMPTY}. Must not be called from a task.
   *
   * @throws InterruptedException if interrupted while waiting
   * @since 1.0.0
   */
  public void join() throws InterruptedException {
    stateLock.lock();
    try {
      while (state != SchedulerState.STOPPED) {
        stateChanged.await();
      }
    } finally {
      stateLock.unlock();
    }
  }

  /**
   * Blocks until the scheduler has stopped, or the timeout occurs, or the current thread is
   * interrupted, whichever happens first.
   *
   * @param timeout the maximum time to wait
   * @param unit the time unit of the timeout argument
   * @return true if the scheduler stopped and false if the timeout elapsed first
   * @throws InterruptedException if interrupted while waiting
   * @since 1.0.0
   */
  @SuppressFBWarnings(
      value = "CWO_CLOSED_WITHOUT_OPENED",
      justification = "Lock is properly acquired before the try block and released in finally")
  public boolean join(long timeout, TimeUnit unit) throws InterruptedException {
    long remainingNanos = unit.toNanos(timeout);
    stateLock.lock();
    try {
      while (state != SchedulerState.STOPPED) {
        if (remainingNanos <= 0) {
          return false;
        }
        remainingNanos = stateChanged.awaitNanos(remainingNanos);
      }
      return true;
    } finally {
      stateLock.unlock();
    }
  }

  /**
   * Returns true if the queue is empty at this instant. Tasks may still be running; use {@link
   * #join()} to wait for them.
   *
   * @return true if no task is pending
   * @since 1.0.0
   */
  public boolean isDone() {
    return taskQueue.isEmpty();
  }

  /**
   * Returns the names of the tasks still pending in the queue, in queue order. Running and finished
   * tasks are not included; see {@link #completedTasks()}.
   *
   * @return a snapshot of pending task names
   * @since 1.0.0
   */
  public List<String> tasks() {
    return taskQueue.names();
  }

  /**
   * Returns the names of finished tasks, successful or not, in completion order.
   *
   * @return a snapshot of finished task names
   * @since 1.0.0
   */
  public List<String> completedTasks() {
    return doneSet.names();
  }

  /**
   * Returns true if a task with this name has finished.
   *
   * @param name the task name
   * @return true if the name is in the done set
   * @since 1.0.0
   */
  public boolean isCompleted(String name) {
    return doneSet.contains(name);
  }

  /**
   * Turns a setting on or off. The change applies from the next scheduling decision on; tasks
   * already taken are not affected.
   *
   * @param setting the setting to change
   * @param value the new value
   * @throws NullPointerException if setting is null
   * @since 1.0.0
   */
  public void set(Setting setting, boolean value) {
    settings.set(setting, value);
    taskQueue.signalWork();
  }

  /**
   * Returns the current value of a setting.
   *
   * @param setting the setting to read
   * @return true if the setting is on
   * @throws NullPointerException if setting is null
   * @since 1.0.0
   */
  public boolean get(Setting setting) {
    return settings.get(setting);
  }

  /**
   * Returns a point-in-time copy of every pool. Later results are not reflected in the copy.
   *
   * @return pool name to (slot id to result value)
   * @since 1.0.0
   */
  public Map<String, SortedMap<Integer, String>> pools() {
    return resultStore.pools();
  }

  /**
   * Returns a copy of one pool, or an empty map if no result was ever published to it.
   *
   * @param name the pool name
   * @return slot id to result value
   * @since 1.0.0
   */
  public SortedMap<Integer, String> pool(String name) {
    return resultStore.pool(name);
  }

  /**
   * Removes every result of one pool. Other pools are untouched, and slot ids of the cleared pool
   * keep counting from where they were. Unknown names are ignored.
   *
   * @param name the pool name
   * @since 1.0.0
   */
  public void clearPool(String name) {
    resultStore.clearPool(name);
  }

  /**
   * Returns true if workers are consuming the queue.
   *
   * @return true if running
   * @since 1.0.0
   */
  public boolean isRunning() {
    return state == SchedulerState.RUNNING;
  }

  /**
   * Returns true if the scheduler is paused.
   *
   * @return true if paused
   * @since 1.0.0
   */
  public boolean isPaused() {
    return state == SchedulerState.PAUSED;
  }

  /**
   * Returns true if the scheduler has stopped and every worker has exited.
   *
   * @return true if stopped
   * @since 1.0.0
   */
  public boolean isStopped() {
    return state == SchedulerState.STOPPED;
  }

  SchedulerState getState() {
    return state;
  }

  /**
   * Returns the number of worker threads this scheduler runs.
   *
   * @return the number of workers
   * @since 1.0.0
   */
  public int getWorkerCount() {
    return workerCount;
  }

  /**
   * Returns the current number of pending tasks.
   *
   * @return the number of queued tasks
   * @since 1.0.0
   */
  public int getQueueSize() {
    return taskQueue.size();
  }

  private void awaitWorkers() {
    try {
      for (Thread workerThread : workerThreads) {
        workerThread.join();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.warn("Orchestrator interrupted before all workers exited");
    }

    stateLock.lock();
    try {
      if (state != SchedulerState.STOPPING) {
        state = SchedulerState.STOPPING;
        logger.debug("All workers exited on their own, stopping");
      }
      taskQueue.close();
      state = SchedulerState.STOPPED;
      stateChanged.signalAll();
      logger.debug("Scheduler stopped");
    } finally {
      stateLock.unlock();
    }
  }

  private boolean isStopRequested() {
    SchedulerState current = state;
    return current == SchedulerState.STOPPING || current == SchedulerState.STOPPED;
  }

  /** Waits while paused. Returns false once a stop has been requested. */
  private boolean awaitNotPaused() throws InterruptedException {
    if (state == SchedulerState.RUNNING) {
      return true;
    }
    stateLock.lock();
    try {
      while (state == SchedulerState.PAUSED) {
        stateChanged.await();
      }
      return state == SchedulerState.RUNNING;
    } finally {
      stateLock.unlock();
    }
  }

  private final class Worker implements Runnable {
    private final int id;

    Worker(int id) {
      this.id = id;
    }

    @Override
    public void run() {
      logger.debug("Worker {} started", id);
      invokeHook("onWorkerStart", () -> hooks.onWorkerStart(id));
      try {
        while (true) {
          if (isStopRequested() || !awaitNotPaused()) {
            return;
          }

          Task task = taskQueue.pollEligible(doneSet, settings.get(Setting.IN_ORDER));
          if (task == null) {
            // Nothing eligible: either the queue is empty or every pending task waits on a
            // dependency.
            if (settings.get(Setting.KILL_ON_EMPTY) && taskQueue.isEmpty()) {
              logger.debug("Worker {} found the queue empty, exiting", id);
              return;
            }
            taskQueue.awaitWork(IDLE_WAIT_MILLIS, TimeUnit.MILLISECONDS);
            continue;
          }

          runTask(task);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } finally {
        invokeHook("onWorkerStop", () -> hooks.onWorkerStop(id));
        logger.debug("Worker {} stopped", id);
      }
    }

    private void runTask(Task task) {
      invokeHook("onTaskStart", () -> hooks.onTaskStart(task, id));
      TaskResult result = execute(task);
      if (result.isSuccess()) {
        invokeHook("onTaskStop", () -> hooks.onTaskStop(task, id));
      } else {
        invokeHook("onTaskFail", () -> hooks.onTaskFail(task, id, result.getErrorCode()));
      }

      // The result goes in before the name so a dependent task always sees it.
      int slot = resultStore.publish(task.getPool(), result.getValue());
      doneSet.add(task.getName());
      taskQueue.signalWork();
      logger.debug(
          "Worker {} finished {} with error code {}, published to {}[{}]",
          id,
          task,
          result.getErrorCode(),
          task.getPool(),
          slot);
    }

    private TaskResult execute(Task task) {
      try {
        TaskResult result = task.getFunction().run();
        if (result == null) {
          logger.error("{} returned no result", task);
          return TaskResult.of("", TaskResult.EXCEPTION_ERROR_CODE);
        }
        return result;
      } catch (Throwable t) {
        logger.error("Exception occurred while executing {}", task, t);
        return TaskResult.of(t.toString(), TaskResult.EXCEPTION_ERROR_CODE);
      } finally {
        // stop() never interrupts workers, so an interrupt here belongs to the task alone.
        if (Thread.interrupted()) {
          logger.debug("Worker {} cleared interrupt left by {}", id, task);
        }
      }
    }

    private void invokeHook(String hookName, Runnable hook) {
      try {
        hook.run();
      } catch (Throwable t) {
        logger.warn("Hook {} threw on worker {}", hookName, id, t);
      }
    }
  }
}
