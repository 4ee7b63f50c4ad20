package dev.aahmedlab.taskmanager;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Internal backlog of pending tasks together with the policy that decides which one runs next.
 * This class is package-private and not part of the public API.
 */
final class TaskQueue {
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition workAvailable = lock.newCondition();
  private final Deque<Task> queue = new ArrayDeque<>();
  private int nextId;
  private boolean closed;

  /**
   * Appends a task and assigns its id.
   *
   * @return the accepted copy of the task, carrying its id
   * @throws IllegalStateException if the queue is closed
   */
  @SuppressFBWarnings(
      value = "CWO_CLOSED_WITHOUT_OPENED",
      justification = "Lock is properly acquired before the try block and released in finally")
  public Task add(Task task) {
    if (task == null) throw new NullPointerException("task");
    lock.lock();
    try {
      if (closed) {
        throw new IllegalStateException("queue is closed");
      }
      Task accepted = task.withId(nextId++);
      queue.addLast(accepted);
      workAvailable.signal();
      return accepted;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes and returns the first eligible task, or null if none is eligible right now.
   *
   * <p>A task is eligible when it has no dependency or its dependency is in the done set. With
   * {@code inOrder} an ineligible front blocks the whole queue. Otherwise ineligible tasks are
   * rotated to the back, at most one full turn per call.
   */
  public Task pollEligible(DoneSet done, boolean inOrder) {
    lock.lock();
    try {
      if (closed) {
        return null;
      }
      for (int scanned = 0, size = queue.size(); scanned < size; scanned++) {
        Task head = queue.peekFirst();
        if (!head.hasDependency() || done.contains(head.getAfter())) {
          return queue.removeFirst();
        }
        if (inOrder) {
          return null;
        }
        queue.addLast(queue.removeFirst());
      }
      return null;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Waits until new work may be available: a task was added, a task finished, settings changed or
   * the queue was closed. Spurious and timed-out returns are expected; callers re-poll.
   */
  public void awaitWork(long timeout, TimeUnit unit) throws InterruptedException {
    lock.lock();
    try {
      if (!closed) {
        workAvailable.await(timeout, unit);
      }
    } finally {
      lock.unlock();
    }
  }

  public void signalWork() {
    lock.lock();
    try {
      workAvailable.signalAll();
    } finally {
      lock.unlock();
    }
  }

  public void close() {
    lock.lock();
    try {
      closed = true;
      workAvailable.signalAll();
    } finally {
      lock.unlock();
    }
  }

  public List<Task> drain() {
    lock.lock();
    try {
      List<Task> drained = new ArrayList<>(queue);
      queue.clear();
      return drained;
    } finally {
      lock.unlock();
    }
  }

  public List<String> names() {
    lock.lock();
    try {
      List<String> names = new ArrayList<>(queue.size());
      for (Task task : queue) {
        names.add(task.getName());
      }
      return names;
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return queue.size();
    } finally {
      lock.unlock();
    }
  }

  public boolean isEmpty() {
    lock.lock();
    try {
      return queue.isEmpty();
    } finally {
      lock.unlock();
    }
  }
}
