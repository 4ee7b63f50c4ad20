package dev.aahmedlab.taskmanager;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/** Append-only record of the names of finished tasks, used to resolve dependencies. */
final class DoneSet {
  private final ReentrantLock lock = new ReentrantLock();
  private final List<String> order = new ArrayList<>();
  private final Set<String> names = new HashSet<>();

  public void add(String name) {
    lock.lock();
    try {
      order.add(name);
      names.add(name);
    } finally {
      lock.unlock();
    }
  }

  public boolean contains(String name) {
    lock.lock();
    try {
      return names.contains(name);
    } finally {
      lock.unlock();
    }
  }

  /** Names in completion order; a name finished twice appears twice. */
  public List<String> names() {
    lock.lock();
    try {
      return new ArrayList<>(order);
    } finally {
      lock.unlock();
    }
  }
}
