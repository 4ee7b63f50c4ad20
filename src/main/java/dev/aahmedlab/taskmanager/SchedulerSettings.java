package dev.aahmedlab.taskmanager;

import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/** Policy flags of a scheduler, read at each scheduling decision. */
final class SchedulerSettings {
  private final ReentrantLock lock = new ReentrantLock();
  private final EnumSet<Setting> enabled = EnumSet.noneOf(Setting.class);

  SchedulerSettings(Set<Setting> initial) {
    enabled.addAll(initial);
  }

  public void set(Setting setting, boolean value) {
    if (setting == null) throw new NullPointerException("setting");
    lock.lock();
    try {
      if (value) {
        enabled.add(setting);
      } else {
        enabled.remove(setting);
      }
    } finally {
      lock.unlock();
    }
  }

  public boolean get(Setting setting) {
    if (setting == null) throw new NullPointerException("setting");
    lock.lock();
    try {
      return enabled.contains(setting);
    } finally {
      lock.unlock();
    }
  }
}
