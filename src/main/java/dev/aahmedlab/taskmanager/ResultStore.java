package dev.aahmedlab.taskmanager;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Named pools of published task results, keyed by per-pool slot id. This class is package-private
 * and not part of the public API.
 *
 * <p>Slot counters live under their own lock and are never reset, so clearing a pool leaves a gap
 * and the next result continues the numbering.
 */
final class ResultStore {
  private final ReentrantLock poolsLock = new ReentrantLock();
  private final ReentrantLock slotLock = new ReentrantLock();
  private final Map<String, SortedMap<Integer, String>> pools = new LinkedHashMap<>();
  private final Map<String, Integer> nextSlots = new HashMap<>();

  /**
   * Stores a result in the named pool, creating the pool on first use.
   *
   * @return the slot id the result was stored under
   */
  public int publish(String poolName, String value) {
    int slot = nextSlot(poolName);
    poolsLock.lock();
    try {
      pools.computeIfAbsent(poolName, k -> new TreeMap<>()).put(slot, value);
    } finally {
      poolsLock.unlock();
    }
    return slot;
  }

  private int nextSlot(String poolName) {
    slotLock.lock();
    try {
      int slot = nextSlots.getOrDefault(poolName, 0);
      nextSlots.put(poolName, slot + 1);
      return slot;
    } finally {
      slotLock.unlock();
    }
  }

  public Map<String, SortedMap<Integer, String>> pools() {
    poolsLock.lock();
    try {
      Map<String, SortedMap<Integer, String>> copy = new LinkedHashMap<>();
      for (Map.Entry<String, SortedMap<Integer, String>> entry : pools.entrySet()) {
        copy.put(entry.getKey(), new TreeMap<>(entry.getValue()));
      }
      return copy;
    } finally {
      poolsLock.unlock();
    }
  }

  public SortedMap<Integer, String> pool(String name) {
    poolsLock.lock();
    try {
      SortedMap<Integer, String> pool = pools.get(name);
      return pool == null ? new TreeMap<>() : new TreeMap<>(pool);
    } finally {
      poolsLock.unlock();
    }
  }

  public void clearPool(String name) {
    poolsLock.lock();
    try {
      SortedMap<Integer, String> pool = pools.get(name);
      if (pool != null) {
        pool.clear();
      }
    } finally {
      poolsLock.unlock();
    }
  }
}
