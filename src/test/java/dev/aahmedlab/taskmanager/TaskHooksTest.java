package dev.aahmedlab.taskmanager;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TaskHooksTest {

  private TaskScheduler scheduler;

  @AfterEach
  void tearDown() throws InterruptedException {
    if (scheduler != null) {
      TaskSchedulerTestSupport.stopAndJoin(scheduler, 2, TimeUnit.SECONDS);
    }
  }

  @Test
  void failedTaskIsStillDoneAndPublished() throws Exception {
    var hooks = new TaskSchedulerTestSupport.RecordingHooks();
    scheduler = TaskSchedulerTestSupport.createDrainingScheduler(2, hooks);
    scheduler.add("broken", TaskSchedulerTestSupport.failingWith("partial output", 7));

    scheduler.start();
    assertTrue(scheduler.join(2, TimeUnit.SECONDS));

    assertTrue(scheduler.isCompleted("broken"));
    assertEquals("partial output", scheduler.pool("broken").get(0));
    assertEquals(1, hooks.count("fail:broken:7"));
    assertEquals(0, hooks.count("stop:broken"));
  }

  @Test
  void hooksFireInOrderForSingleWorker() throws Exception {
    var hooks = new TaskSchedulerTestSupport.RecordingHooks();
    scheduler = TaskSchedulerTestSupport.createDrainingScheduler(1, hooks);
    scheduler.add("a", TaskSchedulerTestSupport.returning("a"));
    scheduler.add("b", TaskSchedulerTestSupport.failingWith("b", 2));

    scheduler.start();
    assertTrue(scheduler.join(2, TimeUnit.SECONDS));

    assertEquals(
        List.of(
            "worker-start:0", "start:a", "stop:a", "start:b", "fail:b:2", "worker-stop:0"),
        hooks.events);
  }

  @Test
  void workerHooksRunOncePerWorker() throws Exception {
    var hooks = new TaskSchedulerTestSupport.RecordingHooks();
    scheduler = TaskSchedulerTestSupport.createDrainingScheduler(3, hooks);

    scheduler.start();
    assertTrue(scheduler.join(2, TimeUnit.SECONDS));

    for (int i = 0; i < 3; i++) {
      assertEquals(1, hooks.count("worker-start:" + i));
      assertEquals(1, hooks.count("worker-stop:" + i));
    }
    assertEquals(6, hooks.events.size());
  }

  @Test
  void throwingFunctionIsRecordedAsFailure() throws Exception {
    var hooks = new TaskSchedulerTestSupport.RecordingHooks();
    scheduler = TaskSchedulerTestSupport.createDrainingScheduler(1, hooks);
    scheduler.add(
        "throws",
        () -> {
          throw new IllegalStateException("boom");
        });
    scheduler.add("after-throw", TaskSchedulerTestSupport.returning("still runs"));

    scheduler.start();
    assertTrue(scheduler.join(2, TimeUnit.SECONDS));

    assertEquals(1, hooks.count("fail:throws:" + TaskResult.EXCEPTION_ERROR_CODE));
    assertTrue(scheduler.pool("throws").get(0).contains("boom"));
    assertEquals(List.of("throws", "after-throw"), scheduler.completedTasks());
  }

  @Test
  void nullResultIsRecordedAsFailure() throws Exception {
    var hooks = new TaskSchedulerTestSupport.RecordingHooks();
    scheduler = TaskSchedulerTestSupport.createDrainingScheduler(1, hooks);
    scheduler.add("null", () -> null);

    scheduler.start();
    assertTrue(scheduler.join(2, TimeUnit.SECONDS));

    assertEquals(1, hooks.count("fail:null:" + TaskResult.EXCEPTION_ERROR_CODE));
    assertEquals("", scheduler.pool("null").get(0));
  }

  @Test
  void throwingHookDoesNotStopWorker() throws Exception {
    AtomicInteger starts = new AtomicInteger();
    TaskHooks hooks =
        new TaskHooks() {
          @Override
          public void onTaskStart(Task task, int workerId) {
            starts.incrementAndGet();
            throw new RuntimeException("hook failure");
          }
        };
    scheduler = TaskSchedulerTestSupport.createDrainingScheduler(1, hooks);
    for (int i = 0; i < 5; i++) {
      scheduler.add("task-" + i, TaskSchedulerTestSupport.returning(""));
    }

    scheduler.start();
    assertTrue(scheduler.join(2, TimeUnit.SECONDS));

    assertEquals(5, starts.get());
    assertEquals(5, scheduler.completedTasks().size());
  }

  @Test
  void hooksReceiveAcceptedTaskWithId() throws Exception {
    AtomicInteger seenId = new AtomicInteger(Task.UNASSIGNED_ID);
    TaskHooks hooks =
        new TaskHooks() {
          @Override
          public void onTaskStop(Task task, int workerId) {
            seenId.set(task.getId());
          }
        };
    scheduler = TaskSchedulerTestSupport.createDrainingScheduler(1, hooks);
    scheduler.add("first", TaskSchedulerTestSupport.returning(""));
    int id = scheduler.add("second", TaskSchedulerTestSupport.returning(""));

    scheduler.start();
    assertTrue(scheduler.join(2, TimeUnit.SECONDS));

    assertEquals(id, seenId.get());
  }

  @Test
  void interruptRaisedByTaskDoesNotReachNextTaskOrStopWorker() throws Exception {
    var hooks = new TaskSchedulerTestSupport.RecordingHooks();
    scheduler = TaskSchedulerTestSupport.createScheduler(1, hooks);
    scheduler.add(
        "throws-interrupt",
        () -> {
          throw new InterruptedException("from task");
        });
    scheduler.add(
        "leaves-flag",
        () -> {
          Thread.currentThread().interrupt();
          return TaskResult.success("flagged");
        });
    scheduler.add(
        "sleepy",
        () -> {
          Thread.sleep(10);
          return TaskResult.success("slept");
        });

    scheduler.start();
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
    while (!scheduler.isCompleted("sleepy") && System.nanoTime() < deadline) {
      Thread.sleep(10);
    }

    assertEquals(1, hooks.count("fail:throws-interrupt:" + TaskResult.EXCEPTION_ERROR_CODE));
    assertEquals(1, hooks.count("stop:leaves-flag"));
    assertEquals(1, hooks.count("stop:sleepy"));
    assertEquals("slept", scheduler.pool("sleepy").get(0));

    assertFalse(scheduler.join(200, TimeUnit.MILLISECONDS), "Worker must outlive the interrupt");
    assertTrue(scheduler.isRunning());
    assertEquals(0, hooks.count("worker-stop:0"));
  }

  @Test
  void errorThrownByFunctionIsRecordedAsFailure() throws Exception {
    var hooks = new TaskSchedulerTestSupport.RecordingHooks();
    scheduler = TaskSchedulerTestSupport.createDrainingScheduler(1, hooks);
    scheduler.add(
        "bad",
        () -> {
          throw new AssertionError("broken invariant");
        });
    scheduler.add(
        Task.builder("next", TaskSchedulerTestSupport.returning("n")).after("bad").build());

    scheduler.start();
    assertTrue(scheduler.join(2, TimeUnit.SECONDS));

    assertEquals(List.of("bad", "next"), scheduler.completedTasks());
    assertEquals(1, hooks.count("fail:bad:" + TaskResult.EXCEPTION_ERROR_CODE));
    assertTrue(scheduler.pool("bad").get(0).contains("broken invariant"));
    assertEquals("n", scheduler.pool("next").get(0));
    assertEquals(1, hooks.count("worker-start:0"));
    assertEquals(1, hooks.count("worker-stop:0"));
  }

  @Test
  void errorThrownByHookDoesNotStopWorker() throws Exception {
    TaskHooks hooks =
        new TaskHooks() {
          @Override
          public void onTaskStop(Task task, int workerId) {
            throw new AssertionError("hook error");
          }
        };
    scheduler = TaskSchedulerTestSupport.createDrainingScheduler(1, hooks);
    for (int i = 0; i < 3; i++) {
      scheduler.add("task-" + i, TaskSchedulerTestSupport.returning("v" + i));
    }

    scheduler.start();
    assertTrue(scheduler.join(2, TimeUnit.SECONDS));

    assertEquals(List.of("task-0", "task-1", "task-2"), scheduler.completedTasks());
    assertEquals("v2", scheduler.pool("task-2").get(0));
  }
}
