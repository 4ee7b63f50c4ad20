package examples;

import dev.aahmedlab.taskmanager.Setting;
import dev.aahmedlab.taskmanager.Task;
import dev.aahmedlab.taskmanager.TaskResult;
import dev.aahmedlab.taskmanager.TaskScheduler;

/**
 * Example demonstrating basic usage of TaskScheduler.
 * This is not part of the API - just a demonstration.
 */
public class BasicUsageExample {
    public static void main(String[] args) {
        // Create a scheduler with four workers using factory method
        TaskScheduler scheduler = TaskScheduler.createDefault();
        scheduler.set(Setting.KILL_ON_EMPTY, true);

        // Fetch, then parse once the fetch has finished; both results land in "pipeline"
        scheduler.add(Task.builder("fetch", () -> TaskResult.success("raw data"))
            .pool("pipeline")
            .build());
        scheduler.add(Task.builder("parse", () -> TaskResult.success("parsed data"))
            .after("fetch")
            .pool("pipeline")
            .build());

        // Independent tasks get a pool named after themselves
        for (int i = 0; i < 10; i++) {
            final int taskId = i;
            scheduler.add("square-" + i, () -> TaskResult.success(String.valueOf(taskId * taskId)));
        }

        scheduler.start();
        try {
            scheduler.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.stop();
            return;
        }

        scheduler.pools().forEach((pool, results) -> System.out.println(pool + " -> " + results));
    }
}
