package com.prakash.planner.service;

import com.prakash.planner.model.PlanningTask;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Total order in which the planner commits tasks.
 * <ol>
 *     <li>priority rank, highest first (urgent, high, medium, low)</li>
 *     <li>tasks with a due date before tasks without one</li>
 *     <li>earlier due date first</li>
 *     <li>original input position</li>
 * </ol>
 * The last key makes the order total, so the result never depends on the sort's stability.
 */
public final class TaskOrdering {

    static final Comparator<IndexedTask> ORDER = Comparator
            .comparingInt((IndexedTask t) -> t.task().effectivePriority().getRank()).reversed()
            .thenComparing(t -> t.task().getDueDate(), Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparingInt(IndexedTask::index);

    private TaskOrdering() {
    }

    public static List<PlanningTask> sort(List<PlanningTask> tasks) {
        List<IndexedTask> indexed = new ArrayList<>(tasks.size());
        for (int i = 0; i < tasks.size(); i++) {
            indexed.add(new IndexedTask(tasks.get(i), i));
        }
        indexed.sort(ORDER);
        return indexed.stream().map(IndexedTask::task).toList();
    }

    record IndexedTask(PlanningTask task, int index) {
    }
}
