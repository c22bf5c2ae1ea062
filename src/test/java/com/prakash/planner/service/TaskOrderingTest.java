package com.prakash.planner.service;

import com.prakash.planner.model.PlanningTask;
import com.prakash.planner.model.TaskPriority;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TaskOrdering Unit Tests")
class TaskOrderingTest {

    private static PlanningTask task(String title, TaskPriority priority, Instant dueDate) {
        return PlanningTask.builder().title(title).priority(priority).dueDate(dueDate).build();
    }

    private static List<String> titles(List<PlanningTask> tasks) {
        return tasks.stream().map(PlanningTask::getTitle).toList();
    }

    @Test
    @DisplayName("Higher priority sorts first")
    void testSort_PriorityDescending() {
        List<PlanningTask> tasks = List.of(
                task("low", TaskPriority.LOW, null),
                task("urgent", TaskPriority.URGENT, null),
                task("medium", TaskPriority.MEDIUM, null),
                task("high", TaskPriority.HIGH, null));

        assertEquals(List.of("urgent", "high", "medium", "low"), titles(TaskOrdering.sort(tasks)));
    }

    @Test
    @DisplayName("Missing priority ranks as medium")
    void testSort_MissingPriorityIsMedium() {
        List<PlanningTask> tasks = List.of(
                task("low", TaskPriority.LOW, null),
                task("unset", null, null),
                task("high", TaskPriority.HIGH, null));

        assertEquals(List.of("high", "unset", "low"), titles(TaskOrdering.sort(tasks)));
    }

    @Test
    @DisplayName("Within equal priority, due dates come first and earlier due date wins")
    void testSort_DueDateTieBreak() {
        Instant early = Instant.parse("2024-03-05T10:00:00Z");
        Instant late = Instant.parse("2024-03-07T10:00:00Z");
        List<PlanningTask> tasks = List.of(
                task("no-due", TaskPriority.HIGH, null),
                task("late", TaskPriority.HIGH, late),
                task("early", TaskPriority.HIGH, early));

        assertEquals(List.of("early", "late", "no-due"), titles(TaskOrdering.sort(tasks)));
    }

    @Test
    @DisplayName("Priority outranks due date")
    void testSort_PriorityBeforeDueDate() {
        List<PlanningTask> tasks = List.of(
                task("medium-due", TaskPriority.MEDIUM, Instant.parse("2024-03-04T10:00:00Z")),
                task("high-no-due", TaskPriority.HIGH, null));

        assertEquals(List.of("high-no-due", "medium-due"), titles(TaskOrdering.sort(tasks)));
    }

    @Test
    @DisplayName("Full ties keep input order")
    void testSort_TiesKeepInputOrder() {
        Instant due = Instant.parse("2024-03-05T10:00:00Z");
        List<PlanningTask> tasks = List.of(
                task("first", TaskPriority.LOW, null),
                task("second", TaskPriority.LOW, null),
                task("third", TaskPriority.LOW, null),
                task("due-a", TaskPriority.MEDIUM, due),
                task("due-b", TaskPriority.MEDIUM, due));

        assertEquals(List.of("due-a", "due-b", "first", "second", "third"), titles(TaskOrdering.sort(tasks)));
    }

    @Test
    @DisplayName("Sorting does not modify the input list")
    void testSort_InputUntouched() {
        List<PlanningTask> tasks = new ArrayList<>(List.of(
                task("low", TaskPriority.LOW, null),
                task("urgent", TaskPriority.URGENT, null)));

        TaskOrdering.sort(tasks);

        assertEquals(List.of("low", "urgent"), titles(tasks));
    }
}
