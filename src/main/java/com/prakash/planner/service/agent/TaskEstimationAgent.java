package com.prakash.planner.service.agent;

import com.prakash.planner.dto.AiTaskEstimate;
import com.prakash.planner.exception.TaskEstimationException;
import com.prakash.planner.model.PlanningTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.chat.prompt.PromptTemplate;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Fills in the duration and priority of tasks that arrive without them, using the configured
 * chat model. Fields the caller supplied are never overwritten.
 */
@Service
public class TaskEstimationAgent {

    private static final Logger log = LoggerFactory.getLogger(TaskEstimationAgent.class);

    private final ChatModel chatModel;

    private final String estimationPromptTemplate = """
            You are an expert personal productivity assistant. Estimate the following task.
            Task Title: "{title}"
            Task Type: "{type}"

            Determine the following:
            1.  Priority: one of LOW, MEDIUM, HIGH, URGENT. Consider urgency, importance, and keywords.
            2.  Estimated Duration (minutes): the focused working time needed, as a positive integer.

            {format}
            """;

    @Autowired
    public TaskEstimationAgent(ChatModel chatModel) {
        this.chatModel = chatModel;
    }

    public static boolean needsEstimate(PlanningTask task) {
        return task.getPriority() == null
                || task.getEstimatedDuration() == null
                || task.getEstimatedDuration() <= 0;
    }

    /**
     * Returns the task with missing fields filled from the model's estimate, or the task itself
     * when nothing is missing.
     *
     * @throws TaskEstimationException if the model call fails or its reply cannot be parsed
     */
    public PlanningTask estimate(PlanningTask task) {
        if (!needsEstimate(task)) {
            return task;
        }
        AiTaskEstimate estimate = requestEstimate(task);

        PlanningTask.PlanningTaskBuilder builder = task.toBuilder();
        if (task.getPriority() == null && estimate.getPriority() != null) {
            builder.priority(estimate.getPriority());
        }
        boolean durationMissing = task.getEstimatedDuration() == null || task.getEstimatedDuration() <= 0;
        Integer minutes = estimate.getEstimatedDurationMinutes();
        if (durationMissing && minutes != null && minutes > 0) {
            builder.estimatedDuration(minutes);
        } else if (durationMissing) {
            log.warn("No usable duration estimate for task '{}'; the default duration applies.", task.getTitle());
        }
        PlanningTask estimated = builder.build();
        log.debug("Estimated task '{}': priority={}, duration={}", task.getTitle(),
                estimated.getPriority(), estimated.getEstimatedDuration());
        return estimated;
    }

    private AiTaskEstimate requestEstimate(PlanningTask task) {
        BeanOutputConverter<AiTaskEstimate> outputConverter = new BeanOutputConverter<>(AiTaskEstimate.class);
        PromptTemplate promptTemplate = new PromptTemplate(estimationPromptTemplate);
        Prompt prompt = promptTemplate.create(Map.of(
                "title", task.getTitle(),
                "type", task.getType() != null ? task.getType() : "unspecified",
                "format", outputConverter.getFormat()
        ));
        log.debug("Sending estimation prompt to AI: \n{}", prompt.getContents());
        try {
            ChatResponse chatResponse = chatModel.call(prompt);
            String rawResponse = chatResponse.getResult().getOutput().getText();
            log.debug("Received raw AI response: \n{}", rawResponse);
            AiTaskEstimate estimate = outputConverter.convert(rawResponse);
            if (estimate == null) {
                throw new IllegalStateException("Empty estimate returned by model");
            }
            return estimate;
        } catch (Exception e) {
            log.error("AI estimation failed for task '{}': {}", task.getTitle(), e.getMessage(), e);
            throw new TaskEstimationException("Failed to estimate task '" + task.getTitle() + "' using AI", e);
        }
    }
}
