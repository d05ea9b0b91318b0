package com.github.mirrorfetch.service.state;

import com.github.mirrorfetch.model.TaskStatus;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for transfer task status transitions.
 *
 * Valid state flow:
 * <pre>
 * PENDING → IN_FLIGHT → COMPLETED
 *    ↓          ↓
 *    ↓        PAUSED → PENDING (resume)
 *    ↓          ↓
 *    └──────→ FAILED
 * </pre>
 * PENDING may also move straight to PAUSED or FAILED when a batch is cancelled or aborted
 * before the task was dispatched.
 */
@Component
@Slf4j
public class TransferStateMachine {

    private final Map<TaskStatus, Set<TaskStatus>> validTransitions;

    public TransferStateMachine() {
        validTransitions = new EnumMap<>(TaskStatus.class);
        initializeTransitions();
    }

    private void initializeTransitions() {
        validTransitions.put(TaskStatus.PENDING,
            EnumSet.of(TaskStatus.IN_FLIGHT, TaskStatus.PAUSED, TaskStatus.FAILED));

        validTransitions.put(TaskStatus.IN_FLIGHT,
            EnumSet.of(TaskStatus.COMPLETED, TaskStatus.PAUSED, TaskStatus.FAILED));

        // Resume
        validTransitions.put(TaskStatus.PAUSED, EnumSet.of(TaskStatus.PENDING));

        validTransitions.put(TaskStatus.COMPLETED, EnumSet.noneOf(TaskStatus.class));
        validTransitions.put(TaskStatus.FAILED, EnumSet.noneOf(TaskStatus.class));
    }

    /**
     * Check if a state transition is valid. Same state is always valid.
     */
    public boolean isValidTransition(@NonNull TaskStatus currentState, @NonNull TaskStatus newState) {
        if (currentState == newState) {
            return true;
        }

        Set<TaskStatus> allowedTransitions = validTransitions.get(currentState);
        return allowedTransitions != null && allowedTransitions.contains(newState);
    }

    /**
     * Validate and perform state transition.
     *
     * @return New state if valid, current state if invalid
     */
    public TaskStatus transition(
            @NonNull String taskId,
            @NonNull TaskStatus currentState,
            @NonNull TaskStatus newState) {

        if (isValidTransition(currentState, newState)) {
            if (currentState != newState) {
                log.debug("Task {} state transition: {} → {}", taskId, currentState, newState);
            }
            return newState;
        } else {
            log.warn("Task {} invalid state transition attempted: {} → {} (rejected)",
                    taskId, currentState, newState);
            return currentState;
        }
    }

    /**
     * Validate and perform state transition with exception on failure.
     *
     * @throws IllegalStateException if transition is invalid
     */
    public TaskStatus transitionOrThrow(
            @NonNull String taskId,
            @NonNull TaskStatus currentState,
            @NonNull TaskStatus newState) {

        if (!isValidTransition(currentState, newState)) {
            throw new IllegalStateException(String.format(
                    "Invalid state transition for task %s: %s → %s",
                    taskId, currentState, newState));
        }

        if (currentState != newState) {
            log.debug("Task {} state transition: {} → {}", taskId, currentState, newState);
        }
        return newState;
    }

    /**
     * A paused task found again by a later run goes back to PENDING before dispatch.
     */
    public boolean canResume(@NonNull TaskStatus currentState) {
        return currentState == TaskStatus.PAUSED;
    }
}
