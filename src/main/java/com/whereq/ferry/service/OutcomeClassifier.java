package com.whereq.ferry.service;

import com.whereq.ferry.dto.Operation;
import com.whereq.ferry.model.JobOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decides whether a finished operation succeeded by looking at its events
 */
@Slf4j
@Component
public class OutcomeClassifier {

    /**
     * A job failed if any event is a failure, or an action exited with a non-zero status.
     * The first failing event provides the message.
     */
    public JobOutcome classify(Operation operation) {
        List<Operation.Event> events = operation.getMetadata() == null
            ? null
            : operation.getMetadata().getEvents();
        if (events == null || events.isEmpty()) {
            return JobOutcome.success();
        }

        String failure = null;
        for (Operation.Event event : events) {
            log.debug(event.getDescription());

            String message = failureMessage(event);
            if (message != null) {
                log.debug(message);
                if (failure == null) {
                    failure = message;
                }
            }
        }
        return failure == null ? JobOutcome.success() : JobOutcome.failure(failure);
    }

    private static String failureMessage(Operation.Event event) {
        if (event.getFailed() != null) {
            return event.getFailed().getCode() + ": " + event.getFailed().getCause();
        }

        Operation.UnexpectedExitStatusEvent exit = event.getUnexpectedExitStatus();
        if (exit != null && exit.getExitStatus() != null && exit.getExitStatus() != 0) {
            String message = event.getDescription();
            if (exit.getStderr() != null) {
                message += ": " + exit.getStderr();
            }
            return message;
        }
        return null;
    }
}
