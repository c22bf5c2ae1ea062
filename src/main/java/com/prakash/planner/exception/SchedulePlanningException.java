package com.prakash.planner.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.INTERNAL_SERVER_ERROR)
public class SchedulePlanningException extends RuntimeException {

    public SchedulePlanningException(String message, Throwable cause) {
        super(message, cause);
    }
}
