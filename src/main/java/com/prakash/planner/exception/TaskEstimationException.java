package com.prakash.planner.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.BAD_GATEWAY) // The model behind the estimation agent failed
public class TaskEstimationException extends RuntimeException {

    public TaskEstimationException(String message, Throwable cause) {
        super(message, cause);
    }
}
