package com.prakash.planner.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.BAD_REQUEST) // Client input the planner cannot work with
public class InvalidScheduleRequestException extends RuntimeException {

    public InvalidScheduleRequestException(String message) {
        super(message);
    }

    public InvalidScheduleRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
