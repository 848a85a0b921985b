package com.flagship.payday.command;

/**
 * The command is not valid for the aggregate's current state or its input is malformed.
 * Not retried.
 */
public class CommandRejectedException extends RuntimeException {

    public CommandRejectedException(String message) {
        super(message);
    }
}
