package io.reminder4j.core;

/**
 * Delivery of a notification failed.
 */
public class NotifyException extends Exception {

    public NotifyException(String message) {
        super(message);
    }

    public NotifyException(String message, Throwable cause) {
        super(message, cause);
    }
}
