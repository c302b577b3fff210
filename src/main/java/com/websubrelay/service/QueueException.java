package com.websubrelay.service;

/**
 * Raised when a job could not be handed to the queue transport.
 */
public class QueueException extends RuntimeException {
    public QueueException(String m) { super(m); }
    public QueueException(String m, Throwable c) { super(m, c); }
}
