package com.websubrelay.service;

public class FeedParseException extends Exception {
    public FeedParseException(String m, Throwable c) { super(m, c); }
}
