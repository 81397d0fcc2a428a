package com.example.playlistrouter.domain.filter;

public class FilterRuleException extends RuntimeException {

    public FilterRuleException(String message) {
        super(message);
    }

    public FilterRuleException(String message, Throwable cause) {
        super(message, cause);
    }
}
