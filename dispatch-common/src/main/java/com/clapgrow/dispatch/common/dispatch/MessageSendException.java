package com.clapgrow.dispatch.common.dispatch;

/**
 * Stands in as the "last fault" for a failed attempt that reported an error without raising one.
 */
public class MessageSendException extends RuntimeException {

    public MessageSendException(String message) {
        super(message);
    }
}
