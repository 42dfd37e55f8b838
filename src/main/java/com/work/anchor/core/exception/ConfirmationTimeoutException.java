package com.work.anchor.core.exception;

/**
 * 在截止时间内没有等到 receipt（或 RPC 传输超时）。下一次尝试会提价重发。
 */
public class ConfirmationTimeoutException extends AnchorException {

    public ConfirmationTimeoutException(String message) {
        super(message);
    }

    public ConfirmationTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
