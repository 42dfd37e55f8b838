package com.work.anchor.core.exception;

/**
 * 无法归类的传输层错误，保留原始信息后直接终止。
 */
public class UnhandledTransportException extends AnchorException {

    public UnhandledTransportException(String message) {
        super(message);
    }

    public UnhandledTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
