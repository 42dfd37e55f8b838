package com.work.anchor.core.exception;

/**
 * 锚定引擎的统一异常类型，submit 失败时调用方只需捕获该类型即可。
 */
public class AnchorException extends RuntimeException {

    public AnchorException(String message) {
        super(message);
    }

    public AnchorException(String message, Throwable cause) {
        super(message, cause);
    }
}
