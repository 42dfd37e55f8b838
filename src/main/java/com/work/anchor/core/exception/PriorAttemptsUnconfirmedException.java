package com.work.anchor.core.exception;

/**
 * nonce 冲突后回扫历史尝试，没有任何一笔能确认成功。
 */
public class PriorAttemptsUnconfirmedException extends AnchorException {

    public PriorAttemptsUnconfirmedException(String message, Throwable cause) {
        super(message, cause);
    }
}
