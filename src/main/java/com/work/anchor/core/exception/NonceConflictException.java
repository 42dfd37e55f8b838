package com.work.anchor.core.exception;

/**
 * 节点报告 nonce 已被使用/过期。
 * 通常意味着之前某次超时的尝试实际上已经上链。
 */
public class NonceConflictException extends AnchorException {

    public NonceConflictException(String message) {
        super(message);
    }

    public NonceConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
