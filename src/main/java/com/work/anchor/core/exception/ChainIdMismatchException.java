package com.work.anchor.core.exception;

import com.work.anchor.core.model.ChainId;

/**
 * 节点返回的 chainId 与 connect 时缓存的不一致，必须终止。
 */
public class ChainIdMismatchException extends AnchorException {

    private final ChainId expected;
    private final ChainId actual;

    public ChainIdMismatchException(ChainId expected, ChainId actual) {
        super("Chain ID of connected blockchain changed from " + expected.toCaip() + " to " + actual.toCaip());
        this.expected = expected;
        this.actual = actual;
    }

    public ChainId getExpected() {
        return expected;
    }

    public ChainId getActual() {
        return actual;
    }
}
