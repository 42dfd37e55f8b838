package com.work.anchor.core.exception;

import com.work.anchor.core.model.TransactionResponse;

/**
 * eth_sendRawTransaction 传输超时：节点可能已经收到交易，也可能没有。
 *
 * 交易哈希在签名后即可确定，pending 记录该哈希，引擎会把它计入尝试历史，
 * 之后若出现 nonce 冲突可以回扫确认。
 */
public class BroadcastTimeoutException extends AnchorException {

    private final TransactionResponse pending;

    public BroadcastTimeoutException(String message, TransactionResponse pending, Throwable cause) {
        super(message, cause);
        this.pending = pending;
    }

    public TransactionResponse getPending() {
        return pending;
    }
}
