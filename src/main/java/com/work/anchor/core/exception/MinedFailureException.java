package com.work.anchor.core.exception;

/**
 * 交易已打包但 receipt status=failure（revert）。当前策略：不重试。
 */
public class MinedFailureException extends AnchorException {

    private final String transactionHash;

    public MinedFailureException(String transactionHash) {
        super("Transaction completed with a failure status. txHash=" + transactionHash);
        this.transactionHash = transactionHash;
    }

    public String getTransactionHash() {
        return transactionHash;
    }
}
