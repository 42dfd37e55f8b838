package com.work.anchor.core.model;

/**
 * 最小 receipt 表达。
 *
 * 在 EVM 语义中，只要 receipt 出现就意味着该 nonce 已被链消耗（无论 success=true/false）。
 */
public class TransactionReceipt {

    private final String hash;
    private final long blockNumber;
    private final String blockHash;
    private final boolean success;

    public TransactionReceipt(String hash, long blockNumber, String blockHash, boolean success) {
        this.hash = hash;
        this.blockNumber = blockNumber;
        this.blockHash = blockHash;
        this.success = success;
    }

    public String getHash() {
        return hash;
    }

    public long getBlockNumber() {
        return blockNumber;
    }

    public String getBlockHash() {
        return blockHash;
    }

    public boolean isSuccess() {
        return success;
    }

    public String getStatus() {
        return success ? "success" : "failure";
    }
}
