package com.work.anchor.core.model;

/**
 * 广播结果（尚未确认）。blockNumber/blockHash 在广播时通常为空。
 */
public class TransactionResponse {

    private final String hash;
    private final ChainId chainId;
    private final Long blockNumber;
    private final String blockHash;
    private final String from;
    private final String rawData;

    public TransactionResponse(String hash, ChainId chainId, Long blockNumber, String blockHash, String from, String rawData) {
        this.hash = hash;
        this.chainId = chainId;
        this.blockNumber = blockNumber;
        this.blockHash = blockHash;
        this.from = from;
        this.rawData = rawData;
    }

    public String getHash() {
        return hash;
    }

    public ChainId getChainId() {
        return chainId;
    }

    public Long getBlockNumber() {
        return blockNumber;
    }

    public String getBlockHash() {
        return blockHash;
    }

    public String getFrom() {
        return from;
    }

    public String getRawData() {
        return rawData;
    }
}
