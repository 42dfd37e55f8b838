package com.work.anchor.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * 锚定成功后的最终产物，仅在 receipt status=success 时产生。
 */
public final class AnchorTransaction {

    private final String chainId;
    private final String transactionHash;
    private final long blockNumber;
    private final Instant blockTimestamp;

    public AnchorTransaction(String chainId, String transactionHash, long blockNumber, Instant blockTimestamp) {
        this.chainId = chainId;
        this.transactionHash = transactionHash;
        this.blockNumber = blockNumber;
        this.blockTimestamp = blockTimestamp;
    }

    /**
     * CAIP-2 形式的链 ID。
     */
    public String getChainId() {
        return chainId;
    }

    public String getTransactionHash() {
        return transactionHash;
    }

    public long getBlockNumber() {
        return blockNumber;
    }

    public Instant getBlockTimestamp() {
        return blockTimestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnchorTransaction)) return false;
        AnchorTransaction that = (AnchorTransaction) o;
        return blockNumber == that.blockNumber
                && Objects.equals(chainId, that.chainId)
                && Objects.equals(transactionHash, that.transactionHash)
                && Objects.equals(blockTimestamp, that.blockTimestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(chainId, transactionHash, blockNumber, blockTimestamp);
    }

    @Override
    public String toString() {
        return "AnchorTransaction{chainId=" + chainId + ", transactionHash=" + transactionHash
                + ", blockNumber=" + blockNumber + ", blockTimestamp=" + blockTimestamp + "}";
    }
}
