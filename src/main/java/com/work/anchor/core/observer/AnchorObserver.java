package com.work.anchor.core.observer;

import com.work.anchor.core.model.TransactionReceipt;
import com.work.anchor.core.model.TransactionRequest;

import java.math.BigInteger;

/**
 * 可观测性端口（不强依赖具体日志/metrics 实现）。
 *
 * 核心路径只调用接口；事件名与负载形状固定。金额单位均为 wei。
 * 实现不应抛异常，也不应影响提交流程。
 */
public interface AnchorObserver {

    /**
     * txCost 在估算 gas 阶段即失败时为 null
     */
    default void insufficientFunds(BigInteger txCost, BigInteger balance) {
    }

    default void transactionTimeout(long timeoutSecs) {
    }

    default void nonceExpired(BigInteger nonce) {
    }

    default void txRequest(TransactionRequest request) {
    }

    default void txResponse(String hash, Long blockNumber, String blockHash, String from) {
    }

    default void txReceipt(TransactionReceipt receipt) {
    }

    default void walletBalance(BigInteger balance) {
    }
}
