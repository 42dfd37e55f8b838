package com.work.anchor.core.signer;

import com.work.anchor.core.model.BlockInfo;
import com.work.anchor.core.model.ChainId;
import com.work.anchor.core.model.FeeEstimate;
import com.work.anchor.core.model.TransactionReceipt;
import com.work.anchor.core.model.TransactionRequest;
import com.work.anchor.core.model.TransactionResponse;

import java.math.BigInteger;
import java.util.Optional;

/**
 * 链交互与签名的最小端口。
 *
 * 实现方负责把底层传输错误归类为 {@link com.work.anchor.core.exception} 中的封闭集合：
 * InsufficientFunds / NonceConflict / ConfirmationTimeout / UnhandledTransport。
 * 引擎内部不再解析原始错误信息。
 */
public interface Signer {

    /**
     * 签名账户地址。
     */
    String getAddress();

    /**
     * 查询链 ID，引擎仅在 connect 时调用一次并缓存。
     */
    ChainId getChainId();

    BigInteger getNonce(String address);

    BigInteger getBalance(String address);

    FeeEstimate getFeeEstimate();

    BigInteger estimateGas(TransactionRequest request);

    /**
     * 签名并广播。返回的响应尚未确认。
     */
    TransactionResponse broadcast(TransactionRequest request);

    /**
     * 等待 receipt 达到指定确认深度。超时返回 empty。
     */
    Optional<TransactionReceipt> waitForReceipt(String txHash, int confirmations, long timeoutMs);

    /**
     * 按区块 hash 查询区块。区块不存在返回 null。
     */
    BlockInfo getBlock(String blockHash);
}
