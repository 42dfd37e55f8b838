package com.work.anchor.chain.web3j;

import com.work.anchor.core.exception.AnchorException;
import com.work.anchor.core.exception.BroadcastTimeoutException;
import com.work.anchor.core.exception.ConfirmationTimeoutException;
import com.work.anchor.core.model.BlockInfo;
import com.work.anchor.core.model.ChainId;
import com.work.anchor.core.model.FeeEstimate;
import com.work.anchor.core.model.TransactionReceipt;
import com.work.anchor.core.model.TransactionRequest;
import com.work.anchor.core.model.TransactionResponse;
import com.work.anchor.core.signer.Signer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Hash;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionEncoder;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthBlock;
import org.web3j.protocol.core.methods.response.EthGetTransactionReceipt;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * 基于 Web3j 的 Signer 实现：
 * - eth_chainId / eth_getTransactionCount / eth_getBalance
 * - 费用估计：最新区块 baseFeePerGas + eth_maxPriorityFeePerGas（EIP-1559），
 *   区块没有 baseFee 时退回 eth_gasPrice
 * - 本地私钥签名后 eth_sendRawTransaction
 * - 轮询 eth_getTransactionReceipt 直到达到确认深度或超时
 *
 * 所有 RPC 错误在此处经 {@link Web3jErrorClassifier} 归类后抛出。
 */
public class Web3jSigner implements Signer {

    private static final Logger log = LoggerFactory.getLogger(Web3jSigner.class);

    /**
     * maxFeePerGas = 2 * baseFee + priorityFee，给 baseFee 上涨留出余量。
     */
    private static final BigInteger BASE_FEE_MULTIPLIER = BigInteger.valueOf(2);

    private final Web3j web3j;
    private final Credentials credentials;
    private final Duration receiptPollInterval;

    /**
     * 首次查询后缓存，签名始终使用该链 ID
     */
    private volatile ChainId chainId;

    public Web3jSigner(Web3j web3j, Credentials credentials, Duration receiptPollInterval) {
        this.web3j = web3j;
        this.credentials = credentials;
        this.receiptPollInterval = receiptPollInterval;
    }

    @Override
    public String getAddress() {
        return credentials.getAddress();
    }

    @Override
    public ChainId getChainId() {
        ChainId current = chainId;
        if (current == null) {
            current = ChainId.of(send(web3j.ethChainId(), "eth_chainId").getChainId().longValue());
            chainId = current;
        }
        return current;
    }

    @Override
    public BigInteger getNonce(String address) {
        return send(web3j.ethGetTransactionCount(address, DefaultBlockParameterName.LATEST), "eth_getTransactionCount")
                .getTransactionCount();
    }

    @Override
    public BigInteger getBalance(String address) {
        return send(web3j.ethGetBalance(address, DefaultBlockParameterName.LATEST), "eth_getBalance").getBalance();
    }

    @Override
    public FeeEstimate getFeeEstimate() {
        EthBlock.Block latest = send(web3j.ethGetBlockByNumber(DefaultBlockParameterName.LATEST, false),
                "eth_getBlockByNumber").getBlock();
        String rawBaseFee = latest == null ? null : latest.getBaseFeePerGasRaw();
        if (rawBaseFee != null) {
            BigInteger baseFee = Numeric.decodeQuantity(rawBaseFee);
            BigInteger priorityFee = send(web3j.ethMaxPriorityFeePerGas(), "eth_maxPriorityFeePerGas")
                    .getMaxPriorityFeePerGas();
            return FeeEstimate.feeMarket(baseFee.multiply(BASE_FEE_MULTIPLIER).add(priorityFee), priorityFee);
        }
        return FeeEstimate.legacy(send(web3j.ethGasPrice(), "eth_gasPrice").getGasPrice());
    }

    @Override
    public BigInteger estimateGas(TransactionRequest request) {
        Transaction tx = Transaction.createFunctionCallTransaction(
                request.getFrom(),
                request.getNonce(),
                request.getGasPrice(),
                null,
                request.getTo(),
                BigInteger.ZERO,
                request.getData());
        return send(web3j.ethEstimateGas(tx), "eth_estimateGas").getAmountUsed();
    }

    @Override
    public TransactionResponse broadcast(TransactionRequest request) {
        ChainId signingChainId = getChainId();
        byte[] signed;
        if (request.isFeeMarket()) {
            RawTransaction raw = RawTransaction.createTransaction(signingChainId.getValue(), request.getNonce(),
                    request.getGasLimit(), request.getTo(), BigInteger.ZERO, request.getData(),
                    request.getMaxPriorityFeePerGas(), request.getMaxFeePerGas());
            signed = TransactionEncoder.signMessage(raw, credentials);
        } else {
            RawTransaction raw = RawTransaction.createTransaction(request.getNonce(), request.getGasPrice(),
                    request.getGasLimit(), request.getTo(), BigInteger.ZERO, request.getData());
            signed = TransactionEncoder.signMessage(raw, signingChainId.getValue(), credentials);
        }
        String rawHex = Numeric.toHexString(signed);
        String txHash = Numeric.toHexString(Hash.sha3(signed));
        EthSendTransaction resp;
        try {
            resp = send(web3j.ethSendRawTransaction(rawHex), "eth_sendRawTransaction");
        } catch (ConfirmationTimeoutException e) {
            log.warn("eth_sendRawTransaction timed out txHash={} nonce={}", txHash, request.getNonce());
            TransactionResponse pending = new TransactionResponse(txHash, signingChainId, null, null,
                    credentials.getAddress(), rawHex);
            throw new BroadcastTimeoutException(e.getMessage(), pending, e.getCause());
        }
        return new TransactionResponse(resp.getTransactionHash(), signingChainId, null, null,
                credentials.getAddress(), rawHex);
    }

    @Override
    public Optional<TransactionReceipt> waitForReceipt(String txHash, int confirmations, long timeoutMs) {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (true) {
            try {
                Optional<TransactionReceipt> receipt = fetchConfirmedReceipt(txHash, confirmations);
                if (receipt.isPresent()) {
                    return receipt;
                }
            } catch (AnchorException e) {
                // 轮询期间的 RPC 抖动不终止等待，超时由 deadline 兜底
                log.warn("getReceipt error txHash={} err={}", txHash, e.getMessage());
            }

            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                return Optional.empty();
            }
            try {
                Thread.sleep(Math.min(remaining, receiptPollInterval.toMillis()));
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new AnchorException("Interrupted while waiting for receipt of " + txHash, ie);
            }
        }
    }

    private Optional<TransactionReceipt> fetchConfirmedReceipt(String txHash, int confirmations) {
        EthGetTransactionReceipt resp = send(web3j.ethGetTransactionReceipt(txHash), "eth_getTransactionReceipt");
        Optional<org.web3j.protocol.core.methods.response.TransactionReceipt> receiptOpt = resp.getTransactionReceipt();
        if (!receiptOpt.isPresent()) {
            return Optional.empty();
        }
        org.web3j.protocol.core.methods.response.TransactionReceipt r = receiptOpt.get();
        long receiptBlock = r.getBlockNumber().longValue();
        long latest = send(web3j.ethBlockNumber(), "eth_blockNumber").getBlockNumber().longValue();
        // confirmations = latest - receiptBlock + 1
        if (latest - receiptBlock + 1 < confirmations) {
            return Optional.empty();
        }
        return Optional.of(new TransactionReceipt(r.getTransactionHash(), receiptBlock, r.getBlockHash(), r.isStatusOK()));
    }

    @Override
    public BlockInfo getBlock(String blockHash) {
        EthBlock.Block block = send(web3j.ethGetBlockByHash(blockHash, false), "eth_getBlockByHash").getBlock();
        if (block == null) {
            return null;
        }
        return new BlockInfo(block.getHash(), block.getNumber().longValue(),
                Instant.ofEpochSecond(block.getTimestamp().longValue()));
    }

    private <T extends Response<?>> T send(Request<?, T> request, String operation) {
        T resp;
        try {
            resp = request.send();
        } catch (IOException e) {
            throw Web3jErrorClassifier.classify(operation, e);
        }
        if (resp.hasError()) {
            throw Web3jErrorClassifier.classify(operation, resp.getError());
        }
        return resp;
    }
}
