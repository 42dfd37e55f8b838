package com.work.anchor.chain.mock;

import com.work.anchor.core.exception.InsufficientFundsException;
import com.work.anchor.core.exception.NonceConflictException;
import com.work.anchor.core.model.BlockInfo;
import com.work.anchor.core.model.ChainId;
import com.work.anchor.core.model.FeeEstimate;
import com.work.anchor.core.model.TransactionReceipt;
import com.work.anchor.core.model.TransactionRequest;
import com.work.anchor.core.model.TransactionResponse;
import com.work.anchor.core.signer.Signer;
import org.web3j.crypto.Hash;

import java.math.BigInteger;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Demo 级签名器：单账户内存链，广播即打包，仅用于跑通最小链路。
 */
public class MockSigner implements Signer {

    static final BigInteger GWEI = BigInteger.valueOf(1_000_000_000L);
    static final BigInteger GAS_PER_ANCHOR = BigInteger.valueOf(30_000L);

    private final String address;
    private final ChainId chainId;
    private final Map<String, BigInteger> balances = new ConcurrentHashMap<>();
    private final Map<String, BigInteger> nonces = new ConcurrentHashMap<>();
    private final Map<String, TransactionReceipt> receipts = new ConcurrentHashMap<>();
    private final Map<String, BlockInfo> blocks = new ConcurrentHashMap<>();
    private final AtomicLong blockNumber = new AtomicLong(1);

    public MockSigner(String address, ChainId chainId, BigInteger initialBalance) {
        this.address = address;
        this.chainId = chainId;
        this.balances.put(address, initialBalance);
    }

    @Override
    public String getAddress() {
        return address;
    }

    @Override
    public ChainId getChainId() {
        return chainId;
    }

    @Override
    public BigInteger getNonce(String address) {
        return nonces.getOrDefault(address, BigInteger.ZERO);
    }

    @Override
    public BigInteger getBalance(String address) {
        return balances.getOrDefault(address, BigInteger.ZERO);
    }

    @Override
    public FeeEstimate getFeeEstimate() {
        // baseFee=2 gwei, tip=1 gwei
        return FeeEstimate.feeMarket(GWEI.multiply(BigInteger.valueOf(5)), GWEI);
    }

    @Override
    public BigInteger estimateGas(TransactionRequest request) {
        return GAS_PER_ANCHOR;
    }

    @Override
    public synchronized TransactionResponse broadcast(TransactionRequest request) {
        BigInteger expectedNonce = getNonce(request.getFrom());
        if (request.getNonce().compareTo(expectedNonce) < 0) {
            throw new NonceConflictException("nonce too low: next nonce " + expectedNonce + ", tx nonce " + request.getNonce());
        }
        BigInteger cost = request.maxCost();
        BigInteger balance = getBalance(request.getFrom());
        if (cost == null || cost.compareTo(balance) > 0) {
            throw new InsufficientFundsException("insufficient funds for gas * price + value");
        }

        long bn = blockNumber.getAndIncrement();
        String blockHash = Hash.sha3String("block_" + bn);
        String txHash = Hash.sha3String(request.getFrom() + "_" + request.getNonce() + "_" + bn);
        blocks.put(blockHash, new BlockInfo(blockHash, bn, Instant.now().truncatedTo(ChronoUnit.SECONDS)));
        receipts.put(txHash, new TransactionReceipt(txHash, bn, blockHash, true));
        balances.put(request.getFrom(), balance.subtract(cost));
        nonces.put(request.getFrom(), request.getNonce().add(BigInteger.ONE));
        return new TransactionResponse(txHash, chainId, null, null, request.getFrom(), request.getData());
    }

    @Override
    public Optional<TransactionReceipt> waitForReceipt(String txHash, int confirmations, long timeoutMs) {
        return Optional.ofNullable(receipts.get(txHash));
    }

    @Override
    public BlockInfo getBlock(String blockHash) {
        return blocks.get(blockHash);
    }
}
