package com.work.anchor.support.observer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.work.anchor.core.model.TransactionReceipt;
import com.work.anchor.core.model.TransactionRequest;
import com.work.anchor.core.observer.AnchorObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.utils.Convert;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * 默认观测实现：每个事件输出一行 JSON 日志，余额按 gwei 展示。
 *
 * 若业务侧提供了自定义 AnchorObserver Bean（例如接入 Micrometer），该实现不会被装配。
 */
public class LoggingAnchorObserver implements AnchorObserver {

    private static final Logger log = LoggerFactory.getLogger(LoggingAnchorObserver.class);

    private final ObjectMapper objectMapper;

    public LoggingAnchorObserver(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void insufficientFunds(BigInteger txCost, BigInteger balance) {
        ObjectNode e = event("insufficientFunds");
        e.put("txCost", txCost);
        e.put("balance", toGwei(balance));
        emit(e);
    }

    @Override
    public void transactionTimeout(long timeoutSecs) {
        ObjectNode e = event("transactionTimeout");
        e.put("transactionTimeoutSecs", timeoutSecs);
        emit(e);
    }

    @Override
    public void nonceExpired(BigInteger nonce) {
        ObjectNode e = event("nonceExpired");
        e.put("nonce", nonce);
        emit(e);
    }

    @Override
    public void txRequest(TransactionRequest request) {
        ObjectNode e = event("txRequest");
        e.set("tx", objectMapper.valueToTree(request));
        emit(e);
    }

    @Override
    public void txResponse(String hash, Long blockNumber, String blockHash, String from) {
        ObjectNode e = event("txResponse");
        e.put("hash", hash);
        e.put("blockNumber", blockNumber);
        e.put("blockHash", blockHash);
        e.put("from", from);
        emit(e);
    }

    @Override
    public void txReceipt(TransactionReceipt receipt) {
        ObjectNode e = event("txReceipt");
        e.set("tx", objectMapper.valueToTree(receipt));
        emit(e);
    }

    @Override
    public void walletBalance(BigInteger balance) {
        ObjectNode e = event("walletBalance");
        e.put("balance", toGwei(balance));
        emit(e);
    }

    static String toGwei(BigInteger wei) {
        if (wei == null) {
            return null;
        }
        return Convert.fromWei(new BigDecimal(wei), Convert.Unit.GWEI).toPlainString();
    }

    private ObjectNode event(String type) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", type);
        return node;
    }

    private void emit(ObjectNode node) {
        try {
            log.info("ethereum {}", objectMapper.writeValueAsString(node));
        } catch (JsonProcessingException e) {
            log.warn("failed to serialize event type={} err={}", node.get("type"), e.toString());
        }
    }
}
