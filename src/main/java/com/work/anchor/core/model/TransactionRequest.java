package com.work.anchor.core.model;

import java.math.BigInteger;

/**
 * 未签名的交易请求。
 *
 * 约束：
 * - nonce 在同一次逻辑提交的所有尝试中保持不变
 * - 费用字段（gasPrice 或 maxFeePerGas/maxPriorityFeePerGas）每次尝试都会被重写
 */
public class TransactionRequest {

    private String to;
    private String data;
    private BigInteger nonce;
    private String from;
    private BigInteger gasLimit;
    private BigInteger gasPrice;
    private BigInteger maxFeePerGas;
    private BigInteger maxPriorityFeePerGas;

    public TransactionRequest() {
    }

    public TransactionRequest(String to, String data, BigInteger nonce, String from) {
        this.to = to;
        this.data = data;
        this.nonce = nonce;
        this.from = from;
    }

    public boolean isFeeMarket() {
        return maxFeePerGas != null && maxPriorityFeePerGas != null;
    }

    /**
     * 本次尝试的最大成本：gasLimit × (maxFeePerGas 或 gasPrice)。费用未设置时返回 null。
     */
    public BigInteger maxCost() {
        BigInteger price = isFeeMarket() ? maxFeePerGas : gasPrice;
        if (gasLimit == null || price == null) {
            return null;
        }
        return gasLimit.multiply(price);
    }

    public TransactionRequest copy() {
        TransactionRequest c = new TransactionRequest(to, data, nonce, from);
        c.gasLimit = gasLimit;
        c.gasPrice = gasPrice;
        c.maxFeePerGas = maxFeePerGas;
        c.maxPriorityFeePerGas = maxPriorityFeePerGas;
        return c;
    }

    public String getTo() {
        return to;
    }

    public void setTo(String to) {
        this.to = to;
    }

    public String getData() {
        return data;
    }

    public void setData(String data) {
        this.data = data;
    }

    public BigInteger getNonce() {
        return nonce;
    }

    public void setNonce(BigInteger nonce) {
        this.nonce = nonce;
    }

    public String getFrom() {
        return from;
    }

    public void setFrom(String from) {
        this.from = from;
    }

    public BigInteger getGasLimit() {
        return gasLimit;
    }

    public void setGasLimit(BigInteger gasLimit) {
        this.gasLimit = gasLimit;
    }

    public BigInteger getGasPrice() {
        return gasPrice;
    }

    public void setGasPrice(BigInteger gasPrice) {
        this.gasPrice = gasPrice;
    }

    public BigInteger getMaxFeePerGas() {
        return maxFeePerGas;
    }

    public void setMaxFeePerGas(BigInteger maxFeePerGas) {
        this.maxFeePerGas = maxFeePerGas;
    }

    public BigInteger getMaxPriorityFeePerGas() {
        return maxPriorityFeePerGas;
    }

    public void setMaxPriorityFeePerGas(BigInteger maxPriorityFeePerGas) {
        this.maxPriorityFeePerGas = maxPriorityFeePerGas;
    }

    @Override
    public String toString() {
        return "TransactionRequest{to=" + to + ", nonce=" + nonce + ", from=" + from
                + ", gasLimit=" + gasLimit + ", gasPrice=" + gasPrice
                + ", maxFeePerGas=" + maxFeePerGas + ", maxPriorityFeePerGas=" + maxPriorityFeePerGas + "}";
    }
}
