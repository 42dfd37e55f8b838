package com.work.anchor.core.model;

import java.math.BigInteger;

/**
 * 节点给出的当前费用估计。maxFeePerGas 与 maxPriorityFeePerGas 同时存在时按 EIP-1559 定价，
 * 否则使用 gasPrice。
 */
public class FeeEstimate {

    private final BigInteger gasPrice;
    private final BigInteger maxFeePerGas;
    private final BigInteger maxPriorityFeePerGas;

    public FeeEstimate(BigInteger gasPrice, BigInteger maxFeePerGas, BigInteger maxPriorityFeePerGas) {
        this.gasPrice = gasPrice;
        this.maxFeePerGas = maxFeePerGas;
        this.maxPriorityFeePerGas = maxPriorityFeePerGas;
    }

    public static FeeEstimate legacy(BigInteger gasPrice) {
        return new FeeEstimate(gasPrice, null, null);
    }

    public static FeeEstimate feeMarket(BigInteger maxFeePerGas, BigInteger maxPriorityFeePerGas) {
        return new FeeEstimate(null, maxFeePerGas, maxPriorityFeePerGas);
    }

    public boolean isFeeMarket() {
        return maxFeePerGas != null && maxPriorityFeePerGas != null;
    }

    public BigInteger getGasPrice() {
        return gasPrice;
    }

    public BigInteger getMaxFeePerGas() {
        return maxFeePerGas;
    }

    public BigInteger getMaxPriorityFeePerGas() {
        return maxPriorityFeePerGas;
    }
}
