package com.work.anchor.core.engine;

import com.work.anchor.core.config.AnchorConfig;
import com.work.anchor.core.exception.UnhandledTransportException;
import com.work.anchor.core.model.FeeEstimate;
import com.work.anchor.core.model.TransactionRequest;
import com.work.anchor.core.signer.Signer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;

/**
 * 每次尝试前重写交易的费用字段与 gasLimit。
 *
 * 同 nonce 的替换交易必须比 mempool 中已有的那笔至少高 10%，否则会被节点以 underpriced 拒绝，
 * 所以第 i 次的价格取 pad(max(当前估计, 第 i-1 次价格))。
 *
 * EIP-1559：
 * - 节点估计给出 maxFeePerGas(M) 与 maxPriorityFeePerGas(P)，baseFee = M - P
 * - nextPriority = pad(max(P, prevPriority))
 * - nextMaxFee = pad(baseFee + nextPriority)：安全余量每次按当前 baseFee 重新计算，
 *   而不是在旧的 maxFeePerGas 上只加小费（那样会不断吃掉余量）
 *
 * Legacy：nextGasPrice = pad(max(gasPrice, prevGasPrice))。
 */
public class FeeEstimator {

    private static final Logger log = LoggerFactory.getLogger(FeeEstimator.class);

    private static final BigInteger TEN = BigInteger.TEN;

    private final Signer signer;
    private final AnchorConfig config;

    public FeeEstimator(Signer signer, AnchorConfig config) {
        this.signer = signer;
        this.config = config;
    }

    /**
     * pad(x) = x + floor(x / 10)，单位为链上最小费用单位（wei）。
     */
    public static BigInteger pad(BigInteger value) {
        return value.add(value.divide(TEN));
    }

    /**
     * @param estimate 当前节点估计（gasPrice 或 maxPriorityFeePerGas）
     * @param previous 上一次尝试使用的值，首次尝试为 null
     */
    public static BigInteger increaseGasPricePerAttempt(BigInteger estimate, BigInteger previous) {
        if (previous == null) {
            return pad(estimate);
        }
        return pad(estimate.max(previous));
    }

    public void price(TransactionRequest request) {
        FeeEstimate fee = signer.getFeeEstimate();
        if (fee != null && fee.isFeeMarket()) {
            BigInteger maxPriorityFee = fee.getMaxPriorityFeePerGas();
            BigInteger baseFee = fee.getMaxFeePerGas().subtract(maxPriorityFee).max(BigInteger.ZERO);
            BigInteger nextPriorityFee = increaseGasPricePerAttempt(maxPriorityFee, request.getMaxPriorityFeePerGas());
            request.setMaxPriorityFeePerGas(nextPriorityFee);
            request.setMaxFeePerGas(pad(baseFee.add(nextPriorityFee)));
            request.setGasPrice(null);
            log.debug("Estimated maxPriorityFeePerGas: {} wei; maxFeePerGas: {} wei",
                    request.getMaxPriorityFeePerGas(), request.getMaxFeePerGas());
        } else {
            if (fee == null || fee.getGasPrice() == null) {
                throw new UnhandledTransportException("Unavailable gas price for pre-EIP-1559 transaction");
            }
            request.setGasPrice(increaseGasPricePerAttempt(fee.getGasPrice(), request.getGasPrice()));
            request.setMaxFeePerGas(null);
            request.setMaxPriorityFeePerGas(null);
            log.debug("Estimated gasPrice: {} wei", request.getGasPrice());
        }

        if (config.isOverrideGasConfig()) {
            request.setGasLimit(config.getGasLimit());
            log.debug("Overriding Gas limit: {}", request.getGasLimit());
            return;
        }
        request.setGasLimit(signer.estimateGas(request));
        log.debug("Estimated Gas limit: {}", request.getGasLimit());
    }
}
