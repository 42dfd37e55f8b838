package com.work.anchor.core.config;

import com.work.anchor.core.support.ValidationUtils;

import java.math.BigInteger;
import java.time.Duration;

/**
 * 纯组件侧的配置定义，不依赖任意框架。宿主应用（如 Spring Boot）只需在装配时
 * 将自身读取到的配置参数注入即可。
 */
public class AnchorConfig {

    public static final int DEFAULT_CONFIRMATION_BLOCKS = 4;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(5);

    private final AnchorMode mode;
    private final String contractAddress;
    private final Duration transactionTimeout;
    private final boolean overrideGasConfig;
    private final BigInteger gasLimit;
    private final int confirmationBlocks;
    private final int maxAttempts;
    private final Duration retryDelay;

    public AnchorConfig(AnchorMode mode,
                        String contractAddress,
                        Duration transactionTimeout,
                        boolean overrideGasConfig,
                        BigInteger gasLimit,
                        int confirmationBlocks,
                        int maxAttempts,
                        Duration retryDelay) {
        this.mode = ValidationUtils.requireNonNull(mode, "mode");
        if (mode == AnchorMode.SMART_CONTRACT) {
            ValidationUtils.requireValidAddress(contractAddress, "contractAddress");
        }
        if (overrideGasConfig) {
            ValidationUtils.requireNonNull(gasLimit, "gasLimit");
        }
        this.contractAddress = contractAddress;
        this.transactionTimeout = ValidationUtils.requirePositive(transactionTimeout, "transactionTimeout");
        this.overrideGasConfig = overrideGasConfig;
        this.gasLimit = gasLimit;
        this.confirmationBlocks = (int) ValidationUtils.requirePositive(confirmationBlocks, "confirmationBlocks");
        this.maxAttempts = (int) ValidationUtils.requirePositive(maxAttempts, "maxAttempts");
        this.retryDelay = ValidationUtils.requireNonNegative(retryDelay, "retryDelay");
    }

    public static AnchorConfig rawData(Duration transactionTimeout) {
        return new AnchorConfig(AnchorMode.RAW_DATA, null, transactionTimeout, false, null,
                DEFAULT_CONFIRMATION_BLOCKS, DEFAULT_MAX_ATTEMPTS, DEFAULT_RETRY_DELAY);
    }

    public AnchorMode getMode() {
        return mode;
    }

    public String getContractAddress() {
        return contractAddress;
    }

    public Duration getTransactionTimeout() {
        return transactionTimeout;
    }

    public boolean isOverrideGasConfig() {
        return overrideGasConfig;
    }

    public BigInteger getGasLimit() {
        return gasLimit;
    }

    public int getConfirmationBlocks() {
        return confirmationBlocks;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }
}
