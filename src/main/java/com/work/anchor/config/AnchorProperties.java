package com.work.anchor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import java.time.Duration;

/**
 * 锚定引擎配置项。
 */
@Validated
@ConfigurationProperties(prefix = "anchor")
public class AnchorProperties {

    /**
     * true: 调用锚定合约 anchorDagCbor(bytes32)；false: 发送携带 CID 的普通交易
     */
    private boolean useSmartContractAnchors = false;

    /**
     * 锚定合约地址（useSmartContractAnchors=true 时必填）
     */
    private String contractAddress;

    /**
     * 单次尝试等待打包的超时
     */
    @NotNull
    private Duration transactionTimeout = Duration.ofMinutes(1);

    /**
     * true: 不做 eth_estimateGas，直接使用 gasLimit
     */
    private boolean overrideGasConfig = false;

    /**
     * overrideGasConfig=true 时使用的固定 gasLimit
     */
    @Min(21000)
    private long gasLimit = 100_000L;

    /**
     * 终局所需确认块数
     */
    @Min(1)
    private int confirmationBlocks = 4;

    /**
     * 单次逻辑提交的最大尝试次数
     */
    @Min(1)
    private int maxAttempts = 3;

    /**
     * 两次尝试之间的固定间隔
     */
    @NotNull
    private Duration retryDelay = Duration.ofSeconds(5);

    public boolean isUseSmartContractAnchors() {
        return useSmartContractAnchors;
    }

    public void setUseSmartContractAnchors(boolean useSmartContractAnchors) {
        this.useSmartContractAnchors = useSmartContractAnchors;
    }

    public String getContractAddress() {
        return contractAddress;
    }

    public void setContractAddress(String contractAddress) {
        this.contractAddress = contractAddress;
    }

    public Duration getTransactionTimeout() {
        return transactionTimeout;
    }

    public void setTransactionTimeout(Duration transactionTimeout) {
        this.transactionTimeout = transactionTimeout;
    }

    public boolean isOverrideGasConfig() {
        return overrideGasConfig;
    }

    public void setOverrideGasConfig(boolean overrideGasConfig) {
        this.overrideGasConfig = overrideGasConfig;
    }

    public long getGasLimit() {
        return gasLimit;
    }

    public void setGasLimit(long gasLimit) {
        this.gasLimit = gasLimit;
    }

    public int getConfirmationBlocks() {
        return confirmationBlocks;
    }

    public void setConfirmationBlocks(int confirmationBlocks) {
        this.confirmationBlocks = confirmationBlocks;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    public void setRetryDelay(Duration retryDelay) {
        this.retryDelay = retryDelay;
    }
}
