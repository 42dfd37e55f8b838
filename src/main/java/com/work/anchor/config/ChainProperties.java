package com.work.anchor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigInteger;
import java.time.Duration;

/**
 * 链连接配置。
 *
 * mode=mock: 使用 MockSigner
 * mode=web3j: 使用 Web3jSigner
 */
@ConfigurationProperties(prefix = "chain")
public class ChainProperties {

    /**
     * mock 或 web3j
     */
    private String mode = "mock";

    /**
     * 网络名，仅用于日志与错误信息，例如 mainnet / sepolia
     */
    private String network = "local";

    /**
     * Web3j HTTP RPC 地址，例如 http://localhost:8545。优先于 rpcHost/rpcPort
     */
    private String rpcUrl;

    private String rpcHost;

    private Integer rpcPort;

    /**
     * 签名账户私钥（十六进制）
     */
    private String privateKey;

    /**
     * receipt 轮询间隔
     */
    private Duration receiptPollInterval = Duration.ofSeconds(2);

    /**
     * mock 链的 chainId
     */
    private long mockChainId = 1337L;

    /**
     * mock 链签名账户地址
     */
    private String mockAddress = "0x00000000000000000000000000000000000a11ce";

    /**
     * mock 账户初始余额（wei），默认 1 ETH
     */
    private BigInteger mockBalance = new BigInteger("1000000000000000000");

    /**
     * 解析 RPC 地址：rpcUrl 优先，其次 rpcHost:rpcPort；都没有时返回 null。
     */
    public String resolveEndpoint() {
        if (rpcUrl != null && !rpcUrl.trim().isEmpty()) {
            return rpcUrl.trim();
        }
        if (rpcHost != null && !rpcHost.trim().isEmpty() && rpcPort != null) {
            return rpcHost.trim() + ":" + rpcPort;
        }
        return null;
    }

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public String getNetwork() {
        return network;
    }

    public void setNetwork(String network) {
        this.network = network;
    }

    public String getRpcUrl() {
        return rpcUrl;
    }

    public void setRpcUrl(String rpcUrl) {
        this.rpcUrl = rpcUrl;
    }

    public String getRpcHost() {
        return rpcHost;
    }

    public void setRpcHost(String rpcHost) {
        this.rpcHost = rpcHost;
    }

    public Integer getRpcPort() {
        return rpcPort;
    }

    public void setRpcPort(Integer rpcPort) {
        this.rpcPort = rpcPort;
    }

    public String getPrivateKey() {
        return privateKey;
    }

    public void setPrivateKey(String privateKey) {
        this.privateKey = privateKey;
    }

    public Duration getReceiptPollInterval() {
        return receiptPollInterval;
    }

    public void setReceiptPollInterval(Duration receiptPollInterval) {
        this.receiptPollInterval = receiptPollInterval;
    }

    public long getMockChainId() {
        return mockChainId;
    }

    public void setMockChainId(long mockChainId) {
        this.mockChainId = mockChainId;
    }

    public String getMockAddress() {
        return mockAddress;
    }

    public void setMockAddress(String mockAddress) {
        this.mockAddress = mockAddress;
    }

    public BigInteger getMockBalance() {
        return mockBalance;
    }

    public void setMockBalance(BigInteger mockBalance) {
        this.mockBalance = mockBalance;
    }
}
