package com.work.anchor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.anchor.chain.mock.MockSigner;
import com.work.anchor.core.AnchorEngine;
import com.work.anchor.core.config.AnchorConfig;
import com.work.anchor.core.config.AnchorMode;
import com.work.anchor.core.model.ChainId;
import com.work.anchor.core.observer.AnchorObserver;
import com.work.anchor.core.signer.Signer;
import com.work.anchor.support.observer.LoggingAnchorObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;

/**
 * 将核心组件装配为 Spring Bean，方便通过依赖注入复用。
 */
@Configuration
@EnableConfigurationProperties({AnchorProperties.class, ChainProperties.class})
public class AnchorEngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AnchorEngineConfiguration.class);

    /**
     * 默认使用 mock；若设置 chain.mode=web3j，将由 Web3jConfiguration 提供实现
     */
    @Bean
    @ConditionalOnProperty(prefix = "chain", name = "mode", havingValue = "mock", matchIfMissing = true)
    public Signer mockSigner(ChainProperties properties) {
        log.warn("Using in-memory mock signer chainId={} address={}", properties.getMockChainId(), properties.getMockAddress());
        return new MockSigner(properties.getMockAddress(), ChainId.of(properties.getMockChainId()), properties.getMockBalance());
    }

    @Bean
    @ConditionalOnMissingBean(AnchorObserver.class)
    public AnchorObserver anchorObserver(ObjectMapper objectMapper) {
        return new LoggingAnchorObserver(objectMapper);
    }

    @Bean
    public AnchorConfig anchorConfig(AnchorProperties properties) {
        AnchorMode mode = properties.isUseSmartContractAnchors() ? AnchorMode.SMART_CONTRACT : AnchorMode.RAW_DATA;
        return new AnchorConfig(
                mode,
                properties.getContractAddress(),
                properties.getTransactionTimeout(),
                properties.isOverrideGasConfig(),
                BigInteger.valueOf(properties.getGasLimit()),
                properties.getConfirmationBlocks(),
                properties.getMaxAttempts(),
                properties.getRetryDelay()
        );
    }

    /**
     * 启动时即 connect：节点不可达或返回异常链 ID 时应用启动失败。
     */
    @Bean
    public AnchorEngine anchorEngine(Signer signer, AnchorConfig config, AnchorObserver observer) {
        AnchorEngine engine = new AnchorEngine(signer, config, observer);
        engine.connect();
        return engine;
    }
}
