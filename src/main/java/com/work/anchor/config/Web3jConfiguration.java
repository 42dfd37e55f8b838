package com.work.anchor.config;

import com.work.anchor.chain.web3j.Web3jSigner;
import com.work.anchor.core.exception.ConfigurationException;
import com.work.anchor.core.signer.Signer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

/**
 * Web3j 装配：
 * 当 chain.mode=web3j 时启用。
 */
@Configuration
@ConditionalOnProperty(prefix = "chain", name = "mode", havingValue = "web3j")
public class Web3jConfiguration {

    private static final Logger log = LoggerFactory.getLogger(Web3jConfiguration.class);

    @Bean(destroyMethod = "shutdown")
    public Web3j web3j(ChainProperties properties) {
        String endpoint = properties.resolveEndpoint();
        if (endpoint == null) {
            throw new ConfigurationException("Cannot connect to " + properties.getNetwork()
                    + ", please provide chain.rpc-url or chain.rpc-host and chain.rpc-port");
        }
        log.info("Connecting ethereum provider to {}", endpoint);
        // 这里使用 HTTP RPC；如需订阅区块事件，可改为 WebSocketService 并引入对应依赖与生命周期管理
        return Web3j.build(new HttpService(endpoint));
    }

    @Bean
    public Signer web3jSigner(Web3j web3j, ChainProperties properties) {
        String privateKey = properties.getPrivateKey();
        if (privateKey == null || privateKey.trim().isEmpty()) {
            throw new ConfigurationException("chain.private-key must be configured when chain.mode=web3j");
        }
        return new Web3jSigner(web3j, Credentials.create(privateKey.trim()), properties.getReceiptPollInterval());
    }
}
