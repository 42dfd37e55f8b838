package com.work.anchor.core;

import com.work.anchor.core.config.AnchorConfig;
import com.work.anchor.core.engine.ConfirmationWaiter;
import com.work.anchor.core.engine.FeeEstimator;
import com.work.anchor.core.engine.SubmissionOrchestrator;
import com.work.anchor.core.engine.TransactionBuilder;
import com.work.anchor.core.engine.WalletBalanceReporter;
import com.work.anchor.core.exception.AnchorException;
import com.work.anchor.core.exception.ConfigurationException;
import com.work.anchor.core.model.AnchorPayload;
import com.work.anchor.core.model.AnchorTransaction;
import com.work.anchor.core.model.ChainId;
import com.work.anchor.core.observer.AnchorObserver;
import com.work.anchor.core.signer.Signer;
import com.work.anchor.core.support.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 门面（Facade）层，对业务侧暴露最少的调用面：connect / getChainId / submit。
 */
public class AnchorEngine {

    private static final Logger log = LoggerFactory.getLogger(AnchorEngine.class);

    private final Signer signer;
    private final SubmissionOrchestrator orchestrator;
    private final WalletBalanceReporter balanceReporter;

    private volatile ChainId chainId;

    public AnchorEngine(Signer signer, AnchorConfig config, AnchorObserver observer) {
        this.signer = ValidationUtils.requireNonNull(signer, "signer");
        ValidationUtils.requireNonNull(config, "config");
        ValidationUtils.requireNonNull(observer, "observer");
        ConfirmationWaiter waiter = new ConfirmationWaiter(signer, config, observer);
        this.orchestrator = new SubmissionOrchestrator(signer, config, observer,
                new TransactionBuilder(signer, config), new FeeEstimator(signer, config), waiter);
        this.balanceReporter = new WalletBalanceReporter(signer, observer);
    }

    /**
     * 查询并缓存链 ID，之后在引擎生命周期内不再变化。
     */
    public void connect() {
        log.info("Connecting to blockchain...");
        ChainId loaded;
        try {
            loaded = signer.getChainId();
        } catch (ConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ConfigurationException("Unable to load chain id from blockchain endpoint: " + e.getMessage(), e);
        }
        if (loaded == null) {
            throw new ConfigurationException("Blockchain endpoint returned no chain id");
        }
        this.chainId = loaded;
        log.info("Connected to blockchain with chain ID {}", loaded.toCaip());
    }

    /**
     * CAIP-2 形式的链 ID，仅在 connect 成功后可用。
     */
    public String getChainId() {
        return requireConnected().toCaip();
    }

    /**
     * 提交一次锚定并等待终局。失败时抛出 {@link AnchorException} 的某个子类，不会返回部分结果。
     */
    public AnchorTransaction submit(AnchorPayload payload) {
        ValidationUtils.requireNonNull(payload, "payload");
        final ChainId connected = requireConnected();
        return balanceReporter.withWalletBalance(signer.getAddress(), () -> orchestrator.submit(payload, connected));
    }

    private ChainId requireConnected() {
        ChainId current = chainId;
        if (current == null) {
            throw new IllegalStateException("No chainId available");
        }
        return current;
    }
}
