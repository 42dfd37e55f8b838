package com.work.anchor.core.engine;

import com.work.anchor.core.config.AnchorConfig;
import com.work.anchor.core.exception.ConfirmationTimeoutException;
import com.work.anchor.core.exception.MinedFailureException;
import com.work.anchor.core.exception.UnhandledTransportException;
import com.work.anchor.core.model.AnchorTransaction;
import com.work.anchor.core.model.BlockInfo;
import com.work.anchor.core.model.ChainId;
import com.work.anchor.core.model.TransactionReceipt;
import com.work.anchor.core.model.TransactionResponse;
import com.work.anchor.core.observer.AnchorObserver;
import com.work.anchor.core.signer.Signer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * 等待已广播交易达到确认深度，并产出最终的 AnchorTransaction。
 *
 * - 超时：ConfirmationTimeoutException（可重试）
 * - receipt status=failure：MinedFailureException（不重试）
 */
public class ConfirmationWaiter {

    private static final Logger log = LoggerFactory.getLogger(ConfirmationWaiter.class);

    private final Signer signer;
    private final AnchorConfig config;
    private final AnchorObserver observer;

    public ConfirmationWaiter(Signer signer, AnchorConfig config, AnchorObserver observer) {
        this.signer = signer;
        this.config = config;
        this.observer = observer;
    }

    public AnchorTransaction confirm(TransactionResponse response, ChainId chainId) {
        String hash = response.getHash();
        log.info("Waiting to confirm transaction with hash {}", hash);

        long timeoutMs = config.getTransactionTimeout().toMillis();
        Optional<TransactionReceipt> receiptOpt = signer.waitForReceipt(hash, config.getConfirmationBlocks(), timeoutMs);
        if (!receiptOpt.isPresent()) {
            throw new ConfirmationTimeoutException("Transaction " + hash + " was not mined within "
                    + config.getTransactionTimeout().getSeconds() + " seconds");
        }
        TransactionReceipt receipt = receiptOpt.get();
        observer.txReceipt(receipt);

        BlockInfo block = signer.getBlock(receipt.getBlockHash());
        if (block == null || block.getTimestamp() == null) {
            throw new UnhandledTransportException("No block found for hash " + receipt.getBlockHash());
        }

        log.info("Transaction completed on {}. txHash={} blockHash={} status={}",
                chainId.toCaip(), receipt.getHash(), receipt.getBlockHash(), receipt.getStatus());
        if (!receipt.isSuccess()) {
            throw new MinedFailureException(receipt.getHash());
        }
        return new AnchorTransaction(chainId.toCaip(), receipt.getHash(), receipt.getBlockNumber(), block.getTimestamp());
    }
}
