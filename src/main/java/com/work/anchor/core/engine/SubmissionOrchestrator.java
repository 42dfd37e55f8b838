package com.work.anchor.core.engine;

import com.work.anchor.core.config.AnchorConfig;
import com.work.anchor.core.exception.AnchorException;
import com.work.anchor.core.exception.BroadcastTimeoutException;
import com.work.anchor.core.exception.ChainIdMismatchException;
import com.work.anchor.core.exception.ConfirmationTimeoutException;
import com.work.anchor.core.exception.InsufficientFundsException;
import com.work.anchor.core.exception.NonceConflictException;
import com.work.anchor.core.exception.PriorAttemptsUnconfirmedException;
import com.work.anchor.core.exception.RetriesExhaustedException;
import com.work.anchor.core.exception.UnhandledTransportException;
import com.work.anchor.core.model.AnchorPayload;
import com.work.anchor.core.model.AnchorTransaction;
import com.work.anchor.core.model.AttemptHistory;
import com.work.anchor.core.model.ChainId;
import com.work.anchor.core.model.TransactionRequest;
import com.work.anchor.core.model.TransactionResponse;
import com.work.anchor.core.observer.AnchorObserver;
import com.work.anchor.core.signer.Signer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;

/**
 * 单次逻辑提交的重试编排：Building -> Pricing -> Broadcasting -> Confirming -> Succeeded。
 *
 * 策略：
 * - 交易请求只构造一次，nonce 在所有尝试间保持不变
 * - 每次尝试重新定价（逐次至少 +10%）后广播并等待确认
 * - 失败按以下优先级归类：余额不足（终止）> 确认超时（重试）> nonce 冲突（回扫历史）> 其它（终止）
 * - 广播本身超时的交易可能已进入节点，同样计入历史以便回扫
 *
 * 同一签名账户同一时间只能有一个逻辑提交在进行，串行化由调用方保证，这里不加锁。
 */
public class SubmissionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SubmissionOrchestrator.class);

    private final Signer signer;
    private final AnchorConfig config;
    private final AnchorObserver observer;
    private final TransactionBuilder builder;
    private final FeeEstimator feeEstimator;
    private final ConfirmationWaiter waiter;

    public SubmissionOrchestrator(Signer signer,
                                  AnchorConfig config,
                                  AnchorObserver observer,
                                  TransactionBuilder builder,
                                  FeeEstimator feeEstimator,
                                  ConfirmationWaiter waiter) {
        this.signer = signer;
        this.config = config;
        this.observer = observer;
        this.builder = builder;
        this.feeEstimator = feeEstimator;
        this.waiter = waiter;
    }

    public AnchorTransaction submit(AnchorPayload payload, ChainId chainId) {
        TransactionRequest request = builder.build(payload);
        AttemptHistory history = new AttemptHistory();
        int maxAttempts = config.getMaxAttempts();
        AnchorException lastFailure = null;

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            try {
                return attemptOnce(request, history, chainId);
            } catch (InsufficientFundsException e) {
                handleInsufficientFunds(request, e);
                lastFailure = e;
            } catch (ConfirmationTimeoutException e) {
                handleTimeout(e);
                lastFailure = e;
            } catch (BroadcastTimeoutException e) {
                handleBroadcastTimeout(history, e);
                lastFailure = e;
            } catch (NonceConflictException e) {
                return handleNonceConflict(request, history, attempt, chainId, e);
            } catch (AnchorException e) {
                log.error("Fatal failure in attempt {} nonce={} err={}", attempt, request.getNonce(), e.getMessage());
                throw e;
            } catch (RuntimeException e) {
                log.error("Unhandled error in attempt {} nonce={}", attempt, request.getNonce(), e);
                throw new UnhandledTransportException("Unhandled error in attempt: " + e.getMessage(), e);
            }

            int remaining = maxAttempts - attempt - 1;
            log.warn("Failed to send transaction; {} retries remain", remaining);
            if (remaining > 0) {
                pause();
            }
        }
        throw new RetriesExhaustedException(maxAttempts, lastFailure);
    }

    private AnchorTransaction attemptOnce(TransactionRequest request, AttemptHistory history, ChainId chainId) {
        feeEstimator.price(request);
        observer.txRequest(request.copy());
        log.info("Sending transaction to {}: {}", chainId.toCaip(), request);

        TransactionResponse response = signer.broadcast(request);
        observer.txResponse(response.getHash(), response.getBlockNumber(), response.getBlockHash(), response.getFrom());
        assertSameChainId(chainId, response);

        history.append(response);
        return waiter.confirm(response, chainId);
    }

    private static void assertSameChainId(ChainId expected, TransactionResponse response) {
        ChainId actual = response.getChainId();
        if (actual == null) {
            throw new UnhandledTransportException("Broadcast response carries no chain id. txHash=" + response.getHash());
        }
        if (!expected.equals(actual)) {
            throw new ChainIdMismatchException(expected, actual);
        }
    }

    /**
     * 节点报告余额不足时重新查询余额：确实不足则终止；否则视为节点视图暂时不一致，继续下一次尝试。
     */
    private void handleInsufficientFunds(TransactionRequest request, InsufficientFundsException cause) {
        BigInteger txCost = request.maxCost();
        BigInteger balance = signer.getBalance(request.getFrom());
        if (txCost == null) {
            // 估算 gas 阶段即报余额不足，成本未知
            observer.insufficientFunds(null, balance);
            log.error("Insufficient funds reported before the transaction was fully priced. balance={} err={}",
                    balance, cause.getMessage());
            throw new InsufficientFundsException(cause.getMessage(), null, balance, cause);
        }
        if (txCost.compareTo(balance) > 0) {
            observer.insufficientFunds(txCost, balance);
            String msg = "Transaction cost is greater than our current balance. [txCost: " + txCost.toString(16)
                    + ", balance: " + balance.toString(16) + "]";
            log.error(msg);
            throw new InsufficientFundsException(msg, txCost, balance, cause);
        }
        log.warn("Node reported insufficient funds but txCost={} <= balance={}; retrying", txCost, balance);
    }

    private void handleBroadcastTimeout(AttemptHistory history, BroadcastTimeoutException cause) {
        TransactionResponse pending = cause.getPending();
        history.append(pending);
        log.warn("Broadcast of txHash={} timed out, keeping it as a previous attempt: {}",
                pending.getHash(), cause.getMessage());
    }

    private void handleTimeout(ConfirmationTimeoutException cause) {
        long timeoutSecs = config.getTransactionTimeout().getSeconds();
        observer.transactionTimeout(timeoutSecs);
        log.error("Transaction timed out after {} seconds without being mined: {}", timeoutSecs, cause.getMessage());
    }

    /**
     * nonce 冲突通常说明之前某次超时的尝试最终上链了。首次尝试或尚无广播记录时冲突无法解释，直接终止。
     */
    private AnchorTransaction handleNonceConflict(TransactionRequest request,
                                                  AttemptHistory history,
                                                  int attempt,
                                                  ChainId chainId,
                                                  NonceConflictException cause) {
        observer.nonceExpired(request.getNonce());
        if (attempt == 0 || history.isEmpty()) {
            log.error("Unexplained nonce conflict nonce={} attempt={}: {}", request.getNonce(), attempt, cause.getMessage());
            throw cause;
        }
        log.warn("Nonce {} already used; checking {} previous attempts", request.getNonce(), history.size());
        return checkForPreviousTransactionSuccess(history, chainId, cause);
    }

    private AnchorTransaction checkForPreviousTransactionSuccess(AttemptHistory history,
                                                                 ChainId chainId,
                                                                 NonceConflictException cause) {
        for (TransactionResponse previous : history.newestFirst()) {
            try {
                return waiter.confirm(previous, chainId);
            } catch (AnchorException e) {
                log.warn("Previous attempt txHash={} not confirmed: {}", previous.getHash(), e.getMessage());
            }
        }
        throw new PriorAttemptsUnconfirmedException("Failed to confirm any previous transaction attempts", cause);
    }

    private void pause() {
        long delayMs = config.getRetryDelay().toMillis();
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new AnchorException("Interrupted while waiting to retry", ie);
        }
    }
}
