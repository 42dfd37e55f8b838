package com.work.anchor.core.engine;

import com.work.anchor.core.observer.AnchorObserver;
import com.work.anchor.core.signer.Signer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.function.Supplier;

/**
 * 在一次完整提交前后上报钱包余额，只观测，不影响结果。
 */
public class WalletBalanceReporter {

    private static final Logger log = LoggerFactory.getLogger(WalletBalanceReporter.class);

    private final Signer signer;
    private final AnchorObserver observer;

    public WalletBalanceReporter(Signer signer, AnchorObserver observer) {
        this.signer = signer;
        this.observer = observer;
    }

    public <T> T withWalletBalance(String address, Supplier<T> operation) {
        BigInteger starting = signer.getBalance(address);
        observer.walletBalance(starting);
        log.debug("Current wallet balance is {}", starting);

        T result = operation.get();

        BigInteger ending = signer.getBalance(address);
        observer.walletBalance(ending);
        log.debug("Wallet balance after submission is {}", ending);
        return result;
    }
}
