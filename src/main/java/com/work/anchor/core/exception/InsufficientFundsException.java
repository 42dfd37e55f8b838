package com.work.anchor.core.exception;

import java.math.BigInteger;

/**
 * 余额不足。
 *
 * 由 Signer 适配层抛出时 txCost/balance 为空（仅表示节点报告余额不足）；
 * 由编排器确认 cost > balance 后重新抛出时两者均有值。
 */
public class InsufficientFundsException extends AnchorException {

    private final BigInteger txCost;
    private final BigInteger balance;

    public InsufficientFundsException(String message) {
        this(message, null, null, null);
    }

    public InsufficientFundsException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    public InsufficientFundsException(String message, BigInteger txCost, BigInteger balance, Throwable cause) {
        super(message, cause);
        this.txCost = txCost;
        this.balance = balance;
    }

    public BigInteger getTxCost() {
        return txCost;
    }

    public BigInteger getBalance() {
        return balance;
    }
}
