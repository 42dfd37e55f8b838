package com.work.anchor.chain.mock;

import com.work.anchor.core.exception.InsufficientFundsException;
import com.work.anchor.core.exception.NonceConflictException;
import com.work.anchor.core.model.ChainId;
import com.work.anchor.core.model.TransactionReceipt;
import com.work.anchor.core.model.TransactionRequest;
import com.work.anchor.core.model.TransactionResponse;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class MockSignerTest {

    private static final String SENDER = "0x00000000000000000000000000000000000a11ce";

    private static TransactionRequest priced(long nonce) {
        TransactionRequest req = new TransactionRequest(SENDER, "0x0f01", BigInteger.valueOf(nonce), SENDER);
        req.setGasPrice(BigInteger.valueOf(10));
        req.setGasLimit(BigInteger.valueOf(21_000));
        return req;
    }

    @Test
    public void broadcast_mines_and_deducts_cost() {
        MockSigner signer = new MockSigner(SENDER, ChainId.of(1337), BigInteger.valueOf(1_000_000));

        TransactionResponse resp = signer.broadcast(priced(0));
        Optional<TransactionReceipt> receipt = signer.waitForReceipt(resp.getHash(), 4, 0L);

        assertTrue(receipt.isPresent());
        assertTrue(receipt.get().isSuccess());
        assertNotNull(signer.getBlock(receipt.get().getBlockHash()));
        assertEquals(BigInteger.valueOf(1_000_000 - 210_000), signer.getBalance(SENDER));
        assertEquals(BigInteger.ONE, signer.getNonce(SENDER));
    }

    @Test
    public void reused_nonce_is_rejected() {
        MockSigner signer = new MockSigner(SENDER, ChainId.of(1337), BigInteger.valueOf(1_000_000));
        signer.broadcast(priced(0));

        assertThrows(NonceConflictException.class, () -> signer.broadcast(priced(0)));
    }

    @Test
    public void cost_above_balance_is_rejected() {
        MockSigner signer = new MockSigner(SENDER, ChainId.of(1337), BigInteger.valueOf(1_000));

        assertThrows(InsufficientFundsException.class, () -> signer.broadcast(priced(0)));
        assertEquals(BigInteger.ZERO, signer.getNonce(SENDER));
    }
}
