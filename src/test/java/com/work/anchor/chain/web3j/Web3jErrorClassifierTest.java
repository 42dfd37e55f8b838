package com.work.anchor.chain.web3j;

import com.work.anchor.core.exception.AnchorException;
import com.work.anchor.core.exception.ConfirmationTimeoutException;
import com.work.anchor.core.exception.InsufficientFundsException;
import com.work.anchor.core.exception.NonceConflictException;
import com.work.anchor.core.exception.UnhandledTransportException;
import org.junit.jupiter.api.Test;
import org.web3j.protocol.core.Response;

import java.io.IOException;
import java.net.SocketTimeoutException;

import static org.junit.jupiter.api.Assertions.*;

public class Web3jErrorClassifierTest {

    private static AnchorException rpc(String message) {
        return Web3jErrorClassifier.classify("eth_sendRawTransaction", new Response.Error(-32000, message));
    }

    @Test
    public void insufficient_funds() {
        assertTrue(rpc("insufficient funds for gas * price + value") instanceof InsufficientFundsException);
    }

    @Test
    public void nonce_phrases() {
        assertTrue(rpc("nonce too low") instanceof NonceConflictException);
        assertTrue(rpc("Nonce has already been used") instanceof NonceConflictException);
        assertTrue(rpc("Transaction nonce is not the correct nonce") instanceof NonceConflictException);
    }

    @Test
    public void anything_else_is_unhandled_and_keeps_message() {
        AnchorException e = rpc("replacement transaction underpriced");
        assertTrue(e instanceof UnhandledTransportException);
        assertTrue(e.getMessage().contains("replacement transaction underpriced"));
        assertTrue(e.getMessage().contains("-32000"));
    }

    @Test
    public void io_errors() {
        assertTrue(Web3jErrorClassifier.classify("eth_sendRawTransaction", new SocketTimeoutException("Read timed out"))
                instanceof ConfirmationTimeoutException);
        AnchorException refused = Web3jErrorClassifier.classify("eth_chainId", new IOException("Connection refused"));
        assertTrue(refused instanceof UnhandledTransportException);
        assertTrue(refused.getCause() instanceof IOException);
    }
}
