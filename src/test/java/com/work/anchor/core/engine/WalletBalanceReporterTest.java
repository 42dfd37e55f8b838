package com.work.anchor.core.engine;

import com.work.anchor.core.observer.AnchorObserver;
import com.work.anchor.core.signer.Signer;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class WalletBalanceReporterTest {

    @Test
    public void reports_balance_before_and_after_and_returns_result_unchanged() {
        Signer signer = mock(Signer.class);
        AnchorObserver observer = mock(AnchorObserver.class);
        when(signer.getBalance(eq("a1"))).thenReturn(BigInteger.valueOf(100)).thenReturn(BigInteger.valueOf(90));

        String result = new WalletBalanceReporter(signer, observer).withWalletBalance("a1", () -> "done");

        assertEquals("done", result);
        InOrder inOrder = inOrder(observer);
        inOrder.verify(observer).walletBalance(BigInteger.valueOf(100));
        inOrder.verify(observer).walletBalance(BigInteger.valueOf(90));
    }

    @Test
    public void failure_propagates_after_starting_balance() {
        Signer signer = mock(Signer.class);
        AnchorObserver observer = mock(AnchorObserver.class);
        when(signer.getBalance(eq("a1"))).thenReturn(BigInteger.valueOf(100));

        WalletBalanceReporter reporter = new WalletBalanceReporter(signer, observer);
        assertThrows(IllegalStateException.class, () -> reporter.withWalletBalance("a1", () -> {
            throw new IllegalStateException("boom");
        }));

        verify(observer, times(1)).walletBalance(BigInteger.valueOf(100));
        verify(signer, times(1)).getBalance(eq("a1"));
    }
}
