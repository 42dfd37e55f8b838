package com.work.anchor.core.engine;

import com.work.anchor.core.config.AnchorConfig;
import com.work.anchor.core.config.AnchorMode;
import com.work.anchor.core.exception.UnhandledTransportException;
import com.work.anchor.core.model.FeeEstimate;
import com.work.anchor.core.model.TransactionRequest;
import com.work.anchor.core.signer.Signer;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class FeeEstimatorTest {

    private static AnchorConfig config(boolean overrideGas) {
        return new AnchorConfig(AnchorMode.RAW_DATA, null, Duration.ofSeconds(60), overrideGas,
                BigInteger.valueOf(50_000), 4, 3, Duration.ZERO);
    }

    private static BigInteger big(long v) {
        return BigInteger.valueOf(v);
    }

    private static TransactionRequest request() {
        return new TransactionRequest("0x00000000000000000000000000000000000a11ce", "0x0f01", big(7),
                "0x00000000000000000000000000000000000a11ce");
    }

    @Test
    public void pad_adds_a_tenth_rounded_down() {
        assertEquals(big(0), FeeEstimator.pad(big(0)));
        assertEquals(big(9), FeeEstimator.pad(big(9)));
        assertEquals(big(11), FeeEstimator.pad(big(10)));
        assertEquals(big(16), FeeEstimator.pad(big(15)));
        assertEquals(big(110), FeeEstimator.pad(big(100)));
        assertEquals(big(2211), FeeEstimator.pad(big(2010)));
    }

    @Test
    public void increase_uses_max_of_estimate_and_previous() {
        assertEquals(big(110), FeeEstimator.increaseGasPricePerAttempt(big(100), null));
        assertEquals(big(220), FeeEstimator.increaseGasPricePerAttempt(big(100), big(200)));
        assertEquals(big(330), FeeEstimator.increaseGasPricePerAttempt(big(300), big(200)));
    }

    @Test
    public void fee_market_first_attempt() {
        Signer signer = mock(Signer.class);
        when(signer.getFeeEstimate()).thenReturn(FeeEstimate.feeMarket(big(2000), big(100)));
        when(signer.estimateGas(any(TransactionRequest.class))).thenReturn(big(21000));

        TransactionRequest req = request();
        new FeeEstimator(signer, config(false)).price(req);

        assertEquals(big(110), req.getMaxPriorityFeePerGas());
        assertEquals(big(2211), req.getMaxFeePerGas());
        assertNull(req.getGasPrice());
        assertEquals(big(21000), req.getGasLimit());
        assertEquals(big(7), req.getNonce());
    }

    @Test
    public void fee_market_retry_escalates_above_previous_priority_fee() {
        Signer signer = mock(Signer.class);
        when(signer.getFeeEstimate()).thenReturn(FeeEstimate.feeMarket(big(2000), big(100)));
        when(signer.estimateGas(any(TransactionRequest.class))).thenReturn(big(21000));

        TransactionRequest req = request();
        req.setMaxPriorityFeePerGas(big(200));
        req.setMaxFeePerGas(big(5000));
        new FeeEstimator(signer, config(false)).price(req);

        // baseFee = 1900, priority = pad(200) = 220, maxFee = pad(2120)
        assertEquals(big(220), req.getMaxPriorityFeePerGas());
        assertEquals(big(2332), req.getMaxFeePerGas());
    }

    @Test
    public void legacy_price_escalates_every_attempt_even_if_estimate_drops() {
        Signer signer = mock(Signer.class);
        when(signer.getFeeEstimate())
                .thenReturn(FeeEstimate.legacy(big(1000)))
                .thenReturn(FeeEstimate.legacy(big(1000)))
                .thenReturn(FeeEstimate.legacy(big(500)));
        when(signer.estimateGas(any(TransactionRequest.class))).thenReturn(big(21000));

        FeeEstimator estimator = new FeeEstimator(signer, config(false));
        TransactionRequest req = request();

        estimator.price(req);
        assertEquals(big(1100), req.getGasPrice());
        estimator.price(req);
        assertEquals(big(1210), req.getGasPrice());
        estimator.price(req);
        assertEquals(big(1331), req.getGasPrice());
        assertNull(req.getMaxFeePerGas());
        assertNull(req.getMaxPriorityFeePerGas());
    }

    @Test
    public void override_gas_config_skips_estimation() {
        Signer signer = mock(Signer.class);
        when(signer.getFeeEstimate()).thenReturn(FeeEstimate.legacy(big(1000)));

        TransactionRequest req = request();
        new FeeEstimator(signer, config(true)).price(req);

        assertEquals(big(50_000), req.getGasLimit());
        assertEquals(big(1100), req.getGasPrice());
        verify(signer, never()).estimateGas(any());
    }

    @Test
    public void legacy_estimate_without_gas_price_fails() {
        Signer signer = mock(Signer.class);
        when(signer.getFeeEstimate()).thenReturn(new FeeEstimate(null, null, null));

        assertThrows(UnhandledTransportException.class,
                () -> new FeeEstimator(signer, config(false)).price(request()));
    }
}
