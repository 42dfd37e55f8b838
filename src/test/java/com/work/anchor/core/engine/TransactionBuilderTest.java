package com.work.anchor.core.engine;

import com.work.anchor.core.config.AnchorConfig;
import com.work.anchor.core.config.AnchorMode;
import com.work.anchor.core.model.AnchorPayload;
import com.work.anchor.core.model.TransactionRequest;
import com.work.anchor.core.signer.Signer;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.Hash;

import java.math.BigInteger;
import java.time.Duration;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class TransactionBuilderTest {

    private static final String SENDER = "0x00000000000000000000000000000000000a11ce";
    private static final String CONTRACT = "0x231055a0852d67c7107ad0d0dfeab60278fe6adc";

    private static AnchorConfig config(AnchorMode mode) {
        return new AnchorConfig(mode, mode == AnchorMode.SMART_CONTRACT ? CONTRACT : null, Duration.ofSeconds(60),
                false, null, 4, 3, Duration.ZERO);
    }

    private static Signer signer() {
        Signer signer = mock(Signer.class);
        when(signer.getAddress()).thenReturn(SENDER);
        when(signer.getNonce(eq(SENDER))).thenReturn(BigInteger.valueOf(7));
        return signer;
    }

    @Test
    public void raw_data_mode_sends_to_self_with_multibase_hex() {
        Signer signer = signer();
        TransactionRequest req = new TransactionBuilder(signer, config(AnchorMode.RAW_DATA))
                .build(AnchorPayload.of(new byte[]{0x01, 0x71}));

        assertEquals(SENDER, req.getTo());
        assertEquals(SENDER, req.getFrom());
        assertEquals(BigInteger.valueOf(7), req.getNonce());
        assertEquals("0x0f0171", req.getData());
        verify(signer, times(1)).getNonce(eq(SENDER));
    }

    @Test
    public void smart_contract_mode_calls_anchor_function_with_digest() {
        byte[] payload = new byte[36];
        payload[0] = 0x01;
        payload[1] = 0x71;
        payload[2] = 0x12;
        payload[3] = 0x20;
        Arrays.fill(payload, 4, 36, (byte) 0xab);

        TransactionRequest req = new TransactionBuilder(signer(), config(AnchorMode.SMART_CONTRACT))
                .build(AnchorPayload.of(payload));

        StringBuilder digest = new StringBuilder();
        for (int i = 0; i < 32; i++) {
            digest.append("ab");
        }
        String selector = Hash.sha3String("anchorDagCbor(bytes32)").substring(0, 10);
        assertEquals(CONTRACT, req.getTo());
        assertEquals(SENDER, req.getFrom());
        assertEquals(selector + digest, req.getData());
    }

    @Test
    public void smart_contract_mode_rejects_payload_without_32_byte_digest() {
        TransactionBuilder builder = new TransactionBuilder(signer(), config(AnchorMode.SMART_CONTRACT));
        assertThrows(IllegalArgumentException.class, () -> builder.build(AnchorPayload.of(new byte[]{0x01, 0x71})));
    }
}
