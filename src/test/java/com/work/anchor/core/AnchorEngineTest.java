package com.work.anchor.core;

import com.work.anchor.chain.mock.MockSigner;
import com.work.anchor.core.config.AnchorConfig;
import com.work.anchor.core.exception.ConfigurationException;
import com.work.anchor.core.exception.UnhandledTransportException;
import com.work.anchor.core.model.AnchorPayload;
import com.work.anchor.core.model.AnchorTransaction;
import com.work.anchor.core.model.ChainId;
import com.work.anchor.core.observer.AnchorObserver;
import com.work.anchor.core.observer.NoopAnchorObserver;
import com.work.anchor.core.signer.Signer;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class AnchorEngineTest {

    private static final String SENDER = "0x00000000000000000000000000000000000a11ce";
    private static final AnchorPayload PAYLOAD = AnchorPayload.of(new byte[]{0x01, 0x71, 0x12, 0x20});

    private final AnchorConfig config = AnchorConfig.rawData(Duration.ofSeconds(30));

    @Test
    public void chain_id_unavailable_before_connect() {
        AnchorEngine engine = new AnchorEngine(mock(Signer.class), config, new NoopAnchorObserver());

        IllegalStateException e = assertThrows(IllegalStateException.class, engine::getChainId);
        assertEquals("No chainId available", e.getMessage());
        assertThrows(IllegalStateException.class, () -> engine.submit(PAYLOAD));
    }

    @Test
    public void connect_caches_chain_id() {
        Signer signer = mock(Signer.class);
        when(signer.getChainId()).thenReturn(ChainId.of(5));

        AnchorEngine engine = new AnchorEngine(signer, config, new NoopAnchorObserver());
        engine.connect();

        assertEquals("eip155:5", engine.getChainId());
        assertEquals("eip155:5", engine.getChainId());
        verify(signer, times(1)).getChainId();
    }

    @Test
    public void unreachable_endpoint_is_configuration_error() {
        Signer signer = mock(Signer.class);
        when(signer.getChainId()).thenThrow(new UnhandledTransportException("eth_chainId failed: connection refused"));

        AnchorEngine engine = new AnchorEngine(signer, config, new NoopAnchorObserver());

        ConfigurationException e = assertThrows(ConfigurationException.class, engine::connect);
        assertTrue(e.getMessage().contains("connection refused"));
    }

    @Test
    public void submit_against_mock_chain_reports_balances_and_advances_nonce() {
        MockSigner signer = new MockSigner(SENDER, ChainId.of(1337), BigInteger.TEN.pow(18));
        AnchorObserver observer = mock(AnchorObserver.class);
        AnchorEngine engine = new AnchorEngine(signer, config, observer);
        engine.connect();

        AnchorTransaction first = engine.submit(PAYLOAD);
        AnchorTransaction second = engine.submit(PAYLOAD);

        assertEquals("eip155:1337", first.getChainId());
        assertEquals(1L, first.getBlockNumber());
        assertEquals(2L, second.getBlockNumber());
        assertNotEquals(first.getTransactionHash(), second.getTransactionHash());
        assertEquals(BigInteger.valueOf(2), signer.getNonce(SENDER));
        verify(observer, times(4)).walletBalance(any(BigInteger.class));
        verify(observer, times(2)).txResponse(any(), any(), any(), any());
    }
}
