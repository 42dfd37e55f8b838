package com.work.anchor.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AttemptHistoryTest {

    @Test
    public void newest_first_does_not_change_history() {
        AttemptHistory history = new AttemptHistory();
        assertTrue(history.isEmpty());
        history.append(new TransactionResponse("h1", ChainId.of(1), null, null, "a", "0x"));
        history.append(new TransactionResponse("h2", ChainId.of(1), null, null, "a", "0x"));

        List<TransactionResponse> newest = history.newestFirst();
        assertEquals("h2", newest.get(0).getHash());
        assertEquals("h1", newest.get(1).getHash());

        newest.clear();
        assertEquals(2, history.size());
    }
}
