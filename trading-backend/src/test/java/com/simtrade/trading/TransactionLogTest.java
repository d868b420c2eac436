package com.simtrade.trading;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TransactionLog Tests")
class TransactionLogTest {

    private static Transaction tx(String id) {
        return new Transaction(id, "AAPL", TransactionType.BUY, 1, 10.0, 10.0, 1.0,
            Instant.EPOCH, TransactionStatus.PENDING, 100.0, 89.0, null, null);
    }

    @Test
    @DisplayName("Recent returns newest first up to the limit")
    void testRecent() {
        var log = new TransactionLog();
        log.append(tx("tx_1"));
        log.append(tx("tx_2"));
        log.append(tx("tx_3"));

        assertThat(log.recent(2)).extracting(Transaction::id).containsExactly("tx_3", "tx_2");
        assertThat(log.all()).extracting(Transaction::id).containsExactly("tx_1", "tx_2", "tx_3");
    }

    @Test
    @DisplayName("Transition replaces the entry in place")
    void testTransition() {
        var log = new TransactionLog();
        log.append(tx("tx_1"));
        log.append(tx("tx_2"));

        log.transition("tx_1", TransactionStatus.COMPLETED, null);

        assertThat(log.all()).extracting(Transaction::status)
            .containsExactly(TransactionStatus.COMPLETED, TransactionStatus.PENDING);
        assertThatThrownBy(() -> log.transition("tx_1", TransactionStatus.FAILED, "late"))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> log.transition("tx_9", TransactionStatus.COMPLETED, null))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Duplicate ids are refused")
    void testDuplicate() {
        var log = new TransactionLog();
        log.append(tx("tx_1"));

        assertThatThrownBy(() -> log.append(tx("tx_1"))).isInstanceOf(IllegalStateException.class);
        assertThat(log.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Restore keeps order and lookups")
    void testRestore() {
        var log = new TransactionLog();
        log.restore(List.of(tx("tx_a"), tx("tx_b")));

        assertThat(log.find("tx_b")).isPresent();
        assertThat(log.recent(1)).extracting(Transaction::id).containsExactly("tx_b");
    }
}
