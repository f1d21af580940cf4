package com.cw.contentflow.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
class FingerprintStoreTest {

    @Autowired
    FingerprintStore fingerprintStore;

    @Autowired
    JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("DELETE FROM CF_FINGERPRINT");
    }

    @Test
    void rememberIsIdempotent() {
        String fp = ContentHash.sha256Hex("https://news.example.com/a");

        assertThat(fingerprintStore.isDuplicate(fp)).isFalse();
        assertThat(fingerprintStore.remember(fp, "src")).isTrue();
        assertThat(fingerprintStore.remember(fp, "src")).isFalse();
        assertThat(fingerprintStore.remember(fp, "other")).isFalse();

        assertThat(fingerprintStore.isDuplicate(fp)).isTrue();
        assertThat(fingerprintStore.count()).isEqualTo(1);
    }

    @Test
    void concurrentRememberHasExactlyOneWinner() throws Exception {
        String fp = ContentHash.sha256Hex("https://news.example.com/race");
        int callers = 12;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return fingerprintStore.remember(fp, "race");
                }));
            }
            start.countDown();

            int winners = 0;
            for (Future<Boolean> f : futures) {
                if (f.get(10, TimeUnit.SECONDS)) winners++;
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
        Integer rows = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM CF_FINGERPRINT WHERE FINGERPRINT = ?", Integer.class, fp);
        assertThat(rows).isEqualTo(1);
    }

    @Test
    void sweepZeroRemovesEverythingRememberedSoFar() {
        fingerprintStore.remember(ContentHash.sha256Hex("a"), "src");
        fingerprintStore.remember(ContentHash.sha256Hex("b"), "src");

        assertThat(fingerprintStore.sweep(0)).isEqualTo(2);
        assertThat(fingerprintStore.isDuplicate(ContentHash.sha256Hex("a"))).isFalse();
        assertThat(fingerprintStore.count()).isZero();
    }

    @Test
    void sweepKeepsRecordsInsideRetention() {
        fingerprintStore.remember(ContentHash.sha256Hex("fresh"), "src");

        assertThat(fingerprintStore.sweep(30)).isZero();
        assertThat(fingerprintStore.count()).isEqualTo(1);
    }

    @Test
    void negativeRetentionIsRejected() {
        assertThatThrownBy(() -> fingerprintStore.sweep(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void blankFingerprintIsNeverDuplicate() {
        assertThat(fingerprintStore.isDuplicate("")).isFalse();
        assertThat(fingerprintStore.isDuplicate(null)).isFalse();
        assertThatThrownBy(() -> fingerprintStore.remember(" ", "src")).isInstanceOf(IllegalArgumentException.class);
    }
}
