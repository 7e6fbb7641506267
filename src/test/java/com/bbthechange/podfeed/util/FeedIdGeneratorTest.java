package com.bbthechange.podfeed.util;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class FeedIdGeneratorTest {

    @Test
    void generate_ReturnsTenCharactersWithoutLookAlikes() {
        for (int i = 0; i < 200; i++) {
            String id = FeedIdGenerator.generate();

            assertThat(id).hasSize(10);
            assertThat(id).matches("[a-km-np-z2-9]+");
        }
    }

    @Test
    void generate_ManyIds_AreDistinct() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            ids.add(FeedIdGenerator.generate());
        }

        assertThat(ids).hasSize(1000);
    }

    @Test
    void generateUnique_RetriesWhileIdIsTaken() {
        // Given - the first two candidates are reported as taken
        AtomicInteger checks = new AtomicInteger();

        // When
        String id = FeedIdGenerator.generateUnique(candidate -> checks.incrementAndGet() <= 2);

        // Then
        assertThat(id).hasSize(10);
        assertThat(checks.get()).isEqualTo(3);
    }
}
