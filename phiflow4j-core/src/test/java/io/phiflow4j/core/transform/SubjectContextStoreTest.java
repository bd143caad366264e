/*
 * Copyright (c) 2025 Phiflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.phiflow4j.core.transform;

import static org.assertj.core.api.Assertions.assertThat;

import io.phiflow4j.core.api.model.PhiCategory;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class SubjectContextStoreTest {

    private final SecureHasher hasher = new SecureHasher("test-salt");

    @Test
    void forSubject_shouldMemoizeContextAndShift() {
        SubjectContextStore store = new SubjectContextStore(hasher);

        SubjectContext a = store.forSubject("p1");
        SubjectContext b = store.forSubject("p1");

        assertThat(a).isSameAs(b);
        assertThat(a.shiftDays()).isEqualTo(71);
        assertThat(a.subjectId()).hasValue("p1");
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void forSubject_shouldReturnEphemeralContextWithoutSubject() {
        SubjectContextStore store = new SubjectContextStore(hasher, 45);

        SubjectContext a = store.forSubject(null);
        SubjectContext b = store.forSubject(" ");

        assertThat(a).isNotSameAs(b);
        assertThat(a.subjectId()).isEmpty();
        assertThat(a.shiftDays()).isEqualTo(45);
        assertThat(store.size()).isZero();
    }

    @Test
    void resetAndClear_shouldForgetSubjects() {
        SubjectContextStore store = new SubjectContextStore(hasher);
        SubjectContext first = store.forSubject("p1");
        store.forSubject("p2");

        store.reset("p1");
        assertThat(store.contains("p1")).isFalse();
        assertThat(store.forSubject("p1")).isNotSameAs(first);

        store.clear();
        assertThat(store.size()).isZero();
    }

    @Test
    void concurrentFirstUse_shouldPublishOnePseudonym() throws Exception {
        SubjectContextStore store = new SubjectContextStore(hasher);
        Pseudonymizer pseudonymizer = new Pseudonymizer(hasher);
        RuleBook rules = RuleBook.defaults();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<String>> results = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                Callable<String> task = () -> {
                    start.await();
                    SubjectContext ctx = store.forSubject("shared");
                    return pseudonymizer.pseudonymize("Jane Doe", PhiCategory.NAME, rules, ctx);
                };
                results.add(pool.submit(task));
            }
            start.countDown();
            Set<String> distinct = ConcurrentHashMap.newKeySet();
            for (Future<String> f : results) distinct.add(f.get(10, TimeUnit.SECONDS));

            assertThat(distinct).hasSize(1);
            assertThat(store.size()).isEqualTo(1);
            assertThat(store.forSubject("shared").pseudonymCount()).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
