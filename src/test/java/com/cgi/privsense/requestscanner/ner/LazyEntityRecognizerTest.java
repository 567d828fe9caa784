package com.cgi.privsense.requestscanner.ner;

import com.cgi.privsense.requestscanner.api.EntityRecognizer;
import com.cgi.privsense.requestscanner.exception.RecognizerInitializationException;
import com.cgi.privsense.requestscanner.model.EntitySpan;
import com.cgi.privsense.requestscanner.model.enums.EntityCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LazyEntityRecognizerTest {

    @Test
    @DisplayName("Should create the delegate on first use only")
    void initializesOnce() {
        AtomicInteger creations = new AtomicInteger();
        EntityRecognizer delegate = mock(EntityRecognizer.class);
        List<EntitySpan> spans = List.of(EntitySpan.builder().text("Ana Lima").category(EntityCategory.PERSON).build());
        when(delegate.recognize("texto")).thenReturn(spans);

        LazyEntityRecognizer lazy = new LazyEntityRecognizer(() -> {
            creations.incrementAndGet();
            return delegate;
        });

        assertFalse(lazy.isInitialized());
        assertEquals(0, creations.get());

        assertSame(spans, lazy.recognize("texto"));
        lazy.recognize("texto");

        assertTrue(lazy.isInitialized());
        assertEquals(1, creations.get());
        verify(delegate, times(2)).recognize("texto");
    }

    @Test
    @DisplayName("Should rethrow a failed initialization without retrying")
    void cachesFailure() {
        AtomicInteger attempts = new AtomicInteger();
        LazyEntityRecognizer lazy = new LazyEntityRecognizer(() -> {
            attempts.incrementAndGet();
            throw new RecognizerInitializationException("service down");
        });

        RecognizerInitializationException first =
                assertThrows(RecognizerInitializationException.class, () -> lazy.recognize("a"));
        RecognizerInitializationException second =
                assertThrows(RecognizerInitializationException.class, lazy::initialize);

        assertSame(first, second);
        assertEquals(1, attempts.get());
        assertFalse(lazy.isInitialized());
    }

    @Test
    @DisplayName("Should wrap unexpected factory errors")
    void wrapsFactoryErrors() {
        LazyEntityRecognizer lazy = new LazyEntityRecognizer(() -> {
            throw new IllegalStateException("model missing");
        });

        RecognizerInitializationException e =
                assertThrows(RecognizerInitializationException.class, lazy::initialize);
        assertTrue(e.getCause() instanceof IllegalStateException);
    }

    @Test
    @DisplayName("Should treat a null delegate as a failed initialization")
    void rejectsNullDelegate() {
        LazyEntityRecognizer lazy = new LazyEntityRecognizer(() -> null);

        assertThrows(RecognizerInitializationException.class, lazy::initialize);
        assertFalse(lazy.isInitialized());
    }

    @Test
    @DisplayName("Should initialize once under concurrent first use")
    void initializesOnceConcurrently() throws Exception {
        AtomicInteger creations = new AtomicInteger();
        LazyEntityRecognizer lazy = new LazyEntityRecognizer(() -> {
            creations.incrementAndGet();
            return text -> List.of();
        });

        int threads = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<EntityRecognizer>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<EntityRecognizer> task = () -> {
                    start.await();
                    return lazy.initialize();
                };
                futures.add(executor.submit(task));
            }
            start.countDown();

            EntityRecognizer first = futures.get(0).get(5, TimeUnit.SECONDS);
            for (Future<EntityRecognizer> future : futures) {
                assertSame(first, future.get(5, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, creations.get());
    }
}
