package org.javai.callguard;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class OperationTest {

    @Test
    void of_success_isAlreadyComplete() {
        assertThat(Operation.of(() -> 42).start()).isCompletedWithValue(42);
    }

    @Test
    void of_checkedException_failsFuture() {
        IOException boom = new IOException("boom");

        CompletableFuture<String> started = Operation.<String>of(() -> {
            throw boom;
        }).start();

        assertThatThrownBy(started::join).hasCause(boom);
    }

    @Test
    void blocking_cancel_interruptsWorker() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        CountDownLatch running = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        try {
            CompletableFuture<String> started = Operation.<String>blocking(() -> {
                running.countDown();
                try {
                    Thread.sleep(60_000);
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    throw e;
                }
                return "never";
            }, executor).start();

            assertThat(running.await(5, TimeUnit.SECONDS)).isTrue();
            started.cancel(true);

            assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void futuresStart_syncThrowOrNull_becomesFailedFuture() {
        Operation<String> throwing = () -> {
            throw new IllegalStateException("x");
        };
        Operation<String> nothing = () -> null;

        assertThat(Futures.start(throwing)).isCompletedExceptionally();
        assertThatThrownBy(Futures.start(nothing)::join).hasCauseInstanceOf(NullPointerException.class);
    }

    @Test
    void futuresUnwrap_stripsCompletionWrappers() {
        IOException root = new IOException("root");

        assertThat(Futures.unwrap(new CompletionException(new ExecutionException(root)))).isSameAs(root);
        assertThat(Futures.unwrap(root)).isSameAs(root);
    }
}
