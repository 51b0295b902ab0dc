package com.boardhub.gameservice.serializer.gate;

import com.boardhub.gameservice.platform.transport.ChatTransport;
import com.boardhub.gameservice.serializer.event.Attachment;
import com.boardhub.gameservice.serializer.event.InboundEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@Timeout(10)
class CommandSerializerImplTest {

    private static final String CHANNEL = "channel-1";

    @Mock
    private ChatTransport transport;

    private CommandSerializerImpl serializer;
    private ExecutorService pool;
    private final List<InboundEvent> replayed = new CopyOnWriteArrayList<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();

    @BeforeEach
    void setUp() {
        serializer = new CommandSerializerImpl(transport);
        serializer.setReplayHandler(event -> serializer.submit(event, true, () -> mutate(() -> replayed.add(event))));
        pool = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void idleSessionRunsImmediately() {
        Optional<String> result = serializer.submit(event("m1", "!roll"), false, () -> "done");

        assertThat(result).contains("done");
        assertThat(serializer.isBusy(CHANNEL)).isFalse();
        verify(transport, never()).delete(any(), any());
    }

    @Test
    void eventsArrivingWhileBusyAreRetractedAndReplayedInArrivalOrder() throws Exception {
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Future<Optional<String>> first = pool.submit(() -> serializer.submit(event("m0", "!roll"), false,
                () -> mutate(() -> {
                    holding.countDown();
                    await(release);
                    return "first";
                })));
        assertThat(holding.await(5, TimeUnit.SECONDS)).isTrue();

        for (int i = 1; i <= 3; i++) {
            Optional<String> queued = serializer.submit(event("m" + i, "!roll"), false, () -> "should not run");
            assertThat(queued).isEmpty();
        }
        assertThat(serializer.pendingCount(CHANNEL)).isEqualTo(3);
        verify(transport).delete(CHANNEL, "m1");
        verify(transport).delete(CHANNEL, "m2");
        verify(transport).delete(CHANNEL, "m3");

        release.countDown();

        assertThat(first.get(5, TimeUnit.SECONDS)).contains("first");
        assertThat(replayed).extracting(InboundEvent::messageId).containsExactly("m1", "m2", "m3");
        assertThat(maxInFlight.get()).isEqualTo(1);
        assertThat(serializer.isBusy(CHANNEL)).isFalse();
    }

    @Test
    void slowAttachmentCaptureDoesNotReorderReplay() throws Exception {
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch slowRead = new CountDownLatch(1);
        when(transport.readAttachment(any())).thenAnswer(inv -> {
            await(slowRead);
            return "picture".getBytes(StandardCharsets.UTF_8);
        });
        Future<Optional<String>> first = pool.submit(() -> serializer.submit(event("m0", "!roll"), false,
                () -> mutate(() -> {
                    holding.countDown();
                    await(release);
                    return "first";
                })));
        assertThat(holding.await(5, TimeUnit.SECONDS)).isTrue();

        Attachment pic = Attachment.remote("pic.png", "image/png", "https://cdn.example/pic.png");
        Future<Optional<String>> withAttachment = pool.submit(() ->
                serializer.submit(event("m1", "look", pic), false, () -> "should not run"));
        waitUntil(() -> serializer.pendingCount(CHANNEL) == 1);
        serializer.submit(event("m2", "!list"), false, () -> "should not run");

        release.countDown();
        slowRead.countDown();

        assertThat(withAttachment.get(5, TimeUnit.SECONDS)).isEmpty();
        first.get(5, TimeUnit.SECONDS);
        assertThat(replayed).extracting(InboundEvent::messageId).containsExactly("m1", "m2");
        Attachment captured = replayed.get(0).attachments().get(0);
        assertThat(captured.isMaterialized()).isTrue();
        assertThat(new String(captured.content(), StandardCharsets.UTF_8)).isEqualTo("picture");
    }

    @Test
    void zeroByteAttachmentIsDroppedAndTheAuthorIsTold() throws Exception {
        when(transport.readAttachment(any())).thenReturn(new byte[0]);

        runWhileBusy(() -> serializer.submit(
                event("m1", "my avatar", Attachment.remote("avatar.png", "image/png", "https://cdn.example/a.png")),
                false, () -> "should not run"));

        assertThat(replayed).hasSize(1);
        assertThat(replayed.get(0).attachments()).isEmpty();
        assertThat(replayed.get(0).text()).isEqualTo("my avatar");
        verify(transport).notifyUser(eq(CHANNEL), eq("author"), contains("avatar.png"));
    }

    @Test
    void unreadableAttachmentIsDroppedWithoutBlockingTheQueue() throws Exception {
        when(transport.readAttachment(any())).thenThrow(new IOException("connection reset"));

        runWhileBusy(() -> serializer.submit(
                event("m1", "!roll", Attachment.remote("x.png", "image/png", "https://cdn.example/x.png")),
                false, () -> "should not run"));

        assertThat(replayed).extracting(InboundEvent::messageId).containsExactly("m1");
        assertThat(replayed.get(0).attachments()).isEmpty();
        verify(transport).notifyUser(eq(CHANNEL), eq("author"), contains("x.png"));
    }

    @Test
    void failedReplayDoesNotStopTheRest() throws Exception {
        serializer.setReplayHandler(event -> {
            if (event.messageId().equals("m1")) {
                throw new IllegalStateException("boom");
            }
            replayed.add(event);
        });

        runWhileBusy(() -> {
            serializer.submit(event("m1", "!roll"), false, () -> "x");
            serializer.submit(event("m2", "!roll"), false, () -> "x");
        });

        assertThat(replayed).extracting(InboundEvent::messageId).containsExactly("m2");
        assertThat(serializer.isBusy(CHANNEL)).isFalse();
    }

    @Test
    void reentrantSubmitOnTheSameThreadIsDropped() {
        AtomicInteger innerRuns = new AtomicInteger();

        Optional<String> result = serializer.submit(event("m0", "!roll"), false, () -> {
            Optional<String> nested = serializer.submit(event("m1", "!roll"), false, () -> {
                innerRuns.incrementAndGet();
                return "inner";
            });
            Optional<String> nestedLock = serializer.withLock(CHANNEL, () -> {
                innerRuns.incrementAndGet();
                return "inner";
            });
            return nested.isEmpty() && nestedLock.isEmpty() ? "outer" : "broken";
        });

        assertThat(result).contains("outer");
        assertThat(innerRuns.get()).isZero();
        assertThat(serializer.pendingCount(CHANNEL)).isZero();
        verify(transport, never()).delete(any(), any());
    }

    @Test
    void backgroundOperationSkipsBusySession() throws Exception {
        AtomicInteger runs = new AtomicInteger();

        runWhileBusy(() -> assertThat(serializer.tryWithLock(CHANNEL, runs::incrementAndGet)).isEmpty());

        assertThat(runs.get()).isZero();
        assertThat(serializer.tryWithLock(CHANNEL, runs::incrementAndGet)).contains(1);
    }

    @Test
    void blockingOperationWaitsForTheQueueToDrain() throws Exception {
        List<String> order = new CopyOnWriteArrayList<>();
        serializer.setReplayHandler(event -> order.add(event.messageId()));
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Future<?> first = pool.submit(() -> serializer.submit(event("m0", "!roll"), false, () -> {
            holding.countDown();
            await(release);
            order.add("m0");
            return null;
        }));
        assertThat(holding.await(5, TimeUnit.SECONDS)).isTrue();
        serializer.submit(event("m1", "!roll"), false, () -> null);
        Future<Optional<Boolean>> query = pool.submit(() -> serializer.withLock(CHANNEL, () -> order.add("query")));

        release.countDown();

        first.get(5, TimeUnit.SECONDS);
        assertThat(query.get(5, TimeUnit.SECONDS)).contains(true);
        assertThat(order).containsExactly("m0", "m1", "query");
    }

    @Test
    void sessionsDoNotBlockEachOther() throws Exception {
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Future<?> busy = pool.submit(() -> serializer.submit(event("m0", "!roll"), false, () -> {
            holding.countDown();
            await(release);
            return null;
        }));
        assertThat(holding.await(5, TimeUnit.SECONDS)).isTrue();

        InboundEvent elsewhere = new InboundEvent("x1", "channel-2", "author", "!roll", List.of(), null, Instant.now());
        assertThat(serializer.submit(elsewhere, false, () -> "ran")).contains("ran");

        release.countDown();
        busy.get(5, TimeUnit.SECONDS);
    }

    // ==================== 工具 ====================

    /** 在另一个线程持有会话锁期间执行 body，然后放开锁并等待重放结束 */
    private void runWhileBusy(Runnable body) throws Exception {
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Future<?> holder = pool.submit(() -> serializer.submit(event("holder", "!roll"), false, () -> {
            holding.countDown();
            await(release);
            return null;
        }));
        assertThat(holding.await(5, TimeUnit.SECONDS)).isTrue();
        try {
            body.run();
        } finally {
            release.countDown();
        }
        holder.get(5, TimeUnit.SECONDS);
    }

    private <T> T mutate(Supplier<T> body) {
        int now = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(now, Math::max);
        try {
            return body.get();
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("latch timed out");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met in time");
            }
            Thread.sleep(5);
        }
    }

    private static InboundEvent event(String messageId, String text, Attachment... attachments) {
        return new InboundEvent(messageId, CHANNEL, "author", text, List.of(attachments), null, Instant.now());
    }
}
