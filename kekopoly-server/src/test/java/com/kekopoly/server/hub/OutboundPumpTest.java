package com.kekopoly.server.hub;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.kekopoly.server.config.ServerConfig;
import com.kekopoly.server.support.RecordingChannel;
import com.kekopoly.shared.util.Priority;

public class OutboundPumpTest {

    private ServerConfig.Hub settings;
    private PriorityOutbox outbox;

    @BeforeEach
    public void setup() {
        settings = new ServerConfig.Hub();
        settings.setBatchSize(2);
        settings.setMinSendIntervalMillis(0);
        outbox = new PriorityOutbox(8, 8, 8);
    }

    private Client client(RecordingChannel channel) {
        return new Client(channel, outbox, "g1", "p1", "s1", 0L);
    }

    @Test
    public void testHighDrainsFullyThenOneNormalBatch() throws Exception {
        RecordingChannel channel = new RecordingChannel("c");
        OutboundPump pump = new OutboundPump(client(channel), settings, (c, e) -> fail(e));
        outbox.offer("l1", Priority.LOW);
        outbox.offer("n1", Priority.NORMAL);
        outbox.offer("n2", Priority.NORMAL);
        outbox.offer("n3", Priority.NORMAL);
        outbox.offer("h1", Priority.HIGH);
        outbox.offer("h2", Priority.HIGH);
        outbox.offer("h3", Priority.HIGH);

        pump.drainOnce(outbox);
        assertEquals(List.of("h1", "h2", "h3", "n1", "n2"), channel.frames());

        pump.drainOnce(outbox);
        assertEquals(List.of("h1", "h2", "h3", "n1", "n2", "n3"), channel.frames());

        pump.drainOnce(outbox);
        assertEquals("l1", channel.frames().get(6));
    }

    @Test
    public void testLowBatchYieldsToNewHighFrame() throws Exception {
        RecordingChannel channel = new RecordingChannel("c") {
            private boolean injected;

            @Override
            public void send(String frame) {
                super.send(frame);
                if (!injected) {
                    injected = true;
                    outbox.offer("urgent", Priority.HIGH);
                }
            }
        };
        OutboundPump pump = new OutboundPump(client(channel), settings, (c, e) -> fail(e));
        outbox.offer("l1", Priority.LOW);
        outbox.offer("l2", Priority.LOW);

        pump.drainOnce(outbox);
        assertEquals(List.of("l1"), channel.frames());

        pump.drainOnce(outbox);
        assertEquals(List.of("l1", "urgent", "l2"), channel.frames());
    }

    @Test
    public void testClosedSocketFailsTheWrite() {
        RecordingChannel channel = new RecordingChannel("c");
        channel.close(1000, "bye");
        OutboundPump pump = new OutboundPump(client(channel), settings, (c, e) -> fail(e));
        outbox.offer("n1", Priority.NORMAL);

        assertThrows(IllegalStateException.class, () -> pump.drainOnce(outbox));
    }

    @Test
    public void testSendFailureIsReportedAndStopsTheWriter() throws Exception {
        RecordingChannel channel = new RecordingChannel("c");
        channel.failSends();
        Client client = client(channel);
        CountDownLatch failed = new CountDownLatch(1);
        AtomicReference<Client> reported = new AtomicReference<>();
        Thread writer = new Thread(new OutboundPump(client, settings, (c, e) -> {
            reported.set(c);
            failed.countDown();
        }));
        writer.start();

        outbox.offer("n1", Priority.NORMAL);

        assertTrue(failed.await(2, TimeUnit.SECONDS));
        assertSame(client, reported.get());
        writer.join(2000);
        assertFalse(writer.isAlive());
    }

    @Test
    public void testSendsAreSpacedByMinimumInterval() throws Exception {
        settings.setMinSendIntervalMillis(20);
        RecordingChannel channel = new RecordingChannel("c");
        OutboundPump pump = new OutboundPump(client(channel), settings, (c, e) -> fail(e));
        outbox.offer("h1", Priority.HIGH);
        outbox.offer("h2", Priority.HIGH);
        outbox.offer("h3", Priority.HIGH);

        long start = System.nanoTime();
        pump.drainOnce(outbox);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(3, channel.frames().size());
        assertTrue(elapsedMillis >= 35, "elapsed " + elapsedMillis);
    }

    @Test
    public void testIdleWriterPingsAndStopsOnClose() throws Exception {
        settings.setPingIntervalSeconds(1);
        RecordingChannel channel = new RecordingChannel("c");
        Thread writer = new Thread(new OutboundPump(client(channel), settings, (c, e) -> fail(e)));
        writer.start();

        long deadline = System.currentTimeMillis() + 3000;
        while (channel.pings() == 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertTrue(channel.pings() >= 1);

        outbox.close();
        writer.join(2000);
        assertFalse(writer.isAlive());
    }
}
