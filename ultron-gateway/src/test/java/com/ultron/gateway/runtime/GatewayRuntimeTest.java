package com.ultron.gateway.runtime;

import com.ultron.common.config.UltronConfig;
import com.ultron.gateway.agent.AgentExecutor;
import com.ultron.gateway.agent.ResponseBlock;
import com.ultron.gateway.agent.RunCompletion;
import com.ultron.gateway.agent.RunSummary;
import com.ultron.gateway.agent.TokenUsage;
import com.ultron.gateway.outbound.OutboundDelivery;
import com.ultron.gateway.outbound.OutboundMessage;
import com.ultron.gateway.queue.Lanes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class GatewayRuntimeTest {

    @TempDir
    Path stateDir;

    private GatewayRuntime runtime;
    private final RecordingChannel channel = new RecordingChannel();

    @AfterEach
    void tearDown() {
        if (runtime != null) {
            runtime.shutdown();
        }
    }

    private static UltronConfig config(String... agentIds) {
        var cfg = new UltronConfig();
        var agents = new UltronConfig.AgentsConfig();
        agents.setList(Arrays.stream(agentIds).map(id -> {
            var entry = new UltronConfig.AgentEntry();
            entry.setId(id);
            return entry;
        }).toList());
        cfg.setAgents(agents);
        var session = new UltronConfig.SessionConfig();
        session.setScope("per-peer");
        cfg.setSession(session);
        return cfg;
    }

    private static final AgentExecutor ECHO = (request, sink) -> {
        String text = request.messages().isEmpty()
                ? "done: " + request.prompt()
                : "echo: " + request.messages().get(request.messages().size() - 1).body();
        sink.accept(ResponseBlock.text(text));
        return CompletableFuture.completedFuture(RunSummary.of(TokenUsage.of(1, 1)));
    };

    private GatewayRuntime start(UltronConfig config, AgentExecutor executor) {
        OutboundDelivery delivery = new OutboundDelivery(null, ms -> {
        });
        delivery.register(channel);
        runtime = new GatewayRuntime(config, stateDir, executor, delivery);
        runtime.start();
        return runtime;
    }

    private OutboundMessage awaitReply() throws InterruptedException {
        OutboundMessage reply = channel.sent.poll(5, TimeUnit.SECONDS);
        assertNotNull(reply, "expected a reply");
        return reply;
    }

    @Nested
    class Inbound {
        @Test
        void messageProducesReplyAndTranscript() throws Exception {
            start(config("main"), ECHO);

            channel.receive(RecordingChannel.message("alice", "1", "ping"));

            OutboundMessage reply = awaitReply();
            assertEquals("echo: ping", reply.text());
            assertEquals("alice", reply.target());
            assertEquals(2, runtime.getSessions().load("agent:main:dm:alice").size());
        }

        @Test
        void redeliveredMessage_answeredOnce() throws Exception {
            start(config("main"), ECHO);

            channel.receive(RecordingChannel.message("alice", "1", "ping"));
            channel.receive(RecordingChannel.message("alice", "1", "ping"));
            awaitReply();

            assertNull(channel.sent.poll(300, TimeUnit.MILLISECONDS));
            assertEquals(1, runtime.getMetrics().get(RuntimeMetrics.Counter.DUPLICATES_DROPPED));
        }

        @Test
        void peersGetSeparateSessions() throws Exception {
            start(config("main"), ECHO);

            channel.receive(RecordingChannel.message("alice", "1", "a"));
            channel.receive(RecordingChannel.message("bob", "2", "b"));
            awaitReply();
            awaitReply();

            assertTrue(runtime.getSessions().find("agent:main:dm:alice").isPresent());
            assertTrue(runtime.getSessions().find("agent:main:dm:bob").isPresent());
        }

        @Test
        void noAgents_batchDroppedAndCounted() {
            start(new UltronConfig(), ECHO);

            runtime.dispatchBatch(List.of(RecordingChannel.message("alice", "1", "hello")));

            assertEquals(1, runtime.getMetrics().get(RuntimeMetrics.Counter.ROUTING_FAILED));
            assertTrue(runtime.getQueue().isIdle());
        }

        @Test
        void submitBeforeStart_rejected() {
            runtime = new GatewayRuntime(config("main"), stateDir, ECHO, new OutboundDelivery());
            assertFalse(runtime.submit(RecordingChannel.message("alice", "1", "hello")));
        }
    }

    @Test
    void scheduledJob_runsInCronSession() throws Exception {
        start(config("main"), ECHO);

        RunCompletion completion = runtime.enqueueScheduled("Nightly", null, "compile report")
                .get(5, TimeUnit.SECONDS);

        assertTrue(completion.isSuccess());
        var record = runtime.getSessions().find("cron:nightly").orElseThrow();
        assertEquals("default", record.getAgentId());
        assertEquals("done: compile report", record.getLastReply());
        assertTrue(channel.sent.isEmpty());
    }

    @Test
    void resetSession_archivesAndStartsFresh() throws Exception {
        start(config("main"), ECHO);
        channel.receive(RecordingChannel.message("alice", "1", "first"));
        awaitReply();
        String before = runtime.getSessions().find("agent:main:dm:alice").orElseThrow().getSessionId();

        assertTrue(runtime.resetSession("agent:main:dm:alice", "manual").isPresent());

        channel.receive(RecordingChannel.message("alice", "2", "second"));
        awaitReply();
        String after = runtime.getSessions().find("agent:main:dm:alice").orElseThrow().getSessionId();
        assertNotEquals(before, after);
        assertEquals(2, runtime.getSessions().load("agent:main:dm:alice").size());
    }

    @Test
    void configReload_keepsInFlightRun() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch proceed = new CountDownLatch(1);
        AgentExecutor gated = (request, sink) -> CompletableFuture.supplyAsync(() -> {
            entered.countDown();
            try {
                proceed.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            sink.accept(ResponseBlock.text("finished"));
            return RunSummary.of(TokenUsage.ZERO);
        });
        start(config("main"), gated);

        channel.receive(RecordingChannel.message("alice", "1", "slow job"));
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        UltronConfig updated = config("main", "ops");
        updated.setQueue(new UltronConfig.QueueConfig());
        updated.getQueue().setMode("steer");
        runtime.applyConfig(updated);

        assertFalse(runtime.getQueue().isIdle(Lanes.sessionLane("agent:main:dm:alice")));
        proceed.countDown();

        assertEquals("finished", awaitReply().text());
        assertEquals("steer", runtime.getConfig().getQueue().getMode());
    }

    @Test
    void shutdown_drainsAndStopsIntake() throws Exception {
        start(config("main"), ECHO);
        channel.receive(RecordingChannel.message("alice", "1", "ping"));
        awaitReply();

        assertTrue(runtime.shutdown());

        assertFalse(runtime.isRunning());
        assertFalse(channel.isRunning());
        assertFalse(runtime.submit(RecordingChannel.message("alice", "2", "late")));
        runtime = null;
    }
}
