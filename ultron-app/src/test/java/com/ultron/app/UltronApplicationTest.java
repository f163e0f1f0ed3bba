package com.ultron.app;

import com.ultron.gateway.agent.AgentExecutor;
import com.ultron.gateway.agent.ResponseBlock;
import com.ultron.gateway.agent.RunSummary;
import com.ultron.gateway.agent.TokenUsage;
import com.ultron.gateway.inbound.InboundMessage;
import com.ultron.gateway.outbound.ChannelAdapter;
import com.ultron.gateway.outbound.DeliveryResult;
import com.ultron.gateway.outbound.OutboundMessage;
import com.ultron.gateway.runtime.GatewayRuntime;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Boots the full application context with an echo agent and an in-memory
 * channel, then sends one message through the whole pipeline.
 */
@SpringBootTest
class UltronApplicationTest {

    private static final Path STATE_DIR = createTempDir();

    @DynamicPropertySource
    static void properties(DynamicPropertyRegistry registry) throws IOException {
        Path config = STATE_DIR.resolve("ultron.json");
        Files.writeString(config, """
                {
                  "agents": { "list": [ { "id": "main", "default": true } ] },
                  "session": { "scope": "per-peer" },
                  "messages": { "inbound": { "debounceMs": 0 } }
                }
                """);
        registry.add("ultron.config.path", config::toString);
        registry.add("ultron.state.dir", STATE_DIR::toString);
    }

    @Autowired
    private GatewayRuntime runtime;

    @Autowired
    private MemoryChannel channel;

    @Test
    void contextStartsRuntime() {
        assertTrue(runtime.isRunning());
        assertEquals("main", runtime.getRoutes().getDefaultAgentId());
    }

    @Test
    void messageFlowsThroughToReply() throws Exception {
        InboundMessage message = InboundMessage.builder()
                .provider("memory")
                .peerId("alice")
                .senderId("alice")
                .body("ping")
                .messageId("m-1")
                .timestamp(System.currentTimeMillis())
                .build();

        assertTrue(runtime.submit(message));

        OutboundMessage reply = channel.sent.poll(5, TimeUnit.SECONDS);
        assertNotNull(reply, "expected a reply");
        assertEquals("echo: ping", reply.text());
        assertEquals("alice", reply.target());
        assertTrue(Files.exists(STATE_DIR.resolve("agents/main/sessions/sessions.json")));
    }

    private static Path createTempDir() {
        try {
            return Files.createTempDirectory("ultron-app-test");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @TestConfiguration
    static class TestBeans {

        @Bean
        AgentExecutor echoExecutor() {
            return (request, sink) -> {
                String last = request.messages().get(request.messages().size() - 1).body();
                sink.accept(ResponseBlock.text("echo: " + last));
                return CompletableFuture.completedFuture(RunSummary.of(TokenUsage.of(3, 2)));
            };
        }

        @Bean
        MemoryChannel memoryChannel() {
            return new MemoryChannel();
        }
    }

    static class MemoryChannel implements ChannelAdapter {
        final BlockingQueue<OutboundMessage> sent = new LinkedBlockingQueue<>();
        private volatile boolean running;

        @Override
        public String provider() {
            return "memory";
        }

        @Override
        public void start(Consumer<InboundMessage> sink) {
            running = true;
        }

        @Override
        public void stop() {
            running = false;
        }

        @Override
        public boolean isRunning() {
            return running;
        }

        @Override
        public DeliveryResult send(OutboundMessage message) {
            sent.add(message);
            return DeliveryResult.sent(provider(), "out-" + sent.size());
        }
    }
}
