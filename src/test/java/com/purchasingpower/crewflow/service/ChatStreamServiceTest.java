package com.purchasingpower.crewflow.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ChatStreamServiceTest {

    private ChatStreamService streams;
    private AtomicInteger disconnects;

    @BeforeEach
    void setUp() {
        streams = new ChatStreamService(new ObjectMapper());
        disconnects = new AtomicInteger();
    }

    @Test
    void completionClosesStreamWithoutDisconnectCallback() {
        streams.createStream("conv-1", disconnects::incrementAndGet);
        assertThat(streams.hasActiveStream("conv-1")).isTrue();

        streams.sendPartialResponse("conv-1", "Hello");
        streams.sendComplete("conv-1", "greeting", "Hello", null);

        assertThat(streams.hasActiveStream("conv-1")).isFalse();
        assertThat(disconnects).hasValue(0);
    }

    @Test
    void turnFinishedBeforeConnectIsReplayedAndClosed() {
        streams.sendThinking("conv-2", "Working");
        streams.sendComplete("conv-2", "greeting", "Done", null);
        assertThat(streams.hasActiveStream("conv-2")).isFalse();

        SseEmitter emitter = streams.createStream("conv-2", disconnects::incrementAndGet);

        assertThat(emitter).isNotNull();
        assertThat(streams.hasActiveStream("conv-2")).isFalse();
        assertThat(disconnects).hasValue(0);
    }

    @Test
    void runningTurnKeepsStreamOpenAfterReplay() {
        streams.sendThinking("conv-3", "Working");

        streams.createStream("conv-3", disconnects::incrementAndGet);

        assertThat(streams.hasActiveStream("conv-3")).isTrue();
    }

    @Test
    void invalidConversationIdIsRejected() {
        SseEmitter emitter = streams.createStream("null", disconnects::incrementAndGet);

        assertThat(emitter).isNotNull();
        assertThat(streams.hasActiveStream("null")).isFalse();
    }
}
