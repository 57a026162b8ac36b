package com.relay.client.dispatch;

import com.relay.common.model.Envelope;
import com.relay.common.model.JsonRpcRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class TopicEventDispatcherTest {

    private TopicEventDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new TopicEventDispatcher();
    }

    @Test
    void testDispatchDeserializesPayload() {
        List<JsonRpcRequest> requests = new CopyOnWriteArrayList<>();
        dispatcher.listenFor("rpc", JsonRpcRequest.class, requests::add);

        dispatcher.dispatch(Envelope.data("rpc", "{\"id\":3,\"method\":\"ping\",\"params\":[1,2]}"));

        assertEquals(1, requests.size());
        assertEquals(3, requests.get(0).getId());
        assertEquals("ping", requests.get(0).getMethod());
        assertEquals(2, requests.get(0).getParams().size());
    }

    @Test
    void testStringBindingReceivesRawPayload() {
        List<String> payloads = new CopyOnWriteArrayList<>();
        dispatcher.listenFor("raw", String.class, payloads::add);

        dispatcher.dispatch(Envelope.data("raw", "not json"));

        assertEquals(List.of("not json"), payloads);
    }

    @Test
    void testSilentEnvelopesAreNotDispatched() {
        List<String> payloads = new CopyOnWriteArrayList<>();
        dispatcher.listenFor("raw", String.class, payloads::add);

        dispatcher.dispatch(Envelope.subscribe("raw"));
        dispatcher.dispatch(Envelope.ack("raw"));

        assertTrue(payloads.isEmpty());
    }

    @Test
    void testOtherTopicsAreIgnored() {
        List<String> payloads = new CopyOnWriteArrayList<>();
        dispatcher.listenFor("a", String.class, payloads::add);

        dispatcher.dispatch(Envelope.data("b", "x"));

        assertTrue(payloads.isEmpty());
    }

    @Test
    void testPayloadMismatchIsContained() {
        List<JsonRpcRequest> requests = new CopyOnWriteArrayList<>();
        List<String> payloads = new CopyOnWriteArrayList<>();
        dispatcher.listenFor("rpc", JsonRpcRequest.class, requests::add);
        dispatcher.listenFor("rpc", String.class, payloads::add);

        assertDoesNotThrow(() -> dispatcher.dispatch(Envelope.data("rpc", "{broken")));

        assertTrue(requests.isEmpty());
        assertEquals(List.of("{broken"), payloads);
    }

    @Test
    void testFailingCallbackDoesNotStopOthers() {
        List<String> payloads = new CopyOnWriteArrayList<>();
        dispatcher.listenFor("a", String.class, p -> {
            throw new IllegalStateException("boom");
        });
        dispatcher.listenFor("a", String.class, payloads::add);

        assertDoesNotThrow(() -> dispatcher.dispatch(Envelope.data("a", "x")));

        assertEquals(List.of("x"), payloads);
    }

    @Test
    void testUnsubscribeTopicDropsBindings() {
        List<String> payloads = new CopyOnWriteArrayList<>();
        dispatcher.listenFor("a", String.class, payloads::add);
        dispatcher.listenFor("a", String.class, payloads::add);
        assertEquals(2, dispatcher.getBindingCount("a"));

        dispatcher.unsubscribeTopic("a");
        dispatcher.dispatch(Envelope.data("a", "x"));

        assertTrue(payloads.isEmpty());
        assertEquals(0, dispatcher.getBindingCount("a"));
        assertTrue(dispatcher.getBoundTopics().isEmpty());
    }
}
