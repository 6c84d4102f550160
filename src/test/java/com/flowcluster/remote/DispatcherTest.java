package com.flowcluster.remote;

import com.flowcluster.core.ConnectionError;
import com.flowcluster.core.Endpoint;
import com.flowcluster.core.Role;
import com.flowcluster.rpc.LocalTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DispatcherTest {

    private final Endpoint self = Endpoint.of("self");
    private final Endpoint peer = Endpoint.of("peer");
    private final Role testRole = Role.of("test");

    private LocalTransport transport;
    private Dispatcher dispatcher;
    private final List<HandlerServer<?>> servers = new ArrayList<>();

    @BeforeEach
    void setUp() {
        LocalTransport.clearRegistry();
        transport = new LocalTransport(self);
        dispatcher = new Dispatcher(transport);
    }

    @AfterEach
    void tearDown() {
        servers.forEach(HandlerServer::stop);
        transport.shutdown();
        LocalTransport.clearRegistry();
    }

    private <S> HandlerServer<S> start(Role role, ConnectionHandler<S> handler) {
        HandlerServer<S> server = new HandlerServer<>(role, handler, transport);
        server.start(dispatcher);
        servers.add(server);
        return server;
    }

    @Test
    @DisplayName("Messages reach the handler bound for their role")
    void testDispatchToBoundRole() {
        RecordingHandler handler = RecordingHandler.accepting();
        start(testRole, handler);

        HandlerReply reply = dispatcher.dispatch(testRole, HandlerMessage.accept(peer, Role.WORKER));

        assertThat(reply.isOk()).isTrue();
        assertThat(handler.calls()).containsExactly("init", "accept peer");
    }

    @Test
    @DisplayName("Binding a role again replaces the earlier handler")
    void testRebind() {
        RecordingHandler first = RecordingHandler.accepting();
        RecordingHandler second = RecordingHandler.rejecting(ConnectionError.of("busy"));
        start(testRole, first);
        HandlerServer<?> replacement = start(testRole, second);

        HandlerReply reply = dispatcher.dispatch(testRole, HandlerMessage.accept(peer, Role.WORKER));

        assertThat(dispatcher.getHandler(testRole)).isSameAs(replacement);
        assertThat(reply.error()).isEqualTo(ConnectionError.of("busy"));
        assertThat(first.calls()).containsExactly("init");
    }

    @Test
    @DisplayName("The default handler receives roles without a binding")
    void testDefaultBinding() {
        RecordingHandler specific = RecordingHandler.accepting();
        RecordingHandler fallback = RecordingHandler.accepting();
        start(testRole, specific);
        HandlerServer<?> defaultServer = start(null, fallback);

        dispatcher.dispatch(Role.of("other"), HandlerMessage.accept(peer, Role.WORKER));

        assertThat(dispatcher.getHandler(Role.of("other"))).isSameAs(defaultServer);
        assertThat(fallback.calls()).containsExactly("init", "accept peer");
        assertThat(specific.calls()).containsExactly("init");
    }

    @Test
    @DisplayName("Roles nobody handles are answered with unknown_role")
    void testUnknownRole() {
        assertThat(dispatcher.getHandler(testRole)).isNull();

        HandlerReply reply = dispatcher.dispatch(testRole, HandlerMessage.remove(peer));

        assertThat(reply.error()).isEqualTo(ConnectionError.UNKNOWN_ROLE);
    }

    @Test
    @DisplayName("Dispatching to an absent endpoint answers unreachable")
    void testRemoteUnreachable() {
        HandlerReply reply = dispatcher.dispatch(Endpoint.of("nowhere"), testRole, HandlerMessage.remove(peer));

        assertThat(reply.error()).isEqualTo(ConnectionError.UNREACHABLE);
    }
}
