package com.radiusproxy;

import com.radiusproxy.router.AuthenticationOutcome;
import com.radiusproxy.router.BackendRouter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.net.InetAddress;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class AuthenticationGatewayTest {

    private static final String SHARED_SECRET = "nas-secret";

    @Mock
    private BackendRouter router;

    private AuthenticationGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new AuthenticationGateway(router);
    }

    private static Map<String, String> request(String user, String password) {
        Map<String, String> attributes = new HashMap<>();
        attributes.put(AuthenticationGateway.USER_NAME, user);
        if (password != null) {
            attributes.put(AuthenticationGateway.USER_PASSWORD, password);
        }
        return attributes;
    }

    @Test
    void testGrantBecomesAcceptWithAttributes() {
        when(router.authenticate("alice", "secret"))
            .thenReturn(AuthenticationOutcome.accepted(Collections.singletonMap("Filter-Id", "staff")));

        AccessDecision decision = gateway.decide(request("alice", "secret"));

        assertTrue(decision.isAccept());
        assertEquals(RadiusPacket.ACCESS_ACCEPT, decision.getPacketCode());
        assertEquals("staff", decision.getReplyAttributes().get("Filter-Id"));
    }

    @Test
    void testRejectionBecomesBareReject() {
        when(router.authenticate("alice", "wrong")).thenReturn(AuthenticationOutcome.rejected());

        AccessDecision decision = gateway.decide(request("alice", "wrong"));

        assertFalse(decision.isAccept());
        assertEquals(RadiusPacket.ACCESS_REJECT, decision.getPacketCode());
        assertTrue(decision.getReplyAttributes().isEmpty());
    }

    @Test
    void testMissingFieldsNeverReachRouter() {
        assertFalse(gateway.decide(null).isAccept());
        assertFalse(gateway.decide(request("alice", null)).isAccept());
        assertFalse(gateway.decide(request("alice", "")).isAccept());
        assertFalse(gateway.decide(request("", "secret")).isAccept());

        verify(router, never()).authenticate(anyString(), anyString());
    }

    @Test
    void testRouterFailureBecomesReject() {
        when(router.authenticate(anyString(), anyString())).thenThrow(new IllegalStateException("boom"));

        assertFalse(gateway.decide(request("alice", "secret")).isAccept());
    }

    @Test
    void testHandleAccessRequestRecoversPassword() throws Exception {
        when(router.authenticate("alice", "password123456"))
            .thenReturn(AuthenticationOutcome.accepted(Collections.emptyMap()));
        byte[] requestAuth = RadiusCodec.generateRequestAuthenticator();
        RadiusPacket packet = new RadiusPacket(RadiusPacket.ACCESS_REQUEST, 5, requestAuth, Arrays.asList(
            new RadiusPacket.RadiusAttribute(RadiusPacket.USER_NAME, "alice"),
            new RadiusPacket.RadiusAttribute(RadiusPacket.USER_PASSWORD,
                RadiusCodec.encryptPassword("password123456", requestAuth, SHARED_SECRET))));

        AccessDecision decision = gateway.handleAccessRequest(
            new RadiusHandler.RadiusRequest(packet, InetAddress.getLoopbackAddress(), SHARED_SECRET));

        assertTrue(decision.isAccept());
        verify(router).authenticate("alice", "password123456");
    }

    @Test
    void testHandleAccessRequestWithoutPasswordIsRejected() {
        RadiusPacket packet = new RadiusPacket(RadiusPacket.ACCESS_REQUEST, 5, new byte[16], Arrays.asList(
            new RadiusPacket.RadiusAttribute(RadiusPacket.USER_NAME, "alice")));

        AccessDecision decision = gateway.handleAccessRequest(
            new RadiusHandler.RadiusRequest(packet, InetAddress.getLoopbackAddress(), SHARED_SECRET));

        assertFalse(decision.isAccept());
        verify(router, never()).authenticate(anyString(), anyString());
    }

    @Test
    void testRequiresRouterAndDictionary() {
        assertThrows(IllegalArgumentException.class, () -> new AuthenticationGateway(null));
        assertThrows(IllegalArgumentException.class, () -> new AuthenticationGateway(router, null));
    }
}
