package com.radiusproxy;

import java.net.InetAddress;
import java.nio.charset.StandardCharsets;

public interface RadiusHandler {

    AccessDecision handleAccessRequest(RadiusRequest request);

    public static class RadiusRequest {
        private final RadiusPacket packet;
        private final InetAddress clientAddress;
        private final String sharedSecret;

        public RadiusRequest(RadiusPacket packet, InetAddress clientAddress, String sharedSecret) {
            this.packet = packet;
            this.clientAddress = clientAddress;
            this.sharedSecret = sharedSecret;
        }

        public RadiusPacket getPacket() {
            return packet;
        }

        public InetAddress getClientAddress() {
            return clientAddress;
        }

        public String getUsername() {
            return packet.getStringAttribute(RadiusPacket.USER_NAME);
        }

        /**
         * Recovers the User-Password hidden with the client's shared secret.
         */
        public String decryptPassword() throws RadiusPacket.RadiusException {
            byte[] hidden = packet.getBinaryAttribute(RadiusPacket.USER_PASSWORD);
            if (hidden == null) {
                throw new RadiusPacket.RadiusException("No User-Password attribute found");
            }
            byte[] plain = RadiusCodec.decryptPassword(hidden, packet.getAuthenticator(), sharedSecret);
            return new String(plain, StandardCharsets.UTF_8);
        }
    }
}
