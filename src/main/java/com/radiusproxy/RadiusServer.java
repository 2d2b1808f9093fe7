package com.radiusproxy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.SocketException;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * UDP front end. Each datagram is handled on a fixed worker pool; packets
 * from unknown clients, malformed packets and anything other than
 * Access-Request are dropped without reply.
 */
public class RadiusServer {

    private static final Logger logger = LoggerFactory.getLogger(RadiusServer.class);

    public static final int DEFAULT_PORT = 1812;
    public static final int DEFAULT_THREAD_POOL_SIZE = 10;

    private final int port;
    private final NasRegistry nasRegistry;
    private final RadiusHandler handler;
    private final AttributeDictionary dictionary;
    private final ExecutorService executorService;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private DatagramSocket socket;
    private Thread serverThread;

    public RadiusServer(int port, NasRegistry nasRegistry, RadiusHandler handler,
                        AttributeDictionary dictionary, int threadPoolSize) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid port: " + port);
        }
        if (nasRegistry == null) {
            throw new IllegalArgumentException("NasRegistry cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("RadiusHandler cannot be null");
        }
        if (dictionary == null) {
            throw new IllegalArgumentException("AttributeDictionary cannot be null");
        }
        if (threadPoolSize <= 0) {
            throw new IllegalArgumentException("Thread pool size must be positive");
        }

        this.port = port;
        this.nasRegistry = nasRegistry;
        this.handler = handler;
        this.dictionary = dictionary;
        this.executorService = Executors.newFixedThreadPool(threadPoolSize);
    }

    public void start() throws IOException {
        if (running.get()) {
            throw new IllegalStateException("Server is already running");
        }

        logger.info("Starting RADIUS server on port {}", port);

        socket = new DatagramSocket(port);
        running.set(true);

        serverThread = new Thread(this::serverLoop, "RadiusServer-" + port);
        serverThread.setDaemon(false);
        serverThread.start();

        logger.info("RADIUS server listening on port {}", socket.getLocalPort());
    }

    public void stop() {
        if (!running.getAndSet(false)) {
            return;
        }

        logger.info("Stopping RADIUS server on port {}", port);

        if (socket != null && !socket.isClosed()) {
            socket.close();
        }

        if (serverThread != null) {
            try {
                serverThread.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting for server thread to stop");
            }
        }

        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(10, TimeUnit.SECONDS)) {
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executorService.shutdownNow();
        }

        logger.info("RADIUS server stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    public int getPort() {
        return port;
    }

    /**
     * Gets the bound port, which differs from {@link #getPort()} when started on port 0.
     */
    public int getLocalPort() {
        return socket != null ? socket.getLocalPort() : -1;
    }

    private void serverLoop() {
        while (running.get() && !socket.isClosed()) {
            try {
                byte[] buffer = new byte[RadiusPacket.MAX_PACKET_LENGTH];
                DatagramPacket packet = new DatagramPacket(buffer, buffer.length);
                socket.receive(packet);

                executorService.submit(() -> processDatagram(packet));

            } catch (SocketException e) {
                if (running.get()) {
                    logger.error("Socket error in server loop", e);
                }
                break;
            } catch (RejectedExecutionException e) {
                logger.warn("Worker pool rejected a request: {}", e.getMessage());
            } catch (IOException e) {
                if (running.get()) {
                    logger.error("I/O error in server loop", e);
                }
            }
        }

        logger.debug("Server loop exited");
    }

    private void processDatagram(DatagramPacket packet) {
        InetAddress clientAddress = packet.getAddress();
        byte[] data = new byte[packet.getLength()];
        System.arraycopy(packet.getData(), packet.getOffset(), data, 0, packet.getLength());

        try {
            Optional<byte[]> reply = handleDatagram(data, clientAddress);
            if (reply.isPresent()) {
                socket.send(new DatagramPacket(reply.get(), reply.get().length, clientAddress, packet.getPort()));
            }
        } catch (IOException e) {
            logger.warn("Failed to send reply to {}: {}", clientAddress.getHostAddress(), e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Error processing request from {}", clientAddress.getHostAddress(), e);
        }
    }

    /**
     * Turns one request datagram into the reply bytes, or empty when the
     * datagram is to be dropped.
     */
    Optional<byte[]> handleDatagram(byte[] data, InetAddress clientAddress) {
        Optional<NasRegistry.NasClient> client = nasRegistry.findClient(clientAddress);
        if (!client.isPresent()) {
            logger.warn("Dropping request from unregistered client: {}", clientAddress.getHostAddress());
            return Optional.empty();
        }
        NasRegistry.NasClient nasClient = client.get();
        nasClient.recordRequest();

        try {
            RadiusPacket request = RadiusPacket.decode(data);

            logger.debug("Received {} from {} (ID: {})",
                RadiusPacket.codeName(request.getCode()), clientAddress.getHostAddress(), request.getIdentifier());

            if (request.getCode() != RadiusPacket.ACCESS_REQUEST) {
                logger.warn("Ignoring unsupported packet type {} from {}",
                    request.getCode(), clientAddress.getHostAddress());
                return Optional.empty();
            }

            AccessDecision decision = handler.handleAccessRequest(
                new RadiusHandler.RadiusRequest(request, clientAddress, nasClient.getSharedSecret()));

            RadiusPacket response = RadiusResponseBuilder.buildFromDecision(
                decision, dictionary, request.getIdentifier(), request.getAuthenticator(), nasClient.getSharedSecret());

            logger.debug("Sending {} to {} (ID: {})",
                RadiusPacket.codeName(response.getCode()), clientAddress.getHostAddress(), response.getIdentifier());
            return Optional.of(response.encode());

        } catch (RadiusPacket.RadiusException e) {
            logger.warn("Invalid RADIUS packet from {}: {}", clientAddress.getHostAddress(), e.getMessage());
            return Optional.empty();
        }
    }
}
