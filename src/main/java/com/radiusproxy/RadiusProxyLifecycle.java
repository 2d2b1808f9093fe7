package com.radiusproxy;

import com.radiusproxy.backend.BackendConfigStore;
import com.radiusproxy.backend.BackendFactory;
import com.radiusproxy.mfa.BackupCodes;
import com.radiusproxy.mfa.MfaEnrollmentStore;
import com.radiusproxy.mfa.MfaProvisioning;
import com.radiusproxy.router.BackendRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process entry point. Wires the components described by a configuration
 * file, runs the RADIUS server until shutdown and releases the backends.
 */
public class RadiusProxyLifecycle {

    private static final Logger logger = LoggerFactory.getLogger(RadiusProxyLifecycle.class);

    private RadiusServer server;
    private BackendRouter router;
    private Thread shutdownHook;

    public void startWithConfiguration(String configFile) throws Exception {
        logger.info("Starting RADIUS authentication proxy with configuration: {}", configFile);

        ConfigurationManager configManager = new ConfigurationManager(configFile);
        configManager.validateConfiguration();
        configManager.logConfigurationSummary();

        BackendFactory factory = BackendFactory.standard();
        NasRegistry nasRegistry = configManager.createNasRegistry();
        BackendConfigStore backendStore = configManager.createBackendStore(factory);
        MfaEnrollmentStore mfaStore = configManager.createMfaStore();
        router = configManager.createRouter(backendStore, factory, mfaStore);

        AuthenticationGateway gateway = new AuthenticationGateway(router);
        server = new RadiusServer(
            configManager.getServerPort(),
            nasRegistry,
            gateway,
            gateway.getDictionary(),
            configManager.getThreadPoolSize()
        );

        setupShutdownHook();
        server.start();

        logger.info("RADIUS authentication proxy started with {} backend(s)", router.getStats().getBackendCount());
    }

    /**
     * Blocks until the server stops.
     */
    public void runMainLoop() {
        if (server == null) {
            throw new IllegalStateException("Server has not been started");
        }

        while (server.isRunning()) {
            try {
                Thread.sleep(1000);
            } catch (InterruptedException e) {
                logger.info("Main loop interrupted, initiating shutdown");
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    public void stop() {
        shutdown();

        if (shutdownHook != null) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                logger.debug("JVM already shutting down; hook stays registered");
            }
            shutdownHook = null;
        }
    }

    public boolean isRunning() {
        return server != null && server.isRunning();
    }

    public BackendRouter getRouter() {
        return router;
    }

    private synchronized void shutdown() {
        if (server != null && server.isRunning()) {
            server.stop();
        }
        if (router != null) {
            router.close();
            router = null;
        }
    }

    private void setupShutdownHook() {
        shutdownHook = new Thread(() -> {
            logger.info("Shutdown hook triggered");
            shutdown();
        }, "RadiusProxy-ShutdownHook");

        Runtime.getRuntime().addShutdownHook(shutdownHook);
    }

    private static void printUsage() {
        System.err.println("Usage:");
        System.err.println("  radius-auth-proxy <config.properties>");
        System.err.println("  radius-auth-proxy enroll <identity> [backup-code-count]");
    }

    /**
     * Prints configuration lines and one-time backup codes for a new enrollment.
     */
    private static void enroll(String[] args) {
        int count = BackupCodes.DEFAULT_COUNT;
        if (args.length > 2) {
            count = Integer.parseInt(args[2]);
        }
        MfaProvisioning.Provisioned provisioned = new MfaProvisioning().provision(args[1], count);

        System.out.println("# add to the proxy configuration");
        System.out.print(provisioned.toProperties());
        System.out.println("# hand these backup codes to the user; they are not stored");
        for (String code : provisioned.getBackupCodes()) {
            System.out.println("#   " + code);
        }
    }

    public static void main(String[] args) {
        if (args.length == 0) {
            printUsage();
            System.exit(2);
            return;
        }
        if ("enroll".equals(args[0])) {
            if (args.length < 2) {
                printUsage();
                System.exit(2);
                return;
            }
            enroll(args);
            return;
        }

        RadiusProxyLifecycle lifecycle = new RadiusProxyLifecycle();
        try {
            lifecycle.startWithConfiguration(args[0]);
            lifecycle.runMainLoop();
        } catch (Exception e) {
            logger.error("Failed to start RADIUS authentication proxy", e);
            lifecycle.stop();
            System.exit(1);
        }
        lifecycle.stop();
    }
}
