package com.awsmcp.mcp;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sun.net.httpserver.HttpServer;

/**
 * Manages the embedded HTTP server and its worker pool
 */
public class McpServerManager {
    private static final Logger LOG = LoggerFactory.getLogger(McpServerManager.class);

    private final int configuredPort;
    private final int threads;
    private HttpServer server;
    private ExecutorService executor;

    /**
     * Creates a new McpServerManager
     *
     * @param port port to listen on; 0 picks a free port
     * @param threads number of worker threads serving requests
     */
    public McpServerManager(int port, int threads) {
        this.configuredPort = port;
        this.threads = threads;
    }

    /**
     * Bind and start the HTTP server. Contexts may be added before or after this call.
     *
     * @throws IOException if the port cannot be bound
     */
    public synchronized void startServer() throws IOException {
        // Stop existing server if running
        if (server != null) {
            LOG.info("Stopping existing HTTP server before starting new one.");
            stopServer();
        }

        HttpServer created = HttpServer.create(new InetSocketAddress(configuredPort), 0);
        executor = Executors.newFixedThreadPool(threads, new WorkerThreadFactory());
        created.setExecutor(executor);
        created.start();
        server = created;
        LOG.info("HTTP server started on port {} with {} worker threads", getPort(), threads);
    }

    /**
     * Stop the HTTP server if it is running
     */
    public synchronized void stopServer() {
        if (server == null) return;

        LOG.info("Stopping HTTP server...");
        server.stop(1); // give open exchanges a second to finish
        server = null;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.info("HTTP server stopped.");
    }

    /**
     * Get the current HTTP server instance
     *
     * @return the HTTP server or null if not running
     */
    public synchronized HttpServer getServer() {
        return server;
    }

    public synchronized boolean isServerRunning() {
        return server != null;
    }

    /**
     * @return the bound port, which differs from the configured one when that was 0
     */
    public synchronized int getPort() {
        return server != null ? server.getAddress().getPort() : configuredPort;
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            return new Thread(task, "mcp-http-" + counter.incrementAndGet());
        }
    }
}
