package com.miniredis.components.server;

import com.miniredis.components.infra.AdmissionController;
import com.miniredis.components.infra.Client;
import com.miniredis.components.infra.Permit;
import com.miniredis.components.infra.ServerConfig;
import com.miniredis.components.infra.ShutdownSignal;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Component
public class TcpServer {
    private final ConnectionHandler connectionHandler;
    private final ServerConfig serverConfig;
    private final ShutdownSignal shutdownSignal = new ShutdownSignal();
    private final CountDownLatch started = new CountDownLatch(1);
    private final ExecutorService clientExecutor;

    private volatile ServerSocket serverSocket;
    private volatile Thread listenerThread;
    private volatile AdmissionController admissionController;

    public TcpServer(ConnectionHandler connectionHandler, ServerConfig serverConfig) {
        this.connectionHandler = connectionHandler;
        this.serverConfig = serverConfig;

        AtomicInteger threadCount = new AtomicInteger();
        this.clientExecutor = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "client-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    // runs on the calling thread until stop(); running sessions are left to finish
    public void startServer() {
        InetSocketAddress address = serverConfig.toSocketAddress();
        admissionController = new AdmissionController(serverConfig.getMaxConns());
        ServerSocket socket = bind(address);
        serverSocket = socket;
        listenerThread = Thread.currentThread();
        log.info("Server started on {}:{} (max {} connections)",
                address.getHostString(), socket.getLocalPort(), admissionController.getMaxConns());
        started.countDown();

        try (socket) {
            while (!shutdownSignal.isTriggered()) {
                Socket clientSocket;
                try {
                    clientSocket = socket.accept();
                } catch (IOException e) {
                    if (shutdownSignal.isTriggered()) {
                        break;
                    }
                    log.error("Failed to accept connection: {}", e.getMessage());
                    continue;
                }
                admit(clientSocket);
            }
        } catch (IOException e) {
            log.error("Error closing server socket: {}", e.getMessage());
        }
        listenerThread = null;
        if (shutdownSignal.isTriggered()) {
            // clear the interrupt stop() may have delivered after the last wait
            Thread.interrupted();
        }
        log.info("Server stopped accepting connections");
    }

    @PreDestroy
    public void stop() {
        if (shutdownSignal.isTriggered()) {
            return;
        }
        log.info("Shutdown signal received, shutting down...");
        shutdownSignal.trigger();
        ServerSocket socket = serverSocket;
        if (socket != null) {
            try {
                socket.close();
            } catch (IOException e) {
                log.error("Error closing server socket: {}", e.getMessage());
            }
        }
        Thread listener = listenerThread;
        if (listener != null && listener != Thread.currentThread()) {
            listener.interrupt();
        }
        clientExecutor.shutdown();
    }

    public boolean awaitStarted(long timeout, TimeUnit unit) throws InterruptedException {
        return started.await(timeout, unit);
    }

    public int getLocalPort() {
        ServerSocket socket = serverSocket;
        return socket == null ? -1 : socket.getLocalPort();
    }

    public AdmissionController getAdmissionController() {
        return admissionController;
    }

    private ServerSocket bind(InetSocketAddress address) {
        ServerSocket socket = null;
        try {
            socket = new ServerSocket();
            socket.setReuseAddress(true);
            socket.bind(address);
            return socket;
        } catch (IOException e) {
            closeQuietly(socket);
            throw new IllegalStateException("Cannot listen on " + address, e);
        }
    }

    private void admit(Socket clientSocket) {
        Permit permit;
        try {
            permit = admissionController.acquire();
        } catch (InterruptedException e) {
            if (!shutdownSignal.isTriggered()) {
                Thread.currentThread().interrupt();
                shutdownSignal.trigger();
            }
            closeQuietly(clientSocket);
            return;
        }
        if (shutdownSignal.isTriggered()) {
            permit.release();
            closeQuietly(clientSocket);
            return;
        }

        Client client;
        try {
            client = new Client(clientSocket);
        } catch (IOException e) {
            log.error("Error opening client streams: {}", e.getMessage());
            permit.release();
            closeQuietly(clientSocket);
            return;
        }

        log.info("New client connected : {}", client);
        try {
            clientExecutor.execute(() -> serve(client, permit));
        } catch (RejectedExecutionException e) {
            log.warn("Server is shutting down, dropping client {}", client);
            permit.release();
            client.close();
        }
    }

    private void serve(Client client, Permit permit) {
        try {
            connectionHandler.handleClient(client);
        } catch (RuntimeException e) {
            log.error("Unexpected error handling client {}", client, e);
            client.close();
        } finally {
            permit.release();
        }
    }

    private static void closeQuietly(Closeable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (IOException e) {
            log.error("Error closing socket: {}", e.getMessage());
        }
    }
}
