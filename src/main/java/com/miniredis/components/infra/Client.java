package com.miniredis.components.infra;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.util.UUID;

@Slf4j
public class Client {
    public final String id;
    public final String address;
    public final Socket socket;
    public final InputStream inputStream;
    public final OutputStream outputStream;

    public Client(Socket socket) throws IOException {
        this(socket.getRemoteSocketAddress().toString(), socket, socket.getInputStream(), socket.getOutputStream());
    }

    public Client(String address, Socket socket, InputStream inputStream, OutputStream outputStream) {
        this.id = UUID.randomUUID().toString();
        this.address = address;
        this.socket = socket;
        this.inputStream = inputStream;
        this.outputStream = outputStream;
    }

    public void send(byte[] data) throws IOException {
        outputStream.write(data);
        outputStream.flush();
    }

    public void close() {
        try {
            if (socket != null) {
                socket.close();
            } else {
                inputStream.close();
                outputStream.close();
            }
        } catch (IOException e) {
            log.error("Error closing client {}: {}", id, e.getMessage());
        }
    }

    @Override
    public String toString() {
        return address + " (" + id + ")";
    }
}
