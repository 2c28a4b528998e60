package com.miniredis.components.server;

import com.miniredis.components.infra.Client;
import com.miniredis.components.infra.ServerConfig;
import com.miniredis.components.services.Command;
import com.miniredis.components.services.CommandException;
import com.miniredis.components.services.CommandHandler;
import com.miniredis.components.services.CommandParser;
import com.miniredis.components.services.LineSerializer;
import com.miniredis.components.services.ProtocolError;
import com.miniredis.components.services.Response;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

@Slf4j
@Component
public class ConnectionHandler {
    private final CommandParser commandParser;
    private final CommandHandler commandHandler;
    private final LineSerializer lineSerializer;
    private final ServerConfig serverConfig;

    public ConnectionHandler(CommandParser commandParser, CommandHandler commandHandler,
                             LineSerializer lineSerializer, ServerConfig serverConfig) {
        this.commandParser = commandParser;
        this.commandHandler = commandHandler;
        this.lineSerializer = lineSerializer;
        this.serverConfig = serverConfig;
    }

    public void handleClient(Client client) {
        int maxLineLength = serverConfig.getMaxLineLength();
        byte[] buffer = new byte[serverConfig.getReadBufferSize()];
        ByteArrayOutputStream line = new ByteArrayOutputStream();
        boolean discarding = false;

        try {
            while (true) {
                int bytesRead = client.inputStream.read(buffer);
                if (bytesRead == -1) {
                    if (line.size() > 0 && !discarding) {
                        reply(client, execute(line.toByteArray()));
                    }
                    log.info("Client disconnected : {}", client);
                    return;
                }

                for (int i = 0; i < bytesRead; i++) {
                    byte b = buffer[i];
                    if (b == '\n') {
                        if (discarding) {
                            discarding = false;
                        } else if (!reply(client, execute(line.toByteArray()))) {
                            return;
                        }
                        line.reset();
                    } else if (!discarding) {
                        if (line.size() >= maxLineLength) {
                            line.reset();
                            discarding = true;
                            if (!reply(client, new CommandException(ProtocolError.TOO_LONG).toResponse())) {
                                return;
                            }
                        } else {
                            line.write(b);
                        }
                    }
                }
            }
        } catch (IOException e) {
            log.warn("Error reading from client {}: {}", client, e.getMessage());
        } finally {
            client.close();
        }
    }

    public Response execute(byte[] line) {
        try {
            String text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(line))
                    .toString();
            Command command = commandParser.parse(text);
            log.debug("Executing {}", command);
            return commandHandler.handle(command);
        } catch (CharacterCodingException e) {
            return new CommandException(ProtocolError.INVALID_UTF8).toResponse();
        } catch (CommandException e) {
            return e.toResponse();
        }
    }

    // false when the write failed and the session must end
    private boolean reply(Client client, Response response) {
        try {
            client.send(lineSerializer.toBytes(response));
            return true;
        } catch (IOException e) {
            log.warn("Error sending response to client {}, closing session: {}", client, e.getMessage());
            return false;
        }
    }
}
