package com.ourfarm.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ourfarm.service.CommandQueue;
import com.ourfarm.service.PlayerCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Socket entry point. Frames are parsed here and queued for the tick thread;
 * nothing in this class touches game state.
 */
@Component
public class GameWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(GameWebSocketHandler.class);

    private final CommandQueue commandQueue;
    private final WebSocketSyncBroadcaster broadcaster;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public GameWebSocketHandler(CommandQueue commandQueue, WebSocketSyncBroadcaster broadcaster) {
        this.commandQueue = commandQueue;
        this.broadcaster = broadcaster;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        broadcaster.register(session);
        log.debug("Connection {} opened", session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        broadcaster.unregister(session.getId());
        commandQueue.markClosed(session.getId());
        log.debug("Connection {} closed ({})", session.getId(), status);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        JsonNode json;
        try {
            json = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            log.warn("Malformed frame from {}: {}", session.getId(), e.getOriginalMessage());
            return;
        }
        if (json == null || !json.hasNonNull("action")) {
            log.warn("Frame without action from {}", session.getId());
            return;
        }
        commandQueue.offer(new PlayerCommand(session.getId(), json.get("action").asText(), json));
    }
}
