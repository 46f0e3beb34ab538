package com.ourfarm.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ourfarm.service.SyncBroadcaster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Sends events over the open WebSocket sessions, one JSON object per text frame. */
@Component
public class WebSocketSyncBroadcaster implements SyncBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(WebSocketSyncBroadcaster.class);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();

    public void register(WebSocketSession session) {
        sessions.put(session.getId(), session);
    }

    public void unregister(String sessionId) {
        sessions.remove(sessionId);
    }

    @Override
    public void toAll(String event, ObjectNode payload) {
        TextMessage message = frame(event, payload);
        for (WebSocketSession s : sessions.values()) send(s, message);
    }

    @Override
    public void toPlayer(String connectionId, String event, ObjectNode payload) {
        WebSocketSession s = sessions.get(connectionId);
        if (s != null) send(s, frame(event, payload));
    }

    @Override
    public void toOthers(String exceptConnectionId, String event, ObjectNode payload) {
        TextMessage message = frame(event, payload);
        for (WebSocketSession s : sessions.values()) {
            if (!s.getId().equals(exceptConnectionId)) send(s, message);
        }
    }

    private TextMessage frame(String event, ObjectNode payload) {
        ObjectNode msg = objectMapper.createObjectNode();
        msg.put("event", event);
        msg.setAll(payload);
        return new TextMessage(msg.toString());
    }

    private void send(WebSocketSession session, TextMessage message) {
        if (!session.isOpen()) return;
        try {
            // Sessions do not allow concurrent writes
            synchronized (session) {
                session.sendMessage(message);
            }
        } catch (IOException e) {
            log.warn("Send to {} failed: {}", session.getId(), e.getMessage());
        }
    }
}
