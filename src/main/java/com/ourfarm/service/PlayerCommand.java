package com.ourfarm.service;

import com.fasterxml.jackson.databind.JsonNode;

/** One inbound frame waiting for the tick thread. */
public class PlayerCommand {
    private final String connectionId;
    private final String action;
    private final JsonNode payload;

    public PlayerCommand(String connectionId, String action, JsonNode payload) {
        this.connectionId = connectionId;
        this.action = action;
        this.payload = payload;
    }

    public String getConnectionId() { return connectionId; }
    public String getAction() { return action; }
    public JsonNode getPayload() { return payload; }
}
