package com.ourfarm.service;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Outbound side of the game. Each call sends one JSON object whose
 * {@code event} field is set to the given event name.
 */
public interface SyncBroadcaster {

    void toAll(String event, ObjectNode payload);

    void toPlayer(String connectionId, String event, ObjectNode payload);

    void toOthers(String exceptConnectionId, String event, ObjectNode payload);
}
