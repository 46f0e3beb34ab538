package com.ourfarm.service;

import com.ourfarm.config.GameProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Bounded per-connection inboxes. Socket threads offer, the tick thread
 * drains. Connections are drained one after another so each player's
 * commands run in the order they were sent.
 */
@Component
public class CommandQueue {

    private static final Logger log = LoggerFactory.getLogger(CommandQueue.class);

    private final int capacity;
    private final Map<String, BlockingQueue<PlayerCommand>> queues = new ConcurrentHashMap<>();
    // Unbounded so a disconnect is never lost to a full inbox
    private final ConcurrentLinkedQueue<String> closed = new ConcurrentLinkedQueue<>();

    public CommandQueue(GameProperties properties) {
        this.capacity = properties.getCommandQueueCapacity();
    }

    /** @return false if the connection's inbox is full and the command was dropped */
    public boolean offer(PlayerCommand command) {
        BlockingQueue<PlayerCommand> queue = queues.computeIfAbsent(
                command.getConnectionId(), id -> new ArrayBlockingQueue<>(capacity));
        if (!queue.offer(command)) {
            log.warn("Command queue full for {}, dropping {}", command.getConnectionId(), command.getAction());
            return false;
        }
        return true;
    }

    public List<PlayerCommand> drainAll() {
        List<PlayerCommand> out = new ArrayList<>();
        for (BlockingQueue<PlayerCommand> queue : queues.values()) {
            queue.drainTo(out);
        }
        return out;
    }

    /** Records a disconnect; it is handled after the connection's pending commands. */
    public void markClosed(String connectionId) {
        closed.add(connectionId);
    }

    /** Returns closed connections and forgets their inboxes. */
    public List<String> drainClosed() {
        List<String> out = new ArrayList<>();
        String id;
        while ((id = closed.poll()) != null) {
            queues.remove(id);
            out.add(id);
        }
        return out;
    }
}
