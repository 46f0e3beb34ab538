package com.ourfarm.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Deployment settings bound from {@code ourfarm.*} in application.properties.
 */
@ConfigurationProperties(prefix = "ourfarm")
public class GameProperties {

    /** Row id of the world this process simulates. */
    private String worldId = "world_main";

    /** Commands buffered per connection before new ones are dropped. */
    private int commandQueueCapacity = 64;

    /** Seed for a newly created world; random when unset. Ignored once the world row exists. */
    private Long seed;

    private int startingCoins = 500;

    public String getWorldId() { return worldId; }
    public void setWorldId(String worldId) { this.worldId = worldId; }
    public int getCommandQueueCapacity() { return commandQueueCapacity; }
    public void setCommandQueueCapacity(int commandQueueCapacity) { this.commandQueueCapacity = commandQueueCapacity; }
    public Long getSeed() { return seed; }
    public void setSeed(Long seed) { this.seed = seed; }
    public int getStartingCoins() { return startingCoins; }
    public void setStartingCoins(int startingCoins) { this.startingCoins = startingCoins; }
}
