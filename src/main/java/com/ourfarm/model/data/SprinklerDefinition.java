package com.ourfarm.model.data;

import java.util.List;

public class SprinklerDefinition {
    public String id;
    /** Tile offsets [dx, dz] watered each morning. */
    public List<int[]> tiles = List.of();
}
