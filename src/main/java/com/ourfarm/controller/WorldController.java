package com.ourfarm.controller;
import com.ourfarm.service.GameService;
import org.springframework.web.bind.annotation.*;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class WorldController {
    private final GameService gameService;
    public WorldController(GameService gs) { this.gameService = gs; }

    @GetMapping("/api/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("players", gameService.getPlayerCount());
        return body;
    }
}
