package com.tokenx.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tokenx.AppLogger;
import com.tokenx.VaultException;
import com.tokenx.vault.VaultLoadSummary;
import com.tokenx.vault.VaultSession;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.LinkedHashMap;
import java.util.Map;

public class VaultController implements Controller {

    private final VaultSession session;
    private final ObjectMapper objectMapper;
    private final AppLogger logger;

    public VaultController(VaultSession session, ObjectMapper objectMapper) {
        this.session = session;
        this.objectMapper = objectMapper;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.post("/api/vault/reload", this::reload);
        app.post("/api/vault/reset", this::reset);
    }

    private void reload(Context ctx) {
        try {
            VaultLoadSummary summary = session.reload();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("loaded", summary.getLoadedCount());
            body.put("failed", summary.getFailed());
            ctx.json(body);
        } catch (VaultException e) {
            Controller.fail(ctx, e);
        }
    }

    private void reset(Context ctx) {
        try {
            JsonNode json = objectMapper.readTree(ctx.body());
            if (!json.path("confirm").asBoolean(false)) {
                ctx.status(400).json(Map.of("error", "Reset must be confirmed with {\"confirm\": true}"));
                return;
            }
            int removed = session.resetVault();
            if (logger != null) {
                logger.warn("[VaultController] Vault reset requested via API");
            }
            ctx.json(Map.of("success", true, "removed", removed));
        } catch (VaultException e) {
            Controller.fail(ctx, e);
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }
}
