package com.tokenx.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tokenx.AppLogger;
import com.tokenx.VaultException;
import com.tokenx.security.PasswordStrength;
import com.tokenx.vault.ReencryptionFailureException;
import com.tokenx.vault.ReencryptionResult;
import com.tokenx.vault.VaultLoadSummary;
import com.tokenx.vault.VaultSession;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Controller for login, lock, activity and master password changes.
 */
public class SessionController implements Controller {

    private final VaultSession session;
    private final PasswordStrength passwordStrength;
    private final ObjectMapper objectMapper;
    private final AppLogger logger;

    public SessionController(VaultSession session, PasswordStrength passwordStrength, ObjectMapper objectMapper) {
        this.session = session;
        this.passwordStrength = passwordStrength;
        this.objectMapper = objectMapper;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/session", this::getStatus);
        app.post("/api/session/setup", this::setup);
        app.post("/api/session/unlock", this::unlock);
        app.post("/api/session/lock", this::lock);
        app.post("/api/session/activity", this::activity);
        app.post("/api/session/password", this::changePassword);
        app.post("/api/password/strength", this::strength);
    }

    private void getStatus(Context ctx) {
        ctx.json(session.status());
    }

    private void setup(Context ctx) {
        try {
            JsonNode json = objectMapper.readTree(ctx.body());
            session.setup(Controller.text(json, "password"), Controller.text(json, "confirm"));
            ctx.status(201).json(session.status());
        } catch (VaultException e) {
            Controller.fail(ctx, e);
        } catch (Exception e) {
            logError("Error during setup: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void unlock(Context ctx) {
        try {
            JsonNode json = objectMapper.readTree(ctx.body());
            VaultLoadSummary summary = session.unlock(Controller.text(json, "password"));
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("state", session.getState().name());
            body.put("loaded", summary.getLoadedCount());
            body.put("failed", summary.getFailed());
            ctx.json(body);
        } catch (VaultException e) {
            Controller.fail(ctx, e);
        } catch (Exception e) {
            logError("Error during unlock: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void lock(Context ctx) {
        session.lock();
        ctx.json(session.status());
    }

    private void activity(Context ctx) {
        try {
            session.touch();
            ctx.json(session.status());
        } catch (VaultException e) {
            Controller.fail(ctx, e);
        }
    }

    private void changePassword(Context ctx) {
        try {
            JsonNode json = objectMapper.readTree(ctx.body());
            ReencryptionResult result = session.changePassword(
                Controller.text(json, "current"),
                Controller.text(json, "password"),
                Controller.text(json, "confirm"));
            ctx.json(Map.of("success", true, "reencrypted", result.getSucceeded().size()));
        } catch (ReencryptionFailureException e) {
            Map<String, Object> body = Controller.errorBody(e);
            body.put("succeeded", e.getResult().getSucceeded());
            body.put("failed", e.getResult().getFailed());
            ctx.status(Controller.statusFor(e.getKind())).json(body);
        } catch (VaultException e) {
            Controller.fail(ctx, e);
        } catch (Exception e) {
            logError("Error changing password: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void strength(Context ctx) {
        try {
            JsonNode json = objectMapper.readTree(ctx.body());
            ctx.json(passwordStrength.score(Controller.text(json, "password")));
        } catch (Exception e) {
            ctx.status(400).json(Controller.errorBody(e));
        }
    }

    private void logError(String message) {
        if (logger != null) {
            logger.error("[SessionController] " + message);
        }
    }
}
