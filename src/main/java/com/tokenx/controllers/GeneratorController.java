package com.tokenx.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tokenx.VaultException;
import com.tokenx.otp.ManualCodeService;
import com.tokenx.otp.OtpCode;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.Map;

/**
 * Manual generator: works without an unlocked vault and stores nothing.
 */
public class GeneratorController implements Controller {

    private final ManualCodeService manualCodeService;
    private final ObjectMapper objectMapper;

    public GeneratorController(ManualCodeService manualCodeService, ObjectMapper objectMapper) {
        this.manualCodeService = manualCodeService;
        this.objectMapper = objectMapper;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.post("/api/generator/secret", this::newSecret);
        app.post("/api/generator/code", this::generateCode);
    }

    private void newSecret(Context ctx) {
        ctx.json(Map.of("secret", manualCodeService.newSecret()));
    }

    private void generateCode(Context ctx) {
        try {
            JsonNode json = objectMapper.readTree(ctx.body());
            OtpCode code = manualCodeService.generate(
                Controller.text(json, "secret"),
                Controller.text(json, "algorithm"),
                Controller.integer(json, "digits"),
                Controller.integer(json, "period"));
            ctx.json(code);
        } catch (VaultException e) {
            Controller.fail(ctx, e);
        } catch (Exception e) {
            ctx.status(400).json(Controller.errorBody(e));
        }
    }
}
