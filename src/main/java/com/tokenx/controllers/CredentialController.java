package com.tokenx.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tokenx.AppLogger;
import com.tokenx.VaultException;
import com.tokenx.qr.QrCodeService;
import com.tokenx.vault.VaultSession;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.Map;

/**
 * Controller for the code list, imports, exports and deletes.
 */
public class CredentialController implements Controller {

    private final VaultSession session;
    private final QrCodeService qrCodeService;
    private final ObjectMapper objectMapper;
    private final AppLogger logger;

    public CredentialController(VaultSession session, QrCodeService qrCodeService, ObjectMapper objectMapper) {
        this.session = session;
        this.qrCodeService = qrCodeService;
        this.objectMapper = objectMapper;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/credentials", this::listCodes);
        app.post("/api/credentials/import", this::importUri);
        app.post("/api/credentials/import/image", this::importImage);
        app.delete("/api/credentials/{name}", this::deleteCredential);
        app.get("/api/credentials/{name}/uri", this::getUri);
        app.get("/api/credentials/{name}/qr", this::getQr);
        app.get("/api/credentials/{name}/qr/encrypted", this::getEncryptedQr);
    }

    private void listCodes(Context ctx) {
        try {
            ctx.json(session.codes());
        } catch (VaultException e) {
            Controller.fail(ctx, e);
        }
    }

    private void importUri(Context ctx) {
        try {
            JsonNode json = objectMapper.readTree(ctx.body());
            boolean overwrite = json.path("overwrite").asBoolean(false);
            String name = session.importUri(Controller.text(json, "uri"), overwrite);
            ctx.status(201).json(Map.of("success", true, "name", name));
        } catch (VaultException e) {
            Controller.fail(ctx, e);
        } catch (Exception e) {
            logError("Error importing URI: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void importImage(Context ctx) {
        try {
            boolean overwrite = Boolean.parseBoolean(ctx.queryParam("overwrite"));
            boolean encrypted = Boolean.parseBoolean(ctx.queryParam("encrypted"));
            String name = session.importImage(ctx.bodyAsBytes(), overwrite, encrypted);
            ctx.status(201).json(Map.of("success", true, "name", name));
        } catch (VaultException e) {
            Controller.fail(ctx, e);
        } catch (Exception e) {
            logError("Error importing QR image: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void deleteCredential(Context ctx) {
        try {
            String name = ctx.pathParam("name");
            session.delete(name);
            ctx.json(Map.of("success", true, "message", "Deleted: " + name));
        } catch (VaultException e) {
            Controller.fail(ctx, e);
        }
    }

    private void getUri(Context ctx) {
        try {
            ctx.json(Map.of("uri", session.exportUri(ctx.pathParam("name"))));
        } catch (VaultException e) {
            Controller.fail(ctx, e);
        }
    }

    private void getQr(Context ctx) {
        try {
            byte[] png = session.exportQrPng(ctx.pathParam("name"));
            if ("data-uri".equals(ctx.queryParam("format"))) {
                ctx.json(Map.of("dataUri", qrCodeService.toDataUri(png)));
            } else {
                ctx.contentType(QrCodeService.PNG_MIME_TYPE).result(png);
            }
        } catch (VaultException e) {
            Controller.fail(ctx, e);
        }
    }

    private void getEncryptedQr(Context ctx) {
        try {
            String name = ctx.pathParam("name");
            String envelope = session.exportEncryptedQr(name);
            ctx.header("Content-Disposition", "attachment; filename=\"" + name + "_qr.enc\"");
            ctx.contentType("text/plain; charset=utf-8").result(envelope);
        } catch (VaultException e) {
            Controller.fail(ctx, e);
        }
    }

    private void logError(String message) {
        if (logger != null) {
            logger.error("[CredentialController] " + message);
        }
    }
}
