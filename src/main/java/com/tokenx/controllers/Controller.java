package com.tokenx.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.tokenx.ErrorKind;
import com.tokenx.VaultException;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Interface for API controllers.
 * Each controller registers its routes with the Javalin app.
 */
public interface Controller {

    /**
     * Register this controller's routes with the Javalin app.
     */
    void registerRoutes(Javalin app);

    /**
     * Safe error body helper that handles null exception messages.
     */
    static Map<String, Object> errorBody(Exception e) {
        String m = e.getMessage();
        if (m == null || m.isBlank()) {
            m = e.getClass().getSimpleName();
        }
        return Map.of("error", m);
    }

    /**
     * Error body carrying the failure kind: {@code {"error": message, "kind": KIND}}.
     */
    static Map<String, Object> errorBody(VaultException e) {
        Map<String, Object> body = new LinkedHashMap<>(errorBody((Exception) e));
        body.put("kind", e.getKind().name());
        return body;
    }

    static int statusFor(ErrorKind kind) {
        if (kind.isValidationError()) {
            return 400;
        }
        switch (kind) {
            case WEAK_PASSWORD:
            case NO_QR_CODE:
            case CODE_GENERATION_FAILURE:
                return 400;
            case DECRYPTION_FAILURE:
            case PASSWORD_MISMATCH:
                return 401;
            case CREDENTIAL_NOT_FOUND:
                return 404;
            case CREDENTIAL_EXISTS:
            case VAULT_ALREADY_INITIALIZED:
            case VAULT_NOT_INITIALIZED:
            case PARTIAL_REENCRYPTION_FAILURE:
                return 409;
            case VAULT_LOCKED:
            case SESSION_TERMINATED:
                return 423;
            case IO_FAILURE:
            default:
                return 500;
        }
    }

    static void fail(Context ctx, VaultException e) {
        ctx.status(statusFor(e.getKind())).json(errorBody(e));
    }

    /**
     * Text of a JSON field, or null if absent or JSON null.
     */
    static String text(JsonNode json, String field) {
        JsonNode node = json == null ? null : json.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    static Integer integer(JsonNode json, String field) throws VaultException {
        String value = text(json, field);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            ErrorKind kind = "digits".equals(field) ? ErrorKind.INVALID_DIGITS
                : "period".equals(field) ? ErrorKind.INVALID_PERIOD : ErrorKind.MISSING_FIELD;
            throw new VaultException(kind, "'" + field + "' must be an integer");
        }
    }
}
