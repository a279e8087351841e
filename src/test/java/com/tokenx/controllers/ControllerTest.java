package com.tokenx.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tokenx.ErrorKind;
import com.tokenx.VaultException;
import com.tokenx.crypto.DecryptionFailureException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ControllerTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void statusCodesByKind() {
        assertEquals(400, Controller.statusFor(ErrorKind.INVALID_SECRET));
        assertEquals(400, Controller.statusFor(ErrorKind.WEAK_PASSWORD));
        assertEquals(400, Controller.statusFor(ErrorKind.NO_QR_CODE));
        assertEquals(401, Controller.statusFor(ErrorKind.DECRYPTION_FAILURE));
        assertEquals(401, Controller.statusFor(ErrorKind.PASSWORD_MISMATCH));
        assertEquals(404, Controller.statusFor(ErrorKind.CREDENTIAL_NOT_FOUND));
        assertEquals(409, Controller.statusFor(ErrorKind.CREDENTIAL_EXISTS));
        assertEquals(409, Controller.statusFor(ErrorKind.PARTIAL_REENCRYPTION_FAILURE));
        assertEquals(423, Controller.statusFor(ErrorKind.VAULT_LOCKED));
        assertEquals(423, Controller.statusFor(ErrorKind.SESSION_TERMINATED));
        assertEquals(500, Controller.statusFor(ErrorKind.IO_FAILURE));
    }

    @Test
    void errorBodyCarriesKind() {
        Map<String, Object> body = Controller.errorBody(new DecryptionFailureException());

        assertEquals(DecryptionFailureException.MESSAGE, body.get("error"));
        assertEquals("DECRYPTION_FAILURE", body.get("kind"));
    }

    @Test
    void errorBodyFallsBackToClassName() {
        assertEquals("IllegalStateException", Controller.errorBody(new IllegalStateException()).get("error"));
    }

    @Test
    void fieldHelpers() throws Exception {
        JsonNode json = mapper.readTree("{\"secret\":\"ABC\",\"digits\":\"8\",\"period\":null,\"bad\":\"x\"}");

        assertEquals("ABC", Controller.text(json, "secret"));
        assertNull(Controller.text(json, "period"));
        assertNull(Controller.text(null, "secret"));
        assertEquals(8, Controller.integer(json, "digits"));
        assertNull(Controller.integer(json, "period"));

        JsonNode badDigits = mapper.readTree("{\"digits\":\"eight\"}");
        VaultException e = assertThrows(VaultException.class, () -> Controller.integer(badDigits, "digits"));
        assertEquals(ErrorKind.INVALID_DIGITS, e.getKind());
    }
}
