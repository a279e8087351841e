package com.tokenx.models;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CredentialFileTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void totpWritesPeriodButNoCounter() throws Exception {
        Credential credential = Credential.totp("me", "jbswy3dpehpk3pxp", "", OtpAlgorithm.SHA256, 8, 60);

        JsonNode json = mapper.readTree(mapper.writeValueAsBytes(CredentialFile.from(credential)));

        assertEquals("totp", json.get("type").asText());
        assertEquals("JBSWY3DPEHPK3PXP", json.get("secret").asText());
        assertEquals(Credential.UNKNOWN_ISSUER, json.get("issuer").asText());
        assertEquals("SHA256", json.get("algorithm").asText());
        assertEquals(60, json.get("period").asInt());
        assertFalse(json.has("counter"));
    }

    @Test
    void missingFieldsTakeDefaults() throws Exception {
        CredentialFile file = mapper.readValue("{\"label\":\"me\",\"secret\":\"JBSWY3DPEHPK3PXP\",\"extra\":1}",
            CredentialFile.class);

        Credential credential = file.toCredential();

        assertEquals(OtpKind.TOTP, credential.getKind());
        assertEquals(OtpAlgorithm.SHA1, credential.getAlgorithm());
        assertEquals(6, credential.getDigits());
        assertEquals(30, credential.getPeriod());
    }

    @Test
    void hotpBindsCounterFromString() throws Exception {
        CredentialFile file = mapper.readValue("{\"type\":\"hotp\",\"label\":\"me\",\"secret\":\"JBSWY3DPEHPK3PXP\","
            + "\"digits\":\"7\",\"counter\":\"42\"}", CredentialFile.class);

        Credential credential = file.toCredential();

        assertEquals(OtpKind.HOTP, credential.getKind());
        assertEquals(7, credential.getDigits());
        assertEquals(42L, credential.getCounter());
        assertNull(credential.getPeriod());
    }

    @Test
    void invalidStoredFieldsAreRejected() throws Exception {
        CredentialFile badType = mapper.readValue("{\"type\":\"motp\",\"label\":\"me\",\"secret\":\"JBSWY3DPEHPK3PXP\"}",
            CredentialFile.class);
        CredentialFile badSecret = mapper.readValue("{\"label\":\"me\",\"secret\":\"not base32\"}", CredentialFile.class);

        assertThrows(IllegalArgumentException.class, badType::toCredential);
        assertThrows(IllegalArgumentException.class, badSecret::toCredential);
    }
}
