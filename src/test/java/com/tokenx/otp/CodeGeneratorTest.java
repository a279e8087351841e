package com.tokenx.otp;

import com.tokenx.ErrorKind;
import com.tokenx.MutableClock;
import com.tokenx.models.Credential;
import com.tokenx.models.OtpAlgorithm;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CodeGeneratorTest {

    // RFC 6238 appendix B keys: "12345678901234567890" repeated to 20, 32 and 64 bytes
    private static final String KEY_SHA1 = "GEZDGNBVGY3TQOJQGEZDGNBVGY3TQOJQ";
    private static final String KEY_SHA256 = "GEZDGNBVGY3TQOJQGEZDGNBVGY3TQOJQGEZDGNBVGY3TQOJQGEZA====";
    private static final String KEY_SHA512 = "GEZDGNBVGY3TQOJQGEZDGNBVGY3TQOJQGEZDGNBVGY3TQOJQGEZDGNBVGY3TQOJQ"
        + "GEZDGNBVGY3TQOJQGEZDGNBVGY3TQOJQGEZDGNA=";
    private static final String HELLO_WORLD = "JBSWY3DPEBLW64TMMQ======";

    private final CodeGenerator generator = new CodeGenerator(MutableClock.atEpochSecond(0));

    @Test
    void matchesRfc6238Vectors() throws Exception {
        assertEquals("94287082", generator.totp(KEY_SHA1, OtpAlgorithm.SHA1, 8, 30, 59));
        assertEquals("46119246", generator.totp(KEY_SHA256, OtpAlgorithm.SHA256, 8, 30, 59));
        assertEquals("90693936", generator.totp(KEY_SHA512, OtpAlgorithm.SHA512, 8, 30, 59));
        assertEquals("07081804", generator.totp(KEY_SHA1, OtpAlgorithm.SHA1, 8, 30, 1111111109L));
    }

    @Test
    void matchesRfc4226Vectors() throws Exception {
        assertEquals("755224", generator.hotp(KEY_SHA1, OtpAlgorithm.SHA1, 6, 0));
        assertEquals("287082", generator.hotp(KEY_SHA1, OtpAlgorithm.SHA1, 6, 1));
        assertEquals("359152", generator.hotp(KEY_SHA1, OtpAlgorithm.SHA1, 6, 2));
    }

    @Test
    void supportsMd5AndDigitExtremes() throws Exception {
        assertEquals("532013", generator.hotp(KEY_SHA1, OtpAlgorithm.MD5, 6, 1));
        assertEquals("1094287082", generator.hotp(KEY_SHA1, OtpAlgorithm.SHA1, 10, 1));
        assertEquals("7082", generator.hotp(KEY_SHA1, OtpAlgorithm.SHA1, 4, 1));
    }

    @Test
    void sameWindowGivesSameCodeAndNextWindowDiffers() throws Exception {
        Credential credential = Credential.totp("me", HELLO_WORLD, "Test", OtpAlgorithm.SHA1, 6, 30);

        OtpCode first = generator.generate(credential, 1_700_000_000L);
        OtpCode again = generator.generate(credential, 1_700_000_005L);
        OtpCode next = generator.generate(credential, 1_700_000_010L);

        assertEquals("699564", first.getCode());
        assertEquals(first.getCode(), again.getCode());
        assertEquals("813973", next.getCode());
        assertEquals(10, first.getRemainingSeconds());
        assertEquals(5, again.getRemainingSeconds());
        assertEquals(30, next.getRemainingSeconds());
    }

    @Test
    void usesInjectedClock() throws Exception {
        MutableClock clock = MutableClock.atEpochSecond(59);
        CodeGenerator clocked = new CodeGenerator(clock);
        Credential credential = Credential.totp("rfc", KEY_SHA1, null, OtpAlgorithm.SHA1, 8, 30);

        assertEquals("94287082", clocked.generate(credential).getCode());
        assertEquals(1, clocked.remainingSeconds(30));

        clock.advanceSeconds(1111111109L - 59);
        assertEquals("07081804", clocked.generate(credential).getCode());
    }

    @Test
    void hotpUsesStoredCounterAndDoesNotAdvance() throws Exception {
        Credential credential = Credential.hotp("ctr", KEY_SHA1, "Svc", OtpAlgorithm.SHA1, 6, 1L);

        OtpCode code = generator.generate(credential);
        assertEquals("287082", code.getCode());
        assertEquals(0, code.getRemainingSeconds());
        assertEquals("287082", generator.generate(credential).getCode());
        assertEquals(1L, credential.getCounter());
    }

    @Test
    void rawHelperDefaultsToSha512() throws Exception {
        assertEquals(OtpAlgorithm.SHA512, CodeGenerator.DEFAULT_RAW_ALGORITHM);
        assertEquals("342147", generator.generateRaw(KEY_SHA1, 59));
    }

    @Test
    void remainingSecondsCountsDownToWindowEnd() {
        assertEquals(30, CodeGenerator.remainingSeconds(30, 0));
        assertEquals(1, CodeGenerator.remainingSeconds(30, 29));
        assertEquals(60, CodeGenerator.remainingSeconds(60, 120));
    }

    @Test
    void invalidSecretRaisesCodeGenerationFailure() {
        CodeGenerationException e = assertThrows(CodeGenerationException.class,
            () -> generator.totp("NOT-BASE32!", OtpAlgorithm.SHA1, 6, 30, 0));
        assertEquals(ErrorKind.CODE_GENERATION_FAILURE, e.getKind());
        assertThrows(CodeGenerationException.class,
            () -> generator.hotp(KEY_SHA1, null, 6, 0));
    }
}
