package com.tokenx.otp;

import com.tokenx.models.Credential;
import com.tokenx.models.OtpAlgorithm;
import org.apache.commons.codec.binary.Base32;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.util.Locale;

/**
 * RFC 4226 / RFC 6238 code generation.
 *
 * HOTP codes are computed from the stored counter and the counter is never advanced here;
 * codes are display-only.
 */
public class CodeGenerator {

    /** Algorithm used by {@link #generateRaw(String, long)}; credential codes use their own algorithm. */
    public static final OtpAlgorithm DEFAULT_RAW_ALGORITHM = OtpAlgorithm.SHA512;
    public static final int DEFAULT_DIGITS = 6;
    public static final int DEFAULT_PERIOD = 30;

    private static final long[] POWERS_OF_TEN = buildPowersOfTen();

    private final Clock clock;

    public CodeGenerator() {
        this(Clock.systemUTC());
    }

    public CodeGenerator(Clock clock) {
        this.clock = clock;
    }

    public long currentEpochSeconds() {
        return clock.instant().getEpochSecond();
    }

    public OtpCode generate(Credential credential) throws CodeGenerationException {
        return generate(credential, currentEpochSeconds());
    }

    public OtpCode generate(Credential credential, long epochSeconds) throws CodeGenerationException {
        if (credential.isTotp()) {
            int period = credential.getPeriod();
            String code = totp(credential.getSecret(), credential.getAlgorithm(), credential.getDigits(),
                period, epochSeconds);
            return new OtpCode(code, remainingSeconds(period, epochSeconds));
        }
        String code = hotp(credential.getSecret(), credential.getAlgorithm(), credential.getDigits(),
            credential.getCounter());
        return new OtpCode(code, 0);
    }

    /**
     * Plain TOTP over a bare secret with {@link #DEFAULT_RAW_ALGORITHM}, 6 digits and a 30 second step.
     */
    public String generateRaw(String secret, long epochSeconds) throws CodeGenerationException {
        return totp(secret, DEFAULT_RAW_ALGORITHM, DEFAULT_DIGITS, DEFAULT_PERIOD, epochSeconds);
    }

    public String totp(String secret, OtpAlgorithm algorithm, int digits, int period, long epochSeconds)
            throws CodeGenerationException {
        if (period < 1) {
            throw new CodeGenerationException("Period must be positive");
        }
        return hotp(secret, algorithm, digits, Math.floorDiv(epochSeconds, (long) period));
    }

    public String hotp(String secret, OtpAlgorithm algorithm, int digits, long counter)
            throws CodeGenerationException {
        if (algorithm == null) {
            throw new CodeGenerationException("Unsupported algorithm");
        }
        if (digits < Credential.MIN_DIGITS || digits > Credential.MAX_DIGITS) {
            throw new CodeGenerationException("Unsupported digit count: " + digits);
        }
        byte[] key = decodeSecret(secret);
        byte[] hash;
        try {
            Mac mac = Mac.getInstance(algorithm.getMacName());
            mac.init(new SecretKeySpec(key, algorithm.getMacName()));
            hash = mac.doFinal(ByteBuffer.allocate(8).putLong(counter).array());
        } catch (GeneralSecurityException e) {
            throw new CodeGenerationException("HMAC " + algorithm + " unavailable", e);
        }

        int offset = hash[hash.length - 1] & 0x0F;
        long binary = ((hash[offset] & 0x7F) << 24)
            | ((hash[offset + 1] & 0xFF) << 16)
            | ((hash[offset + 2] & 0xFF) << 8)
            | (hash[offset + 3] & 0xFF);
        long otp = binary % POWERS_OF_TEN[digits];
        return String.format(Locale.ROOT, "%0" + digits + "d", otp);
    }

    public int remainingSeconds(int period) {
        return remainingSeconds(period, currentEpochSeconds());
    }

    public static int remainingSeconds(int period, long epochSeconds) {
        return (int) (period - Math.floorMod(epochSeconds, (long) period));
    }

    private static byte[] decodeSecret(String secret) throws CodeGenerationException {
        if (!Credential.isBase32(secret)) {
            throw new CodeGenerationException("Secret is not valid Base32");
        }
        byte[] key = new Base32().decode(secret.toUpperCase(Locale.ROOT));
        if (key.length == 0) {
            throw new CodeGenerationException("Secret decodes to an empty key");
        }
        return key;
    }

    private static long[] buildPowersOfTen() {
        long[] powers = new long[Credential.MAX_DIGITS + 1];
        powers[0] = 1L;
        for (int i = 1; i < powers.length; i++) {
            powers[i] = powers[i - 1] * 10L;
        }
        return powers;
    }
}
