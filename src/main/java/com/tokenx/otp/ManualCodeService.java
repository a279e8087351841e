package com.tokenx.otp;

import com.tokenx.ErrorKind;
import com.tokenx.VaultException;
import com.tokenx.models.Credential;
import com.tokenx.models.OtpAlgorithm;
import dev.samstevens.totp.secret.DefaultSecretGenerator;
import dev.samstevens.totp.secret.SecretGenerator;

/**
 * Ad-hoc generator: fresh random secrets and codes for secrets that are not stored in the vault.
 */
public class ManualCodeService {
    public static final OtpAlgorithm DEFAULT_ALGORITHM = OtpAlgorithm.SHA1;

    private final CodeGenerator codeGenerator;
    // 32 Base32 characters = 160 bits
    private final SecretGenerator secretGenerator = new DefaultSecretGenerator(32);

    public ManualCodeService(CodeGenerator codeGenerator) {
        this.codeGenerator = codeGenerator;
    }

    public String newSecret() {
        return secretGenerator.generate();
    }

    /**
     * TOTP code for a raw secret. Null arguments take the SHA1/6/30 defaults.
     */
    public OtpCode generate(String secret, String algorithm, Integer digits, Integer period) throws VaultException {
        if (secret == null || secret.isBlank()) {
            throw new VaultException(ErrorKind.MISSING_FIELD, "Missing secret");
        }
        String normalized = secret.replace(" ", "").trim().toUpperCase();
        if (!Credential.isBase32(normalized)) {
            throw new VaultException(ErrorKind.INVALID_SECRET, "Secret is not valid Base32");
        }
        OtpAlgorithm resolved = algorithm == null || algorithm.isBlank()
            ? DEFAULT_ALGORITHM : OtpAlgorithm.fromName(algorithm);
        if (resolved == null) {
            throw new VaultException(ErrorKind.INVALID_ALGORITHM, "Unsupported algorithm: " + algorithm);
        }
        int resolvedDigits = digits != null ? digits : CodeGenerator.DEFAULT_DIGITS;
        if (resolvedDigits < Credential.MIN_DIGITS || resolvedDigits > Credential.MAX_DIGITS) {
            throw new VaultException(ErrorKind.INVALID_DIGITS, "Digits must be between "
                + Credential.MIN_DIGITS + " and " + Credential.MAX_DIGITS);
        }
        int resolvedPeriod = period != null ? period : CodeGenerator.DEFAULT_PERIOD;
        if (resolvedPeriod < 1) {
            throw new VaultException(ErrorKind.INVALID_PERIOD, "Period must be at least 1 second");
        }
        long now = codeGenerator.currentEpochSeconds();
        String code = codeGenerator.totp(normalized, resolved, resolvedDigits, resolvedPeriod, now);
        return new OtpCode(code, CodeGenerator.remainingSeconds(resolvedPeriod, now));
    }
}
