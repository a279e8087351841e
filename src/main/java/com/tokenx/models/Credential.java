package com.tokenx.models;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One OTP account. TOTP credentials carry a period and no counter, HOTP
 * credentials carry a counter and no period; the factories enforce it.
 */
public final class Credential {

    public static final Pattern BASE32_PATTERN = Pattern.compile("^[A-Z2-7]+=*$");
    public static final int MIN_DIGITS = 4;
    public static final int MAX_DIGITS = 10;
    public static final String UNKNOWN_ISSUER = "Unknown";

    private final OtpKind kind;
    private final String label;
    private final String secret;
    private final String issuer;
    private final OtpAlgorithm algorithm;
    private final int digits;
    private final Integer period;
    private final Long counter;

    private Credential(OtpKind kind, String label, String secret, String issuer, OtpAlgorithm algorithm,
                       int digits, Integer period, Long counter) {
        if (label == null || label.isEmpty()) {
            throw new IllegalArgumentException("label is required");
        }
        if (secret == null || !isBase32(secret)) {
            throw new IllegalArgumentException("secret must be Base32");
        }
        if (digits < MIN_DIGITS || digits > MAX_DIGITS) {
            throw new IllegalArgumentException("digits must be between " + MIN_DIGITS + " and " + MAX_DIGITS);
        }
        this.kind = Objects.requireNonNull(kind, "kind");
        this.label = label;
        this.secret = secret.toUpperCase(Locale.ROOT);
        this.issuer = issuer == null || issuer.isEmpty() ? UNKNOWN_ISSUER : issuer;
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
        this.digits = digits;
        this.period = period;
        this.counter = counter;
    }

    public static Credential totp(String label, String secret, String issuer, OtpAlgorithm algorithm,
                                  int digits, int period) {
        if (period < 1) {
            throw new IllegalArgumentException("period must be at least 1");
        }
        return new Credential(OtpKind.TOTP, label, secret, issuer, algorithm, digits, period, null);
    }

    public static Credential hotp(String label, String secret, String issuer, OtpAlgorithm algorithm,
                                  int digits, long counter) {
        if (counter < 0) {
            throw new IllegalArgumentException("counter must not be negative");
        }
        return new Credential(OtpKind.HOTP, label, secret, issuer, algorithm, digits, null, counter);
    }

    public static boolean isBase32(String value) {
        return value != null && BASE32_PATTERN.matcher(value.toUpperCase(Locale.ROOT)).matches();
    }

    public OtpKind getKind() {
        return kind;
    }

    public String getLabel() {
        return label;
    }

    public String getSecret() {
        return secret;
    }

    public String getIssuer() {
        return issuer;
    }

    public OtpAlgorithm getAlgorithm() {
        return algorithm;
    }

    public int getDigits() {
        return digits;
    }

    /**
     * Step in seconds, or null for HOTP.
     */
    public Integer getPeriod() {
        return period;
    }

    /**
     * Stored counter, or null for TOTP.
     */
    public Long getCounter() {
        return counter;
    }

    public boolean isTotp() {
        return kind == OtpKind.TOTP;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Credential)) {
            return false;
        }
        Credential other = (Credential) o;
        return digits == other.digits
            && kind == other.kind
            && label.equals(other.label)
            && secret.equals(other.secret)
            && issuer.equals(other.issuer)
            && algorithm == other.algorithm
            && Objects.equals(period, other.period)
            && Objects.equals(counter, other.counter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, label, secret, issuer, algorithm, digits, period, counter);
    }

    @Override
    public String toString() {
        // secret deliberately left out
        return "Credential{" +
            "kind=" + kind +
            ", label='" + label + '\'' +
            ", issuer='" + issuer + '\'' +
            ", algorithm=" + algorithm +
            ", digits=" + digits +
            (period != null ? ", period=" + period : ", counter=" + counter) +
            '}';
    }
}
