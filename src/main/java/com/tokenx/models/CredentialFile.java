package com.tokenx.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * JSON shape of a credential inside a vault envelope:
 * {@code {type, label, secret, issuer, algorithm, digits, period|counter}}.
 * Numeric fields also bind from numeric strings, which older vault files used.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CredentialFile {
    private String type;
    private String label;
    private String secret;
    private String issuer;
    private String algorithm;
    private Integer digits;
    private Integer period;
    private Long counter;

    public static CredentialFile from(Credential credential) {
        CredentialFile file = new CredentialFile();
        file.setType(credential.getKind().getUriName());
        file.setLabel(credential.getLabel());
        file.setSecret(credential.getSecret());
        file.setIssuer(credential.getIssuer());
        file.setAlgorithm(credential.getAlgorithm().name());
        file.setDigits(credential.getDigits());
        file.setPeriod(credential.getPeriod());
        file.setCounter(credential.getCounter());
        return file;
    }

    /**
     * @throws IllegalArgumentException if the stored fields do not form a valid credential
     */
    public Credential toCredential() {
        OtpKind kind = type == null ? OtpKind.TOTP : OtpKind.fromName(type);
        if (kind == null) {
            throw new IllegalArgumentException("Unsupported OTP type: " + type);
        }
        OtpAlgorithm resolvedAlgorithm = algorithm == null ? OtpAlgorithm.SHA1 : OtpAlgorithm.fromName(algorithm);
        if (resolvedAlgorithm == null) {
            throw new IllegalArgumentException("Unsupported algorithm: " + algorithm);
        }
        int resolvedDigits = digits != null ? digits : 6;
        if (kind == OtpKind.TOTP) {
            return Credential.totp(label, secret, issuer, resolvedAlgorithm, resolvedDigits,
                period != null ? period : 30);
        }
        return Credential.hotp(label, secret, issuer, resolvedAlgorithm, resolvedDigits,
            counter != null ? counter : 0L);
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label;
    }

    public String getSecret() {
        return secret;
    }

    public void setSecret(String secret) {
        this.secret = secret;
    }

    public String getIssuer() {
        return issuer;
    }

    public void setIssuer(String issuer) {
        this.issuer = issuer;
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public void setAlgorithm(String algorithm) {
        this.algorithm = algorithm;
    }

    public Integer getDigits() {
        return digits;
    }

    public void setDigits(Integer digits) {
        this.digits = digits;
    }

    public Integer getPeriod() {
        return period;
    }

    public void setPeriod(Integer period) {
        this.period = period;
    }

    public Long getCounter() {
        return counter;
    }

    public void setCounter(Long counter) {
        this.counter = counter;
    }
}
