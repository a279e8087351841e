package com.tokenx.models;

/**
 * One row of the code list handed to the display layer.
 */
public class CodeView {

    public static final String UNAVAILABLE = "code unavailable";

    private String name;
    private String label;
    private String issuer;
    private String type;
    private String code;
    private int remainingSeconds;
    private Integer period;
    private boolean available;

    public CodeView() {
    }

    public CodeView(String name, Credential credential, String code, int remainingSeconds, boolean available) {
        this.name = name;
        this.label = credential.getLabel();
        this.issuer = credential.getIssuer();
        this.type = credential.getKind().getUriName();
        this.period = credential.getPeriod();
        this.code = code;
        this.remainingSeconds = remainingSeconds;
        this.available = available;
    }

    public static CodeView unavailable(String name, Credential credential) {
        return new CodeView(name, credential, UNAVAILABLE, 0, false);
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label;
    }

    public String getIssuer() {
        return issuer;
    }

    public void setIssuer(String issuer) {
        this.issuer = issuer;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public int getRemainingSeconds() {
        return remainingSeconds;
    }

    public void setRemainingSeconds(int remainingSeconds) {
        this.remainingSeconds = remainingSeconds;
    }

    public Integer getPeriod() {
        return period;
    }

    public void setPeriod(Integer period) {
        this.period = period;
    }

    public boolean isAvailable() {
        return available;
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }
}
