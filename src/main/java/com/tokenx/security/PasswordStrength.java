package com.tokenx.security;

import com.tokenx.ErrorKind;
import com.tokenx.VaultException;
import com.tokenx.models.StrengthReport;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Additive 0-100 rubric for master passwords. Only the scoring lives here; rendering the
 * meter is up to the display layer.
 */
public class PasswordStrength {
    public static final int DEFAULT_MIN_LENGTH = 8;
    public static final int ACCEPTABLE_SCORE = 60;

    private static final Pattern LOWER = Pattern.compile("[a-z]");
    private static final Pattern UPPER = Pattern.compile("[A-Z]");
    private static final Pattern DIGIT = Pattern.compile("\\d");
    private static final Pattern SPECIAL = Pattern.compile("[!@#$%^&*()_+\\-=\\[\\]{};:'\",.<>?/\\\\|`~]");
    private static final Pattern REPEAT = Pattern.compile("(.)\\1{2,}");
    private static final Pattern SEQUENCE = Pattern.compile("012|123|234|345|456|567|678|789|abc|bcd|cde");

    private final int minLength;

    public PasswordStrength() {
        this(DEFAULT_MIN_LENGTH);
    }

    public PasswordStrength(int minLength) {
        this.minLength = minLength > 0 ? minLength : DEFAULT_MIN_LENGTH;
    }

    public int getMinLength() {
        return minLength;
    }

    public StrengthReport score(String password) {
        if (password == null || password.isEmpty()) {
            return new StrengthReport(0, "Very Weak", List.of("Password is empty"), "#ff0000");
        }

        int score = 0;
        List<String> feedback = new ArrayList<>();
        int length = password.length();

        if (length >= 8) {
            score += 10;
        } else {
            feedback.add("Password should be at least 8 characters (currently " + length + ")");
        }
        if (length >= 12) {
            score += 10;
        }
        if (length >= 16) {
            score += 10;
        }

        if (LOWER.matcher(password).find()) {
            score += 15;
        } else {
            feedback.add("Add lowercase letters (a-z)");
        }
        if (UPPER.matcher(password).find()) {
            score += 15;
        } else {
            feedback.add("Add uppercase letters (A-Z)");
        }
        if (DIGIT.matcher(password).find()) {
            score += 15;
        } else {
            feedback.add("Add numbers (0-9)");
        }
        if (SPECIAL.matcher(password).find()) {
            score += 15;
        } else {
            feedback.add("Add special characters (!@#$%^&*)");
        }

        if (REPEAT.matcher(password).find()) {
            score -= 10;
            feedback.add("Avoid repeating characters");
        }
        if (SEQUENCE.matcher(password.toLowerCase(Locale.ROOT)).find()) {
            score -= 5;
            feedback.add("Avoid sequential characters");
        }

        score = Math.max(0, Math.min(100, score));

        if (score < 20) {
            return new StrengthReport(score, "Very Weak", feedback, "#ff0000");
        } else if (score < 40) {
            return new StrengthReport(score, "Weak", feedback, "#ff6600");
        } else if (score < 60) {
            return new StrengthReport(score, "Fair", feedback, "#ffcc00");
        } else if (score < 80) {
            return new StrengthReport(score, "Good", feedback, "#99cc00");
        }
        return new StrengthReport(score, "Strong", feedback, "#00cc00");
    }

    /**
     * Gate for new master passwords: minimum length and a score of at least 60.
     */
    public boolean isAcceptable(String password) {
        return password != null
            && password.length() >= minLength
            && score(password).getScore() >= ACCEPTABLE_SCORE;
    }

    public void requireAcceptable(String password, String confirmation) throws VaultException {
        if (password == null || !password.equals(confirmation)) {
            throw new VaultException(ErrorKind.PASSWORD_MISMATCH, "Passwords do not match.");
        }
        if (password.length() < minLength) {
            throw new VaultException(ErrorKind.WEAK_PASSWORD,
                "Password must be at least " + minLength + " characters long.");
        }
        if (score(password).getScore() < ACCEPTABLE_SCORE) {
            throw new VaultException(ErrorKind.WEAK_PASSWORD,
                "Password is not strong enough. Please add more complexity.");
        }
    }
}
