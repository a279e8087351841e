package com.tokenx.otp;

import com.tokenx.ErrorKind;
import com.tokenx.VaultException;
import com.tokenx.models.Credential;
import com.tokenx.models.OtpAlgorithm;
import com.tokenx.models.OtpKind;

import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.EncoderException;
import org.apache.commons.codec.net.PercentCodec;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Reads and writes {@code otpauth://} URIs, the interchange format of QR codes and clipboard text.
 *
 * Validation runs in a fixed order and stops at the first failure: secret present, label present,
 * secret alphabet, algorithm, digits, period, counter.
 */
public class OtpUriParser {
    public static final String SCHEME_PREFIX = "otpauth://";
    public static final String DEFAULT_ALGORITHM = "SHA1";
    public static final String DEFAULT_DIGITS = "6";
    public static final String DEFAULT_PERIOD = "30";
    public static final String DEFAULT_COUNTER = "0";

    private static final PercentCodec PATH_CODEC = new PercentCodec(reservedAscii(), false);
    private static final PercentCodec QUERY_CODEC = new PercentCodec(reservedAscii(), true);

    public OtpUriParseResult parse(String uri) {
        if (uri == null || uri.isBlank()) {
            return OtpUriParseResult.error(ErrorKind.INVALID_URI, "URI must be a non-empty string");
        }
        if (!uri.startsWith(SCHEME_PREFIX)) {
            return OtpUriParseResult.error(ErrorKind.INVALID_URI, "URI must start with '" + SCHEME_PREFIX + "'");
        }

        String rest = uri.substring(SCHEME_PREFIX.length());
        int fragment = rest.indexOf('#');
        if (fragment >= 0) {
            rest = rest.substring(0, fragment);
        }
        String query = "";
        int queryStart = rest.indexOf('?');
        if (queryStart >= 0) {
            query = rest.substring(queryStart + 1);
            rest = rest.substring(0, queryStart);
        }
        int pathStart = rest.indexOf('/');
        String authority = pathStart >= 0 ? rest.substring(0, pathStart) : rest;
        String path = pathStart >= 0 ? stripLeadingSlashes(rest.substring(pathStart)) : "";

        OtpKind kind = OtpKind.fromName(authority);
        if (kind == null) {
            return OtpUriParseResult.error(ErrorKind.INVALID_URI,
                "Unsupported OTP type: " + authority.toLowerCase(Locale.ROOT));
        }

        String pathIssuer = null;
        String label;
        int colon = path.indexOf(':');
        if (colon >= 0) {
            pathIssuer = percentDecode(path.substring(0, colon).trim(), false);
            label = path.substring(colon + 1).trim();
        } else {
            label = path.trim();
        }
        label = percentDecode(label, false);

        Map<String, String> params = parseQuery(query);
        String secret = params.get("secret");
        String issuer = firstNonEmpty(params.get("issuer"), pathIssuer, Credential.UNKNOWN_ISSUER);
        String algorithmName = params.getOrDefault("algorithm", DEFAULT_ALGORITHM).toUpperCase(Locale.ROOT);
        String digitsRaw = params.getOrDefault("digits", DEFAULT_DIGITS);
        String periodRaw = params.getOrDefault("period", DEFAULT_PERIOD);
        String counterRaw = params.getOrDefault("counter", DEFAULT_COUNTER);

        if (secret == null) {
            return OtpUriParseResult.error(ErrorKind.MISSING_FIELD, "Missing required 'secret' parameter");
        }
        if (label.isEmpty()) {
            return OtpUriParseResult.error(ErrorKind.MISSING_FIELD, "Missing label (account identifier)");
        }
        if (!Credential.isBase32(secret)) {
            return OtpUriParseResult.error(ErrorKind.INVALID_SECRET, "Invalid secret format (must be Base32)");
        }
        OtpAlgorithm algorithm = OtpAlgorithm.fromName(algorithmName);
        if (algorithm == null) {
            return OtpUriParseResult.error(ErrorKind.INVALID_ALGORITHM,
                "Invalid algorithm: " + algorithmName + ". Must be one of: SHA1, SHA256, SHA512, MD5");
        }
        Long digits = parseInteger(digitsRaw);
        if (digits == null || digits < Credential.MIN_DIGITS || digits > Credential.MAX_DIGITS) {
            return OtpUriParseResult.error(ErrorKind.INVALID_DIGITS, "Invalid digits value: " + digitsRaw);
        }
        Long period = parseInteger(periodRaw);
        if (period == null || period < 1 || period > Integer.MAX_VALUE) {
            return OtpUriParseResult.error(ErrorKind.INVALID_PERIOD, "Invalid period value: " + periodRaw);
        }
        Long counter = parseInteger(counterRaw);
        if (counter == null || counter < 0) {
            return OtpUriParseResult.error(ErrorKind.INVALID_COUNTER, "Invalid counter value: " + counterRaw);
        }

        Credential credential = kind == OtpKind.TOTP
            ? Credential.totp(label, secret, issuer, algorithm, digits.intValue(), period.intValue())
            : Credential.hotp(label, secret, issuer, algorithm, digits.intValue(), counter);
        return OtpUriParseResult.success(credential);
    }

    public Credential parseOrThrow(String uri) throws VaultException {
        OtpUriParseResult result = parse(uri);
        if (!result.isSuccess()) {
            throw result.toException();
        }
        return result.getCredential();
    }

    /**
     * @return the validation message, or empty when the URI is importable
     */
    public Optional<String> validate(String uri) {
        OtpUriParseResult result = parse(uri);
        return result.isSuccess() ? Optional.empty() : Optional.of(result.getErrorDetail());
    }

    public String build(Credential credential) {
        String issuer = percentEncode(credential.getIssuer());
        StringBuilder uri = new StringBuilder(SCHEME_PREFIX)
            .append(credential.getKind().getUriName())
            .append('/')
            .append(issuer)
            .append(':')
            .append(percentEncode(credential.getLabel()))
            .append("?secret=").append(credential.getSecret())
            .append("&issuer=").append(issuer)
            .append("&algorithm=").append(credential.getAlgorithm().name())
            .append("&digits=").append(credential.getDigits());
        if (credential.isTotp()) {
            uri.append("&period=").append(credential.getPeriod());
        } else {
            uri.append("&counter=").append(credential.getCounter());
        }
        return uri.toString();
    }

    private Map<String, String> parseQuery(String query) {
        Map<String, String> params = new HashMap<>();
        if (query.isEmpty()) {
            return params;
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String key = percentDecode(pair.substring(0, eq), true);
            String value = percentDecode(pair.substring(eq + 1), true);
            // blank values count as absent; the first occurrence wins
            if (!value.isEmpty() && !params.containsKey(key)) {
                params.put(key, value);
            }
        }
        return params;
    }

    private static String stripLeadingSlashes(String value) {
        int i = 0;
        while (i < value.length() && value.charAt(i) == '/') {
            i++;
        }
        return value.substring(i);
    }

    private static String firstNonEmpty(String... values) {
        for (String value : values) {
            if (value != null && !value.isEmpty()) {
                return value;
            }
        }
        return null;
    }

    private static Long parseInteger(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Percent-decodes as UTF-8. A value with a malformed escape is kept as written.
     */
    static String percentDecode(String value, boolean plusAsSpace) {
        if (value.indexOf('%') < 0 && (!plusAsSpace || value.indexOf('+') < 0)) {
            return value;
        }
        PercentCodec codec = plusAsSpace ? QUERY_CODEC : PATH_CODEC;
        try {
            return new String(codec.decode(value.getBytes(StandardCharsets.UTF_8)), StandardCharsets.UTF_8);
        } catch (DecoderException e) {
            return value;
        }
    }

    /**
     * RFC 3986 encoding: everything except unreserved characters is escaped.
     */
    static String percentEncode(String value) {
        try {
            return new String(PATH_CODEC.encode(value.getBytes(StandardCharsets.UTF_8)), StandardCharsets.US_ASCII);
        } catch (EncoderException e) {
            throw new IllegalStateException("Percent encoding failed", e);
        }
    }

    // every ASCII byte outside A-Z a-z 0-9 and "-._~"; bytes above 0x7F are always escaped
    private static byte[] reservedAscii() {
        ByteArrayOutputStream reserved = new ByteArrayOutputStream();
        for (int c = 0; c < 0x80; c++) {
            boolean unreserved = (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')
                || c == '-' || c == '.' || c == '_' || c == '~';
            if (!unreserved) {
                reserved.write(c);
            }
        }
        return reserved.toByteArray();
    }
}
