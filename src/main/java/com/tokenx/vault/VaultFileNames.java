package com.tokenx.vault;

import com.tokenx.storage.FileStorage;

import java.nio.charset.StandardCharsets;

/**
 * Maps credential labels to vault file names.
 */
public final class VaultFileNames {
    public static final String EXTENSION = ".enc";
    public static final int MAX_FILE_NAME_BYTES = 255;
    // room for the staging suffix as well, so "<name>.enc.tmp" also fits
    public static final int MAX_NAME_BYTES =
        MAX_FILE_NAME_BYTES - EXTENSION.length() - FileStorage.TEMP_SUFFIX.length();

    private VaultFileNames() {
    }

    /**
     * Replaces every character outside {@code [A-Za-z0-9._@-]} with {@code _} and truncates so that
     * the file name and its staging temp both fit in 255 bytes. The labels {@code .} and
     * {@code ..} become underscores.
     */
    public static String sanitize(String label) {
        if (label == null || label.isEmpty()) {
            return "_";
        }
        StringBuilder sb = new StringBuilder(label.length());
        label.codePoints().forEach(cp -> sb.append(isAllowed(cp) ? (char) cp : '_'));
        String sanitized = sb.toString();
        // sanitized output is ASCII, so chars and bytes line up
        if (sanitized.getBytes(StandardCharsets.US_ASCII).length > MAX_NAME_BYTES) {
            sanitized = sanitized.substring(0, MAX_NAME_BYTES);
        }
        if (".".equals(sanitized) || "..".equals(sanitized)) {
            sanitized = "_".repeat(sanitized.length());
        }
        return sanitized;
    }

    public static String fileName(String name) {
        return name + EXTENSION;
    }

    public static boolean isVaultFile(String fileName) {
        return fileName.endsWith(EXTENSION) && fileName.length() > EXTENSION.length();
    }

    public static String nameOf(String fileName) {
        return fileName.substring(0, fileName.length() - EXTENSION.length());
    }

    /**
     * True if the name is already in sanitized form, so it can be used as a file name as-is.
     */
    public static boolean isValidName(String name) {
        return name != null && !name.isEmpty() && sanitize(name).equals(name)
            && !".".equals(name) && !"..".equals(name);
    }

    private static boolean isAllowed(int cp) {
        return (cp >= 'A' && cp <= 'Z') || (cp >= 'a' && cp <= 'z') || (cp >= '0' && cp <= '9')
            || cp == '.' || cp == '_' || cp == '@' || cp == '-';
    }
}
