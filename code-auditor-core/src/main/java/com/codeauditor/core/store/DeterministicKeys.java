package com.codeauditor.core.store;

import com.codeauditor.core.model.FindingRow;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Computes the primary key of a finding from its identifying fields.
 *
 * <p>The key is the SHA-256 hex digest of the kind's table name, root, file path,
 * rule id, line, column and message, each separated by a unit separator so that
 * adjacent fields cannot run together. Rescanning unchanged code reproduces the
 * same keys.
 */
public final class DeterministicKeys {

    private static final char SEPARATOR = '\u001f';

    private DeterministicKeys() {
    }

    public static String compute(FindingRow row) {
        StringBuilder material = new StringBuilder();
        append(material, row.kind().tableName());
        append(material, row.root());
        append(material, row.filePath());
        append(material, row.ruleId());
        append(material, row.lineNumber());
        append(material, row.colOffset());
        append(material, row.message());
        return sha256(material.toString());
    }

    private static void append(StringBuilder material, Object value) {
        material.append(value == null ? "" : value.toString()).append(SEPARATOR);
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
