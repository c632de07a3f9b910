package com.crossreview.core.identity;

import com.crossreview.core.model.ContentFingerprint;
import com.crossreview.core.model.FileIdentity;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Derives stable file identities and diff fingerprints.
 * <p>
 * Identity is {@code <normalizedRoot>:<normalizedPath>}, with {@code %} and {@code :} inside either
 * part percent-escaped so that the separator is unambiguous. Every stage, the cache, and the
 * fallback used when an LLM response omits a {@code fileId} all go through
 * {@link #normalizePath(String)}, so {@code src\\a.ts}, {@code ./src/a.ts} and
 * {@code src//a.ts} resolve to the same identity.
 */
@Service
public class FileIdentityService {

    private static final HexFormat HEX = HexFormat.of();

    public FileIdentity identify(String projectRoot, String relativePath) {
        if (projectRoot == null || projectRoot.isBlank()) {
            throw new IllegalArgumentException("Project root is required");
        }
        if (relativePath == null || relativePath.isBlank()) {
            throw new IllegalArgumentException("Relative path is required");
        }
        return new FileIdentity(projectPrefix(projectRoot) + escape(normalizePath(relativePath)));
    }

    /**
     * The identity prefix shared by every file of a project root.
     */
    public static String projectPrefix(String projectRoot) {
        return escape(normalizePath(projectRoot)) + ":";
    }

    /**
     * Recovers the relative path from an identity string of the given project, for LLM responses
     * that only echo the {@code fileId}.
     */
    public static Optional<String> relativePath(String projectRoot, String identity) {
        if (identity == null) {
            return Optional.empty();
        }
        String prefix = projectPrefix(projectRoot);
        String value = identity.trim().replace('\\', '/');
        if (!value.startsWith(prefix) || value.length() == prefix.length()) {
            return Optional.empty();
        }
        String path = normalizePath(unescape(value.substring(prefix.length())));
        return path.isBlank() ? Optional.empty() : Optional.of(path);
    }

    public ContentFingerprint fingerprint(String diffText) {
        byte[] bytes = (diffText == null ? "" : diffText).getBytes(StandardCharsets.UTF_8);
        return new ContentFingerprint(HEX.formatHex(sha256().digest(bytes)));
    }

    /**
     * Normalizes a path for identity purposes: forward slashes, no leading {@code ./},
     * no {@code .} segments, no repeated or trailing separators. A bare {@code /} root is preserved.
     */
    public static String normalizePath(String path) {
        if (path == null) return "";
        String normalized = path.trim().replace('\\', '/');
        normalized = normalized.replaceAll("/{2,}", "/");
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        while (normalized.contains("/./")) {
            normalized = normalized.replace("/./", "/");
        }
        if (normalized.endsWith("/.")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        if (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }

    private static String escape(String part) {
        return part.replace("%", "%25").replace(":", "%3A");
    }

    private static String unescape(String part) {
        return part.replace("%3A", ":").replace("%25", "%");
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
