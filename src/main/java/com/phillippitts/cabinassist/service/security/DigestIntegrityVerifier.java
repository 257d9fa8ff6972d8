package com.phillippitts.cabinassist.service.security;

import com.phillippitts.cabinassist.config.properties.IntegrityProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Verifies configured files against their expected SHA-256 digests.
 *
 * <p>Verification passes when disabled or when every listed file exists and matches. A missing
 * or unreadable file fails verification; it is logged, not thrown.
 */
public class DigestIntegrityVerifier implements IntegrityVerifier {

    private static final Logger LOG = LogManager.getLogger(DigestIntegrityVerifier.class);
    private static final String ALGORITHM = "SHA-256";

    private final IntegrityProperties properties;
    private volatile boolean started;

    public DigestIntegrityVerifier(IntegrityProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    @Override
    public void start() {
        started = true;
        LOG.info("Integrity verifier started (enabled={}, files={})",
                properties.isEnabled(), properties.getFiles().size());
    }

    @Override
    public boolean verifySystemIntegrity() {
        if (!started) {
            throw new IllegalStateException("Integrity verifier not started");
        }
        if (!properties.isEnabled()) {
            LOG.warn("Integrity verification disabled");
            return true;
        }
        boolean ok = true;
        for (Map.Entry<String, String> entry : properties.getFiles().entrySet()) {
            Path path = Path.of(entry.getKey());
            String expected = entry.getValue().trim().toLowerCase(Locale.ROOT);
            try {
                String actual = sha256(path);
                if (!actual.equals(expected)) {
                    LOG.error("Integrity mismatch for {}: expected {} but was {}", path, expected, actual);
                    ok = false;
                }
            } catch (IOException e) {
                LOG.error("Integrity check could not read {}: {}", path, e.getMessage());
                ok = false;
            }
        }
        return ok;
    }

    @Override
    public void stop() {
        started = false;
    }

    static String sha256(Path path) throws IOException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " unavailable", e);
        }
        try (InputStream in = Files.newInputStream(path)) {
            byte[] buffer = new byte[8192];
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }
}
