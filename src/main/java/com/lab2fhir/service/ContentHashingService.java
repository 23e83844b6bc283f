package com.lab2fhir.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

@Service
public class ContentHashingService {

    private static final Logger logger = LoggerFactory.getLogger(ContentHashingService.class);

    private final MessageDigest digest;

    /**
     * Initializes the SHA-256 digest shared by document and identifier hashing.
     */
    public ContentHashingService() {
        try {
            this.digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            logger.error("Could not initialize SHA-256 MessageDigest", e);
            throw new IllegalStateException("Failed to initialize hashing service", e);
        }
    }

    /**
     * SHA-256 of raw document bytes as 64 lowercase hex characters.
     */
    public synchronized String hash(byte[] content) {
        if (content == null) {
            throw new IllegalArgumentException("content must not be null");
        }
        return toHex(digest.digest(content));
    }

    /**
     * SHA-256 of the UTF-8 encoding of {@code content}.
     */
    public String hash(String content) {
        if (content == null) {
            throw new IllegalArgumentException("content must not be null");
        }
        return hash(content.getBytes(StandardCharsets.UTF_8));
    }

    private static String toHex(byte[] hash) {
        StringBuilder hex = new StringBuilder(2 * hash.length);
        for (byte b : hash) {
            String part = Integer.toHexString(0xff & b);
            if (part.length() == 1) {
                hex.append('0');
            }
            hex.append(part);
        }
        return hex.toString();
    }
}
