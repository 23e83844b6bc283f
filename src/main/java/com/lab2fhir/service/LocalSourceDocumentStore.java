package com.lab2fhir.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

@Service
@ConditionalOnProperty(name = "app.storage.type", havingValue = "local", matchIfMissing = true)
public class LocalSourceDocumentStore implements SourceDocumentStore {

    private static final Logger logger = LoggerFactory.getLogger(LocalSourceDocumentStore.class);

    private final Path root;

    public LocalSourceDocumentStore(@Value("${app.storage.local-path:./data/documents}") String localPath) {
        this.root = Paths.get(localPath).toAbsolutePath().normalize();
    }

    @Override
    public String store(String contentHash, byte[] content, String mediaType) {
        Path target = root.resolve(contentHash.substring(0, 2)).resolve(contentHash);
        try {
            if (!Files.exists(target)) {
                Files.createDirectories(target.getParent());
                Path tmp = Files.createTempFile(target.getParent(), contentHash, ".part");
                Files.write(tmp, content);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                logger.info("Stored document {} ({} bytes) at {}", contentHash, content.length, target);
            }
            return target.toUri().toString();
        } catch (IOException e) {
            throw new StorageException("Failed to store document " + contentHash, e);
        }
    }

    @Override
    public byte[] load(String storageUri) {
        try {
            return Files.readAllBytes(Paths.get(URI.create(storageUri)));
        } catch (IOException | IllegalArgumentException e) {
            throw new StorageException("Failed to read document " + storageUri, e);
        }
    }
}
