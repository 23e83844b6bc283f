package com.lab2fhir.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.net.URI;

@Service
@ConditionalOnProperty(name = "app.storage.type", havingValue = "s3")
public class S3SourceDocumentStore implements SourceDocumentStore {

    private static final Logger logger = LoggerFactory.getLogger(S3SourceDocumentStore.class);

    private final S3Client s3Client;
    private final String bucket;
    private final String prefix;

    public S3SourceDocumentStore(S3Client s3Client,
                                 @Value("${app.storage.s3.bucket}") String bucket,
                                 @Value("${app.storage.s3.prefix:documents/}") String prefix) {
        this.s3Client = s3Client;
        this.bucket = bucket;
        this.prefix = prefix;
    }

    @Override
    public String store(String contentHash, byte[] content, String mediaType) {
        String key = prefix + contentHash;
        try {
            s3Client.putObject(PutObjectRequest.builder()
                            .bucket(bucket)
                            .key(key)
                            .contentType(mediaType)
                            .build(),
                    RequestBody.fromBytes(content));
        } catch (SdkException e) {
            throw new StorageException("Failed to upload document " + contentHash + " to s3://" + bucket, e);
        }
        logger.info("Uploaded document {} ({} bytes) to s3://{}/{}", contentHash, content.length, bucket, key);
        return "s3://" + bucket + "/" + key;
    }

    @Override
    public byte[] load(String storageUri) {
        URI uri = URI.create(storageUri);
        String key = uri.getPath().startsWith("/") ? uri.getPath().substring(1) : uri.getPath();
        try {
            return s3Client.getObjectAsBytes(GetObjectRequest.builder()
                    .bucket(uri.getHost())
                    .key(key)
                    .build()).asByteArray();
        } catch (SdkException e) {
            throw new StorageException("Failed to download " + storageUri, e);
        }
    }
}
