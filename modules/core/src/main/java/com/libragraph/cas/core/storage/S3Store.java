package com.libragraph.cas.core.storage;

import com.libragraph.cas.core.stream.ChunkStreams;
import com.libragraph.cas.util.ContentHasher;
import com.libragraph.cas.util.buffer.Buffer;
import com.libragraph.cas.util.buffer.FileBuffer;
import com.libragraph.cas.util.buffer.RamBuffer;
import io.minio.BucketExistsArgs;
import io.minio.CopyObjectArgs;
import io.minio.CopySource;
import io.minio.GetObjectArgs;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.RemoveObjectArgs;
import io.minio.StatObjectArgs;
import io.minio.errors.ErrorResponseException;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * S3/MinIO-backed Store.
 *
 * <p>All keys live in one bucket, created on first write. Leading slashes are
 * stripped from keys. The upload API needs the object size up front, so a write
 * spools the stream first: in memory for small blobs, in a {@link FileBuffer} past
 * {@link Buffer#FILE_THRESHOLD}. The spool's content hash is stored as the
 * {@value #HASH_METADATA} user metadata entry.
 *
 * <p>Rename is a server-side copy followed by a remove. Offers the
 * {@value Capabilities#COPY} capability.
 */
public class S3Store implements Store {

    private static final Logger log = Logger.getLogger(S3Store.class);

    public static final String HASH_METADATA = "content-hash";

    private static final int INITIAL_SPOOL_CAPACITY = 64 * 1024;

    private final MinioClient minioClient;
    private final String bucket;
    private final String hashAlgorithm;
    private final Map<String, StoreCapability> capabilities;
    private volatile boolean bucketReady;

    public S3Store(MinioClient minioClient, String bucket) {
        this(minioClient, bucket, ContentHasher.DEFAULT_ALGORITHM);
    }

    public S3Store(MinioClient minioClient, String bucket, String hashAlgorithm) {
        this.minioClient = minioClient;
        this.bucket = bucket;
        this.hashAlgorithm = ContentHasher.checkAlgorithm(hashAlgorithm);
        this.capabilities = Map.of(Capabilities.COPY, args -> copy(
                Capabilities.stringArg(Capabilities.COPY, args, 0),
                Capabilities.stringArg(Capabilities.COPY, args, 1)).onItem().castTo(Object.class));
    }

    public static MinioClient client(String endpoint, String accessKey, String secretKey) {
        return MinioClient.builder()
                .endpoint(endpoint)
                .credentials(accessKey, secretKey)
                .build();
    }

    public String bucket() {
        return bucket;
    }

    private static String objectName(String key) {
        String name = key;
        while (name.startsWith("/")) {
            name = name.substring(1);
        }
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Invalid key: '" + key + "'");
        }
        return name;
    }

    private static boolean isMissing(ErrorResponseException e) {
        String code = e.errorResponse().code();
        return "NoSuchKey".equals(code) || "NoSuchBucket".equals(code);
    }

    private void ensureBucket() {
        if (bucketReady) {
            return;
        }
        try {
            if (!minioClient.bucketExists(BucketExistsArgs.builder().bucket(bucket).build())) {
                minioClient.makeBucket(MakeBucketArgs.builder().bucket(bucket).build());
                log.infof("Created bucket %s", bucket);
            }
            bucketReady = true;
        } catch (ErrorResponseException e) {
            // created concurrently by another writer
            if ("BucketAlreadyOwnedByYou".equals(e.errorResponse().code())) {
                bucketReady = true;
                return;
            }
            throw new StorageException("Failed to ensure bucket: " + bucket, e);
        } catch (Exception e) {
            throw new StorageException("Failed to ensure bucket: " + bucket, e);
        }
    }

    @Override
    public Uni<Void> write(String key, Multi<byte[]> source) {
        return Uni.createFrom().deferred(() -> {
            String object = objectName(key);
            AtomicReference<Buffer> spool = new AtomicReference<>(new RamBuffer(INITIAL_SPOOL_CAPACITY, hashAlgorithm));
            return source
                    .onItem().invoke(chunk -> spool(spool, chunk, key))
                    .onItem().ignoreAsUni()
                    .invoke(() -> upload(object, spool.get()))
                    .onTermination().invoke(() -> release(spool.get(), key));
        });
    }

    // Spools in memory up to Buffer.FILE_THRESHOLD, then moves to a temp file.
    private void spool(AtomicReference<Buffer> spool, byte[] chunk, String key) {
        try {
            Buffer current = spool.get();
            if (current instanceof RamBuffer ram && ram.size() + chunk.length > Buffer.FILE_THRESHOLD) {
                FileBuffer file = new FileBuffer(hashAlgorithm);
                spool.set(file);
                file.append(ram.toByteArray());
                log.debugf("Spooling %s to %s", key, file.path());
                current = file;
            }
            current.append(chunk);
        } catch (IOException e) {
            throw new StorageException("Failed to spool blob: " + key, e);
        }
    }

    private void upload(String object, Buffer spool) {
        ensureBucket();
        try (InputStream is = spool.inputStream(0)) {
            minioClient.putObject(PutObjectArgs.builder()
                    .bucket(bucket)
                    .object(object)
                    .stream(is, spool.size(), -1)
                    .contentType("application/octet-stream")
                    .userMetadata(Map.of(HASH_METADATA, spool.hash().toHex()))
                    .build());
            log.debugf("Uploaded %s (%d bytes) to bucket %s", object, spool.size(), bucket);
        } catch (Exception e) {
            throw new StorageException("Failed to write blob: " + object, e);
        }
    }

    private void release(Buffer spool, String key) {
        try {
            spool.close();
        } catch (IOException e) {
            log.warnf(e, "Failed to release spool for %s", key);
        }
    }

    @Override
    public Multi<byte[]> read(String key) {
        return Multi.createFrom().deferred(() -> {
            String object = objectName(key);
            InputStream is;
            try {
                is = minioClient.getObject(GetObjectArgs.builder().bucket(bucket).object(object).build());
            } catch (ErrorResponseException e) {
                if (isMissing(e)) {
                    return Multi.createFrom().failure(new BlobNotFoundException(key, e));
                }
                return Multi.createFrom().failure(new StorageException("Failed to read blob: " + key, e));
            } catch (Exception e) {
                return Multi.createFrom().failure(new StorageException("Failed to read blob: " + key, e));
            }
            return ChunkStreams.of(is)
                    .onFailure(IOException.class).transform(e -> new StorageException("Failed to read blob: " + key, e));
        });
    }

    @Override
    public Uni<Void> rename(String sourceKey, String destKey) {
        return copy(sourceKey, destKey).invoke(() -> {
            if (objectName(sourceKey).equals(objectName(destKey))) {
                return;
            }
            remove(sourceKey);
            log.debugf("Renamed %s to %s", sourceKey, destKey);
        });
    }

    /**
     * Server-side copy, replacing {@code destKey} if present.
     *
     * @throws BlobNotFoundException if {@code sourceKey} is absent
     */
    public Uni<Void> copy(String sourceKey, String destKey) {
        return Uni.createFrom().voidItem().invoke(() -> {
            String source = objectName(sourceKey);
            String dest = objectName(destKey);
            if (source.equals(dest)) {
                stat(sourceKey);
                return;
            }
            try {
                minioClient.copyObject(CopyObjectArgs.builder()
                        .bucket(bucket)
                        .object(dest)
                        .source(CopySource.builder().bucket(bucket).object(source).build())
                        .build());
            } catch (ErrorResponseException e) {
                if (isMissing(e)) {
                    throw new BlobNotFoundException(sourceKey, e);
                }
                throw new StorageException("Failed to copy blob: " + sourceKey + " -> " + destKey, e);
            } catch (Exception e) {
                throw new StorageException("Failed to copy blob: " + sourceKey + " -> " + destKey, e);
            }
        });
    }

    @Override
    public Uni<Boolean> exists(String key) {
        return Uni.createFrom().item(() -> {
            try {
                stat(key);
                return true;
            } catch (BlobNotFoundException e) {
                return false;
            }
        });
    }

    @Override
    public Uni<Void> delete(String key) {
        return Uni.createFrom().voidItem().invoke(() -> {
            // removeObject is silent on missing keys
            stat(key);
            remove(key);
        });
    }

    @Override
    public Map<String, StoreCapability> capabilities() {
        return capabilities;
    }

    private void stat(String key) {
        try {
            minioClient.statObject(StatObjectArgs.builder().bucket(bucket).object(objectName(key)).build());
        } catch (ErrorResponseException e) {
            if (isMissing(e)) {
                throw new BlobNotFoundException(key, e);
            }
            throw new StorageException("Failed to stat blob: " + key, e);
        } catch (Exception e) {
            throw new StorageException("Failed to stat blob: " + key, e);
        }
    }

    private void remove(String key) {
        try {
            minioClient.removeObject(RemoveObjectArgs.builder().bucket(bucket).object(objectName(key)).build());
            log.debugf("Removed %s from bucket %s", key, bucket);
        } catch (Exception e) {
            throw new StorageException("Failed to delete blob: " + key, e);
        }
    }
}
