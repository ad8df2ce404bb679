package com.archiver.engine.persistence.s3;

import com.archiver.core.exception.StoreUnavailableException;
import com.archiver.core.exception.TransientStoreException;
import com.archiver.core.exception.VersionConflictException;
import com.archiver.core.model.ArchiveListing;
import com.archiver.core.model.VersionedArchive;
import com.archiver.core.model.WeekArchive;
import com.archiver.core.model.WeekKey;
import com.archiver.core.store.ArchiveStore;
import com.archiver.engine.codec.ArchiveDocumentCodec;
import com.archiver.engine.persistence.ArchiveKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * ArchiveStore on an S3 bucket, one JSON object per week.
 *
 * The version token is the object's ETag. Writes are conditional:
 * If-Match with the fetched ETag, or If-None-Match: * when the week is new.
 * 412 and 409 responses are lost races; 429, 5xx, throttling and client-side
 * failures (timeouts, dropped connections) are transient.
 */
public class S3ArchiveStore implements ArchiveStore {

    private static final Logger log = LoggerFactory.getLogger(S3ArchiveStore.class);

    static final String CONTENT_TYPE = "application/json";
    private static final int PRECONDITION_FAILED = 412;
    private static final int CONFLICT = 409;
    private static final int TOO_MANY_REQUESTS = 429;

    private final S3Client s3Client;
    private final String bucket;
    private final String keyPrefix;
    private final ArchiveDocumentCodec codec;

    public S3ArchiveStore(S3Client s3Client, String bucket, String keyPrefix, ArchiveDocumentCodec codec) {
        this.s3Client = s3Client;
        this.bucket = bucket;
        this.keyPrefix = keyPrefix;
        this.codec = codec;
    }

    @Override
    public Optional<VersionedArchive> get(WeekKey week) {
        String key = storageKey(week);
        GetObjectRequest request = GetObjectRequest.builder()
            .bucket(bucket)
            .key(key)
            .build();

        ResponseBytes<GetObjectResponse> response;
        try {
            response = call("get", key, () -> s3Client.getObjectAsBytes(request));
        } catch (NoSuchKeyException e) {
            log.debug("No archive yet at s3://{}/{}", bucket, key);
            return Optional.empty();
        }

        WeekArchive archive = ArchiveKeys.checkedWeek(codec.decode(response.asByteArray()), week, key);
        return Optional.of(new VersionedArchive(
            archive,
            response.response().eTag(),
            response.response().lastModified()));
    }

    @Override
    public void putIfVersion(WeekKey week, WeekArchive archive, String expectedVersion) {
        ArchiveKeys.checkWrite(week, archive);
        String key = storageKey(week);

        Map<String, String> metadata = new HashMap<>();
        metadata.put("week", week.toString());
        metadata.put("total-events", String.valueOf(archive.size()));
        if (archive.generatedAt() != null) {
            metadata.put("last-updated", archive.generatedAt().toString());
        }

        PutObjectRequest.Builder request = PutObjectRequest.builder()
            .bucket(bucket)
            .key(key)
            .contentType(CONTENT_TYPE)
            .metadata(metadata);
        if (expectedVersion == null) {
            request.ifNoneMatch("*");
        } else {
            request.ifMatch(expectedVersion);
        }

        byte[] document = codec.encode(archive);
        try {
            call("put", key, () -> s3Client.putObject(request.build(), RequestBody.fromBytes(document)));
        } catch (AwsServiceException e) {
            if (e.statusCode() == PRECONDITION_FAILED || e.statusCode() == CONFLICT) {
                throw new VersionConflictException(key, expectedVersion, e);
            }
            throw e;
        }
    }

    @Override
    public List<ArchiveListing> list() {
        ListObjectsV2Request request = ListObjectsV2Request.builder()
            .bucket(bucket)
            .prefix(keyPrefix)
            .build();

        return call("list", keyPrefix, () -> {
            List<ArchiveListing> listings = new ArrayList<>();
            for (S3Object object : s3Client.listObjectsV2Paginator(request).contents()) {
                ArchiveKeys.weekOf(keyPrefix, object.key()).ifPresent(week -> listings.add(
                    new ArchiveListing(week, object.key(), object.lastModified(), object.size())));
            }
            listings.sort(Comparator.comparing(ArchiveListing::week));
            return listings;
        });
    }

    @Override
    public String storageKey(WeekKey week) {
        return ArchiveKeys.storageKey(keyPrefix, week);
    }

    /**
     * Run an S3 call, translating transient failures. Missing keys and
     * conditional-write failures are left to the caller.
     */
    private <T> T call(String operation, String key, Supplier<T> request) {
        try {
            return request.get();
        } catch (NoSuchKeyException e) {
            throw e;
        } catch (AwsServiceException e) {
            if (isTransient(e)) {
                throw new TransientStoreException(operation, key, e);
            }
            if (e.statusCode() == PRECONDITION_FAILED || e.statusCode() == CONFLICT) {
                throw e;
            }
            throw new StoreUnavailableException(
                String.format("S3 %s of s3://%s/%s failed: %s", operation, bucket, key, e.getMessage()), e);
        } catch (SdkClientException e) {
            throw new TransientStoreException(operation, key, e);
        } catch (SdkException e) {
            throw new StoreUnavailableException(
                String.format("S3 %s of s3://%s/%s failed: %s", operation, bucket, key, e.getMessage()), e);
        }
    }

    static boolean isTransient(AwsServiceException e) {
        return e.isThrottlingException()
            || e.statusCode() == TOO_MANY_REQUESTS
            || e.statusCode() >= 500;
    }
}
