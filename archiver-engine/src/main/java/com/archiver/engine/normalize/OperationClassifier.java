package com.archiver.engine.normalize;

import com.archiver.core.model.OperationCategory;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Fixed event name to operation category table.
 * Names missing from the table classify as OTHER.
 */
public final class OperationClassifier {

    private static final Set<String> READ_EVENTS = Set.of(
        "GetObject", "HeadObject", "GetObjectAcl", "GetObjectAttributes", "GetObjectTagging",
        "GetObjectLegalHold", "GetObjectRetention", "SelectObjectContent",
        "ListBucket", "ListObjects", "ListObjectsV2", "ListObjectVersions",
        "ListMultipartUploadParts", "ListParts", "ListMultipartUploads",
        "HeadBucket", "GetBucketLocation", "GetBucketVersioning", "GetBucketAcl",
        "GetBucketPolicy", "GetBucketTagging"
    );

    private static final Set<String> WRITE_EVENTS = Set.of(
        "PutObject", "CopyObject", "RestoreObject",
        "CreateMultipartUpload", "UploadPart", "UploadPartCopy", "CompleteMultipartUpload",
        "PutObjectAcl", "PutObjectTagging", "PutObjectLegalHold", "PutObjectRetention",
        "CreateBucket", "PutBucketVersioning", "PutBucketPolicy", "PutBucketAcl", "PutBucketTagging"
    );

    private static final Set<String> DELETE_EVENTS = Set.of(
        "DeleteObject", "DeleteObjects", "DeleteObjectTagging", "AbortMultipartUpload",
        "DeleteBucket", "DeleteBucketPolicy", "DeleteBucketTagging"
    );

    private static final Map<String, OperationCategory> TABLE = buildTable();

    private OperationClassifier() {
    }

    public static OperationCategory classify(String eventName) {
        if (eventName == null) {
            return OperationCategory.OTHER;
        }
        return TABLE.getOrDefault(eventName, OperationCategory.OTHER);
    }

    /**
     * The full table, for documentation and tests.
     */
    public static Map<String, OperationCategory> table() {
        return TABLE;
    }

    private static Map<String, OperationCategory> buildTable() {
        Map<String, OperationCategory> table = new HashMap<>();
        READ_EVENTS.forEach(name -> table.put(name, OperationCategory.READ));
        WRITE_EVENTS.forEach(name -> table.put(name, OperationCategory.WRITE));
        DELETE_EVENTS.forEach(name -> table.put(name, OperationCategory.DELETE));
        return Map.copyOf(table);
    }
}
