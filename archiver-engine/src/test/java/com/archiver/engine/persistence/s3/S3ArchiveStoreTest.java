package com.archiver.engine.persistence.s3;

import com.archiver.core.exception.StoreUnavailableException;
import com.archiver.core.exception.TransientStoreException;
import com.archiver.core.exception.VersionConflictException;
import com.archiver.core.model.ArchiveListing;
import com.archiver.core.model.CanonicalEvent;
import com.archiver.core.model.VersionedArchive;
import com.archiver.core.model.WeekArchive;
import com.archiver.core.model.WeekKey;
import com.archiver.engine.codec.ArchiveDocumentCodec;
import com.archiver.engine.summary.SummaryAggregator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.services.s3.paginators.ListObjectsV2Iterable;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.archiver.engine.test.Events.event;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class S3ArchiveStoreTest {

    private static final WeekKey WEEK = new WeekKey(2024, 25);
    private static final String BUCKET = "audit-archive";
    private static final Instant MODIFIED = Instant.parse("2024-06-20T10:00:00Z");

    @Mock
    private S3Client s3Client;

    private final ArchiveDocumentCodec codec = new ArchiveDocumentCodec(new ObjectMapper());
    private S3ArchiveStore store;

    @BeforeEach
    void setUp() {
        store = new S3ArchiveStore(s3Client, BUCKET, "weekly-logs/", codec);
    }

    @Test
    void get_shouldReturnArchiveWithEtagAsVersion() {
        GetObjectResponse response = GetObjectResponse.builder()
            .eTag("\"etag-1\"")
            .lastModified(MODIFIED)
            .build();
        ArgumentCaptor<GetObjectRequest> request = ArgumentCaptor.forClass(GetObjectRequest.class);
        when(s3Client.getObjectAsBytes(request.capture()))
            .thenReturn(ResponseBytes.fromByteArray(response, codec.encode(archive("r1"))));

        VersionedArchive fetched = store.get(WEEK).orElseThrow();

        assertThat(fetched.version()).isEqualTo("\"etag-1\"");
        assertThat(fetched.lastModified()).isEqualTo(MODIFIED);
        assertThat(fetched.archive().events()).containsOnlyKeys("r1");
        assertThat(request.getValue().bucket()).isEqualTo(BUCKET);
        assertThat(request.getValue().key()).isEqualTo("weekly-logs/2024-W25.json");
    }

    @Test
    void get_shouldTreatMissingKeyAsAbsent() {
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
            .thenThrow(NoSuchKeyException.builder().statusCode(404).message("missing").build());

        assertThat(store.get(WEEK)).isEmpty();
    }

    @Test
    void putIfVersion_shouldCreateWithIfNoneMatch() {
        ArgumentCaptor<PutObjectRequest> request = ArgumentCaptor.forClass(PutObjectRequest.class);
        when(s3Client.putObject(request.capture(), any(RequestBody.class)))
            .thenReturn(PutObjectResponse.builder().eTag("\"etag-1\"").build());

        store.putIfVersion(WEEK, archive("r1"), null);

        assertThat(request.getValue().ifNoneMatch()).isEqualTo("*");
        assertThat(request.getValue().ifMatch()).isNull();
        assertThat(request.getValue().contentType()).isEqualTo("application/json");
        assertThat(request.getValue().metadata())
            .containsEntry("week", "2024-W25")
            .containsEntry("total-events", "1")
            .containsEntry("last-updated", "2024-06-20T10:00:00Z");
    }

    @Test
    void putIfVersion_shouldUpdateWithIfMatch() {
        ArgumentCaptor<PutObjectRequest> request = ArgumentCaptor.forClass(PutObjectRequest.class);
        when(s3Client.putObject(request.capture(), any(RequestBody.class)))
            .thenReturn(PutObjectResponse.builder().eTag("\"etag-2\"").build());

        store.putIfVersion(WEEK, archive("r1"), "\"etag-1\"");

        assertThat(request.getValue().ifMatch()).isEqualTo("\"etag-1\"");
        assertThat(request.getValue().ifNoneMatch()).isNull();
    }

    @Test
    void putIfVersion_shouldMapPreconditionFailureToConflict() {
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
            .thenThrow(S3Exception.builder().statusCode(412).message("At least one precondition failed").build());

        assertThatThrownBy(() -> store.putIfVersion(WEEK, archive("r1"), "\"etag-1\""))
            .isInstanceOf(VersionConflictException.class);
    }

    @Test
    void putIfVersion_shouldMapConcurrentCreateToConflict() {
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
            .thenThrow(S3Exception.builder().statusCode(409).message("ConditionalRequestConflict").build());

        assertThatThrownBy(() -> store.putIfVersion(WEEK, archive("r1"), null))
            .isInstanceOf(VersionConflictException.class);
    }

    @Test
    void putIfVersion_shouldMapThrottlingAndServerErrorsToTransient() {
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
            .thenThrow(S3Exception.builder().statusCode(503).message("Slow Down").build())
            .thenThrow(S3Exception.builder().statusCode(429).message("Too Many Requests").build())
            .thenThrow(SdkClientException.create("Read timed out"));

        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> store.putIfVersion(WEEK, archive("r1"), null))
                .isInstanceOf(TransientStoreException.class);
        }
    }

    @Test
    void get_shouldMapAccessDeniedToUnavailable() {
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
            .thenThrow(S3Exception.builder().statusCode(403).message("Access Denied").build());

        assertThatThrownBy(() -> store.get(WEEK))
            .isInstanceOf(StoreUnavailableException.class)
            .hasMessageContaining("s3://audit-archive/weekly-logs/2024-W25.json");
    }

    @Test
    void list_shouldKeepOnlyArchiveKeys() {
        when(s3Client.listObjectsV2Paginator(any(ListObjectsV2Request.class)))
            .thenAnswer(invocation -> new ListObjectsV2Iterable(s3Client, invocation.getArgument(0)));
        when(s3Client.listObjectsV2(any(ListObjectsV2Request.class))).thenReturn(ListObjectsV2Response.builder()
            .isTruncated(false)
            .contents(
                S3Object.builder().key("weekly-logs/2024-W26.json").lastModified(MODIFIED).size(120L).build(),
                S3Object.builder().key("weekly-logs/README.txt").lastModified(MODIFIED).size(5L).build(),
                S3Object.builder().key("weekly-logs/2024-W25.json").lastModified(MODIFIED).size(100L).build())
            .build());

        assertThat(store.list())
            .extracting(ArchiveListing::week, ArchiveListing::sizeBytes)
            .containsExactly(tuple(WEEK, 100L), tuple(new WeekKey(2024, 26), 120L));
    }

    private WeekArchive archive(String requestId) {
        CanonicalEvent event = event(requestId, "GetObject", "2024-06-18T10:00:00Z");
        return new WeekArchive(WEEK, Map.of(requestId, event),
            new SummaryAggregator().aggregate(List.of(event)), MODIFIED);
    }
}
