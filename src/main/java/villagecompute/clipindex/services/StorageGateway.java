package villagecompute.clipindex.services;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.time.Duration;

/**
 * S3-compatible object storage for thumbnail images.
 *
 * <p>
 * Object keys are the thumbnail storage paths ({@code thumbnails/guild_{g}/{clip}_{size}.webp}). Every call is traced
 * and timed; failures are rethrown as {@link RuntimeException} after being recorded.
 */
@ApplicationScoped
public class StorageGateway {

    private static final Logger LOG = Logger.getLogger(StorageGateway.class);

    @Inject
    S3Client s3Client;

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    @ConfigProperty(
            name = "clipindex.storage.thumbnails-bucket")
    String thumbnailsBucket;

    /**
     * Stores {@code bytes} under {@code objectKey}, replacing any existing object.
     */
    public void upload(String objectKey, byte[] bytes, String contentType) {
        Span span = tracer.spanBuilder("storage.upload").setAttribute("object_key", objectKey)
                .setAttribute("size_bytes", bytes.length).startSpan();
        long startTime = System.currentTimeMillis();

        try (Scope scope = span.makeCurrent()) {
            PutObjectRequest putRequest = PutObjectRequest.builder().bucket(thumbnailsBucket).key(objectKey)
                    .contentType(contentType).build();
            s3Client.putObject(putRequest, RequestBody.fromBytes(bytes));

            long latencyMs = System.currentTimeMillis() - startTime;
            LOG.debugf("Uploaded %s/%s (%d bytes, %dms)", thumbnailsBucket, objectKey, bytes.length, latencyMs);
            record("upload", latencyMs, true);
            span.setAttribute("upload_success", true);

        } catch (S3Exception e) {
            record("upload", System.currentTimeMillis() - startTime, false);
            span.recordException(e);
            span.setAttribute("upload_success", false);
            String detail = e.awsErrorDetails() == null ? e.getMessage() : e.awsErrorDetails().errorMessage();
            LOG.errorf(e, "Failed to upload %s: %s", objectKey, detail);
            throw new RuntimeException("Storage upload failed: " + detail, e);

        } finally {
            span.end();
        }
    }

    /**
     * Deletes {@code objectKey}. Deleting a missing object succeeds.
     */
    public void delete(String objectKey) {
        Span span = tracer.spanBuilder("storage.delete").setAttribute("object_key", objectKey).startSpan();
        long startTime = System.currentTimeMillis();

        try (Scope scope = span.makeCurrent()) {
            s3Client.deleteObject(DeleteObjectRequest.builder().bucket(thumbnailsBucket).key(objectKey).build());
            record("delete", System.currentTimeMillis() - startTime, true);
            LOG.debugf("Deleted %s/%s", thumbnailsBucket, objectKey);

        } catch (S3Exception e) {
            record("delete", System.currentTimeMillis() - startTime, false);
            span.recordException(e);
            String detail = e.awsErrorDetails() == null ? e.getMessage() : e.awsErrorDetails().errorMessage();
            LOG.errorf(e, "Failed to delete %s: %s", objectKey, detail);
            throw new RuntimeException("Storage delete failed: " + detail, e);

        } finally {
            span.end();
        }
    }

    private void record(String operation, long latencyMs, boolean success) {
        String status = success ? "success" : "failure";
        Counter.builder("clipindex.storage.operations.total").tag("operation", operation).tag("status", status)
                .register(meterRegistry).increment();
        Timer.builder("clipindex.storage.duration").tag("operation", operation).register(meterRegistry)
                .record(Duration.ofMillis(latencyMs));
    }
}
