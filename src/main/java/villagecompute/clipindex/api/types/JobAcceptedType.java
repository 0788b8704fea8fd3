package villagecompute.clipindex.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Acknowledgement of an enqueued job.
 */
public record JobAcceptedType(@JsonProperty("job_id") Long jobId, String type) {
}
