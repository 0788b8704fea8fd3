package villagecompute.clipindex.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

/**
 * MDC field names and helpers for structured job logs.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier</li>
 * <li>{@code span_id} - Current span identifier within the trace</li>
 * <li>{@code job_id} - Queued job primary key</li>
 * <li>{@code job_type} - Wire name of the job type (e.g. {@code scan})</li>
 * <li>{@code guild_id} - Target guild of the job</li>
 * <li>{@code channel_id} - Target channel of the job, when it has one</li>
 * <li>{@code request_origin} - HTTP path or {@code job:<type>}</li>
 * </ul>
 *
 * <p>
 * <b>Usage in the dispatcher:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setJob(job.id, job.jobType, job.guildId, job.channelId);
 * try {
 *     handler.execute(job.id, job.payload);
 * } finally {
 *     LoggingConfig.clearMDC();
 * }
 * </pre>
 *
 * <p>
 * MDC is thread-local; worker threads are pooled, so every job must clear it when done.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    public static final String MDC_JOB_ID = "job_id";

    public static final String MDC_JOB_TYPE = "job_type";

    public static final String MDC_GUILD_ID = "guild_id";

    public static final String MDC_CHANNEL_ID = "channel_id";

    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Copies trace_id and span_id of the current span into MDC. Empty strings when no span is active.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();
        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    /**
     * Sets the job fields. Null values are skipped.
     */
    public static void setJob(Long jobId, String jobType, String guildId, String channelId) {
        if (jobId != null) {
            MDC.put(MDC_JOB_ID, jobId.toString());
        }
        if (jobType != null) {
            MDC.put(MDC_JOB_TYPE, jobType);
            MDC.put(MDC_REQUEST_ORIGIN, "job:" + jobType);
        }
        if (guildId != null) {
            MDC.put(MDC_GUILD_ID, guildId);
        }
        if (channelId != null) {
            MDC.put(MDC_CHANNEL_ID, channelId);
        }
    }

    public static void setRequestOrigin(String requestOrigin) {
        if (requestOrigin != null) {
            MDC.put(MDC_REQUEST_ORIGIN, requestOrigin);
        }
    }

    /**
     * Removes every field set by this class.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_JOB_ID);
        MDC.remove(MDC_JOB_TYPE);
        MDC.remove(MDC_GUILD_ID);
        MDC.remove(MDC_CHANNEL_ID);
        MDC.remove(MDC_REQUEST_ORIGIN);
    }
}
