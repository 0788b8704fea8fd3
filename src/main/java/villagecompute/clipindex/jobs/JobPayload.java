package villagecompute.clipindex.jobs;

import villagecompute.clipindex.exceptions.ValidationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed read access to a job payload map.
 *
 * <p>
 * Payloads are stored as JSONB, so numbers may come back as {@code Integer}, {@code Long} or {@code String} and
 * snowflake ids may be numbers or strings. Every accessor normalizes these forms; a missing or unparseable required
 * field raises {@link ValidationException}, which dead-letters the job.
 */
public final class JobPayload {

    public static final String GUILD_ID = "guild_id";
    public static final String CHANNEL_ID = "channel_id";
    public static final String DIRECTION = "direction";
    public static final String LIMIT = "limit";
    public static final String AUTO_CONTINUE = "auto_continue";
    public static final String RESCAN = "rescan";
    public static final String CURSOR_MESSAGE_ID = "cursor_message_id";
    public static final String HISTORICAL = "historical";
    public static final String CLIP_IDS = "clip_ids";

    private final Map<String, Object> values;

    private JobPayload(Map<String, Object> values) {
        this.values = values;
    }

    public static JobPayload of(Map<String, Object> payload) {
        if (payload == null) {
            throw new ValidationException("Job payload is missing");
        }
        return new JobPayload(payload);
    }

    public String requireString(String key) {
        return optionalString(key).orElseThrow(() -> new ValidationException("Job payload is missing '" + key + "'"));
    }

    public Optional<String> optionalString(String key) {
        Object value = values.get(key);
        if (value == null) {
            return Optional.empty();
        }
        String text = value.toString().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    public int intValue(String key, int defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("Job payload field '" + key + "' is not a number: " + value, e);
        }
    }

    public boolean booleanValue(String key, boolean defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        String text = value.toString().trim();
        if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
            return Boolean.parseBoolean(text);
        }
        throw new ValidationException("Job payload field '" + key + "' is not a boolean: " + value);
    }

    /**
     * Reads a list of ids. Accepts a JSON array or a single scalar value.
     */
    public List<String> stringList(String key) {
        Object value = values.get(key);
        List<String> result = new ArrayList<>();
        if (value == null) {
            return result;
        }
        if (value instanceof Collection<?> collection) {
            for (Object item : collection) {
                if (item != null && !item.toString().isBlank()) {
                    result.add(item.toString().trim());
                }
            }
        } else if (!value.toString().isBlank()) {
            result.add(value.toString().trim());
        }
        return result;
    }

    public Map<String, Object> asMap() {
        return values;
    }
}
