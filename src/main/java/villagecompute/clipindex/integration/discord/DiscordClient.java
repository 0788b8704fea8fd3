package villagecompute.clipindex.integration.discord;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.clipindex.exceptions.ChatPlatformException;
import villagecompute.clipindex.exceptions.MessageDeletedException;
import villagecompute.clipindex.exceptions.RateLimitException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * REST client for the Discord API (v10), authenticated as the bot.
 *
 * <p>
 * Every call goes through {@link DiscordRetryPolicy}: 429 and 5xx responses are retried with backoff, other error
 * statuses fail immediately. An exhausted rate limit surfaces as {@link RateLimitException} so the job is nacked and
 * retried later rather than dead-lettered.
 */
@ApplicationScoped
public class DiscordClient {

    private static final Logger LOG = Logger.getLogger(DiscordClient.class);

    private static final Duration HTTP_TIMEOUT = Duration.ofSeconds(15);

    /**
     * Largest page the message history endpoint returns.
     */
    public static final int MAX_PAGE_SIZE = 100;

    static final int UNKNOWN_MESSAGE_CODE = 10008;

    @ConfigProperty(
            name = "clipindex.discord.base-url",
            defaultValue = "https://discord.com/api/v10")
    String baseUrl;

    @ConfigProperty(
            name = "clipindex.discord.bot-token")
    String botToken;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    DiscordRetryPolicy retryPolicy;

    private final HttpClient httpClient;

    public DiscordClient() {
        this.httpClient = HttpClient.newBuilder().connectTimeout(HTTP_TIMEOUT).build();
    }

    /**
     * Fetches one page of channel history.
     *
     * @param direction
     *            {@code FORWARD} returns messages after the cursor, {@code BACKWARD} messages before it
     * @param cursorMessageId
     *            exclusive cursor, or null to start at the channel's beginning (forward) or newest message (backward)
     * @param limit
     *            page size, capped at {@link #MAX_PAGE_SIZE}
     * @return messages in walking order: oldest first for forward scans, newest first for backward scans
     */
    public List<DiscordMessage> fetchMessages(String channelId, ScanDirection direction, String cursorMessageId,
            int limit) {
        int pageSize = Math.max(1, Math.min(limit, MAX_PAGE_SIZE));
        StringBuilder path = new StringBuilder("/channels/").append(channelId).append("/messages?limit=")
                .append(pageSize);
        if (cursorMessageId != null) {
            path.append('&').append(direction.getCursorParameter()).append('=').append(cursorMessageId);
        } else if (direction == ScanDirection.FORWARD) {
            path.append("&after=0");
        }

        HttpResponse<String> response = send("GET", path.toString());
        if (response.statusCode() != 200) {
            throw new ChatPlatformException("Fetching messages of channel " + channelId + " failed with status "
                    + response.statusCode() + ": " + response.body(), response.statusCode());
        }

        List<DiscordMessage> messages = new ArrayList<>();
        for (JsonNode node : readTree(response.body())) {
            messages.add(toMessage(node, channelId));
        }
        messages.sort(direction == ScanDirection.FORWARD ? DiscordMessage.OLDEST_FIRST
                : DiscordMessage.OLDEST_FIRST.reversed());
        LOG.debugf("Fetched %d messages from channel %s (%s, cursor=%s)", messages.size(), channelId,
                direction.getWireName(), cursorMessageId);
        return messages;
    }

    /**
     * Fetches a single message.
     *
     * @throws MessageDeletedException
     *             when Discord reports Unknown Message (404 with code 10008)
     * @throws ChatPlatformException
     *             for any other non-200 response, including a 404 for an unknown channel or a missing route
     */
    public DiscordMessage fetchMessage(String channelId, String messageId) {
        HttpResponse<String> response = send("GET", "/channels/" + channelId + "/messages/" + messageId);
        if (response.statusCode() == 404 && errorCode(response.body()) == UNKNOWN_MESSAGE_CODE) {
            LOG.infof("Message %s in channel %s no longer exists", messageId, channelId);
            throw new MessageDeletedException(channelId, messageId);
        }
        if (response.statusCode() != 200) {
            throw new ChatPlatformException("Fetching message " + messageId + " failed with status "
                    + response.statusCode() + ": " + response.body(), response.statusCode());
        }
        return toMessage(readTree(response.body()), channelId);
    }

    /**
     * Removes the bot from a guild. A guild the bot already left counts as success.
     */
    public void leaveGuild(String guildId) {
        HttpResponse<String> response = send("DELETE", "/users/@me/guilds/" + guildId);
        int status = response.statusCode();
        if (status == 204 || status == 200) {
            LOG.infof("Left guild %s", guildId);
            return;
        }
        if (status == 404) {
            LOG.infof("Guild %s already left", guildId);
            return;
        }
        throw new ChatPlatformException("Leaving guild " + guildId + " failed with status " + status, status);
    }

    private HttpResponse<String> send(String method, String path) {
        HttpRequest request = HttpRequest.newBuilder().uri(URI.create(baseUrl + path)).timeout(HTTP_TIMEOUT)
                .header("Authorization", "Bot " + botToken).header("Accept", "application/json")
                .method(method, HttpRequest.BodyPublishers.noBody()).build();

        int retries = 0;
        while (true) {
            HttpResponse<String> response;
            try {
                response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            } catch (IOException e) {
                throw new ChatPlatformException("Request " + method + " " + path + " failed", e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ChatPlatformException("Interrupted during " + method + " " + path, e);
            }

            int status = response.statusCode();
            if (!retryPolicy.isRetryable(status)) {
                return response;
            }

            Duration retryAfter = status == 429 ? retryAfter(response) : null;
            if (!retryPolicy.canRetry(retries)) {
                LOG.errorf("Discord API error %d on %s %s: retries exhausted (%d/%d)", status, method, path, retries,
                        retryPolicy.getMaxRetries());
                if (status == 429) {
                    throw new RateLimitException("Discord rate limit exceeded on " + path, retryAfter);
                }
                throw new ChatPlatformException(
                        "Discord API returned status " + status + " on " + path + ": " + response.body(), status);
            }

            retries++;
            Duration delay = retryPolicy.delayFor(retries, retryAfter);
            LOG.warnf("Discord API error %d on %s %s (attempt %d/%d), retrying in %d ms", status, method, path,
                    retries, retryPolicy.getMaxRetries(), delay.toMillis());
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ChatPlatformException("Interrupted while backing off on " + path, e);
            }
        }
    }

    /**
     * Reads {@code retry_after} (seconds) from the JSON body, falling back to the {@code Retry-After} header.
     */
    private Duration retryAfter(HttpResponse<String> response) {
        try {
            JsonNode body = objectMapper.readTree(response.body());
            if (body != null && body.hasNonNull("retry_after")) {
                return Duration.ofMillis((long) (body.get("retry_after").asDouble() * 1000));
            }
        } catch (IOException e) {
            LOG.debugf("Rate limit response without JSON body: %s", e.getMessage());
        }
        return response.headers().firstValue("Retry-After").map(value -> {
            try {
                return Duration.ofMillis((long) (Double.parseDouble(value) * 1000));
            } catch (NumberFormatException e) {
                LOG.debugf("Unparseable Retry-After header: %s", value);
                return null;
            }
        }).orElse(null);
    }

    private int errorCode(String body) {
        try {
            JsonNode node = objectMapper.readTree(body);
            return node != null && node.has("code") ? node.get("code").asInt() : -1;
        } catch (IOException e) {
            LOG.debugf("Error response without JSON body: %s", e.getMessage());
            return -1;
        }
    }

    private JsonNode readTree(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new ChatPlatformException("Unreadable Discord response", e);
        }
    }

    private static DiscordMessage toMessage(JsonNode node, String channelId) {
        JsonNode authorNode = node.path("author");
        DiscordAuthor author = new DiscordAuthor(authorNode.path("id").asText(),
                authorNode.path("username").asText(""), textOrNull(authorNode, "discriminator"),
                textOrNull(authorNode, "avatar"));

        List<DiscordAttachment> attachments = new ArrayList<>();
        for (JsonNode attachment : node.path("attachments")) {
            attachments.add(new DiscordAttachment(attachment.path("id").asText(),
                    attachment.path("filename").asText(), attachment.path("size").asLong(),
                    attachment.path("url").asText(), textOrNull(attachment, "content_type")));
        }

        Instant timestamp = OffsetDateTime.parse(node.path("timestamp").asText()).toInstant();
        String messageChannel = node.hasNonNull("channel_id") ? node.get("channel_id").asText() : channelId;
        return new DiscordMessage(node.path("id").asText(), messageChannel, author, textOrNull(node, "content"),
                timestamp, attachments);
    }

    private static String textOrNull(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : null;
    }
}
