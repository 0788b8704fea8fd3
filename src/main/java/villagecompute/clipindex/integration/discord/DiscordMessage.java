package villagecompute.clipindex.integration.discord;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * A chat message with the fields the indexer reads.
 */
public record DiscordMessage(String id, String channelId, DiscordAuthor author, String content, Instant timestamp,
        List<DiscordAttachment> attachments) {

    /**
     * Orders messages by snowflake, oldest first.
     */
    public static final Comparator<DiscordMessage> OLDEST_FIRST = Comparator
            .comparing(message -> new BigInteger(message.id()));

    public DiscordMessage {
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    public Optional<DiscordAttachment> findAttachment(String filename) {
        return attachments.stream().filter(a -> a.filename().equals(filename)).findFirst();
    }
}
