package villagecompute.clipindex.integration.discord;

import villagecompute.clipindex.services.ResolvedSettings;

import java.util.List;

/**
 * Decides which attachments of a message are indexed as clips.
 *
 * <p>
 * The default implementation is {@link VideoAttachmentExtractor}; deployments can replace it with their own bean.
 */
public interface AttachmentExtractor {

    /**
     * Clip candidates of {@code message} under {@code settings}; empty when the message is not indexed at all.
     */
    List<ClipCandidate> extract(DiscordMessage message, ResolvedSettings settings);
}
