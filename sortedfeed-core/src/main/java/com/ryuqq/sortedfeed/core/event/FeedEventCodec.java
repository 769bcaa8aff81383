package com.ryuqq.sortedfeed.core.event;

import com.ryuqq.sortedfeed.core.model.Content;
import com.ryuqq.sortedfeed.core.model.FeedId;
import com.ryuqq.sortedfeed.core.model.FeedKeys;

/**
 * Wire format for feed notifications.
 *
 * <pre>
 * publish channel:  &lt;id&gt; \0 &lt;content&gt;
 * retract channel:  &lt;id&gt;
 * </pre>
 *
 * <p>Only the first {@code \0} separates the fields, so content may itself contain NUL.</p>
 *
 * @author SortedFeed Team
 * @since 1.0.0
 */
public final class FeedEventCodec {

    /**
     * Separator between id and content in publish messages.
     */
    public static final char SEPARATOR = '\0';

    private FeedEventCodec() {
    }

    /**
     * Encodes an event into its channel message.
     *
     * @param event the event
     * @return the message body
     * @throws IllegalArgumentException if event is null
     */
    public static String encode(FeedEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        if (event instanceof PublishEvent publish) {
            return publish.id().asString() + SEPARATOR + publish.content().getValue();
        }
        return event.id().asString();
    }

    /**
     * Resolves the channel an event is broadcast on.
     *
     * @param keys the feed keys
     * @param event the event
     * @return publish or retract channel name
     * @throws IllegalArgumentException if keys or event is null
     */
    public static String channel(FeedKeys keys, FeedEvent event) {
        if (keys == null) {
            throw new IllegalArgumentException("keys cannot be null");
        }
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        return event.isPublish() ? keys.publishChannel() : keys.retractChannel();
    }

    /**
     * Decodes a message received on one of the feed's channels.
     *
     * @param keys the feed keys
     * @param channel the channel the message arrived on
     * @param message the message body
     * @return the decoded event
     * @throws IllegalArgumentException if the channel does not belong to the feed or the message is malformed
     */
    public static FeedEvent decode(FeedKeys keys, String channel, String message) {
        if (keys == null) {
            throw new IllegalArgumentException("keys cannot be null");
        }
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        if (keys.publishChannel().equals(channel)) {
            int split = message.indexOf(SEPARATOR);
            if (split < 0) {
                throw new IllegalArgumentException("publish message has no separator");
            }
            FeedId id = FeedId.parse(message.substring(0, split));
            return new PublishEvent(keys.feed(), id, Content.of(message.substring(split + 1)));
        }
        if (keys.retractChannel().equals(channel)) {
            return new RetractEvent(keys.feed(), FeedId.parse(message));
        }
        throw new IllegalArgumentException("channel " + channel + " does not belong to " + keys.feed());
    }
}
