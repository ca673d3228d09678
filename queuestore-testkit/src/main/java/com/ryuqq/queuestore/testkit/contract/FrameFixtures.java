package com.ryuqq.queuestore.testkit.contract;

import com.ryuqq.queuestore.core.model.Frame;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Test fixtures for building frames.
 *
 * @author QueueStore Team
 * @since 1.0.0
 */
public final class FrameFixtures {

    private FrameFixtures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Creates a frame with a UTF-8 text body and no headers.
     *
     * @param body the body text
     * @return a new frame without message-id
     */
    public static Frame textFrame(String body) {
        return Frame.ofText(body);
    }

    /**
     * Creates a frame whose message-id is already set by the caller.
     *
     * @param messageId the preset message-id
     * @param body the body text
     * @return a new frame carrying the given message-id
     */
    public static Frame frameWithId(String messageId, String body) {
        Frame frame = Frame.ofText(body);
        frame.setHeader(Frame.MESSAGE_ID, messageId);
        return frame;
    }

    /**
     * Creates a frame tagged with its producer and sequence number, for ordering checks.
     *
     * @param producer producer index
     * @param sequence per-producer sequence number
     * @return a new frame with {@code producer} and {@code seq} headers
     */
    public static Frame producerFrame(int producer, int sequence) {
        return new Frame(
            Map.of("producer", String.valueOf(producer), "seq", String.valueOf(sequence)),
            ("p" + producer + "-" + sequence).getBytes(StandardCharsets.UTF_8)
        );
    }
}
