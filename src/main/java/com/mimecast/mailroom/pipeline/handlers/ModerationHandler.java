package com.mimecast.mailroom.pipeline.handlers;

import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.pipeline.Handler;
import com.mimecast.mailroom.pipeline.HandlerResult;
import com.mimecast.mailroom.queue.Metadata;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;

/**
 * Stops the pipeline unless the chain accepted the message.
 */
public class ModerationHandler implements Handler {
    private static final Logger log = LogManager.getLogger(ModerationHandler.class);

    @Override
    public String getName() {
        return "moderation";
    }

    @Override
    public String getDescription() {
        return "Stop processing of messages the rule chain did not accept.";
    }

    @Override
    @SuppressWarnings("unchecked")
    public HandlerResult process(MailMessage message, Metadata metadata, MailingList list) {
        Object verdict = metadata.get(Metadata.VERDICT);
        String type = verdict instanceof Map ? String.valueOf(((Map<String, Object>) verdict).get("type")) : "accept";
        if (!"accept".equals(type)) {
            log.info("Stopping pipeline for {} on {}: verdict {}", message.getMessageId(), list.getName(), type);
            return HandlerResult.stop();
        }
        return HandlerResult.proceed();
    }
}
