package com.mimecast.mailroom.pipeline.handlers;

import com.mimecast.mailroom.digest.DigestBuilder;
import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.pipeline.Handler;
import com.mimecast.mailroom.pipeline.HandlerResult;
import com.mimecast.mailroom.pipeline.TransientHandlerException;
import com.mimecast.mailroom.queue.Metadata;
import com.mimecast.mailroom.queue.QueueNames;
import com.mimecast.mailroom.queue.QueueStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;

/**
 * Collects the message for the list digest and sends the digest once it is big enough.
 * <p>The digest is queued to the virgin queue addressed to the digest members.
 */
public class DigestHandler implements Handler {
    private static final Logger log = LogManager.getLogger(DigestHandler.class);

    private final DigestBuilder builder;
    private final QueueStore store;

    public DigestHandler(DigestBuilder builder, QueueStore store) {
        this.builder = builder;
        this.store = store;
    }

    @Override
    public String getName() {
        return "digest";
    }

    @Override
    public String getDescription() {
        return "Collect the message into the list digest.";
    }

    @Override
    public HandlerResult process(MailMessage message, Metadata metadata, MailingList list) throws TransientHandlerException {
        try {
            if (builder.add(list, message)) {
                DigestBuilder.Digest digest = builder.build(list);
                if (digest != null) {
                    Metadata digestMetadata = Metadata.forList(list.getName())
                            .put(Metadata.RECIPIENTS, new ArrayList<>(list.getDigestMembers()))
                            .put("digestVolume", digest.getVolume());
                    store.enqueue(QueueNames.VIRGIN, digest.getMessage(), digestMetadata);
                    builder.clear(list, digest);
                    log.info("Sent digest: list={}, volume={}, messages={}", list.getName(), digest.getVolume(), digest.getFiles().size());
                }
            }
        } catch (IOException e) {
            throw new TransientHandlerException("Digest collection failed: " + e.getMessage(), e);
        }
        return HandlerResult.stop();
    }
}
