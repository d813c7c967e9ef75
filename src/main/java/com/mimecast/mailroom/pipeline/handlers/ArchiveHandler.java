package com.mimecast.mailroom.pipeline.handlers;

import com.mimecast.mailroom.archive.Archiver;
import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.pipeline.Handler;
import com.mimecast.mailroom.pipeline.HandlerResult;
import com.mimecast.mailroom.pipeline.TransientHandlerException;
import com.mimecast.mailroom.queue.Metadata;

import java.io.IOException;

/**
 * Writes the message to the list archive.
 */
public class ArchiveHandler implements Handler {

    private final Archiver archiver;

    public ArchiveHandler(Archiver archiver) {
        this.archiver = archiver;
    }

    @Override
    public String getName() {
        return "archive";
    }

    @Override
    public String getDescription() {
        return "Archive the message.";
    }

    @Override
    public HandlerResult process(MailMessage message, Metadata metadata, MailingList list) throws TransientHandlerException {
        try {
            archiver.archive(list, message);
        } catch (IOException e) {
            throw new TransientHandlerException("Archive unavailable: " + e.getMessage(), e);
        }
        return HandlerResult.stop();
    }
}
