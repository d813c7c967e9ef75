package com.mimecast.mailroom.archive;

import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.mime.MailMessage;

import java.io.IOException;

/**
 * Archiver interface.
 */
public interface Archiver {

    /**
     * Archives a posting.
     * <p>Archiving the same Message-ID twice is a no-op.
     *
     * @param list    List.
     * @param message Message.
     * @throws IOException Archive unavailable.
     */
    void archive(MailingList list, MailMessage message) throws IOException;
}
