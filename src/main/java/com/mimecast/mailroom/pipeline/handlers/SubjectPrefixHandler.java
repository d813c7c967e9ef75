package com.mimecast.mailroom.pipeline.handlers;

import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.pipeline.Handler;
import com.mimecast.mailroom.pipeline.HandlerResult;
import com.mimecast.mailroom.queue.Metadata;
import jakarta.mail.internet.MimeUtility;

import java.io.UnsupportedEncodingException;

/**
 * Adds the list's subject prefix unless already present.
 */
public class SubjectPrefixHandler implements Handler {

    @Override
    public String getName() {
        return "subject-prefix";
    }

    @Override
    public String getDescription() {
        return "Add a list-specific prefix to the Subject header value.";
    }

    @Override
    public HandlerResult process(MailMessage message, Metadata metadata, MailingList list) {
        String prefix = list.getSubjectPrefix();
        if (prefix.isBlank()) {
            return HandlerResult.proceed();
        }

        String subject = message.getSubject();
        if (subject.contains(prefix.trim())) {
            return HandlerResult.proceed();
        }

        String prefixed = prefix + (subject.isEmpty() ? "(no subject)" : subject);
        try {
            message.setHeader("Subject", MimeUtility.encodeText(prefixed, "UTF-8", null));
        } catch (UnsupportedEncodingException e) {
            message.setHeader("Subject", prefixed);
        }
        return HandlerResult.proceed();
    }
}
