package com.mimecast.mailroom.notice;

import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.util.MutableClock;
import com.mimecast.mailroom.util.TestMessages;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NoticeGeneratorTest {

    private final NoticeGenerator generator =
            new NoticeGenerator("lists.example.com", new MutableClock(Instant.parse("2026-10-19T10:00:00Z")));
    private final MailingList list = TestMessages.list();

    @Test
    void rejectionNotice() throws IOException {
        MailMessage original = TestMessages.memberPosting("rejected@example.com");

        MailMessage notice = generator.rejection(list, original, "anne@example.com", "Off topic");

        assertEquals(List.of("ant-owner@example.com"), notice.getAddresses("From"));
        assertEquals(List.of("anne@example.com"), notice.getAddresses("To"));
        assertEquals("auto-replied", notice.getHeader("Auto-Submitted"));
        assertTrue(notice.getMessageId().endsWith("@lists.example.com>"));
        String body = new String(notice.getBody(), StandardCharsets.UTF_8);
        assertTrue(body.contains("Off topic"));
        assertTrue(body.contains("message/rfc822"));
        assertTrue(body.contains("Subject: Weekly meeting"));
        assertTrue(notice.getSubject().startsWith("Your message to Ant was rejected"));
    }

    @Test
    void deliveryFailureNotice() throws IOException {
        MailMessage original = TestMessages.memberPosting("failed@example.com");

        MailMessage notice = generator.deliveryFailure(list, original, "anne@example.com", "550 no such user",
                List.of("cris@example.com"));

        assertEquals(List.of("ant-bounces@example.com"), notice.getAddresses("From"));
        assertEquals("auto-generated", notice.getHeader("Auto-Submitted"));
        assertTrue(notice.getHeader("Content-Type").startsWith("multipart/report"));
        String body = new String(notice.getBody(), StandardCharsets.UTF_8);
        assertTrue(body.contains("message/delivery-status"));
        assertTrue(body.contains("text/rfc822-headers"));
        assertTrue(body.contains("Reporting-MTA: dns; lists.example.com"));
        assertTrue(body.contains("<cris@example.com>"));
    }

    @Test
    void plainTextListsFailures() {
        String text = generator.generatePlainText(list, List.of("cris@example.com", "bart@example.com"), "550 gone");

        assertTrue(text.startsWith("Your message to the Ant mailing-list could not be delivered."));
        assertTrue(text.contains("<cris@example.com>\r\n<bart@example.com>\r\n"));
        assertTrue(text.endsWith("(reason: 550 gone)\r\n"));
    }
}
