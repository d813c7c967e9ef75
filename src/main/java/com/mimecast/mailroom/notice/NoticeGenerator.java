package com.mimecast.mailroom.notice;

import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.mime.MailMessage;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.InternetHeaders;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Date;
import java.util.List;
import java.util.Properties;
import java.util.UUID;

/**
 * Composes notices sent back to senders.
 *
 * <p>Rejections quote the reason and attach the original; delivery failures are
 * {@code multipart/report} delivery status notifications carrying the original headers.
 */
public class NoticeGenerator {
    private static final Logger log = LogManager.getLogger(NoticeGenerator.class);

    private final String hostname;
    private final Clock clock;

    public NoticeGenerator(String hostname, Clock clock) {
        this.hostname = hostname;
        this.clock = clock;
    }

    /**
     * Composes a rejection notice.
     *
     * @param list      List.
     * @param original  Rejected message.
     * @param recipient Notice recipient.
     * @param reason    Rejection reason.
     * @return MailMessage.
     * @throws IOException Unable to compose.
     */
    public MailMessage rejection(MailingList list, MailMessage original, String recipient, String reason) throws IOException {
        String text = "Your message to the " + list.getDisplayName() + " mailing-list was rejected for the following reasons:\r\n" +
                "\r\n" +
                reason + "\r\n" +
                "\r\n" +
                "The original message as received by the mailing list is attached.\r\n";
        try {
            Session session = Session.getInstance(new Properties());
            MimeMultipart multipart = new MimeMultipart();
            multipart.addBodyPart(textPart(text));

            MimeBodyPart attached = new MimeBodyPart();
            attached.setContent(new MimeMessage(session, new ByteArrayInputStream(original.toBytes())), "message/rfc822");
            multipart.addBodyPart(attached);

            MimeMessage message = envelope(session, list.getOwnerAddress(), recipient,
                    "Your message to " + list.getDisplayName() + " was rejected: " + original.getSubject());
            message.setHeader("Auto-Submitted", "auto-replied");
            message.setContent(multipart);
            return finish(message);
        } catch (MessagingException e) {
            throw new IOException("Unable to compose rejection notice: " + e.getMessage(), e);
        }
    }

    /**
     * Composes a delivery status notification.
     *
     * @param list             List.
     * @param original         Undeliverable message.
     * @param recipient        Notice recipient.
     * @param reason           Diagnostic.
     * @param failedRecipients Failed recipients, may be empty.
     * @return MailMessage.
     * @throws IOException Unable to compose.
     */
    public MailMessage deliveryFailure(MailingList list, MailMessage original, String recipient, String reason,
                                       List<String> failedRecipients) throws IOException {
        try {
            Session session = Session.getInstance(new Properties());
            MimeMultipart multipart = new MimeMultipart("report");
            multipart.addBodyPart(textPart(generatePlainText(list, failedRecipients, reason)));

            MimeBodyPart status = new MimeBodyPart(new InternetHeaders(),
                    generateDeliveryStatus(failedRecipients, reason).getBytes(StandardCharsets.UTF_8));
            status.setHeader("Content-Type", "message/delivery-status");
            multipart.addBodyPart(status);

            MimeBodyPart headers = new MimeBodyPart(new InternetHeaders(), headerBlock(original));
            headers.setHeader("Content-Type", "text/rfc822-headers");
            multipart.addBodyPart(headers);

            MimeMessage message = envelope(session, "Mail Delivery Subsystem <" + list.getBouncesAddress() + ">", recipient,
                    "Delivery Status Notification (Failure)");
            message.setHeader("Auto-Submitted", "auto-generated");
            message.setContent(multipart);

            MailMessage notice = finish(message);
            String contentType = notice.getHeader("Content-Type");
            if (contentType != null && !contentType.contains("report-type")) {
                notice.setHeader("Content-Type", contentType + "; report-type=delivery-status");
            }
            return notice;
        } catch (MessagingException e) {
            throw new IOException("Unable to compose delivery status notification: " + e.getMessage(), e);
        }
    }

    String generatePlainText(MailingList list, List<String> failedRecipients, String reason) {
        StringBuilder text = new StringBuilder()
                .append("Your message to the ").append(list.getDisplayName())
                .append(" mailing-list could not be delivered.\r\n")
                .append("\r\n")
                .append("   ----- The following addresses had permanent fatal errors -----\r\n");
        for (String failed : failedRecipients) {
            text.append("<").append(failed).append(">\r\n");
        }
        return text.append("    (reason: ").append(reason).append(")\r\n").toString();
    }

    String generateDeliveryStatus(List<String> failedRecipients, String reason) {
        StringBuilder status = new StringBuilder()
                .append("Reporting-MTA: dns; ").append(hostname).append("\r\n")
                .append("Arrival-Date: ").append(new Date(clock.millis())).append("\r\n");
        for (String failed : failedRecipients) {
            status.append("\r\n")
                    .append("Final-Recipient: RFC822; ").append(failed).append("\r\n")
                    .append("Action: failed\r\n")
                    .append("Status: 5.0.0\r\n")
                    .append("Diagnostic-Code: X-Mailroom; ").append(reason).append("\r\n");
        }
        return status.toString();
    }

    private static MimeBodyPart textPart(String text) throws MessagingException {
        MimeBodyPart part = new MimeBodyPart();
        part.setText(text, "UTF-8");
        return part;
    }

    private MimeMessage envelope(Session session, String from, String to, String subject) throws MessagingException {
        MimeMessage message = new MimeMessage(session);
        message.setFrom(new InternetAddress(from));
        message.setRecipient(MimeMessage.RecipientType.TO, new InternetAddress(to));
        message.setSubject(subject, "UTF-8");
        message.setSentDate(Date.from(clock.instant()));
        return message;
    }

    private MailMessage finish(MimeMessage message) throws MessagingException, IOException {
        message.saveChanges();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        message.writeTo(out);
        MailMessage notice = MailMessage.parse(out.toByteArray());
        notice.setHeader("Message-ID", "<" + UUID.randomUUID() + "@" + hostname + ">");
        log.debug("Composed notice: to={}, subject={}", notice.getHeader("To"), notice.getSubject());
        return notice;
    }

    private static byte[] headerBlock(MailMessage original) {
        byte[] bytes = original.toBytes();
        String text = new String(bytes, StandardCharsets.UTF_8);
        int end = text.indexOf("\r\n\r\n");
        return (end >= 0 ? text.substring(0, end + 2) : text).getBytes(StandardCharsets.UTF_8);
    }
}
