package com.mimecast.mailroom.mime;

import jakarta.mail.Header;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.InternetHeaders;
import jakarta.mail.internet.MimeUtility;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.Locale;

/**
 * Email message: an ordered header block and an opaque body.
 *
 * <p>The engine never interprets the body; handlers only touch headers
 * (and the digest and notice builders compose new messages).
 */
public class MailMessage {
    private static final Logger log = LogManager.getLogger(MailMessage.class);

    private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);

    private final InternetHeaders headers;
    private byte[] body;

    /**
     * Constructs a new empty message.
     */
    public MailMessage() {
        this(new InternetHeaders(), new byte[0]);
    }

    private MailMessage(InternetHeaders headers, byte[] body) {
        this.headers = headers;
        this.body = body;
    }

    /**
     * Parses RFC 5322 bytes.
     *
     * @param bytes Raw message.
     * @return MailMessage instance.
     * @throws IOException Header block cannot be parsed.
     */
    public static MailMessage parse(byte[] bytes) throws IOException {
        int split = headerEnd(bytes);
        byte[] headerBytes = split < 0 ? bytes : Arrays.copyOfRange(bytes, 0, split);
        byte[] body = split < 0 ? new byte[0] : Arrays.copyOfRange(bytes, bodyStart(bytes, split), bytes.length);

        try {
            InternetHeaders headers = new InternetHeaders(new ByteArrayInputStream(headerBytes), true);
            return new MailMessage(headers, body);
        } catch (MessagingException e) {
            throw new IOException("Unable to parse message headers: " + e.getMessage(), e);
        }
    }

    /**
     * Parses a string message.
     *
     * @param message Raw message.
     * @return MailMessage instance.
     * @throws IOException Header block cannot be parsed.
     */
    public static MailMessage parse(String message) throws IOException {
        return parse(message.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Finds the offset of the blank line separating headers and body.
     *
     * @return Offset of the first byte of the separator or -1.
     */
    private static int headerEnd(byte[] bytes) {
        for (int i = 0; i < bytes.length - 1; i++) {
            if (bytes[i] == '\n' && bytes[i + 1] == '\n') {
                return i + 1;
            }
            if (i < bytes.length - 3 && bytes[i] == '\r' && bytes[i + 1] == '\n'
                    && bytes[i + 2] == '\r' && bytes[i + 3] == '\n') {
                return i + 2;
            }
        }
        return -1;
    }

    private static int bodyStart(byte[] bytes, int split) {
        return bytes[split] == '\r' ? split + 2 : split + 1;
    }

    /**
     * Gets the first value of a header.
     *
     * @param name Header name.
     * @return Raw value or null.
     */
    public String getHeader(String name) {
        String[] values = headers.getHeader(name);
        return values != null && values.length > 0 ? values[0].trim() : null;
    }

    /**
     * Gets all values of a header.
     *
     * @param name Header name.
     * @return List of raw values, never null.
     */
    public List<String> getHeaders(String name) {
        String[] values = headers.getHeader(name);
        if (values == null) {
            return Collections.emptyList();
        }
        List<String> list = new ArrayList<>(values.length);
        for (String value : values) {
            list.add(value.trim());
        }
        return list;
    }

    /**
     * Gets all header names in order.
     *
     * @return List of names.
     */
    public List<String> getHeaderNames() {
        List<String> names = new ArrayList<>();
        Enumeration<Header> all = headers.getAllHeaders();
        while (all.hasMoreElements()) {
            names.add(all.nextElement().getName());
        }
        return names;
    }

    /**
     * Checks if a header is present.
     *
     * @param name Header name.
     * @return Boolean.
     */
    public boolean hasHeader(String name) {
        return headers.getHeader(name) != null;
    }

    /**
     * Replaces all occurrences of a header with a single value.
     *
     * @param name  Header name.
     * @param value Header value.
     * @return Self.
     */
    public MailMessage setHeader(String name, String value) {
        headers.setHeader(name, value);
        return this;
    }

    /**
     * Adds a header occurrence.
     *
     * @param name  Header name.
     * @param value Header value.
     * @return Self.
     */
    public MailMessage addHeader(String name, String value) {
        headers.addHeader(name, value);
        return this;
    }

    /**
     * Removes all occurrences of a header.
     *
     * @param name Header name.
     * @return Self.
     */
    public MailMessage removeHeader(String name) {
        headers.removeHeader(name);
        return this;
    }

    /**
     * Gets the decoded subject.
     *
     * @return Subject or empty string.
     */
    public String getSubject() {
        String subject = getHeader("Subject");
        if (subject == null) {
            return "";
        }
        try {
            return MimeUtility.decodeText(MimeUtility.unfold(subject));
        } catch (UnsupportedEncodingException e) {
            log.debug("Undecodable subject kept raw: {}", e.getMessage());
            return MimeUtility.unfold(subject);
        }
    }

    /**
     * Gets the Message-ID header.
     *
     * @return Message-ID or a digest of the message when absent.
     */
    public String getMessageId() {
        String id = getHeader("Message-ID");
        return StringUtils.isNotBlank(id) ? id : "<" + DigestUtils.sha1Hex(toBytes()) + "@mailroom>";
    }

    /**
     * Gets the sender address.
     * <p>Looks at From, then Sender, then Reply-To.
     *
     * @return Lower cased address or null.
     */
    public String getSender() {
        for (String name : List.of("From", "Sender", "Reply-To")) {
            List<String> addresses = getAddresses(name);
            if (!addresses.isEmpty()) {
                return addresses.get(0);
            }
        }
        return null;
    }

    /**
     * Gets explicit recipients from To and Cc.
     *
     * @return Lower cased addresses.
     */
    public List<String> getRecipients() {
        List<String> recipients = new ArrayList<>(getAddresses("To"));
        recipients.addAll(getAddresses("Cc"));
        return recipients;
    }

    /**
     * Parses the addresses in every occurrence of a header.
     *
     * @param name Header name.
     * @return Lower cased addresses, unparsable values are skipped.
     */
    public List<String> getAddresses(String name) {
        List<String> addresses = new ArrayList<>();
        for (String value : getHeaders(name)) {
            try {
                for (InternetAddress address : InternetAddress.parseHeader(value, false)) {
                    if (address.getAddress() != null) {
                        addresses.add(address.getAddress().toLowerCase(Locale.ROOT));
                    }
                }
            } catch (AddressException e) {
                log.debug("Unparsable {} header: {}", name, value);
            }
        }
        return addresses;
    }

    /**
     * Gets body bytes.
     *
     * @return Byte array.
     */
    public byte[] getBody() {
        return body;
    }

    /**
     * Sets body bytes.
     *
     * @param body Byte array.
     * @return Self.
     */
    public MailMessage setBody(byte[] body) {
        this.body = body != null ? body : new byte[0];
        return this;
    }

    /**
     * Sets body text.
     *
     * @param text Body text.
     * @return Self.
     */
    public MailMessage setBody(String text) {
        return setBody(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Serializes the message.
     *
     * @return RFC 5322 bytes with CRLF header lines.
     */
    public byte[] toBytes() {
        ByteArrayOutputStream stream = new ByteArrayOutputStream(body.length + 1024);
        Enumeration<String> lines = headers.getAllHeaderLines();
        while (lines.hasMoreElements()) {
            stream.writeBytes(lines.nextElement().getBytes(StandardCharsets.UTF_8));
            stream.writeBytes(CRLF);
        }
        stream.writeBytes(CRLF);
        stream.writeBytes(body);
        return stream.toByteArray();
    }

    /**
     * Gets serialized size.
     *
     * @return Bytes.
     */
    public int size() {
        return toBytes().length;
    }

    /**
     * Deep copy.
     *
     * @return New MailMessage.
     */
    public MailMessage copy() {
        try {
            return parse(toBytes());
        } catch (IOException e) {
            throw new IllegalStateException("Message no longer parses: " + e.getMessage(), e);
        }
    }
}
