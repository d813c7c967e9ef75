package com.mimecast.mailroom.moderation;

import java.time.Instant;

/**
 * Hold record.
 * <p>Serialized as JSON by the file ledger, hence the plain mutable fields.
 */
public class HoldRecord {

    private String list;
    private String requestId;
    private String messageId;
    private String sender;
    private String subject;
    private String reason;
    private String rule;
    private long heldAt;
    private String disposition = HoldDisposition.PENDING.toString();
    private long resolvedAt;

    public HoldRecord() {
        // Gson.
    }

    public HoldRecord(HoldId id, String messageId, String reason, String rule, Instant heldAt) {
        this.list = id.getListName();
        this.requestId = id.getRequestId();
        this.messageId = messageId;
        this.reason = reason;
        this.rule = rule;
        this.heldAt = heldAt.toEpochMilli();
    }

    public HoldId getId() {
        return new HoldId(list, requestId);
    }

    public String getList() {
        return list;
    }

    public String getMessageId() {
        return messageId;
    }

    public String getSender() {
        return sender;
    }

    public HoldRecord setSender(String sender) {
        this.sender = sender;
        return this;
    }

    public String getSubject() {
        return subject;
    }

    public HoldRecord setSubject(String subject) {
        this.subject = subject;
        return this;
    }

    public String getReason() {
        return reason;
    }

    public String getRule() {
        return rule;
    }

    public Instant getHeldAt() {
        return Instant.ofEpochMilli(heldAt);
    }

    public HoldDisposition getDisposition() {
        return HoldDisposition.fromString(disposition);
    }

    /**
     * Records a resolution.
     *
     * @param disposition Terminal disposition.
     * @param at          Resolution time.
     * @return Self.
     */
    public HoldRecord resolve(HoldDisposition disposition, Instant at) {
        this.disposition = disposition.toString();
        this.resolvedAt = at.toEpochMilli();
        return this;
    }

    public Instant getResolvedAt() {
        return resolvedAt > 0 ? Instant.ofEpochMilli(resolvedAt) : null;
    }

    public boolean isPending() {
        return getDisposition() == HoldDisposition.PENDING;
    }

    @Override
    public String toString() {
        return getId() + " [" + disposition + "] rule=" + rule + ", reason=" + reason
                + ", sender=" + sender + ", subject=" + subject + ", messageId=" + messageId;
    }
}
