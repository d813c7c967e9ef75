package com.mimecast.mailroom.rules.builtin;

import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.queue.Metadata;
import com.mimecast.mailroom.util.TestMessages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BuiltinRulesTest {

    private MailingList list;
    private Metadata metadata;
    private MailMessage posting;

    @BeforeEach
    void setUp() throws IOException {
        list = TestMessages.list();
        metadata = Metadata.forList(list.getName());
        posting = TestMessages.memberPosting("rules@example.com");
    }

    @Test
    void truthAlwaysHits() {
        assertTrue(new TruthRule().check(posting, metadata, list));
    }

    @Test
    void anyHitsOnlyAfterEarlierHits() {
        AnyRule rule = new AnyRule();
        assertFalse(rule.check(posting, metadata, list));

        metadata.addToList(Metadata.RULE_HITS, "loop");
        assertTrue(rule.check(posting, metadata, list));
    }

    @Test
    void emergencyUnlessApproved() {
        EmergencyRule rule = new EmergencyRule();
        assertFalse(rule.check(posting, metadata, list));

        MailingList emergency = TestMessages.list("emergency", true);
        assertTrue(rule.check(posting, metadata, emergency));
        assertNotNull(metadata.getAnnotation("emergency"));

        metadata.put(Metadata.MODERATOR_APPROVED, true);
        assertFalse(rule.check(posting, metadata, emergency));
    }

    @Test
    void loopOnOwnBeenThere() {
        LoopRule rule = new LoopRule();
        assertFalse(rule.check(posting, metadata, list));

        posting.addHeader("X-BeenThere", "other@example.com");
        assertFalse(rule.check(posting, metadata, list));

        posting.addHeader("X-BeenThere", "ANT@example.com");
        assertTrue(rule.check(posting, metadata, list));
    }

    @ParameterizedTest
    @ValueSource(strings = {"subscribe", "Unsubscribe me please", "help", "WHO"})
    void administriviaInSubject(String subject) throws IOException {
        MailMessage message = TestMessages.posting("anne@example.com", "ant@example.com", subject, "a@example.com");

        assertTrue(new AdministriviaRule().check(message, metadata, list));
        assertTrue(metadata.getAnnotation("administrivia").contains(subject.split(" ")[0].toLowerCase()));
    }

    @Test
    void administriviaInFirstBodyLines() {
        AdministriviaRule rule = new AdministriviaRule();
        assertFalse(rule.check(posting, metadata, list));

        posting.setBody("\r\n\r\nleave\r\n");
        assertTrue(rule.check(posting, metadata, list));
    }

    @Test
    void administriviaIgnoresLateLinesAndLargeBodies() {
        AdministriviaRule rule = new AdministriviaRule();

        posting.setBody("one\r\ntwo\r\nthree\r\nfour\r\nfive\r\nsubscribe\r\n");
        assertFalse(rule.check(posting, metadata, list));

        posting.setBody("subscribe\r\n" + "x".repeat(4096) + "\r\n");
        assertFalse(rule.check(posting, metadata, list));
    }

    @Test
    void administriviaDisabled() throws IOException {
        MailMessage message = TestMessages.posting("anne@example.com", "ant@example.com", "subscribe", "a@example.com");

        assertFalse(new AdministriviaRule().check(message, metadata, TestMessages.list("administrivia", false)));
    }

    @Test
    void implicitDestination() throws IOException {
        ImplicitDestinationRule rule = new ImplicitDestinationRule();
        assertFalse(rule.check(posting, metadata, list));

        MailMessage bcc = TestMessages.posting("anne@example.com", "someone@example.org", "Hi", "b@example.com");
        assertTrue(rule.check(bcc, metadata, list));
        assertFalse(rule.check(bcc, metadata, TestMessages.list("acceptableAliases", List.of("^.*@example\\.org"))));
        assertFalse(rule.check(bcc, metadata, TestMessages.list("requireExplicitDestination", false)));
    }

    @Test
    void maxRecipients() throws IOException {
        MaxRecipientsRule rule = new MaxRecipientsRule();
        MailMessage message = TestMessages.posting("anne@example.com",
                "ant@example.com, b@example.com, c@example.com", "Hi", "c@example.com");
        message.addHeader("Cc", "b@example.com");

        assertFalse(rule.check(message, metadata, list));
        assertTrue(rule.check(message, metadata, TestMessages.list("maxNumRecipients", 3)));
        assertFalse(rule.check(message, metadata, TestMessages.list("maxNumRecipients", 4)));
        assertFalse(rule.check(message, metadata, TestMessages.list("maxNumRecipients", 0)));
    }

    @Test
    void maxSize() {
        MaxSizeRule rule = new MaxSizeRule();
        assertFalse(rule.check(posting, metadata, list));

        posting.setBody("x".repeat(2048));
        assertTrue(rule.check(posting, metadata, TestMessages.list("maxMessageSize", 1)));
        assertFalse(rule.check(posting, metadata, TestMessages.list("maxMessageSize", 0)));
    }

    @Test
    void noSubject() throws IOException {
        NoSubjectRule rule = new NoSubjectRule();
        assertFalse(rule.check(posting, metadata, list));

        MailMessage message = TestMessages.posting("anne@example.com", "ant@example.com", " ", "d@example.com");
        assertTrue(rule.check(message, metadata, list));
    }

    @Test
    void spamFlagAndScore() {
        SpamCheckRule rule = new SpamCheckRule();
        assertFalse(rule.check(posting, metadata, list));

        posting.setHeader("X-Spam-Score", "4.9");
        assertFalse(rule.check(posting, metadata, list));

        posting.setHeader("X-Spam-Score", "7.2 / 5.0");
        assertTrue(rule.check(posting, metadata, list));
        assertFalse(rule.check(posting, metadata, TestMessages.list("spamScoreThreshold", 10.0)));

        posting.removeHeader("X-Spam-Score");
        posting.setHeader("X-Spam-Flag", "yes");
        assertTrue(rule.check(posting, metadata, list));
    }

    @Test
    void suspiciousHeader() {
        SuspiciousHeaderRule rule = new SuspiciousHeaderRule();
        MailingList configured = TestMessages.list("bounceMatchingHeaders",
                List.of("# comment", "X-Mailer: ^bulk", "broken line"));

        assertFalse(rule.check(posting, metadata, configured));

        posting.setHeader("X-Mailer", "Bulk Sender 2.0");
        assertTrue(rule.check(posting, metadata, configured));
    }

    @Test
    void headerMatchWithAndWithoutAction() {
        HeaderMatchRule rule = new HeaderMatchRule();
        MailingList configured = TestMessages.list("headerMatches", List.of(
                Map.of("header", "X-Priority", "pattern", "urgent"),
                Map.of("header", "Subject", "pattern", "^free", "action", "discard"),
                Map.of("header", "X-Broken", "pattern", "(")));

        assertFalse(rule.check(posting, metadata, configured));

        posting.setHeader("X-Priority", "URGENT");
        assertTrue(rule.check(posting, metadata, configured));
        assertNull(metadata.getString(Metadata.MODERATION_ACTION));

        posting.removeHeader("X-Priority");
        posting.setHeader("Subject", "Free stuff");
        assertTrue(rule.check(posting, metadata, configured));
        assertEquals("discard", metadata.getString(Metadata.MODERATION_ACTION));
    }

    @Test
    void bannedAddressLiteralAndRegex() throws IOException {
        BannedAddressRule rule = new BannedAddressRule();
        MailMessage spammer = TestMessages.posting("Spam <Spam@Bad.example>", "ant@example.com", "Hi", "e@example.com");

        assertFalse(rule.check(spammer, metadata, list));
        assertTrue(rule.check(spammer, metadata, TestMessages.list("bannedAddresses", List.of("spam@bad.example"))));
        assertTrue(rule.check(spammer, metadata, TestMessages.list("bannedAddresses", List.of("^.*@bad\\.example$"))));
        assertFalse(rule.check(posting, metadata, TestMessages.list("bannedAddresses", List.of("^.*@bad\\.example$"))));
    }

    @Test
    void memberModeration() {
        MemberModerationRule rule = new MemberModerationRule();
        assertFalse(rule.check(posting, metadata, list));

        MailingList moderated = TestMessages.list("moderatedMembers", List.of("anne@example.com"));
        assertTrue(rule.check(posting, metadata, moderated));
        assertEquals("hold", metadata.getString(Metadata.MODERATION_ACTION));

        metadata.put(Metadata.MODERATOR_APPROVED, true);
        assertFalse(rule.check(posting, metadata, moderated));
    }

    @Test
    void nonmemberModerationSkipsMembersAndModerators() throws IOException {
        NonmemberModerationRule rule = new NonmemberModerationRule();

        assertFalse(rule.check(posting, metadata, list));
        assertFalse(rule.check(TestMessages.posting("dave@example.com", "ant@example.com", "Hi", "f@example.com"), metadata, list));
        assertFalse(rule.check(TestMessages.posting("mod@example.com", "ant@example.com", "Hi", "g@example.com"), metadata, list));
    }

    @Test
    void nonmemberModerationActions() throws IOException {
        NonmemberModerationRule rule = new NonmemberModerationRule();
        MailMessage stranger = TestMessages.posting("zed@example.net", "ant@example.com", "Hi", "h@example.com");

        // Default action.
        assertTrue(rule.check(stranger, metadata, list));
        assertEquals("hold", metadata.getString(Metadata.MODERATION_ACTION));

        assertTrue(rule.check(stranger, metadata, TestMessages.list("defaultNonmemberAction", "discard")));
        assertEquals("discard", metadata.getString(Metadata.MODERATION_ACTION));

        // Address lists win over the default, accept first.
        Map<String, Object> map = TestMessages.listMap();
        map.put("acceptTheseNonmembers", List.of("^.*@example\\.net$"));
        map.put("rejectTheseNonmembers", List.of("zed@example.net"));
        assertTrue(rule.check(stranger, metadata, new MailingList(map)));
        assertEquals("accept", metadata.getString(Metadata.MODERATION_ACTION));

        assertTrue(rule.check(stranger, metadata, TestMessages.list("rejectTheseNonmembers", List.of("zed@example.net"))));
        assertEquals("reject", metadata.getString(Metadata.MODERATION_ACTION));
        assertTrue(metadata.getString(Metadata.MODERATION_REASON).contains("rejectTheseNonmembers"));

        // Approved messages pass.
        metadata.put(Metadata.MODERATOR_APPROVED, true);
        assertFalse(rule.check(stranger, metadata, list));
    }
}
