package com.mimecast.mailroom.list;

import com.mimecast.mailroom.config.BasicConfig;
import com.mimecast.mailroom.rules.ChainAction;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Mailing list.
 *
 * <p>Read-only view of one entry of the list configuration feed.
 * <p>Lists are owned by the list management collaborator; the engine never mutates them.
 */
@SuppressWarnings("unchecked")
public class MailingList extends BasicConfig {

    /**
     * Default posting chain name.
     */
    public static final String DEFAULT_CHAIN = "default-posting-chain";

    /**
     * Default posting pipeline name.
     */
    public static final String DEFAULT_PIPELINE = "default-posting-pipeline";

    /**
     * Constructs a new MailingList instance.
     *
     * @param map Configuration map.
     */
    public MailingList(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets fully qualified list name, e.g. {@code ant@example.com}.
     *
     * @return String.
     */
    public String getName() {
        return getStringProperty("name", "").toLowerCase(Locale.ROOT);
    }

    /**
     * Gets the local part of the list name.
     *
     * @return String.
     */
    public String getListName() {
        String name = getName();
        int at = name.indexOf('@');
        return at > 0 ? name.substring(0, at) : name;
    }

    /**
     * Gets the mail host of the list.
     *
     * @return String.
     */
    public String getMailHost() {
        String name = getName();
        int at = name.indexOf('@');
        return at > 0 ? name.substring(at + 1) : "";
    }

    /**
     * Gets the RFC 2919 list identifier.
     *
     * @return String.
     */
    public String getListId() {
        return getStringProperty("listId", getListName() + "." + getMailHost());
    }

    /**
     * Gets display name.
     *
     * @return String.
     */
    public String getDisplayName() {
        return getStringProperty("displayName", getListName());
    }

    /**
     * Gets posting address.
     *
     * @return String.
     */
    public String getPostingAddress() {
        return getName();
    }

    /**
     * Gets request address.
     *
     * @return String.
     */
    public String getRequestAddress() {
        return getListName() + "-request@" + getMailHost();
    }

    /**
     * Gets owner address.
     *
     * @return String.
     */
    public String getOwnerAddress() {
        return getListName() + "-owner@" + getMailHost();
    }

    /**
     * Gets bounces address.
     *
     * @return String.
     */
    public String getBouncesAddress() {
        return getListName() + "-bounces@" + getMailHost();
    }

    /**
     * Gets the posting chain name.
     *
     * @return String.
     */
    public String getPostingChain() {
        return getStringProperty("postingChain", DEFAULT_CHAIN);
    }

    /**
     * Gets the posting pipeline name.
     *
     * @return String.
     */
    public String getPostingPipeline() {
        return getStringProperty("postingPipeline", DEFAULT_PIPELINE);
    }

    /**
     * Gets per list retry limit override.
     *
     * @return Optional of max retries.
     */
    public Optional<Integer> getMaxRetries() {
        return hasProperty("maxRetries")
                ? Optional.of(Math.toIntExact(getLongProperty("maxRetries", 0L)))
                : Optional.empty();
    }

    /**
     * Is the list in emergency moderation.
     *
     * @return Boolean.
     */
    public boolean isEmergency() {
        return getBooleanProperty("emergency", false);
    }

    /**
     * Should administrivia requests sent to the posting address be held.
     *
     * @return Boolean.
     */
    public boolean isAdministrivia() {
        return getBooleanProperty("administrivia", true);
    }

    /**
     * Must the list be named explicitly in To or Cc.
     *
     * @return Boolean.
     */
    public boolean isRequireExplicitDestination() {
        return getBooleanProperty("requireExplicitDestination", true);
    }

    /**
     * Gets acceptable aliases (addresses or ^regexes) for the explicit destination check.
     *
     * @return List of strings.
     */
    public List<String> getAcceptableAliases() {
        return getStringListProperty("acceptableAliases");
    }

    /**
     * Gets maximum message size.
     *
     * @return Kilobytes, 0 for no limit.
     */
    public long getMaxMessageSize() {
        return getLongProperty("maxMessageSize", 40L);
    }

    /**
     * Gets maximum number of explicit recipients.
     *
     * @return Integer, 0 for no limit.
     */
    public int getMaxNumRecipients() {
        return Math.toIntExact(getLongProperty("maxNumRecipients", 10L));
    }

    /**
     * Gets subject prefix.
     *
     * @return String, may be empty.
     */
    public String getSubjectPrefix() {
        return getStringProperty("subjectPrefix", "[" + getDisplayName() + "] ");
    }

    /**
     * Gets regular delivery members.
     *
     * @return Lower cased addresses.
     */
    public List<String> getMembers() {
        return lower(getStringListProperty("members"));
    }

    /**
     * Gets digest delivery members.
     *
     * @return Lower cased addresses.
     */
    public List<String> getDigestMembers() {
        return lower(getStringListProperty("digestMembers"));
    }

    /**
     * Gets members whose postings are moderated.
     *
     * @return Lower cased addresses.
     */
    public List<String> getModeratedMembers() {
        return lower(getStringListProperty("moderatedMembers"));
    }

    /**
     * Gets moderator addresses.
     *
     * @return Lower cased addresses.
     */
    public List<String> getModerators() {
        return lower(getStringListProperty("moderators"));
    }

    /**
     * Checks if address is a regular or digest member.
     *
     * @param address Email address.
     * @return Boolean.
     */
    public boolean isMember(String address) {
        if (address == null) {
            return false;
        }
        String lowered = address.toLowerCase(Locale.ROOT);
        return getMembers().contains(lowered) || getDigestMembers().contains(lowered);
    }

    /**
     * Gets the action applied to moderated member postings.
     *
     * @return ChainAction.
     */
    public ChainAction getDefaultMemberAction() {
        return ChainAction.fromString(getStringProperty("defaultMemberAction", "hold"));
    }

    /**
     * Gets the action applied to nonmember postings not matched by any address list.
     *
     * @return ChainAction.
     */
    public ChainAction getDefaultNonmemberAction() {
        return ChainAction.fromString(getStringProperty("defaultNonmemberAction", "hold"));
    }

    /**
     * Gets nonmember patterns for the given action.
     * <p>Keys: {@code acceptTheseNonmembers}, {@code holdTheseNonmembers},
     * {@code rejectTheseNonmembers}, {@code discardTheseNonmembers}.
     *
     * @param key Property key.
     * @return Addresses or ^regexes.
     */
    public List<String> getNonmemberPatterns(String key) {
        return getStringListProperty(key);
    }

    /**
     * Gets banned address patterns.
     *
     * @return Addresses or ^regexes.
     */
    public List<String> getBannedAddresses() {
        return getStringListProperty("bannedAddresses");
    }

    /**
     * Gets header match definitions.
     * <p>Each entry is a map with {@code header} and {@code pattern}.
     *
     * @return List of maps.
     */
    public List<Map<String, Object>> getHeaderMatches() {
        List<Map<String, Object>> list = new ArrayList<>();
        for (Object object : getListProperty("headerMatches")) {
            if (object instanceof Map) {
                list.add((Map<String, Object>) object);
            }
        }
        return list;
    }

    /**
     * Gets suspicious header lines in {@code header: regex} form.
     *
     * @return List of strings.
     */
    public List<String> getBounceMatchingHeaders() {
        return getStringListProperty("bounceMatchingHeaders");
    }

    /**
     * Gets spam score threshold for the spam-check rule.
     *
     * @return Double.
     */
    public double getSpamScoreThreshold() {
        return getDoubleProperty("spamScoreThreshold", 5.0D);
    }

    /**
     * Is archiving enabled.
     *
     * @return Boolean.
     */
    public boolean isArchive() {
        return !"never".equalsIgnoreCase(getStringProperty("archivePolicy", "public"));
    }

    /**
     * Are digests enabled.
     *
     * @return Boolean.
     */
    public boolean isDigestsEnabled() {
        return getBooleanProperty("digestsEnabled", true);
    }

    /**
     * Gets digest size threshold.
     *
     * @return Kilobytes.
     */
    public double getDigestSizeThreshold() {
        return getDoubleProperty("digestSizeThreshold", 30.0D);
    }

    /**
     * Gets the maximum number of days a message may stay held.
     *
     * @return Days, 0 to keep forever.
     */
    public int getMaxDaysToHold() {
        return Math.toIntExact(getLongProperty("maxDaysToHold", 0L));
    }

    /**
     * Should RFC 2369 List-* headers be added.
     *
     * @return Boolean.
     */
    public boolean isIncludeRfc2369Headers() {
        return getBooleanProperty("includeRfc2369Headers", true);
    }

    private static List<String> lower(List<String> list) {
        List<String> lowered = new ArrayList<>(list.size());
        for (String s : list) {
            lowered.add(s.toLowerCase(Locale.ROOT));
        }
        return lowered;
    }

    @Override
    public String toString() {
        return getName();
    }
}
