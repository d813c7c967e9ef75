package com.mimecast.mailroom.queue;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.ToNumberPolicy;
import com.google.gson.reflect.TypeToken;
import com.mimecast.mailroom.mime.MailMessage;
import org.apache.commons.codec.binary.Base64;
import org.apache.commons.codec.digest.DigestUtils;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Queue record codec.
 *
 * <p>Records are UTF-8 JSON documents:
 * <pre>
 * {"format":"mailroom-entry","version":1,"checksum":"...","metadata":"{...}","message":"base64..."}
 * </pre>
 * <p>Metadata is embedded as a JSON string so the checksum covers exactly the bytes written.
 * <p>Unknown format, unsupported version, checksum mismatch or an unparsable message are all
 * reported as {@link CorruptEntryException}.
 */
public final class QueueRecordCodec {

    public static final String FORMAT = "mailroom-entry";
    public static final int VERSION = 1;

    private static final Gson GSON = new GsonBuilder()
            .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
            .serializeNulls()
            .create();

    private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

    /**
     * Decoded record.
     */
    public static final class Record {
        private final MailMessage message;
        private final Metadata metadata;

        Record(MailMessage message, Metadata metadata) {
            this.message = message;
            this.metadata = metadata;
        }

        public MailMessage getMessage() {
            return message;
        }

        public Metadata getMetadata() {
            return metadata;
        }
    }

    private QueueRecordCodec() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Encodes a message and its metadata.
     *
     * @param message  Message.
     * @param metadata Metadata.
     * @return Record bytes.
     */
    public static byte[] encode(MailMessage message, Metadata metadata) {
        String metadataJson = GSON.toJson(metadata.asMap());
        String messageB64 = Base64.encodeBase64String(message.toBytes());

        JsonObject record = new JsonObject();
        record.addProperty("format", FORMAT);
        record.addProperty("version", VERSION);
        record.addProperty("checksum", checksum(metadataJson, messageB64));
        record.addProperty("metadata", metadataJson);
        record.addProperty("message", messageB64);
        return GSON.toJson(record).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Decodes record bytes.
     *
     * @param bytes Record bytes.
     * @return Record instance.
     * @throws CorruptEntryException Record cannot be trusted.
     */
    public static Record decode(byte[] bytes) throws CorruptEntryException {
        JsonObject record;
        try {
            record = JsonParser.parseString(new String(bytes, StandardCharsets.UTF_8)).getAsJsonObject();
        } catch (JsonParseException | IllegalStateException e) {
            throw new CorruptEntryException("Record is not a JSON object", e);
        }

        String metadataJson;
        String messageB64;
        try {
            if (!record.has("format") || !FORMAT.equals(record.get("format").getAsString())) {
                throw new CorruptEntryException("Unknown record format");
            }
            int version = record.has("version") ? record.get("version").getAsInt() : -1;
            if (version != VERSION) {
                throw new CorruptEntryException("Unsupported record version: " + version);
            }
            if (!record.has("metadata") || !record.has("message") || !record.has("checksum")) {
                throw new CorruptEntryException("Record is missing fields");
            }

            metadataJson = record.get("metadata").getAsString();
            messageB64 = record.get("message").getAsString();
            if (!checksum(metadataJson, messageB64).equals(record.get("checksum").getAsString())) {
                throw new CorruptEntryException("Record checksum mismatch");
            }
        } catch (UnsupportedOperationException | IllegalStateException | NumberFormatException e) {
            throw new CorruptEntryException("Record fields have unexpected types", e);
        }

        try {
            Map<String, Object> map = GSON.fromJson(metadataJson, MAP_TYPE);
            MailMessage message = MailMessage.parse(Base64.decodeBase64(messageB64));
            return new Record(message, new Metadata(map));
        } catch (JsonParseException | IOException e) {
            throw new CorruptEntryException("Record payload is undecodable: " + e.getMessage(), e);
        }
    }

    private static String checksum(String metadataJson, String messageB64) {
        return DigestUtils.sha256Hex(metadataJson + "\n" + messageB64);
    }
}
