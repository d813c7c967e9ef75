package com.mimecast.mailroom;

import com.mimecast.mailroom.queue.FileQueueStore;
import com.mimecast.mailroom.queue.QueueNames;
import com.mimecast.mailroom.util.TestMessages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @TempDir
    Path tempDir;

    private Path configDir;

    @BeforeEach
    void setUp() throws IOException {
        configDir = tempDir.resolve("cfg");
        Files.createDirectories(configDir.resolve("lists"));
        Files.writeString(configDir.resolve(Main.CONFIG_FILE), "{\n" +
                "  hostname: \"lists.example.com\",\n" +
                "  queueDir: \"" + tempDir.resolve("queue") + "\",\n" +
                "  ledgerDir: \"" + tempDir.resolve("held") + "\",\n" +
                "  archiveDir: \"" + tempDir.resolve("archives") + "\",\n" +
                "  digestDir: \"" + tempDir.resolve("digests") + "\",\n" +
                "  spoolDir: \"" + tempDir.resolve("outbound") + "\"\n" +
                "}\n");
        Files.writeString(configDir.resolve("lists").resolve("ant.json5"),
                "{name: \"ant@example.com\", members: [\"anne@example.com\"]}");
    }

    @Test
    void help() {
        assertEquals(0, new Main(new String[]{"--help"}).getExitCode());
        assertEquals(0, new Main(new String[]{}).getExitCode());
    }

    @Test
    void unknownOption() {
        assertEquals(2, new Main(new String[]{"--bogus"}).getExitCode());
    }

    @Test
    void injectAndRunOnce() throws IOException {
        Path eml = tempDir.resolve("posting.eml");
        Files.write(eml, TestMessages.memberPosting("cli@example.com").toBytes());

        // when injected
        Main inject = new Main(new String[]{"--config", configDir.toString(), "--inject", eml.toString(),
                "--list", "ant@example.com"});

        // then
        assertEquals(0, inject.getExitCode());
        FileQueueStore store = new FileQueueStore(tempDir.resolve("queue"));
        assertEquals(1L, store.size(QueueNames.IN));

        // when the incoming runner makes one pass
        assertEquals(0, new Main(new String[]{"--config", configDir.toString(), "--runner", "in", "--once"}).getExitCode());

        // then the posting moved on
        assertEquals(0L, store.size(QueueNames.IN));
        assertEquals(1L, store.size(QueueNames.OUT));
    }

    @Test
    void invalidRequests() {
        String config = configDir.toString();

        assertEquals(2, new Main(new String[]{"--config", config, "--inject", "x.eml"}).getExitCode());
        assertEquals(2, new Main(new String[]{"--config", config, "--held", "nobody@example.com"}).getExitCode());
        assertEquals(2, new Main(new String[]{"--config", config, "--resolve", "ant@example.com/0123456789abcdef"}).getExitCode());
        assertEquals(2, new Main(new String[]{"--config", config, "--resolve", "ant@example.com/0123456789abcdef",
                "--disposition", "approve"}).getExitCode());
        assertEquals(2, new Main(new String[]{"--config", config, "--runner", "shunt", "--once"}).getExitCode());
    }

    @Test
    void heldAndUnshunt() {
        String config = configDir.toString();

        assertEquals(0, new Main(new String[]{"--config", config, "--held", "ant@example.com"}).getExitCode());
        assertEquals(0, new Main(new String[]{"--config", config, "--unshunt"}).getExitCode());
    }

    @Test
    void missingConfiguration() {
        Path missing = tempDir.resolve("missing");
        assertEquals(1, new Main(new String[]{"--config", missing.toString(), "--unshunt"}).getExitCode());
    }

    @Test
    void injectUnreadableFile() {
        assertEquals(1, new Main(new String[]{"--config", configDir.toString(), "--inject",
                tempDir.resolve("none.eml").toString(), "--list", "ant@example.com"}).getExitCode());
    }

    @Test
    void postingFileIsRfc822() throws IOException {
        Path eml = tempDir.resolve("raw.eml");
        Files.writeString(eml, "From: anne@example.com\r\nTo: ant@example.com\r\nSubject: Hi\r\n" +
                "Message-ID: <raw@example.com>\r\n\r\nBody\r\n", StandardCharsets.UTF_8);

        assertEquals(0, new Main(new String[]{"--config", configDir.toString(), "--inject", eml.toString(),
                "--list", "ant@example.com", "--owner"}).getExitCode());
    }
}
