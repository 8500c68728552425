package com.cdnarchiver.channel.discord;

import com.cdnarchiver.channel.upload.UploadCredentials;
import com.cdnarchiver.common.errors.AttachmentNotFoundException;
import com.cdnarchiver.common.errors.ConfigurationException;
import com.cdnarchiver.common.errors.UploadFailureException;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DiscordRehydratorTest {

    private static final UploadCredentials BOT = new UploadCredentials("test-bot-token-0123456789", null);

    private MockWebServer server;
    private DiscordRehydrator rehydrator;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        rehydrator = new DiscordRehydrator(new DiscordHttp(DiscordHttp.defaultClient(), new ObjectMapper(),
                server.url("/api/v10").toString()));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private void enqueueMessage(String body) {
        server.enqueue(new MockResponse().setBody("{\"id\":\"bot-user\"}"));
        server.enqueue(new MockResponse().setBody(body));
    }

    @Test
    void returnsFreshUrlOfFirstAttachment() throws Exception {
        enqueueMessage("{\"id\":\"m1\",\"channel_id\":\"1001\",\"attachments\":["
                + "{\"id\":\"a1\",\"filename\":\"cat.jpg\",\"url\":\"https://cdn.example/a1?ex=2\"},"
                + "{\"id\":\"a2\",\"filename\":\"dog.jpg\",\"url\":\"https://cdn.example/a2?ex=2\"}]}");

        DiscordAttachment attachment = rehydrator.fetchAttachment("m1", "1001", BOT, null);

        assertEquals("a1", attachment.id());
        assertEquals("https://cdn.example/a1?ex=2", attachment.url());
        assertEquals("cat.jpg", attachment.filename());
        server.takeRequest(1, TimeUnit.SECONDS);
        assertEquals("/api/v10/channels/1001/messages/m1", server.takeRequest(1, TimeUnit.SECONDS).getPath());
    }

    @Test
    void selectsRequestedAttachment() {
        enqueueMessage("{\"id\":\"m1\",\"attachments\":["
                + "{\"id\":\"a1\",\"url\":\"u1\"},{\"id\":\"a2\",\"url\":\"u2\"}]}");
        assertEquals("u2", rehydrator.fetchAttachment("m1", "1001", BOT, "a2").url());
    }

    @Test
    void absentAttachmentIsNotFound() {
        enqueueMessage("{\"id\":\"m1\",\"attachments\":[{\"id\":\"a1\",\"url\":\"u1\"}]}");
        assertThrows(AttachmentNotFoundException.class,
                () -> rehydrator.fetchAttachment("m1", "1001", BOT, "a9"));
    }

    @Test
    void messageWithoutAttachmentsIsNotFound() {
        enqueueMessage("{\"id\":\"m1\",\"attachments\":[]}");
        assertThrows(AttachmentNotFoundException.class,
                () -> rehydrator.fetchAttachment("m1", "1001", BOT, null));
    }

    @Test
    void deletedMessageIsNotFound() {
        server.enqueue(new MockResponse().setBody("{\"id\":\"bot-user\"}"));
        server.enqueue(new MockResponse().setResponseCode(404).setBody("{\"message\":\"Unknown Message\"}"));
        assertThrows(AttachmentNotFoundException.class,
                () -> rehydrator.fetchAttachment("m1", "1001", BOT, null));
    }

    @Test
    void providerOutageIsUploadFailure() {
        server.enqueue(new MockResponse().setBody("{\"id\":\"bot-user\"}"));
        server.enqueue(new MockResponse().setResponseCode(503).setBody("unavailable"));
        assertThrows(UploadFailureException.class,
                () -> rehydrator.fetchAttachment("m1", "1001", BOT, null));
    }

    @Test
    void requiresBotToken() {
        assertThrows(ConfigurationException.class,
                () -> rehydrator.fetchAttachment("m1", "1001", new UploadCredentials(null, "https://hook"), null));
        assertEquals(0, server.getRequestCount());
    }
}
