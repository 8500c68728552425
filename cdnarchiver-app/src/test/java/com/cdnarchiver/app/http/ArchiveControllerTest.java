package com.cdnarchiver.app.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Full stack: MockMvc -> controller -> ArchiveService -> SQLite manifest,
 * with Discord replaced by a MockWebServer.
 */
@SpringBootTest
@AutoConfigureMockMvc
class ArchiveControllerTest {

    private static final String API_TOKEN = "test-api-token";
    private static final Pattern SEND = Pattern.compile("/api/v10/channels/(\\d+)/messages");
    private static final Pattern FETCH = Pattern.compile("/api/v10/channels/(\\d+)/messages/(m\\d+)");

    private static final MockWebServer DISCORD = new MockWebServer();
    private static final AtomicInteger MESSAGES = new AtomicInteger();
    private static final AtomicInteger UPLOADS = new AtomicInteger();

    @Autowired
    private MockMvc mvc;

    @Autowired
    private ObjectMapper objectMapper;

    @DynamicPropertySource
    static void archiverProperties(DynamicPropertyRegistry registry) throws IOException {
        DISCORD.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                return discord(request);
            }
        });
        DISCORD.start();

        Path dir = Files.createTempDirectory("archive-controller-test");
        Path routes = Files.writeString(dir.resolve("routes.yaml"), """
                routes:
                  images:
                    public: { channel_id: "1000" }
                  docs:
                    public: { channel_id: "3000" }
                """);
        registry.add("ARCHIVE_ROUTES_PATH", routes::toString);
        registry.add("ARCHIVE_DB_PATH", () -> dir.resolve("manifest.db").toString());
        registry.add("ARCHIVE_API_TOKEN", () -> API_TOKEN);
        registry.add("DISCORD_BOT_TOKEN", () -> "test-bot-token-0123456789");
        registry.add("DISCORD_API_BASE", () -> DISCORD.url("/api/v10").toString());
    }

    @AfterAll
    static void stopDiscord() throws IOException {
        DISCORD.shutdown();
    }

    private static MockResponse discord(RecordedRequest request) {
        String path = request.getPath();
        if (path.endsWith("/users/@me")) {
            return json("{\"id\":\"bot-user\"}");
        }
        Matcher fetch = FETCH.matcher(path);
        if ("GET".equals(request.getMethod()) && fetch.matches()) {
            String messageId = fetch.group(2);
            String n = messageId.substring(1);
            return json("{\"id\":\"" + messageId + "\",\"channel_id\":\"" + fetch.group(1) + "\",\"attachments\":["
                    + "{\"id\":\"a" + n + "\",\"filename\":\"x\",\"url\":\"https://cdn.example/fresh/a" + n + "\"}]}");
        }
        Matcher send = SEND.matcher(path);
        if ("POST".equals(request.getMethod()) && send.matches()) {
            UPLOADS.incrementAndGet();
            int n = MESSAGES.incrementAndGet();
            return json("{\"id\":\"m" + n + "\",\"channel_id\":\"" + send.group(1) + "\",\"attachments\":["
                    + "{\"id\":\"a" + n + "\",\"filename\":\"x\",\"url\":\"https://cdn.example/a" + n + "?ex=1\"}]}");
        }
        return new MockResponse().setResponseCode(404).setBody("{\"message\":\"Unknown\"}");
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private static byte[] png(int seed) {
        BufferedImage img = new BufferedImage(16, 16, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < 16; y++) {
            for (int x = 0; x < 16; x++) {
                img.setRGB(x, y, (seed * 7919 + x * 31 + y) & 0xFFFFFF);
            }
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            ImageIO.write(img, "png", out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    private MvcResult post(String filename, byte[] bytes, String meta, String token, int expectedStatus)
            throws Exception {
        var request = multipart("/archive")
                .file(new MockMultipartFile("file", filename, "application/octet-stream", bytes));
        if (meta != null) {
            request.file(new MockMultipartFile("meta", "", MediaType.APPLICATION_JSON_VALUE,
                    meta.getBytes(StandardCharsets.UTF_8)));
        }
        if (token != null) {
            request.header("Authorization", "Bearer " + token);
        }
        return mvc.perform(request).andExpect(status().is(expectedStatus)).andReturn();
    }

    private JsonNode body(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    // =========================================================================
    // Tests
    // =========================================================================

    @Test
    void archiveRequiresBearerToken() throws Exception {
        JsonNode missing = body(post("cat.png", png(1), null, null, 401));
        assertEquals("unauthorized", missing.path("error").path("kind").asText());
        post("cat.png", png(1), null, "wrong", 401);
    }

    @Test
    void archiveThenDedupThenRehydrate() throws Exception {
        byte[] bytes = png(2);
        int uploadsBefore = UPLOADS.get();

        JsonNode first = body(post("cat.png", bytes, "{\"tags\":[\"cats\",\"pets\"],\"tenant\":\"t1\"}",
                API_TOKEN, 200));
        String hash = first.path("content_hash").asText();
        assertEquals(64, hash.length());
        assertFalse(first.path("cache_hit").asBoolean());
        assertEquals("cat.png", first.path("filename").asText());
        assertEquals("images", first.path("media_type").asText());
        assertEquals("1000", first.path("channel_id").asText());
        assertEquals("t1", first.path("tenant").asText());
        assertEquals(bytes.length, first.path("compression").path("original_size").asLong());

        JsonNode second = body(post("again.png", bytes, null, API_TOKEN, 200));
        assertTrue(second.path("cache_hit").asBoolean());
        assertEquals(hash, second.path("content_hash").asText());
        assertEquals(first.path("message_id").asText(), second.path("message_id").asText());
        assertEquals(uploadsBefore + 1, UPLOADS.get());

        JsonNode link = body(mvc.perform(get("/archive/" + hash)).andExpect(status().isOk()).andReturn());
        String attachment = first.path("attachment_ids").get(0).asText();
        assertEquals("https://cdn.example/fresh/" + attachment, link.path("url").asText());
        assertEquals("cat.png", link.path("filename").asText());
    }

    @Test
    void unknownHashIs404() throws Exception {
        JsonNode error = body(mvc.perform(get("/archive/0000")).andExpect(status().isNotFound()).andReturn());
        assertEquals("not_found", error.path("error").path("kind").asText());
        assertFalse(error.path("error").path("retryable").asBoolean());
    }

    @Test
    void searchAndRetag() throws Exception {
        JsonNode archived = body(post("dog.png", png(3), "{\"tags\":[\"dogs-searchable\"]}", API_TOKEN, 200));
        String hash = archived.path("content_hash").asText();

        JsonNode results = body(mvc.perform(get("/archive/search").param("tag", "searchable"))
                .andExpect(status().isOk()).andReturn());
        assertEquals(1, results.size());
        assertEquals(hash, results.get(0).path("content_hash").asText());
        assertEquals("dog.png", results.get(0).path("filename").asText());

        mvc.perform(patch("/archive/" + hash + "/tags").contentType(MediaType.APPLICATION_JSON)
                .content("{\"tags\":[\"x\"]}")).andExpect(status().isUnauthorized());

        JsonNode updated = body(mvc.perform(patch("/archive/" + hash + "/tags")
                .header("Authorization", "Bearer " + API_TOKEN)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tags\":[\"renamed\"]}")).andExpect(status().isOk()).andReturn());
        assertEquals("renamed", updated.path("tags").get(0).asText());
        assertEquals(archived.path("message_id").asText(), updated.path("message_id").asText());
    }

    @Test
    void searchRequiresTag() throws Exception {
        mvc.perform(get("/archive/search")).andExpect(status().isBadRequest());
    }

    @Test
    void policyDenialIs422WithReasons() throws Exception {
        JsonNode error = body(post("virus.exe", new byte[8], "{\"do_not_archive\":true}", API_TOKEN, 422));
        assertEquals("policy_denied", error.path("error").path("kind").asText());
        assertEquals(2, error.path("error").path("reasons").size());
    }

    @Test
    void malformedMetaIs400() throws Exception {
        JsonNode error = body(post("cat.png", png(4), "{not json", API_TOKEN, 400));
        assertEquals("bad_request", error.path("error").path("kind").asText());
    }

    @Test
    void healthReportsManifest() throws Exception {
        JsonNode health = body(mvc.perform(get("/health")).andExpect(status().isOk()).andReturn());
        assertEquals("ok", health.path("status").asText());
        assertTrue(health.path("archiver_enabled").asBoolean());
        assertTrue(health.path("manifest").path("reachable").asBoolean());
        assertTrue(health.path("manifest").has("records"));
    }
}
