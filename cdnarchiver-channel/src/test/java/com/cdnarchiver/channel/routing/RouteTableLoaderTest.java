package com.cdnarchiver.channel.routing;

import com.cdnarchiver.common.errors.ArchiveErrorKind;
import com.cdnarchiver.common.errors.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class RouteTableLoaderTest {

    static Path resource(String name) {
        try {
            return Path.of(RouteTableLoaderTest.class.getResource("/routes/" + name).toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    @Test
    void loadsDefaultsAndTenantOverrides() {
        RouteTable table = RouteTableLoader.load(resource("archive_routes.yaml"));

        assertEquals(4, table.size());
        RouteDecision images = table.defaultRoute("images", "public").orElseThrow();
        assertEquals("1000", images.channelId());
        assertEquals("1001", images.threadId());
        assertEquals("900", images.guildId());
        assertNull(images.webhookUrl());

        assertEquals("7000", table.tenantRoute("acme", "images", "public").orElseThrow().channelId());
        assertTrue(table.tenantRoute("acme", "videos", "public").isEmpty());
        assertTrue(table.tenantRoute(null, "images", "public").isEmpty());
        assertEquals("https://discord.com/api/webhooks/42/route-secret",
                table.defaultRoute("docs", "public").orElseThrow().webhookUrl());
    }

    @Test
    void acceptsJsonDocuments() {
        RouteTable table = RouteTableLoader.load(resource("archive_routes.json"));
        assertEquals("4000", table.defaultRoute("audio", "public").orElseThrow().channelId());
    }

    @Test
    void missingFileIsConfigurationError(@TempDir Path dir) {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> RouteTableLoader.load(dir.resolve("nope.yaml")));
        assertEquals(ArchiveErrorKind.CONFIGURATION, e.getKind());
    }

    @Test
    void entryWithoutChannelIsRejected() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> RouteTableLoader.load(resource("missing_channel.yaml")));
        assertTrue(e.getMessage().contains("routes.images.public"));
    }

    @Test
    void documentWithoutRoutesIsRejected() {
        assertThrows(ConfigurationException.class, () -> RouteTableLoader.load(resource("no_routes.yaml")));
    }

    @Test
    void unparsableFileIsRejected(@TempDir Path dir) throws IOException {
        Path broken = Files.writeString(dir.resolve("broken.yaml"), "routes: [unterminated");
        assertThrows(ConfigurationException.class, () -> RouteTableLoader.load(broken));
    }
}
