package com.cdnarchiver.channel.routing;

import com.cdnarchiver.common.errors.ConfigurationException;
import com.cdnarchiver.common.model.ArchiveMeta;
import com.cdnarchiver.media.MediaKind;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ChannelRouterTest {

    private final ChannelRouter router =
            new ChannelRouter(RouteTableLoader.load(RouteTableLoaderTest.resource("archive_routes.yaml")));

    @Test
    void defaultRouteForKindAndVisibility() {
        RouteDecision decision = router.pickChannel(Path.of("/tmp/cat.png"), ArchiveMeta.empty());
        assertEquals("1000", decision.channelId());
        assertEquals("1001", decision.deliveryChannelId());
        assertEquals("900", decision.targetId());
    }

    @Test
    void tenantOverrideWins() {
        ArchiveMeta meta = ArchiveMeta.builder().tenant("acme").build();
        RouteDecision decision = router.pickChannel(Path.of("/tmp/cat.png"), meta);
        assertEquals("7000", decision.channelId());
        assertNull(decision.threadId());
    }

    @Test
    void tenantWithoutOverrideFallsBackToDefault() {
        ArchiveMeta meta = ArchiveMeta.builder().tenant("globex").build();
        assertEquals("1000", router.pickChannel(Path.of("/tmp/cat.png"), meta).channelId());
    }

    @Test
    void visibilityIsPartOfTheKey() {
        ArchiveMeta meta = ArchiveMeta.builder().visibility("private").build();
        assertEquals("1100", router.pickChannel(Path.of("/tmp/cat.png"), meta).channelId());
    }

    @Test
    void missingPairIsConfigurationError() {
        ArchiveMeta meta = ArchiveMeta.builder().visibility("private").build();
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> router.pickChannel(Path.of("/tmp/clip.mp4"), meta));
        assertTrue(e.getMessage().contains("videos/private"));
    }

    @Test
    void explicitMediaTypeBeatsExtension() {
        ArchiveMeta meta = ArchiveMeta.builder().mediaType("videos").build();
        assertEquals(MediaKind.VIDEOS, ChannelRouter.kindFor(Path.of("/tmp/upload.bin"), meta));
        assertEquals("2000", router.pickChannel(Path.of("/tmp/upload.bin"), meta).channelId());
    }

    @Test
    void originalFilenameBeatsTempName() {
        ArchiveMeta meta = ArchiveMeta.builder().filename("report.pdf").build();
        assertEquals(MediaKind.DOCS, ChannelRouter.kindFor(Path.of("/tmp/upload-123.tmp"), meta));
    }
}
