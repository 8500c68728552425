package com.cdnarchiver.app.config;

import com.cdnarchiver.channel.discord.DiscordHttp;
import com.cdnarchiver.channel.discord.DiscordRehydrator;
import com.cdnarchiver.channel.discord.DiscordUploader;
import com.cdnarchiver.channel.limits.UploadSizeLimits;
import com.cdnarchiver.channel.rehydrate.AttachmentRehydrator;
import com.cdnarchiver.channel.routing.ChannelRouter;
import com.cdnarchiver.channel.routing.RouteTable;
import com.cdnarchiver.channel.routing.RouteTableLoader;
import com.cdnarchiver.channel.upload.ArchiveUploader;
import com.cdnarchiver.common.config.ArchiverEnv;
import com.cdnarchiver.core.archive.ArchiveService;
import com.cdnarchiver.core.policy.ContentPolicy;
import com.cdnarchiver.core.policy.FilenamePatternContentPolicy;
import com.cdnarchiver.core.policy.PolicyEngine;
import com.cdnarchiver.manifest.ArchiveManifest;
import com.cdnarchiver.media.cleanup.CleanupManager;
import com.cdnarchiver.media.compress.MediaCompressor;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.time.Clock;

/**
 * Spring wiring for the archiver components.
 * <p>
 * Settings are looked up through Spring's {@link Environment}, so OS
 * environment variables, system properties and application.yml all apply.
 * A missing route table fails start-up.
 */
@Slf4j
@Configuration
public class ArchiverBeanConfig {

    @Bean
    public ArchiverEnv archiverEnv(Environment environment) {
        return new ArchiverEnv(environment::getProperty);
    }

    @Bean
    public RouteTable routeTable(ArchiverEnv env) {
        return RouteTableLoader.load(env.routesPath());
    }

    @Bean
    public ChannelRouter channelRouter(RouteTable routeTable) {
        return new ChannelRouter(routeTable);
    }

    @Bean
    public UploadSizeLimits uploadSizeLimits(ArchiverEnv env) {
        return new UploadSizeLimits(env);
    }

    @Bean
    public MediaCompressor mediaCompressor() {
        return new MediaCompressor();
    }

    @Bean
    public CleanupManager cleanupManager() {
        return new CleanupManager();
    }

    @Bean
    public ArchiveManifest archiveManifest(ArchiverEnv env, ObjectMapper objectMapper) {
        return new ArchiveManifest(env.manifestPath(), objectMapper, Clock.systemUTC());
    }

    @Bean
    public ContentPolicy contentPolicy(ArchiverEnv env) {
        return FilenamePatternContentPolicy.fromEnv(env);
    }

    @Bean
    public PolicyEngine policyEngine(ArchiverEnv env, ContentPolicy contentPolicy) {
        return new PolicyEngine(env, contentPolicy);
    }

    @Bean
    public DiscordHttp discordHttp(ArchiverEnv env, ObjectMapper objectMapper) {
        log.info("Discord API base: {}", env.apiBase());
        return new DiscordHttp(DiscordHttp.defaultClient(), objectMapper, env.apiBase());
    }

    @Bean
    public ArchiveUploader archiveUploader(DiscordHttp discordHttp) {
        return new DiscordUploader(discordHttp);
    }

    @Bean
    public AttachmentRehydrator attachmentRehydrator(DiscordHttp discordHttp) {
        return new DiscordRehydrator(discordHttp);
    }

    @Bean
    public ArchiveService archiveService(ArchiverEnv env, PolicyEngine policyEngine, ChannelRouter channelRouter,
            UploadSizeLimits uploadSizeLimits, MediaCompressor mediaCompressor, ArchiveManifest archiveManifest,
            ArchiveUploader archiveUploader, AttachmentRehydrator attachmentRehydrator,
            CleanupManager cleanupManager) {
        if (env.apiToken() == null) {
            log.warn("{} is not set; POST /archive will reject every request", ArchiverEnv.API_TOKEN);
        }
        return new ArchiveService(env, policyEngine, channelRouter, uploadSizeLimits, mediaCompressor,
                archiveManifest, archiveUploader, attachmentRehydrator, cleanupManager);
    }
}
