package com.cdnarchiver.core.archive;

import com.cdnarchiver.channel.discord.DiscordAttachment;
import com.cdnarchiver.channel.routing.RouteDecision;
import com.cdnarchiver.channel.upload.ArchiveUploader;
import com.cdnarchiver.channel.upload.UploadCredentials;
import com.cdnarchiver.channel.upload.UploadResult;
import com.cdnarchiver.common.errors.UploadFailureException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory uploader that records every call and hands out sequential ids.
 */
class RecordingUploader implements ArchiveUploader {

    record Call(String filename, long size, RouteDecision destination, boolean useFallback) {
    }

    final List<Call> calls = new CopyOnWriteArrayList<>();
    private final AtomicInteger sequence = new AtomicInteger();
    volatile boolean failing;
    volatile long delayMillis;

    @Override
    public CompletableFuture<UploadResult> uploadAsync(Path path, String filename, RouteDecision destination,
            UploadCredentials credentials, boolean useFallback) {
        if (failing) {
            return CompletableFuture.failedFuture(new UploadFailureException("Discord upload failed: HTTP 503"));
        }
        long size;
        try {
            size = Files.size(path);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        pause();
        calls.add(new Call(filename, size, destination, useFallback));
        int n = sequence.incrementAndGet();
        String channelId = destination.deliveryChannelId();
        DiscordAttachment attachment = new DiscordAttachment("att-" + n,
                "https://cdn.example/attachments/" + channelId + "/att-" + n + "/" + filename + "?ex=1",
                null, filename, size, null);
        return CompletableFuture.completedFuture(new UploadResult("msg-" + n, channelId, List.of(attachment)));
    }

    private void pause() {
        if (delayMillis > 0) {
            try {
                Thread.sleep(delayMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
