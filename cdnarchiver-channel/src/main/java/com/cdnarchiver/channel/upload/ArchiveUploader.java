package com.cdnarchiver.channel.upload;

import com.cdnarchiver.channel.routing.RouteDecision;
import com.cdnarchiver.common.errors.ArchiveException;
import com.cdnarchiver.common.errors.UploadFailureException;
import com.cdnarchiver.common.infra.ErrorUtils;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Sends one file to the storage provider.
 * <p>
 * No retries: a caller that retries after an ambiguous failure may create a
 * duplicate remote object.
 */
public interface ArchiveUploader {

    /**
     * @param useFallback deliver through the webhook instead of the bot
     * @return completes with the stored location, or exceptionally with an
     *         {@link ArchiveException} (upload failure or missing credential)
     */
    CompletableFuture<UploadResult> uploadAsync(Path path, String filename, RouteDecision destination,
            UploadCredentials credentials, boolean useFallback);

    /**
     * Blocking variant for callers outside an async flow.
     */
    default UploadResult upload(Path path, String filename, RouteDecision destination,
            UploadCredentials credentials, boolean useFallback) {
        try {
            return uploadAsync(path, filename, destination, credentials, useFallback).join();
        } catch (CompletionException e) {
            Throwable cause = ErrorUtils.unwrap(e);
            if (cause instanceof ArchiveException archiveException) {
                throw archiveException;
            }
            throw new UploadFailureException("Upload failed: " + ErrorUtils.formatErrorMessage(cause), cause);
        }
    }
}
