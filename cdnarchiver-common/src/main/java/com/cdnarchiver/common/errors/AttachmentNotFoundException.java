package com.cdnarchiver.common.errors;

/**
 * The provider message exists but no longer carries the requested attachment.
 */
public class AttachmentNotFoundException extends ArchiveException {

    public AttachmentNotFoundException(String messageId, String attachmentId) {
        super(ArchiveErrorKind.NOT_FOUND, attachmentId != null
                ? "Attachment " + attachmentId + " not found on message " + messageId
                : "Message " + messageId + " has no attachments");
    }
}
