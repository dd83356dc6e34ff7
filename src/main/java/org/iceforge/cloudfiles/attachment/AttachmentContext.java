package org.iceforge.cloudfiles.attachment;

/**
 * What the host attachment framework tells the storage backend about one attachment.
 * Object paths are computed by the host from its own path template.
 *
 * @param <T> type of the record owning the attachment
 */
public interface AttachmentContext<T> {

    /** Attachment name on the owning record, e.g. {@code avatar}. */
    String name();

    T owner();

    String defaultStyle();

    /** Object path for a style, e.g. {@code avatars/42/thumb/me.png}. */
    String path(String style);
}
