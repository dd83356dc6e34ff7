package org.iceforge.cloudfiles.attachment;

import java.util.Objects;

/**
 * Container name option: fixed, or computed from the attachment at activation.
 */
@FunctionalInterface
public interface ContainerNameSource<T> {

    String containerName(AttachmentContext<T> attachment);

    static <T> ContainerNameSource<T> of(String name) {
        Objects.requireNonNull(name, "name");
        return attachment -> name;
    }
}
