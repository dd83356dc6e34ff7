package org.iceforge.cloudfiles.store;

import java.util.Objects;

public record ObjectHandle(ContainerHandle container, String path) {

    public ObjectHandle {
        Objects.requireNonNull(container, "container");
        Objects.requireNonNull(path, "path");
    }

    @Override
    public String toString() {
        return container.name() + "/" + path;
    }
}
