package org.iceforge.cloudfiles.store.s3;

import org.iceforge.cloudfiles.store.DependencyUnavailableException;
import org.iceforge.cloudfiles.store.RemoteStoreClient;
import org.iceforge.cloudfiles.store.spi.RemoteStoreContext;
import org.iceforge.cloudfiles.store.spi.RemoteStoreProvider;

/**
 * Default provider. Talks to any S3-compatible object store through the AWS SDK.
 */
public final class S3RemoteStoreProvider implements RemoteStoreProvider {

    static final String SDK_CLASS = "software.amazon.awssdk.services.s3.S3Client";

    @Override
    public String id() {
        return "s3";
    }

    /** Supports everything unless the SDK is missing; a more specific provider can still claim a context. */
    @Override
    public boolean supports(RemoteStoreContext context) {
        return sdkAvailable();
    }

    @Override
    public RemoteStoreClient client(RemoteStoreContext context) {
        if (!sdkAvailable()) {
            throw new DependencyUnavailableException("AWS SDK for S3 is not on the classpath"
                    + " (you may need to add the software.amazon.awssdk:s3 dependency)");
        }
        return new S3RemoteStoreClient(context);
    }

    static boolean sdkAvailable() {
        try {
            Class.forName(SDK_CLASS, false, S3RemoteStoreProvider.class.getClassLoader());
            return true;
        } catch (ClassNotFoundException | LinkageError e) {
            return false;
        }
    }
}
