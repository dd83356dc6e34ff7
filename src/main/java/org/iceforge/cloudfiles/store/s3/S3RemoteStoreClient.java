package org.iceforge.cloudfiles.store.s3;

import org.iceforge.cloudfiles.store.RemoteServiceException;
import org.iceforge.cloudfiles.store.RemoteStoreClient;
import org.iceforge.cloudfiles.store.RemoteStoreSession;
import org.iceforge.cloudfiles.store.spi.RemoteStoreContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.http.apache.ApacheHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;
import java.util.Optional;

/**
 * Builds one {@link S3Client} per authenticated session. The account user name is the access key
 * id and the API key is the secret.
 * <p>
 * Endpoint selection: the internal endpoint when {@code useServiceNet} is set and one is
 * configured, else the credentials' {@code authUrl}, else the context's endpoint override,
 * else the SDK's regional default.
 */
public class S3RemoteStoreClient implements RemoteStoreClient {
    private static final Logger logger = LoggerFactory.getLogger(S3RemoteStoreClient.class);

    static final String DEFAULT_REGION = "us-east-1";

    private final RemoteStoreContext ctx;

    public S3RemoteStoreClient(RemoteStoreContext ctx) {
        this.ctx = ctx;
    }

    @Override
    public RemoteStoreSession authenticate(String username, String apiKey, boolean useServiceNet, URI authUrl) {
        Optional<URI> endpoint = endpointFor(useServiceNet, authUrl);
        String region = ctx.region().orElse(DEFAULT_REGION);
        try {
            S3ClientBuilder b = S3Client.builder()
                    .credentialsProvider(StaticCredentialsProvider.create(AwsBasicCredentials.create(username, apiKey)))
                    .region(Region.of(region))
                    .httpClientBuilder(ApacheHttpClient.builder())
                    .serviceConfiguration(S3Configuration.builder()
                            .pathStyleAccessEnabled(ctx.pathStyleAccess())
                            .build());

            endpoint.ifPresent(b::endpointOverride);
            ctx.apiTimeout().ifPresent(t -> b.overrideConfiguration(ClientOverrideConfiguration.builder()
                    .apiCallTimeout(t)
                    .build()));

            S3Client s3 = b.build();
            logger.info("Opened S3 session for user={} region={} endpoint={}",
                    username, region, endpoint.map(URI::toString).orElse("<default>"));
            return new S3RemoteStoreSession(s3, cdnTemplate(endpoint, region), region);
        } catch (SdkException | IllegalArgumentException e) {
            logger.error("S3 client setup failed for user={}", username, e);
            throw new RemoteServiceException("authenticate failed for user " + username, e);
        }
    }

    Optional<URI> endpointFor(boolean useServiceNet, URI authUrl) {
        if (useServiceNet) {
            if (ctx.internalEndpoint().isPresent()) return ctx.internalEndpoint();
            logger.warn("servicenet requested but no internal endpoint is configured; using the public endpoint");
        }
        if (authUrl != null) return Optional.of(authUrl);
        return ctx.endpointOverride();
    }

    /** Public base for objects of a container, see {@link S3RemoteStoreSession#CONTAINER_PLACEHOLDER}. */
    String cdnTemplate(Optional<URI> endpoint, String region) {
        if (ctx.cdnBaseUrl().isPresent()) {
            return trimSlash(ctx.cdnBaseUrl().get());
        }
        if (endpoint.isPresent()) {
            URI e = endpoint.get();
            String host = e.getPort() > 0 ? e.getHost() + ":" + e.getPort() : e.getHost();
            return ctx.pathStyleAccess()
                    ? e.getScheme() + "://" + host + "/" + S3RemoteStoreSession.CONTAINER_PLACEHOLDER
                    : e.getScheme() + "://" + S3RemoteStoreSession.CONTAINER_PLACEHOLDER + "." + host;
        }
        return "https://" + S3RemoteStoreSession.CONTAINER_PLACEHOLDER + ".s3." + region + ".amazonaws.com";
    }

    private static String trimSlash(String s) {
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }
}
