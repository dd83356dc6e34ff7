package org.iceforge.cloudfiles.config;

import org.iceforge.cloudfiles.attachment.CloudFilesStorageFactory;
import org.iceforge.cloudfiles.container.StoreConnections;
import org.iceforge.cloudfiles.credentials.CredentialResolver;
import org.iceforge.cloudfiles.store.RemoteStoreClient;
import org.iceforge.cloudfiles.store.spi.RemoteStoreClientFactory;
import org.iceforge.cloudfiles.store.spi.RemoteStoreProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

/**
 * Wires the backend: provider discovery, the process-wide {@link StoreConnections} and the
 * {@link CloudFilesStorageFactory}. The store client is resolved at startup, so a missing
 * provider or client library fails the context instead of the first upload.
 */
@AutoConfiguration
@EnableConfigurationProperties(CloudFilesProperties.class)
public class CloudFilesAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(CloudFilesAutoConfiguration.class);

    static final String DEFAULT_ENVIRONMENT = "development";

    @Bean
    @ConditionalOnMissingBean
    public RemoteStoreClientFactory remoteStoreClientFactory(ObjectProvider<RemoteStoreProvider> providers) {
        return new RemoteStoreClientFactory(providers.orderedStream().toList());
    }

    @Bean
    @ConditionalOnMissingBean
    public RemoteStoreClient remoteStoreClient(RemoteStoreClientFactory factory, CloudFilesProperties props) {
        return factory.resolve(props.getProvider(), props.toContext()).client();
    }

    @Bean
    @ConditionalOnMissingBean
    public StoreConnections storeConnections(RemoteStoreClient client) {
        return new StoreConnections(client);
    }

    @Bean
    @ConditionalOnMissingBean
    public CredentialResolver credentialResolver(CloudFilesProperties props, Environment env) {
        String environment = environmentName(props, env);
        log.info("Resolving Cloud Files credentials for environment '{}'", environment);
        return new CredentialResolver(environment);
    }

    @Bean
    @ConditionalOnMissingBean
    public CloudFilesStorageFactory cloudFilesStorageFactory(CredentialResolver resolver, StoreConnections connections) {
        return new CloudFilesStorageFactory(resolver, connections);
    }

    static String environmentName(CloudFilesProperties props, Environment env) {
        if (props.getEnvironment() != null && !props.getEnvironment().isBlank()) {
            return props.getEnvironment();
        }
        String[] active = env.getActiveProfiles();
        return active.length > 0 ? active[0] : DEFAULT_ENVIRONMENT;
    }
}
