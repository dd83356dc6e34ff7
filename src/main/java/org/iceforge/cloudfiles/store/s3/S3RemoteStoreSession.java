package org.iceforge.cloudfiles.store.s3;

import org.iceforge.cloudfiles.store.ContainerHandle;
import org.iceforge.cloudfiles.store.ObjectHandle;
import org.iceforge.cloudfiles.store.RemoteObjectNotFoundException;
import org.iceforge.cloudfiles.store.RemoteServiceException;
import org.iceforge.cloudfiles.store.RemoteStoreSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.BucketAlreadyOwnedByYouException;
import software.amazon.awssdk.services.s3.model.BucketCannedACL;
import software.amazon.awssdk.services.s3.model.CreateBucketConfiguration;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.DeletePublicAccessBlockRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.ObjectCannedACL;
import software.amazon.awssdk.services.s3.model.ObjectOwnership;
import software.amazon.awssdk.services.s3.model.OwnershipControls;
import software.amazon.awssdk.services.s3.model.OwnershipControlsRule;
import software.amazon.awssdk.services.s3.model.PutBucketAclRequest;
import software.amazon.awssdk.services.s3.model.PutBucketOwnershipControlsRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link RemoteStoreSession} over an AWS SDK {@link S3Client}. Containers are buckets and
 * objects are keys. Publishing a container grants public-read on the bucket, and objects
 * uploaded to a public container are written public-read as well.
 * <p>
 * New buckets default to owner-enforced object ownership and a full public access block, both of
 * which reject ACLs. Buckets are therefore created with {@code ObjectWriter} ownership, and
 * publishing removes the public access block and re-asserts ownership before the ACL is applied.
 * Stores that do not implement those two calls (HTTP 501) are published with the ACL alone.
 */
public class S3RemoteStoreSession implements RemoteStoreSession {
    private static final Logger logger = LoggerFactory.getLogger(S3RemoteStoreSession.class);

    /** Placeholder replaced by the container name in {@code cdnTemplate}. */
    public static final String CONTAINER_PLACEHOLDER = "{container}";

    /** Region in which buckets are created without a location constraint. */
    static final String US_EAST_1 = "us-east-1";

    private final S3Client s3;
    private final String cdnTemplate;
    private final String region;

    /**
     * @param cdnTemplate public base for a container's objects, containing {@value #CONTAINER_PLACEHOLDER}
     * @param region      region new buckets are created in
     */
    public S3RemoteStoreSession(S3Client s3, String cdnTemplate, String region) {
        this.s3 = s3;
        this.cdnTemplate = cdnTemplate;
        this.region = region;
    }

    @Override
    public ContainerHandle createContainer(String name) {
        try {
            CreateBucketRequest.Builder req = CreateBucketRequest.builder()
                    .bucket(name)
                    .objectOwnership(ObjectOwnership.OBJECT_WRITER);
            if (region != null && !US_EAST_1.equals(region)) {
                req = req.createBucketConfiguration(CreateBucketConfiguration.builder()
                        .locationConstraint(region)
                        .build());
            }
            s3.createBucket(req.build());
            logger.info("Created bucket {} in {}", name, region);
        } catch (BucketAlreadyOwnedByYouException e) {
            logger.info("Bucket {} already exists and is owned by this account", name);
        } catch (SdkException e) {
            logger.error("S3 createBucket failed for {}", name, e);
            throw new RemoteServiceException("createContainer failed: " + name, e);
        }
        return new ContainerHandle(name, null, null, false);
    }

    @Override
    public ContainerHandle makePublic(ContainerHandle container) {
        allowAcls(container.name());
        try {
            s3.putBucketAcl(PutBucketAclRequest.builder()
                    .bucket(container.name())
                    .acl(BucketCannedACL.PUBLIC_READ)
                    .build());
        } catch (SdkException e) {
            logger.error("S3 putBucketAcl failed for {}", container.name(), e);
            throw new RemoteServiceException("makePublic failed: " + container.name(), e);
        }
        String base = cdnTemplate.replace(CONTAINER_PLACEHOLDER, container.name());
        return container.published(withScheme(base, "http"), withScheme(base, "https"));
    }

    private void allowAcls(String bucket) {
        try {
            s3.deletePublicAccessBlock(DeletePublicAccessBlockRequest.builder().bucket(bucket).build());
            s3.putBucketOwnershipControls(PutBucketOwnershipControlsRequest.builder()
                    .bucket(bucket)
                    .ownershipControls(OwnershipControls.builder()
                            .rules(OwnershipControlsRule.builder()
                                    .objectOwnership(ObjectOwnership.OBJECT_WRITER)
                                    .build())
                            .build())
                    .build());
        } catch (S3Exception e) {
            if (e.statusCode() == 501) {
                logger.warn("Store does not support public access block or ownership controls for {}; applying ACL only", bucket);
                return;
            }
            logger.error("S3 could not open bucket {} to ACLs", bucket, e);
            throw new RemoteServiceException("makePublic failed: " + bucket, e);
        } catch (SdkException e) {
            logger.error("S3 could not open bucket {} to ACLs", bucket, e);
            throw new RemoteServiceException("makePublic failed: " + bucket, e);
        }
    }

    @Override
    public boolean objectExists(ContainerHandle container, String path) {
        try {
            s3.headObject(HeadObjectRequest.builder().bucket(container.name()).key(path).build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (S3Exception e) {
            // Some S3-compatible APIs answer HEAD on a missing key with a bare 404.
            if (e.statusCode() == 404) return false;
            logger.error("S3 head failed for s3://{}/{}", container.name(), path, e);
            throw new RemoteServiceException("objectExists failed: " + container.name() + "/" + path, e);
        } catch (SdkException e) {
            logger.error("S3 head failed for s3://{}/{}", container.name(), path, e);
            throw new RemoteServiceException("objectExists failed: " + container.name() + "/" + path, e);
        }
    }

    @Override
    public byte[] readObject(ContainerHandle container, String path) {
        try {
            return s3.getObjectAsBytes(GetObjectRequest.builder().bucket(container.name()).key(path).build())
                    .asByteArray();
        } catch (NoSuchKeyException e) {
            throw new RemoteObjectNotFoundException("Object not found: " + container.name() + "/" + path, e);
        } catch (SdkException e) {
            logger.error("S3 getObject failed for s3://{}/{}", container.name(), path, e);
            throw new RemoteServiceException("readObject failed: " + container.name() + "/" + path, e);
        }
    }

    @Override
    public ObjectHandle createObject(ContainerHandle container, String path) {
        return new ObjectHandle(container, path);
    }

    @Override
    public void loadFromFile(ObjectHandle object, Path localFile) {
        ContainerHandle container = object.container();
        try {
            PutObjectRequest.Builder req = PutObjectRequest.builder()
                    .bucket(container.name())
                    .key(object.path());
            String contentType = probeContentType(localFile);
            if (contentType != null) req = req.contentType(contentType);
            if (container.publicAccess()) req = req.acl(ObjectCannedACL.PUBLIC_READ);

            s3.putObject(req.build(), RequestBody.fromFile(localFile));
        } catch (SdkException e) {
            logger.error("S3 putObject failed for s3://{}/{} from {}", container.name(), object.path(), localFile, e);
            throw new RemoteServiceException("loadFromFile failed: " + object + " from " + localFile, e);
        } catch (UncheckedIOException e) {
            throw new RemoteServiceException("loadFromFile could not read " + localFile, e);
        }
    }

    /** AWS S3 deletes are idempotent; only S3-compatible stores that answer NoSuchKey report a missing object. */
    @Override
    public void deleteObject(ContainerHandle container, String path) {
        try {
            s3.deleteObject(DeleteObjectRequest.builder().bucket(container.name()).key(path).build());
        } catch (NoSuchKeyException e) {
            throw new RemoteObjectNotFoundException("Object not found: " + container.name() + "/" + path, e);
        } catch (SdkException e) {
            logger.error("S3 delete failed for s3://{}/{}", container.name(), path, e);
            throw new RemoteServiceException("deleteObject failed: " + container.name() + "/" + path, e);
        }
    }

    @Override
    public void close() {
        s3.close();
    }

    static String withScheme(String url, String scheme) {
        int i = url.indexOf("://");
        String rest = i < 0 ? url : url.substring(i + 3);
        return scheme + "://" + rest;
    }

    private static String probeContentType(Path file) {
        try {
            return Files.probeContentType(file);
        } catch (IOException e) {
            logger.debug("Could not probe content type of {}", file, e);
            return null;
        }
    }
}
