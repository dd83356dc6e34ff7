package org.iceforge.cloudfiles.attachment;

import org.iceforge.cloudfiles.container.StoreConnections;
import org.iceforge.cloudfiles.credentials.CredentialResolver;
import org.iceforge.cloudfiles.store.RemoteObjectNotFoundException;
import org.iceforge.cloudfiles.store.RemoteServiceException;
import org.iceforge.cloudfiles.store.local.LocalFsRemoteStoreClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Save, read, URL and destroy of an attachment against the local filesystem store.
 */
class LocalStoreAttachmentLifecycleTest {

    @TempDir
    Path storeDir;

    @TempDir
    Path workDir;

    private StoreConnections connections;
    private CloudFilesStorageFactory factory;

    @BeforeEach
    void setUp() {
        connections = new StoreConnections(new LocalFsRemoteStoreClient(storeDir, "http://cdn.local/{container}"));
        factory = new CloudFilesStorageFactory(new CredentialResolver("development"), connections);
    }

    @AfterEach
    void tearDown() {
        connections.close();
    }

    @Test
    void saveReadAndDestroy() throws Exception {
        TestAttachment attachment = new TestAttachment(new TestAttachment.User(1, false), "photo.jpg");
        CloudFilesAttachmentStorage<TestAttachment.User> storage = factory.activate(attachment,
                CloudFilesOptions.<TestAttachment.User>builder()
                        .credentials(Map.of("development", Map.of("username", "dev", "api_key", "k", "container", "media")))
                        .build());

        assertThat(storeDir.resolve("media")).isDirectory();
        assertThat(storeDir.resolve("media/.public")).exists();

        Path original = Files.writeString(workDir.resolve("original.jpg"), "big picture");
        Path thumb = Files.writeString(workDir.resolve("thumb.jpg"), "small picture");
        storage.queueWrite("original", original);
        storage.queueWrite("thumb", thumb);

        assertThat(storage.exists("thumb")).isFalse();
        storage.flushWrites();

        assertThat(storage.exists("original")).isTrue();
        assertThat(storage.exists("thumb")).isTrue();
        assertThat(new String(storage.read("thumb"))).isEqualTo("small picture");
        assertThat(storeDir.resolve("media/avatars/1/original/photo.jpg")).hasContent("big picture");
        assertThat(storage.url("thumb")).isEqualTo("http://cdn.local/media/avatars/1/thumb/photo.jpg");

        Path downloaded = storage.toFile("original");
        try {
            assertThat(downloaded).isNotEqualTo(original).hasContent("big picture");
        } finally {
            Files.deleteIfExists(downloaded);
        }

        storage.queueDeleteStyles(List.of("original", "thumb"));
        storage.queueDelete("avatars/1/medium/photo.jpg");
        storage.flushDeletes();

        assertThat(storage.exists("original")).isFalse();
        assertThat(storage.exists("thumb")).isFalse();
        assertThat(storage.isClean()).isTrue();
        assertThatThrownBy(() -> storage.read("thumb")).isInstanceOf(RemoteObjectNotFoundException.class);
    }

    @Test
    void rejectedObjectPath_failsFlushAsStoreErrorAndStaysQueued() {
        TestAttachment attachment = new TestAttachment(new TestAttachment.User(3, false), "x.txt");
        CloudFilesAttachmentStorage<TestAttachment.User> storage = factory.activate(attachment,
                CloudFilesOptions.<TestAttachment.User>builder()
                        .credentials(Map.of("username", "dev", "api_key", "k"))
                        .container("docs")
                        .build());

        storage.queueDelete("../../outside.txt");

        assertThatThrownBy(storage::flushDeletes).isInstanceOf(RemoteServiceException.class);
        assertThat(storage.pendingDeletes()).containsExactly("../../outside.txt");
    }

    @Test
    void reuploadOverwritesExistingObject() throws Exception {
        TestAttachment attachment = new TestAttachment(new TestAttachment.User(2, true), "doc.txt");
        CloudFilesAttachmentStorage<TestAttachment.User> storage = factory.activate(attachment,
                CloudFilesOptions.<TestAttachment.User>builder()
                        .credentials(Map.of("username", "dev", "api_key", "k"))
                        .container("docs")
                        .ssl(true)
                        .build());

        storage.queueWrite("original", Files.writeString(workDir.resolve("v1.txt"), "v1"));
        storage.flushWrites();
        storage.queueWrite("original", Files.writeString(workDir.resolve("v2.txt"), "v2"));
        storage.flushWrites();

        assertThat(new String(storage.read())).isEqualTo("v2");
        assertThat(storage.url()).isEqualTo("https://cdn.local/docs/avatars/2/original/doc.txt");
    }
}
