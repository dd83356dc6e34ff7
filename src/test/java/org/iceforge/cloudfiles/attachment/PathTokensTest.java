package org.iceforge.cloudfiles.attachment;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.function.BiFunction;

import static org.junit.jupiter.api.Assertions.*;

class PathTokensTest {

    @Test
    void hostDefaultPathIsReplaced() {
        String hostDefault = ":rails_root/public/system/:attachment/:id/:style/:filename";

        assertEquals(PathTokens.DEFAULT_PATH, PathTokens.pathTemplate(hostDefault, hostDefault));
        assertEquals(PathTokens.DEFAULT_PATH, PathTokens.pathTemplate(null, hostDefault));
        assertEquals("uploads/:id/:style.:extension", PathTokens.pathTemplate("uploads/:id/:style.:extension", hostDefault));
    }

    @Test
    void registeredTokenResolvesToObjectPath() {
        Map<String, BiFunction<AttachmentContext<?>, String, String>> hooks = new HashMap<>();
        PathTokens.register(hooks::put);

        TestAttachment attachment = new TestAttachment(new TestAttachment.User(7, false), "me.png");

        assertTrue(hooks.containsKey(PathTokens.CF_PATH_FILENAME));
        assertEquals("avatars/7/thumb/me.png", hooks.get(PathTokens.CF_PATH_FILENAME).apply(attachment, "thumb"));
    }
}
