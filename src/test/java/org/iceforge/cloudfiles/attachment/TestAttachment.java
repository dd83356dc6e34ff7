package org.iceforge.cloudfiles.attachment;

/**
 * Minimal host attachment: {@code avatars/<id>/<style>/<fileName>}.
 */
record TestAttachment(TestAttachment.User owner, String fileName) implements AttachmentContext<TestAttachment.User> {

    record User(long id, boolean prefersSsl) {}

    @Override
    public String name() {
        return "avatar";
    }

    @Override
    public String defaultStyle() {
        return "original";
    }

    @Override
    public String path(String style) {
        return "avatars/" + owner.id() + "/" + style + "/" + fileName;
    }
}
