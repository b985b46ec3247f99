package com.mimecast.mailfetch.mime;

/**
 * PartDescriptor fixtures.
 */
final class Parts {

    private Parts() {
    }

    static PartDescriptor.Builder leaf(PartType type, String subtype) {
        return PartDescriptor.builder().type(type).subtype(subtype);
    }

    static PartDescriptor plain() {
        return leaf(PartType.TEXT, "plain").typeParameter("charset", "UTF-8").build();
    }

    static PartDescriptor html() {
        return leaf(PartType.TEXT, "html").typeParameter("charset", "UTF-8").build();
    }

    static PartDescriptor file(PartType type, String subtype, String filename) {
        return leaf(type, subtype)
                .encoding(TransferEncoding.BASE64)
                .disposition("attachment")
                .dispositionParameter("filename", filename)
                .build();
    }

    static PartDescriptor multipart(String subtype, PartDescriptor... parts) {
        PartDescriptor.Builder builder = leaf(PartType.MULTIPART, subtype);
        for (PartDescriptor part : parts) {
            builder.part(part);
        }
        return builder.build();
    }

    static PartDescriptor rfc822(String disposition, PartDescriptor body) {
        return leaf(PartType.MESSAGE, "rfc822")
                .disposition(disposition)
                .part(body)
                .build();
    }
}
