package com.mimecast.mailfetch.mime;

import com.mimecast.mailfetch.exceptions.UnexpectedStructureException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Server reported metadata for one MIME part.
 *
 * <p>Instances are immutable and built through {@link Builder} which validates required fields.
 * <p>A descriptor with sub-parts is a container and never carries content of its own.
 */
public final class PartDescriptor {

    private final PartType type;
    private final String subtype;
    private final TransferEncoding encoding;
    private final String disposition;
    private final String id;
    private final List<PartParameter> typeParameters;
    private final List<PartParameter> dispositionParameters;
    private final List<PartDescriptor> parts;

    private PartDescriptor(Builder builder) {
        this.type = builder.type;
        this.subtype = builder.subtype;
        this.encoding = builder.encoding;
        this.disposition = builder.disposition;
        this.id = builder.id;
        this.typeParameters = Collections.unmodifiableList(new ArrayList<>(builder.typeParameters));
        this.dispositionParameters = Collections.unmodifiableList(new ArrayList<>(builder.dispositionParameters));
        this.parts = Collections.unmodifiableList(new ArrayList<>(builder.parts));
    }

    public PartType getType() {
        return type;
    }

    /**
     * Gets subtype.
     *
     * @return Upper cased subtype, for example PLAIN or RFC822.
     */
    public String getSubtype() {
        return subtype;
    }

    public TransferEncoding getEncoding() {
        return encoding;
    }

    public Optional<String> getDisposition() {
        return Optional.ofNullable(disposition);
    }

    /**
     * Gets raw Content-ID.
     *
     * @return Optional of String, angle brackets included.
     */
    public Optional<String> getId() {
        return Optional.ofNullable(id);
    }

    public List<PartParameter> getTypeParameters() {
        return typeParameters;
    }

    public List<PartParameter> getDispositionParameters() {
        return dispositionParameters;
    }

    public List<PartDescriptor> getParts() {
        return parts;
    }

    /**
     * Checks if this part has sub-parts.
     *
     * @return Boolean.
     */
    public boolean isContainer() {
        return !parts.isEmpty();
    }

    /**
     * Checks subtype ignoring case.
     *
     * @param name Subtype name.
     * @return Boolean.
     */
    public boolean isSubtype(String name) {
        return subtype.equalsIgnoreCase(name);
    }

    /**
     * Checks if disposition is "attachment" ignoring case.
     *
     * @return Boolean.
     */
    public boolean isDispositionAttachment() {
        return disposition != null && disposition.equalsIgnoreCase("attachment");
    }

    /**
     * Checks if this part is a message/rfc822 sent as an attachment.
     *
     * @return Boolean.
     */
    public boolean isEmbeddedMessageAttachment() {
        return isSubtype("RFC822") && isDispositionAttachment();
    }

    /**
     * Gets MIME type string.
     *
     * @return For example "image/png".
     */
    public String getMimeType() {
        return type.name().toLowerCase(Locale.ROOT) + "/" + subtype.toLowerCase(Locale.ROOT);
    }

    /**
     * Gets a copy of this descriptor with sub-parts removed.
     *
     * @return PartDescriptor instance.
     */
    public PartDescriptor withoutParts() {
        if (parts.isEmpty()) {
            return this;
        }
        return toBuilder().parts(List.of()).build();
    }

    /**
     * Gets a builder seeded with this descriptor.
     *
     * @return Builder instance.
     */
    public Builder toBuilder() {
        Builder builder = new Builder()
                .type(type)
                .subtype(subtype)
                .encoding(encoding)
                .disposition(disposition)
                .id(id);
        builder.typeParameters.addAll(typeParameters);
        builder.dispositionParameters.addAll(dispositionParameters);
        builder.parts.addAll(parts);
        return builder;
    }

    @Override
    public String toString() {
        return getMimeType() + (isContainer() ? " (" + parts.size() + " parts)" : "");
    }

    /**
     * Gets a new builder.
     *
     * @return Builder instance.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * PartDescriptor builder.
     */
    public static class Builder {
        private PartType type;
        private String subtype;
        private TransferEncoding encoding = TransferEncoding.SEVEN_BIT;
        private String disposition;
        private String id;
        private final List<PartParameter> typeParameters = new ArrayList<>();
        private final List<PartParameter> dispositionParameters = new ArrayList<>();
        private final List<PartDescriptor> parts = new ArrayList<>();

        /**
         * Sets type.
         *
         * @param type PartType.
         * @return Self.
         */
        public Builder type(PartType type) {
            this.type = type;
            return this;
        }

        /**
         * Sets subtype.
         *
         * @param subtype Subtype, upper cased on build.
         * @return Self.
         */
        public Builder subtype(String subtype) {
            this.subtype = subtype;
            return this;
        }

        /**
         * Sets transfer encoding.
         *
         * @param encoding TransferEncoding, null means 7bit.
         * @return Self.
         */
        public Builder encoding(TransferEncoding encoding) {
            this.encoding = encoding != null ? encoding : TransferEncoding.SEVEN_BIT;
            return this;
        }

        /**
         * Sets disposition.
         *
         * @param disposition Disposition or null.
         * @return Self.
         */
        public Builder disposition(String disposition) {
            this.disposition = disposition == null || disposition.isBlank() ? null : disposition.trim();
            return this;
        }

        /**
         * Sets Content-ID.
         *
         * @param id Content-ID or null.
         * @return Self.
         */
        public Builder id(String id) {
            this.id = id;
            return this;
        }

        /**
         * Adds type parameter.
         *
         * @param attribute Attribute name.
         * @param value     Value.
         * @return Self.
         */
        public Builder typeParameter(String attribute, String value) {
            typeParameters.add(new PartParameter(attribute, value));
            return this;
        }

        /**
         * Adds disposition parameter.
         *
         * @param attribute Attribute name.
         * @param value     Value.
         * @return Self.
         */
        public Builder dispositionParameter(String attribute, String value) {
            dispositionParameters.add(new PartParameter(attribute, value));
            return this;
        }

        /**
         * Adds sub-part.
         *
         * @param part PartDescriptor.
         * @return Self.
         */
        public Builder part(PartDescriptor part) {
            parts.add(part);
            return this;
        }

        /**
         * Replaces sub-parts.
         *
         * @param list List of PartDescriptor.
         * @return Self.
         */
        public Builder parts(List<PartDescriptor> list) {
            parts.clear();
            parts.addAll(list);
            return this;
        }

        /**
         * Builds descriptor.
         *
         * @return PartDescriptor instance.
         * @throws UnexpectedStructureException Type or subtype missing.
         */
        public PartDescriptor build() {
            if (type == null) {
                throw new UnexpectedStructureException("Part type missing");
            }
            if (subtype == null || subtype.isBlank()) {
                throw new UnexpectedStructureException("Part subtype missing for type " + type);
            }
            subtype = subtype.trim().toUpperCase(Locale.ROOT);
            for (PartDescriptor part : parts) {
                if (part == null) {
                    throw new UnexpectedStructureException("Null sub-part in " + type + "/" + subtype);
                }
            }
            return new PartDescriptor(this);
        }
    }
}
