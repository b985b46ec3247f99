package com.mimecast.mailfetch.mime;

import com.mimecast.mailfetch.util.StringEncoding;

import java.util.*;

/**
 * Resolved parameter map of a part.
 *
 * <p>Type parameters are MIME decoded when not blank.
 * <br>Disposition parameters keep their raw value and RFC 2231 continuations
 * <br>(<code>filename*0*</code>, <code>filename*1*</code>, ...) are folded onto the base attribute in encounter order.
 * <br>Attribute names are lower cased.
 */
public final class PartParameters {

    /**
     * Parameter kinds the assembler acts on.
     */
    public enum Kind {
        FILENAME("filename"),
        NAME("name"),
        CHARSET("charset"),
        OTHER(null);

        private final String attribute;

        Kind(String attribute) {
            this.attribute = attribute;
        }

        /**
         * Gets attribute name.
         *
         * @return Lower case attribute name or null for OTHER.
         */
        public String getAttribute() {
            return attribute;
        }

        /**
         * Classifies an attribute name.
         *
         * @param attribute Lower case attribute name.
         * @return Kind.
         */
        public static Kind of(String attribute) {
            for (Kind kind : values()) {
                if (kind.attribute != null && kind.attribute.equals(attribute)) {
                    return kind;
                }
            }
            return OTHER;
        }
    }

    private final Map<Kind, String> known = new EnumMap<>(Kind.class);
    private final Map<String, String> others = new LinkedHashMap<>();
    private final Map<String, String> all = new LinkedHashMap<>();

    private PartParameters() {
    }

    /**
     * Resolves parameters of given part.
     *
     * @param part PartDescriptor.
     * @return PartParameters instance.
     */
    public static PartParameters resolve(PartDescriptor part) {
        PartParameters params = new PartParameters();

        for (PartParameter param : part.getTypeParameters()) {
            String value = param.value();
            params.put(param.attribute().toLowerCase(Locale.ROOT), value.isBlank() ? "" : StringEncoding.decodeMimeStr(value));
        }

        for (PartParameter param : part.getDispositionParameters()) {
            params.fold(baseAttribute(param.attribute()), param.value());
        }

        return params;
    }

    /**
     * Strips the RFC 2231 section suffix from an attribute name.
     *
     * @param attribute Attribute name, for example <code>filename*1*</code>.
     * @return Lower cased base name, for example <code>filename</code>.
     */
    static String baseAttribute(String attribute) {
        int star = attribute.indexOf('*');
        String base = star >= 0 ? attribute.substring(0, star) : attribute;
        return base.toLowerCase(Locale.ROOT);
    }

    private void put(String attribute, String value) {
        all.put(attribute, value);
        Kind kind = Kind.of(attribute);
        if (kind == Kind.OTHER) {
            others.put(attribute, value);
        } else {
            known.put(kind, value);
        }
    }

    private void fold(String attribute, String value) {
        String existing = all.get(attribute);
        put(attribute, existing != null ? existing + value : value);
    }

    /**
     * Checks if a known parameter is present, blank or not.
     *
     * @param kind Kind, not OTHER.
     * @return Boolean.
     */
    public boolean has(Kind kind) {
        return known.containsKey(kind);
    }

    /**
     * Gets a known parameter.
     *
     * @param kind Kind, not OTHER.
     * @return Optional of String, may be blank.
     */
    public Optional<String> get(Kind kind) {
        return Optional.ofNullable(known.get(kind));
    }

    /**
     * Gets a known parameter only when it is not blank.
     *
     * @param kind Kind, not OTHER.
     * @return Optional of String.
     */
    public Optional<String> getNonBlank(Kind kind) {
        return get(kind).filter(value -> !value.isBlank());
    }

    /**
     * Gets any parameter by attribute name.
     *
     * @param attribute Attribute name.
     * @return Optional of String.
     */
    public Optional<String> get(String attribute) {
        return Optional.ofNullable(all.get(attribute.toLowerCase(Locale.ROOT)));
    }

    /**
     * Gets parameters without a dedicated kind.
     *
     * @return Unmodifiable map.
     */
    public Map<String, String> getOthers() {
        return Collections.unmodifiableMap(others);
    }

    /**
     * Gets all parameters in encounter order.
     *
     * @return Unmodifiable map.
     */
    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(all);
    }

    /**
     * Checks if the part names a file, which marks it as an attachment candidate.
     *
     * @return Boolean.
     */
    public boolean isNamed() {
        return has(Kind.FILENAME) || has(Kind.NAME);
    }
}
