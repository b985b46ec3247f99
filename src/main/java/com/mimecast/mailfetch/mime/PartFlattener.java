package com.mimecast.mailfetch.mime;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Linearizes a part tree into positional keys.
 *
 * <p>Siblings are numbered from 1 in document order and children extend the parent key with ".N".
 * <br>Children of a MESSAGE part restart at 0 under the parent key and do not extend the prefix again one level down,
 * <br>so the body of an embedded message is "N.0" and its own children are "N.1", "N.2", ...
 * <p>This numbering is a compatibility contract with existing key consumers and must not change.
 * <p>A key seen twice keeps its first position and takes the later part.
 */
public class PartFlattener {

    /**
     * Flattens the direct children of a message.
     *
     * @param parts Top level parts.
     * @return Insertion ordered map of key to FlattenedPart.
     */
    public Map<String, FlattenedPart> flatten(List<PartDescriptor> parts) {
        Map<String, FlattenedPart> flat = new LinkedHashMap<>();
        flatten(parts, flat, "", 1, true, false);
        return flat;
    }

    private void flatten(List<PartDescriptor> parts, Map<String, FlattenedPart> flat,
                         String prefix, int index, boolean fullPrefix, boolean embedded) {
        for (PartDescriptor part : parts) {
            String key = prefix + index;
            flat.put(key, new FlattenedPart(key, part.withoutParts(), part.isContainer(), embedded));

            if (part.isContainer()) {
                boolean childEmbedded = embedded || part.isEmbeddedMessageAttachment();
                if (part.getType() == PartType.MESSAGE) {
                    flatten(part.getParts(), flat, key + ".", 0, false, childEmbedded);
                } else if (fullPrefix) {
                    flatten(part.getParts(), flat, key + ".", 1, true, childEmbedded);
                } else {
                    flatten(part.getParts(), flat, prefix, 1, true, childEmbedded);
                }
            }

            index++;
        }
    }
}
