package com.mimecast.mailfetch.mime;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PartParametersTest {

    @Test
    void typeParametersDecoded() {
        PartDescriptor part = Parts.leaf(PartType.APPLICATION, "pdf")
                .typeParameter("NAME", "=?UTF-8?B?UmVwb3J0LnBkZg==?=")
                .typeParameter("Charset", "UTF-8")
                .typeParameter("format", "flowed")
                .build();

        PartParameters params = PartParameters.resolve(part);

        assertEquals("Report.pdf", params.get(PartParameters.Kind.NAME).orElse(null));
        assertEquals("UTF-8", params.get(PartParameters.Kind.CHARSET).orElse(null));
        assertEquals("flowed", params.getOthers().get("format"));
        assertEquals("flowed", params.get("FORMAT").orElse(null));
        assertTrue(params.isNamed());
    }

    @Test
    void continuationsFolded() {
        PartDescriptor part = Parts.leaf(PartType.APPLICATION, "octet-stream")
                .disposition("attachment")
                .dispositionParameter("filename*0*", "UTF-8''very%20long")
                .dispositionParameter("filename*1*", "%20name")
                .dispositionParameter("filename*2", ".txt")
                .build();

        PartParameters params = PartParameters.resolve(part);

        assertEquals("UTF-8''very%20long%20name.txt", params.get(PartParameters.Kind.FILENAME).orElse(null));
        assertEquals(1, params.asMap().size());
    }

    @Test
    void blankValuesKept() {
        PartDescriptor part = Parts.leaf(PartType.TEXT, "plain")
                .typeParameter("name", "")
                .typeParameter("charset", " ")
                .build();

        PartParameters params = PartParameters.resolve(part);

        assertTrue(params.isNamed());
        assertTrue(params.has(PartParameters.Kind.CHARSET));
        assertTrue(params.getNonBlank(PartParameters.Kind.CHARSET).isEmpty());
    }

    @Test
    void unnamed() {
        PartParameters params = PartParameters.resolve(Parts.plain());

        assertFalse(params.isNamed());
        assertTrue(params.get(PartParameters.Kind.FILENAME).isEmpty());
    }

    @Test
    void baseAttribute() {
        assertEquals("filename", PartParameters.baseAttribute("FileName*0*"));
        assertEquals("name", PartParameters.baseAttribute("name"));
        assertEquals(PartParameters.Kind.OTHER, PartParameters.Kind.of("boundary"));
    }
}
