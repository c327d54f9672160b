package com.ciro.jluax.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/** Tablas Lua → JSON. Las tablas tipo array ya llegan como List y el resto como Map. */
public class JsonRenderer {

    private final ObjectMapper mapper;

    public JsonRenderer() {
        this(ObjectMapperFactory.create());
    }

    public JsonRenderer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String render(Object payload) {
        try {
            return mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new RenderException("cannot serialize payload as JSON: " + e.getOriginalMessage(), e);
        }
    }
}
