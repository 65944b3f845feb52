package org.geoserve.server.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.module.blackbird.BlackbirdModule;

/**
 * Mapper for geolocation records. Property names come from the annotations of the MaxMind model, empty names maps
 * and subdivision lists are skipped the same way the MaxMind web service omits them.
 */
public final class ObjectMapperProvider {

    private static final ObjectMapper MAPPER;

    static {
        MAPPER = JsonMapper.builder()
                .configure(MapperFeature.DEFAULT_VIEW_INCLUSION, false)
                .configure(MapperFeature.CAN_OVERRIDE_ACCESS_MODIFIERS, false)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
                .serializationInclusion(JsonInclude.Include.NON_EMPTY)
                .addModule(new BlackbirdModule())
                .build();
    }

    private ObjectMapperProvider() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
