package com.routine.loader.batch.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.routine.loader.compiler.metadata.BuildMetadata;
import com.routine.loader.util.FileWriteUtil;

/**
 * Reads and writes the metadata of all stored routines as one JSON document keyed by routine name.
 */
public class MetadataStore {
    private static final Logger log = LoggerFactory.getLogger(MetadataStore.class);

    private static final TypeReference<TreeMap<String, BuildMetadata>> METADATA_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    /**
     * @return the metadata keyed by routine name; empty if the file does not exist yet
     */
    public Map<String, BuildMetadata> load(Path metadataFile) throws IOException {
        if (!Files.exists(metadataFile)) {
            log.debug("No metadata file {}, all routines will be loaded", metadataFile);
            return new TreeMap<>();
        }
        return mapper.readValue(metadataFile.toFile(), METADATA_TYPE);
    }

    public void save(Path metadataFile, Map<String, BuildMetadata> metadata) throws IOException {
        FileWriteUtil.safeWriteString(metadataFile, mapper.writeValueAsString(new TreeMap<>(metadata)));
        log.debug("Wrote metadata of {} routine(s) to {}", metadata.size(), metadataFile);
    }
}
