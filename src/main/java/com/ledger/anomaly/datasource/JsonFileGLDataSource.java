package com.ledger.anomaly.datasource;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledger.anomaly.model.GLFilter;
import com.ledger.anomaly.model.LineItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Reads an exported ledger extract (a JSON array of line items) and applies the filter in memory.
 * The file is re-read on every call so a refreshed extract is picked up without a restart.
 */
public class JsonFileGLDataSource implements GLDataSource {

    private static final Logger log = LoggerFactory.getLogger(JsonFileGLDataSource.class);

    private static final TypeReference<List<LineItem>> LINE_ITEMS = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final Resource resource;

    public JsonFileGLDataSource(ObjectMapper objectMapper, Resource resource) {
        this.objectMapper = objectMapper;
        this.resource = resource;
    }

    @Override
    public CompletableFuture<List<LineItem>> getGLLineItems(GLFilter filter) {
        List<LineItem> all;
        try (InputStream in = resource.getInputStream()) {
            all = objectMapper.readValue(in, LINE_ITEMS);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(
                    new GLDataSourceException("Failed to read line items from " + resource.getDescription(), e));
        }

        List<LineItem> matching = all.stream()
                .filter(filter::matches)
                .toList();
        log.debug("Loaded {} line items from {}, {} match filter", all.size(), resource.getDescription(), matching.size());
        return CompletableFuture.completedFuture(matching);
    }
}
