package com.catalogcrawl.crawl.output;

import com.catalogcrawl.config.CrawlerProperties;
import com.catalogcrawl.crawl.model.ProductRecord;
import com.catalogcrawl.crawl.model.RunSummary;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Writes the run as one JSON document to {@code crawler.output.path}. Absent optional fields
 * are written as {@code null}.
 */
@Component
public class JsonFileProductSink implements ProductSink {
    private static final Logger log = LoggerFactory.getLogger(JsonFileProductSink.class);

    private final ObjectMapper objectMapper;
    private final CrawlerProperties properties;

    public JsonFileProductSink(ObjectMapper objectMapper, CrawlerProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public void accept(List<ProductRecord> records, RunSummary summary) {
        Path target = Path.of(properties.getOutput().getPath()).toAbsolutePath();
        try {
            write(target, CatalogExport.of(records, summary));
        } catch (IOException e) {
            log.error("Failed to write {} products to {}", records.size(), target, e);
            throw new UncheckedIOException("Export write failed: " + target, e);
        }
        log.info("Wrote {} products to {}", records.size(), target);
    }

    private void write(Path target, CatalogExport export) throws IOException {
        Path directory = target.getParent();
        if (directory != null) {
            Files.createDirectories(directory);
        }
        Path temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), export);
            moveIntoPlace(temp, target);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, replacing in place", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
