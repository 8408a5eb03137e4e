/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.convoy.scheduler;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Stores schedules as a JSON array in {@code <dataDir>/schedules.json}. Each write goes to a
 * temporary file in the same directory, which then replaces the target.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-11
 * @version 1.0
 */
public class JsonFileScheduleRepository implements ScheduleRepository {

    private static final Logger logger = LoggerFactory.getLogger(JsonFileScheduleRepository.class);
    private static final String FILE_NAME = "schedules.json";

    private final Path dataDirectory;
    private final Path file;
    private final ObjectMapper mapper;

    public JsonFileScheduleRepository(Path dataDirectory) {
        this.dataDirectory = Objects.requireNonNull(dataDirectory, "Data directory cannot be null");
        this.file = dataDirectory.resolve(FILE_NAME);
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public synchronized List<Schedule> loadAll() throws IOException {
        if (!Files.exists(file)) {
            logger.debug("No schedule file at {}", file);
            return List.of();
        }
        List<Schedule> schedules = mapper.readValue(file.toFile(), new TypeReference<List<Schedule>>() {
        });
        logger.info("Loaded {} schedules from {}", schedules.size(), file);
        return schedules;
    }

    @Override
    public synchronized void saveAll(Collection<Schedule> schedules) throws IOException {
        Files.createDirectories(dataDirectory);
        Path tmp = Files.createTempFile(dataDirectory, "schedules", ".json.tmp");
        try {
            mapper.writeValue(tmp.toFile(), new ArrayList<>(schedules));
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
        logger.debug("Saved {} schedules to {}", schedules.size(), file);
    }

    public Path getFile() {
        return file;
    }
}
