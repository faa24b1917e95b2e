package com.place.conflation.rules;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link ReferenceData} from JSON.
 *
 * <p>Expected format:</p>
 * <pre>
 * {
 *   "brands": { "Joe's Pizza": ["Joes Pizza", "Joe's Pizza NYC"] },
 *   "businessSuffixes": ["llc", "inc", "co"]
 * }
 * </pre>
 */
public final class ReferenceDataLoader {
    private static final Logger log = LoggerFactory.getLogger(ReferenceDataLoader.class);

    public static final String DEFAULT_RESOURCE = "/place-conflation-reference.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ReferenceDataLoader() {
        // Utility class
    }

    /**
     * Loads the reference data bundled on the classpath.
     */
    public static ReferenceData loadDefault() {
        return loadResource(DEFAULT_RESOURCE);
    }

    public static ReferenceData loadResource(String resource) {
        try (InputStream in = ReferenceDataLoader.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new ReferenceDataException("Reference data resource not found: " + resource);
            }
            return load(in, resource);
        } catch (IOException e) {
            throw new ReferenceDataException("Failed to read reference data resource " + resource, e);
        }
    }

    public static ReferenceData load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        } catch (IOException e) {
            throw new ReferenceDataException("Failed to read reference data file " + path, e);
        }
    }

    public static ReferenceData load(InputStream in) {
        return load(in, "stream");
    }

    private static ReferenceData load(InputStream in, String origin) {
        try {
            ReferenceData data = MAPPER.readValue(in, ReferenceData.class);
            log.info("referenceData.loaded origin={} brands={} suffixes={}",
                    origin, data.brands().size(), data.businessSuffixes().size());
            return data;
        } catch (IOException e) {
            throw new ReferenceDataException("Malformed reference data in " + origin + ": " + e.getMessage(), e);
        }
    }
}
