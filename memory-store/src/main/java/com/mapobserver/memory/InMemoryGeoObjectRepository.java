package com.mapobserver.memory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.mapobserver.core.model.GeoObject;
import com.mapobserver.core.spi.GeoObjectQuery;
import com.mapobserver.core.spi.GeoObjectSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * {@link GeoObjectSource} over a fixed list of objects held in memory.
 *
 * <p>
 * "Active" is evaluated against the supplied {@link Clock}, so expiry can be
 * tested deterministically.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemoryGeoObjectRepository implements GeoObjectSource {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryGeoObjectRepository.class);

    private static final ObjectMapper MAPPER = new ObjectMapper().registerModule(new JavaTimeModule());

    private final List<GeoObject> objects;
    private final Clock clock;

    public InMemoryGeoObjectRepository(Collection<GeoObject> objects) {
        this(objects, Clock.systemUTC());
    }

    /**
     * @param objects the objects to serve; must not be {@code null}
     * @param clock   clock used to evaluate expiry; must not be {@code null}
     */
    public InMemoryGeoObjectRepository(Collection<GeoObject> objects, Clock clock) {
        this.objects = List.copyOf(Objects.requireNonNull(objects, "Objects must not be null"));
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    /**
     * Load objects from a JSON array on the classpath.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @param clock    clock used to evaluate expiry; must not be {@code null}
     * @return the repository
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if the resource cannot be read or parsed
     */
    public static InMemoryGeoObjectRepository fromClasspath(String resource, Clock clock) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = InMemoryGeoObjectRepository.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            List<GeoObject> loaded = MAPPER.readValue(is, new TypeReference<List<GeoObject>>() {
            });
            LOG.info("Loaded {} geo-object(s) from {}", loaded.size(), resource);
            return new InMemoryGeoObjectRepository(loaded, clock);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read geo-objects from: " + resource, e);
        }
    }

    @Override
    public GeoObjectQuery createQuery() {
        return new InMemoryGeoObjectQuery(objects, clock);
    }

    @Override
    public List<GeoObject> findActiveByMap(long mapId) {
        return objects.stream()
                .filter(object -> object.getMapId() == mapId)
                .filter(object -> object.isActiveAt(clock.instant()))
                .toList();
    }

    /**
     * @return every object, active or not
     */
    public List<GeoObject> findAll() {
        return objects;
    }
}
