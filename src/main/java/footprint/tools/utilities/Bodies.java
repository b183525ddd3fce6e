package footprint.tools.utilities;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Registry of the known target bodies, read from the bodies.json resource on first use
 **/
public class Bodies {

    private static final Logger LOG = LoggerFactory.getLogger(Bodies.class);

    static final String RESOURCE = "/footprint/tools/bodies.json";

    private Bodies() {
    }

    private static final class Holder {
        private static final Map<String, Body> BODIES = load(RESOURCE);
    }

    static Map<String, Body> load(String resource) {

        try (InputStream in = Bodies.class.getResourceAsStream(resource)) {

            if (in == null) {
                throw new IllegalStateException("Body registry " + resource + " not found");
            }

            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {

                List<Body> bodies = new Gson().fromJson(reader, new TypeToken<List<Body>>() {
                }.getType());

                Map<String, Body> registry = new LinkedHashMap<>();
                for (Body body : bodies) {
                    registry.put(key(body.name()), body);
                }

                LOG.info("Loaded {} bodies from {}", registry.size(), resource);
                return Collections.unmodifiableMap(registry);

            }

        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read the body registry " + resource, e);
        } catch (JsonParseException e) {
            throw new IllegalStateException("Malformed body registry " + resource, e);
        }

    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Case insensitive lookup
     *
     * @param name the body name
     * @return the body
     * @throws IllegalArgumentException if the body is unknown
     **/
    public static Body get(String name) {

        Body body = Holder.BODIES.get(key(name));
        if (body == null) {
            throw new IllegalArgumentException("Unknown body: " + name + ", available: " + Holder.BODIES.keySet());
        }
        return body;

    }

    public static boolean contains(String name) {
        return Holder.BODIES.containsKey(key(name));
    }

    public static Map<String, Body> all() {
        return Holder.BODIES;
    }

}
