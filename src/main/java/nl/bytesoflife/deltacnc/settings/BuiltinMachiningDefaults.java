package nl.bytesoflife.deltacnc.settings;

import nl.bytesoflife.deltacnc.model.MachiningParams;
import nl.bytesoflife.deltacnc.model.OperationType;

import java.io.IOException;
import java.io.InputStream;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Fallback machining parameters per operation type, bundled as a classpath resource.
 */
public class BuiltinMachiningDefaults {

    static final String RESOURCE = "/machining-defaults.properties";

    private static volatile Map<OperationType, MachiningParams> cached;

    public static MachiningParams forType(OperationType type) {
        return all().get(type);
    }

    public static Map<OperationType, MachiningParams> all() {
        if (cached == null) {
            synchronized (BuiltinMachiningDefaults.class) {
                if (cached == null) {
                    cached = load(RESOURCE);
                }
            }
        }
        return cached;
    }

    static Map<OperationType, MachiningParams> load(String resource) {
        try (InputStream is = BuiltinMachiningDefaults.class.getResourceAsStream(resource)) {
            if (is == null) throw new IllegalStateException("Resource not found: " + resource);
            Properties props = new Properties();
            props.load(is);
            return parse(props);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load machining defaults from " + resource, e);
        }
    }

    static Map<OperationType, MachiningParams> parse(Properties props) {
        Map<OperationType, MachiningParams> defaults = new EnumMap<>(OperationType.class);
        for (OperationType type : OperationType.values()) {
            String prefix = type.name().toLowerCase(Locale.ROOT) + ".";
            defaults.put(type, new MachiningParams(
                    (int) number(props, prefix + "spindleSpeed"),
                    number(props, prefix + "feedRate"),
                    number(props, prefix + "plungeRate"),
                    number(props, prefix + "peckingDepth"),
                    number(props, prefix + "passDepth"),
                    number(props, prefix + "materialDepth"),
                    number(props, prefix + "safetyHeight"),
                    number(props, prefix + "travelHeight")));
        }
        return Map.copyOf(defaults);
    }

    private static double number(Properties props, String key) {
        String value = props.getProperty(key);
        if (value == null) {
            throw new IllegalStateException("Missing machining default: " + key);
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid number for " + key + ": " + value, e);
        }
    }
}
