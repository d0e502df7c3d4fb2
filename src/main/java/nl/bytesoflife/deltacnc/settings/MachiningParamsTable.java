package nl.bytesoflife.deltacnc.settings;

import nl.bytesoflife.deltacnc.model.MachiningParams;
import nl.bytesoflife.deltacnc.model.OperationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Machining parameters keyed by material, tool size and operation type, as supplied
 * by the materials store. Lookups never fail: a missing entry falls back to
 * {@link BuiltinMachiningDefaults}.
 */
public class MachiningParamsTable {

    private static final Logger log = LoggerFactory.getLogger(MachiningParamsTable.class);

    private final Map<Key, MachiningParams> entries = new LinkedHashMap<>();

    public MachiningParamsTable register(String material, double toolDiameter, OperationType type,
                                         MachiningParams params) {
        entries.put(new Key(material, toolDiameter, type), params);
        return this;
    }

    public boolean contains(String material, double toolDiameter, OperationType type) {
        return entries.containsKey(new Key(material, toolDiameter, type));
    }

    /**
     * Parameters for the combination, carrying the given material depth.
     */
    public MachiningParams resolve(String material, double toolDiameter, OperationType type,
                                   double materialDepth) {
        MachiningParams params = entries.get(new Key(material, toolDiameter, type));
        if (params == null) {
            log.warn("No {} settings for material '{}' with {} in tool, using built-in defaults",
                    type, material, toolDiameter);
            params = BuiltinMachiningDefaults.forType(type);
        }
        return params.withMaterialDepth(materialDepth);
    }

    public Map<Key, MachiningParams> getEntries() {
        return Collections.unmodifiableMap(entries);
    }

    /**
     * Tool diameters are matched at 0.0001 in resolution, material names case-insensitively.
     */
    public record Key(String material, long toolTenThousandths, OperationType type) {

        public Key(String material, double toolDiameter, OperationType type) {
            this(material.toLowerCase(Locale.ROOT), Math.round(toolDiameter * 10000), type);
        }
    }
}
