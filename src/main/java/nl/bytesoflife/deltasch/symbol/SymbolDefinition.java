package nl.bytesoflife.deltasch.symbol;

import nl.bytesoflife.deltasch.geometry.BoundingBox;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A library symbol with everything the geometry and connectivity code needs.
 */
public class SymbolDefinition {

    private final String libId;
    private final List<SymbolPin> pins;
    private final boolean powerSymbol;
    private final BoundingBox bounds;
    private final Map<String, String> properties;
    private final int unitCount;

    public SymbolDefinition(String libId, List<SymbolPin> pins, boolean powerSymbol, BoundingBox bounds,
                            Map<String, String> properties, int unitCount) {
        this.libId = libId;
        this.pins = List.copyOf(pins);
        this.powerSymbol = powerSymbol;
        this.bounds = bounds;
        this.properties = Collections.unmodifiableMap(properties);
        this.unitCount = unitCount;
    }

    public String getLibId() {
        return libId;
    }

    public List<SymbolPin> getPins() {
        return pins;
    }

    /**
     * Pins of one unit, including the pins shared by all units.
     */
    public List<SymbolPin> getPins(int unit) {
        List<SymbolPin> result = new ArrayList<>();
        for (SymbolPin pin : pins) {
            if (pin.unit() == 0 || pin.unit() == unit) {
                result.add(pin);
            }
        }
        return result;
    }

    public Optional<SymbolPin> findPin(String number) {
        for (SymbolPin pin : pins) {
            if (pin.number().equals(number)) return Optional.of(pin);
        }
        return Optional.empty();
    }

    /**
     * Pin with the given number visible in {@code unit}.
     */
    public Optional<SymbolPin> findPin(String number, int unit) {
        for (SymbolPin pin : getPins(unit)) {
            if (pin.number().equals(number)) return Optional.of(pin);
        }
        return Optional.empty();
    }

    public boolean isPowerSymbol() {
        return powerSymbol;
    }

    /**
     * Extent of pins and body graphics in library coordinates, Y up.
     */
    public BoundingBox getBounds() {
        return bounds;
    }

    public Map<String, String> getProperties() {
        return properties;
    }

    public String getReferencePrefix() {
        return properties.getOrDefault("Reference", "U");
    }

    public int getUnitCount() {
        return unitCount;
    }

    @Override
    public String toString() {
        return libId + " (" + pins.size() + " pins" + (powerSymbol ? ", power" : "") + ")";
    }
}
