package nl.bytesoflife.deltasch.symbol;

import nl.bytesoflife.deltasch.geometry.BoundingBox;
import nl.bytesoflife.deltasch.model.Point;
import nl.bytesoflife.deltasch.sexpr.SNode.SList;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a library {@code (symbol "Name" ...)} list into a {@link SymbolDefinition}.
 * <p>
 * Unit sub-symbols are named {@code <Name>_<unit>_<style>}; unit 0 holds what all units share.
 * A symbol that {@code (extends "Parent")} takes the parent's pins and graphics and overrides its
 * properties.
 */
public class LibrarySymbolReader {

    private static final Pattern UNIT_SUFFIX = Pattern.compile("_(\\d+)_(\\d+)$");

    private final Function<String, SList> parentLookup;

    /**
     * @param parentLookup finds a sibling symbol list by name for {@code extends}, may return null
     */
    public LibrarySymbolReader(Function<String, SList> parentLookup) {
        this.parentLookup = parentLookup;
    }

    public SymbolDefinition read(String libId, SList symbol) {
        return read(libId, symbol, 0);
    }

    private SymbolDefinition read(String libId, SList symbol, int depth) {
        if (depth > 16) {
            throw new IllegalArgumentException("Symbol inheritance too deep at " + libId);
        }
        List<SymbolPin> pins = new ArrayList<>();
        List<Point> extent = new ArrayList<>();
        Map<String, String> properties = new LinkedHashMap<>();
        boolean power = symbol.find("power") != null;
        int units = 1;

        SList extendsNode = symbol.find("extends");
        if (extendsNode != null) {
            String parentName = extendsNode.value(1);
            SList parent = parentLookup.apply(parentName);
            if (parent == null) {
                throw new IllegalArgumentException("Symbol " + libId + " extends unknown symbol " + parentName);
            }
            SymbolDefinition base = read(parentName, parent, depth + 1);
            pins.addAll(base.getPins());
            if (base.getBounds() != null) {
                extent.add(new Point(base.getBounds().minX(), base.getBounds().minY()));
                extent.add(new Point(base.getBounds().maxX(), base.getBounds().maxY()));
            }
            properties.putAll(base.getProperties());
            power |= base.isPowerSymbol();
            units = base.getUnitCount();
        }

        for (SList property : symbol.findAll("property")) {
            properties.put(property.value(1), property.value(2) != null ? property.value(2) : "");
        }

        readBody(symbol, 0, pins, extent);
        for (SList unitSymbol : symbol.findAll("symbol")) {
            int unit = unitOf(unitSymbol.value(1));
            units = Math.max(units, unit);
            readBody(unitSymbol, unit, pins, extent);
        }
        return new SymbolDefinition(libId, pins, power, BoundingBox.around(extent), properties, units);
    }

    static int unitOf(String subSymbolName) {
        if (subSymbolName == null) return 0;
        Matcher matcher = UNIT_SUFFIX.matcher(subSymbolName);
        return matcher.find() ? Integer.parseInt(matcher.group(1)) : 0;
    }

    private static void readBody(SList body, int unit, List<SymbolPin> pins, List<Point> extent) {
        for (SList item : body.lists()) {
            switch (item.tag()) {
                case "pin" -> {
                    SymbolPin pin = readPin(item, unit);
                    pins.add(pin);
                    extent.add(pin.position());
                    extent.add(pin.bodyEnd());
                }
                case "rectangle" -> {
                    addPoint(item.find("start"), extent);
                    addPoint(item.find("end"), extent);
                }
                case "polyline", "bezier" -> {
                    SList pts = item.find("pts");
                    if (pts != null) {
                        for (SList xy : pts.findAll("xy")) {
                            addPoint(xy, extent);
                        }
                    }
                }
                case "circle" -> {
                    SList center = item.find("center");
                    SList radius = item.find("radius");
                    if (center != null && radius != null) {
                        double r = radius.number(1, 0);
                        Point c = point(center);
                        extent.add(c.translate(-r, -r));
                        extent.add(c.translate(r, r));
                    }
                }
                case "arc" -> {
                    addPoint(item.find("start"), extent);
                    addPoint(item.find("mid"), extent);
                    addPoint(item.find("end"), extent);
                }
                default -> {
                }
            }
        }
    }

    private static SymbolPin readPin(SList pin, int unit) {
        String type = pin.value(1);
        SList at = pin.find("at");
        SList length = pin.find("length");
        SList name = pin.find("name");
        SList number = pin.find("number");
        boolean hidden = pin.hasSymbol("hide");
        SList hide = pin.find("hide");
        if (hide != null) {
            hidden = !"no".equals(hide.value(1));
        }
        return new SymbolPin(
                number != null ? number.value(1) : "",
                name != null ? name.value(1) : "",
                at != null ? point(at) : new Point(0, 0),
                at != null ? at.number(3, 0) : 0,
                length != null ? length.number(1, 0) : 0,
                type != null ? PinElectricalType.fromKicadName(type) : PinElectricalType.UNSPECIFIED,
                unit,
                hidden);
    }

    private static void addPoint(SList list, List<Point> extent) {
        if (list != null) {
            extent.add(point(list));
        }
    }

    private static Point point(SList list) {
        return new Point(list.number(1, 0), list.number(2, 0));
    }

    /**
     * Name part of a lib id, {@code R} for {@code Device:R}.
     */
    static String symbolName(String libId) {
        int colon = libId.indexOf(':');
        return colon >= 0 ? libId.substring(colon + 1) : libId;
    }
}
