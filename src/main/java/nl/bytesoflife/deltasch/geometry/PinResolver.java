package nl.bytesoflife.deltasch.geometry;

import nl.bytesoflife.deltasch.model.Component;
import nl.bytesoflife.deltasch.model.MirrorAxis;
import nl.bytesoflife.deltasch.model.Point;
import nl.bytesoflife.deltasch.symbol.SymbolDefinition;
import nl.bytesoflife.deltasch.symbol.SymbolPin;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sheet coordinates of symbol pins.
 * <p>
 * Library symbols are drawn Y-up, schematics Y-down. A library point is flipped into sheet
 * orientation, mirrored, rotated counter-clockwise as seen on screen and finally moved to the
 * component position.
 */
public class PinResolver {

    /**
     * @throws PinNotFoundException     if the component's unit has no pin with that number
     * @throws IllegalArgumentException if the component is rotated by something other than a
     *                                  multiple of 90 degrees
     */
    public Point resolvePinPosition(Component component, String pinNumber, SymbolDefinition definition)
            throws PinNotFoundException {
        SymbolPin pin = definition.findPin(pinNumber, component.getUnit())
                .orElseThrow(() -> new PinNotFoundException(component.getReference(), pinNumber,
                        definition.getLibId()));
        return transform(pin.position(), component);
    }

    /**
     * Pin number to sheet position for every pin of the component's unit, in library order.
     */
    public Map<String, Point> resolveAll(Component component, SymbolDefinition definition) {
        Map<String, Point> positions = new LinkedHashMap<>();
        for (SymbolPin pin : definition.getPins(component.getUnit())) {
            positions.putIfAbsent(pin.number(), transform(pin.position(), component));
        }
        return positions;
    }

    /**
     * Sheet-space extent of the component's body and pins, {@code null} for an empty symbol.
     */
    public BoundingBox boundingBox(Component component, SymbolDefinition definition) {
        BoundingBox local = definition.getBounds();
        if (local == null) {
            return null;
        }
        List<Point> corners = new ArrayList<>(4);
        corners.add(transform(new Point(local.minX(), local.minY()), component));
        corners.add(transform(new Point(local.maxX(), local.minY()), component));
        corners.add(transform(new Point(local.minX(), local.maxY()), component));
        corners.add(transform(new Point(local.maxX(), local.maxY()), component));
        return BoundingBox.around(corners);
    }

    public static Point transform(Point libraryPoint, Component component) {
        return transform(libraryPoint, component.getPosition(), component.getRotation(), component.getMirror());
    }

    public static Point transform(Point libraryPoint, Point position, double rotation, MirrorAxis mirror) {
        int angle = Component.normalizeRotation(rotation);
        double x = libraryPoint.x();
        double y = -libraryPoint.y();
        if (mirror == MirrorAxis.X) {
            y = -y;
        } else if (mirror == MirrorAxis.Y) {
            x = -x;
        }
        double rx;
        double ry;
        switch (angle) {
            case 90 -> {
                rx = y;
                ry = -x;
            }
            case 180 -> {
                rx = -x;
                ry = -y;
            }
            case 270 -> {
                rx = -y;
                ry = x;
            }
            default -> {
                rx = x;
                ry = y;
            }
        }
        return new Point(position.x() + rx, position.y() + ry).snapped();
    }
}
