package nl.bytesoflife.deltasch.symbol;

import nl.bytesoflife.deltasch.model.Point;

/**
 * A pin of a library symbol.
 *
 * @param position connection point in library coordinates, Y growing upwards
 * @param rotation direction the pin body points to, in degrees
 * @param unit     unit the pin belongs to, 0 for pins shared by all units
 */
public record SymbolPin(String number, String name, Point position, double rotation, double length,
                        PinElectricalType type, int unit, boolean hidden) {

    /**
     * The inner end of the pin, where it meets the symbol body.
     */
    public Point bodyEnd() {
        double radians = Math.toRadians(rotation);
        return new Point(position.x() + length * Math.cos(radians),
                position.y() + length * Math.sin(radians)).snapped();
    }
}
