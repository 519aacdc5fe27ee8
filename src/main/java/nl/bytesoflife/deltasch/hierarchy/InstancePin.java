package nl.bytesoflife.deltasch.hierarchy;

import nl.bytesoflife.deltasch.connectivity.PinRef;

public record InstancePin(String path, PinRef pin) implements Comparable<InstancePin> {

    @Override
    public int compareTo(InstancePin other) {
        int byPath = path.compareTo(other.path);
        return byPath != 0 ? byPath : pin.compareTo(other.pin);
    }

    @Override
    public String toString() {
        return path + pin;
    }
}
