package nl.bytesoflife.deltasch.symbol;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * A small bundled symbol set: {@code Device} (R, C, L, LED, D) and {@code power} (GND, +5V, +3V3,
 * VCC), loaded from the classpath on first use.
 */
public class BuiltinSymbols {

    private static volatile SymbolResolver cached;

    public static SymbolResolver resolver() {
        if (cached == null) {
            synchronized (BuiltinSymbols.class) {
                if (cached == null) {
                    cached = new CachingSymbolResolver(new CompositeSymbolResolver(
                            device(), power()));
                }
            }
        }
        return cached;
    }

    public static SymbolLibrary device() {
        return load("Device", "/symbols/Device.kicad_sym");
    }

    public static SymbolLibrary power() {
        return load("power", "/symbols/power.kicad_sym");
    }

    private static SymbolLibrary load(String nickname, String resource) {
        try (InputStream is = BuiltinSymbols.class.getResourceAsStream(resource)) {
            if (is == null) throw new IllegalStateException("Resource not found: " + resource);
            String content = new String(is.readAllBytes(), StandardCharsets.UTF_8);
            return SymbolLibrary.parse(nickname, content);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load symbol library " + nickname, e);
        }
    }
}
