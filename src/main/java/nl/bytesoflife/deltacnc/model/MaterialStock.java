package nl.bytesoflife.deltacnc.model;

import nl.bytesoflife.deltacnc.tube.TubeProfile;

/**
 * The stock being machined. Width and height span the machined face,
 * thickness is the default material depth.
 *
 * @param tubeProfile hollow profile for rectangular tube stock, or null for flat stock
 */
public record MaterialStock(
        String name,
        double width,
        double height,
        double thickness,
        TubeProfile tubeProfile
) {
    public MaterialStock {
        if (name == null || name.isBlank()) {
            throw new InvalidOperationException("Material name must not be blank");
        }
        if (!(width > 0) || !(height > 0) || !(thickness > 0)) {
            throw new InvalidOperationException(
                    "Material dimensions must be > 0, got " + width + " x " + height + " x " + thickness);
        }
    }

    public static MaterialStock sheet(String name, double width, double height, double thickness) {
        return new MaterialStock(name, width, height, thickness, null);
    }

    public boolean isTube() {
        return tubeProfile != null;
    }
}
