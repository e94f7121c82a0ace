package kymograph.processing;

import kymograph.image.BoundingBox;
import kymograph.image.Image;

/**
 * Rotation with interpolation of a single plane image
 */
public interface Rotator {
    /**
     * Rotates {@param image} counter-clockwise as displayed (Y axis pointing down) around its center. Pixels mapped from outside the source are zeros.
     * @param degrees rotation angle in degrees
     * @param expand if true the output is enlarged to contain the whole rotated image, otherwise it has the size of the input
     * @return rotated image. Type may differ from the input type when values are interpolated
     */
    Image rotate(Image image, double degrees, boolean expand);

    /**
     * @param bounds relative to {@param image}, parts outside the image are filled with zeros
     */
    default Image crop(Image image, BoundingBox bounds) {
        return image.crop(bounds);
    }
}
