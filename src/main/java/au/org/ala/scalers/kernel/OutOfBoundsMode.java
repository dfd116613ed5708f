package au.org.ala.scalers.kernel;

/**
 * How a {@link NeighborFrame} answers reads outside the source image.
 */
public enum OutOfBoundsMode {
    /** Repeat the edge pixel: {@code aaa|abcde|eee}. */
    CLAMP {
        @Override
        int outside(int coord, int size) {
            return coord < 0 ? 0 : size - 1;
        }
    },
    /** Mirror at the pixel edge: {@code cba|abcde|edc}. */
    HALF {
        @Override
        int outside(int coord, int size) {
            return coord < 0 ? -coord - 1 : 2 * size - coord - 1;
        }
    },
    /** Mirror at the pixel centre: {@code dcb|abcde|dcb}. */
    WHOLE {
        @Override
        int outside(int coord, int size) {
            return coord < 0 ? -coord : 2 * size - coord - 2;
        }
    },
    /** Tile the image: {@code cde|abcde|abc}. */
    WRAP {
        @Override
        int outside(int coord, int size) {
            return Math.floorMod(coord, size);
        }
    };

    abstract int outside(int coord, int size);

    /**
     * Maps {@code coord} into {@code [0, size)}. Mirrored reads further out than one image length fall back to
     * clamping.
     */
    public int resolve(int coord, int size) {
        if (coord >= 0 && coord < size) {
            return coord;
        }
        int resolved = outside(coord, size);
        if (resolved < 0) {
            return 0;
        }
        return resolved >= size ? size - 1 : resolved;
    }
}
