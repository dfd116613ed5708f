package au.org.ala.scalers.util;

import org.imgscalr.Scalr;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

public class ImageUtils {

    /**
     * Resizes to exactly {@code destWidth x destHeight}, ignoring the aspect ratio of {@code src}.
     */
    public static BufferedImage scale(BufferedImage src, int destWidth, int destHeight) {
        BufferedImage scaled = Scalr.resize(src, Scalr.Method.QUALITY, Scalr.Mode.FIT_EXACT, destWidth, destHeight, Scalr.OP_ANTIALIAS);
        return toIntArgb(scaled);
    }

    /**
     * Returns {@code src} itself when it is already {@link BufferedImage#TYPE_INT_ARGB}, otherwise a converted copy.
     */
    public static BufferedImage toIntArgb(BufferedImage src) {
        if (src.getType() == BufferedImage.TYPE_INT_ARGB) {
            return src;
        }
        BufferedImage converted = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = converted.createGraphics();
        try {
            g.drawImage(src, 0, 0, null);
        } finally {
            g.dispose();
        }
        return converted;
    }

}
