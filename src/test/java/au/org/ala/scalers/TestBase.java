package au.org.ala.scalers;

import java.awt.image.BufferedImage;

public class TestBase {

    protected void println(String fmt, Object...args) {
        System.out.println(String.format(fmt, args));
    }

    /**
     * Builds a TYPE_INT_ARGB image from pixels given row by row.
     */
    protected BufferedImage image(int width, int height, int... argb) {
        if (argb.length != width * height) {
            throw new IllegalArgumentException(String.format("%d pixels for a %dx%d image", argb.length, width, height));
        }
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        image.setRGB(0, 0, width, height, argb, 0, width);
        return image;
    }

    protected BufferedImage solidImage(int width, int height, int argb) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.setRGB(x, y, argb);
            }
        }
        return image;
    }

    /**
     * A deterministic, busy test pattern: diagonal gradients with a few hard edges.
     */
    protected BufferedImage patternImage(int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int r = (x * 255) / Math.max(1, width - 1);
                int g = (y * 255) / Math.max(1, height - 1);
                int b = ((x / 3 + y / 5) % 2 == 0) ? 0 : 255;
                image.setRGB(x, y, 0xff000000 | (r << 16) | (g << 8) | b);
            }
        }
        return image;
    }

    protected int[] pixels(BufferedImage image) {
        return image.getRGB(0, 0, image.getWidth(), image.getHeight(), null, 0, image.getWidth());
    }
}
