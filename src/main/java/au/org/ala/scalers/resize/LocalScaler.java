package au.org.ala.scalers.resize;

import au.org.ala.scalers.Dimension;
import au.org.ala.scalers.ScaleFactor;
import au.org.ala.scalers.ScalerQuality;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;

public class LocalScaler {

    private static final Logger log = LoggerFactory.getLogger(LocalScaler.class);

    public static void main(String[] args) throws IOException {
        if (args.length < 3) {
            usage();
            System.exit(0);
        }

        ScalerDescriptor<?> descriptor = ScalerRegistry.find(args[0]).orElse(null);
        if (descriptor == null) {
            error(String.format("Unknown scaler: %s", args[0]));
            return;
        }

        File input = new File(args[2]);
        if (!input.exists()) {
            error(String.format("Invalid file name: %s", args[2]));
            return;
        }
        File output = args.length > 3 ? new File(args[3]) : defaultOutput(input, descriptor, args[1]);

        BufferedImage image = ImageIO.read(input);
        if (image == null) {
            error(String.format("Unsupported image format: %s", input));
            return;
        }

        Stopwatch sw = Stopwatch.createStarted();
        BufferedImage result = scale(new Scalers(), descriptor, args[1], image);
        String format = StringUtils.defaultIfEmpty(FilenameUtils.getExtension(output.getName()), "png").toLowerCase();
        if (!ImageIO.write(result, format, output)) {
            error(String.format("No image writer for format %s", format));
            return;
        }
        log.info("Scaled {} ({}x{}) with {} to {} ({}x{}) in {}", input, image.getWidth(), image.getHeight(),
                descriptor.getName(), output, result.getWidth(), result.getHeight(), sw);
    }

    /**
     * A size such as {@code 640x480px} fits the image to exactly that size; anything else is read as a scale factor.
     */
    static BufferedImage scale(Scalers scalers, ScalerDescriptor<?> descriptor, String scaleOrSize, BufferedImage image) {
        Dimension size = parseSize(scaleOrSize);
        if (size != null) {
            return scalers.scaleToFit(image, size.width, size.height, ImmutableList.of(descriptor), ScalerQuality.HIGH_QUALITY);
        }
        return scalers.scale(image, descriptor.create(ScaleFactor.parse(scaleOrSize)), ScalerQuality.HIGH_QUALITY);
    }

    /**
     * @return the size for text of the form {@code WxHpx}, or {@code null} for anything without the {@code px}
     * suffix
     */
    static Dimension parseSize(String text) {
        if (!StringUtils.endsWithIgnoreCase(text, "px")) {
            return null;
        }
        String[] parts = StringUtils.split(StringUtils.removeEndIgnoreCase(text, "px").toLowerCase(), 'x');
        if (parts.length != 2 || !StringUtils.isNumeric(parts[0]) || !StringUtils.isNumeric(parts[1])) {
            throw new IllegalArgumentException("Invalid size: " + text);
        }
        return new Dimension(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
    }

    private static File defaultOutput(File input, ScalerDescriptor<?> descriptor, String scaleOrSize) {
        String name = String.format("%s-%s-%s.png", FilenameUtils.getBaseName(input.getName()),
                StringUtils.deleteWhitespace(descriptor.getName()).toLowerCase(), scaleOrSize.toLowerCase());
        return new File(input.getAbsoluteFile().getParentFile(), name);
    }

    private static void usage() {
        System.out.println("LocalScaler <scaler> <scale|WxHpx> <input> [output]");
        System.out.println("Scalers:");
        for (ScalerDescriptor<?> descriptor : ScalerRegistry.all()) {
            System.out.printf("  %-20s %s%n", descriptor.getName(), StringUtils.defaultString(descriptor.getDescription()));
        }
    }

    private static void error(String message) {
        System.err.println(message);
        System.exit(-1);
    }
}
