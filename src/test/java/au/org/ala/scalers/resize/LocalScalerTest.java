package au.org.ala.scalers.resize;

import au.org.ala.scalers.Dimension;
import au.org.ala.scalers.TestBase;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.File;

@RunWith(JUnit4.class)
public class LocalScalerTest extends TestBase {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testParseSize() {
        Assert.assertEquals(new Dimension(640, 480), LocalScaler.parseSize("640x480px"));
        Assert.assertEquals(new Dimension(3, 2), LocalScaler.parseSize("3X2PX"));
        Assert.assertNull(LocalScaler.parseSize("2x"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testParseInvalidSize() {
        LocalScaler.parseSize("wide x tall px");
    }

    @Test
    public void testScalesFile() throws Exception {
        File input = folder.newFile("pattern.png");
        ImageIO.write(patternImage(12, 8), "png", input);
        File output = new File(folder.getRoot(), "scaled.png");

        LocalScaler.main(new String[]{"Scale", "3x", input.getPath(), output.getPath()});

        BufferedImage scaled = ImageIO.read(output);
        Assert.assertEquals(36, scaled.getWidth());
        Assert.assertEquals(24, scaled.getHeight());
    }

    @Test
    public void testDefaultOutputName() throws Exception {
        File input = folder.newFile("pattern.png");
        ImageIO.write(patternImage(12, 8), "png", input);

        LocalScaler.main(new String[]{"catmull-rom", "20x10px", input.getPath()});

        BufferedImage scaled = ImageIO.read(new File(folder.getRoot(), "pattern-catmull-rom-20x10px.png"));
        Assert.assertEquals(20, scaled.getWidth());
        Assert.assertEquals(10, scaled.getHeight());
    }
}
