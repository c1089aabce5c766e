package stages;

import model.CfaPattern;
import model.Channel;
import model.ColorImage;
import model.PixelBuffer;
import model.RawFrame;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Demosaic by direct placement: each CFA sample goes to its own channel of a zero RGB
 * buffer, then the gaps of every channel are filled with the largest sample of that
 * channel in the 3×3 neighbourhood. Works on 8-bit values throughout.
 *
 * Less accurate than {@link ConvolutionDemosaicer} on smooth gradients but never blends
 * samples, so it tolerates sensor layouts that are not a clean bilinear fit.
 */
public final class DilationDemosaicer implements Demosaicer {

    private static final Logger logger = LoggerFactory.getLogger(DilationDemosaicer.class);

    private final CfaPattern fixedPattern;

    /** Uses each frame's own CFA pattern. */
    public DilationDemosaicer() {
        this(null);
    }

    /** Ignores the frames' tags and always samples with the given pattern (null = use the frame's). */
    public DilationDemosaicer(CfaPattern fixedPattern) {
        this.fixedPattern = fixedPattern;
    }

    @Override
    public String name() {
        return "dilation";
    }

    @Override
    public ColorImage demosaic(RawFrame frame) {
        int[] gray = toGray8(frame.pixels());
        int w = frame.width(), h = frame.height();
        CfaPattern pattern = fixedPattern != null ? fixedPattern : frame.cfaPattern();

        int nch = Channel.values().length;
        int[][] planes = new int[nch][w * h];
        boolean[][] sampled = new boolean[nch][w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int i = y * w + x;
                int c = pattern.channelAt(y, x).index();
                planes[c][i] = gray[i];
                sampled[c][i] = true;
            }
        }

        byte[] out = new byte[w * h * ColorImage.RGB];
        for (int c = 0; c < nch; c++) {
            int[] filled = PlaneFilters.maxFill3x3(planes[c], sampled[c], w, h);
            for (int i = 0; i < filled.length; i++)
                out[i * ColorImage.RGB + c] = (byte) filled[i];
        }

        logger.debug("Dilation-demosaiced {} ({}x{}, {})", frame.identifier(), w, h, pattern);
        return new ColorImage(w, h, ColorImage.RGB, out);
    }

    /** Channel mean, rescaled to 8 bits and truncated. */
    static int[] toGray8(PixelBuffer pixels) {
        PixelBuffer mono = pixels.averageChannels();
        float[] plane = mono.toPlane();
        double scale = 255.0 / mono.fullScale();
        int[] out = new int[plane.length];
        for (int i = 0; i < plane.length; i++)
            out[i] = PlaneFilters.clamp8(plane[i] * scale);
        return out;
    }
}
