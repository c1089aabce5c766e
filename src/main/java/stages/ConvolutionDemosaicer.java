package stages;

import model.CfaPattern;
import model.Channel;
import model.ColorImage;
import model.PixelBuffer;
import model.RawFrame;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bilinear demosaic: each channel's samples are masked out of the CFA plane and
 * convolved with a fixed 3×3 kernel that interpolates the missing sites.
 *
 * <pre>
 *   G:      0 1 0        R, B:  1 2 1
 *           1 4 1  / 4          2 4 2  / 4
 *           0 1 0               1 2 1
 * </pre>
 *
 * Defaults: full-scale normalization and mirrored borders, so a uniform frame comes
 * back uniform and 8-bit input is reproduced exactly at sampled sites.
 * <p>
 * A frame one pixel wide or high has no neighbours across its thin axis, so under MIRROR
 * each site is divided by the kernel weight that actually landed on that channel's samples
 * instead of the fixed 4. A channel with no sites in such a frame stays 0.
 */
public final class ConvolutionDemosaicer implements Demosaicer {

    private static final Logger logger = LoggerFactory.getLogger(ConvolutionDemosaicer.class);

    static final int[] KERNEL_G = {
            0, 1, 0,
            1, 4, 1,
            0, 1, 0
    };
    static final int[] KERNEL_RB = {
            1, 2, 1,
            2, 4, 2,
            1, 2, 1
    };
    static final int KERNEL_DIVISOR = 4;

    private final Normalization normalization;
    private final BorderMode border;

    public ConvolutionDemosaicer() {
        this(Normalization.FULL_SCALE, BorderMode.MIRROR);
    }

    public ConvolutionDemosaicer(Normalization normalization, BorderMode border) {
        this.normalization = normalization;
        this.border = border;
    }

    @Override
    public String name() {
        return "convolution";
    }

    @Override
    public ColorImage demosaic(RawFrame frame) {
        PixelBuffer gray = frame.pixels().averageChannels();
        int w = gray.width(), h = gray.height();
        byte[] out = new byte[w * h * ColorImage.RGB];

        double divisor = normalization == Normalization.PEAK ? gray.max() : gray.fullScale();
        if (!(divisor > 0)) {
            logger.debug("Frame {} has no positive samples; returning black image", frame.identifier());
            return new ColorImage(w, h, ColorImage.RGB, out);
        }
        // normalize, divide by the kernel weight and rescale to 8 bits in one step
        double factor = 255.0 / (KERNEL_DIVISOR * divisor);

        boolean thin = border == BorderMode.MIRROR && (w == 1 || h == 1);
        float[][] masked = splitChannels(gray.toPlane(), w, h, frame.cfaPattern());
        float[][] sites = thin ? channelSites(w, h, frame.cfaPattern()) : null;
        for (Channel ch : Channel.values()) {
            int c = ch.index();
            int[] kernel = ch == Channel.G ? KERNEL_G : KERNEL_RB;
            double[] acc = PlaneFilters.convolve3x3(masked[c], w, h, kernel, border);
            double[] weight = thin ? PlaneFilters.convolve3x3(sites[c], w, h, kernel, border) : null;
            for (int i = 0; i < acc.length; i++) {
                double f = factor;
                if (weight != null && weight[i] > 0)
                    f = factor * KERNEL_DIVISOR / weight[i];
                out[i * ColorImage.RGB + c] = (byte) PlaneFilters.clamp8(acc[i] * f);
            }
        }

        logger.debug("Demosaiced {} ({}x{}, {}, {} border)", frame.identifier(), w, h, frame.cfaPattern(), border);
        return new ColorImage(w, h, ColorImage.RGB, out);
    }

    /** One zeroed plane per channel holding only that channel's CFA samples. */
    static float[][] splitChannels(float[] plane, int w, int h, CfaPattern pattern) {
        float[][] masked = new float[Channel.values().length][w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int i = y * w + x;
                masked[pattern.channelAt(y, x).index()][i] = plane[i];
            }
        }
        return masked;
    }

    /** 1 where the site belongs to the channel, 0 elsewhere. */
    static float[][] channelSites(int w, int h, CfaPattern pattern) {
        float[][] sites = new float[Channel.values().length][w * h];
        for (int y = 0; y < h; y++)
            for (int x = 0; x < w; x++)
                sites[pattern.channelAt(y, x).index()][y * w + x] = 1f;
        return sites;
    }
}
