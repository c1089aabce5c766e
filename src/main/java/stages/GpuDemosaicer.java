package stages;

import model.CfaPattern;
import model.ColorImage;
import model.PixelBuffer;
import model.RawFrame;

import org.jocl.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.jocl.CL.*;

/**
 * Bilinear demosaic on GPU using JOCL (OpenCL 1.x/2.0).
 * Same kernels, full-scale normalization and mirrored border as {@link ConvolutionDemosaicer}.
 * Falls back to the CPU implementation if no compatible GPU/OpenCL is available.
 */
public final class GpuDemosaicer implements Demosaicer {

    private static final Logger logger = LoggerFactory.getLogger(GpuDemosaicer.class);

    private static final String KERNEL = """
                __constant int KG[9]  = { 0, 1, 0,  1, 4, 1,  0, 1, 0 };
                __constant int KRB[9] = { 1, 2, 1,  2, 4, 2,  1, 2, 1 };

                // frames are at least 2x2 here; thinner ones stay on the CPU
                int mirror(int i, int n)
                {
                    if (i < 0) return -i;
                    if (i >= n) return 2 * n - 2 - i;
                    return i;
                }

                __kernel void bilinearDemosaic(
                    __global const float* plane,
                    __global uchar* rgb,
                    const int width,
                    const int height,
                    const int4 tile,          // channel of sites (0,0) (0,1) (1,0) (1,1)
                    const float factor)       // 255 / (4 * divisor)
                {
                    int x = get_global_id(0);
                    int y = get_global_id(1);
                    if (x >= width || y >= height) return;

                    float acc[3] = { 0.0f, 0.0f, 0.0f };
                    for (int j = -1; j <= 1; j++) {
                        int yy = mirror(y + j, height);
                        for (int i = -1; i <= 1; i++) {
                            int xx = mirror(x + i, width);
                            int site = ((yy & 1) << 1) | (xx & 1);
                            int c = site == 0 ? tile.x : site == 1 ? tile.y : site == 2 ? tile.z : tile.w;
                            int k = (j + 1) * 3 + (i + 1);
                            float wgt = (c == 1) ? KG[k] : KRB[k];
                            acc[c] += wgt * plane[yy * width + xx];
                        }
                    }

                    int o = (y * width + x) * 3;
                    for (int c = 0; c < 3; c++)
                        rgb[o + c] = (uchar) clamp(acc[c] * factor, 0.0f, 255.0f);
                }
            """;

    private final ConvolutionDemosaicer cpu = new ConvolutionDemosaicer(Normalization.FULL_SCALE, BorderMode.MIRROR);

    @Override
    public String name() {
        return "gpu";
    }

    @Override
    public ColorImage demosaic(RawFrame frame) {
        if (frame.width() < 2 || frame.height() < 2)
            return cpu.demosaic(frame);
        try {
            return runOnGpu(frame);
        } catch (Throwable t) {
            logger.warn("[GPU] Falling back to CPU for {}: {}", frame.identifier(), t.getMessage());
            return cpu.demosaic(frame);
        }
    }

    // ---- JOCL implementation ----
    private static ColorImage runOnGpu(RawFrame frame) {
        CL.setExceptionsEnabled(true);

        PixelBuffer gray = frame.pixels().averageChannels();
        int w = gray.width();
        int h = gray.height();
        float[] plane = gray.toPlane();
        byte[] rgb = new byte[w * h * ColorImage.RGB];

        CfaPattern p = frame.cfaPattern();
        int[] tile = {
                p.channelAt(0, 0).index(), p.channelAt(0, 1).index(),
                p.channelAt(1, 0).index(), p.channelAt(1, 1).index()
        };
        float factor = (float) (255.0 / (ConvolutionDemosaicer.KERNEL_DIVISOR * gray.fullScale()));

        // --- Platform & device ---
        int[] numPlatforms = new int[1];
        clGetPlatformIDs(0, null, numPlatforms);
        if (numPlatforms[0] == 0)
            throw new IllegalStateException("No OpenCL platforms found");

        cl_platform_id[] platforms = new cl_platform_id[numPlatforms[0]];
        clGetPlatformIDs(platforms.length, platforms, null);
        cl_platform_id platform = platforms[0];

        int[] numDevices = new int[1];
        int err = clGetDeviceIDs(platform, CL_DEVICE_TYPE_GPU, 0, null, numDevices);
        if (err != CL_SUCCESS || numDevices[0] == 0)
            throw new IllegalStateException("No OpenCL GPU device found");

        cl_device_id[] devices = new cl_device_id[numDevices[0]];
        clGetDeviceIDs(platform, CL_DEVICE_TYPE_GPU, devices.length, devices, null);
        cl_device_id device = devices[0];

        // --- Context & queue ---
        cl_context_properties props = new cl_context_properties();
        props.addProperty(CL_CONTEXT_PLATFORM, platform);

        cl_context context = clCreateContext(props, 1, new cl_device_id[] { device }, null, null, null);
        cl_command_queue queue = null;
        cl_program program = null;
        cl_kernel kernel = null;
        cl_mem in = null;
        cl_mem out = null;
        try {
            queue = clCreateCommandQueueWithProperties(context, device, new cl_queue_properties(), null);

            // --- Program & kernel ---
            program = clCreateProgramWithSource(context, 1, new String[] { KERNEL }, null, null);
            clBuildProgram(program, 0, null, null, null, null);
            kernel = clCreateKernel(program, "bilinearDemosaic", null);

            // --- Device buffers ---
            in = clCreateBuffer(context,
                    CL_MEM_READ_ONLY | CL_MEM_COPY_HOST_PTR,
                    (long) Sizeof.cl_float * plane.length, Pointer.to(plane), null);
            out = clCreateBuffer(context, CL_MEM_WRITE_ONLY,
                    (long) Sizeof.cl_uchar * rgb.length, null, null);

            // --- Kernel args ---
            clSetKernelArg(kernel, 0, Sizeof.cl_mem, Pointer.to(in));
            clSetKernelArg(kernel, 1, Sizeof.cl_mem, Pointer.to(out));
            clSetKernelArg(kernel, 2, Sizeof.cl_int, Pointer.to(new int[] { w }));
            clSetKernelArg(kernel, 3, Sizeof.cl_int, Pointer.to(new int[] { h }));
            clSetKernelArg(kernel, 4, Sizeof.cl_int * 4, Pointer.to(tile));
            clSetKernelArg(kernel, 5, Sizeof.cl_float, Pointer.to(new float[] { factor }));

            // --- Launch ---
            long[] global = new long[] { w, h };
            clEnqueueNDRangeKernel(queue, kernel, 2, null, global, null, 0, null, null);

            // --- Read back ---
            clEnqueueReadBuffer(queue, out, CL_TRUE, 0,
                    (long) Sizeof.cl_uchar * rgb.length, Pointer.to(rgb), 0, null, null);
        } finally {
            // --- Cleanup: only what was created ---
            if (in != null)
                clReleaseMemObject(in);
            if (out != null)
                clReleaseMemObject(out);
            if (kernel != null)
                clReleaseKernel(kernel);
            if (program != null)
                clReleaseProgram(program);
            if (queue != null)
                clReleaseCommandQueue(queue);
            clReleaseContext(context);
        }

        logger.debug("GPU demosaiced {} ({}x{}, {})", frame.identifier(), w, h, p);
        return new ColorImage(w, h, ColorImage.RGB, rgb);
    }
}
