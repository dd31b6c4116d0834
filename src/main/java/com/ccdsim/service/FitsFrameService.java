package com.ccdsim.service;

import com.ccdsim.model.AuxiliaryArray;
import com.ccdsim.model.CcdSimException;
import com.ccdsim.model.Converter;
import com.ccdsim.model.Direction;
import com.ccdsim.model.Fault;
import com.ccdsim.model.FrameMetadata;
import com.ccdsim.model.HeaderIssue;
import com.ccdsim.model.Parameters;
import com.ccdsim.model.Slice;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.util.ArrayFuncs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.List;

/**
 * Loads converters from FITS frames and writes finished converters back out.
 */
public class FitsFrameService {

    private static final Logger log = LoggerFactory.getLogger(FitsFrameService.class);

    private final FitsHeaderService headerService;

    public FitsFrameService() {
        this(new FitsHeaderService());
    }

    public FitsFrameService(FitsHeaderService headerService) {
        this.headerService = headerService;
    }

    public Converter readElectronFlux(File input, SettingsOverrides overrides, String command)
            throws IOException, FitsException {
        return read(input, Direction.ELECTRON_FLUX, overrides, command);
    }

    public Converter readRaw(File input, SettingsOverrides overrides, String command)
            throws IOException, FitsException {
        return read(input, Direction.RAW, overrides, command);
    }

    private Converter read(File input, Direction direction, SettingsOverrides overrides, String command)
            throws IOException, FitsException {
        try (Fits fits = new Fits(input)) {
            BasicHDU<?>[] hdus = fits.read();
            if (hdus == null || hdus.length != 1) {
                throw new CcdSimException(Fault.SHAPE_MISMATCH, "Only a single image per FITS file is supported, "
                        + input.getName() + " has " + (hdus == null ? 0 : hdus.length) + " HDUs");
            }
            Header header = hdus[0].getHeader();
            ResolvedSettings settings = SettingResolver.resolveAll(direction, overrides,
                    headerService.keywords(header));
            for (HeaderIssue issue : settings.getIssues()) {
                log.warn("{}: {}", input.getName(), issue);
            }

            Parameters parameters = settings.getParameters();
            double[][] frame = toDoubleImage(hdus[0].getKernel(), header);
            List<Slice> slices = direction == Direction.RAW
                    ? FrameLayout.splitRaw(frame, parameters.getNumberOfSlices(), parameters.geometry())
                    : FrameLayout.splitElectronFlux(frame, parameters.getNumberOfSlices(), parameters.geometry());
            log.info("Read {} frame {} ({}x{}) as {} slice(s)", direction, input.getName(),
                    frame.length, frame[0].length, slices.size());

            FrameMetadata metadata = new FrameMetadata(input.getPath(), command, header);
            return new Converter(direction, slices, metadata, parameters, settings.getFlags());
        }
    }

    public void writeRaw(Converter converter, File output, boolean overwrite) throws IOException, FitsException {
        write(converter, FrameLayout.assembleRaw(converter.getSlices(), converter.getParameters().geometry()),
                output, overwrite);
    }

    public void writeCalibrated(Converter converter, File output, boolean overwrite)
            throws IOException, FitsException {
        write(converter, FrameLayout.assembleCalibrated(converter.getSlices(), converter.getParameters().geometry()),
                output, overwrite);
    }

    private void write(Converter converter, double[][] frame, File output, boolean overwrite)
            throws IOException, FitsException {
        if (output.exists()) {
            if (!overwrite) {
                throw new IOException("Output file " + output.getPath() + " already exists (use --force to overwrite)");
            }
            Files.delete(output.toPath());
        }
        BasicHDU<?> hdu = Fits.makeHDU(frame);
        Header header = hdu.getHeader();
        headerService.copyCards(converter.getMetadata().getHeader(), header);
        headerService.writeSettings(header, converter.getParameters(), converter.getFlags());
        headerService.addHistory(header, converter.getMetadata().getCommand());

        try (Fits fits = new Fits()) {
            fits.addHDU(hdu);
            fits.write(output);
        }
        log.info("Wrote {} ({}x{})", output.getPath(), frame.length, frame[0].length);
    }

    /**
     * Converts a 2-D image kernel to doubles. {@code BSCALE}/{@code BZERO} are applied to integer
     * kernels, so unsigned 16-bit frames come out in their true range.
     */
    static double[][] toDoubleImage(Object kernel, Header header) {
        double scale = header == null ? 1.0 : header.getDoubleValue("BSCALE", 1.0);
        double zero = header == null ? 0.0 : header.getDoubleValue("BZERO", 0.0);

        if (kernel instanceof double[][]) {
            double[][] k = (double[][]) kernel;
            double[][] d = new double[k.length][];
            for (int i = 0; i < k.length; i++) d[i] = k[i].clone();
            return requireImage(d);
        }
        if (kernel instanceof float[][]) {
            float[][] k = (float[][]) kernel;
            double[][] d = new double[k.length][k.length == 0 ? 0 : k[0].length];
            for (int i = 0; i < k.length; i++) for (int j = 0; j < k[i].length; j++) d[i][j] = k[i][j];
            return requireImage(d);
        }
        if (kernel instanceof short[][]) {
            short[][] k = (short[][]) kernel;
            double[][] d = new double[k.length][k.length == 0 ? 0 : k[0].length];
            for (int i = 0; i < k.length; i++) for (int j = 0; j < k[i].length; j++) d[i][j] = k[i][j] * scale + zero;
            return requireImage(d);
        }
        if (kernel instanceof int[][]) {
            int[][] k = (int[][]) kernel;
            double[][] d = new double[k.length][k.length == 0 ? 0 : k[0].length];
            for (int i = 0; i < k.length; i++) for (int j = 0; j < k[i].length; j++) d[i][j] = k[i][j] * scale + zero;
            return requireImage(d);
        }
        if (kernel instanceof long[][]) {
            long[][] k = (long[][]) kernel;
            double[][] d = new double[k.length][k.length == 0 ? 0 : k[0].length];
            for (int i = 0; i < k.length; i++) for (int j = 0; j < k[i].length; j++) d[i][j] = k[i][j] * scale + zero;
            return requireImage(d);
        }
        throw new CcdSimException(Fault.SHAPE_MISMATCH, "Unsupported FITS image data: "
                + (kernel == null ? "none" : kernel.getClass().getSimpleName()) + " (expected a 2-D numeric array)");
    }

    private static double[][] requireImage(double[][] image) {
        if (image.length == 0 || image[0].length == 0) {
            throw new CcdSimException(Fault.SHAPE_MISMATCH, "FITS image is empty");
        }
        return image;
    }

    /** Reads the primary array of a FITS file of any dimensionality, in C order. */
    public static AuxiliaryArray readArray(File file) throws IOException, FitsException {
        try (Fits fits = new Fits(file)) {
            BasicHDU<?> hdu = fits.getHDU(0);
            Object kernel = hdu == null ? null : hdu.getKernel();
            if (kernel == null || !kernel.getClass().isArray()) {
                throw new CcdSimException(Fault.RESOURCE, "No array data in " + file.getName());
            }
            int[] shape = ArrayFuncs.getDimensions(kernel);
            double[] data = (double[]) ArrayFuncs.flatten(ArrayFuncs.convertArray(kernel, double.class));
            return new AuxiliaryArray(shape, data);
        }
    }
}
