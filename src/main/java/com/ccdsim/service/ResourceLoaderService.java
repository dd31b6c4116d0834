package com.ccdsim.service;

import com.ccdsim.model.AuxiliaryArray;
import com.ccdsim.model.CcdSimException;
import com.ccdsim.model.Fault;
import nom.tam.fits.FitsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Loads auxiliary arrays (start of line ringing, pattern noise) by reference.
 * <p>
 * {@code "built-in <name>"} resolves against the bundled {@code ccdsim/data} directory, anything
 * else is a filesystem path. Supported are single-entry {@code .npz} archives, bare {@code .npy}
 * arrays and, from the filesystem, the primary array of a {@code .fits} file. Loaded arrays are
 * cached for the lifetime of the loader.
 */
public class ResourceLoaderService implements AuxiliaryArraySource {

    private static final Logger log = LoggerFactory.getLogger(ResourceLoaderService.class);

    public static final String BUILT_IN_PREFIX = "built-in ";
    private static final String BUILT_IN_DIRECTORY = "/ccdsim/data/";

    private static final byte[] NPY_MAGIC = {(byte) 0x93, 'N', 'U', 'M', 'P', 'Y'};
    private static final Pattern DESCR = Pattern.compile("'descr'\\s*:\\s*'([^']+)'");
    private static final Pattern FORTRAN_ORDER = Pattern.compile("'fortran_order'\\s*:\\s*(True|False)");
    private static final Pattern SHAPE = Pattern.compile("'shape'\\s*:\\s*\\(([^)]*)\\)");

    private final Map<String, AuxiliaryArray> cache = new HashMap<>();

    @Override
    public AuxiliaryArray load(String reference) {
        AuxiliaryArray cached = cache.get(reference);
        if (cached != null) {
            return cached;
        }
        AuxiliaryArray array;
        try {
            array = reference.startsWith(BUILT_IN_PREFIX)
                    ? loadBuiltIn(reference.substring(BUILT_IN_PREFIX.length()).trim())
                    : loadFile(new File(reference));
        } catch (IOException | FitsException e) {
            throw new CcdSimException(Fault.RESOURCE, "Could not load " + reference + ": " + e.getMessage(), e);
        }
        log.debug("Loaded {} as {}", reference, array);
        cache.put(reference, array);
        return array;
    }

    private AuxiliaryArray loadBuiltIn(String name) throws IOException {
        try (InputStream in = ResourceLoaderService.class.getResourceAsStream(BUILT_IN_DIRECTORY + name)) {
            if (in == null) {
                throw new CcdSimException(Fault.RESOURCE, "No built-in resource named " + name);
            }
            return parse(name, in);
        }
    }

    private AuxiliaryArray loadFile(File file) throws IOException, FitsException {
        if (!file.isFile()) {
            throw new CcdSimException(Fault.RESOURCE, "Resource file not found: " + file.getPath());
        }
        if (file.getName().toLowerCase(Locale.ROOT).endsWith(".fits")) {
            return FitsFrameService.readArray(file);
        }
        try (InputStream in = new FileInputStream(file)) {
            return parse(file.getName(), in);
        }
    }

    private static AuxiliaryArray parse(String name, InputStream in) throws IOException {
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".npz")) {
            return readNpz(name, in);
        }
        if (lower.endsWith(".npy")) {
            return readNpy(name, readAll(in));
        }
        throw new CcdSimException(Fault.RESOURCE, "Unsupported resource type: " + name
                + " (expected .npz, .npy or .fits)");
    }

    /** An archive must hold exactly one array. */
    static AuxiliaryArray readNpz(String name, InputStream in) throws IOException {
        try (ZipInputStream zip = new ZipInputStream(in)) {
            ZipEntry entry = zip.getNextEntry();
            if (entry == null) {
                throw new CcdSimException(Fault.RESOURCE, "Archive " + name + " is empty");
            }
            String entryName = entry.getName();
            byte[] bytes = readAll(zip);
            ZipEntry extra = zip.getNextEntry();
            if (extra != null) {
                throw new CcdSimException(Fault.RESOURCE, "Archive " + name + " holds more than one array ("
                        + entryName + ", " + extra.getName() + ")");
            }
            return readNpy(name + ":" + entryName, bytes);
        }
    }

    static AuxiliaryArray readNpy(String name, byte[] bytes) {
        for (int i = 0; i < NPY_MAGIC.length; i++) {
            if (bytes.length <= i || bytes[i] != NPY_MAGIC[i]) {
                throw new CcdSimException(Fault.RESOURCE, name + " is not a .npy array");
            }
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        int major = bytes[6] & 0xFF;
        int headerLength;
        int dataStart;
        if (major == 1) {
            headerLength = buffer.getShort(8) & 0xFFFF;
            dataStart = 10 + headerLength;
        } else if (major == 2 || major == 3) {
            headerLength = buffer.getInt(8);
            dataStart = 12 + headerLength;
        } else {
            throw new CcdSimException(Fault.RESOURCE, name + " has unsupported .npy version " + major);
        }
        String header = new String(bytes, dataStart - headerLength, headerLength, StandardCharsets.ISO_8859_1);

        Matcher descr = DESCR.matcher(header);
        Matcher fortran = FORTRAN_ORDER.matcher(header);
        Matcher shapeMatch = SHAPE.matcher(header);
        if (!descr.find() || !fortran.find() || !shapeMatch.find()) {
            throw new CcdSimException(Fault.RESOURCE, name + " has a malformed .npy header: " + header.trim());
        }
        if ("True".equals(fortran.group(1))) {
            throw new CcdSimException(Fault.RESOURCE, name + " is stored in Fortran order, which is not supported");
        }
        int[] shape = parseShape(shapeMatch.group(1));

        String dtype = descr.group(1);
        ByteOrder order = dtype.charAt(0) == '>' ? ByteOrder.BIG_ENDIAN : ByteOrder.LITTLE_ENDIAN;
        String kind = dtype.substring(1);
        long count = 1;
        for (int d : shape) count *= d;
        double[] data = new double[(int) count];

        ByteBuffer payload = ByteBuffer.wrap(bytes, dataStart, bytes.length - dataStart).slice().order(order);
        int width;
        switch (kind) {
            case "f8": width = 8; break;
            case "f4": width = 4; break;
            case "i8": width = 8; break;
            case "i4": width = 4; break;
            default:
                throw new CcdSimException(Fault.RESOURCE, name + " has unsupported dtype " + dtype);
        }
        if (payload.remaining() < count * width) {
            throw new CcdSimException(Fault.RESOURCE, name + " is truncated");
        }
        for (int i = 0; i < data.length; i++) {
            switch (kind) {
                case "f8": data[i] = payload.getDouble(); break;
                case "f4": data[i] = payload.getFloat(); break;
                case "i8": data[i] = payload.getLong(); break;
                default: data[i] = payload.getInt(); break;
            }
        }
        return new AuxiliaryArray(shape, data);
    }

    private static int[] parseShape(String text) {
        String[] parts = text.split(",");
        int n = 0;
        int[] dims = new int[parts.length];
        for (String part : parts) {
            String p = part.trim();
            if (!p.isEmpty()) dims[n++] = Integer.parseInt(p);
        }
        int[] shape = new int[n];
        System.arraycopy(dims, 0, shape, 0, n);
        return shape;
    }

    private static byte[] readAll(InputStream in) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] chunk = new byte[64 * 1024];
        int read;
        while ((read = in.read(chunk)) != -1) {
            out.write(chunk, 0, read);
        }
        return out.toByteArray();
    }
}
