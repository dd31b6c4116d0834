package com.ccdsim.model;

import nom.tam.fits.Header;

/**
 * Opaque frame metadata carried through the pipeline untouched: where the frame came from,
 * the command that produced it and the original FITS header.
 */
public final class FrameMetadata {

    private final String originFileName;
    private final String command;
    private final Header header;

    public FrameMetadata(String originFileName, String command, Header header) {
        this.originFileName = originFileName;
        this.command = command == null ? "" : command;
        this.header = header;
    }

    public static FrameMetadata empty() {
        return new FrameMetadata(null, "", null);
    }

    public String getOriginFileName() {
        return originFileName;
    }

    public String getCommand() {
        return command;
    }

    public Header getHeader() {
        return header;
    }
}
