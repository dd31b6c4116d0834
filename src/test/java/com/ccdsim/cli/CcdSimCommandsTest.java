package com.ccdsim.cli;

import com.ccdsim.main.CcdSimApp;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.Header;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.File;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Runs the commands end to end on small FITS frames.
 */
@Tag("integration")
public class CcdSimCommandsTest {

    @TempDir
    Path tempDir;

    private CommandLine cmdLine;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        cmdLine = CcdSimApp.createCommandLine();
        out = new StringWriter();
        err = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
    }

    @Test
    void testSubcommandsAreRegistered() {
        assertThat(cmdLine.getSubcommands()).containsKeys("simulate-raw", "calibrate", "settings", "help");
    }

    @Test
    void testSettingsListsParametersFlagsAndSteps() {
        int exitCode = cmdLine.execute("settings");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString())
                .contains("video_scales")
                .contains("VSCALE")
                .contains("NREADS/NUMEXP")
                .contains("in_adu")
                .contains("add_shot_noise")
                .contains("remove_smear");
    }

    @Test
    void testSimulateThenCalibrate() throws Exception {
        File flux = writeElectronFlux(tempDir.resolve("flux.fits").toFile());
        File raw = tempDir.resolve("raw.fits").toFile();
        File calibrated = tempDir.resolve("calibrated.fits").toFile();

        int simulated = cmdLine.execute("simulate-raw", flux.getPath(), raw.getPath(),
                "--set", "random_seed=7",
                "--set", "simulate_start_of_line_ringing=false",
                "--set", "add-pattern-noise=false");

        assertThat(simulated)
            .describedAs("Exit code should be 0. stderr: %s", err.toString())
            .isEqualTo(0);
        double[][] rawImage = readImage(raw);
        assertThat(rawImage).hasDimensions(16, 20);
        assertThat(rawImage[0][0]).isBetween(5900.0, 6100.0);

        CommandLine second = CcdSimApp.createCommandLine();
        second.setErr(new PrintWriter(err));
        int exitCode = second.execute("calibrate", raw.getPath(), calibrated.getPath(),
                "-s", "remove_start_of_line_ringing=false",
                "-s", "remove_pattern_noise=false");

        assertThat(exitCode)
            .describedAs("Exit code should be 0. stderr: %s", err.toString())
            .isEqualTo(0);
        double[][] image = readImage(calibrated);
        assertThat(image).hasDimensions(10, 12);
        for (int r = 0; r < 10; r++) {
            for (int c = 0; c < 12; c++) {
                assertThat(image[r][c]).isCloseTo(1000 + 10 * r + c, within(250.0));
            }
        }
        try (Fits fits = new Fits(calibrated)) {
            Header header = fits.getHDU(0).getHeader();
            assertThat(header.getBooleanValue("INADU")).isFalse();
            assertThat(header.getBooleanValue("SHOTPRS")).isTrue();
            assertThat(header.getLongValue("RNGSEED")).isEqualTo(7L);
        }
    }

    @Test
    void testConfigFileSettingsAreApplied() throws Exception {
        File flux = writeElectronFlux(tempDir.resolve("flux.fits").toFile());
        Path config = tempDir.resolve("settings.tsv");
        Files.write(config, ("number_of_slices\t1\n"
                + "simulate_start_of_line_ringing\tfalse\n"
                + "add_pattern_noise\tfalse\n").getBytes(StandardCharsets.UTF_8));
        File raw = tempDir.resolve("raw.fits").toFile();

        int exitCode = cmdLine.execute("simulate-raw", "-c", config.toString(), flux.getPath(), raw.getPath());

        assertThat(exitCode)
            .describedAs("Exit code should be 0. stderr: %s", err.toString())
            .isEqualTo(0);
        assertThat(readImage(raw)).hasDimensions(16, 16);
    }

    @Test
    void testUnknownSettingReturnsError() throws Exception {
        File flux = writeElectronFlux(tempDir.resolve("flux.fits").toFile());

        int exitCode = cmdLine.execute("simulate-raw", flux.getPath(), tempDir.resolve("raw.fits").toString(),
                "--set", "video_scale=5.5");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Unknown setting").contains("video_scales");
    }

    @Test
    void testExistingOutputNeedsForce() throws Exception {
        File flux = writeElectronFlux(tempDir.resolve("flux.fits").toFile());
        File raw = tempDir.resolve("raw.fits").toFile();
        Files.write(raw.toPath(), new byte[] {0});

        int exitCode = cmdLine.execute("simulate-raw", flux.getPath(), raw.getPath(),
                "-s", "simulate_start_of_line_ringing=false", "-s", "add_pattern_noise=false");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("--force");
        assertThat(raw.length()).isEqualTo(1L);
    }

    @Test
    void testMissingOutputArgument() {
        int exitCode = cmdLine.execute("calibrate", "only-input.fits");

        assertThat(exitCode).isNotEqualTo(0);
        assertThat(err.toString()).contains("OUTPUT");
    }

    private static double[][] readImage(File file) throws Exception {
        try (Fits fits = new Fits(file)) {
            return (double[][]) fits.getHDU(0).getKernel();
        }
    }

    private static File writeElectronFlux(File file) throws Exception {
        double[][] image = new double[10][12];
        for (int r = 0; r < 10; r++) {
            for (int c = 0; c < 12; c++) image[r][c] = 1000 + 10 * r + c;
        }
        BasicHDU<?> hdu = Fits.makeHDU(image);
        Header header = hdu.getHeader();
        header.addValue("NUMSLICE", 2, "");
        header.addValue("EDARKCOL", 2, "");
        header.addValue("LDARKCOL", 2, "");
        header.addValue("FDARKROW", 3, "");
        header.addValue("SMEARROW", 3, "");
        try (Fits fits = new Fits()) {
            fits.addHDU(hdu);
            fits.write(file);
        }
        return file;
    }
}
