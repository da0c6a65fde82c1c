package wizardrunner.runner;

import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.WebDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Captures a JPEG of the viewport at every meaningful step of one execution
 * and keeps all of them, in order, in memory. Which ones are returned is
 * decided later by {@link ScreenshotRetention}.
 *
 * <p>When a save directory is configured, each image is also written to:
 * <pre>{saveDir}/{wizardId}/screenshot_{timestamp}_{label}.jpg</pre>
 * Capture and save failures are logged as warnings and never abort the run.
 */
public class ScreenshotRecorder {

    private static final Logger log = LoggerFactory.getLogger(ScreenshotRecorder.class);

    static final String JPEG = "image/jpeg";
    static final String PNG  = "image/png";

    private static final DateTimeFormatter FILE_TS =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS").withZone(ZoneId.of("UTC"));

    private final String wizardId;
    private final int jpegQuality;
    private final String saveDir;
    private final Clock clock;
    private final List<Screenshot> captured = new ArrayList<>();

    /**
     * @param wizardId    sub-directory name for saved images
     * @param jpegQuality 1..100
     * @param saveDir     directory to also write images to, or {@code null}
     */
    public ScreenshotRecorder(String wizardId, int jpegQuality, String saveDir, Clock clock) {
        this.wizardId = wizardId;
        this.jpegQuality = jpegQuality;
        this.saveDir = saveDir;
        this.clock = clock;
    }

    /**
     * Captures the current viewport.
     *
     * @return the screenshot, or empty if the driver could not produce one
     */
    public Optional<Screenshot> capture(WebDriver driver, String label) {
        if (!(driver instanceof TakesScreenshot)) {
            log.warn("Driver does not support TakesScreenshot; skipping '{}'", label);
            return Optional.empty();
        }
        byte[] png;
        try {
            png = ((TakesScreenshot) driver).getScreenshotAs(OutputType.BYTES);
        } catch (Exception e) {
            log.warn("Failed to capture screenshot '{}': {}", label, NavigationException.firstLine(e.getMessage()));
            return Optional.empty();
        }
        if (png == null || png.length == 0) {
            log.warn("Driver returned an empty screenshot for '{}'", label);
            return Optional.empty();
        }

        byte[] jpeg = toJpeg(png);
        Screenshot shot = jpeg != null
                ? new Screenshot(captured.size(), label, clock.instant(), JPEG, jpeg)
                : new Screenshot(captured.size(), label, clock.instant(), PNG, png);
        captured.add(shot);
        log.debug("Captured {}", shot);
        save(shot);
        return Optional.of(shot);
    }

    /** Every screenshot captured so far, oldest first. */
    public List<Screenshot> getAll() {
        return Collections.unmodifiableList(captured);
    }

    public int count() {
        return captured.size();
    }

    // ── Private helpers ──────────────────────────────────────────────────

    /** Re-encodes a PNG as JPEG; {@code null} if the bytes cannot be decoded. */
    byte[] toJpeg(byte[] png) {
        try {
            BufferedImage source = ImageIO.read(new ByteArrayInputStream(png));
            if (source == null) {
                log.debug("Screenshot bytes are not a decodable image; keeping them as PNG");
                return null;
            }
            // JPEG has no alpha channel
            BufferedImage rgb = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_RGB);
            Graphics2D g = rgb.createGraphics();
            g.drawImage(source, 0, 0, Color.WHITE, null);
            g.dispose();

            Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
            if (!writers.hasNext()) {
                log.warn("No JPEG writer available; keeping screenshot as PNG");
                return null;
            }
            ImageWriter writer = writers.next();
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(jpegQuality / 100f);

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            try (ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
                writer.setOutput(ios);
                writer.write(null, new IIOImage(rgb, null, null), param);
            } finally {
                writer.dispose();
            }
            return out.toByteArray();
        } catch (IOException e) {
            log.warn("JPEG conversion failed; keeping screenshot as PNG: {}", e.getMessage());
            return null;
        }
    }

    private void save(Screenshot shot) {
        if (saveDir == null) return;
        String safeWizard = wizardId.replaceAll("[^a-zA-Z0-9_\\-]", "_");
        String safeLabel = shot.getLabel().replaceAll("[^a-zA-Z0-9_\\-]", "_");
        String ext = JPEG.equals(shot.getContentType()) ? "jpg" : "png";
        Path dir = Paths.get(saveDir, safeWizard);
        Path target = dir.resolve(String.format("screenshot_%s_%s.%s",
                FILE_TS.format(shot.getCapturedAt()), safeLabel, ext));
        try {
            Files.createDirectories(dir);
            Files.write(target, shot.getData());
            log.debug("Screenshot saved to {}", target);
        } catch (IOException e) {
            log.warn("Failed to save screenshot to {}: {}", target, e.getMessage());
        }
    }
}
