package com.streamrelay.streamrelay.service.recording;

import com.streamrelay.streamrelay.config.RecordingProperties;
import com.streamrelay.streamrelay.model.RecordingDetails;
import com.streamrelay.streamrelay.util.RecordingFileNames;
import org.bytedeco.javacv.FFmpegFrameGrabber;
import org.bytedeco.javacv.Frame;
import org.bytedeco.javacv.Java2DFrameConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Probes captures with FFmpeg: container duration, frame height as quality label, and a JPEG
 * thumbnail of the first decodable frame written next to the capture.
 */
@Component
public class FFmpegRecordingProbe implements RecordingProbe {

    private static final Logger logger = LoggerFactory.getLogger(FFmpegRecordingProbe.class);
    private static final int MAX_THUMBNAIL_ATTEMPTS = 50;

    private final RecordingProperties properties;

    public FFmpegRecordingProbe(RecordingProperties properties) {
        this.properties = properties;
    }

    @Override
    public RecordingDetails probe(Path capture) {
        if (!properties.getProbe().isEnabled()) {
            return RecordingDetails.NONE;
        }

        try (FFmpegFrameGrabber grabber = new FFmpegFrameGrabber(capture.toFile())) {
            grabber.start();

            long lengthMicros = grabber.getLengthInTime();
            Double duration = lengthMicros > 0 ? lengthMicros / 1_000_000.0 : null;
            String quality = grabber.getImageHeight() > 0 ? grabber.getImageHeight() + "p" : null;
            String thumbnail = extractThumbnail(grabber, capture);

            grabber.stop();
            logger.debug("Probed {}: duration={}s quality={} thumbnail={}", capture, duration, quality, thumbnail);

            return RecordingDetails.builder()
                    .duration(duration)
                    .quality(quality)
                    .thumbnailPath(thumbnail)
                    .build();
        } catch (Exception e) {
            logger.warn("Could not probe capture {}: {}", capture, e.getMessage());
            return RecordingDetails.NONE;
        }
    }

    private String extractThumbnail(FFmpegFrameGrabber grabber, Path capture) throws Exception {
        for (int i = 0; i < MAX_THUMBNAIL_ATTEMPTS; i++) {
            Frame frame = grabber.grabImage();
            if (frame == null) {
                return null;
            }
            if (frame.image == null || frame.imageWidth <= 0 || frame.imageHeight <= 0) {
                continue;
            }
            BufferedImage image = toJpegCompatible(new Java2DFrameConverter().convert(frame));
            if (image == null) {
                continue;
            }
            Path target = capture.resolveSibling(
                    RecordingFileNames.baseName(capture.getFileName().toString()) + ".jpg");
            writeJpeg(image, target);
            return target.toString();
        }
        return null;
    }

    private static void writeJpeg(BufferedImage image, Path target) throws IOException {
        if (!ImageIO.write(image, "jpg", target.toFile())) {
            throw new IOException("No JPEG writer available");
        }
    }

    /**
     * Copies into a 3-byte BGR image; the converter's buffer is reused between frames and JPEG
     * encoding needs a type without alpha.
     */
    private static BufferedImage toJpegCompatible(BufferedImage original) {
        if (original == null) {
            return null;
        }
        BufferedImage copy = new BufferedImage(original.getWidth(), original.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
        copy.getGraphics().drawImage(original, 0, 0, null);
        return copy;
    }
}
