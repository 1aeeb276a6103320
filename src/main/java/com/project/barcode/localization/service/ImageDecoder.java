package com.project.barcode.localization.service;

import com.project.barcode.localization.exceptions.DetectionException;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.imageio.ImageIO;

/**
 * Decodes image bytes with ImageIO, falling back to OpenCV for formats ImageIO has no reader for
 * (WebP, for instance). The native library is loaded on first use.
 */
@Component
public class ImageDecoder {
    private static final Logger log = LoggerFactory.getLogger(ImageDecoder.class);

    private static volatile Boolean openCvAvailable;

    public BufferedImage decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new DetectionException("Empty image data");
        }
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(bytes));
        } catch (IOException e) {
            log.debug("ImageIO failed to read image: {}", e.getMessage());
            image = null;
        }
        if (image == null) {
            image = decodeWithOpenCv(bytes);
        }
        if (image == null) {
            throw new DetectionException("The file is not a valid image or is corrupted.");
        }
        log.debug("Image decoded: {}x{}", image.getWidth(), image.getHeight());
        return image;
    }

    public BufferedImage decode(Path file) {
        try {
            return decode(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new DetectionException("Failed to open image: " + file, e);
        }
    }

    private BufferedImage decodeWithOpenCv(byte[] bytes) {
        if (!openCvLoaded()) {
            return null;
        }
        // colour decode: OpenCV's own grayscale conversion uses BT.601 weights
        Mat bgr = Imgcodecs.imdecode(new MatOfByte(bytes), Imgcodecs.IMREAD_COLOR);
        if (bgr.empty()) {
            return null;
        }
        byte[] data = new byte[bgr.cols() * bgr.rows() * 3];
        bgr.get(0, 0, data);
        BufferedImage image = fromBgr(bgr.cols(), bgr.rows(), data);
        bgr.release();
        return image;
    }

    /**
     * Wraps interleaved 8-bit BGR samples, the layout OpenCV decodes into, as a
     * {@code TYPE_3BYTE_BGR} image.
     */
    public static BufferedImage fromBgr(int width, int height, byte[] bgr) {
        if (bgr.length != width * height * 3) {
            throw new IllegalArgumentException("Expected " + (width * height * 3) + " BGR samples");
        }
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_3BYTE_BGR);
        byte[] target = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
        System.arraycopy(bgr, 0, target, 0, bgr.length);
        return image;
    }

    private static boolean openCvLoaded() {
        if (openCvAvailable == null) {
            synchronized (ImageDecoder.class) {
                if (openCvAvailable == null) {
                    try {
                        nu.pattern.OpenCV.loadLocally();
                        openCvAvailable = Boolean.TRUE;
                        log.info("OpenCV loaded successfully");
                    } catch (Exception | LinkageError e) {
                        openCvAvailable = Boolean.FALSE;
                        log.warn("OpenCV unavailable, only ImageIO formats can be decoded", e);
                    }
                }
            }
        }
        return openCvAvailable;
    }
}
