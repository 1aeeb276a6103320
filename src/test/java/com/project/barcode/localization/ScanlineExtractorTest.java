package com.project.barcode.localization;

import com.project.barcode.localization.service.ImageDecoder;
import com.project.barcode.localization.service.LuminanceImage;
import com.project.barcode.localization.service.ScanlineExtractor;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.assertThat;

class ScanlineExtractorTest {
    private final ScanlineExtractor extractor = new ScanlineExtractor();

    @Test
    void readsMidpointRow_andBinarizesStrictlyAbove128() {
        // 6x4 image; only row 2 (midpoint of a 4 px tile starting at y=0) carries the pattern
        byte[] samples = new byte[24];
        int[] row = {0, 128, 129, 255, 200, 10};
        for (int x = 0; x < 6; x++) {
            samples[2 * 6 + x] = (byte) row[x];
        }
        LuminanceImage image = LuminanceImage.of(6, 4, samples);

        assertThat(extractor.extract(image, 0, 0, 6, 4)).containsExactly(0.0, 0.0, 1.0, 1.0, 1.0, 0.0);
        assertThat(extractor.extract(image, 2, 0, 3, 4)).containsExactly(1.0, 1.0, 1.0);
        assertThat(extractor.extract(image, 0, 0, 6, 2)).containsOnly(0.0);
    }

    @Test
    void grayImagesKeepTheirRawSamples() {
        BufferedImage gray = new BufferedImage(2, 1, BufferedImage.TYPE_BYTE_GRAY);
        gray.getRaster().setSample(0, 0, 0, 129);
        gray.getRaster().setSample(1, 0, 0, 128);

        LuminanceImage image = LuminanceImage.fromBufferedImage(gray);

        assertThat(image.sample(0, 0)).isEqualTo(129);
        assertThat(extractor.extract(image, 0, 0, 2, 1)).containsExactly(1.0, 0.0);
    }

    @Test
    void colorImagesUseRec709Luma() {
        BufferedImage rgb = new BufferedImage(3, 1, BufferedImage.TYPE_INT_RGB);
        rgb.setRGB(0, 0, new Color(200, 200, 200).getRGB());
        rgb.setRGB(1, 0, new Color(0, 255, 0).getRGB());
        rgb.setRGB(2, 0, new Color(255, 0, 0).getRGB());

        LuminanceImage image = LuminanceImage.fromBufferedImage(rgb);

        assertThat(image.sample(0, 0)).isEqualTo(200);
        assertThat(image.sample(1, 0)).isEqualTo(182);
        assertThat(image.sample(2, 0)).isEqualTo(54);
    }

    @Test
    void lumaIsTruncatedNotRounded_atTheBinarizationThreshold() {
        // 0.2126*131 + 0.7152*128 + 0.0722*128 = 128.64; truncates to 128, which is not > 128
        BufferedImage rgb = new BufferedImage(1, 1, BufferedImage.TYPE_INT_RGB);
        rgb.setRGB(0, 0, new Color(131, 128, 128).getRGB());

        LuminanceImage image = LuminanceImage.fromBufferedImage(rgb);

        assertThat(image.sample(0, 0)).isEqualTo(128);
        assertThat(extractor.extract(image, 0, 0, 1, 1)).containsExactly(0.0);
    }

    @Test
    void bgrSamplesFromOpenCvGoThroughTheSameLuma() {
        // B, G, R order as decoded by imdecode
        byte[] bgr = {(byte) 128, (byte) 128, (byte) 131, 0, (byte) 255, 0};

        BufferedImage decoded = ImageDecoder.fromBgr(2, 1, bgr);
        LuminanceImage image = LuminanceImage.fromBufferedImage(decoded);

        assertThat(decoded.getType()).isEqualTo(BufferedImage.TYPE_3BYTE_BGR);
        assertThat(image.sample(0, 0)).isEqualTo(128);
        assertThat(image.sample(1, 0)).isEqualTo(182);
        assertThat(extractor.extract(image, 0, 0, 2, 1)).containsExactly(0.0, 1.0);
    }
}
