package com.karting.entries.mail;

import com.lowagie.text.pdf.Barcode39;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Locale;

/**
 * Code 39 barcode rendered as a PNG raster, so mail clients that strip inline SVG still show it.
 * Bar widths come from OpenPDF's {@link Barcode39}; a wide element is two modules, so each symbol
 * is twelve modules plus a one-module gap.
 */
public final class Code39Barcode {

    private static final int WIDE_MODULES = 2;

    private Code39Barcode() {
    }

    /** Last {@code maxChars} characters of the value, upper-cased. */
    public static String payload(String value, int maxChars) {
        String upper = value.toUpperCase(Locale.ROOT);
        return upper.length() <= maxChars ? upper : upper.substring(upper.length() - maxChars);
    }

    /** Bar/space module sequence including start/stop characters and inter-symbol gaps. */
    static String modules(String payload) {
        if (payload.indexOf('*') >= 0) {
            throw new IllegalArgumentException("'*' is reserved for start/stop");
        }
        // even elements are bars, odd are spaces; 1 marks a wide element
        byte[] bars = Barcode39.getBarsCode39(payload);
        StringBuilder bits = new StringBuilder();
        for (int i = 0; i < bars.length; i++) {
            char module = i % 2 == 0 ? '1' : '0';
            int width = bars[i] == 1 ? WIDE_MODULES : 1;
            for (int w = 0; w < width; w++) {
                bits.append(module);
            }
        }
        return bits.toString();
    }

    public static byte[] renderPng(String payload, int moduleWidth, int height) {
        String bits = modules(payload);
        int quietZone = 10 * moduleWidth;
        int width = bits.length() * moduleWidth + 2 * quietZone;

        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_BINARY);
        Graphics2D g = image.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, width, height);
            g.setColor(Color.BLACK);
            for (int i = 0; i < bits.length(); i++) {
                if (bits.charAt(i) == '1') {
                    g.fillRect(quietZone + i * moduleWidth, 0, moduleWidth, height);
                }
            }
        } finally {
            g.dispose();
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            ImageIO.write(image, "png", out);
        } catch (IOException e) {
            throw new UncheckedIOException("PNG encoding failed", e);
        }
        return out.toByteArray();
    }
}
