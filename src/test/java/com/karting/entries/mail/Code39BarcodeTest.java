package com.karting.entries.mail;

import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class Code39BarcodeTest {

    @Test
    void payloadKeepsTheTailUpperCased() {
        assertThat(Code39Barcode.payload("eng-d001-ered-1700000000000-x4k9qz", 12)).isEqualTo("00000-X4K9QZ");
        assertThat(Code39Barcode.payload("abc", 12)).isEqualTo("ABC");
    }

    @Test
    void modulesFrameThePayloadWithStartStopAndGaps() {
        String bits = Code39Barcode.modules("A1");

        // four symbols of twelve modules plus three one-module gaps
        assertThat(bits).hasSize(4 * 12 + 3);
        // '*' then 'A', wide elements doubled
        assertThat(bits).startsWith("100101101101" + "0" + "110101001011");
        assertThat(bits).endsWith("0" + "100101101101");
    }

    @Test
    void everySymbolHasFiveBarsAndFourSpaces() {
        String bits = Code39Barcode.modules("TYR-42");

        for (int start = 0; start < bits.length(); start += 13) {
            String symbol = bits.substring(start, start + 12);
            assertThat(symbol).startsWith("1").endsWith("1");
            assertThat(symbol.split("0+")).hasSize(5);
            if (start + 12 < bits.length()) {
                assertThat(bits.charAt(start + 12)).isEqualTo('0');
            }
        }
    }

    @Test
    void rejectsCharactersOutsideCode39() {
        assertThatThrownBy(() -> Code39Barcode.modules("a"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Code39Barcode.modules("A*B"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rendersPngWithQuietZones() throws IOException {
        byte[] png = Code39Barcode.renderPng("TYR-42", 2, 40);

        BufferedImage image = ImageIO.read(new ByteArrayInputStream(png));
        int modules = Code39Barcode.modules("TYR-42").length();
        assertThat(image.getWidth()).isEqualTo(modules * 2 + 2 * 20);
        assertThat(image.getHeight()).isEqualTo(40);
        // quiet zone is white, first module of the start character is a bar
        assertThat(image.getRGB(0, 10) & 0xFFFFFF).isEqualTo(0xFFFFFF);
        assertThat(image.getRGB(20, 10) & 0xFFFFFF).isEqualTo(0x000000);
    }
}
