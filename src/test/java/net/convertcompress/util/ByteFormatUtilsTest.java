package net.convertcompress.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ByteFormatUtilsTest {

    @Test
    void should_FormatBytes_When_BelowOneKibibyte() {
        assertThat(ByteFormatUtils.formatBytes(0)).isEqualTo("0 B");
        assertThat(ByteFormatUtils.formatBytes(1023)).isEqualTo("1023 B");
    }

    @Test
    void should_FormatKilobytesWithoutDecimals_When_BelowOneMebibyte() {
        assertThat(ByteFormatUtils.formatBytes(1024)).isEqualTo("1 KB");
        assertThat(ByteFormatUtils.formatBytes(1536)).isEqualTo("2 KB");
    }

    @Test
    void should_FormatMegabytesWithTwoDecimals_When_AtLeastOneMebibyte() {
        assertThat(ByteFormatUtils.formatBytes(1024L * 1024L)).isEqualTo("1.00 MB");
        assertThat(ByteFormatUtils.formatBytes(1024L * 1024L * 3 / 2)).isEqualTo("1.50 MB");
    }

    @Test
    void should_TreatNegativeAsZero_When_CountIsNegative() {
        assertThat(ByteFormatUtils.formatBytes(-5)).isEqualTo("0 B");
    }
}
