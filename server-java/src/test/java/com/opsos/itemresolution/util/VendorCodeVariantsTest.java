package com.opsos.itemresolution.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class VendorCodeVariantsTest {

    @Test
    void expandsCaseDelimiterAndZeroPaddingVariants() {
        assertThat(VendorCodeVariants.of(" 00123-a "))
                .containsExactly("00123-a", "00123-A", "00123A", "123-a", "123-A", "123A");
    }

    @Test
    void keepsLoneZero() {
        assertThat(VendorCodeVariants.of("0")).containsExactly("0");
    }

    @Test
    void blankCodeHasNoVariants() {
        assertThat(VendorCodeVariants.of(null)).isEmpty();
        assertThat(VendorCodeVariants.of(" ")).isEmpty();
    }
}
