package com.opsos.itemresolution.matching;

import com.opsos.itemresolution.model.PackConfiguration;
import com.opsos.itemresolution.model.PackType;

import java.math.BigDecimal;

/**
 * Pack metadata read from free text. {@code unitsPerPack} is at least 1 and {@code unitSize}
 * is positive; the parser never builds anything else.
 */
public record ParsedPack(PackType packType, int unitsPerPack, double unitSize, String unitSizeUom) {

    /**
     * Short human form, "12/750mL" for a case and "1L" for a single unit.
     */
    public String describe() {
        String size = BigDecimal.valueOf(unitSize).stripTrailingZeros().toPlainString() + unitSizeUom;
        return unitsPerPack > 1 || packType == PackType.CASE ? unitsPerPack + "/" + size : size;
    }

    public boolean sameAs(PackConfiguration configuration) {
        return configuration != null
                && packType == configuration.getPackType()
                && configuration.getUnitsPerPack() != null
                && unitsPerPack == configuration.getUnitsPerPack()
                && configuration.getUnitSize() != null
                && Double.compare(unitSize, configuration.getUnitSize()) == 0
                && unitSizeUom.equals(configuration.getUnitSizeUom());
    }

    public PackConfiguration toConfiguration(Long itemId, Long vendorId, String vendorItemCode) {
        PackConfiguration configuration = new PackConfiguration();
        configuration.setItemId(itemId);
        configuration.setVendorId(vendorId);
        configuration.setVendorItemCode(vendorItemCode);
        configuration.setPackType(packType);
        configuration.setUnitsPerPack(unitsPerPack);
        configuration.setUnitSize(unitSize);
        configuration.setUnitSizeUom(unitSizeUom);
        configuration.setActive(true);
        return configuration;
    }
}
