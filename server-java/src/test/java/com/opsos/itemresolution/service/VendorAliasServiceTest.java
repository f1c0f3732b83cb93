package com.opsos.itemresolution.service;

import com.opsos.itemresolution.matching.PackSizeParser;
import com.opsos.itemresolution.model.ItemCostHistory;
import com.opsos.itemresolution.model.PackConfiguration;
import com.opsos.itemresolution.model.PackType;
import com.opsos.itemresolution.model.VendorItemAlias;
import com.opsos.itemresolution.repository.CanonicalItemRepository;
import com.opsos.itemresolution.repository.ItemCostHistoryRepository;
import com.opsos.itemresolution.repository.PackConfigurationRepository;
import com.opsos.itemresolution.repository.VendorItemAliasRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class VendorAliasServiceTest {

    private static final Long VENDOR = 5L;
    private static final LocalDate INVOICE_DATE = LocalDate.of(2025, 3, 14);

    @Mock
    private VendorItemAliasRepository aliasRepository;

    @Mock
    private CanonicalItemRepository itemRepository;

    @Mock
    private ItemCostHistoryRepository costHistoryRepository;

    @Mock
    private PackConfigurationRepository packConfigurationRepository;

    private VendorAliasService aliasService;
    private final AtomicReference<VendorItemAlias> stored = new AtomicReference<>();

    @BeforeEach
    void setup() {
        aliasService = new VendorAliasService(aliasRepository, itemRepository, costHistoryRepository,
                packConfigurationRepository, new PackSizeParser());

        when(aliasRepository.findByVendorIdAndVendorItemCode(eq(VENDOR), any()))
                .thenAnswer(invocation -> Optional.ofNullable(stored.get()));
        when(aliasRepository.save(any(VendorItemAlias.class))).thenAnswer(invocation -> {
            VendorItemAlias alias = invocation.getArgument(0);
            stored.set(alias);
            return alias;
        });
        when(packConfigurationRepository.save(any(PackConfiguration.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
        when(packConfigurationRepository.findByVendorIdAndVendorItemCodeAndActiveTrue(any(), any())).thenReturn(List.of());
    }

    @Test
    void firstConfirmationCreatesAliasCostAndPack() {
        VendorItemAlias alias = aliasService.confirmMapping(VENDOR, "GG-750", 100L, "CS/12 750ML Grey Goose",
                null, new BigDecimal("312.00"), INVOICE_DATE, 1L);

        assertThat(alias.getItemId()).isEqualTo(100L);
        assertThat(alias.getVendorItemCode()).isEqualTo("GG-750");
        assertThat(alias.getConfirmations()).isEqualTo(1);
        assertThat(alias.getActive()).isTrue();
        verify(itemRepository).incrementAliasConfirmations(100L);

        ArgumentCaptor<ItemCostHistory> cost = ArgumentCaptor.forClass(ItemCostHistory.class);
        verify(costHistoryRepository).save(cost.capture());
        assertThat(cost.getValue().getUnitCost()).isEqualByComparingTo("312.00");
        assertThat(cost.getValue().getEffectiveDate()).isEqualTo(INVOICE_DATE);
        assertThat(cost.getValue().getSourceInvoiceLineId()).isEqualTo(1L);

        ArgumentCaptor<PackConfiguration> pack = ArgumentCaptor.forClass(PackConfiguration.class);
        verify(packConfigurationRepository).save(pack.capture());
        assertThat(pack.getValue().getPackType()).isEqualTo(PackType.CASE);
        assertThat(pack.getValue().getUnitsPerPack()).isEqualTo(12);
        assertThat(pack.getValue().getUnitSizeUom()).isEqualTo("mL");
    }

    @Test
    void secondConfirmationRepointsTheSameAlias() {
        VendorItemAlias first = aliasService.confirmMapping(VENDOR, "GG-750", 100L, "Grey Goose", null, null, null, null);
        VendorItemAlias second = aliasService.confirmMapping(VENDOR, "GG-750", 101L, "Grey Goose", null, null, null, null);

        assertThat(second).isSameAs(first);
        assertThat(second.getItemId()).isEqualTo(101L);
        assertThat(second.getConfirmations()).isEqualTo(2);
        assertThat(second.getActive()).isTrue();
        verify(aliasRepository, times(2)).save(first);
    }

    @Test
    void noCostHistoryWithoutUnitCost() {
        aliasService.confirmMapping(VENDOR, "GG-750", 100L, "Grey Goose", null, null, INVOICE_DATE, 1L);

        verify(costHistoryRepository, never()).save(any());
    }

    @Test
    void identicalActivePackIsNotInsertedAgain() {
        PackConfiguration existing = new PackConfiguration(1L, 100L, VENDOR, "GG-750", PackType.CASE, 12, 750.0, "mL",
                true, null);
        when(packConfigurationRepository.findByVendorIdAndVendorItemCodeAndActiveTrue(VENDOR, "GG-750"))
                .thenReturn(List.of(existing));

        Optional<PackConfiguration> learned = aliasService.learnPackConfiguration(100L, VENDOR, "GG-750", "12/750ML", null);

        assertThat(learned).isEmpty();
        assertThat(existing.getActive()).isTrue();
        verify(packConfigurationRepository, never()).save(any(PackConfiguration.class));
    }

    @Test
    void differentPackSupersedesActiveOne() {
        PackConfiguration existing = new PackConfiguration(1L, 100L, VENDOR, "GG-750", PackType.CASE, 6, 750.0, "mL",
                true, null);
        when(packConfigurationRepository.findByVendorIdAndVendorItemCodeAndActiveTrue(VENDOR, "GG-750"))
                .thenReturn(List.of(existing));

        Optional<PackConfiguration> learned = aliasService.learnPackConfiguration(100L, VENDOR, "GG-750", "12/750ML", null);

        assertThat(learned).isPresent();
        assertThat(learned.get().getUnitsPerPack()).isEqualTo(12);
        assertThat(existing.getActive()).isFalse();
        verify(packConfigurationRepository).saveAll(anyList());
    }

    @Test
    void unparseableTextLearnsNoPack() {
        assertThat(aliasService.learnPackConfiguration(100L, VENDOR, "GG-750", null, "Grey Goose")).isEmpty();
    }

    @Test
    void lookupFindsAliasStoredUnderCodeVariant() {
        VendorItemAlias alias = new VendorItemAlias();
        alias.setVendorId(VENDOR);
        alias.setVendorItemCode("123A");
        alias.setItemId(100L);
        when(aliasRepository.findByVendorIdAndVendorItemCodeInAndActiveTrue(eq(VENDOR), anyCollection()))
                .thenReturn(List.of(alias));

        assertThat(aliasService.lookup(VENDOR, "00123-a")).contains(alias);
        assertThat(aliasService.lookup(null, "00123-a")).isEmpty();
        assertThat(aliasService.lookup(VENDOR, " ")).isEmpty();
    }

    @Test
    void confirmationReusesAliasStoredUnderCodeVariant() {
        VendorItemAlias existing = new VendorItemAlias();
        existing.setId(9L);
        existing.setVendorId(VENDOR);
        existing.setVendorItemCode("123A");
        existing.setItemId(100L);
        existing.setConfirmations(3);
        when(aliasRepository.findByVendorIdAndVendorItemCode(VENDOR, "00123-A")).thenReturn(Optional.empty());
        when(aliasRepository.findByVendorIdAndVendorItemCodeIn(eq(VENDOR), anyCollection()))
                .thenReturn(List.of(existing));

        VendorItemAlias confirmed = aliasService.confirmMapping(VENDOR, "00123-A", 101L, "Lime Juice 32oz",
                null, null, null, null);

        assertThat(confirmed).isSameAs(existing);
        assertThat(confirmed.getVendorItemCode()).isEqualTo("123A");
        assertThat(confirmed.getItemId()).isEqualTo(101L);
        assertThat(confirmed.getConfirmations()).isEqualTo(4);
        verify(aliasRepository, times(1)).save(any(VendorItemAlias.class));
        verify(packConfigurationRepository).findByVendorIdAndVendorItemCodeAndActiveTrue(VENDOR, "123A");
    }

    @Test
    void confirmationRequiresCode() {
        assertThrows(IllegalArgumentException.class,
                () -> aliasService.confirmMapping(VENDOR, " ", 100L, "Grey Goose", null, null, null, null));
    }
}
