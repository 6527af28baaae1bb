package me.golemcore.gateway.domain.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class ModelBindingTest {

    @Test
    void shouldMaskCredentialInBindingToString() {
        ModelBinding binding = ModelBinding.builder().key("default").credential("sk-secret").build();

        assertFalse(binding.toString().contains("sk-secret"));
        assertEquals("default", binding.getAccountingKey());
        assertEquals("gpt-4o", binding.toBuilder().key(null).modelName("gpt-4o").build().getAccountingKey());
    }

    @Test
    void shouldDefaultCurrencyAndWireMode() {
        ModelBinding binding = ModelBinding.builder().modelName("m").build();

        assertEquals("USD", binding.getCurrency());
        assertEquals(WireMode.AUTO, binding.getWireMode());
        assertFalse(binding.hasPricing());
        assertTrue(binding.toBuilder().priceOutputPerMillion(BigDecimal.ZERO).build().hasPricing());
    }
}
