package me.golemcore.gateway.domain.service;

import me.golemcore.gateway.domain.model.BackendKind;
import me.golemcore.gateway.port.outbound.BackendAdapter;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class BackendAdapterRegistryTest {

    @Test
    void shouldIndexAdaptersByKind() {
        BackendAdapter chat = adapter(BackendKind.CHAT_COMPLETIONS);
        BackendAdapter local = adapter(BackendKind.LOCAL_NDJSON);
        BackendAdapterRegistry registry = new BackendAdapterRegistry(List.of(chat, local));

        registry.init();

        assertSame(chat, registry.getAdapter(BackendKind.CHAT_COMPLETIONS));
        assertSame(local, registry.getAdapter(BackendKind.LOCAL_NDJSON));
    }

    @Test
    void shouldFailForMissingKind() {
        BackendAdapterRegistry registry = new BackendAdapterRegistry(List.of(adapter(BackendKind.CHAT_COMPLETIONS)));
        registry.init();

        assertThrows(IllegalStateException.class, () -> registry.getAdapter(BackendKind.RESPONSES));
    }

    private static BackendAdapter adapter(BackendKind kind) {
        BackendAdapter adapter = mock(BackendAdapter.class);
        when(adapter.getKind()).thenReturn(kind);
        return adapter;
    }
}
