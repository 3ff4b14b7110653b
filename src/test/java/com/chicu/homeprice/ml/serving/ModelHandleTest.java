package com.chicu.homeprice.ml.serving;

import com.chicu.homeprice.ml.model.PricingModel;
import com.chicu.homeprice.ml.registry.ArtifactStore;
import com.chicu.homeprice.ml.registry.CorruptRegistryException;
import com.chicu.homeprice.ml.registry.LoadedModel;
import com.chicu.homeprice.ml.registry.NotRegisteredException;
import com.chicu.homeprice.ml.registry.RegisteredRun;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ModelHandleTest {

    @Mock private ArtifactStore artifactStore;
    @Mock private PricingModel model;

    @InjectMocks
    private ModelHandle handle;

    @Test
    void beforeReload_isNotReady_andRefuses() {
        assertFalse(handle.isReady());
        assertTrue(handle.peek().isEmpty());
        assertThrows(ModelUnavailableException.class, handle::current);
        verifyNoInteractions(artifactStore);
    }

    @Test
    void reload_setsCurrentModel() {
        LoadedModel loaded = loaded("20260103T123000Z_rf");
        when(artifactStore.loadCurrent()).thenReturn(loaded);

        handle.reload();

        assertTrue(handle.isReady());
        assertSame(loaded, handle.current());
        assertNull(handle.lastError());
    }

    @Test
    void failedReload_clearsHandle_andRethrows() {
        LoadedModel first = loaded("20260103T123000Z_rf");
        when(artifactStore.loadCurrent())
                .thenReturn(first)
                .thenThrow(new CorruptRegistryException("run is incomplete"));

        handle.reload();
        assertTrue(handle.isReady());
        assertSame(first, handle.current());

        assertThrows(CorruptRegistryException.class, handle::reload);

        assertFalse(handle.isReady());
        ModelUnavailableException e = assertThrows(ModelUnavailableException.class, handle::current);
        assertTrue(e.getMessage().contains("run is incomplete"));
    }

    @Test
    void notRegistered_isReportedAsReason() {
        when(artifactStore.loadCurrent()).thenThrow(new NotRegisteredException("no active model"));

        assertThrows(NotRegisteredException.class, handle::reload);

        assertEquals("no active model", handle.lastError());
    }

    private LoadedModel loaded(String runId) {
        lenient().when(model.algorithm()).thenReturn("ridge-linear");
        RegisteredRun run = RegisteredRun.builder().runId(runId).metrics(Map.of("cv_rmse", 3.0)).build();
        return new LoadedModel(model, run);
    }
}
