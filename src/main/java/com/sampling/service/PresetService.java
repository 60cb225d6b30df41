package com.sampling.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sampling.model.CameraPreset;
import com.sampling.model.FullRigPreset;
import com.sampling.model.Preset;
import com.sampling.model.PresetCollection;
import com.sampling.model.TelescopePreset;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Presets con nombre (telescopio, cámara, equipo completo) guardados como un único
 * documento JSON en un nodo de preferencias. La colección se cachea en memoria.
 */
public class PresetService {

    private static final Logger log = LoggerFactory.getLogger(PresetService.class);

    static final String STORAGE_KEY = "sampling-calculator-presets";

    // Preferences limita cada valor a MAX_VALUE_LENGTH: el JSON se trocea
    private static final int CHUNK_SIZE = Preferences.MAX_VALUE_LENGTH;
    private static final String CHUNK_COUNT_SUFFIX = ".chunks";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final Preferences node;
    private PresetCollection cache;

    public PresetService(Preferences node) {
        this.node = node;
    }

    /** Copia de la colección; los cambios pasan por los métodos save / delete. */
    public synchronized PresetCollection getAll() {
        PresetCollection c = collection();
        PresetCollection copy = new PresetCollection();
        copy.setVersion(c.getVersion());
        copy.setTelescopes(new ArrayList<>(c.getTelescopes()));
        copy.setCameras(new ArrayList<>(c.getCameras()));
        copy.setFullRigs(new ArrayList<>(c.getFullRigs()));
        return copy;
    }

    private PresetCollection collection() {
        if (cache != null) return cache;

        String json = readJson();
        if (json == null || json.isEmpty()) {
            cache = new PresetCollection();
            return cache;
        }

        try {
            cache = MAPPER.readValue(json, PresetCollection.class);
            if (cache == null) cache = new PresetCollection();
        } catch (JsonProcessingException e) {
            // JSON corrupto: se reinicia a vacío
            log.warn("Presets corruptos en '{}', se reinicia la colección", STORAGE_KEY, e);
            cache = new PresetCollection();
            saveCollection();
        }
        return cache;
    }

    // --- TELESCOPIOS ---
    public synchronized List<TelescopePreset> getTelescopePresets() { return List.copyOf(collection().getTelescopes()); }
    public synchronized void saveTelescopePreset(TelescopePreset preset) { upsert(collection().getTelescopes(), preset); }
    public synchronized void deleteTelescopePreset(String id) { remove(collection().getTelescopes(), id); }

    // --- CÁMARAS ---
    public synchronized List<CameraPreset> getCameraPresets() { return List.copyOf(collection().getCameras()); }
    public synchronized void saveCameraPreset(CameraPreset preset) { upsert(collection().getCameras(), preset); }
    public synchronized void deleteCameraPreset(String id) { remove(collection().getCameras(), id); }

    // --- EQUIPOS COMPLETOS ---
    public synchronized List<FullRigPreset> getFullRigPresets() { return List.copyOf(collection().getFullRigs()); }
    public synchronized void saveFullRigPreset(FullRigPreset preset) { upsert(collection().getFullRigs(), preset); }
    public synchronized void deleteFullRigPreset(String id) { remove(collection().getFullRigs(), id); }

    /** Olvida la caché; la próxima lectura vuelve a las preferencias. */
    public synchronized void clearCache() {
        cache = null;
    }

    public synchronized void clearAll() {
        cache = new PresetCollection();
        saveCollection();
    }

    private synchronized <T extends Preset> void upsert(List<T> list, T preset) {
        int existing = indexOf(list, preset.getId());
        if (existing >= 0) {
            preset.setUpdatedAt(Instant.now());
            list.set(existing, preset);
        } else {
            list.add(preset);
        }
        log.debug("Preset {} '{}' guardado", preset.getType(), preset.getName());
        saveCollection();
    }

    private synchronized <T extends Preset> void remove(List<T> list, String id) {
        if (list.removeIf(p -> p.getId().equals(id))) log.debug("Preset {} borrado", id);
        saveCollection();
    }

    private static int indexOf(List<? extends Preset> list, String id) {
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i).getId().equals(id)) return i;
        }
        return -1;
    }

    // --- ALMACENAMIENTO ---

    private void saveCollection() {
        if (cache == null) return;
        try {
            writeJson(MAPPER.writeValueAsString(cache));
        } catch (JsonProcessingException e) {
            throw new PresetStorageException("No se pudieron serializar los presets", e);
        }
    }

    private String readJson() {
        int chunks = node.getInt(STORAGE_KEY + CHUNK_COUNT_SUFFIX, -1);
        if (chunks < 0) return node.get(STORAGE_KEY, null);

        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < chunks; i++) sb.append(node.get(STORAGE_KEY + "." + i, ""));
        return sb.toString();
    }

    private void writeJson(String json) {
        // Borrar trozos anteriores
        int oldChunks = node.getInt(STORAGE_KEY + CHUNK_COUNT_SUFFIX, 0);
        for (int i = 0; i < oldChunks; i++) node.remove(STORAGE_KEY + "." + i);

        if (json.length() <= CHUNK_SIZE) {
            node.remove(STORAGE_KEY + CHUNK_COUNT_SUFFIX);
            node.put(STORAGE_KEY, json);
        } else {
            node.remove(STORAGE_KEY);
            int count = 0;
            for (int start = 0; start < json.length(); start += CHUNK_SIZE) {
                node.put(STORAGE_KEY + "." + count++, json.substring(start, Math.min(json.length(), start + CHUNK_SIZE)));
            }
            node.putInt(STORAGE_KEY + CHUNK_COUNT_SUFFIX, count);
        }

        try {
            node.flush();
        } catch (BackingStoreException e) {
            throw new PresetStorageException("No se pudieron guardar los presets", e);
        }
    }
}
