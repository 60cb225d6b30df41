package com.sampling.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Base de los presets guardados. Cada subtipo cubre un subconjunto de
 * {@link CalculatorInput} y sabe aplicarlo sobre una entrada existente.
 */
public abstract class Preset {

    private String id = UUID.randomUUID().toString();
    private String name = "";
    private Instant createdAt = Instant.now();
    private Instant updatedAt = Instant.now();

    public abstract PresetType getType();

    /** Devuelve una copia de {@code input} con los campos de este preset. */
    public abstract CalculatorInput applyTo(CalculatorInput input);

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    @Override
    public String toString() {
        return name;
    }
}
