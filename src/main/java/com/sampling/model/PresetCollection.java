package com.sampling.model;

import java.util.ArrayList;
import java.util.List;

/** Documento JSON completo que se guarda en las preferencias. */
public class PresetCollection {
    private int version = 1;
    private List<TelescopePreset> telescopes = new ArrayList<>();
    private List<CameraPreset> cameras = new ArrayList<>();
    private List<FullRigPreset> fullRigs = new ArrayList<>();

    public int getVersion() { return version; }
    public void setVersion(int version) { this.version = version; }

    public List<TelescopePreset> getTelescopes() { return telescopes; }
    public void setTelescopes(List<TelescopePreset> telescopes) { this.telescopes = telescopes; }

    public List<CameraPreset> getCameras() { return cameras; }
    public void setCameras(List<CameraPreset> cameras) { this.cameras = cameras; }

    public List<FullRigPreset> getFullRigs() { return fullRigs; }
    public void setFullRigs(List<FullRigPreset> fullRigs) { this.fullRigs = fullRigs; }
}
